package org.metapatch.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access rights a role may grant per metadata kind.
 */
public final class RightsVocabulary {

    private static final List<String> REFERENCE_OBJECT = List.of(
            "Read", "Insert", "Update", "Delete", "View", "Edit", "InputByString",
            "InteractiveInsert", "InteractiveSetDeletionMark", "InteractiveClearDeletionMark",
            "InteractiveDelete", "InteractiveDeleteMarked", "InteractiveDeletePredefinedData",
            "InteractiveSetDeletionMarkPredefinedData", "InteractiveClearDeletionMarkPredefinedData",
            "InteractiveDeleteMarkedPredefinedData", "ReadDataHistory", "ViewDataHistory", "UpdateDataHistory",
            "UpdateDataHistorySettings", "UpdateDataHistoryVersionComment", "EditDataHistoryVersionComment",
            "SwitchToDataHistoryVersion");

    private static final List<String> DOCUMENT = concat(REFERENCE_OBJECT, List.of(
            "Posting", "UndoPosting", "InteractivePosting", "InteractivePostingRegular",
            "InteractiveUndoPosting", "InteractiveChangeOfPosted"));

    private static final List<String> REGISTER = List.of(
            "Read", "Update", "View", "Edit", "TotalsControl", "ReadDataHistory", "ViewDataHistory",
            "UpdateDataHistory", "UpdateDataHistorySettings", "UpdateDataHistoryVersionComment",
            "EditDataHistoryVersionComment", "SwitchToDataHistoryVersion");

    private static final List<String> USE_VIEW = List.of("Use", "View");

    private static final List<String> VIEW = List.of("View");

    private static final List<String> CONFIGURATION = List.of(
            "Administration", "DataAdministration", "UpdateDataBaseConfiguration", "ExclusiveMode",
            "ActiveUsers", "EventLog", "ThinClient", "WebClient", "MobileClient", "ThickClient",
            "ExternalConnection", "Automation", "Output", "SaveUserData", "ConfigurationExtensionsAdministration",
            "InteractiveOpenExtDataProcessors", "InteractiveOpenExtReports", "AnalyticsSystemClient",
            "CollaborationSystemInfoBaseRegistration", "MainWindowModeNormal", "MainWindowModeWorkplace",
            "MainWindowModeEmbeddedWorkplace", "MainWindowModeFullscreenWorkplace", "MainWindowModeKiosk");

    private static final Map<String, List<String>> BY_KIND = Map.ofEntries(
            Map.entry("Configuration", CONFIGURATION),
            Map.entry("Catalog", REFERENCE_OBJECT),
            Map.entry("ExchangePlan", REFERENCE_OBJECT),
            Map.entry("ChartOfCharacteristicTypes", REFERENCE_OBJECT),
            Map.entry("ChartOfAccounts", REFERENCE_OBJECT),
            Map.entry("ChartOfCalculationTypes", REFERENCE_OBJECT),
            Map.entry("BusinessProcess", concat(REFERENCE_OBJECT, List.of("Start", "InteractiveStart",
                    "InteractiveActivate"))),
            Map.entry("Task", concat(REFERENCE_OBJECT, List.of("Execute", "InteractiveExecute",
                    "InteractiveActivate"))),
            Map.entry("Document", DOCUMENT),
            Map.entry("DocumentJournal", List.of("Read", "View")),
            Map.entry("InformationRegister", REGISTER),
            Map.entry("AccumulationRegister", List.of("Read", "Update", "View", "Edit", "TotalsControl")),
            Map.entry("AccountingRegister", List.of("Read", "Update", "View", "Edit", "TotalsControl")),
            Map.entry("CalculationRegister", List.of("Read", "Update", "View", "Edit")),
            Map.entry("Constant", List.of("Read", "Update", "View", "Edit", "ReadDataHistory",
                    "ViewDataHistory", "UpdateDataHistory", "UpdateDataHistorySettings")),
            Map.entry("Report", USE_VIEW),
            Map.entry("DataProcessor", USE_VIEW),
            Map.entry("Subsystem", VIEW),
            Map.entry("CommonForm", VIEW),
            Map.entry("CommonCommand", VIEW),
            Map.entry("CommonAttribute", List.of("View", "Edit")),
            Map.entry("SessionParameter", List.of("Get", "Set")),
            Map.entry("FilterCriterion", VIEW),
            Map.entry("Sequence", List.of("Read", "Update")),
            Map.entry("WebService", List.of("Use")),
            Map.entry("HTTPService", List.of("Use")),
            Map.entry("IntegrationService", List.of("Use")));

    private RightsVocabulary() {
    }

    /** Rights known for a kind; empty when the kind carries no rights. */
    public static List<String> rightsOf(String kind) {
        return BY_KIND.getOrDefault(kind, List.of());
    }

    /** Canonical spelling of {@code right} for {@code kind}, matched case-insensitively. */
    public static Optional<String> find(String kind, String right) {
        for (String known : rightsOf(kind)) {
            if (known.equalsIgnoreCase(right)) return Optional.of(known);
        }
        return Optional.empty();
    }

    public static String suggest(String kind, String right) {
        return Suggestions.nearest(right, rightsOf(kind));
    }

    private static List<String> concat(List<String> a, List<String> b) {
        ArrayList<String> out = new ArrayList<>(a);
        out.addAll(b);
        return List.copyOf(out);
    }
}
