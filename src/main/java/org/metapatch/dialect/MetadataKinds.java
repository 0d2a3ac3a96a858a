package org.metapatch.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Top-level metadata object kinds in the order the platform lists them under {@code ChildObjects}, with their
 * Russian names and, for object kinds, the name of their reference type.
 */
public final class MetadataKinds {

    public record Kind(String name, String russianName, boolean hasReference) {

        public String referenceType() {
            return hasReference ? name + "Ref" : null;
        }
    }

    private static final List<Kind> KINDS = List.of(
            new Kind("Language", "Язык", false),
            new Kind("Subsystem", "Подсистема", false),
            new Kind("StyleItem", "ЭлементСтиля", false),
            new Kind("Style", "Стиль", false),
            new Kind("CommonPicture", "ОбщаяКартинка", false),
            new Kind("SessionParameter", "ПараметрСеанса", false),
            new Kind("Role", "Роль", false),
            new Kind("CommonTemplate", "ОбщийМакет", false),
            new Kind("FilterCriterion", "КритерийОтбора", false),
            new Kind("CommonModule", "ОбщийМодуль", false),
            new Kind("CommonAttribute", "ОбщийРеквизит", false),
            new Kind("ExchangePlan", "ПланОбмена", true),
            new Kind("XDTOPackage", "ПакетXDTO", false),
            new Kind("WebService", "WebСервис", false),
            new Kind("HTTPService", "HTTPСервис", false),
            new Kind("WSReference", "WSСсылка", false),
            new Kind("EventSubscription", "ПодпискаНаСобытие", false),
            new Kind("ScheduledJob", "РегламентноеЗадание", false),
            new Kind("SettingsStorage", "ХранилищеНастроек", false),
            new Kind("FunctionalOption", "ФункциональнаяОпция", false),
            new Kind("FunctionalOptionsParameter", "ПараметрФункциональныхОпций", false),
            new Kind("DefinedType", "ОпределяемыйТип", false),
            new Kind("CommonCommand", "ОбщаяКоманда", false),
            new Kind("CommandGroup", "ГруппаКоманд", false),
            new Kind("Constant", "Константа", false),
            new Kind("CommonForm", "ОбщаяФорма", false),
            new Kind("Catalog", "Справочник", true),
            new Kind("Document", "Документ", true),
            new Kind("DocumentNumerator", "НумераторДокументов", false),
            new Kind("Sequence", "Последовательность", false),
            new Kind("DocumentJournal", "ЖурналДокументов", false),
            new Kind("Enum", "Перечисление", true),
            new Kind("Report", "Отчет", false),
            new Kind("DataProcessor", "Обработка", false),
            new Kind("InformationRegister", "РегистрСведений", false),
            new Kind("AccumulationRegister", "РегистрНакопления", false),
            new Kind("ChartOfCharacteristicTypes", "ПланВидовХарактеристик", true),
            new Kind("ChartOfAccounts", "ПланСчетов", true),
            new Kind("AccountingRegister", "РегистрБухгалтерии", false),
            new Kind("ChartOfCalculationTypes", "ПланВидовРасчета", true),
            new Kind("CalculationRegister", "РегистрРасчета", false),
            new Kind("BusinessProcess", "БизнесПроцесс", true),
            new Kind("Task", "Задача", true),
            new Kind("ExternalDataSource", "ВнешнийИсточникДанных", false),
            new Kind("IntegrationService", "СервисИнтеграции", false));

    private static final Vocabulary<Kind> BY_NAME = new Vocabulary<>("metadata kind");
    private static final Vocabulary<Kind> BY_REFERENCE = new Vocabulary<>("reference type");

    static {
        for (Kind kind : KINDS) {
            BY_NAME.put(kind, kind.name(), kind.russianName());
            if (kind.hasReference()) {
                BY_REFERENCE.put(kind, kind.referenceType(), kind.russianName() + "Ссылка");
            }
        }
    }

    private MetadataKinds() {
    }

    public static List<Kind> all() {
        return KINDS;
    }

    /** Element names of {@code ChildObjects} entries in canonical order. */
    public static List<String> childObjectOrder() {
        List<String> names = new ArrayList<>(KINDS.size());
        for (Kind kind : KINDS) names.add(kind.name());
        return Collections.unmodifiableList(names);
    }

    /** Resolves "Catalog", "Справочник" (any case). */
    public static Optional<Kind> find(String token) {
        return BY_NAME.find(token);
    }

    /** Resolves reference kind tokens: "Catalog", "CatalogRef", "Справочник", "СправочникСсылка". */
    public static Optional<Kind> findReference(String token) {
        Optional<Kind> ref = BY_REFERENCE.find(token);
        if (ref.isPresent()) return ref;
        return BY_NAME.find(token).filter(Kind::hasReference);
    }

    public static String suggest(String token) {
        return BY_NAME.suggest(token);
    }
}
