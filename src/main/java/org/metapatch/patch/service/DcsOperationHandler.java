package org.metapatch.patch.service;

import org.metapatch.dialect.CanonicalOrder;
import org.metapatch.dialect.DcsVocabulary.DatasetKind;
import org.metapatch.dialect.Dialect;
import org.metapatch.patch.config.PatchConfig;
import org.metapatch.patch.domain.Cascade;
import org.metapatch.patch.domain.Operation;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.PreparedOperation;
import org.metapatch.patch.domain.UsageException;
import org.metapatch.render.EntityIdentities;
import org.metapatch.shorthand.CalculatedFieldRecord;
import org.metapatch.shorthand.DataSourceRecord;
import org.metapatch.shorthand.DatasetRecord;
import org.metapatch.shorthand.EntityKind;
import org.metapatch.shorthand.EntityRecord;
import org.metapatch.shorthand.FieldRecord;
import org.metapatch.shorthand.LinkRecord;
import org.metapatch.shorthand.LocalizedText;
import org.metapatch.shorthand.SelectionRecord;
import org.metapatch.shorthand.ShorthandException;
import org.metapatch.shorthand.ShorthandParser;
import org.metapatch.shorthand.VariantRecord;
import org.metapatch.xml.IdentityLookup;
import org.metapatch.xml.IdentitySpec;
import org.metapatch.xml.TargetNotFoundException;
import org.metapatch.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Data composition schema operations. {@code --target} names the dataset for field and query operations and the
 * settings variant for filter, order, selection and appearance operations; without it the first one is used.
 */
@Component
public class DcsOperationHandler implements OperationHandler {

    private static final Logger logger = LoggerFactory.getLogger(DcsOperationHandler.class);

    private static final String FILTER = "dcsset:filter";
    private static final String ORDER = "dcsset:order";
    private static final String SELECTION = "dcsset:selection";
    private static final String APPEARANCE = "dcsset:conditionalAppearance";
    private static final String LIST_ITEM = "dcsset:item";

    private final ShorthandParser parser;
    private final PatchConfig.DcsConfig dcsConfig;

    public DcsOperationHandler(ShorthandParser parser, PatchConfig config) {
        this.parser = parser;
        this.dcsConfig = config.getDcs();
    }

    @Override
    public Dialect dialect() {
        return Dialect.DCS;
    }

    @Override
    public List<PreparedOperation> prepare(PatchRequest request) {
        Operation op = request.operation();
        if (!op.takesValues()) return List.of(PreparedOperation.ofName(op, null, request.target()));
        if (op == Operation.SET_QUERY && request.values().size() > 1) {
            throw new UsageException("set-query takes a single query text");
        }
        List<PreparedOperation> out = new ArrayList<>();
        for (String entry : request.values()) {
            out.add(prepare(op, entry, request.target()));
        }
        return out;
    }

    private PreparedOperation prepare(Operation op, String entry, String target) {
        return switch (op) {
            case ADD_FIELD -> PreparedOperation.ofRecord(op, entry, parser.parseField(entry));
            case ADD_TOTAL -> PreparedOperation.ofRecord(op, entry, parser.parseTotal(entry));
            case ADD_CALCULATED_FIELD -> PreparedOperation.ofRecord(op, entry, parser.parseCalculatedField(entry));
            case ADD_PARAMETER -> PreparedOperation.ofRecord(op, entry, parser.parseParameter(entry));
            case ADD_FILTER -> PreparedOperation.ofRecord(op, entry, parser.parseFilter(entry));
            case ADD_ORDER, REMOVE_ORDER -> PreparedOperation.ofRecord(op, entry, parser.parseOrder(entry));
            case ADD_SELECTION, REMOVE_SELECTION ->
                    PreparedOperation.ofRecord(op, entry, parser.parseSelection(entry));
            case ADD_LINK -> PreparedOperation.ofRecord(op, entry, parser.parseLink(entry));
            case ADD_DATASET -> PreparedOperation.ofRecord(op, entry, parser.parseDataset(entry));
            case ADD_VARIANT -> PreparedOperation.ofRecord(op, entry, parser.parseVariant(entry));
            case ADD_CONDITIONAL_APPEARANCE ->
                    PreparedOperation.ofRecord(op, entry, parser.parseConditionalAppearance(entry));
            case REMOVE_FIELD, REMOVE_TOTAL, REMOVE_CALCULATED_FIELD, REMOVE_PARAMETER, REMOVE_FILTER,
                    REMOVE_DATASET, REMOVE_VARIANT -> PreparedOperation.ofName(op, entry, parser.parseName(entry));
            case SET_QUERY -> PreparedOperation.ofText(op, entry, target, entry);
            case SET_EXPRESSION -> {
                int eq = entry.indexOf('=');
                if (eq < 0) throw new ShorthandException("Expected 'Path = expression'", entry);
                String expression = entry.substring(eq + 1).trim();
                if (expression.isEmpty()) throw new ShorthandException("Missing expression", entry);
                yield PreparedOperation.ofText(op, entry, parser.parseName(entry.substring(0, eq)), expression);
            }
            default -> throw new IllegalStateException(op.cliName() + " is not a schema operation");
        };
    }

    @Override
    public List<Cascade> apply(PatchSession session, PreparedOperation p) {
        XmlNode root = session.root();
        String target = session.request().target();
        switch (p.operation()) {
            case ADD_FIELD -> {
                FieldRecord field = (FieldRecord) p.record();
                if (session.add(dataset(session, target, true), field, CanonicalOrder.DCS_DATASET)) {
                    return List.of(Cascade.add(new SelectionRecord(field.dataPath(), null), null));
                }
            }
            case ADD_CALCULATED_FIELD -> {
                CalculatedFieldRecord field = (CalculatedFieldRecord) p.record();
                if (session.add(root, field, CanonicalOrder.DCS_ROOT)) {
                    return List.of(Cascade.add(new SelectionRecord(field.dataPath(), null), target));
                }
            }
            case ADD_TOTAL, ADD_PARAMETER, ADD_VARIANT -> session.add(root, p.record(), CanonicalOrder.DCS_ROOT);
            case ADD_LINK -> {
                LinkRecord link = (LinkRecord) p.record();
                for (String name : List.of(link.sourceDataSet(), link.destinationDataSet())) {
                    if (findDataset(root, name) == null) session.warn("link", link.displayName(),
                            "dataset " + name + " does not exist");
                }
                session.add(root, link, CanonicalOrder.DCS_ROOT);
            }
            case ADD_DATASET -> {
                return addDataset(session, (DatasetRecord) p.record());
            }
            case ADD_FILTER -> session.add(settingsList(session, target, FILTER, true), p.record(),
                    CanonicalOrder.DCS_SETTINGS_LIST);
            case ADD_ORDER -> session.add(settingsList(session, target, ORDER, true), p.record(),
                    CanonicalOrder.DCS_SETTINGS_LIST);
            case ADD_SELECTION -> session.add(settingsList(session, target, SELECTION, true), p.record(),
                    CanonicalOrder.DCS_SETTINGS_LIST);
            case ADD_CONDITIONAL_APPEARANCE -> session.add(settingsList(session, target, APPEARANCE, true),
                    p.record(), CanonicalOrder.DCS_SETTINGS_LIST);
            case REMOVE_FIELD -> removeField(session, p.name(), target);
            case REMOVE_TOTAL -> removeNamed(session, root, EntityIdentities.TOTAL, EntityKind.TOTAL, p.name());
            case REMOVE_CALCULATED_FIELD -> removeNamed(session, root, EntityIdentities.CALCULATED_FIELD,
                    EntityKind.CALCULATED_FIELD, p.name());
            case REMOVE_PARAMETER ->
                    removeNamed(session, root, EntityIdentities.PARAMETER, EntityKind.PARAMETER, p.name());
            case REMOVE_DATASET -> removeNamed(session, root, EntityIdentities.DATASET, EntityKind.DATASET, p.name());
            case REMOVE_VARIANT -> removeNamed(session, root, EntityIdentities.VARIANT, EntityKind.VARIANT, p.name());
            case REMOVE_FILTER -> removeNamed(session, settingsList(session, target, FILTER, false),
                    EntityIdentities.FILTER, EntityKind.FILTER, p.name());
            case REMOVE_ORDER -> removeRecord(session, settingsList(session, target, ORDER, false), p.record());
            case REMOVE_SELECTION ->
                    removeRecord(session, settingsList(session, target, SELECTION, false), p.record());
            case SET_QUERY -> setQuery(session, target, p.text());
            case SET_EXPRESSION -> setExpression(session, p.name(), p.text());
            case CLEAR_SELECTION -> clear(session, target, SELECTION, EntityKind.SELECTION);
            case CLEAR_FILTER -> clear(session, target, FILTER, EntityKind.FILTER);
            case CLEAR_ORDER -> clear(session, target, ORDER, EntityKind.ORDER);
            default -> throw new IllegalStateException(p.operation().cliName() + " is not a schema operation");
        }
        return List.of();
    }

    @Override
    public void applyCascade(PatchSession session, Cascade cascade) {
        EntityRecord record = cascade.record();
        switch (record.kind()) {
            case SELECTION -> {
                XmlNode variant = variant(session, cascade.target(), false);
                if (variant == null) {
                    logger.debug("No settings variant, {} not added to a selection", record.displayName());
                    return;
                }
                XmlNode list = session.editor().ensureChild(settings(session, variant), SELECTION,
                        CanonicalOrder.DCS_SETTINGS);
                session.add(list, record, CanonicalOrder.DCS_SETTINGS_LIST);
            }
            case DATA_SOURCE -> session.add(session.root(), record, CanonicalOrder.DCS_ROOT);
            default -> throw new IllegalStateException("Unexpected schema cascade: " + record.kind());
        }
    }

    /* ===================== Datasets ===================== */

    private List<Cascade> addDataset(PatchSession session, DatasetRecord record) {
        XmlNode root = session.root();
        XmlNode source = root.child("dataSource");
        DatasetRecord resolved = record;
        if (record.datasetKind() != DatasetKind.UNION) {
            resolved = record.withDataSource(source != null ? source.select("name") : dcsConfig.getDataSourceName());
        }
        if (session.add(root, resolved, CanonicalOrder.DCS_ROOT) && source == null
                && record.datasetKind() != DatasetKind.UNION) {
            return List.of(Cascade.add(new DataSourceRecord(dcsConfig.getDataSourceName(),
                    dcsConfig.getDataSourceType()), null));
        }
        return List.of();
    }

    /**
     * Dataset named {@code target}, else the first one. Without an explicit target and with no dataset at all,
     * {@code create} adds a default query dataset.
     */
    private XmlNode dataset(PatchSession session, String target, boolean create) {
        XmlNode root = session.root();
        if (target != null) {
            XmlNode found = findDataset(root, target);
            if (found == null) throw new TargetNotFoundException(root.path() + "/dataSet[" + target + "]");
            return found;
        }
        XmlNode first = root.child("dataSet");
        if (first != null) return first;
        if (!create) throw new TargetNotFoundException(root.path() + "/dataSet", "the schema has no datasets");
        logger.info("Schema has no datasets, creating {}", dcsConfig.getDefaultDatasetName());
        DatasetRecord record = new DatasetRecord(dcsConfig.getDefaultDatasetName(), DatasetKind.QUERY, "", null);
        for (Cascade c : addDataset(session, record)) applyCascade(session, c);
        return root.child("dataSet");
    }

    /** Searches top-level datasets and the members of union datasets. */
    static XmlNode findDataset(XmlNode container, String name) {
        for (XmlNode child : container.children()) {
            boolean member = child.name().equals("dataSet") || child.name().equals("item")
                    && child.attribute("xsi:type") != null && child.attribute("xsi:type").startsWith("DataSet");
            if (!member) continue;
            if (name.equalsIgnoreCase(child.select("name"))) return child;
            XmlNode nested = findDataset(child, name);
            if (nested != null) return nested;
        }
        return null;
    }

    private void removeField(PatchSession session, String name, String target) {
        XmlNode dataset = null;
        if (target == null) {
            // Without a target the field is looked up in every dataset
            List<XmlNode> candidates = new ArrayList<>();
            collectDatasets(session.root(), candidates);
            for (XmlNode candidate : candidates) {
                if (IdentityLookup.exists(candidate, EntityIdentities.FIELD, EntityIdentities.FIELD.key(name))) {
                    dataset = candidate;
                    break;
                }
            }
        }
        if (dataset == null) dataset = dataset(session, target, false);
        removeNamed(session, dataset, EntityIdentities.FIELD, EntityKind.FIELD, name);
    }

    private static void collectDatasets(XmlNode container, List<XmlNode> out) {
        for (XmlNode child : container.children()) {
            String type = child.attribute("xsi:type");
            if (child.name().equals("dataSet") || child.name().equals("item") && type != null
                    && type.startsWith("DataSet")) {
                out.add(child);
                collectDatasets(child, out);
            }
        }
    }

    private void setQuery(PatchSession session, String target, String text) {
        XmlNode dataset = target != null ? dataset(session, target, false) : firstQueryDataset(session.root());
        XmlNode query = dataset.child("query");
        if (query == null) throw new TargetNotFoundException(dataset.path() + "/query", "not a query dataset");
        session.modify(query, text, EntityKind.DATASET.label(), dataset.select("name"));
    }

    private static XmlNode firstQueryDataset(XmlNode root) {
        List<XmlNode> all = new ArrayList<>();
        collectDatasets(root, all);
        for (XmlNode d : all) {
            if (d.child("query") != null) return d;
        }
        throw new TargetNotFoundException(root.path() + "/dataSet", "the schema has no query datasets");
    }

    private void setExpression(PatchSession session, String name, String expression) {
        XmlNode root = session.root();
        XmlNode owner = IdentityLookup.findFirst(root, EntityIdentities.CALCULATED_FIELD,
                EntityIdentities.CALCULATED_FIELD.key(name));
        EntityKind kind = EntityKind.CALCULATED_FIELD;
        if (owner == null) {
            owner = IdentityLookup.findFirst(root, EntityIdentities.TOTAL, EntityIdentities.TOTAL.key(name));
            kind = EntityKind.TOTAL;
        }
        if (owner == null) {
            throw new TargetNotFoundException(root.path() + "/calculatedField[" + name + "]",
                    "no calculated field or total with this path");
        }
        XmlNode leaf = owner.child("expression");
        if (leaf == null) throw new TargetNotFoundException(owner.path() + "/expression");
        session.modify(leaf, expression, kind.label(), name);
    }

    /* ===================== Settings variants ===================== */

    /**
     * Variant named {@code target}, else the first one. With no variant at all, {@code create} adds the default
     * variant; otherwise the result is null.
     */
    private XmlNode variant(PatchSession session, String target, boolean create) {
        XmlNode root = session.root();
        if (target != null) {
            XmlNode found = IdentityLookup.findFirst(root, EntityIdentities.VARIANT,
                    EntityIdentities.VARIANT.key(target));
            if (found == null) throw new TargetNotFoundException(root.path() + "/settingsVariant[" + target + "]");
            return found;
        }
        XmlNode first = root.child("settingsVariant");
        if (first != null || !create) return first;
        String name = dcsConfig.getDefaultVariantName();
        logger.info("Schema has no settings variants, creating {}", name);
        session.add(root, new VariantRecord(name, LocalizedText.of(session.language(), name)),
                CanonicalOrder.DCS_ROOT);
        return root.child("settingsVariant");
    }

    private static XmlNode settings(PatchSession session, XmlNode variant) {
        return session.editor().ensureChild(variant, "dcsset:settings", CanonicalOrder.DCS_VARIANT);
    }

    /**
     * The {@code list} element of the variant settings. Adds create what is missing; removals and clears need an
     * existing variant and get null when the list itself is absent.
     */
    private XmlNode settingsList(PatchSession session, String target, String list, boolean create) {
        XmlNode variant = variant(session, target, create);
        if (variant == null) {
            throw new TargetNotFoundException(session.root().path() + "/settingsVariant",
                    "the schema has no settings variants");
        }
        if (create) return session.editor().ensureChild(settings(session, variant), list, CanonicalOrder.DCS_SETTINGS);
        XmlNode settings = variant.child("dcsset:settings");
        return settings == null ? null : settings.child(list);
    }

    private void clear(PatchSession session, String target, String list, EntityKind kind) {
        XmlNode container = settingsList(session, target, list, false);
        String label = kind.label();
        if (container == null) {
            session.audit().skipped(label, list, "already empty");
            return;
        }
        session.clear(container, LIST_ITEM, label, list);
    }

    /* ===================== Removal ===================== */

    private static void removeNamed(PatchSession session, XmlNode container, IdentitySpec identity, EntityKind kind,
                                    String name) {
        if (container == null) {
            session.warn(kind.label(), name, "not found");
            return;
        }
        session.remove(container, identity, identity.key(name), kind.label(), name);
    }

    private static void removeRecord(PatchSession session, XmlNode container, EntityRecord record) {
        if (container == null) {
            session.warn(record.kind().label(), record.displayName(), "not found");
            return;
        }
        session.remove(container, EntityIdentities.specOf(record),
                EntityIdentities.keyOf(record, null), record.kind().label(),
                record.displayName());
    }
}
