package org.metapatch.patch.service;

import org.metapatch.dialect.CanonicalOrder;
import org.metapatch.dialect.Dialect;
import org.metapatch.patch.domain.Cascade;
import org.metapatch.patch.domain.Operation;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.PreparedOperation;
import org.metapatch.render.EntityIdentities;
import org.metapatch.shorthand.AttributeColumnRecord;
import org.metapatch.shorthand.ColumnRecord;
import org.metapatch.shorthand.EntityKind;
import org.metapatch.shorthand.ShorthandParser;
import org.metapatch.xml.IdentityLookup;
import org.metapatch.xml.TargetNotFoundException;
import org.metapatch.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Managed form operations on table columns. {@code --target} names the table; without it the first table of the
 * form is used.
 */
@Component
public class FormOperationHandler implements OperationHandler {

    private static final Logger logger = LoggerFactory.getLogger(FormOperationHandler.class);

    private final ShorthandParser parser;

    public FormOperationHandler(ShorthandParser parser) {
        this.parser = parser;
    }

    @Override
    public Dialect dialect() {
        return Dialect.FORM;
    }

    @Override
    public List<PreparedOperation> prepare(PatchRequest request) {
        List<PreparedOperation> out = new ArrayList<>();
        for (String entry : request.values()) {
            out.add(switch (request.operation()) {
                case ADD_COLUMN -> PreparedOperation.ofRecord(request.operation(), entry, parser.parseColumn(entry));
                case REMOVE_COLUMN -> PreparedOperation.ofName(request.operation(), entry, parser.parseName(entry));
                default -> throw new IllegalStateException(request.operation().cliName() + " is not a form operation");
            });
        }
        return out;
    }

    @Override
    public List<Cascade> apply(PatchSession session, PreparedOperation p) {
        XmlNode table = table(session.root(), session.request().target());
        String tableName = table.attribute("name");
        String dataPath = table.select("DataPath");
        if (p.operation() == Operation.ADD_COLUMN) {
            ColumnRecord column = (ColumnRecord) p.record();
            XmlNode items = session.editor().ensureChild(table, "ChildItems", CanonicalOrder.FORM_TABLE);
            if (session.addOwned(items, column, tableName, dataPath) && column.type() != null) {
                String attribute = ownAttribute(dataPath);
                if (attribute != null) {
                    return List.of(Cascade.add(new AttributeColumnRecord(column.name(), column.type(),
                            column.title()), attribute));
                }
                logger.debug("Table {} is bound to {}, column type belongs to the object metadata", tableName,
                        dataPath);
            }
            return List.of();
        }
        XmlNode items = table.child("ChildItems");
        String path = EntityIdentities.columnDataPath(dataPath, p.name());
        if (items == null) {
            session.warn(EntityKind.COLUMN.label(), p.name(), "not found");
            return List.of();
        }
        boolean removed = session.remove(items, EntityIdentities.COLUMN, EntityIdentities.COLUMN.key(path),
                EntityKind.COLUMN.label(), p.name());
        String attribute = ownAttribute(dataPath);
        if (removed && attribute != null) {
            return List.of(Cascade.remove(new AttributeColumnRecord(p.name(), null, null), attribute));
        }
        return List.of();
    }

    @Override
    public void applyCascade(PatchSession session, Cascade cascade) {
        AttributeColumnRecord column = (AttributeColumnRecord) cascade.record();
        XmlNode attribute = attribute(session.root(), cascade.target());
        if (attribute == null) {
            session.warn(EntityKind.ATTRIBUTE_COLUMN.label(), column.name(),
                    "form attribute " + cascade.target() + " not found");
            return;
        }
        if (cascade.action() == Operation.Action.ADD) {
            XmlNode columns = session.editor().ensureChild(attribute, "Columns", CanonicalOrder.FORM_ATTRIBUTE);
            session.addOwned(columns, column, cascade.target(), null);
            return;
        }
        XmlNode columns = attribute.child("Columns");
        if (columns == null) {
            logger.debug("Attribute {} has no columns", cascade.target());
            return;
        }
        if (IdentityLookup.exists(columns, EntityIdentities.ATTRIBUTE_COLUMN,
                EntityIdentities.ATTRIBUTE_COLUMN.key(column.name()))) {
            session.remove(columns, EntityIdentities.ATTRIBUTE_COLUMN,
                    EntityIdentities.ATTRIBUTE_COLUMN.key(column.name()), EntityKind.ATTRIBUTE_COLUMN.label(),
                    column.name());
        }
    }

    /** Table named {@code target} anywhere in the item tree, else the first table. */
    static XmlNode table(XmlNode form, String target) {
        XmlNode found = findTable(form.child("ChildItems"), target);
        if (found != null) return found;
        String path = form.path() + "/ChildItems//Table" + (target == null ? "" : "[@name='" + target + "']");
        if (target == null) throw new TargetNotFoundException(path, "the form has no tables");
        throw new TargetNotFoundException(path);
    }

    private static XmlNode findTable(XmlNode items, String target) {
        if (items == null) return null;
        for (XmlNode item : items.children()) {
            if (item.name().equals("Table") && (target == null || target.equalsIgnoreCase(item.attribute("name")))) {
                return item;
            }
            XmlNode nested = findTable(item.child("ChildItems"), target);
            if (nested != null) return nested;
        }
        return null;
    }

    private static XmlNode attribute(XmlNode form, String name) {
        XmlNode attributes = form.child("Attributes");
        if (attributes == null) return null;
        for (XmlNode attribute : attributes.children("Attribute")) {
            if (name.equalsIgnoreCase(attribute.attribute("name"))) return attribute;
        }
        return null;
    }

    /**
     * The form attribute holding the table rows when the table is bound straight to it ({@code Товары}); tables
     * bound to an object's tabular section ({@code Объект.Товары}) get their columns from metadata.
     */
    static String ownAttribute(String dataPath) {
        if (dataPath == null || dataPath.isEmpty() || dataPath.contains(".")) return null;
        return dataPath;
    }
}
