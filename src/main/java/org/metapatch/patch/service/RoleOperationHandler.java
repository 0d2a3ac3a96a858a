package org.metapatch.patch.service;

import org.metapatch.dialect.CanonicalOrder;
import org.metapatch.dialect.Dialect;
import org.metapatch.patch.domain.Cascade;
import org.metapatch.patch.domain.Operation;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.PreparedOperation;
import org.metapatch.render.EntityIdentities;
import org.metapatch.shorthand.EntityKind;
import org.metapatch.shorthand.RightRecord;
import org.metapatch.shorthand.ShorthandParser;
import org.metapatch.xml.IdentityLookup;
import org.metapatch.xml.OrderKey;
import org.metapatch.xml.XmlNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Role rights. Adding rights to an object the role already lists merges them into that object.
 */
@Component
public class RoleOperationHandler implements OperationHandler {

    private static final String LABEL = EntityKind.RIGHT.label();

    private final ShorthandParser parser;

    public RoleOperationHandler(ShorthandParser parser) {
        this.parser = parser;
    }

    @Override
    public Dialect dialect() {
        return Dialect.ROLE;
    }

    @Override
    public List<PreparedOperation> prepare(PatchRequest request) {
        Operation op = request.operation();
        if (op != Operation.ADD_RIGHT && op != Operation.REMOVE_RIGHT) {
            throw new IllegalStateException(op.cliName() + " is not a role operation");
        }
        List<PreparedOperation> out = new ArrayList<>();
        for (String entry : request.values()) {
            out.add(PreparedOperation.ofRecord(op, entry, parser.parseRight(entry, op == Operation.ADD_RIGHT)));
        }
        return out;
    }

    @Override
    public List<Cascade> apply(PatchSession session, PreparedOperation p) {
        RightRecord record = (RightRecord) p.record();
        XmlNode root = session.root();
        XmlNode object = IdentityLookup.findFirst(root, EntityIdentities.RIGHT,
                EntityIdentities.RIGHT.key(record.objectName()));
        if (p.operation() == Operation.ADD_RIGHT) {
            if (object == null) session.add(root, record, CanonicalOrder.ROLE_ROOT);
            else merge(session, object, record);
        } else if (record.rights().isEmpty()) {
            session.remove(root, EntityIdentities.RIGHT, EntityIdentities.RIGHT.key(record.objectName()), LABEL,
                    record.objectName());
        } else if (object == null) {
            session.warn(LABEL, record.objectName(), "object not found");
        } else {
            for (String right : record.rights().keySet()) {
                XmlNode entry = findRight(object, right);
                if (entry == null) session.warn(LABEL, record.objectName() + "." + right, "not found");
                else {
                    session.editor().remove(entry);
                    session.audit().removed(LABEL, record.objectName() + "." + right);
                }
            }
        }
        return List.of();
    }

    @Override
    public void applyCascade(PatchSession session, Cascade cascade) {
        throw new IllegalStateException("Role operations have no cascades");
    }

    /** Existing rights with the same value are skipped, differing values are replaced, missing ones appended. */
    private static void merge(PatchSession session, XmlNode object, RightRecord record) {
        boolean changed = false;
        for (Map.Entry<String, Boolean> right : record.rights().entrySet()) {
            String value = String.valueOf(right.getValue());
            XmlNode existing = findRight(object, right.getKey());
            if (existing == null) {
                XmlNode fragment = session.renderer().rightEntry(right.getKey(), right.getValue(),
                        session.contextFor(object));
                session.editor().insert(object, fragment, CanonicalOrder.ROLE_OBJECT, OrderKey.of("right"));
                changed = true;
                continue;
            }
            XmlNode valueNode = existing.child("value");
            if (valueNode == null) {
                session.warn(LABEL, record.objectName() + "." + right.getKey(), "right has no value element");
            } else if (!valueNode.text().trim().equalsIgnoreCase(value)) {
                session.editor().replaceText(valueNode, value);
                changed = true;
            }
        }
        if (changed) session.audit().modified(LABEL, record.displayName(), "rights merged");
        else session.audit().skipped(LABEL, record.displayName(), "already granted");
    }

    private static XmlNode findRight(XmlNode object, String right) {
        for (XmlNode entry : object.children("right")) {
            String name = entry.select("name");
            if (name != null && right.equalsIgnoreCase(name.trim())) return entry;
        }
        return null;
    }
}
