package org.metapatch.patch.service;

import org.metapatch.dialect.CanonicalOrder;
import org.metapatch.dialect.Dialect;
import org.metapatch.patch.config.PatchConfig;
import org.metapatch.patch.domain.Cascade;
import org.metapatch.patch.domain.Operation;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.PreparedOperation;
import org.metapatch.render.EntityIdentities;
import org.metapatch.shorthand.ConfigurationObjectRecord;
import org.metapatch.shorthand.EntityKind;
import org.metapatch.shorthand.ShorthandParser;
import org.metapatch.xml.OrderSpec;
import org.metapatch.xml.TargetNotFoundException;
import org.metapatch.xml.XmlNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers and unregisters top-level objects in the configuration's {@code ChildObjects} list. Only the list
 * entry is edited; the object's own files are left alone.
 */
@Component
public class ConfigurationOperationHandler implements OperationHandler {

    private final ShorthandParser parser;
    private final OrderSpec childObjects;
    private final boolean sortByName;

    public ConfigurationOperationHandler(ShorthandParser parser, PatchConfig config) {
        this.parser = parser;
        this.sortByName = config.getConfiguration().isSortObjectsByName();
        this.childObjects = sortByName ? CanonicalOrder.CHILD_OBJECTS.withDisplayKey(XmlNode::text)
                : CanonicalOrder.CHILD_OBJECTS;
    }

    @Override
    public Dialect dialect() {
        return Dialect.CONFIGURATION;
    }

    @Override
    public List<PreparedOperation> prepare(PatchRequest request) {
        Operation op = request.operation();
        if (op != Operation.ADD_OBJECT && op != Operation.REMOVE_OBJECT) {
            throw new IllegalStateException(op.cliName() + " is not a configuration operation");
        }
        List<PreparedOperation> out = new ArrayList<>();
        for (String entry : request.values()) {
            out.add(PreparedOperation.ofRecord(op, entry, parser.parseConfigurationObject(entry)));
        }
        return out;
    }

    @Override
    public List<Cascade> apply(PatchSession session, PreparedOperation p) {
        ConfigurationObjectRecord record = (ConfigurationObjectRecord) p.record();
        XmlNode configuration = session.root().child("Configuration");
        if (configuration == null) throw new TargetNotFoundException(session.root().path() + "/Configuration");
        if (p.operation() == Operation.ADD_OBJECT) {
            XmlNode list = session.editor().ensureChild(configuration, "ChildObjects", CanonicalOrder.CONFIGURATION);
            session.add(list, record, childObjects, sortByName ? record.name() : null);
            return List.of();
        }
        XmlNode list = configuration.child("ChildObjects");
        if (list == null) throw new TargetNotFoundException(configuration.path() + "/ChildObjects");
        session.remove(list, EntityIdentities.specOf(record), EntityIdentities.keyOf(record, null),
                EntityKind.CONFIGURATION_OBJECT.label(), record.displayName());
        return List.of();
    }

    @Override
    public void applyCascade(PatchSession session, Cascade cascade) {
        throw new IllegalStateException("Configuration operations have no cascades");
    }
}
