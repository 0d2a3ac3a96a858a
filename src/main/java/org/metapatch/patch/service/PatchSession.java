package org.metapatch.patch.service;

import org.metapatch.patch.domain.AuditLog;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.render.EntityIdentities;
import org.metapatch.render.FormIdPools;
import org.metapatch.render.FragmentRenderer;
import org.metapatch.render.RenderContext;
import org.metapatch.shorthand.EntityRecord;
import org.metapatch.xml.IdentityKey;
import org.metapatch.xml.IdentityLookup;
import org.metapatch.xml.IdentitySpec;
import org.metapatch.xml.OrderKey;
import org.metapatch.xml.OrderSpec;
import org.metapatch.xml.StructuralEditor;
import org.metapatch.xml.XmlDocument;
import org.metapatch.xml.XmlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * State of one invocation: the document being edited, its editor and the audit log. Handlers go through the
 * {@code add}, {@code remove}, {@code modify} and {@code clear} helpers so every edit is checked against existing
 * entities and ends up in the audit.
 */
public class PatchSession {

    private static final Logger logger = LoggerFactory.getLogger(PatchSession.class);

    private final PatchRequest request;
    private final XmlDocument document;
    private final StructuralEditor editor;
    private final FragmentRenderer renderer;
    private final AuditLog audit;
    private final String language;
    private final int extensionIdBase;
    private FormIdPools formIds;

    public PatchSession(PatchRequest request, XmlDocument document, StructuralEditor editor,
                        FragmentRenderer renderer, AuditLog audit, String language, int extensionIdBase) {
        this.request = request;
        this.document = document;
        this.editor = editor;
        this.renderer = renderer;
        this.audit = audit;
        this.language = language;
        this.extensionIdBase = extensionIdBase;
    }

    public PatchRequest request() {
        return request;
    }

    public XmlDocument document() {
        return document;
    }

    public XmlNode root() {
        return document.root();
    }

    public StructuralEditor editor() {
        return editor;
    }

    public FragmentRenderer renderer() {
        return renderer;
    }

    public AuditLog audit() {
        return audit;
    }

    public String language() {
        return language;
    }

    /** Form id pools, seeded from the document on first use. */
    public FormIdPools formIds() {
        if (formIds == null) formIds = FormIdPools.scan(document.root(), extensionIdBase);
        return formIds;
    }

    /** Layout for a fragment that will become a child of {@code container}. */
    public RenderContext contextFor(XmlNode container) {
        return RenderContext.of(editor.indentation().childGap(container), editor.indentation().unit());
    }

    /* ===================== Edits ===================== */

    public boolean add(XmlNode container, EntityRecord record, OrderSpec order) {
        return add(container, record, order, null);
    }

    /**
     * Renders and inserts {@code record} unless an entity with the same identity exists. Placement follows
     * {@code order} (kind first, then {@code displayKey} when given); a null order appends.
     */
    public boolean add(XmlNode container, EntityRecord record, OrderSpec order, String displayKey) {
        if (isDuplicate(container, record, null)) return false;
        XmlNode fragment = renderer.render(record, contextFor(container));
        editor.insert(container, fragment, order, order == null ? null : OrderKey.of(fragment.name(), displayKey));
        audit.added(record.kind().label(), record.displayName());
        return true;
    }

    /** Form entities: ids come from the form pools, the owner is the table or attribute the entity belongs to. */
    public boolean addOwned(XmlNode container, EntityRecord record, String ownerName, String ownerDataPath) {
        if (isDuplicate(container, record, ownerDataPath)) return false;
        RenderContext ctx = contextFor(container).withOwner(formIds(), ownerName, ownerDataPath);
        editor.append(container, renderer.render(record, ctx));
        audit.added(record.kind().label(), record.displayName());
        return true;
    }

    private boolean isDuplicate(XmlNode container, EntityRecord record, String ownerDataPath) {
        IdentitySpec identity = EntityIdentities.specOf(record);
        IdentityKey key = EntityIdentities.keyOf(record, ownerDataPath);
        if (!IdentityLookup.exists(container, identity, key)) return false;
        logger.warn("{} {} already exists in {}", record.kind().label(), record.displayName(), container.path());
        audit.skipped(record.kind().label(), record.displayName(), "already exists");
        return true;
    }

    /**
     * Removes the entity with {@code key}. Absence is a warning; with several matches the first one is removed and
     * the ambiguity reported.
     */
    public boolean remove(XmlNode container, IdentitySpec identity, IdentityKey key, String label, String name) {
        List<XmlNode> matches = IdentityLookup.findAll(container, identity, key);
        if (matches.isEmpty()) {
            warn(label, name, "not found");
            return false;
        }
        if (matches.size() > 1) {
            warn(label, name, matches.size() + " matches, removing the first");
        }
        editor.remove(matches.get(0));
        audit.removed(label, name);
        return true;
    }

    /** Replaces the text of {@code leaf}; an unchanged value is recorded as skipped. */
    public boolean modify(XmlNode leaf, String text, String label, String name) {
        if (!editor.replaceText(leaf, text)) {
            audit.skipped(label, name, "unchanged");
            return false;
        }
        audit.modified(label, name, leaf.name() + " replaced");
        return true;
    }

    /** Clears the {@code childName} entries of {@code container}; other children such as list settings stay. */
    public int clear(XmlNode container, String childName, String label, String name) {
        int removed = editor.clearChildren(container, childName);
        if (removed == 0) audit.skipped(label, name, "already empty");
        else audit.modified(label, name, removed + " entries cleared");
        return removed;
    }

    public void warn(String label, String name, String message) {
        logger.warn("{} {}: {}", label, name, message);
        audit.warn(label, name, message);
    }

    public void warn(String message) {
        logger.warn(message);
        audit.warn(message);
    }

    /** Moves structural warnings collected by the editor into the audit (already logged there). */
    public void collectEditorWarnings() {
        for (String message : editor.drainWarnings()) audit.warn(message);
    }
}
