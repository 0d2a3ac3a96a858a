package org.metapatch.patch.service;

import org.metapatch.dialect.Dialect;
import org.metapatch.patch.config.PatchConfig;
import org.metapatch.patch.domain.AuditLog;
import org.metapatch.patch.domain.Cascade;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.PreparedOperation;
import org.metapatch.patch.domain.UsageException;
import org.metapatch.render.FragmentRenderer;
import org.metapatch.xml.IndentationInferencer;
import org.metapatch.xml.StructuralEditor;
import org.metapatch.xml.XmlDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one request: load, compile every entry, apply them with their cascades, write once.
 * Any exception leaves the file as it was.
 */
@Service
public class PatchService {

    private static final Logger logger = LoggerFactory.getLogger(PatchService.class);

    private final DocumentStore store;
    private final FragmentRenderer renderer;
    private final PatchConfig config;
    private final Map<Dialect, OperationHandler> handlers = new EnumMap<>(Dialect.class);

    public PatchService(DocumentStore store, FragmentRenderer renderer, PatchConfig config,
                        List<OperationHandler> handlers) {
        this.store = store;
        this.renderer = renderer;
        this.config = config;
        for (OperationHandler handler : handlers) this.handlers.put(handler.dialect(), handler);
    }

    public AuditLog execute(PatchRequest request) throws IOException {
        XmlDocument document = store.load(request.document());
        Dialect dialect = Dialect.detect(document.root()).orElseThrow(() -> new UsageException(
                "Unsupported document: root element <" + document.root().name() + ">"));
        if (dialect != request.operation().dialect()) {
            throw new UsageException(request.operation().cliName() + " applies to "
                    + request.operation().dialect().description() + " documents, " + request.document()
                    + " is a " + dialect.description());
        }
        OperationHandler handler = handlers.get(dialect);
        if (handler == null) throw new IllegalStateException("No handler for " + dialect);

        List<PreparedOperation> prepared = handler.prepare(request);
        logger.info("{}: {} entr{} for {}", request.operation().cliName(), prepared.size(),
                prepared.size() == 1 ? "y" : "ies", request.document());

        AuditLog audit = new AuditLog();
        StructuralEditor editor = new StructuralEditor(document,
                IndentationInferencer.forDocument(document, config.getIndentUnit()));
        PatchSession session = new PatchSession(request, document, editor, renderer, audit,
                config.getDefaultLanguage(), config.getForm().getExtensionIdBase());

        for (PreparedOperation operation : prepared) {
            List<Cascade> cascades = handler.apply(session, operation);
            if (!request.cascade()) {
                if (!cascades.isEmpty()) logger.debug("Cascades suppressed for {}", operation.name());
                continue;
            }
            for (Cascade cascade : cascades) handler.applyCascade(session, cascade);
        }
        session.collectEditorWarnings();

        if (document.isModified()) store.save(document, request.document());
        else logger.info("No changes, {} not rewritten", request.document());
        return audit;
    }
}
