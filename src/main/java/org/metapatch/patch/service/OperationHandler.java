package org.metapatch.patch.service;

import org.metapatch.dialect.Dialect;
import org.metapatch.patch.domain.Cascade;
import org.metapatch.patch.domain.PatchRequest;
import org.metapatch.patch.domain.PreparedOperation;

import java.util.List;

/**
 * Carries out the operations of one document dialect.
 */
public interface OperationHandler {

    Dialect dialect();

    /**
     * Compiles every batch entry of the request. Runs before any edit, so one malformed entry aborts the whole
     * invocation with the document untouched.
     */
    List<PreparedOperation> prepare(PatchRequest request);

    /** Applies one prepared entry and returns the secondary edits it asks for. */
    List<Cascade> apply(PatchSession session, PreparedOperation operation);

    void applyCascade(PatchSession session, Cascade cascade);
}
