package org.metapatch.patch.domain;

/**
 * Command line that cannot be carried out as given: unknown operation, missing argument, or an operation that does
 * not apply to the document's dialect.
 */
public class UsageException extends IllegalArgumentException {

    public UsageException(String message) {
        super(message);
    }
}
