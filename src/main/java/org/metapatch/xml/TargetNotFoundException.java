package org.metapatch.xml;

/**
 * A named container or entity required by an operation is absent from the document.
 */
public class TargetNotFoundException extends IllegalArgumentException {

    private final String path;

    public TargetNotFoundException(String path) {
        super("Target not found: " + path);
        this.path = path;
    }

    public TargetNotFoundException(String path, String detail) {
        super("Target not found: " + path + " (" + detail + ")");
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
