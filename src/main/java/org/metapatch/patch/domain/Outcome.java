package org.metapatch.patch.domain;

public enum Outcome {
    ADDED,
    REMOVED,
    MODIFIED,
    SKIPPED,
    WARN
}
