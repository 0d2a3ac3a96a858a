package org.metapatch.shorthand;

/**
 * A shorthand entry that cannot be compiled. Carries the offending literal and, where one is close enough, the
 * nearest known term.
 */
public class ShorthandException extends IllegalArgumentException {

    private final String literal;
    private final String suggestion;

    public ShorthandException(String message, String literal) {
        this(message, literal, null);
    }

    public ShorthandException(String message, String literal, String suggestion) {
        super(message + (literal == null ? "" : ": '" + literal + "'")
                + (suggestion == null ? "" : " (did you mean '" + suggestion + "'?)"));
        this.literal = literal;
        this.suggestion = suggestion;
    }

    public String getLiteral() {
        return literal;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
