package edictjava;

/**
 * Raised while building a {@link RuleIndex} or a {@link DictionaryIndex} from source text.
 *
 * <p>A parse failure aborts the whole build: no partially populated index is ever
 * returned to the caller.</p>
 */
public class EdictParseException extends Exception {

    /**
     * Category of the failure.
     */
    public enum Kind {
        /**
         * A line does not have the expected field structure.
         */
        FORMAT,
        /**
         * A field expected to hold a decimal integer does not.
         */
        INTEGER
    }

    private final Kind kind;
    private final int lineNo;
    private final String expected;

    private EdictParseException(Kind kind, int lineNo, String expected, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.lineNo = lineNo;
        this.expected = expected;
    }

    /**
     * Creates a format error.
     *
     * @param lineNo   1-based line number
     * @param expected the token or structure that was expected (e.g. {@code " /"})
     * @param line     the offending line, quoted in the message
     * @return the exception
     */
    public static EdictParseException format(int lineNo, String expected, String line) {
        return new EdictParseException(Kind.FORMAT, lineNo, expected,
                "line " + lineNo + ": expected '" + expected + "' in: " + line, null);
    }

    /**
     * Creates an integer error.
     *
     * @param lineNo 1-based line number
     * @param field  the text that failed to parse
     * @param cause  the underlying {@link NumberFormatException}
     * @return the exception
     */
    public static EdictParseException integer(int lineNo, String field, NumberFormatException cause) {
        return new EdictParseException(Kind.INTEGER, lineNo, "integer",
                "line " + lineNo + ": not an unsigned 32-bit decimal integer: '" + field + "'", cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the 1-based line number of the offending line
     */
    public int getLineNo() {
        return lineNo;
    }

    public String getExpected() {
        return expected;
    }
}
