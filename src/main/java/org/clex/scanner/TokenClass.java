package org.clex.scanner;

/**
 * The lexical classes the {@link Scanner} can recognize.
 * Each class carries the short code used in the scanner's output.
 */
public enum TokenClass {
    /** A name such as {@code counter} or {@code _tmp1}. */
    IDENTIFIER("IDEN"),
    /** One of the fixed keywords, such as {@code while}. */
    RESERVED_WORD("REWD"),
    /** A decimal, octal or hexadecimal integer constant. */
    INTEGER("INTE"),
    /** A floating-point constant such as {@code 3.14e-2}. */
    FLOAT("FLOT"),
    /** A character constant between single quotes. */
    CHAR_LITERAL("CHAR"),
    /** A string constant between double quotes. */
    STRING_LITERAL("STR"),
    /** An arithmetic, logical or structural operator. */
    OPERATOR("OPER"),
    /** One of the punctuation symbols {@code { } ( ) ;}. */
    SPECIAL_SYMBOL("SPEC"),
    /** A comment introduced by {@code //}. */
    SINGLE_LINE_COMMENT("SC"),
    /** A comment between {@code /*} and its closing delimiter. */
    MULTI_LINE_COMMENT("MC"),
    /** An {@code #include} directive. */
    PREPROCESSOR("PREP");

    private final String code;

    TokenClass(String code) {
        this.code = code;
    }

    /**
     * @return The short code written in front of each token in the scanner output.
     */
    public String code() {
        return code;
    }
}
