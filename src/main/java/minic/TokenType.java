package minic;

import java.util.*;

public enum TokenType {
    INT("int"),
    FLOAT("float"),
    CHAR("char"),
    VOID("void"),
    IF("if"),
    ELIF("elif"),
    ELSE("else"),
    LOOP("loop"),
    FROM("from"),
    TO("to"),
    STEP("step"),
    SHOW("show"),
    TELL("tell"),
    RETURN("return"),
    FUNC("func"),

    IDENTIFIER,
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    CHAR_LITERAL,

    PLUS("+"),
    MINUS("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    ASSIGN("="),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    GT(">"),
    LTE("<="),
    GTE(">="),
    AND("&&"),
    OR("||"),
    NOT("!"),

    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    SEMICOLON(";"),
    COMMA(","),

    EOF;

    /**
     * Fixed text of keywords, operators and delimiters, null for the other types
     */
    public final String text;

    TokenType() {
        this(null);
    }

    TokenType(String text) {
        this.text = text;
    }

    private static final Map<String, TokenType> keywords = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.isKeyword()) {
                keywords.put(type.text, type);
            }
        }
    }

    public boolean isKeyword() {
        return text != null && Character.isLetter(text.charAt(0));
    }

    /**
     * Keyword with the passed spelling or null
     */
    public static TokenType keyword(String word) {
        return keywords.get(word);
    }

    /**
     * Has the token a value that differs between tokens of this type?
     */
    public boolean hasValue() {
        return this == IDENTIFIER || this == INTEGER_LITERAL || this == FLOAT_LITERAL || this == CHAR_LITERAL;
    }

    public boolean isTypeKeyword() {
        return this == INT || this == FLOAT || this == CHAR;
    }
}
