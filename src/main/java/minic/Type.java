package minic;

/**
 * Types of the language, {@link #BOOL} is only the result of conditions and can't be declared
 */
public enum Type {
    INT, FLOAT, CHAR, VOID, BOOL;

    public static Type fromKeyword(TokenType keyword) {
        switch (keyword) {
            case INT:
                return INT;
            case FLOAT:
                return FLOAT;
            case CHAR:
                return CHAR;
            case VOID:
                return VOID;
            default:
                throw new IllegalArgumentException(keyword + " isn't a type");
        }
    }

    /**
     * int or float
     */
    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    /**
     * Bytes of storage of a variable of this type
     */
    public int size() {
        return this == CHAR ? 1 : 4;
    }

    /**
     * Can a value of the source type be stored in a variable of this type?
     * Identical types, int to float and char to int are allowed.
     */
    public boolean isAssignableFrom(Type source) {
        return this == source || (this == FLOAT && source == INT) || (this == INT && source == CHAR);
    }

    public boolean isComparableWith(Type other) {
        boolean bothScalar = (isNumeric() || this == CHAR) && (other.isNumeric() || other == CHAR);
        return bothScalar || this == other;
    }

    /**
     * Result type of an arithmetic operation, null if the operands are invalid. Chars are promoted to int.
     */
    public static Type arithmeticResult(Type left, Type right) {
        Type l = left == CHAR ? INT : left;
        Type r = right == CHAR ? INT : right;
        if (!l.isNumeric() || !r.isNumeric()) {
            return null;
        }
        return l == FLOAT || r == FLOAT ? FLOAT : INT;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
