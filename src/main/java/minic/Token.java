package minic;

import java.util.Objects;

public class Token {

    public final TokenType type;

    /**
     * Source text of the token (the character itself for char literals), null for EOF
     */
    public final String value;

    public final Location location;

    public Token(TokenType type, String value, Location location) {
        this.type = type;
        this.value = value;
        this.location = location;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        if (type.hasValue()) {
            return type + "(" + value + ")";
        }
        return type.toString();
    }

    public String toStringWithLocation() {
        return toString() + location;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Token)) {
            return false;
        }
        Token other = (Token) obj;
        return other.type == type && Objects.equals(other.value, value) && other.location.equals(location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, location);
    }
}
