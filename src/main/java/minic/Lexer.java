package minic;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single pass scanner that turns source text into tokens.
 *
 * Errors don't stop the scan, they are collected and the scan continues after the faulty input.
 * The token list always ends with an {@link TokenType#EOF} token.
 */
public class Lexer {

    private static final Logger LOG = Logger.getLogger("Compiler");

    private final String source;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private final List<Token> tokens = new ArrayList<>();
    private final List<CompilerError> errors = new ArrayList<>();

    public Lexer(String source) {
        this.source = source;
    }

    private char current() {
        return pos < source.length() ? source.charAt(pos) : '\0';
    }

    private char peek() {
        return pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private void advance() {
        if (atEnd()) {
            return;
        }
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private Location location() {
        return new Location(line, column);
    }

    private void error(Location location, String message) {
        errors.add(CompilerError.lexical(location, message));
    }

    public List<Token> tokenize() {
        if (!tokens.isEmpty()) {
            return tokens;
        }
        while (true) {
            skipWhitespaceAndComments();
            if (atEnd()) {
                break;
            }
            char c = current();
            if (Character.isDigit(c)) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readIdentifier();
            } else if (c == '\'') {
                readCharLiteral();
            } else {
                readOperator();
            }
        }
        tokens.add(new Token(TokenType.EOF, null, location()));
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Lexed %d tokens with %d errors", tokens.size(), errors.size()));
        }
        return tokens;
    }

    public List<CompilerError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    private void skipWhitespaceAndComments() {
        while (!atEnd()) {
            char c = current();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peek() == '/') {
                while (!atEnd() && current() != '\n') {
                    advance();
                }
            } else {
                return;
            }
        }
    }

    /**
     * Reads an integer or float literal, a second decimal point is an error and the rest of the
     * digits and points is skipped
     */
    private void readNumber() {
        Location start = location();
        StringBuilder text = new StringBuilder();
        boolean isFloat = false;
        boolean invalid = false;
        while (!atEnd() && (Character.isDigit(current()) || current() == '.')) {
            if (current() == '.') {
                if (isFloat && !invalid) {
                    error(location(), "Invalid number format");
                    invalid = true;
                }
                isFloat = true;
            }
            if (!invalid) {
                text.append(current());
            }
            advance();
        }
        tokens.add(new Token(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INTEGER_LITERAL, text.toString(), start));
    }

    private void readIdentifier() {
        Location start = location();
        StringBuilder text = new StringBuilder();
        while (!atEnd() && (Character.isLetterOrDigit(current()) || current() == '_')) {
            text.append(current());
            advance();
        }
        String word = text.toString();
        TokenType keyword = TokenType.keyword(word);
        tokens.add(new Token(keyword != null ? keyword : TokenType.IDENTIFIER, word, start));
    }

    private void readCharLiteral() {
        Location start = location();
        advance();
        if (atEnd() || current() == '\n') {
            error(start, "Unterminated char literal");
            return;
        }
        char value = current();
        advance();
        if (current() == '\'' && !atEnd() && value != '\'') {
            advance();
            tokens.add(new Token(TokenType.CHAR_LITERAL, String.valueOf(value), start));
            return;
        }
        if (value != '\'' && (atEnd() || current() == '\n')) {
            error(start, "Unterminated char literal");
            return;
        }
        error(start, "Char literal must be single character");
        if (value == '\'') {
            return;
        }
        // resume after the next quote on this line
        while (!atEnd() && current() != '\n' && current() != '\'') {
            advance();
        }
        if (current() == '\'' && !atEnd()) {
            advance();
        }
    }

    private void readOperator() {
        Location start = location();
        char c = current();
        char next = peek();
        TokenType type = null;
        switch (c) {
            case '=':
                type = next == '=' ? TokenType.EQ : TokenType.ASSIGN;
                break;
            case '!':
                type = next == '=' ? TokenType.NEQ : TokenType.NOT;
                break;
            case '<':
                type = next == '=' ? TokenType.LTE : TokenType.LT;
                break;
            case '>':
                type = next == '=' ? TokenType.GTE : TokenType.GT;
                break;
            case '&':
                type = next == '&' ? TokenType.AND : null;
                break;
            case '|':
                type = next == '|' ? TokenType.OR : null;
                break;
            case '+': type = TokenType.PLUS; break;
            case '-': type = TokenType.MINUS; break;
            case '*': type = TokenType.MULTIPLY; break;
            case '/': type = TokenType.DIVIDE; break;
            case '%': type = TokenType.MODULO; break;
            case '(': type = TokenType.LPAREN; break;
            case ')': type = TokenType.RPAREN; break;
            case '{': type = TokenType.LBRACE; break;
            case '}': type = TokenType.RBRACE; break;
            case ';': type = TokenType.SEMICOLON; break;
            case ',': type = TokenType.COMMA; break;
        }
        if (type == null) {
            error(start, String.format("Unknown character '%s'", c));
            advance();
            return;
        }
        for (int i = 0; i < type.text.length(); i++) {
            advance();
        }
        tokens.add(new Token(type, type.text, start));
    }
}
