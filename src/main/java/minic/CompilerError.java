package minic;

import lrlab.LrlabException;

/**
 * A located diagnostic of one of the compiler phases.
 *
 * The parser throws it internally and records it at its recovery points, all other phases only
 * collect them.
 */
public class CompilerError extends LrlabException {

    public enum Phase {
        LEXICAL("Lexical"),
        SYNTAX("Syntax"),
        SEMANTIC("Semantic");

        public final String displayName;

        Phase(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    public final Phase phase;

    public final Location location;

    /**
     * Message without phase and location
     */
    public final String detail;

    public CompilerError(Phase phase, Location location, String detail) {
        super(format(phase, location, detail));
        this.phase = phase;
        this.location = location;
        this.detail = detail;
    }

    private static String format(Phase phase, Location location, String detail) {
        if (phase == Phase.LEXICAL) {
            return String.format("%s Error at %d:%d: %s", phase, location.line, location.column, detail);
        }
        return String.format("%s Error at line %d: %s", phase, location.line, detail);
    }

    public static CompilerError lexical(Location location, String detail) {
        return new CompilerError(Phase.LEXICAL, location, detail);
    }

    public static CompilerError syntax(Location location, String detail) {
        return new CompilerError(Phase.SYNTAX, location, detail);
    }

    public static CompilerError semantic(Location location, String detail) {
        return new CompilerError(Phase.SEMANTIC, location, detail);
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
