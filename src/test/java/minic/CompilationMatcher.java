package minic;

import java.util.*;

import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fluent checks of a compilation result, collected and evaluated together with {@link #run()}
 */
public class CompilationMatcher {

    public static class TestBuilder {
        List<Executable> testers = new ArrayList<>();

        public TestBuilder add(Executable tester) {
            testers.add(tester);
            return this;
        }

        public void run() {
            assertAll(testers.toArray(new Executable[0]));
        }
    }

    public final Compiler.CompilationResult result;
    private final TestBuilder builder = new TestBuilder();

    public CompilationMatcher(Compiler.CompilationResult result) {
        this.result = result;
    }

    public static CompilationMatcher compile(String source) {
        return new CompilationMatcher(new Compiler().compile(source));
    }

    public CompilationMatcher succeeds() {
        builder.add(() -> assertTrue(result.isSuccessful(), () -> "Expected no errors, got\n" + result.formatErrors()));
        return this;
    }

    public CompilationMatcher haltsAfter(CompilerError.Phase phase) {
        builder.add(() -> assertEquals(phase, result.haltedAfter, result::formatErrors));
        builder.add(() -> assertNull(result.tac, "No TAC is generated for an erroneous program"));
        return this;
    }

    public CompilationMatcher errorCount(int count) {
        builder.add(() -> assertEquals(count, result.getErrors().size(), result::formatErrors));
        return this;
    }

    /**
     * The result has an error with exactly this message (including phase and location)
     */
    public CompilationMatcher error(String message) {
        builder.add(() -> assertTrue(result.getErrors().stream().anyMatch(e -> e.getMessage().equals(message)),
                () -> String.format("Expected error \"%s\", got\n%s", message, result.formatErrors())));
        return this;
    }

    public CompilationMatcher errorContaining(String part) {
        builder.add(() -> assertTrue(result.getErrors().stream().anyMatch(e -> e.detail.contains(part)),
                () -> String.format("Expected an error containing \"%s\", got\n%s", part, result.formatErrors())));
        return this;
    }

    /**
     * The TAC contains the instructions in this order (not necessarily adjacent)
     */
    public CompilationMatcher tac(String... instructions) {
        builder.add(() -> {
            assertNotNull(result.tac, result::formatErrors);
            int position = 0;
            for (String instruction : instructions) {
                int from = position;
                int index = result.tac.subList(from, result.tac.size()).indexOf(instruction);
                assertTrue(index >= 0, () -> String.format("Expected %s after instruction %d in\n%s",
                        instruction, from, result.formatTac()));
                position += index + 1;
            }
        });
        return this;
    }

    public CompilationMatcher exactTac(String... instructions) {
        builder.add(() -> assertEquals(Arrays.asList(instructions), result.tac, result::formatTac));
        return this;
    }

    public CompilationMatcher noTac(String instruction) {
        builder.add(() -> assertFalse(result.tac != null && result.tac.contains(instruction), result::formatTac));
        return this;
    }

    public CompilationMatcher symbol(String name, Type type) {
        builder.add(() -> {
            assertNotNull(result.symbolTable, "The analysis ran");
            assertTrue(result.symbolTable.getHistory().stream().anyMatch(e -> e.name.equals(name) && e.type == type),
                    () -> String.format("Expected symbol %s of type %s in\n%s", name, type, result.symbolTable.format()));
        });
        return this;
    }

    public void run() {
        builder.run();
    }
}
