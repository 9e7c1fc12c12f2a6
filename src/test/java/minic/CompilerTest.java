package minic;

import org.junit.jupiter.api.Test;

import static minic.CompilationMatcher.compile;
import static org.junit.jupiter.api.Assertions.*;

public class CompilerTest {

    private static final String ADD = "func int add(int a, int b) { return a + b; }\n";

    @Test
    public void testTokens() {
        Compiler.CompilationResult result = new Compiler().compile("int x; x = 5 + 3; show x;");
        assertEquals(13, result.tokens.size());
        assertEquals(TokenType.EOF, result.tokens.get(12).type);
        assertNotNull(result.program);
    }

    @Test
    public void testAssignmentIsLowered() {
        compile("int x; x = 5 + 3; show x;")
                .succeeds()
                .exactTac("MAIN:", "ALLOC x int", "t0 = 5 + 3", "x = t0", "PRINT x", "END_MAIN")
                .symbol("x", Type.INT)
                .run();
    }

    @Test
    public void testNarrowingHaltsBeforeTac() {
        Compiler.CompilationResult result = new Compiler().compile("int x; x = 3.5;");
        new CompilationMatcher(result)
                .haltsAfter(CompilerError.Phase.SEMANTIC)
                .errorCount(1)
                .errorContaining("cannot assign float to int")
                .run();
        assertEquals(1, result.semanticErrors.size());
        assertNotNull(result.symbolTable);
    }

    @Test
    public void testFunctionCall() {
        compile(ADD + "int r = add(2, 3);\nshow r;")
                .succeeds()
                .symbol("add", Type.INT)
                .tac("FUNC_add:", "PARAM a 0", "PARAM b 1", "END_FUNC_add", "MAIN:", "PUSH 3", "PUSH 2",
                        "CALL FUNC_add 2", "r = t1", "PRINT r")
                .run();
    }

    @Test
    public void testFunctionCallWithWrongSignature() {
        compile(ADD + "int r = add(2);\nint s = add(2.5, 1);")
                .haltsAfter(CompilerError.Phase.SEMANTIC)
                .errorCount(2)
                .error("Semantic Error at line 2: Function 'add' expects 2 arguments, got 1")
                .error("Semantic Error at line 3: Argument 1 type mismatch: expected int, got float")
                .run();
    }

    @Test
    public void testHaltsAfterLexicalErrors() {
        Compiler.CompilationResult result = new Compiler().compile("int x = #;\nshow y;");
        new CompilationMatcher(result)
                .haltsAfter(CompilerError.Phase.LEXICAL)
                .errorCount(1)
                .error("Lexical Error at 1:9: Unknown character '#'")
                .run();
        assertNull(result.program);
        assertNull(result.symbolTable);
        assertFalse(result.tokens.isEmpty());
    }

    @Test
    public void testHaltsAfterSyntaxErrors() {
        Compiler.CompilationResult result = new Compiler().compile("int x = ;\nshow y;");
        new CompilationMatcher(result)
                .haltsAfter(CompilerError.Phase.SYNTAX)
                .errorCount(1)
                .run();
        assertNotNull(result.program);
        assertNull(result.symbolTable);
        assertTrue(result.semanticErrors.isEmpty());
    }

    @Test
    public void testLargerProgram() {
        compile("func int fact(int n) {\n" +
                "    if (n <= 1) { return 1; }\n" +
                "    else { return n * fact(n - 1); }\n" +
                "}\n" +
                "int limit;\n" +
                "tell limit;\n" +
                "loop from i = 1 to limit {\n" +
                "    show i, fact(i);\n" +
                "}\n" +
                "float avg = 0;\n" +
                "loop (avg < 10.5 || limit == 0) { avg = avg + 2.5; }\n")
                .succeeds()
                .symbol("fact", Type.INT)
                .symbol("i", Type.INT)
                .symbol("avg", Type.FLOAT)
                .tac("FUNC_fact:", "CALL FUNC_fact 1", "END_FUNC_fact", "MAIN:", "READ limit", "ALLOC i int",
                        "ALLOC avg float", "END_MAIN")
                .noTac("ALLOC n int")
                .run();
    }

    @Test
    public void testFormatting() {
        Compiler.CompilationResult result = new Compiler().compile("show 1;");
        assertEquals("MAIN:\nPRINT 1\nEND_MAIN\n", result.formatTac());
        assertEquals("", result.formatErrors());
        Compiler.CompilationResult failed = new Compiler().compile("show y;");
        assertEquals("Semantic Error at line 1: Variable 'y' not declared\n", failed.formatErrors());
        assertEquals("", failed.formatTac());
    }
}
