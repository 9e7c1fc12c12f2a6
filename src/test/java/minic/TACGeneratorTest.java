package minic;

import java.util.*;

import org.junit.jupiter.api.Test;

import static minic.Parser.ProgramNode;
import static org.junit.jupiter.api.Assertions.*;

public class TACGeneratorTest {

    private static List<String> generate(String source) {
        ProgramNode program = Parser.parse(source);
        SemanticAnalyzer analyzer = new SemanticAnalyzer();
        analyzer.analyze(program);
        assertEquals(Collections.emptyList(), analyzer.getErrors());
        return new TACGenerator(analyzer.getAnnotations()).generate(program);
    }

    private static void assertTac(String source, String... expected) {
        assertEquals(Arrays.asList(expected), generate(source), () -> String.join("\n", generate(source)));
    }

    @Test
    public void testEmptyProgram() {
        assertTac("", "MAIN:", "END_MAIN");
    }

    @Test
    public void testAssignment() {
        assertTac("int x; x = 5 + 3; show x;",
                "MAIN:", "ALLOC x int", "t0 = 5 + 3", "x = t0", "PRINT x", "END_MAIN");
    }

    @Test
    public void testDeclarationWithInitializer() {
        assertTac("float f = 2.5; int x = -(1 + 2);",
                "MAIN:", "ALLOC f float", "f = 2.5", "ALLOC x int", "t0 = 1 + 2", "t1 = -t0", "x = t1", "END_MAIN");
    }

    @Test
    public void testCharLiterals() {
        assertTac("char c = 'c'; show c, 'd';",
                "MAIN:", "ALLOC c char", "c = 'c'", "PRINT c", "PRINT 'd'", "END_MAIN");
    }

    @Test
    public void testInput() {
        assertTac("int x; tell x; show x;", "MAIN:", "ALLOC x int", "READ x", "PRINT x", "END_MAIN");
    }

    @Test
    public void testIfElifElse() {
        assertTac("int x = 1; if (x > 0) { show 1; } elif (x < 0) { show 2; } else { show 3; }",
                "MAIN:", "ALLOC x int", "x = 1",
                "t0 = x > 0", "IF_FALSE t0 GOTO L0",
                "ENTER_SCOPE", "PRINT 1", "EXIT_SCOPE", "GOTO L2",
                "L0:", "t1 = x < 0", "IF_FALSE t1 GOTO L1",
                "ENTER_SCOPE", "PRINT 2", "EXIT_SCOPE", "GOTO L2",
                "L1:", "ENTER_SCOPE", "PRINT 3", "EXIT_SCOPE",
                "L2:", "END_MAIN");
    }

    @Test
    public void testIfWithoutElse() {
        assertTac("int x = 1; if (x) { }",
                "MAIN:", "ALLOC x int", "x = 1", "IF_FALSE x GOTO L0", "ENTER_SCOPE", "EXIT_SCOPE", "GOTO L0", "L0:",
                "END_MAIN");
    }

    @Test
    public void testLogicalCondition() {
        assertTac("int a = 1; if (a > 0 && !(a == 2)) { }",
                "MAIN:", "ALLOC a int", "a = 1",
                "t0 = a > 0", "t1 = a == 2", "t2 = !t1", "t3 = t0 && t2", "IF_FALSE t3 GOTO L0",
                "ENTER_SCOPE", "EXIT_SCOPE", "GOTO L0", "L0:", "END_MAIN");
    }

    @Test
    public void testRangeLoopDeclaringItsVariable() {
        assertTac("loop from i = 1 to 3 { show i; }",
                "MAIN:", "ALLOC i int", "i = 1",
                "L0:", "t0 = i <= 3", "IF_FALSE t0 GOTO L1",
                "ENTER_SCOPE", "PRINT i", "EXIT_SCOPE",
                "t1 = i + 1", "i = t1", "GOTO L0", "L1:", "END_MAIN");
    }

    @Test
    public void testRangeLoopWithExistingVariableAndStep() {
        assertTac("int n = 0; loop from n to 10 step 2 { }",
                "MAIN:", "ALLOC n int", "n = 0",
                "L0:", "t0 = n <= 10", "IF_FALSE t0 GOTO L1",
                "ENTER_SCOPE", "EXIT_SCOPE",
                "t1 = n + 2", "n = t1", "GOTO L0", "L1:", "END_MAIN");
    }

    @Test
    public void testConditionalLoop() {
        assertTac("int x = 3; loop (x > 0) { x = x - 1; }",
                "MAIN:", "ALLOC x int", "x = 3",
                "L0:", "t0 = x > 0", "IF_FALSE t0 GOTO L1",
                "ENTER_SCOPE", "t1 = x - 1", "x = t1", "EXIT_SCOPE",
                "GOTO L0", "L1:", "END_MAIN");
    }

    @Test
    public void testFunction() {
        assertTac("func int add(int a, int b) { return a + b; }\nint r = add(2, 3);\nshow r;",
                "FUNC_add:", "PARAM a 0", "PARAM b 1",
                "ENTER_SCOPE", "t0 = a + b", "RETURN t0", "EXIT_SCOPE",
                "RETURN 0", "END_FUNC_add",
                "MAIN:", "ALLOC r int", "PUSH 3", "PUSH 2", "CALL FUNC_add 2", "t1 = RETVAL", "r = t1", "PRINT r",
                "END_MAIN");
    }

    @Test
    public void testNestedCallStatement() {
        assertTac("func void f(int a) { return; } func int g() { return 1; } f(g());",
                "FUNC_f:", "PARAM a 0", "ENTER_SCOPE", "RETURN 0", "EXIT_SCOPE", "RETURN 0", "END_FUNC_f",
                "FUNC_g:", "ENTER_SCOPE", "RETURN 1", "EXIT_SCOPE", "RETURN 0", "END_FUNC_g",
                "MAIN:", "CALL FUNC_g 0", "t0 = RETVAL", "PUSH t0", "CALL FUNC_f 1", "t1 = RETVAL", "END_MAIN");
    }

    @Test
    public void testTemporariesAndLabelsAreUnique() {
        List<String> tac = generate("int x = 1;\n" +
                "loop from i = 0 to 4 { if (i % 2 == 0) { x = x * 2 + i; } else { x = x - 1; } }\n" +
                "loop (x > 100) { x = x / 2; }\n" +
                "show x + 1, x * 3;");
        Set<String> temporaries = new HashSet<>();
        Set<String> labels = new HashSet<>();
        for (String instruction : tac) {
            if (instruction.matches("t\\d+ = .*")) {
                assertTrue(temporaries.add(instruction.split(" ")[0]), instruction);
            }
            if (instruction.matches("L\\d+:")) {
                assertTrue(labels.add(instruction), instruction);
            }
        }
        assertEquals(6, labels.size());
        for (String instruction : tac) {
            if (instruction.contains("GOTO")) {
                String target = instruction.substring(instruction.lastIndexOf(' ') + 1);
                assertTrue(labels.contains(target + ":"), "Jump to undefined label " + target);
            }
        }
    }
}
