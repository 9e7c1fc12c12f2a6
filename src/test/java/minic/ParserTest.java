package minic;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static minic.Parser.*;
import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static List<CompilerError> syntaxErrors(String source) {
        Parser parser = new Parser(new Lexer(source).tokenize());
        parser.parse();
        return parser.getErrors();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "int x;",
            "int x = 1; float y = x * 2.5; char c = 'a';",
            "x = -(1 + 2) % 3;",
            "f(); f(1, g(2), 'c');",
            "if (x == 1) { show x; } elif (x < 1 && !(y >= 2)) { } elif (x) { } else { tell x; }",
            "loop (x != 0 || y > 1) { x = x - 1; }",
            "loop from i = 1 to 10 step 2 { show i, i * i; }",
            "loop from i to n { }",
            "{ { int x; } }",
            "func void f() { return; } func int g(int a, float b, char c) { return a; } show g(1, 2.0, 'x');"
    })
    public void testValidPrograms(String source) {
        assertEquals(0, syntaxErrors(source).size(), () -> syntaxErrors(source).toString());
    }

    @Test
    public void testProgramStructure() {
        ProgramNode program = Parser.parse("func int add(int a, int b) { return a + b; }\nint x = add(2, 3);");
        assertEquals(1, program.functions.size());
        FunctionDeclNode add = program.getFunction("add");
        assertEquals(Type.INT, add.returnType);
        assertEquals(2, add.parameters.size());
        assertEquals("b", add.parameters.get(1).name);
        assertEquals(1, program.statements.size());
        DeclarationNode declaration = (DeclarationNode) program.statements.get(0);
        assertTrue(declaration.initializer instanceof FunctionCallNode);
        assertEquals(2, ((FunctionCallNode) declaration.initializer).arguments.size());
        assertEquals(new Location(2, 1), declaration.location);
        assertNull(program.getFunction("sub"));
    }

    @Test
    public void testOperatorPrecedence() {
        AssignmentNode assignment = (AssignmentNode) Parser.parse("x = 1 + 2 * -3 - 4;").statements.get(0);
        BinaryOperationNode minus = (BinaryOperationNode) assignment.expression;
        assertEquals("-", minus.operator);
        BinaryOperationNode plus = (BinaryOperationNode) minus.left;
        assertEquals("+", plus.operator);
        BinaryOperationNode times = (BinaryOperationNode) plus.right;
        assertEquals("*", times.operator);
        assertTrue(times.right instanceof UnaryOperationNode);
    }

    @Test
    public void testConditionPrecedence() {
        IfNode ifNode = (IfNode) Parser.parse("if (a < 1 || b == 2 && !c) { }").statements.get(0);
        BinaryOperationNode or = (BinaryOperationNode) ifNode.condition;
        assertEquals("||", or.operator);
        assertTrue(or.isLogical());
        assertTrue(((BinaryOperationNode) or.left).isRelational());
        BinaryOperationNode and = (BinaryOperationNode) or.right;
        assertEquals("&&", and.operator);
        assertEquals("!", ((UnaryOperationNode) and.right).operator);
    }

    @Test
    public void testLoops() {
        List<StatementNode> statements = Parser.parse("loop from i = 0 to 3 { } loop from j to 5 step 2 { } loop (x) { }").statements;
        RangeLoopNode first = (RangeLoopNode) statements.get(0);
        assertFalse(first.usesExistingVariable());
        assertNull(first.step);
        RangeLoopNode second = (RangeLoopNode) statements.get(1);
        assertTrue(second.usesExistingVariable());
        assertEquals("2", ((LiteralNode) second.step).text);
        assertTrue(statements.get(2) instanceof ConditionalLoopNode);
    }

    @Test
    public void testIfBranches() {
        IfNode ifNode = (IfNode) Parser.parse("if (x) { } elif (y) { show 1; } else { }").statements.get(0);
        assertEquals(1, ifNode.elifBranches.size());
        assertEquals(1, ifNode.elifBranches.get(0).block.statements.size());
        assertTrue(ifNode.hasElse());
        assertFalse(((IfNode) Parser.parse("if (x) { }").statements.get(0)).hasElse());
    }

    @Test
    public void testMissingSemicolon() {
        List<CompilerError> errors = syntaxErrors("int x");
        assertEquals(1, errors.size());
        assertEquals("Syntax Error at line 1: Expected SEMICOLON, got EOF", errors.get(0).getMessage());
    }

    @Test
    public void testUnexpectedToken() {
        List<CompilerError> errors = syntaxErrors("int x;\n+ 2;\nshow x;");
        assertEquals(1, errors.size());
        assertEquals("Syntax Error at line 2: Unexpected token PLUS", errors.get(0).getMessage());
    }

    @Test
    public void testRecoveryCollectsSeveralErrors() {
        Parser parser = new Parser(new Lexer("int = 1;\nx = ;\nshow x;\nif x show x;").tokenize());
        ProgramNode program = parser.parse();
        List<CompilerError> errors = parser.getErrors();
        assertEquals(3, errors.size(), errors::toString);
        assertEquals(1, errors.get(0).location.line);
        assertEquals(2, errors.get(1).location.line);
        assertEquals("Syntax Error at line 4: Expected LPAREN, got IDENTIFIER", errors.get(2).getMessage());
        assertTrue(program.statements.get(0) instanceof PrintNode);
    }

    @Test
    public void testRecoveryInsideFunction() {
        Parser parser = new Parser(new Lexer("func int f(x) { return 1; }\nshow 2;").tokenize());
        ProgramNode program = parser.parse();
        assertEquals(1, parser.getErrors().size());
        assertEquals("Syntax Error at line 1: Expected parameter type, got IDENTIFIER", parser.getErrors().get(0).getMessage());
        assertEquals(1, program.statements.size());
        assertTrue(program.functions.isEmpty());
    }

    @Test
    public void testLeftoverTokens() {
        List<CompilerError> errors = syntaxErrors("show 1; }");
        assertEquals(1, errors.size());
        assertEquals("Syntax Error at line 1: Unexpected tokens after program end", errors.get(0).getMessage());
    }

    @Test
    public void testLoopVariableError() {
        assertEquals("Syntax Error at line 1: Expected '=' or 'to' after loop variable, got INTEGER_LITERAL",
                syntaxErrors("loop from i 1 to 2 { }").get(0).getMessage());
    }

    @Test
    public void testTokensHaveToEndWithEof() {
        assertThrows(IllegalArgumentException.class, () -> new Parser(java.util.Collections.emptyList()));
    }

    @Test
    public void testStaticParseThrowsFirstError() {
        CompilerError lexical = assertThrows(CompilerError.class, () -> Parser.parse("int x = #;"));
        assertEquals(CompilerError.Phase.LEXICAL, lexical.phase);
        CompilerError syntax = assertThrows(CompilerError.class, () -> Parser.parse("int x = ;"));
        assertEquals(CompilerError.Phase.SYNTAX, syntax.phase);
    }

    @Test
    public void testAstPrinter() {
        String tree = new AstPrinter().print(Parser.parse("int x = 'a';\nif (x > 1) { show x; } else { }"));
        assertEquals("Program\n" +
                "  Declaration int x [1:1]\n" +
                "    Literal char 'a' [1:9]\n" +
                "  If [2:1]\n" +
                "    condition:\n" +
                "      BinaryOperation > [2:7]\n" +
                "        Identifier x [2:5]\n" +
                "        Literal int 1 [2:9]\n" +
                "    then:\n" +
                "      Block [2:12]\n" +
                "        Print [2:14]\n" +
                "          Identifier x [2:19]\n" +
                "    else:\n" +
                "      Block [2:29]\n", tree);
    }
}
