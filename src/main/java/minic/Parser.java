package minic;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import static minic.TokenType.*;

/**
 * Recursive descent parser that builds the AST of a program.
 *
 * <pre>
 * Program      := FunctionDecl* Stmt*
 * FunctionDecl := 'func' (int|float|char|void) IDENT '(' [Param {',' Param}] ')' Block
 * Stmt         := Decl | Assign | CallStmt | If | Loop | Show | Tell | Return | Block
 * Cond         := AndCond {'||' AndCond}
 * AndCond      := Relation {'&amp;&amp;' Relation}
 * Relation     := '!' Relation | '(' Cond ')' | Expr [relop Expr]
 * Expr         := Term {('+'|'-') Term}
 * Term         := Unary {('*'|'/'|'%') Unary}
 * Unary        := '-' Unary | Primary
 * </pre>
 *
 * Every decision needs at most one token of lookahead. Syntax errors are thrown as {@link CompilerError}
 * and caught in the statement list and function list parsing, which record them and skip to the
 * next <code>;</code>, <code>}</code> or the end of the input.
 */
public class Parser {

    private static final Logger LOG = Logger.getLogger("Compiler");

    /**
     * Visitor with a method for every node kind, there are no defaults
     */
    public interface NodeVisitor<R> {

        R visit(ProgramNode program);

        R visit(FunctionDeclNode function);

        R visit(DeclarationNode declaration);

        R visit(AssignmentNode assignment);

        R visit(CallStatementNode callStatement);

        R visit(IfNode ifStatement);

        R visit(RangeLoopNode loop);

        R visit(ConditionalLoopNode loop);

        R visit(PrintNode print);

        R visit(InputNode input);

        R visit(ReturnNode returnStatement);

        R visit(BlockNode block);

        R visit(BinaryOperationNode binaryOperation);

        R visit(UnaryOperationNode unaryOperation);

        R visit(IdentifierNode identifier);

        R visit(LiteralNode literal);

        R visit(FunctionCallNode call);
    }

    /**
     * A basic AST node, nodes aren't modified after parsing
     */
    public static abstract class Node {

        public final Location location;

        protected Node(Location location) {
            this.location = location;
        }

        public abstract <R> R accept(NodeVisitor<R> visitor);

        @Override
        public String toString() {
            return new AstPrinter().print(this);
        }
    }

    public static abstract class StatementNode extends Node {
        protected StatementNode(Location location) {
            super(location);
        }
    }

    public static abstract class ExpressionNode extends Node {
        protected ExpressionNode(Location location) {
            super(location);
        }
    }

    /**
     * Functions followed by the main statements
     */
    public static class ProgramNode extends Node {

        public final List<FunctionDeclNode> functions;
        public final List<StatementNode> statements;

        public ProgramNode(Location location, List<FunctionDeclNode> functions, List<StatementNode> statements) {
            super(location);
            this.functions = Collections.unmodifiableList(functions);
            this.statements = Collections.unmodifiableList(statements);
        }

        public FunctionDeclNode getFunction(String name) {
            for (FunctionDeclNode function : functions) {
                if (function.name.equals(name)) {
                    return function;
                }
            }
            return null;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Parameter {
        public final Type type;
        public final String name;
        public final Location location;

        public Parameter(Type type, String name, Location location) {
            this.type = type;
            this.name = name;
            this.location = location;
        }

        @Override
        public String toString() {
            return type + " " + name;
        }
    }

    public static class FunctionDeclNode extends Node {

        public final Type returnType;
        public final String name;
        public final List<Parameter> parameters;
        public final BlockNode body;

        public FunctionDeclNode(Location location, Type returnType, String name, List<Parameter> parameters, BlockNode body) {
            super(location);
            this.returnType = returnType;
            this.name = name;
            this.parameters = Collections.unmodifiableList(parameters);
            this.body = body;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class DeclarationNode extends StatementNode {

        public final Type type;
        public final String name;
        /**
         * Might be null
         */
        public final ExpressionNode initializer;

        public DeclarationNode(Location location, Type type, String name, ExpressionNode initializer) {
            super(location);
            this.type = type;
            this.name = name;
            this.initializer = initializer;
        }

        public boolean hasInitializer() {
            return initializer != null;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class AssignmentNode extends StatementNode {

        public final String name;
        public final ExpressionNode expression;

        public AssignmentNode(Location location, String name, ExpressionNode expression) {
            super(location);
            this.name = name;
            this.expression = expression;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A function call whose result is discarded
     */
    public static class CallStatementNode extends StatementNode {

        public final FunctionCallNode call;

        public CallStatementNode(Location location, FunctionCallNode call) {
            super(location);
            this.call = call;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class ElifBranch {
        public final ExpressionNode condition;
        public final BlockNode block;

        public ElifBranch(ExpressionNode condition, BlockNode block) {
            this.condition = condition;
            this.block = block;
        }
    }

    public static class IfNode extends StatementNode {

        public final ExpressionNode condition;
        public final BlockNode thenBlock;
        public final List<ElifBranch> elifBranches;
        /**
         * Might be null
         */
        public final BlockNode elseBlock;

        public IfNode(Location location, ExpressionNode condition, BlockNode thenBlock, List<ElifBranch> elifBranches, BlockNode elseBlock) {
            super(location);
            this.condition = condition;
            this.thenBlock = thenBlock;
            this.elifBranches = Collections.unmodifiableList(elifBranches);
            this.elseBlock = elseBlock;
        }

        public boolean hasElse() {
            return elseBlock != null;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * <code>loop from i [= start] to end [step s] { … }</code>
     */
    public static class RangeLoopNode extends StatementNode {

        public final String variable;
        /**
         * Null if the loop uses the current value of an existing variable
         */
        public final ExpressionNode start;
        public final ExpressionNode end;
        /**
         * Might be null, the step is 1 then
         */
        public final ExpressionNode step;
        public final BlockNode body;

        public RangeLoopNode(Location location, String variable, ExpressionNode start, ExpressionNode end, ExpressionNode step, BlockNode body) {
            super(location);
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.step = step;
            this.body = body;
        }

        public boolean usesExistingVariable() {
            return start == null;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * <code>loop (cond) { … }</code>
     */
    public static class ConditionalLoopNode extends StatementNode {

        public final ExpressionNode condition;
        public final BlockNode body;

        public ConditionalLoopNode(Location location, ExpressionNode condition, BlockNode body) {
            super(location);
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * <code>show a, b;</code>
     */
    public static class PrintNode extends StatementNode {

        public final List<ExpressionNode> expressions;

        public PrintNode(Location location, List<ExpressionNode> expressions) {
            super(location);
            this.expressions = Collections.unmodifiableList(expressions);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * <code>tell x;</code>
     */
    public static class InputNode extends StatementNode {

        public final String name;

        public InputNode(Location location, String name) {
            super(location);
            this.name = name;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class ReturnNode extends StatementNode {

        /**
         * Might be null
         */
        public final ExpressionNode expression;

        public ReturnNode(Location location, ExpressionNode expression) {
            super(location);
            this.expression = expression;
        }

        public boolean hasExpression() {
            return expression != null;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BlockNode extends StatementNode {

        public final List<StatementNode> statements;

        public BlockNode(Location location, List<StatementNode> statements) {
            super(location);
            this.statements = Collections.unmodifiableList(statements);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class BinaryOperationNode extends ExpressionNode {

        public final ExpressionNode left;
        public final String operator;
        public final ExpressionNode right;

        public BinaryOperationNode(Location location, ExpressionNode left, String operator, ExpressionNode right) {
            super(location);
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        public boolean isLogical() {
            return operator.equals("&&") || operator.equals("||");
        }

        public boolean isRelational() {
            switch (operator) {
                case "==":
                case "!=":
                case "<":
                case ">":
                case "<=":
                case ">=":
                    return true;
                default:
                    return false;
            }
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class UnaryOperationNode extends ExpressionNode {

        /**
         * <code>-</code> or <code>!</code>
         */
        public final String operator;
        public final ExpressionNode operand;

        public UnaryOperationNode(Location location, String operator, ExpressionNode operand) {
            super(location);
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class IdentifierNode extends ExpressionNode {

        public final String name;

        public IdentifierNode(Location location, String name) {
            super(location);
            this.name = name;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class LiteralNode extends ExpressionNode {

        public final Type type;

        /**
         * Literal as written, the character itself for char literals
         */
        public final String text;

        public LiteralNode(Location location, Type type, String text) {
            super(location);
            this.type = type;
            this.text = text;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class FunctionCallNode extends ExpressionNode {

        public final String name;
        public final List<ExpressionNode> arguments;

        public FunctionCallNode(Location location, String name, List<ExpressionNode> arguments) {
            super(location);
            this.name = name;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    private final List<Token> tokens;
    private int pos = 0;
    private final List<CompilerError> errors = new ArrayList<>();

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != EOF) {
            throw new IllegalArgumentException("Token list has to end with an EOF token");
        }
        this.tokens = tokens;
    }

    public List<CompilerError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek() {
        return tokens.get(Math.min(pos + 1, tokens.size() - 1));
    }

    private boolean is(TokenType type) {
        return current().type == type;
    }

    private Token advance() {
        Token token = current();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type) {
        if (!is(type)) {
            throw error(String.format("Expected %s, got %s", type, current().type));
        }
        return advance();
    }

    private CompilerError error(String message) {
        return CompilerError.syntax(current().location, message);
    }

    /**
     * Skips to the next <code>;</code>, <code>}</code> or EOF and consumes a <code>;</code>
     */
    private void synchronize() {
        while (!is(SEMICOLON) && !is(RBRACE) && !is(EOF)) {
            advance();
        }
        if (is(SEMICOLON)) {
            advance();
        }
    }

    private void record(CompilerError error) {
        errors.add(error);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(error.getMessage());
        }
    }

    public ProgramNode parse() {
        Location location = current().location;
        List<FunctionDeclNode> functions = new ArrayList<>();
        while (is(FUNC)) {
            try {
                functions.add(parseFunction());
            } catch (CompilerError error) {
                record(error);
                synchronize();
                if (is(RBRACE)) {
                    advance();
                }
            }
        }
        List<StatementNode> statements = parseStatementList();
        if (!is(EOF)) {
            record(error("Unexpected tokens after program end"));
        }
        return new ProgramNode(location, functions, statements);
    }

    private List<StatementNode> parseStatementList() {
        List<StatementNode> statements = new ArrayList<>();
        while (!is(EOF) && !is(RBRACE)) {
            try {
                statements.add(parseStatement());
            } catch (CompilerError error) {
                record(error);
                synchronize();
            }
        }
        return statements;
    }

    private FunctionDeclNode parseFunction() {
        Location location = expect(FUNC).location;
        if (!is(INT) && !is(FLOAT) && !is(CHAR) && !is(VOID)) {
            throw error("Expected return type (int, float, char or void), got " + current().type);
        }
        Type returnType = Type.fromKeyword(advance().type);
        String name = expect(IDENTIFIER).value;
        expect(LPAREN);
        List<Parameter> parameters = new ArrayList<>();
        if (!is(RPAREN)) {
            parameters.add(parseParameter());
            while (is(COMMA)) {
                advance();
                parameters.add(parseParameter());
            }
        }
        expect(RPAREN);
        BlockNode body = parseBlock();
        return new FunctionDeclNode(location, returnType, name, parameters, body);
    }

    private Parameter parseParameter() {
        if (!current().type.isTypeKeyword()) {
            throw error("Expected parameter type, got " + current().type);
        }
        Token typeToken = advance();
        Token name = expect(IDENTIFIER);
        return new Parameter(Type.fromKeyword(typeToken.type), name.value, typeToken.location);
    }

    private StatementNode parseStatement() {
        Token token = current();
        switch (token.type) {
            case INT:
            case FLOAT:
            case CHAR:
                return parseDeclaration();
            case IDENTIFIER:
                if (peek().is(LPAREN)) {
                    FunctionCallNode call = parseCall();
                    expect(SEMICOLON);
                    return new CallStatementNode(token.location, call);
                }
                return parseAssignment();
            case IF:
                return parseIf();
            case LOOP:
                return parseLoop();
            case SHOW:
                return parsePrint();
            case TELL:
                return parseInput();
            case RETURN:
                return parseReturn();
            case LBRACE:
                return parseBlock();
            default:
                throw error("Unexpected token " + token.type);
        }
    }

    private DeclarationNode parseDeclaration() {
        Token typeToken = advance();
        String name = expect(IDENTIFIER).value;
        ExpressionNode initializer = null;
        if (is(ASSIGN)) {
            advance();
            initializer = parseExpression();
        }
        expect(SEMICOLON);
        return new DeclarationNode(typeToken.location, Type.fromKeyword(typeToken.type), name, initializer);
    }

    private AssignmentNode parseAssignment() {
        Token name = expect(IDENTIFIER);
        expect(ASSIGN);
        ExpressionNode expression = parseExpression();
        expect(SEMICOLON);
        return new AssignmentNode(name.location, name.value, expression);
    }

    private IfNode parseIf() {
        Location location = expect(IF).location;
        expect(LPAREN);
        ExpressionNode condition = parseCondition();
        expect(RPAREN);
        BlockNode thenBlock = parseBlock();
        List<ElifBranch> elifBranches = new ArrayList<>();
        while (is(ELIF)) {
            advance();
            expect(LPAREN);
            ExpressionNode elifCondition = parseCondition();
            expect(RPAREN);
            elifBranches.add(new ElifBranch(elifCondition, parseBlock()));
        }
        BlockNode elseBlock = null;
        if (is(ELSE)) {
            advance();
            elseBlock = parseBlock();
        }
        return new IfNode(location, condition, thenBlock, elifBranches, elseBlock);
    }

    private StatementNode parseLoop() {
        Location location = expect(LOOP).location;
        if (is(LPAREN)) {
            advance();
            ExpressionNode condition = parseCondition();
            expect(RPAREN);
            return new ConditionalLoopNode(location, condition, parseBlock());
        }
        expect(FROM);
        String variable = expect(IDENTIFIER).value;
        ExpressionNode start = null;
        if (is(ASSIGN)) {
            advance();
            start = parseExpression();
        } else if (!is(TO)) {
            throw error("Expected '=' or 'to' after loop variable, got " + current().type);
        }
        expect(TO);
        ExpressionNode end = parseExpression();
        ExpressionNode step = null;
        if (is(STEP)) {
            advance();
            step = parseExpression();
        }
        return new RangeLoopNode(location, variable, start, end, step, parseBlock());
    }

    private PrintNode parsePrint() {
        Location location = expect(SHOW).location;
        List<ExpressionNode> expressions = new ArrayList<>();
        expressions.add(parseExpression());
        while (is(COMMA)) {
            advance();
            expressions.add(parseExpression());
        }
        expect(SEMICOLON);
        return new PrintNode(location, expressions);
    }

    private InputNode parseInput() {
        Location location = expect(TELL).location;
        String name = expect(IDENTIFIER).value;
        expect(SEMICOLON);
        return new InputNode(location, name);
    }

    private ReturnNode parseReturn() {
        Location location = expect(RETURN).location;
        ExpressionNode expression = null;
        if (!is(SEMICOLON)) {
            expression = parseExpression();
        }
        expect(SEMICOLON);
        return new ReturnNode(location, expression);
    }

    private BlockNode parseBlock() {
        Location location = expect(LBRACE).location;
        List<StatementNode> statements = parseStatementList();
        expect(RBRACE);
        return new BlockNode(location, statements);
    }

    private ExpressionNode parseCondition() {
        ExpressionNode left = parseAndCondition();
        while (is(OR)) {
            Token op = advance();
            left = new BinaryOperationNode(op.location, left, op.value, parseAndCondition());
        }
        return left;
    }

    private ExpressionNode parseAndCondition() {
        ExpressionNode left = parseRelation();
        while (is(AND)) {
            Token op = advance();
            left = new BinaryOperationNode(op.location, left, op.value, parseRelation());
        }
        return left;
    }

    private ExpressionNode parseRelation() {
        if (is(NOT)) {
            Token op = advance();
            return new UnaryOperationNode(op.location, op.value, parseRelation());
        }
        if (is(LPAREN)) {
            advance();
            ExpressionNode condition = parseCondition();
            expect(RPAREN);
            return condition;
        }
        ExpressionNode left = parseExpression();
        switch (current().type) {
            case EQ:
            case NEQ:
            case LT:
            case GT:
            case LTE:
            case GTE:
                Token op = advance();
                return new BinaryOperationNode(op.location, left, op.value, parseExpression());
            default:
                return left;
        }
    }

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (is(PLUS) || is(MINUS)) {
            Token op = advance();
            left = new BinaryOperationNode(op.location, left, op.value, parseTerm());
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseUnary();
        while (is(MULTIPLY) || is(DIVIDE) || is(MODULO)) {
            Token op = advance();
            left = new BinaryOperationNode(op.location, left, op.value, parseUnary());
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (is(MINUS)) {
            Token op = advance();
            return new UnaryOperationNode(op.location, op.value, parseUnary());
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        Token token = current();
        switch (token.type) {
            case IDENTIFIER:
                if (peek().is(LPAREN)) {
                    return parseCall();
                }
                advance();
                return new IdentifierNode(token.location, token.value);
            case INTEGER_LITERAL:
                advance();
                return new LiteralNode(token.location, Type.INT, token.value);
            case FLOAT_LITERAL:
                advance();
                return new LiteralNode(token.location, Type.FLOAT, token.value);
            case CHAR_LITERAL:
                advance();
                return new LiteralNode(token.location, Type.CHAR, token.value);
            case LPAREN:
                advance();
                ExpressionNode expression = parseExpression();
                expect(RPAREN);
                return expression;
            default:
                throw error("Unexpected token " + token.type);
        }
    }

    private FunctionCallNode parseCall() {
        Token name = expect(IDENTIFIER);
        expect(LPAREN);
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!is(RPAREN)) {
            arguments.add(parseExpression());
            while (is(COMMA)) {
                advance();
                arguments.add(parseExpression());
            }
        }
        expect(RPAREN);
        return new FunctionCallNode(name.location, name.value, arguments);
    }

    /**
     * Lexes and parses the passed source, throws the first lexical or syntax error
     */
    public static ProgramNode parse(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        if (!lexer.getErrors().isEmpty()) {
            throw lexer.getErrors().get(0);
        }
        Parser parser = new Parser(tokens);
        ProgramNode program = parser.parse();
        if (!parser.getErrors().isEmpty()) {
            throw parser.getErrors().get(0);
        }
        return program;
    }
}
