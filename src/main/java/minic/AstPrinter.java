package minic;

import java.util.List;

import static minic.Parser.*;

/**
 * Prints an AST as an indented tree, one node per line
 */
public class AstPrinter implements NodeVisitor<Void> {

    private static final String INDENT = "  ";

    private final StringBuilder builder = new StringBuilder();
    private int depth = 0;

    public String print(Node node) {
        builder.setLength(0);
        depth = 0;
        node.accept(this);
        return builder.toString();
    }

    private void line(String text) {
        for (int i = 0; i < depth; i++) {
            builder.append(INDENT);
        }
        builder.append(text).append("\n");
    }

    private void child(String label, Node node) {
        depth++;
        if (label != null) {
            line(label + ":");
            depth++;
        }
        node.accept(this);
        if (label != null) {
            depth--;
        }
        depth--;
    }

    private void children(List<? extends Node> nodes) {
        for (Node node : nodes) {
            child(null, node);
        }
    }

    @Override
    public Void visit(ProgramNode program) {
        line("Program");
        children(program.functions);
        children(program.statements);
        return null;
    }

    @Override
    public Void visit(FunctionDeclNode function) {
        StringBuilder params = new StringBuilder();
        for (Parameter parameter : function.parameters) {
            if (params.length() > 0) {
                params.append(", ");
            }
            params.append(parameter);
        }
        line(String.format("FunctionDecl %s %s(%s) %s", function.returnType, function.name, params, function.location));
        child(null, function.body);
        return null;
    }

    @Override
    public Void visit(DeclarationNode declaration) {
        line(String.format("Declaration %s %s %s", declaration.type, declaration.name, declaration.location));
        if (declaration.hasInitializer()) {
            child(null, declaration.initializer);
        }
        return null;
    }

    @Override
    public Void visit(AssignmentNode assignment) {
        line(String.format("Assignment %s %s", assignment.name, assignment.location));
        child(null, assignment.expression);
        return null;
    }

    @Override
    public Void visit(CallStatementNode callStatement) {
        line("CallStatement " + callStatement.location);
        child(null, callStatement.call);
        return null;
    }

    @Override
    public Void visit(IfNode ifStatement) {
        line("If " + ifStatement.location);
        child("condition", ifStatement.condition);
        child("then", ifStatement.thenBlock);
        for (ElifBranch branch : ifStatement.elifBranches) {
            child("elif condition", branch.condition);
            child("elif", branch.block);
        }
        if (ifStatement.hasElse()) {
            child("else", ifStatement.elseBlock);
        }
        return null;
    }

    @Override
    public Void visit(RangeLoopNode loop) {
        line(String.format("RangeLoop %s %s", loop.variable, loop.location));
        if (!loop.usesExistingVariable()) {
            child("from", loop.start);
        }
        child("to", loop.end);
        if (loop.step != null) {
            child("step", loop.step);
        }
        child(null, loop.body);
        return null;
    }

    @Override
    public Void visit(ConditionalLoopNode loop) {
        line("ConditionalLoop " + loop.location);
        child("condition", loop.condition);
        child(null, loop.body);
        return null;
    }

    @Override
    public Void visit(PrintNode print) {
        line("Print " + print.location);
        children(print.expressions);
        return null;
    }

    @Override
    public Void visit(InputNode input) {
        line(String.format("Input %s %s", input.name, input.location));
        return null;
    }

    @Override
    public Void visit(ReturnNode returnStatement) {
        line("Return " + returnStatement.location);
        if (returnStatement.hasExpression()) {
            child(null, returnStatement.expression);
        }
        return null;
    }

    @Override
    public Void visit(BlockNode block) {
        line("Block " + block.location);
        children(block.statements);
        return null;
    }

    @Override
    public Void visit(BinaryOperationNode binaryOperation) {
        line(String.format("BinaryOperation %s %s", binaryOperation.operator, binaryOperation.location));
        child(null, binaryOperation.left);
        child(null, binaryOperation.right);
        return null;
    }

    @Override
    public Void visit(UnaryOperationNode unaryOperation) {
        line(String.format("UnaryOperation %s %s", unaryOperation.operator, unaryOperation.location));
        child(null, unaryOperation.operand);
        return null;
    }

    @Override
    public Void visit(IdentifierNode identifier) {
        line(String.format("Identifier %s %s", identifier.name, identifier.location));
        return null;
    }

    @Override
    public Void visit(LiteralNode literal) {
        String text = literal.type == Type.CHAR ? "'" + literal.text + "'" : literal.text;
        line(String.format("Literal %s %s %s", literal.type, text, literal.location));
        return null;
    }

    @Override
    public Void visit(FunctionCallNode call) {
        line(String.format("FunctionCall %s %s", call.name, call.location));
        children(call.arguments);
        return null;
    }
}
