package minic;

import java.util.*;

import static minic.Parser.*;

/**
 * Lowers an analyzed AST into three address code, one instruction per string.
 *
 * Expression visits emit the code computing the value and return the operand holding it (a temporary,
 * a variable or a literal). Temporaries (t0, t1, …) and labels (L0, L1, …) are numbered by counters of
 * this generator and never reused within one program.
 */
public class TACGenerator implements NodeVisitor<String> {

    private final TypeAnnotations annotations;

    private final List<String> code = new ArrayList<>();

    private int tempCounter = 0;

    private int labelCounter = 0;

    public TACGenerator(TypeAnnotations annotations) {
        this.annotations = annotations;
    }

    public List<String> generate(ProgramNode program) {
        program.accept(this);
        return Collections.unmodifiableList(code);
    }

    private String newTemp() {
        return "t" + tempCounter++;
    }

    private String newLabel() {
        return "L" + labelCounter++;
    }

    private void emit(String instruction) {
        code.add(instruction);
    }

    private void emit(String format, Object... args) {
        code.add(String.format(format, args));
    }

    @Override
    public String visit(ProgramNode program) {
        for (FunctionDeclNode function : program.functions) {
            function.accept(this);
        }
        emit("MAIN:");
        for (StatementNode statement : program.statements) {
            statement.accept(this);
        }
        emit("END_MAIN");
        return null;
    }

    @Override
    public String visit(FunctionDeclNode function) {
        emit("FUNC_%s:", function.name);
        for (int i = 0; i < function.parameters.size(); i++) {
            emit("PARAM %s %d", function.parameters.get(i).name, i);
        }
        function.body.accept(this);
        emit("RETURN 0");
        emit("END_FUNC_%s", function.name);
        return null;
    }

    @Override
    public String visit(DeclarationNode declaration) {
        emit("ALLOC %s %s", declaration.name, declaration.type);
        if (declaration.hasInitializer()) {
            emit("%s = %s", declaration.name, declaration.initializer.accept(this));
        }
        return null;
    }

    @Override
    public String visit(AssignmentNode assignment) {
        emit("%s = %s", assignment.name, assignment.expression.accept(this));
        return null;
    }

    @Override
    public String visit(CallStatementNode callStatement) {
        callStatement.call.accept(this);
        return null;
    }

    @Override
    public String visit(IfNode ifStatement) {
        List<String> elifLabels = new ArrayList<>();
        for (int i = 0; i < ifStatement.elifBranches.size(); i++) {
            elifLabels.add(newLabel());
        }
        String elseLabel = ifStatement.hasElse() ? newLabel() : null;
        String endLabel = newLabel();
        String afterLastBranch = elseLabel != null ? elseLabel : endLabel;

        String condition = ifStatement.condition.accept(this);
        emit("IF_FALSE %s GOTO %s", condition, elifLabels.isEmpty() ? afterLastBranch : elifLabels.get(0));
        ifStatement.thenBlock.accept(this);
        emit("GOTO %s", endLabel);
        for (int i = 0; i < elifLabels.size(); i++) {
            ElifBranch branch = ifStatement.elifBranches.get(i);
            emit("%s:", elifLabels.get(i));
            String elifCondition = branch.condition.accept(this);
            emit("IF_FALSE %s GOTO %s", elifCondition, i + 1 < elifLabels.size() ? elifLabels.get(i + 1) : afterLastBranch);
            branch.block.accept(this);
            emit("GOTO %s", endLabel);
        }
        if (elseLabel != null) {
            emit("%s:", elseLabel);
            ifStatement.elseBlock.accept(this);
        }
        emit("%s:", endLabel);
        return null;
    }

    @Override
    public String visit(RangeLoopNode loop) {
        String startLabel = newLabel();
        String endLabel = newLabel();
        if (annotations.declaresLoopVariable(loop)) {
            emit("ALLOC %s %s", loop.variable, annotations.getLoopVariableType(loop));
        }
        if (!loop.usesExistingVariable()) {
            emit("%s = %s", loop.variable, loop.start.accept(this));
        }
        emit("%s:", startLabel);
        String end = loop.end.accept(this);
        String condition = newTemp();
        emit("%s = %s <= %s", condition, loop.variable, end);
        emit("IF_FALSE %s GOTO %s", condition, endLabel);
        loop.body.accept(this);
        String step = loop.step != null ? loop.step.accept(this) : "1";
        String next = newTemp();
        emit("%s = %s + %s", next, loop.variable, step);
        emit("%s = %s", loop.variable, next);
        emit("GOTO %s", startLabel);
        emit("%s:", endLabel);
        return null;
    }

    @Override
    public String visit(ConditionalLoopNode loop) {
        String startLabel = newLabel();
        String endLabel = newLabel();
        emit("%s:", startLabel);
        String condition = loop.condition.accept(this);
        emit("IF_FALSE %s GOTO %s", condition, endLabel);
        loop.body.accept(this);
        emit("GOTO %s", startLabel);
        emit("%s:", endLabel);
        return null;
    }

    @Override
    public String visit(PrintNode print) {
        for (ExpressionNode expression : print.expressions) {
            emit("PRINT %s", expression.accept(this));
        }
        return null;
    }

    @Override
    public String visit(InputNode input) {
        emit("READ %s", input.name);
        return null;
    }

    @Override
    public String visit(ReturnNode returnStatement) {
        emit("RETURN %s", returnStatement.hasExpression() ? returnStatement.expression.accept(this) : "0");
        return null;
    }

    @Override
    public String visit(BlockNode block) {
        emit("ENTER_SCOPE");
        for (StatementNode statement : block.statements) {
            statement.accept(this);
        }
        emit("EXIT_SCOPE");
        return null;
    }

    @Override
    public String visit(BinaryOperationNode binaryOperation) {
        String left = binaryOperation.left.accept(this);
        String right = binaryOperation.right.accept(this);
        String temp = newTemp();
        emit("%s = %s %s %s", temp, left, binaryOperation.operator, right);
        return temp;
    }

    @Override
    public String visit(UnaryOperationNode unaryOperation) {
        String operand = unaryOperation.operand.accept(this);
        String temp = newTemp();
        emit("%s = %s%s", temp, unaryOperation.operator, operand);
        return temp;
    }

    @Override
    public String visit(IdentifierNode identifier) {
        return identifier.name;
    }

    @Override
    public String visit(LiteralNode literal) {
        if (literal.type == Type.CHAR) {
            return "'" + literal.text + "'";
        }
        return literal.text;
    }

    @Override
    public String visit(FunctionCallNode call) {
        List<String> arguments = new ArrayList<>();
        for (ExpressionNode argument : call.arguments) {
            arguments.add(argument.accept(this));
        }
        for (int i = arguments.size() - 1; i >= 0; i--) {
            emit("PUSH %s", arguments.get(i));
        }
        emit("CALL FUNC_%s %d", call.name, arguments.size());
        String temp = newTemp();
        emit("%s = RETVAL", temp);
        return temp;
    }
}
