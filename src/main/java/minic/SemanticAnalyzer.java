package minic;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import static minic.Parser.*;

/**
 * Checks declarations, scopes, initialization and types of a program.
 *
 * The first pass registers all functions in the global scope, so functions can call functions that
 * are declared later. The second pass visits the function bodies and then the main statements.
 * Errors are collected, after an error the analysis continues with a fallback type (int).
 * Expression visits return the type of the expression, statement visits return null.
 */
public class SemanticAnalyzer implements NodeVisitor<Type> {

    private static final Logger LOG = Logger.getLogger("Compiler");

    private final SymbolTable symbolTable = new SymbolTable();

    private final TypeAnnotations annotations = new TypeAnnotations();

    private final List<CompilerError> errors = new ArrayList<>();

    /**
     * Function whose body is analyzed, null for the main statements
     */
    private FunctionDeclNode currentFunction = null;

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public TypeAnnotations getAnnotations() {
        return annotations;
    }

    public List<CompilerError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public void analyze(ProgramNode program) {
        program.accept(this);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("Semantic analysis found %d errors", errors.size()));
        }
    }

    private void error(Node node, String message) {
        errors.add(CompilerError.semantic(node.location, message));
    }

    private Type annotate(ExpressionNode expression, Type type) {
        annotations.put(expression, type);
        return type;
    }

    private Type typeOf(ExpressionNode expression) {
        return expression.accept(this);
    }

    private void visitInScope(List<StatementNode> statements) {
        symbolTable.enterScope();
        for (StatementNode statement : statements) {
            statement.accept(this);
        }
        symbolTable.exitScope();
    }

    @Override
    public Type visit(ProgramNode program) {
        for (FunctionDeclNode function : program.functions) {
            List<Type> parameterTypes = new ArrayList<>();
            for (Parameter parameter : function.parameters) {
                parameterTypes.add(parameter.type);
            }
            try {
                symbolTable.insertFunction(function.name, parameterTypes, function.returnType, function.location);
            } catch (CompilerError error) {
                errors.add(error);
            }
        }
        for (FunctionDeclNode function : program.functions) {
            function.accept(this);
        }
        for (StatementNode statement : program.statements) {
            statement.accept(this);
        }
        return null;
    }

    @Override
    public Type visit(FunctionDeclNode function) {
        symbolTable.enterScope();
        currentFunction = function;
        for (Parameter parameter : function.parameters) {
            try {
                symbolTable.insertVariable(parameter.name, parameter.type, parameter.location, true);
            } catch (CompilerError error) {
                errors.add(error);
            }
        }
        function.body.accept(this);
        if (function.returnType != Type.VOID && !function.body.accept(new ReturnCheck())) {
            error(function, String.format("Function '%s' with return type '%s' must have a return statement",
                    function.name, function.returnType));
        }
        currentFunction = null;
        symbolTable.exitScope();
        return null;
    }

    @Override
    public Type visit(DeclarationNode declaration) {
        Type initializerType = declaration.hasInitializer() ? typeOf(declaration.initializer) : null;
        try {
            symbolTable.insertVariable(declaration.name, declaration.type, declaration.location,
                    declaration.hasInitializer());
        } catch (CompilerError error) {
            errors.add(error);
            return null;
        }
        if (initializerType != null && !declaration.type.isAssignableFrom(initializerType)) {
            error(declaration, String.format("Type mismatch: cannot assign %s to %s", initializerType, declaration.type));
        }
        return null;
    }

    @Override
    public Type visit(AssignmentNode assignment) {
        Type expressionType = typeOf(assignment.expression);
        SymbolTable.Entry entry = symbolTable.lookup(assignment.name);
        if (entry == null) {
            error(assignment, String.format("Variable '%s' not declared", assignment.name));
            return null;
        }
        if (entry.isFunction) {
            error(assignment, String.format("Cannot assign to function '%s'", assignment.name));
            return null;
        }
        if (!entry.type.isAssignableFrom(expressionType)) {
            error(assignment, String.format("Type mismatch: cannot assign %s to %s", expressionType, entry.type));
        }
        entry.markInitialized();
        return null;
    }

    @Override
    public Type visit(CallStatementNode callStatement) {
        typeOf(callStatement.call);
        return null;
    }

    @Override
    public Type visit(IfNode ifStatement) {
        typeOf(ifStatement.condition);
        ifStatement.thenBlock.accept(this);
        for (ElifBranch branch : ifStatement.elifBranches) {
            typeOf(branch.condition);
            branch.block.accept(this);
        }
        if (ifStatement.hasElse()) {
            ifStatement.elseBlock.accept(this);
        }
        return null;
    }

    @Override
    public Type visit(RangeLoopNode loop) {
        symbolTable.enterScope();
        SymbolTable.Entry entry = symbolTable.lookup(loop.variable);
        if (entry != null && entry.isFunction) {
            error(loop, String.format("Loop variable '%s' is a function", loop.variable));
        } else if (loop.usesExistingVariable()) {
            if (entry == null) {
                error(loop, String.format("Loop variable '%s' not declared", loop.variable));
            } else {
                checkNumericLoopVariable(loop, entry);
                if (!entry.isInitialized()) {
                    error(loop, String.format("Loop variable '%s' used before initialization", loop.variable));
                }
            }
        } else {
            Type startType = typeOf(loop.start);
            if (!startType.isNumeric()) {
                error(loop, "Loop start must be numeric, got " + startType);
            }
            if (entry == null) {
                symbolTable.insertVariable(loop.variable, Type.INT, loop.location, true);
                annotations.declareLoopVariable(loop, Type.INT);
            } else {
                checkNumericLoopVariable(loop, entry);
                entry.markInitialized();
            }
        }
        Type endType = typeOf(loop.end);
        if (!endType.isNumeric()) {
            error(loop, "Loop end must be numeric, got " + endType);
        }
        if (loop.step != null) {
            Type stepType = typeOf(loop.step);
            if (!stepType.isNumeric()) {
                error(loop, "Loop step must be numeric, got " + stepType);
            }
        }
        loop.body.accept(this);
        symbolTable.exitScope();
        return null;
    }

    private void checkNumericLoopVariable(RangeLoopNode loop, SymbolTable.Entry entry) {
        if (!entry.type.isNumeric()) {
            error(loop, "Loop variable must be numeric, got " + entry.type);
        }
    }

    @Override
    public Type visit(ConditionalLoopNode loop) {
        symbolTable.enterScope();
        typeOf(loop.condition);
        loop.body.accept(this);
        symbolTable.exitScope();
        return null;
    }

    @Override
    public Type visit(PrintNode print) {
        for (ExpressionNode expression : print.expressions) {
            typeOf(expression);
        }
        return null;
    }

    @Override
    public Type visit(InputNode input) {
        SymbolTable.Entry entry = symbolTable.lookup(input.name);
        if (entry == null) {
            error(input, String.format("Variable '%s' not declared", input.name));
        } else if (entry.isFunction) {
            error(input, String.format("Cannot read into function '%s'", input.name));
        } else {
            entry.markInitialized();
        }
        return null;
    }

    @Override
    public Type visit(ReturnNode returnStatement) {
        Type valueType = returnStatement.hasExpression() ? typeOf(returnStatement.expression) : null;
        if (currentFunction == null) {
            error(returnStatement, "Return statement outside of function");
            return null;
        }
        Type returnType = currentFunction.returnType;
        if (valueType != null) {
            if (returnType == Type.VOID) {
                error(returnStatement, String.format("Void function '%s' should not return a value", currentFunction.name));
            } else if (!returnType.isAssignableFrom(valueType)) {
                error(returnStatement, String.format("Return type mismatch: expected %s, got %s", returnType, valueType));
            }
        } else if (returnType != Type.VOID) {
            error(returnStatement, String.format("Function '%s' must return a value of type %s", currentFunction.name, returnType));
        }
        return null;
    }

    @Override
    public Type visit(BlockNode block) {
        visitInScope(block.statements);
        return null;
    }

    @Override
    public Type visit(BinaryOperationNode binaryOperation) {
        Type left = typeOf(binaryOperation.left);
        Type right = typeOf(binaryOperation.right);
        if (binaryOperation.isLogical()) {
            return annotate(binaryOperation, Type.BOOL);
        }
        if (binaryOperation.isRelational()) {
            if (!left.isComparableWith(right)) {
                error(binaryOperation, String.format("Cannot compare %s and %s", left, right));
            }
            return annotate(binaryOperation, Type.BOOL);
        }
        Type result = Type.arithmeticResult(left, right);
        if (result == null) {
            error(binaryOperation, String.format("Invalid operands for %s: %s and %s", binaryOperation.operator, left, right));
            return annotate(binaryOperation, Type.INT);
        }
        return annotate(binaryOperation, result);
    }

    @Override
    public Type visit(UnaryOperationNode unaryOperation) {
        Type operand = typeOf(unaryOperation.operand);
        if (unaryOperation.operator.equals("!")) {
            return annotate(unaryOperation, Type.BOOL);
        }
        if (!operand.isNumeric()) {
            error(unaryOperation, "Cannot negate " + operand);
            return annotate(unaryOperation, Type.INT);
        }
        return annotate(unaryOperation, operand);
    }

    @Override
    public Type visit(IdentifierNode identifier) {
        SymbolTable.Entry entry = symbolTable.lookup(identifier.name);
        if (entry == null) {
            error(identifier, String.format("Variable '%s' not declared", identifier.name));
            return annotate(identifier, Type.INT);
        }
        if (entry.isFunction) {
            error(identifier, String.format("Function '%s' used as a variable", identifier.name));
            return annotate(identifier, Type.INT);
        }
        if (!entry.isInitialized()) {
            error(identifier, String.format("Variable '%s' used before initialization", identifier.name));
        }
        return annotate(identifier, entry.type);
    }

    @Override
    public Type visit(LiteralNode literal) {
        return annotate(literal, literal.type);
    }

    @Override
    public Type visit(FunctionCallNode call) {
        List<Type> argumentTypes = new ArrayList<>();
        for (ExpressionNode argument : call.arguments) {
            argumentTypes.add(typeOf(argument));
        }
        SymbolTable.Entry entry = symbolTable.lookup(call.name);
        if (entry == null) {
            error(call, String.format("Function '%s' not declared", call.name));
            return annotate(call, Type.INT);
        }
        if (!entry.isFunction) {
            error(call, String.format("'%s' is not a function", call.name));
            return annotate(call, Type.INT);
        }
        if (argumentTypes.size() != entry.parameterTypes.size()) {
            error(call, String.format("Function '%s' expects %d arguments, got %d", call.name,
                    entry.parameterTypes.size(), argumentTypes.size()));
        }
        for (int i = 0; i < Math.min(argumentTypes.size(), entry.parameterTypes.size()); i++) {
            Type expected = entry.parameterTypes.get(i);
            if (!expected.isAssignableFrom(argumentTypes.get(i))) {
                error(call, String.format("Argument %d type mismatch: expected %s, got %s", i + 1, expected,
                        argumentTypes.get(i)));
            }
        }
        return annotate(call, entry.returnType());
    }

    /**
     * Syntactic check whether a statement returns on every path: a return, a block containing one,
     * an if with an else whose branches all return, or a loop whose body returns.
     */
    static class ReturnCheck implements NodeVisitor<Boolean> {

        @Override
        public Boolean visit(ProgramNode program) {
            return false;
        }

        @Override
        public Boolean visit(FunctionDeclNode function) {
            return function.body.accept(this);
        }

        @Override
        public Boolean visit(DeclarationNode declaration) {
            return false;
        }

        @Override
        public Boolean visit(AssignmentNode assignment) {
            return false;
        }

        @Override
        public Boolean visit(CallStatementNode callStatement) {
            return false;
        }

        @Override
        public Boolean visit(IfNode ifStatement) {
            if (!ifStatement.hasElse() || !ifStatement.thenBlock.accept(this) || !ifStatement.elseBlock.accept(this)) {
                return false;
            }
            for (ElifBranch branch : ifStatement.elifBranches) {
                if (!branch.block.accept(this)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visit(RangeLoopNode loop) {
            return loop.body.accept(this);
        }

        @Override
        public Boolean visit(ConditionalLoopNode loop) {
            return loop.body.accept(this);
        }

        @Override
        public Boolean visit(PrintNode print) {
            return false;
        }

        @Override
        public Boolean visit(InputNode input) {
            return false;
        }

        @Override
        public Boolean visit(ReturnNode returnStatement) {
            return true;
        }

        @Override
        public Boolean visit(BlockNode block) {
            for (StatementNode statement : block.statements) {
                if (statement.accept(this)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Boolean visit(BinaryOperationNode binaryOperation) {
            return false;
        }

        @Override
        public Boolean visit(UnaryOperationNode unaryOperation) {
            return false;
        }

        @Override
        public Boolean visit(IdentifierNode identifier) {
            return false;
        }

        @Override
        public Boolean visit(LiteralNode literal) {
            return false;
        }

        @Override
        public Boolean visit(FunctionCallNode call) {
            return false;
        }
    }
}
