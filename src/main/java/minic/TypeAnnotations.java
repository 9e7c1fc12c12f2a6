package minic;

import java.util.*;

import static minic.Parser.*;

/**
 * Types inferred by the semantic analysis, kept beside the AST.
 *
 * Nodes are keyed by identity. The TAC generator only reads it.
 */
public class TypeAnnotations {

    private final Map<ExpressionNode, Type> expressionTypes = new IdentityHashMap<>();

    /**
     * Range loops that declared their loop variable, with its type
     */
    private final Map<RangeLoopNode, Type> declaredLoopVariables = new IdentityHashMap<>();

    void put(ExpressionNode expression, Type type) {
        expressionTypes.put(expression, type);
    }

    void declareLoopVariable(RangeLoopNode loop, Type type) {
        declaredLoopVariables.put(loop, type);
    }

    /**
     * Type of the expression, the return type for function calls, null if it wasn't analyzed
     */
    public Type typeOf(ExpressionNode expression) {
        return expressionTypes.get(expression);
    }

    public boolean hasType(ExpressionNode expression) {
        return expressionTypes.containsKey(expression);
    }

    public boolean declaresLoopVariable(RangeLoopNode loop) {
        return declaredLoopVariables.containsKey(loop);
    }

    /**
     * Type of the variable the loop declared, null if it reuses an existing one
     */
    public Type getLoopVariableType(RangeLoopNode loop) {
        return declaredLoopVariables.get(loop);
    }

    public int size() {
        return expressionTypes.size();
    }
}
