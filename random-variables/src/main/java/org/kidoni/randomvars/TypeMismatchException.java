package org.kidoni.randomvars;

public class TypeMismatchException extends EvaluationException {
    private final Operator operator;

    public TypeMismatchException(final Operator operator, final Constant left, final Constant right) {
        super("cannot apply '" + operator.symbol() + "' to " + left + " and " + right);
        this.operator = operator;
    }

    public Operator getOperator() {
        return operator;
    }
}
