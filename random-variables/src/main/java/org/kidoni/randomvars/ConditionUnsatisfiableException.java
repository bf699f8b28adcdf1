package org.kidoni.randomvars;

/**
 * Thrown when a conditional value has rejected as many draws as {@link SamplingSettings#maxRejections()} allows, which
 * usually means its condition has zero or negligible probability.
 */
public class ConditionUnsatisfiableException extends EvaluationException {
    private final Given given;
    private final int maxRejections;

    public ConditionUnsatisfiableException(final Given given, final int maxRejections) {
        super("condition " + given.condition() + " not satisfied after " + maxRejections + " rejected samples of " + given);
        this.given = given;
        this.maxRejections = maxRejections;
    }

    public Given getGiven() {
        return given;
    }

    public int getMaxRejections() {
        return maxRejections;
    }
}
