package org.kidoni.randomvars;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws concrete outcomes of operands.
 * <p>
 * One sample draws every distinct free variable exactly once and substitutes the whole tree with that single
 * assignment, so {@code x - x} samples to exactly 0. A {@link Given} is rejection sampled: subject and condition
 * are drawn together and the draw is retried until the condition is truthy, at most
 * {@link SamplingSettings#maxRejections()} times.
 * <p>
 * A sampler is not thread safe unless its {@link RandomSource} is; use {@link #split()} to hand each worker its
 * own stream.
 */
public final class Sampler {
    private static final Logger LOG = LoggerFactory.getLogger(Sampler.class);

    private static final int SLOW_ACCEPTANCE = 10_000;

    private final RandomSource source;
    private final SamplingSettings settings;

    public Sampler(final RandomSource source, final SamplingSettings settings) {
        this.source = Objects.requireNonNull(source, "source");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Sampler(final RandomSource source) {
        this(source, SamplingSettings.defaults());
    }

    /**
     * The sampler behind {@link Operand#sample()}: thread local draws, settings from the environment.
     */
    public static Sampler defaults() {
        return DefaultHolder.DEFAULT;
    }

    public RandomSource source() {
        return source;
    }

    public SamplingSettings settings() {
        return settings;
    }

    public Sampler split() {
        return new Sampler(source.split(), settings);
    }

    public Constant sample(final Operand operand) {
        if (operand instanceof Constant constant) {
            return constant;
        }
        if (operand instanceof Given given) {
            return sampleGiven(given);
        }
        return evaluate(operand, draw(operand.variables()));
    }

    /**
     * Draws one value per variable.
     */
    public Map<Variable, Constant> draw(final Set<Variable> variables) {
        Map<Variable, Constant> values = new HashMap<>();
        for (Variable variable : variables) {
            values.put(variable, variable.draw(source));
        }
        return values;
    }

    private Constant sampleGiven(final Given given) {
        final int maxRejections = settings.maxRejections();
        for (int rejections = 0; rejections < maxRejections; rejections++) {
            Map<Variable, Constant> values = draw(given.variables());
            Constant condition = evaluate(given.condition(), values);
            if (condition.truthy()) {
                if (rejections >= SLOW_ACCEPTANCE) {
                    LOG.debug("accepted sample of {} after {} rejections", given, rejections);
                }
                return evaluate(given.subject(), values);
            }
        }

        LOG.warn("giving up on {} after {} rejected samples", given, maxRejections);
        throw new ConditionUnsatisfiableException(given, maxRejections);
    }

    private static Constant evaluate(final Operand operand, final Map<Variable, Constant> values) {
        Operand result = operand.subs(values);
        if (result instanceof Constant constant) {
            return constant;
        }
        throw new IllegalStateException("unbound variables remain in " + result);
    }

    private static final class DefaultHolder {
        static final Sampler DEFAULT = new Sampler(RandomSource.threadLocal(), SamplingSettings.fromEnvironment());
    }
}
