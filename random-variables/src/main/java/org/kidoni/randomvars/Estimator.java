package org.kidoni.randomvars;

import java.util.List;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monte Carlo estimates over independent samples of an operand.
 * <p>
 * The parallel variants split the samples into contiguous chunks, give every chunk its own {@link Sampler#split()}
 * stream and add the partial sums.
 */
public final class Estimator {
    private static final Logger LOG = LoggerFactory.getLogger(Estimator.class);

    public static final int DEFAULT_SAMPLES = 1000;

    private final Sampler sampler;

    public Estimator(final Sampler sampler) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
    }

    public static Estimator defaults() {
        return new Estimator(Sampler.defaults());
    }

    public double expected(final Operand x) {
        return expected(x, DEFAULT_SAMPLES);
    }

    /**
     * The mean of {@code n} samples of {@code x}. Boolean samples count as 1 and 0.
     */
    public double expected(final Operand x, final int n) {
        checkSamples(n);
        double mean = total(x, n, sampler, Constant::doubleValue) / n;
        LOG.debug("E[{}] ~ {} from {} samples", x, mean, n);
        return mean;
    }

    public double expected(final Operand x, final int n, final int workers) {
        checkSamples(n);
        double mean = parallelTotal(x, n, workers, Constant::doubleValue) / n;
        LOG.debug("E[{}] ~ {} from {} samples on {} workers", x, mean, n, workers);
        return mean;
    }

    public double probability(final Operand x) {
        return probability(x, DEFAULT_SAMPLES);
    }

    /**
     * The fraction of {@code n} samples of {@code x} that are truthy.
     */
    public double probability(final Operand x, final int n) {
        checkSamples(n);
        double p = total(x, n, sampler, Estimator::indicator) / n;
        LOG.debug("P[{}] ~ {} from {} samples", x, p, n);
        return p;
    }

    public double probability(final Operand x, final int n, final int workers) {
        checkSamples(n);
        double p = parallelTotal(x, n, workers, Estimator::indicator) / n;
        LOG.debug("P[{}] ~ {} from {} samples on {} workers", x, p, n, workers);
        return p;
    }

    private double parallelTotal(final Operand x, final int n, final int workers, final ToDoubleFunction<Constant> measure) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be greater than 0");
        }

        final int chunks = Math.min(workers, n);
        // split on the calling thread so a seeded sampler gives reproducible chunks
        final List<Sampler> samplers = IntStream.range(0, chunks)
                .mapToObj(i -> sampler.split())
                .collect(Collectors.toList());

        return IntStream.range(0, chunks)
                .parallel()
                .mapToDouble(i -> total(x, n / chunks + (i < n % chunks ? 1 : 0), samplers.get(i), measure))
                .sum();
    }

    private static double total(final Operand x, final int n, final Sampler sampler, final ToDoubleFunction<Constant> measure) {
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += measure.applyAsDouble(sampler.sample(x));
        }
        return sum;
    }

    private static double indicator(final Constant value) {
        return value.truthy() ? 1.0 : 0.0;
    }

    private static void checkSamples(final int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be greater than 0");
        }
    }
}
