package org.kidoni.randomvars;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * The uniform and standard normal draws that variables are sampled from.
 */
public interface RandomSource {
    /**
     * @return a value in [0, 1)
     */
    double uniform();

    double standardNormal();

    /**
     * Creates a source whose stream is independent of this one, for use on another thread.
     */
    RandomSource split();

    static RandomSource of(final RandomGenerator generator) {
        return new GeneratorRandomSource(generator);
    }

    static RandomSource seeded(final long seed) {
        return of(new SplittableRandom(seed));
    }

    /**
     * A source drawing from {@link java.util.concurrent.ThreadLocalRandom}, safe to share between threads.
     */
    static RandomSource threadLocal() {
        return ThreadLocalRandomSource.INSTANCE;
    }
}
