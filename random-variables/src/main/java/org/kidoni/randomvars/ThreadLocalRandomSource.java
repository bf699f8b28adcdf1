package org.kidoni.randomvars;

import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;

enum ThreadLocalRandomSource implements RandomSource {
    INSTANCE;

    @Override
    public double uniform() {
        return ThreadLocalRandom.current().nextDouble();
    }

    @Override
    public double standardNormal() {
        return ThreadLocalRandom.current().nextGaussian();
    }

    @Override
    public RandomSource split() {
        return new GeneratorRandomSource(new SplittableRandom(ThreadLocalRandom.current().nextLong()));
    }
}
