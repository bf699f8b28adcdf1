package org.kidoni.randomvars;

import java.util.Objects;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

record GeneratorRandomSource(RandomGenerator generator) implements RandomSource {
    GeneratorRandomSource {
        Objects.requireNonNull(generator, "generator");
    }

    @Override
    public double uniform() {
        return generator.nextDouble();
    }

    @Override
    public double standardNormal() {
        return generator.nextGaussian();
    }

    @Override
    public RandomSource split() {
        if (generator instanceof RandomGenerator.SplittableGenerator splittable) {
            return new GeneratorRandomSource(splittable.split());
        }
        return new GeneratorRandomSource(new SplittableRandom(generator.nextLong()));
    }
}
