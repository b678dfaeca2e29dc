package com.apilifecycle.engine;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniform draws in [0, 1) for probabilistic brownouts.
 * Only consulted for policies that enable chaos brownouts.
 */
@FunctionalInterface
public interface BrownoutSampler {

    double sample();

    static BrownoutSampler random() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }

    /** A sampler that always returns the same draw; handy for deterministic setups. */
    static BrownoutSampler fixed(double draw) {
        return () -> draw;
    }
}
