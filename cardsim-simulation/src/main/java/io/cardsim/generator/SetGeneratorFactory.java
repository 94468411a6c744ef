package io.cardsim.generator;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.Collection;

/**
 * Creates the sets of one simulation run.
 *
 * <p>The returned iterable is iterated once, in order. Implementations draw their randomness from
 * {@code random} so that two runs sharing one random stream see different sets.
 */
@FunctionalInterface
public interface SetGeneratorFactory<T>
{
  Iterable<? extends Collection<T>> create(RandomGenerator random);
}
