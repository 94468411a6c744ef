package io.cardsim.generator;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Collections;
import java.util.Iterator;
import java.util.Set;

/**
 * Generates {@code numSets} copies of a single random set, so the true union never grows past the first set.
 */
public class FullyOverlapSetGenerator implements Iterable<Set<Integer>>
{
  private final Set<Integer> ids;
  private final int numSets;

  public FullyOverlapSetGenerator(RandomGenerator random, int universeSize, int numSets, int setSize)
  {
    Preconditions.checkNotNull(random, "random");
    Preconditions.checkArgument(numSets >= 0, "invalid numSets [%s] : should be >= 0", numSets);
    Preconditions.checkArgument(
        setSize >= 0 && setSize <= universeSize,
        "invalid setSize [%s] : should be in [0, %s]",
        setSize,
        universeSize
    );
    this.ids = IndependentSetGenerator.sample(new RandomDataGenerator(random), universeSize, setSize);
    this.numSets = numSets;
  }

  public static SetGeneratorFactory<Integer> factory(int universeSize, int numSets, int setSize)
  {
    return random -> new FullyOverlapSetGenerator(random, universeSize, numSets, setSize);
  }

  @Override
  public Iterator<Set<Integer>> iterator()
  {
    return Collections.nCopies(numSets, ids).iterator();
  }
}
