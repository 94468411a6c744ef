package io.cardsim.generator;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Iterator;
import java.util.Set;

/**
 * Generates sets whose ids are sampled uniformly without replacement from {@code [0, universeSize)},
 * independently for each set. Sets are drawn lazily while iterating.
 *
 * <p>Every set shuffles a full {@code int[universeSize]}, so drawing one set costs time and memory
 * proportional to the universe, not to {@code setSize}. Keep the universe small or expect slow runs
 * when {@code setSize} is much smaller than {@code universeSize}.
 */
public class IndependentSetGenerator implements Iterable<Set<Integer>>
{
  private final RandomDataGenerator random;
  private final int universeSize;
  private final int numSets;
  private final int setSize;

  public IndependentSetGenerator(RandomGenerator random, int universeSize, int numSets, int setSize)
  {
    Preconditions.checkNotNull(random, "random");
    Preconditions.checkArgument(numSets >= 0, "invalid numSets [%s] : should be >= 0", numSets);
    Preconditions.checkArgument(
        setSize >= 0 && setSize <= universeSize,
        "invalid setSize [%s] : should be in [0, %s]",
        setSize,
        universeSize
    );
    this.random = new RandomDataGenerator(random);
    this.universeSize = universeSize;
    this.numSets = numSets;
    this.setSize = setSize;
  }

  public static SetGeneratorFactory<Integer> factory(int universeSize, int numSets, int setSize)
  {
    return random -> new IndependentSetGenerator(random, universeSize, numSets, setSize);
  }

  @Override
  public Iterator<Set<Integer>> iterator()
  {
    return new AbstractIterator<Set<Integer>>()
    {
      private int generated = 0;

      @Override
      protected Set<Integer> computeNext()
      {
        if (generated == numSets) {
          return endOfData();
        }
        generated++;
        return sample(random, universeSize, setSize);
      }
    };
  }

  static Set<Integer> sample(RandomDataGenerator random, int universeSize, int setSize)
  {
    if (setSize == 0) {
      // nextPermutation rejects k == 0
      return ImmutableSet.of();
    }
    ImmutableSet.Builder<Integer> ids = ImmutableSet.builderWithExpectedSize(setSize);
    for (int id : random.nextPermutation(universeSize, setSize)) {
      ids.add(id);
    }
    return ids.build();
  }
}
