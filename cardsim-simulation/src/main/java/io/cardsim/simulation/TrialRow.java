package io.cardsim.simulation;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Result of estimating the union of the first {@code numSets} sets of one run.
 */
public final class TrialRow
{
  private final int numSets;
  private final double estimatedCardinality;
  private final long trueCardinality;

  public TrialRow(int numSets, double estimatedCardinality, long trueCardinality)
  {
    Preconditions.checkArgument(numSets > 0, "invalid numSets [%s] : should be > 0", numSets);
    this.numSets = numSets;
    this.estimatedCardinality = estimatedCardinality;
    this.trueCardinality = trueCardinality;
  }

  public int numSets()
  {
    return numSets;
  }

  public double estimatedCardinality()
  {
    return estimatedCardinality;
  }

  public long trueCardinality()
  {
    return trueCardinality;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TrialRow)) {
      return false;
    }
    TrialRow that = (TrialRow) o;
    return numSets == that.numSets
           && Double.compare(estimatedCardinality, that.estimatedCardinality) == 0
           && trueCardinality == that.trueCardinality;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(numSets, estimatedCardinality, trueCardinality);
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("numSets", numSets)
        .add("estimated", estimatedCardinality)
        .add("true", trueCardinality)
        .toString();
  }
}
