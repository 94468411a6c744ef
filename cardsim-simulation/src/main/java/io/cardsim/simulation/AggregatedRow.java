package io.cardsim.simulation;

import com.google.common.base.MoreObjects;

public final class AggregatedRow
{
  private final int numSets;
  private final Statistic estimatedCardinality;
  private final Statistic trueCardinality;
  private final Statistic relativeError;

  public AggregatedRow(
      int numSets,
      Statistic estimatedCardinality,
      Statistic trueCardinality,
      Statistic relativeError
  )
  {
    this.numSets = numSets;
    this.estimatedCardinality = estimatedCardinality;
    this.trueCardinality = trueCardinality;
    this.relativeError = relativeError;
  }

  public int numSets()
  {
    return numSets;
  }

  public Statistic estimatedCardinality()
  {
    return estimatedCardinality;
  }

  public Statistic trueCardinality()
  {
    return trueCardinality;
  }

  public Statistic relativeError()
  {
    return relativeError;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("numSets", numSets)
        .add("estimated", estimatedCardinality)
        .add("true", trueCardinality)
        .add("relativeError", relativeError)
        .toString();
  }
}
