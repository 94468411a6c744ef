package io.cardsim.simulation;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * A {@link TrialRow} labelled with the run it came from and its relative error.
 */
public final class RawRow
{
  private final TrialRow row;
  private final int runIndex;
  private final double relativeError;

  RawRow(TrialRow row, int runIndex)
  {
    this.row = row;
    this.runIndex = runIndex;
    this.relativeError = RelativeError.of(row.estimatedCardinality(), row.trueCardinality());
  }

  public int numSets()
  {
    return row.numSets();
  }

  public double estimatedCardinality()
  {
    return row.estimatedCardinality();
  }

  public long trueCardinality()
  {
    return row.trueCardinality();
  }

  public int runIndex()
  {
    return runIndex;
  }

  public double relativeError()
  {
    return relativeError;
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawRow)) {
      return false;
    }
    RawRow that = (RawRow) o;
    return runIndex == that.runIndex && row.equals(that.row);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(row, runIndex);
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("runIndex", runIndex)
        .add("numSets", row.numSets())
        .add("estimated", row.estimatedCardinality())
        .add("true", row.trueCardinality())
        .add("relativeError", relativeError)
        .toString();
  }
}
