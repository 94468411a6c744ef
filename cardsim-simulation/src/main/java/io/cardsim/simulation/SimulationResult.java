package io.cardsim.simulation;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Raw rows of every run plus their per-{@code numSets} aggregation.
 */
public final class SimulationResult
{
  private final List<RawRow> raw;
  private final List<AggregatedRow> aggregated;

  public SimulationResult(List<RawRow> raw, List<AggregatedRow> aggregated)
  {
    this.raw = ImmutableList.copyOf(raw);
    this.aggregated = ImmutableList.copyOf(aggregated);
  }

  /**
   * @return rows of run 0 first, then run 1 and so on, each run's rows in prefix order
   */
  public List<RawRow> raw()
  {
    return raw;
  }

  /**
   * @return one row per distinct {@code numSets}, in ascending order
   */
  public List<AggregatedRow> aggregated()
  {
    return aggregated;
  }
}
