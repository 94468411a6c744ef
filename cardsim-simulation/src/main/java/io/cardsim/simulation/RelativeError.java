package io.cardsim.simulation;

public final class RelativeError
{
  private RelativeError()
  {
  }

  /**
   * Computes {@code (estimated - truth) / truth}.
   *
   * @return NaN when {@code truth} is zero, whatever the estimate
   */
  public static double of(double estimated, double truth)
  {
    if (truth == 0) {
      return Double.NaN;
    }
    return (estimated - truth) / truth;
  }
}
