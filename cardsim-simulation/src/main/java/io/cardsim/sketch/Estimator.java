package io.cardsim.sketch;

import java.util.List;

/**
 * Estimates the cardinality of the union of everything inserted into a list of sketches.
 */
@FunctionalInterface
public interface Estimator<S extends Sketch<?>>
{
  /**
   * @param sketches sketches in the order their sets were generated, never empty
   *
   * @return a non-negative estimate of the union cardinality
   */
  double estimate(List<S> sketches);
}
