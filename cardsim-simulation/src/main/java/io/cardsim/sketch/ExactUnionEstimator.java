package io.cardsim.sketch;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Returns the exact size of the union of {@link ExactSetSketch}es.
 */
public class ExactUnionEstimator<T> implements Estimator<ExactSetSketch<T>>
{
  @Override
  public double estimate(List<ExactSetSketch<T>> sketches)
  {
    if (sketches.size() == 1) {
      return sketches.get(0).size();
    }
    Set<T> union = new HashSet<>();
    for (ExactSetSketch<T> sketch : sketches) {
      sketch.copyTo(union);
    }
    return union.size();
  }
}
