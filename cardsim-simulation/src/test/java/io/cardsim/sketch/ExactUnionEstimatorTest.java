package io.cardsim.sketch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class ExactUnionEstimatorTest
{
  private static ExactSetSketch<String> sketchOf(String... ids)
  {
    ExactSetSketch<String> sketch = ExactSetSketch.<String>factory().create(0);
    sketch.addIds(ImmutableList.copyOf(ids));
    return sketch;
  }

  @Test
  public void testDuplicateIdsAreCountedOnce()
  {
    ExactSetSketch<String> sketch = sketchOf("a", "b", "a");
    sketch.addIds(ImmutableSet.of("b", "c"));
    assertEquals(sketch.size(), 3);
    assertEquals(sketch.ids(), ImmutableSet.of("a", "b", "c"));
  }

  @Test
  public void testUnion()
  {
    ExactUnionEstimator<String> estimator = new ExactUnionEstimator<>();
    ExactSetSketch<String> first = sketchOf("a", "b");
    ExactSetSketch<String> second = sketchOf("b", "c");
    ExactSetSketch<String> empty = sketchOf();

    assertEquals(estimator.estimate(ImmutableList.of(first)), 2.0);
    assertEquals(estimator.estimate(ImmutableList.of(first, second)), 3.0);
    assertEquals(estimator.estimate(ImmutableList.of(first, second, empty)), 3.0);
    assertEquals(estimator.estimate(ImmutableList.of(empty)), 0.0);
  }

  @Test
  public void testEstimateLeavesSketchesUntouched()
  {
    ExactSetSketch<String> first = sketchOf("a");
    ExactSetSketch<String> second = sketchOf("b");
    new ExactUnionEstimator<String>().estimate(ImmutableList.of(first, second));
    assertEquals(first.ids(), ImmutableSet.of("a"));
    assertEquals(second.ids(), ImmutableSet.of("b"));
  }
}
