package io.cardsim.sketch;

/**
 * Builds empty sketches. Sketches built from the same seed must be comparable with each other,
 * e.g. share their hash functions.
 */
@FunctionalInterface
public interface SketchFactory<S extends Sketch<?>>
{
  S create(long seed);
}
