package io.cardsim.sketch;

/**
 * Perturbs a finished sketch, e.g. to give it a differential privacy guarantee.
 * A noiser only ever sees sketches, never the identifiers inserted into them.
 */
@FunctionalInterface
public interface Noiser<S extends Sketch<?>>
{
  S apply(S sketch);
}
