package io.cardsim.sketch;

/**
 * A summary of a set of identifiers that an {@link Estimator} can turn into a cardinality estimate.
 *
 * <p>Apart from insertion, a sketch is opaque to the simulation: only the estimator and noiser
 * of the same family know how to read it.
 *
 * @param <T> identifier type
 */
public interface Sketch<T>
{
  /**
   * Inserts every identifier of {@code ids}. Inserting the same identifier twice must be harmless.
   */
  void addIds(Iterable<? extends T> ids);
}
