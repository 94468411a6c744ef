package io.cardsim.sketch;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

import java.util.HashSet;
import java.util.Set;

/**
 * A "sketch" that keeps every identifier. Used as the zero-error baseline of an experiment.
 */
public class ExactSetSketch<T> implements Sketch<T>
{
  private final Set<T> ids = new HashSet<>();

  public static <T> SketchFactory<ExactSetSketch<T>> factory()
  {
    // no randomness, the seed is irrelevant
    return seed -> new ExactSetSketch<>();
  }

  @Override
  public void addIds(Iterable<? extends T> ids)
  {
    Iterables.addAll(this.ids, ids);
  }

  public int size()
  {
    return ids.size();
  }

  public Set<T> ids()
  {
    return ImmutableSet.copyOf(ids);
  }

  void copyTo(Set<? super T> target)
  {
    target.addAll(ids);
  }
}
