package io.cardsim.simulation;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.cardsim.sketch.Estimator;
import io.cardsim.sketch.Noiser;
import io.cardsim.sketch.Sketch;
import io.cardsim.sketch.SketchFactory;

import java.util.Optional;

/**
 * The estimation method under test: how to build a sketch, how to estimate from a list of sketches,
 * and optionally how to noise each sketch before estimation.
 */
public final class EstimatorConfig<S extends Sketch<?>>
{
  private final SketchFactory<S> sketchFactory;
  private final Estimator<S> estimator;
  private final Noiser<S> noiser; // may be null

  public EstimatorConfig(SketchFactory<S> sketchFactory, Estimator<S> estimator, Noiser<S> noiser)
  {
    this.sketchFactory = Preconditions.checkNotNull(sketchFactory, "sketchFactory");
    this.estimator = Preconditions.checkNotNull(estimator, "estimator");
    this.noiser = noiser;
  }

  public EstimatorConfig(SketchFactory<S> sketchFactory, Estimator<S> estimator)
  {
    this(sketchFactory, estimator, null);
  }

  public SketchFactory<S> sketchFactory()
  {
    return sketchFactory;
  }

  public Estimator<S> estimator()
  {
    return estimator;
  }

  public Optional<Noiser<S>> noiser()
  {
    return Optional.ofNullable(noiser);
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("sketchFactory", sketchFactory)
        .add("estimator", estimator)
        .add("noiser", noiser)
        .toString();
  }
}
