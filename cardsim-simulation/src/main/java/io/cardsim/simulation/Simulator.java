package io.cardsim.simulation;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import com.google.common.io.ByteSink;
import io.cardsim.generator.SetGeneratorFactory;
import io.cardsim.sketch.Estimator;
import io.cardsim.sketch.Noiser;
import io.cardsim.sketch.Sketch;
import io.cardsim.sketch.SketchFactory;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Measures the accuracy of one estimation method over {@code numRuns} randomized runs.
 *
 * <p>Each run draws sets from a fresh set generator, builds one sketch per set, optionally noises the
 * sketches, and estimates the union of the first 1, 2, .., n sketches against the exact union of the
 * first 1, 2, .., n sets. Runs are then merged and aggregated per number of sets.
 *
 * <p>Two random streams drive a simulation: one is handed to every set generator, the other yields one
 * sketch seed per run. Both only move forward, so results are reproducible given the seeds of both streams
 * and the order of calls. Instances are not thread-safe.
 *
 * @param <T> identifier type
 * @param <S> sketch type of the estimation method
 */
public class Simulator<T, S extends Sketch<T>> implements Callable<SimulationResult>
{
  private static final Logger LOG = LoggerFactory.getLogger(Simulator.class);

  // inclusive, 2^32 - 1 itself is never drawn
  static final long MAX_SKETCH_SEED = (1L << 32) - 2;

  private final int numRuns;
  private final SetGeneratorFactory<T> setGeneratorFactory;
  private final EstimatorConfig<S> estimatorConfig;
  private final RandomDataGenerator sketchRandom;
  private final RandomGenerator setGeneratorRandom;
  private final ByteSink rawSink; // may be null
  private final ByteSink aggregatedSink; // may be null

  private Simulator(Builder<T, S> builder)
  {
    this.numRuns = builder.numRuns;
    this.setGeneratorFactory = builder.setGeneratorFactory;
    this.estimatorConfig = builder.estimatorConfig;
    this.sketchRandom = new RandomDataGenerator(
        builder.sketchRandom != null ? builder.sketchRandom : new Well19937c()
    );
    this.setGeneratorRandom = builder.setGeneratorRandom != null ? builder.setGeneratorRandom : new Well19937c();
    this.rawSink = builder.rawSink;
    this.aggregatedSink = builder.aggregatedSink;
  }

  public static <T, S extends Sketch<T>> Builder<T, S> builder(
      int numRuns,
      SetGeneratorFactory<T> setGeneratorFactory,
      EstimatorConfig<S> estimatorConfig
  )
  {
    return new Builder<>(numRuns, setGeneratorFactory, estimatorConfig);
  }

  @Override
  public SimulationResult call() throws IOException
  {
    return runAllAndAggregate();
  }

  /**
   * Runs all iterations, aggregates them and writes both tables to the configured sinks.
   *
   * <p>Both tables are computed before anything is written. A failing write is rethrown and the
   * remaining sink, if any, is not written.
   *
   * @throws IOException if writing to a sink fails
   */
  public SimulationResult runAllAndAggregate() throws IOException
  {
    LOG.info("Starting {} runs with {}", numRuns, estimatorConfig);
    final Stopwatch total = Stopwatch.createStarted();

    ImmutableList.Builder<RawRow> raw = ImmutableList.builder();
    for (int run = 0; run < numRuns; run++) {
      final Stopwatch stopwatch = Stopwatch.createStarted();
      List<TrialRow> rows = runOne();
      for (TrialRow row : rows) {
        raw.add(new RawRow(row, run));
      }
      LOG.debug("Finish run #{} with {} rows in {} ms", run, rows.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    final List<RawRow> rawTable = raw.build();
    final SimulationResult result = new SimulationResult(rawTable, aggregate(rawTable));

    if (rawSink != null) {
      LOG.debug("Writing {} raw rows to {}", result.raw().size(), rawSink);
      TableWriter.writeRaw(result.raw(), rawSink);
    }
    if (aggregatedSink != null) {
      LOG.debug("Writing {} aggregated rows to {}", result.aggregated().size(), aggregatedSink);
      TableWriter.writeAggregated(result.aggregated(), aggregatedSink);
    }

    LOG.info("Finished {} runs, {} rows in {} ms", numRuns, rawTable.size(), total.elapsed(TimeUnit.MILLISECONDS));
    return result;
  }

  /**
   * Runs one iteration.
   *
   * @return one row per generated set: the estimate and the true cardinality of the union of the
   *     first {@code numSets} sets. Empty if the generator yields no set.
   */
  public List<TrialRow> runOne()
  {
    final Iterable<? extends Collection<T>> setGenerator = Preconditions.checkNotNull(
        setGeneratorFactory.create(setGeneratorRandom),
        "set generator factory returned null"
    );
    // one seed for every sketch of the run, so that sketches share their internal randomness
    final long sketchSeed = sketchRandom.nextLong(0, MAX_SKETCH_SEED);

    final SketchFactory<S> sketchFactory = estimatorConfig.sketchFactory();
    List<S> sketches = new ArrayList<>();
    List<Collection<T>> actualIds = new ArrayList<>();
    for (Collection<T> ids : setGenerator) {
      actualIds.add(ids);
      S sketch = Preconditions.checkNotNull(sketchFactory.create(sketchSeed), "sketch factory returned null");
      sketch.addIds(ids);
      sketches.add(sketch);
    }

    final Optional<Noiser<S>> noiser = estimatorConfig.noiser();
    if (noiser.isPresent()) {
      for (int i = 0; i < sketches.size(); i++) {
        sketches.set(i, Preconditions.checkNotNull(noiser.get().apply(sketches.get(i)), "noiser returned null"));
      }
    }

    final Estimator<S> estimator = estimatorConfig.estimator();
    final List<S> noisedSketches = Collections.unmodifiableList(sketches);
    final Set<T> trueUnion = new HashSet<>();
    ImmutableList.Builder<TrialRow> rows = ImmutableList.builder();
    for (int i = 0; i < noisedSketches.size(); i++) {
      final double estimatedCardinality = estimator.estimate(noisedSketches.subList(0, i + 1));
      trueUnion.addAll(actualIds.get(i));
      rows.add(new TrialRow(i + 1, estimatedCardinality, trueUnion.size()));
    }
    return rows.build();
  }

  /**
   * Groups {@code raw} by number of sets and computes mean and std of each metric.
   *
   * @return one row per distinct number of sets, sorted by it
   */
  public static List<AggregatedRow> aggregate(List<RawRow> raw)
  {
    ListMultimap<Integer, RawRow> byNumSets = MultimapBuilder.treeKeys().arrayListValues().build();
    for (RawRow row : raw) {
      byNumSets.put(row.numSets(), row);
    }

    ImmutableList.Builder<AggregatedRow> aggregated = ImmutableList.builder();
    for (Map.Entry<Integer, Collection<RawRow>> entry : byNumSets.asMap().entrySet()) {
      final Collection<RawRow> group = entry.getValue();
      aggregated.add(new AggregatedRow(
          entry.getKey(),
          Statistic.of(group.stream().mapToDouble(RawRow::estimatedCardinality).toArray()),
          Statistic.of(group.stream().mapToDouble(RawRow::trueCardinality).toArray()),
          Statistic.of(group.stream().mapToDouble(RawRow::relativeError).toArray())
      ));
    }
    return aggregated.build();
  }

  public static class Builder<T, S extends Sketch<T>>
  {
    private final int numRuns;
    private final SetGeneratorFactory<T> setGeneratorFactory;
    private final EstimatorConfig<S> estimatorConfig;
    private RandomGenerator sketchRandom;
    private RandomGenerator setGeneratorRandom;
    private ByteSink rawSink;
    private ByteSink aggregatedSink;

    private Builder(int numRuns, SetGeneratorFactory<T> setGeneratorFactory, EstimatorConfig<S> estimatorConfig)
    {
      Preconditions.checkArgument(numRuns >= 0, "invalid numRuns [%s] : should be >= 0", numRuns);
      this.numRuns = numRuns;
      this.setGeneratorFactory = Preconditions.checkNotNull(setGeneratorFactory, "setGeneratorFactory");
      this.estimatorConfig = Preconditions.checkNotNull(estimatorConfig, "estimatorConfig");
    }

    /**
     * Random stream the per-run sketch seeds are drawn from. Defaults to an unseeded {@link Well19937c}.
     */
    public Builder<T, S> sketchRandom(RandomGenerator sketchRandom)
    {
      this.sketchRandom = Preconditions.checkNotNull(sketchRandom, "sketchRandom");
      return this;
    }

    public Builder<T, S> sketchRandomSeed(long seed)
    {
      return sketchRandom(new Well19937c(seed));
    }

    /**
     * Random stream handed to every set generator. Defaults to an unseeded {@link Well19937c}.
     */
    public Builder<T, S> setGeneratorRandom(RandomGenerator setGeneratorRandom)
    {
      this.setGeneratorRandom = Preconditions.checkNotNull(setGeneratorRandom, "setGeneratorRandom");
      return this;
    }

    public Builder<T, S> setGeneratorRandomSeed(long seed)
    {
      return setGeneratorRandom(new Well19937c(seed));
    }

    public Builder<T, S> rawSink(ByteSink rawSink)
    {
      this.rawSink = Preconditions.checkNotNull(rawSink, "rawSink");
      return this;
    }

    public Builder<T, S> aggregatedSink(ByteSink aggregatedSink)
    {
      this.aggregatedSink = Preconditions.checkNotNull(aggregatedSink, "aggregatedSink");
      return this;
    }

    public Simulator<T, S> build()
    {
      return new Simulator<>(this);
    }
  }
}
