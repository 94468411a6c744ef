package io.cardsim.simulation;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteSink;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes simulation tables as comma separated text with a header line.
 *
 * <p>NaN is written as an empty field.
 */
public final class TableWriter
{
  public static final String NUM_SETS = "num_sets";
  public static final String ESTIMATED_CARDINALITY = "estimated_cardinality";
  public static final String TRUE_CARDINALITY = "true_cardinality";
  public static final String RUN_INDEX = "run_index";
  public static final String RELATIVE_ERROR = "relative_error";

  static final List<String> RAW_HEADER = ImmutableList.of(
      NUM_SETS,
      ESTIMATED_CARDINALITY,
      TRUE_CARDINALITY,
      RUN_INDEX,
      RELATIVE_ERROR
  );

  static final List<String> AGGREGATED_HEADER = ImmutableList.of(
      NUM_SETS,
      ESTIMATED_CARDINALITY + "_mean",
      ESTIMATED_CARDINALITY + "_std",
      TRUE_CARDINALITY + "_mean",
      TRUE_CARDINALITY + "_std",
      RELATIVE_ERROR + "_mean",
      RELATIVE_ERROR + "_std"
  );

  private static final Joiner JOINER = Joiner.on(',');

  private TableWriter()
  {
  }

  public static void writeRaw(List<RawRow> rows, ByteSink sink) throws IOException
  {
    try (Writer writer = sink.asCharSink(StandardCharsets.UTF_8).openBufferedStream()) {
      writeRaw(rows, writer);
    }
  }

  public static void writeAggregated(List<AggregatedRow> rows, ByteSink sink) throws IOException
  {
    try (Writer writer = sink.asCharSink(StandardCharsets.UTF_8).openBufferedStream()) {
      writeAggregated(rows, writer);
    }
  }

  /**
   * Writes {@code rows} to {@code writer} without closing it.
   */
  public static void writeRaw(List<RawRow> rows, Writer writer) throws IOException
  {
    writeLine(writer, RAW_HEADER);
    for (RawRow row : rows) {
      writeLine(writer, ImmutableList.of(
          String.valueOf(row.numSets()),
          format(row.estimatedCardinality()),
          String.valueOf(row.trueCardinality()),
          String.valueOf(row.runIndex()),
          format(row.relativeError())
      ));
    }
    writer.flush();
  }

  /**
   * Writes {@code rows} to {@code writer} without closing it.
   */
  public static void writeAggregated(List<AggregatedRow> rows, Writer writer) throws IOException
  {
    writeLine(writer, AGGREGATED_HEADER);
    for (AggregatedRow row : rows) {
      writeLine(writer, ImmutableList.of(
          String.valueOf(row.numSets()),
          format(row.estimatedCardinality().mean()),
          format(row.estimatedCardinality().std()),
          format(row.trueCardinality().mean()),
          format(row.trueCardinality().std()),
          format(row.relativeError().mean()),
          format(row.relativeError().std())
      ));
    }
    writer.flush();
  }

  private static void writeLine(Writer writer, List<String> fields) throws IOException
  {
    writer.write(JOINER.join(fields));
    writer.write("\n");
  }

  static String format(double value)
  {
    return Double.isNaN(value) ? "" : Double.toString(value);
  }
}
