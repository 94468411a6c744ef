package io.cardsim.simulation;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Mean and sample standard deviation of one metric over all runs.
 */
public final class Statistic
{
  private final double mean;
  private final double std;

  public Statistic(double mean, double std)
  {
    this.mean = mean;
    this.std = std;
  }

  /**
   * A NaN among {@code values} makes both the mean and the std NaN. The std of a single value is NaN
   * since the sample standard deviation divides by {@code n - 1}.
   */
  public static Statistic of(double[] values)
  {
    Preconditions.checkArgument(values.length > 0, "no values");
    final double mean = new Mean().evaluate(values);
    final double std = values.length == 1 ? Double.NaN : new StandardDeviation(true).evaluate(values);
    return new Statistic(mean, std);
  }

  public double mean()
  {
    return mean;
  }

  public double std()
  {
    return std;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
        .add("mean", mean)
        .add("std", std)
        .toString();
  }
}
