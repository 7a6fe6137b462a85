/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.augment;

import com.luisppb16.synthseed.error.AugmentationException;
import com.luisppb16.synthseed.model.ColumnStatistics;
import com.luisppb16.synthseed.model.Dataset;
import com.luisppb16.synthseed.model.DatasetColumn;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/** Per-column summary statistics of an existing dataset. */
public final class DistributionFitter {

  private static final double DEGENERATE_STDDEV = 1.0;

  public Map<String, ColumnStatistics.Numeric> fit(
      final Dataset dataset, final Collection<String> numericColumnNames) {
    final Map<String, ColumnStatistics.Numeric> stats = new LinkedHashMap<>();
    for (final String name : numericColumnNames) {
      final DatasetColumn column = dataset.column(name);
      if (column == null) {
        throw new AugmentationException("Unknown column '" + name + "'");
      }
      stats.put(column.name(), fitColumn(column));
    }
    return stats;
  }

  /**
   * Mean and sample standard deviation of the non-missing values. A zero or undefined deviation
   * (fewer than two values) is replaced by 1 so the sampling distribution keeps a width.
   */
  public ColumnStatistics.Numeric fitColumn(final DatasetColumn column) {
    if (!column.kind().isNumeric()) {
      throw new AugmentationException(
          "Column '" + column.name() + "' is " + column.kind() + ", not numeric");
    }
    final double[] values =
        column.nonMissing().stream()
            .mapToDouble(v -> ((Number) v).doubleValue())
            .toArray();
    if (values.length == 0) {
      throw new AugmentationException("Column '" + column.name() + "' has no values to fit");
    }

    double sum = 0;
    for (final double v : values) {
      sum += v;
    }
    final double mean = sum / values.length;

    double stddev = Double.NaN;
    if (values.length > 1) {
      double squares = 0;
      for (final double v : values) {
        squares += (v - mean) * (v - mean);
      }
      stddev = Math.sqrt(squares / (values.length - 1));
    }
    if (!(stddev > 0)) {
      stddev = DEGENERATE_STDDEV;
    }
    return new ColumnStatistics.Numeric(mean, stddev, values.length);
  }

  public ColumnStatistics.Distinct distinct(final DatasetColumn column) {
    return new ColumnStatistics.Distinct(List.copyOf(new LinkedHashSet<>(column.nonMissing())));
  }
}
