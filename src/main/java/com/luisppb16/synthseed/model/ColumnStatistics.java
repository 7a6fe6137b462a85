/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import java.util.List;

/** Summary of an observed column, fitted before new rows are synthesized. */
public sealed interface ColumnStatistics {

  /**
   * @param mean sample mean of the non-missing values
   * @param stddev sample standard deviation, replaced by 1 when the sample is degenerate
   * @param count number of non-missing values the fit used
   */
  record Numeric(double mean, double stddev, long count) implements ColumnStatistics {}

  /** Distinct non-missing values in first-seen order. */
  record Distinct(List<Object> values) implements ColumnStatistics {
    public Distinct {
      values = List.copyOf(values);
    }
  }
}
