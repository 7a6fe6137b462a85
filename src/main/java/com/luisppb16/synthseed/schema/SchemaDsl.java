/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.schema;

import com.luisppb16.synthseed.error.SchemaException;
import com.luisppb16.synthseed.model.ColumnSpec;
import com.luisppb16.synthseed.model.Schema;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import lombok.experimental.UtilityClass;

@UtilityClass
public class SchemaDsl {

  public static Schema schema(ColumnSpec... columns) {
    return new Schema(List.of(columns));
  }

  public static ColumnSpec integer(String name, long min, long max) {
    return new ColumnSpec.IntegerRange(name, min, max);
  }

  public static ColumnSpec decimal(String name, double min, double max) {
    return new ColumnSpec.DecimalRange(name, min, max);
  }

  public static ColumnSpec category(String name, String... labels) {
    return new ColumnSpec.Category(name, List.of(labels));
  }

  public static ColumnSpec text(String name, int length) {
    return new ColumnSpec.Text(name, length);
  }

  public static ColumnSpec date(String name, LocalDate start, LocalDate end) {
    return new ColumnSpec.DateRange(name, start, end);
  }

  /** ISO {@code YYYY-MM-DD} bounds. */
  public static ColumnSpec date(String name, String start, String end) {
    return date(name, parseDate(name, start), parseDate(name, end));
  }

  public static ColumnSpec identifier(String name) {
    return new ColumnSpec.Identifier(name);
  }

  private static LocalDate parseDate(String column, String value) {
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      throw new SchemaException("Column '" + column + "': invalid date '" + value + "'", e);
    }
  }
}
