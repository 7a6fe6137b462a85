/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import java.time.LocalDate;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Kind of the values stored in a dataset column, with the Java type each value must have. */
@Getter
@RequiredArgsConstructor
public enum ValueKind {
  INTEGER(Long.class),
  FLOAT(Double.class),
  STRING(String.class),
  DATE(LocalDate.class);

  private final Class<?> javaType;

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }

  /** Missing values ({@code null}) are accepted by every kind. */
  public boolean accepts(Object value) {
    return value == null || javaType.isInstance(value);
  }
}
