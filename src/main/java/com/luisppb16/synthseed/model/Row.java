/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One positional slice of a dataset: column name to value, in column order. */
public record Row(Map<String, Object> values) {

  public Row {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public Object get(String columnName) {
    return values.get(columnName);
  }
}
