/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.error;

/**
 * Structural violation of a column declaration or schema, such as {@code min > max}, an empty
 * category set or a duplicated column name. Raised at construction, never while rows are drawn.
 */
public class SchemaException extends SynthSeedException {

  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
