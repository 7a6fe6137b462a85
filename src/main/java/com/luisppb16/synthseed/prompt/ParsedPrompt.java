/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.prompt;

import com.luisppb16.synthseed.model.Schema;
import java.util.Objects;

public record ParsedPrompt(Schema schema, int rowCount) {

  public ParsedPrompt {
    Objects.requireNonNull(schema, "Schema cannot be null");
  }
}
