/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import java.util.Locale;
import java.util.Objects;

/** Column-name fragment that switches a string column to a realistic value capability. */
public record SemanticRule(String fragment, Capability capability) {

  public SemanticRule {
    Objects.requireNonNull(fragment, "Fragment cannot be null");
    Objects.requireNonNull(capability, "Capability cannot be null");
    fragment = fragment.toLowerCase(Locale.ROOT);
  }

  public boolean matches(String columnName) {
    return columnName.toLowerCase(Locale.ROOT).contains(fragment);
  }
}
