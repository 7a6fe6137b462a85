/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.augment;

import com.luisppb16.synthseed.model.ValueKind;
import java.util.EnumSet;
import java.util.Set;

/** How augmented values of one column are synthesized. Bound once per column per call. */
public enum AugmentationStrategy {
  /** Draw from a normal distribution fitted to the column. */
  FITTED,
  /** Pick an existing value and add small noise. */
  PERTURB,
  /** Pick among the distinct observed values. */
  EXISTING_ONLY,
  /** Like {@link #EXISTING_ONLY}, occasionally inventing a label never seen before. */
  EXISTING_PLUS_NOVEL,
  /** Resample the raw column, missing values included. */
  BOOTSTRAP;

  private static final Set<AugmentationStrategy> NUMERIC = EnumSet.of(FITTED, PERTURB, BOOTSTRAP);
  private static final Set<AugmentationStrategy> TEXTUAL =
      EnumSet.of(EXISTING_ONLY, EXISTING_PLUS_NOVEL, BOOTSTRAP);

  public boolean supports(ValueKind kind) {
    return switch (kind) {
      case INTEGER, FLOAT -> NUMERIC.contains(this);
      case STRING -> TEXTUAL.contains(this);
      case DATE -> this == BOOTSTRAP;
    };
  }

  public static AugmentationStrategy defaultFor(ValueKind kind) {
    return switch (kind) {
      case INTEGER, FLOAT -> FITTED;
      case STRING -> EXISTING_PLUS_NOVEL;
      case DATE -> BOOTSTRAP;
    };
  }
}
