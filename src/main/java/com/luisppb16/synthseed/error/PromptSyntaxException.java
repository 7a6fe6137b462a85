/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.error;

import java.util.Objects;

/**
 * Grammar violation in a generation prompt. Carries the fragment that failed to parse (usually
 * one column definition) so the caller can point the user at it.
 */
public class PromptSyntaxException extends SynthSeedException {

  private final String reason;
  private final String offendingFragment;

  public PromptSyntaxException(String reason, String offendingFragment) {
    this(reason, offendingFragment, null);
  }

  public PromptSyntaxException(String reason, String offendingFragment, Throwable cause) {
    super(format(reason, offendingFragment), cause);
    this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    this.offendingFragment = Objects.requireNonNullElse(offendingFragment, "");
  }

  public String reason() {
    return reason;
  }

  public String offendingFragment() {
    return offendingFragment;
  }

  private static String format(String reason, String fragment) {
    return fragment == null || fragment.isEmpty() ? reason : reason + ": '" + fragment + "'";
  }
}
