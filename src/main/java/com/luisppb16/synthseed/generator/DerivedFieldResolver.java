/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Computes columns whose values are a pure function of another column. */
public final class DerivedFieldResolver {

  private static final String FALLBACK_LOCAL_PART = "user";

  private final String domain;

  public DerivedFieldResolver(final String domain) {
    this.domain = Objects.requireNonNull(domain, "Domain cannot be null");
  }

  public List<String> deriveEmail(final List<String> names) {
    return names.stream().map(this::emailFor).toList();
  }

  /**
   * Lower-cases the name, joins its words with dots and drops apostrophes and hyphens. Missing
   * or empty names map to {@code user@<domain>}.
   */
  public String emailFor(final String name) {
    String local =
        name == null
            ? ""
            : name.toLowerCase(Locale.ROOT).replace(' ', '.').replace("'", "").replace("-", "");
    if (local.isEmpty() || local.chars().allMatch(c -> c == '.')) {
      local = FALLBACK_LOCAL_PART;
    }
    return local + "@" + domain;
  }

  public String suffix() {
    return "@" + domain;
  }
}
