/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered name-sniffing rules for string columns. The first rule whose fragment occurs in the
 * column name wins; the declared length is then ignored.
 */
public final class SemanticRules {

  public static final SemanticRules DEFAULT =
      new SemanticRules(
          List.of(
              new SemanticRule("name", Capability.NAME),
              new SemanticRule("city", Capability.CITY),
              new SemanticRule("phone", Capability.PHONE),
              new SemanticRule("mobile", Capability.PHONE)));

  private final List<SemanticRule> rules;

  public SemanticRules(final List<SemanticRule> rules) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "Rules cannot be null"));
  }

  public Optional<Capability> match(final String columnName) {
    return rules.stream()
        .filter(rule -> rule.matches(columnName))
        .map(SemanticRule::capability)
        .findFirst();
  }

  public List<SemanticRule> rules() {
    return rules;
  }
}
