/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import lombok.Builder;

/**
 * Tunables of the generation engine.
 *
 * @param seed seed of the engine random source and of the stock Faker provider; {@code null}
 *     draws a fresh seed per engine
 * @param locale Faker locale for realistic values
 * @param emailDomain domain appended to derived email addresses
 * @param identifierBase first identifier handed out when no identifiers exist yet
 * @param defaultStringLength length of prompt {@code string} columns without an explicit length
 * @param maxRowCount upper bound for generated and appended row counts
 * @param novelLabelProbability chance that an augmented categorical value is a brand-new label
 * @param integerJitter bound of the integer noise added by the perturb strategy
 * @param parallelColumns generate independent columns concurrently
 */
@Builder(toBuilder = true)
public record GenerationConfig(
    Long seed,
    Locale locale,
    String emailDomain,
    long identifierBase,
    int defaultStringLength,
    int maxRowCount,
    double novelLabelProbability,
    int integerJitter,
    boolean parallelColumns) {

  public static final Locale DEFAULT_LOCALE = new Locale("en", "IND");
  public static final String DEFAULT_EMAIL_DOMAIN = "example.com";
  public static final long DEFAULT_IDENTIFIER_BASE = 10_000L;
  public static final int DEFAULT_STRING_LENGTH = 8;
  public static final int DEFAULT_MAX_ROW_COUNT = 100_000;
  public static final double DEFAULT_NOVEL_LABEL_PROBABILITY = 0.1;
  public static final int DEFAULT_INTEGER_JITTER = 2;

  public GenerationConfig {
    Objects.requireNonNull(locale, "Locale cannot be null");
    Objects.requireNonNull(emailDomain, "Email domain cannot be null");
    if (emailDomain.isBlank() || emailDomain.contains("@")) {
      throw new IllegalArgumentException("Invalid email domain: '" + emailDomain + "'");
    }
    if (defaultStringLength <= 0) {
      throw new IllegalArgumentException("Default string length must be positive");
    }
    if (maxRowCount <= 0) {
      throw new IllegalArgumentException("Maximum row count must be positive");
    }
    if (novelLabelProbability < 0.0 || novelLabelProbability > 1.0) {
      throw new IllegalArgumentException("Novel label probability must lie in [0, 1]");
    }
    if (integerJitter < 0) {
      throw new IllegalArgumentException("Integer jitter cannot be negative");
    }
  }

  public static GenerationConfig defaults() {
    return new GenerationConfig(
        null,
        DEFAULT_LOCALE,
        DEFAULT_EMAIL_DOMAIN,
        DEFAULT_IDENTIFIER_BASE,
        DEFAULT_STRING_LENGTH,
        DEFAULT_MAX_ROW_COUNT,
        DEFAULT_NOVEL_LABEL_PROBABILITY,
        DEFAULT_INTEGER_JITTER,
        false);
  }

  public Random newRandom() {
    return seed == null ? new Random() : new Random(seed);
  }
}
