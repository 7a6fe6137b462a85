/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Single-value draws shared by the column generators and the augmentation planner.
 *
 * <p>All randomness flows through one {@link Random}, so a seeded instance makes a whole run
 * reproducible. {@code Random} is thread-safe, which lets independent columns be drawn
 * concurrently.
 */
public final class ValueGenerator {

  private static final String ALPHANUMERIC =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
  private static final int DECIMAL_SCALE = 2;

  private final Random random;

  public ValueGenerator(final Random random) {
    this.random = Objects.requireNonNull(random, "Random cannot be null");
  }

  /** Uniform integer in {@code [min, max]}, both inclusive. */
  public long boundedLong(final long min, final long max) {
    if (min > max) {
      throw new IllegalArgumentException("min " + min + " is greater than max " + max);
    }
    if (max == Long.MAX_VALUE) {
      return min == Long.MIN_VALUE ? random.nextLong() : random.nextLong(min - 1, max) + 1;
    }
    return random.nextLong(min, max + 1);
  }

  /** Uniform value in {@code [min, max]} rounded half-up to two decimals. */
  public double boundedDecimal(final double min, final double max) {
    final double u = random.nextDouble();
    // Convex combination, finite for any finite bounds.
    final double raw = min * (1 - u) + max * u;
    if (!Double.isFinite(raw)) {
      return Math.min(max, Math.max(min, raw));
    }
    final double rounded =
        BigDecimal.valueOf(raw).setScale(DECIMAL_SCALE, RoundingMode.HALF_UP).doubleValue();
    return Math.min(max, Math.max(min, rounded));
  }

  public LocalDate boundedDate(final LocalDate start, final LocalDate end) {
    return start.plusDays(boundedLong(0, ChronoUnit.DAYS.between(start, end)));
  }

  public <T> T pickRandom(final List<T> values) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("Cannot pick from an empty list");
    }
    return values.get(random.nextInt(values.size()));
  }

  public String alphanumeric(final int length) {
    final StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
    }
    return sb.toString();
  }

  public double gaussian(final double mean, final double stddev) {
    return mean + stddev * random.nextGaussian();
  }

  /** Uniform integer noise in {@code [-bound, bound]}. */
  public long jitter(final int bound) {
    return boundedLong(-bound, bound);
  }

  public boolean chance(final double probability) {
    return random.nextDouble() < probability;
  }
}
