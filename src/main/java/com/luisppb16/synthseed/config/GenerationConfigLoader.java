/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link GenerationConfig} from the {@code /synthseed.properties} classpath resource,
 * then lets {@code synthseed.*} system properties override individual keys. Keys that are absent
 * everywhere keep the {@link GenerationConfig#defaults() defaults}.
 */
@Slf4j
public final class GenerationConfigLoader {

  public static final String DEFAULT_RESOURCE = "/synthseed.properties";
  private static final String PREFIX = "synthseed.";

  private GenerationConfigLoader() {}

  public static GenerationConfig load() {
    return load(DEFAULT_RESOURCE, System.getProperties());
  }

  public static GenerationConfig load(final String resource, final Properties overrides) {
    final Properties props = readResource(resource);
    overrides.stringPropertyNames().stream()
        .filter(k -> k.startsWith(PREFIX))
        .forEach(k -> props.setProperty(k, overrides.getProperty(k)));
    return fromProperties(props);
  }

  public static GenerationConfig fromProperties(final Properties props) {
    final GenerationConfig defaults = GenerationConfig.defaults();
    return defaults.toBuilder()
        .seed(parseSeed(props.getProperty(PREFIX + "seed")))
        .locale(parseLocale(props.getProperty(PREFIX + "locale"), defaults.locale()))
        .emailDomain(props.getProperty(PREFIX + "email.domain", defaults.emailDomain()).strip())
        .identifierBase(parseLong(props, "identifier.base", defaults.identifierBase()))
        .defaultStringLength(
            (int) parseLong(props, "string.length", defaults.defaultStringLength()))
        .maxRowCount((int) parseLong(props, "rows.max", defaults.maxRowCount()))
        .novelLabelProbability(
            parseDouble(props, "novel.probability", defaults.novelLabelProbability()))
        .integerJitter((int) parseLong(props, "integer.jitter", defaults.integerJitter()))
        .parallelColumns(
            Boolean.parseBoolean(
                props.getProperty(PREFIX + "parallel.columns", "false").strip()))
        .build();
  }

  private static Properties readResource(final String resource) {
    final Properties props = new Properties();
    try (final InputStream is = GenerationConfigLoader.class.getResourceAsStream(resource)) {
      if (Objects.isNull(is)) {
        log.debug("No {} on the classpath, using defaults", resource);
        return props;
      }
      props.load(is);
      log.debug("Loaded generation settings from {}", resource);
      return props;
    } catch (final IOException e) {
      throw new UncheckedIOException("Unable to read " + resource, e);
    }
  }

  private static Long parseSeed(final String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(value.strip());
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + PREFIX + "seed: " + value, e);
    }
  }

  private static Locale parseLocale(final String value, final Locale fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    final String[] parts = value.strip().split("[_-]", 2);
    return parts.length == 1 ? new Locale(parts[0]) : new Locale(parts[0], parts[1]);
  }

  private static long parseLong(final Properties props, final String key, final long fallback) {
    final String value = props.getProperty(PREFIX + key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(value.strip());
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
    }
  }

  private static double parseDouble(
      final Properties props, final String key, final double fallback) {
    final String value = props.getProperty(PREFIX + key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(value.strip());
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
    }
  }
}
