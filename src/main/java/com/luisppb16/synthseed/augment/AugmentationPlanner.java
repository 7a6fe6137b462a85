/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.augment;

import com.luisppb16.synthseed.config.GenerationConfig;
import com.luisppb16.synthseed.error.AugmentationException;
import com.luisppb16.synthseed.generator.Capability;
import com.luisppb16.synthseed.generator.DerivedFieldResolver;
import com.luisppb16.synthseed.generator.IdentifierAllocator;
import com.luisppb16.synthseed.generator.ValueGenerator;
import com.luisppb16.synthseed.model.ColumnRoles;
import com.luisppb16.synthseed.model.ColumnStatistics;
import com.luisppb16.synthseed.model.Dataset;
import com.luisppb16.synthseed.model.DatasetColumn;
import com.luisppb16.synthseed.model.ValueKind;
import com.luisppb16.synthseed.provider.RealisticValueProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Grows a dataset by new rows that keep each column's observed character.
 *
 * <p>Every ordinary column is bound to one {@link AugmentationStrategy} for the whole call, either
 * from the caller's map or from the kind's default ({@code FITTED} for numbers, {@code
 * EXISTING_PLUS_NOVEL} for text, {@code BOOTSTRAP} for dates). Strategy keys match column names
 * case-insensitively. A key naming no column, or a strategy the column's kind cannot use, fails
 * the call before any row is drawn.
 *
 * <p>Key responsibilities include:
 *
 * <ul>
 *   <li>Fitting a normal distribution to numeric columns, keeping integral columns integral
 *   <li>Perturbing, resampling or widening the observed values of the remaining columns
 *   <li>Allocating identifiers past every identifier already present
 *   <li>Recomputing emails derived from a name column over old and new rows alike
 * </ul>
 *
 * <p>New rows are drawn row by row, so labels invented for a text column join its pool and may be
 * drawn again later in the same call. All other original values are carried over unchanged, and
 * missing values ({@code null} or {@code NaN}) never feed a fitted distribution.
 *
 * @author Luis Pepe
 * @version 1.0
 * @since 2026
 */
@Slf4j
public final class AugmentationPlanner {

  private static final String FORCED_INTEGRAL_COLUMN = "age";
  private static final int NOVEL_LABEL_ATTEMPTS = 10;

  private final ValueGenerator values;
  private final RealisticValueProvider provider;
  private final IdentifierAllocator identifiers;
  private final DerivedFieldResolver resolver;
  private final DistributionFitter fitter;
  private final GenerationConfig config;

  public AugmentationPlanner(
      final ValueGenerator values,
      final RealisticValueProvider provider,
      final IdentifierAllocator identifiers,
      final DerivedFieldResolver resolver,
      final DistributionFitter fitter,
      final GenerationConfig config) {
    this.values = Objects.requireNonNull(values, "Value generator cannot be null");
    this.provider = Objects.requireNonNull(provider, "Value provider cannot be null");
    this.identifiers = Objects.requireNonNull(identifiers, "Identifier allocator cannot be null");
    this.resolver = Objects.requireNonNull(resolver, "Field resolver cannot be null");
    this.fitter = Objects.requireNonNull(fitter, "Distribution fitter cannot be null");
    this.config = Objects.requireNonNull(config, "Config cannot be null");
  }

  public Dataset augment(
      final Dataset dataset,
      final int additionalRows,
      final Map<String, AugmentationStrategy> strategies) {
    Objects.requireNonNull(dataset, "Dataset cannot be null");
    Objects.requireNonNull(strategies, "Strategy map cannot be null");
    if (dataset.columns().isEmpty()) {
      throw new AugmentationException("Cannot augment a dataset without columns");
    }
    if (additionalRows < 1 || additionalRows > config.maxRowCount()) {
      throw new AugmentationException(
          "Additional rows must be between 1 and %d, was %d"
              .formatted(config.maxRowCount(), additionalRows));
    }

    final Instant start = Instant.now();
    final List<String> names = dataset.columnNames();
    final Optional<String> nameSource = ColumnRoles.nameSource(names);
    final Set<String> derivedEmails =
        nameSource.isPresent() ? Set.copyOf(ColumnRoles.emailColumns(names)) : Set.of();

    final Map<String, AugmentationStrategy> bound =
        bindStrategies(dataset, strategies, derivedEmails);
    final Map<String, Supplier<Object>> samplers = new LinkedHashMap<>();
    bound.forEach((name, strategy) -> samplers.put(name, sampler(dataset.column(name), strategy)));

    final Map<String, List<Object>> fresh = new LinkedHashMap<>();
    samplers.keySet().forEach(name -> fresh.put(name, new ArrayList<>(additionalRows)));
    for (int row = 0; row < additionalRows; row++) {
      samplers.forEach((name, sampler) -> fresh.get(name).add(sampler.get()));
    }

    final List<DatasetColumn> columns = new ArrayList<>(names.size());
    for (final DatasetColumn column : dataset.columns()) {
      final List<Object> combined = new ArrayList<>(column.values());
      if (derivedEmails.contains(column.name())) {
        combined.addAll(Collections.nCopies(additionalRows, null));
      } else if (ColumnRoles.isIdentifier(column.name())) {
        combined.addAll(newIdentifiers(column, additionalRows));
      } else {
        combined.addAll(fresh.get(column.name()));
      }
      columns.add(new DatasetColumn(column.name(), column.kind(), combined));
    }

    final Dataset grown = new Dataset(columns);
    final Dataset result =
        nameSource.isPresent() && !derivedEmails.isEmpty()
            ? recomputeEmails(grown, nameSource.get(), derivedEmails)
            : grown;

    log.debug(
        "Augmented {} rows with {} new rows in {} ms, strategies {}",
        dataset.rowCount(),
        additionalRows,
        Duration.between(start, Instant.now()).toMillis(),
        bound);
    return result;
  }

  private Map<String, AugmentationStrategy> bindStrategies(
      final Dataset dataset,
      final Map<String, AugmentationStrategy> requested,
      final Set<String> derivedEmails) {
    final Map<String, AugmentationStrategy> byLowerName =
        requested.entrySet().stream()
            .collect(
                Collectors.toMap(
                    e -> e.getKey().toLowerCase(Locale.ROOT),
                    e -> Objects.requireNonNull(e.getValue(), "Strategy cannot be null"),
                    (a, b) -> {
                      throw new AugmentationException("Strategy map names a column twice");
                    }));

    final Set<String> known = new HashSet<>();
    final Map<String, AugmentationStrategy> bound = new LinkedHashMap<>();
    for (final DatasetColumn column : dataset.columns()) {
      final String key = column.name().toLowerCase(Locale.ROOT);
      known.add(key);
      final AugmentationStrategy chosen = byLowerName.get(key);
      if (ColumnRoles.isIdentifier(column.name()) || derivedEmails.contains(column.name())) {
        if (chosen != null) {
          throw new AugmentationException(
              "Column '" + column.name() + "' is recomputed, it takes no strategy");
        }
        continue;
      }
      final AugmentationStrategy strategy =
          chosen != null ? chosen : AugmentationStrategy.defaultFor(column.kind());
      if (!strategy.supports(column.kind())) {
        throw new AugmentationException(
            "Strategy %s does not apply to %s column '%s'"
                .formatted(strategy, column.kind(), column.name()));
      }
      bound.put(column.name(), strategy);
    }

    byLowerName.keySet().stream()
        .filter(k -> !known.contains(k))
        .findFirst()
        .ifPresent(
            k -> {
              throw new AugmentationException("Strategy given for unknown column '" + k + "'");
            });
    return bound;
  }

  private Supplier<Object> sampler(
      final DatasetColumn column, final AugmentationStrategy strategy) {
    return switch (strategy) {
      case FITTED -> fittedSampler(column);
      case PERTURB -> perturbSampler(column);
      case EXISTING_ONLY -> {
        final List<Object> pool = distinctPool(column);
        yield () -> values.pickRandom(pool);
      }
      case EXISTING_PLUS_NOVEL -> novelSampler(column);
      case BOOTSTRAP -> {
        if (column.size() == 0) {
          throw new AugmentationException("Column '" + column.name() + "' has no rows to sample");
        }
        yield () -> values.pickRandom(column.values());
      }
    };
  }

  private Supplier<Object> fittedSampler(final DatasetColumn column) {
    final ColumnStatistics.Numeric stats = fitter.fitColumn(column);
    final boolean integral = isIntegral(column);
    return () -> {
      final double drawn = values.gaussian(stats.mean(), stats.stddev());
      return integral ? ofKind(column.kind(), Math.round(drawn)) : (Object) drawn;
    };
  }

  private Supplier<Object> perturbSampler(final DatasetColumn column) {
    final List<Object> pool = column.nonMissing();
    if (pool.isEmpty()) {
      throw new AugmentationException("Column '" + column.name() + "' has no values to perturb");
    }
    final boolean integral = isIntegral(column);
    return () -> {
      final Number base = (Number) values.pickRandom(pool);
      if (integral) {
        return ofKind(column.kind(), base.longValue() + values.jitter(config.integerJitter()));
      }
      return base.doubleValue() + values.gaussian(0.0, 1.0);
    };
  }

  private Supplier<Object> novelSampler(final DatasetColumn column) {
    final List<Object> pool = new ArrayList<>(distinctPool(column));
    return () -> {
      if (values.chance(config.novelLabelProbability())) {
        final String label = novelLabel(pool);
        if (label != null) {
          pool.add(label);
          return label;
        }
      }
      return values.pickRandom(pool);
    };
  }

  private String novelLabel(final List<Object> pool) {
    for (int attempt = 0; attempt < NOVEL_LABEL_ATTEMPTS; attempt++) {
      final String word = capitalize(Capability.WORD.draw(provider));
      if (!word.isEmpty() && !pool.contains(word)) {
        return word;
      }
    }
    return null;
  }

  private List<Object> distinctPool(final DatasetColumn column) {
    final List<Object> pool = fitter.distinct(column).values();
    if (pool.isEmpty()) {
      throw new AugmentationException("Column '" + column.name() + "' has no values to sample");
    }
    return pool;
  }

  private List<Object> newIdentifiers(final DatasetColumn column, final int count) {
    if (!column.kind().isNumeric()) {
      throw new AugmentationException(
          "Identifier column '" + column.name() + "' must hold integers, not " + column.kind());
    }
    final Set<Long> existing = new HashSet<>();
    for (final Object value : column.nonMissing()) {
      final double asDouble = ((Number) value).doubleValue();
      if (asDouble != Math.rint(asDouble)) {
        throw new AugmentationException(
            "Identifier column '" + column.name() + "' holds a non-integer value: " + value);
      }
      existing.add(((Number) value).longValue());
    }
    final List<Long> allocated;
    try {
      allocated = identifiers.allocate(count, existing);
    } catch (final ArithmeticException e) {
      throw new AugmentationException(
          "Identifier column '" + column.name() + "' has no room for " + count + " new values", e);
    }
    return allocated.stream().map(id -> ofKind(column.kind(), id)).toList();
  }

  private Dataset recomputeEmails(
      final Dataset dataset, final String nameColumn, final Set<String> emailColumns) {
    final List<String> names =
        dataset.column(nameColumn).values().stream()
            .map(v -> v == null ? null : v.toString())
            .toList();
    final List<String> emails = resolver.deriveEmail(names);
    return new Dataset(
        dataset.columns().stream()
            .map(
                c ->
                    emailColumns.contains(c.name())
                        ? DatasetColumn.of(c.name(), ValueKind.STRING, emails)
                        : c)
            .toList());
  }

  private static boolean isIntegral(final DatasetColumn column) {
    return column.kind() == ValueKind.INTEGER
        || FORCED_INTEGRAL_COLUMN.equalsIgnoreCase(column.name());
  }

  private static Object ofKind(final ValueKind kind, final long value) {
    return kind == ValueKind.INTEGER ? (Object) value : (Object) (double) value;
  }

  private static String capitalize(final String word) {
    if (word == null || word.isBlank()) {
      return "";
    }
    final String trimmed = word.strip();
    return trimmed.substring(0, 1).toUpperCase(Locale.ROOT)
        + trimmed.substring(1).toLowerCase(Locale.ROOT);
  }
}
