/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.engine;

import com.luisppb16.synthseed.augment.AugmentationPlanner;
import com.luisppb16.synthseed.augment.AugmentationStrategy;
import com.luisppb16.synthseed.augment.DistributionFitter;
import com.luisppb16.synthseed.config.GenerationConfig;
import com.luisppb16.synthseed.config.GenerationConfigLoader;
import com.luisppb16.synthseed.error.SchemaException;
import com.luisppb16.synthseed.generator.ColumnGenerators;
import com.luisppb16.synthseed.generator.DerivedFieldResolver;
import com.luisppb16.synthseed.generator.GeneratorContext;
import com.luisppb16.synthseed.generator.IdentifierAllocator;
import com.luisppb16.synthseed.generator.SemanticRules;
import com.luisppb16.synthseed.generator.ValueGenerator;
import com.luisppb16.synthseed.model.ColumnRoles;
import com.luisppb16.synthseed.model.ColumnSpec;
import com.luisppb16.synthseed.model.Dataset;
import com.luisppb16.synthseed.model.DatasetColumn;
import com.luisppb16.synthseed.model.Schema;
import com.luisppb16.synthseed.model.ValueKind;
import com.luisppb16.synthseed.prompt.ParsedPrompt;
import com.luisppb16.synthseed.prompt.PromptParser;
import com.luisppb16.synthseed.provider.RealisticValueProvider;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the synthetic data engine: schema or prompt in, dataset out, plus augmentation
 * of existing datasets.
 *
 * <p>The engine owns one random source, shared by every column generator and by the augmentation
 * planner, so a seeded {@link GenerationConfig} together with a seeded {@link
 * RealisticValueProvider} reproduces the same dataset run after run. The provider is supplied by
 * the caller and never constructed here, which lets tests plug in a deterministic stub.
 *
 * <p>Generation runs in two passes:
 *
 * <ul>
 *   <li>Columns with no cross-column dependency are generated first, optionally one worker per
 *       column when {@code parallelColumns} is set.
 *   <li>Identifier columns and email columns follow, since they depend on the identifiers already
 *       in use and on the final name column respectively. Without a name column, emails come
 *       straight from the provider.
 * </ul>
 *
 * <p>The output keeps the schema's column order. The engine never writes to the console or
 * prompts; failures surface as {@link com.luisppb16.synthseed.error.SynthSeedException}
 * subclasses.
 *
 * @author Luis Pepe
 * @version 1.0
 * @since 2026
 */
@Slf4j
public final class GenerationEngine {

  @Getter private final GenerationConfig config;
  private final RealisticValueProvider provider;
  private final GeneratorContext context;
  private final DerivedFieldResolver resolver;
  private final AugmentationPlanner planner;
  private final PromptParser parser;

  /**
   * Engine configured from {@code /synthseed.properties}, overridden by {@code synthseed.*}
   * system properties.
   */
  public GenerationEngine(final RealisticValueProvider provider) {
    this(GenerationConfigLoader.load(), provider);
  }

  public GenerationEngine(final GenerationConfig config, final RealisticValueProvider provider) {
    this(config, provider, config.newRandom());
  }

  public GenerationEngine(
      final GenerationConfig config,
      final RealisticValueProvider provider,
      final Random random) {
    this.config = Objects.requireNonNull(config, "Config cannot be null");
    this.provider = Objects.requireNonNull(provider, "Value provider cannot be null");
    final ValueGenerator values = new ValueGenerator(random);
    final IdentifierAllocator identifiers = new IdentifierAllocator(config.identifierBase());
    this.context = new GeneratorContext(values, provider, identifiers, SemanticRules.DEFAULT);
    this.resolver = new DerivedFieldResolver(config.emailDomain());
    this.planner =
        new AugmentationPlanner(
            values, provider, identifiers, resolver, new DistributionFitter(), config);
    this.parser = new PromptParser(config.defaultStringLength());
  }

  public Dataset generate(final Schema schema, final int rowCount) {
    Objects.requireNonNull(schema, "Schema cannot be null");
    if (rowCount < 1 || rowCount > config.maxRowCount()) {
      throw new SchemaException(
          "Row count must be between 1 and %d, was %d".formatted(config.maxRowCount(), rowCount));
    }

    final Instant start = Instant.now();
    final List<String> names = schema.columnNames();
    final List<String> emailOrder = ColumnRoles.emailColumns(names);
    final Set<String> emailColumns = Set.copyOf(emailOrder);
    final Optional<String> nameSource = ColumnRoles.nameSource(names);

    final List<ColumnSpec> independent =
        schema.columns().stream()
            .filter(c -> !(c instanceof ColumnSpec.Identifier))
            .filter(c -> !emailColumns.contains(c.name()))
            .toList();
    final Stream<ColumnSpec> firstPass =
        config.parallelColumns() ? independent.parallelStream() : independent.stream();
    final Map<String, List<Object>> data =
        new HashMap<>(
            firstPass.collect(
                Collectors.toMap(
                    ColumnSpec::name, c -> ColumnGenerators.generate(c, rowCount, context))));

    schema.columns().stream()
        .filter(c -> c instanceof ColumnSpec.Identifier)
        .filter(c -> !emailColumns.contains(c.name()))
        .forEach(c -> data.put(c.name(), ColumnGenerators.generate(c, rowCount, context)));

    emailOrder.forEach(
        email -> data.put(email, emailValues(nameSource.map(data::get), rowCount)));

    final List<DatasetColumn> columns = new ArrayList<>(names.size());
    for (final ColumnSpec spec : schema.columns()) {
      final ValueKind kind =
          emailColumns.contains(spec.name()) ? ValueKind.STRING : spec.type().getValueKind();
      columns.add(new DatasetColumn(spec.name(), kind, data.get(spec.name())));
    }

    log.debug(
        "Generated {} rows x {} columns in {} ms",
        rowCount,
        columns.size(),
        Duration.between(start, Instant.now()).toMillis());
    return new Dataset(columns);
  }

  public ParsedPrompt parsePrompt(final String prompt) {
    return parser.parse(prompt);
  }

  public Dataset generateFromPrompt(final String prompt) {
    final ParsedPrompt parsed = parsePrompt(prompt);
    return generate(parsed.schema(), parsed.rowCount());
  }

  public Dataset augment(final Dataset dataset, final int additionalRows) {
    return augment(dataset, additionalRows, Map.of());
  }

  public Dataset augment(
      final Dataset dataset,
      final int additionalRows,
      final Map<String, AugmentationStrategy> strategies) {
    return planner.augment(dataset, additionalRows, strategies);
  }

  private List<Object> emailValues(final Optional<List<Object>> names, final int rowCount) {
    if (names.isEmpty()) {
      final List<Object> emails = new ArrayList<>(rowCount);
      for (int i = 0; i < rowCount; i++) {
        emails.add(provider.email());
      }
      return emails;
    }
    final List<String> asText =
        names.get().stream().map(v -> v == null ? null : v.toString()).toList();
    return new ArrayList<>(resolver.deriveEmail(asText));
  }
}
