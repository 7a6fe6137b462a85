/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.generator;

import static org.assertj.core.api.Assertions.*;

import com.luisppb16.synthseed.model.ColumnSpec;
import com.luisppb16.synthseed.provider.StubValueProvider;
import com.luisppb16.synthseed.schema.SchemaDsl;
import java.time.LocalDate;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ColumnGeneratorsTest {

  private GeneratorContext context;

  @BeforeEach
  void setUp() {
    context =
        new GeneratorContext(
            new ValueGenerator(new Random(3)),
            new StubValueProvider(),
            new IdentifierAllocator(10_000L),
            SemanticRules.DEFAULT);
  }

  @Test
  void integerColumn() {
    List<Object> values = ColumnGenerators.generate(SchemaDsl.integer("age", 20, 50), 100, context);
    assertThat(values).hasSize(100).allSatisfy(v -> assertThat((Long) v).isBetween(20L, 50L));
  }

  @Test
  void decimalColumn() {
    List<Object> values =
        ColumnGenerators.generate(SchemaDsl.decimal("salary", 1000, 5000), 50, context);
    assertThat(values).hasSize(50).allSatisfy(v -> assertThat((Double) v).isBetween(1000.0, 5000.0));
  }

  @Test
  void categoryColumn() {
    List<Object> values =
        ColumnGenerators.generate(SchemaDsl.category("gender", "M", "F"), 200, context);
    assertThat(values).hasSize(200).containsOnly("M", "F").contains("M", "F");
  }

  @Test
  void textColumn_randomWhenNameCarriesNoHint() {
    List<Object> values = ColumnGenerators.generate(SchemaDsl.text("code", 6), 10, context);
    assertThat(values).allSatisfy(v -> assertThat((String) v).matches("[A-Za-z0-9]{6}"));
  }

  @Test
  void textColumn_nameHintIgnoresLength() {
    assertThat(ColumnGenerators.generate(SchemaDsl.text("full_name", 2), 2, context))
        .containsExactly("Asha Rao", "Vikram O'Neil-Shah");
    assertThat(ColumnGenerators.generate(SchemaDsl.text("city", 2), 3, context))
        .containsOnly(StubValueProvider.CITY);
    assertThat(ColumnGenerators.generate(SchemaDsl.text("mobile", 2), 3, context))
        .containsOnly(StubValueProvider.PHONE);
  }

  @Test
  void dateColumn() {
    LocalDate start = LocalDate.of(2020, 1, 1);
    LocalDate end = LocalDate.of(2023, 12, 31);
    List<Object> values = ColumnGenerators.generate(SchemaDsl.date("doj", start, end), 50, context);
    assertThat(values).allSatisfy(v -> assertThat((LocalDate) v).isBetween(start, end));
  }

  @Test
  void identifierColumn() {
    assertThat(ColumnGenerators.generate(new ColumnSpec.Identifier("pid"), 3, context))
        .containsExactly(10_000L, 10_001L, 10_002L);
  }
}
