/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.synthseed.engine;

import static com.luisppb16.synthseed.schema.SchemaDsl.*;
import static org.assertj.core.api.Assertions.*;

import com.luisppb16.synthseed.augment.AugmentationStrategy;
import com.luisppb16.synthseed.config.GenerationConfig;
import com.luisppb16.synthseed.error.PromptSyntaxException;
import com.luisppb16.synthseed.error.SchemaException;
import com.luisppb16.synthseed.model.Dataset;
import com.luisppb16.synthseed.model.Schema;
import com.luisppb16.synthseed.model.ValueKind;
import com.luisppb16.synthseed.provider.StubValueProvider;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GenerationEngineTest {

  private static final GenerationConfig SEEDED =
      GenerationConfig.defaults().toBuilder().seed(7L).build();

  private static Schema people() {
    return schema(
        identifier("pid"),
        text("name", 10),
        text("email", 10),
        integer("age", 20, 50),
        text("city", 6),
        text("mobile", 6),
        category("gender", "M", "F"),
        date("doj", "2020-01-01", "2023-12-31"));
  }

  @Test
  void generatesEveryColumnInSchemaOrder() {
    Dataset ds = new GenerationEngine(SEEDED, new StubValueProvider()).generate(people(), 6);

    assertThat(ds.rowCount()).isEqualTo(6);
    assertThat(ds.columnNames())
        .containsExactly("pid", "name", "email", "age", "city", "mobile", "gender", "doj");
    assertThat(ds.column("pid").values())
        .containsExactly(10_000L, 10_001L, 10_002L, 10_003L, 10_004L, 10_005L);
    assertThat(ds.column("age").values()).allSatisfy(v -> assertThat((Long) v).isBetween(20L, 50L));
    assertThat(ds.column("gender").values()).containsOnly("M", "F");
    assertThat(ds.column("doj").kind()).isEqualTo(ValueKind.DATE);
  }

  @Test
  void semanticColumnsUseTheProvider() {
    Dataset ds = new GenerationEngine(SEEDED, new StubValueProvider()).generate(people(), 4);

    assertThat(ds.column("name").values()).containsExactlyElementsOf(StubValueProvider.NAMES);
    assertThat(ds.column("city").values()).containsOnly(StubValueProvider.CITY);
    assertThat(ds.column("mobile").values()).containsOnly(StubValueProvider.PHONE);
  }

  @Test
  void emailsAreDerivedFromNames() {
    Dataset ds = new GenerationEngine(SEEDED, new StubValueProvider()).generate(people(), 4);

    assertThat(ds.column("email").values())
        .containsExactly(
            "asha.rao@example.com",
            "vikram.oneilshah@example.com",
            "meera.iyer@example.com",
            "john.smith@example.com");
  }

  @Test
  void emailsComeFromProviderWithoutNameColumn() {
    Dataset ds =
        new GenerationEngine(SEEDED, new StubValueProvider())
            .generate(schema(integer("contact_email", 1, 5), integer("score", 1, 5)), 3);

    assertThat(ds.column("contact_email").kind()).isEqualTo(ValueKind.STRING);
    assertThat(ds.column("contact_email").values())
        .containsExactly("stub1@mail.test", "stub2@mail.test", "stub3@mail.test");
  }

  @Test
  void sameSeedSameDataset() {
    Dataset first = new GenerationEngine(SEEDED, new StubValueProvider()).generate(people(), 50);
    Dataset second = new GenerationEngine(SEEDED, new StubValueProvider()).generate(people(), 50);
    assertThat(first).isEqualTo(second);
  }

  @Test
  void parallelColumnsKeepShapeAndRanges() {
    GenerationConfig parallel = SEEDED.toBuilder().parallelColumns(true).build();
    Dataset ds = new GenerationEngine(parallel, new StubValueProvider()).generate(people(), 200);

    assertThat(ds.rowCount()).isEqualTo(200);
    assertThat(ds.column("pid").values()).doesNotHaveDuplicates();
    assertThat(ds.column("age").values()).allSatisfy(v -> assertThat((Long) v).isBetween(20L, 50L));
    for (int i = 0; i < ds.rowCount(); i++) {
      assertThat((String) ds.column("email").get(i)).endsWith("@example.com");
    }
  }

  @Test
  void rowCountOutsideLimitsRejected() {
    GenerationEngine engine =
        new GenerationEngine(SEEDED.toBuilder().maxRowCount(10).build(), new StubValueProvider());

    assertThatThrownBy(() -> engine.generate(people(), 0)).isInstanceOf(SchemaException.class);
    assertThatThrownBy(() -> engine.generate(people(), 11))
        .isInstanceOf(SchemaException.class)
        .hasMessageContaining("10");
  }

  @Test
  void generatesFromPrompt() {
    Dataset ds =
        new GenerationEngine(SEEDED, new StubValueProvider())
            .generateFromPrompt("3 rows, columns: age int 20-50, gender category M/F");

    assertThat(ds.rowCount()).isEqualTo(3);
    assertThat(ds.columnNames()).containsExactly("age", "gender");
    assertThat(ds.column("gender").values()).containsOnly("M", "F");
  }

  @Test
  void malformedPromptPropagates() {
    GenerationEngine engine = new GenerationEngine(SEEDED, new StubValueProvider());
    assertThatThrownBy(() -> engine.generateFromPrompt("3 rows, columns: age int"))
        .isInstanceOf(PromptSyntaxException.class);
  }

  @Test
  void augmentsGeneratedDataset() {
    GenerationEngine engine = new GenerationEngine(SEEDED, new StubValueProvider());
    Dataset ds = engine.generate(people(), 5);

    Dataset grown =
        engine.augment(ds, 5, Map.of("gender", AugmentationStrategy.EXISTING_ONLY));

    assertThat(grown.rowCount()).isEqualTo(10);
    assertThat(grown.column("pid").values().subList(5, 10))
        .containsExactly(10_005L, 10_006L, 10_007L, 10_008L, 10_009L);
    assertThat(grown.column("gender").values()).containsOnly("M", "F");
    assertThat(grown.column("doj").values().subList(0, 5))
        .isEqualTo(ds.column("doj").values());
  }

  @Test
  void widestDecimalRangeGenerates() {
    Dataset ds =
        new GenerationEngine(SEEDED, new StubValueProvider())
            .generate(schema(decimal("x", -Double.MAX_VALUE, Double.MAX_VALUE)), 3);

    assertThat(ds.column("x").values())
        .allSatisfy(v -> assertThat(Double.isFinite((Double) v)).isTrue());
  }

  @Test
  void providerOnlyEngineReadsConfiguredProperties() {
    System.setProperty("synthseed.identifier.base", "777");
    try {
      GenerationEngine engine = new GenerationEngine(new StubValueProvider());

      assertThat(engine.getConfig().identifierBase()).isEqualTo(777L);
      assertThat(engine.getConfig().emailDomain()).isEqualTo("example.com");
      assertThat(engine.generate(schema(identifier("pid")), 2).column("pid").values())
          .containsExactly(777L, 778L);
    } finally {
      System.clearProperty("synthseed.identifier.base");
    }
  }

}
