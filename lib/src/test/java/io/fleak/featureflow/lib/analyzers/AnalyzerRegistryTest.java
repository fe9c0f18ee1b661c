/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.fleak.featureflow.lib.analyzers;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.featureflow.api.analyzer.AnalyzerKind;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.errors.AnalyzerException;
import io.fleak.featureflow.api.schema.FieldSpec;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.schema.ValueType;
import org.junit.jupiter.api.Test;

class AnalyzerRegistryTest {

  private static final Schema SCHEMA =
      Schema.of(
          FieldSpec.scalar("x", ValueType.FLOAT),
          FieldSpec.scalar("c", ValueType.INT),
          FieldSpec.scalar("s", ValueType.STRING));

  @Test
  void everyKindIsRegistered() {
    for (AnalyzerKind kind : AnalyzerKind.values()) {
      assertEquals(kind, AnalyzerRegistry.create(AnalyzerSpec.of(kind, "x")).spec().kind());
    }
  }

  @Test
  void check_acceptsSupportedTypes() {
    assertDoesNotThrow(() -> AnalyzerRegistry.check(AnalyzerSpec.mean("x"), SCHEMA));
    assertDoesNotThrow(() -> AnalyzerRegistry.check(AnalyzerSpec.max("c"), SCHEMA));
    assertDoesNotThrow(() -> AnalyzerRegistry.check(AnalyzerSpec.vocabulary("s"), SCHEMA));
    assertDoesNotThrow(() -> AnalyzerRegistry.check(AnalyzerSpec.vocabulary("c"), SCHEMA));
  }

  @Test
  void check_rejectsUnknownField() {
    AnalyzerException e =
        assertThrows(
            AnalyzerException.class,
            () -> AnalyzerRegistry.check(AnalyzerSpec.mean("missing"), SCHEMA));
    assertEquals(AnalyzerException.Kind.UNSUPPORTED_FIELD, e.getKind());
  }

  @Test
  void check_rejectsWrongType() {
    AnalyzerException numericOnString =
        assertThrows(
            AnalyzerException.class, () -> AnalyzerRegistry.check(AnalyzerSpec.mean("s"), SCHEMA));
    assertEquals(AnalyzerException.Kind.TYPE_MISMATCH, numericOnString.getKind());
    assertThrows(
        AnalyzerException.class,
        () -> AnalyzerRegistry.check(AnalyzerSpec.vocabulary("x"), SCHEMA));
  }
}
