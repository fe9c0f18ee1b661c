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
package io.fleak.featureflow.api.errors;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.schema.ValidationError;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class PreprocessingExceptionTest {

  @Test
  void message_namesPhaseAndField() {
    SchemaException e = new SchemaException("age", "value type is required");
    assertEquals("[SCHEMA] field 'age': value type is required", e.getMessage());
    assertEquals(
        "[METADATA] no output", new MetadataException(null, "no output").getMessage());
  }

  @Test
  void validationException_summarizesLongErrorLists() {
    List<ValidationError> errors =
        IntStream.range(0, 12)
            .mapToObj(i -> new ValidationError(i, "x", "missing required field"))
            .toList();
    ValidationException e = new ValidationException(errors);
    assertEquals(12, e.getErrors().size());
    assertEquals("x", e.getField());
    assertTrue(e.getMessage().startsWith("[VALIDATION] field 'x': 12 validation error(s): "));
    assertTrue(e.getMessage().endsWith("(and 2 more)"));
  }

  @Test
  void analyzerException_carriesKindAndSpec() {
    AnalyzerException e =
        new AnalyzerException(
            AnalyzerException.Kind.EMPTY_INPUT, AnalyzerSpec.mean("x"), "no values");
    assertEquals(AnalyzerException.Kind.EMPTY_INPUT, e.getKind());
    assertEquals(AnalyzerSpec.mean("x"), e.getAnalyzerSpec());
    assertEquals(Phase.ANALYZING, e.getPhase());
    assertEquals("x", e.getField());
  }

  @Test
  void transformException_atRecordKeepsReason() {
    TransformException e = new TransformException("y", "vector lengths differ");
    TransformException located = e.atRecord(7);
    assertEquals(7, located.getRecordIndex());
    assertEquals("y", located.getField());
    assertEquals("[TRANSFORMING] field 'y': record 7: vector lengths differ", located.getMessage());
  }
}
