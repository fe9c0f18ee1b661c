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
package io.fleak.featureflow.lib.metadata;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.featureflow.api.errors.MetadataException;
import io.fleak.featureflow.api.schema.FieldSpec;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.schema.ValueType;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OutputSchemaDeriverTest {

  private final OutputSchemaDeriver deriver = new OutputSchemaDeriver();

  private static RecordFeatureData record(Map<String, ?> fields) {
    return FeatureData.record(fields);
  }

  @Test
  void infer_scalarsAndVectors() {
    List<RecordFeatureData> outputs =
        List.of(
            record(Map.of("x_centered", -1.0, "s_id", 0, "v", List.of(1.0, 2.0), "name", "a")),
            record(Map.of("x_centered", 1.0, "s_id", 1, "v", List.of(3.0, 4.0), "name", "b")));

    Schema schema = deriver.derive(Optional.empty(), outputs);

    assertEquals(
        Schema.of(
            FieldSpec.scalar("x_centered", ValueType.FLOAT),
            FieldSpec.scalar("s_id", ValueType.INT),
            FieldSpec.vector("v", ValueType.FLOAT, 2),
            FieldSpec.scalar("name", ValueType.STRING)),
        schema);
  }

  @Test
  void infer_fieldMissingFromSomeRecordsIsOptional() {
    Schema schema =
        deriver.derive(
            Optional.empty(),
            List.of(record(Map.of("a", 1.0, "b", "x")), record(Map.of("a", 2.0))));

    assertTrue(schema.field("a").orElseThrow().isRequired());
    assertEquals(FieldSpec.scalar("b", ValueType.STRING).optional(), schema.field("b").get());
  }

  @Test
  void infer_inconsistentTypes() {
    List<RecordFeatureData> outputs = List.of(record(Map.of("a", 1)), record(Map.of("a", 1.5)));
    MetadataException e =
        assertThrows(MetadataException.class, () -> deriver.derive(Optional.empty(), outputs));
    assertEquals("a", e.getField());
  }

  @Test
  void infer_differentVectorLengthsGiveVariableLength() {
    List<RecordFeatureData> outputs =
        List.of(record(Map.of("v", List.of(1.0))), record(Map.of("v", List.of(1.0, 2.0))));
    assertEquals(
        Schema.of(FieldSpec.variableLength("v", ValueType.FLOAT)),
        deriver.derive(Optional.empty(), outputs));
  }

  @Test
  void infer_emptyListAmongOthersGivesVariableLength() {
    List<RecordFeatureData> outputs =
        List.of(
            record(Map.of("tags", List.of())),
            record(Map.of("tags", List.of("a", "b"))),
            record(Map.of("tags", List.of("c", "d"))));
    assertEquals(
        Schema.of(FieldSpec.variableLength("tags", ValueType.STRING)),
        deriver.derive(Optional.empty(), outputs));
  }

  @Test
  void infer_listAndScalarDisagree() {
    List<RecordFeatureData> outputs =
        List.of(record(Map.of("v", List.of(1))), record(Map.of("v", 1)));
    MetadataException e =
        assertThrows(MetadataException.class, () -> deriver.derive(Optional.empty(), outputs));
    assertEquals("v", e.getField());
  }

  @Test
  void infer_onlyEmptyListsHaveNoElementType() {
    List<RecordFeatureData> outputs =
        List.of(record(Map.of("v", List.of())), record(Map.of("v", List.of())));
    assertThrows(MetadataException.class, () -> deriver.derive(Optional.empty(), outputs));
  }

  @Test
  void infer_mixedElementTypes() {
    List<RecordFeatureData> outputs = List.of(record(Map.of("v", List.of(1, "a"))));
    assertThrows(MetadataException.class, () -> deriver.derive(Optional.empty(), outputs));
  }

  @Test
  void infer_nestedRecordIsNotAFeature() {
    List<RecordFeatureData> outputs = List.of(record(Map.of("r", Map.of("k", 1))));
    assertThrows(MetadataException.class, () -> deriver.derive(Optional.empty(), outputs));
  }

  @Test
  void infer_emptyBatch() {
    assertThrows(MetadataException.class, () -> deriver.derive(Optional.empty(), List.of()));
  }

  @Test
  void infer_noFields() {
    assertThrows(
        MetadataException.class,
        () -> deriver.derive(Optional.empty(), List.of(new RecordFeatureData())));
  }

  @Test
  void check_declaredSchemaIsReturned() {
    Schema declared =
        Schema.of(
            FieldSpec.scalar("a", ValueType.FLOAT),
            FieldSpec.scalar("b", ValueType.INT).optional());
    Schema schema =
        deriver.derive(Optional.of(declared), List.of(record(Map.of("a", 1.0)), record(Map.of())));
    assertSame(declared, schema);
  }

  @Test
  void check_emptyBatchKeepsDeclaredSchema() {
    Schema declared = Schema.of(FieldSpec.scalar("a", ValueType.FLOAT));
    assertSame(declared, deriver.derive(Optional.of(declared), List.of()));
  }

  @Test
  void check_undeclaredField() {
    Schema declared = Schema.of(FieldSpec.scalar("a", ValueType.FLOAT));
    MetadataException e =
        assertThrows(
            MetadataException.class,
            () ->
                deriver.derive(
                    Optional.of(declared), List.of(record(Map.of("a", 1.0, "extra", 2.0)))));
    assertEquals("extra", e.getField());
  }

  @Test
  void check_valueDisagreesWithDeclaration() {
    Schema declared = Schema.of(FieldSpec.scalar("a", ValueType.INT));
    MetadataException e =
        assertThrows(
            MetadataException.class,
            () -> deriver.derive(Optional.of(declared), List.of(record(Map.of("a", "text")))));
    assertEquals("a", e.getField());
  }
}
