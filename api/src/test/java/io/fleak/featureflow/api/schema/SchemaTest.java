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
package io.fleak.featureflow.api.schema;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleak.featureflow.api.errors.Phase;
import io.fleak.featureflow.api.errors.SchemaException;
import io.fleak.featureflow.api.structure.FeatureData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SchemaTest {

  private static final Schema SCHEMA =
      Schema.of(
          FieldSpec.scalar("x", ValueType.FLOAT),
          FieldSpec.scalar("n", ValueType.INT),
          FieldSpec.scalar("s", ValueType.STRING).optional(),
          FieldSpec.vector("v", ValueType.FLOAT, 2),
          FieldSpec.variableLength("tags", ValueType.STRING).optional());

  @Test
  void validate_conformingRecord() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("x", 1);
    raw.put("n", 2);
    raw.put("v", List.of(1.0, 2.0));
    raw.put("tags", List.of());
    raw.put("extra", "ignored");
    assertEquals(List.of(), SCHEMA.validate(FeatureData.record(raw)));
  }

  @Test
  void validate_collectsEveryViolation() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("n", 2.5);
    raw.put("s", 3);
    raw.put("v", List.of(1.0, 2.0, 3.0));
    raw.put("tags", "solo");
    List<ValidationError> errors = SCHEMA.validate(FeatureData.record(raw));

    assertEquals(
        List.of("x", "n", "s", "v", "tags"), errors.stream().map(ValidationError::field).toList());
    assertEquals("missing required field", errors.get(0).reason());
    assertEquals("expected INT but got FLOAT", errors.get(1).reason());
    assertEquals("expected 2 values but got 3", errors.get(3).reason());
  }

  @Test
  void validate_scalarFieldRejectsList() {
    List<ValidationError> errors =
        SCHEMA.validate(FeatureData.record(Map.of("x", List.of(1.0), "n", 1, "v", List.of(1, 2))));
    assertEquals(1, errors.size());
    assertEquals("x", errors.get(0).field());
  }

  @Test
  void validate_vectorElementTypes() {
    List<ValidationError> errors =
        SCHEMA.validate(FeatureData.record(Map.of("x", 1.0, "n", 1, "v", List.of(1, "two"))));
    assertEquals(1, errors.size());
    assertEquals("element 1: expected FLOAT but got STRING", errors.get(0).reason());
  }

  @Test
  void build_rejectsVectorWithoutLength() {
    FieldSpec bad =
        FieldSpec.builder().name("v").valueType(ValueType.FLOAT).arity(Arity.FIXED_VECTOR).build();
    SchemaException e = assertThrows(SchemaException.class, () -> Schema.of(bad));
    assertEquals("v", e.getField());
    assertEquals(Phase.SCHEMA, e.getPhase());
  }

  @Test
  void build_rejectsLengthOnScalar() {
    FieldSpec bad = FieldSpec.builder().name("x").valueType(ValueType.FLOAT).length(3).build();
    assertThrows(SchemaException.class, () -> Schema.of(bad));
  }

  @Test
  void build_rejectsEmptyAndDuplicates() {
    assertThrows(SchemaException.class, () -> Schema.build(Map.of()));
    assertThrows(
        SchemaException.class,
        () ->
            Schema.of(FieldSpec.scalar("a", ValueType.INT), FieldSpec.scalar("a", ValueType.INT)));
  }

  @Test
  void build_rejectsMissingType() {
    FieldSpec bad = FieldSpec.builder().name("x").build();
    assertThrows(SchemaException.class, () -> Schema.of(bad));
  }

  @Test
  void json_mapFormTakesNamesFromKeys() throws Exception {
    String json =
        "{\"age\": {\"valueType\": \"int\"},"
            + " \"emb\": {\"valueType\": \"FLOAT\", \"arity\": \"fixed_vector\", \"length\": 3},"
            + " \"raw\": {\"valueType\": \"bytes\", \"required\": false}}";
    ObjectMapper mapper = new ObjectMapper();
    Schema schema = mapper.readValue(json, Schema.class);

    assertEquals(FieldSpec.scalar("age", ValueType.INT), schema.field("age").orElseThrow());
    assertEquals(FieldSpec.vector("emb", ValueType.FLOAT, 3), schema.field("emb").orElseThrow());
    assertEquals(
        FieldSpec.scalar("raw", ValueType.STRING).optional(), schema.field("raw").orElseThrow());

    Schema reread = mapper.readValue(mapper.writeValueAsString(schema), Schema.class);
    assertTrue(schema.isCompatibleWith(reread));
  }
}
