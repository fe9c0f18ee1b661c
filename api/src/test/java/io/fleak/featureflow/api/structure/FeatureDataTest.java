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
package io.fleak.featureflow.api.structure;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeatureDataTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Test
  void wrap_mapsJavaValuesToFeatureData() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("i", 3);
    raw.put("f", 1.5);
    raw.put("s", "hello");
    raw.put("v", List.of(1L, 2L));
    RecordFeatureData record = FeatureData.record(raw);

    assertEquals(NumberFeatureData.ofInt(3), record.get("i"));
    assertEquals(NumberFeatureData.ofFloat(1.5), record.get("f"));
    assertEquals(new StringFeatureData("hello"), record.get("s"));
    assertEquals(
        new ArrayFeatureData(List.of(NumberFeatureData.ofInt(1), NumberFeatureData.ofInt(2))),
        record.get("v"));
    assertEquals(List.of("i", "f", "s", "v"), List.copyOf(record.getPayload().keySet()));
  }

  @Test
  void numberFeatureData_foldsNegativeZero() {
    NumberFeatureData negativeZero = NumberFeatureData.ofFloat(-0.0);
    assertEquals(NumberFeatureData.ofFloat(0.0), negativeZero);
    assertEquals(0L, Double.doubleToRawLongBits(negativeZero.getNumberValue()));
  }

  @Test
  void unwrap_keepsIntAndFloatApart() {
    assertEquals(2L, NumberFeatureData.ofInt(2).unwrap());
    assertEquals(2.0, NumberFeatureData.ofFloat(2).unwrap());
  }

  @Test
  void largeIntegers_keepEveryBit() throws Exception {
    FeatureData data = MAPPER.readValue("{\"id\": 9007199254740993}", FeatureData.class);
    NumberFeatureData id = (NumberFeatureData) data.getPayload().get("id");

    assertEquals(9007199254740993L, id.getLongValue());
    assertEquals(9007199254740993L, id.unwrap());
    assertNotEquals(NumberFeatureData.ofInt(9007199254740992L), id);
    assertEquals("{\"id\":9007199254740993}", MAPPER.writeValueAsString(data));
  }

  @Test
  void serialize_writesPlainJson() throws Exception {
    RecordFeatureData record =
        FeatureData.record(Map.of("x", List.of(1.0, 2.5), "n", 4, "s", "a"));
    String json = MAPPER.writeValueAsString(record);
    assertEquals(record, MAPPER.readValue(json, FeatureData.class));
    assertTrue(json.contains("\"n\":4"));
    assertTrue(json.contains("[1.0,2.5]"));
  }

  @Test
  void deserialize_distinguishesIntFromFloat() throws Exception {
    FeatureData data = MAPPER.readValue("{\"a\": 1, \"b\": 1.0}", FeatureData.class);
    assertEquals(NumberFeatureData.NumberType.INT, data.getPayload().get("a").getNumberType());
    assertEquals(NumberFeatureData.NumberType.FLOAT, data.getPayload().get("b").getNumberType());
  }

  @Test
  void deserialize_rejectsBooleans() {
    assertThrows(Exception.class, () -> MAPPER.readValue("{\"a\": true}", FeatureData.class));
  }

  @Test
  void record_isReadOnlyAndOwnsItsPayload() {
    Map<String, FeatureData> source = new LinkedHashMap<>();
    source.put("a", NumberFeatureData.ofInt(1));
    RecordFeatureData record = new RecordFeatureData(source);
    source.put("b", NumberFeatureData.ofInt(2));

    assertFalse(record.has("b"));
    assertThrows(
        UnsupportedOperationException.class,
        () -> record.getPayload().put("b", NumberFeatureData.ofInt(2)));
    assertThrows(UnsupportedOperationException.class, () -> record.getPayload().remove("a"));
    assertEquals(record, record.copy());
  }

  @Test
  void nonRecordGetters_throw() {
    FeatureData s = new StringFeatureData("x");
    assertThrows(UnsupportedOperationException.class, s::getNumberValue);
    assertThrows(UnsupportedOperationException.class, s::getPayload);
  }
}
