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

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Data;

/**
 * One record of a batch: field name to value. Field order is kept so transformed records come out
 * in the order their outputs were declared. JSON serialization outputs just the payload map.
 *
 * <p>Records are read-only once built: {@link #getPayload()} is an unmodifiable view.
 */
@Data
@JsonSerialize(using = FeatureDataSerializer.class)
@JsonDeserialize(using = FeatureDataDeserializer.class)
public class RecordFeatureData implements FeatureData {

  private final Map<String, FeatureData> payload;

  public RecordFeatureData() {
    payload = new LinkedHashMap<>();
  }

  public RecordFeatureData(Map<String, FeatureData> payload) {
    this.payload = new LinkedHashMap<>(payload);
  }

  @Override
  public Map<String, FeatureData> getPayload() {
    return Collections.unmodifiableMap(payload);
  }

  /** Returns the value of a field, or null when the field is absent. */
  public FeatureData get(String field) {
    return payload.get(field);
  }

  public boolean has(String field) {
    return payload.get(field) != null;
  }

  public RecordFeatureData copy() {
    return new RecordFeatureData(Optional.ofNullable(payload).orElse(Map.of()));
  }

  @Override
  @JsonValue
  public Map<String, Object> unwrap() {
    var m = new LinkedHashMap<String, Object>();
    for (var entry : payload.entrySet()) {
      var v = entry.getValue();
      m.put(entry.getKey(), (v == null) ? null : v.unwrap());
    }
    return m;
  }
}
