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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Data;

/**
 * Vector value of a FIXED_VECTOR or VARIABLE_LENGTH field. JSON serialization outputs just the
 * element list.
 */
@Data
@JsonSerialize(using = FeatureDataSerializer.class)
@JsonDeserialize(using = FeatureDataDeserializer.class)
public class ArrayFeatureData implements FeatureData {
  private final List<FeatureData> arrayPayload;

  public ArrayFeatureData() {
    this(List.of());
  }

  public ArrayFeatureData(List<FeatureData> arrayPayload) {
    this.arrayPayload = Collections.unmodifiableList(new ArrayList<>(arrayPayload));
  }

  public int size() {
    return arrayPayload.size();
  }

  @Override
  @JsonValue
  public List<?> unwrap() {
    return arrayPayload.stream()
        .map(d -> d == null ? null : d.unwrap())
        .collect(Collectors.toList());
  }
}
