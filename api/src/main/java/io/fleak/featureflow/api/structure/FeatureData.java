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
import java.util.*;
import java.util.stream.Collectors;

/**
 * A typed feature value. Records are maps from field name to FeatureData, vector valued fields are
 * {@link ArrayFeatureData} and scalars are either {@link NumberFeatureData} or {@link
 * StringFeatureData}.
 */
@JsonSerialize(using = FeatureDataSerializer.class)
@JsonDeserialize(using = FeatureDataDeserializer.class)
public interface FeatureData {

  default Map<String, FeatureData> getPayload() {
    throw new UnsupportedOperationException("trying to get payload from a non-record value");
  }

  default String getStringValue() {
    throw new UnsupportedOperationException("trying to get string value from a non-string value");
  }

  default double getNumberValue() {
    throw new UnsupportedOperationException("trying to get number value from a non-number value");
  }

  default NumberFeatureData.NumberType getNumberType() {
    throw new UnsupportedOperationException("trying to get number type from a non-number value");
  }

  default List<FeatureData> getArrayPayload() {
    throw new UnsupportedOperationException("trying to get array payload from a non-array value");
  }

  /** Returns the wrapped java value. Also used for JSON serialization. */
  @JsonValue
  Object unwrap();

  static FeatureData wrap(Object obj) {
    if (obj == null) {
      return null;
    }

    if (obj instanceof FeatureData) {
      return (FeatureData) obj;
    }

    if (obj instanceof Map<?, ?> map) {
      var retMap = new LinkedHashMap<String, FeatureData>();
      for (var entry : map.entrySet()) {
        retMap.put(entry.getKey().toString(), wrap(entry.getValue()));
      }
      return new RecordFeatureData(retMap);
    }

    if (obj instanceof Collection<?> l) {
      return new ArrayFeatureData(
          l.stream().map(FeatureData::wrap).collect(Collectors.<FeatureData>toList()));
    }

    if (obj instanceof double[] arr) {
      return new ArrayFeatureData(
          Arrays.stream(arr).mapToObj(NumberFeatureData::ofFloat).collect(Collectors.toList()));
    }

    if (obj instanceof long[] arr) {
      return new ArrayFeatureData(
          Arrays.stream(arr).mapToObj(NumberFeatureData::ofInt).collect(Collectors.toList()));
    }

    if (obj instanceof Integer || obj instanceof Long || obj instanceof Short) {
      return NumberFeatureData.ofInt(((Number) obj).longValue());
    }

    if (obj instanceof Number n) {
      return NumberFeatureData.ofFloat(n.doubleValue());
    }

    return new StringFeatureData(obj.toString());
  }

  static RecordFeatureData record(Map<String, ?> fields) {
    return (RecordFeatureData) wrap(fields);
  }
}
