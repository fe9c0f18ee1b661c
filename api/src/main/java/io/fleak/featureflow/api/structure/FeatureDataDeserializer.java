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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads feature values from JSON. Integral literals become INT numbers, literals with a fraction
 * or exponent become FLOAT numbers.
 */
public class FeatureDataDeserializer extends StdDeserializer<FeatureData> {

  public FeatureDataDeserializer() {
    this(null);
  }

  protected FeatureDataDeserializer(Class<?> vc) {
    super(vc);
  }

  @Override
  public FeatureData deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    return deserializeToken(p, p.currentToken());
  }

  private FeatureData deserializeToken(JsonParser p, JsonToken token) throws IOException {
    if (token == null) {
      token = p.nextToken();
    }

    if (token == null || token == JsonToken.VALUE_NULL) {
      return null;
    }
    return switch (token) {
      case VALUE_STRING -> new StringFeatureData(p.getText());
      case VALUE_NUMBER_INT -> NumberFeatureData.ofInt(p.getLongValue());
      case VALUE_NUMBER_FLOAT -> NumberFeatureData.ofFloat(p.getDoubleValue());
      case START_OBJECT -> deserializeObject(p);
      case START_ARRAY -> deserializeArray(p);
      default -> throw new IOException("Unsupported JSON token for a feature value: " + token);
    };
  }

  private RecordFeatureData deserializeObject(JsonParser p) throws IOException {
    Map<String, FeatureData> payload = new LinkedHashMap<>();
    JsonToken token = p.nextToken();
    while (token != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IOException("Expected field name, found: " + token);
      }
      String fieldName = p.currentName();
      token = p.nextToken();
      payload.put(fieldName, deserializeToken(p, token));
      token = p.nextToken();
    }
    return new RecordFeatureData(payload);
  }

  private ArrayFeatureData deserializeArray(JsonParser p) throws IOException {
    List<FeatureData> items = new ArrayList<>();
    JsonToken token = p.nextToken();
    while (token != JsonToken.END_ARRAY) {
      items.add(deserializeToken(p, token));
      token = p.nextToken();
    }
    return new ArrayFeatureData(items);
  }
}
