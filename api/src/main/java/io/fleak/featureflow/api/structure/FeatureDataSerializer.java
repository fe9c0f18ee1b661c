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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/** Writes feature values as plain JSON: numbers, strings, arrays and objects. */
public class FeatureDataSerializer extends StdSerializer<FeatureData> {

  public FeatureDataSerializer() {
    this(null);
  }

  protected FeatureDataSerializer(Class<FeatureData> t) {
    super(t);
  }

  @Override
  public void serialize(FeatureData value, JsonGenerator gen, SerializerProvider provider)
      throws IOException {
    if (value == null) {
      gen.writeNull();
      return;
    }
    if (value instanceof NumberFeatureData n) {
      // keep FLOAT values distinguishable from INT values on the wire
      if (n.isIntegral()) {
        gen.writeNumber(n.getLongValue());
      } else {
        gen.writeNumber(n.getNumberValue());
      }
      return;
    }
    provider.defaultSerializeValue(value.unwrap(), gen);
  }
}
