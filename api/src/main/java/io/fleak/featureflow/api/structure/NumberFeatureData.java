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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A numeric scalar. INT values keep their exact {@code long} alongside the double view used for
 * arithmetic, so 64-bit identifiers survive categorical lookups and serialization. Negative zero is
 * stored as positive zero so that equal transforms produce bit-identical output.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonSerialize(using = FeatureDataSerializer.class)
@JsonDeserialize(using = FeatureDataDeserializer.class)
public class NumberFeatureData implements FeatureData {

  private final double numberValue;
  private final long longValue;
  private final NumberType numberType;

  private NumberFeatureData(double numberValue, long longValue, @NonNull NumberType numberType) {
    // -0.0 == 0.0, so this folds both zeros into +0.0
    this.numberValue = numberValue == 0.0 ? 0.0 : numberValue;
    this.longValue = longValue;
    this.numberType = numberType;
  }

  public static NumberFeatureData ofInt(long value) {
    return new NumberFeatureData(value, value, NumberType.INT);
  }

  public static NumberFeatureData ofFloat(double value) {
    return new NumberFeatureData(value, 0L, NumberType.FLOAT);
  }

  public boolean isIntegral() {
    return numberType == NumberType.INT;
  }

  @Override
  @JsonValue
  public Number unwrap() {
    if (numberType == NumberType.INT) {
      return longValue;
    }
    return numberValue;
  }

  public enum NumberType {
    INT,
    FLOAT
  }
}
