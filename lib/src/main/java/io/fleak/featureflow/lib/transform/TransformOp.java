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
package io.fleak.featureflow.lib.transform;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;
import lombok.Getter;

/** Operations available to a declarative transform. */
@Getter
public enum TransformOp {
  /** Passes the input through. */
  IDENTITY(1, false),
  /** {@code x - mean(x)}. */
  CENTER(1, true),
  /** {@code (x - min) / (max - min)}, 0 when max == min. */
  SCALE_TO_0_1(1, true),
  /** 0-1 scaling stretched to [outputMin, outputMax]. */
  SCALE_BY_MIN_MAX(1, true),
  /** {@code (x - mean) / stddev}, 0 when the variance is 0. */
  SCALE_TO_Z_SCORE(1, true),
  /** Vocabulary index of the term, {@code -1} for out-of-vocabulary terms. */
  COMPUTE_AND_APPLY_VOCABULARY(1, true),
  ADD(2, false),
  MULTIPLY(2, false);

  private final int arity;

  /** Whether the op reads analyzer constants, which requires its input to be a raw field. */
  private final boolean analyzed;

  TransformOp(int arity, boolean analyzed) {
    this.arity = arity;
    this.analyzed = analyzed;
  }

  @JsonCreator
  public static TransformOp parse(String value) {
    return TransformOp.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
