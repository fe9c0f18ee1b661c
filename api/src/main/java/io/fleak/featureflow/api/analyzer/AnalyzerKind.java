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
package io.fleak.featureflow.api.analyzer;

/**
 * The closed set of full-pass reductions. Each kind produces exactly one constant per analyzed
 * field.
 */
public enum AnalyzerKind {
  /** Arithmetic mean, a scalar. */
  MEAN,
  /** Smallest value, a scalar. */
  MIN,
  /** Largest value, a scalar. */
  MAX,
  /** The (min, max) pair used by 0-1 and min-max scaling. */
  SCALE_0_1,
  /** Population variance, a scalar. */
  VARIANCE,
  /** Frequency ordered term list. */
  VOCABULARY;

  public boolean isNumeric() {
    return this != VOCABULARY;
  }
}
