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

import com.google.common.base.Preconditions;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Identifies one analyzer run: its kind, the input field it reduces, and for VOCABULARY the
 * filtering options. Two equal specs share one constant.
 *
 * @param kind reduction kind
 * @param field input field name
 * @param topK keep only the {@code topK} most frequent terms, 0 keeps all
 * @param frequencyThreshold drop terms seen fewer times than this
 */
public record AnalyzerSpec(AnalyzerKind kind, String field, int topK, long frequencyThreshold) {

  public AnalyzerSpec {
    Preconditions.checkNotNull(kind, "analyzer kind is required");
    Preconditions.checkArgument(StringUtils.isNotBlank(field), "analyzer field is required");
    Preconditions.checkArgument(topK >= 0, "topK must not be negative: %s", topK);
    Preconditions.checkArgument(
        frequencyThreshold >= 0, "frequencyThreshold must not be negative: %s", frequencyThreshold);
    Preconditions.checkArgument(
        kind == AnalyzerKind.VOCABULARY || (topK == 0 && frequencyThreshold == 0),
        "topK and frequencyThreshold only apply to VOCABULARY, not %s",
        kind);
  }

  public static AnalyzerSpec of(AnalyzerKind kind, String field) {
    return new AnalyzerSpec(kind, field, 0, 0);
  }

  public static AnalyzerSpec mean(String field) {
    return of(AnalyzerKind.MEAN, field);
  }

  public static AnalyzerSpec min(String field) {
    return of(AnalyzerKind.MIN, field);
  }

  public static AnalyzerSpec max(String field) {
    return of(AnalyzerKind.MAX, field);
  }

  public static AnalyzerSpec scale01(String field) {
    return of(AnalyzerKind.SCALE_0_1, field);
  }

  public static AnalyzerSpec variance(String field) {
    return of(AnalyzerKind.VARIANCE, field);
  }

  public static AnalyzerSpec vocabulary(String field) {
    return of(AnalyzerKind.VOCABULARY, field);
  }

  public static AnalyzerSpec vocabulary(String field, int topK, long frequencyThreshold) {
    return new AnalyzerSpec(AnalyzerKind.VOCABULARY, field, topK, frequencyThreshold);
  }

  @Override
  public String toString() {
    String name = kind.name().toLowerCase(Locale.ROOT);
    if (topK == 0 && frequencyThreshold == 0) {
      return name + "(" + field + ")";
    }
    return String.format(
        "%s(%s, top_k=%d, frequency_threshold=%d)", name, field, topK, frequencyThreshold);
  }
}
