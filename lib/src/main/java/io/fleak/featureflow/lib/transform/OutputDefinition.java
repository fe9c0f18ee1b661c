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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One output field of a declarative transform.
 *
 * <pre>{@code
 * - name: s_integerized
 *   op: compute_and_apply_vocabulary
 *   input: s
 *   topK: 1000
 * }</pre>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutputDefinition {
  private String name;
  private TransformOp op;

  @JsonAlias("input")
  @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
  private List<String> inputs;

  // vocabulary options
  private Integer topK;
  private Long frequencyThreshold;

  // SCALE_BY_MIN_MAX options
  private Double outputMin;
  private Double outputMax;

  OutputDefinition copy() {
    return toBuilder().inputs(inputs == null ? null : new ArrayList<>(inputs)).build();
  }

  double outputMinOrDefault() {
    return outputMin == null ? 0.0 : outputMin;
  }

  double outputMaxOrDefault() {
    return outputMax == null ? 1.0 : outputMax;
  }

  /** The analyzers this output reads, in the order they are used. */
  List<AnalyzerSpec> requiredAnalyzers() {
    String field = inputs.get(0);
    return switch (op) {
      case CENTER -> List.of(AnalyzerSpec.mean(field));
      case SCALE_TO_0_1, SCALE_BY_MIN_MAX -> List.of(AnalyzerSpec.scale01(field));
      case SCALE_TO_Z_SCORE -> List.of(AnalyzerSpec.mean(field), AnalyzerSpec.variance(field));
      case COMPUTE_AND_APPLY_VOCABULARY ->
          List.of(
              AnalyzerSpec.vocabulary(
                  field,
                  topK == null ? 0 : topK,
                  frequencyThreshold == null ? 0 : frequencyThreshold));
      case IDENTITY, ADD, MULTIPLY -> List.of();
    };
  }
}
