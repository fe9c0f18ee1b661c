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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A transform function written as data. Outputs are evaluated in order and may reference raw input
 * fields or outputs declared before them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransformDefinition {
  private String name;
  @Builder.Default private List<OutputDefinition> outputs = new ArrayList<>();

  /** Returns a deep copy that shares no mutable state with this definition. */
  public TransformDefinition copy() {
    return toBuilder()
        .outputs(
            outputs == null
                ? null
                : outputs.stream()
                    .map(o -> o == null ? null : o.copy())
                    .collect(Collectors.toCollection(ArrayList::new)))
        .build();
  }
}
