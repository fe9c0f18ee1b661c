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
package io.fleak.featureflow.lib.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.schema.Schema;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Everything needed to apply a trained transform to new records: the schemas on both sides, the
 * finalized analyzer constants and a reference to the transform function.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FrozenArtifact {
  public static final int CURRENT_FORMAT_VERSION = 1;

  @Builder.Default int formatVersion = CURRENT_FORMAT_VERSION;
  String pipelineId;
  @NonNull Schema inputSchema;
  @NonNull Schema outputSchema;
  @NonNull ConstantsTable constants;
  @NonNull TransformReference transform;
  @Builder.Default Instant createdAt = Instant.now();
}
