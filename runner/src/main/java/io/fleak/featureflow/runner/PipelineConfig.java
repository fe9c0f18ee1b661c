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
package io.fleak.featureflow.runner;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import io.fleak.featureflow.lib.utils.MiscUtils;
import io.fleak.featureflow.lib.utils.YamlUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Run options of a {@link PreprocessingPipeline}. */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {

  public enum ValidationMode {
    /** Any invalid record aborts the run. */
    STRICT,
    /** Invalid records are left out and reported in the result. */
    LENIENT;

    @JsonCreator
    public static ValidationMode parse(String value) {
      return MiscUtils.parseEnum(ValidationMode.class, value);
    }
  }

  @Builder.Default String pipelineId = MiscUtils.generateRandomHash();
  @Builder.Default ValidationMode validationMode = ValidationMode.STRICT;
  @Builder.Default int analyzeParallelism = 1;
  @Builder.Default int transformParallelism = 1;

  /** Level for the {@code io.fleak.featureflow} loggers, unchanged when null. */
  String logLevel;

  @Builder.Default Map<String, String> metricTags = Map.of();

  public static PipelineConfig defaults() {
    return PipelineConfig.builder().build();
  }

  public static PipelineConfig load(Path path) throws IOException {
    Map<String, Object> raw = YamlUtils.fromYamlFile(path, new TypeReference<>() {});
    return YamlUtils.convert(raw, PipelineConfig.class);
  }
}
