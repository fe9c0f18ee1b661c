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

import static io.fleak.featureflow.lib.utils.JsonUtils.OBJECT_MAPPER;

import com.fasterxml.jackson.core.type.TypeReference;
import io.fleak.featureflow.lib.utils.YamlUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/** Turns raw YAML/JSON configuration into a {@link TransformDefinition}. */
public class TransformConfigParser {

  public TransformDefinition parseConfig(Map<String, Object> config) {
    try {
      return OBJECT_MAPPER.convertValue(config, TransformDefinition.class);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("failed to parse transform definition: " + config, e);
    }
  }

  public TransformDefinition parseFile(Path path) throws IOException {
    Map<String, Object> raw = YamlUtils.fromYamlFile(path, new TypeReference<>() {});
    return parseConfig(raw);
  }

  public TransformDefinition parseString(String yaml) {
    Map<String, Object> raw = YamlUtils.fromYamlString(yaml, new TypeReference<>() {});
    return parseConfig(raw);
  }
}
