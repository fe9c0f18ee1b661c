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
package io.fleak.featureflow.lib.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads configuration, schema and transform definitions. YAML is a superset of JSON. */
public interface YamlUtils {
  ObjectMapper OBJECT_MAPPER = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

  static <T> T fromYamlResource(String resourcePath, TypeReference<T> typeReference)
      throws IOException {
    try (InputStream in = YamlUtils.class.getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new IOException("Resource not found: " + resourcePath);
      }
      return OBJECT_MAPPER.readValue(in, typeReference);
    }
  }

  static <T> T fromYamlFile(Path path, TypeReference<T> typeReference) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return OBJECT_MAPPER.readValue(in, typeReference);
    }
  }

  static <T> T fromYamlString(String str, TypeReference<T> typeReference) {
    try {
      return OBJECT_MAPPER.readValue(str, typeReference);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  static <T> T convert(Object raw, Class<T> clz) {
    return OBJECT_MAPPER.convertValue(raw, clz);
  }
}
