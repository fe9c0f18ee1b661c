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

import static io.fleak.featureflow.lib.utils.JsonUtils.OBJECT_MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.fleak.featureflow.api.errors.Phase;
import io.fleak.featureflow.api.errors.PreprocessingException;
import io.fleak.featureflow.lib.utils.JsonUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** JSON form of {@link FrozenArtifact}. */
@Slf4j
public class FrozenArtifactCodec {

  public String toJson(FrozenArtifact artifact) {
    return JsonUtils.toPrettyJsonString(artifact);
  }

  /**
   * @throws PreprocessingException if the document was written by an unsupported format version
   * @throws IllegalArgumentException if the document is not a valid artifact
   */
  public FrozenArtifact fromJson(String json) {
    JsonNode tree;
    try {
      tree = OBJECT_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("artifact is not valid JSON", e);
    }
    JsonNode version = tree.get("formatVersion");
    if (version == null || !version.canConvertToInt()) {
      throw new IllegalArgumentException("artifact has no formatVersion");
    }
    if (version.intValue() != FrozenArtifact.CURRENT_FORMAT_VERSION) {
      throw new PreprocessingException(
          Phase.SERVING,
          null,
          String.format(
              "unsupported artifact format version %d, expected %d",
              version.intValue(), FrozenArtifact.CURRENT_FORMAT_VERSION));
    }
    try {
      return OBJECT_MAPPER.treeToValue(tree, FrozenArtifact.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("failed to read artifact: " + e.getOriginalMessage(), e);
    }
  }

  public void write(FrozenArtifact artifact, Path path) throws IOException {
    Files.writeString(path, toJson(artifact), StandardCharsets.UTF_8);
    log.info(
        "wrote artifact for transform {} with {} constants to {}",
        artifact.getTransform().transformName(),
        artifact.getConstants().size(),
        path);
  }

  public FrozenArtifact read(Path path) throws IOException {
    FrozenArtifact artifact = fromJson(Files.readString(path, StandardCharsets.UTF_8));
    log.debug("read artifact {} from {}", artifact.getTransform().transformName(), path);
    return artifact;
  }
}
