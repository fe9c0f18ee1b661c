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

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.errors.Phase;
import io.fleak.featureflow.api.errors.PreprocessingException;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.transform.TransformFunction;
import io.fleak.featureflow.lib.analyzers.AnalyzePass;
import io.fleak.featureflow.lib.transform.DeclarativeTransformFunction;
import io.fleak.featureflow.lib.transform.TransformConfigParser;
import io.fleak.featureflow.lib.utils.JsonUtils;
import io.fleak.featureflow.lib.utils.MiscUtils;
import io.fleak.featureflow.lib.utils.YamlUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FrozenArtifactCodecTest {

  private static final List<RecordFeatureData> BATCH =
      List.of(
          FeatureData.record(
              Map.of("age", 25, "income", 30000.0, "hours", 40.0, "occupation", "clerk")),
          FeatureData.record(
              Map.of("age", 40, "income", 82000.5, "hours", 50.0, "occupation", "engineer")),
          FeatureData.record(
              Map.of("age", 61, "income", 51000.0, "hours", 20.0, "occupation", "clerk")));

  private final FrozenArtifactCodec codec = new FrozenArtifactCodec();

  private DeclarativeTransformFunction function;
  private FrozenArtifact artifact;

  @BeforeEach
  void setUp() {
    Schema inputSchema =
        YamlUtils.fromYamlString(
            MiscUtils.loadStringFromResource("/transform/census_schema.yml"),
            new TypeReference<>() {});
    function =
        new DeclarativeTransformFunction(
            new TransformConfigParser()
                .parseString(MiscUtils.loadStringFromResource("/transform/census_transform.yml")));
    ConstantsTable constants = AnalyzePass.analyze(function.analyzers(), BATCH);
    artifact =
        FrozenArtifact.builder()
            .pipelineId("p1")
            .inputSchema(inputSchema)
            .outputSchema(function.declareOutputSchema(inputSchema).orElseThrow())
            .constants(constants)
            .transform(TransformReference.of(function))
            .build();
  }

  @Test
  void fromJson_restoresEqualArtifact() {
    FrozenArtifact restored = codec.fromJson(codec.toJson(artifact));
    assertEquals(artifact, restored);
  }

  @Test
  void restoredArtifactTransformsLikeTheOriginal() {
    FrozenArtifact restored = codec.fromJson(codec.toJson(artifact));
    TransformFunction resolved =
        new TransformFunctionResolver(Map.of()).resolve(restored.getTransform());

    RecordFeatureData unseen =
        FeatureData.record(
            Map.of("age", 33, "income", 1.0e5, "hours", 35.0, "occupation", "pilot"));
    assertEquals(
        function.apply(unseen, artifact.getConstants()),
        resolved.apply(unseen, restored.getConstants()));
  }

  @Test
  void fromJson_unsupportedFormatVersion() {
    ObjectNode tree = JsonUtils.OBJECT_MAPPER.valueToTree(artifact);
    tree.put("formatVersion", FrozenArtifact.CURRENT_FORMAT_VERSION + 1);

    PreprocessingException e =
        assertThrows(PreprocessingException.class, () -> codec.fromJson(tree.toString()));
    assertEquals(Phase.SERVING, e.getPhase());
  }

  @Test
  void fromJson_missingFormatVersion() {
    ObjectNode tree = JsonUtils.OBJECT_MAPPER.valueToTree(artifact);
    tree.remove("formatVersion");
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson(tree.toString()));
  }

  @Test
  void fromJson_notJson() {
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson("not json {"));
  }

  @Test
  void fromJson_missingConstants() {
    ObjectNode tree = JsonUtils.OBJECT_MAPPER.valueToTree(artifact);
    tree.remove("constants");
    assertThrows(IllegalArgumentException.class, () -> codec.fromJson(tree.toString()));
  }

  @Test
  void writeThenRead(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("artifact.json");
    codec.write(artifact, file);

    assertTrue(Files.readString(file).contains("\"kind\" : \"declarative\""));
    assertEquals(artifact, codec.read(file));
  }
}
