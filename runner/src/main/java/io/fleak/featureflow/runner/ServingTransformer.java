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

import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.errors.Phase;
import io.fleak.featureflow.api.errors.PreprocessingException;
import io.fleak.featureflow.api.errors.ValidationException;
import io.fleak.featureflow.api.metric.MetricClientProvider;
import io.fleak.featureflow.api.schema.ValidationError;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.transform.TransformFunction;
import io.fleak.featureflow.lib.artifact.FrozenArtifact;
import io.fleak.featureflow.lib.artifact.TransformFunctionResolver;
import io.fleak.featureflow.lib.utils.MiscUtils;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a frozen transform to single records. Holds only immutable state, so one instance can be
 * shared between threads.
 */
@Slf4j
public class ServingTransformer {

  @Getter private final FrozenArtifact artifact;
  private final TransformFunction function;
  private final PipelineCounters counters;

  ServingTransformer(
      FrozenArtifact artifact, TransformFunction function, PipelineCounters counters) {
    this.artifact = artifact;
    this.function = function;
    this.counters = counters;
  }

  public static ServingTransformer load(FrozenArtifact artifact) {
    return load(
        artifact,
        new TransformFunctionResolver(),
        new MetricClientProvider.NoopMetricClientProvider());
  }

  /**
   * Resolves the artifact's transform function and checks that every analyzer it reads has a
   * constant.
   */
  public static ServingTransformer load(
      FrozenArtifact artifact,
      TransformFunctionResolver resolver,
      MetricClientProvider metricClientProvider) {
    TransformFunction function;
    try {
      function = resolver.resolve(artifact.getTransform());
    } catch (IllegalArgumentException e) {
      throw new PreprocessingException(Phase.SERVING, null, e.getMessage(), e);
    }
    Set<AnalyzerSpec> missing =
        function.analyzers().stream()
            .filter(spec -> !artifact.getConstants().specs().contains(spec))
            .collect(Collectors.toSet());
    if (!missing.isEmpty()) {
      throw new PreprocessingException(
          Phase.SERVING,
          null,
          String.format(
              "artifact has no constants for %s required by transform %s",
              missing, function.name()));
    }
    PipelineCounters counters =
        PipelineCounters.createPipelineCounters(
            metricClientProvider,
            MiscUtils.basicPipelineMetricTags(null, artifact.getPipelineId(), function.name()));
    log.info(
        "loaded transform {} with {} constants", function.name(), artifact.getConstants().size());
    return new ServingTransformer(artifact, function, counters);
  }

  /**
   * Validates {@code record} against the input schema and applies the transform with the frozen
   * constants.
   *
   * @throws ValidationException if the record does not conform to the input schema
   * @throws io.fleak.featureflow.api.errors.TransformException if the transform fails
   */
  public RecordFeatureData applySingle(RecordFeatureData record) {
    List<ValidationError> errors = artifact.getInputSchema().validate(record);
    if (!errors.isEmpty()) {
      counters.increaseServingErrorCounter();
      throw new ValidationException(errors);
    }
    try {
      RecordFeatureData output =
          ParallelTransformExecutor.applyOne(function, artifact.getConstants(), record, -1);
      counters.increaseServedRecordCounter();
      return output;
    } catch (RuntimeException e) {
      counters.increaseServingErrorCounter();
      throw e;
    }
  }

  public String transformName() {
    return function.name();
  }
}
