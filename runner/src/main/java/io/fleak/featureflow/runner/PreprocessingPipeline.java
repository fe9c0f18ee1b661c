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

import static io.fleak.featureflow.lib.utils.MiscUtils.basicPipelineMetricTags;

import com.google.common.annotations.VisibleForTesting;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.errors.Phase;
import io.fleak.featureflow.api.errors.PipelineStateException;
import io.fleak.featureflow.api.errors.PreprocessingException;
import io.fleak.featureflow.api.errors.ValidationException;
import io.fleak.featureflow.api.metric.MetricClientProvider;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.schema.ValidationError;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.transform.TransformFunction;
import io.fleak.featureflow.lib.analyzers.AnalyzerRegistry;
import io.fleak.featureflow.lib.artifact.FrozenArtifact;
import io.fleak.featureflow.lib.artifact.TransformReference;
import io.fleak.featureflow.lib.metadata.OutputSchemaDeriver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.MDC;

/**
 * Runs a transform function over a batch in two phases and freezes the result.
 *
 * <ol>
 *   <li>INIT: every record is validated against the input schema.
 *   <li>ANALYZING: every analyzer the transform declares is folded over the whole batch.
 *   <li>TRANSFORMING: the transform is applied to each record with the finalized constants.
 *   <li>FROZEN: the output schema is derived and the artifact is packaged. From here on {@link
 *       #applySingle} serves single records with the same constants.
 * </ol>
 *
 * <p>A pipeline runs once. Any failure leaves it FAILED; {@link #reset()} returns a FROZEN pipeline
 * to INIT.
 */
@Slf4j
public class PreprocessingPipeline {

  static final String LOGGER_NAME = "io.fleak.featureflow";
  static final String MDC_PIPELINE_ID = "pipelineId";

  @Getter private final Schema inputSchema;
  @Getter private final TransformFunction transformFunction;
  @Getter private final PipelineConfig config;
  private final PipelineCounters counters;
  private final OutputSchemaDeriver outputSchemaDeriver = new OutputSchemaDeriver();

  @Getter private volatile PipelineState state = PipelineState.INIT;
  private volatile ServingTransformer serving;

  public PreprocessingPipeline(Schema inputSchema, TransformFunction transformFunction) {
    this(
        inputSchema,
        transformFunction,
        PipelineConfig.defaults(),
        new MetricClientProvider.NoopMetricClientProvider());
  }

  public PreprocessingPipeline(
      @NonNull Schema inputSchema,
      @NonNull TransformFunction transformFunction,
      @NonNull PipelineConfig config,
      @NonNull MetricClientProvider metricClientProvider) {
    this.inputSchema = inputSchema;
    this.transformFunction = transformFunction;
    this.config = config;
    Map<String, String> metricTags =
        basicPipelineMetricTags(
            config.getMetricTags(), config.getPipelineId(), transformFunction.name());
    this.counters = PipelineCounters.createPipelineCounters(metricClientProvider, metricTags);
    applyLogLevel(config);
  }

  /**
   * Validates, analyzes and transforms {@code batch}, then freezes the pipeline.
   *
   * @throws ValidationException in STRICT mode when any record is invalid
   * @throws PipelineStateException if the pipeline already ran or failed
   * @throws PreprocessingException for any other failure; the pipeline is FAILED afterwards
   */
  public synchronized PipelineResult run(@NonNull List<RecordFeatureData> batch) {
    checkCanRun();
    MDC.put(MDC_PIPELINE_ID, config.getPipelineId());
    try {
      PipelineResult result = doRun(batch);
      state = PipelineState.FROZEN;
      log.info(
          "pipeline frozen: {} records transformed, {} skipped",
          result.records().size(),
          result.skipped().size());
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      PipelineState interruptedIn = state;
      state = PipelineState.FAILED;
      throw new PreprocessingException(
          interruptedIn == PipelineState.TRANSFORMING ? Phase.TRANSFORMING : Phase.ANALYZING,
          null,
          "interrupted while " + interruptedIn,
          e);
    } catch (RuntimeException e) {
      log.error("pipeline failed in state {}: {}", state, e.getMessage());
      state = PipelineState.FAILED;
      throw e;
    } finally {
      MDC.remove(MDC_PIPELINE_ID);
    }
  }

  private PipelineResult doRun(List<RecordFeatureData> batch) throws InterruptedException {
    counters.increaseInputRecordCounter(batch.size());

    // INIT
    List<ValidationError> skipped = new ArrayList<>();
    List<RecordFeatureData> accepted = new ArrayList<>(batch.size());
    List<Integer> acceptedIndexes = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      List<ValidationError> errors = inputSchema.validate(batch.get(i));
      if (errors.isEmpty()) {
        accepted.add(batch.get(i));
        acceptedIndexes.add(i);
      } else {
        int index = i;
        errors.forEach(e -> skipped.add(e.atRecord(index)));
      }
    }
    if (!skipped.isEmpty()) {
      counters.increaseInvalidRecordCounter(batch.size() - accepted.size());
      if (config.getValidationMode() == PipelineConfig.ValidationMode.STRICT) {
        throw new ValidationException(skipped);
      }
      log.warn(
          "skipping {} invalid records: {}",
          batch.size() - accepted.size(),
          new ValidationException(skipped).getMessage());
    }
    for (AnalyzerSpec spec : transformFunction.analyzers()) {
      AnalyzerRegistry.check(spec, inputSchema);
    }
    Optional<Schema> declaredOutput = transformFunction.declareOutputSchema(inputSchema);

    // ANALYZING
    state = PipelineState.ANALYZING;
    log.debug("analyzing {} records with {}", accepted.size(), transformFunction.analyzers());
    counters.analyzeStopWatch().start();
    ConstantsTable constants;
    try (ShardedAnalyzeExecutor analyzeExecutor =
        new ShardedAnalyzeExecutor(config.getAnalyzeParallelism())) {
      constants = analyzeExecutor.analyze(transformFunction.analyzers(), accepted);
    }
    counters.analyzeStopWatch().stop(Map.of());
    counters.increaseAnalyzedRecordCounter(accepted.size());

    // TRANSFORMING
    state = PipelineState.TRANSFORMING;
    counters.transformStopWatch().start();
    List<TransformedRecord> transformed;
    try (ParallelTransformExecutor transformExecutor =
        new ParallelTransformExecutor(config.getTransformParallelism())) {
      transformed =
          transformExecutor.transform(transformFunction, constants, accepted, acceptedIndexes);
    }
    counters.transformStopWatch().stop(Map.of());
    counters.increaseTransformedRecordCounter(transformed.size());

    // FROZEN
    Schema outputSchema =
        outputSchemaDeriver.derive(
            declaredOutput, transformed.stream().map(TransformedRecord::output).toList());
    FrozenArtifact artifact =
        FrozenArtifact.builder()
            .pipelineId(config.getPipelineId())
            .inputSchema(inputSchema)
            .outputSchema(outputSchema)
            .constants(constants)
            .transform(TransformReference.of(transformFunction))
            .build();
    serving = new ServingTransformer(artifact, transformFunction, counters);
    return new PipelineResult(artifact, transformed, List.copyOf(skipped));
  }

  private void checkCanRun() {
    switch (state) {
      case FROZEN -> throw new PipelineStateException(
          PipelineStateException.Kind.ALREADY_FROZEN,
          "pipeline is frozen, reset() it before running another batch");
      case FAILED -> throw new PipelineStateException(
          PipelineStateException.Kind.FAILED, "pipeline failed in an earlier run");
      default -> {}
    }
  }

  /**
   * Transforms one record with the frozen constants. Never re-runs analysis.
   *
   * @throws PipelineStateException NOT_FROZEN before a successful {@link #run}, FAILED after a
   *     failed one
   */
  public RecordFeatureData applySingle(@NonNull RecordFeatureData record) {
    ServingTransformer current = serving;
    PipelineState currentState = state;
    if (currentState == PipelineState.FAILED) {
      throw new PipelineStateException(
          PipelineStateException.Kind.FAILED, "pipeline failed in an earlier run");
    }
    if (currentState != PipelineState.FROZEN || current == null) {
      throw new PipelineStateException(
          PipelineStateException.Kind.NOT_FROZEN,
          "applySingle requires a FROZEN pipeline but it is " + currentState);
    }
    return current.applySingle(record);
  }

  /** The frozen artifact. */
  public FrozenArtifact getArtifact() {
    ServingTransformer current = serving;
    if (state != PipelineState.FROZEN || current == null) {
      throw new PipelineStateException(
          PipelineStateException.Kind.NOT_FROZEN, "no artifact before the pipeline is frozen");
    }
    return current.getArtifact();
  }

  /** Drops the frozen state so the pipeline can run another batch. */
  public synchronized void reset() {
    if (state == PipelineState.FAILED) {
      throw new PipelineStateException(
          PipelineStateException.Kind.FAILED, "a failed pipeline cannot be reset");
    }
    if (state != PipelineState.FROZEN) {
      throw new PipelineStateException(
          PipelineStateException.Kind.NOT_FROZEN, "only a FROZEN pipeline can be reset");
    }
    serving = null;
    state = PipelineState.INIT;
    log.debug("pipeline {} reset", config.getPipelineId());
  }

  @VisibleForTesting
  static void applyLogLevel(PipelineConfig config) {
    if (config == null || StringUtils.isBlank(config.getLogLevel())) {
      return;
    }
    Level level = Level.toLevel(config.getLogLevel().trim(), null);
    if (level == null) {
      log.warn("ignoring unknown log level: {}", config.getLogLevel());
      return;
    }
    Configurator.setLevel(LOGGER_NAME, level);
  }
}
