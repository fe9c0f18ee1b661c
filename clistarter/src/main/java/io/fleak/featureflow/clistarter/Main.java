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
package io.fleak.featureflow.clistarter;

import com.fasterxml.jackson.core.type.TypeReference;
import io.fleak.featureflow.api.errors.PreprocessingException;
import io.fleak.featureflow.api.metric.MetricClientProvider;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.lib.artifact.FrozenArtifact;
import io.fleak.featureflow.lib.artifact.FrozenArtifactCodec;
import io.fleak.featureflow.lib.artifact.TransformFunctionResolver;
import io.fleak.featureflow.lib.transform.DeclarativeTransformFunction;
import io.fleak.featureflow.lib.transform.TransformConfigParser;
import io.fleak.featureflow.lib.utils.JsonUtils;
import io.fleak.featureflow.lib.utils.YamlUtils;
import io.fleak.featureflow.runner.PipelineConfig;
import io.fleak.featureflow.runner.PipelineResult;
import io.fleak.featureflow.runner.PreprocessingPipeline;
import io.fleak.featureflow.runner.ServingTransformer;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

@Slf4j
public class Main {
  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_FAILED = 2;

  public static void main(String[] args) {
    int exitCode = execute(args);
    if (exitCode != EXIT_OK) {
      System.exit(exitCode);
    }
  }

  static int execute(String[] args) {
    CliCommand command;
    try {
      command = FeatureflowCliParser.parseArgs(args);
    } catch (ParseException e) {
      System.err.println(e.getMessage());
      FeatureflowCliParser.printUsage("featureflow");
      return EXIT_USAGE;
    }
    try (MetricClientProvider metricClientProvider =
        new MetricClientProvider.NoopMetricClientProvider()) {
      if (command instanceof CliCommand.Analyze analyze) {
        analyze(analyze, metricClientProvider);
      } else if (command instanceof CliCommand.Apply apply) {
        apply(apply, metricClientProvider);
      }
      return EXIT_OK;
    } catch (PreprocessingException e) {
      log.error("{} failed: {}", command.getClass().getSimpleName(), e.getMessage());
      return EXIT_FAILED;
    } catch (Exception e) {
      log.error("{} failed", command.getClass().getSimpleName(), e);
      return EXIT_FAILED;
    }
  }

  static void analyze(CliCommand.Analyze command, MetricClientProvider metricClientProvider)
      throws IOException {
    Schema schema = YamlUtils.fromYamlFile(command.schemaFile(), new TypeReference<>() {});
    DeclarativeTransformFunction transform =
        new DeclarativeTransformFunction(
            new TransformConfigParser().parseFile(command.transformFile()));
    PipelineConfig config =
        command.configFile() == null
            ? PipelineConfig.defaults()
            : PipelineConfig.load(command.configFile());
    List<RecordFeatureData> batch = JsonUtils.readJsonLines(command.inputFile());
    log.info("read {} records from {}", batch.size(), command.inputFile());

    PreprocessingPipeline pipeline =
        new PreprocessingPipeline(schema, transform, config, metricClientProvider);
    PipelineResult result = pipeline.run(batch);
    new FrozenArtifactCodec().write(result.artifact(), command.artifactFile());
    if (!result.skipped().isEmpty()) {
      log.warn("{} validation errors in skipped records", result.skipped().size());
    }
    if (command.outputFile() != null) {
      try (Writer writer = Files.newBufferedWriter(command.outputFile(), StandardCharsets.UTF_8)) {
        JsonUtils.writeJsonLines(result.outputs(), writer);
      }
      log.info("wrote {} transformed records to {}", result.records().size(), command.outputFile());
    }
  }

  static void apply(CliCommand.Apply command, MetricClientProvider metricClientProvider)
      throws IOException {
    FrozenArtifact artifact = new FrozenArtifactCodec().read(command.artifactFile());
    ServingTransformer serving =
        ServingTransformer.load(artifact, new TransformFunctionResolver(), metricClientProvider);
    List<RecordFeatureData> records = JsonUtils.readJsonLines(command.inputFile());
    List<RecordFeatureData> outputs = new ArrayList<>(records.size());
    for (RecordFeatureData record : records) {
      outputs.add(serving.applySingle(record));
    }
    Path outputFile = command.outputFile();
    if (outputFile == null) {
      Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
      JsonUtils.writeJsonLines(outputs, stdout);
      stdout.flush();
      return;
    }
    try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
      JsonUtils.writeJsonLines(outputs, writer);
    }
    log.info("wrote {} records to {}", outputs.size(), outputFile);
  }
}
