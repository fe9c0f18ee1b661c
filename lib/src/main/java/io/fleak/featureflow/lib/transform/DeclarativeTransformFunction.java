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

import com.google.common.base.Preconditions;
import io.fleak.featureflow.api.analyzer.AnalyzerConstant;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.errors.TransformException;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.structure.ArrayFeatureData;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.NumberFeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.transform.TransformFunction;
import io.fleak.featureflow.lib.utils.FeatureValues;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A {@link TransformFunction} built from a {@link TransformDefinition}. Outputs are evaluated in
 * declaration order; an input name resolves to an earlier output first and to a raw field
 * otherwise. An output whose input is absent is left out of the result record.
 *
 * <p>The definition is copied on the way in and on the way out, so later changes to the caller's
 * object never reach a built function or the artifact frozen from it.
 */
public class DeclarativeTransformFunction implements TransformFunction {

  private static final TransformConfigValidator VALIDATOR = new TransformConfigValidator();

  private final TransformDefinition definition;
  private final Set<AnalyzerSpec> analyzers;

  public DeclarativeTransformFunction(TransformDefinition definition) {
    Preconditions.checkNotNull(definition, "transform definition is required");
    this.definition = definition.copy();
    VALIDATOR.validateStructure(this.definition);
    Set<AnalyzerSpec> specs = new LinkedHashSet<>();
    this.definition.getOutputs().forEach(o -> specs.addAll(o.requiredAnalyzers()));
    this.analyzers = Collections.unmodifiableSet(specs);
  }

  public TransformDefinition getDefinition() {
    return definition.copy();
  }

  @Override
  public String name() {
    return definition.getName();
  }

  @Override
  public Set<AnalyzerSpec> analyzers() {
    return analyzers;
  }

  @Override
  public Optional<Schema> declareOutputSchema(Schema inputSchema) {
    return Optional.of(VALIDATOR.validateConfig(definition, inputSchema));
  }

  @Override
  public RecordFeatureData apply(RecordFeatureData record, ConstantsTable constants) {
    Map<String, FeatureData> outputs = new LinkedHashMap<>();
    for (OutputDefinition output : definition.getOutputs()) {
      FeatureData value;
      try {
        value = evaluate(output, record, outputs, constants);
      } catch (IllegalArgumentException | UnsupportedOperationException e) {
        throw new TransformException(
            -1,
            output.getName(),
            String.format("%s failed: %s", output.getOp(), e.getMessage()),
            e);
      }
      if (value != null) {
        outputs.put(output.getName(), value);
      }
    }
    return new RecordFeatureData(outputs);
  }

  private static FeatureData evaluate(
      OutputDefinition output,
      RecordFeatureData record,
      Map<String, FeatureData> earlier,
      ConstantsTable constants) {
    List<String> inputs = output.getInputs();
    if (output.getOp().isAnalyzed()) {
      // analyzed ops always read the raw field the analyzers saw
      FeatureData raw = record.get(inputs.get(0));
      return raw == null ? null : applyAnalyzed(output, raw, constants);
    }
    FeatureData first = lookup(inputs.get(0), record, earlier);
    if (first == null) {
      return null;
    }
    return switch (output.getOp()) {
      case IDENTITY -> first;
      case ADD, MULTIPLY -> {
        FeatureData second = lookup(inputs.get(1), record, earlier);
        if (second == null) {
          yield null;
        }
        yield output.getOp() == TransformOp.ADD
            ? FeatureValues.combine(first, second, Double::sum)
            : FeatureValues.combine(first, second, (a, b) -> a * b);
      }
      default -> throw new IllegalStateException("unexpected op: " + output.getOp());
    };
  }

  private static FeatureData lookup(
      String name, RecordFeatureData record, Map<String, FeatureData> earlier) {
    if (earlier.containsKey(name)) {
      return earlier.get(name);
    }
    return record.get(name);
  }

  private static FeatureData applyAnalyzed(
      OutputDefinition output, FeatureData value, ConstantsTable constants) {
    List<AnalyzerSpec> specs = output.requiredAnalyzers();
    switch (output.getOp()) {
      case CENTER:
        {
          double mean = constants.scalar(specs.get(0));
          return FeatureValues.mapNumbers(value, v -> v - mean);
        }
      case SCALE_TO_0_1:
        {
          AnalyzerConstant.RangeConstant range = constants.range(specs.get(0));
          return FeatureValues.mapNumbers(value, range::scale01);
        }
      case SCALE_BY_MIN_MAX:
        {
          AnalyzerConstant.RangeConstant range = constants.range(specs.get(0));
          double low = output.outputMinOrDefault();
          double span = output.outputMaxOrDefault() - low;
          return FeatureValues.mapNumbers(value, v -> low + range.scale01(v) * span);
        }
      case SCALE_TO_Z_SCORE:
        {
          double mean = constants.scalar(specs.get(0));
          double stddev = Math.sqrt(constants.scalar(specs.get(1)));
          return FeatureValues.mapNumbers(value, v -> stddev == 0 ? 0.0 : (v - mean) / stddev);
        }
      case COMPUTE_AND_APPLY_VOCABULARY:
        {
          AnalyzerConstant.VocabularyConstant vocabulary = constants.vocabulary(specs.get(0));
          if (value instanceof ArrayFeatureData array) {
            return new ArrayFeatureData(
                array.getArrayPayload().stream()
                    .map(e -> lookupIndex(vocabulary, e))
                    .collect(Collectors.toList()));
          }
          return lookupIndex(vocabulary, value);
        }
      default:
        throw new IllegalStateException("unexpected op: " + output.getOp());
    }
  }

  private static FeatureData lookupIndex(
      AnalyzerConstant.VocabularyConstant vocabulary, FeatureData term) {
    return NumberFeatureData.ofInt(vocabulary.indexOf(FeatureValues.toTerm(term)));
  }
}
