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
import io.fleak.featureflow.api.errors.SchemaException;
import io.fleak.featureflow.api.schema.Arity;
import io.fleak.featureflow.api.schema.FieldSpec;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.schema.ValueType;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Checks a {@link TransformDefinition}.
 *
 * <p>{@link #validateStructure} needs only the definition. {@link #validateConfig} also resolves
 * every input against the input schema and propagates types and shapes, which yields the output
 * schema.
 */
public class TransformConfigValidator {

  /**
   * @throws IllegalArgumentException on a malformed definition
   */
  public void validateStructure(TransformDefinition definition) {
    Preconditions.checkNotNull(definition, "transform definition is required");
    Preconditions.checkArgument(
        StringUtils.isNotBlank(definition.getName()), "transform name is required");
    Preconditions.checkArgument(
        CollectionUtils.isNotEmpty(definition.getOutputs()),
        "transform %s declares no outputs",
        definition.getName());
    Set<String> seen = new HashSet<>();
    for (OutputDefinition output : definition.getOutputs()) {
      Preconditions.checkNotNull(output, "null output in transform %s", definition.getName());
      String name = output.getName();
      Preconditions.checkArgument(StringUtils.isNotBlank(name), "output name is required");
      Preconditions.checkArgument(seen.add(name), "duplicate output name: %s", name);
      Preconditions.checkArgument(output.getOp() != null, "output %s has no op", name);
      List<String> inputs = output.getInputs();
      int inputCount = inputs == null ? 0 : inputs.size();
      Preconditions.checkArgument(
          inputCount == output.getOp().getArity(),
          "output %s: %s takes %s input(s) but %s were given",
          name,
          output.getOp(),
          output.getOp().getArity(),
          inputCount);
      Preconditions.checkArgument(
          inputs.stream().allMatch(StringUtils::isNotBlank), "output %s has a blank input", name);
      boolean vocabulary = output.getOp() == TransformOp.COMPUTE_AND_APPLY_VOCABULARY;
      Preconditions.checkArgument(
          vocabulary || (output.getTopK() == null && output.getFrequencyThreshold() == null),
          "output %s: topK and frequencyThreshold only apply to %s",
          name,
          TransformOp.COMPUTE_AND_APPLY_VOCABULARY);
      Preconditions.checkArgument(
          output.getTopK() == null || output.getTopK() >= 0,
          "output %s: topK must not be negative",
          name);
      Preconditions.checkArgument(
          output.getFrequencyThreshold() == null || output.getFrequencyThreshold() >= 0,
          "output %s: frequencyThreshold must not be negative",
          name);
      boolean minMax = output.getOp() == TransformOp.SCALE_BY_MIN_MAX;
      Preconditions.checkArgument(
          minMax || (output.getOutputMin() == null && output.getOutputMax() == null),
          "output %s: outputMin and outputMax only apply to %s",
          name,
          TransformOp.SCALE_BY_MIN_MAX);
      Preconditions.checkArgument(
          output.outputMinOrDefault() < output.outputMaxOrDefault(),
          "output %s: outputMin must be smaller than outputMax",
          name);
    }
  }

  /**
   * Validates the definition against the input schema.
   *
   * @return the schema of the records the transform produces
   * @throws IllegalArgumentException on a malformed definition
   * @throws SchemaException when an input is unknown or has a type the op cannot handle
   */
  public Schema validateConfig(TransformDefinition definition, Schema inputSchema) {
    validateStructure(definition);
    Map<String, FieldSpec> outputs = new LinkedHashMap<>();
    for (OutputDefinition output : definition.getOutputs()) {
      String name = output.getName();
      TransformOp op = output.getOp();
      if (op.isAnalyzed()) {
        String input = output.getInputs().get(0);
        if (outputs.containsKey(input)) {
          throw new SchemaException(
              input,
              String.format(
                  "output %s: %s needs a raw input field but '%s' is an earlier output",
                  name, op, input));
        }
      }
      List<FieldSpec> args =
          output.getInputs().stream().map(i -> resolve(name, i, outputs, inputSchema)).toList();
      outputs.put(name, outputSpec(output, args));
    }
    return Schema.build(outputs);
  }

  private static FieldSpec resolve(
      String output, String input, Map<String, FieldSpec> earlier, Schema inputSchema) {
    FieldSpec spec = earlier.get(input);
    if (spec != null) {
      return spec;
    }
    return inputSchema
        .field(input)
        .orElseThrow(
            () ->
                new SchemaException(
                    input,
                    String.format(
                        "output %s references a field the input schema does not declare",
                        output)));
  }

  private static FieldSpec outputSpec(OutputDefinition output, List<FieldSpec> args) {
    String name = output.getName();
    FieldSpec first = args.get(0);
    return switch (output.getOp()) {
      case IDENTITY -> first.withName(name);
      case CENTER, SCALE_TO_0_1, SCALE_BY_MIN_MAX, SCALE_TO_Z_SCORE -> {
        requireNumeric(output, first);
        yield first.toBuilder().name(name).valueType(ValueType.FLOAT).build();
      }
      case COMPUTE_AND_APPLY_VOCABULARY -> {
        if (first.getValueType() == ValueType.FLOAT) {
          throw new SchemaException(
              first.getName(),
              String.format("output %s: vocabulary needs a STRING or INT input", name));
        }
        yield first.toBuilder().name(name).valueType(ValueType.INT).build();
      }
      case ADD, MULTIPLY -> {
        FieldSpec second = args.get(1);
        requireNumeric(output, first);
        requireNumeric(output, second);
        yield broadcast(name, first, second);
      }
    };
  }

  private static void requireNumeric(OutputDefinition output, FieldSpec arg) {
    if (!arg.getValueType().isNumeric()) {
      throw new SchemaException(
          arg.getName(),
          String.format(
              "output %s: %s needs a numeric input but got %s",
              output.getName(), output.getOp(), arg.getValueType()));
    }
  }

  private static FieldSpec broadcast(String name, FieldSpec a, FieldSpec b) {
    FieldSpec.FieldSpecBuilder builder =
        FieldSpec.builder()
            .name(name)
            .valueType(ValueType.FLOAT)
            .required(a.isRequired() && b.isRequired());
    if (a.isScalar() && b.isScalar()) {
      return builder.build();
    }
    if (a.isScalar() || b.isScalar()) {
      FieldSpec vector = a.isScalar() ? b : a;
      return builder.arity(vector.getArity()).length(vector.getLength()).build();
    }
    if (a.getArity() == Arity.FIXED_VECTOR && b.getArity() == Arity.FIXED_VECTOR) {
      if (!Objects.equals(a.getLength(), b.getLength())) {
        throw new SchemaException(
            a.getName(),
            String.format(
                "output %s: vector lengths differ (%s has %d, %s has %d)",
                name, a.getName(), a.getLength(), b.getName(), b.getLength()));
      }
      return builder.arity(Arity.FIXED_VECTOR).length(a.getLength()).build();
    }
    return builder.arity(Arity.VARIABLE_LENGTH).build();
  }
}
