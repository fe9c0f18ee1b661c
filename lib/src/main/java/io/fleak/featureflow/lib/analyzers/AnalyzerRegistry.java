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
package io.fleak.featureflow.lib.analyzers;

import com.google.common.collect.ImmutableMap;
import io.fleak.featureflow.api.analyzer.AnalyzerKind;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.errors.AnalyzerException;
import io.fleak.featureflow.api.schema.FieldSpec;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.schema.ValueType;
import java.util.Map;
import java.util.function.Function;

/** The closed set of analyzer implementations, keyed by kind. */
public interface AnalyzerRegistry {

  Map<AnalyzerKind, Function<AnalyzerSpec, Analyzer<?>>> ANALYZERS =
      ImmutableMap.<AnalyzerKind, Function<AnalyzerSpec, Analyzer<?>>>builder()
          .put(AnalyzerKind.MEAN, MeanAnalyzer::new)
          .put(AnalyzerKind.MIN, MinMaxAnalyzer::new)
          .put(AnalyzerKind.MAX, MinMaxAnalyzer::new)
          .put(AnalyzerKind.SCALE_0_1, MinMaxAnalyzer::new)
          .put(AnalyzerKind.VARIANCE, VarianceAnalyzer::new)
          .put(AnalyzerKind.VOCABULARY, VocabularyAnalyzer::new)
          .build();

  static Analyzer<?> create(AnalyzerSpec spec) {
    Function<AnalyzerSpec, Analyzer<?>> factory = ANALYZERS.get(spec.kind());
    if (factory == null) {
      throw new IllegalStateException("no analyzer registered for kind " + spec.kind());
    }
    return factory.apply(spec);
  }

  /**
   * Checks that the analyzer can run over the field it names.
   *
   * @throws AnalyzerException UNSUPPORTED_FIELD when the schema does not declare the field,
   *     TYPE_MISMATCH when the field type cannot be reduced by this kind
   */
  static void check(AnalyzerSpec spec, Schema schema) {
    FieldSpec field =
        schema
            .field(spec.field())
            .orElseThrow(
                () ->
                    new AnalyzerException(
                        AnalyzerException.Kind.UNSUPPORTED_FIELD,
                        spec,
                        "field is not declared in the input schema"));
    ValueType type = field.getValueType();
    if (spec.kind().isNumeric() && !type.isNumeric()) {
      throw new AnalyzerException(
          AnalyzerException.Kind.TYPE_MISMATCH, spec, "requires a numeric field but was " + type);
    }
    if (spec.kind() == AnalyzerKind.VOCABULARY && type == ValueType.FLOAT) {
      throw new AnalyzerException(
          AnalyzerException.Kind.TYPE_MISMATCH,
          spec,
          "requires a STRING or INT field but was " + type);
    }
  }
}
