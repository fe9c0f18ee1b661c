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

import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.errors.AnalyzerException;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.lib.utils.FeatureValues;

/** Base of analyzers over numbers. Vector values are reduced over all their elements. */
abstract class NumericAnalyzer<A> implements Analyzer<A> {

  protected final AnalyzerSpec spec;

  protected NumericAnalyzer(AnalyzerSpec spec) {
    this.spec = spec;
  }

  @Override
  public AnalyzerSpec spec() {
    return spec;
  }

  @Override
  public A accumulate(A accumulator, FeatureData value, long ordinal) {
    try {
      FeatureValues.forEachNumber(
          value,
          v -> {
            if (!Double.isFinite(v)) {
              throw new AnalyzerException(
                  AnalyzerException.Kind.TYPE_MISMATCH,
                  spec,
                  "non-finite value " + v + " in record " + ordinal);
            }
            add(accumulator, v);
          });
    } catch (IllegalArgumentException e) {
      throw new AnalyzerException(
          AnalyzerException.Kind.TYPE_MISMATCH, spec, e.getMessage() + " in record " + ordinal);
    }
    return accumulator;
  }

  protected abstract void add(A accumulator, double value);

  protected AnalyzerException emptyInput() {
    return new AnalyzerException(
        AnalyzerException.Kind.EMPTY_INPUT, spec, "no values to reduce over");
  }
}
