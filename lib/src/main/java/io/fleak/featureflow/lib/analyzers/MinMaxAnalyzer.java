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

import io.fleak.featureflow.api.analyzer.AnalyzerConstant;
import io.fleak.featureflow.api.analyzer.AnalyzerKind;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;

/**
 * Tracks the running minimum and maximum. Finalizes to the minimum for MIN, the maximum for MAX
 * and the (min, max) range for SCALE_0_1.
 */
public class MinMaxAnalyzer extends NumericAnalyzer<MinMaxAnalyzer.Extremes> {

  public MinMaxAnalyzer(AnalyzerSpec spec) {
    super(spec);
  }

  @Override
  public Extremes seed() {
    return new Extremes();
  }

  @Override
  protected void add(Extremes accumulator, double value) {
    accumulator.min = Math.min(accumulator.min, value);
    accumulator.max = Math.max(accumulator.max, value);
    accumulator.count++;
  }

  @Override
  public Extremes merge(Extremes left, Extremes right) {
    left.min = Math.min(left.min, right.min);
    left.max = Math.max(left.max, right.max);
    left.count += right.count;
    return left;
  }

  @Override
  public AnalyzerConstant finalizeConstant(Extremes accumulator) {
    if (accumulator.count == 0) {
      throw emptyInput();
    }
    AnalyzerKind kind = spec.kind();
    return switch (kind) {
      case MIN -> new AnalyzerConstant.ScalarConstant(accumulator.min);
      case MAX -> new AnalyzerConstant.ScalarConstant(accumulator.max);
      case SCALE_0_1 -> new AnalyzerConstant.RangeConstant(accumulator.min, accumulator.max);
      default -> throw new IllegalStateException("not a min/max analyzer: " + kind);
    };
  }

  public static class Extremes {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    long count;
  }
}
