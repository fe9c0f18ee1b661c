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
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;

/** MEAN: accumulates (sum, count) and finalizes to sum / count. */
public class MeanAnalyzer extends NumericAnalyzer<MeanAnalyzer.SumCount> {

  public MeanAnalyzer(AnalyzerSpec spec) {
    super(spec);
  }

  @Override
  public SumCount seed() {
    return new SumCount();
  }

  @Override
  protected void add(SumCount accumulator, double value) {
    accumulator.sum += value;
    accumulator.count++;
  }

  @Override
  public SumCount merge(SumCount left, SumCount right) {
    left.sum += right.sum;
    left.count += right.count;
    return left;
  }

  @Override
  public AnalyzerConstant finalizeConstant(SumCount accumulator) {
    if (accumulator.count == 0) {
      throw emptyInput();
    }
    return new AnalyzerConstant.ScalarConstant(accumulator.sum / accumulator.count);
  }

  public static class SumCount {
    double sum;
    long count;
  }
}
