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

/**
 * Population variance. Each shard runs Welford's update and shards are combined with the pairwise
 * formula of Chan et al., which keeps the merge exact up to rounding in any grouping.
 */
public class VarianceAnalyzer extends NumericAnalyzer<VarianceAnalyzer.Moments> {

  public VarianceAnalyzer(AnalyzerSpec spec) {
    super(spec);
  }

  @Override
  public Moments seed() {
    return new Moments();
  }

  @Override
  protected void add(Moments m, double value) {
    m.count++;
    double delta = value - m.mean;
    m.mean += delta / m.count;
    m.m2 += delta * (value - m.mean);
  }

  @Override
  public Moments merge(Moments left, Moments right) {
    if (right.count == 0) {
      return left;
    }
    if (left.count == 0) {
      return right;
    }
    long count = left.count + right.count;
    double delta = right.mean - left.mean;
    left.mean += delta * right.count / count;
    left.m2 += right.m2 + delta * delta * ((double) left.count * right.count / count);
    left.count = count;
    return left;
  }

  @Override
  public AnalyzerConstant finalizeConstant(Moments m) {
    if (m.count == 0) {
      throw emptyInput();
    }
    return new AnalyzerConstant.ScalarConstant(Math.max(0.0, m.m2 / m.count));
  }

  public static class Moments {
    long count;
    double mean;
    double m2;
  }
}
