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
import io.fleak.featureflow.api.structure.FeatureData;

/**
 * A full-pass reduction bound to one {@link AnalyzerSpec}.
 *
 * <p>{@link #merge(Object, Object)} must be associative and commutative so that accumulators built
 * over disjoint shards of a batch can be combined in any grouping. Implementations may reuse
 * (mutate and return) the accumulator they are given; callers never read an accumulator after
 * passing it to {@link #accumulate} or {@link #merge}.
 *
 * @param <A> accumulator type
 */
public interface Analyzer<A> {

  AnalyzerSpec spec();

  A seed();

  /**
   * Folds one present field value into the accumulator.
   *
   * @param ordinal position of the record in the full batch
   */
  A accumulate(A accumulator, FeatureData value, long ordinal);

  A merge(A left, A right);

  AnalyzerConstant finalizeConstant(A accumulator);
}
