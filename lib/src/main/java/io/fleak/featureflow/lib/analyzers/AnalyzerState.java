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

import com.google.common.base.Preconditions;
import io.fleak.featureflow.api.analyzer.AnalyzerConstant;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;

/**
 * A partial reduction: one analyzer and its accumulator over some shard of the batch. Not
 * thread-safe; each shard owns its states until they are merged.
 */
public final class AnalyzerState<A> {
  private final Analyzer<A> analyzer;
  private A accumulator;

  private AnalyzerState(Analyzer<A> analyzer) {
    this.analyzer = analyzer;
    this.accumulator = analyzer.seed();
  }

  public static AnalyzerState<?> seed(AnalyzerSpec spec) {
    return seed(AnalyzerRegistry.create(spec));
  }

  private static <A> AnalyzerState<A> seed(Analyzer<A> analyzer) {
    return new AnalyzerState<>(analyzer);
  }

  public AnalyzerSpec spec() {
    return analyzer.spec();
  }

  /** Folds the analyzed field of {@code record}; absent values are skipped. */
  public void add(RecordFeatureData record, long ordinal) {
    FeatureData value = record.get(analyzer.spec().field());
    if (value == null) {
      return;
    }
    accumulator = analyzer.accumulate(accumulator, value, ordinal);
  }

  /** Merges {@code other} into this state. {@code other} must not be used afterwards. */
  @SuppressWarnings("unchecked")
  public void mergeFrom(AnalyzerState<?> other) {
    Preconditions.checkArgument(
        spec().equals(other.spec()), "cannot merge %s into %s", other.spec(), spec());
    accumulator = analyzer.merge(accumulator, ((AnalyzerState<A>) other).accumulator);
  }

  public AnalyzerConstant finalizeConstant() {
    return analyzer.finalizeConstant(accumulator);
  }
}
