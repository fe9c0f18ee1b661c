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
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The three steps of a full pass: fold shards, merge partials, finalize constants. */
public interface AnalyzePass {

  /**
   * Folds one shard.
   *
   * @param firstOrdinal batch ordinal of {@code shard.get(0)}
   */
  static Map<AnalyzerSpec, AnalyzerState<?>> fold(
      Collection<AnalyzerSpec> specs, List<RecordFeatureData> shard, long firstOrdinal) {
    Map<AnalyzerSpec, AnalyzerState<?>> states = new LinkedHashMap<>();
    for (AnalyzerSpec spec : specs) {
      states.put(spec, AnalyzerState.seed(spec));
    }
    for (int i = 0; i < shard.size(); i++) {
      RecordFeatureData record = shard.get(i);
      for (AnalyzerState<?> state : states.values()) {
        state.add(record, firstOrdinal + i);
      }
    }
    return states;
  }

  /** Merges shard partials into the first one. */
  static Map<AnalyzerSpec, AnalyzerState<?>> merge(
      List<Map<AnalyzerSpec, AnalyzerState<?>>> partials) {
    if (partials.isEmpty()) {
      throw new IllegalArgumentException("nothing to merge");
    }
    Map<AnalyzerSpec, AnalyzerState<?>> merged = partials.get(0);
    for (Map<AnalyzerSpec, AnalyzerState<?>> partial : partials.subList(1, partials.size())) {
      partial.forEach((spec, state) -> merged.get(spec).mergeFrom(state));
    }
    return merged;
  }

  static ConstantsTable finalizeAll(Map<AnalyzerSpec, AnalyzerState<?>> merged) {
    Map<AnalyzerSpec, AnalyzerConstant> constants = new LinkedHashMap<>();
    merged.forEach((spec, state) -> constants.put(spec, state.finalizeConstant()));
    return ConstantsTable.of(constants);
  }

  /** Single shard convenience: fold, then finalize. */
  static ConstantsTable analyze(Collection<AnalyzerSpec> specs, List<RecordFeatureData> batch) {
    return finalizeAll(fold(specs, batch, 0));
  }
}
