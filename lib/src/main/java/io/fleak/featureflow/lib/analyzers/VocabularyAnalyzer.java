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
import io.fleak.featureflow.api.errors.AnalyzerException;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.lib.utils.FeatureValues;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Builds a categorical vocabulary. Terms are ordered by descending frequency; equal frequencies
 * are ordered by where the term was first seen in the batch (record ordinal, then position inside
 * a vector value). Because first-seen positions are global ordinals, the order does not depend on
 * how the batch was sharded.
 */
public class VocabularyAnalyzer implements Analyzer<VocabularyAnalyzer.TermCounts> {

  private static final Comparator<Map.Entry<String, TermStats>> VOCABULARY_ORDER =
      Comparator.<Map.Entry<String, TermStats>>comparingLong(e -> -e.getValue().count)
          .thenComparingLong(e -> e.getValue().firstRecord)
          .thenComparingInt(e -> e.getValue().firstPosition)
          .thenComparing(Map.Entry::getKey);

  private final AnalyzerSpec spec;

  public VocabularyAnalyzer(AnalyzerSpec spec) {
    this.spec = spec;
  }

  @Override
  public AnalyzerSpec spec() {
    return spec;
  }

  @Override
  public TermCounts seed() {
    return new TermCounts();
  }

  @Override
  public TermCounts accumulate(TermCounts accumulator, FeatureData value, long ordinal) {
    List<String> terms;
    try {
      terms = FeatureValues.terms(value);
    } catch (IllegalArgumentException e) {
      throw new AnalyzerException(
          AnalyzerException.Kind.TYPE_MISMATCH, spec, e.getMessage() + " in record " + ordinal);
    }
    for (int position = 0; position < terms.size(); position++) {
      String term = terms.get(position);
      TermStats stats = accumulator.terms.get(term);
      if (stats == null) {
        accumulator.terms.put(term, new TermStats(1, ordinal, position));
      } else {
        stats.count++;
        stats.observe(ordinal, position);
      }
    }
    return accumulator;
  }

  @Override
  public TermCounts merge(TermCounts left, TermCounts right) {
    right.terms.forEach(
        (term, stats) ->
            left.terms.merge(
                term,
                stats,
                (a, b) -> {
                  a.count += b.count;
                  a.observe(b.firstRecord, b.firstPosition);
                  return a;
                }));
    return left;
  }

  @Override
  public AnalyzerConstant finalizeConstant(TermCounts accumulator) {
    Stream<Map.Entry<String, TermStats>> ordered =
        accumulator.terms.entrySet().stream()
            .filter(e -> e.getValue().count >= spec.frequencyThreshold())
            .sorted(VOCABULARY_ORDER);
    if (spec.topK() > 0) {
      ordered = ordered.limit(spec.topK());
    }
    return new AnalyzerConstant.VocabularyConstant(ordered.map(Map.Entry::getKey).toList());
  }

  public static class TermCounts {
    final Map<String, TermStats> terms = new HashMap<>();
  }

  static class TermStats {
    long count;
    long firstRecord;
    int firstPosition;

    TermStats(long count, long firstRecord, int firstPosition) {
      this.count = count;
      this.firstRecord = firstRecord;
      this.firstPosition = firstPosition;
    }

    void observe(long record, int position) {
      if (record < firstRecord || (record == firstRecord && position < firstPosition)) {
        firstRecord = record;
        firstPosition = position;
      }
    }
  }
}
