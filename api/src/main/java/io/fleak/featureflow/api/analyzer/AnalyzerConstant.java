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
package io.fleak.featureflow.api.analyzer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** The frozen result of one analyzer. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = AnalyzerConstant.ScalarConstant.class, name = "scalar"),
  @JsonSubTypes.Type(value = AnalyzerConstant.RangeConstant.class, name = "range"),
  @JsonSubTypes.Type(value = AnalyzerConstant.VocabularyConstant.class, name = "vocabulary"),
})
public interface AnalyzerConstant {

  /** Index assigned to terms that were never seen during analysis. */
  int OOV_INDEX = -1;

  record ScalarConstant(double value) implements AnalyzerConstant {}

  record RangeConstant(double min, double max) implements AnalyzerConstant {
    public RangeConstant {
      Preconditions.checkArgument(min <= max, "min (%s) is larger than max (%s)", min, max);
    }

    /** Maps {@code v} into [0, 1]; a single-valued range maps everything to 0. */
    public double scale01(double v) {
      double span = max - min;
      if (span == 0) {
        return 0.0;
      }
      return (v - min) / span;
    }
  }

  /** Terms ordered by index: the term at position i has index i. */
  @ToString(of = "terms")
  @EqualsAndHashCode(of = "terms")
  final class VocabularyConstant implements AnalyzerConstant {
    private final ImmutableList<String> terms;
    private final ImmutableMap<String, Integer> index;

    @JsonCreator
    public VocabularyConstant(@JsonProperty("terms") List<String> terms) {
      this.terms = ImmutableList.copyOf(terms);
      ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
      for (int i = 0; i < this.terms.size(); i++) {
        builder.put(this.terms.get(i), i);
      }
      // buildOrThrow rejects duplicate terms
      this.index = builder.buildOrThrow();
    }

    @JsonProperty("terms")
    public List<String> getTerms() {
      return terms;
    }

    /** Returns the index of {@code term}, or {@link #OOV_INDEX} if it is not in the vocabulary. */
    public int indexOf(String term) {
      return index.getOrDefault(term, OOV_INDEX);
    }

    public int size() {
      return terms.size();
    }
  }
}
