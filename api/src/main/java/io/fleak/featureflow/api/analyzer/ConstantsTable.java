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
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;

/**
 * Immutable mapping from {@link AnalyzerSpec} to its computed constant. Created once by the
 * analyze phase and then shared read-only by every transform call, including serving-time ones.
 */
@EqualsAndHashCode
public final class ConstantsTable {

  public static final ConstantsTable EMPTY = new ConstantsTable(ImmutableMap.of());

  private final ImmutableMap<AnalyzerSpec, AnalyzerConstant> constants;

  private ConstantsTable(ImmutableMap<AnalyzerSpec, AnalyzerConstant> constants) {
    this.constants = constants;
  }

  public static ConstantsTable of(Map<AnalyzerSpec, ? extends AnalyzerConstant> constants) {
    return new ConstantsTable(ImmutableMap.copyOf(constants));
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ConstantsTable fromEntries(List<Entry> entries) {
    Map<AnalyzerSpec, AnalyzerConstant> map = new LinkedHashMap<>();
    for (Entry entry : entries) {
      if (map.put(entry.analyzer(), entry.constant()) != null) {
        throw new IllegalArgumentException("duplicate constant for " + entry.analyzer());
      }
    }
    return of(map);
  }

  @JsonValue
  public List<Entry> entries() {
    return constants.entrySet().stream().map(e -> new Entry(e.getKey(), e.getValue())).toList();
  }

  public AnalyzerConstant get(AnalyzerSpec spec) {
    AnalyzerConstant constant = constants.get(spec);
    if (constant == null) {
      throw new IllegalArgumentException("no constant computed for analyzer " + spec);
    }
    return constant;
  }

  public double scalar(AnalyzerSpec spec) {
    return as(spec, AnalyzerConstant.ScalarConstant.class).value();
  }

  public AnalyzerConstant.RangeConstant range(AnalyzerSpec spec) {
    return as(spec, AnalyzerConstant.RangeConstant.class);
  }

  public AnalyzerConstant.VocabularyConstant vocabulary(AnalyzerSpec spec) {
    return as(spec, AnalyzerConstant.VocabularyConstant.class);
  }

  private <T extends AnalyzerConstant> T as(AnalyzerSpec spec, Class<T> type) {
    AnalyzerConstant constant = get(spec);
    if (!type.isInstance(constant)) {
      throw new IllegalArgumentException(
          String.format(
              "constant of %s is a %s, not a %s",
              spec, constant.getClass().getSimpleName(), type.getSimpleName()));
    }
    return type.cast(constant);
  }

  public boolean containsAll(Collection<AnalyzerSpec> specs) {
    return constants.keySet().containsAll(specs);
  }

  public Set<AnalyzerSpec> specs() {
    return constants.keySet();
  }

  public int size() {
    return constants.size();
  }

  @Override
  public String toString() {
    return "ConstantsTable" + constants;
  }

  public record Entry(AnalyzerSpec analyzer, AnalyzerConstant constant) {}
}
