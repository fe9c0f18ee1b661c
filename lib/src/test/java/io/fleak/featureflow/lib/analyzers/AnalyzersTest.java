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

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.featureflow.api.analyzer.AnalyzerConstant;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.errors.AnalyzerException;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class AnalyzersTest {

  private static List<RecordFeatureData> column(String field, Object... values) {
    List<RecordFeatureData> records = new ArrayList<>();
    for (Object v : values) {
      records.add(FeatureData.record(Map.of(field, v)));
    }
    return records;
  }

  @Test
  void mean() {
    ConstantsTable table =
        AnalyzePass.analyze(List.of(AnalyzerSpec.mean("x")), column("x", 1, 2, 3));
    assertEquals(2.0, table.scalar(AnalyzerSpec.mean("x")));
  }

  @Test
  void minMaxAndRange() {
    List<RecordFeatureData> batch = column("y", 3.0, 1.0, 2.0);
    ConstantsTable table =
        AnalyzePass.analyze(
            List.of(AnalyzerSpec.min("y"), AnalyzerSpec.max("y"), AnalyzerSpec.scale01("y")),
            batch);
    assertEquals(1.0, table.scalar(AnalyzerSpec.min("y")));
    assertEquals(3.0, table.scalar(AnalyzerSpec.max("y")));
    assertEquals(
        new AnalyzerConstant.RangeConstant(1.0, 3.0), table.range(AnalyzerSpec.scale01("y")));
  }

  @Test
  void populationVariance() {
    ConstantsTable table =
        AnalyzePass.analyze(
            List.of(AnalyzerSpec.variance("x")), column("x", 2, 4, 4, 4, 5, 5, 7, 9));
    assertEquals(4.0, table.scalar(AnalyzerSpec.variance("x")), 1e-12);
  }

  @Test
  void vectorsReduceOverAllElements() {
    List<RecordFeatureData> batch = column("v", List.of(1.0, 5.0), List.of(3.0, 7.0));
    ConstantsTable table =
        AnalyzePass.analyze(List.of(AnalyzerSpec.mean("v"), AnalyzerSpec.max("v")), batch);
    assertEquals(4.0, table.scalar(AnalyzerSpec.mean("v")));
    assertEquals(7.0, table.scalar(AnalyzerSpec.max("v")));
  }

  @Test
  void absentValuesAreSkipped() {
    List<RecordFeatureData> batch = column("x", 1, 3);
    batch.add(FeatureData.record(Map.of("other", 100)));
    ConstantsTable table = AnalyzePass.analyze(List.of(AnalyzerSpec.mean("x")), batch);
    assertEquals(2.0, table.scalar(AnalyzerSpec.mean("x")));
  }

  @Test
  void vocabulary_orderedByFrequencyThenFirstSeen() {
    List<RecordFeatureData> batch =
        column("s", "hello", "world", "hello", "zebra", "apple", "apple");
    ConstantsTable table = AnalyzePass.analyze(List.of(AnalyzerSpec.vocabulary("s")), batch);
    assertEquals(
        List.of("hello", "apple", "world", "zebra"),
        table.vocabulary(AnalyzerSpec.vocabulary("s")).getTerms());
  }

  @Test
  void vocabulary_thresholdThenTopK() {
    List<RecordFeatureData> batch = column("s", "a", "b", "b", "c", "c", "c", "d", "d");
    AnalyzerSpec spec = AnalyzerSpec.vocabulary("s", 2, 2);
    ConstantsTable table = AnalyzePass.analyze(List.of(spec), batch);
    assertEquals(List.of("c", "b"), table.vocabulary(spec).getTerms());
  }

  @Test
  void vocabulary_emptyAfterFilteringIsAllowed() {
    AnalyzerSpec spec = AnalyzerSpec.vocabulary("s", 0, 5);
    ConstantsTable table = AnalyzePass.analyze(List.of(spec), column("s", "a", "b"));
    assertEquals(0, table.vocabulary(spec).size());
  }

  @Test
  void vocabulary_intTermsUseDecimalText() {
    ConstantsTable table =
        AnalyzePass.analyze(List.of(AnalyzerSpec.vocabulary("c")), column("c", 7, 3, 7));
    assertEquals(List.of("7", "3"), table.vocabulary(AnalyzerSpec.vocabulary("c")).getTerms());
  }

  @Test
  void emptyInput() {
    AnalyzerException e =
        assertThrows(
            AnalyzerException.class,
            () -> AnalyzePass.analyze(List.of(AnalyzerSpec.mean("x")), List.of()));
    assertEquals(AnalyzerException.Kind.EMPTY_INPUT, e.getKind());
    assertThrows(
        AnalyzerException.class,
        () -> AnalyzePass.analyze(List.of(AnalyzerSpec.scale01("x")), column("y", 1)));
  }

  @Test
  void typeMismatch() {
    AnalyzerException e =
        assertThrows(
            AnalyzerException.class,
            () -> AnalyzePass.analyze(List.of(AnalyzerSpec.mean("x")), column("x", 1, "two")));
    assertEquals(AnalyzerException.Kind.TYPE_MISMATCH, e.getKind());

    AnalyzerException nan =
        assertThrows(
            AnalyzerException.class,
            () -> AnalyzePass.analyze(List.of(AnalyzerSpec.max("x")), column("x", Double.NaN)));
    assertEquals(AnalyzerException.Kind.TYPE_MISMATCH, nan.getKind());

    assertThrows(
        AnalyzerException.class,
        () -> AnalyzePass.analyze(List.of(AnalyzerSpec.vocabulary("x")), column("x", 1.5)));
  }

  @Test
  void shardedFoldEqualsSinglePass() {
    List<RecordFeatureData> batch = new ArrayList<>();
    IntStream.range(0, 100)
        .forEach(
            i ->
                batch.add(
                    FeatureData.record(
                        Map.of("x", (i * 37) % 11 + 0.25, "s", "t" + (i * 7) % 13))));
    List<AnalyzerSpec> specs =
        List.of(
            AnalyzerSpec.mean("x"),
            AnalyzerSpec.variance("x"),
            AnalyzerSpec.scale01("x"),
            AnalyzerSpec.vocabulary("s"),
            AnalyzerSpec.vocabulary("s", 5, 0));
    ConstantsTable single = AnalyzePass.analyze(specs, batch);

    ConstantsTable sharded =
        AnalyzePass.finalizeAll(
            AnalyzePass.merge(
                List.of(
                    AnalyzePass.fold(specs, batch.subList(0, 33), 0),
                    AnalyzePass.fold(specs, batch.subList(33, 34), 33),
                    AnalyzePass.fold(specs, batch.subList(34, 100), 34))));

    assertEquals(single.scalar(specs.get(0)), sharded.scalar(specs.get(0)), 1e-12);
    assertEquals(single.scalar(specs.get(1)), sharded.scalar(specs.get(1)), 1e-12);
    assertEquals(single.range(specs.get(2)), sharded.range(specs.get(2)));
    assertEquals(single.vocabulary(specs.get(3)), sharded.vocabulary(specs.get(3)));
    assertEquals(single.vocabulary(specs.get(4)), sharded.vocabulary(specs.get(4)));
  }
}
