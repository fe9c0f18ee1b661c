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
package io.fleak.featureflow.runner;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.errors.AnalyzerException;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.lib.analyzers.AnalyzePass;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ShardedAnalyzeExecutorTest {

  private static final Set<AnalyzerSpec> SPECS =
      Set.of(
          AnalyzerSpec.mean("x"),
          AnalyzerSpec.scale01("x"),
          AnalyzerSpec.vocabulary("s"),
          AnalyzerSpec.vocabulary("s", 3, 2));

  private static List<RecordFeatureData> batch(int size) {
    List<RecordFeatureData> batch = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      batch.add(FeatureData.record(Map.of("x", i % 23, "s", "t" + (i * 7) % 5)));
    }
    return batch;
  }

  @Test
  void shardedConstantsEqualSinglePass() throws Exception {
    List<RecordFeatureData> batch = batch(503);
    try (ShardedAnalyzeExecutor executor = new ShardedAnalyzeExecutor(6)) {
      assertEquals(AnalyzePass.analyze(SPECS, batch), executor.analyze(SPECS, batch));
    }
  }

  @Test
  void moreShardsThanRecords() throws Exception {
    List<RecordFeatureData> batch = batch(2);
    try (ShardedAnalyzeExecutor executor = new ShardedAnalyzeExecutor(8)) {
      assertEquals(AnalyzePass.analyze(SPECS, batch), executor.analyze(SPECS, batch));
    }
  }

  @Test
  void noAnalyzers() throws Exception {
    try (ShardedAnalyzeExecutor executor = new ShardedAnalyzeExecutor(2)) {
      assertSame(ConstantsTable.EMPTY, executor.analyze(Set.of(), batch(10)));
    }
  }

  @Test
  void failingShardFailsTheWholePass() {
    List<RecordFeatureData> batch = batch(100);
    batch.set(77, FeatureData.record(Map.of("x", "seventy-seven", "s", "t0")));
    try (ShardedAnalyzeExecutor executor = new ShardedAnalyzeExecutor(4)) {
      AnalyzerException e =
          assertThrows(AnalyzerException.class, () -> executor.analyze(SPECS, batch));
      assertEquals(AnalyzerException.Kind.TYPE_MISMATCH, e.getKind());
      assertTrue(e.getMessage().contains("record 77"), e.getMessage());
    }
  }

  @Test
  void parallelismMustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new ShardedAnalyzeExecutor(0));
  }
}
