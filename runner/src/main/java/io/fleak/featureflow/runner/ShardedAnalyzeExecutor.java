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

import com.google.common.base.Preconditions;
import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.errors.Phase;
import io.fleak.featureflow.api.errors.PreprocessingException;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.lib.analyzers.AnalyzePass;
import io.fleak.featureflow.lib.analyzers.AnalyzerState;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the analyze pass over contiguous shards of the batch in parallel.
 *
 * <p>Each shard folds its own accumulators. Partials are merged only once every shard has
 * finished, so no accumulator is ever shared between threads. If a shard fails the remaining
 * shards are cancelled and no constants are produced.
 */
@Slf4j
public class ShardedAnalyzeExecutor implements AutoCloseable {

  private final int parallelism;
  private final ExecutorService executor;

  public ShardedAnalyzeExecutor(int parallelism) {
    Preconditions.checkArgument(parallelism > 0, "analyzeParallelism must be positive");
    this.parallelism = parallelism;
    this.executor =
        parallelism > 1 ? WorkerThreads.newPool("featureflow-analyze", parallelism) : null;
  }

  public ConstantsTable analyze(Collection<AnalyzerSpec> specs, List<RecordFeatureData> batch)
      throws InterruptedException {
    if (specs.isEmpty()) {
      return ConstantsTable.EMPTY;
    }
    int[] bounds = WorkerThreads.shardBounds(batch.size(), parallelism);
    int shards = bounds.length - 1;
    if (executor == null || shards == 1) {
      return AnalyzePass.analyze(specs, batch);
    }
    log.debug("analyzing {} records in {} shards", batch.size(), shards);

    List<Future<Map<AnalyzerSpec, AnalyzerState<?>>>> futures = new ArrayList<>(shards);
    for (int s = 0; s < shards; s++) {
      int from = bounds[s];
      int to = bounds[s + 1];
      futures.add(executor.submit(() -> AnalyzePass.fold(specs, batch.subList(from, to), from)));
    }

    // barrier: every shard must be done before anything is merged
    List<Map<AnalyzerSpec, AnalyzerState<?>>> partials = new ArrayList<>(shards);
    try {
      for (Future<Map<AnalyzerSpec, AnalyzerState<?>>> future : futures) {
        partials.add(future.get());
      }
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof PreprocessingException preprocessingException) {
        throw preprocessingException;
      }
      throw new PreprocessingException(
          Phase.ANALYZING, null, "analyze shard failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      cancelAll(futures);
      throw e;
    }
    return AnalyzePass.finalizeAll(AnalyzePass.merge(partials));
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    futures.forEach(f -> f.cancel(true));
  }

  @Override
  public void close() {
    if (executor != null) {
      WorkerThreads.shutdown(executor);
    }
  }
}
