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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/** Fixed pools of named daemon threads for the analyze and transform phases. */
@Slf4j
final class WorkerThreads {

  private WorkerThreads() {}

  static ExecutorService newPool(String namePrefix, int size) {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        size,
        r -> {
          Thread t = new Thread(r, namePrefix + "-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  static void shutdown(ExecutorService executor) {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("worker pool did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Splits {@code size} items into at most {@code parts} contiguous ranges of similar length. */
  static int[] shardBounds(int size, int parts) {
    int shards = Math.max(1, Math.min(parts, size));
    int[] bounds = new int[shards + 1];
    for (int i = 0; i <= shards; i++) {
      bounds[i] = (int) ((long) size * i / shards);
    }
    return bounds;
  }
}
