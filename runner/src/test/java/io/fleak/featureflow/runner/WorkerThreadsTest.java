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

import java.util.concurrent.ExecutorService;
import org.junit.jupiter.api.Test;

class WorkerThreadsTest {

  @Test
  void shardBounds_evenSplit() {
    assertArrayEquals(new int[] {0, 25, 50, 75, 100}, WorkerThreads.shardBounds(100, 4));
  }

  @Test
  void shardBounds_unevenSplitCoversEverything() {
    assertArrayEquals(new int[] {0, 3, 6, 10}, WorkerThreads.shardBounds(10, 3));
  }

  @Test
  void shardBounds_fewerItemsThanParts() {
    assertArrayEquals(new int[] {0, 1, 2}, WorkerThreads.shardBounds(2, 8));
  }

  @Test
  void shardBounds_emptyInputHasOneEmptyShard() {
    assertArrayEquals(new int[] {0, 0}, WorkerThreads.shardBounds(0, 4));
  }

  @Test
  void newPool_namesDaemonThreads() throws Exception {
    ExecutorService pool = WorkerThreads.newPool("featureflow-test", 2);
    try {
      Thread worker = pool.submit(Thread::currentThread).get();
      assertTrue(worker.getName().startsWith("featureflow-test-"), worker.getName());
      assertTrue(worker.isDaemon());
    } finally {
      WorkerThreads.shutdown(pool);
    }
    assertTrue(pool.isShutdown());
  }
}
