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
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.errors.PreprocessingException;
import io.fleak.featureflow.api.errors.TransformException;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.transform.TransformFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a transform function to every record of a batch. Records are split into contiguous
 * chunks; results keep the order of the input.
 */
@Slf4j
public class ParallelTransformExecutor implements AutoCloseable {

  private final int parallelism;
  private final ExecutorService executor;

  public ParallelTransformExecutor(int parallelism) {
    Preconditions.checkArgument(parallelism > 0, "transformParallelism must be positive");
    this.parallelism = parallelism;
    this.executor =
        parallelism > 1 ? WorkerThreads.newPool("featureflow-transform", parallelism) : null;
  }

  /**
   * @param records records to transform
   * @param inputIndexes for each record, its position in the submitted batch
   * @throws TransformException if the function fails on any record
   */
  public List<TransformedRecord> transform(
      TransformFunction function,
      ConstantsTable constants,
      List<RecordFeatureData> records,
      List<Integer> inputIndexes)
      throws InterruptedException {
    Preconditions.checkArgument(records.size() == inputIndexes.size());
    int[] bounds = WorkerThreads.shardBounds(records.size(), parallelism);
    int chunks = bounds.length - 1;
    if (executor == null || chunks == 1) {
      return transformRange(function, constants, records, inputIndexes, 0, records.size());
    }

    List<Future<List<TransformedRecord>>> futures = new ArrayList<>(chunks);
    for (int c = 0; c < chunks; c++) {
      int from = bounds[c];
      int to = bounds[c + 1];
      futures.add(
          executor.submit(
              () -> transformRange(function, constants, records, inputIndexes, from, to)));
    }
    List<TransformedRecord> out = new ArrayList<>(records.size());
    try {
      for (Future<List<TransformedRecord>> future : futures) {
        out.addAll(future.get());
      }
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException(e.getCause());
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      throw e;
    }
    return out;
  }

  private static List<TransformedRecord> transformRange(
      TransformFunction function,
      ConstantsTable constants,
      List<RecordFeatureData> records,
      List<Integer> inputIndexes,
      int from,
      int to) {
    List<TransformedRecord> out = new ArrayList<>(to - from);
    for (int i = from; i < to; i++) {
      int inputIndex = inputIndexes.get(i);
      RecordFeatureData output = applyOne(function, constants, records.get(i), inputIndex);
      out.add(new TransformedRecord(inputIndex, output));
    }
    return out;
  }

  static RecordFeatureData applyOne(
      TransformFunction function,
      ConstantsTable constants,
      RecordFeatureData record,
      int inputIndex) {
    try {
      RecordFeatureData output = function.apply(record, constants);
      if (output == null) {
        throw new TransformException(
            inputIndex, null, "transform " + function.name() + " returned no record", null);
      }
      return output;
    } catch (TransformException e) {
      if (e.getRecordIndex() >= 0) {
        throw e;
      }
      throw e.atRecord(inputIndex);
    } catch (PreprocessingException e) {
      throw e;
    } catch (RuntimeException e) {
      log.debug("transform {} failed on record {}", function.name(), inputIndex, e);
      throw new TransformException(
          inputIndex, null, "transform " + function.name() + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    if (executor != null) {
      WorkerThreads.shutdown(executor);
    }
  }
}
