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

import static io.fleak.featureflow.lib.utils.MiscUtils.*;

import com.google.common.annotations.VisibleForTesting;
import io.fleak.featureflow.api.metric.FleakCounter;
import io.fleak.featureflow.api.metric.FleakStopWatch;
import io.fleak.featureflow.api.metric.MetricClientProvider;
import java.util.Map;

public record PipelineCounters(
    FleakCounter inputRecordCounter,
    FleakCounter invalidRecordCounter,
    FleakCounter analyzedRecordCounter,
    FleakCounter transformedRecordCounter,
    FleakCounter servedRecordCounter,
    FleakCounter servingErrorCounter,
    FleakStopWatch analyzeStopWatch,
    FleakStopWatch transformStopWatch) {

  public void increaseInputRecordCounter(long n) {
    inputRecordCounter.increase(n, Map.of());
  }

  public void increaseInvalidRecordCounter(long n) {
    invalidRecordCounter.increase(n, Map.of());
  }

  public void increaseAnalyzedRecordCounter(long n) {
    analyzedRecordCounter.increase(n, Map.of());
  }

  public void increaseTransformedRecordCounter(long n) {
    transformedRecordCounter.increase(n, Map.of());
  }

  public void increaseServedRecordCounter() {
    servedRecordCounter.increase(Map.of());
  }

  public void increaseServingErrorCounter() {
    servingErrorCounter.increase(Map.of());
  }

  @VisibleForTesting
  public static PipelineCounters createPipelineCounters(
      MetricClientProvider metricClientProvider, Map<String, String> metricTags) {
    return new PipelineCounters(
        metricClientProvider.counter(METRIC_NAME_INPUT_RECORD_COUNT, metricTags),
        metricClientProvider.counter(METRIC_NAME_INVALID_RECORD_COUNT, metricTags),
        metricClientProvider.counter(METRIC_NAME_ANALYZED_RECORD_COUNT, metricTags),
        metricClientProvider.counter(METRIC_NAME_TRANSFORMED_RECORD_COUNT, metricTags),
        metricClientProvider.counter(METRIC_NAME_SERVED_RECORD_COUNT, metricTags),
        metricClientProvider.counter(METRIC_NAME_SERVING_ERROR_COUNT, metricTags),
        metricClientProvider.stopWatch(METRIC_NAME_ANALYZE_TIME_MILLIS, metricTags),
        metricClientProvider.stopWatch(METRIC_NAME_TRANSFORM_TIME_MILLIS, metricTags));
  }
}
