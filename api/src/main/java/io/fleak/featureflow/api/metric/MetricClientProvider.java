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
package io.fleak.featureflow.api.metric;

import java.util.Map;

public interface MetricClientProvider extends AutoCloseable {

  FleakCounter counter(String name, Map<String, String> tags);

  FleakStopWatch stopWatch(String name, Map<String, String> tags);

  @Override
  void close();

  class NoopMetricClientProvider implements MetricClientProvider {

    @Override
    public FleakCounter counter(String name, Map<String, String> tags) {
      return new NoopFleakCounter();
    }

    @Override
    public FleakStopWatch stopWatch(String name, Map<String, String> tags) {
      return new NoopStopWatch();
    }

    @Override
    public void close() {
      // no-op
    }

    public static class NoopFleakCounter implements FleakCounter {
      @Override
      public void increase(Map<String, String> additionalTags) {
        // no-op
      }

      @Override
      public void increase(long n, Map<String, String> additionalTags) {
        // no-op
      }
    }

    public static class NoopStopWatch extends FleakStopWatch {
      @Override
      protected void reportDuration(long duration, Map<String, String> additionalTags) {
        // no-op
      }
    }
  }
}
