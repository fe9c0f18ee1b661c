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
package io.fleak.featureflow.lib.utils;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.*;
import lombok.NonNull;
import org.apache.commons.io.IOUtils;

public interface MiscUtils {

  String METRIC_NAME_INPUT_RECORD_COUNT = "input_record_count";
  String METRIC_NAME_INVALID_RECORD_COUNT = "invalid_record_count";
  String METRIC_NAME_ANALYZED_RECORD_COUNT = "analyzed_record_count";
  String METRIC_NAME_TRANSFORMED_RECORD_COUNT = "transformed_record_count";
  String METRIC_NAME_SERVED_RECORD_COUNT = "served_record_count";
  String METRIC_NAME_SERVING_ERROR_COUNT = "serving_error_count";
  String METRIC_NAME_ANALYZE_TIME_MILLIS = "analyze_time_millis";
  String METRIC_NAME_TRANSFORM_TIME_MILLIS = "transform_time_millis";

  String METRIC_TAG_PIPELINE_ID = "pipeline_id";
  String METRIC_TAG_TRANSFORM_NAME = "transform_name";

  String REGEX_WINDOWS_LINE_SEPARATOR = "\\r\\n";
  String REGEX_LINUX_LINE_SEPARATOR = "\n";

  static String loadStringFromResource(String resourceName) {
    try (InputStream in = MiscUtils.class.getResourceAsStream(resourceName)) {
      Preconditions.checkNotNull(in, "resource not found: %s", resourceName);
      return IOUtils.toString(in, StandardCharsets.UTF_8)
          .replaceAll(REGEX_WINDOWS_LINE_SEPARATOR, REGEX_LINUX_LINE_SEPARATOR);
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }

  static String generateRandomHash() {
    return new BigInteger(128, new SecureRandom()).toString(32).substring(0, 16);
  }

  static Map<String, String> basicPipelineMetricTags(
      Map<String, String> configuredTags, String pipelineId, String transformName) {
    Map<String, String> metricTags =
        new HashMap<>(Optional.ofNullable(configuredTags).orElse(Map.of()));
    metricTags.put(METRIC_TAG_PIPELINE_ID, pipelineId);
    metricTags.put(METRIC_TAG_TRANSFORM_NAME, transformName);
    return metricTags;
  }

  static <T extends Enum<T>> T parseEnum(@NonNull Class<T> enumType, @NonNull String enumStr) {
    try {
      return Enum.valueOf(enumType, enumStr.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid value for enum " + enumType.getSimpleName() + ": " + enumStr, e);
    }
  }
}
