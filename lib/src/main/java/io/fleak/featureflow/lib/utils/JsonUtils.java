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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.fleak.featureflow.api.structure.*;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import org.apache.commons.lang3.StringUtils;

public abstract class JsonUtils {
  public static final ObjectMapper OBJECT_MAPPER;

  static {
    OBJECT_MAPPER = new ObjectMapper();
    OBJECT_MAPPER.registerModule(new JavaTimeModule());
    OBJECT_MAPPER.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    SimpleModule featureDataModule = new SimpleModule("FeatureDataModule");
    featureDataModule.addSerializer(FeatureData.class, new FeatureDataSerializer());
    featureDataModule.addDeserializer(FeatureData.class, new FeatureDataDeserializer());
    OBJECT_MAPPER.registerModule(featureDataModule);
  }

  public static String toJsonString(Object object) {
    if (Objects.isNull(object)) {
      return null;
    }
    try {
      return OBJECT_MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static String toPrettyJsonString(Object object) {
    if (Objects.isNull(object)) {
      return null;
    }
    try {
      return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJsonString(String jsonStr, TypeReference<T> typeReference) {
    if (Objects.isNull(jsonStr)) {
      return null;
    }
    try {
      return OBJECT_MAPPER.readValue(jsonStr, typeReference);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJsonString(String jsonStr, Class<T> clz) {
    if (Objects.isNull(jsonStr)) {
      return null;
    }
    try {
      return OBJECT_MAPPER.readValue(jsonStr, clz);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  /** Parses one JSON object into a record. */
  public static RecordFeatureData toRecord(String jsonObjectStr) {
    FeatureData data = fromJsonString(jsonObjectStr, FeatureData.class);
    if (!(data instanceof RecordFeatureData record)) {
      throw new IllegalArgumentException("expected a JSON object but got: " + jsonObjectStr);
    }
    return record;
  }

  /** Reads newline delimited JSON objects. Blank lines are skipped. */
  public static List<RecordFeatureData> readJsonLines(Reader reader) throws IOException {
    List<RecordFeatureData> records = new ArrayList<>();
    BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
    String line;
    int lineNumber = 0;
    while ((line = br.readLine()) != null) {
      lineNumber++;
      if (StringUtils.isBlank(line)) {
        continue;
      }
      try {
        records.add(toRecord(line));
      } catch (RuntimeException e) {
        throw new IOException("failed to parse JSON line " + lineNumber + ": " + line, e);
      }
    }
    return records;
  }

  public static List<RecordFeatureData> readJsonLines(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return readJsonLines(reader);
    }
  }

  public static void writeJsonLines(Collection<RecordFeatureData> records, Writer writer) {
    records.forEach(
        r -> {
          try {
            writer.write(toJsonString(r));
            writer.write('\n');
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        });
  }
}
