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
package io.fleak.featureflow.lib.metadata;

import io.fleak.featureflow.api.errors.MetadataException;
import io.fleak.featureflow.api.schema.FieldSpec;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.schema.ValidationError;
import io.fleak.featureflow.api.schema.ValueType;
import io.fleak.featureflow.api.structure.ArrayFeatureData;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.NumberFeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.structure.StringFeatureData;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives the schema of transformed records.
 *
 * <p>A declared schema is checked against every record. Without one, each field's spec is inferred
 * from its values: numbers give INT or FLOAT scalars, strings give STRING scalars and lists give a
 * {@code FIXED_VECTOR} of their element type. Lists whose lengths differ across records, or that
 * are sometimes empty, give a {@code VARIABLE_LENGTH} field instead. A field that some records lack
 * is optional.
 */
@Slf4j
public class OutputSchemaDeriver {

  public Schema derive(Optional<Schema> declared, List<RecordFeatureData> outputs) {
    if (declared.isPresent()) {
      return check(declared.get(), outputs);
    }
    return infer(outputs);
  }

  Schema check(Schema declared, List<RecordFeatureData> outputs) {
    for (int i = 0; i < outputs.size(); i++) {
      RecordFeatureData record = outputs.get(i);
      for (String key : record.getPayload().keySet()) {
        if (!declared.contains(key)) {
          throw new MetadataException(
              key, String.format("record %d has a field the transform did not declare", i));
        }
      }
      List<ValidationError> errors = declared.validate(record);
      if (!errors.isEmpty()) {
        ValidationError first = errors.get(0);
        throw new MetadataException(
            first.field(),
            String.format("record %d does not match the declared output: %s", i, first.reason()));
      }
    }
    return declared;
  }

  Schema infer(List<RecordFeatureData> outputs) {
    if (outputs.isEmpty()) {
      throw new MetadataException(null, "cannot infer an output schema from an empty batch");
    }
    Map<String, Shape> shapes = new LinkedHashMap<>();
    Map<String, Integer> seenCount = new LinkedHashMap<>();
    for (int i = 0; i < outputs.size(); i++) {
      for (Map.Entry<String, FeatureData> entry : outputs.get(i).getPayload().entrySet()) {
        if (entry.getValue() == null) {
          continue;
        }
        String key = entry.getKey();
        Shape shape = inferShape(key, entry.getValue(), i);
        Shape previous = shapes.get(key);
        shapes.put(key, previous == null ? shape : previous.merge(shape, key, i));
        seenCount.merge(key, 1, Integer::sum);
      }
    }
    if (shapes.isEmpty()) {
      throw new MetadataException(null, "the transform produced no output fields");
    }
    Map<String, FieldSpec> result = new LinkedHashMap<>();
    shapes.forEach(
        (key, shape) -> {
          FieldSpec spec = shape.toFieldSpec(key);
          boolean everywhere = seenCount.get(key) == outputs.size();
          result.put(key, everywhere ? spec : spec.optional());
        });
    Schema schema = Schema.build(result);
    log.debug("inferred output schema {} from {} records", schema, outputs.size());
    return schema;
  }

  private static Shape inferShape(String key, FeatureData value, int recordIndex) {
    if (value instanceof ArrayFeatureData array) {
      ValueType elementType = null;
      for (FeatureData element : array.getArrayPayload()) {
        ValueType type = scalarType(key, element, recordIndex);
        if (elementType != null && elementType != type) {
          throw new MetadataException(
              key,
              String.format(
                  "record %d mixes %s and %s elements in one list",
                  recordIndex, elementType, type));
        }
        elementType = type;
      }
      return new Shape(elementType, true, array.size());
    }
    return new Shape(scalarType(key, value, recordIndex), false, 0);
  }

  private static ValueType scalarType(String key, FeatureData value, int recordIndex) {
    if (value instanceof NumberFeatureData n) {
      return n.isIntegral() ? ValueType.INT : ValueType.FLOAT;
    }
    if (value instanceof StringFeatureData) {
      return ValueType.STRING;
    }
    throw new MetadataException(
        key,
        String.format(
            "record %d has a value that is not a number, string or list of them", recordIndex));
  }

  /**
   * What the records seen so far say about one key. {@code type} is null while only empty lists
   * were seen; {@code length} is -1 once list lengths disagree.
   */
  private record Shape(ValueType type, boolean list, int length) {

    Shape merge(Shape other, String key, int recordIndex) {
      boolean typesClash = type != null && other.type != null && type != other.type;
      if (list != other.list || typesClash) {
        throw new MetadataException(
            key,
            String.format(
                "inconsistent output: record %d has %s but earlier records have %s",
                recordIndex, other, this));
      }
      return new Shape(
          type != null ? type : other.type, list, length == other.length ? length : -1);
    }

    FieldSpec toFieldSpec(String key) {
      if (type == null) {
        throw new MetadataException(
            key, "every list for this field is empty, its element type cannot be inferred");
      }
      if (!list) {
        return FieldSpec.scalar(key, type);
      }
      return length > 0 ? FieldSpec.vector(key, type, length) : FieldSpec.variableLength(key, type);
    }

    @Override
    public String toString() {
      if (!list) {
        return String.valueOf(type);
      }
      return type + (length >= 0 ? "[" + length + "]" : "[]");
    }
  }
}
