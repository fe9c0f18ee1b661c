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
package io.fleak.featureflow.api.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableMap;
import io.fleak.featureflow.api.errors.SchemaException;
import io.fleak.featureflow.api.structure.ArrayFeatureData;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.NumberFeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.structure.StringFeatureData;
import java.util.*;
import lombok.EqualsAndHashCode;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable, ordered set of {@link FieldSpec}s keyed by field name.
 *
 * <p>A schema is built once, before any record is read, and is shared by the analyze phase, the
 * transform phase and every serving-time call. Fields that a record carries but the schema does
 * not declare are ignored by {@link #validate(RecordFeatureData)}.
 */
@EqualsAndHashCode
public final class Schema {

  private final ImmutableMap<String, FieldSpec> fields;

  private Schema(ImmutableMap<String, FieldSpec> fields) {
    this.fields = fields;
  }

  /**
   * Builds a schema from a field name to spec mapping. A spec may omit its name, in which case the
   * map key is used.
   *
   * @throws SchemaException if a name is blank or disagrees with its key, a spec is missing, or a
   *     type/arity combination cannot be resolved to a storage shape
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Schema build(Map<String, FieldSpec> fieldToSpec) {
    if (fieldToSpec == null || fieldToSpec.isEmpty()) {
      throw new SchemaException(null, "schema declares no fields");
    }
    ImmutableMap.Builder<String, FieldSpec> builder = ImmutableMap.builder();
    for (Map.Entry<String, FieldSpec> entry : fieldToSpec.entrySet()) {
      String key = entry.getKey();
      FieldSpec spec = entry.getValue();
      if (StringUtils.isBlank(key)) {
        throw new SchemaException(key, "field name must not be blank");
      }
      if (spec == null) {
        throw new SchemaException(key, "missing field spec");
      }
      if (spec.getName() != null && !spec.getName().equals(key)) {
        throw new SchemaException(
            key, String.format("spec name '%s' does not match its key", spec.getName()));
      }
      FieldSpec named = spec.getName() == null ? spec.withName(key) : spec;
      checkSpec(named);
      builder.put(key, named);
    }
    return new Schema(builder.build());
  }

  /**
   * Builds a schema from a list of named specs.
   *
   * @throws SchemaException if a name is duplicated or a spec is malformed
   */
  public static Schema of(List<FieldSpec> specs) {
    if (specs == null || specs.isEmpty()) {
      throw new SchemaException(null, "schema declares no fields");
    }
    Map<String, FieldSpec> byName = new LinkedHashMap<>();
    for (FieldSpec spec : specs) {
      if (spec == null) {
        throw new SchemaException(null, "missing field spec");
      }
      if (StringUtils.isBlank(spec.getName())) {
        throw new SchemaException(spec.getName(), "field name must not be blank");
      }
      if (byName.putIfAbsent(spec.getName(), spec) != null) {
        throw new SchemaException(spec.getName(), "duplicate field name");
      }
    }
    return build(byName);
  }

  public static Schema of(FieldSpec... specs) {
    return of(Arrays.asList(specs));
  }

  static void checkSpec(FieldSpec spec) {
    String name = spec.getName();
    if (spec.getValueType() == null) {
      throw new SchemaException(name, "value type is required");
    }
    if (spec.getArity() == null) {
      throw new SchemaException(name, "arity is required");
    }
    Integer length = spec.getLength();
    if (spec.getArity() == Arity.FIXED_VECTOR) {
      if (length == null) {
        throw new SchemaException(name, "FIXED_VECTOR requires a length");
      }
      if (length < 1) {
        throw new SchemaException(name, "vector length must be positive but was " + length);
      }
    } else if (length != null) {
      throw new SchemaException(
          name, String.format("length %d is not supported for arity %s", length, spec.getArity()));
    }
  }

  @JsonValue
  public Map<String, FieldSpec> getFields() {
    return fields;
  }

  public Optional<FieldSpec> field(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public boolean contains(String name) {
    return fields.containsKey(name);
  }

  public Set<String> fieldNames() {
    return fields.keySet();
  }

  public int size() {
    return fields.size();
  }

  /** Two schemas are compatible when they declare the same fields with equal specs. */
  public boolean isCompatibleWith(Schema other) {
    return other != null && fields.equals(other.fields);
  }

  /**
   * Checks required-field presence, value type and shape of every declared field.
   *
   * @return every violation found, empty when the record conforms
   */
  public List<ValidationError> validate(RecordFeatureData record) {
    if (record == null) {
      return List.of(ValidationError.of("*", "record is null"));
    }
    List<ValidationError> errors = new ArrayList<>();
    for (FieldSpec spec : fields.values()) {
      validateValue(spec, record.get(spec.getName()), errors);
    }
    return errors;
  }

  private static void validateValue(FieldSpec spec, FeatureData value, List<ValidationError> out) {
    String name = spec.getName();
    if (value == null) {
      if (spec.isRequired()) {
        out.add(ValidationError.of(name, "missing required field"));
      }
      return;
    }
    switch (spec.getArity()) {
      case FIXED_SCALAR -> {
        if (value instanceof ArrayFeatureData array) {
          out.add(
              ValidationError.of(
                  name, "expected a scalar but got a list of " + array.size() + " values"));
          return;
        }
        typeMismatch(spec.getValueType(), value)
            .ifPresent(reason -> out.add(ValidationError.of(name, reason)));
      }
      case FIXED_VECTOR, VARIABLE_LENGTH -> {
        if (!(value instanceof ArrayFeatureData array)) {
          out.add(ValidationError.of(name, "expected a list but got " + describe(value)));
          return;
        }
        if (spec.getArity() == Arity.FIXED_VECTOR && array.size() != spec.getLength()) {
          out.add(
              ValidationError.of(
                  name,
                  String.format(
                      "expected %d values but got %d", spec.getLength(), array.size())));
          return;
        }
        List<FeatureData> elements = array.getArrayPayload();
        for (int i = 0; i < elements.size(); i++) {
          int index = i;
          typeMismatch(spec.getValueType(), elements.get(i))
              .ifPresent(
                  reason -> out.add(ValidationError.of(name, "element " + index + ": " + reason)));
        }
      }
    }
  }

  private static Optional<String> typeMismatch(ValueType expected, FeatureData value) {
    boolean ok =
        switch (expected) {
          case FLOAT -> value instanceof NumberFeatureData;
          case INT -> value instanceof NumberFeatureData n && n.isIntegral();
          case STRING -> value instanceof StringFeatureData;
        };
    if (ok) {
      return Optional.empty();
    }
    return Optional.of("expected " + expected + " but got " + describe(value));
  }

  static String describe(FeatureData value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof NumberFeatureData n) {
      return n.getNumberType().name();
    }
    if (value instanceof StringFeatureData) {
      return "STRING";
    }
    if (value instanceof ArrayFeatureData) {
      return "list";
    }
    return "record";
  }

  @Override
  public String toString() {
    return "Schema" + fields.values();
  }
}
