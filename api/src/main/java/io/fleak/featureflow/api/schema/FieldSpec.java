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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Declaration of one field: value type, shape and presence constraint. */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldSpec {
  String name;
  ValueType valueType;
  @Builder.Default Arity arity = Arity.FIXED_SCALAR;

  /** Vector length, only set for {@link Arity#FIXED_VECTOR}. */
  Integer length;

  @Builder.Default boolean required = true;

  public static FieldSpec scalar(String name, ValueType valueType) {
    return FieldSpec.builder().name(name).valueType(valueType).build();
  }

  public static FieldSpec vector(String name, ValueType valueType, int length) {
    return FieldSpec.builder()
        .name(name)
        .valueType(valueType)
        .arity(Arity.FIXED_VECTOR)
        .length(length)
        .build();
  }

  public static FieldSpec variableLength(String name, ValueType valueType) {
    return FieldSpec.builder()
        .name(name)
        .valueType(valueType)
        .arity(Arity.VARIABLE_LENGTH)
        .build();
  }

  public FieldSpec optional() {
    return toBuilder().required(false).build();
  }

  public FieldSpec withName(String newName) {
    return toBuilder().name(newName).build();
  }

  @JsonIgnore
  public boolean isScalar() {
    return arity == Arity.FIXED_SCALAR;
  }

  @Override
  public String toString() {
    String shape =
        switch (arity) {
          case FIXED_SCALAR -> "";
          case FIXED_VECTOR -> "[" + length + "]";
          case VARIABLE_LENGTH -> "[]";
        };
    return name + ":" + valueType + shape + (required ? "" : "?");
  }
}
