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

import io.fleak.featureflow.api.structure.ArrayFeatureData;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.NumberFeatureData;
import io.fleak.featureflow.api.structure.StringFeatureData;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleConsumer;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.Collectors;

/** Element level access to scalar and vector feature values. */
public interface FeatureValues {

  /**
   * Calls {@code consumer} with every number in {@code value}: once for a scalar, once per
   * element for a vector.
   *
   * @throws IllegalArgumentException if a non-numeric element is found
   */
  static void forEachNumber(FeatureData value, DoubleConsumer consumer) {
    if (value instanceof ArrayFeatureData array) {
      for (FeatureData element : array.getArrayPayload()) {
        consumer.accept(toDouble(element));
      }
      return;
    }
    consumer.accept(toDouble(value));
  }

  /**
   * Returns every categorical term in {@code value}. INT numbers are turned into their decimal
   * text.
   *
   * @throws IllegalArgumentException for FLOAT numbers and other non-categorical values
   */
  static List<String> terms(FeatureData value) {
    if (value instanceof ArrayFeatureData array) {
      List<String> out = new ArrayList<>(array.size());
      for (FeatureData element : array.getArrayPayload()) {
        out.add(toTerm(element));
      }
      return out;
    }
    return List.of(toTerm(value));
  }

  static double toDouble(FeatureData value) {
    if (value instanceof NumberFeatureData n) {
      return n.getNumberValue();
    }
    throw new IllegalArgumentException("expected a number but got: " + describe(value));
  }

  static String toTerm(FeatureData value) {
    if (value instanceof StringFeatureData s) {
      return s.getStringValue();
    }
    if (value instanceof NumberFeatureData n && n.isIntegral()) {
      return Long.toString(n.getLongValue());
    }
    throw new IllegalArgumentException("expected a categorical value but got: " + describe(value));
  }

  /** Applies {@code op} to a scalar, or element-wise to a vector, producing FLOAT numbers. */
  static FeatureData mapNumbers(FeatureData value, DoubleUnaryOperator op) {
    if (value instanceof ArrayFeatureData array) {
      return new ArrayFeatureData(
          array.getArrayPayload().stream()
              .map(e -> (FeatureData) NumberFeatureData.ofFloat(op.applyAsDouble(toDouble(e))))
              .collect(Collectors.toList()));
    }
    return NumberFeatureData.ofFloat(op.applyAsDouble(toDouble(value)));
  }

  /**
   * Combines two numeric values element-wise. A scalar operand is broadcast over a vector operand;
   * two vectors must have the same length. The result is FLOAT.
   */
  static FeatureData combine(FeatureData left, FeatureData right, DoubleBinaryOperator op) {
    boolean leftVector = left instanceof ArrayFeatureData;
    boolean rightVector = right instanceof ArrayFeatureData;
    if (!leftVector && !rightVector) {
      return NumberFeatureData.ofFloat(op.applyAsDouble(toDouble(left), toDouble(right)));
    }
    if (leftVector && rightVector) {
      List<FeatureData> l = left.getArrayPayload();
      List<FeatureData> r = right.getArrayPayload();
      if (l.size() != r.size()) {
        throw new IllegalArgumentException(
            String.format("vector lengths differ: %d and %d", l.size(), r.size()));
      }
      List<FeatureData> out = new ArrayList<>(l.size());
      for (int i = 0; i < l.size(); i++) {
        out.add(
            NumberFeatureData.ofFloat(op.applyAsDouble(toDouble(l.get(i)), toDouble(r.get(i)))));
      }
      return new ArrayFeatureData(out);
    }
    if (leftVector) {
      double scalar = toDouble(right);
      return mapNumbers(left, v -> op.applyAsDouble(v, scalar));
    }
    double scalar = toDouble(left);
    return mapNumbers(right, v -> op.applyAsDouble(scalar, v));
  }

  static String describe(FeatureData value) {
    return value == null ? "null" : JsonUtils.toJsonString(value);
  }
}
