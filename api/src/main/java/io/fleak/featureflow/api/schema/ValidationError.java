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

/**
 * One reason a record does not conform to a {@link Schema}.
 *
 * @param recordIndex position of the record in its batch, -1 for a single serving-time record
 * @param field offending field
 * @param reason human readable reason
 */
public record ValidationError(int recordIndex, String field, String reason) {

  public static ValidationError of(String field, String reason) {
    return new ValidationError(-1, field, reason);
  }

  public ValidationError atRecord(int index) {
    return new ValidationError(index, field, reason);
  }

  @Override
  public String toString() {
    String prefix = recordIndex >= 0 ? "record " + recordIndex + ", " : "";
    return prefix + "field '" + field + "': " + reason;
  }
}
