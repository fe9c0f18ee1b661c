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
package io.fleak.featureflow.api.errors;

import lombok.Getter;

/** The transform function failed on a record. */
@Getter
public class TransformException extends PreprocessingException {
  private final int recordIndex;
  private final String reason;

  public TransformException(String field, String message) {
    this(-1, field, message, null);
  }

  public TransformException(int recordIndex, String field, String message, Throwable cause) {
    super(
        Phase.TRANSFORMING,
        field,
        recordIndex >= 0 ? "record " + recordIndex + ": " + message : message,
        cause);
    this.recordIndex = recordIndex;
    this.reason = message;
  }

  /** Returns the same failure attributed to the record at {@code index} of a batch. */
  public TransformException atRecord(int index) {
    return new TransformException(index, getField(), reason, getCause());
  }
}
