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

/**
 * Base of every error the preprocessing engine raises. Identifies the phase, the offending field
 * when there is one, and the reason.
 */
@Getter
public class PreprocessingException extends RuntimeException {
  private final Phase phase;
  private final String field;

  public PreprocessingException(Phase phase, String field, String message) {
    this(phase, field, message, null);
  }

  public PreprocessingException(Phase phase, String field, String message, Throwable cause) {
    super(format(phase, field, message), cause);
    this.phase = phase;
    this.field = field;
  }

  private static String format(Phase phase, String field, String message) {
    if (field == null) {
      return String.format("[%s] %s", phase, message);
    }
    return String.format("[%s] field '%s': %s", phase, field, message);
  }
}
