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

import io.fleak.featureflow.api.schema.ValidationError;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/** One or more records do not conform to the input schema. Carries every collected error. */
@Getter
public class ValidationException extends PreprocessingException {
  private final List<ValidationError> errors;

  public ValidationException(List<ValidationError> errors) {
    super(Phase.VALIDATION, errors.isEmpty() ? null : errors.get(0).field(), summarize(errors));
    this.errors = List.copyOf(errors);
  }

  private static String summarize(List<ValidationError> errors) {
    int shown = Math.min(errors.size(), 10);
    String head =
        errors.subList(0, shown).stream()
            .map(ValidationError::toString)
            .collect(Collectors.joining("; "));
    if (shown < errors.size()) {
      head += String.format(" (and %d more)", errors.size() - shown);
    }
    return errors.size() + " validation error(s): " + head;
  }
}
