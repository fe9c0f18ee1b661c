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

/** A pipeline operation was called in a state that does not allow it. */
@Getter
public class PipelineStateException extends PreprocessingException {
  private final Kind kind;

  public PipelineStateException(Kind kind, String message) {
    super(Phase.STATE, null, kind + ": " + message);
    this.kind = kind;
  }

  public enum Kind {
    ALREADY_FROZEN,
    NOT_FROZEN,
    FAILED
  }
}
