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

import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import lombok.Getter;

/** An analyzer precondition was violated. Fatal to the batch. */
@Getter
public class AnalyzerException extends PreprocessingException {
  private final Kind kind;
  private final AnalyzerSpec analyzerSpec;

  public AnalyzerException(Kind kind, AnalyzerSpec analyzerSpec, String message) {
    super(
        Phase.ANALYZING,
        analyzerSpec == null ? null : analyzerSpec.field(),
        String.format("%s %s: %s", kind, analyzerSpec, message));
    this.kind = kind;
    this.analyzerSpec = analyzerSpec;
  }

  public enum Kind {
    EMPTY_INPUT,
    TYPE_MISMATCH,
    UNSUPPORTED_FIELD
  }
}
