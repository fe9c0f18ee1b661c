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
package io.fleak.featureflow.api.transform;

import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.schema.Schema;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import java.util.Optional;
import java.util.Set;

/**
 * A per-record mapping from input fields and analyzer constants to output fields.
 *
 * <p>Implementations must be pure: no state is carried between calls and two calls with equal
 * arguments return equal records. Full-pass aggregation is only available through the analyzers
 * returned by {@link #analyzers()}; the pipeline runs exactly those before the first call to
 * {@link #apply(RecordFeatureData, ConstantsTable)}.
 */
public interface TransformFunction {

  /** Stable name. Stored in frozen artifacts to find the function again at serving time. */
  String name();

  /** The analyzers whose constants {@link #apply} reads. */
  Set<AnalyzerSpec> analyzers();

  RecordFeatureData apply(RecordFeatureData record, ConstantsTable constants);

  /**
   * Declares the schema of the records {@link #apply} returns, when it can be known from the
   * input schema alone. Without a declaration the output schema is inferred from the transformed
   * batch, where lists of differing lengths come out as VARIABLE_LENGTH and a field whose lists are
   * all empty cannot be typed. Functions whose output shape must not depend on the batch should
   * declare it here.
   */
  default Optional<Schema> declareOutputSchema(Schema inputSchema) {
    return Optional.empty();
  }
}
