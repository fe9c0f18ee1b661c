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
package io.fleak.featureflow.runner;

import io.fleak.featureflow.api.schema.ValidationError;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.lib.artifact.FrozenArtifact;
import java.util.List;

/**
 * Outcome of a successful {@link PreprocessingPipeline#run}.
 *
 * @param artifact the frozen artifact
 * @param records transformed records in input order
 * @param skipped validation errors of the records left out in LENIENT mode
 */
public record PipelineResult(
    FrozenArtifact artifact, List<TransformedRecord> records, List<ValidationError> skipped) {

  public List<RecordFeatureData> outputs() {
    return records.stream().map(TransformedRecord::output).toList();
  }
}
