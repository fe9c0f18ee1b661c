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
package io.fleak.featureflow.lib.artifact;

import io.fleak.featureflow.api.analyzer.AnalyzerSpec;
import io.fleak.featureflow.api.analyzer.ConstantsTable;
import io.fleak.featureflow.api.structure.FeatureData;
import io.fleak.featureflow.api.structure.RecordFeatureData;
import io.fleak.featureflow.api.transform.TransformFunction;
import io.fleak.featureflow.api.transform.TransformFunctionProvider;
import java.util.Map;
import java.util.Set;

/** Registered through META-INF/services for the resolver tests. */
public class SampleTransformFunctionProvider implements TransformFunctionProvider {

  public static final String X_MINUS_MEAN = "x_minus_mean";

  @Override
  public Map<String, TransformFunction> getTransformFunctions() {
    return Map.of(X_MINUS_MEAN, new XMinusMean());
  }

  static class XMinusMean implements TransformFunction {
    private static final AnalyzerSpec MEAN = AnalyzerSpec.mean("x");

    @Override
    public String name() {
      return X_MINUS_MEAN;
    }

    @Override
    public Set<AnalyzerSpec> analyzers() {
      return Set.of(MEAN);
    }

    @Override
    public RecordFeatureData apply(RecordFeatureData record, ConstantsTable constants) {
      double x = record.get("x").getNumberValue();
      return FeatureData.record(Map.of("x_minus_mean", x - constants.scalar(MEAN)));
    }
  }
}
