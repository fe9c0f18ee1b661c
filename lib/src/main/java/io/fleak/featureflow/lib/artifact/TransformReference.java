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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.fleak.featureflow.api.transform.TransformFunction;
import io.fleak.featureflow.lib.transform.DeclarativeTransformFunction;
import io.fleak.featureflow.lib.transform.TransformDefinition;

/**
 * How a frozen artifact finds its transform function again. Declarative transforms are stored
 * inline; any other function is stored by name and looked up through a {@link
 * io.fleak.featureflow.api.transform.TransformFunctionProvider}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = TransformReference.Declarative.class, name = "declarative"),
  @JsonSubTypes.Type(value = TransformReference.Named.class, name = "named"),
})
public interface TransformReference {

  String transformName();

  static TransformReference of(TransformFunction function) {
    if (function instanceof DeclarativeTransformFunction declarative) {
      return new Declarative(declarative.getDefinition());
    }
    return new Named(function.name());
  }

  record Declarative(TransformDefinition definition) implements TransformReference {
    public Declarative {
      definition = definition == null ? null : definition.copy();
    }

    @Override
    public TransformDefinition definition() {
      return definition == null ? null : definition.copy();
    }

    @Override
    public String transformName() {
      return definition.getName();
    }
  }

  record Named(String name) implements TransformReference {
    @Override
    public String transformName() {
      return name;
    }
  }
}
