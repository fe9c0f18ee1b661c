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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import io.fleak.featureflow.api.transform.TransformFunction;
import io.fleak.featureflow.api.transform.TransformFunctionProvider;
import io.fleak.featureflow.lib.transform.DeclarativeTransformFunction;
import java.util.HashMap;
import java.util.Map;
import java.util.ServiceLoader;
import lombok.extern.slf4j.Slf4j;

/** Turns a {@link TransformReference} back into a {@link TransformFunction}. */
@Slf4j
public class TransformFunctionResolver {

  private final Map<String, TransformFunction> namedFunctions;

  /** Discovers named functions through {@link ServiceLoader}. */
  public TransformFunctionResolver() {
    this(loadTransformFunctions());
  }

  @VisibleForTesting
  public TransformFunctionResolver(Map<String, TransformFunction> namedFunctions) {
    this.namedFunctions = ImmutableMap.copyOf(namedFunctions);
  }

  public static Map<String, TransformFunction> loadTransformFunctions() {
    Map<String, TransformFunction> aggregated = new HashMap<>();
    ServiceLoader<TransformFunctionProvider> loader =
        ServiceLoader.load(TransformFunctionProvider.class);

    log.info("Discovering transform function providers...");
    for (TransformFunctionProvider provider : loader) {
      String providerName = provider.getClass().getName();
      log.info("Loading transform functions from provider: {}", providerName);
      try {
        Map<String, TransformFunction> functions = provider.getTransformFunctions();
        if (functions == null) {
          continue;
        }
        functions.forEach(
            (key, value) -> {
              if (aggregated.containsKey(key)) {
                throw new IllegalStateException("Duplicate transform function detected: " + key);
              }
              log.info("Loading transform function: {}", key);
              aggregated.put(key, value);
            });
      } catch (Exception e) {
        log.error(
            "Failed to load transform functions from provider {}: {}",
            providerName,
            e.getMessage());
        throw e;
      }
    }
    return aggregated;
  }

  /**
   * @throws IllegalArgumentException if a named function is not registered
   */
  public TransformFunction resolve(TransformReference reference) {
    if (reference instanceof TransformReference.Declarative declarative) {
      return new DeclarativeTransformFunction(declarative.definition());
    }
    String name = reference.transformName();
    TransformFunction function = namedFunctions.get(name);
    if (function == null) {
      throw new IllegalArgumentException(
          String.format(
              "transform function %s is not registered, known functions: %s",
              name, namedFunctions.keySet()));
    }
    return function;
  }
}
