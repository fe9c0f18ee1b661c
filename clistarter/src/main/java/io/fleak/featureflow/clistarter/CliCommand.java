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
package io.fleak.featureflow.clistarter;

import java.nio.file.Path;

/** A parsed command line. */
public interface CliCommand {

  /**
   * {@code analyze}: run a pipeline over a training batch and write the frozen artifact.
   *
   * @param configFile optional pipeline config, null for defaults
   * @param outputFile optional destination of the transformed batch, null to skip it
   */
  record Analyze(
      Path schemaFile,
      Path transformFile,
      Path inputFile,
      Path artifactFile,
      Path configFile,
      Path outputFile)
      implements CliCommand {}

  /**
   * {@code apply}: transform records with a frozen artifact.
   *
   * @param outputFile destination, null for standard output
   */
  record Apply(Path artifactFile, Path inputFile, Path outputFile) implements CliCommand {}
}
