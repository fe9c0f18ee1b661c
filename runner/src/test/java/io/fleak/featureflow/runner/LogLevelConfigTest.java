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

import static org.junit.jupiter.api.Assertions.*;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LogLevelConfigTest {

  private static final String FEATUREFLOW_LOGGER = PreprocessingPipeline.LOGGER_NAME;

  @AfterEach
  void resetLogLevel() {
    Configurator.setLevel(FEATUREFLOW_LOGGER, Level.INFO);
  }

  @Test
  void testApplyLogLevel_setsDebugLevel() {
    PreprocessingPipeline.applyLogLevel(PipelineConfig.builder().logLevel("debug").build());
    assertEquals(Level.DEBUG, LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel());
  }

  @Test
  void testApplyLogLevel_caseInsensitive() {
    PreprocessingPipeline.applyLogLevel(PipelineConfig.builder().logLevel("WARN").build());
    assertEquals(Level.WARN, LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel());
  }

  @Test
  void testApplyLogLevel_nullLogLevel_noChange() {
    Level before = LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel();
    PreprocessingPipeline.applyLogLevel(PipelineConfig.defaults());
    assertEquals(before, LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel());
  }

  @Test
  void testApplyLogLevel_nullConfig_noException() {
    Level before = LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel();
    assertDoesNotThrow(() -> PreprocessingPipeline.applyLogLevel(null));
    assertEquals(before, LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel());
  }

  @Test
  void testApplyLogLevel_invalidLevel_noChange() {
    Level before = LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel();
    PreprocessingPipeline.applyLogLevel(
        PipelineConfig.builder().logLevel("notavalidlevel").build());
    assertEquals(before, LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel());
  }

  @Test
  void testApplyLogLevel_blankString_noChange() {
    Level before = LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel();
    PreprocessingPipeline.applyLogLevel(PipelineConfig.builder().logLevel("  ").build());
    assertEquals(before, LogManager.getLogger(FEATUREFLOW_LOGGER).getLevel());
  }
}
