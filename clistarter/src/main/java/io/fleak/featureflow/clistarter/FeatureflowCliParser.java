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
import java.util.Arrays;
import java.util.function.Function;
import org.apache.commons.cli.*;

public class FeatureflowCliParser {
  static final String COMMAND_ANALYZE = "analyze";
  static final String COMMAND_APPLY = "apply";

  private static final Option SCHEMA_OPT =
      Option.builder("s")
          .longOpt("schema")
          .desc("path to the input schema yaml/json file")
          .hasArg()
          .required()
          .build();

  private static final Option TRANSFORM_OPT =
      Option.builder("t")
          .longOpt("transform")
          .desc("path to the transform definition yaml/json file")
          .hasArg()
          .required()
          .build();

  private static final Option INPUT_OPT =
      Option.builder("i")
          .longOpt("input")
          .desc("path to the input records, one JSON object per line")
          .hasArg()
          .required()
          .build();

  private static final Option ARTIFACT_OUT_OPT =
      Option.builder("o")
          .longOpt("artifact")
          .desc("where to write the frozen artifact")
          .hasArg()
          .required()
          .build();

  private static final Option ARTIFACT_IN_OPT =
      Option.builder("a")
          .longOpt("artifact")
          .desc("path to a frozen artifact")
          .hasArg()
          .required()
          .build();

  private static final Option CONFIG_OPT =
      Option.builder("c")
          .longOpt("config")
          .desc("path to the pipeline config yaml")
          .hasArg()
          .build();

  private static final Option OUTPUT_OPT =
      Option.builder()
          .longOpt("output")
          .desc("where to write transformed records, one JSON object per line")
          .hasArg()
          .build();

  static final Options ANALYZE_OPTIONS =
      new Options()
          .addOption(SCHEMA_OPT)
          .addOption(TRANSFORM_OPT)
          .addOption(INPUT_OPT)
          .addOption(ARTIFACT_OUT_OPT)
          .addOption(CONFIG_OPT)
          .addOption(OUTPUT_OPT);

  static final Options APPLY_OPTIONS =
      new Options().addOption(ARTIFACT_IN_OPT).addOption(INPUT_OPT).addOption(OUTPUT_OPT);

  public static CliCommand parseArgs(String[] args) throws ParseException {
    if (args == null || args.length == 0) {
      throw new ParseException(
          "missing command, expected " + COMMAND_ANALYZE + " or " + COMMAND_APPLY);
    }
    String command = args[0];
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    CommandLineParser commandLineParser = new DefaultParser();
    switch (command) {
      case COMMAND_ANALYZE -> {
        CommandLine cmd = commandLineParser.parse(ANALYZE_OPTIONS, rest);
        return new CliCommand.Analyze(
            Path.of(cmd.getOptionValue("s")),
            Path.of(cmd.getOptionValue("t")),
            Path.of(cmd.getOptionValue("i")),
            Path.of(cmd.getOptionValue("o")),
            getOptionalCommandArgValue(cmd, "c", Path::of, null),
            getOptionalCommandArgValue(cmd, "output", Path::of, null));
      }
      case COMMAND_APPLY -> {
        CommandLine cmd = commandLineParser.parse(APPLY_OPTIONS, rest);
        return new CliCommand.Apply(
            Path.of(cmd.getOptionValue("a")),
            Path.of(cmd.getOptionValue("i")),
            getOptionalCommandArgValue(cmd, "output", Path::of, null));
      }
      default -> throw new ParseException("unknown command: " + command);
    }
  }

  static <T> T getOptionalCommandArgValue(
      CommandLine cmd, String argName, Function<String, T> func, T defaultValue) {
    if (!cmd.hasOption(argName)) {
      return defaultValue;
    }
    return func.apply(cmd.getOptionValue(argName));
  }

  public static void printUsage(String prog) {
    HelpFormatter formatter = new HelpFormatter();
    String footer = "\n";
    formatter.printHelp(prog + " " + COMMAND_ANALYZE, "Options:", ANALYZE_OPTIONS, footer, true);
    formatter.printHelp(prog + " " + COMMAND_APPLY, "Options:", APPLY_OPTIONS, footer, true);
  }
}
