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
package io.fleak.flowgen.clistarter;

import static io.fleak.flowgen.lib.utils.MiscUtils.fromBase64String;

import io.fleak.flowgen.compiler.CompilerConfig;
import io.fleak.flowgen.lib.dag.FlowGraph;
import io.fleak.flowgen.lib.templates.WorkflowTemplate;
import io.fleak.flowgen.lib.templates.WorkflowTemplates;
import io.fleak.flowgen.lib.utils.JsonUtils;
import io.fleak.flowgen.lib.utils.YamlUtils;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.*;
import org.apache.commons.lang3.StringUtils;

@Slf4j
public class FlowCliParser {
  private static final Options CLI_OPTIONS;

  private static final Option FLOW_FILE_OPT =
      Option.builder("f")
          .longOpt("flowFile")
          .desc("path to the flow document (.json, .yml or .yaml)")
          .hasArg()
          .build();

  private static final Option FLOW_OPT =
      Option.builder("d").longOpt("flow").desc("base64 encoded flow document").hasArg().build();

  private static final Option TEMPLATE_OPT =
      Option.builder("t").longOpt("template").desc("compile a built-in template").hasArg().build();

  private static final Option CONFIG_OPT =
      Option.builder("c")
          .longOpt("config")
          .desc("path to the compiler config yaml")
          .hasArg()
          .build();

  private static final Option OUTPUT_OPT =
      Option.builder("o").longOpt("output").desc("write the program to this file").hasArg().build();

  private static final Option LIST_OPERATORS_OPT =
      Option.builder().longOpt("list-operators").desc("list available operators").build();

  private static final Option LIST_TEMPLATES_OPT =
      Option.builder().longOpt("list-templates").desc("list built-in templates").build();

  static {
    CLI_OPTIONS = new Options();
    CLI_OPTIONS
        .addOption(FLOW_FILE_OPT)
        .addOption(FLOW_OPT)
        .addOption(TEMPLATE_OPT)
        .addOption(CONFIG_OPT)
        .addOption(OUTPUT_OPT)
        .addOption(LIST_OPERATORS_OPT)
        .addOption(LIST_TEMPLATES_OPT);
  }

  public static CliRequest parseArgs(String[] args) throws ParseException {
    CommandLineParser commandLineParser = new DefaultParser();
    CommandLine commandLine = commandLineParser.parse(CLI_OPTIONS, args);

    if (commandLine.hasOption(LIST_OPERATORS_OPT.getLongOpt())) {
      return CliRequest.builder().action(CliRequest.Action.LIST_OPERATORS).build();
    }
    if (commandLine.hasOption(LIST_TEMPLATES_OPT.getLongOpt())) {
      return CliRequest.builder().action(CliRequest.Action.LIST_TEMPLATES).build();
    }

    CompilerConfig compilerConfig =
        getOptionalCommandArgValue(
            commandLine,
            "c",
            c -> CompilerConfig.fromYamlFile(Path.of(c)),
            CompilerConfig.defaults());
    Path outputPath = getOptionalCommandArgValue(commandLine, "o", o -> Path.of(o), null);

    return CliRequest.builder()
        .action(CliRequest.Action.COMPILE)
        .graph(getGraph(commandLine))
        .compilerConfig(compilerConfig)
        .outputPath(outputPath)
        .build();
  }

  private static FlowGraph getGraph(CommandLine commandLine) throws ParseException {
    // base64 document (-d) first
    FlowGraph graph =
        getOptionalCommandArgValue(
            commandLine,
            "d",
            d -> {
              if (StringUtils.isBlank(d)) {
                return null;
              }
              try {
                String flowStr = new String(fromBase64String(d), StandardCharsets.UTF_8);
                // YAML is a superset of JSON
                return YamlUtils.fromYamlString(flowStr, FlowGraph.class);
              } catch (Exception e) {
                throw new IllegalArgumentException(
                    "failed to convert -d argument into a flow: " + d, e);
              }
            },
            null);
    if (graph != null) {
      return graph;
    }

    graph =
        getOptionalCommandArgValue(
            commandLine,
            "f",
            f -> {
              if (StringUtils.isBlank(f)) {
                return null;
              }
              try {
                String flowStr = Files.readString(Path.of(f));
                log.debug("read content from flow file {}:\n{}", f, flowStr);
                return isYamlFile(f)
                    ? YamlUtils.fromYamlString(flowStr, FlowGraph.class)
                    : JsonUtils.fromJsonString(flowStr, FlowGraph.class);
              } catch (Exception e) {
                throw new IllegalArgumentException("failed to load flow from file: " + f, e);
              }
            },
            null);
    if (graph != null) {
      return graph;
    }

    graph =
        getOptionalCommandArgValue(
            commandLine,
            "t",
            t ->
                WorkflowTemplates.find(t)
                    .map(WorkflowTemplate::create)
                    .orElseThrow(() -> new IllegalArgumentException("unknown template: " + t)),
            null);
    if (graph != null) {
      return graph;
    }
    throw new ParseException("no flow provided, use one of -f, -d or -t");
  }

  static boolean isYamlFile(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    return lower.endsWith(".yml") || lower.endsWith(".yaml");
  }

  static <T> T getOptionalCommandArgValue(
      CommandLine cmd, String argName, Function<String, T> func, T defaultValue) {
    if (!cmd.hasOption(argName)) {
      return defaultValue;
    }
    String value = cmd.getOptionValue(argName);
    return func.apply(value);
  }

  public static void printUsage(String prog) {
    HelpFormatter formatter = new HelpFormatter();
    String header = "Options:";
    String footer = "\n";
    formatter.printHelp(prog, header, CLI_OPTIONS, footer, true);
  }
}
