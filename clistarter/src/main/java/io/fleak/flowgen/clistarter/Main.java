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

import static io.fleak.flowgen.lib.utils.JsonUtils.toJsonString;

import io.fleak.flowgen.api.GraphStructureException;
import io.fleak.flowgen.api.OperatorDefinition;
import io.fleak.flowgen.compiler.CompiledProgram;
import io.fleak.flowgen.compiler.FlowCompiler;
import io.fleak.flowgen.lib.catalog.OperatorRegistry;
import io.fleak.flowgen.lib.templates.WorkflowTemplate;
import io.fleak.flowgen.lib.templates.WorkflowTemplates;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

@Slf4j
public class Main {
  static final String PROGRAM_NAME = "flowgen";

  static final int EXIT_OK = 0;
  static final int EXIT_USAGE = 1;
  static final int EXIT_INVALID_GRAPH = 2;

  public static void main(String[] args) throws Exception {
    int status = run(args, System.out, System.err);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) throws IOException {
    CliRequest request;
    try {
      request = FlowCliParser.parseArgs(args);
    } catch (ParseException cliParseException) {
      err.println(cliParseException.getMessage());
      FlowCliParser.printUsage(PROGRAM_NAME);
      return EXIT_USAGE;
    } catch (IllegalArgumentException e) {
      log.error("invalid input: {}", e.getMessage());
      err.println(e.getMessage());
      return EXIT_USAGE;
    }

    return switch (request.getAction()) {
      case LIST_OPERATORS -> {
        listOperators(out);
        yield EXIT_OK;
      }
      case LIST_TEMPLATES -> {
        listTemplates(out);
        yield EXIT_OK;
      }
      case COMPILE -> compile(request, out, err);
    };
  }

  private static int compile(CliRequest request, PrintStream out, PrintStream err)
      throws IOException {
    FlowCompiler compiler = new FlowCompiler(OperatorRegistry.DEFAULT, request.getCompilerConfig());
    CompiledProgram program;
    try {
      program = compiler.compile(request.getGraph());
    } catch (GraphStructureException e) {
      err.println(e.getErrorType() + ": " + e.getMessage());
      return EXIT_INVALID_GRAPH;
    }
    program.warnings().forEach(w -> err.println("warning: " + w));

    if (request.getOutputPath() == null) {
      out.print(program.text());
      out.flush();
    } else {
      Files.writeString(request.getOutputPath(), program.text(), StandardCharsets.UTF_8);
      log.info("wrote program to {}", request.getOutputPath());
    }
    return EXIT_OK;
  }

  private static void listOperators(PrintStream out) {
    for (OperatorDefinition definition : OperatorRegistry.DEFAULT.all()) {
      out.printf(
          "%-16s %-8s %-32s %s%n",
          definition.name(),
          definition.category(),
          definition.description(),
          toJsonString(definition.defaultConfig()));
    }
  }

  private static void listTemplates(PrintStream out) {
    for (WorkflowTemplate template : WorkflowTemplates.ALL) {
      out.printf(
          "%-18s %-20s %-8s %s%n",
          template.id(), template.name(), template.category(), template.description());
    }
  }
}
