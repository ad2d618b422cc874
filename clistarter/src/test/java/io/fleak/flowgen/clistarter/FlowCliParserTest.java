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

import static io.fleak.flowgen.lib.utils.JsonUtils.fromJsonString;
import static org.junit.jupiter.api.Assertions.*;

import io.fleak.flowgen.compiler.CompilerConfig;
import io.fleak.flowgen.lib.dag.FlowGraph;
import io.fleak.flowgen.lib.templates.WorkflowTemplates;
import io.fleak.flowgen.lib.utils.MiscUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowCliParserTest {

  private static FlowGraph expectedHttpFlow() {
    return fromJsonString(MiscUtils.loadStringFromResource("/flow_http.json"), FlowGraph.class);
  }

  @Test
  void parseArgs_loadFlowFromCli() throws ParseException {
    String flowStr = MiscUtils.loadStringFromResource("/flow_http.yml");
    String flowBase64Str = MiscUtils.toBase64String(flowStr.getBytes(StandardCharsets.UTF_8));
    CliRequest request = FlowCliParser.parseArgs(new String[] {"-d", flowBase64Str});
    assertEquals(CliRequest.Action.COMPILE, request.getAction());
    assertEquals(expectedHttpFlow(), request.getGraph());
    assertEquals(CompilerConfig.defaults(), request.getCompilerConfig());
    assertNull(request.getOutputPath());
  }

  @Test
  void parseArgs_loadFlowFromYamlFile(@TempDir Path tempDir) throws IOException, ParseException {
    Path flowFile = tempDir.resolve("flow.yaml");
    Files.writeString(flowFile, MiscUtils.loadStringFromResource("/flow_http.yml"));
    CliRequest request = FlowCliParser.parseArgs(new String[] {"-f", flowFile.toString()});
    assertEquals(expectedHttpFlow(), request.getGraph());
  }

  @Test
  void parseArgs_loadFlowFromJsonFile(@TempDir Path tempDir) throws IOException, ParseException {
    Path flowFile = tempDir.resolve("flow.json");
    Files.writeString(flowFile, MiscUtils.loadStringFromResource("/flow_http.json"));
    Path outFile = tempDir.resolve("out.hlx");
    CliRequest request =
        FlowCliParser.parseArgs(
            new String[] {"--flowFile", flowFile.toString(), "-o", outFile.toString()});
    assertEquals(expectedHttpFlow(), request.getGraph());
    assertEquals(outFile, request.getOutputPath());
  }

  @Test
  void parseArgs_template() throws ParseException {
    CliRequest request = FlowCliParser.parseArgs(new String[] {"-t", "tensor-multiply"});
    assertEquals(WorkflowTemplates.TENSOR_MULTIPLY.create(), request.getGraph());
  }

  @Test
  void parseArgs_compilerConfig(@TempDir Path tempDir) throws IOException, ParseException {
    Path configFile = tempDir.resolve("compiler.yml");
    Files.writeString(configFile, "programName: demo\nannotateNodes: true\n");
    CliRequest request =
        FlowCliParser.parseArgs(
            new String[] {"-t", "math-calculator", "-c", configFile.toString()});
    assertEquals("demo", request.getCompilerConfig().getProgramName());
    assertTrue(request.getCompilerConfig().isAnnotateNodes());
  }

  @Test
  void parseArgs_listActions() throws ParseException {
    assertEquals(
        CliRequest.Action.LIST_OPERATORS,
        FlowCliParser.parseArgs(new String[] {"--list-operators"}).getAction());
    assertEquals(
        CliRequest.Action.LIST_TEMPLATES,
        FlowCliParser.parseArgs(new String[] {"--list-templates"}).getAction());
  }

  @Test
  void parseArgs_noFlow() {
    ParseException e =
        assertThrows(ParseException.class, () -> FlowCliParser.parseArgs(new String[0]));
    assertEquals("no flow provided, use one of -f, -d or -t", e.getMessage());
  }

  @Test
  void parseArgs_badInputs(@TempDir Path tempDir) {
    IllegalArgumentException missing =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                FlowCliParser.parseArgs(
                    new String[] {"-f", tempDir.resolve("none.json").toString()}));
    assertTrue(missing.getMessage().startsWith("failed to load flow from file: "));

    IllegalArgumentException template =
        assertThrows(
            IllegalArgumentException.class,
            () -> FlowCliParser.parseArgs(new String[] {"-t", "nope"}));
    assertEquals("unknown template: nope", template.getMessage());
  }

  @Test
  void isYamlFile() {
    assertTrue(FlowCliParser.isYamlFile("a.yml"));
    assertTrue(FlowCliParser.isYamlFile("A.YAML"));
    assertFalse(FlowCliParser.isYamlFile("a.json"));
  }
}
