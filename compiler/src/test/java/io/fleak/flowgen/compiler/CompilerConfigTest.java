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
package io.fleak.flowgen.compiler;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompilerConfigTest {

  @TempDir Path tempDir;

  @Test
  void testDefaults() {
    CompilerConfig config = CompilerConfig.defaults();
    assertEquals("workflow", config.getProgramName());
    assertFalse(config.isAnnotateNodes());
    assertEquals(config, new CompilerConfig());
  }

  @Test
  void testFromYamlFile() throws Exception {
    Path file = tempDir.resolve("compiler.yml");
    Files.writeString(file, "programName: pipeline\nannotateNodes: true\nunused: 1\n");
    CompilerConfig config = CompilerConfig.fromYamlFile(file);
    assertEquals("pipeline", config.getProgramName());
    assertTrue(config.isAnnotateNodes());
  }

  @Test
  void testPartialYamlKeepsDefaults() throws Exception {
    Path file = tempDir.resolve("partial.yaml");
    Files.writeString(file, "annotateNodes: true\n");
    CompilerConfig config = CompilerConfig.fromYamlFile(file);
    assertEquals("workflow", config.getProgramName());
    assertTrue(config.isAnnotateNodes());
  }

  @Test
  void testMissingFile() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> CompilerConfig.fromYamlFile(tempDir.resolve("absent.yml")));
    assertTrue(e.getMessage().startsWith("failed to read compiler config: "));
  }

  @Test
  void testEffectiveProgramName() {
    assertEquals(
        "a_1", CompilerConfig.builder().programName("a_1").build().getEffectiveProgramName());
    assertEquals(
        "workflow", CompilerConfig.builder().programName("1abc").build().getEffectiveProgramName());
    assertEquals(
        "workflow", CompilerConfig.builder().programName(null).build().getEffectiveProgramName());
  }
}
