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
package io.fleak.flowgen.lib.operators.files;

import static io.fleak.flowgen.lib.operators.files.FileOperators.*;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class FileOperatorsTest {

  @Test
  void testPathOnlyOperators() {
    assertEquals(
        "    let r_out = read_file(\"input.txt\");\n",
        FILE_READ.generateCode("r", objectNode("path", "input.txt"), List.of("ignored_out")));
    assertEquals(
        "    let r_out = file_exists(\"file.txt\");\n",
        FILE_EXISTS.generateCode("r", null, List.of()));
    assertEquals(
        "    let r_out = delete_file(\"file.txt\");\n",
        FILE_DELETE.generateCode("r", null, List.of()));
    assertEquals(
        "    let r_out = list_files(\".\");\n", FILE_LIST.generateCode("r", null, List.of()));
    assertEquals(
        "    let r_out = create_dir(\"new_dir\");\n",
        DIR_CREATE.generateCode("r", null, List.of()));
    assertEquals(
        "    let r_out = read_json(\"data.json\");\n",
        JSON_READ.generateCode("r", null, List.of()));
  }

  @Test
  void testWriteOperatorsTakeContentFromInput() {
    assertEquals(
        "    let w_out = write_file(\"output.txt\", u_out);\n",
        FILE_WRITE.generateCode("w", objectNode("path", "output.txt"), List.of("u_out")));
    assertEquals(
        "    let w_out = write_file(\"file.txt\", \"\");\n",
        FILE_WRITE.generateCode("w", null, List.of()));
    assertEquals(
        "    let w_out = write_json(\"results.json\", g_out);\n",
        JSON_WRITE.generateCode("w", objectNode("path", "results.json"), List.of("g_out")));
    assertEquals(
        "    let w_out = write_json(\"data.json\", null);\n",
        JSON_WRITE.generateCode("w", null, List.of()));
  }

  @Test
  void testWindowsPathIsEscaped() {
    assertEquals(
        "    let r_out = read_file(\"C:\\\\data\\\\in.txt\");\n",
        FILE_READ.generateCode("r", objectNode("path", "C:\\data\\in.txt"), List.of()));
  }
}
