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

import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.ConfigUtils.getString;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

/**
 * File system operators. Each one reads a {@code path} field; the write operators also take their
 * first input as the content to write.
 */
public final class FileOperators {

  public static final String FIELD_PATH = "path";

  public static final OperatorDefinition FILE_READ =
      pathOnly(OPERATOR_FILE_READ, "Read file contents", "read_file", "file.txt");

  public static final OperatorDefinition FILE_WRITE =
      withContent(
          OPERATOR_FILE_WRITE,
          "Write file contents",
          "write_file",
          "file.txt",
          EMPTY_STRING_LITERAL);

  public static final OperatorDefinition FILE_EXISTS =
      pathOnly(OPERATOR_FILE_EXISTS, "Check if file exists", "file_exists", "file.txt");

  public static final OperatorDefinition FILE_DELETE =
      pathOnly(OPERATOR_FILE_DELETE, "Delete file", "delete_file", "file.txt");

  public static final OperatorDefinition FILE_LIST =
      pathOnly(OPERATOR_FILE_LIST, "List files in directory", "list_files", ".");

  public static final OperatorDefinition DIR_CREATE =
      pathOnly(OPERATOR_DIR_CREATE, "Create directory", "create_dir", "new_dir");

  public static final OperatorDefinition JSON_READ =
      pathOnly(OPERATOR_JSON_READ, "Read JSON file", "read_json", "data.json");

  public static final OperatorDefinition JSON_WRITE =
      withContent(OPERATOR_JSON_WRITE, "Write JSON file", "write_json", "data.json", NULL_LITERAL);

  public static final List<OperatorDefinition> ALL =
      List.of(
          FILE_READ,
          FILE_WRITE,
          FILE_EXISTS,
          FILE_DELETE,
          FILE_LIST,
          DIR_CREATE,
          JSON_READ,
          JSON_WRITE);

  private FileOperators() {}

  private static OperatorDefinition pathOnly(
      String name, String description, String function, String defaultPath) {
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_FILES)
        .description(description)
        .defaultConfigSupplier(() -> objectNode(FIELD_PATH, defaultPath))
        .codeGenerator(
            (nodeId, config, inputs) ->
                bindOutput(
                    nodeId,
                    call(function, stringLiteral(getString(config, FIELD_PATH, defaultPath)))))
        .build();
  }

  private static OperatorDefinition withContent(
      String name, String description, String function, String defaultPath, String missingContent) {
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_FILES)
        .description(description)
        .defaultConfigSupplier(() -> objectNode(FIELD_PATH, defaultPath))
        .codeGenerator(
            (nodeId, config, inputs) ->
                bindOutput(
                    nodeId,
                    call(
                        function,
                        stringLiteral(getString(config, FIELD_PATH, defaultPath)),
                        firstInput(inputs, missingContent))))
        .build();
  }
}
