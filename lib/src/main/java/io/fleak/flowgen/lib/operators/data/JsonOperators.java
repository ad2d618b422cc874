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
package io.fleak.flowgen.lib.operators.data;

import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.ConfigUtils.getString;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import io.fleak.flowgen.api.CodeGenerator;
import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

public final class JsonOperators {

  public static final String FIELD_KEY = "key";
  public static final String FIELD_VALUE = "value";
  public static final String DEFAULT_KEY = "field";
  public static final String DEFAULT_VALUE = "";

  public static final OperatorDefinition JSON_PARSE =
      OperatorDefinition.builder()
          .name(OPERATOR_JSON_PARSE)
          .category(CATEGORY_DATA)
          .description("Parse JSON string")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(
              (nodeId, config, inputs) ->
                  bindOutput(nodeId, call("json_parse", firstInput(inputs, NULL_LITERAL))))
          .build();

  public static final OperatorDefinition JSON_STRINGIFY =
      OperatorDefinition.builder()
          .name(OPERATOR_JSON_STRINGIFY)
          .category(CATEGORY_DATA)
          .description("Convert value to JSON string")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(
              (nodeId, config, inputs) ->
                  bindOutput(nodeId, call("json_stringify", firstInput(inputs, NULL_LITERAL))))
          .build();

  public static final OperatorDefinition JSON_GET =
      OperatorDefinition.builder()
          .name(OPERATOR_JSON_GET)
          .category(CATEGORY_DATA)
          .description("Get value from JSON object")
          .defaultConfigSupplier(() -> objectNode(FIELD_KEY, DEFAULT_KEY))
          .codeGenerator(getField(NULL_LITERAL))
          .build();

  public static final OperatorDefinition JSON_SET =
      OperatorDefinition.builder()
          .name(OPERATOR_JSON_SET)
          .category(CATEGORY_DATA)
          .description("Set value in JSON object")
          .defaultConfigSupplier(
              () -> objectNode(FIELD_KEY, DEFAULT_KEY, FIELD_VALUE, DEFAULT_VALUE))
          .codeGenerator(setField())
          .build();

  public static final List<OperatorDefinition> ALL =
      List.of(JSON_PARSE, JSON_STRINGIFY, JSON_GET, JSON_SET);

  private JsonOperators() {}

  /** {@code get(<input>, "<key>")}, shared with the object operators. */
  static CodeGenerator getField(String missingInput) {
    return (nodeId, config, inputs) ->
        bindOutput(
            nodeId,
            call(
                "get",
                firstInput(inputs, missingInput),
                stringLiteral(getString(config, FIELD_KEY, DEFAULT_KEY))));
  }

  /** {@code set(<input>, "<key>", "<value>")}; only string values are supported. */
  static CodeGenerator setField() {
    return (nodeId, config, inputs) ->
        bindOutput(
            nodeId,
            call(
                "set",
                firstInput(inputs, EMPTY_OBJECT_LITERAL),
                stringLiteral(getString(config, FIELD_KEY, DEFAULT_KEY)),
                stringLiteral(getString(config, FIELD_VALUE, DEFAULT_VALUE))));
  }
}
