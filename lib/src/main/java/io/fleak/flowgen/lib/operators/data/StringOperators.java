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

import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

/**
 * String operators. Missing inputs default to the empty string literal.
 *
 * <p>{@code string_concat} joins every resolved input: a single input is passed through as is, two
 * or more are passed as an array literal in edge order.
 */
public final class StringOperators {

  public static final String FIELD_SEPARATOR = "separator";
  public static final String FIELD_DELIMITER = "delimiter";
  public static final String FIELD_FIND = "find";
  public static final String FIELD_REPLACE = "replace";

  public static final OperatorDefinition STRING_CONCAT =
      OperatorDefinition.builder()
          .name(OPERATOR_STRING_CONCAT)
          .category(CATEGORY_DATA)
          .description("Concatenate strings")
          .defaultConfigSupplier(() -> objectNode(FIELD_SEPARATOR, ""))
          .codeGenerator(
              (nodeId, config, inputs) -> {
                String operand =
                    inputs.size() > 1
                        ? arrayLiteral(inputs)
                        : firstInput(inputs, EMPTY_STRING_LITERAL);
                return bindOutput(
                    nodeId,
                    call("concat", operand, stringLiteral(getString(config, FIELD_SEPARATOR, ""))));
              })
          .build();

  public static final OperatorDefinition STRING_UPPER =
      unary(OPERATOR_STRING_UPPER, "Convert to uppercase", "to_upper");

  public static final OperatorDefinition STRING_LOWER =
      unary(OPERATOR_STRING_LOWER, "Convert to lowercase", "to_lower");

  public static final OperatorDefinition STRING_TRIM =
      unary(OPERATOR_STRING_TRIM, "Trim whitespace", "trim");

  public static final OperatorDefinition STRING_SPLIT =
      OperatorDefinition.builder()
          .name(OPERATOR_STRING_SPLIT)
          .category(CATEGORY_DATA)
          .description("Split string into array")
          .defaultConfigSupplier(() -> objectNode(FIELD_DELIMITER, ","))
          .codeGenerator(
              (nodeId, config, inputs) ->
                  unsupported(nodeId, OPERATOR_STRING_SPLIT, EMPTY_ARRAY_LITERAL))
          .build();

  public static final OperatorDefinition STRING_REPLACE =
      OperatorDefinition.builder()
          .name(OPERATOR_STRING_REPLACE)
          .category(CATEGORY_DATA)
          .description("Replace substring")
          .defaultConfigSupplier(() -> objectNode(FIELD_FIND, "", FIELD_REPLACE, ""))
          .codeGenerator(
              (nodeId, config, inputs) ->
                  unsupported(
                      nodeId, OPERATOR_STRING_REPLACE, firstInput(inputs, EMPTY_STRING_LITERAL)))
          .build();

  public static final OperatorDefinition STRING_LENGTH =
      unary(OPERATOR_STRING_LENGTH, "Get string length", "strlen");

  public static final List<OperatorDefinition> ALL =
      List.of(
          STRING_CONCAT,
          STRING_UPPER,
          STRING_LOWER,
          STRING_TRIM,
          STRING_SPLIT,
          STRING_REPLACE,
          STRING_LENGTH);

  private StringOperators() {}

  private static OperatorDefinition unary(String name, String description, String function) {
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_DATA)
        .description(description)
        .defaultConfigSupplier(() -> objectNode())
        .codeGenerator(
            (nodeId, config, inputs) ->
                bindOutput(nodeId, call(function, firstInput(inputs, EMPTY_STRING_LITERAL))))
        .build();
  }
}
