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
import static io.fleak.flowgen.lib.utils.ConfigUtils.getLong;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;
import java.util.function.Supplier;

public final class ArrayOperators {

  public static final String FIELD_START = "start";
  public static final String FIELD_END = "end";
  public static final long DEFAULT_START = 0;
  public static final long DEFAULT_END = 10;

  // higher order array functions need lambdas, which the runtime lacks
  public static final OperatorDefinition ARRAY_MAP =
      unsupportedOperator(
          OPERATOR_ARRAY_MAP, "Map function over array", () -> objectNode("function", ""), false);

  public static final OperatorDefinition ARRAY_FILTER =
      unsupportedOperator(
          OPERATOR_ARRAY_FILTER, "Filter array elements", () -> objectNode("condition", ""), false);

  public static final OperatorDefinition ARRAY_REDUCE =
      OperatorDefinition.builder()
          .name(OPERATOR_ARRAY_REDUCE)
          .category(CATEGORY_DATA)
          .description("Reduce array to single value")
          .defaultConfigSupplier(() -> objectNode("initial", 0))
          .codeGenerator(
              (nodeId, config, inputs) -> unsupported(nodeId, OPERATOR_ARRAY_REDUCE, NULL_LITERAL))
          .build();

  public static final OperatorDefinition ARRAY_SLICE =
      OperatorDefinition.builder()
          .name(OPERATOR_ARRAY_SLICE)
          .category(CATEGORY_DATA)
          .description("Slice array")
          .defaultConfigSupplier(
              () -> objectNode(FIELD_START, DEFAULT_START, FIELD_END, DEFAULT_END))
          .codeGenerator(
              (nodeId, config, inputs) ->
                  bindOutput(
                      nodeId,
                      call(
                          "arr_slice",
                          firstInput(inputs, EMPTY_ARRAY_LITERAL),
                          String.valueOf(getLong(config, FIELD_START, DEFAULT_START)),
                          String.valueOf(getLong(config, FIELD_END, DEFAULT_END)))))
          .build();

  public static final OperatorDefinition ARRAY_CONCAT =
      OperatorDefinition.builder()
          .name(OPERATOR_ARRAY_CONCAT)
          .category(CATEGORY_DATA)
          .description("Concatenate arrays")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(
              (nodeId, config, inputs) -> {
                if (inputs.size() < 2) {
                  return bindOutput(
                      nodeId,
                      call(
                          "arr_concat",
                          firstInput(inputs, EMPTY_ARRAY_LITERAL),
                          EMPTY_ARRAY_LITERAL));
                }
                String expression = inputs.get(0);
                for (String input : inputs.subList(1, inputs.size())) {
                  expression = call("arr_concat", expression, input);
                }
                return bindOutput(nodeId, expression);
              })
          .build();

  public static final OperatorDefinition ARRAY_SORT =
      unsupportedOperator(
          OPERATOR_ARRAY_SORT, "Sort array", () -> objectNode("order", "asc"), true);

  public static final OperatorDefinition ARRAY_LENGTH =
      OperatorDefinition.builder()
          .name(OPERATOR_ARRAY_LENGTH)
          .category(CATEGORY_DATA)
          .description("Get array length")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(
              (nodeId, config, inputs) ->
                  bindOutput(nodeId, call("len", firstInput(inputs, EMPTY_ARRAY_LITERAL))))
          .build();

  public static final List<OperatorDefinition> ALL =
      List.of(
          ARRAY_MAP,
          ARRAY_FILTER,
          ARRAY_REDUCE,
          ARRAY_SLICE,
          ARRAY_CONCAT,
          ARRAY_SORT,
          ARRAY_LENGTH);

  private ArrayOperators() {}

  /**
   * @param passThrough when true the first input (or {@code []}) is bound unchanged, otherwise
   *     the empty array is bound
   */
  private static OperatorDefinition unsupportedOperator(
      String name, String description, Supplier<JsonNode> defaults, boolean passThrough) {
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_DATA)
        .description(description)
        .defaultConfigSupplier(defaults)
        .codeGenerator(
            (nodeId, config, inputs) ->
                unsupported(
                    nodeId,
                    name,
                    passThrough ? firstInput(inputs, EMPTY_ARRAY_LITERAL) : EMPTY_ARRAY_LITERAL))
        .build();
  }
}
