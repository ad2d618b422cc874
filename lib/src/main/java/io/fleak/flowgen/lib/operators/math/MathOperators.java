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
package io.fleak.flowgen.lib.operators.math;

import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.ConfigUtils.field;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

/**
 * Arithmetic operators.
 *
 * <p>The binary operators combine their input with the configured {@code value}. When a node has
 * two or more inputs the configured value is ignored and the inputs are joined with the operator in
 * edge order, e.g. {@code a_out - b_out - c_out}.
 */
public final class MathOperators {

  public static final String FIELD_VALUE = "value";

  public static final OperatorDefinition MATH_ADD =
      binary(OPERATOR_MATH_ADD, "Add two numbers", "+", 0);

  public static final OperatorDefinition MATH_SUBTRACT =
      binary(OPERATOR_MATH_SUBTRACT, "Subtract two numbers", "-", 0);

  public static final OperatorDefinition MATH_MULTIPLY =
      binary(OPERATOR_MATH_MULTIPLY, "Multiply two numbers", "*", 1);

  public static final OperatorDefinition MATH_DIVIDE =
      binary(OPERATOR_MATH_DIVIDE, "Divide two numbers", "/", 1);

  public static final OperatorDefinition MATH_FLOOR =
      unary(OPERATOR_MATH_FLOOR, "Floor of number", "floor");

  public static final OperatorDefinition MATH_CEIL =
      unary(OPERATOR_MATH_CEIL, "Ceiling of number", "ceil");

  public static final OperatorDefinition MATH_ROUND =
      unary(OPERATOR_MATH_ROUND, "Round number", "round");

  public static final OperatorDefinition MATH_SQRT =
      unary(OPERATOR_MATH_SQRT, "Square root", "sqrt");

  public static final OperatorDefinition MATH_RANDOM =
      OperatorDefinition.builder()
          .name(OPERATOR_MATH_RANDOM)
          .category(CATEGORY_MATH)
          .description("Random number (0-1)")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator((nodeId, config, inputs) -> bindOutput(nodeId, call("random")))
          .build();

  public static final List<OperatorDefinition> ALL =
      List.of(
          MATH_ADD,
          MATH_SUBTRACT,
          MATH_MULTIPLY,
          MATH_DIVIDE,
          MATH_FLOOR,
          MATH_CEIL,
          MATH_ROUND,
          MATH_SQRT,
          MATH_RANDOM);

  private MathOperators() {}

  /**
   * Renders the configured operand. Integral numbers print without a fraction, other numbers as
   * doubles; anything else yields the identity element.
   */
  static String numericLiteral(JsonNode config, long identity) {
    JsonNode value = field(config, FIELD_VALUE);
    if (value == null || !value.isNumber()) {
      return String.valueOf(identity);
    }
    if (value.isIntegralNumber() && value.canConvertToLong()) {
      return String.valueOf(value.longValue());
    }
    return doubleLiteral(value.doubleValue());
  }

  private static OperatorDefinition binary(
      String name, String description, String operator, long identity) {
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_MATH)
        .description(description)
        .defaultConfigSupplier(() -> objectNode(FIELD_VALUE, identity))
        .codeGenerator(
            (nodeId, config, inputs) -> {
              String glue = " " + operator + " ";
              if (inputs.size() > 1) {
                return bindOutput(nodeId, String.join(glue, inputs));
              }
              return bindOutput(
                  nodeId,
                  firstInput(inputs, String.valueOf(identity))
                      + glue
                      + numericLiteral(config, identity));
            })
        .build();
  }

  private static OperatorDefinition unary(String name, String description, String function) {
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_MATH)
        .description(description)
        .defaultConfigSupplier(() -> objectNode())
        .codeGenerator(
            (nodeId, config, inputs) -> bindOutput(nodeId, call(function, firstInput(inputs, "0"))))
        .build();
  }
}
