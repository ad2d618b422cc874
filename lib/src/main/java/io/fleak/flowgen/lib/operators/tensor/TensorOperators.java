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
package io.fleak.flowgen.lib.operators.tensor;

import static io.fleak.flowgen.api.VariableNames.scratchVariable;
import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.ConfigUtils.*;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleak.flowgen.api.CodeGenerator;
import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;
import java.util.Locale;

/**
 * Tensor operators backed by the runtime's GPU builtins.
 *
 * <p>{@code tensor_create} allocates a 2D tensor into the scratch variable {@code <id>_t} and
 * writes the configured values, row-major, through the data slot {@code <id>_data}. The binary
 * operators need exactly their first two inputs; with fewer they emit a diagnostic and bind null.
 */
public final class TensorOperators {

  public static final String FIELD_ROWS = "rows";
  public static final String FIELD_COLS = "cols";
  public static final String FIELD_VALUES = "values";
  public static final String FIELD_OP = "op";

  public static final long DEFAULT_ROWS = 2;
  public static final long DEFAULT_COLS = 2;
  public static final String DEFAULT_OP = "dot";

  /** Index of the flat data buffer inside a tensor handle. */
  static final int DATA_SLOT = 2;

  static final String DATA_SUFFIX = "_data";

  private static final CodeGenerator MATMUL_GENERATOR = binaryTensor("tensor_matmul");
  private static final CodeGenerator ADD_GENERATOR = binaryTensor("tensor_add");

  public static final OperatorDefinition TENSOR_CREATE =
      OperatorDefinition.builder()
          .name(OPERATOR_TENSOR_CREATE)
          .category(CATEGORY_ML)
          .description("Create 2D tensor")
          .defaultConfigSupplier(
              () ->
                  objectNode(
                      FIELD_ROWS,
                      DEFAULT_ROWS,
                      FIELD_COLS,
                      DEFAULT_COLS,
                      FIELD_VALUES,
                      List.of(1.0, 0.0, 0.0, 1.0)))
          .codeGenerator(TensorOperators::createTensor)
          .build();

  public static final OperatorDefinition TENSOR_MATMUL =
      OperatorDefinition.builder()
          .name(OPERATOR_TENSOR_MATMUL)
          .category(CATEGORY_ML)
          .description("Matrix multiplication")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(MATMUL_GENERATOR)
          .build();

  public static final OperatorDefinition TENSOR_ADD =
      OperatorDefinition.builder()
          .name(OPERATOR_TENSOR_ADD)
          .category(CATEGORY_ML)
          .description("Element-wise tensor addition")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(ADD_GENERATOR)
          .build();

  public static final OperatorDefinition TENSOR_OP =
      OperatorDefinition.builder()
          .name(OPERATOR_TENSOR_OP)
          .category(CATEGORY_ML)
          .description("Binary tensor operation selected by 'op' (dot, matmul, add)")
          .defaultConfigSupplier(() -> objectNode(FIELD_OP, DEFAULT_OP))
          .codeGenerator(
              (nodeId, config, inputs) -> {
                String op = getString(config, FIELD_OP, DEFAULT_OP).trim().toLowerCase(Locale.ROOT);
                return switch (op) {
                  case "dot", "matmul" -> MATMUL_GENERATOR.generate(nodeId, config, inputs);
                  case "add" -> ADD_GENERATOR.generate(nodeId, config, inputs);
                  default ->
                      comment("unknown tensor op: " + op) + bindOutput(nodeId, NULL_LITERAL);
                };
              })
          .build();

  public static final List<OperatorDefinition> ALL =
      List.of(TENSOR_CREATE, TENSOR_MATMUL, TENSOR_ADD, TENSOR_OP);

  private TensorOperators() {}

  private static String createTensor(String nodeId, JsonNode config, List<String> inputs) {
    String tensor = scratchVariable(nodeId);
    String data = nodeId + DATA_SUFFIX;
    StringBuilder code = new StringBuilder();
    code.append(
        bind(
            tensor,
            call(
                "tensor_new_2d",
                String.valueOf(getNonNegativeLong(config, FIELD_ROWS, DEFAULT_ROWS)),
                String.valueOf(getNonNegativeLong(config, FIELD_COLS, DEFAULT_COLS)))));
    List<JsonNode> values = getArray(config, FIELD_VALUES).orElse(List.of());
    if (!values.isEmpty()) {
      code.append(bind(data, tensor + "[" + DATA_SLOT + "]"));
      for (int i = 0; i < values.size(); i++) {
        JsonNode value = values.get(i);
        double number = value != null && value.isNumber() ? value.doubleValue() : 0.0;
        code.append(statement(data + "[" + i + "] = " + doubleLiteral(number) + ";"));
      }
    }
    code.append(bindOutput(nodeId, tensor));
    return code.toString();
  }

  private static CodeGenerator binaryTensor(String function) {
    return (nodeId, config, inputs) -> {
      if (inputs.size() < 2) {
        return comment(function + " needs two tensor inputs, got " + inputs.size())
            + bindOutput(nodeId, NULL_LITERAL);
      }
      return bindOutput(nodeId, call(function, inputs.get(0), inputs.get(1)));
    };
  }
}
