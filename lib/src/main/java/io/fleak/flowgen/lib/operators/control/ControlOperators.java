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
package io.fleak.flowgen.lib.operators.control;

import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

/** Program entry and debugging operators. */
public final class ControlOperators {

  /** Name of the entry function's single positional parameter. */
  public static final String ENTRY_PARAMETER = "input";

  public static final OperatorDefinition START =
      OperatorDefinition.builder()
          .name(OPERATOR_START)
          .category(CATEGORY_CONTROL)
          .description("Entry point for workflow")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator((nodeId, config, inputs) -> bindOutput(nodeId, ENTRY_PARAMETER))
          .build();

  public static final OperatorDefinition PRINT =
      OperatorDefinition.builder()
          .name(OPERATOR_PRINT)
          .category(CATEGORY_DEBUG)
          .description("Print value to console")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(
              (nodeId, config, inputs) -> {
                String input = firstInput(inputs, NULL_LITERAL);
                return statement(call("print", input) + ";") + bindOutput(nodeId, input);
              })
          .build();

  public static final List<OperatorDefinition> ALL = List.of(START, PRINT);

  private ControlOperators() {}
}
