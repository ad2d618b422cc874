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
package io.fleak.flowgen.lib.operators.convert;

import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

public final class ConvertOperators {

  public static final OperatorDefinition TO_STRING =
      conversion(OPERATOR_TO_STRING, "Convert to string", NULL_LITERAL);

  public static final OperatorDefinition TO_INT =
      conversion(OPERATOR_TO_INT, "Convert to integer", "0");

  public static final OperatorDefinition TO_FLOAT =
      conversion(OPERATOR_TO_FLOAT, "Convert to float", "0");

  public static final List<OperatorDefinition> ALL = List.of(TO_STRING, TO_INT, TO_FLOAT);

  private ConvertOperators() {}

  // the runtime builtin shares the operator name
  private static OperatorDefinition conversion(
      String name, String description, String missingInput) {
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_CONVERT)
        .description(description)
        .defaultConfigSupplier(() -> objectNode())
        .codeGenerator(
            (nodeId, config, inputs) ->
                bindOutput(nodeId, call(name, firstInput(inputs, missingInput))))
        .build();
  }
}
