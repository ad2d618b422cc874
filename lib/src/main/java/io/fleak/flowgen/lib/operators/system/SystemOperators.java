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
package io.fleak.flowgen.lib.operators.system;

import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.ConfigUtils.getNonNegativeLong;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

public final class SystemOperators {

  public static final String FIELD_MS = "ms";
  public static final long DEFAULT_MS = 1000;

  /** Pauses, then forwards its input unchanged. */
  public static final OperatorDefinition SLEEP =
      OperatorDefinition.builder()
          .name(OPERATOR_SLEEP)
          .category(CATEGORY_SYSTEM)
          .description("Sleep for milliseconds")
          .defaultConfigSupplier(() -> objectNode(FIELD_MS, DEFAULT_MS))
          .codeGenerator(
              (nodeId, config, inputs) -> {
                long ms = getNonNegativeLong(config, FIELD_MS, DEFAULT_MS);
                return statement(call("sleep", String.valueOf(ms)) + ";")
                    + bindOutput(nodeId, firstInput(inputs, NULL_LITERAL));
              })
          .build();

  public static final OperatorDefinition CAPTURE_SCREEN =
      OperatorDefinition.builder()
          .name(OPERATOR_CAPTURE_SCREEN)
          .category(CATEGORY_SYSTEM)
          .description("Capture screenshot")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator((nodeId, config, inputs) -> bindOutput(nodeId, call("capture_screen")))
          .build();

  public static final List<OperatorDefinition> ALL = List.of(SLEEP, CAPTURE_SCREEN);

  private SystemOperators() {}
}
