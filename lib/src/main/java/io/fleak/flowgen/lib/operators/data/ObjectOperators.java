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
import static io.fleak.flowgen.lib.operators.data.JsonOperators.*;
import static io.fleak.flowgen.lib.utils.ConfigUtils.getString;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;

/** Object operators. Missing inputs default to the empty object literal. */
public final class ObjectOperators {

  public static final OperatorDefinition OBJECT_GET =
      OperatorDefinition.builder()
          .name(OPERATOR_OBJECT_GET)
          .category(CATEGORY_DATA)
          .description("Get object property")
          .defaultConfigSupplier(() -> objectNode(FIELD_KEY, DEFAULT_KEY))
          .codeGenerator(getField(EMPTY_OBJECT_LITERAL))
          .build();

  public static final OperatorDefinition OBJECT_SET =
      OperatorDefinition.builder()
          .name(OPERATOR_OBJECT_SET)
          .category(CATEGORY_DATA)
          .description("Set object property")
          .defaultConfigSupplier(
              () -> objectNode(FIELD_KEY, DEFAULT_KEY, FIELD_VALUE, DEFAULT_VALUE))
          .codeGenerator(setField())
          .build();

  public static final OperatorDefinition OBJECT_KEYS =
      OperatorDefinition.builder()
          .name(OPERATOR_OBJECT_KEYS)
          .category(CATEGORY_DATA)
          .description("Get object keys")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(
              (nodeId, config, inputs) ->
                  bindOutput(nodeId, call("keys", firstInput(inputs, EMPTY_OBJECT_LITERAL))))
          .build();

  public static final OperatorDefinition OBJECT_VALUES =
      OperatorDefinition.builder()
          .name(OPERATOR_OBJECT_VALUES)
          .category(CATEGORY_DATA)
          .description("Get object values")
          .defaultConfigSupplier(() -> objectNode())
          .codeGenerator(
              (nodeId, config, inputs) ->
                  bindOutput(nodeId, call("values", firstInput(inputs, EMPTY_OBJECT_LITERAL))))
          .build();

  public static final OperatorDefinition OBJECT_HAS_KEY =
      OperatorDefinition.builder()
          .name(OPERATOR_OBJECT_HAS_KEY)
          .category(CATEGORY_DATA)
          .description("Check if object has key")
          .defaultConfigSupplier(() -> objectNode(FIELD_KEY, DEFAULT_KEY))
          .codeGenerator(
              (nodeId, config, inputs) ->
                  bindOutput(
                      nodeId,
                      call(
                          "has_key",
                          firstInput(inputs, EMPTY_OBJECT_LITERAL),
                          stringLiteral(getString(config, FIELD_KEY, DEFAULT_KEY)))))
          .build();

  public static final List<OperatorDefinition> ALL =
      List.of(OBJECT_GET, OBJECT_SET, OBJECT_KEYS, OBJECT_VALUES, OBJECT_HAS_KEY);

  private ObjectOperators() {}
}
