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
package io.fleak.flowgen.lib.operators.http;

import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;
import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.ConfigUtils.getString;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import io.fleak.flowgen.api.CodeGenerator;
import io.fleak.flowgen.api.OperatorDefinition;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * HTTP operators. All of them lower to the runtime builtin {@code http_request(method, url, body,
 * headers)}; headers are always empty.
 */
public final class HttpOperators {

  public static final String FIELD_URL = "url";
  public static final String FIELD_METHOD = "method";
  public static final String DEFAULT_URL = "https://example.com";
  public static final String DEFAULT_METHOD = "GET";

  public static final OperatorDefinition HTTP_GET =
      fixedMethod(OPERATOR_HTTP_GET, "HTTP GET request", "GET", false);

  public static final OperatorDefinition HTTP_POST =
      fixedMethod(OPERATOR_HTTP_POST, "HTTP POST request", "POST", true);

  public static final OperatorDefinition HTTP_PUT =
      fixedMethod(OPERATOR_HTTP_PUT, "HTTP PUT request", "PUT", true);

  public static final OperatorDefinition HTTP_DELETE =
      fixedMethod(OPERATOR_HTTP_DELETE, "HTTP DELETE request", "DELETE", false);

  public static final OperatorDefinition HTTP_REQUEST =
      OperatorDefinition.builder()
          .name(OPERATOR_HTTP_REQUEST)
          .category(CATEGORY_HTTP)
          .description("Custom HTTP request")
          .defaultConfigSupplier(
              () -> objectNode(FIELD_METHOD, DEFAULT_METHOD, FIELD_URL, DEFAULT_URL))
          .codeGenerator(
              (nodeId, config, inputs) -> {
                String method = getString(config, FIELD_METHOD, DEFAULT_METHOD);
                if (StringUtils.isBlank(method)) {
                  method = DEFAULT_METHOD;
                }
                return request(
                    nodeId,
                    method.trim().toUpperCase(Locale.ROOT),
                    getString(config, FIELD_URL, DEFAULT_URL),
                    firstInput(inputs, NULL_LITERAL));
              })
          .build();

  public static final List<OperatorDefinition> ALL =
      List.of(HTTP_GET, HTTP_POST, HTTP_PUT, HTTP_DELETE, HTTP_REQUEST);

  private HttpOperators() {}

  private static OperatorDefinition fixedMethod(
      String name, String description, String method, boolean sendsBody) {
    CodeGenerator generator =
        (nodeId, config, inputs) ->
            request(
                nodeId,
                method,
                getString(config, FIELD_URL, DEFAULT_URL),
                sendsBody ? firstInput(inputs, NULL_LITERAL) : NULL_LITERAL);
    return OperatorDefinition.builder()
        .name(name)
        .category(CATEGORY_HTTP)
        .description(description)
        .defaultConfigSupplier(() -> objectNode(FIELD_URL, DEFAULT_URL))
        .codeGenerator(generator)
        .build();
  }

  private static String request(String nodeId, String method, String url, String body) {
    return bindOutput(
        nodeId,
        call(
            "http_request",
            stringLiteral(method),
            stringLiteral(url),
            body,
            EMPTY_OBJECT_LITERAL));
  }
}
