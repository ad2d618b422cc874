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

import static io.fleak.flowgen.lib.operators.http.HttpOperators.*;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class HttpOperatorsTest {

  @Test
  void testGetIgnoresInput() {
    assertEquals(
        "    let h_out = http_request(\"GET\", \"https://api.github.com/users/octocat\","
            + " null, {});\n",
        HTTP_GET.generateCode(
            "h", objectNode("url", "https://api.github.com/users/octocat"), List.of("x_out")));
  }

  @Test
  void testPostSendsFirstInputAsBody() {
    assertEquals(
        "    let h_out = http_request(\"POST\", \"https://example.com\", body_out, {});\n",
        HTTP_POST.generateCode("h", objectNode(), List.of("body_out", "other_out")));
    assertEquals(
        "    let h_out = http_request(\"PUT\", \"https://example.com\", null, {});\n",
        HTTP_PUT.generateCode("h", null, List.of()));
  }

  @Test
  void testDelete() {
    assertEquals(
        "    let h_out = http_request(\"DELETE\", \"https://x.io/1\", null, {});\n",
        HTTP_DELETE.generateCode("h", objectNode("url", "https://x.io/1"), List.of("a_out")));
  }

  @Test
  void testCustomRequestUpperCasesMethod() {
    assertEquals(
        "    let h_out = http_request(\"PATCH\", \"https://example.com\", a_out, {});\n",
        HTTP_REQUEST.generateCode("h", objectNode("method", " patch "), List.of("a_out")));
    assertEquals(
        "    let h_out = http_request(\"GET\", \"https://example.com\", null, {});\n",
        HTTP_REQUEST.generateCode("h", objectNode("method", ""), List.of()));
    assertEquals(
        "    let h_out = http_request(\"GET\", \"https://example.com\", null, {});\n",
        HTTP_REQUEST.generateCode("h", objectNode("method", 42), List.of()));
  }

  @Test
  void testUrlIsEscaped() {
    String code =
        HTTP_GET.generateCode("h", objectNode("url", "https://x.io/?q=\"a\"\nb\\c"), List.of());
    assertEquals(
        "    let h_out = http_request(\"GET\","
            + " \"https://x.io/?q=\\\"a\\\"\\nb\\\\c\", null, {});\n",
        code);
    assertEquals(1, code.lines().count());
  }

  @Test
  void testMethodIsUpperCasedIndependentOfLocale() {
    Locale original = Locale.getDefault();
    try {
      Locale.setDefault(new Locale("tr", "TR"));
      assertEquals(
          "    let h_out = http_request(\"OPTIONS\", \"https://example.com\", null, {});\n",
          HTTP_REQUEST.generateCode("h", objectNode("method", "options"), List.of()));
    } finally {
      Locale.setDefault(original);
    }
  }

  @Test
  void testNonAsciiTextIsKept() {
    String url = "https://bücher.de/straße?q=日本";
    assertEquals(
        "    let h_out = http_request(\"GET\", \"" + url + "\", null, {});\n",
        HTTP_GET.generateCode("h", objectNode("url", url), List.of()));
    assertEquals(
        "    let h_out = http_request(\"GET\", \"a\\tb\\u0001c\\u007F\", null, {});\n",
        HTTP_GET.generateCode("h", objectNode("url", "a\tb\u0001c\u007f"), List.of()));
  }
}
