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
package io.fleak.flowgen.lib.catalog;

import static io.fleak.flowgen.api.VariableNames.outputVariable;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.text.translate.AggregateTranslator;
import org.apache.commons.text.translate.CharSequenceTranslator;
import org.apache.commons.text.translate.EntityArrays;
import org.apache.commons.text.translate.JavaUnicodeEscaper;
import org.apache.commons.text.translate.LookupTranslator;

/** Building blocks shared by the code generators. Statements are indented one level. */
public interface CodegenUtils {
  String INDENT = "    ";
  String LINE_SEPARATOR = "\n";

  String NULL_LITERAL = "null";
  String EMPTY_STRING_LITERAL = "\"\"";
  String EMPTY_ARRAY_LITERAL = "[]";
  String EMPTY_OBJECT_LITERAL = "{}";

  /**
   * Escapes quotes, backslashes and control characters. Unlike Java escaping, non-ASCII text is
   * kept as is.
   */
  CharSequenceTranslator ESCAPE_STRING_LITERAL =
      new AggregateTranslator(
          new LookupTranslator(Map.<CharSequence, CharSequence>of("\"", "\\\"", "\\", "\\\\")),
          new LookupTranslator(EntityArrays.JAVA_CTRL_CHARS_ESCAPE),
          JavaUnicodeEscaper.below(32),
          JavaUnicodeEscaper.between(0x7f, 0x7f));

  static String statement(String text) {
    return INDENT + text + LINE_SEPARATOR;
  }

  /** {@code let <nodeId>_out = <expression>;} */
  static String bindOutput(String nodeId, String expression) {
    return bind(outputVariable(nodeId), expression);
  }

  static String bind(String variable, String expression) {
    return statement("let " + variable + " = " + expression + ";");
  }

  /** Single line comment. Line breaks in {@code text} are flattened so the comment stays closed. */
  static String comment(String text) {
    String flat = text == null ? "" : text.replaceAll("[\\r\\n]+", " ");
    return statement("// " + flat);
  }

  static String call(String function, String... args) {
    return function + "(" + String.join(", ", args) + ")";
  }

  static String arrayLiteral(List<String> elements) {
    return elements.stream().collect(Collectors.joining(", ", "[", "]"));
  }

  static String stringLiteral(String value) {
    return "\"" + ESCAPE_STRING_LITERAL.translate(value) + "\"";
  }

  static String doubleLiteral(double value) {
    return Double.isFinite(value) ? Double.toString(value) : "0.0";
  }

  static String firstInput(List<String> inputs, String fallback) {
    return inputAt(inputs, 0, fallback);
  }

  static String inputAt(List<String> inputs, int index, String fallback) {
    return inputs != null && index < inputs.size() ? inputs.get(index) : fallback;
  }

  /**
   * Block for an operator the target runtime cannot express yet: a diagnostic comment and a
   * placeholder binding, so that downstream nodes still find {@code <nodeId>_out}.
   */
  static String unsupported(String nodeId, String operatorName, String fallback) {
    return comment(operatorName + " is not supported by the target runtime")
        + bindOutput(nodeId, fallback);
  }
}
