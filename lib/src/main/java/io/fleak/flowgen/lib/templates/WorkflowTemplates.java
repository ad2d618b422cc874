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
package io.fleak.flowgen.lib.templates;

import static io.fleak.flowgen.lib.catalog.OperatorNames.*;
import static io.fleak.flowgen.lib.utils.JsonUtils.arrayNode;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleak.flowgen.lib.dag.FlowEdge;
import io.fleak.flowgen.lib.dag.FlowGraph;
import io.fleak.flowgen.lib.dag.FlowNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Built-in example workflows. */
public final class WorkflowTemplates {

  private static final double COLUMN_WIDTH = 200;
  private static final double FIRST_COLUMN = 100;

  public static final WorkflowTemplate HTTP_TO_JSON_TO_PRINT =
      new WorkflowTemplate(
          "http-json-print",
          "HTTP → JSON → Print",
          "Fetch JSON from API and print result",
          "API",
          () ->
              chain(
                  200,
                  node(
                      "http1",
                      OPERATOR_HTTP_GET,
                      objectNode("url", "https://api.github.com/users/octocat")),
                  node("json1", OPERATOR_JSON_PARSE, objectNode()),
                  node("print1", OPERATOR_PRINT, objectNode())));

  public static final WorkflowTemplate FILE_PROCESSING =
      new WorkflowTemplate(
          "file-processing",
          "File Processing",
          "Read file, transform, write back",
          CATEGORY_FILES,
          () ->
              chain(
                  200,
                  node("read1", OPERATOR_FILE_READ, objectNode("path", "input.txt")),
                  node("upper1", OPERATOR_STRING_UPPER, objectNode()),
                  node("write1", OPERATOR_FILE_WRITE, objectNode("path", "output.txt"))));

  public static final WorkflowTemplate JSON_API_PIPELINE =
      new WorkflowTemplate(
          "json-api-pipeline",
          "JSON API Pipeline",
          "Fetch, parse, extract, save to file",
          "API",
          () ->
              chain(
                  150,
                  node(
                      "http1",
                      OPERATOR_HTTP_GET,
                      objectNode("url", "https://api.example.com/data")),
                  node("json1", OPERATOR_JSON_PARSE, objectNode()),
                  node("get1", OPERATOR_JSON_GET, objectNode("key", "results")),
                  node("write1", OPERATOR_JSON_WRITE, objectNode("path", "results.json"))));

  public static final WorkflowTemplate DATA_PROCESSING =
      new WorkflowTemplate(
          "data-processing",
          "Data Processing",
          "Load JSON, transform, filter, save",
          CATEGORY_DATA,
          () ->
              chain(
                  200,
                  node("read1", OPERATOR_JSON_READ, objectNode("path", "data.json")),
                  node("get1", OPERATOR_OBJECT_GET, objectNode("key", "items")),
                  node("len1", OPERATOR_ARRAY_LENGTH, objectNode()),
                  node("print1", OPERATOR_PRINT, objectNode())));

  public static final WorkflowTemplate MATH_CALCULATOR =
      new WorkflowTemplate(
          "math-calculator",
          "Math Calculator",
          "Chain math operations",
          CATEGORY_MATH,
          () ->
              chain(
                  200,
                  node("add1", OPERATOR_MATH_ADD, objectNode("value", 10)),
                  node("mult1", OPERATOR_MATH_MULTIPLY, objectNode("value", 2)),
                  node("sqrt1", OPERATOR_MATH_SQRT, objectNode()),
                  node("print1", OPERATOR_PRINT, objectNode())));

  /** Two constant matrices multiplied on the GPU. The only built-in with a two-input node. */
  public static final WorkflowTemplate TENSOR_MULTIPLY =
      new WorkflowTemplate(
          "tensor-multiply",
          "Tensor Multiply",
          "Multiply two 2x2 matrices and print the product",
          CATEGORY_ML,
          WorkflowTemplates::tensorMultiply);

  public static final List<WorkflowTemplate> ALL =
      List.of(
          HTTP_TO_JSON_TO_PRINT,
          FILE_PROCESSING,
          JSON_API_PIPELINE,
          DATA_PROCESSING,
          MATH_CALCULATOR,
          TENSOR_MULTIPLY);

  private WorkflowTemplates() {}

  /** Finds a template by id or by display name, ignoring case. */
  public static Optional<WorkflowTemplate> find(String idOrName) {
    if (idOrName == null) {
      return Optional.empty();
    }
    String key = idOrName.trim();
    return ALL.stream()
        .filter(t -> t.id().equalsIgnoreCase(key) || t.name().equalsIgnoreCase(key))
        .findFirst();
  }

  private static FlowGraph tensorMultiply() {
    List<FlowNode> nodes =
        List.of(
            positioned(tensor("matA", arrayNode(1.0, 0.0, 0.0, 1.0)), FIRST_COLUMN, 100),
            positioned(tensor("matB", arrayNode(2.0, 2.0, 2.0, 2.0)), FIRST_COLUMN, 300),
            positioned(node("matmul", OPERATOR_TENSOR_OP, objectNode("op", "dot")), 300, 200),
            positioned(node("printer", OPERATOR_PRINT, objectNode()), 500, 200));
    List<FlowEdge> edges =
        List.of(
            new FlowEdge("matA", "matmul"),
            new FlowEdge("matB", "matmul"),
            new FlowEdge("matmul", "printer"));
    return new FlowGraph(nodes, edges);
  }

  private static FlowNode tensor(String id, JsonNode values) {
    return node(id, OPERATOR_TENSOR_CREATE, objectNode("rows", 2, "cols", 2, "values", values));
  }

  private static FlowNode node(String id, String operator, JsonNode config) {
    return FlowNode.builder().id(id).operator(operator).config(config).build();
  }

  private static FlowNode positioned(FlowNode node, double x, double y) {
    node.setPosition(new FlowNode.Position(x, y));
    return node;
  }

  /** Lays the nodes out left to right on one row and links each to the next. */
  private static FlowGraph chain(double y, FlowNode... nodes) {
    List<FlowEdge> edges = new ArrayList<>();
    for (int i = 0; i < nodes.length; i++) {
      positioned(nodes[i], FIRST_COLUMN + i * COLUMN_WIDTH, y);
      if (i > 0) {
        edges.add(new FlowEdge(nodes[i - 1].getId(), nodes[i].getId()));
      }
    }
    return new FlowGraph(List.of(nodes), edges);
  }
}
