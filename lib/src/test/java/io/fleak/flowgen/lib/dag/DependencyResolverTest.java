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
package io.fleak.flowgen.lib.dag;

import static org.junit.jupiter.api.Assertions.*;

import io.fleak.flowgen.api.GraphStructureException;
import java.util.*;
import org.junit.jupiter.api.Test;

class DependencyResolverTest {

  private static FlowNode node(String id) {
    return FlowNode.builder().id(id).operator("print").build();
  }

  private static List<String> ids(ResolvedGraph resolved) {
    return resolved.orderedNodes().stream().map(FlowNode::getId).toList();
  }

  @Test
  void testDiamond() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("A"), node("B"), node("C"), node("D")),
            List.of(
                new FlowEdge("A", "B"),
                new FlowEdge("A", "C"),
                new FlowEdge("B", "D"),
                new FlowEdge("C", "D")));

    ResolvedGraph resolved = DependencyResolver.resolve(graph);

    assertEquals(List.of("A", "B", "C", "D"), ids(resolved));
    assertEquals(List.of("B_out", "C_out"), resolved.inputsOf("D"));
    assertEquals(List.of(), resolved.inputsOf("A"));
    assertEquals(Optional.of("D"), resolved.outputNode());
  }

  @Test
  void testProducerDeclaredAfterConsumer() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("consumer"), node("producer")),
            List.of(new FlowEdge("producer", "consumer")));

    ResolvedGraph resolved = DependencyResolver.resolve(graph);

    assertEquals(List.of("producer", "consumer"), ids(resolved));
    assertEquals(List.of("producer_out"), resolved.inputsOf("consumer"));
  }

  @Test
  void testTiesFollowDeclarationOrder() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("z"), node("a"), node("m"), node("b")),
            List.of(new FlowEdge("m", "b")));

    assertEquals(List.of("z", "a", "m", "b"), ids(DependencyResolver.resolve(graph)));
  }

  @Test
  void testDeterministic() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("n3"), node("n1"), node("n2"), node("n0")),
            List.of(new FlowEdge("n1", "n0"), new FlowEdge("n3", "n0"), new FlowEdge("n2", "n1")));

    ResolvedGraph first = DependencyResolver.resolve(graph);
    for (int i = 0; i < 20; i++) {
      assertEquals(first, DependencyResolver.resolve(graph));
    }
    assertEquals(List.of("n3", "n2", "n1", "n0"), ids(first));
    assertEquals(List.of("n1_out", "n3_out"), first.inputsOf("n0"));
  }

  @Test
  void testInputsFollowEdgeOrder() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("a"), node("b"), node("sum")),
            List.of(new FlowEdge("b", "sum"), new FlowEdge("a", "sum")));

    assertEquals(List.of("b_out", "a_out"), DependencyResolver.resolve(graph).inputsOf("sum"));
  }

  @Test
  void testDuplicateEdgeSuppliesValueTwice() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("a"), node("b")),
            List.of(new FlowEdge("a", "b"), new FlowEdge("a", "b")));

    ResolvedGraph resolved = DependencyResolver.resolve(graph);
    assertEquals(List.of("a", "b"), ids(resolved));
    assertEquals(List.of("a_out", "a_out"), resolved.inputsOf("b"));
  }

  @Test
  void testOutputIsFirstSinkInDeclarationOrder() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("src"), node("left"), node("right")),
            List.of(new FlowEdge("src", "right"), new FlowEdge("src", "left")));

    assertEquals(Optional.of("left"), DependencyResolver.resolve(graph).outputNode());
  }

  @Test
  void testEmptyGraph() {
    ResolvedGraph resolved = DependencyResolver.resolve(FlowGraph.empty());
    assertTrue(resolved.orderedNodes().isEmpty());
    assertTrue(resolved.outputNode().isEmpty());
  }

  @Test
  void testSelfLoop() {
    FlowGraph graph = new FlowGraph(List.of(node("A")), List.of(new FlowEdge("A", "A")));

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.resolve(graph));
    assertEquals(GraphStructureException.ErrorType.CYCLIC_GRAPH, e.getErrorType());
    assertEquals("A", e.getNodeId());
    assertEquals("graph has a cycle: A -> A", e.getMessage());
  }

  @Test
  void testTwoNodeCycle() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("A"), node("B")),
            List.of(new FlowEdge("A", "B"), new FlowEdge("B", "A")));

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.resolve(graph));
    assertEquals(GraphStructureException.ErrorType.CYCLIC_GRAPH, e.getErrorType());
    assertEquals("A", e.getNodeId());
    assertEquals("graph has a cycle: A -> B -> A", e.getMessage());
  }

  @Test
  void testCycleDownstreamOfValidNodes() {
    FlowGraph graph =
        new FlowGraph(
            List.of(node("start"), node("x"), node("y"), node("z")),
            List.of(
                new FlowEdge("start", "x"),
                new FlowEdge("x", "y"),
                new FlowEdge("y", "z"),
                new FlowEdge("z", "x")));

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.resolve(graph));
    assertEquals(GraphStructureException.ErrorType.CYCLIC_GRAPH, e.getErrorType());
    assertTrue(Set.of("x", "y", "z").contains(e.getNodeId()));
    assertEquals("graph has a cycle: x -> y -> z -> x", e.getMessage());
  }

  @Test
  void testDanglingTarget() {
    FlowGraph graph = new FlowGraph(List.of(node("A")), List.of(new FlowEdge("A", "ghost")));

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.resolve(graph));
    assertEquals(GraphStructureException.ErrorType.DANGLING_EDGE, e.getErrorType());
    assertEquals("ghost", e.getNodeId());
    assertEquals("A", e.getEdgeSource());
    assertEquals("ghost", e.getEdgeTarget());
  }

  @Test
  void testDanglingSource() {
    FlowGraph graph = new FlowGraph(List.of(node("A")), List.of(new FlowEdge("ghost", "A")));

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.validate(graph));
    assertEquals(GraphStructureException.ErrorType.DANGLING_EDGE, e.getErrorType());
    assertEquals("ghost", e.getNodeId());
    assertEquals("edge ghost -> A references unknown node: ghost", e.getMessage());
  }

  @Test
  void testDuplicateId() {
    FlowGraph graph = new FlowGraph(List.of(node("A"), node("B"), node("A")), List.of());

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.resolve(graph));
    assertEquals(GraphStructureException.ErrorType.DUPLICATE_NODE_ID, e.getErrorType());
    assertEquals("A", e.getNodeId());
  }

  @Test
  void testBlankId() {
    FlowGraph graph = new FlowGraph(List.of(node("A"), node("  ")), List.of());

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.resolve(graph));
    assertEquals(GraphStructureException.ErrorType.INVALID_NODE_ID, e.getErrorType());
    assertEquals(
        "node at position 1 has an invalid id: '  ', expected an identifier", e.getMessage());
  }

  @Test
  void testIdMustBeIdentifier() {
    List<String> ids =
        List.of("node-1", "1st", "a b", "x = 1;\n    delete_file(\"f\");\n    let y");
    for (String id : ids) {
      FlowGraph graph = new FlowGraph(List.of(node("ok"), node(id)), List.of());

      GraphStructureException e =
          assertThrows(GraphStructureException.class, () -> DependencyResolver.resolve(graph), id);
      assertEquals(GraphStructureException.ErrorType.INVALID_NODE_ID, e.getErrorType());
      assertEquals(id, e.getNodeId());
    }
  }

  @Test
  void testNullId() {
    FlowGraph graph = new FlowGraph(List.of(node(null)), List.of());

    GraphStructureException e =
        assertThrows(GraphStructureException.class, () -> DependencyResolver.validate(graph));
    assertEquals(GraphStructureException.ErrorType.INVALID_NODE_ID, e.getErrorType());
  }

  @Test
  void testEveryEdgeRespectedInLargerGraph() {
    List<FlowNode> nodes = new ArrayList<>();
    List<FlowEdge> edges = new ArrayList<>();
    // declared in reverse, each node i depends on i + 1 and i + 2
    for (int i = 0; i < 12; i++) {
      nodes.add(node("n" + i));
    }
    for (int i = 0; i < 10; i++) {
      edges.add(new FlowEdge("n" + (i + 1), "n" + i));
      edges.add(new FlowEdge("n" + (i + 2), "n" + i));
    }
    FlowGraph graph = new FlowGraph(nodes, edges);

    List<String> order = ids(DependencyResolver.resolve(graph));
    assertEquals(nodes.size(), order.size());
    for (FlowEdge edge : edges) {
      assertTrue(
          order.indexOf(edge.getSource()) < order.indexOf(edge.getTarget()),
          "edge not respected: " + edge);
    }
  }
}
