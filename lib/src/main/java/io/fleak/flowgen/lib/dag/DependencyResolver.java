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

import static io.fleak.flowgen.api.VariableNames.outputVariable;
import static io.fleak.flowgen.lib.utils.MiscUtils.isIdentifier;

import io.fleak.flowgen.api.GraphStructureException;
import java.util.*;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes a dependency respecting evaluation order for a {@link FlowGraph}.
 *
 * <pre>
 * 1. every node id is an identifier and unique
 * 2. every edge endpoint names a declared node
 * 3. Kahn's algorithm; among ready nodes the earliest declared goes first
 * 4. a node's inputs are its producers' variables in incoming edge order
 * 5. the output node is the first declared node without outgoing edges
 * </pre>
 */
@Slf4j
public final class DependencyResolver {

  private DependencyResolver() {}

  public static ResolvedGraph resolve(FlowGraph graph) {
    validate(graph);

    List<FlowNode> nodes = graph.getNodes();
    if (nodes.isEmpty()) {
      return new ResolvedGraph(List.of(), Map.of(), null);
    }

    Map<String, Integer> declarationIndex = new HashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      declarationIndex.put(nodes.get(i).getId(), i);
    }

    int[] inDegree = new int[nodes.size()];
    for (FlowEdge edge : graph.getEdges()) {
      inDegree[declarationIndex.get(edge.getTarget())]++;
    }

    PriorityQueue<Integer> ready = new PriorityQueue<>();
    for (int i = 0; i < nodes.size(); i++) {
      if (inDegree[i] == 0) {
        ready.offer(i);
      }
    }

    List<FlowNode> orderedNodes = new ArrayList<>(nodes.size());
    while (!ready.isEmpty()) {
      FlowNode current = nodes.get(ready.poll());
      orderedNodes.add(current);

      for (FlowEdge edge : graph.outgoingEdges(current.getId())) {
        int target = declarationIndex.get(edge.getTarget());
        if (--inDegree[target] == 0) {
          ready.offer(target);
        }
      }
    }

    if (orderedNodes.size() != nodes.size()) {
      Set<String> resolved = new HashSet<>();
      orderedNodes.forEach(n -> resolved.add(n.getId()));
      throw cycleError(graph, resolved);
    }

    Map<String, List<String>> inputVariables = new HashMap<>();
    for (FlowNode node : orderedNodes) {
      List<String> inputs =
          graph.incomingEdges(node.getId()).stream()
              .map(e -> outputVariable(e.getSource()))
              .toList();
      inputVariables.put(node.getId(), inputs);
    }

    String outputNodeId =
        nodes.stream()
            .map(FlowNode::getId)
            .filter(id -> !graph.hasOutgoing(id))
            .findFirst()
            .orElse(null);

    log.debug(
        "resolved {} nodes and {} edges, output node: {}",
        orderedNodes.size(),
        graph.getEdges().size(),
        outputNodeId);
    return new ResolvedGraph(orderedNodes, inputVariables, outputNodeId);
  }

  /**
   * Checks node ids and edge endpoints.
   *
   * @throws GraphStructureException on a non-identifier or duplicate id, or an edge naming an
   *     unknown node
   */
  public static void validate(FlowGraph graph) {
    Set<String> seen = new HashSet<>();
    List<FlowNode> nodes = graph.getNodes();
    for (int i = 0; i < nodes.size(); i++) {
      String id = nodes.get(i).getId();
      if (!isIdentifier(id)) {
        throw GraphStructureException.invalidNodeId(i, id);
      }
      if (!seen.add(id)) {
        throw GraphStructureException.duplicateNodeId(id);
      }
    }

    for (FlowEdge edge : graph.getEdges()) {
      if (!seen.contains(edge.getSource())) {
        throw GraphStructureException.danglingEdge(
            edge.getSource(), edge.getSource(), edge.getTarget());
      }
      if (!seen.contains(edge.getTarget())) {
        throw GraphStructureException.danglingEdge(
            edge.getTarget(), edge.getSource(), edge.getTarget());
      }
    }
  }

  /**
   * Every unresolved node keeps at least one unresolved producer, so walking producers backwards
   * from any unresolved node must revisit a node. The revisited node lies on a cycle.
   */
  private static GraphStructureException cycleError(FlowGraph graph, Set<String> resolved) {
    String start =
        graph.getNodes().stream()
            .map(FlowNode::getId)
            .filter(id -> !resolved.contains(id))
            .findFirst()
            .orElseThrow();

    List<String> path = new ArrayList<>();
    Map<String, Integer> positions = new HashMap<>();
    String current = start;
    while (!positions.containsKey(current)) {
      positions.put(current, path.size());
      path.add(current);
      current =
          graph.incomingEdges(current).stream()
              .map(FlowEdge::getSource)
              .filter(id -> !resolved.contains(id))
              .findFirst()
              .orElseThrow();
    }

    List<String> cycle = new ArrayList<>(path.subList(positions.get(current), path.size()));
    cycle.add(current);
    Collections.reverse(cycle);
    log.debug("cycle detected: {}", cycle);
    return GraphStructureException.cyclicGraph(current, cycle);
  }
}
