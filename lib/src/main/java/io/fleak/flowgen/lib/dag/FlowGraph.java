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

import static io.fleak.flowgen.lib.utils.JsonUtils.toJsonString;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.*;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Snapshot of a workflow graph: nodes in declaration order and edges in collection order. The
 * lists and every node and edge in them are copied on construction, so later changes to the
 * caller's objects are not observed. Lookups are indexed once; the nodes and edges handed out by
 * the getters must not be modified.
 *
 * <p>No normalization happens here. Duplicate ids and edges pointing at unknown nodes are kept as
 * given and reported by {@link DependencyResolver}.
 */
@Getter
@EqualsAndHashCode(of = {"nodes", "edges"})
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlowGraph {

  private final List<FlowNode> nodes;
  private final List<FlowEdge> edges;

  // Index maps for faster lookups
  @Getter(AccessLevel.NONE)
  private final transient Map<String, FlowNode> nodeIndex = new HashMap<>();

  @Getter(AccessLevel.NONE)
  private final transient Map<String, List<FlowEdge>> incomingEdgesIndex = new HashMap<>();

  @Getter(AccessLevel.NONE)
  private final transient Map<String, List<FlowEdge>> outgoingEdgesIndex = new HashMap<>();

  @JsonCreator
  public FlowGraph(
      @JsonProperty("nodes") List<FlowNode> nodes, @JsonProperty("edges") List<FlowEdge> edges) {
    this.nodes = nodes == null ? List.of() : nodes.stream().map(FlowNode::copy).toList();
    this.edges =
        edges == null ? List.of() : edges.stream().map(e -> e.toBuilder().build()).toList();
    buildIndexes();
  }

  public static FlowGraph empty() {
    return new FlowGraph(List.of(), List.of());
  }

  private void buildIndexes() {
    // the first declaration wins, duplicates are reported by the resolver
    for (FlowNode node : nodes) {
      nodeIndex.putIfAbsent(node.getId(), node);
    }
    for (FlowEdge edge : edges) {
      incomingEdgesIndex.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
      outgoingEdgesIndex.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
    }
  }

  public boolean containsNode(String nodeId) {
    return nodeIndex.containsKey(nodeId);
  }

  public Optional<FlowNode> findNode(String nodeId) {
    return Optional.ofNullable(nodeIndex.get(nodeId));
  }

  public FlowNode lookupNode(String nodeId) {
    FlowNode node = nodeIndex.get(nodeId);
    if (node == null) {
      throw new IllegalArgumentException("Node with ID " + nodeId + " not found");
    }
    return node;
  }

  /**
   * @return edges whose target is {@code nodeId}, in edge collection order
   */
  public List<FlowEdge> incomingEdges(String nodeId) {
    return Collections.unmodifiableList(
        incomingEdgesIndex.getOrDefault(nodeId, Collections.emptyList()));
  }

  /**
   * @return edges whose source is {@code nodeId}, in edge collection order
   */
  public List<FlowEdge> outgoingEdges(String nodeId) {
    return Collections.unmodifiableList(
        outgoingEdgesIndex.getOrDefault(nodeId, Collections.emptyList()));
  }

  public boolean hasOutgoing(String nodeId) {
    return outgoingEdgesIndex.containsKey(nodeId);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  @Override
  public String toString() {
    return toJsonString(this);
  }
}
