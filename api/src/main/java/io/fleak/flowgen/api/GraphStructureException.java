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
package io.fleak.flowgen.api;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Raised when a graph cannot be lowered because of its shape. Always detected before any code is
 * emitted, so no partial program accompanies it.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class GraphStructureException extends RuntimeException {

  public enum ErrorType {
    INVALID_NODE_ID,
    DUPLICATE_NODE_ID,
    DANGLING_EDGE,
    CYCLIC_GRAPH
  }

  private final ErrorType errorType;
  private final String nodeId;
  private final String edgeSource;
  private final String edgeTarget;

  public GraphStructureException(
      ErrorType errorType, String nodeId, String edgeSource, String edgeTarget, String message) {
    super(message);
    this.errorType = errorType;
    this.nodeId = nodeId;
    this.edgeSource = edgeSource;
    this.edgeTarget = edgeTarget;
  }

  public static GraphStructureException invalidNodeId(int position, String nodeId) {
    return new GraphStructureException(
        ErrorType.INVALID_NODE_ID,
        nodeId,
        null,
        null,
        String.format(
            "node at position %d has an invalid id: '%s', expected an identifier",
            position, nodeId));
  }

  public static GraphStructureException duplicateNodeId(String nodeId) {
    return new GraphStructureException(
        ErrorType.DUPLICATE_NODE_ID, nodeId, null, null, "duplicate node id: " + nodeId);
  }

  /**
   * @param missingNodeId the endpoint that does not name a node
   */
  public static GraphStructureException danglingEdge(
      String missingNodeId, String edgeSource, String edgeTarget) {
    return new GraphStructureException(
        ErrorType.DANGLING_EDGE,
        missingNodeId,
        edgeSource,
        edgeTarget,
        String.format(
            "edge %s -> %s references unknown node: %s", edgeSource, edgeTarget, missingNodeId));
  }

  /**
   * @param cycle node ids along the cycle, starting and ending at {@code nodeId}
   */
  public static GraphStructureException cyclicGraph(String nodeId, List<String> cycle) {
    return new GraphStructureException(
        ErrorType.CYCLIC_GRAPH,
        nodeId,
        null,
        null,
        "graph has a cycle: " + String.join(" -> ", cycle));
  }
}
