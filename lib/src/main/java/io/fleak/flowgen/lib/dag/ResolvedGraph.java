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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of dependency resolution.
 *
 * @param orderedNodes nodes in evaluation order
 * @param inputVariables key: node id, value: producer variables in incoming edge order
 * @param outputNodeId the node whose result the program returns, null when there is none
 */
public record ResolvedGraph(
    List<FlowNode> orderedNodes, Map<String, List<String>> inputVariables, String outputNodeId) {

  public ResolvedGraph {
    orderedNodes = List.copyOf(orderedNodes);
    inputVariables = Map.copyOf(inputVariables);
  }

  public List<String> inputsOf(String nodeId) {
    return inputVariables.getOrDefault(nodeId, List.of());
  }

  public Optional<String> outputNode() {
    return Optional.ofNullable(outputNodeId);
  }
}
