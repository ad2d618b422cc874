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
package io.fleak.flowgen.compiler;

import java.util.List;
import java.util.Optional;

/**
 * Result of lowering one graph.
 *
 * @param blocks one statement block per node, in evaluation order
 * @param outputNodeId node whose output the program returns, null if the program returns null
 * @param warnings non-fatal problems that were embedded in the program as comments
 * @param text the complete program
 */
public record CompiledProgram(
    List<String> blocks, String outputNodeId, List<String> warnings, String text) {

  public CompiledProgram {
    blocks = List.copyOf(blocks);
    warnings = List.copyOf(warnings);
  }

  public Optional<String> outputNode() {
    return Optional.ofNullable(outputNodeId);
  }

  public boolean hasWarnings() {
    return !warnings.isEmpty();
  }

  @Override
  public String toString() {
    return text;
  }
}
