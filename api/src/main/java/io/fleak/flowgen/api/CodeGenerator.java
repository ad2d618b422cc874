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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Emits the statement block for one node. Implementations must be pure: no I/O, no shared state,
 * and the same output for the same arguments.
 */
@FunctionalInterface
public interface CodeGenerator {

  /**
   * @param nodeId id of the node being lowered. The block must bind {@code <nodeId>_out}.
   * @param config the node's configuration as supplied by the editor. May be null, a scalar, an
   *     array or an object; every field read must fall back to a default.
   * @param inputs producer variables feeding this node, in incoming edge order
   * @return one or more complete statements, each terminated by a line separator
   */
  String generate(String nodeId, JsonNode config, List<String> inputs);
}
