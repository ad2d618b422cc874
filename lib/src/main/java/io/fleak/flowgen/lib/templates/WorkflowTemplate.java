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

import com.google.common.base.Preconditions;
import io.fleak.flowgen.lib.dag.FlowGraph;
import java.util.function.Supplier;

/**
 * A named, pre-built graph offered to editors as a starting point.
 *
 * @param id short stable key, usable on the command line
 * @param name display name
 */
public record WorkflowTemplate(
    String id, String name, String description, String category, Supplier<FlowGraph> factory) {

  public WorkflowTemplate {
    Preconditions.checkNotNull(id);
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(factory, "template %s has no factory", id);
  }

  /**
   * @return a new graph instance on every call
   */
  public FlowGraph create() {
    return factory.get();
  }
}
