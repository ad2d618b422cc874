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
package io.fleak.flowgen.clistarter;

import io.fleak.flowgen.compiler.CompilerConfig;
import io.fleak.flowgen.lib.dag.FlowGraph;
import java.nio.file.Path;
import lombok.Builder;
import lombok.Data;

/** What one command line invocation asks for. */
@Data
@Builder
public class CliRequest {

  public enum Action {
    COMPILE,
    LIST_OPERATORS,
    LIST_TEMPLATES
  }

  private final Action action;

  /** Graph to compile, null unless the action is {@link Action#COMPILE}. */
  private final FlowGraph graph;

  @Builder.Default private final CompilerConfig compilerConfig = CompilerConfig.defaults();

  /** Where to write the program; null means standard output. */
  private final Path outputPath;
}
