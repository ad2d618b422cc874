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

import static io.fleak.flowgen.lib.utils.MiscUtils.isIdentifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.fleak.flowgen.lib.utils.YamlUtils;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output options of {@link FlowCompiler}. Loadable from YAML:
 *
 * <pre>
 * programName: pipeline
 * annotateNodes: true
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompilerConfig {
  public static final String DEFAULT_PROGRAM_NAME = "workflow";

  @Builder.Default private String programName = DEFAULT_PROGRAM_NAME;

  /** Precede each node's block with a comment naming the node and its operator. */
  @Builder.Default private boolean annotateNodes = false;

  public static CompilerConfig defaults() {
    return CompilerConfig.builder().build();
  }

  public static CompilerConfig fromYamlFile(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      CompilerConfig config = YamlUtils.OBJECT_MAPPER.readValue(in, CompilerConfig.class);
      return config == null ? defaults() : config;
    } catch (IOException e) {
      throw new IllegalArgumentException("failed to read compiler config: " + path, e);
    }
  }

  /**
   * @return {@link #programName} when it is a valid identifier, otherwise the default name
   */
  @JsonIgnore
  public String getEffectiveProgramName() {
    return isIdentifier(programName) ? programName : DEFAULT_PROGRAM_NAME;
  }
}
