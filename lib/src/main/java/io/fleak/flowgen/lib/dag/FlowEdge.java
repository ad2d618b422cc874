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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed dependency from {@code source}'s output to one of {@code target}'s inputs. Port labels
 * are carried through but not used for resolution yet.
 */
@Data
@NoArgsConstructor
@Builder(toBuilder = true)
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowEdge {
  private String source;
  private String target;

  @JsonAlias({"source_handle", "sourceHandle"})
  private String sourcePort;

  @JsonAlias({"target_handle", "targetHandle"})
  private String targetPort;

  public FlowEdge(String source, String target) {
    this(source, target, null, null);
  }

  @Override
  public String toString() {
    return source + " -> " + target;
  }
}
