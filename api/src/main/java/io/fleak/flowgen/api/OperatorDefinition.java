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
import com.google.common.base.Preconditions;
import java.util.List;
import java.util.function.Supplier;
import lombok.Builder;

/**
 * A registered operator: its catalog key, presentation metadata, default configuration and code
 * generator. Instances are immutable and safe to share between compilations.
 */
@Builder
public record OperatorDefinition(
    String name,
    String category,
    String description,
    Supplier<JsonNode> defaultConfigSupplier,
    CodeGenerator codeGenerator) {

  public OperatorDefinition {
    Preconditions.checkArgument(
        name != null && !name.isBlank(), "operator name must not be blank");
    Preconditions.checkNotNull(
        defaultConfigSupplier, "operator %s has no default config supplier", name);
    Preconditions.checkNotNull(codeGenerator, "operator %s has no code generator", name);
    category = category == null ? "" : category;
    description = description == null ? "" : description;
  }

  /**
   * @return a fresh copy of the default configuration; callers may mutate it freely
   */
  public JsonNode defaultConfig() {
    JsonNode config = defaultConfigSupplier.get();
    return config == null ? null : config.deepCopy();
  }

  public String generateCode(String nodeId, JsonNode config, List<String> inputs) {
    return codeGenerator.generate(nodeId, config, inputs == null ? List.of() : inputs);
  }
}
