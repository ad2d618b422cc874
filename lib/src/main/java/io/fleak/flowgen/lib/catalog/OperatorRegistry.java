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
package io.fleak.flowgen.lib.catalog;

import com.google.common.collect.ImmutableMap;
import io.fleak.flowgen.api.OperatorCatalog;
import io.fleak.flowgen.api.OperatorDefinition;
import io.fleak.flowgen.lib.operators.control.ControlOperators;
import io.fleak.flowgen.lib.operators.convert.ConvertOperators;
import io.fleak.flowgen.lib.operators.data.ArrayOperators;
import io.fleak.flowgen.lib.operators.data.JsonOperators;
import io.fleak.flowgen.lib.operators.data.ObjectOperators;
import io.fleak.flowgen.lib.operators.data.StringOperators;
import io.fleak.flowgen.lib.operators.files.FileOperators;
import io.fleak.flowgen.lib.operators.http.HttpOperators;
import io.fleak.flowgen.lib.operators.math.MathOperators;
import io.fleak.flowgen.lib.operators.system.SystemOperators;
import io.fleak.flowgen.lib.operators.tensor.TensorOperators;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Immutable operator catalog keyed by operator name, iterated in registration order.
 *
 * <p>{@link #DEFAULT} holds every built-in operator. Extend it with {@link #builder()}:
 *
 * <pre>{@code
 * OperatorCatalog catalog = OperatorRegistry.builder().register(myOperator).build();
 * }</pre>
 */
public final class OperatorRegistry implements OperatorCatalog {

  public static final List<OperatorDefinition> BUILT_IN_OPERATORS =
      List.of(
              ControlOperators.ALL,
              HttpOperators.ALL,
              JsonOperators.ALL,
              StringOperators.ALL,
              ArrayOperators.ALL,
              ObjectOperators.ALL,
              FileOperators.ALL,
              MathOperators.ALL,
              ConvertOperators.ALL,
              TensorOperators.ALL,
              SystemOperators.ALL)
          .stream()
          .flatMap(Collection::stream)
          .toList();

  public static final OperatorRegistry DEFAULT = builder().build();

  private final ImmutableMap<String, OperatorDefinition> operators;

  private OperatorRegistry(ImmutableMap<String, OperatorDefinition> operators) {
    this.operators = operators;
  }

  /**
   * @return a builder pre-populated with the built-in operators
   */
  public static Builder builder() {
    return emptyBuilder().registerAll(BUILT_IN_OPERATORS);
  }

  public static Builder emptyBuilder() {
    return new Builder();
  }

  @Override
  public Optional<OperatorDefinition> lookup(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(operators.get(name));
  }

  @Override
  public List<OperatorDefinition> all() {
    return operators.values().asList();
  }

  public int size() {
    return operators.size();
  }

  @Override
  public String toString() {
    return "OperatorRegistry" + operators.keySet();
  }

  public static final class Builder {
    private final ImmutableMap.Builder<String, OperatorDefinition> operators =
        ImmutableMap.builder();

    private Builder() {}

    public Builder register(OperatorDefinition definition) {
      operators.put(definition.name(), definition);
      return this;
    }

    public Builder registerAll(Collection<OperatorDefinition> definitions) {
      definitions.forEach(this::register);
      return this;
    }

    /**
     * @throws IllegalArgumentException if two operators share a name
     */
    public OperatorRegistry build() {
      return new OperatorRegistry(operators.buildOrThrow());
    }
  }
}
