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

import static io.fleak.flowgen.api.VariableNames.outputVariable;
import static io.fleak.flowgen.lib.catalog.CodegenUtils.*;

import com.google.common.base.Preconditions;
import io.fleak.flowgen.api.GraphStructureException;
import io.fleak.flowgen.api.OperatorCatalog;
import io.fleak.flowgen.api.OperatorDefinition;
import io.fleak.flowgen.lib.catalog.OperatorRegistry;
import io.fleak.flowgen.lib.dag.DependencyResolver;
import io.fleak.flowgen.lib.dag.FlowGraph;
import io.fleak.flowgen.lib.dag.FlowNode;
import io.fleak.flowgen.lib.dag.ResolvedGraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Lowers a {@link FlowGraph} into one program of the target language.
 *
 * <p>Structural problems (blank or duplicate ids, dangling edges, cycles) are detected before any
 * code is emitted and surface as {@link GraphStructureException}. Everything after that succeeds:
 * unknown operators and failing generators degrade to a comment and a {@code null} binding, and
 * are reported through {@link CompiledProgram#warnings()}.
 *
 * <p>Instances hold no per-compilation state and may be shared between threads.
 */
@Slf4j
public record FlowCompiler(OperatorCatalog catalog, CompilerConfig config) {

  static final String ENTRY_FUNCTION_HEADER = "fn main(input) {";

  public FlowCompiler {
    Preconditions.checkNotNull(catalog, "catalog");
    config = config == null ? CompilerConfig.defaults() : config;
  }

  public FlowCompiler(OperatorCatalog catalog) {
    this(catalog, CompilerConfig.defaults());
  }

  public static FlowCompiler createDefault() {
    return new FlowCompiler(OperatorRegistry.DEFAULT);
  }

  public CompiledProgram compile(FlowGraph graph) {
    Preconditions.checkNotNull(graph, "graph");
    CompilationStage stage = CompilationStage.INIT;
    try {
      stage = advance(stage, CompilationStage.RESOLVING);
      ResolvedGraph resolved = DependencyResolver.resolve(graph);

      stage = advance(stage, CompilationStage.EMITTING);
      List<String> blocks = new ArrayList<>(resolved.orderedNodes().size());
      List<String> warnings = new ArrayList<>();
      for (FlowNode node : resolved.orderedNodes()) {
        blocks.add(emit(node, resolved.inputsOf(node.getId()), warnings));
      }

      stage = advance(stage, CompilationStage.FINALIZING);
      String text = assemble(blocks, resolved.outputNode());

      advance(stage, CompilationStage.DONE);
      return new CompiledProgram(blocks, resolved.outputNodeId(), warnings, text);
    } catch (GraphStructureException e) {
      log.warn("compilation failed while {}: {}", stage, e.getMessage());
      advance(stage, CompilationStage.FAILED);
      throw e;
    }
  }

  /** Convenience for callers that only need the program text. */
  public String compileToText(FlowGraph graph) {
    return compile(graph).text();
  }

  private String emit(FlowNode node, List<String> inputs, List<String> warnings) {
    String nodeId = node.getId();
    String operator = node.getOperator();
    String prefix =
        config.isAnnotateNodes() ? comment("node " + nodeId + " (" + operator + ")") : "";

    Optional<OperatorDefinition> definition = catalog.lookup(operator);
    if (definition.isEmpty()) {
      log.warn("unknown operator {} at node {}", operator, nodeId);
      warnings.add(String.format("node %s: unknown operator %s", nodeId, operator));
      return prefix + comment("Unknown node type: " + operator) + bindOutput(nodeId, NULL_LITERAL);
    }
    String code;
    try {
      code = definition.get().generateCode(nodeId, node.getConfig(), inputs);
    } catch (RuntimeException e) {
      log.error("code generation failed at node {} ({})", nodeId, operator, e);
      return prefix + generationFailed(nodeId, operator, e.getMessage(), warnings);
    }
    if (code == null) {
      log.error("code generator of {} returned null at node {}", operator, nodeId);
      return prefix + generationFailed(nodeId, operator, "generator returned null", warnings);
    }
    return prefix + code;
  }

  private static String generationFailed(
      String nodeId, String operator, String reason, List<String> warnings) {
    warnings.add(
        String.format("node %s: code generation failed for %s: %s", nodeId, operator, reason));
    return comment("Code generation failed for " + operator) + bindOutput(nodeId, NULL_LITERAL);
  }

  private String assemble(List<String> blocks, Optional<String> outputNodeId) {
    StringBuilder source = new StringBuilder();
    source.append("program ").append(config.getEffectiveProgramName()).append(" {\n\n");
    source.append(ENTRY_FUNCTION_HEADER).append(LINE_SEPARATOR);
    blocks.forEach(source::append);
    String returned = outputNodeId.map(id -> outputVariable(id)).orElse(NULL_LITERAL);
    source.append(statement("return " + returned + ";"));
    source.append("}\n\n");
    source.append("}\n");
    return source.toString();
  }

  private static CompilationStage advance(CompilationStage from, CompilationStage to) {
    log.debug("compilation stage {} -> {}", from, to);
    return to;
  }
}
