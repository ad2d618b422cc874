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
package io.fleak.flowgen.lib.operators.tensor;

import static io.fleak.flowgen.lib.operators.tensor.TensorOperators.*;
import static io.fleak.flowgen.lib.utils.JsonUtils.objectNode;
import static io.fleak.flowgen.lib.utils.JsonUtils.readTree;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class TensorOperatorsTest {

  @Test
  void testCreateWithDefaults() {
    String expected =
        "    let m_t = tensor_new_2d(2, 2);\n"
            + "    let m_data = m_t[2];\n"
            + "    m_data[0] = 1.0;\n"
            + "    m_data[1] = 0.0;\n"
            + "    m_data[2] = 0.0;\n"
            + "    m_data[3] = 1.0;\n"
            + "    let m_out = m_t;\n";
    assertEquals(
        expected, TENSOR_CREATE.generateCode("m", TENSOR_CREATE.defaultConfig(), List.of()));
  }

  @Test
  void testCreateWithoutValues() {
    assertEquals(
        "    let m_t = tensor_new_2d(3, 1);\n    let m_out = m_t;\n",
        TENSOR_CREATE.generateCode("m", objectNode("rows", 3, "cols", 1), List.of()));
  }

  @Test
  void testCreateToleratesBadValues() {
    JsonNode config = readTree("{\"rows\": -1, \"cols\": \"4\", \"values\": [2, \"x\", 0.5]}");
    String code = TENSOR_CREATE.generateCode("m", config, List.of());
    assertEquals(
        "    let m_t = tensor_new_2d(2, 2);\n"
            + "    let m_data = m_t[2];\n"
            + "    m_data[0] = 2.0;\n"
            + "    m_data[1] = 0.0;\n"
            + "    m_data[2] = 0.5;\n"
            + "    let m_out = m_t;\n",
        code);
  }

  @Test
  void testBinaryOperatorsUseFirstTwoInputs() {
    assertEquals(
        "    let p_out = tensor_matmul(a_out, b_out);\n",
        TENSOR_MATMUL.generateCode("p", null, List.of("a_out", "b_out", "c_out")));
    assertEquals(
        "    let p_out = tensor_add(a_out, b_out);\n",
        TENSOR_ADD.generateCode("p", null, List.of("a_out", "b_out")));
  }

  @Test
  void testBinaryOperatorWithOneInput() {
    assertEquals(
        "    // tensor_matmul needs two tensor inputs, got 1\n    let p_out = null;\n",
        TENSOR_MATMUL.generateCode("p", null, List.of("a_out")));
  }

  @Test
  void testTensorOpDispatch() {
    List<String> inputs = List.of("matA_out", "matB_out");
    assertEquals(
        "    let mm_out = tensor_matmul(matA_out, matB_out);\n",
        TENSOR_OP.generateCode("mm", objectNode("op", "dot"), inputs));
    assertEquals(
        "    let mm_out = tensor_matmul(matA_out, matB_out);\n",
        TENSOR_OP.generateCode("mm", objectNode("op", "MatMul"), inputs));
    assertEquals(
        "    let mm_out = tensor_add(matA_out, matB_out);\n",
        TENSOR_OP.generateCode("mm", objectNode("op", "add"), inputs));
    assertEquals(
        "    // unknown tensor op: conv\n    let mm_out = null;\n",
        TENSOR_OP.generateCode("mm", objectNode("op", "conv"), inputs));
  }
}
