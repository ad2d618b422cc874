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
package io.fleak.flowgen.lib.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

public abstract class JsonUtils {
  public static final ObjectMapper OBJECT_MAPPER;

  static {
    OBJECT_MAPPER = new ObjectMapper();
    OBJECT_MAPPER.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    OBJECT_MAPPER.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
  }

  public static String toJsonString(Object object) {
    if (Objects.isNull(object)) {
      return null;
    }
    try {
      return OBJECT_MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJsonString(String jsonStr, Class<T> clz) {
    if (Objects.isNull(jsonStr)) {
      return null;
    }
    try {
      return OBJECT_MAPPER.readValue(jsonStr, clz);
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJsonResource(String resourcePath, Class<T> clz) throws IOException {
    try (InputStream in = JsonUtils.class.getResourceAsStream(resourcePath)) {
      if (in == null) {
        throw new IOException("Resource not found: " + resourcePath);
      }
      return OBJECT_MAPPER.readValue(in, clz);
    }
  }

  /** Parses a JSON literal, e.g. a configuration value typed by a user. */
  public static JsonNode readTree(String jsonStr) {
    if (jsonStr == null) {
      return null;
    }
    try {
      return OBJECT_MAPPER.readTree(jsonStr);
    } catch (JsonProcessingException e) {
      throw new RuntimeException("Failed to parse JSON string: " + jsonStr, e);
    }
  }

  /**
   * Builds an object node from alternating key/value arguments. Values are converted with the
   * shared mapper, so strings, numbers, booleans, lists and nested nodes are all accepted.
   */
  public static ObjectNode objectNode(Object... keyValues) {
    Preconditions.checkArgument(
        keyValues.length % 2 == 0, "expected key/value pairs but got %s values", keyValues.length);
    ObjectNode node = OBJECT_MAPPER.createObjectNode();
    for (int i = 0; i < keyValues.length; i += 2) {
      node.set(String.valueOf(keyValues[i]), OBJECT_MAPPER.valueToTree(keyValues[i + 1]));
    }
    return node;
  }

  public static ArrayNode arrayNode(Object... values) {
    ArrayNode node = OBJECT_MAPPER.createArrayNode();
    for (Object value : values) {
      node.add(OBJECT_MAPPER.<JsonNode>valueToTree(value));
    }
    return node;
  }
}
