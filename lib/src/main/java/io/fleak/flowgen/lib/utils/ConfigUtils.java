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

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed readers over loosely structured node configuration.
 *
 * <p>Every reader returns the supplied default when the configuration is not an object, when the
 * field is absent or null, or when it holds a value of another type. Values are never coerced
 * across types: {@code "5"} is not a number.
 */
public interface ConfigUtils {

  static JsonNode field(JsonNode config, String key) {
    if (config == null || !config.isObject()) {
      return null;
    }
    JsonNode value = config.get(key);
    return value == null || value.isNull() ? null : value;
  }

  static String getString(JsonNode config, String key, String defaultValue) {
    JsonNode value = field(config, key);
    return value != null && value.isTextual() ? value.textValue() : defaultValue;
  }

  static long getLong(JsonNode config, String key, long defaultValue) {
    JsonNode value = field(config, key);
    return value != null && value.isIntegralNumber() && value.canConvertToLong()
        ? value.longValue()
        : defaultValue;
  }

  /** Like {@link #getLong} but negative values also fall back to the default. */
  static long getNonNegativeLong(JsonNode config, String key, long defaultValue) {
    long value = getLong(config, key, defaultValue);
    return value < 0 ? defaultValue : value;
  }

  static Optional<List<JsonNode>> getArray(JsonNode config, String key) {
    JsonNode value = field(config, key);
    if (value == null || !value.isArray()) {
      return Optional.empty();
    }
    List<JsonNode> elements = new ArrayList<>(value.size());
    value.forEach(elements::add);
    return Optional.of(elements);
  }
}
