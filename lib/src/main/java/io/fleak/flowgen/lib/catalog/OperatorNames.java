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

public interface OperatorNames {

  String CATEGORY_CONTROL = "Control";
  String CATEGORY_DEBUG = "Debug";
  String CATEGORY_HTTP = "HTTP";
  String CATEGORY_DATA = "Data";
  String CATEGORY_FILES = "Files";
  String CATEGORY_MATH = "Math";
  String CATEGORY_CONVERT = "Convert";
  String CATEGORY_ML = "ML/GPU";
  String CATEGORY_SYSTEM = "System";

  String OPERATOR_START = "start";
  String OPERATOR_PRINT = "print";

  String OPERATOR_HTTP_GET = "http_get";
  String OPERATOR_HTTP_POST = "http_post";
  String OPERATOR_HTTP_PUT = "http_put";
  String OPERATOR_HTTP_DELETE = "http_delete";
  String OPERATOR_HTTP_REQUEST = "http_request";

  String OPERATOR_JSON_PARSE = "json_parse";
  String OPERATOR_JSON_STRINGIFY = "json_stringify";
  String OPERATOR_JSON_GET = "json_get";
  String OPERATOR_JSON_SET = "json_set";

  String OPERATOR_STRING_CONCAT = "string_concat";
  String OPERATOR_STRING_UPPER = "string_upper";
  String OPERATOR_STRING_LOWER = "string_lower";
  String OPERATOR_STRING_TRIM = "string_trim";
  String OPERATOR_STRING_SPLIT = "string_split";
  String OPERATOR_STRING_REPLACE = "string_replace";
  String OPERATOR_STRING_LENGTH = "string_length";

  String OPERATOR_ARRAY_MAP = "array_map";
  String OPERATOR_ARRAY_FILTER = "array_filter";
  String OPERATOR_ARRAY_REDUCE = "array_reduce";
  String OPERATOR_ARRAY_SLICE = "array_slice";
  String OPERATOR_ARRAY_CONCAT = "array_concat";
  String OPERATOR_ARRAY_SORT = "array_sort";
  String OPERATOR_ARRAY_LENGTH = "array_length";

  String OPERATOR_OBJECT_GET = "object_get";
  String OPERATOR_OBJECT_SET = "object_set";
  String OPERATOR_OBJECT_KEYS = "object_keys";
  String OPERATOR_OBJECT_VALUES = "object_values";
  String OPERATOR_OBJECT_HAS_KEY = "object_has_key";

  String OPERATOR_FILE_READ = "file_read";
  String OPERATOR_FILE_WRITE = "file_write";
  String OPERATOR_FILE_EXISTS = "file_exists";
  String OPERATOR_FILE_DELETE = "file_delete";
  String OPERATOR_FILE_LIST = "file_list";
  String OPERATOR_DIR_CREATE = "dir_create";
  String OPERATOR_JSON_READ = "json_read";
  String OPERATOR_JSON_WRITE = "json_write";

  String OPERATOR_MATH_ADD = "math_add";
  String OPERATOR_MATH_SUBTRACT = "math_subtract";
  String OPERATOR_MATH_MULTIPLY = "math_multiply";
  String OPERATOR_MATH_DIVIDE = "math_divide";
  String OPERATOR_MATH_FLOOR = "math_floor";
  String OPERATOR_MATH_CEIL = "math_ceil";
  String OPERATOR_MATH_ROUND = "math_round";
  String OPERATOR_MATH_SQRT = "math_sqrt";
  String OPERATOR_MATH_RANDOM = "math_random";

  String OPERATOR_TO_STRING = "to_string";
  String OPERATOR_TO_INT = "to_int";
  String OPERATOR_TO_FLOAT = "to_float";

  String OPERATOR_TENSOR_CREATE = "tensor_create";
  String OPERATOR_TENSOR_MATMUL = "tensor_matmul";
  String OPERATOR_TENSOR_ADD = "tensor_add";
  String OPERATOR_TENSOR_OP = "tensor_op";

  String OPERATOR_SLEEP = "sleep";
  String OPERATOR_CAPTURE_SCREEN = "capture_screen";
}
