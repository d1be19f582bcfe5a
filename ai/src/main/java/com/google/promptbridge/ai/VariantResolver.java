/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.google.promptbridge.ai;

import java.util.Map;

/**
 * VariantResolver tags results of multi-shape functions with the variant that
 * matches the result's class.
 */
public final class VariantResolver {

  private VariantResolver() {
    // Utility class
  }

  /**
   * Tags a result with its variant.
   *
   * @param result
   *            the engine result
   * @param variants
   *            variant names mapped to the class each variant produces, in
   *            declaration order; null or empty when the function has a single
   *            shape
   * @return the result unchanged for single-shape functions, otherwise a
   *         {@link TaggedValue} whose type is the first variant whose class is
   *         exactly the result's class (null when none matches)
   */
  public static Object tag(Object result, Map<String, Class<?>> variants) {
    if (variants == null || variants.isEmpty()) {
      return result;
    }
    if (result instanceof TaggedValue) {
      return result;
    }
    String type = null;
    if (result != null) {
      for (Map.Entry<String, Class<?>> entry : variants.entrySet()) {
        if (entry.getValue() == result.getClass()) {
          type = entry.getKey();
          break;
        }
      }
    }
    return new TaggedValue(type, result);
  }
}
