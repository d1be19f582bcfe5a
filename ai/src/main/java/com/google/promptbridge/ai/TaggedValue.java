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

import java.util.Objects;

/**
 * TaggedValue is the result of a function that returns one of several shapes,
 * labelled with the name of the variant the engine picked.
 */
public final class TaggedValue {

  private final String type;
  private final Object value;

  /**
   * Creates a TaggedValue.
   *
   * @param type
   *            the variant name, null when no declared variant matched
   * @param value
   *            the value
   */
  public TaggedValue(String type, Object value) {
    this.type = type;
    this.value = value;
  }

  public String getType() {
    return type;
  }

  public Object getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaggedValue)) {
      return false;
    }
    TaggedValue other = (TaggedValue) o;
    return Objects.equals(type, other.type) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    return "TaggedValue{" + type + "=" + value + "}";
  }
}
