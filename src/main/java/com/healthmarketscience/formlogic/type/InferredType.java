/*
Copyright (c) 2018 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.formlogic.type;

import java.util.HashMap;
import java.util.Map;

/**
 * The types which the type inferrer can assign to an expression, a field
 * path or a logic key.  {@link #UNKNOWN} means the inferrer abstained, it is
 * never an error by itself.
 *
 * @author James Ahlborn
 */
public enum InferredType
{
  BOOLEAN("boolean"),
  STRING("string"),
  NUMBER("number"),
  INTEGER("integer"),
  DATE("date"),
  DATETIME("datetime"),
  TIME("time"),
  DURATION("duration"),
  MONEY("money"),
  ADDRESS("address"),
  PHONE("phone"),
  COORDINATE("coordinate"),
  BBOX("bbox"),
  PERSON("person"),
  ORGANIZATION("organization"),
  IDENTIFICATION("identification"),
  OBJECT("object"),
  ARRAY("array"),
  NULL("null"),
  UNKNOWN("unknown");

  private static final Map<String,InferredType> NAMES =
    new HashMap<String,InferredType>();

  static {
    for(InferredType type : values()) {
      NAMES.put(type._str, type);
    }
  }

  private final String _str;

  private InferredType(String str) {
    _str = str;
  }

  public String getName() {
    return _str;
  }

  public boolean isNumeric() {
    return inRange(NUMBER, INTEGER);
  }

  public boolean isTemporal() {
    return inRange(DATE, DURATION);
  }

  public boolean isComposite() {
    return inRange(MONEY, ARRAY);
  }

  public boolean isKnown() {
    return (this != UNKNOWN);
  }

  private boolean inRange(InferredType start, InferredType end) {
    return ((start.ordinal() <= ordinal()) && (ordinal() <= end.ordinal()));
  }

  /**
   * @return the type with the given lower-case name, or {@code null} if
   *         there is none
   */
  public static InferredType fromName(String name) {
    return NAMES.get(name);
  }

  @Override
  public String toString() {
    return _str;
  }
}
