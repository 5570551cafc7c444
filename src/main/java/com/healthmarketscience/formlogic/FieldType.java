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

package com.healthmarketscience.formlogic;

import java.util.HashMap;
import java.util.Map;

/**
 * Supported form field types.  The value type and addressable
 * sub-properties of each type are supplied by a
 * {@link com.healthmarketscience.formlogic.type.FieldTypeLookup}.
 *
 * @author James Ahlborn
 */
public enum FieldType
{
  TEXT("text"),
  BOOLEAN("boolean"),
  NUMBER("number"),
  COORDINATE("coordinate"),
  BBOX("bbox"),
  MONEY("money"),
  ADDRESS("address"),
  PHONE("phone"),
  DURATION("duration"),
  EMAIL("email"),
  UUID("uuid"),
  URI("uri"),
  ENUM("enum"),
  DATE("date"),
  DATETIME("datetime"),
  TIME("time"),
  PERSON("person"),
  ORGANIZATION("organization"),
  IDENTIFICATION("identification"),
  MULTISELECT("multiselect"),
  PERCENTAGE("percentage"),
  RATING("rating"),
  /** a group of nested fields */
  FIELDSET("fieldset");

  private static final Map<String,FieldType> CODES =
    new HashMap<String,FieldType>();

  static {
    for(FieldType type : values()) {
      CODES.put(type._code, type);
    }
  }

  private final String _code;

  private FieldType(String code) {
    _code = code;
  }

  public String getCode() {
    return _code;
  }

  /**
   * @return the field type with the given code
   * @throws IllegalArgumentException if there is no such type
   */
  public static FieldType fromCode(String code) {
    FieldType type = CODES.get(code);
    if(type == null) {
      throw new IllegalArgumentException("Unknown field type " + code);
    }
    return type;
  }

  @Override
  public String toString() {
    return _code;
  }
}
