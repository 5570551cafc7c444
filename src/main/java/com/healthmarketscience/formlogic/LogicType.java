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

import com.healthmarketscience.formlogic.type.InferredType;

/**
 * Declared type of a {@link LogicKey}.  Scalar types have a single
 * expression, object types have one expression per property.
 *
 * @author James Ahlborn
 */
public enum LogicType
{
  BOOLEAN("boolean", InferredType.BOOLEAN, false),
  STRING("string", InferredType.STRING, false),
  NUMBER("number", InferredType.NUMBER, false),
  INTEGER("integer", InferredType.INTEGER, false),
  PERCENTAGE("percentage", InferredType.NUMBER, false),
  RATING("rating", InferredType.NUMBER, false),
  DATE("date", InferredType.DATE, false),
  TIME("time", InferredType.TIME, false),
  DATETIME("datetime", InferredType.DATETIME, false),
  DURATION("duration", InferredType.DURATION, false),
  MONEY("money", InferredType.MONEY, true),
  ADDRESS("address", InferredType.ADDRESS, true),
  PHONE("phone", InferredType.PHONE, true),
  COORDINATE("coordinate", InferredType.COORDINATE, true),
  BBOX("bbox", InferredType.BBOX, true),
  PERSON("person", InferredType.PERSON, true),
  ORGANIZATION("organization", InferredType.ORGANIZATION, true),
  IDENTIFICATION("identification", InferredType.IDENTIFICATION, true);

  private static final Map<String,LogicType> CODES =
    new HashMap<String,LogicType>();

  static {
    for(LogicType type : values()) {
      CODES.put(type._code, type);
    }
  }

  private final String _code;
  private final InferredType _valueType;
  private final boolean _object;

  private LogicType(String code, InferredType valueType, boolean object) {
    _code = code;
    _valueType = valueType;
    _object = object;
  }

  public String getCode() {
    return _code;
  }

  /**
   * @return the type a value of this logic type has within expressions
   */
  public InferredType getValueType() {
    return _valueType;
  }

  public boolean isObject() {
    return _object;
  }

  public static LogicType fromCode(String code) {
    LogicType type = CODES.get(code);
    if(type == null) {
      throw new IllegalArgumentException("Unknown logic type " + code);
    }
    return type;
  }

  @Override
  public String toString() {
    return _code;
  }
}
