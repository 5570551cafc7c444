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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.healthmarketscience.formlogic.impl.CustomToStringStyle;

/**
 * A named, derived value in an artifact's {@link LogicSection}.  A key of a
 * scalar {@link LogicType} has a single expression, a key of an object type
 * has an expression for each of its properties.  Other expressions refer to
 * a key by its name, or to a property of an object key as
 * {@code <name>.<property>}.
 *
 * @author James Ahlborn
 */
public class LogicKey
{
  private final String _name;
  private final LogicType _type;
  private String _label;
  private String _description;
  private String _expression;
  private final Map<String,String> _properties =
    new LinkedHashMap<String,String>();

  public LogicKey(String name, LogicType type) {
    _name = Objects.requireNonNull(name, "name");
    _type = Objects.requireNonNull(type, "type");
  }

  public String getName() {
    return _name;
  }

  public LogicType getType() {
    return _type;
  }

  public String getLabel() {
    return _label;
  }

  public LogicKey setLabel(String label) {
    _label = label;
    return this;
  }

  public String getDescription() {
    return _description;
  }

  public LogicKey setDescription(String description) {
    _description = description;
    return this;
  }

  /**
   * @return the expression of a scalar key, {@code null} for object keys
   */
  public String getExpression() {
    return _expression;
  }

  public LogicKey setExpression(String expression) {
    if(_type.isObject()) {
      throw new IllegalStateException(
          "Logic key " + _name + " of type " + _type +
          " requires property expressions");
    }
    _expression = expression;
    return this;
  }

  /**
   * @return the property expressions of an object key in declaration order,
   *         empty for scalar keys
   */
  public Map<String,String> getProperties() {
    return Collections.unmodifiableMap(_properties);
  }

  public LogicKey setProperty(String property, String expression) {
    if(!_type.isObject()) {
      throw new IllegalStateException(
          "Logic key " + _name + " of type " + _type +
          " does not have properties");
    }
    _properties.put(Objects.requireNonNull(property, "property"), expression);
    return this;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("name", _name)
      .append("type", _type)
      .append("expression", _expression)
      .append("properties", _properties)
      .toString();
  }
}
