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
 * A form field definition.  Fields of type {@link FieldType#FIELDSET} hold
 * nested fields, keyed by id.  The setters return this instance so that they
 * can be chained.
 *
 * @author James Ahlborn
 */
public class Field
{
  private final FieldType _type;
  private String _label;
  private String _description;
  private CondExpr _required;
  private CondExpr _visible;
  private CondExpr _disabled;
  private final Map<String,Field> _fields = new LinkedHashMap<String,Field>();

  public Field(FieldType type) {
    _type = Objects.requireNonNull(type, "type");
  }

  public FieldType getType() {
    return _type;
  }

  public String getLabel() {
    return _label;
  }

  public Field setLabel(String label) {
    _label = label;
    return this;
  }

  public String getDescription() {
    return _description;
  }

  public Field setDescription(String description) {
    _description = description;
    return this;
  }

  /**
   * @return the required condition, {@code null} if unset
   */
  public CondExpr getRequired() {
    return _required;
  }

  public Field setRequired(CondExpr required) {
    _required = required;
    return this;
  }

  public Field setRequired(String expression) {
    return setRequired(CondExpr.of(expression));
  }

  public Field setRequired(boolean required) {
    return setRequired(CondExpr.of(required));
  }

  /**
   * @return the visibility condition, {@code null} if unset
   */
  public CondExpr getVisible() {
    return _visible;
  }

  public Field setVisible(CondExpr visible) {
    _visible = visible;
    return this;
  }

  public Field setVisible(String expression) {
    return setVisible(CondExpr.of(expression));
  }

  public Field setVisible(boolean visible) {
    return setVisible(CondExpr.of(visible));
  }

  /**
   * @return the read-only condition, {@code null} if unset
   */
  public CondExpr getDisabled() {
    return _disabled;
  }

  public Field setDisabled(CondExpr disabled) {
    _disabled = disabled;
    return this;
  }

  public Field setDisabled(String expression) {
    return setDisabled(CondExpr.of(expression));
  }

  public Field setDisabled(boolean disabled) {
    return setDisabled(CondExpr.of(disabled));
  }

  /**
   * @return the nested fields of a fieldset, empty for all other types
   */
  public Map<String,Field> getFields() {
    return Collections.unmodifiableMap(_fields);
  }

  /**
   * Adds a nested field to this fieldset.
   *
   * @throws IllegalStateException if this field is not a fieldset
   */
  public Field addField(String id, Field field) {
    if(_type != FieldType.FIELDSET) {
      throw new IllegalStateException(
          "Only fieldset fields may contain nested fields, not " + _type);
    }
    _fields.put(Objects.requireNonNull(id, "id"),
                Objects.requireNonNull(field, "field"));
    return this;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("type", _type)
      .append("label", _label)
      .append("required", _required)
      .append("visible", _visible)
      .append("disabled", _disabled)
      .append("fields", _fields)
      .toString();
  }
}
