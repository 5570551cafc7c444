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

import java.util.Objects;

import com.healthmarketscience.formlogic.impl.CustomToStringStyle;

/**
 * A supporting document slot attached to a form.
 *
 * @author James Ahlborn
 */
public class Annex
{
  private final String _id;
  private final String _title;
  private String _description;
  private CondExpr _required;
  private CondExpr _visible;

  public Annex(String id, String title) {
    _id = Objects.requireNonNull(id, "id");
    _title = title;
  }

  public String getId() {
    return _id;
  }

  public String getTitle() {
    return _title;
  }

  public String getDescription() {
    return _description;
  }

  public Annex setDescription(String description) {
    _description = description;
    return this;
  }

  public CondExpr getRequired() {
    return _required;
  }

  public Annex setRequired(CondExpr required) {
    _required = required;
    return this;
  }

  public Annex setRequired(String expression) {
    return setRequired(CondExpr.of(expression));
  }

  public CondExpr getVisible() {
    return _visible;
  }

  public Annex setVisible(CondExpr visible) {
    _visible = visible;
    return this;
  }

  public Annex setVisible(String expression) {
    return setVisible(CondExpr.of(expression));
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("id", _id)
      .append("title", _title)
      .append("required", _required)
      .append("visible", _visible)
      .toString();
  }
}
