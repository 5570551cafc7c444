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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.healthmarketscience.formlogic.impl.CustomToStringStyle;

/**
 * A form definition: fields keyed by id, annexes and logic.
 *
 * @author James Ahlborn
 */
public class Form extends Artifact
{
  private final Map<String,Field> _fields = new LinkedHashMap<String,Field>();
  private final List<Annex> _annexes = new ArrayList<Annex>();

  public Form(String name) {
    super(name);
  }

  @Override
  public Form setTitle(String title) {
    super.setTitle(title);
    return this;
  }

  @Override
  public Form setLogic(LogicSection logic) {
    super.setLogic(logic);
    return this;
  }

  @Override
  public Form addLogicKey(LogicKey key) {
    super.addLogicKey(key);
    return this;
  }

  public Map<String,Field> getFields() {
    return Collections.unmodifiableMap(_fields);
  }

  public Form addField(String id, Field field) {
    _fields.put(Objects.requireNonNull(id, "id"),
                Objects.requireNonNull(field, "field"));
    return this;
  }

  public List<Annex> getAnnexes() {
    return Collections.unmodifiableList(_annexes);
  }

  public Form addAnnex(Annex annex) {
    _annexes.add(Objects.requireNonNull(annex, "annex"));
    return this;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("name", getName())
      .append("fields", _fields)
      .append("annexes", _annexes)
      .append("logic", getLogic())
      .toString();
  }
}
