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
import java.util.List;
import java.util.Objects;

import com.healthmarketscience.formlogic.impl.CustomToStringStyle;

/**
 * A collection of other artifacts, each optionally included based on a
 * condition.  Inline contents embed the artifact itself, path and registry
 * contents only reference it.
 *
 * @author James Ahlborn
 */
public class Bundle extends Artifact
{
  private final List<BundleContentItem> _contents =
    new ArrayList<BundleContentItem>();

  public Bundle(String name) {
    super(name);
  }

  @Override
  public Bundle setTitle(String title) {
    super.setTitle(title);
    return this;
  }

  @Override
  public Bundle setLogic(LogicSection logic) {
    super.setLogic(logic);
    return this;
  }

  @Override
  public Bundle addLogicKey(LogicKey key) {
    super.addLogicKey(key);
    return this;
  }

  public List<BundleContentItem> getContents() {
    return Collections.unmodifiableList(_contents);
  }

  public Bundle addContent(BundleContentItem item) {
    _contents.add(Objects.requireNonNull(item, "item"));
    return this;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("name", getName())
      .append("contents", _contents)
      .append("logic", getLogic())
      .toString();
  }
}
