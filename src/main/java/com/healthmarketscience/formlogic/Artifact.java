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

/**
 * Base class for the document definitions which carry logic, a {@link Form}
 * or a {@link Bundle}.
 *
 * @author James Ahlborn
 */
public abstract class Artifact
{
  private final String _name;
  private String _title;
  private LogicSection _logic = new LogicSection();

  protected Artifact(String name) {
    _name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return _name;
  }

  public String getTitle() {
    return _title;
  }

  public Artifact setTitle(String title) {
    _title = title;
    return this;
  }

  /**
   * @return the logic section, never {@code null} (possibly empty)
   */
  public LogicSection getLogic() {
    return _logic;
  }

  public Artifact setLogic(LogicSection logic) {
    _logic = ((logic != null) ? logic : new LogicSection());
    return this;
  }

  public Artifact addLogicKey(LogicKey key) {
    _logic.add(key);
    return this;
  }
}
