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

import java.util.Set;

/**
 * The read-only name to type mapping which expressions are checked against.
 * Names are field paths (e.g. {@code fields.age.value}) and logic key names
 * (e.g. {@code isAdult} or {@code total.amount} for object logic keys).
 *
 * @author James Ahlborn
 */
public interface TypeEnvironment
{
  /**
   * @return the recorded type of the given name, or
   *         {@link TypeInference#UNKNOWN} if the name is not defined
   */
  public TypeInference getVariableType(String name);

  public boolean hasVariable(String name);

  /**
   * @return the signature of the given function, {@code null} if no such
   *         function exists
   */
  public FunctionSignature getFunction(String name);

  /**
   * @return all defined names, in the order they were added
   */
  public Set<String> getVariableNames();
}
