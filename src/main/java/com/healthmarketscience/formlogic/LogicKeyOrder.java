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
import java.util.List;
import java.util.Set;

/**
 * Evaluation order of the keys of a {@link LogicSection}.  Every key appears
 * in the sorted list exactly once, after all the keys it references.  Keys
 * involved in a reference cycle come last and are also reported as cyclic.
 *
 * @author James Ahlborn
 */
public final class LogicKeyOrder
{
  private final List<String> _sorted;
  private final Set<String> _cyclicKeys;

  public LogicKeyOrder(List<String> sorted, Set<String> cyclicKeys) {
    _sorted = Collections.unmodifiableList(sorted);
    _cyclicKeys = Collections.unmodifiableSet(cyclicKeys);
  }

  public List<String> getSorted() {
    return _sorted;
  }

  public Set<String> getCyclicKeys() {
    return _cyclicKeys;
  }

  public boolean isCyclic(String key) {
    return _cyclicKeys.contains(key);
  }

  @Override
  public String toString() {
    return "LogicKeyOrder[sorted=" + _sorted + ", cyclic=" + _cyclicKeys + "]";
  }
}
