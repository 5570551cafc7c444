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

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The ordered collection of {@link LogicKey}s of an artifact, keyed by name.
 * Iteration follows declaration order.
 *
 * @author James Ahlborn
 */
public class LogicSection implements Iterable<LogicKey>
{
  private final Map<String,LogicKey> _keys =
    new LinkedHashMap<String,LogicKey>();

  public LogicSection() {}

  public LogicSection(LogicKey... keys) {
    for(LogicKey key : keys) {
      add(key);
    }
  }

  /**
   * Adds the given key, replacing any existing key with the same name.
   */
  public LogicSection add(LogicKey key) {
    _keys.put(key.getName(), key);
    return this;
  }

  public LogicKey getKey(String name) {
    return _keys.get(name);
  }

  public boolean hasKey(String name) {
    return _keys.containsKey(name);
  }

  public Set<String> getNames() {
    return Collections.unmodifiableSet(_keys.keySet());
  }

  public Collection<LogicKey> getKeys() {
    return Collections.unmodifiableCollection(_keys.values());
  }

  public int size() {
    return _keys.size();
  }

  public boolean isEmpty() {
    return _keys.isEmpty();
  }

  @Override
  public Iterator<LogicKey> iterator() {
    return getKeys().iterator();
  }

  @Override
  public String toString() {
    return _keys.values().toString();
  }
}
