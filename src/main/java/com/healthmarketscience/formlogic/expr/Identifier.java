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

package com.healthmarketscience.formlogic.expr;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * identifies a variable referenced by an expression, either a bare name
 * (e.g. a logic key {@code isAdult}) or a dotted member path (e.g. the field
 * path {@code fields.age.value}).  An Identifier must have at least one
 * segment.
 *
 * @author James Ahlborn
 */
public class Identifier
{
  private final List<String> _segments;
  private final String _path;

  public Identifier(String path)
  {
    this(Arrays.asList(StringUtils.split(path, '.')));
  }

  public Identifier(List<String> segments)
  {
    if(segments.isEmpty()) {
      throw new IllegalArgumentException("Identifier must have a name");
    }
    _segments = Collections.unmodifiableList(segments);
    _path = StringUtils.join(segments, '.');
  }

  /**
   * @return the individual names making up this identifier
   */
  public List<String> getSegments()
  {
    return _segments;
  }

  /**
   * @return the first segment of this identifier
   */
  public String getRoot()
  {
    return _segments.get(0);
  }

  /**
   * @return the full dotted path of this identifier
   */
  public String getPath()
  {
    return _path;
  }

  public boolean isBareName()
  {
    return (_segments.size() == 1);
  }

  @Override
  public int hashCode() {
    return _path.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if(!(o instanceof Identifier)) {
      return false;
    }

    return _path.equals(((Identifier)o)._path);
  }

  @Override
  public String toString() {
    return _path;
  }

}
