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

package com.healthmarketscience.formlogic.impl;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.formlogic.Field;
import com.healthmarketscience.formlogic.FieldType;
import com.healthmarketscience.formlogic.type.FieldTypeLookup;
import com.healthmarketscience.formlogic.type.InferredType;
import org.apache.commons.lang3.StringUtils;

/**
 * Enumerates the variable paths under which expressions may reference the
 * values of form fields.  For a field {@code age} the path is
 * {@code fields.age.value}, composite values add a path per sub-property
 * ({@code fields.price.value.amount}) and the fields of a fieldset are
 * nested under the fieldset id ({@code fields.applicant.name.value}).
 *
 * @author James Ahlborn
 */
public class FieldPaths
{
  public static final String FIELDS_PREFIX = "fields";
  public static final String VALUE_SEGMENT = "value";

  private static final char PATH_SEP = '.';

  private final FieldTypeLookup _fieldTypes;
  private final int _maxDepth;

  public FieldPaths(FieldTypeLookup fieldTypes, int maxDepth) {
    _fieldTypes = fieldTypes;
    _maxDepth = maxDepth;
  }

  /**
   * @return every path reachable from the given fields mapped to the type of
   *         the value at that path, in field declaration order
   * @throws IllegalArgumentException if fieldsets are nested deeper than the
   *         configured maximum
   */
  public Map<String,InferredType> collectFieldTypes(
      Map<String,Field> fields, String prefix) {
    Map<String,InferredType> types = new LinkedHashMap<String,InferredType>();
    collectFieldTypes(fields, prefix, 1, types);
    return types;
  }

  public Set<String> collectFieldPaths(Map<String,Field> fields, String prefix) {
    return new LinkedHashSet<String>(collectFieldTypes(fields, prefix).keySet());
  }

  /**
   * @return the dotted ids of the given fields and all nested fields, e.g.
   *         {@code applicant} and {@code applicant.name}
   */
  public Set<String> collectFieldIds(Map<String,Field> fields, String prefix) {
    Set<String> ids = new LinkedHashSet<String>();
    collectFieldIds(fields, prefix, 1, ids);
    return ids;
  }

  private void collectFieldTypes(Map<String,Field> fields, String prefix,
                                 int depth, Map<String,InferredType> types) {
    checkDepth(depth, prefix);

    for(Map.Entry<String,Field> e : fields.entrySet()) {
      String fieldPath = join(prefix, e.getKey());
      Field field = e.getValue();
      FieldType fieldType = field.getType();

      String valuePath = join(fieldPath, VALUE_SEGMENT);
      types.put(valuePath, _fieldTypes.getValueType(fieldType));

      for(Map.Entry<String,InferredType> sub :
            _fieldTypes.getSubProperties(fieldType).entrySet()) {
        types.put(join(valuePath, sub.getKey()), sub.getValue());
      }

      if(fieldType == FieldType.FIELDSET) {
        collectFieldTypes(field.getFields(), fieldPath, depth + 1, types);
      }
    }
  }

  private void collectFieldIds(Map<String,Field> fields, String prefix,
                               int depth, Set<String> ids) {
    checkDepth(depth, prefix);

    for(Map.Entry<String,Field> e : fields.entrySet()) {
      String id = join(prefix, e.getKey());
      ids.add(id);

      Field field = e.getValue();
      if(field.getType() == FieldType.FIELDSET) {
        collectFieldIds(field.getFields(), id, depth + 1, ids);
      }
    }
  }

  private void checkDepth(int depth, String prefix) {
    if(depth > _maxDepth) {
      throw new IllegalArgumentException(
          "Fieldsets nested deeper than " + _maxDepth + " levels at '" +
          prefix + "'");
    }
  }

  private static String join(String prefix, String name) {
    if(StringUtils.isEmpty(prefix)) {
      return name;
    }
    return prefix + PATH_SEP + name;
  }
}
