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

import java.util.Map;

import com.healthmarketscience.formlogic.FieldType;

/**
 * Maps field types to the types of the values they hold.
 *
 * @author James Ahlborn
 */
public interface FieldTypeLookup
{
  /**
   * @return the type of the value held by a field of the given type
   */
  public InferredType getValueType(FieldType fieldType);

  /**
   * @return the addressable sub-properties of a field value of the given type
   *         (in a stable order) mapped to their types, empty for types with
   *         no sub-properties
   */
  public Map<String,InferredType> getSubProperties(FieldType fieldType);
}
