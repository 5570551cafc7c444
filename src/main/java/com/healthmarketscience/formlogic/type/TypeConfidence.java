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

/**
 * How sure the inferrer is about an {@link InferredType}.  Ordered from
 * strongest to weakest.
 *
 * @author James Ahlborn
 */
public enum TypeConfidence
{
  /** known from a literal, a field definition or a function signature */
  CERTAIN("certain"),
  /** derived from other inferences */
  INFERRED("inferred"),
  UNKNOWN("unknown");

  private final String _str;

  private TypeConfidence(String str) {
    _str = str;
  }

  /**
   * @return the weaker of the two given confidences
   */
  public static TypeConfidence weakest(TypeConfidence c1, TypeConfidence c2) {
    return ((c1.ordinal() >= c2.ordinal()) ? c1 : c2);
  }

  @Override
  public String toString() {
    return _str;
  }
}
