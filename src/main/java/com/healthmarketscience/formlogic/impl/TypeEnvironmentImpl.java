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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.formlogic.LogicKeyOrder;
import com.healthmarketscience.formlogic.type.FunctionLookup;
import com.healthmarketscience.formlogic.type.FunctionSignature;
import com.healthmarketscience.formlogic.type.InferredType;
import com.healthmarketscience.formlogic.type.TypeConfidence;
import com.healthmarketscience.formlogic.type.TypeEnvironment;
import com.healthmarketscience.formlogic.type.TypeInference;

/**
 * Mutable TypeEnvironment populated by the {@link TypeEnvironmentBuilder}.
 *
 * @author James Ahlborn
 */
public class TypeEnvironmentImpl implements TypeEnvironment
{
  private final Map<String,TypeInference> _vars =
    new LinkedHashMap<String,TypeInference>();
  private final FunctionLookup _funcs;
  private LogicKeyOrder _keyOrder =
    new LogicKeyOrder(Collections.<String>emptyList(),
                      Collections.<String>emptySet());

  public TypeEnvironmentImpl(FunctionLookup funcs) {
    _funcs = funcs;
  }

  @Override
  public TypeInference getVariableType(String name) {
    TypeInference type = _vars.get(name);
    return ((type != null) ? type : TypeInference.UNKNOWN);
  }

  @Override
  public boolean hasVariable(String name) {
    return _vars.containsKey(name);
  }

  @Override
  public FunctionSignature getFunction(String name) {
    return _funcs.getFunction(name);
  }

  @Override
  public Set<String> getVariableNames() {
    return Collections.unmodifiableSet(_vars.keySet());
  }

  public void setVariableType(String name, TypeInference type) {
    _vars.put(name, type);
  }

  public void setVariableTypes(Map<String,InferredType> types,
                               TypeConfidence confidence) {
    for(Map.Entry<String,InferredType> e : types.entrySet()) {
      _vars.put(e.getKey(), new TypeInference(e.getValue(), confidence));
    }
  }

  /**
   * Copies all the variables of the given environment into this one, each
   * name prefixed with the given prefix and a dot.
   */
  public void addNested(String prefix, TypeEnvironment nested) {
    for(String name : nested.getVariableNames()) {
      _vars.put(prefix + "." + name, nested.getVariableType(name));
    }
  }

  /**
   * @return the evaluation order of the logic keys of the artifact this
   *         environment was built for
   */
  public LogicKeyOrder getLogicKeyOrder() {
    return _keyOrder;
  }

  void setLogicKeyOrder(LogicKeyOrder keyOrder) {
    _keyOrder = keyOrder;
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("variables", _vars)
      .toString();
  }
}
