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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.formlogic.LogicKey;
import com.healthmarketscience.formlogic.LogicKeyOrder;
import com.healthmarketscience.formlogic.LogicSection;
import com.healthmarketscience.formlogic.expr.Identifier;
import com.healthmarketscience.formlogic.expr.ParseResult;
import com.healthmarketscience.formlogic.impl.expr.Expressionator;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Computes the evaluation order of the keys of a {@link LogicSection} from
 * the references between their expressions.  A key depends on another key
 * if one of its expressions references that key by name, or references a
 * property ({@code <name>.<property>}) of that key when it is an object
 * key.  Field paths and unknown names never create dependencies, neither do
 * expressions which fail to parse.
 *
 * @author James Ahlborn
 */
public class LogicKeySorter
{
  private static final Log LOG = LogFactory.getLog(LogicKeySorter.class);

  private LogicKeySorter() {}

  public static LogicKeyOrder sort(LogicSection logic) {

    final Map<String,Set<String>> deps = new HashMap<String,Set<String>>();
    for(LogicKey key : logic) {
      deps.put(key.getName(), getDependencies(key, logic));
    }

    List<String> names = new ArrayList<String>(logic.getNames());
    TopoSorter<String> sorter = new TopoSorter<String>(names) {
      @Override
      protected void getDependencies(String from, List<String> dependencies) {
        dependencies.addAll(deps.get(from));
      }
    };
    sorter.sort();

    Set<String> cyclicKeys = new LinkedHashSet<String>(
        sorter.getCyclicValues());
    if(!cyclicKeys.isEmpty() && LOG.isDebugEnabled()) {
      LOG.debug("Logic keys " + cyclicKeys + " are part of a dependency cycle");
    }

    return new LogicKeyOrder(names, cyclicKeys);
  }

  /**
   * @return the variables referenced by all the expressions of the given
   *         key, in order of first appearance.  Expressions which fail to
   *         parse contribute nothing.
   */
  public static Set<String> getVariables(LogicKey key) {
    Set<String> vars = new LinkedHashSet<String>();
    for(String exprStr : getExpressions(key)) {
      ParseResult result = Expressionator.parseExpression(exprStr);
      vars.addAll(result.getVariables());
    }
    return vars;
  }

  /**
   * @return the expression texts of the given key, one for a scalar key, one
   *         per property for an object key
   */
  public static List<String> getExpressions(LogicKey key) {
    List<String> exprs = new ArrayList<String>();
    if(key.getType().isObject()) {
      for(String exprStr : key.getProperties().values()) {
        if(exprStr != null) {
          exprs.add(exprStr);
        }
      }
    } else if(key.getExpression() != null) {
      exprs.add(key.getExpression());
    }
    return exprs;
  }

  private static Set<String> getDependencies(LogicKey key, LogicSection logic) {
    Set<String> deps = new LinkedHashSet<String>();
    for(String var : getVariables(key)) {
      String dep = resolveKeyReference(var, logic);
      if(dep != null) {
        deps.add(dep);
      }
    }
    return deps;
  }

  /**
   * @return the name of the logic key referenced by the given variable, or
   *         {@code null} if the variable does not reference a logic key
   */
  static String resolveKeyReference(String var, LogicSection logic) {
    if(logic.hasKey(var)) {
      return var;
    }
    Identifier id = new Identifier(var);
    if(!id.isBareName()) {
      LogicKey key = logic.getKey(id.getRoot());
      if((key != null) && key.getType().isObject()) {
        return key.getName();
      }
    }
    return null;
  }
}
