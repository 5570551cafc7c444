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

import java.util.Map;

import com.healthmarketscience.formlogic.Artifact;
import com.healthmarketscience.formlogic.Bundle;
import com.healthmarketscience.formlogic.BundleContentItem;
import com.healthmarketscience.formlogic.Field;
import com.healthmarketscience.formlogic.Form;
import com.healthmarketscience.formlogic.LogicKey;
import com.healthmarketscience.formlogic.LogicKeyOrder;
import com.healthmarketscience.formlogic.LogicSection;
import com.healthmarketscience.formlogic.ValidationOptions;
import com.healthmarketscience.formlogic.type.TypeConfidence;
import com.healthmarketscience.formlogic.type.TypeInference;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Builds the {@link TypeEnvironmentImpl} for an artifact.  Field paths are
 * recorded with certain confidence, then the logic keys are inferred in
 * dependency order so that each key sees the types of the keys it
 * references.  Keys involved in a dependency cycle are recorded as unknown
 * without attempting inference.
 * <p>
 * For a bundle, the environment of each inline artifact is built on its own
 * and added under {@code forms.<key>.} (inline forms) or
 * {@code bundles.<key>.} (inline bundles), before the bundle's own logic
 * keys are inferred.
 *
 * @author James Ahlborn
 */
public class TypeEnvironmentBuilder
{
  private static final Log LOG = LogFactory.getLog(TypeEnvironmentBuilder.class);

  public static final String FORMS_PREFIX = "forms";
  public static final String BUNDLES_PREFIX = "bundles";

  private final ValidationOptions _options;
  private final FieldPaths _fieldPaths;

  public TypeEnvironmentBuilder(ValidationOptions options) {
    _options = options;
    _fieldPaths = new FieldPaths(options.getFieldTypeLookup(),
                                 options.getMaxFieldDepth());
  }

  public FieldPaths getFieldPaths() {
    return _fieldPaths;
  }

  public TypeEnvironmentImpl build(Artifact artifact) {
    if(artifact instanceof Form) {
      return buildForm((Form)artifact);
    }
    if(artifact instanceof Bundle) {
      return buildBundle((Bundle)artifact);
    }
    throw new IllegalArgumentException(
        "Unsupported artifact " + ((artifact != null) ?
                                   artifact.getClass().getName() : null));
  }

  public TypeEnvironmentImpl buildForm(Form form) {
    return build(form.getFields(), form.getLogic());
  }

  public TypeEnvironmentImpl build(Map<String,Field> fields,
                                   LogicSection logic) {
    TypeEnvironmentImpl env = newEnvironment();

    env.setVariableTypes(
        _fieldPaths.collectFieldTypes(fields, FieldPaths.FIELDS_PREFIX),
        TypeConfidence.CERTAIN);

    addLogic(env, logic);

    return env;
  }

  public TypeEnvironmentImpl buildBundle(Bundle bundle) {
    TypeEnvironmentImpl env = newEnvironment();

    for(BundleContentItem item : bundle.getContents()) {
      if(item.getType() != BundleContentItem.Type.INLINE) {
        // referenced artifacts are not available here
        continue;
      }

      Artifact artifact = item.getArtifact();
      if(artifact instanceof Form) {
        env.addNested(FORMS_PREFIX + "." + item.getKey(),
                      buildForm((Form)artifact));
      } else if(artifact instanceof Bundle) {
        env.addNested(BUNDLES_PREFIX + "." + item.getKey(),
                      buildBundle((Bundle)artifact));
      }
    }

    addLogic(env, bundle.getLogic());

    return env;
  }

  private TypeEnvironmentImpl newEnvironment() {
    return new TypeEnvironmentImpl(_options.getFunctionLookup());
  }

  private static void addLogic(TypeEnvironmentImpl env, LogicSection logic) {

    LogicKeyOrder order = LogicKeySorter.sort(logic);
    env.setLogicKeyOrder(order);

    // cyclic keys are known names with unknown types, so that references to
    // them are neither unknown variables nor guesses
    for(String name : order.getCyclicKeys()) {
      LogicKey key = logic.getKey(name);
      TypeInference unknown = TypeInference.unknown("dependency cycle");
      env.setVariableType(name, unknown);
      for(String prop : key.getProperties().keySet()) {
        env.setVariableType(name + "." + prop, unknown);
      }
    }

    for(String name : order.getSorted()) {
      if(order.isCyclic(name)) {
        continue;
      }
      addLogicKey(env, logic.getKey(name));
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("Inferred logic key types in order " + order.getSorted() +
                (order.getCyclicKeys().isEmpty() ? "" :
                 ", cyclic keys " + order.getCyclicKeys()));
    }
  }

  private static void addLogicKey(TypeEnvironmentImpl env, LogicKey key) {
    String name = key.getName();

    if(key.getType().isObject()) {
      // the properties are inferred individually, the object itself has the
      // declared shape
      for(Map.Entry<String,String> e : key.getProperties().entrySet()) {
        env.setVariableType(name + "." + e.getKey(),
                            inferLogicExpr(e.getValue(), env));
      }
      env.setVariableType(name, new TypeInference(
                              key.getType().getValueType(),
                              TypeConfidence.INFERRED, "declared"));
      return;
    }

    // an abstained inference stays unknown, the declaration is only checked
    // against what was actually inferred
    env.setVariableType(name, inferLogicExpr(key.getExpression(), env));
  }

  private static TypeInference inferLogicExpr(String exprStr,
                                              TypeEnvironmentImpl env) {
    if(exprStr == null) {
      return TypeInference.unknown("no expression");
    }
    TypeInference type = TypeInferrer.infer(exprStr, env);
    if(type.getConfidence() == TypeConfidence.CERTAIN) {
      // derived from an expression, not a definition
      type = type.withConfidence(TypeConfidence.INFERRED);
    }
    return type;
  }
}
