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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.healthmarketscience.formlogic.type.InferredType.*;

/**
 * The functions available to every logic expression.  Lookup is case
 * sensitive.
 *
 * @author James Ahlborn
 */
public class BuiltinFunctions implements FunctionLookup
{
  public static final BuiltinFunctions INSTANCE = new BuiltinFunctions();

  private static final Map<String,FunctionSignature> FUNCS =
    new LinkedHashMap<String,FunctionSignature>();

  static {
    // string predicates
    registerFunc("contains", BOOLEAN, STRING, STRING);
    registerFunc("startsWith", BOOLEAN, STRING, STRING);
    registerFunc("endsWith", BOOLEAN, STRING, STRING);
    registerFunc("matches", BOOLEAN, STRING, STRING);
    registerFunc("isEmpty", BOOLEAN, UNKNOWN);
    registerFunc("isNotEmpty", BOOLEAN, UNKNOWN);

    // string functions
    registerFunc("upper", STRING, STRING);
    registerFunc("lower", STRING, STRING);
    registerFunc("trim", STRING, STRING);
    registerVarArgsFunc("concat", STRING, STRING);

    // numeric functions
    registerFunc("length", NUMBER, UNKNOWN);
    registerFunc("abs", NUMBER, NUMBER);
    registerVarArgsFunc("min", NUMBER, NUMBER);
    registerVarArgsFunc("max", NUMBER, NUMBER);
    registerFunc("ceil", NUMBER, NUMBER);
    registerFunc("floor", NUMBER, NUMBER);
    registerFunc("round", NUMBER, NUMBER);
    registerFunc("sqrt", NUMBER, NUMBER);
    registerFunc("pow", NUMBER, NUMBER, NUMBER);
    registerFunc("log", NUMBER, NUMBER);
    registerFunc("exp", NUMBER, NUMBER);
    registerFunc("sin", NUMBER, NUMBER);
    registerFunc("cos", NUMBER, NUMBER);
    registerFunc("tan", NUMBER, NUMBER);

    registerVarArgsFunc("coalesce", UNKNOWN, UNKNOWN);

    // signing party functions, the argument is the party role name
    registerFunc("partyCount", NUMBER, STRING);
    registerFunc("signedCount", NUMBER, STRING);
    registerFunc("witnessCount", NUMBER, STRING);
    registerFunc("allSigned", BOOLEAN, STRING);
    registerFunc("anySigned", BOOLEAN, STRING);
    registerFunc("allWitnessesSigned", BOOLEAN, STRING);
    registerFunc("anyWitnessSigned", BOOLEAN, STRING);
    registerFunc("partyType", STRING, STRING, NUMBER);
  }

  private BuiltinFunctions() {}

  @Override
  public FunctionSignature getFunction(String name) {
    return FUNCS.get(name);
  }

  /**
   * @return all the builtin functions, in registration order
   */
  public Map<String,FunctionSignature> getFunctions() {
    return Collections.unmodifiableMap(FUNCS);
  }

  private static void registerFunc(String name, InferredType returnType,
                                   InferredType... paramTypes) {
    FUNCS.put(name, new FunctionSignature(name, returnType, paramTypes));
  }

  private static void registerVarArgsFunc(String name, InferredType returnType,
                                          InferredType... paramTypes) {
    FUNCS.put(name, new FunctionSignature(name, returnType, true, paramTypes));
  }
}
