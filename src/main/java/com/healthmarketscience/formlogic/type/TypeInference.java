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

import java.util.Objects;

/**
 * The result of inferring the type of an expression (or the recorded type of
 * a name in a {@link TypeEnvironment}).  Instances are immutable.
 *
 * @author James Ahlborn
 */
public final class TypeInference
{
  public static final TypeInference UNKNOWN =
    new TypeInference(InferredType.UNKNOWN, TypeConfidence.UNKNOWN, null);

  private final InferredType _type;
  private final TypeConfidence _confidence;
  private final String _reason;

  public TypeInference(InferredType type, TypeConfidence confidence) {
    this(type, confidence, null);
  }

  public TypeInference(InferredType type, TypeConfidence confidence,
                       String reason) {
    _type = Objects.requireNonNull(type, "type");
    _confidence = Objects.requireNonNull(confidence, "confidence");
    _reason = reason;
  }

  public static TypeInference certain(InferredType type) {
    return new TypeInference(type, TypeConfidence.CERTAIN);
  }

  public static TypeInference inferred(InferredType type) {
    return new TypeInference(type, TypeConfidence.INFERRED);
  }

  public static TypeInference unknown(String reason) {
    return new TypeInference(InferredType.UNKNOWN, TypeConfidence.UNKNOWN,
                             reason);
  }

  public InferredType getType() {
    return _type;
  }

  public TypeConfidence getConfidence() {
    return _confidence;
  }

  /**
   * @return a short human readable explanation of how the type was
   *         determined, may be {@code null}
   */
  public String getReason() {
    return _reason;
  }

  public boolean isKnown() {
    return ((_type != InferredType.UNKNOWN) &&
            (_confidence != TypeConfidence.UNKNOWN));
  }

  public TypeInference withConfidence(TypeConfidence confidence) {
    if(confidence == _confidence) {
      return this;
    }
    return new TypeInference(_type, confidence, _reason);
  }

  /**
   * Equality considers the type and confidence only, the reason is
   * informational.
   */
  @Override
  public int hashCode() {
    return _type.hashCode() * 31 + _confidence.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if(!(o instanceof TypeInference)) {
      return false;
    }
    TypeInference oi = (TypeInference)o;
    return ((_type == oi._type) && (_confidence == oi._confidence));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder()
      .append(_type).append("(").append(_confidence).append(")");
    if(_reason != null) {
      sb.append(" [").append(_reason).append("]");
    }
    return sb.toString();
  }
}
