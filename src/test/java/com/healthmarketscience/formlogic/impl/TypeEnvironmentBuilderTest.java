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

import com.healthmarketscience.formlogic.Bundle;
import com.healthmarketscience.formlogic.BundleContentItem;
import com.healthmarketscience.formlogic.Field;
import com.healthmarketscience.formlogic.FieldType;
import com.healthmarketscience.formlogic.Form;
import com.healthmarketscience.formlogic.LogicKey;
import com.healthmarketscience.formlogic.LogicType;
import com.healthmarketscience.formlogic.LogicValidator;
import com.healthmarketscience.formlogic.ValidationOptions;
import com.healthmarketscience.formlogic.type.InferredType;
import com.healthmarketscience.formlogic.type.TypeConfidence;
import com.healthmarketscience.formlogic.type.TypeEnvironment;
import com.healthmarketscience.formlogic.type.TypeInference;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;
import static com.healthmarketscience.formlogic.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class TypeEnvironmentBuilderTest
{

  @Test
  public void testFormEnvironment() throws Exception
  {
    Form form = createIntakeForm();
    TypeEnvironment env = LogicValidator.buildTypeEnvironment(form);

    assertEquals(TypeInference.certain(InferredType.NUMBER),
                 env.getVariableType("fields.age.value"));
    assertEquals(TypeInference.certain(InferredType.MONEY),
                 env.getVariableType("fields.fee.value"));
    assertEquals(TypeInference.certain(InferredType.NUMBER),
                 env.getVariableType("fields.fee.value.amount"));
    assertEquals(TypeInference.certain(InferredType.STRING),
                 env.getVariableType("fields.guardian.fullName.value"));

    // logic keys are derived, never certain
    assertEquals(TypeInference.inferred(InferredType.BOOLEAN),
                 env.getVariableType("isAdult"));
    assertEquals(TypeInference.inferred(InferredType.BOOLEAN),
                 env.getVariableType("isExempt"));

    assertFalse(env.hasVariable("fields.age"));
    assertFalse(env.hasVariable("fields.guardian.value.fullName"));
    assertEquals(TypeInference.UNKNOWN, env.getVariableType("nothing"));

    assertNotNull(env.getFunction("upper"));
    assertNull(env.getFunction("nothing"));

    // same result from the fields and logic directly
    assertEquals(env.getVariableNames(),
                 LogicValidator.buildTypeEnvironment(
                     form.getFields(), form.getLogic()).getVariableNames());
  }

  @Test
  public void testLogicKeyTypes() throws Exception
  {
    Form form = new Form("keys")
      .addField("qty", new Field(FieldType.NUMBER))
      .addField("name", new Field(FieldType.TEXT))
      .addLogicKey(new LogicKey("label", LogicType.STRING)
                   .setExpression("coalesce(fields.name.value, 'none')"))
      .addLogicKey(new LogicKey("doubled", LogicType.NUMBER)
                   .setExpression("fields.qty.value * 2"))
      .addLogicKey(new LogicKey("total", LogicType.MONEY)
                   .setProperty("amount", "doubled * 10")
                   .setProperty("currency", "'USD'"))
      .addLogicKey(new LogicKey("expensive", LogicType.BOOLEAN)
                   .setExpression("total.amount > 100"))
      .addLogicKey(new LogicKey("a", LogicType.BOOLEAN).setExpression("b"))
      .addLogicKey(new LogicKey("b", LogicType.BOOLEAN).setExpression("a"));

    TypeEnvironmentImpl env = new TypeEnvironmentBuilder(
        new ValidationOptions()).build(form);

    // inference abstains, the declared type is not substituted
    TypeInference label = env.getVariableType("label");
    assertTrue(env.hasVariable("label"));
    assertEquals(TypeConfidence.UNKNOWN, label.getConfidence());
    assertFalse(label.isKnown());

    assertEquals(TypeInference.inferred(InferredType.NUMBER),
                 env.getVariableType("doubled"));
    assertEquals(TypeInference.inferred(InferredType.NUMBER),
                 env.getVariableType("total.amount"));
    assertEquals(TypeInference.inferred(InferredType.STRING),
                 env.getVariableType("total.currency"));
    assertEquals(TypeInference.inferred(InferredType.MONEY),
                 env.getVariableType("total"));
    assertEquals(TypeInference.inferred(InferredType.BOOLEAN),
                 env.getVariableType("expensive"));

    // cyclic keys are present but unknown
    assertTrue(env.hasVariable("a"));
    assertTrue(env.hasVariable("b"));
    assertEquals(TypeConfidence.UNKNOWN,
                 env.getVariableType("a").getConfidence());
    assertEquals(set("a", "b"), env.getLogicKeyOrder().getCyclicKeys());
  }

  @Test
  public void testBundleEnvironment() throws Exception
  {
    Bundle inner = new Bundle("inner")
      .addContent(BundleContentItem.inline(
                      "extra", new Form("extra")
                      .addField("x", new Field(FieldType.TEXT))));

    Bundle bundle = new Bundle("onboarding")
      .addContent(BundleContentItem.inline("intake", createIntakeForm()))
      .addContent(BundleContentItem.inline("more", inner))
      .addContent(BundleContentItem.path("terms", "./terms.form.json"))
      .addContent(BundleContentItem.registry("kyc", "acme/kyc"))
      .addLogicKey(new LogicKey("adultApplicant", LogicType.BOOLEAN)
                   .setExpression("forms.intake.isAdult"));

    TypeEnvironment env = LogicValidator.buildTypeEnvironment(bundle);

    assertEquals(TypeInference.certain(InferredType.NUMBER),
                 env.getVariableType("forms.intake.fields.age.value"));
    assertEquals(TypeInference.inferred(InferredType.BOOLEAN),
                 env.getVariableType("forms.intake.isAdult"));
    assertEquals(TypeInference.certain(InferredType.STRING),
                 env.getVariableType("bundles.more.forms.extra.fields.x.value"));
    assertEquals(TypeInference.inferred(InferredType.BOOLEAN),
                 env.getVariableType("adultApplicant"));

    assertFalse(env.hasVariable("fields.age.value"));
    for(String name : env.getVariableNames()) {
      assertFalse(name.startsWith("forms.terms") || name.startsWith("forms.kyc"),
                  name);
    }

    assertThrows(IllegalArgumentException.class,
                 () -> LogicValidator.buildTypeEnvironment((Form)null));
  }
}
