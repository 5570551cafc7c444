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

package com.healthmarketscience.formlogic;

import java.util.Arrays;

import com.healthmarketscience.formlogic.type.InferredType;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class ModelTest
{

  @Test
  public void testLogicKeys() throws Exception
  {
    LogicKey key = new LogicKey("total", LogicType.MONEY)
      .setProperty("amount", "1")
      .setProperty("currency", "'EUR'");
    assertEquals(Arrays.asList("amount", "currency"),
                 Arrays.asList(key.getProperties().keySet().toArray()));
    assertNull(key.getExpression());
    assertThrows(IllegalStateException.class, () -> key.setExpression("1"));

    LogicKey flag = new LogicKey("flag", LogicType.BOOLEAN);
    assertThrows(IllegalStateException.class,
                 () -> flag.setProperty("amount", "1"));
    assertTrue(flag.getProperties().isEmpty());

    String str = key.toString();
    assertTrue(str.startsWith("LogicKey["), str);
    assertTrue(str.contains("amount=1"), str);
  }

  @Test
  public void testTypeCodes() throws Exception
  {
    assertSame(FieldType.MULTISELECT, FieldType.fromCode("multiselect"));
    assertSame(LogicType.PERCENTAGE, LogicType.fromCode("percentage"));
    assertEquals(InferredType.NUMBER, LogicType.PERCENTAGE.getValueType());
    assertTrue(LogicType.ADDRESS.isObject());
    assertFalse(LogicType.DURATION.isObject());
    assertThrows(IllegalArgumentException.class,
                 () -> FieldType.fromCode("signature"));
    assertThrows(IllegalArgumentException.class,
                 () -> LogicType.fromCode("text"));

    assertSame(InferredType.DATETIME, InferredType.fromName("datetime"));
    assertNull(InferredType.fromName("DATETIME"));
    assertTrue(InferredType.INTEGER.isNumeric());
    assertTrue(InferredType.DURATION.isTemporal());
    assertTrue(InferredType.ARRAY.isComposite());
    assertFalse(InferredType.NULL.isComposite());
    assertFalse(InferredType.UNKNOWN.isKnown());
  }

  @Test
  public void testLogicSection() throws Exception
  {
    LogicSection logic = new LogicSection()
      .add(new LogicKey("b", LogicType.STRING))
      .add(new LogicKey("a", LogicType.STRING));
    assertEquals(Arrays.asList("b", "a"),
                 Arrays.asList(logic.getNames().toArray()));
    assertEquals(2, logic.size());
    assertTrue(logic.hasKey("a"));
    assertNull(logic.getKey("c"));

    Form form = new Form("f");
    assertTrue(form.getLogic().isEmpty());
    assertSame(form, form.setLogic(logic));
    assertSame(logic, form.getLogic());
  }

  @Test
  public void testConditions() throws Exception
  {
    assertSame(CondExpr.TRUE, CondExpr.of(true));
    assertTrue(CondExpr.TRUE.isLiteral());
    assertFalse(CondExpr.FALSE.getLiteral());
    assertNull(CondExpr.TRUE.getExpression());

    CondExpr cond = CondExpr.of("isAdult");
    assertFalse(cond.isLiteral());
    assertEquals("isAdult", cond.getExpression());
    assertEquals(cond, CondExpr.of("isAdult"));
    assertThrows(IllegalStateException.class, () -> cond.getLiteral());

    Field field = new Field(FieldType.TEXT).setVisible("isAdult");
    assertEquals(cond, field.getVisible());
    assertEquals(CondExpr.TRUE, field.setRequired(true).getRequired());
  }

  @Test
  public void testToString() throws Exception
  {
    String nl = System.lineSeparator();
    Form form = new Form("contact")
      .addField("email", new Field(FieldType.EMAIL)
                .setVisible("fields.phone.value == null"));

    String str = form.toString();
    assertTrue(str.startsWith("Form[" + nl + "  name: contact" + nl), str);
    assertTrue(str.contains("annexes: []"), str);
    // nested containers are indented one more level
    assertTrue(str.contains(nl + "    email=Field[" + nl + "      type: "),
               str);
    assertTrue(str.endsWith(nl + "]"), str);

    assertEquals(-1, new Annex("id", "ID").toString().indexOf(nl));
  }
}
