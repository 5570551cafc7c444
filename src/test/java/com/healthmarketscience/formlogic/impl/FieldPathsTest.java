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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import com.healthmarketscience.formlogic.Field;
import com.healthmarketscience.formlogic.FieldType;
import com.healthmarketscience.formlogic.Form;
import com.healthmarketscience.formlogic.LogicValidator;
import com.healthmarketscience.formlogic.type.DefaultFieldTypes;
import com.healthmarketscience.formlogic.type.InferredType;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;
import static com.healthmarketscience.formlogic.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class FieldPathsTest
{

  @Test
  public void testFieldTypes() throws Exception
  {
    Form form = new Form("paths")
      .addField("name", new Field(FieldType.TEXT))
      .addField("fee", new Field(FieldType.MONEY))
      .addField("applicant", new Field(FieldType.FIELDSET)
                .addField("dob", new Field(FieldType.DATE))
                .addField("tags", new Field(FieldType.MULTISELECT)));

    Map<String,InferredType> expected =
      new LinkedHashMap<String,InferredType>();
    expected.put("fields.name.value", InferredType.STRING);
    expected.put("fields.fee.value", InferredType.MONEY);
    expected.put("fields.fee.value.amount", InferredType.NUMBER);
    expected.put("fields.fee.value.currency", InferredType.STRING);
    expected.put("fields.applicant.value", InferredType.OBJECT);
    expected.put("fields.applicant.dob.value", InferredType.DATE);
    expected.put("fields.applicant.tags.value", InferredType.ARRAY);

    FieldPaths paths = new FieldPaths(DefaultFieldTypes.INSTANCE, 32);
    Map<String,InferredType> types = paths.collectFieldTypes(
        form.getFields(), FieldPaths.FIELDS_PREFIX);
    assertEquals(expected, types);
    // declaration order
    assertEquals(new ArrayList<String>(expected.keySet()),
                 new ArrayList<String>(types.keySet()));

    assertEquals(expected.keySet(),
                 LogicValidator.collectFieldPaths(form.getFields()));

    assertEquals(set("name", "fee", "applicant", "applicant.dob",
                     "applicant.tags"),
                 LogicValidator.collectFieldIds(form.getFields()));
    assertEquals(set("x.name", "x.fee", "x.applicant", "x.applicant.dob",
                     "x.applicant.tags"),
                 LogicValidator.collectFieldIds(form.getFields(), "x"));
  }

  @Test
  public void testCompositeSubPaths() throws Exception
  {
    Map<String,Field> fields = new LinkedHashMap<String,Field>();
    fields.put("home", new Field(FieldType.ADDRESS));
    fields.put("where", new Field(FieldType.COORDINATE));
    fields.put("id", new Field(FieldType.IDENTIFICATION));

    Map<String,InferredType> types = new FieldPaths(
        DefaultFieldTypes.INSTANCE, 32).collectFieldTypes(fields, "fields");

    assertEquals(InferredType.ADDRESS, types.get("fields.home.value"));
    assertEquals(InferredType.STRING, types.get("fields.home.value.postalCode"));
    assertEquals(InferredType.NUMBER, types.get("fields.where.value.lat"));
    assertEquals(InferredType.NUMBER, types.get("fields.where.value.lon"));
    assertEquals(InferredType.DATE, types.get("fields.id.value.expiryDate"));
    assertEquals(InferredType.STRING, types.get("fields.id.value.idNumber"));
    assertFalse(types.containsKey("fields.home.value.amount"));
  }

  @Test
  public void testEmptyAndPrefix() throws Exception
  {
    FieldPaths paths = new FieldPaths(DefaultFieldTypes.INSTANCE, 32);
    assertTrue(paths.collectFieldPaths(
                   new LinkedHashMap<String,Field>(), "fields").isEmpty());

    Map<String,Field> fields = new LinkedHashMap<String,Field>();
    fields.put("age", new Field(FieldType.NUMBER));
    assertEquals(set("age.value"), paths.collectFieldPaths(fields, ""));
    assertEquals(set("forms.a.fields.age.value"),
                 paths.collectFieldPaths(fields, "forms.a.fields"));
  }

  @Test
  public void testMaxDepth() throws Exception
  {
    Field inner = new Field(FieldType.FIELDSET)
      .addField("leaf", new Field(FieldType.TEXT));
    Map<String,Field> fields = new LinkedHashMap<String,Field>();
    fields.put("outer", new Field(FieldType.FIELDSET).addField("inner", inner));

    // three levels of fields
    assertEquals(Arrays.asList("fields.outer.value",
                               "fields.outer.inner.value",
                               "fields.outer.inner.leaf.value"),
                 new ArrayList<String>(new FieldPaths(
                     DefaultFieldTypes.INSTANCE, 3).collectFieldPaths(
                         fields, "fields")));

    IllegalArgumentException e = assertThrows(
        IllegalArgumentException.class,
        () -> new FieldPaths(DefaultFieldTypes.INSTANCE, 2)
          .collectFieldPaths(fields, "fields"));
    assertTrue(e.getMessage().startsWith("Fieldsets nested deeper than 2"));

    assertThrows(IllegalStateException.class,
                 () -> new Field(FieldType.TEXT).addField(
                     "x", new Field(FieldType.TEXT)));
  }
}
