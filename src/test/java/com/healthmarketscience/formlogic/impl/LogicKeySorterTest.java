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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import com.healthmarketscience.formlogic.LogicKey;
import com.healthmarketscience.formlogic.LogicKeyOrder;
import com.healthmarketscience.formlogic.LogicSection;
import com.healthmarketscience.formlogic.LogicType;
import com.healthmarketscience.formlogic.LogicValidator;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;
import static com.healthmarketscience.formlogic.TestUtil.*;

/**
 *
 * @author James Ahlborn
 */
public class LogicKeySorterTest
{

  @Test
  public void testNoDependencies() throws Exception
  {
    List<LogicKey> keys = Arrays.asList(
        bool("c", "fields.a.value > 1"),
        bool("a", "true"),
        bool("b", "fields.b.value == 'x'"),
        bool("isAdult", "fields.age.value >= 18"));

    for(int i = 0; i < 2; ++i) {
      LogicSection logic = new LogicSection(keys.toArray(new LogicKey[0]));
      LogicKeyOrder order = LogicValidator.topologicalSortLogicKeys(logic);
      assertEquals(keys.size(), order.getSorted().size());
      assertEquals(set("c", "a", "b", "isAdult"),
                   new HashSet<String>(order.getSorted()));
      assertTrue(order.getCyclicKeys().isEmpty());

      keys = new ArrayList<LogicKey>(keys);
      Collections.reverse(keys);
    }
  }

  @Test
  public void testDependencyOrder() throws Exception
  {
    LogicSection logic = new LogicSection(
        bool("isSenior", "isAdult and fields.age.value >= 65"),
        bool("isAdult", "fields.age.value >= 18"),
        bool("needsReview", "isSenior or not isAdult"));

    LogicKeyOrder order = LogicKeySorter.sort(logic);
    assertEquals(Arrays.asList("isAdult", "isSenior", "needsReview"),
                 order.getSorted());
    assertFalse(order.isCyclic("isAdult"));
    assertDependencyOrder(logic, order);
  }

  @Test
  public void testDiamond() throws Exception
  {
    LogicSection logic = new LogicSection(
        bool("canDoEverything", "canVote and canDrive"),
        bool("canVote", "isAdult"),
        bool("canDrive", "isAdult and hasLicense"),
        bool("isAdult", "fields.age.value >= 18"),
        bool("hasLicense", "fields.license.value"));

    LogicKeyOrder order = LogicKeySorter.sort(logic);
    List<String> sorted = order.getSorted();
    assertEquals(5, sorted.size());
    assertTrue(order.getCyclicKeys().isEmpty());

    assertTrue(sorted.indexOf("isAdult") < sorted.indexOf("canVote"));
    assertTrue(sorted.indexOf("isAdult") < sorted.indexOf("canDrive"));
    assertTrue(sorted.indexOf("hasLicense") < sorted.indexOf("canDrive"));
    assertTrue(sorted.indexOf("canVote") < sorted.indexOf("canDoEverything"));
    assertTrue(sorted.indexOf("canDrive") < sorted.indexOf("canDoEverything"));
    assertDependencyOrder(logic, order);
  }

  @Test
  public void testCycles() throws Exception
  {
    LogicSection logic = new LogicSection(bool("loop", "loop or true"));
    LogicKeyOrder order = LogicKeySorter.sort(logic);
    assertEquals(set("loop"), order.getCyclicKeys());
    assertEquals(Arrays.asList("loop"), order.getSorted());

    logic = new LogicSection(
        bool("a", "b"),
        bool("b", "c"),
        bool("c", "a"),
        bool("free", "fields.x.value"),
        bool("dependent", "a or free"));
    order = LogicKeySorter.sort(logic);
    assertEquals(set("a", "b", "c"), order.getCyclicKeys());
    assertTrue(order.isCyclic("b"));
    assertFalse(order.isCyclic("dependent"));
    assertEquals(Arrays.asList("free", "dependent"),
                 order.getSorted().subList(0, 2));
    assertEquals(5, order.getSorted().size());
  }

  @Test
  public void testFieldPathsAreNotKeys() throws Exception
  {
    // a scalar key named like the root of a field path is not referenced
    // by that path
    LogicSection logic = new LogicSection(
        bool("check", "fields.age.value > 1"),
        bool("fields", "check"));

    LogicKeyOrder order = LogicKeySorter.sort(logic);
    assertEquals(Arrays.asList("check", "fields"), order.getSorted());
    assertTrue(order.getCyclicKeys().isEmpty());

    assertNull(LogicKeySorter.resolveKeyReference("fields.age.value", logic));
    assertEquals("check", LogicKeySorter.resolveKeyReference("check", logic));
    assertNull(LogicKeySorter.resolveKeyReference("nope", logic));
  }

  @Test
  public void testObjectKeys() throws Exception
  {
    LogicSection logic = new LogicSection(
        bool("expensive", "total.amount > 100"),
        new LogicKey("total", LogicType.MONEY)
          .setProperty("amount", "fields.qty.value * 10")
          .setProperty("currency", "'USD'"));

    LogicKeyOrder order = LogicKeySorter.sort(logic);
    assertEquals(Arrays.asList("total", "expensive"), order.getSorted());

    assertEquals("total",
                 LogicKeySorter.resolveKeyReference("total.amount", logic));
    assertEquals(Arrays.asList("fields.qty.value * 10", "'USD'"),
                 LogicKeySorter.getExpressions(logic.getKey("total")));
  }

  @Test
  public void testUnparseableExpressions() throws Exception
  {
    LogicSection logic = new LogicSection(
        bool("broken", "a and ("),
        bool("a", "broken"));

    LogicKeyOrder order = LogicKeySorter.sort(logic);
    assertEquals(Arrays.asList("broken", "a"), order.getSorted());
    assertTrue(order.getCyclicKeys().isEmpty());
    assertEquals(Collections.emptySet(),
                 LogicKeySorter.getVariables(logic.getKey("broken")));
  }

  /**
   * Asserts that every key comes after the keys it references.
   */
  private static void assertDependencyOrder(LogicSection logic,
                                            LogicKeyOrder order) {
    List<String> sorted = order.getSorted();
    for(LogicKey key : logic) {
      for(String var : LogicKeySorter.getVariables(key)) {
        if(logic.hasKey(var)) {
          assertTrue(sorted.indexOf(var) < sorted.indexOf(key.getName()),
                     var + " before " + key.getName());
        }
      }
    }
  }

  private static LogicKey bool(String name, String expr) {
    return new LogicKey(name, LogicType.BOOLEAN).setExpression(expr);
  }
}
