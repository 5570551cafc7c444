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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class TopoSorterTest
{

  @Test
  public void testTopoSort() throws Exception
  {
    doTopoTest(Arrays.asList("A", "B", "C"),
               Arrays.asList("A", "B", "C"),
               Collections.<String>emptySet());

    doTopoTest(Arrays.asList("B", "A", "C"),
               Arrays.asList("C", "B", "A"),
               Collections.<String>emptySet(),
               "B", "C",
               "A", "B");

    doTopoTest(Arrays.asList("B", "D", "A", "C"),
               Arrays.asList("C", "B", "D", "A"),
               Collections.<String>emptySet(),
               "B", "C",
               "A", "B");

    doTopoTest(Arrays.asList("B", "D", "A", "C"),
               Arrays.asList("C", "B", "D", "A"),
               Collections.<String>emptySet(),
               "B", "C",
               "A", "B",
               "A", "D");

    // diamond
    doTopoTest(Arrays.asList("D", "B", "C", "A"),
               Arrays.asList("A", "B", "C", "D"),
               Collections.<String>emptySet(),
               "D", "B",
               "D", "C",
               "B", "A",
               "C", "A");
  }

  @Test
  public void testCycles() throws Exception
  {
    doTopoTest(Arrays.asList("B", "A", "C"),
               Arrays.asList("B", "C", "A"),
               set("A", "B", "C"),
               "B", "C",
               "A", "B",
               "C", "A");

    // self reference
    doTopoTest(Arrays.asList("A", "B"),
               Arrays.asList("B", "A"),
               set("A"),
               "A", "A");

    // values depending on a cycle are still ordered
    doTopoTest(Arrays.asList("X", "A", "B", "Y"),
               Arrays.asList("X", "Y", "A", "B"),
               set("A", "B"),
               "A", "B",
               "B", "A",
               "Y", "A");
  }

  @Test
  public void testUnknownDependency() throws Exception
  {
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> {
      doTopoTest(Arrays.asList("B", "A", "C"),
                 Arrays.asList("C", "B", "A"),
                 Collections.<String>emptySet(),
                 "B", "D");
    });
    assertTrue(e.getMessage().startsWith("Unknown dependency"));
  }

  private static void doTopoTest(List<String> original,
                                 List<String> expected,
                                 Set<String> expectedCyclic,
                                 String... deps) {

    List<String> values = new ArrayList<String>();
    values.addAll(original);

    TestTopoSorter tsorter = new TestTopoSorter(values);
    for(int i = 0; i < deps.length; i+=2) {
      tsorter.addDependencies(deps[i], deps[i+1]);
    }

    tsorter.sort();

    assertEquals(expected, values);
    assertEquals(expectedCyclic, tsorter.getCyclicValues());
  }

  private static Set<String> set(String... vals) {
    return new LinkedHashSet<String>(Arrays.asList(vals));
  }

  private static class TestTopoSorter extends TopoSorter<String>
  {
    private final Map<String,List<String>> _depMap =
      new HashMap<String,List<String>>();

    protected TestTopoSorter(List<String> values) {
      super(values);
    }

    public void addDependencies(String from, String... tos) {
      List<String> deps = _depMap.get(from);
      if(deps == null) {
        deps = new ArrayList<String>();
        _depMap.put(from, deps);
      }

      deps.addAll(Arrays.asList(tos));
    }

    @Override
    protected void getDependencies(String from, List<String> dependencies) {
      List<String> deps = _depMap.get(from);
      if(deps != null) {
        dependencies.addAll(deps);
      }
    }
  }
}
