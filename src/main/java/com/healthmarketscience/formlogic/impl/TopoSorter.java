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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders values so that every value comes after the values it depends on.
 * Values which are part of a dependency cycle (including a value which
 * depends on itself) cannot be ordered, they are moved to the end of the
 * sorted list and reported by {@link #getCyclicValues}.
 *
 * @author James Ahlborn
 */
public abstract class TopoSorter<E>
{
  // https://en.wikipedia.org/wiki/Tarjan%27s_strongly_connected_components_algorithm
  private static final int UNVISITED = -1;

  private final List<E> _values;
  private final Map<E,Node<E>> _nodes = new LinkedHashMap<E,Node<E>>();
  private final Deque<Node<E>> _stack = new ArrayDeque<Node<E>>();
  private final List<E> _sorted = new ArrayList<E>();
  private final Set<E> _cyclic = new LinkedHashSet<E>();
  private int _index;

  protected TopoSorter(List<E> values) {
    _values = values;
  }

  /**
   * Sorts the values given at construction, in place.  Values with no
   * ordering constraint between them keep their original relative order
   * where possible.
   */
  public void sort() {

    for(E val : _values) {
      Node<E> node = new Node<E>(val);
      getDependencies(val, node._deps);
      _nodes.put(val, node);
    }

    for(Node<E> node : _nodes.values()) {
      if(node._index == UNVISITED) {
        visit(node);
      }
    }

    _values.clear();
    _values.addAll(_sorted);
    _values.addAll(_cyclic);
  }

  /**
   * @return the values which are part of a dependency cycle, in sorted
   *         order.  Only valid after {@link #sort}.
   */
  public Set<E> getCyclicValues() {
    return _cyclic;
  }

  private void visit(Node<E> node) {

    node._index = _index;
    node._lowLink = _index;
    ++_index;
    _stack.push(node);
    node._onStack = true;

    for(E depVal : node._deps) {
      Node<E> dep = findDependency(depVal);
      if(dep == node) {
        node._selfRef = true;
      } else if(dep._index == UNVISITED) {
        visit(dep);
        node._lowLink = Math.min(node._lowLink, dep._lowLink);
      } else if(dep._onStack) {
        node._lowLink = Math.min(node._lowLink, dep._index);
      }
    }

    if(node._lowLink != node._index) {
      // not the root of its component
      return;
    }

    List<Node<E>> component = new ArrayList<Node<E>>();
    Node<E> member = null;
    do {
      member = _stack.pop();
      member._onStack = false;
      component.add(0, member);
    } while(member != node);

    if((component.size() == 1) && !node._selfRef) {
      _sorted.add(node._val);
      return;
    }

    for(Node<E> cycleNode : component) {
      _cyclic.add(cycleNode._val);
    }
  }

  private Node<E> findDependency(E val) {
    Node<E> node = _nodes.get(val);
    if(node == null) {
      throw new IllegalStateException("Unknown dependency " + val);
    }
    return node;
  }

  /**
   * Adds the values which the given value depends on to the given list.
   * Every dependency must be one of the values being sorted.
   */
  protected abstract void getDependencies(E from, List<E> dependencies);


  private static class Node<E>
  {
    private final E _val;
    private final List<E> _deps = new ArrayList<E>();
    private int _index = UNVISITED;
    private int _lowLink = UNVISITED;
    private boolean _onStack;
    private boolean _selfRef;

    private Node(E val) {
      _val = val;
    }
  }
}
