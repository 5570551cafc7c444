/*
Copyright (c) 2013 James Ahlborn

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

import java.util.Collection;
import java.util.Map;

import org.apache.commons.lang3.builder.StandardToStringStyle;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * ToStringStyles for the model objects.  The multi-line {@link #builder}
 * style is used for the artifacts and other containers, nested values are
 * indented one level per container.  The single-line {@link #valueBuilder}
 * style is used for the leaf objects.
 *
 * @author James Ahlborn
 */
public class CustomToStringStyle extends StandardToStringStyle
{
  private static final long serialVersionUID = 0L;

  private static final String LINE_SEPARATOR = System.lineSeparator();
  private static final String ML_FIELD_SEP = LINE_SEPARATOR + "  ";

  public static final CustomToStringStyle INSTANCE =
    new CustomToStringStyle(true);

  public static final CustomToStringStyle VALUE_INSTANCE =
    new CustomToStringStyle(false);

  private CustomToStringStyle(boolean multiLine) {
    setUseShortClassName(true);
    setUseIdentityHashCode(false);
    if(multiLine) {
      setContentStart("[");
      setFieldSeparator(ML_FIELD_SEP);
      setFieldSeparatorAtStart(true);
      setFieldNameValueSeparator(": ");
      setArraySeparator("," + ML_FIELD_SEP);
      setContentEnd(LINE_SEPARATOR + "]");
    }
  }

  public static ToStringBuilder builder(Object obj) {
    return new ToStringBuilder(obj, INSTANCE);
  }

  public static ToStringBuilder valueBuilder(Object obj) {
    return new ToStringBuilder(obj, VALUE_INSTANCE);
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Object value) {
    buffer.append(indent(value));
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Collection<?> value) {
    appendEntries(buffer, fieldName, value, false, "[", "]");
  }

  @Override
  protected void appendDetail(StringBuffer buffer, String fieldName,
                              Map<?,?> value) {
    appendEntries(buffer, fieldName, value.entrySet(), true, "{", "}");
  }

  private void appendEntries(StringBuffer buffer, String fieldName,
                             Collection<?> entries, boolean mapEntries,
                             String start, String end) {
    buffer.append(start);
    if(entries.isEmpty()) {
      buffer.append(end);
      return;
    }

    StringBuffer sb = new StringBuffer();
    String sep = (isFieldSeparatorAtStart() ? getFieldSeparator() : "");
    for(Object entry : entries) {
      sb.append(sep);
      sep = getArraySeparator();

      Object value = entry;
      if(mapEntries) {
        Map.Entry<?,?> e = (Map.Entry<?,?>)entry;
        sb.append(e.getKey()).append("=");
        value = e.getValue();
      }
      if(value == null) {
        appendNullText(sb, fieldName);
      } else {
        appendInternal(sb, fieldName, value, true);
      }
    }

    // the contents are one level deeper than the container
    buffer.append(indent(sb));
    if(isFieldSeparatorAtStart()) {
      buffer.append(getFieldSeparator());
    }
    buffer.append(end);
  }

  private static String indent(Object obj) {
    return ((obj != null) ? obj.toString().replace(
                LINE_SEPARATOR, ML_FIELD_SEP) : null);
  }
}
