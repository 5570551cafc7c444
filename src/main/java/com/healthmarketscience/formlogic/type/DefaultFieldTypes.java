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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.healthmarketscience.formlogic.FieldType;

/**
 * The standard field type table.
 *
 * @author James Ahlborn
 */
public class DefaultFieldTypes implements FieldTypeLookup
{
  public static final DefaultFieldTypes INSTANCE = new DefaultFieldTypes();

  private static final Map<FieldType,InferredType> VALUE_TYPES =
    new EnumMap<FieldType,InferredType>(FieldType.class);
  private static final Map<FieldType,Map<String,InferredType>> SUB_PROPS =
    new EnumMap<FieldType,Map<String,InferredType>>(FieldType.class);

  static {
    VALUE_TYPES.put(FieldType.TEXT, InferredType.STRING);
    VALUE_TYPES.put(FieldType.EMAIL, InferredType.STRING);
    VALUE_TYPES.put(FieldType.UUID, InferredType.STRING);
    VALUE_TYPES.put(FieldType.URI, InferredType.STRING);
    VALUE_TYPES.put(FieldType.ENUM, InferredType.STRING);
    VALUE_TYPES.put(FieldType.BOOLEAN, InferredType.BOOLEAN);
    VALUE_TYPES.put(FieldType.NUMBER, InferredType.NUMBER);
    VALUE_TYPES.put(FieldType.PERCENTAGE, InferredType.NUMBER);
    VALUE_TYPES.put(FieldType.RATING, InferredType.NUMBER);
    VALUE_TYPES.put(FieldType.DATE, InferredType.DATE);
    VALUE_TYPES.put(FieldType.DATETIME, InferredType.DATETIME);
    VALUE_TYPES.put(FieldType.TIME, InferredType.TIME);
    VALUE_TYPES.put(FieldType.DURATION, InferredType.DURATION);
    VALUE_TYPES.put(FieldType.MONEY, InferredType.MONEY);
    VALUE_TYPES.put(FieldType.ADDRESS, InferredType.ADDRESS);
    VALUE_TYPES.put(FieldType.PHONE, InferredType.PHONE);
    VALUE_TYPES.put(FieldType.COORDINATE, InferredType.COORDINATE);
    VALUE_TYPES.put(FieldType.BBOX, InferredType.BBOX);
    VALUE_TYPES.put(FieldType.PERSON, InferredType.PERSON);
    VALUE_TYPES.put(FieldType.ORGANIZATION, InferredType.ORGANIZATION);
    VALUE_TYPES.put(FieldType.IDENTIFICATION, InferredType.IDENTIFICATION);
    VALUE_TYPES.put(FieldType.MULTISELECT, InferredType.ARRAY);
    VALUE_TYPES.put(FieldType.FIELDSET, InferredType.OBJECT);

    addSubProps(FieldType.MONEY, InferredType.NUMBER, "amount");
    addSubProps(FieldType.MONEY, InferredType.STRING, "currency");
    addSubProps(FieldType.ADDRESS, InferredType.STRING, "line1", "line2",
                "locality", "region", "postalCode", "country");
    addSubProps(FieldType.PHONE, InferredType.STRING, "number", "type",
                "extension");
    addSubProps(FieldType.COORDINATE, InferredType.NUMBER, "lat", "lon");
    addSubProps(FieldType.BBOX, InferredType.NUMBER, "north", "south", "east",
                "west");
    addSubProps(FieldType.DURATION, InferredType.NUMBER, "years", "months",
                "weeks", "days", "hours", "minutes", "seconds");
    addSubProps(FieldType.PERSON, InferredType.STRING, "fullName",
                "firstName", "middleName", "lastName", "suffix", "title");
    addSubProps(FieldType.ORGANIZATION, InferredType.STRING, "name",
                "legalName", "entityType", "domicile");
    addSubProps(FieldType.IDENTIFICATION, InferredType.STRING, "idType",
                "idNumber", "issuingAuthority");
    addSubProps(FieldType.IDENTIFICATION, InferredType.DATE, "issuedDate",
                "expiryDate");
  }

  protected DefaultFieldTypes() {}

  @Override
  public InferredType getValueType(FieldType fieldType) {
    InferredType type = VALUE_TYPES.get(fieldType);
    return ((type != null) ? type : InferredType.UNKNOWN);
  }

  @Override
  public Map<String,InferredType> getSubProperties(FieldType fieldType) {
    Map<String,InferredType> props = SUB_PROPS.get(fieldType);
    return ((props != null) ? Collections.unmodifiableMap(props) :
            Collections.<String,InferredType>emptyMap());
  }

  private static void addSubProps(FieldType fieldType, InferredType propType,
                                  String... names) {
    Map<String,InferredType> props = SUB_PROPS.get(fieldType);
    if(props == null) {
      props = new LinkedHashMap<String,InferredType>();
      SUB_PROPS.put(fieldType, props);
    }
    for(String name : names) {
      props.put(name, propType);
    }
  }
}
