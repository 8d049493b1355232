/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
*/
package org.trypticon.dismax.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Documents are the unit of indexing and search.
 *
 * A Document is a set of fields.  Each field has a name and a textual value,
 * which is indexed as a single term without any analysis. A field name may
 * repeat; every occurrence of the same value in the same field counts toward
 * that term's frequency in the document.
 */
public final class Document {
  private final List<Field> fields = new ArrayList<Field>();

  public Document() {}

  /** Adds a field to a document. */
  public Document add(Field field) {
    fields.add(field);
    return this;
  }

  /** Adds a field with the given name and value to the document. */
  public Document add(String name, String value) {
    return add(new Field(name, value));
  }

  /** Returns the string value of the first field with the given name, or null. */
  public String get(String name) {
    for (Field field : fields) {
      if (field.name().equals(name))
        return field.value();
    }
    return null;
  }

  private final static String[] NO_STRINGS = new String[0];

  /** Returns the values of all fields with the given name, in the order added. */
  public String[] getValues(String name) {
    List<String> result = new ArrayList<String>();
    for (Field field : fields) {
      if (field.name().equals(name))
        result.add(field.value());
    }
    if (result.size() == 0)
      return NO_STRINGS;
    return result.toArray(new String[result.size()]);
  }

  /** Returns an unmodifiable view of all the fields of this document. */
  public List<Field> getFields() {
    return Collections.unmodifiableList(fields);
  }

  @Override
  public String toString() {
    StringBuilder buffer = new StringBuilder();
    buffer.append("Document<");
    for (int i = 0; i < fields.size(); i++) {
      buffer.append(fields.get(i).toString());
      if (i != fields.size()-1)
        buffer.append(" ");
    }
    buffer.append(">");
    return buffer.toString();
  }
}
