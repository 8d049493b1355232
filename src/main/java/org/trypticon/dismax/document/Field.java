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

import java.util.Objects;

/**
  A field is a section of a Document.  Each field has two parts, a name and a
  value. The value is indexed verbatim as one term.
  */
public final class Field {
  private final String name;
  private final String value;

  public Field(String name, String value) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = Objects.requireNonNull(value, "value");
  }

  /** Returns the name of the field. */
  public String name() { return name; }

  /** The value of the field as a String. */
  public String value() { return value; }

  @Override
  public String toString() {
    return name + ":" + value;
  }
}
