/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package minic.common.lang;

import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSet;

/**
 * Type names of the language.  Types are only carried through the
 * tree for declarations and casts; nothing is checked.
 */
public class Types {
  public static final String INT = "int";
  public static final String FLOAT = "float";
  public static final String CHAR = "char";

  public static final Set<String> BASE_TYPES =
                            ImmutableSet.of(INT, FLOAT, CHAR);

  public static boolean isBaseType(String typeName) {
    return BASE_TYPES.contains(typeName);
  }

  /**
   * @return e.g. "int**" for int with pointer depth 2
   */
  public static String typeString(String typeName, int pointerDepth) {
    return typeName + StringUtils.repeat('*', pointerDepth);
  }
}
