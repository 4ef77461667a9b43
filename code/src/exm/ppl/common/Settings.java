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
package exm.ppl.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.ppl.common.exceptions.InvalidOptionException;

/**
 * General translator settings, read from Java system properties.
 *
 * Settings are read-only once {@link #initPPLProperties()} has run, so
 * translations on several threads may consult them freely.
 * */
public class Settings
{
  public static final String LOG_FILE = "ppl.log.file";
  public static final String LOG_TRACE = "ppl.log.trace";

  /** Number of spaces per indentation level in generated code */
  public static final String EMIT_INDENT = "ppl.emit.indent";
  /** Comment emitted at the top of generated files, e.g. "off" or "header" */
  public static final String EMIT_BANNER = "ppl.emit.banner";

  /** Prefix for temporaries introduced by hoisting */
  public static final String TEMP_PREFIX = "ppl.codegen.temp-prefix";

  public static final String GEN_CONSTRAINTS_NAME =
                                    "ppl.gen.constraints-name";
  public static final String GEN_AGGREGATOR_NAME = "ppl.gen.aggregator-name";

  /** Lower choice-free loops to slice assignments in plate backends */
  public static final String PYRO_VECTORIZE = "ppl.pyro.vectorize";

  /** Refuse translation on warnings as well as errors */
  public static final String LINT_WARNINGS_AS_ERRORS =
                                    "ppl.lint.warnings-as-errors";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(EMIT_INDENT, "4");
    defaults.setProperty(EMIT_BANNER, "off");
    defaults.setProperty(TEMP_PREFIX, "__tmp");
    defaults.setProperty(GEN_CONSTRAINTS_NAME, "__observe_constraints");
    defaults.setProperty(GEN_AGGREGATOR_NAME, "__choicemap_aggregation");
    defaults.setProperty(PYRO_VECTORIZE, "true");
    defaults.setProperty(LINT_WARNINGS_AS_ERRORS, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initPPLProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(PYRO_VECTORIZE);
    getBoolean(LINT_WARNINGS_AS_ERRORS);
    int indent = getInt(EMIT_INDENT);
    if (indent < 1 || indent > 16) {
      throw new InvalidOptionException("Indentation width " + indent +
                                       " out of range 1-16");
    }
    checkOneOf(EMIT_BANNER, Arrays.asList("off", "header"));
    checkIdentifier(TEMP_PREFIX);
    checkIdentifier(GEN_CONSTRAINTS_NAME);
    checkIdentifier(GEN_AGGREGATOR_NAME);
  }

  /**
   * Names that end up in generated code must be valid identifiers in
   * both Julia and Python.
   */
  private static void checkIdentifier(String key)
                                      throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null || val.length() == 0) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    for (int i = 0; i < val.length(); i++) {
      char c = val.charAt(i);
      boolean ok = Character.isLetter(c) || c == '_' ||
                   (i > 0 && Character.isDigit(c));
      if (!ok) {
        throw new InvalidOptionException("Bad character '" + c +
              "' in option " + key + ": '" + val + "'");
      }
    }
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                          throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'").append(vv).append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
                                       key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
