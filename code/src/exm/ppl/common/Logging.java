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

import java.io.IOException;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging {
  private static final String PPL_LOGGER_NAME = "exm.ppl";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted.  Translations for several backends may log
   * concurrently, so access is synchronized.
   */
  private static final Set<String> emitted =
          Collections.synchronizedSet(new HashSet<String>());

  public static Logger getPPLLogger() {
    return Logger.getLogger(PPL_LOGGER_NAME);
  }

  /**
   * Configure the translator logger.
   * @param logfile file to write to, or null/empty for console only
   * @param trace if true, log at TRACE level, otherwise DEBUG to the file
   *              and WARN to the console
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger pplLogger = getPPLLogger();
    pplLogger.removeAllAppenders();
    pplLogger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
                      new PatternLayout(LOG_PATTERN), ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    pplLogger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(new PatternLayout(LOG_PATTERN),
                                             logfile, false);
        pplLogger.addAppender(file);
        pplLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
      } catch (IOException e) {
        pplLogger.setLevel(Level.WARN);
        pplLogger.warn("Could not open log file " + logfile + ": " +
                       e.getMessage());
      }
    } else {
      pplLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    return pplLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(level.toString() + ":" + msg);
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getPPLLogger().warn(msg);
    } else {
      Logging.getPPLLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
