/*
Copyright 2014 Luke Blanshard

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
package us.blanshard.crossword.tools;

import static java.util.logging.Level.WARNING;

import com.google.common.io.Closeables;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Logging setup shared by the command-line tools.
 */
class ToolLogging {
  private static final Logger logger = Logger.getLogger(ToolLogging.class.getName());

  // Held so the level set by setVerbose isn't lost to garbage collection.
  private static final Logger crosswordLogger = Logger.getLogger("us.blanshard.crossword");

  /**
   * Loads logging.properties from the classpath, if it's there.
   */
  static void configure() {
    InputStream in = ToolLogging.class.getResourceAsStream("/logging.properties");
    if (in == null) return;
    try {
      LogManager.getLogManager().readConfiguration(in);
    } catch (IOException e) {
      logger.log(WARNING, "Unable to read logging configuration", e);
    } finally {
      Closeables.closeQuietly(in);
    }
  }

  /** Turns on the solver's detailed logging. */
  static void setVerbose() {
    crosswordLogger.setLevel(Level.FINE);
  }
}
