/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.bigsmiles.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the JSON configuration files for parsing and rendering.
 */
public class ConfigLoader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConfigLoader.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private ConfigLoader() {
  }

  public static <T> T load(File configFile, Class<T> klass) throws IOException {
    if (!configFile.exists() || !configFile.isFile()) {
      String msg = String.format("Config file at %s does not exist or is not a regular file",
          configFile.getAbsolutePath());
      LOGGER.error(msg);
      throw new IOException(msg);
    }
    LOGGER.info("Reading %s from %s", klass.getSimpleName(), configFile.getAbsolutePath());
    return OBJECT_MAPPER.readValue(configFile, klass);
  }

  public static <T> T load(InputStream configStream, Class<T> klass) throws IOException {
    return OBJECT_MAPPER.readValue(configStream, klass);
  }

  /**
   * Loads one of the bundled default configurations. A missing or unreadable bundled resource is a packaging error.
   */
  static <T> T loadResource(String resourceName, Class<T> klass) {
    try (InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (stream == null) {
        throw new IOException(String.format("Unable to find resource %s", resourceName));
      }
      return load(stream, klass);
    } catch (IOException e) {
      LOGGER.error("Unable to read default configuration %s: %s", resourceName, e.getMessage());
      throw new RuntimeException(e);
    }
  }
}
