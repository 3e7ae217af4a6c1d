//******************************************************************************
//
// Title:       EM Transform X.
// Description: EM Transform X - Conversion of cryo-EM metadata files.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2026.
//
// This file is part of EM Transform X.
//
// EM Transform X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// EM Transform X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// EM Transform X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
//******************************************************************************
package emx.utilities;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Layered EMX properties.
 *
 * <p>Sources are consulted in order: JVM system properties, a properties file that shares the base
 * name of the input file, the user file ~/.emx/emx.properties, and finally the file named by the
 * EMX_PROPERTIES environment variable.
 *
 * @author Michael J. Schnieders
 */
public class EMXProperties {

  private static final Logger logger = Logger.getLogger(EMXProperties.class.getName());

  /**
   * Environment variable naming a site wide properties file.
   */
  public static final String ENVIRONMENT_VARIABLE = "EMX_PROPERTIES";

  private EMXProperties() {
    // Static methods only.
  }

  /**
   * Load properties without an input file.
   *
   * @return a CompositeConfiguration.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * Load properties for an input file.
   *
   * @param file The input file, or null.
   * @return a CompositeConfiguration.
   */
  public static CompositeConfiguration loadProperties(File file) {

    // Command line options take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    /*
      JVM system properties are read first.
      a.) -Dkey=value from the Java command line
      b.) System.setProperty("key","value") within Java code.
     */
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Input file specific options are 2nd.
    if (file != null) {
      String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File propertyFile = new File(basename + ".properties");
      if (!propertyFile.exists()) {
        propertyFile = new File(basename + ".prop");
      }
      if (propertyFile.exists() && propertyFile.canRead()) {
        PropertiesConfiguration fileConfiguration = readProperties(propertyFile);
        if (fileConfiguration != null) {
          fileConfiguration.setHeader("Input file properties (" + propertyFile + ").");
          properties.addConfiguration(fileConfiguration);
          try {
            properties.addProperty("propertyFile", propertyFile.getCanonicalPath());
          } catch (IOException e) {
            properties.addProperty("propertyFile", propertyFile.getAbsolutePath());
          }
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + ".emx" + File.separator + "emx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration userConfiguration = readProperties(userPropFile);
      if (userConfiguration != null) {
        userConfiguration.setHeader("EMX user property file (" + filename + ").");
        properties.addConfiguration(userConfiguration);
      }
    }

    // Site wide options are last.
    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      File sitePropFile = new File(filename);
      if (sitePropFile.exists() && sitePropFile.canRead()) {
        PropertiesConfiguration envConfiguration = readProperties(sitePropFile);
        if (envConfiguration != null) {
          envConfiguration.setHeader("Environment variable " + ENVIRONMENT_VARIABLE + " (" + filename + ").");
          properties.addConfiguration(envConfiguration);
        }
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      StringBuilder sb = new StringBuilder("\n Properties\n");
      Iterator<String> keys = properties.getKeys();
      while (keys.hasNext()) {
        String key = keys.next();
        sb.append(format("  %-30s %s\n", key, properties.getString(key)));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read a comma separated list property, trimming each entry and skipping empty entries.
   *
   * @param properties   The configuration.
   * @param key          The property key.
   * @param defaultValue Value used when the key is absent.
   * @return the list of entries.
   */
  public static List<String> getList(Configuration properties, String key, String defaultValue) {
    String value = properties.getString(key, defaultValue);
    List<String> list = new ArrayList<>();
    if (value == null) {
      return list;
    }
    for (String entry : value.split(",")) {
      String trimmed = entry.trim();
      if (!trimmed.isEmpty()) {
        list.add(trimmed);
      }
    }
    return list;
  }

  private static PropertiesConfiguration readProperties(File file) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(file)
                  .setIncludesAllowed(false));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", file);
      return null;
    }
  }
}
