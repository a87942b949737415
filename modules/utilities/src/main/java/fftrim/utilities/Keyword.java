//******************************************************************************
//
// Title:       Force Field X.
// Description: Force Field X - Software for Molecular Biophysics.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of Force Field X.
//
// Force Field X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Force Field X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Force Field X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package fftrim.utilities;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The Keyword class assembles the keyword=value properties that tune a trimming run.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Keyword {

  private static final Logger logger = Logger.getLogger(Keyword.class.getName());

  /**
   * Name of the environment variable pointing at a system wide property file.
   */
  public static final String PROPERTIES_ENV = "FFTRIM_PROPERTIES";

  /**
   * Location of the user property file, relative to the user's home directory.
   */
  public static final String USER_PROPERTIES = ".fftrim" + File.separator + "fftrim.properties";

  private Keyword() {
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Structure specific properties (for example ethane.properties)
   * <p>
   * 3.) User specific properties (~/.fftrim/fftrim.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable FFTRIM_PROPERTIES)
   *
   * @param file the structure file; null if there is none.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @since 1.0
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

    // Structure specific options are 2nd.
    if (file != null) {
      String structureBasename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File structurePropFile = new File(structureBasename + ".properties");
      if (!structurePropFile.exists()) {
        structurePropFile = new File(structureBasename + ".prop");
      }
      PropertiesConfiguration structureConfiguration = readPropertyFile(structurePropFile,
          "Structure properties from (" + structurePropFile + ").");
      if (structureConfiguration != null) {
        properties.addConfiguration(structureConfiguration);
        try {
          properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
        } catch (IOException e) {
          logger.log(Level.INFO, " Could not resolve {0}.", structurePropFile);
        }
      }
    }

    // User specific options are 3rd.
    File userPropFile = new File(System.getProperty("user.home"), USER_PROPERTIES);
    PropertiesConfiguration userConfiguration = readPropertyFile(userPropFile,
        "User property file (" + userPropFile + ").");
    if (userConfiguration != null) {
      properties.addConfiguration(userConfiguration);
    }

    // System wide options are last.
    String filename = System.getenv(PROPERTIES_ENV);
    if (filename != null) {
      File systemPropFile = new File(filename);
      PropertiesConfiguration envConfiguration = readPropertyFile(systemPropFile,
          "Environment variable " + PROPERTIES_ENV + " (" + filename + ").");
      if (envConfiguration != null) {
        properties.addConfiguration(envConfiguration);
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read one property file.
   *
   * @param propFile the file.
   * @param header   the header to record on the configuration.
   * @return the configuration, or null if the file is missing or unreadable.
   */
  private static PropertiesConfiguration readPropertyFile(File propFile, String header) {
    if (!propFile.exists() || !propFile.canRead()) {
      return null;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header);
      return configuration;
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propFile);
      return null;
    }
  }
}
