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
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

import java.awt.GraphicsEnvironment;
import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Base Force Field Trim Command class.
 *
 * @author Michael J. Schnieders
 */
public abstract class TrimCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(TrimCommand.class.getName());

  /**
   * Package searched for commands given by their short name.
   */
  private static final String COMMAND_PACKAGE = "fftrim.potential.commands.";

  /**
   * Unix shells are able to evaluate PicoCLI ANSI color codes; an embedding environment may not.
   *
   * <p>In a headless environment color will be ON for command line help, otherwise OFF.
   */
  public final Ansi color;

  /**
   * The array of args passed into the Command.
   */
  public String[] args;

  /**
   * Parse Result.
   */
  public ParseResult parseResult = null;

  /**
   * -V or --version Prints the version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the Force Field Trim version and exit.")
  public boolean version;

  /**
   * -h or --help Prints a help message.
   */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * The Binding that provides variables to this Command.
   */
  public TrimBinding binding;

  /**
   * Default constructor for a Command.
   */
  public TrimCommand() {
    this(new TrimBinding());
  }

  /**
   * Create a Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public TrimCommand(String[] args) {
    this(new TrimBinding(args));
  }

  /**
   * Create a Command using the supplied binding.
   *
   * @param binding the Binding that provides variables to this Command.
   */
  public TrimCommand(TrimBinding binding) {
    this.binding = binding;
    if (GraphicsEnvironment.isHeadless()) {
      color = Ansi.ON;
    } else {
      color = Ansi.OFF;
    }
  }

  /**
   * Set the Binding that provides variables to this Command.
   *
   * @param binding The Binding to use.
   */
  public void setBinding(TrimBinding binding) {
    this.binding = binding;
  }

  /**
   * Use the class loader of this class to find the requested Command.
   *
   * @param name Name of the Command to load (e.g., Trim), or a fully qualified class name.
   * @return The Command, if found, or null.
   */
  public static Class<? extends TrimCommand> getCommand(String name) {
    ClassLoader loader = TrimCommand.class.getClassLoader();
    Class<?> command;
    try {
      // First try to load the class directly.
      command = loader.loadClass(name);
    } catch (ClassNotFoundException e) {
      // Next, try the commands package.
      try {
        command = loader.loadClass(COMMAND_PACKAGE + name);
      } catch (ClassNotFoundException e2) {
        logger.warning(format(" %s was not found.", name));
        return null;
      }
    }
    if (!TrimCommand.class.isAssignableFrom(command)) {
      logger.warning(format(" %s is not a command.", name));
      return null;
    }
    return command.asSubclass(TrimCommand.class);
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    return " " + new CommandLine(this).getUsageMessage(color);
  }

  /**
   * Properties for this command: those held by the binding, on top of those found by
   * {@link Keyword#loadProperties(File)} for the given structure file.
   *
   * @param structureFile the structure being processed (may be null).
   * @return the composite configuration.
   */
  public CompositeConfiguration getProperties(File structureFile) {
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addConfiguration(binding);
    properties.addConfiguration(Keyword.loadProperties(structureFile));
    return properties;
  }

  /**
   * Prefix a file name with the "baseDir" binding variable, if one was given.
   *
   * @param filename the file name.
   * @return the base directory (with a trailing separator) or an empty String.
   */
  public String getBaseDirString(String filename) {
    Object baseDir = binding.getVariable("baseDir");
    if (baseDir instanceof File dir && dir.isDirectory()) {
      return dir.getAbsolutePath() + File.separator;
    }
    File file = new File(filename).getAbsoluteFile();
    File parent = file.getParentFile();
    if (parent == null) {
      return "";
    }
    return parent.getAbsolutePath() + File.separator;
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    // The args variable could either be a list or an array of String arguments.
    Object arguments = binding.getVariable("args");

    if (arguments instanceof List<?> list) {
      int numArgs = list.size();
      args = new String[numArgs];
      for (int i = 0; i < numArgs; i++) {
        args[i] = (String) list.get(i);
      }
    } else if (arguments instanceof String[] array) {
      args = Arrays.copyOf(array, array.length);
    } else if (arguments instanceof String single) {
      args = new String[]{single};
    } else {
      args = new String[0];
    }

    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --output) are only preceded by one dash.");
      throw uae;
    }

    // Print help info exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    return !version;
  }

  /**
   * Execute this Command.
   *
   * @return The current TrimCommand.
   */
  public TrimCommand run() {
    logger.info(helpString());
    return this;
  }
}
