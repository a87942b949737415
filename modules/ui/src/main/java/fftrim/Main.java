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
package fftrim;

import fftrim.ui.LogHandler;
import fftrim.utilities.TrimBinding;
import fftrim.utilities.TrimCommand;
import org.apache.commons.lang3.time.StopWatch;
import picocli.CommandLine.Command;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The Main class is the command line entry point to Force Field Trim.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  /**
   * Commands listed by the usage message.
   */
  static final String[] COMMANDS = {"Trim", "Score"};

  static final String border =
      " ______________________________________________________________________________";
  static final String title = "\n                            FORCE FIELD TRIM";
  static final String aboutString =
      "        Trim a force field XML file to the records a typed structure uses.";

  /**
   * Handle Force Field Trim logging.
   */
  private static LogHandler logHandler;

  private Main() {
  }

  /**
   * Run a Force Field Trim command.
   *
   * @param args the command name followed by its arguments.
   */
  public static void main(String[] args) {
    try {
      TrimCommand command = runCommand(args);
      if (command == null || (logHandler != null && logHandler.hasSevere())) {
        System.exit(1);
      }
    } catch (Throwable t) {
      int statusCode = 1;
      logger.info(" Uncaught exception: exiting with status code " + statusCode);
      t.printStackTrace();
      System.exit(statusCode);
    }
  }

  /**
   * Process the arguments, start logging, then resolve and run the named command.
   *
   * @param args the command name followed by its arguments.
   * @return the command after it ran, or null if no command could be run.
   */
  public static TrimCommand runCommand(String[] args) {
    // Process any "-D" command line flags.
    args = processProperties(args);

    // Configure our logging.
    startLogging();

    // Print the header.
    header(args);

    if (args.length < 1) {
      commandLineInterfaceHelp();
      return null;
    }

    Class<? extends TrimCommand> commandClass = TrimCommand.getCommand(args[0]);
    if (commandClass == null) {
      commandLineInterfaceHelp();
      return null;
    }

    TrimCommand command;
    try {
      command = commandClass.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      logger.log(Level.SEVERE, format(" %s could not be created.", commandClass.getName()), e);
      return null;
    }

    List<String> argList = new ArrayList<>(Arrays.asList(args).subList(1, args.length));
    TrimBinding binding = new TrimBinding(argList.toArray(new String[0]));
    command.setBinding(binding);

    StopWatch stopWatch = new StopWatch();
    stopWatch.start();
    command.run();
    stopWatch.stop();
    logger.info(format("\n %s time (sec): %8.3f", args[0], stopWatch.getTime() * 1.0e-3));
    return command;
  }

  private static void commandLineInterfaceHelp() {
    logger.info(" usage: fftrim [-D<property=value>] <command> [-options] <XYZ> <XML>");
    logger.info("  where commands include:");
    for (String name : COMMANDS) {
      Class<? extends TrimCommand> commandClass = TrimCommand.getCommand(name);
      if (commandClass == null) {
        continue;
      }
      Command annotation = commandClass.getAnnotation(Command.class);
      String description = "";
      if (annotation != null && annotation.description().length > 0) {
        description = annotation.description()[0];
      }
      logger.info(format("   %-12s %s", name, description));
    }
    logger.info("\n For help on a specific command use:  fftrim <command> -h\n");
  }

  private static void header(String[] args) {
    StringBuilder sb = new StringBuilder();
    sb.append(border).append("\n");
    sb.append(title).append("\n");
    sb.append(aboutString).append("\n");
    sb.append(border);
    sb.append("\n ").append(new Date());

    // Print out command line arguments if the array is not null.
    if (args != null && args.length > 0) {
      sb.append("\n\n Command line arguments:\n ");
      sb.append(Arrays.toString(args));
      sb.append("\n");
    }
    logger.info(sb.toString());
  }

  /**
   * Process any "-D" command line flags.
   *
   * @param args the raw arguments.
   * @return the arguments that are not "-D" flags.
   */
  static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        // Remove -D from the front of String.
        arg = arg.substring(2);
        // Split at the first equals if it exists.
        if (arg.contains("=")) {
          int equalsPosition = arg.indexOf("=");
          String key = arg.substring(0, equalsPosition);
          String value = arg.substring(equalsPosition + 1);
          // Set the system property.
          System.setProperty(key, value);
        } else if (arg.length() > 0) {
          System.setProperty(arg, "");
        }
      } else {
        // Collect non "-D" arguments.
        newArgs.add(arg);
      }
    }
    // Return the remaining arguments.
    return newArgs.toArray(new String[0]);
  }

  /**
   * Replace the default console handler with our custom handler.
   */
  private static void startLogging() {
    // Remove all log handlers from the default logger.
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    Logger trimLogger = Logger.getLogger("fftrim");
    // Remove any existing handlers.
    for (Handler handler : trimLogger.getHandlers()) {
      trimLogger.removeHandler(handler);
    }

    // Retrieve the log level from the fftrim.log system property.
    String logLevel = System.getProperty("fftrim.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (IllegalArgumentException e) {
      level = Level.INFO;
    }

    logHandler = new LogHandler();
    logHandler.setLevel(level);
    trimLogger.addHandler(logHandler);
    trimLogger.setLevel(level);
  }
}
