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
package emx.transform;

import emx.utilities.EMXCommand;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The Main class is the command line entry point of EM Transform X.
 *
 * <p>Usage: emxc &lt;Command&gt; [options] &lt;file&gt;
 *
 * @author Michael J. Schnieders
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  /** Commands listed by the help message. */
  private static final List<String> COMMANDS = List.of("Convert", "ShowMetadata");

  private Main() {
    // Static methods only.
  }

  /**
   * Run a Command.
   *
   * @param args the Command name followed by its arguments.
   */
  public static void main(String[] args) {
    args = processProperties(args);
    startLogging();

    if (args.length == 0) {
      commandLineInterfaceHelp();
      return;
    }

    try {
      EMXCommand command = createCommand(args[0], Arrays.copyOfRange(args, 1, args.length));
      if (command == null) {
        commandLineInterfaceHelp();
        System.exit(1);
      }
      command.run();
    } catch (Throwable t) {
      int statusCode = 1;
      logger.log(Level.SEVERE, " Uncaught exception: exiting with status code " + statusCode, t);
      System.exit(statusCode);
    }
  }

  /**
   * Instantiate a Command by name.
   *
   * @param name the Command name, e.g. Convert.
   * @param args the Command arguments.
   * @return the Command, or null if it does not exist.
   */
  public static EMXCommand createCommand(String name, String[] args) {
    Class<? extends EMXCommand> commandClass = EMXCommand.getCommand(name);
    if (commandClass == null) {
      return null;
    }
    try {
      return commandClass.getConstructor(String[].class).newInstance((Object) args);
    } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
      throw new IllegalStateException(format(" %s cannot be instantiated.", name), e);
    } catch (InvocationTargetException e) {
      throw new IllegalStateException(format(" %s cannot be instantiated.", name), e.getCause());
    }
  }

  /**
   * Move -Dkey=value flags into the system properties.
   *
   * @param args the raw arguments.
   * @return the remaining arguments.
   */
  static String[] processProperties(String[] args) {
    List<String> remaining = new ArrayList<>();
    for (String arg : args) {
      if (arg.startsWith("-D") && arg.contains("=")) {
        int equals = arg.indexOf('=');
        System.setProperty(arg.substring(2, equals), arg.substring(equals + 1));
      } else {
        remaining.add(arg);
      }
    }
    return remaining.toArray(new String[0]);
  }

  /**
   * Read the bundled logging configuration unless one was given with
   * -Djava.util.logging.config.file.
   */
  private static void startLogging() {
    if (System.getProperty("java.util.logging.config.file") != null) {
      return;
    }
    try (InputStream inputStream = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
      if (inputStream != null) {
        LogManager.getLogManager().readConfiguration(inputStream);
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, " The logging configuration could not be read.", e);
    }
    String level = System.getProperty("emx.log");
    if (level != null) {
      try {
        Logger.getLogger("emx").setLevel(Level.parse(level.toUpperCase()));
      } catch (IllegalArgumentException e) {
        logger.warning(format(" Unknown log level %s.", level));
      }
    }
  }

  private static void commandLineInterfaceHelp() {
    StringBuilder sb = new StringBuilder("\n Usage: emxc <Command> [-Dkey=value] [options] <file>\n\n Commands:\n");
    for (String command : COMMANDS) {
      sb.append(format("  %s\n", command));
    }
    sb.append("\n Use emxc <Command> -h for the options of a Command.\n");
    logger.info(sb.toString());
  }
}
