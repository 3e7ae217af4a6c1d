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

import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;
import static picocli.CommandLine.usage;

/**
 * Base EMX Command class.
 *
 * <p>Subclasses declare their options with picocli annotations, call {@link #init()} to parse the
 * arguments held by their {@link EMXBinding}, and then do their work in {@link #run()}.
 *
 * @author Michael J. Schnieders
 */
public abstract class EMXCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(EMXCommand.class.getName());

  /**
   * Package searched for Commands given by simple name.
   */
  public static final String COMMAND_PACKAGE = "emx.transform.commands.";

  /**
   * Help is only colored when System.console() is attached.
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
   * -V or --version Prints the EMX version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the EM Transform X version and exit.")
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
  public EMXBinding binding;

  /**
   * Default constructor for an EMX Command.
   */
  public EMXCommand() {
    this(new EMXBinding());
  }

  /**
   * Create an EMX Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public EMXCommand(String[] args) {
    this(new EMXBinding());
    binding.setVariable("args", Arrays.asList(args));
  }

  /**
   * Create an EMX Command that reads its variables from a Binding.
   *
   * @param binding the Binding that provides variables to this Command.
   */
  public EMXCommand(EMXBinding binding) {
    this.binding = binding;
    color = (System.console() != null) ? Ansi.ON : Ansi.OFF;
  }

  /**
   * Set the Binding that provides variables to this Command.
   *
   * @param binding The Binding to use.
   */
  public void setBinding(EMXBinding binding) {
    this.binding = binding;
  }

  /**
   * Use the ClassLoader to find the requested Command.
   *
   * @param name Name of the Command to load (e.g., Convert).
   * @return The Command, if found, or null.
   */
  public static Class<? extends EMXCommand> getCommand(String name) {
    ClassLoader loader = EMXCommand.class.getClassLoader();
    Class<?> command;
    try {
      // First try to load the class directly.
      command = loader.loadClass(name);
    } catch (ClassNotFoundException e) {
      try {
        command = loader.loadClass(COMMAND_PACKAGE + name);
      } catch (ClassNotFoundException e2) {
        logger.warning(format(" %s was not found.", name));
        return null;
      }
    }
    if (!EMXCommand.class.isAssignableFrom(command)) {
      logger.warning(format(" %s is not a Command.", name));
      return null;
    }
    return command.asSubclass(EMXCommand.class);
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    StringOutputStream sos = new StringOutputStream(new ByteArrayOutputStream());
    usage(this, sos, color);
    return " " + sos;
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
    } else if (arguments instanceof String[]) {
      args = (String[]) arguments;
    } else if (arguments instanceof String) {
      args = new String[]{(String) arguments};
    } else {
      args = new String[0];
    }

    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is a long-form argument (such as --from) preceded by only one dash.");
      throw uae;
    }

    // Print help info and exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    return !version;
  }

  /**
   * Execute this Command.
   *
   * @return The current EMXCommand.
   */
  public EMXCommand run() {
    logger.info(helpString());
    return this;
  }
}
