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

package com.twentyn.balancer.utils;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.io.OutputStreamWriter;
import java.util.List;

/**
 * Command line plumbing shared by the entry points: every tool gets a -h/--help flag, usage is printed on bad input,
 * and argument errors end the process with {@link #EXIT_ARGUMENT_ERROR}.
 *
 * {@link #parse(String[])} and {@link #getIntOptionValue} report problems as {@link ParseException}s and never exit,
 * so they can be tested; {@link #parseCommandLine} and {@link #failWithMessage} are the exiting wrappers used from
 * {@code main}.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final String OPTION_HELP = "h";
  public static final int EXIT_ARGUMENT_ERROR = 1;

  private static final int HELP_WIDTH = 100;

  private final String commandName;
  private final String helpMessage;
  private final Options options = new Options();
  private CommandLine commandLine;

  public CLIUtil(Class<?> mainClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.commandName = mainClass.getCanonicalName();
    this.helpMessage = helpMessage;
    optionBuilders.forEach(builder -> options.addOption(builder.build()));
    options.addOption(Option.builder(OPTION_HELP).longOpt("help").desc("Prints this help message").build());
  }

  public Options getOptions() {
    return options;
  }

  public CommandLine getCommandLine() {
    return commandLine;
  }

  /**
   * Parse arguments without any side effect beyond remembering the result.
   * @throws ParseException if an option is unknown or is missing its argument.
   */
  public CommandLine parse(String[] args) throws ParseException {
    commandLine = new DefaultParser().parse(options, args);
    return commandLine;
  }

  /**
   * Parse arguments; on failure print usage and exit, and on -h print usage and exit successfully.
   */
  public CommandLine parseCommandLine(String[] args) {
    try {
      parse(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      printHelp();
      System.exit(EXIT_ARGUMENT_ERROR);
    }
    if (commandLine.hasOption(OPTION_HELP)) {
      printHelp();
      System.exit(0);
    }
    return commandLine;
  }

  /**
   * @return the integer value of an option, or {@code defaultValue} when the option is absent.
   * @throws ParseException if the value is not an integer.
   */
  public int getIntOptionValue(CommandLine cl, String option, int defaultValue) throws ParseException {
    if (!cl.hasOption(option)) {
      return defaultValue;
    }
    String value = cl.getOptionValue(option);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ParseException(String.format("Option -%s expects an integer, got '%s'", option, value));
    }
  }

  public void failWithMessage(String formatStr, Object... args) {
    failWithMessage(String.format(formatStr, args));
  }

  public void failWithMessage(String msg) {
    LOGGER.error(msg);
    printHelp();
    System.exit(EXIT_ARGUMENT_ERROR);
  }

  public void printHelp(PrintWriter out) {
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(out, HELP_WIDTH, commandName, helpMessage, options,
        formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
    out.flush();
  }

  private void printHelp() {
    printHelp(new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8)));
  }
}
