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

package com.twentyn.balancer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.balancer.equation.BalancedResult;
import com.twentyn.balancer.equation.ChemicalEquationBalancer;
import com.twentyn.balancer.i18n.LocalizedMessages;
import com.twentyn.balancer.solver.SolverConfig;
import com.twentyn.balancer.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class BalanceEquations {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BalanceEquations.class);

  private static final String OPTION_EQUATION = "e";
  private static final String OPTION_INPUT_FILE = "i";
  private static final String OPTION_OUTPUT_FILE = "o";
  private static final String OPTION_LOCALE = "l";
  private static final String OPTION_MAX_WEIGHT = "w";

  private static final String DEFAULT_LOCALE = "en";
  private static final String COMMENT_PREFIX = "#";

  private static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class balances chemical equations such as 'Fe + O2 -> Fe2O3', read from the command line and/or a file ",
      "with one equation per line.  Balanced equations are printed one per line, or written as a JSON array of ",
      "results (coefficients, balanced string and per-element totals) when an output file is given."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_EQUATION)
        .argName("equation")
        .desc("An equation to balance; may be repeated")
        .hasArg()
        .longOpt("equation")
    );
    add(Option.builder(OPTION_INPUT_FILE)
        .argName("input-file")
        .desc("A file containing one equation per line; blank lines and lines starting with # are skipped")
        .hasArg()
        .longOpt("input-file")
    );
    add(Option.builder(OPTION_OUTPUT_FILE)
        .argName("output-file")
        .desc("Write results as JSON to this file instead of printing balanced equations")
        .hasArg()
        .longOpt("output-file")
    );
    add(Option.builder(OPTION_LOCALE)
        .argName("locale")
        .desc(String.format("Language of error messages, one of %s (default %s)",
            LocalizedMessages.SUPPORTED_LOCALES, DEFAULT_LOCALE))
        .hasArg()
        .longOpt("locale")
    );
    add(Option.builder(OPTION_MAX_WEIGHT)
        .argName("max-weight")
        .desc(String.format("Largest weight tried when combining independent solutions (default %d)",
            SolverConfig.DEFAULT_MAX_WEIGHT))
        .hasArg()
        .longOpt("max-weight")
    );
  }};

  private final ChemicalEquationBalancer balancer;

  public BalanceEquations(ChemicalEquationBalancer balancer) {
    this.balancer = balancer;
  }

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(BalanceEquations.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    if (!cl.hasOption(OPTION_EQUATION) && !cl.hasOption(OPTION_INPUT_FILE)) {
      cliUtil.failWithMessage("At least one of --equation or --input-file must be specified");
    }

    LocalizedMessages messages = null;
    try {
      messages = LocalizedMessages.forLanguageTag(cl.getOptionValue(OPTION_LOCALE, DEFAULT_LOCALE));
    } catch (IllegalArgumentException e) {
      cliUtil.failWithMessage(e.getMessage());
    }

    SolverConfig config = SolverConfig.defaults();
    try {
      config = config.withMaxWeight(
          cliUtil.getIntOptionValue(cl, OPTION_MAX_WEIGHT, SolverConfig.DEFAULT_MAX_WEIGHT));
    } catch (ParseException | IllegalArgumentException e) {
      cliUtil.failWithMessage("Invalid max weight: %s", e.getMessage());
    }

    List<String> equations = new ArrayList<>();
    if (cl.hasOption(OPTION_EQUATION)) {
      equations.addAll(Arrays.asList(cl.getOptionValues(OPTION_EQUATION)));
    }
    if (cl.hasOption(OPTION_INPUT_FILE)) {
      File inputFile = new File(cl.getOptionValue(OPTION_INPUT_FILE));
      if (!inputFile.exists()) {
        cliUtil.failWithMessage("Input file does not exist at %s", inputFile.getAbsolutePath());
      }
      equations.addAll(readEquations(inputFile));
    }
    LOGGER.info("Balancing %d equations", equations.size());

    BalanceEquations runner = new BalanceEquations(new ChemicalEquationBalancer(messages, config));
    List<BalancedResult> results = runner.balanceAll(equations);

    if (cl.hasOption(OPTION_OUTPUT_FILE)) {
      File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT_FILE));
      runner.writeJson(results, outputFile);
      LOGGER.info("Wrote %d results to %s", results.size(), outputFile.getAbsolutePath());
    } else {
      runner.printResults(results, System.out);
    }
  }

  /**
   * Read equations from a file, one per line, skipping blank lines and # comments.
   */
  public static List<String> readEquations(File inputFile) throws IOException {
    List<String> equations = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(inputFile.toPath(), StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
          continue;
        }
        equations.add(line);
      }
    }
    return equations;
  }

  public List<BalancedResult> balanceAll(List<String> equations) {
    List<BalancedResult> results = new ArrayList<>(equations.size());
    int failures = 0;
    for (String equation : equations) {
      BalancedResult result = balancer.balance(equation);
      if (!result.isSuccess()) {
        failures++;
      }
      results.add(result);
    }
    if (failures > 0) {
      LOGGER.warn("%d of %d equations could not be balanced", failures, equations.size());
    }
    return results;
  }

  public void printResults(List<BalancedResult> results, PrintStream out) {
    results.forEach(out::println);
  }

  public void writeJson(List<BalancedResult> results, File outputFile) throws IOException {
    ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    mapper.writeValue(outputFile, results);
  }
}
