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
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.junit.Before;
import org.junit.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class CLIUtilTest {

  private CLIUtil cliUtil;

  @Before
  public void setup() {
    cliUtil = new CLIUtil(CLIUtilTest.class, "Balances things", Arrays.asList(
        Option.builder("e").argName("equation").desc("An equation").hasArg().longOpt("equation"),
        Option.builder("w").argName("weight").desc("A weight").hasArg().longOpt("max-weight")));
  }

  @Test
  public void testHelpOptionIsAlwaysAdded() {
    assertTrue(cliUtil.getOptions().hasOption(CLIUtil.OPTION_HELP));
    assertTrue(cliUtil.getOptions().hasOption("help"));
    assertTrue(cliUtil.getOptions().hasOption("equation"));
    assertTrue(cliUtil.getOptions().hasOption("w"));
  }

  @Test
  public void testParseRemembersCommandLine() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{"--equation", "H2 + O2 -> H2O"});
    assertSame(cl, cliUtil.getCommandLine());
    assertEquals("H2 + O2 -> H2O", cl.getOptionValue("e"));
    assertFalse(cl.hasOption(CLIUtil.OPTION_HELP));
  }

  @Test(expected = ParseException.class)
  public void testUnknownOptionIsRejected() throws Exception {
    cliUtil.parse(new String[]{"--not-an-option"});
  }

  @Test
  public void testIntOptionValue() throws Exception {
    assertEquals(4, cliUtil.getIntOptionValue(cliUtil.parse(new String[]{"-w", "4"}), "w", 6));
    assertEquals("Absent options use the default",
        6, cliUtil.getIntOptionValue(cliUtil.parse(new String[]{}), "w", 6));
  }

  @Test(expected = ParseException.class)
  public void testNonIntegerOptionValueIsRejected() throws Exception {
    cliUtil.getIntOptionValue(cliUtil.parse(new String[]{"-w", "six"}), "w", 6);
  }

  @Test
  public void testHelpListsOptions() {
    StringWriter out = new StringWriter();
    cliUtil.printHelp(new PrintWriter(out));
    String help = out.toString();
    assertTrue(help, help.contains(CLIUtilTest.class.getCanonicalName()));
    assertTrue(help, help.contains("Balances things"));
    assertTrue(help, help.contains("--max-weight"));
    assertTrue(help, help.contains("--help"));
  }
}
