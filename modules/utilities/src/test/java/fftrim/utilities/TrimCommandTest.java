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

import org.junit.Test;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

/**
 * Test command look-up and argument handling of the TrimCommand base class.
 */
public class TrimCommandTest {

  /**
   * A minimal command.
   */
  @Command(name = "Echo", description = " Echo the given file names.")
  public static class Echo extends TrimCommand {

    @Option(names = {"-u", "--upper"}, description = "Upper case.")
    boolean upper = false;

    @Parameters(arity = "1..*", paramLabel = "files", description = "File names.")
    List<String> files = null;

    public Echo() {
      super();
    }

    public Echo(TrimBinding binding) {
      super(binding);
    }

    @Override
    public Echo run() {
      if (!init()) {
        return this;
      }
      binding.setVariable("echo", upper ? files.toString().toUpperCase() : files.toString());
      return this;
    }
  }

  @Test
  public void testGetCommand() {
    assertSame(Echo.class, TrimCommand.getCommand(Echo.class.getName()));
    assertNull(TrimCommand.getCommand("NoSuchCommand"));
    // Loadable, but not a command.
    assertNull(TrimCommand.getCommand(String.class.getName()));
  }

  @Test
  public void testListArgs() {
    TrimBinding binding = new TrimBinding(new String[]{"-u", "a.xyz", "b.xml"});
    Echo echo = new Echo(binding);
    echo.run();
    assertArrayEquals(new String[]{"-u", "a.xyz", "b.xml"}, echo.args);
    assertEquals("[A.XYZ, B.XML]", binding.getVariable("echo"));
  }

  @Test
  public void testArrayArgs() {
    TrimBinding binding = new TrimBinding();
    binding.setVariable("args", new String[]{"a.xyz"});
    Echo echo = new Echo(binding);
    echo.run();
    assertEquals("[a.xyz]", binding.getVariable("echo"));
    assertTrue(echo.parseResult.hasMatchedPositional(0));
  }

  @Test
  public void testHelp() {
    TrimBinding binding = new TrimBinding(new String[]{"--help"});
    Echo echo = new Echo(binding);
    assertFalse(echo.init());
    assertTrue(echo.help);
    assertTrue(echo.helpString().contains("Echo"));
  }

  @Test(expected = CommandLine.UnmatchedArgumentException.class)
  public void testUnknownOption() {
    Echo echo = new Echo(new TrimBinding(new String[]{"--nosuch", "a.xyz"}));
    echo.init();
  }

  @Test
  public void testBaseDir() {
    Echo echo = new Echo();
    File dir = new File(System.getProperty("java.io.tmpdir")).getAbsoluteFile();
    echo.binding.setVariable("baseDir", dir);
    assertEquals(dir.getAbsolutePath() + File.separator, echo.getBaseDirString("ethane.xyz"));

    echo.binding.removeVariable("baseDir");
    File structure = new File(dir, "ethane.xyz");
    assertEquals(dir.getAbsolutePath() + File.separator,
        echo.getBaseDirString(structure.getPath()));
  }

  @Test
  public void testSetBinding() {
    Echo echo = new Echo();
    TrimBinding binding = new TrimBinding(Arrays.asList("x").toArray(new String[0]));
    echo.setBinding(binding);
    echo.run();
    assertEquals("[x]", binding.getVariable("echo"));
  }
}
