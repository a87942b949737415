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

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

/**
 * Test argument processing of the command line entry point.
 */
public class MainTest {

  private Properties systemProperties;

  @Before
  public void setUp() {
    systemProperties = (Properties) System.getProperties().clone();
  }

  @After
  public void tearDown() {
    System.setProperties(systemProperties);
  }

  @Test
  public void testProcessProperties() {
    String[] args = Main.processProperties(
        new String[]{"-Dxml-indent=4", "Trim", "-Dprint-unmatched", "ethane.xyz", "oplsaa.xml"});
    assertArrayEquals(new String[]{"Trim", "ethane.xyz", "oplsaa.xml"}, args);
    assertEquals("4", System.getProperty("xml-indent"));
    assertEquals("", System.getProperty("print-unmatched"));
  }

  @Test
  public void testValueWithEquals() {
    Main.processProperties(new String[]{"-Dtrim.key=a=b.log"});
    assertEquals("a=b.log", System.getProperty("trim.key"));
  }

  @Test
  public void testNoCommand() {
    assertNull(Main.runCommand(new String[0]));
  }

  @Test
  public void testUnknownCommand() {
    assertNull(Main.runCommand(new String[]{"Minimize", "ethane.xyz"}));
  }
}
