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
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Test the precedence of property sources.
 */
public class KeywordTest {

  private File dir;

  @Before
  public void setUp() throws IOException {
    dir = Files.createTempDirectory("KeywordTest").toFile();
  }

  @After
  public void tearDown() throws IOException {
    System.clearProperty("xml-indent");
    FileUtils.deleteDirectory(dir);
  }

  @Test
  public void testStructureProperties() throws IOException {
    File structure = new File(dir, "ethane.xyz");
    FileUtils.writeStringToFile(new File(dir, "ethane.properties"),
        "xml-indent = 4\nprint-unmatched = true\n", StandardCharsets.UTF_8);

    CompositeConfiguration properties = Keyword.loadProperties(structure);
    assertEquals(4, properties.getInt("xml-indent", 2));
    assertTrue(properties.getBoolean("print-unmatched", false));
    assertTrue(properties.containsKey("propertyFile"));
  }

  @Test
  public void testPropExtension() throws IOException {
    File structure = new File(dir, "acetone.xyz");
    FileUtils.writeStringToFile(new File(dir, "acetone.prop"), "xml-indent = 3\n",
        StandardCharsets.UTF_8);
    assertEquals(3, Keyword.loadProperties(structure).getInt("xml-indent", 2));
  }

  @Test
  public void testSystemPropertiesTakePrecedence() throws IOException {
    File structure = new File(dir, "ethane.xyz");
    FileUtils.writeStringToFile(new File(dir, "ethane.properties"), "xml-indent = 4\n",
        StandardCharsets.UTF_8);
    System.setProperty("xml-indent", "8");
    assertEquals(8, Keyword.loadProperties(structure).getInt("xml-indent", 2));
  }

  @Test
  public void testDefaults() {
    CompositeConfiguration properties = Keyword.loadProperties(new File(dir, "none.xyz"));
    assertEquals(2, properties.getInt("xml-indent", 2));
    assertFalse(properties.getBoolean("print-unmatched", false));
    assertFalse(properties.containsKey("propertyFile"));
  }
}
