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
package fftrim.ui;

import org.junit.Test;

import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

/**
 * Test LogFormatter verbosity.
 */
public class LogFormatterTest {

  @Test
  public void testInfoIsBare() {
    LogFormatter formatter = new LogFormatter();
    LogRecord record = new LogRecord(Level.INFO, " Trimmed 20 records.");
    assertEquals(" Trimmed 20 records.", formatter.format(record));
  }

  @Test
  public void testParameters() {
    LogFormatter formatter = new LogFormatter();
    LogRecord record = new LogRecord(Level.INFO, " Could not resolve {0}.");
    record.setParameters(new Object[]{"ethane.properties"});
    assertEquals(" Could not resolve ethane.properties.", formatter.format(record));
  }

  @Test
  public void testWarningIsDecorated() {
    LogFormatter formatter = new LogFormatter();
    LogRecord record = new LogRecord(Level.WARNING, " Atom type opls_999 is not defined.");
    String formatted = formatter.format(record);
    assertNotEquals(" Atom type opls_999 is not defined.", formatted);
    assertTrue(formatted.contains(Level.WARNING.getLocalizedName()));
    assertTrue(formatted.contains("opls_999"));
  }

  @Test
  public void testDebug() {
    LogFormatter formatter = new LogFormatter(true);
    LogRecord record = new LogRecord(Level.FINE, " Matched (CT, HC).");
    assertTrue(formatter.format(record).contains(Level.FINE.getLocalizedName()));
  }
}
