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

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * The default ConsoleHandler publishes logging to System.err. This class publishes to System.out,
 * except for SEVERE records, which go to System.err.
 *
 * <p>The formatter used reduces verbosity relative to the default SimpleFormatter.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LogHandler extends Handler {

  /**
   * Set once a SEVERE record has been published.
   */
  private boolean severe = false;

  /**
   * Construct the Force Field Trim Log Handler.
   *
   * @since 1.0
   */
  public LogHandler() {
    setLevel(Level.ALL);
    // Log all messages to the file specified by "fftrim.log.file".
    String log = System.getProperty("fftrim.log.file", "");
    if (log != null && !log.isEmpty()) {
      String logFile = new File(log).getAbsolutePath();
      try {
        PrintStream printStream = new PrintStream(new FileOutputStream(logFile, true), true);
        System.setOut(printStream);
        System.setErr(printStream);
      } catch (IOException e) {
        reportError(" Could not open log file " + logFile, e, ErrorManager.OPEN_FAILURE);
      }
    }
    setFormatter(new LogFormatter(System.getProperty("fftrim.debug") != null));
  }

  /**
   * {@inheritDoc}
   *
   * <p>Flush, but do not close System.out.
   *
   * @since 1.0
   */
  @Override
  public void close() {
    flush();
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public void flush() {
    System.out.flush();
    System.err.flush();
  }

  /**
   * Returns true if a SEVERE record has been published.
   *
   * @return true after a command failure.
   */
  public boolean hasSevere() {
    return severe;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Publish a LogRecord.
   *
   * @since 1.0.
   */
  @Override
  public synchronized void publish(LogRecord record) {
    if (!isLoggable(record)) {
      return;
    }

    String msg;
    try {
      msg = getFormatter().format(record);
    } catch (Exception e) {
      // Report the exception to any registered ErrorManager.
      reportError(null, e, ErrorManager.FORMAT_FAILURE);
      return;
    }

    try {
      if (record.getLevel() == Level.SEVERE) {
        severe = true;
        System.err.println(msg);
        Throwable throwable = record.getThrown();
        if (throwable != null) {
          System.err.printf(" %s%n", throwable);
        }
        System.err.flush();
      } else {
        System.out.println(msg);
      }
    } catch (Exception e) {
      // Report the exception to any registered ErrorManager.
      reportError(null, e, ErrorManager.WRITE_FAILURE);
    }
  }
}
