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

import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * A minor extension to the SimpleFormatter to reduce verbosity if debugging is not turned on.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LogFormatter extends SimpleFormatter {

  private static final int warningLevel = Level.WARNING.intValue();
  private final boolean debug;

  /**
   * Constructor for the LogFormatter with debugging off.
   */
  public LogFormatter() {
    this(false);
  }

  /**
   * Constructor for the LogFormatter.
   *
   * @param debug If debug is true, then LogFormatter is equivalent to {@link SimpleFormatter}.
   * @since 1.0
   */
  public LogFormatter(boolean debug) {
    this.debug = debug;
  }

  /**
   * {@inheritDoc}
   * <p>
   * Unless debugging is turned on or the LogRecord is of level WARNING or greater, just return the
   * message.
   *
   * @since 1.0
   */
  @Override
  public String format(LogRecord record) {
    if (debug || record.getLevel().intValue() >= warningLevel) {
      return super.format(record);
    }
    String message = record.getMessage();
    Object[] objects = record.getParameters();
    if (message != null && objects != null && objects.length > 0) {
      message = MessageFormat.format(message, objects);
    }
    return message;
  }
}
