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
package fftrim.potential.bonded;

/**
 * This exception is thrown when a structure cannot be trimmed against: it is not a typed structure,
 * it has no atoms, or one of its atoms has no atom type.
 *
 * @since 1.0
 */
public class InvalidStructureException extends RuntimeException {

  /**
   * The source of the structure (file name or structure name), if known.
   */
  public final String source;
  /**
   * The offending atom, if the problem is with one atom.
   */
  public final Atom atom;

  public InvalidStructureException(String message, String source) {
    this(message, source, null, null);
  }

  public InvalidStructureException(String message, String source, Atom atom) {
    this(message, source, atom, null);
  }

  public InvalidStructureException(String message, String source, Throwable cause) {
    this(message, source, null, cause);
  }

  public InvalidStructureException(String message, String source, Atom atom, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.atom = atom;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(super.toString());
    if (source != null) {
      sb.append("\n Structure: ").append(source);
    }
    if (atom != null) {
      sb.append("\n Atom: ").append(atom);
    }
    return sb.toString();
  }
}
