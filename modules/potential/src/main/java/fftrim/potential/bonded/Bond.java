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
 * The Bond class represents a covalent bond between two atoms.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Bond extends BondedTerm {

  /**
   * Bond constructor. The bond is registered with both of its atoms.
   *
   * @param a1 Atom number 1.
   * @param a2 Atom number 2.
   */
  public Bond(Atom a1, Atom a2) {
    super(a1, a2);
    a1.addBond(this);
    a2.addBond(this);
  }

  /**
   * Finds the other atom in this bond.
   *
   * @param a an atom of this bond.
   * @return the other atom, or null if <code>a</code> is not part of this bond.
   */
  public Atom get1_2(Atom a) {
    if (a == atoms[0]) {
      return atoms[1];
    }
    if (a == atoms[1]) {
      return atoms[0];
    }
    return null;
  }

  /**
   * Find the atom shared with another bond.
   *
   * @param b the other bond.
   * @return the common atom, or null if the bonds do not share one.
   */
  public Atom getCommonAtom(Bond b) {
    if (b == this || b == null) {
      return null;
    }
    if (b.atoms[0] == atoms[0] || b.atoms[1] == atoms[0]) {
      return atoms[0];
    }
    if (b.atoms[0] == atoms[1] || b.atoms[1] == atoms[1]) {
      return atoms[1];
    }
    return null;
  }

  /**
   * Find the atom of this bond that is not shared with the given bond.
   *
   * @param b the other bond.
   * @return the atom of this bond not in <code>b</code>, or null if they share no atom.
   */
  public Atom getOtherAtom(Bond b) {
    Atom common = getCommonAtom(b);
    if (common == null) {
      return null;
    }
    return get1_2(common);
  }
}
