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
 * The Torsion class represents a proper torsion: four atoms bonded in a chain a0-a1-a2-a3.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Torsion extends BondedTerm {

  private Torsion(Atom a0, Atom a1, Atom a2, Atom a3) {
    super(a0, a1, a2, a3);
  }

  /**
   * Attempt to create a new Torsion based on the supplied bonds. The first and last bonds must each
   * share an atom with the middle bond.
   *
   * @param bond1      the first Bond.
   * @param middleBond the middle Bond.
   * @param bond3      the last Bond.
   * @return a new Torsion, or null if the bonds do not form a chain of four distinct atoms.
   */
  static Torsion torsionFactory(Bond bond1, Bond middleBond, Bond bond3) {
    Atom a1 = bond1.getCommonAtom(middleBond);
    Atom a2 = bond3.getCommonAtom(middleBond);
    if (a1 == null || a2 == null || a1 == a2) {
      return null;
    }
    Atom a0 = bond1.get1_2(a1);
    Atom a3 = bond3.get1_2(a2);
    // A three-membered ring closes the chain back on itself.
    if (a0 == a3) {
      return null;
    }
    return new Torsion(a0, a1, a2, a3);
  }
}
