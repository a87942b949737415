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
 * The Angle class represents the angle formed by two bonds that share an atom; the shared atom is
 * the second atom of the angle.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Angle extends BondedTerm {

  private Angle(Atom a1, Atom ac, Atom a3) {
    super(a1, ac, a3);
  }

  /**
   * Create the angle formed by two bonds.
   *
   * @param b1 a {@link Bond} object.
   * @param b2 a {@link Bond} object.
   * @return the Angle, or null if the bonds do not share an atom.
   */
  static Angle angleFactory(Bond b1, Bond b2) {
    Atom ac = b1.getCommonAtom(b2);
    if (ac == null) {
      return null;
    }
    Atom a1 = b1.get1_2(ac);
    Atom a3 = b2.get1_2(ac);
    return new Angle(a1, ac, a3);
  }

  /**
   * The central atom of this angle.
   *
   * @return the atom shared by both bonds.
   */
  public Atom getCentralAtom() {
    return atoms[1];
  }
}
