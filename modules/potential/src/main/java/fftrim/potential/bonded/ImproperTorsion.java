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

import java.util.List;

/**
 * The ImproperTorsion class represents an improper torsion about a trigonal atom. The trigonal
 * (central) atom is listed first, followed by the three atoms bonded to it.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ImproperTorsion extends BondedTerm {

  private ImproperTorsion(Atom center, Atom a1, Atom a2, Atom a3) {
    super(center, a1, a2, a3);
  }

  /**
   * ImproperTorsion factory method.
   *
   * @param atom Create the improper torsion around this atom.
   * @return the ImproperTorsion if the atom has exactly three bonds, or null otherwise.
   */
  static ImproperTorsion improperTorsionFactory(Atom atom) {
    if (atom == null) {
      return null;
    }
    List<Bond> bonds = atom.getBonds();
    if (bonds.size() != 3) {
      return null;
    }
    return new ImproperTorsion(atom, bonds.get(0).get1_2(atom), bonds.get(1).get1_2(atom),
        bonds.get(2).get1_2(atom));
  }

  /**
   * The trigonal atom this improper torsion is defined about.
   *
   * @return the central atom.
   */
  public Atom getCentralAtom() {
    return atoms[0];
  }
}
