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

import java.util.Arrays;

/**
 * The BondedTerm class is the base of the bonded interactions of a structure: an ordered list of
 * atoms whose atom types are matched against force field records.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class BondedTerm {

  /**
   * The atoms of this term, in order.
   */
  protected final Atom[] atoms;

  /**
   * BondedTerm constructor.
   *
   * @param atoms the atoms of this term, in order.
   */
  protected BondedTerm(Atom... atoms) {
    this.atoms = atoms;
  }

  /**
   * Get one atom of this term.
   *
   * @param i the position, counted from 0.
   * @return the atom.
   */
  public Atom getAtom(int i) {
    return atoms[i];
  }

  /**
   * Number of atoms in this term.
   *
   * @return the number of atoms.
   */
  public int getNumberOfAtoms() {
    return atoms.length;
  }

  /**
   * Returns true if the given atom is part of this term.
   *
   * @param atom the atom.
   * @return true if it is one of the atoms of this term.
   */
  public boolean containsAtom(Atom atom) {
    for (Atom a : atoms) {
      if (a == atom) {
        return true;
      }
    }
    return false;
  }

  /**
   * The atom type of each atom of this term, in order.
   *
   * @return the atom types.
   */
  public String[] getAtomTypes() {
    String[] types = new String[atoms.length];
    for (int i = 0; i < atoms.length; i++) {
      types[i] = atoms[i].getAtomType();
    }
    return types;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(" ");
    for (int i = 0; i < atoms.length; i++) {
      if (i > 0) {
        sb.append("-");
      }
      sb.append(atoms[i].getIndex());
    }
    sb.append(" ").append(Arrays.toString(getAtomTypes()));
    return sb.toString();
  }
}
