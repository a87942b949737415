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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;

/**
 * The Atom class represents one typed atom of a structure.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Atom {

  /**
   * Index of this atom within its structure, starting at 1.
   */
  private final int index;
  /**
   * Atom name (i.e. C1).
   */
  private final String name;
  /**
   * The atom type assigned to this atom (i.e. opls_135).
   */
  private final String atomType;
  /**
   * Bonds this atom takes part in, in the order they were made.
   */
  private final List<Bond> bonds = new ArrayList<>();

  /**
   * Atom constructor.
   *
   * @param index    the atom index, starting at 1.
   * @param name     the atom name.
   * @param atomType the assigned atom type.
   */
  public Atom(int index, String name, String atomType) {
    this.index = index;
    this.name = name;
    this.atomType = atomType;
  }

  public int getIndex() {
    return index;
  }

  public String getName() {
    return name;
  }

  /**
   * The atom type assigned to this atom.
   *
   * @return the atom type name, or null if the atom is untyped.
   */
  public String getAtomType() {
    return atomType;
  }

  /**
   * Bonds this atom takes part in.
   *
   * @return an unmodifiable list.
   */
  public List<Bond> getBonds() {
    return Collections.unmodifiableList(bonds);
  }

  /**
   * Number of atoms bonded to this one.
   *
   * @return the number of bonds.
   */
  public int getNumBonds() {
    return bonds.size();
  }

  /**
   * Returns true if this atom is bonded to the given atom.
   *
   * @param atom the other atom.
   * @return true if bonded.
   */
  public boolean isBonded(Atom atom) {
    for (Bond bond : bonds) {
      if (bond.get1_2(this) == atom) {
        return true;
      }
    }
    return false;
  }

  void addBond(Bond bond) {
    bonds.add(bond);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format("%d-%s %s", index, name, atomType);
  }
}
