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
package fftrim.potential.trim;

import fftrim.potential.bonded.BondedTerm;

import java.util.Arrays;

/**
 * An immutable, ordered tuple of atom type names describing one bonded interaction.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class TypeTuple {

  private final String[] types;

  /**
   * TypeTuple constructor.
   *
   * @param types the atom type of each atom, in order.
   */
  public TypeTuple(String... types) {
    this.types = types.clone();
  }

  /**
   * The atom types of a bonded term.
   *
   * @param term the bonded term.
   * @return a new TypeTuple.
   */
  public static TypeTuple of(BondedTerm term) {
    return new TypeTuple(term.getAtomTypes());
  }

  public int size() {
    return types.length;
  }

  public String get(int position) {
    return types[position];
  }

  /**
   * The atom types, in order.
   *
   * @return a copy of the types.
   */
  public String[] toArray() {
    return types.clone();
  }

  /**
   * Reorder this tuple.
   *
   * @param permutation for each position of the result, the position of this tuple to read.
   * @return the permuted tuple.
   */
  public TypeTuple permute(int[] permutation) {
    if (permutation.length != types.length) {
      throw new IllegalArgumentException(
          String.format(" A permutation of length %d cannot reorder %s.", permutation.length, this));
    }
    String[] permuted = new String[types.length];
    for (int i = 0; i < permutation.length; i++) {
      permuted[i] = types[permutation[i]];
    }
    return new TypeTuple(permuted);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(types, ((TypeTuple) o).types);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int hashCode() {
    return Arrays.hashCode(types);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return "(" + String.join(", ", types) + ")";
  }
}
