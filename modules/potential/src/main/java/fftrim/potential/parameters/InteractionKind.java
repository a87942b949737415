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
package fftrim.potential.parameters;

import fftrim.potential.bonded.BondedTerm;
import fftrim.potential.bonded.TypedStructure;
import fftrim.potential.parameters.ForceField.ForceFieldType;

import java.util.List;

/**
 * The four bonded interaction kinds that parameters are trimmed for.
 * <p>
 * Each kind knows its arity, the XML element its parameter records use, the section of the trimmed
 * document its records are written to, the atom orderings under which two of its interactions are
 * the same interaction, and how to get its bonded terms from a structure.
 *
 * @since 1.0
 */
public enum InteractionKind {

  /**
   * Two-body bond stretch; forward and reverse orderings are equivalent.
   */
  BOND(ForceFieldType.BOND, "HarmonicBondForce", new int[][]{{0, 1}, {1, 0}}) {
    @Override
    public List<? extends BondedTerm> getTerms(TypedStructure structure) {
      return structure.getBonds();
    }
  },

  /**
   * Three-body angle bend; forward and reverse orderings are equivalent.
   */
  ANGLE(ForceFieldType.ANGLE, "HarmonicAngleForce", new int[][]{{0, 1, 2}, {2, 1, 0}}) {
    @Override
    public List<? extends BondedTerm> getTerms(TypedStructure structure) {
      return structure.getAngles();
    }
  },

  /**
   * Four-body proper torsion along a chain; forward and reverse orderings are equivalent.
   */
  PROPER(ForceFieldType.PROPER, "RBTorsionForce", new int[][]{{0, 1, 2, 3}, {3, 2, 1, 0}}) {
    @Override
    public List<? extends BondedTerm> getTerms(TypedStructure structure) {
      return structure.getTorsions();
    }
  },

  /**
   * Four-body improper torsion about a central atom listed first; any order of the three peripheral
   * atoms is equivalent.
   */
  IMPROPER(ForceFieldType.IMPROPER, "PeriodicTorsionForce", new int[][]{
      {0, 1, 2, 3}, {0, 1, 3, 2}, {0, 2, 1, 3}, {0, 2, 3, 1}, {0, 3, 1, 2}, {0, 3, 2, 1}}) {
    @Override
    public List<? extends BondedTerm> getTerms(TypedStructure structure) {
      return structure.getImproperTorsions();
    }
  };

  /**
   * The ForceFieldType of records for this kind.
   */
  public final ForceFieldType forceFieldType;
  /**
   * The section of the trimmed document that matched records are written to.
   */
  public final String section;
  /**
   * Number of atoms in one interaction.
   */
  public final int arity;
  /**
   * Atom orderings that describe the same interaction; the identity ordering comes first.
   */
  private final int[][] permutations;

  InteractionKind(ForceFieldType forceFieldType, String section, int[][] permutations) {
    this.forceFieldType = forceFieldType;
    this.section = section;
    this.arity = permutations[0].length;
    this.permutations = permutations;
  }

  /**
   * The bonded terms of this kind in the given structure.
   *
   * @param structure the typed structure.
   * @return its terms of this kind, in structure order.
   */
  public abstract List<? extends BondedTerm> getTerms(TypedStructure structure);

  /**
   * The XML element name of parameter records for this kind (i.e. Bond).
   *
   * @return the element name.
   */
  public String getTag() {
    return forceFieldType.tag;
  }

  /**
   * The equivalent atom orderings of this kind. Entry <code>[p][i]</code> is the index of the atom
   * placed at position <code>i</code> by ordering <code>p</code>.
   *
   * @return a copy of the orderings.
   */
  public int[][] getPermutations() {
    int[][] copy = new int[permutations.length][];
    for (int i = 0; i < permutations.length; i++) {
      copy[i] = permutations[i].clone();
    }
    return copy;
  }
}
