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
import fftrim.potential.bonded.TypedStructure;
import fftrim.potential.parameters.InteractionKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The TopologyEnumerator reduces the bonded terms of a structure to the unique atom type tuples of
 * one interaction kind. Tuples related by one of the kind's permutations are the same interaction;
 * the first one seen is kept.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class TopologyEnumerator {

  private TopologyEnumerator() {
  }

  /**
   * Unique type tuples of one interaction kind of a structure.
   *
   * @param structure the typed structure.
   * @param kind      the interaction kind.
   * @return unique tuples in order of first occurrence.
   */
  public static List<TypeTuple> enumerate(TypedStructure structure, InteractionKind kind) {
    List<TypeTuple> tuples = new ArrayList<>();
    for (BondedTerm term : kind.getTerms(structure)) {
      tuples.add(TypeTuple.of(term));
    }
    return unique(tuples, kind.getPermutations());
  }

  /**
   * Drop every tuple that is a permutation of a tuple already kept.
   *
   * @param tuples       tuples in source order.
   * @param permutations the equivalent orderings, the identity included.
   * @return unique tuples in order of first occurrence.
   */
  public static List<TypeTuple> unique(List<TypeTuple> tuples, int[][] permutations) {
    List<TypeTuple> unique = new ArrayList<>();
    Set<TypeTuple> accepted = new HashSet<>();
    for (TypeTuple tuple : tuples) {
      boolean seen = accepted.contains(tuple);
      for (int i = 0; i < permutations.length && !seen; i++) {
        seen = accepted.contains(tuple.permute(permutations[i]));
      }
      if (!seen) {
        accepted.add(tuple);
        unique.add(tuple);
      }
    }
    return unique;
  }
}
