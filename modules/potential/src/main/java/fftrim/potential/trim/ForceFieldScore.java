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

import fftrim.potential.parameters.ForceField;
import fftrim.potential.parameters.InteractionKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.logging.Logger;

import static fftrim.potential.parameters.ForceField.ForceFieldType.ATOM;
import static java.lang.String.format;

/**
 * The ForceFieldScore measures how much of a force field one structure exercises: the fraction of
 * atom type records it uses and, for each bonded interaction kind, the fraction of candidate records
 * it selects.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ForceFieldScore {

  private static final Logger logger = Logger.getLogger(ForceFieldScore.class.getName());

  private final String forceFieldName;
  private final String structureName;
  private final int atomTypeCount;
  private final int atomTypesUsed;
  private final Map<InteractionKind, Integer> candidateCounts = new EnumMap<>(InteractionKind.class);
  private final Map<InteractionKind, Integer> matchedCounts = new EnumMap<>(InteractionKind.class);

  /**
   * Score a trim result against the force field it was trimmed from.
   *
   * @param forceField the untrimmed force field.
   * @param result     the trim result.
   */
  public ForceFieldScore(ForceField forceField, TrimResult result) {
    forceFieldName = forceField.getName();
    structureName = result.getStructureName();
    atomTypeCount = forceField.getForceFieldTypeCount(ATOM);
    atomTypesUsed = result.getEntries(ForceFieldTrimmer.ATOM_TYPES).size();
    for (InteractionKind kind : InteractionKind.values()) {
      candidateCounts.put(kind, forceField.getCandidates(kind).size());
      matchedCounts.put(kind, result.getMatches(kind).size());
    }
  }

  /**
   * Fraction of Type records used.
   *
   * @return a value between 0 and 1; 0 for a force field without atom types.
   */
  public double getAtomTypeCoverage() {
    return fraction(atomTypesUsed, atomTypeCount);
  }

  /**
   * Fraction of the candidate records of one kind that were selected.
   *
   * @param kind the interaction kind.
   * @return a value between 0 and 1; 0 when the force field has no records of the kind.
   */
  public double getCoverage(InteractionKind kind) {
    return fraction(matchedCounts.get(kind), candidateCounts.get(kind));
  }

  /**
   * Fraction of all atom type and bonded records that were used.
   *
   * @return a value between 0 and 1.
   */
  public double getScore() {
    int used = atomTypesUsed;
    int total = atomTypeCount;
    for (InteractionKind kind : InteractionKind.values()) {
      used += matchedCounts.get(kind);
      total += candidateCounts.get(kind);
    }
    return fraction(used, total);
  }

  public int getMatchedCount(InteractionKind kind) {
    return matchedCounts.get(kind);
  }

  public int getCandidateCount(InteractionKind kind) {
    return candidateCounts.get(kind);
  }

  private static double fraction(int used, int total) {
    if (total == 0) {
      return 0.0;
    }
    return (double) used / (double) total;
  }

  /**
   * Log the score.
   */
  public void log() {
    logger.info(toString());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(
        format(" Coverage of %s by %s\n", forceFieldName, structureName));
    sb.append(format("  %-9s %5d of %5d  %6.2f%%\n", "Type", atomTypesUsed, atomTypeCount,
        100.0 * getAtomTypeCoverage()));
    for (InteractionKind kind : InteractionKind.values()) {
      sb.append(format("  %-9s %5d of %5d  %6.2f%%\n", kind.getTag(), matchedCounts.get(kind),
          candidateCounts.get(kind), 100.0 * getCoverage(kind)));
    }
    sb.append(format("  %-9s %25.2f%%", "Score", 100.0 * getScore()));
    return sb.toString();
  }
}
