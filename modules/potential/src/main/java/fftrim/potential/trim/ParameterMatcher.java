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

import fftrim.potential.parameters.BondedType;
import fftrim.potential.parameters.InteractionKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The ParameterMatcher selects, for each unique type tuple of an interaction kind, the most specific
 * candidate record that matches it under one of the kind's atom orderings.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ParameterMatcher {

  private static final Logger logger = Logger.getLogger(ParameterMatcher.class.getName());

  private final InteractionKind kind;
  /**
   * Candidate records in priority order.
   */
  private final List<BondedType> candidates;
  private final ResolvedAtomTypes atomTypes;
  private final int[][] permutations;

  /**
   * ParameterMatcher constructor.
   *
   * @param kind       the interaction kind.
   * @param candidates classified candidate records, most specific first.
   * @param atomTypes  the resolved atom types, used to look up atom classes.
   */
  public ParameterMatcher(InteractionKind kind, List<BondedType> candidates,
                          ResolvedAtomTypes atomTypes) {
    this.kind = kind;
    this.candidates = new ArrayList<>(candidates);
    this.atomTypes = atomTypes;
    this.permutations = kind.getPermutations();
  }

  /**
   * Find the first candidate record that matches a tuple.
   *
   * @param tuple the type tuple.
   * @return the record, or null if none matches.
   */
  public BondedType findMatch(TypeTuple tuple) {
    String[] types = tuple.toArray();
    String[] classes = new String[types.length];
    for (int i = 0; i < types.length; i++) {
      classes[i] = atomTypes.getAtomClass(types[i]);
    }
    for (BondedType bondedType : candidates) {
      for (int[] permutation : permutations) {
        if (bondedType.matches(types, classes, permutation)) {
          return bondedType;
        }
      }
    }
    return null;
  }

  /**
   * Match tuples to candidate records.
   *
   * @param tuples the unique type tuples.
   * @return one result per selected record, in the order records were first selected.
   */
  public List<MatchResult> match(List<TypeTuple> tuples) {
    return match(tuples, new ArrayList<>());
  }

  /**
   * Match tuples to candidate records.
   *
   * @param tuples    the unique type tuples.
   * @param unmatched receives every tuple that no record matches.
   * @return one result per selected record, in the order records were first selected.
   */
  public List<MatchResult> match(List<TypeTuple> tuples, List<TypeTuple> unmatched) {
    Map<BondedType, MatchResult> results = new LinkedHashMap<>();
    for (TypeTuple tuple : tuples) {
      BondedType bondedType = findMatch(tuple);
      if (bondedType == null) {
        unmatched.add(tuple);
        if (logger.isLoggable(Level.FINE)) {
          logger.fine(format(" No %s record matches %s.", kind.getTag(), tuple));
        }
        continue;
      }
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" %s matched %s", tuple, bondedType));
      }
      results.computeIfAbsent(bondedType, MatchResult::new).addTuple(tuple);
    }
    return new ArrayList<>(results.values());
  }

  public InteractionKind getKind() {
    return kind;
  }
}
