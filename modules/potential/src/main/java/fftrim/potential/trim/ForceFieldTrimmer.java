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

import fftrim.potential.bonded.Atom;
import fftrim.potential.bonded.InvalidStructureException;
import fftrim.potential.bonded.TypedStructure;
import fftrim.potential.parameters.AtomType;
import fftrim.potential.parameters.BondedType;
import fftrim.potential.parameters.ForceField;
import fftrim.potential.parameters.InteractionKind;
import fftrim.potential.parameters.NonbondedType;
import org.apache.commons.configuration2.CompositeConfiguration;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static fftrim.potential.parameters.ForceField.ForceFieldType.ATOM;
import static fftrim.potential.parameters.ForceField.ForceFieldType.NONBONDED;
import static java.lang.String.format;

/**
 * The ForceFieldTrimmer reduces a force field to the records one typed structure uses.
 * <p>
 * Atom types come first, then nonbonded records, then the selected records of each bonded
 * interaction kind in the order BOND, ANGLE, PROPER and IMPROPER.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ForceFieldTrimmer {

  private static final Logger logger = Logger.getLogger(ForceFieldTrimmer.class.getName());

  /**
   * Section holding atom type records.
   */
  public static final String ATOM_TYPES = "AtomTypes";
  /**
   * Section holding nonbonded records.
   */
  public static final String NONBONDED_FORCE = "NonbondedForce";

  private final ForceField forceField;
  /**
   * Log each unmatched interaction at INFO rather than FINE.
   */
  private boolean printUnmatched = false;

  public ForceFieldTrimmer(ForceField forceField) {
    this.forceField = forceField;
  }

  /**
   * ForceFieldTrimmer constructor.
   *
   * @param forceField the force field to trim.
   * @param properties read for the <code>print-unmatched</code> flag.
   */
  public ForceFieldTrimmer(ForceField forceField, CompositeConfiguration properties) {
    this(forceField);
    if (properties != null) {
      printUnmatched = properties.getBoolean("print-unmatched", false);
    }
  }

  public void setPrintUnmatched(boolean printUnmatched) {
    this.printUnmatched = printUnmatched;
  }

  /**
   * Trim the force field to the records a structure uses.
   *
   * @param structure the typed structure.
   * @return the trimmed records.
   * @throws InvalidStructureException if the structure has no atoms or an untyped atom.
   */
  public TrimResult trim(TypedStructure structure) {
    validate(structure);

    AtomTypeResolver resolver = new AtomTypeResolver(forceField);
    ResolvedAtomTypes atomTypes = resolver.resolve(structure.getAtomTypeNames());
    TrimResult result = new TrimResult(structure.getName(), forceField.getName(), atomTypes);

    for (AtomType atomType : forceField.getAtomTypes()) {
      if (atomTypes.contains(atomType.name)) {
        result.addEntry(new TrimResult.Entry(ATOM_TYPES, ATOM.tag, atomType.getAttributes()));
      }
    }
    for (NonbondedType nonbondedType : forceField.getNonbondedTypes()) {
      if (atomTypes.contains(nonbondedType.atomType)) {
        result.addEntry(
            new TrimResult.Entry(NONBONDED_FORCE, NONBONDED.tag, nonbondedType.getAttributes()));
      }
    }

    for (InteractionKind kind : InteractionKind.values()) {
      List<BondedType> candidates = SchemaClassifier.classify(kind, forceField.getCandidates(kind));
      List<TypeTuple> tuples = TopologyEnumerator.enumerate(structure, kind);
      ParameterMatcher matcher = new ParameterMatcher(kind, candidates, atomTypes);
      List<TypeTuple> unmatched = new ArrayList<>();
      List<MatchResult> matches = matcher.match(tuples, unmatched);
      for (MatchResult match : matches) {
        result.addEntry(new TrimResult.Entry(kind.section, kind.getTag(),
            match.getBondedType().getAttributes()));
      }
      result.setMatches(kind, matches, unmatched);
      logUnmatched(kind, tuples.size(), unmatched);
    }
    return result;
  }

  private void logUnmatched(InteractionKind kind, int total, List<TypeTuple> unmatched) {
    if (unmatched.isEmpty()) {
      return;
    }
    logger.info(format(" %d of %d unique %s interactions have no %s record.", unmatched.size(),
        total, kind.getTag().toLowerCase(), forceField.getName()));
    Level level = printUnmatched ? Level.INFO : Level.FINE;
    if (logger.isLoggable(level)) {
      for (TypeTuple tuple : unmatched) {
        logger.log(level, format("  %s", tuple));
      }
    }
  }

  /**
   * Check that every atom of a structure carries an atom type.
   *
   * @param structure the structure.
   * @throws InvalidStructureException if the structure cannot be trimmed against.
   */
  private static void validate(TypedStructure structure) {
    if (structure == null) {
      throw new InvalidStructureException(" No structure was given.", null);
    }
    List<Atom> atoms = structure.getAtoms();
    if (atoms == null || atoms.isEmpty()) {
      throw new InvalidStructureException(
          format(" Structure %s has no atoms.", structure.getName()), structure.getName());
    }
    for (Atom atom : atoms) {
      String atomType = atom.getAtomType();
      if (atomType == null || atomType.trim().isEmpty()) {
        throw new InvalidStructureException(
            format(" Atom %d of structure %s has no atom type.", atom.getIndex(),
                structure.getName()), structure.getName(), atom);
      }
    }
  }
}
