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

import fftrim.potential.parameters.InteractionKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The outcome of trimming a force field against one structure: the ordered records of the trimmed
 * document, the selected records of each interaction kind and the interactions left unmatched.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class TrimResult {

  private static final Logger logger = Logger.getLogger(TrimResult.class.getName());

  /**
   * One element of the trimmed document.
   */
  public static class Entry {

    /**
     * The section the element belongs in (i.e. HarmonicBondForce).
     */
    public final String section;
    /**
     * The element tag (i.e. Bond).
     */
    public final String tag;
    /**
     * The element's attributes, copied from the source document.
     */
    public final Map<String, String> attributes;

    public Entry(String section, String tag, Map<String, String> attributes) {
      this.section = section;
      this.tag = tag;
      this.attributes = attributes;
    }

    @Override
    public String toString() {
      return format("%s/%s %s", section, tag, attributes);
    }
  }

  private final String structureName;
  private final String forceFieldName;
  private final ResolvedAtomTypes atomTypes;
  private final List<Entry> entries = new ArrayList<>();
  private final Map<InteractionKind, List<MatchResult>> matches =
      new EnumMap<>(InteractionKind.class);
  private final Map<InteractionKind, List<TypeTuple>> unmatched =
      new EnumMap<>(InteractionKind.class);

  TrimResult(String structureName, String forceFieldName, ResolvedAtomTypes atomTypes) {
    this.structureName = structureName;
    this.forceFieldName = forceFieldName;
    this.atomTypes = atomTypes;
    for (InteractionKind kind : InteractionKind.values()) {
      matches.put(kind, Collections.emptyList());
      unmatched.put(kind, Collections.emptyList());
    }
  }

  void addEntry(Entry entry) {
    entries.add(entry);
  }

  void setMatches(InteractionKind kind, List<MatchResult> results, List<TypeTuple> missing) {
    matches.put(kind, Collections.unmodifiableList(new ArrayList<>(results)));
    unmatched.put(kind, Collections.unmodifiableList(new ArrayList<>(missing)));
  }

  public String getStructureName() {
    return structureName;
  }

  public String getForceFieldName() {
    return forceFieldName;
  }

  public ResolvedAtomTypes getResolvedAtomTypes() {
    return atomTypes;
  }

  /**
   * Elements of the trimmed document, in output order.
   *
   * @return an unmodifiable list.
   */
  public List<Entry> getEntries() {
    return Collections.unmodifiableList(entries);
  }

  /**
   * Elements of one section of the trimmed document.
   *
   * @param section the section name.
   * @return the section's elements, in output order.
   */
  public List<Entry> getEntries(String section) {
    List<Entry> list = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.section.equals(section)) {
        list.add(entry);
      }
    }
    return list;
  }

  /**
   * Selected records of an interaction kind.
   *
   * @param kind the interaction kind.
   * @return results in the order records were first selected.
   */
  public List<MatchResult> getMatches(InteractionKind kind) {
    return matches.get(kind);
  }

  /**
   * Type tuples of an interaction kind that no record matched.
   *
   * @param kind the interaction kind.
   * @return the unmatched tuples.
   */
  public List<TypeTuple> getUnmatched(InteractionKind kind) {
    return unmatched.get(kind);
  }

  /**
   * Log a summary.
   */
  public void log() {
    logger.info(toString());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(
        format(" Trimmed %s for %s: %d atom types, %d nonbonded records", forceFieldName,
            structureName, getEntries("AtomTypes").size(), getEntries("NonbondedForce").size()));
    for (InteractionKind kind : InteractionKind.values()) {
      sb.append(format("\n  %-9s %4d records matched, %4d interactions unmatched", kind.getTag(),
          matches.get(kind).size(), unmatched.get(kind).size()));
    }
    return sb.toString();
  }
}
