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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The ForceField class organizes the records of one force field XML document.
 * <p>
 * Atom types, nonbonded records and the candidate records of each bonded interaction kind are kept in
 * document order, since the order of the trimmed document follows it.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ForceField {

  private static final Logger logger = Logger.getLogger(ForceField.class.getName());

  /**
   * Attributes of the document's root element (i.e. name, version, combining_rule).
   */
  private final Map<String, String> rootAttributes = new LinkedHashMap<>();
  /**
   * Attributes of each section element (i.e. NonbondedForce coulomb14scale), by section name.
   */
  private final Map<String, Map<String, String>> sectionAttributes = new LinkedHashMap<>();
  /**
   * Atom type records in document order.
   */
  private final List<AtomType> atomTypes = new ArrayList<>();
  /**
   * Atom type look-up by name.
   */
  private final Map<String, AtomType> atomTypeMap = new HashMap<>();
  /**
   * NonbondedForce records in document order.
   */
  private final List<NonbondedType> nonbondedTypes = new ArrayList<>();
  /**
   * Raw candidate records of each bonded interaction kind in document order.
   */
  private final Map<InteractionKind, List<Map<String, String>>> candidates =
      new EnumMap<>(InteractionKind.class);

  /**
   * ForceField Constructor.
   */
  public ForceField() {
    for (InteractionKind kind : InteractionKind.values()) {
      candidates.put(kind, new ArrayList<>());
    }
  }

  /**
   * The force field name given by the root element, or "unnamed".
   *
   * @return the name.
   */
  public String getName() {
    return rootAttributes.getOrDefault("name", "unnamed");
  }

  /**
   * Attributes of the root element, in document order.
   *
   * @return an unmodifiable view.
   */
  public Map<String, String> getRootAttributes() {
    return Collections.unmodifiableMap(rootAttributes);
  }

  /**
   * Record the attributes of the root element.
   *
   * @param attributes the attributes.
   */
  public void setRootAttributes(Map<String, String> attributes) {
    rootAttributes.clear();
    rootAttributes.putAll(attributes);
  }

  /**
   * Attributes of a section element.
   *
   * @param section the section name (i.e. NonbondedForce).
   * @return an unmodifiable view, empty if the section has none or is absent.
   */
  public Map<String, String> getSectionAttributes(String section) {
    Map<String, String> attributes = sectionAttributes.get(section);
    if (attributes == null) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(attributes);
  }

  /**
   * Record the attributes of a section element. The first occurrence of a section is kept.
   *
   * @param section    the section name.
   * @param attributes the attributes.
   */
  public void setSectionAttributes(String section, Map<String, String> attributes) {
    sectionAttributes.putIfAbsent(section, new LinkedHashMap<>(attributes));
  }

  /**
   * Add an atom type. When a name is defined twice, the later record gives the atom class used for
   * look-ups, while the overrides of every record are kept (see {@link #getOverrides(String)}).
   *
   * @param atomType the atom type.
   */
  public void addAtomType(AtomType atomType) {
    if (atomType == null) {
      logger.info(" Null atom type ignored.");
      return;
    }
    AtomType old = atomTypeMap.put(atomType.name, atomType);
    if (old != null) {
      logger.log(Level.WARNING, " Atom type {0} is defined more than once.", atomType.name);
    }
    atomTypes.add(atomType);
  }

  /**
   * Look up an atom type by name.
   *
   * @param name the atom type name.
   * @return the AtomType, or null if it is not defined.
   */
  public AtomType getAtomType(String name) {
    return atomTypeMap.get(name);
  }

  /**
   * The overridden atom types of every record that defines a name, in document order without
   * repeats.
   *
   * @param name the atom type name.
   * @return the union of the overrides; empty if the name is not defined.
   */
  public List<String> getOverrides(String name) {
    Set<String> overrides = new LinkedHashSet<>();
    for (AtomType atomType : atomTypes) {
      if (atomType.name.equals(name)) {
        overrides.addAll(atomType.getOverrides());
      }
    }
    return new ArrayList<>(overrides);
  }

  /**
   * All atom type records in document order.
   *
   * @return an unmodifiable list.
   */
  public List<AtomType> getAtomTypes() {
    return Collections.unmodifiableList(atomTypes);
  }

  /**
   * Add a NonbondedForce record.
   *
   * @param nonbondedType the record.
   */
  public void addNonbondedType(NonbondedType nonbondedType) {
    nonbondedTypes.add(nonbondedType);
  }

  /**
   * All NonbondedForce records in document order.
   *
   * @return an unmodifiable list.
   */
  public List<NonbondedType> getNonbondedTypes() {
    return Collections.unmodifiableList(nonbondedTypes);
  }

  /**
   * Add the raw attributes of a candidate record.
   *
   * @param kind       the interaction kind.
   * @param attributes the raw attributes.
   */
  public void addCandidate(InteractionKind kind, Map<String, String> attributes) {
    candidates.get(kind).add(new LinkedHashMap<>(attributes));
  }

  /**
   * The raw candidate records of an interaction kind, in document order.
   *
   * @param kind the interaction kind.
   * @return an unmodifiable list.
   */
  public List<Map<String, String>> getCandidates(InteractionKind kind) {
    return Collections.unmodifiableList(candidates.get(kind));
  }

  /**
   * Number of records of a ForceFieldType.
   *
   * @param type the ForceFieldType.
   * @return the count.
   */
  public int getForceFieldTypeCount(ForceFieldType type) {
    return switch (type) {
      case ATOM -> atomTypes.size();
      case NONBONDED -> nonbondedTypes.size();
      case BOND -> candidates.get(InteractionKind.BOND).size();
      case ANGLE -> candidates.get(InteractionKind.ANGLE).size();
      case PROPER -> candidates.get(InteractionKind.PROPER).size();
      case IMPROPER -> candidates.get(InteractionKind.IMPROPER).size();
    };
  }

  /**
   * Log a summary of the force field.
   */
  public void log() {
    logger.info(toString());
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" Force field %s", getName()));
    for (ForceFieldType type : ForceFieldType.values()) {
      sb.append(format("\n  %-10s %6d", type.tag, getForceFieldTypeCount(type)));
    }
    return sb.toString();
  }

  /**
   * The kinds of records in a force field document, with the element name each uses.
   */
  public enum ForceFieldType {
    ATOM("Type"), NONBONDED("Atom"), BOND("Bond"), ANGLE("Angle"), PROPER("Proper"), IMPROPER("Improper");

    /**
     * XML element name of records of this type.
     */
    public final String tag;

    ForceFieldType(String tag) {
      this.tag = tag;
    }
  }
}
