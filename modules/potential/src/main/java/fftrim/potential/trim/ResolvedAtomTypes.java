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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The atom types a structure depends on: its own atom types plus those reached through overrides
 * statements, each with its atom class.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ResolvedAtomTypes {

  /**
   * Atom class of each atom type, in the order the types were discovered. A null class is unresolved.
   */
  private final Map<String, String> atomClasses;
  private final List<String> overrideOnly;
  private final List<String> undefined;

  ResolvedAtomTypes(Map<String, String> atomClasses, List<String> overrideOnly,
                    List<String> undefined) {
    this.atomClasses = Collections.unmodifiableMap(new LinkedHashMap<>(atomClasses));
    this.overrideOnly = Collections.unmodifiableList(new ArrayList<>(overrideOnly));
    this.undefined = Collections.unmodifiableList(new ArrayList<>(undefined));
  }

  /**
   * Returns true if the atom type is part of the closure.
   *
   * @param atomType the atom type name.
   * @return true if resolved or referenced.
   */
  public boolean contains(String atomType) {
    return atomClasses.containsKey(atomType);
  }

  /**
   * The atom class of an atom type.
   *
   * @param atomType the atom type name.
   * @return the class, or null if the type is unknown or has no class.
   */
  public String getAtomClass(String atomType) {
    return atomClasses.get(atomType);
  }

  public Set<String> getAtomTypeNames() {
    return atomClasses.keySet();
  }

  public Map<String, String> getAtomClasses() {
    return atomClasses;
  }

  /**
   * Atom types that are only present because another type overrides them.
   *
   * @return the atom type names, in discovery order.
   */
  public List<String> getOverrideOnly() {
    return overrideOnly;
  }

  /**
   * Atom types with no Type record in the force field.
   *
   * @return the atom type names, in discovery order.
   */
  public List<String> getUndefined() {
    return undefined;
  }

  public int size() {
    return atomClasses.size();
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : atomClasses.entrySet()) {
      sb.append(String.format(" %-12s %s%n", entry.getKey(),
          entry.getValue() == null ? "(unresolved)" : entry.getValue()));
    }
    return sb.toString();
  }
}
