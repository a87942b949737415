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
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static fftrim.potential.parameters.ForceField.ForceFieldType.ATOM;
import static java.lang.String.format;

/**
 * The AtomType class represents one atom type definition (a <code>Type</code> record of the
 * <code>AtomTypes</code> section).
 * <p>
 * An atom type has a name, the atom class it belongs to, and may list other atom types that it
 * overrides.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class AtomType extends BaseType {

  /**
   * Attribute holding the atom type name.
   */
  public static final String NAME = "name";
  /**
   * Attribute holding the atom class.
   */
  public static final String CLASS = "class";
  /**
   * Attribute holding the comma separated list of overridden atom types.
   */
  public static final String OVERRIDES = "overrides";

  /**
   * Atom type name (i.e. opls_135).
   */
  public final String name;
  /**
   * Atom class (i.e. CT), or null if the record does not give one.
   */
  public final String atomClass;
  /**
   * Names of the atom types this type overrides.
   */
  private final List<String> overrides;

  /**
   * AtomType Constructor.
   *
   * @param name       the atom type name.
   * @param atomClass  the atom class (may be null).
   * @param overrides  overridden atom type names.
   * @param attributes the raw attributes.
   */
  public AtomType(String name, String atomClass, List<String> overrides,
                  Map<String, String> attributes) {
    super(ATOM, name, attributes);
    this.name = name;
    this.atomClass = atomClass;
    this.overrides = Collections.unmodifiableList(new ArrayList<>(overrides));
  }

  /**
   * Construct an AtomType from the attributes of a <code>Type</code> record.
   *
   * @param attributes the raw attributes.
   * @return an AtomType instance.
   * @throws ForceFieldException if the record has no name.
   */
  public static AtomType parse(Map<String, String> attributes) {
    String name = attributes.get(NAME);
    if (name == null || name.isBlank()) {
      throw new ForceFieldException(" An atom type record is missing its name attribute.", null,
          attributes.toString());
    }
    return new AtomType(name, attributes.get(CLASS), parseOverrides(attributes.get(OVERRIDES)),
        attributes);
  }

  /**
   * Split an overrides attribute into atom type names.
   *
   * @param overrides the attribute value (may be null).
   * @return the overridden atom type names.
   */
  static List<String> parseOverrides(String overrides) {
    List<String> names = new ArrayList<>();
    if (overrides == null) {
      return names;
    }
    for (String token : overrides.split(",")) {
      String name = token.trim();
      if (!name.isEmpty()) {
        names.add(name);
      }
    }
    return names;
  }

  /**
   * Names of the atom types this type overrides.
   *
   * @return an unmodifiable list, empty if there are none.
   */
  public List<String> getOverrides() {
    return overrides;
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
    AtomType atomType = (AtomType) o;
    return atomType.name.equals(this.name) && Objects.equals(atomType.atomClass, this.atomClass);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int hashCode() {
    return Objects.hash(name, atomClass);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Nicely formatted atom type string.
   */
  @Override
  public String toString() {
    if (overrides.isEmpty()) {
      return format("atom  %-12s  %-8s", name, atomClass);
    }
    return format("atom  %-12s  %-8s  overrides %s", name, atomClass, String.join(",", overrides));
  }
}
