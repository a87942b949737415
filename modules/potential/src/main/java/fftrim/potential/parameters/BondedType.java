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

import java.util.Map;

import static java.lang.String.format;

/**
 * The BondedType class is one candidate parameter record for a bonded interaction kind.
 * <p>
 * Each atom position of the record is constrained either by an exact atom type
 * (<code>type1</code>, <code>type2</code>, ...) or by a generic atom class (<code>class1</code>,
 * <code>class2</code>, ...). The weight of a record is its number of class constrained positions, so
 * that a lower weight means a more specific record.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class BondedType extends BaseType {

  /**
   * How one atom position of a record is constrained.
   */
  public enum Constraint {
    /**
     * The position must match an atom class.
     */
    CLASS("class"),
    /**
     * The position must match an atom type.
     */
    TYPE("type");

    /**
     * Prefix of the attribute that holds the constraint value; the position (from 1) is appended.
     */
    public final String prefix;

    Constraint(String prefix) {
      this.prefix = prefix;
    }

    /**
     * Attribute name for the given position.
     *
     * @param position the atom position, counted from 0.
     * @return the attribute name (i.e. class1).
     */
    public String attribute(int position) {
      return prefix + (position + 1);
    }
  }

  /**
   * The interaction kind of this record.
   */
  public final InteractionKind kind;
  /**
   * Position of this record among the records of its kind in the source document.
   */
  public final int index;
  /**
   * The constraint of each atom position.
   */
  private final Constraint[] schema;
  /**
   * The constraint value of each atom position.
   */
  private final String[] values;
  /**
   * Number of class constrained positions.
   */
  private final int weight;

  /**
   * BondedType constructor.
   *
   * @param kind       the interaction kind.
   * @param index      the document position of the record among records of its kind.
   * @param schema     the constraint of each position.
   * @param values     the constraint value of each position.
   * @param attributes the raw attributes.
   */
  public BondedType(InteractionKind kind, int index, Constraint[] schema, String[] values,
                    Map<String, String> attributes) {
    super(kind.forceFieldType, sortKey(schema, values), attributes);
    if (schema.length != kind.arity || values.length != kind.arity) {
      throw new IllegalArgumentException(
          format(" A %s record needs %d positions, found %d.", kind, kind.arity, schema.length));
    }
    this.kind = kind;
    this.index = index;
    this.schema = schema.clone();
    this.values = values.clone();
    int w = 0;
    for (Constraint constraint : schema) {
      if (constraint == Constraint.CLASS) {
        w++;
      }
    }
    this.weight = w;
  }

  /**
   * Build the look-up key, i.e. "class1=CT class2=HC".
   *
   * @param schema the constraint of each position.
   * @param values the constraint value of each position.
   * @return lookup key
   */
  public static String sortKey(Constraint[] schema, String[] values) {
    if (schema == null || values == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < schema.length; i++) {
      sb.append(schema[i].attribute(i)).append("=").append(values[i]).append(" ");
    }
    return sb.toString().trim();
  }

  /**
   * The number of class constrained positions. Lower is more specific.
   *
   * @return the weight.
   */
  public int getWeight() {
    return weight;
  }

  /**
   * The constraint of one atom position.
   *
   * @param position the position, counted from 0.
   * @return CLASS or TYPE.
   */
  public Constraint getConstraint(int position) {
    return schema[position];
  }

  /**
   * The constraint value of one atom position.
   *
   * @param position the position, counted from 0.
   * @return the atom class or atom type this position requires.
   */
  public String getValue(int position) {
    return values[position];
  }

  /**
   * The constraint values of all positions, in order.
   *
   * @return a copy of the values.
   */
  public String[] getValues() {
    return values.clone();
  }

  /**
   * Returns true if an interaction, read in the given atom ordering, satisfies this record.
   *
   * @param types       atom type of each atom of the interaction.
   * @param classes     atom class of each atom of the interaction; an entry may be null.
   * @param permutation the atom placed at each position of this record.
   * @return true if every position matches.
   */
  public boolean matches(String[] types, String[] classes, int[] permutation) {
    for (int i = 0; i < values.length; i++) {
      int atom = permutation[i];
      String actual = (schema[i] == Constraint.CLASS) ? classes[atom] : types[atom];
      if (!values[i].equals(actual)) {
        return false;
      }
    }
    return true;
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
    BondedType bondedType = (BondedType) o;
    return kind == bondedType.kind && index == bondedType.index;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + index;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Nicely formatted record string.
   */
  @Override
  public String toString() {
    return format("%-8s %3d  weight %d  %s", kind.getTag(), index, weight, key);
  }
}
