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
import fftrim.potential.parameters.BondedType.Constraint;
import fftrim.potential.parameters.ForceFieldException;
import fftrim.potential.parameters.InteractionKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * The SchemaClassifier decides, for each atom position of a candidate record, whether the record
 * constrains it by atom class or by atom type.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class SchemaClassifier {

  private SchemaClassifier() {
  }

  /**
   * Classify one candidate record. A position with a <code>class{i}</code> attribute is constrained by
   * class; any other position must carry <code>type{i}</code>.
   *
   * @param kind       the interaction kind.
   * @param attributes the raw attributes of the record.
   * @param index      the position of the record among the records of its kind.
   * @return the classified record.
   * @throws ForceFieldException if a position has neither attribute.
   */
  public static BondedType classify(InteractionKind kind, Map<String, String> attributes,
                                    int index) {
    Constraint[] schema = new Constraint[kind.arity];
    String[] values = new String[kind.arity];
    for (int i = 0; i < kind.arity; i++) {
      if (attributes.containsKey(Constraint.CLASS.attribute(i))) {
        schema[i] = Constraint.CLASS;
      } else {
        schema[i] = Constraint.TYPE;
      }
      values[i] = attributes.get(schema[i].attribute(i));
      if (values[i] == null) {
        throw new ForceFieldException(
            format(" %s record %d has neither %s nor %s for atom position %d.", kind.getTag(),
                index, Constraint.CLASS.attribute(i), Constraint.TYPE.attribute(i), i + 1),
            kind, attributes.toString());
      }
    }
    return new BondedType(kind, index, schema, values, attributes);
  }

  /**
   * Classify every candidate record of a kind and sort them from most to least specific. Records of
   * equal weight keep their document order.
   *
   * @param kind       the interaction kind.
   * @param candidates raw candidate records in document order.
   * @return the classified records in priority order.
   */
  public static List<BondedType> classify(InteractionKind kind,
                                          List<Map<String, String>> candidates) {
    List<BondedType> bondedTypes = new ArrayList<>(candidates.size());
    int index = 0;
    for (Map<String, String> attributes : candidates) {
      bondedTypes.add(classify(kind, attributes, index++));
    }
    // List.sort is stable.
    bondedTypes.sort(Comparator.comparingInt(BondedType::getWeight));
    return bondedTypes;
  }
}
