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

import fftrim.potential.parameters.AtomType;
import fftrim.potential.parameters.ForceField;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The AtomTypeResolver assigns an atom class to each atom type of a structure and follows overrides
 * statements until no new atom types are found.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class AtomTypeResolver {

  private static final Logger logger = Logger.getLogger(AtomTypeResolver.class.getName());

  private final ForceField forceField;

  public AtomTypeResolver(ForceField forceField) {
    this.forceField = forceField;
  }

  /**
   * Resolve the atom types of a structure.
   *
   * @param structureTypes the atom types present in the structure.
   * @return the resolved closure.
   */
  public ResolvedAtomTypes resolve(Collection<String> structureTypes) {
    Map<String, String> atomClasses = new LinkedHashMap<>();
    Deque<String> queue = new ArrayDeque<>();
    for (String name : structureTypes) {
      if (!atomClasses.containsKey(name)) {
        atomClasses.put(name, null);
        queue.add(name);
      }
    }

    List<String> overrideOnly = new ArrayList<>();
    List<String> undefined = new ArrayList<>();
    while (!queue.isEmpty()) {
      String name = queue.poll();
      AtomType atomType = forceField.getAtomType(name);
      if (atomType == null) {
        undefined.add(name);
        continue;
      }
      atomClasses.put(name, atomType.atomClass);
      for (String override : forceField.getOverrides(name)) {
        if (!atomClasses.containsKey(override)) {
          atomClasses.put(override, null);
          overrideOnly.add(override);
          queue.add(override);
          logger.info(format(" Note: atom type %s is referenced in an overrides statement,"
              + " but does not appear in the system.", override));
        }
      }
    }

    for (String name : undefined) {
      logger.warning(format(" Atom type %s has no Type record in force field %s.", name,
          forceField.getName()));
    }
    return new ResolvedAtomTypes(atomClasses, overrideOnly, undefined);
  }
}
