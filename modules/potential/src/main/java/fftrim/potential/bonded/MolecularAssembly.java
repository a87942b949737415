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
package fftrim.potential.bonded;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * The MolecularAssembly class is a typed structure built from atoms and the bonds between them.
 * Angles, proper torsions and improper torsions are derived from the bond graph.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MolecularAssembly implements TypedStructure {

  private static final Logger logger = Logger.getLogger(MolecularAssembly.class.getName());

  private final String name;
  private final List<Atom> atoms = new ArrayList<>();
  private final List<Bond> bonds = new ArrayList<>();
  /**
   * Derived terms; cleared whenever a bond is added.
   */
  private List<Angle> angles = null;
  private List<Torsion> torsions = null;
  private List<ImproperTorsion> improperTorsions = null;

  /**
   * MolecularAssembly constructor.
   *
   * @param name a name for the structure.
   */
  public MolecularAssembly(String name) {
    this.name = name;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String getName() {
    return name;
  }

  /**
   * Add an atom.
   *
   * @param atom the atom.
   */
  public void addAtom(Atom atom) {
    atoms.add(atom);
  }

  /**
   * Find an atom by its index.
   *
   * @param index the atom index.
   * @return the atom, or null if there is none.
   */
  public Atom getAtom(int index) {
    for (Atom atom : atoms) {
      if (atom.getIndex() == index) {
        return atom;
      }
    }
    return null;
  }

  /**
   * Bond two atoms. Bonding a pair of atoms that are already bonded returns the existing bond.
   *
   * @param a1 Atom number 1.
   * @param a2 Atom number 2.
   * @return the bond.
   * @throws InvalidStructureException if an atom is bonded to itself.
   */
  public Bond addBond(Atom a1, Atom a2) {
    if (a1 == a2) {
      throw new InvalidStructureException(format(" Atom %s cannot be bonded to itself.", a1), name, a1);
    }
    for (Bond bond : a1.getBonds()) {
      if (bond.get1_2(a1) == a2) {
        return bond;
      }
    }
    Bond bond = new Bond(a1, a2);
    bonds.add(bond);
    angles = null;
    torsions = null;
    improperTorsions = null;
    return bond;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public List<Atom> getAtoms() {
    return Collections.unmodifiableList(atoms);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public List<Bond> getBonds() {
    return Collections.unmodifiableList(bonds);
  }

  /**
   * {@inheritDoc}
   * <p>
   * Each atom, in index order, is the center of one angle per pair of its bonds.
   */
  @Override
  public List<Angle> getAngles() {
    if (angles == null) {
      List<Angle> list = new ArrayList<>();
      for (Atom atom : atoms) {
        List<Bond> atomBonds = atom.getBonds();
        for (int i = 0; i < atomBonds.size(); i++) {
          for (int j = i + 1; j < atomBonds.size(); j++) {
            Angle angle = Angle.angleFactory(atomBonds.get(i), atomBonds.get(j));
            if (angle != null) {
              list.add(angle);
            }
          }
        }
      }
      angles = Collections.unmodifiableList(list);
    }
    return angles;
  }

  /**
   * {@inheritDoc}
   * <p>
   * Each bond, in bond order, is the middle bond of one torsion per pair of outer bonds.
   */
  @Override
  public List<Torsion> getTorsions() {
    if (torsions == null) {
      List<Torsion> list = new ArrayList<>();
      for (Bond middleBond : bonds) {
        Atom a1 = middleBond.getAtom(0);
        Atom a2 = middleBond.getAtom(1);
        for (Bond bond1 : a1.getBonds()) {
          if (bond1 == middleBond) {
            continue;
          }
          for (Bond bond3 : a2.getBonds()) {
            if (bond3 == middleBond) {
              continue;
            }
            Torsion torsion = Torsion.torsionFactory(bond1, middleBond, bond3);
            if (torsion != null) {
              list.add(torsion);
            }
          }
        }
      }
      torsions = Collections.unmodifiableList(list);
    }
    return torsions;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public List<ImproperTorsion> getImproperTorsions() {
    if (improperTorsions == null) {
      List<ImproperTorsion> list = new ArrayList<>();
      for (Atom atom : atoms) {
        ImproperTorsion improperTorsion = ImproperTorsion.improperTorsionFactory(atom);
        if (improperTorsion != null) {
          list.add(improperTorsion);
        }
      }
      improperTorsions = Collections.unmodifiableList(list);
    }
    return improperTorsions;
  }

  /**
   * Log a summary of the structure.
   */
  public void log() {
    logger.info(toString());
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" %s: %d atoms, %d bonds, %d angles, %d torsions, %d improper torsions", name,
        atoms.size(), bonds.size(), getAngles().size(), getTorsions().size(),
        getImproperTorsions().size());
  }
}
