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

import fftrim.potential.FFTrimTest;
import fftrim.potential.bonded.Atom;
import fftrim.potential.bonded.InvalidStructureException;
import fftrim.potential.bonded.MolecularAssembly;
import fftrim.potential.parameters.ForceField;
import fftrim.potential.parameters.InteractionKind;
import fftrim.potential.parsers.ForceFieldXmlFilter;
import fftrim.potential.parsers.XYZFilter;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Trim the test force field against ethane and acetone.
 */
public class ForceFieldTrimmerTest extends FFTrimTest {

  private ForceField forceField;

  @Before
  public void parseForceField() {
    forceField = new ForceFieldXmlFilter(getResourceFile("ff/oplsaa-test.xml")).parse();
  }

  private static List<String> values(List<TrimResult.Entry> entries, String attribute) {
    List<String> values = new ArrayList<>();
    for (TrimResult.Entry entry : entries) {
      values.add(entry.attributes.get(attribute));
    }
    return values;
  }

  @Test
  public void testEthane() {
    MolecularAssembly ethane = new XYZFilter(getResourceFile("structures/ethane.xyz")).readFile();
    TrimResult result = new ForceFieldTrimmer(forceField).trim(ethane);

    assertEquals(9, result.getEntries().size());
    assertEquals(Arrays.asList("opls_135", "opls_140"),
        values(result.getEntries(ForceFieldTrimmer.ATOM_TYPES), "name"));
    assertEquals(Arrays.asList("opls_135", "opls_140"),
        values(result.getEntries(ForceFieldTrimmer.NONBONDED_FORCE), "type"));
    assertEquals(Arrays.asList("CT", "CT"),
        values(result.getEntries("HarmonicBondForce"), "class1"));
    assertEquals(Arrays.asList("CT", "HC"),
        values(result.getEntries("HarmonicBondForce"), "class2"));
    assertEquals(2, result.getEntries("HarmonicAngleForce").size());

    // The type specific torsion wins over the class torsion listed before it.
    List<TrimResult.Entry> propers = result.getEntries("RBTorsionForce");
    assertEquals(1, propers.size());
    assertEquals("opls_140", propers.get(0).attributes.get("type1"));
    assertTrue(result.getEntries("PeriodicTorsionForce").isEmpty());

    for (InteractionKind kind : InteractionKind.values()) {
      assertTrue(result.getUnmatched(kind).isEmpty());
    }
  }

  @Test
  public void testAcetone() {
    MolecularAssembly acetone = new XYZFilter(getResourceFile("structures/acetone.xyz")).readFile();
    TrimResult result = new ForceFieldTrimmer(forceField).trim(acetone);

    // Override targets are written with the structure's own atom types, in document order.
    assertEquals(
        Arrays.asList("opls_135", "opls_140", "opls_231", "opls_232", "opls_235", "opls_236"),
        values(result.getEntries(ForceFieldTrimmer.ATOM_TYPES), "name"));
    assertEquals(Arrays.asList("opls_231", "opls_232"),
        result.getResolvedAtomTypes().getOverrideOnly());
    assertEquals(Arrays.asList("opls_135", "opls_140", "opls_231", "opls_235", "opls_236"),
        values(result.getEntries(ForceFieldTrimmer.NONBONDED_FORCE), "type"));

    List<MatchResult> bonds = result.getMatches(InteractionKind.BOND);
    assertEquals(3, bonds.size());
    assertEquals(6, bonds.get(0).getBondedType().index);
    assertEquals(5, bonds.get(1).getBondedType().index);
    assertEquals(1, bonds.get(2).getBondedType().index);

    List<MatchResult> angles = result.getMatches(InteractionKind.ANGLE);
    assertEquals(4, angles.size());
    assertEquals(3, angles.get(0).getBondedType().index);
    assertEquals(4, angles.get(1).getBondedType().index);
    assertEquals(5, angles.get(2).getBondedType().index);
    assertEquals(1, angles.get(3).getBondedType().index);

    // The partly type constrained torsion is more specific than the class torsion.
    List<MatchResult> propers = result.getMatches(InteractionKind.PROPER);
    assertEquals(1, propers.size());
    assertEquals(4, propers.get(0).getBondedType().index);
    assertEquals(Collections.singletonList(
            new TypeTuple("opls_135", "opls_235", "opls_135", "opls_140")),
        result.getUnmatched(InteractionKind.PROPER));

    List<MatchResult> impropers = result.getMatches(InteractionKind.IMPROPER);
    assertEquals(1, impropers.size());
    assertEquals(0, impropers.get(0).getBondedType().index);

    assertEquals(20, result.getEntries().size());
  }

  @Test
  public void testEntryOrder() {
    MolecularAssembly acetone = new XYZFilter(getResourceFile("structures/acetone.xyz")).readFile();
    TrimResult result = new ForceFieldTrimmer(forceField).trim(acetone);
    List<String> sections = new ArrayList<>();
    for (TrimResult.Entry entry : result.getEntries()) {
      if (sections.isEmpty() || !sections.get(sections.size() - 1).equals(entry.section)) {
        sections.add(entry.section);
      }
    }
    assertEquals(Arrays.asList("AtomTypes", "NonbondedForce", "HarmonicBondForce",
        "HarmonicAngleForce", "RBTorsionForce", "PeriodicTorsionForce"), sections);
  }

  @Test
  public void testEmptyStructure() {
    try {
      new ForceFieldTrimmer(forceField).trim(new MolecularAssembly("empty"));
      fail(" A structure without atoms should be rejected.");
    } catch (InvalidStructureException e) {
      assertEquals("empty", e.source);
    }
  }

  @Test
  public void testUntypedAtom() {
    MolecularAssembly molecularAssembly = new MolecularAssembly("untyped");
    Atom typed = new Atom(1, "C1", "opls_135");
    Atom untyped = new Atom(2, "C2", null);
    molecularAssembly.addAtom(typed);
    molecularAssembly.addAtom(untyped);
    molecularAssembly.addBond(typed, untyped);
    try {
      new ForceFieldTrimmer(forceField).trim(molecularAssembly);
      fail(" A structure with an untyped atom should be rejected.");
    } catch (InvalidStructureException e) {
      assertSame(untyped, e.atom);
    }
  }

  @Test
  public void testUnknownAtomType() {
    MolecularAssembly molecularAssembly = new MolecularAssembly("unknown");
    Atom c1 = new Atom(1, "C1", "opls_135");
    Atom x2 = new Atom(2, "X2", "opls_777");
    molecularAssembly.addAtom(c1);
    molecularAssembly.addAtom(x2);
    molecularAssembly.addBond(c1, x2);
    TrimResult result = new ForceFieldTrimmer(forceField).trim(molecularAssembly);
    assertEquals(Collections.singletonList("opls_777"),
        result.getResolvedAtomTypes().getUndefined());
    assertEquals(1, result.getUnmatched(InteractionKind.BOND).size());
    assertEquals(1, result.getEntries(ForceFieldTrimmer.ATOM_TYPES).size());
  }
}
