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
import fftrim.potential.bonded.MolecularAssembly;
import fftrim.potential.parameters.InteractionKind;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

/**
 * Test reduction of bonded terms to unique type tuples.
 */
public class TopologyEnumeratorTest extends FFTrimTest {

  private static TypeTuple tuple(String... types) {
    return new TypeTuple(types);
  }

  @Test
  public void testReversedBondIsDropped() {
    List<TypeTuple> tuples = Arrays.asList(tuple("t1", "t2"), tuple("t2", "t1"));
    List<TypeTuple> unique =
        TopologyEnumerator.unique(tuples, InteractionKind.BOND.getPermutations());
    assertEquals(Arrays.asList(tuple("t1", "t2")), unique);
  }

  @Test
  public void testFirstOccurrenceOrder() {
    List<TypeTuple> tuples = Arrays.asList(
        tuple("c", "a", "b"), tuple("a", "a", "a"), tuple("b", "a", "c"), tuple("a", "b", "c"));
    List<TypeTuple> unique =
        TopologyEnumerator.unique(tuples, InteractionKind.ANGLE.getPermutations());
    assertEquals(Arrays.asList(tuple("c", "a", "b"), tuple("a", "a", "a"), tuple("a", "b", "c")),
        unique);
  }

  @Test
  public void testIdempotent() {
    List<TypeTuple> tuples = Arrays.asList(
        tuple("a", "b", "c", "d"), tuple("d", "c", "b", "a"), tuple("a", "c", "b", "d"),
        tuple("b", "b", "c", "d"));
    int[][] permutations = InteractionKind.PROPER.getPermutations();
    List<TypeTuple> once = TopologyEnumerator.unique(tuples, permutations);
    assertEquals(3, once.size());
    assertEquals(once, TopologyEnumerator.unique(once, permutations));
  }

  @Test
  public void testImproperPeripheralOrderings() {
    List<TypeTuple> tuples = Arrays.asList(
        tuple("x", "b", "c", "d"), tuple("x", "d", "b", "c"), tuple("x", "c", "d", "b"),
        tuple("b", "x", "c", "d"));
    List<TypeTuple> unique =
        TopologyEnumerator.unique(tuples, InteractionKind.IMPROPER.getPermutations());
    // A different central atom is a different interaction.
    assertEquals(Arrays.asList(tuple("x", "b", "c", "d"), tuple("b", "x", "c", "d")), unique);
  }

  @Test
  public void testStructureBonds() {
    MolecularAssembly ethane = new MolecularAssembly("ethane");
    Atom c1 = new Atom(1, "C1", "opls_135");
    Atom c2 = new Atom(2, "C2", "opls_135");
    ethane.addAtom(c1);
    ethane.addAtom(c2);
    ethane.addBond(c1, c2);
    int index = 3;
    for (Atom carbon : new Atom[]{c1, c2}) {
      for (int i = 0; i < 3; i++) {
        Atom hydrogen = new Atom(index++, "H", "opls_140");
        ethane.addAtom(hydrogen);
        ethane.addBond(hydrogen, carbon);
      }
    }

    assertEquals(Arrays.asList(tuple("opls_135", "opls_135"), tuple("opls_140", "opls_135")),
        TopologyEnumerator.enumerate(ethane, InteractionKind.BOND));
    assertEquals(2, TopologyEnumerator.enumerate(ethane, InteractionKind.ANGLE).size());
    assertEquals(Arrays.asList(tuple("opls_140", "opls_135", "opls_135", "opls_140")),
        TopologyEnumerator.enumerate(ethane, InteractionKind.PROPER));
    assertEquals(0, TopologyEnumerator.enumerate(ethane, InteractionKind.IMPROPER).size());
  }
}
