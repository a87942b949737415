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
import fftrim.potential.parameters.BondedType;
import fftrim.potential.parameters.InteractionKind;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

/**
 * Test selection of candidate records for type tuples.
 */
public class ParameterMatcherTest extends FFTrimTest {

  private static Map<String, String> record(String... pairs) {
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      map.put(pairs[i], pairs[i + 1]);
    }
    return map;
  }

  private static ResolvedAtomTypes atomTypes(String... pairs) {
    Map<String, String> classes = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      classes.put(pairs[i], pairs[i + 1]);
    }
    return new ResolvedAtomTypes(classes, Collections.emptyList(), Collections.emptyList());
  }

  private static ParameterMatcher matcher(InteractionKind kind, ResolvedAtomTypes atomTypes,
                                          List<Map<String, String>> records) {
    return new ParameterMatcher(kind, SchemaClassifier.classify(kind, records), atomTypes);
  }

  @Test
  public void testTypeRecordBeatsClassRecord() {
    List<Map<String, String>> records = Arrays.asList(
        record("class1", "CT", "class2", "HC", "k", "class"),
        record("type1", "opls_135", "type2", "opls_140", "k", "type"));
    ParameterMatcher matcher = matcher(InteractionKind.BOND,
        atomTypes("opls_135", "CT", "opls_140", "HC"), records);
    BondedType match = matcher.findMatch(new TypeTuple("opls_135", "opls_140"));
    assertNotNull(match);
    assertEquals("type", match.getAttribute("k"));
  }

  @Test
  public void testEqualWeightKeepsDocumentOrder() {
    List<Map<String, String>> records = Arrays.asList(
        record("class1", "CT", "type2", "opls_140", "k", "first"),
        record("type1", "opls_135", "class2", "HC", "k", "second"));
    ParameterMatcher matcher = matcher(InteractionKind.BOND,
        atomTypes("opls_135", "CT", "opls_140", "HC"), records);
    BondedType match = matcher.findMatch(new TypeTuple("opls_135", "opls_140"));
    assertEquals("first", match.getAttribute("k"));
  }

  @Test
  public void testReversedTupleMatches() {
    List<Map<String, String>> records =
        Collections.singletonList(record("type1", "A", "type2", "B"));
    ParameterMatcher matcher = matcher(InteractionKind.BOND, atomTypes("A", "X", "B", "Y"), records);
    assertNotNull(matcher.findMatch(new TypeTuple("B", "A")));
  }

  @Test
  public void testAngleCenterMustMatch() {
    List<Map<String, String>> records =
        Collections.singletonList(record("class1", "CT", "class2", "C", "class3", "O"));
    ParameterMatcher matcher = matcher(InteractionKind.ANGLE,
        atomTypes("opls_135", "CT", "opls_235", "C", "opls_236", "O"), records);
    assertNotNull(matcher.findMatch(new TypeTuple("opls_236", "opls_235", "opls_135")));
    assertNull(matcher.findMatch(new TypeTuple("opls_235", "opls_236", "opls_135")));
  }

  @Test
  public void testImproperPeripheralPermutations() {
    List<Map<String, String>> records =
        Collections.singletonList(record("type1", "A", "type2", "B", "type3", "C", "type4", "D"));
    ParameterMatcher matcher = matcher(InteractionKind.IMPROPER,
        atomTypes("A", "a", "B", "b", "C", "c", "D", "d"), records);
    String[][] orderings = {
        {"A", "B", "C", "D"}, {"A", "B", "D", "C"}, {"A", "C", "B", "D"},
        {"A", "C", "D", "B"}, {"A", "D", "B", "C"}, {"A", "D", "C", "B"}};
    for (String[] ordering : orderings) {
      assertNotNull(Arrays.toString(ordering), matcher.findMatch(new TypeTuple(ordering)));
    }
    // The central atom is fixed.
    assertNull(matcher.findMatch(new TypeTuple("B", "A", "C", "D")));
  }

  @Test
  public void testProperIsNotAnImproper() {
    List<Map<String, String>> records =
        Collections.singletonList(record("type1", "A", "type2", "B", "type3", "C", "type4", "D"));
    ParameterMatcher matcher = matcher(InteractionKind.PROPER,
        atomTypes("A", "a", "B", "b", "C", "c", "D", "d"), records);
    assertNotNull(matcher.findMatch(new TypeTuple("D", "C", "B", "A")));
    assertNull(matcher.findMatch(new TypeTuple("A", "C", "B", "D")));
  }

  @Test
  public void testUnresolvedClassNeverMatches() {
    List<Map<String, String>> records =
        Collections.singletonList(record("class1", "CT", "class2", "CT"));
    Map<String, String> classes = new LinkedHashMap<>();
    classes.put("opls_777", null);
    ResolvedAtomTypes atomTypes = new ResolvedAtomTypes(classes, Collections.emptyList(),
        Collections.singletonList("opls_777"));
    ParameterMatcher matcher = matcher(InteractionKind.BOND, atomTypes, records);
    assertNull(matcher.findMatch(new TypeTuple("opls_777", "opls_777")));
  }

  @Test
  public void testRecordIsEmittedOnce() {
    List<Map<String, String>> records = Arrays.asList(
        record("class1", "CT", "class2", "HC", "k", "CT-HC"),
        record("class1", "CT", "class2", "CT", "k", "CT-CT"));
    ParameterMatcher matcher = matcher(InteractionKind.BOND,
        atomTypes("opls_135", "CT", "opls_136", "CT", "opls_140", "HC", "opls_900", "XX"), records);
    List<TypeTuple> tuples = Arrays.asList(
        new TypeTuple("opls_135", "opls_135"),
        new TypeTuple("opls_135", "opls_140"),
        new TypeTuple("opls_136", "opls_140"),
        new TypeTuple("opls_900", "opls_140"),
        new TypeTuple("opls_135", "opls_136"));
    List<TypeTuple> unmatched = new ArrayList<>();
    List<MatchResult> results = matcher.match(tuples, unmatched);

    assertEquals(2, results.size());
    // First-match order, not document order.
    assertEquals("CT-CT", results.get(0).getBondedType().getAttribute("k"));
    assertEquals(2, results.get(0).getTuples().size());
    assertEquals("CT-HC", results.get(1).getBondedType().getAttribute("k"));
    assertEquals(2, results.get(1).getTuples().size());
    assertSame(InteractionKind.BOND, results.get(1).getKind());
    assertEquals(Collections.singletonList(new TypeTuple("opls_900", "opls_140")), unmatched);
  }

  @Test
  public void testEndToEndSymmetricBonds() {
    List<TypeTuple> tuples = TopologyEnumerator.unique(
        Arrays.asList(new TypeTuple("t1", "t2"), new TypeTuple("t2", "t1")),
        InteractionKind.BOND.getPermutations());
    assertEquals(1, tuples.size());
    ParameterMatcher matcher = matcher(InteractionKind.BOND, atomTypes("t1", "c1", "t2", "c2"),
        Collections.singletonList(record("type1", "t1", "type2", "t2")));
    List<MatchResult> results = matcher.match(tuples);
    assertEquals(1, results.size());
    assertEquals(0, results.get(0).getBondedType().index);
  }
}
