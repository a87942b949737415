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
package fftrim.potential.parsers;

import fftrim.potential.bonded.Atom;
import fftrim.potential.bonded.InvalidStructureException;
import fftrim.potential.bonded.MolecularAssembly;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.getBaseName;

/**
 * The XYZFilter reads a Tinker Cartesian coordinate file whose atom type column holds force field
 * atom type names (i.e. opls_135) rather than Tinker type numbers.
 * <p>
 * The first line holds the number of atoms and an optional title. An optional periodic box line may
 * follow. Each atom line then reads <code>index name x y z type [bonded atom indices]</code>.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XYZFilter {

  private static final Logger logger = Logger.getLogger(XYZFilter.class.getName());

  private final File file;

  public XYZFilter(File file) {
    this.file = file;
  }

  /**
   * Returns true if the file looks like a Tinker Cartesian coordinate file: its first token is an
   * integer and its first atom line starts with an integer and has at least six tokens.
   *
   * @param file the file.
   * @return true if the file can be read by this filter.
   */
  public static boolean acceptDeep(File file) {
    if (file == null || file.isDirectory() || !file.canRead()) {
      return false;
    }
    try {
      List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
      if (lines.isEmpty()) {
        return false;
      }
      String[] header = tokens(lines.get(0));
      if (header.length == 0 || !isInteger(header[0])) {
        return false;
      }
      int first = firstAtomLine(lines, Integer.parseInt(header[0]));
      if (lines.size() <= first) {
        return false;
      }
      String[] data = tokens(lines.get(first));
      return data.length >= 6 && isInteger(data[0]);
    } catch (IOException e) {
      logger.fine(format(" %s could not be read: %s", file, e));
      return false;
    }
  }

  /**
   * Index of the first atom line, skipping the optional periodic box line.
   * <p>
   * The second line is a box line if its first token is not an integer, or if all of its tokens
   * are numbers and either there are fewer than six of them or there are exactly six and the file
   * holds one more line than the declared number of atoms. An atom line has at least six tokens and
   * its sixth is an atom type name.
   *
   * @param lines         all lines of the file.
   * @param numberOfAtoms the number of atoms declared by the header.
   * @return 1, or 2 if the file has a box line.
   */
  static int firstAtomLine(List<String> lines, int numberOfAtoms) {
    if (lines.size() < 2) {
      return 1;
    }
    String[] second = tokens(lines.get(1));
    if (second.length == 0) {
      return 1;
    }
    if (!isInteger(second[0])) {
      return 2;
    }
    for (String token : second) {
      if (!isNumber(token)) {
        return 1;
      }
    }
    if (second.length < 6) {
      return 2;
    }
    if (second.length == 6) {
      int remaining = 0;
      for (int i = 1; i < lines.size(); i++) {
        if (tokens(lines.get(i)).length > 0) {
          remaining++;
        }
      }
      if (remaining == numberOfAtoms + 1) {
        return 2;
      }
    }
    return 1;
  }

  /**
   * Read the structure.
   *
   * @return the typed structure.
   * @throws InvalidStructureException if the file is not a typed XYZ file.
   */
  public MolecularAssembly readFile() {
    String name = (file == null) ? null : file.getName();
    if (!acceptDeep(file)) {
      throw new InvalidStructureException(
          format(" %s is not a typed Tinker XYZ file.", file), name);
    }

    List<String> lines;
    try {
      lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new InvalidStructureException(format(" %s could not be read.", file), name, e);
    }

    String[] header = tokens(lines.get(0));
    int numberOfAtoms = Integer.parseInt(header[0]);
    if (numberOfAtoms < 1) {
      throw new InvalidStructureException(format(" %s declares %d atoms.", file, numberOfAtoms),
          name);
    }
    int first = firstAtomLine(lines, numberOfAtoms);
    if (lines.size() < first + numberOfAtoms) {
      throw new InvalidStructureException(
          format(" %s declares %d atoms but has %d atom lines.", file, numberOfAtoms,
              lines.size() - first), name);
    }

    MolecularAssembly molecularAssembly = new MolecularAssembly(getBaseName(name));
    List<int[]> bonds = new ArrayList<>();
    for (int i = 0; i < numberOfAtoms; i++) {
      int lineNumber = first + i + 1;
      String[] data = tokens(lines.get(first + i));
      if (data.length < 6 || !isInteger(data[0])) {
        throw new InvalidStructureException(
            format(" Line %d of %s is not an atom record: %s", lineNumber, file,
                lines.get(first + i)), name);
      }
      for (int j = 2; j < 5; j++) {
        try {
          Double.parseDouble(data[j]);
        } catch (NumberFormatException e) {
          throw new InvalidStructureException(
              format(" Line %d of %s has an invalid coordinate %s.", lineNumber, file, data[j]),
              name, e);
        }
      }
      int index = Integer.parseInt(data[0]);
      if (molecularAssembly.getAtom(index) != null) {
        throw new InvalidStructureException(
            format(" Line %d of %s repeats atom index %d.", lineNumber, file, index), name);
      }
      molecularAssembly.addAtom(new Atom(index, data[1], data[5]));
      for (int j = 6; j < data.length; j++) {
        if (!isInteger(data[j])) {
          throw new InvalidStructureException(
              format(" Line %d of %s has an invalid bonded atom %s.", lineNumber, file, data[j]),
              name);
        }
        bonds.add(new int[] {index, Integer.parseInt(data[j])});
      }
    }

    for (int[] bond : bonds) {
      Atom a1 = molecularAssembly.getAtom(bond[0]);
      Atom a2 = molecularAssembly.getAtom(bond[1]);
      if (a2 == null) {
        throw new InvalidStructureException(
            format(" Atom %d of %s is bonded to missing atom %d.", bond[0], file, bond[1]), name,
            a1);
      }
      molecularAssembly.addBond(a1, a2);
    }

    logger.info(format(" Opened %s with %d atoms and %d bonds.", name,
        molecularAssembly.getAtoms().size(), molecularAssembly.getBonds().size()));
    return molecularAssembly;
  }

  private static String[] tokens(String line) {
    if (line == null) {
      return new String[0];
    }
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return new String[0];
    }
    return trimmed.split("\\s+");
  }

  private static boolean isNumber(String token) {
    try {
      Double.parseDouble(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean isInteger(String token) {
    try {
      Integer.parseInt(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
