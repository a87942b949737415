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
package fftrim.potential.cli;

import fftrim.potential.bonded.MolecularAssembly;
import fftrim.potential.parameters.ForceField;
import fftrim.potential.parsers.ForceFieldXmlFilter;
import fftrim.potential.parsers.XYZFilter;
import fftrim.utilities.TrimBinding;
import fftrim.utilities.TrimCommand;

import java.io.File;

/**
 * Base class for commands in the potential package: they open a typed structure and a force field.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class PotentialCommand extends TrimCommand {

  /**
   * The MolecularAssembly loaded by the command from its structure file argument.
   */
  public MolecularAssembly activeAssembly = null;

  public PotentialCommand() {
    super();
  }

  public PotentialCommand(TrimBinding binding) {
    super(binding);
  }

  public PotentialCommand(String[] args) {
    super(args);
  }

  /**
   * Open a typed structure file. The file named on the command line is always read; a structure is
   * never taken from the binding.
   *
   * @param filename Filename to open.
   * @return The active assembly.
   * @throws fftrim.potential.bonded.InvalidStructureException if the file is not a typed structure.
   */
  public MolecularAssembly getActiveAssembly(String filename) {
    activeAssembly = new XYZFilter(new File(filename)).readFile();
    return activeAssembly;
  }

  /**
   * Parse a force field XML file.
   *
   * @param filename the force field file.
   * @return the ForceField.
   */
  public ForceField getForceField(String filename) {
    ForceField forceField = new ForceFieldXmlFilter(new File(filename)).parse();
    forceField.log();
    return forceField;
  }
}
