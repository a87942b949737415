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
package fftrim.potential.commands;

import fftrim.potential.bonded.InvalidStructureException;
import fftrim.potential.bonded.MolecularAssembly;
import fftrim.potential.cli.PotentialCommand;
import fftrim.potential.parameters.ForceField;
import fftrim.potential.parameters.ForceFieldException;
import fftrim.potential.parsers.TrimmedXmlFilter;
import fftrim.potential.trim.ForceFieldTrimmer;
import fftrim.potential.trim.TrimResult;
import fftrim.utilities.TrimBinding;
import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.getName;
import static org.apache.commons.io.FilenameUtils.removeExtension;

/**
 * The Trim command writes the subset of a force field XML file used by a typed structure.
 * <p>
 * Usage:
 * <p>
 * fftrim Trim [options] &lt;structure.xyz&gt; &lt;forcefield.xml&gt;
 */
@Command(name = "Trim", description = " Trim a force field XML file to the records a typed structure uses.")
public class Trim extends PotentialCommand {

  /**
   * -o or --output Name of the trimmed force field file.
   */
  @Option(names = {"-o", "--output"}, paramLabel = "file",
      description = "Trimmed force field file (default: <structure>_trimmed.xml).")
  private String outputName = null;

  /**
   * The first argument is a typed XYZ file.
   */
  @Parameters(index = "0", arity = "1", paramLabel = "structure",
      description = "Typed Tinker XYZ file.")
  private String structureName = null;

  /**
   * The second argument is the force field XML file.
   */
  @Parameters(index = "1", arity = "1", paramLabel = "forcefield",
      description = "Force field XML file.")
  private String forceFieldName = null;

  private TrimResult trimResult = null;
  private File outputFile = null;

  public Trim() {
    super();
  }

  public Trim(TrimBinding binding) {
    super(binding);
  }

  public Trim(String[] args) {
    super(args);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public Trim run() {
    // Init the context and bind variables.
    if (!init()) {
      return this;
    }

    try {
      MolecularAssembly molecularAssembly = getActiveAssembly(structureName);
      CompositeConfiguration properties = getProperties(new File(structureName));
      ForceField forceField = getForceField(forceFieldName);

      ForceFieldTrimmer trimmer = new ForceFieldTrimmer(forceField, properties);
      trimResult = trimmer.trim(molecularAssembly);
      trimResult.log();

      outputFile = resolveOutputFile();
      if (outputFile.getCanonicalFile().equals(new File(forceFieldName).getCanonicalFile())) {
        logger.severe(format(" Refusing to overwrite the input force field %s.", outputFile));
        outputFile = null;
        return this;
      }
      TrimmedXmlFilter xmlFilter = new TrimmedXmlFilter(forceField, trimResult, properties);
      xmlFilter.writeFile(outputFile);
    } catch (InvalidStructureException | ForceFieldException e) {
      logger.severe(" Error trimming force field: " + e);
      outputFile = null;
      return this;
    } catch (IOException e) {
      logger.severe(" Error writing XML: " + e.getMessage());
      outputFile = null;
      return this;
    }

    binding.setVariable("trimResult", trimResult);
    binding.setVariable("outputFile", outputFile);
    return this;
  }

  /**
   * The trimmed records, or null if the command did not complete.
   *
   * @return the trim result.
   */
  public TrimResult getTrimResult() {
    return trimResult;
  }

  /**
   * The file written, or null if nothing was written.
   *
   * @return the output file.
   */
  public File getOutputFile() {
    return outputFile;
  }

  private File resolveOutputFile() {
    if (outputName != null) {
      return new File(outputName);
    }
    // Use the current base directory, or update if necessary based on the given filename.
    String saveName = getBaseDirString(structureName) + removeExtension(getName(structureName));
    return new File(saveName + "_trimmed.xml");
  }
}
