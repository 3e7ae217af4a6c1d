//******************************************************************************
//
// Title:       EM Transform X.
// Description: EM Transform X - Conversion of cryo-EM metadata files.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2026.
//
// This file is part of EM Transform X.
//
// EM Transform X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// EM Transform X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// EM Transform X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package emx.transform.commands;

import emx.transform.cli.InputOptions;
import emx.transform.cli.OutputOptions;
import emx.transform.cli.TransformCommand;
import emx.transform.parsers.MetadataFilter;
import emx.transform.parsers.MetadataFormat;
import emx.transform.table.Table;
import emx.utilities.EMXBinding;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;

import static java.lang.String.format;

/**
 * Convert a metadata file from one format into another.
 *
 * Usage:
 *   emxc Convert [options] &lt;filename&gt;
 */
@Command(name = "Convert", description = " Convert a cryo-EM metadata file into another format.")
public class Convert extends TransformCommand {

  @Mixin
  private InputOptions inputOptions;

  @Mixin
  private OutputOptions outputOptions;

  /** The final argument is the file to convert. */
  @Parameters(arity = "1", paramLabel = "file",
      description = "A metadata file (STAR, CTER, CTFFIND, MotionCor2, Unblur, box, MRC or XML).")
  private String filename = null;

  /** The table that was read. */
  private Table table = null;

  /** The file that was written. */
  private File outputFile = null;

  public Convert() { super(); }
  public Convert(EMXBinding binding) { super(binding); }
  public Convert(String[] args) { super(args); }

  /** Return the converted table, in internal names and units. */
  public Table getTable() { return table; }
  /** Return the file that was written. */
  public File getOutputFile() { return outputFile; }

  @Override
  public Convert run() {
    if (!init()) {
      return this;
    }

    File inputFile = new File(filename);
    MetadataFormat from = inputOptions.getFormat(inputFile);
    MetadataFormat to = outputOptions.getFormat();

    logger.info(format("\n Converting %s from %s to %s.", inputFile, from, to));

    try {
      table = readTable(inputFile, from, inputOptions.getInputVersion());
      logger.info(format(" Read %d rows with %d fields.", table.getRowCount(), table.getColumnCount()));

      // Command line options override property files.
      BaseConfiguration overrides = new BaseConfiguration();
      if (outputOptions.getBoxSize() != null) {
        overrides.setProperty(MetadataFormat.BOX_SIZE, outputOptions.getBoxSize());
      }
      CompositeConfiguration outputProperties = new CompositeConfiguration();
      outputProperties.addConfiguration(overrides);
      outputProperties.addConfiguration(properties);

      MetadataFilter filter = to.createFilter(outputOptions.getOutputVersion(), outputProperties);
      if (!filter.canWrite()) {
        logger.warning(format(" %s files can only be read.", to));
        return this;
      }

      if (outputOptions.getOutput() != null) {
        outputFile = new File(outputOptions.getOutput());
      } else {
        outputFile = outputFile(inputFile, to.getExtension());
      }
      filter.writeFile(outputFile, table);
      logger.info(format(" Wrote %s.", outputFile));
    } catch (IOException e) {
      throw new IllegalStateException(format(" Conversion of %s failed: %s", inputFile, e.getMessage()), e);
    }

    binding.setVariable("table", table);
    binding.setVariable("output", outputFile);
    return this;
  }
}
