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
import emx.transform.cli.TransformCommand;
import emx.transform.table.Column;
import emx.transform.table.Table;
import emx.utilities.EMXBinding;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;

import static java.lang.String.format;

/**
 * Print the fields of a metadata file.
 *
 * Usage:
 *   emxc ShowMetadata [options] &lt;filename&gt;
 */
@Command(name = "ShowMetadata", description = " Print the fields and first rows of a metadata file.")
public class ShowMetadata extends TransformCommand {

  @Mixin
  private InputOptions inputOptions;

  /** -r or --rows Number of rows to print. */
  @Option(names = {"-r", "--rows"}, paramLabel = "5", defaultValue = "5",
      description = "Number of rows to print.")
  private int rows = 5;

  /** The final argument is the file to read. */
  @Parameters(arity = "1", paramLabel = "file", description = "A metadata file.")
  private String filename = null;

  private Table table = null;

  public ShowMetadata() { super(); }
  public ShowMetadata(EMXBinding binding) { super(binding); }
  public ShowMetadata(String[] args) { super(args); }

  public Table getTable() { return table; }

  @Override
  public ShowMetadata run() {
    if (!init()) {
      return this;
    }

    File inputFile = new File(filename);
    try {
      table = readTable(inputFile, inputOptions.getFormat(inputFile), inputOptions.getInputVersion());
    } catch (IOException e) {
      throw new IllegalStateException(format(" Reading %s failed: %s", inputFile, e.getMessage()), e);
    }

    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder(format("\n %s: %d rows, %d fields\n",
          inputFile.getName(), table.getRowCount(), table.getColumnCount()));
      int n = Math.min(rows, table.getRowCount());
      for (Column column : table.getColumns()) {
        sb.append(format("  %-30s %-8s", column.getName(), column.getType()));
        for (int i = 0; i < n; i++) {
          sb.append(" ").append(column.get(i));
        }
        sb.append("\n");
      }
      logger.info(sb.toString());
    }

    binding.setVariable("table", table);
    return this;
  }
}
