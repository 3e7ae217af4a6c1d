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
package emx.transform.parsers;

import emx.transform.InputFormatException;
import emx.transform.table.Column;
import emx.transform.table.ReadOptions;
import emx.transform.table.Table;
import emx.transform.table.TableIO;
import emx.utilities.Version;
import emx.utilities.VersionDispatcher;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Reads and writes Unblur shift files: one line of x shifts and one line of y shifts, one value per
 * frame. Shifts are relative to the first frame.
 *
 * @author Michael J. Schnieders
 */
public class UnblurFilter implements MetadataFilter {

  private static final Logger logger = Logger.getLogger(UnblurFilter.class.getName());

  private static final VersionDispatcher<List<String>> VERSIONS =
      new VersionDispatcher<>(Map.of("1.0.2", ShiftTrajectory.COLUMNS));

  private final Version version;
  private final List<String> columns;

  /**
   * Constructor.
   *
   * @param version requested version, or null for the newest.
   */
  public UnblurFilter(String version) {
    this.version = VERSIONS.selectVersion(version);
    this.columns = VERSIONS.select(version);
  }

  @Override
  public MetadataFormat getFormat() {
    return MetadataFormat.UNBLUR;
  }

  public Version getVersion() {
    return version;
  }

  @Override
  public Table readFile(File file) throws IOException {
    Table rows = TableIO.read(file, new ReadOptions().comment('#'));
    if (rows.getRowCount() != columns.size()) {
      throw new InputFormatException(
          format("Expected %d lines of shifts, found %d", columns.size(), rows.getRowCount()), file.getName());
    }
    int frames = rows.getColumnCount();
    List<Column> transposed = new ArrayList<>(columns.size());
    for (int r = 0; r < columns.size(); r++) {
      double[] values = new double[frames];
      for (int f = 0; f < frames; f++) {
        values[f] = rows.getColumns().get(f).getDouble(r);
      }
      transposed.add(Column.ofDoubles(columns.get(r), values));
    }
    Table table = ShiftTrajectory.rebase(new Table(transposed));
    logger.info(format(" Read %d Unblur %s frame shifts from %s.", frames, version, file.getName()));
    return table;
  }

  @Override
  public boolean canWrite() {
    return true;
  }

  @Override
  public void writeFile(File file, Table table) throws IOException {
    Table shifts = table.select(columns);
    int frames = shifts.getRowCount();
    List<Column> list = new ArrayList<>(frames);
    for (int f = 0; f < frames; f++) {
      double[] values = new double[columns.size()];
      for (int c = 0; c < columns.size(); c++) {
        values[c] = shifts.getColumn(columns.get(c)).getDouble(f);
      }
      list.add(Column.ofDoubles(Integer.toString(f), values));
    }
    TableIO.write(file, new Table(list), List.of("# Unblur shifts, x then y (Angstroms)"), true);
    logger.info(format(" Wrote %d Unblur %s frame shifts to %s.", frames, version, file.getName()));
  }
}
