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

import emx.transform.table.Column;
import emx.transform.table.ColumnType;
import emx.transform.table.ReadOptions;
import emx.transform.table.Table;
import emx.transform.table.TableIO;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Reads and writes particle box files. On disk a box is given by its corner and size; internally
 * only the box center is kept.
 *
 * @author Michael J. Schnieders
 */
public class BoxFilter implements MetadataFilter {

  private static final Logger logger = Logger.getLogger(BoxFilter.class.getName());

  /** Internal name of the center x coordinate. */
  public static final String COORDINATE_X = "CoordinateX";
  /** Internal name of the center y coordinate. */
  public static final String COORDINATE_Y = "CoordinateY";

  private final BoxFormat boxFormat;
  private final long boxSize;

  /**
   * Constructor.
   *
   * @param boxFormat the dialect.
   * @param boxSize   box width and height used on write; must be positive to write.
   */
  public BoxFilter(BoxFormat boxFormat, long boxSize) {
    this.boxFormat = boxFormat;
    this.boxSize = boxSize;
  }

  @Override
  public MetadataFormat getFormat() {
    return MetadataFormat.BOX;
  }

  public BoxFormat getBoxFormat() {
    return boxFormat;
  }

  /**
   * Shift a coordinate by half the box size, rounded down.
   *
   * @param coordinate the coordinates.
   * @param size       the box sizes.
   * @param sign       +1 for corner to center, -1 for center to corner.
   * @param name       name of the result.
   * @return the shifted coordinates.
   */
  static Column shift(Column coordinate, Column size, int sign, String name) {
    int n = coordinate.size();
    if (coordinate.getType() == ColumnType.LONG && size.getType() == ColumnType.LONG) {
      long[] out = new long[n];
      for (int i = 0; i < n; i++) {
        out[i] = coordinate.getLong(i) + sign * Math.floorDiv(size.getLong(i), 2L);
      }
      return Column.ofLongs(name, out);
    }
    double[] out = new double[n];
    for (int i = 0; i < n; i++) {
      out[i] = coordinate.getDouble(i) + sign * Math.floor(size.getDouble(i) / 2.0);
    }
    return Column.ofDoubles(name, out);
  }

  @Override
  public Table readFile(File file) throws IOException {
    List<String> names = boxFormat.getColumns();
    Table raw = TableIO.read(file, new ReadOptions().comment('#').names(names));
    Table table = Table.of(
        shift(raw.getColumn(names.get(0)), raw.getColumn(names.get(2)), 1, COORDINATE_X),
        shift(raw.getColumn(names.get(1)), raw.getColumn(names.get(3)), 1, COORDINATE_Y));
    logger.info(format(" Read %d %s boxes from %s.", table.getRowCount(), boxFormat.getLabel(), file.getName()));
    return table;
  }

  @Override
  public boolean canWrite() {
    return true;
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the box size is not positive.
   */
  @Override
  public void writeFile(File file, Table table) throws IOException {
    if (boxSize <= 0) {
      throw new IllegalArgumentException(format(" Box size %d is not positive; set --boxSize or %s.",
          boxSize, MetadataFormat.BOX_SIZE));
    }
    List<String> names = boxFormat.getColumns();
    int rows = table.getRowCount();
    Column sizeX = Column.constant(names.get(2), boxSize, rows);
    Column sizeY = Column.constant(names.get(3), boxSize, rows);
    List<Column> columns = new ArrayList<>(4);
    columns.add(shift(table.getColumn(COORDINATE_X), sizeX, -1, names.get(0)));
    columns.add(shift(table.getColumn(COORDINATE_Y), sizeY, -1, names.get(1)));
    columns.add(sizeX);
    columns.add(sizeY);
    TableIO.write(file, new Table(columns), null, true);
    logger.info(format(" Wrote %d %s boxes of size %d to %s.", rows, boxFormat.getLabel(), boxSize, file.getName()));
  }
}
