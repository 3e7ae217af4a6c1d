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
import emx.transform.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-frame shifts of a movie alignment.
 *
 * @author Michael J. Schnieders
 */
public class ShiftTrajectory {

  /** Column of the x shifts. */
  public static final String SHIFT_X = "shift_x";
  /** Column of the y shifts. */
  public static final String SHIFT_Y = "shift_y";

  /**
   * Shift columns, x then y.
   */
  public static final List<String> COLUMNS = List.of(SHIFT_X, SHIFT_Y);

  private ShiftTrajectory() {
    // Static methods only.
  }

  /**
   * Subtract the first row from every row, column by column, so the first frame is at the origin.
   *
   * @param shifts numeric shift columns.
   * @return a new Table of double columns.
   */
  public static Table rebase(Table shifts) {
    if (shifts.getRowCount() == 0) {
      return shifts;
    }
    List<Column> columns = new ArrayList<>(shifts.getColumnCount());
    for (Column column : shifts.getColumns()) {
      double[] values = column.toDoubles();
      double origin = values[0];
      for (int i = 0; i < values.length; i++) {
        values[i] -= origin;
      }
      columns.add(Column.ofDoubles(column.getName(), values));
    }
    return new Table(columns);
  }
}
