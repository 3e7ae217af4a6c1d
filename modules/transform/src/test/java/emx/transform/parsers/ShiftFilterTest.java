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
import emx.transform.TransformTest;
import emx.transform.table.Table;
import org.junit.Test;

import java.io.File;
import java.io.IOException;

import static emx.transform.parsers.ShiftTrajectory.SHIFT_X;
import static emx.transform.parsers.ShiftTrajectory.SHIFT_Y;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/**
 * Tests of the MotionCor2 and Unblur frame shift files.
 *
 * @author Michael J. Schnieders
 */
public class ShiftFilterTest extends TransformTest {

  private static final double tolerance = 1.0e-9;
  private static final double[] expectedX = {0.0, 3.58 - 5.59, 2.08 - 5.59, -5.59};
  private static final double[] expectedY = {0.0, 11.86 - 13.05, 9.68 - 13.05, -13.05};

  @Test
  public void testReadMotionCor2() throws IOException {
    Table table = new MotionCor2Filter(null).readFile(getResourceFile("motioncor2.log"));
    assertEquals(ShiftTrajectory.COLUMNS, table.getColumnNames());
    assertArrayEquals(expectedX, table.getColumn(SHIFT_X).toDoubles(), tolerance);
    assertArrayEquals(expectedY, table.getColumn(SHIFT_Y).toDoubles(), tolerance);
  }

  @Test
  public void testReadUnblur() throws IOException {
    Table table = new UnblurFilter(null).readFile(getResourceFile("unblur.txt"));
    assertEquals(4, table.getRowCount());
    assertArrayEquals(expectedX, table.getColumn(SHIFT_X).toDoubles(), tolerance);
    assertArrayEquals(expectedY, table.getColumn(SHIFT_Y).toDoubles(), tolerance);
  }

  @Test(expected = InputFormatException.class)
  public void testUnblurNeedsTwoLines() throws IOException {
    new UnblurFilter(null).readFile(getResourceFile("unblur_corrupt.txt"));
  }

  @Test
  public void testMotionCor2ToUnblur() throws IOException {
    Table table = new MotionCor2Filter(null).readFile(getResourceFile("motioncor2.log"));
    File file = registerTemporaryDirectory().resolve("shifts.txt").toFile();
    UnblurFilter unblur = new UnblurFilter("1.0.2");
    unblur.writeFile(file, table);
    assertEquals(table, unblur.readFile(file));
  }

  @Test
  public void testUnblurToMotionCor2() throws IOException {
    Table table = new UnblurFilter(null).readFile(getResourceFile("unblur.txt"));
    File file = registerTemporaryDirectory().resolve("shifts.log").toFile();
    MotionCor2Filter motionCor2 = new MotionCor2Filter(null);
    motionCor2.writeFile(file, table);
    Table reread = motionCor2.readFile(file);
    assertArrayEquals(table.getColumn(SHIFT_X).toDoubles(), reread.getColumn(SHIFT_X).toDoubles(), 0.0);
  }
}
