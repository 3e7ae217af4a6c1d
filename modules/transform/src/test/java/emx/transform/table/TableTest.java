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
package emx.transform.table;

import emx.transform.DuplicateKeyException;
import emx.transform.SchemaResolutionException;
import emx.utilities.EMXTest;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Michael J. Schnieders
 */
public class TableTest extends EMXTest {

  private static Table micrographs() {
    return Table.of(
        Column.ofStrings("MicrographName", "a.mrc", "b.mrc", "c.mrc"),
        Column.ofDoubles("DefocusU", 20000.0, 21000.0, 22000.0),
        Column.ofLongs("frame", 1, 2, 3));
  }

  @Test
  public void testInferTypes() {
    assertEquals(ColumnType.LONG, ColumnType.infer(List.of("1", "-2", "+3")));
    assertEquals(ColumnType.DOUBLE, ColumnType.infer(List.of("1", "2.5", "1e-3")));
    assertEquals(ColumnType.DOUBLE, ColumnType.infer(List.of("nan", "inf", "0.1")));
    assertEquals(ColumnType.BOOLEAN, ColumnType.infer(List.of("True", "false")));
    assertEquals(ColumnType.STRING, ColumnType.infer(List.of("1", "a.mrc")));
    assertEquals(ColumnType.STRING, ColumnType.infer(List.of()));
  }

  @Test
  public void testParseColumn() {
    Column column = Column.parse("value", List.of("1", "2.5", "nan"));
    assertEquals(ColumnType.DOUBLE, column.getType());
    assertEquals(2.5, column.getDouble(1), 0.0);
    assertTrue(Double.isNaN(column.getDouble(2)));
  }

  @Test
  public void testSignedNonFiniteTokens() {
    List<String> tokens = List.of("-nan", "+nan", "-NaN", "-inf", "-Infinity", "1.0");
    assertEquals(ColumnType.DOUBLE, ColumnType.infer(tokens));
    Column column = Column.parse("value", tokens);
    assertTrue(Double.isNaN(column.getDouble(0)));
    assertTrue(Double.isNaN(column.getDouble(1)));
    assertTrue(Double.isNaN(column.getDouble(2)));
    assertEquals(Double.NEGATIVE_INFINITY, column.getDouble(3), 0.0);
    assertEquals(Double.NEGATIVE_INFINITY, column.getDouble(4), 0.0);
    assertEquals(1.0, column.getDouble(5), 0.0);
  }

  @Test
  public void testGetColumn() {
    Table table = micrographs();
    assertEquals(3, table.getRowCount());
    assertEquals(3, table.getColumnCount());
    assertEquals(21000.0, table.getColumn("DefocusU").getDouble(1), 0.0);
    assertEquals(List.of("MicrographName", "DefocusU", "frame"), table.getColumnNames());
  }

  @Test
  public void testMissingColumn() {
    try {
      micrographs().getColumn("DefocusV");
      fail(" A missing column was returned.");
    } catch (SchemaResolutionException e) {
      assertEquals(List.of("DefocusV"), e.fieldNames);
    }
  }

  @Test(expected = DuplicateKeyException.class)
  public void testDuplicateName() {
    Table.of(Column.ofLongs("a", 1), Column.ofLongs("a", 2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnequalLengths() {
    Table.of(Column.ofLongs("a", 1, 2), Column.ofLongs("b", 2));
  }

  @Test
  public void testSelectDropAndReplace() {
    Table table = micrographs();
    assertEquals(List.of("frame", "MicrographName"), table.select(List.of("frame", "MicrographName")).getColumnNames());
    assertEquals(List.of("MicrographName", "frame"), table.drop(List.of("DefocusU", "unknown")).getColumnNames());

    Table replaced = table.withColumn(Column.ofDoubles("DefocusU", 1.0, 2.0, 3.0));
    assertEquals(List.of("MicrographName", "DefocusU", "frame"), replaced.getColumnNames());
    assertEquals(2.0, replaced.getColumn("DefocusU").getDouble(1), 0.0);

    Table appended = table.withColumn(Column.ofDoubles("DefocusV", 1.0, 2.0, 3.0));
    assertEquals("DefocusV", appended.getColumnNames().get(3));
  }

  @Test
  public void testConcatBroadcastsSingleRow() {
    Table metadata = Table.of(Column.ofDoubles("Voltage", 300.0), Column.ofStrings("MicrographName", "a.mrc"));
    Table table = Table.of(Column.ofLongs("frame", 1, 2, 3)).concat(metadata);
    assertEquals(3, table.getRowCount());
    assertEquals("a.mrc", table.getColumn("MicrographName").get(2));
    assertEquals(300.0, table.getColumn("Voltage").getDouble(1), 0.0);
  }

  @Test
  public void testRoundKeepsNonFinite() {
    Column column = Column.ofDoubles("x", 1.23456789, Double.NaN).round(3);
    assertEquals(1.235, column.getDouble(0), 0.0);
    assertTrue(Double.isNaN(column.getDouble(1)));
    Column longs = Column.ofLongs("n", 5);
    assertEquals(longs, longs.round(2));
  }

  @Test
  public void testConstantNormalizesIntegers() {
    Column column = Column.constant("n", 4, 2);
    assertEquals(ColumnType.LONG, column.getType());
    assertEquals(4L, column.getLong(1));
  }

  @Test
  public void testEmpty() {
    assertTrue(Table.empty().isEmpty());
    assertFalse(micrographs().isEmpty());
    assertTrue(Table.of(Column.ofDoubles("x")).isEmpty());
  }
}
