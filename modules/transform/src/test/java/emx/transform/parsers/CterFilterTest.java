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

import emx.transform.SchemaResolutionException;
import emx.transform.TransformTest;
import emx.transform.ctf.CterDialect;
import emx.transform.table.Column;
import emx.transform.table.Table;
import emx.utilities.VersionFormatException;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author Michael J. Schnieders
 */
public class CterFilterTest extends TransformTest {

  private static final double tolerance = 1.0e-7;

  @Test
  public void testReadRelion() throws IOException {
    Table table = new CterFilter(null).readFile(getResourceFile("cter_relion.txt"));
    assertEquals(2, table.getRowCount());
    assertEquals(List.of("DefocusU", "DefocusV"), table.getColumnNames().subList(0, 2));
    assertFalse(table.hasColumn("defocus"));
    assertFalse(table.hasColumn("astigmatism_amplitude"));

    assertEquals(22862.365, table.getColumn("DefocusU").getDouble(0), tolerance);
    assertEquals(22257.635, table.getColumn("DefocusV").getDouble(0), tolerance);
    assertEquals(19.435, table.getColumn("DefocusAngle").getDouble(0), tolerance);
    // 45 - (-30) = 75.
    assertEquals(75.0, table.getColumn("DefocusAngle").getDouble(1), tolerance);
    assertEquals(0.1, table.getColumn("AmplitudeContrast").getDouble(0), tolerance);
    assertEquals(0.1, table.getColumn("total_ac").getDouble(0), tolerance);
    assertEquals(4.0, table.getColumn("resolution_limit_defocus").getDouble(0), tolerance);
    assertEquals(5.0, table.getColumn("resolution_limit_defocus_astig").getDouble(0), tolerance);
    assertEquals(2.0, table.getColumn("nyquist").getDouble(0), tolerance);
    assertEquals(4.0, table.getColumn("CtfMaxResolution").getDouble(0), tolerance);
    assertEquals("test_file.mrc", table.getColumn("MicrographNameNoDW").get(0));
  }

  @Test
  public void testRoundTrip() throws IOException {
    CterFilter filter = new CterFilter("1.0");
    Table table = filter.readFile(getResourceFile("cter_relion.txt"));
    File file = registerTemporaryDirectory().resolve("partres.txt").toFile();
    filter.writeFile(file, table);
    Table reread = filter.readFile(file);

    assertEquals(table.getColumnNames(), reread.getColumnNames());
    for (Column column : table.getColumns()) {
      Column other = reread.getColumn(column.getName());
      for (int row = 0; row < table.getRowCount(); row++) {
        if (column.getType().isNumeric()) {
          assertEquals(column.getName(), column.getDouble(row), other.getDouble(row), tolerance);
        } else {
          assertEquals(column.getName(), column.get(row), other.get(row));
        }
      }
    }

    // On disk the mean defocus and astigmatism are restored.
    String[] tokens = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8).get(0).split("\t");
    assertEquals(22, tokens.length);
    assertEquals(2.256, Double.parseDouble(tokens[0]), tolerance);
    assertEquals(-0.060473, Double.parseDouble(tokens[6]), tolerance);
    assertEquals(25.565, Double.parseDouble(tokens[7]), tolerance);
  }

  @Test
  public void testFailedFitRowIsRead() throws IOException {
    List<String> lines = Files.readAllLines(getResourceFile("cter_relion.txt").toPath(), StandardCharsets.UTF_8);
    String[] tokens = lines.get(1).split("\t");
    tokens[7] = "nan";
    File file = registerTemporaryDirectory().resolve("partres.txt").toFile();
    Files.write(file.toPath(), List.of(lines.get(0), String.join("\t", tokens)), StandardCharsets.UTF_8);

    Table table = new CterFilter(null).readFile(file);
    assertEquals(2, table.getRowCount());
    assertEquals(19.435, table.getColumn("DefocusAngle").getDouble(0), tolerance);
    assertTrue(Double.isNaN(table.getColumn("DefocusAngle").getDouble(1)));
  }

  @Test
  public void testReadSphire() throws IOException {
    CterFilter filter = new CterFilter(null, CterDialect.SPHIRE, CterFilter.DEFAULT_DIGITS);
    Table table = filter.readFile(getResourceFile("cter_sphire.txt"));
    assertEquals(22862.365, table.getColumn("defocus_u").getDouble(0), tolerance);
    assertEquals(19.435, table.getColumn("astigmatism_angle").getDouble(0), tolerance);
    assertEquals(0.1, table.getColumn("ac").getDouble(0), tolerance);
    assertEquals(5.0, table.getColumn("resolution_limit").getDouble(0), tolerance);
    assertEquals("test_file.mrc", table.getColumn("micrograph_name").get(0));
  }

  @Test
  public void testDerivedFieldsOnWrite() throws IOException {
    Table table = Table.of(
        Column.ofDoubles("DefocusU", 22862.365),
        Column.ofDoubles("DefocusV", 22257.635),
        Column.ofDoubles("DefocusAngle", 19.435),
        Column.ofDoubles("PixelSize", 1.0),
        Column.ofDoubles("AmplitudeContrast", 0.1),
        Column.ofDoubles("PhaseShift", 0.0),
        Column.ofStrings("MicrographNameNoDW", "test_file.mrc"));
    CterFilter filter = new CterFilter(null);
    File file = registerTemporaryDirectory().resolve("partres.txt").toFile();
    filter.writeFile(file, table);

    String[] tokens = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8).get(0).split("\t");
    List<String> columns = CterDialect.RELION.getColumns();
    // Nyquist frequency from the pixel size.
    assertEquals(0.5, Double.parseDouble(tokens[columns.indexOf("nyquist")]), tolerance);
    // Missing resolution limits fall back to the Nyquist frequency.
    assertEquals(0.5, Double.parseDouble(tokens[columns.indexOf("CtfMaxResolution")]), tolerance);
    assertEquals(0.5, Double.parseDouble(tokens[columns.indexOf("resolution_limit_defocus")]), tolerance);
    // Without a phase shift the total amplitude contrast is the amplitude contrast.
    assertEquals(10.0, Double.parseDouble(tokens[columns.indexOf("total_ac")]), tolerance);
    assertEquals(10.0, Double.parseDouble(tokens[columns.indexOf("AmplitudeContrast")]), tolerance);
    assertEquals("test_file.mrc", tokens[columns.indexOf("MicrographNameNoDW")]);
  }

  @Test(expected = SchemaResolutionException.class)
  public void testNyquistNeedsPixelSize() throws IOException {
    Table table = Table.of(Column.ofDoubles("DefocusU", 20000.0), Column.ofDoubles("DefocusV", 20000.0));
    File file = registerTemporaryDirectory().resolve("partres.txt").toFile();
    new CterFilter(null).writeFile(file, table);
  }

  @Test(expected = SchemaResolutionException.class)
  public void testDefocusIsRequired() throws IOException {
    File file = registerTemporaryDirectory().resolve("partres.txt").toFile();
    new CterFilter(null).writeFile(file, Table.of(Column.ofDoubles("PixelSize", 1.0)));
  }

  @Test(expected = VersionFormatException.class)
  public void testVersionTooOld() {
    new CterFilter("0.9");
  }
}
