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
import emx.transform.SchemaResolutionException;
import emx.transform.TransformTest;
import emx.transform.table.Column;
import emx.transform.table.Table;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * @author Michael J. Schnieders
 */
public class CtffindFilterTest extends TransformTest {

  @Test
  public void testRead() throws IOException {
    CtffindFilter filter = new CtffindFilter(null);
    assertEquals("4.1.0", filter.getVersion().toString());
    Table table = filter.readFile(getResourceFile("ctffind.txt"));

    assertEquals(1, table.getRowCount());
    assertEquals(10125.569336, table.getColumn("DefocusU").getDouble(0), 1.0e-9);
    assertEquals(9971.217773, table.getColumn("DefocusV").getDouble(0), 1.0e-9);
    assertEquals(-70.023018, table.getColumn("DefocusAngle").getDouble(0), 1.0e-9);
    // Radians on disk.
    assertEquals(45.0, table.getColumn("PhaseShift").getDouble(0), 1.0e-3);
    assertEquals(0.038154, table.getColumn("CtfFigureOfMerit").getDouble(0), 1.0e-9);
    assertEquals(4.68, table.getColumn("CtfMaxResolution").getDouble(0), 1.0e-9);

    assertEquals("4.1.8", table.getColumn(CtffindFilter.VERSION).get(0));
    assertEquals("/data/test_file.mrc", table.getColumn(CtffindFilter.MICROGRAPH_NAME).get(0));
    assertEquals(1.14, table.getColumn("PixelSize").getDouble(0), 0.0);
    assertEquals(300.0, table.getColumn("Voltage").getDouble(0), 0.0);
    assertEquals(2.7, table.getColumn("SphericalAberration").getDouble(0), 0.0);
    assertEquals(0.1, table.getColumn("AmplitudeContrast").getDouble(0), 0.0);
  }

  @Test
  public void testMetadataIsBroadcast() throws InputFormatException {
    List<String> lines = List.of(
        "# Output from CTFFind version 4.1.10, run on 2019-01-01",
        "# Pixel size: 0.5 Angstroms ; acceleration voltage: 200.0 keV");
    Table metadata = CtffindFilter.readMetadata(lines, "test");
    assertEquals(List.of("version", "PixelSize", "Voltage"), metadata.getColumnNames());
    Table table = Table.of(Column.ofDoubles("DefocusU", 1.0, 2.0, 3.0)).concat(metadata);
    assertEquals(0.5, table.getColumn("PixelSize").getDouble(2), 0.0);
  }

  @Test(expected = InputFormatException.class)
  public void testCorruptMetadata() throws IOException {
    new CtffindFilter(null).readFile(getResourceFile("ctffind_corrupt.txt"));
  }

  @Test
  public void testRoundTrip() throws IOException {
    CtffindFilter filter = new CtffindFilter("4.1.8");
    Table table = filter.readFile(getResourceFile("ctffind.txt"));
    File file = registerTemporaryDirectory().resolve("ctffind.txt").toFile();
    filter.writeFile(file, table);

    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    assertEquals(CtffindFilter.COMMENT_LINES + 1, lines.size());
    assertTrue(lines.get(0).contains("CTFFind version 4.1.8"));
    String[] tokens = lines.get(CtffindFilter.COMMENT_LINES).split("\t");
    assertEquals(7, tokens.length);
    assertEquals("1", tokens[0]);
    assertEquals(0.785398, Double.parseDouble(tokens[4]), 1.0e-12);

    Table reread = filter.readFile(file);
    for (String name : filter.getColumns()) {
      assertEquals(name, table.getColumn(name).getDouble(0), reread.getColumn(name).getDouble(0), 1.0e-9);
    }
    assertEquals(1.14, reread.getColumn("PixelSize").getDouble(0), 0.0);
    assertEquals("/data/test_file.mrc", reread.getColumn(CtffindFilter.MICROGRAPH_NAME).get(0));
  }

  @Test
  public void testRoundTripWithoutMetadata() throws IOException {
    Table table = Table.of(
        Column.ofDoubles("DefocusU", 20000.0, 21000.5),
        Column.ofDoubles("DefocusV", 19000.0, 20500.25),
        Column.ofDoubles("DefocusAngle", -70.5, 12.0),
        Column.ofDoubles("PhaseShift", 0.0, 0.0),
        Column.ofDoubles("CtfFigureOfMerit", 0.04, 0.125),
        Column.ofDoubles("CtfMaxResolution", 4.5, 6.0));
    CtffindFilter filter = new CtffindFilter(null);
    File file = registerTemporaryDirectory().resolve("ctffind.txt").toFile();
    filter.writeFile(file, table);

    // No run parameter may be read back.
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    assertEquals(0, CtffindFilter.readMetadata(lines, file.getName()).getColumnCount());
    assertEquals(table, filter.readFile(file));
  }

  @Test
  public void testOptionalColumnsDefaultToZero() throws IOException {
    Table table = Table.of(Column.ofDoubles("DefocusU", 20000.0), Column.ofDoubles("DefocusV", 19000.0));
    File file = registerTemporaryDirectory().resolve("ctffind.txt").toFile();
    new CtffindFilter(null).writeFile(file, table);
    String[] tokens = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)
        .get(CtffindFilter.COMMENT_LINES).split("\t");
    assertEquals("20000.0", tokens[1]);
    assertEquals("0.0", tokens[3]);
  }

  @Test(expected = SchemaResolutionException.class)
  public void testDefocusIsRequired() throws IOException {
    File file = registerTemporaryDirectory().resolve("ctffind.txt").toFile();
    new CtffindFilter(null).writeFile(file, Table.of(Column.ofDoubles("DefocusU", 20000.0)));
  }
}
