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
import emx.transform.keys.KeyRegistry;
import emx.transform.table.Column;
import emx.transform.table.Table;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.apache.commons.io.FileUtils.writeStringToFile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

/**
 * @author Michael J. Schnieders
 */
public class StarFilterTest extends TransformTest {

  private static StarFilter filter(String version) throws IOException {
    return new StarFilter(KeyRegistry.starRegistry(KeyRegistry.STAR_VERSIONS), version);
  }

  @Test
  public void testHeaderFields() {
    List<String> lines = List.of("", "data_", "loop_", "_rlnDefocusU #1", " _rlnDefocusV #2", "1.0 2.0");
    assertEquals(List.of("_rlnDefocusU", "_rlnDefocusV"), StarFilter.headerFields(lines));
  }

  @Test
  public void testRead() throws IOException {
    StarFilter filter = filter(null);
    File file = getResourceFile("relion_3.star");
    assertEquals("relion_3", filter.detectVersion(file));
    Table table = filter.readFile(file);
    assertEquals(List.of("MicrographName", "DefocusU", "DefocusV", "DefocusAngle", "b_factor"), table.getColumnNames());
    assertEquals(19000.5, table.getColumn("DefocusV").getDouble(1), 0.0);
    assertEquals(12.5, table.getColumn("b_factor").getDouble(1), 0.0);
  }

  @Test
  public void testExactRoundTrip() throws IOException {
    StarFilter filter = filter("relion_3");
    File input = getResourceFile("relion_3.star");
    File output = registerTemporaryDirectory().resolve("out.star").toFile();
    filter.writeFile(output, filter.readFile(input));
    assertEquals(Files.readAllLines(input.toPath(), StandardCharsets.UTF_8),
        Files.readAllLines(output.toPath(), StandardCharsets.UTF_8));
  }

  @Test
  public void testRelion2Detection() throws IOException {
    StarFilter filter = filter(null);
    File file = getResourceFile("relion_2.star");
    assertEquals("relion_2", filter.detectVersion(file));
    Table table = filter.readFile(file);
    assertEquals(3L, table.getColumn("SgdNextSubset").getLong(0));

    // Relion 3 has no SgdNextSubset.
    File output = registerTemporaryDirectory().resolve("out.star").toFile();
    filter.writeFile(output, table);
    Table reread = filter.readFile(output);
    assertEquals(List.of("MicrographName"), reread.getColumnNames());
  }

  @Test
  public void testExportToRelion2() throws IOException {
    Table table = Table.of(
        Column.ofStrings("MicrographName", "a.mrc"),
        Column.ofDoubles("not_a_key", 1.5),
        Column.ofDoubles("DefocusU", 20000.0));
    File output = registerTemporaryDirectory().resolve("out.star").toFile();
    filter("relion_2").writeFile(output, table);
    List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
    assertEquals(List.of("", "data_", "", "loop_", "_rlnMicrographName #1", "_rlnDefocusU #2", "a.mrc\t20000.0"), lines);
  }

  @Test(expected = SchemaResolutionException.class)
  public void testUnknownKey() throws IOException {
    File file = registerTemporaryDirectory().resolve("bad.star").toFile();
    writeStringToFile(file, "data_\nloop_\n_rlnDefocusU #1\n_rlnUnknownLabel #2\n1.0 2.0\n", StandardCharsets.UTF_8);
    filter(null).readFile(file);
  }

  @Test(expected = InputFormatException.class)
  public void testNoHeader() throws IOException {
    File file = registerTemporaryDirectory().resolve("bad.star").toFile();
    writeStringToFile(file, "data_\n1.0 2.0\n", StandardCharsets.UTF_8);
    filter(null).readFile(file);
  }

  @Test
  public void testNoKnownFieldIsAnError() throws IOException {
    File file = registerTemporaryDirectory().resolve("out.star").toFile();
    try {
      filter(null).writeFile(file, Table.of(Column.ofDoubles("not_a_key", 1.0)));
      fail(" A table without known fields should not be written.");
    } catch (SchemaResolutionException e) {
      assertEquals(List.of("not_a_key"), e.fieldNames);
    }
    assertFalse(file.exists());
  }
}
