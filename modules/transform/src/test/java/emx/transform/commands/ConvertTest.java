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

import emx.transform.TransformTest;
import emx.transform.keys.KeyRegistry;
import emx.transform.parsers.MotionCor2Filter;
import emx.transform.parsers.StarFilter;
import emx.transform.parsers.UnblurFilter;
import emx.transform.table.Table;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import static org.apache.commons.io.FileUtils.copyFile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * Tests of the Convert and ShowMetadata commands.
 *
 * @author Michael J. Schnieders
 */
public class ConvertTest extends TransformTest {

  @Test
  public void testMotionCor2ToUnblur() throws IOException {
    Path dir = registerTemporaryDirectory();
    File input = dir.resolve("motioncor2.log").toFile();
    copyFile(getResourceFile("motioncor2.log"), input);

    String[] args = {"--from", "motioncor2", "--to", "unblur", input.getAbsolutePath()};
    binding.setVariable("args", args);
    Convert convert = new Convert(binding);
    convert.run();

    File output = convert.getOutputFile();
    assertEquals(dir.resolve("motioncor2.txt").toFile(), output);
    assertTrue(output.exists());
    assertEquals(output, binding.getVariable("output"));

    Table expected = new MotionCor2Filter(null).readFile(input);
    assertEquals(expected, convert.getTable());
    assertEquals(expected, new UnblurFilter(null).readFile(output));
  }

  @Test
  public void testExistingOutputIsNotOverwritten() throws IOException {
    Path dir = registerTemporaryDirectory();
    File input = dir.resolve("motioncor2.log").toFile();
    copyFile(getResourceFile("motioncor2.log"), input);
    copyFile(getResourceFile("unblur.txt"), dir.resolve("motioncor2.txt").toFile());

    String[] args = {"-f", "motioncor2", "-t", "unblur", input.getAbsolutePath()};
    binding.setVariable("args", args);
    Convert convert = new Convert(binding);
    convert.run();
    assertEquals(dir.resolve("motioncor2_2.txt").toFile(), convert.getOutputFile());
  }

  @Test
  public void testCtffindToStar() throws IOException {
    File output = registerTemporaryDirectory().resolve("ctf.star").toFile();
    String[] args = {"--from", "ctffind", "--to", "star", "--ov", "relion_3",
        "-o", output.getAbsolutePath(), getResourcePath("ctffind.txt")};
    binding.setVariable("args", args);
    Convert convert = new Convert(binding);
    convert.run();

    assertEquals(output, convert.getOutputFile());
    StarFilter starFilter = new StarFilter(KeyRegistry.starRegistry(KeyRegistry.STAR_VERSIONS), null);
    Table table = starFilter.readFile(output);
    assertEquals(10125.569336, table.getColumn("DefocusU").getDouble(0), 1.0e-6);
    assertEquals(9971.217773, table.getColumn("DefocusV").getDouble(0), 1.0e-6);
  }

  @Test
  public void testStarToMrcIsNotWritten() {
    String[] args = {"--to", "mrc", getResourcePath("relion_3.star")};
    binding.setVariable("args", args);
    Convert convert = new Convert(binding);
    convert.run();
    assertEquals(2, convert.getTable().getRowCount());
    assertNull(convert.getOutputFile());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testAmbiguousExtension() {
    String[] args = {getResourcePath("ctffind.txt")};
    binding.setVariable("args", args);
    new Convert(binding).run();
  }

  @Test
  public void testShowMetadata() {
    String[] args = {"-r", "1", getResourcePath("relion_3.star")};
    binding.setVariable("args", args);
    ShowMetadata showMetadata = new ShowMetadata(binding);
    showMetadata.run();
    Table table = showMetadata.getTable();
    assertEquals(2, table.getRowCount());
    assertEquals("a.mrc", table.getColumn("MicrographName").get(0));
    assertEquals(table, binding.getVariable("table"));
  }
}
