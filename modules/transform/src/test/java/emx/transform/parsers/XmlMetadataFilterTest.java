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

import emx.transform.DuplicateKeyException;
import emx.transform.InputFormatException;
import emx.transform.TransformTest;
import emx.transform.table.Table;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.apache.commons.io.FileUtils.writeStringToFile;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

/**
 * @author Michael J. Schnieders
 */
public class XmlMetadataFilterTest extends TransformTest {

  private static final String ARRAYS = "http://schemas.microsoft.com/2003/10/Serialization/Arrays";

  @Test
  public void testKeyWithoutPrefix() {
    assertEquals("x", XmlMetadataFilter.keyWithoutPrefix("{http://schemas.datacontract.org/2004/07/Fei.Types}_x"));
    assertEquals("name", XmlMetadataFilter.keyWithoutPrefix(" __name_ "));
    assertEquals("Defocus", XmlMetadataFilter.keyWithoutPrefix("Defocus"));
  }

  @Test
  public void testEpuDefaults() throws IOException {
    Table table = new XmlMetadataFilter(XmlLevels.defaults()).readFile(getResourceFile("epu.xml"));
    assertEquals(1, table.getRowCount());
    assertEquals(List.of("AccelerationVoltage", "InstrumentModel", "BeamShift_x", "BeamShift_y", "Defocus",
        "Position_A", "Position_B", "Position_X", "Position_Y", "Position_Z",
        "pixelSize_x", "pixelSize_y", "Dose", "PhasePlateUsed", "NumberOffractions", "FramesPerFraction"),
        table.getColumnNames());
    assertEquals(300000L, table.getColumn("AccelerationVoltage").getLong(0));
    assertEquals("TITAN52336320", table.getColumn("InstrumentModel").getString(0));
    assertEquals(-0.0123, table.getColumn("BeamShift_x").getDouble(0), 0.0);
    assertEquals(-1.5e-6, table.getColumn("Defocus").getDouble(0), 0.0);
    assertEquals(1.2e-10, table.getColumn("pixelSize_y").getDouble(0), 0.0);
    assertEquals(4.2e21, table.getColumn("Dose").getDouble(0), 0.0);
    assertEquals(40L, table.getColumn("NumberOffractions").getLong(0));
    assertEquals(1L, table.getColumn("FramesPerFraction").getLong(0));
  }

  @Test
  public void testFalconDoseFractions() throws IOException {
    XmlLevels levels = new XmlLevels()
        .add(XmlLevels.Shape.KEY_VALUE, XmlLevels.clark(ARRAYS, "Key"), XmlLevels.clark(ARRAYS, "Value"));
    Table table = new XmlMetadataFilter(levels).readFile(getResourceFile("falcon.xml"));
    assertEquals(List.of("NumberOffractions", "FramesPerFraction", "Dose"), table.getColumnNames());
    assertEquals(3L, table.getColumn("NumberOffractions").getLong(0));
    assertEquals(5L, table.getColumn("FramesPerFraction").getLong(0));
    assertEquals(35.5, table.getColumn("Dose").getDouble(0), 0.0);
  }

  @Test
  public void testDuplicateKey() throws IOException {
    File file = registerTemporaryDirectory().resolve("duplicate.xml").toFile();
    writeStringToFile(file, "<r><a><Defocus>1</Defocus></a><b><Defocus>2</Defocus></b></r>", StandardCharsets.UTF_8);
    XmlLevels levels = new XmlLevels().add(XmlLevels.Shape.LEVEL_0, "Defocus");
    try {
      new XmlMetadataFilter(levels).readFile(file);
      fail(" A repeated key should not be accepted.");
    } catch (DuplicateKeyException e) {
      assertEquals("Defocus", e.key);
    }
  }

  @Test(expected = InputFormatException.class)
  public void testMalformed() throws IOException {
    File file = registerTemporaryDirectory().resolve("malformed.xml").toFile();
    writeStringToFile(file, "<r><Defocus>1</r>", StandardCharsets.UTF_8);
    new XmlMetadataFilter(new XmlLevels()).readFile(file);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testKeyValueNeedsOneValueTag() {
    new XmlLevels().add(XmlLevels.Shape.KEY_VALUE, "Key");
  }

  @Test
  public void testXmlIsReadOnly() {
    assertFalse(new XmlMetadataFilter(new XmlLevels()).canWrite());
  }
}
