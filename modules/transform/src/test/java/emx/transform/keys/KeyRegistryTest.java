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
package emx.transform.keys;

import emx.transform.SchemaResolutionException;
import emx.utilities.EMXTest;
import emx.utilities.VersionFormatException;
import org.junit.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Michael J. Schnieders
 */
public class KeyRegistryTest extends EMXTest {

  private static KeyRegistry registry() throws IOException {
    return KeyRegistry.starRegistry(KeyRegistry.STAR_VERSIONS);
  }

  @Test
  public void testRegistryIsShared() throws IOException {
    assertSame(registry(), KeyRegistry.starRegistry(List.of("relion_2", "relion_3")));
    assertEquals("relion_3", registry().getNewestVersion());
  }

  @Test
  public void testConfiguredOrderIsIgnored() throws IOException {
    KeyRegistry reversed = KeyRegistry.starRegistry(List.of("relion_3", "relion_2"));
    assertEquals(List.of("relion_2", "relion_3"), reversed.getVersions());
    assertEquals("relion_3", reversed.getNewestVersion());
    assertEquals("relion_3", reversed.detectVersion(List.of("_rlnMicrographName", "_rlnDefocusU")));
  }

  @Test
  public void testReleaseOrdering() {
    assertTrue(KeyRegistry.releaseOf("relion_10").compareTo(KeyRegistry.releaseOf("relion_9")) > 0);
    assertEquals(0, KeyRegistry.releaseOf("relion_3.1").compareTo(KeyRegistry.releaseOf("relion_3.1")));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testVersionWithoutRelease() {
    KeyRegistry.releaseOf("relion");
  }

  @Test
  public void testDetectCommonHeaderAsNewest() throws IOException {
    assertEquals("relion_3", registry().detectVersion(List.of("_rlnMicrographName", "_rlnDefocusU")));
  }

  @Test
  public void testDetectRelion2() throws IOException {
    assertEquals("relion_2", registry().detectVersion(List.of("_rlnDefocusU", "_rlnSgdNextSubset")));
  }

  @Test
  public void testDetectRelion3() throws IOException {
    assertEquals("relion_3", registry().detectVersion(List.of("_rlnMicrographShiftX", "_rlnDefocusV")));
  }

  @Test
  public void testUnknownKey() throws IOException {
    try {
      registry().detectVersion(List.of("_rlnDefocusU", "_rlnNotAKey"));
      fail(" An unknown key was accepted.");
    } catch (SchemaResolutionException e) {
      assertEquals(List.of("_rlnNotAKey"), e.fieldNames);
    }
  }

  @Test
  public void testImportRenames() throws IOException {
    List<String> names = registry().importHeader(
        List.of("_rlnMicrographShiftX", "_rlnCtfBfactor", "_rlnDefocusU"), "relion_3");
    assertEquals(List.of("shift_x", "b_factor", "DefocusU"), names);
  }

  @Test
  public void testExportDropsUnknownFields() throws IOException {
    ExportHeader header = registry().exportHeader(List.of("DefocusU", "SgdNextSubset", "b_factor"), "relion_3");
    assertEquals(List.of("DefocusU", "CtfBfactor"), header.getNames());
    assertEquals(List.of("DefocusU", "b_factor"), header.getKeptFields());
    assertEquals(List.of("_rlnDefocusU", "_rlnCtfBfactor"), header.getPrefixedNames());
    assertFalse(header.getKeptFields().contains("SgdNextSubset"));
  }

  @Test(expected = SchemaResolutionException.class)
  public void testExportWithNoKnownField() throws IOException {
    registry().exportHeader(List.of("SgdNextSubset"), "relion_3");
  }

  @Test(expected = VersionFormatException.class)
  public void testUnknownVersion() throws IOException {
    registry().getDictionary("relion_1");
  }
}
