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
package emx.transform.ctf;

import emx.transform.ValueDomainException;
import emx.utilities.EMXTest;
import org.junit.Test;

import static emx.transform.ctf.CtfConversions.amplitudeContrastToAngle;
import static emx.transform.ctf.CtfConversions.normalizeAngle;
import static emx.transform.ctf.CtfConversions.toDefocusAstigmatism;
import static emx.transform.ctf.CtfConversions.toDefocusUV;
import static emx.transform.ctf.CtfConversions.totalAmplitudeContrast;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Michael J. Schnieders
 */
public class CtfValuesTest extends EMXTest {

  @Test
  public void testDefocusUV() {
    double[][] uv = toDefocusUV(new double[]{2.256}, new double[]{-0.060473});
    assertEquals(22862.365, uv[0][0], 1.0e-8);
    assertEquals(22257.635, uv[1][0], 1.0e-8);

    double[][] back = toDefocusAstigmatism(uv[0], uv[1]);
    assertEquals(2.256, back[0][0], 1.0e-12);
    assertEquals(-0.060473, back[1][0], 1.0e-12);
  }

  @Test
  public void testAnglesInRangeAreUnchanged() {
    double[] angles = {0.0, 1.0e-12, 19.435, 90.0, 179.99999999};
    for (double angle : angles) {
      assertEquals(angle, normalizeAngle(angle), 0.0);
    }
  }

  @Test
  public void testAnglesAreWrapped() {
    assertEquals(0.0, normalizeAngle(180.0), 0.0);
    assertEquals(170.0, normalizeAngle(-10.0), 1.0e-12);
    assertEquals(10.0, normalizeAngle(370.0), 1.0e-12);
    assertEquals(100.0, normalizeAngle(100.0 - 180.0 * 5555), 1.0e-6);
    assertEquals(Double.POSITIVE_INFINITY, 1.0 / normalizeAngle(-180.0 * 5555), 0.0);
    double tiny = normalizeAngle(-1.0e-20);
    assertEquals(true, tiny >= 0.0 && tiny < 180.0);
  }

  @Test(expected = ValueDomainException.class)
  public void testInfiniteAngle() {
    normalizeAngle(Double.NEGATIVE_INFINITY);
  }

  @Test
  public void testFailedFitAngleIsKept() {
    assertTrue(Double.isNaN(normalizeAngle(Double.NaN)));
  }

  @Test
  public void testMixedSeriesOutOfDomain() {
    try {
      amplitudeContrastToAngle(new double[]{10.0, -200.0});
      fail(" An amplitude contrast of -200 was accepted.");
    } catch (ValueDomainException e) {
      assertEquals(-200.0, e.value, 0.0);
      assertEquals(1, e.index);
    }
  }

  @Test
  public void testTotalAmplitudeContrast() {
    // Without a phase shift the amplitude contrast is unchanged.
    assertArrayEquals(new double[]{10.0}, totalAmplitudeContrast(new double[]{10.0}, new double[]{0.0}), 1.0e-9);
    // A 120 degree phase plate shift on top of 30 degrees gives 150 degrees.
    assertArrayEquals(new double[]{-50.0}, totalAmplitudeContrast(new double[]{50.0}, new double[]{120.0}), 1.0e-9);
  }
}
