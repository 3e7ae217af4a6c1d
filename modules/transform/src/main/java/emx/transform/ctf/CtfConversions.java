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
import org.apache.commons.math3.util.FastMath;

/**
 * Unit conventions of CTF parameters.
 *
 * <p>Defocus U and V are in Angstrom. Mean defocus and astigmatism amplitude are in micrometers,
 * with the astigmatism amplitude defined as (V - U) / 10000. Angles are in degrees.
 *
 * @author Michael J. Schnieders
 */
public class CtfConversions {

  /**
   * Largest magnitude of an amplitude contrast in percent.
   */
  public static final double MAX_AMPLITUDE_CONTRAST = 100.0;

  private CtfConversions() {
    // Static methods only.
  }

  /**
   * Defocus U from mean defocus and astigmatism amplitude.
   *
   * @param defocus     mean defocus (micrometers).
   * @param astigmatism astigmatism amplitude (micrometers).
   * @return defocus U (Angstrom).
   */
  public static double defocusU(double defocus, double astigmatism) {
    return (20000.0 * defocus - 10000.0 * astigmatism) / 2.0;
  }

  /**
   * Defocus V from mean defocus and astigmatism amplitude.
   *
   * @param defocus     mean defocus (micrometers).
   * @param astigmatism astigmatism amplitude (micrometers).
   * @return defocus V (Angstrom).
   */
  public static double defocusV(double defocus, double astigmatism) {
    return 20000.0 * defocus - defocusU(defocus, astigmatism);
  }

  /**
   * Mean defocus.
   *
   * @param defocusU defocus U (Angstrom).
   * @param defocusV defocus V (Angstrom).
   * @return mean defocus (micrometers).
   */
  public static double meanDefocus(double defocusU, double defocusV) {
    return (defocusU + defocusV) / 20000.0;
  }

  /**
   * Astigmatism amplitude.
   *
   * @param defocusU defocus U (Angstrom).
   * @param defocusV defocus V (Angstrom).
   * @return astigmatism amplitude (micrometers).
   */
  public static double astigmatismAmplitude(double defocusU, double defocusV) {
    return (defocusV - defocusU) / 10000.0;
  }

  /**
   * Element-wise defocus U and V.
   *
   * @param defocus     mean defocus (micrometers).
   * @param astigmatism astigmatism amplitude (micrometers).
   * @return {U, V} in Angstrom.
   */
  public static double[][] toDefocusUV(double[] defocus, double[] astigmatism) {
    checkLengths(defocus, astigmatism);
    double[] u = new double[defocus.length];
    double[] v = new double[defocus.length];
    for (int i = 0; i < defocus.length; i++) {
      u[i] = defocusU(defocus[i], astigmatism[i]);
      v[i] = defocusV(defocus[i], astigmatism[i]);
    }
    return new double[][] {u, v};
  }

  /**
   * Element-wise mean defocus and astigmatism amplitude.
   *
   * @param defocusU defocus U (Angstrom).
   * @param defocusV defocus V (Angstrom).
   * @return {defocus, astigmatism} in micrometers.
   */
  public static double[][] toDefocusAstigmatism(double[] defocusU, double[] defocusV) {
    checkLengths(defocusU, defocusV);
    double[] defocus = new double[defocusU.length];
    double[] astigmatism = new double[defocusU.length];
    for (int i = 0; i < defocusU.length; i++) {
      defocus[i] = meanDefocus(defocusU[i], defocusV[i]);
      astigmatism[i] = astigmatismAmplitude(defocusU[i], defocusV[i]);
    }
    return new double[][] {defocus, astigmatism};
  }

  /**
   * Wrap an angle into [0, 180). Angles already in range are returned unchanged.
   *
   * @param angle angle in degrees.
   * @return the wrapped angle; NaN, the value of a failed fit, is returned unchanged.
   * @throws ValueDomainException if the angle is infinite.
   */
  public static double normalizeAngle(double angle) {
    if (Double.isNaN(angle)) {
      return angle;
    }
    if (Double.isInfinite(angle)) {
      throw new ValueDomainException("Angle must be finite", angle, -1);
    }
    if (angle >= 0.0 && angle < 180.0) {
      return angle;
    }
    double wrapped = angle % 180.0;
    if (wrapped < 0.0) {
      wrapped += 180.0;
    }
    // A tiny negative remainder rounds up to 180.
    if (wrapped >= 180.0) {
      wrapped -= 180.0;
    }
    // No negative zero.
    if (wrapped == 0.0) {
      return 0.0;
    }
    return wrapped;
  }

  /**
   * Element-wise {@link #normalizeAngle(double)}.
   *
   * @param angles angles in degrees.
   * @return the wrapped angles.
   */
  public static double[] normalizeAngles(double[] angles) {
    double[] out = new double[angles.length];
    for (int i = 0; i < angles.length; i++) {
      out[i] = normalizeAngle(angles[i]);
    }
    return out;
  }

  /**
   * Phase angle of an amplitude contrast.
   *
   * @param amplitudeContrast amplitude contrast in percent, within [-100, 100].
   * @return the angle in degrees, within [0, 180).
   * @throws ValueDomainException if the amplitude contrast is out of range.
   */
  public static double amplitudeContrastToAngle(double amplitudeContrast) {
    checkAmplitudeContrast(amplitudeContrast, -1);
    double ac = amplitudeContrast;
    double angle = FastMath.atan2(ac, FastMath.sqrt(1.0e4 - ac * ac));
    if (angle < 0.0) {
      angle += FastMath.PI;
    }
    return FastMath.toDegrees(angle);
  }

  /**
   * Element-wise {@link #amplitudeContrastToAngle(double)}. Every value is checked before any is
   * converted.
   *
   * @param amplitudeContrast amplitude contrasts in percent.
   * @return the angles in degrees.
   * @throws ValueDomainException for the first value out of range.
   */
  public static double[] amplitudeContrastToAngle(double[] amplitudeContrast) {
    for (int i = 0; i < amplitudeContrast.length; i++) {
      checkAmplitudeContrast(amplitudeContrast[i], i);
    }
    double[] out = new double[amplitudeContrast.length];
    for (int i = 0; i < amplitudeContrast.length; i++) {
      out[i] = amplitudeContrastToAngle(amplitudeContrast[i]);
    }
    return out;
  }

  /**
   * Amplitude contrast of a phase angle.
   *
   * @param angle angle in degrees.
   * @return amplitude contrast in percent.
   */
  public static double angleToAmplitudeContrast(double angle) {
    double tan = FastMath.tan(FastMath.toRadians(angle));
    return tan / FastMath.sqrt(1.0 + tan * tan) * 100.0;
  }

  /**
   * Element-wise {@link #angleToAmplitudeContrast(double)}.
   *
   * @param angles angles in degrees.
   * @return amplitude contrasts in percent.
   */
  public static double[] angleToAmplitudeContrast(double[] angles) {
    double[] out = new double[angles.length];
    for (int i = 0; i < angles.length; i++) {
      out[i] = angleToAmplitudeContrast(angles[i]);
    }
    return out;
  }

  /**
   * Total amplitude contrast from the intrinsic amplitude contrast plus a phase plate shift. The two
   * are summed as angles.
   *
   * @param amplitudeContrast amplitude contrasts in percent.
   * @param phaseShift        phase shifts in degrees.
   * @return total amplitude contrasts in percent.
   */
  public static double[] totalAmplitudeContrast(double[] amplitudeContrast, double[] phaseShift) {
    checkLengths(amplitudeContrast, phaseShift);
    double[] angles = amplitudeContrastToAngle(amplitudeContrast);
    for (int i = 0; i < angles.length; i++) {
      angles[i] += phaseShift[i];
    }
    return angleToAmplitudeContrast(angles);
  }

  /**
   * Element-wise 1 / x.
   *
   * @param values the values.
   * @return the reciprocals.
   */
  public static double[] reciprocal(double[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = 1.0 / values[i];
    }
    return out;
  }

  /**
   * Element-wise a * x + b.
   *
   * @param values the values.
   * @param a      the scale.
   * @param b      the offset.
   * @return the transformed values.
   */
  public static double[] affine(double[] values, double a, double b) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = a * values[i] + b;
    }
    return out;
  }

  private static void checkAmplitudeContrast(double ac, int index) {
    if (!(FastMath.abs(ac) <= MAX_AMPLITUDE_CONTRAST)) {
      throw new ValueDomainException("Amplitude contrast must be within [-100, 100] percent", ac, index);
    }
  }

  private static void checkLengths(double[] a, double[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(String.format(" Arrays differ in length (%d, %d).", a.length, b.length));
    }
  }
}
