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

import emx.transform.SchemaResolutionException;
import emx.transform.table.Column;
import emx.transform.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static emx.transform.ctf.CtfConversions.affine;
import static emx.transform.ctf.CtfConversions.normalizeAngles;
import static emx.transform.ctf.CtfConversions.reciprocal;
import static emx.transform.ctf.CtfConversions.toDefocusAstigmatism;
import static emx.transform.ctf.CtfConversions.toDefocusUV;
import static emx.transform.ctf.CtfConversions.totalAmplitudeContrast;
import static java.lang.String.format;

/**
 * Converts CTER records between the on-disk convention and the internal convention.
 *
 * <p>On disk, defocus is a mean plus an astigmatism amplitude in micrometers, amplitude contrasts
 * are percentages, the astigmatism angle is measured as 45 degrees minus the internal angle, and
 * resolutions are stored as reciprocals. Internally, defocus is U and V in Angstrom, amplitude
 * contrasts are fractions and resolutions are direct.
 *
 * @author Michael J. Schnieders
 */
public class CterConverter {

  private static final Logger logger = Logger.getLogger(CterConverter.class.getName());

  /**
   * Offset between the on-disk and the internal astigmatism angle.
   */
  public static final double ANGLE_OFFSET = 45.0;

  /**
   * Resolution fields that fall back to the Nyquist value, in evaluation order.
   */
  private static final CtfField[] RESOLUTION_FIELDS = {
      CtfField.RESOLUTION_LIMIT_DEFOCUS,
      CtfField.RESOLUTION_LIMIT_DEFOCUS_ASTIG,
      CtfField.MAX_RESOLUTION
  };

  private final CterDialect dialect;
  private final int digits;

  /**
   * Constructor.
   *
   * @param dialect the column vocabulary.
   * @param digits  decimal digits kept on output.
   */
  public CterConverter(CterDialect dialect, int digits) {
    this.dialect = dialect;
    this.digits = digits;
  }

  public CterDialect getDialect() {
    return dialect;
  }

  /**
   * Convert an on-disk table to the internal convention. Defocus U and V become the first columns.
   *
   * @param raw columns named by the dialect.
   * @return a new Table.
   * @throws SchemaResolutionException if the defocus or astigmatism amplitude is missing.
   */
  public Table toInternal(Table raw) {
    Table table = raw;
    table = scale(table, CtfField.AMPLITUDE_CONTRAST, 0.01);
    table = scale(table, CtfField.TOTAL_AC, 0.01);

    String angle = CtfField.ASTIGMATISM_ANGLE.getName(dialect);
    if (table.hasColumn(angle)) {
      double[] values = affine(table.getColumn(angle).toDoubles(), -1.0, ANGLE_OFFSET);
      table = table.withColumn(Column.ofDoubles(angle, normalizeAngles(values)));
    }

    for (CtfField field : new CtfField[] {CtfField.NYQUIST, CtfField.RESOLUTION_LIMIT_DEFOCUS_ASTIG,
        CtfField.RESOLUTION_LIMIT_DEFOCUS, CtfField.MAX_RESOLUTION}) {
      table = invert(table, field);
    }

    String defocus = CtfField.DEFOCUS.getName(dialect);
    String astigmatism = CtfField.ASTIGMATISM_AMPLITUDE.getName(dialect);
    requireColumns(table, defocus, astigmatism);
    double[][] uv = toDefocusUV(table.getColumn(defocus).toDoubles(), table.getColumn(astigmatism).toDoubles());
    List<Column> first = new ArrayList<>(2);
    first.add(Column.ofDoubles(CtfField.DEFOCUS_U.getName(dialect), uv[0]));
    first.add(Column.ofDoubles(CtfField.DEFOCUS_V.getName(dialect), uv[1]));
    return table.drop(List.of(defocus, astigmatism)).prepend(first);
  }

  /**
   * Convert an internal table to the on-disk convention. The result has every dialect column, in
   * order. Columns the input lacks are zero, or derived as described for each field.
   *
   * @param internal internal columns.
   * @return a new Table, rounded.
   * @throws SchemaResolutionException if defocus U or V is missing, or if the Nyquist value must be
   *                                   derived and the pixel size is missing.
   */
  public Table fromInternal(Table internal) {
    String defocusU = CtfField.DEFOCUS_U.getName(dialect);
    String defocusV = CtfField.DEFOCUS_V.getName(dialect);
    requireColumns(internal, defocusU, defocusV);
    int rows = internal.getRowCount();
    double[][] defocus = toDefocusAstigmatism(
        internal.getColumn(defocusU).toDoubles(), internal.getColumn(defocusV).toDoubles());

    String defocusName = CtfField.DEFOCUS.getName(dialect);
    String astigmatismName = CtfField.ASTIGMATISM_AMPLITUDE.getName(dialect);
    List<Column> columns = new ArrayList<>(dialect.getColumns().size());
    List<String> missing = new ArrayList<>();
    for (String name : dialect.getColumns()) {
      if (name.equals(defocusName)) {
        columns.add(Column.ofDoubles(name, defocus[0]));
      } else if (name.equals(astigmatismName)) {
        columns.add(Column.ofDoubles(name, defocus[1]));
      } else if (internal.hasColumn(name)) {
        columns.add(internal.getColumn(name));
      } else {
        columns.add(Column.constant(name, 0L, rows));
        missing.add(name);
      }
    }
    if (!missing.isEmpty()) {
      logger.fine(format(" CTER columns not in the input: %s", missing));
    }
    Table cter = new Table(columns);

    cter = scale(cter, CtfField.AMPLITUDE_CONTRAST, 100.0);

    String angle = CtfField.ASTIGMATISM_ANGLE.getName(dialect);
    double[] angles = affine(cter.getColumn(angle).toDoubles(), -1.0, ANGLE_OFFSET);
    cter = cter.withColumn(Column.ofDoubles(angle, normalizeAngles(angles)));

    String totalAc = CtfField.TOTAL_AC.getName(dialect);
    if (internal.hasColumn(totalAc)) {
      cter = scale(cter, CtfField.TOTAL_AC, 100.0);
    } else {
      double[] ac = cter.getColumn(CtfField.AMPLITUDE_CONTRAST.getName(dialect)).toDoubles();
      double[] phaseShift = cter.getColumn(CtfField.PHASE_SHIFT.getName(dialect)).toDoubles();
      cter = cter.withColumn(Column.ofDoubles(totalAc, totalAmplitudeContrast(ac, phaseShift)));
    }

    String nyquist = CtfField.NYQUIST.getName(dialect);
    if (internal.hasColumn(nyquist)) {
      cter = invert(cter, CtfField.NYQUIST);
    } else {
      String pixelSize = CtfField.PIXEL_SIZE.getName(dialect);
      if (!internal.hasColumn(pixelSize)) {
        throw new SchemaResolutionException("Nyquist frequency needs the pixel size", List.of(nyquist, pixelSize));
      }
      double[] frequency = reciprocal(affine(internal.getColumn(pixelSize).toDoubles(), 2.0, 0.0));
      cter = cter.withColumn(Column.ofDoubles(nyquist, frequency));
    }
    Column nyquistColumn = cter.getColumn(nyquist);

    for (CtfField field : RESOLUTION_FIELDS) {
      String name = field.getName(dialect);
      if (name == null) {
        continue;
      }
      if (internal.hasColumn(name)) {
        cter = invert(cter, field);
      } else {
        cter = cter.withColumn(nyquistColumn.rename(name));
      }
    }

    return cter.round(digits);
  }

  private Table scale(Table table, CtfField field, double factor) {
    String name = field.getName(dialect);
    if (name == null || !table.hasColumn(name)) {
      return table;
    }
    return table.withColumn(Column.ofDoubles(name, affine(table.getColumn(name).toDoubles(), factor, 0.0)));
  }

  private Table invert(Table table, CtfField field) {
    String name = field.getName(dialect);
    if (name == null || !table.hasColumn(name)) {
      return table;
    }
    return table.withColumn(Column.ofDoubles(name, reciprocal(table.getColumn(name).toDoubles())));
  }

  private static void requireColumns(Table table, String... names) {
    List<String> missing = new ArrayList<>();
    for (String name : names) {
      if (!table.hasColumn(name)) {
        missing.add(name);
      }
    }
    if (!missing.isEmpty()) {
      throw new SchemaResolutionException("Missing CTF field", missing);
    }
  }
}
