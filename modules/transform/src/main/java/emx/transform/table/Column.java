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

import org.apache.commons.math3.util.Precision;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;

/**
 * An immutable named column of values that share one {@link ColumnType}.
 *
 * @author Michael J. Schnieders
 */
public final class Column {

  private final String name;
  private final ColumnType type;
  private final List<Object> values;

  private Column(String name, ColumnType type, List<Object> values) {
    this.name = Objects.requireNonNull(name, "Column name");
    this.type = type;
    this.values = Collections.unmodifiableList(values);
  }

  /**
   * Create a column of integers.
   *
   * @param name   column name.
   * @param values the values.
   * @return the Column.
   */
  public static Column ofLongs(String name, long... values) {
    List<Object> list = new ArrayList<>(values.length);
    for (long v : values) {
      list.add(v);
    }
    return new Column(name, ColumnType.LONG, list);
  }

  /**
   * Create a column of floating point values.
   *
   * @param name   column name.
   * @param values the values.
   * @return the Column.
   */
  public static Column ofDoubles(String name, double... values) {
    List<Object> list = new ArrayList<>(values.length);
    for (double v : values) {
      list.add(v);
    }
    return new Column(name, ColumnType.DOUBLE, list);
  }

  /**
   * Create a column of flags.
   *
   * @param name   column name.
   * @param values the values.
   * @return the Column.
   */
  public static Column ofBooleans(String name, boolean... values) {
    List<Object> list = new ArrayList<>(values.length);
    for (boolean v : values) {
      list.add(v);
    }
    return new Column(name, ColumnType.BOOLEAN, list);
  }

  /**
   * Create a column of strings.
   *
   * @param name   column name.
   * @param values the values.
   * @return the Column.
   */
  public static Column ofStrings(String name, List<String> values) {
    return new Column(name, ColumnType.STRING, new ArrayList<>(values));
  }

  /**
   * Create a column of strings.
   *
   * @param name   column name.
   * @param values the values.
   * @return the Column.
   */
  public static Column ofStrings(String name, String... values) {
    return ofStrings(name, Arrays.asList(values));
  }

  /**
   * Create a column that repeats one value.
   *
   * @param name  column name.
   * @param value a Long, Double, Boolean or String.
   * @param rows  number of rows.
   * @return the Column.
   */
  public static Column constant(String name, Object value, int rows) {
    ColumnType type = typeOf(value);
    if (value instanceof Integer) {
      value = ((Integer) value).longValue();
    } else if (value instanceof Float) {
      value = ((Float) value).doubleValue();
    }
    return new Column(name, type, new ArrayList<>(Collections.nCopies(rows, value)));
  }

  /**
   * Create a column from cell text, inferring the narrowest type that holds every cell.
   *
   * @param name   column name.
   * @param tokens the text of each cell.
   * @return the Column.
   */
  public static Column parse(String name, List<String> tokens) {
    ColumnType type = ColumnType.infer(tokens);
    List<Object> list = new ArrayList<>(tokens.size());
    for (String token : tokens) {
      list.add(type.parse(token));
    }
    return new Column(name, type, list);
  }

  /**
   * Type of a boxed cell value.
   *
   * @param value a Long, Integer, Double, Boolean or String.
   * @return the ColumnType.
   */
  public static ColumnType typeOf(Object value) {
    if (value instanceof Long || value instanceof Integer) {
      return ColumnType.LONG;
    } else if (value instanceof Double || value instanceof Float) {
      return ColumnType.DOUBLE;
    } else if (value instanceof Boolean) {
      return ColumnType.BOOLEAN;
    } else if (value instanceof String) {
      return ColumnType.STRING;
    }
    throw new IllegalArgumentException(format(" Unsupported cell value %s.", value));
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public int size() {
    return values.size();
  }

  /**
   * Get one cell.
   *
   * @param row the row.
   * @return the boxed value.
   */
  public Object get(int row) {
    return values.get(row);
  }

  /**
   * Get one numeric cell as a double.
   *
   * @param row the row.
   * @return the value.
   * @throws IllegalStateException if the column is not numeric.
   */
  public double getDouble(int row) {
    checkNumeric();
    return ((Number) values.get(row)).doubleValue();
  }

  /**
   * Get one numeric cell as a long.
   *
   * @param row the row.
   * @return the value.
   * @throws IllegalStateException if the column is not LONG.
   */
  public long getLong(int row) {
    if (type != ColumnType.LONG) {
      throw new IllegalStateException(format(" Column %s holds %s values, not integers.", name, type));
    }
    return (Long) values.get(row);
  }

  /**
   * Get one cell as text.
   *
   * @param row the row.
   * @return the text written for the cell.
   */
  public String getString(int row) {
    Object value = values.get(row);
    if (value instanceof Double) {
      return Double.toString((Double) value);
    }
    return String.valueOf(value);
  }

  /**
   * Copy the values into a double array.
   *
   * @return the values.
   * @throws IllegalStateException if the column is not numeric.
   */
  public double[] toDoubles() {
    checkNumeric();
    double[] out = new double[values.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = ((Number) values.get(i)).doubleValue();
    }
    return out;
  }

  /**
   * Copy the values into a long array.
   *
   * @return the values.
   */
  public long[] toLongs() {
    long[] out = new long[values.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = getLong(i);
    }
    return out;
  }

  /**
   * The same values under another name.
   *
   * @param newName the new name.
   * @return a new Column.
   */
  public Column rename(String newName) {
    return new Column(newName, type, new ArrayList<>(values));
  }

  /**
   * Repeat the value of a single row column.
   *
   * @param rows number of rows.
   * @return a new Column.
   */
  public Column broadcast(int rows) {
    if (values.size() != 1) {
      throw new IllegalStateException(format(" Column %s has %d rows; only single values broadcast.", name, values.size()));
    }
    return constant(name, values.get(0), rows);
  }

  /**
   * Round floating point values. Other types are returned unchanged.
   *
   * @param digits decimal digits kept.
   * @return the rounded Column.
   */
  public Column round(int digits) {
    if (type != ColumnType.DOUBLE) {
      return this;
    }
    double[] rounded = toDoubles();
    for (int i = 0; i < rounded.length; i++) {
      if (Double.isFinite(rounded[i])) {
        rounded[i] = Precision.round(rounded[i], digits);
      }
    }
    return ofDoubles(name, rounded);
  }

  private void checkNumeric() {
    if (!type.isNumeric()) {
      throw new IllegalStateException(format(" Column %s holds %s values, not numbers.", name, type));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Column column = (Column) o;
    return name.equals(column.name) && type == column.type && values.equals(column.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, values);
  }

  @Override
  public String toString() {
    return format("%s (%s, %d rows)", name, type, values.size());
  }
}
