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

import emx.transform.DuplicateKeyException;
import emx.transform.SchemaResolutionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;

/**
 * An immutable, ordered set of equal length named columns.
 *
 * <p>Column order determines the on-disk column index. Every operation returns a new Table.
 *
 * @author Michael J. Schnieders
 */
public final class Table {

  private static final Table EMPTY = new Table(Collections.emptyList());

  private final List<Column> columns;
  private final Map<String, Column> byName;
  private final int rows;

  /**
   * Constructor.
   *
   * @param columns the columns, in order.
   * @throws DuplicateKeyException    if two columns share a name.
   * @throws IllegalArgumentException if the columns differ in length.
   */
  public Table(List<Column> columns) {
    Map<String, Column> map = new LinkedHashMap<>();
    int n = columns.isEmpty() ? 0 : columns.get(0).size();
    for (Column column : columns) {
      if (map.put(column.getName(), column) != null) {
        throw new DuplicateKeyException("Column name used twice", column.getName());
      }
      if (column.size() != n) {
        throw new IllegalArgumentException(
            format(" Column %s has %d rows, expected %d.", column.getName(), column.size(), n));
      }
    }
    this.columns = List.copyOf(columns);
    this.byName = Collections.unmodifiableMap(map);
    this.rows = n;
  }

  /**
   * Create a Table from columns.
   *
   * @param columns the columns, in order.
   * @return the Table.
   */
  public static Table of(Column... columns) {
    return new Table(Arrays.asList(columns));
  }

  /**
   * The Table without columns.
   *
   * @return the empty Table.
   */
  public static Table empty() {
    return EMPTY;
  }

  public int getRowCount() {
    return rows;
  }

  public int getColumnCount() {
    return columns.size();
  }

  /**
   * Check if the table has no columns or no rows.
   *
   * @return true if there is nothing to write.
   */
  public boolean isEmpty() {
    return columns.isEmpty() || rows == 0;
  }

  public List<Column> getColumns() {
    return columns;
  }

  /**
   * Column names in order.
   *
   * @return the names.
   */
  public List<String> getColumnNames() {
    return new ArrayList<>(byName.keySet());
  }

  public boolean hasColumn(String name) {
    return byName.containsKey(name);
  }

  /**
   * Look up a column.
   *
   * @param name the column name.
   * @return the Column.
   * @throws SchemaResolutionException if there is no such column.
   */
  public Column getColumn(String name) {
    Column column = byName.get(name);
    if (column == null) {
      throw new SchemaResolutionException("Missing field", List.of(name));
    }
    return column;
  }

  /**
   * Keep the named columns, in the given order.
   *
   * @param names the names to keep.
   * @return a new Table.
   */
  public Table select(List<String> names) {
    List<Column> selected = new ArrayList<>(names.size());
    for (String name : names) {
      selected.add(getColumn(name));
    }
    return new Table(selected);
  }

  /**
   * Remove columns. Names that are not present are ignored.
   *
   * @param names the names to remove.
   * @return a new Table.
   */
  public Table drop(Collection<String> names) {
    Set<String> remove = new HashSet<>(names);
    List<Column> kept = new ArrayList<>();
    for (Column column : columns) {
      if (!remove.contains(column.getName())) {
        kept.add(column);
      }
    }
    return new Table(kept);
  }

  /**
   * Replace the column of the same name in place, or append the column.
   *
   * @param column the column.
   * @return a new Table.
   */
  public Table withColumn(Column column) {
    List<Column> list = new ArrayList<>(columns);
    boolean replaced = false;
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i).getName().equals(column.getName())) {
        list.set(i, column);
        replaced = true;
        break;
      }
    }
    if (!replaced) {
      list.add(column);
    }
    return new Table(list);
  }

  /**
   * Put columns in front of the existing ones.
   *
   * @param first the leading columns.
   * @return a new Table.
   */
  public Table prepend(List<Column> first) {
    List<Column> list = new ArrayList<>(first);
    list.addAll(columns);
    return new Table(list);
  }

  /**
   * Rename every column.
   *
   * @param names the new names, one per column.
   * @return a new Table.
   */
  public Table renameColumns(List<String> names) {
    if (names.size() != columns.size()) {
      throw new IllegalArgumentException(
          format(" %d names given for %d columns.", names.size(), columns.size()));
    }
    List<Column> list = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      list.add(columns.get(i).rename(names.get(i)));
    }
    return new Table(list);
  }

  /**
   * Repeat the single row of this table.
   *
   * @param n number of rows.
   * @return a new Table.
   */
  public Table broadcast(int n) {
    List<Column> list = new ArrayList<>(columns.size());
    for (Column column : columns) {
      list.add(column.broadcast(n));
    }
    return new Table(list);
  }

  /**
   * Place the columns of another table after those of this table. A single row table is repeated
   * to match the number of rows of this table.
   *
   * @param other the table to append.
   * @return a new Table.
   */
  public Table concat(Table other) {
    Table right = other;
    if (other.rows == 1 && rows != 1 && !columns.isEmpty()) {
      right = other.broadcast(rows);
    }
    List<Column> list = new ArrayList<>(columns);
    list.addAll(right.columns);
    return new Table(list);
  }

  /**
   * Round every floating point column.
   *
   * @param digits decimal digits kept.
   * @return a new Table.
   */
  public Table round(int digits) {
    List<Column> list = new ArrayList<>(columns.size());
    for (Column column : columns) {
      list.add(column.round(digits));
    }
    return new Table(list);
  }

  /**
   * Values of one row, keyed by column name.
   *
   * @param row the row.
   * @return the row values.
   */
  public Map<String, Object> getRow(int row) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Column column : columns) {
      map.put(column.getName(), column.get(row));
    }
    return map;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return columns.equals(((Table) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return format("Table %d x %d %s", rows, columns.size(), byName.keySet());
  }
}
