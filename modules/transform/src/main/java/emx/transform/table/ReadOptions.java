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

import java.util.Arrays;
import java.util.List;

/**
 * Options for {@link TableIO#read(java.io.File, ReadOptions)}.
 *
 * @author Michael J. Schnieders
 */
public class ReadOptions {

  private List<String> names = null;
  private int skipRows = 0;
  private Character comment = null;
  private int[] useColumns = null;

  /**
   * Column names for the kept columns. Without names, columns are named by their index.
   *
   * @param names the names.
   * @return this ReadOptions.
   */
  public ReadOptions names(List<String> names) {
    this.names = List.copyOf(names);
    return this;
  }

  /**
   * Column names for the kept columns.
   *
   * @param names the names.
   * @return this ReadOptions.
   */
  public ReadOptions names(String... names) {
    return names(Arrays.asList(names));
  }

  /**
   * Number of leading lines to ignore.
   *
   * @param skipRows the number of lines.
   * @return this ReadOptions.
   */
  public ReadOptions skipRows(int skipRows) {
    this.skipRows = skipRows;
    return this;
  }

  /**
   * Character that starts a comment running to the end of the line.
   *
   * @param comment the comment character.
   * @return this ReadOptions.
   */
  public ReadOptions comment(char comment) {
    this.comment = comment;
    return this;
  }

  /**
   * Indices of the columns to keep, in order.
   *
   * @param useColumns the column indices.
   * @return this ReadOptions.
   */
  public ReadOptions useColumns(int... useColumns) {
    this.useColumns = useColumns.clone();
    return this;
  }

  public List<String> getNames() {
    return names;
  }

  public int getSkipRows() {
    return skipRows;
  }

  public Character getComment() {
    return comment;
  }

  public int[] getUseColumns() {
    return useColumns == null ? null : useColumns.clone();
  }
}
