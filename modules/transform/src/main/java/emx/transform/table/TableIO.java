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

import emx.transform.InputFormatException;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Reads and writes whitespace delimited tables.
 *
 * @author Michael J. Schnieders
 */
public class TableIO {

  private static final Logger logger = Logger.getLogger(TableIO.class.getName());

  private TableIO() {
    // Static methods only.
  }

  /**
   * Read a table.
   *
   * @param file    the file to read.
   * @param options names, skipped lines, comment character and kept columns.
   * @return the Table.
   * @throws IOException if the file cannot be read or the rows are ragged.
   */
  public static Table read(File file, ReadOptions options) throws IOException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    return parse(lines, options, file.getName());
  }

  /**
   * Parse table rows from lines of text.
   *
   * @param lines   the lines.
   * @param options names, skipped lines, comment character and kept columns.
   * @param source  name of the source, used in error messages.
   * @return the Table.
   * @throws InputFormatException if the rows are ragged or the names do not fit.
   */
  public static Table parse(List<String> lines, ReadOptions options, String source) throws InputFormatException {
    Character comment = options.getComment();
    List<String[]> rows = new ArrayList<>();
    int width = -1;
    for (int i = options.getSkipRows(); i < lines.size(); i++) {
      String line = lines.get(i);
      if (comment != null) {
        int index = line.indexOf(comment);
        if (index >= 0) {
          line = line.substring(0, index);
        }
      }
      line = line.trim();
      if (line.isEmpty()) {
        continue;
      }
      String[] tokens = line.split("\\s+");
      if (width < 0) {
        width = tokens.length;
      } else if (tokens.length != width) {
        throw new InputFormatException(
            format("Line %d has %d columns, expected %d", i + 1, tokens.length, width), source);
      }
      rows.add(tokens);
    }

    int[] use = options.getUseColumns();
    if (use == null) {
      use = new int[Math.max(width, 0)];
      for (int i = 0; i < use.length; i++) {
        use[i] = i;
      }
      if (width < 0 && options.getNames() != null) {
        use = new int[options.getNames().size()];
      }
    }
    for (int index : use) {
      if (width >= 0 && index >= width) {
        throw new InputFormatException(format("Column %d requested from %d columns", index, width), source);
      }
    }

    List<String> names = options.getNames();
    if (names == null) {
      names = new ArrayList<>();
      for (int index : use) {
        names.add(Integer.toString(index));
      }
    } else if (names.size() != use.length) {
      throw new InputFormatException(format("%d names given for %d columns", names.size(), use.length), source);
    }

    List<Column> columns = new ArrayList<>(use.length);
    for (int c = 0; c < use.length; c++) {
      List<String> tokens = new ArrayList<>(rows.size());
      for (String[] row : rows) {
        tokens.add(row[use[c]]);
      }
      columns.add(Column.parse(names.get(c), tokens));
    }
    return new Table(columns);
  }

  /**
   * Write a table as tab separated rows, after an optional header.
   *
   * @param file     the file to write.
   * @param table    the data.
   * @param header   header entries, or null for none.
   * @param vertical write one header entry per line, instead of one tab separated line.
   * @throws IOException if the table is empty or the file cannot be written.
   */
  public static void write(File file, Table table, List<String> header, boolean vertical) throws IOException {
    if (table.isEmpty()) {
      throw new InputFormatException("Cannot write empty data", file.getName());
    }
    String orientation = vertical ? "\n" : "\t";
    List<Column> columns = table.getColumns();
    try (BufferedWriter bw = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
      if (header != null) {
        bw.write(String.join(orientation, header));
        bw.write('\n');
      }
      StringBuilder sb = new StringBuilder();
      for (int row = 0; row < table.getRowCount(); row++) {
        sb.setLength(0);
        for (int c = 0; c < columns.size(); c++) {
          if (c > 0) {
            sb.append('\t');
          }
          sb.append(columns.get(c).getString(row));
        }
        bw.write(sb.toString());
        bw.write('\n');
      }
    }
    logger.fine(format(" Wrote %d rows of %d columns to %s.", table.getRowCount(), columns.size(), file));
  }

  /**
   * Build header entries.
   *
   * @param names   the names.
   * @param indexed append " #i" with a 1-based column index.
   * @return the header entries.
   * @throws InputFormatException if there are no names.
   */
  public static List<String> createHeader(List<String> names, boolean indexed) throws InputFormatException {
    if (names.isEmpty()) {
      throw new InputFormatException("Cannot create header from empty sequence");
    }
    List<String> header = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      header.add(indexed ? format("%s #%d", names.get(i), i + 1) : names.get(i));
    }
    return header;
  }
}
