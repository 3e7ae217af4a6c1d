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

import java.util.regex.Pattern;

/**
 * Value type shared by every cell of a column.
 *
 * @author Michael J. Schnieders
 */
public enum ColumnType {
  LONG, DOUBLE, BOOLEAN, STRING;

  private static final Pattern LONG_PATTERN = Pattern.compile("[-+]?\\d+");
  private static final Pattern DOUBLE_PATTERN = Pattern.compile(
      "[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?|[-+]?(NaN|Infinity|nan|inf)");
  private static final Pattern BOOLEAN_PATTERN = Pattern.compile("(?i)true|false");

  /**
   * Check if values of this type take part in arithmetic.
   *
   * @return true for LONG and DOUBLE.
   */
  public boolean isNumeric() {
    return this == LONG || this == DOUBLE;
  }

  /**
   * Narrowest type that can hold every token.
   *
   * @param tokens the text of each cell.
   * @return the inferred type; STRING for an empty column.
   */
  public static ColumnType infer(Iterable<String> tokens) {
    boolean allLong = true;
    boolean allDouble = true;
    boolean allBoolean = true;
    boolean any = false;
    for (String token : tokens) {
      any = true;
      if (allLong && !isLong(token)) {
        allLong = false;
      }
      if (allDouble && !DOUBLE_PATTERN.matcher(token).matches()) {
        allDouble = false;
      }
      if (allBoolean && !BOOLEAN_PATTERN.matcher(token).matches()) {
        allBoolean = false;
      }
      if (!allLong && !allDouble && !allBoolean) {
        return STRING;
      }
    }
    if (!any) {
      return STRING;
    }
    if (allLong) {
      return LONG;
    } else if (allDouble) {
      return DOUBLE;
    }
    return BOOLEAN;
  }

  /**
   * Parse one token as this type.
   *
   * @param token the text of a cell.
   * @return the boxed value.
   * @throws NumberFormatException if the token does not parse.
   */
  public Object parse(String token) {
    switch (this) {
      case LONG:
        return Long.parseLong(token.startsWith("+") ? token.substring(1) : token);
      case DOUBLE:
        return parseDouble(token);
      case BOOLEAN:
        return Boolean.parseBoolean(token);
      default:
        return token;
    }
  }

  private static boolean isLong(String token) {
    if (!LONG_PATTERN.matcher(token).matches()) {
      return false;
    }
    try {
      Long.parseLong(token.startsWith("+") ? token.substring(1) : token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static double parseDouble(String token) {
    String t = token.startsWith("+") ? token.substring(1) : token;
    switch (t) {
      case "nan":
      case "-nan":
      case "-NaN":
        return Double.NaN;
      case "inf":
        return Double.POSITIVE_INFINITY;
      case "-inf":
        return Double.NEGATIVE_INFINITY;
      default:
        return Double.parseDouble(t);
    }
  }
}
