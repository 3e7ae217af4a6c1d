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

import emx.utilities.VersionFormatException;

import java.util.ArrayList;
import java.util.List;

/**
 * Box file dialects, selected by name.
 *
 * @author Michael J. Schnieders
 */
public enum BoxFormat {
  EMAN1("eman1", List.of("CoordinateX", "CoordinateY", "box_x", "box_y"));

  private final String label;
  private final List<String> columns;

  BoxFormat(String label, List<String> columns) {
    this.label = label;
    this.columns = columns;
  }

  public String getLabel() {
    return label;
  }

  /**
   * Column names: corner x, corner y, box width, box height.
   *
   * @return the names.
   */
  public List<String> getColumns() {
    return columns;
  }

  /**
   * Select a dialect by name.
   *
   * @param name the dialect name, or null for eman1.
   * @return the BoxFormat.
   * @throws VersionFormatException for an unknown name.
   */
  public static BoxFormat parse(String name) {
    if (name == null) {
      return EMAN1;
    }
    List<String> known = new ArrayList<>();
    for (BoxFormat format : values()) {
      if (format.label.equalsIgnoreCase(name.trim())) {
        return format;
      }
      known.add(format.label);
    }
    throw new VersionFormatException("Unknown box file format", name, known);
  }
}
