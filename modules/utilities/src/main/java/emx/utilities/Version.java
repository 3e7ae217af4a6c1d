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
package emx.utilities;

import java.util.Arrays;
import java.util.List;

import static java.lang.String.format;

/**
 * A dot separated tuple of non-negative integers, ordered component by component.
 *
 * @author Michael J. Schnieders
 */
public final class Version implements Comparable<Version> {

  private final String text;
  private final int[] components;

  private Version(String text, int[] components) {
    this.text = text;
    this.components = components;
  }

  /**
   * Parse a version string such as "4.1.0".
   *
   * @param text the version string.
   * @return the Version.
   * @throws VersionFormatException if any component is not a non-negative integer.
   */
  public static Version parse(String text) {
    if (text == null || text.isBlank()) {
      throw new VersionFormatException("Empty version", String.valueOf(text), List.of());
    }
    String[] tokens = text.trim().split("\\.", -1);
    int[] components = new int[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      if (!tokens[i].matches("\\d+")) {
        throw new VersionFormatException("Version components must be non-negative integers", text, List.of());
      }
      try {
        components[i] = Integer.parseInt(tokens[i]);
      } catch (NumberFormatException e) {
        throw new VersionFormatException(format("Version component %s is too large", tokens[i]), text, List.of());
      }
    }
    return new Version(text.trim(), components);
  }

  /**
   * Number of components.
   *
   * @return the arity.
   */
  public int arity() {
    return components.length;
  }

  /**
   * Get one component.
   *
   * @param i index of the component.
   * @return the component value.
   */
  public int getComponent(int i) {
    return components[i];
  }

  @Override
  public int compareTo(Version other) {
    return Arrays.compare(components, other.components);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.equals(components, ((Version) o).components);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(components);
  }

  @Override
  public String toString() {
    return text;
  }
}
