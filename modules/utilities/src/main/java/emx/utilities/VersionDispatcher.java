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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Selects a handler from a registry keyed by version string.
 *
 * <p>Without a request the newest handler is used. A request selects the handler with the greatest
 * version that does not exceed it. A request older than every registered version is an error.
 *
 * @param <T> the handler type.
 * @author Michael J. Schnieders
 */
public class VersionDispatcher<T> {

  private static final Logger logger = Logger.getLogger(VersionDispatcher.class.getName());

  private final List<Version> versions;
  private final List<T> handlers;
  private final List<String> knownVersions;
  private final int arity;

  /**
   * Build a dispatcher.
   *
   * @param registry handlers keyed by version string.
   * @throws VersionFormatException if the registry is empty, a key does not parse, or the keys
   *                                differ in arity.
   */
  public VersionDispatcher(Map<String, T> registry) {
    knownVersions = new ArrayList<>(registry.keySet());
    if (registry.isEmpty()) {
      throw new VersionFormatException("No versions registered", "", knownVersions);
    }
    Map<Version, T> byVersion = new TreeMap<>();
    List<Version> parsed = new ArrayList<>();
    for (Map.Entry<String, T> entry : registry.entrySet()) {
      Version v = Version.parse(entry.getKey());
      if (byVersion.put(v, entry.getValue()) != null) {
        throw new VersionFormatException("Version registered twice", entry.getKey(), knownVersions);
      }
      parsed.add(v);
    }
    arity = parsed.get(0).arity();
    for (Version v : parsed) {
      if (v.arity() != arity) {
        throw new VersionFormatException(
            format("Registered versions must all have %d components", arity), v.toString(), knownVersions);
      }
    }
    versions = List.copyOf(byVersion.keySet());
    handlers = Collections.unmodifiableList(new ArrayList<>(byVersion.values()));
  }

  /**
   * The registered versions in ascending order.
   *
   * @return the versions.
   */
  public List<Version> getVersions() {
    return versions;
  }

  /**
   * Resolve a requested version to a registered one.
   *
   * @param requested the requested version, or null for the newest.
   * @return the registered version that is used.
   * @throws VersionFormatException if the request does not parse, has the wrong arity, or is older
   *                                than every registered version.
   */
  public Version selectVersion(String requested) {
    return versions.get(selectIndex(requested));
  }

  /**
   * Resolve a requested version to its handler.
   *
   * @param requested the requested version, or null for the newest.
   * @return the handler.
   */
  public T select(String requested) {
    return handlers.get(selectIndex(requested));
  }

  private int selectIndex(String requested) {
    int n = versions.size();
    if (requested == null) {
      return n - 1;
    }
    Version version;
    try {
      version = Version.parse(requested);
    } catch (VersionFormatException e) {
      throw new VersionFormatException("Invalid version", requested, knownVersions);
    }
    if (version.arity() != arity) {
      throw new VersionFormatException(
          format("Version must have %d components", arity), requested, knownVersions);
    }

    // Leftmost insertion point of the request.
    int index = Collections.binarySearch(versions, version);
    if (index >= 0) {
      return index;
    }
    int insertion = -(index + 1);
    if (insertion == n) {
      logger.fine(format(" Version %s is newer than all known versions; using %s.", requested, versions.get(n - 1)));
      return n - 1;
    } else if (insertion == 0) {
      throw new VersionFormatException("Version too small", requested, knownVersions);
    }
    return insertion - 1;
  }
}
