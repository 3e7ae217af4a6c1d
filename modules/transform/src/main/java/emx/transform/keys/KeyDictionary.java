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
package emx.transform.keys;

import emx.transform.DuplicateKeyException;
import emx.transform.InputFormatException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * Field names of one key set version, mapped between the internal and the on-disk vocabulary.
 *
 * <p>Raw keys are either {@code internal} (the on-disk name is the same) or
 * {@code internal:on_disk}. The reserved key {@code STAR_PREFIX[:prefix]} gives the namespace
 * prefix of the on-disk names.
 *
 * @author Michael J. Schnieders
 */
public class KeyDictionary {

  /**
   * Reserved key holding the namespace prefix.
   */
  public static final String STAR_PREFIX = "STAR_PREFIX";

  private final String version;
  private final String prefix;
  private final Map<String, String> importMap;
  private final Map<String, String> exportMap;

  /**
   * Build the dictionary of one version.
   *
   * @param version the version name.
   * @param rawKeys the raw keys.
   * @throws InputFormatException  if a key is malformed or the prefix is missing.
   * @throws DuplicateKeyException if two keys map to the same name.
   */
  public KeyDictionary(String version, List<String> rawKeys) throws InputFormatException {
    this.version = version;
    Map<String, String> imports = parseKeys(rawKeys, false);
    Map<String, String> exports = parseKeys(rawKeys, true);
    if (!imports.containsKey(STAR_PREFIX)) {
      throw new InputFormatException(format("Key set %s does not define %s", version, STAR_PREFIX));
    }
    prefix = imports.remove(STAR_PREFIX);
    exports.remove(STAR_PREFIX);
    importMap = Collections.unmodifiableMap(imports);
    exportMap = Collections.unmodifiableMap(exports);
  }

  /**
   * Map raw keys in one direction.
   *
   * @param rawKeys the raw keys.
   * @param export  true for internal name to on-disk name, false for on-disk name to internal name.
   * @return the map, in key order. {@link #STAR_PREFIX} always maps to the prefix.
   * @throws InputFormatException  if a key has more than one separator or an empty part.
   * @throws DuplicateKeyException if two keys produce the same map key.
   */
  public static Map<String, String> parseKeys(List<String> rawKeys, boolean export) throws InputFormatException {
    Map<String, String> map = new LinkedHashMap<>();
    for (String raw : rawKeys) {
      String[] parts = raw.split(":", -1);
      if (parts.length > 2 || parts[0].isEmpty() || (parts.length == 2 && parts[1].isEmpty() && !parts[0].equals(STAR_PREFIX))) {
        throw new InputFormatException(format("Malformed key '%s'", raw));
      }
      String key;
      String value;
      if (parts[0].equals(STAR_PREFIX)) {
        key = STAR_PREFIX;
        value = parts.length == 2 ? parts[1] : "";
      } else {
        String internal = parts[0];
        String onDisk = parts.length == 2 ? parts[1] : parts[0];
        key = export ? internal : onDisk;
        value = export ? onDisk : internal;
      }
      if (map.containsKey(key)) {
        throw new DuplicateKeyException(export ? "Internal name defined twice" : "On-disk name defined twice", key);
      }
      map.put(key, value);
    }
    return map;
  }

  public String getVersion() {
    return version;
  }

  public String getPrefix() {
    return prefix;
  }

  /**
   * On-disk name (without prefix) to internal name.
   *
   * @return the unmodifiable import map.
   */
  public Map<String, String> getImportMap() {
    return importMap;
  }

  /**
   * Internal name to on-disk name (without prefix).
   *
   * @return the unmodifiable export map.
   */
  public Map<String, String> getExportMap() {
    return exportMap;
  }

  /**
   * Remove the leading underscore and then the prefix of this version from a header field.
   *
   * @param field a header field such as "_rlnMicrographName".
   * @return the bare on-disk name.
   */
  public String stripPrefix(String field) {
    String name = field.startsWith("_") ? field.substring(1) : field;
    if (!prefix.isEmpty() && name.startsWith(prefix)) {
      name = name.substring(prefix.length());
    }
    return name;
  }

  /**
   * Check if a header field is known to this version.
   *
   * @param field a header field such as "_rlnMicrographName".
   * @return true if the field has an internal name.
   */
  public boolean accepts(String field) {
    return importMap.containsKey(stripPrefix(field));
  }

  @Override
  public String toString() {
    return format("%s (prefix '%s', %d keys)", version, prefix, importMap.size());
  }
}
