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

import emx.transform.SchemaResolutionException;
import emx.utilities.Version;
import emx.utilities.VersionFormatException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * The known key set versions of one file family, oldest first.
 *
 * <p>Version names end in a release number, such as "relion_3". The registry orders its key sets
 * by that number, whatever order they are configured in. A registry is built once and handed to
 * the filters that need it.
 *
 * @author Michael J. Schnieders
 */
public class KeyRegistry {

  private static final Logger logger = Logger.getLogger(KeyRegistry.class.getName());

  /**
   * Bundled STAR key set versions, oldest first.
   */
  public static final List<String> STAR_VERSIONS = List.of("relion_2", "relion_3");

  private static final Map<List<String>, KeyRegistry> starRegistries = new LinkedHashMap<>();

  private static final Pattern RELEASE = Pattern.compile(".*?(\\d+(?:\\.\\d+)*)$");

  private final Map<String, KeyDictionary> dictionaries;

  /**
   * Constructor.
   *
   * @param dictionaries one dictionary per version, in any order.
   * @throws IllegalArgumentException if there are none, if a version is repeated, or if a
   *                                  version name does not end in a release number.
   */
  public KeyRegistry(List<KeyDictionary> dictionaries) {
    if (dictionaries.isEmpty()) {
      throw new IllegalArgumentException(" A key registry needs at least one version.");
    }
    List<KeyDictionary> sorted = new ArrayList<>(dictionaries);
    sorted.sort(Comparator.comparing(dictionary -> releaseOf(dictionary.getVersion())));
    if (!sorted.equals(dictionaries) && logger.isLoggable(Level.FINE)) {
      logger.fine(" Key set versions were reordered oldest first.");
    }
    Map<String, KeyDictionary> map = new LinkedHashMap<>();
    for (KeyDictionary dictionary : sorted) {
      if (map.put(dictionary.getVersion(), dictionary) != null) {
        throw new IllegalArgumentException(format(" Key set %s registered twice.", dictionary.getVersion()));
      }
    }
    this.dictionaries = Collections.unmodifiableMap(map);
  }

  /**
   * The release number at the end of a version name.
   *
   * @param version a version name such as "relion_3".
   * @return the release.
   * @throws IllegalArgumentException if the name does not end in a release number.
   */
  static Version releaseOf(String version) {
    Matcher matcher = RELEASE.matcher(version);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(format(" Key set %s does not end in a release number.", version));
    }
    return Version.parse(matcher.group(1));
  }

  /**
   * Load bundled STAR key sets named "star_keys_[version].txt".
   *
   * @param versions the versions, in any order.
   * @return the registry.
   * @throws IOException if a resource is missing or malformed.
   */
  public static KeyRegistry fromResources(List<String> versions) throws IOException {
    List<KeyDictionary> list = new ArrayList<>(versions.size());
    for (String version : versions) {
      List<String> keys = KeyDefinitions.loadResource("star_keys_" + version + ".txt");
      list.add(new KeyDictionary(version, keys));
    }
    return new KeyRegistry(list);
  }

  /**
   * The bundled STAR key sets. Parsed key sets are kept for the life of the process.
   *
   * @param versions the versions, in any order.
   * @return the registry.
   * @throws IOException if a resource is missing or malformed.
   */
  public static synchronized KeyRegistry starRegistry(List<String> versions) throws IOException {
    List<String> key = List.copyOf(versions);
    KeyRegistry registry = starRegistries.get(key);
    if (registry == null) {
      registry = fromResources(key);
      starRegistries.put(key, registry);
    }
    return registry;
  }

  /**
   * Version names, oldest first.
   *
   * @return the versions.
   */
  public List<String> getVersions() {
    return new ArrayList<>(dictionaries.keySet());
  }

  /**
   * The newest version.
   *
   * @return the version name.
   */
  public String getNewestVersion() {
    List<String> versions = getVersions();
    return versions.get(versions.size() - 1);
  }

  /**
   * Look up the dictionary of a version.
   *
   * @param version the version name.
   * @return the dictionary.
   * @throws VersionFormatException if the version is not registered.
   */
  public KeyDictionary getDictionary(String version) {
    KeyDictionary dictionary = dictionaries.get(version);
    if (dictionary == null) {
      throw new VersionFormatException("Unknown key set", version, getVersions());
    }
    return dictionary;
  }

  /**
   * Find the newest version whose key set explains every field of a header.
   *
   * @param header header fields such as "_rlnMicrographName".
   * @return the version name.
   * @throws SchemaResolutionException if a field is not known to any remaining version.
   */
  public String detectVersion(List<String> header) {
    List<KeyDictionary> candidates = new ArrayList<>(dictionaries.values());
    for (String field : header) {
      List<KeyDictionary> remaining = new ArrayList<>(candidates.size());
      for (KeyDictionary dictionary : candidates) {
        if (dictionary.accepts(field)) {
          remaining.add(dictionary);
        }
      }
      if (remaining.isEmpty()) {
        throw new SchemaResolutionException("Key not known", List.of(field));
      }
      if (logger.isLoggable(Level.FINE) && remaining.size() < candidates.size()) {
        logger.fine(format(" Field %s leaves %d candidate key sets.", field, remaining.size()));
      }
      candidates = remaining;
    }
    return candidates.get(candidates.size() - 1).getVersion();
  }

  /**
   * Translate header fields into internal names.
   *
   * @param header  header fields such as "_rlnMicrographName".
   * @param version the version of the header.
   * @return the internal names.
   * @throws SchemaResolutionException if a field is not known to the version.
   */
  public List<String> importHeader(List<String> header, String version) {
    KeyDictionary dictionary = getDictionary(version);
    List<String> names = new ArrayList<>(header.size());
    for (String field : header) {
      String internal = dictionary.getImportMap().get(dictionary.stripPrefix(field));
      if (internal == null) {
        throw new SchemaResolutionException(format("Key not known to %s", version), List.of(field));
      }
      names.add(internal);
    }
    return names;
  }

  /**
   * Translate internal names into the on-disk names of a version, dropping names it does not know.
   *
   * @param fields  internal names.
   * @param version the target version.
   * @return the export header.
   * @throws SchemaResolutionException if no field is known to the version.
   */
  public ExportHeader exportHeader(List<String> fields, String version) {
    KeyDictionary dictionary = getDictionary(version);
    Map<String, String> exportMap = dictionary.getExportMap();
    List<String> names = new ArrayList<>();
    List<String> kept = new ArrayList<>();
    for (String field : fields) {
      String onDisk = exportMap.get(field);
      if (onDisk == null) {
        logger.fine(format(" Field %s is not part of key set %s and is dropped.", field, version));
        continue;
      }
      names.add(onDisk);
      kept.add(field);
    }
    if (names.isEmpty()) {
      throw new SchemaResolutionException(format("No field is known to key set %s", version), fields);
    }
    return new ExportHeader(names, kept, dictionary.getPrefix());
  }
}
