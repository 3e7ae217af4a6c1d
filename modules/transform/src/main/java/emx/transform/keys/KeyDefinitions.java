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

import emx.transform.InputFormatException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;

/**
 * Reads key definition resources: one key per line, with "#" starting a comment.
 *
 * @author Michael J. Schnieders
 */
public class KeyDefinitions {

  /**
   * Classpath folder of the bundled key definitions.
   */
  public static final String RESOURCE_PATH = "emx/transform/keys/";

  private KeyDefinitions() {
    // Static methods only.
  }

  /**
   * Read key definitions from a file.
   *
   * @param file the key definition file.
   * @return the raw keys, in order.
   * @throws IOException if the file cannot be read or a key contains whitespace.
   */
  public static List<String> load(File file) throws IOException {
    try (BufferedReader br = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return load(br, file.getName());
    }
  }

  /**
   * Read bundled key definitions.
   *
   * @param name resource name relative to {@link #RESOURCE_PATH}.
   * @return the raw keys, in order.
   * @throws IOException if the resource is missing, cannot be read or a key contains whitespace.
   */
  public static List<String> loadResource(String name) throws IOException {
    String path = RESOURCE_PATH + name;
    InputStream stream = KeyDefinitions.class.getClassLoader().getResourceAsStream(path);
    if (stream == null) {
      throw new IOException(format("Key definition resource %s was not found", path));
    }
    try (BufferedReader br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      return load(br, path);
    }
  }

  /**
   * Read key definitions.
   *
   * @param br     the reader.
   * @param source name of the source, used in error messages.
   * @return the raw keys, in order.
   * @throws IOException if a key contains whitespace.
   */
  public static List<String> load(BufferedReader br, String source) throws IOException {
    List<String> keys = new ArrayList<>();
    String line;
    int lineNumber = 0;
    while ((line = br.readLine()) != null) {
      lineNumber++;
      int comment = line.indexOf('#');
      if (comment >= 0) {
        line = line.substring(0, comment);
      }
      String key = line.trim();
      if (key.isEmpty()) {
        continue;
      }
      if (key.matches(".*\\s.*")) {
        throw new InputFormatException(format("Whitespace in key '%s' on line %d", key, lineNumber), source);
      }
      keys.add(key);
    }
    return keys;
  }
}
