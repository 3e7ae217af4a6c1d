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

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

import java.io.IOException;
import java.net.URL;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;

/**
 * Which XML tags to extract, and how their values are nested.
 *
 * <p>Tags are given in Clark notation, {@code {namespace}local}.
 *
 * @author Michael J. Schnieders
 */
public class XmlLevels {

  /**
   * Nesting of a value below its tag.
   */
  public enum Shape {
    /** A key element followed by a sibling value element. */
    KEY_VALUE("key_value", "xml.keyvalue"),
    /** {@code <tag>value</tag>}. */
    LEVEL_0("level 0", "xml.level0"),
    /** {@code <tag><sub>value</sub></tag>}. */
    LEVEL_1("level 1", "xml.level1"),
    /** {@code <tag><a><b><sub>value</sub></b></a></tag>}. */
    LEVEL_3("level 3", "xml.level3");

    private final String label;
    private final String property;

    Shape(String label, String property) {
      this.label = label;
      this.property = property;
    }

    public String getLabel() {
      return label;
    }

    public String getProperty() {
      return property;
    }
  }

  /**
   * Bundled configuration for Thermo Fisher EPU metadata files.
   */
  public static final String DEFAULT_RESOURCE = "emx/transform/parsers/xml_levels.properties";

  private final Map<Shape, Map<String, List<String>>> levels = new EnumMap<>(Shape.class);

  /**
   * Create an empty configuration.
   */
  public XmlLevels() {
    for (Shape shape : Shape.values()) {
      levels.put(shape, new LinkedHashMap<>());
    }
  }

  /**
   * Tag in Clark notation.
   *
   * @param namespace the namespace URI, or null.
   * @param local     the local name.
   * @return "{namespace}local", or the local name without a namespace.
   */
  public static String clark(String namespace, String local) {
    if (namespace == null || namespace.isEmpty()) {
      return local;
    }
    return "{" + namespace + "}" + local;
  }

  /**
   * Add a tag to extract.
   *
   * @param shape      the nesting of its values.
   * @param tag        the tag, in Clark notation.
   * @param searchKeys sub-tags holding values; for KEY_VALUE, the value tag.
   * @return this XmlLevels.
   */
  public XmlLevels add(Shape shape, String tag, String... searchKeys) {
    if (shape == Shape.KEY_VALUE && searchKeys.length != 1) {
      throw new IllegalArgumentException(format(" Key/value tag %s needs exactly one value tag.", tag));
    }
    if (shape == Shape.LEVEL_0 && searchKeys.length != 0) {
      throw new IllegalArgumentException(format(" Level 0 tag %s takes no sub-tags.", tag));
    }
    levels.get(shape).put(tag, List.copyOf(Arrays.asList(searchKeys)));
    return this;
  }

  /**
   * Tags of one shape with their search keys.
   *
   * @param shape the shape.
   * @return unmodifiable map from tag to search keys.
   */
  public Map<String, List<String>> get(Shape shape) {
    return Collections.unmodifiableMap(levels.get(shape));
  }

  /**
   * Read a configuration from properties.
   *
   * <p>{@code xml.namespace.<p> = <uri>} declares a prefix. Each shape property is a comma separated
   * list of entries {@code p:Tag/p:Sub/...}; the first element is the tag and the rest are its
   * search keys.
   *
   * @param properties the properties.
   * @return the XmlLevels.
   * @throws IllegalArgumentException for an undeclared prefix.
   */
  public static XmlLevels fromConfiguration(Configuration properties) {
    Map<String, String> namespaces = new HashMap<>();
    Iterator<String> keys = properties.getKeys("xml.namespace");
    while (keys.hasNext()) {
      String key = keys.next();
      namespaces.put(key.substring("xml.namespace.".length()), properties.getString(key).trim());
    }
    XmlLevels xmlLevels = new XmlLevels();
    for (Shape shape : Shape.values()) {
      String value = properties.getString(shape.property, null);
      if (value == null) {
        continue;
      }
      for (String entry : value.split(",")) {
        if (entry.isBlank()) {
          continue;
        }
        String[] parts = entry.trim().split("/");
        List<String> tags = new ArrayList<>(parts.length);
        for (String part : parts) {
          tags.add(expand(part.trim(), namespaces));
        }
        xmlLevels.add(shape, tags.get(0), tags.subList(1, tags.size()).toArray(new String[0]));
      }
    }
    return xmlLevels;
  }

  /**
   * Check if properties configure any XML tags.
   *
   * @param properties the properties.
   * @return true if any shape property is set.
   */
  public static boolean isConfigured(Configuration properties) {
    for (Shape shape : Shape.values()) {
      if (properties.containsKey(shape.property)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Load the bundled configuration.
   *
   * @return the XmlLevels.
   * @throws IOException if the resource cannot be read.
   */
  public static XmlLevels defaults() throws IOException {
    URL url = XmlLevels.class.getClassLoader().getResource(DEFAULT_RESOURCE);
    if (url == null) {
      throw new IOException(format("Resource %s was not found", DEFAULT_RESOURCE));
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties().setURL(url).setIncludesAllowed(false));
      return fromConfiguration(builder.getConfiguration());
    } catch (ConfigurationException e) {
      throw new IOException(format("Resource %s could not be parsed", DEFAULT_RESOURCE), e);
    }
  }

  private static String expand(String prefixed, Map<String, String> namespaces) {
    int colon = prefixed.indexOf(':');
    if (colon < 0) {
      return prefixed;
    }
    String prefix = prefixed.substring(0, colon);
    String namespace = namespaces.get(prefix);
    if (namespace == null) {
      throw new IllegalArgumentException(format(" XML namespace prefix %s is not declared (xml.namespace.%s).", prefix, prefix));
    }
    return clark(namespace, prefixed.substring(colon + 1));
  }
}
