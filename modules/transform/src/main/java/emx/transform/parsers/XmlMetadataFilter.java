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

import emx.transform.DuplicateKeyException;
import emx.transform.InputFormatException;
import emx.transform.table.Column;
import emx.transform.table.Table;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * Extracts instrument metadata from an XML file into a single row table.
 *
 * <p>Every element of the document is matched against the tags of an {@link XmlLevels}
 * configuration. Column names are local tag names, trimmed and stripped of leading and trailing
 * underscores; nested values join the names of their enclosing tags with an underscore.
 *
 * @author Michael J. Schnieders
 */
public class XmlMetadataFilter implements MetadataFilter {

  private static final Logger logger = Logger.getLogger(XmlMetadataFilter.class.getName());

  /**
   * Namespace of the dose fractionation settings of Thermo Fisher acquisition software.
   */
  public static final String OMP_NAMESPACE =
      "http://schemas.datacontract.org/2004/07/Fei.Applications.Common.Omp.Interface";

  /** Dose fraction list, one child per fraction. */
  public static final String DOSE_FRACTIONS = XmlLevels.clark(OMP_NAMESPACE, "DoseFractions");
  /** Plain fraction count. */
  public static final String NUMBER_OF_FRACTIONS = XmlLevels.clark(OMP_NAMESPACE, "NumberOffractions");

  private static final Pattern CLARK = Pattern.compile(".*\\{.*}(.*)");

  private final XmlLevels levels;

  /**
   * Constructor.
   *
   * @param levels the tags to extract.
   */
  public XmlMetadataFilter(XmlLevels levels) {
    this.levels = levels;
  }

  @Override
  public MetadataFormat getFormat() {
    return MetadataFormat.XML;
  }

  /**
   * Local part of a Clark notation tag, trimmed and stripped of underscores at both ends.
   *
   * @param tag the tag.
   * @return the key.
   */
  public static String keyWithoutPrefix(String tag) {
    Matcher matcher = CLARK.matcher(tag);
    String key = matcher.matches() ? matcher.group(1) : tag;
    key = key.trim();
    int start = 0;
    int end = key.length();
    while (start < end && key.charAt(start) == '_') {
      start++;
    }
    while (end > start && key.charAt(end - 1) == '_') {
      end--;
    }
    return key.substring(start, end);
  }

  @Override
  public Table readFile(File file) throws IOException {
    Document document;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      document = builder.parse(file);
    } catch (ParserConfigurationException | SAXException e) {
      throw new InputFormatException(format("Malformed XML: %s", e.getMessage()), file.getName());
    }

    Map<String, String> data = new LinkedHashMap<>();
    visit(document.getDocumentElement(), data, file.getName());

    List<Column> columns = new ArrayList<>(data.size());
    for (Map.Entry<String, String> entry : data.entrySet()) {
      columns.add(Column.parse(entry.getKey(), List.of(entry.getValue())));
    }
    Table table = new Table(columns);

    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder(format(" Read %d metadata values from %s.", data.size(), file.getName()));
      if (logger.isLoggable(Level.FINE)) {
        for (Map.Entry<String, String> entry : data.entrySet()) {
          sb.append(format("\n  %-40s %s", entry.getKey(), entry.getValue()));
        }
      }
      logger.info(sb.toString());
    }
    return table;
  }

  private void visit(Element node, Map<String, String> data, String source) throws InputFormatException {
    for (Map.Entry<String, List<String>> entry : levels.get(XmlLevels.Shape.KEY_VALUE).entrySet()) {
      keyValue(node, entry.getKey(), entry.getValue(), data, source);
    }
    for (Map.Entry<String, List<String>> entry : levels.get(XmlLevels.Shape.LEVEL_0).entrySet()) {
      level0(node, entry.getKey(), data);
    }
    for (Map.Entry<String, List<String>> entry : levels.get(XmlLevels.Shape.LEVEL_1).entrySet()) {
      level1(node, entry.getKey(), entry.getValue(), data, source);
    }
    for (Map.Entry<String, List<String>> entry : levels.get(XmlLevels.Shape.LEVEL_3).entrySet()) {
      level3(node, entry.getKey(), entry.getValue(), data, source);
    }
    for (Element child : children(node)) {
      visit(child, data, source);
    }
  }

  /**
   * Sibling key and value elements below the node, paired in order.
   */
  private static void keyValue(Element node, String key, List<String> searchKeys,
      Map<String, String> data, String source) throws InputFormatException {
    List<Element> keys = children(node, key);
    if (keys.isEmpty()) {
      return;
    }
    List<Element> values = children(node, searchKeys.get(0));
    if (keys.size() != values.size()) {
      throw new InputFormatException(format("%d %s elements but %d %s elements",
          keys.size(), key, values.size(), searchKeys.get(0)), source);
    }
    for (int i = 0; i < keys.size(); i++) {
      String value = text(values.get(i));
      if (value != null) {
        String name = text(keys.get(i));
        if (name == null) {
          throw new InputFormatException(format("Empty %s element", key), source);
        }
        add(data, name, value);
        continue;
      }
      for (Element grandChild : children(values.get(i))) {
        String tag = tag(grandChild);
        if (tag.equals(DOSE_FRACTIONS)) {
          doseFractions(grandChild, data, source);
        } else if (tag.equals(NUMBER_OF_FRACTIONS)) {
          numberOfFractions(grandChild, data, source);
        }
      }
    }
  }

  /**
   * Fraction count and frames per fraction from a list of dose fractions.
   */
  private static void doseFractions(Element node, Map<String, String> data, String source) throws InputFormatException {
    String start = null;
    String end = null;
    List<Element> all = new ArrayList<>();
    all.add(node);
    NodeList descendants = node.getElementsByTagNameNS("*", "*");
    for (int i = 0; i < descendants.getLength(); i++) {
      all.add((Element) descendants.item(i));
    }
    for (Element element : all) {
      String tag = tag(element);
      if (start == null && tag.contains("StartFrameNumber")) {
        start = text(element);
      }
      if (end == null && tag.contains("EndFrameNumber")) {
        end = text(element);
      }
      if (start != null && end != null) {
        break;
      }
    }
    if (start != null && end != null) {
      try {
        int frames = Integer.parseInt(end) - Integer.parseInt(start) + 1;
        add(data, "NumberOffractions", Integer.toString(children(node).size()));
        add(data, "FramesPerFraction", Integer.toString(frames));
      } catch (NumberFormatException e) {
        throw new InputFormatException(format("Frame numbers %s and %s are not integers", start, end), source);
      }
    }
  }

  /**
   * Plain fraction count; each fraction holds one frame.
   */
  private static void numberOfFractions(Element node, Map<String, String> data, String source) throws InputFormatException {
    String text = text(node);
    try {
      add(data, "NumberOffractions", Integer.toString(Integer.parseInt(text)));
    } catch (NumberFormatException e) {
      throw new InputFormatException(format("Fraction count %s is not an integer", text), source);
    }
    add(data, "FramesPerFraction", "1");
  }

  private static void level0(Element node, String key, Map<String, String> data) {
    if (!key.equals(tag(node))) {
      return;
    }
    String value = text(node);
    if (value != null) {
      add(data, keyWithoutPrefix(key), value);
    }
  }

  private static void level1(Element node, String key, List<String> searchKeys,
      Map<String, String> data, String source) throws InputFormatException {
    if (!key.equals(tag(node))) {
      return;
    }
    List<String> search = withoutPrefix(searchKeys);
    String key1 = keyWithoutPrefix(key);
    for (Element child : children(node)) {
      String key2 = keyWithoutPrefix(tag(child));
      if (search.contains(key2)) {
        add(data, key1 + "_" + key2, required(child, source));
      }
    }
  }

  private static void level3(Element node, String key, List<String> searchKeys,
      Map<String, String> data, String source) throws InputFormatException {
    if (!key.equals(tag(node))) {
      return;
    }
    List<String> search = withoutPrefix(searchKeys);
    for (Element child : children(node)) {
      String key1 = keyWithoutPrefix(tag(child));
      for (Element grandChild : children(child)) {
        String combined = key1 + "_" + keyWithoutPrefix(tag(grandChild));
        for (Element greatGrandChild : children(grandChild)) {
          if (search.contains(keyWithoutPrefix(tag(greatGrandChild)))) {
            add(data, combined, required(greatGrandChild, source));
          }
        }
      }
    }
  }

  private static void add(Map<String, String> data, String key, String value) {
    if (data.containsKey(key)) {
      throw new DuplicateKeyException("Metadata key found twice", key);
    }
    data.put(key, value);
  }

  private static String required(Element element, String source) throws InputFormatException {
    String value = text(element);
    if (value == null) {
      throw new InputFormatException(format("Element %s has no value", tag(element)), source);
    }
    return value;
  }

  private static List<String> withoutPrefix(List<String> tags) {
    List<String> list = new ArrayList<>(tags.size());
    for (String tag : tags) {
      list.add(keyWithoutPrefix(tag));
    }
    return list;
  }

  /**
   * Tag of an element in Clark notation.
   */
  static String tag(Element element) {
    String local = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    return XmlLevels.clark(element.getNamespaceURI(), local);
  }

  /**
   * Text before the first child element, trimmed; null if blank.
   */
  static String text(Element element) {
    StringBuilder sb = new StringBuilder();
    for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (n.getNodeType() == Node.ELEMENT_NODE) {
        break;
      }
      if (n.getNodeType() == Node.TEXT_NODE || n.getNodeType() == Node.CDATA_SECTION_NODE) {
        sb.append(n.getNodeValue());
      }
    }
    String text = sb.toString().trim();
    return text.isEmpty() ? null : text;
  }

  private static List<Element> children(Element element) {
    List<Element> list = new ArrayList<>();
    for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
      if (n.getNodeType() == Node.ELEMENT_NODE) {
        list.add((Element) n);
      }
    }
    return list;
  }

  private static List<Element> children(Element element, String tag) {
    List<Element> list = new ArrayList<>();
    for (Element child : children(element)) {
      if (tag(child).equals(tag)) {
        list.add(child);
      }
    }
    return list;
  }
}
