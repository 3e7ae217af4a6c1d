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

import emx.transform.InputFormatException;
import emx.transform.keys.ExportHeader;
import emx.transform.keys.KeyRegistry;
import emx.transform.table.ReadOptions;
import emx.transform.table.Table;
import emx.transform.table.TableIO;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Reads and writes STAR files with a single loop block.
 *
 * <p>The header is the run of lines starting with an underscore. Its key set version is detected
 * from the field names on read. On write, fields the target key set does not know are dropped.
 *
 * @author Michael J. Schnieders
 */
public class StarFilter implements MetadataFilter {

  private static final Logger logger = Logger.getLogger(StarFilter.class.getName());

  private final KeyRegistry registry;
  private final String exportVersion;

  /**
   * Constructor.
   *
   * @param registry      the known key sets.
   * @param exportVersion key set used on write, or null for the newest.
   */
  public StarFilter(KeyRegistry registry, String exportVersion) {
    this.registry = registry;
    this.exportVersion = exportVersion == null ? registry.getNewestVersion() : exportVersion;
    // Fail early on an unknown key set.
    registry.getDictionary(this.exportVersion);
  }

  @Override
  public MetadataFormat getFormat() {
    return MetadataFormat.STAR;
  }

  public String getExportVersion() {
    return exportVersion;
  }

  /**
   * Header fields of a STAR file.
   *
   * @param lines the lines of the file.
   * @return the field names, in order.
   */
  static List<String> headerFields(List<String> lines) {
    List<String> header = new ArrayList<>();
    for (String line : lines) {
      String trimmed = line.trim();
      if (trimmed.startsWith("_")) {
        header.add(trimmed.split("\\s+")[0]);
      } else if (!header.isEmpty()) {
        break;
      }
    }
    return header;
  }

  /**
   * Index of the first line after the header block.
   */
  private static int dataStart(List<String> lines) {
    boolean inHeader = false;
    for (int i = 0; i < lines.size(); i++) {
      boolean headerLine = lines.get(i).trim().startsWith("_");
      if (headerLine) {
        inHeader = true;
      } else if (inHeader) {
        return i;
      }
    }
    return lines.size();
  }

  /**
   * Detect the key set version of a STAR file.
   *
   * @param file the file to read.
   * @return the version name.
   * @throws IOException if the file cannot be read or has no header.
   */
  public String detectVersion(File file) throws IOException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    List<String> header = headerFields(lines);
    if (header.isEmpty()) {
      throw new InputFormatException("No header information found", file.getName());
    }
    return registry.detectVersion(header);
  }

  @Override
  public Table readFile(File file) throws IOException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    List<String> header = headerFields(lines);
    if (header.isEmpty()) {
      throw new InputFormatException("No header information found", file.getName());
    }
    String version = registry.detectVersion(header);
    List<String> names = registry.importHeader(header, version);
    List<String> data = lines.subList(dataStart(lines), lines.size());
    Table table = TableIO.parse(data, new ReadOptions().names(names), file.getName());

    if (logger.isLoggable(Level.INFO)) {
      logger.info(format(" Read %d rows of %d fields from %s (key set %s).",
          table.getRowCount(), table.getColumnCount(), file.getName(), version));
    }
    return table;
  }

  @Override
  public boolean canWrite() {
    return true;
  }

  @Override
  public void writeFile(File file, Table table) throws IOException {
    ExportHeader export = registry.exportHeader(table.getColumnNames(), exportVersion);
    Table data = table.select(export.getKeptFields());

    List<String> header = new ArrayList<>();
    header.add("");
    header.add("data_");
    header.add("");
    header.add("loop_");
    header.addAll(TableIO.createHeader(export.getPrefixedNames(), true));
    TableIO.write(file, data, header, true);

    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder(format(" Wrote %d rows of %d fields to %s (key set %s).",
          data.getRowCount(), data.getColumnCount(), file.getName(), exportVersion));
      int dropped = table.getColumnCount() - data.getColumnCount();
      if (dropped > 0) {
        List<String> names = new ArrayList<>(table.getColumnNames());
        names.removeAll(export.getKeptFields());
        sb.append(format("\n  %d fields unknown to %s were dropped: %s", dropped, exportVersion, String.join(", ", names)));
      }
      logger.info(sb.toString());
    }
  }
}
