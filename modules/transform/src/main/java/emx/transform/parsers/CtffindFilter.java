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
import emx.transform.table.Column;
import emx.transform.table.ReadOptions;
import emx.transform.table.Table;
import emx.transform.table.TableIO;
import emx.utilities.Version;
import emx.utilities.VersionDispatcher;
import org.apache.commons.math3.util.FastMath;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
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
 * Reads and writes CTFFIND4 diagnostic output.
 *
 * <p>The file starts with five comment lines that describe the run, followed by one row per
 * micrograph: an index and six values. The phase shift is stored in radians. Run parameters
 * scraped from the comments are repeated on every row.
 *
 * @author Michael J. Schnieders
 */
public class CtffindFilter implements MetadataFilter {

  private static final Logger logger = Logger.getLogger(CtffindFilter.class.getName());

  /**
   * Number of comment lines before the data.
   */
  public static final int COMMENT_LINES = 5;

  /** Metadata key of the program version. */
  public static final String VERSION = "version";
  /** Metadata key of the micrograph name. */
  public static final String MICROGRAPH_NAME = "MicrographNameNoDW";
  /** Internal name of the phase shift column. */
  public static final String PHASE_SHIFT = "PhaseShift";

  private static final VersionDispatcher<List<String>> VERSIONS = new VersionDispatcher<>(Map.of(
      "4.1.0", List.of("DefocusU", "DefocusV", "DefocusAngle", PHASE_SHIFT, "CtfFigureOfMerit", "CtfMaxResolution")));

  /**
   * Patterns of the run parameters, by metadata key.
   */
  private static final Map<String, Pattern> METADATA = new LinkedHashMap<>();

  static {
    METADATA.put(VERSION, Pattern.compile(".*CTFFind version ([^, ]*).*"));
    METADATA.put(MICROGRAPH_NAME, Pattern.compile(".*Input file: ([^ ]*).*"));
    METADATA.put("PixelSize", Pattern.compile(".*Pixel size: ([^ ]*).*"));
    METADATA.put("Voltage", Pattern.compile(".*acceleration voltage: ([^ ]*).*"));
    METADATA.put("SphericalAberration", Pattern.compile(".*spherical aberration: ([^ ]*).*"));
    METADATA.put("AmplitudeContrast", Pattern.compile(".*amplitude contrast: ([^ ]*).*"));
  }

  private final Version version;
  private final List<String> columns;
  private final int digits;

  /**
   * Constructor.
   *
   * @param version requested version, or null for the newest.
   */
  public CtffindFilter(String version) {
    this(version, CterFilter.DEFAULT_DIGITS);
  }

  /**
   * Constructor.
   *
   * @param version requested version, or null for the newest.
   * @param digits  decimal digits kept on output.
   */
  public CtffindFilter(String version, int digits) {
    this.version = VERSIONS.selectVersion(version);
    this.columns = VERSIONS.select(version);
    this.digits = digits;
  }

  @Override
  public MetadataFormat getFormat() {
    return MetadataFormat.CTFFIND;
  }

  public Version getVersion() {
    return version;
  }

  /**
   * Data column names, in file order after the index column.
   *
   * @return the names.
   */
  public List<String> getColumns() {
    return columns;
  }

  /**
   * Scrape the run parameters from the comment lines. Only the version and the micrograph name
   * may be text.
   *
   * @param lines  the lines of the file.
   * @param source name of the source, used in error messages.
   * @return a single row table with one column per parameter found.
   * @throws InputFormatException if a numeric parameter does not parse.
   */
  public static Table readMetadata(List<String> lines, String source) throws InputFormatException {
    List<Column> metadata = new ArrayList<>();
    for (Map.Entry<String, Pattern> entry : METADATA.entrySet()) {
      String key = entry.getKey();
      for (String line : lines) {
        Matcher matcher = entry.getValue().matcher(line);
        if (!matcher.matches()) {
          continue;
        }
        String value = matcher.group(1);
        if (key.equals(VERSION) || key.equals(MICROGRAPH_NAME)) {
          metadata.add(Column.ofStrings(key, value));
        } else {
          try {
            metadata.add(Column.ofDoubles(key, Double.parseDouble(value)));
          } catch (NumberFormatException e) {
            throw new InputFormatException(format("Value '%s' of %s is not a number", value, key), source);
          }
        }
        break;
      }
    }
    return new Table(metadata);
  }

  @Override
  public Table readFile(File file) throws IOException {
    List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    ReadOptions options = new ReadOptions()
        .skipRows(COMMENT_LINES)
        .comment('#')
        .useColumns(1, 2, 3, 4, 5, 6)
        .names(columns);
    Table table = TableIO.parse(lines, options, file.getName());
    double[] phaseShift = table.getColumn(PHASE_SHIFT).toDoubles();
    for (int i = 0; i < phaseShift.length; i++) {
      phaseShift[i] = FastMath.toDegrees(phaseShift[i]);
    }
    table = table.withColumn(Column.ofDoubles(PHASE_SHIFT, phaseShift));

    Table metadata = readMetadata(lines.subList(0, Math.min(COMMENT_LINES, lines.size())), file.getName());
    if (metadata.getColumnCount() > 0 && table.getRowCount() > 0) {
      table = table.concat(metadata);
    }

    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder(format(" Read %d CTFFIND %s records from %s.",
          table.getRowCount(), version, file.getName()));
      for (Column column : metadata.getColumns()) {
        sb.append(format("\n  %-20s %s", column.getName(), column.getString(0)));
      }
      logger.info(sb.toString());
    }
    return table;
  }

  @Override
  public boolean canWrite() {
    return true;
  }

  @Override
  public void writeFile(File file, Table table) throws IOException {
    int rows = table.getRowCount();
    List<Column> data = new ArrayList<>(columns.size() + 1);
    long[] index = new long[rows];
    for (int i = 0; i < rows; i++) {
      index[i] = i + 1;
    }
    data.add(Column.ofLongs("index", index));
    for (int c = 0; c < columns.size(); c++) {
      String name = columns.get(c);
      // Defocus U and V are required; the other values default to zero.
      if (c < 2 || table.hasColumn(name)) {
        data.add(table.getColumn(name));
      } else {
        data.add(Column.constant(name, 0.0, rows));
      }
    }
    Table out = new Table(data);
    double[] phaseShift = out.getColumn(PHASE_SHIFT).toDoubles();
    for (int i = 0; i < rows; i++) {
      phaseShift[i] = FastMath.toRadians(phaseShift[i]);
    }
    out = out.withColumn(Column.ofDoubles(PHASE_SHIFT, phaseShift)).round(digits);

    TableIO.write(file, out, comments(table), true);
    logger.info(format(" Wrote %d CTFFIND %s records to %s.", rows, version, file.getName()));
  }

  /**
   * Comment block describing the run, built from the metadata of the first row. A parameter the
   * table does not hold is left out, so that reading the file back does not invent it.
   */
  private List<String> comments(Table table) {
    List<String> comments = new ArrayList<>(COMMENT_LINES);
    String programVersion = metadata(table, VERSION);
    if (programVersion != null) {
      comments.add(format("# Output from CTFFind version %s, converted by EM Transform X", programVersion));
    } else {
      comments.add("# Output from CTFFind, converted by EM Transform X");
    }
    String micrograph = metadata(table, MICROGRAPH_NAME);
    if (micrograph != null) {
      comments.add(format("# Input file: %s ; Number of micrographs: %d", micrograph, table.getRowCount()));
    } else {
      comments.add(format("# Number of micrographs: %d", table.getRowCount()));
    }
    List<String> parameters = new ArrayList<>(4);
    addParameter(parameters, table, "PixelSize", "Pixel size: %s Angstroms");
    addParameter(parameters, table, "Voltage", "acceleration voltage: %s keV");
    addParameter(parameters, table, "SphericalAberration", "spherical aberration: %s mm");
    addParameter(parameters, table, "AmplitudeContrast", "amplitude contrast: %s");
    if (parameters.isEmpty()) {
      comments.add("# Run parameters were not recorded");
    } else {
      comments.add("# " + String.join(" ; ", parameters));
    }
    comments.add("# Box size: 0 pixels ; min. res.: 0.0 Angstroms ; max. res.: 0.0 Angstroms ; min. def.: 0.0 um; max. def. 0.0 um");
    comments.add("# Columns: #1 - micrograph number; #2 - defocus 1 [Angstroms]; #3 - defocus 2; "
        + "#4 - azimuth of astigmatism; #5 - additional phase shift [radians]; #6 - cross correlation; "
        + "#7 - spacing (in Angstroms) up to which CTF rings were fit successfully");
    return comments;
  }

  private static void addParameter(List<String> parameters, Table table, String key, String pattern) {
    String value = metadata(table, key);
    if (value != null) {
      parameters.add(format(pattern, value));
    }
  }

  private static String metadata(Table table, String key) {
    if (!table.hasColumn(key) || table.getRowCount() == 0) {
      return null;
    }
    return table.getColumn(key).getString(0);
  }
}
