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

import emx.transform.ctf.CterConverter;
import emx.transform.ctf.CterDialect;
import emx.transform.table.ReadOptions;
import emx.transform.table.Table;
import emx.transform.table.TableIO;
import emx.utilities.Version;
import emx.utilities.VersionDispatcher;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Reads and writes CTER partres files: one headerless row per micrograph.
 *
 * @author Michael J. Schnieders
 */
public class CterFilter implements MetadataFilter {

  private static final Logger logger = Logger.getLogger(CterFilter.class.getName());

  /**
   * Digits kept on output by default.
   */
  public static final int DEFAULT_DIGITS = 7;

  private static final VersionDispatcher<CterDialect> RELION_VERSIONS =
      new VersionDispatcher<>(Map.of("1.0", CterDialect.RELION));
  private static final VersionDispatcher<CterDialect> SPHIRE_VERSIONS =
      new VersionDispatcher<>(Map.of("1.0", CterDialect.SPHIRE));

  private final Version version;
  private final CterConverter converter;

  /**
   * Constructor for the RELION dialect.
   *
   * @param version requested version, or null for the newest.
   */
  public CterFilter(String version) {
    this(version, CterDialect.RELION, DEFAULT_DIGITS);
  }

  /**
   * Constructor.
   *
   * @param version requested version, or null for the newest.
   * @param dialect the column vocabulary.
   * @param digits  decimal digits kept on output.
   */
  public CterFilter(String version, CterDialect dialect, int digits) {
    VersionDispatcher<CterDialect> versions = (dialect == CterDialect.RELION) ? RELION_VERSIONS : SPHIRE_VERSIONS;
    this.version = versions.selectVersion(version);
    this.converter = new CterConverter(versions.select(version), digits);
  }

  @Override
  public MetadataFormat getFormat() {
    return MetadataFormat.CTER;
  }

  public Version getVersion() {
    return version;
  }

  public CterDialect getDialect() {
    return converter.getDialect();
  }

  @Override
  public Table readFile(File file) throws IOException {
    Table raw = TableIO.read(file, new ReadOptions().names(getDialect().getColumns()));
    Table table = converter.toInternal(raw);
    logger.info(format(" Read %d CTER %s records (%s) from %s.",
        table.getRowCount(), version, getDialect(), file.getName()));
    return table;
  }

  @Override
  public boolean canWrite() {
    return true;
  }

  @Override
  public void writeFile(File file, Table table) throws IOException {
    Table cter = converter.fromInternal(table);
    TableIO.write(file, cter, null, true);
    logger.info(format(" Wrote %d CTER %s records (%s) to %s.",
        cter.getRowCount(), version, getDialect(), file.getName()));
  }
}
