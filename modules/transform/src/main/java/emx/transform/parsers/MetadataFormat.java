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

import emx.transform.ctf.CterDialect;
import emx.transform.keys.KeyRegistry;
import emx.utilities.EMXProperties;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.lang.String.format;

/**
 * The supported metadata file formats.
 *
 * @author Michael J. Schnieders
 */
public enum MetadataFormat {
  STAR("star"),
  CTER("txt"),
  CTFFIND("txt"),
  MOTIONCOR2("log"),
  UNBLUR("txt"),
  BOX("box"),
  MRC("mrc", "mrcs", "st"),
  XML("xml");

  /** Property naming the STAR key set versions, oldest first. */
  public static final String STAR_VERSIONS = "star.versions";
  /** Property naming the STAR key set used on write. */
  public static final String STAR_VERSION = "star.version";
  /** Property naming the CTER dialect. */
  public static final String CTER_DIALECT = "cter.dialect";
  /** Property naming the box file dialect. */
  public static final String BOX_FORMAT = "box.format";
  /** Property giving the box size used when writing box files. */
  public static final String BOX_SIZE = "box.size";
  /** Property giving the digits kept on CTER output. */
  public static final String OUTPUT_DIGITS = "output.digits";

  private final String[] extensions;

  MetadataFormat(String... extensions) {
    this.extensions = extensions;
  }

  /**
   * Default file extension, without the dot.
   *
   * @return the extension.
   */
  public String getExtension() {
    return extensions[0];
  }

  /**
   * Parse a format name, ignoring case.
   *
   * @param name the name, e.g. "star" or "ctffind".
   * @return the MetadataFormat.
   * @throws IllegalArgumentException for an unknown name.
   */
  public static MetadataFormat parse(String name) {
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      List<String> known = new ArrayList<>();
      for (MetadataFormat format : values()) {
        known.add(format.name().toLowerCase(Locale.ROOT));
      }
      throw new IllegalArgumentException(format(" Unknown format %s (known: %s).", name, String.join(", ", known)), e);
    }
  }

  /**
   * Guess a format from a file name. Text files are ambiguous and return null.
   *
   * @param fileName the file name.
   * @return the MetadataFormat, or null.
   */
  public static MetadataFormat fromFileName(String fileName) {
    String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
    if (extension.equals("txt")) {
      return null;
    }
    for (MetadataFormat format : values()) {
      for (String e : format.extensions) {
        if (e.equals(extension)) {
          return format;
        }
      }
    }
    return null;
  }

  /**
   * Create the filter for this format.
   *
   * @param version    requested version, or null for the default.
   * @param properties settings for the filters.
   * @return the MetadataFilter.
   * @throws IOException if bundled key sets cannot be read.
   */
  public MetadataFilter createFilter(String version, Configuration properties) throws IOException {
    switch (this) {
      case STAR:
        List<String> versions = EMXProperties.getList(properties, STAR_VERSIONS, String.join(",", KeyRegistry.STAR_VERSIONS));
        KeyRegistry registry = KeyRegistry.starRegistry(versions);
        String starVersion = version != null ? version : properties.getString(STAR_VERSION, null);
        return new StarFilter(registry, starVersion);
      case CTER:
        CterDialect dialect = CterDialect.parse(properties.getString(CTER_DIALECT, "relion"));
        int digits = properties.getInt(OUTPUT_DIGITS, CterFilter.DEFAULT_DIGITS);
        return new CterFilter(version, dialect, digits);
      case CTFFIND:
        return new CtffindFilter(version, properties.getInt(OUTPUT_DIGITS, CterFilter.DEFAULT_DIGITS));
      case MOTIONCOR2:
        return new MotionCor2Filter(version);
      case UNBLUR:
        return new UnblurFilter(version);
      case BOX:
        String name = version != null ? version : properties.getString(BOX_FORMAT, null);
        return new BoxFilter(BoxFormat.parse(name), properties.getLong(BOX_SIZE, 0L));
      case MRC:
        return new MrcHeaderFilter();
      case XML:
      default:
        XmlLevels levels = XmlLevels.isConfigured(properties)
            ? XmlLevels.fromConfiguration(properties) : XmlLevels.defaults();
        return new XmlMetadataFilter(levels);
    }
  }
}
