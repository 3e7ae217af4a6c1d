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
package emx.transform.cli;

import emx.transform.parsers.MetadataFilter;
import emx.transform.parsers.MetadataFormat;
import emx.transform.table.Table;
import emx.utilities.EMXBinding;
import emx.utilities.EMXCommand;
import emx.utilities.EMXProperties;
import org.apache.commons.configuration2.CompositeConfiguration;

import java.io.File;
import java.io.IOException;

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.getExtension;
import static org.apache.commons.io.FilenameUtils.removeExtension;

/**
 * Base class of the Commands that read metadata files.
 *
 * @author Michael J. Schnieders
 */
public abstract class TransformCommand extends EMXCommand {

  /**
   * Properties of the current input file.
   */
  protected CompositeConfiguration properties;

  public TransformCommand() {
    super();
  }

  public TransformCommand(EMXBinding binding) {
    super(binding);
  }

  public TransformCommand(String[] args) {
    super(args);
  }

  /**
   * Read a metadata file.
   *
   * @param file    the file.
   * @param format  its format.
   * @param version requested format version, or null.
   * @return the Table.
   * @throws IOException if the file cannot be read.
   */
  protected Table readTable(File file, MetadataFormat format, String version) throws IOException {
    if (!file.exists()) {
      throw new IOException(format("File %s does not exist", file));
    }
    properties = EMXProperties.loadProperties(file);
    MetadataFilter filter = format.createFilter(version, properties);
    return filter.readFile(file);
  }

  /**
   * Output file for an input file: the base name with a new extension. An existing file is not
   * overwritten; a numbered suffix is appended instead.
   *
   * @param input     the input file.
   * @param extension the new extension, without the dot.
   * @return the output file.
   */
  public static File outputFile(File input, String extension) {
    String base = removeExtension(input.getPath());
    File file = new File(base + "." + extension);
    if (file.getAbsoluteFile().equals(input.getAbsoluteFile()) && getExtension(input.getName()).equals(extension)) {
      file = new File(base + "_emx." + extension);
    }
    return versionFile(file);
  }

  /**
   * A file name that does not exist yet: the name itself, or the name with _2, _3, ... before the
   * extension.
   *
   * @param file the preferred file.
   * @return a file that does not exist.
   */
  public static File versionFile(File file) {
    if (!file.exists()) {
      return file;
    }
    String base = removeExtension(file.getPath());
    String extension = getExtension(file.getName());
    String suffix = extension.isEmpty() ? "" : "." + extension;
    int i = 2;
    File versioned = new File(base + "_" + i + suffix);
    while (versioned.exists()) {
      i++;
      versioned = new File(base + "_" + i + suffix);
    }
    return versioned;
  }
}
