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

import emx.transform.parsers.MetadataFormat;
import picocli.CommandLine.Option;

/**
 * Command line options that describe an output file.
 *
 * @author Michael J. Schnieders
 */
public class OutputOptions {

  /**
   * -t or --to Format of the output file.
   */
  @Option(names = {"-t", "--to"}, paramLabel = "star", defaultValue = "star",
      description = "Output format [star/cter/ctffind/motioncor2/unblur/box].")
  private String to = "star";

  /**
   * --ov or --outputVersion Version of the output format.
   */
  @Option(names = {"--ov", "--outputVersion"}, paramLabel = "latest",
      description = "Version of the output format (for STAR files, the key set such as relion_2).")
  private String outputVersion = null;

  /**
   * -o or --output Output file name.
   */
  @Option(names = {"-o", "--output"}, paramLabel = "file",
      description = "Output file; by default the input name with the extension of the output format.")
  private String output = null;

  /**
   * --bs or --boxSize Box size written to box files.
   */
  @Option(names = {"--bs", "--boxSize"}, paramLabel = "0",
      description = "Box width and height used when writing box files.")
  private Long boxSize = null;

  public MetadataFormat getFormat() {
    return MetadataFormat.parse(to);
  }

  public String getOutputVersion() {
    return outputVersion;
  }

  public String getOutput() {
    return output;
  }

  /**
   * Box size given on the command line.
   *
   * @return the box size, or null if not given.
   */
  public Long getBoxSize() {
    return boxSize;
  }
}
