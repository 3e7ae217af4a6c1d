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
import emx.transform.table.Table;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Reads the header of an MRC2014 file into a single row table: the primary header fields, followed
 * by the fields of the first FEI1/FEI2 extended header record when present. Image data is not read.
 *
 * @author Michael J. Schnieders
 */
public class MrcHeaderFilter implements MetadataFilter {

  private static final Logger logger = Logger.getLogger(MrcHeaderFilter.class.getName());

  /**
   * Size of the primary header in bytes.
   */
  public static final int HEADER_LENGTH = 1024;

  /**
   * Offset of the machine stamp.
   */
  public static final int MACHINE_STAMP_OFFSET = 212;

  private static final String[] INT_FIELDS = {
      "nx", "ny", "nz", "mode", "nxstart", "nystart", "nzstart", "mx", "my", "mz"};
  private static final String[] CELL_FIELDS = {
      "cella_x", "cella_y", "cella_z", "cellb_alpha", "cellb_beta", "cellb_gamma"};
  private static final String[] AXIS_FIELDS = {"mapc", "mapr", "maps"};
  private static final String[] DENSITY_FIELDS = {"dmin", "dmax", "dmean"};
  private static final String[] ORIGIN_FIELDS = {"origin_x", "origin_y", "origin_z"};

  @Override
  public MetadataFormat getFormat() {
    return MetadataFormat.MRC;
  }

  /**
   * Byte order given by the machine stamp. The first nibble is 4 for little endian and 1 for big
   * endian data. Unrecognized stamps are read as little endian.
   *
   * @param stamp the four machine stamp bytes.
   * @return the byte order.
   */
  public static ByteOrder byteOrder(byte[] stamp) {
    int first = (stamp[0] >> 4) & 0xF;
    switch (first) {
      case 1:
      case 3:
        return ByteOrder.BIG_ENDIAN;
      case 4:
        return ByteOrder.LITTLE_ENDIAN;
      default:
        logger.fine(format(" Unrecognized machine stamp %02x%02x; assuming little endian.", stamp[0], stamp[1]));
        return ByteOrder.LITTLE_ENDIAN;
    }
  }

  @Override
  public Table readFile(File file) throws IOException {
    byte[] header = new byte[HEADER_LENGTH];
    byte[] stamp = new byte[4];
    byte[] extended;
    ByteOrder order;
    ByteBuffer bb;
    try (InputStream is = Files.newInputStream(file.toPath());
        DataInputStream dis = new DataInputStream(is)) {
      try {
        dis.readFully(header);
      } catch (EOFException e) {
        throw new InputFormatException("File is shorter than an MRC header", file.getName());
      }

      System.arraycopy(header, MACHINE_STAMP_OFFSET, stamp, 0, 4);
      order = byteOrder(stamp);
      bb = ByteBuffer.wrap(header).order(order);
      int nsymbt = bb.getInt(92);
      if (nsymbt < 0) {
        throw new InputFormatException(format("Negative extended header size %d", nsymbt), file.getName());
      }
      long available = Files.size(file.toPath()) - HEADER_LENGTH;
      if (nsymbt > available) {
        throw new InputFormatException(format("Extended header size %d exceeds the %d bytes after the header",
            nsymbt, available), file.getName());
      }
      extended = new byte[nsymbt];
      try {
        dis.readFully(extended);
      } catch (EOFException e) {
        throw new InputFormatException(format("File ends inside the %d byte extended header", nsymbt), file.getName());
      }
    }

    List<Column> columns = new ArrayList<>();
    int at = 0;
    for (String name : INT_FIELDS) {
      columns.add(Column.ofLongs(name, bb.getInt(at)));
      at += 4;
    }
    for (String name : CELL_FIELDS) {
      columns.add(Column.ofDoubles(name, bb.getFloat(at)));
      at += 4;
    }
    for (String name : AXIS_FIELDS) {
      columns.add(Column.ofLongs(name, bb.getInt(at)));
      at += 4;
    }
    for (String name : DENSITY_FIELDS) {
      columns.add(Column.ofDoubles(name, bb.getFloat(at)));
      at += 4;
    }
    columns.add(Column.ofLongs("ispg", bb.getInt(88)));
    columns.add(Column.ofLongs("nsymbt", bb.getInt(92)));
    String exttyp = FeiExtendedHeader.text(bb, 104, 4);
    columns.add(Column.ofStrings("exttyp", exttyp));
    columns.add(Column.ofLongs("nversion", bb.getInt(108)));
    at = 196;
    for (String name : ORIGIN_FIELDS) {
      columns.add(Column.ofDoubles(name, bb.getFloat(at)));
      at += 4;
    }
    columns.add(Column.ofStrings("map", FeiExtendedHeader.text(bb, 208, 4)));
    columns.add(Column.ofStrings("machst", format("%02x%02x%02x%02x", stamp[0], stamp[1], stamp[2], stamp[3])));
    columns.add(Column.ofDoubles("rms", bb.getFloat(216)));
    int nlabl = bb.getInt(220);
    columns.add(Column.ofLongs("nlabl", nlabl));
    List<String> labels = new ArrayList<>();
    for (int i = 0; i < Math.min(Math.max(nlabl, 0), 10); i++) {
      labels.add(FeiExtendedHeader.text(bb, 224 + 80 * i, 80));
    }
    columns.add(Column.ofStrings("labels", String.join(" | ", labels)));

    if ((exttyp.equals("FEI1") || exttyp.equals("FEI2")) && extended.length > 0) {
      if (extended.length < FeiExtendedHeader.getLength()) {
        throw new InputFormatException(format("Extended header of %d bytes is shorter than one %s record",
            extended.length, exttyp), file.getName());
      }
      ByteBuffer ext = ByteBuffer.wrap(extended).order(order);
      columns.addAll(FeiExtendedHeader.decode(ext, 0));
    } else if (extended.length > 0) {
      logger.fine(format(" Extended header type '%s' is not decoded.", exttyp));
    }

    Table table = new Table(columns);
    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder(format(" Read MRC header of %s", file.getName()));
      sb.append(format("\n  Dimensions:       %d x %d x %d", bb.getInt(0), bb.getInt(4), bb.getInt(8)));
      sb.append(format("\n  Mode:             %d", bb.getInt(12)));
      sb.append(format("\n  Byte order:       %s", order));
      sb.append(format("\n  Extended header:  %d bytes (%s)", extended.length, exttyp.isEmpty() ? "none" : exttyp));
      logger.info(sb.toString());
    }
    return table;
  }
}
