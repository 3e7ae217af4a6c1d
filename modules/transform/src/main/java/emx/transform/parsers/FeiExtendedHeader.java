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

import emx.transform.table.Column;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layout of one record of the FEI1 MRC extended header, as written by Thermo Fisher acquisition
 * software. Fields are packed without padding. FEI2 records start with the same fields.
 *
 * @author Michael J. Schnieders
 */
public class FeiExtendedHeader {

  /**
   * Encoding of one field.
   */
  public enum Kind {
    /** Signed 32-bit integer. */
    INT(4),
    /** Unsigned 32-bit integer. */
    UINT(4),
    /** 64-bit float. */
    DOUBLE(8),
    /** One byte flag. */
    BOOLEAN(1),
    /** Fixed length, NUL padded text. */
    STRING(0);

    private final int size;

    Kind(int size) {
      this.size = size;
    }
  }

  /**
   * One field of the record.
   */
  public static final class Field {
    private final String name;
    private final Kind kind;
    private final int size;
    private final int offset;

    private Field(String name, Kind kind, int size, int offset) {
      this.name = name;
      this.kind = kind;
      this.size = size;
      this.offset = offset;
    }

    public String getName() {
      return name;
    }

    public Kind getKind() {
      return kind;
    }

    public int getSize() {
      return size;
    }

    public int getOffset() {
      return offset;
    }
  }

  private static final List<Field> FIELDS;
  private static final Map<String, Field> BY_NAME;
  private static final int LENGTH;

  static {
    Builder b = new Builder();
    b.add("Metadata size", Kind.INT);
    b.add("Metadata version", Kind.INT);
    b.add("Bitmask 1", Kind.UINT);
    b.add("Timestamp", Kind.DOUBLE);
    b.text("Microscope type", 16);
    b.text("D-Number", 16);
    b.text("Application", 16);
    b.text("Application version", 16);
    b.add("HT", Kind.DOUBLE);
    b.add("Dose", Kind.DOUBLE);
    b.add("Alpha tilt", Kind.DOUBLE);
    b.add("Beta tilt", Kind.DOUBLE);
    b.add("X-Stage", Kind.DOUBLE);
    b.add("Y-Stage", Kind.DOUBLE);
    b.add("Z-Stage", Kind.DOUBLE);
    b.add("Tilt axis angle", Kind.DOUBLE);
    b.add("Dual axis rotation", Kind.DOUBLE);
    b.add("Pixel size X", Kind.DOUBLE);
    b.add("Pixel size Y", Kind.DOUBLE);
    b.text("Unused range", 48);
    b.add("Defocus", Kind.DOUBLE);
    b.add("STEM Defocus", Kind.DOUBLE);
    b.add("Applied defocus", Kind.DOUBLE);
    b.add("Instrument mode", Kind.INT);
    b.add("Projection mode", Kind.INT);
    b.text("Objective lens mode", 16);
    b.text("High magnification mode", 16);
    b.add("Probe mode", Kind.INT);
    b.add("EFTEM On", Kind.BOOLEAN);
    b.add("Magnification", Kind.DOUBLE);
    b.add("Bitmask 2", Kind.UINT);
    b.add("Camera length", Kind.DOUBLE);
    b.add("Spot index", Kind.INT);
    b.add("Illuminated area", Kind.DOUBLE);
    b.add("Intensity", Kind.DOUBLE);
    b.add("Convergence angle", Kind.DOUBLE);
    b.text("Illumination mode", 16);
    b.add("Wide convergence angle range", Kind.BOOLEAN);
    b.add("Slit inserted", Kind.BOOLEAN);
    b.add("Slit width", Kind.DOUBLE);
    b.add("Acceleration voltage offset", Kind.DOUBLE);
    b.add("Drift tube voltage", Kind.DOUBLE);
    b.add("Energy shift", Kind.DOUBLE);
    b.add("Shift offset X", Kind.DOUBLE);
    b.add("Shift offset Y", Kind.DOUBLE);
    b.add("Shift X", Kind.DOUBLE);
    b.add("Shift Y", Kind.DOUBLE);
    b.add("Integration time", Kind.DOUBLE);
    b.add("Binning Width", Kind.INT);
    b.add("Binning Height", Kind.INT);
    b.text("Camera name", 16);
    b.add("Readout area left", Kind.INT);
    b.add("Readout area top", Kind.INT);
    b.add("Readout area right", Kind.INT);
    b.add("Readout area bottom", Kind.INT);
    b.add("Direct detector electron counting", Kind.BOOLEAN);
    b.add("Direct detector align frames", Kind.BOOLEAN);
    for (int i = 0; i < 4; i++) {
      b.add("Camera param reserved " + i, Kind.INT);
    }
    b.add("Bitmask 3", Kind.UINT);
    for (int i = 4; i < 10; i++) {
      b.add("Camera param reserved " + i, Kind.INT);
    }
    b.add("Phase Plate", Kind.BOOLEAN);
    b.text("STEM Detector name", 16);
    b.add("Gain", Kind.DOUBLE);
    b.add("Offset", Kind.DOUBLE);
    for (int i = 0; i < 5; i++) {
      b.add("STEM param reserved " + i, Kind.INT);
    }
    b.add("Dwell time", Kind.DOUBLE);
    b.add("Frame time", Kind.DOUBLE);
    b.add("Scan size left", Kind.INT);
    b.add("Scan size top", Kind.INT);
    b.add("Scan size right", Kind.INT);
    b.add("Scan size bottom", Kind.INT);
    b.add("Full scan FOV X", Kind.DOUBLE);
    b.add("Full scan FOV Y", Kind.DOUBLE);
    b.text("Element", 16);
    b.add("Energy interval lower edge", Kind.DOUBLE);
    b.add("Energy interval higher edge", Kind.DOUBLE);
    b.add("Method", Kind.INT);
    b.add("Is dose fraction", Kind.BOOLEAN);
    b.add("Fraction number", Kind.INT);
    b.add("Start frame", Kind.INT);
    b.add("End frame", Kind.INT);
    b.text("Input stack filename", 80);
    b.add("Bitmask 4", Kind.UINT);
    b.add("Alpha tilt min", Kind.DOUBLE);
    b.add("Alpha tilt max", Kind.DOUBLE);

    FIELDS = Collections.unmodifiableList(b.fields);
    Map<String, Field> map = new LinkedHashMap<>();
    for (Field field : FIELDS) {
      map.put(field.name, field);
    }
    BY_NAME = Collections.unmodifiableMap(map);
    LENGTH = b.offset;
  }

  private FeiExtendedHeader() {
    // Static layout only.
  }

  /**
   * Fields in record order.
   *
   * @return the fields.
   */
  public static List<Field> getFields() {
    return FIELDS;
  }

  /**
   * Number of bytes used by the known fields.
   *
   * @return the length in bytes.
   */
  public static int getLength() {
    return LENGTH;
  }

  /**
   * Byte offset of a field within a record.
   *
   * @param name the field name.
   * @return the offset.
   * @throws IllegalArgumentException for an unknown field.
   */
  public static int offsetOf(String name) {
    Field field = BY_NAME.get(name);
    if (field == null) {
      throw new IllegalArgumentException(String.format(" Unknown FEI extended header field %s.", name));
    }
    return field.offset;
  }

  /**
   * Decode one record.
   *
   * @param record buffer positioned anywhere, with its byte order set; absolute reads start at
   *               {@code start}.
   * @param start  offset of the record in the buffer.
   * @return one single row column per field.
   */
  public static List<Column> decode(ByteBuffer record, int start) {
    List<Column> columns = new ArrayList<>(FIELDS.size());
    for (Field field : FIELDS) {
      int at = start + field.offset;
      switch (field.kind) {
        case INT:
          columns.add(Column.ofLongs(field.name, record.getInt(at)));
          break;
        case UINT:
          columns.add(Column.ofLongs(field.name, Integer.toUnsignedLong(record.getInt(at))));
          break;
        case DOUBLE:
          columns.add(Column.ofDoubles(field.name, record.getDouble(at)));
          break;
        case BOOLEAN:
          columns.add(Column.ofBooleans(field.name, record.get(at) != 0));
          break;
        default:
          columns.add(Column.ofStrings(field.name, text(record, at, field.size)));
      }
    }
    return columns;
  }

  /**
   * Read NUL padded text.
   *
   * @param buffer the buffer.
   * @param at     absolute offset.
   * @param size   field length in bytes.
   * @return the trimmed text.
   */
  static String text(ByteBuffer buffer, int at, int size) {
    byte[] bytes = new byte[size];
    for (int i = 0; i < size; i++) {
      bytes[i] = buffer.get(at + i);
    }
    int end = 0;
    while (end < size && bytes[end] != 0) {
      end++;
    }
    return new String(bytes, 0, end, StandardCharsets.US_ASCII).trim();
  }

  private static final class Builder {
    private final List<Field> fields = new ArrayList<>();
    private int offset = 0;

    void add(String name, Kind kind) {
      fields.add(new Field(name, kind, kind.size, offset));
      offset += kind.size;
    }

    void text(String name, int size) {
      fields.add(new Field(name, Kind.STRING, size, offset));
      offset += size;
    }
  }
}
