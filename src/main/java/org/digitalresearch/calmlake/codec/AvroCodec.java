package org.digitalresearch.calmlake.codec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import org.apache.avro.*;
import org.apache.avro.generic.*;
import org.apache.avro.io.*;

/**
 * A codec for Avro generic records of one schema, using Avro's binary
 * encoding. The schema is not written with the data, so both ends have to
 * agree on it.
 *
 * @author calm-lake developers
 */
public class AvroCodec implements Codec<GenericRecord> {

  // Instance fields.

  protected final Schema schema;
  protected final GenericDatumWriter<GenericRecord> writer;
  protected final GenericDatumReader<GenericRecord> reader;

  // Implementation.

  public AvroCodec(Schema schema) {
    if (schema == null) throw new NullPointerException("schema");
    if (schema.getType() != Schema.Type.RECORD) throw new IllegalArgumentException(
        String.format("%s is not a record schema", schema.getFullName()));
    this.schema = schema;
    writer = new GenericDatumWriter<GenericRecord>(schema);
    reader = new GenericDatumReader<GenericRecord>(schema);
  }

  public Schema getSchema() {
    return schema;
  }

  // Codec implementation.

  @Override
  public byte[] encode(GenericRecord item) throws IOException {
    ByteArrayOutputStream bao = new ByteArrayOutputStream();
    BinaryEncoder out = EncoderFactory.get().binaryEncoder(bao, null);
    try {
      writer.write(item, out);
    } catch (RuntimeException re) {
      // Missing fields and values of the wrong type surface as runtime exceptions.
      throw new IOException("Cannot encode record", re);
    }
    out.flush();
    return bao.toByteArray();
  }

  @Override
  public GenericRecord decode(byte[] bytes) throws IOException {
    BinaryDecoder in = DecoderFactory.get().binaryDecoder(bytes, null);
    try {
      return reader.read(null, in);
    } catch (AvroRuntimeException are) {
      throw new IOException("Cannot decode record", are);
    }
  }
}
