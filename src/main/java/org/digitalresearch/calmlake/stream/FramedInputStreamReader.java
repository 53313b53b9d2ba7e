package org.digitalresearch.calmlake.stream;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.digitalresearch.calmlake.codec.Codec;

/**
 * Reads back the frames written by an OutputStreamProxy, stopping at the end
 * marker or at the end of the stream. A lake recording to a file and this
 * reader replaying the file let a consumer be tested without the producer.
 *
 * @param <T> The type of items read.
 * @author calm-lake developers
 */
public class FramedInputStreamReader<T> {

  // Instance fields.

  protected final DataInputStream in;
  protected final Codec<T> codec;

  protected boolean finished;

  // Implementation.

  public FramedInputStreamReader(InputStream in, Codec<T> codec) {
    if (in == null) throw new NullPointerException("in");
    if (codec == null) throw new NullPointerException("codec");
    this.in = new DataInputStream(in);
    this.codec = codec;
  }

  /**
   * Read the next item.
   *
   * @return The next item, or null at the end marker or at the end of the
   *         underlying stream.
   * @throws IOException On a malformed or truncated frame.
   */
  public T read() throws IOException {
    if (finished) return null;
    int byteCount;
    try {
      byteCount = in.readInt();
    } catch (EOFException eofe) {
      // Writer went away without an end marker.
      finished = true;
      return null;
    }
    if (byteCount == OutputStreamProxy.END_OF_STREAM) {
      finished = true;
      return null;
    }
    if (byteCount < 0 || byteCount > OutputStreamProxy.MAX_FRAME_SIZE) {
      throw new IOException("Invalid frame length: " + byteCount);
    }
    byte[] bytes = new byte[byteCount];
    in.readFully(bytes);
    return codec.decode(bytes);
  }

  /**
   * Read items until the end marker or the end of the stream.
   *
   * @return All remaining items, in order.
   * @throws IOException On a malformed or truncated frame.
   */
  public List<T> readAll() throws IOException {
    List<T> result = new ArrayList<T>();
    T item;
    while ((item = read()) != null) result.add(item);
    return result;
  }

  public boolean isFinished() {
    return finished;
  }

  public void close() throws IOException {
    in.close();
  }
}
