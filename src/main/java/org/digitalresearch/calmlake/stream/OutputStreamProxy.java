package org.digitalresearch.calmlake.stream;

import java.io.DataOutputStream;
import java.io.IOException;

import org.digitalresearch.calmlake.codec.Codec;
import org.slf4j.*;

/**
 * A StreamProxy writing to whatever OutputStream its StreamOpener hands out,
 * a file, a pipe or a socket. Each item is encoded with a codec and written as
 * a frame: the byte count as a big-endian int, followed by the bytes. Closing
 * the proxy writes a byte count of -1 as end marker. FramedInputStreamReader
 * reads the frames back.
 * <p/>
 * Any IOException breaks the proxy: it is reported to the listener, and the
 * item that could not be written stays with the caller. An item that encodes
 * to more than maxFrameSize bytes counts as such a failure, so that every
 * frame written can be read back.
 *
 * @param <T> The type of items written.
 * @author calm-lake developers
 */
public class OutputStreamProxy<T> implements StreamProxy<T, Void> {

  // Log.

  protected static final Logger LOG = LoggerFactory.getLogger(OutputStreamProxy.class);

  // Constants.

  public static final int END_OF_STREAM = -1;
  public static final int MAX_FRAME_SIZE = 64 * 1024 * 1024;

  // Instance fields.

  protected final StreamOpener opener;
  protected final Codec<T> codec;
  protected final int maxFrameSize;

  protected StreamProxyListener<Void> listener;
  protected DataOutputStream out;
  protected boolean broken;
  protected boolean closed;

  // Implementation.

  public OutputStreamProxy(StreamOpener opener, Codec<T> codec) {
    this(opener, codec, MAX_FRAME_SIZE);
  }

  /**
   * @param maxFrameSize The largest encoded item accepted, in bytes. Must not
   *                     exceed MAX_FRAME_SIZE, the limit of
   *                     FramedInputStreamReader.
   */
  public OutputStreamProxy(StreamOpener opener, Codec<T> codec, int maxFrameSize) {
    if (opener == null) throw new NullPointerException("opener");
    if (codec == null) throw new NullPointerException("codec");
    if (maxFrameSize < 0 || maxFrameSize > MAX_FRAME_SIZE) throw new IllegalArgumentException(
        "maxFrameSize must be between 0 and " + MAX_FRAME_SIZE + ": " + maxFrameSize);
    this.opener = opener;
    this.codec = codec;
    this.maxFrameSize = maxFrameSize;
  }

  public static <T> StreamProxyFactory<T, Void> factory(final StreamOpener opener, final Codec<T> codec) {
    return new StreamProxyFactory<T, Void>() {
      @Override
      public StreamProxy<T, Void> create() {
        return new OutputStreamProxy<T>(opener, codec);
      }
    };
  }

  protected void broke(IOException ioe) {
    broken = true;
    LOG.warn("Output stream broke", ioe);
    listener.onError(ioe);
  }

  // StreamProxy implementation.

  @Override
  public void connect(StreamProxyListener<Void> listener) {
    if (closed) throw new IllegalStateException("Proxy is closed");
    this.listener = listener;
    try {
      out = new DataOutputStream(opener.open());
    } catch (IOException ioe) {
      broke(ioe);
      return;
    }
    listener.onConnected();
  }

  @Override
  public boolean send(T item) {
    if (out == null || broken || closed) return false;
    try {
      byte[] bytes = codec.encode(item);
      if (bytes.length > maxFrameSize) {
        throw new IOException("Frame of " + bytes.length + " bytes exceeds " + maxFrameSize);
      }
      out.writeInt(bytes.length);
      out.write(bytes);
      out.flush();
      return true;
    } catch (IOException ioe) {
      broke(ioe);
      return false;
    }
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    if (out != null) {
      try {
        if (!broken) {
          out.writeInt(END_OF_STREAM);
          out.flush();
        }
        out.close();
      } catch (IOException ioe) {
        LOG.debug("Error closing output stream", ioe);
      }
    }
    if (listener != null) listener.onClosed();
  }
}
