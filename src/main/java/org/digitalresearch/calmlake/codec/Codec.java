package org.digitalresearch.calmlake.codec;

import java.io.IOException;

/**
 * Turns items into bytes and back. Used by stream proxies that write to
 * byte-oriented transports.
 *
 * @param <T> The item type.
 * @author calm-lake developers
 */
public interface Codec<T> {

  // Interface.

  byte[] encode(T item) throws IOException;

  T decode(byte[] bytes) throws IOException;
}
