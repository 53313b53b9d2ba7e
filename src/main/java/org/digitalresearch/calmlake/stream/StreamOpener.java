package org.digitalresearch.calmlake.stream;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Opens the output stream an OutputStreamProxy writes to. Called once per
 * proxy, so every reconnect gets a fresh stream.
 *
 * @author calm-lake developers
 */
public interface StreamOpener {

  // Interface.

  OutputStream open() throws IOException;
}
