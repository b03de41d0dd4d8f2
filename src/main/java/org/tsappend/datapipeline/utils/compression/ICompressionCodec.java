package org.tsappend.datapipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream-level compression used for stored chunks.
 * <p>
 * Implementations are stateless; every wrap call returns an independent stream.
 */
public interface ICompressionCodec {

    /**
     * @return codec name as written to store metadata (e.g. {@code "zstd"})
     */
    String getName();

    /**
     * @return compression level, or 0 for codecs without levels
     */
    int getLevel();

    /**
     * Wraps {@code out} so that bytes written to the result are compressed. Closing the result
     * finishes the frame and closes {@code out}.
     */
    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    /**
     * Wraps {@code in} so that reading the result yields decompressed bytes.
     */
    InputStream wrapInputStream(InputStream in) throws IOException;
}
