package org.tsappend.datapipeline.utils.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec for uncompressed stores.
 */
public class NoneCompressionCodec implements ICompressionCodec {

    public static final String NAME = "none";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getLevel() {
        return 0;
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) {
        return out;
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }
}
