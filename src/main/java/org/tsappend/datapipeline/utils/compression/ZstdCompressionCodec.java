package org.tsappend.datapipeline.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

/**
 * Zstandard codec backed by zstd-jni.
 * <p>
 * Levels run from 1 (fastest) to {@link Zstd#maxCompressionLevel()}; chunk data is small and
 * written once per run, so stores default to a high level.
 */
public class ZstdCompressionCodec implements ICompressionCodec {

    public static final String NAME = "zstd";

    private final int level;

    /**
     * @param level compression level
     * @throws IllegalArgumentException if the level is outside zstd's supported range
     */
    public ZstdCompressionCodec(int level) {
        if (level < 1 || level > Zstd.maxCompressionLevel()) {
            throw new IllegalArgumentException("zstd level must be between 1 and "
                    + Zstd.maxCompressionLevel() + ", got: " + level);
        }
        this.level = level;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getLevel() {
        return level;
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }
}
