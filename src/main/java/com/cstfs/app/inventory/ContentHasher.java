package com.cstfs.app.inventory;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HexFormat;

import net.jpountz.xxhash.StreamingXXHash64;
import net.jpountz.xxhash.XXHashFactory;

/**
 * Content digest of a whole file: xxHash64, seed 0, as 16 lower-case hex digits.
 * <p>
 * xxHash64 is not cryptographic. Two unrelated files colliding is possible in
 * theory and accepted here in exchange for scan throughput; do not replace it
 * with SHA-256 without re-hashing every existing index.
 * <p>
 * Files are hashed straight from a read-only memory mapping. Above 2 GiB a
 * single mapping is not addressable, so the file is fed window by window to
 * the streaming variant, which yields the same value.
 */
public final class ContentHasher {

    public static final int HEX_LENGTH = 16;

    static final long SEED = 0L;
    private static final long SINGLE_MAP_LIMIT = Integer.MAX_VALUE;
    private static final long WINDOW_BYTES = 256L * 1024 * 1024;
    private static final int CHUNK_BYTES = 1024 * 1024;

    private final XXHashFactory factory;
    private final long singleMapLimit;
    private final long windowBytes;
    private final int chunkBytes;

    public ContentHasher() {
        this(XXHashFactory.fastestInstance(), SINGLE_MAP_LIMIT, WINDOW_BYTES, CHUNK_BYTES);
    }

    /**
     * @param singleMapLimit largest file hashed from one mapping, at most {@link Integer#MAX_VALUE}
     * @param windowBytes    mapping size used above that limit
     * @param chunkBytes     copy buffer fed to the streaming hasher
     */
    ContentHasher(XXHashFactory factory, long singleMapLimit, long windowBytes, int chunkBytes) {
        if (singleMapLimit > Integer.MAX_VALUE || windowBytes <= 0 || chunkBytes <= 0) {
            throw new IllegalArgumentException("Invalid hashing sizes: singleMapLimit=" + singleMapLimit
                + ", windowBytes=" + windowBytes + ", chunkBytes=" + chunkBytes);
        }
        this.factory = factory;
        this.singleMapLimit = singleMapLimit;
        this.windowBytes = windowBytes;
        this.chunkBytes = chunkBytes;
    }

    /**
     * @throws IOException when the file cannot be opened or mapped
     *         (vanished after enumeration, permission denied, ...)
     */
    public String hash(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            // The native hasher cannot read a zero-length mapping.
            if (size == 0) {
                return toHex(factory.hash64().hash(new byte[0], 0, 0, SEED));
            }
            if (size <= singleMapLimit) {
                MappedByteBuffer mapped = channel.map(FileChannel.MapMode.READ_ONLY, 0, size);
                return toHex(factory.hash64().hash(mapped, 0, (int) size, SEED));
            }
            return toHex(hashWindows(channel, size));
        } catch (IOException e) {
            throw new IOException("Could not hash file " + file, e);
        }
    }

    private long hashWindows(FileChannel channel, long size) throws IOException {
        StreamingXXHash64 digest = factory.newStreamingHash64(SEED);
        byte[] chunk = new byte[chunkBytes];
        for (long position = 0; position < size; position += windowBytes) {
            long length = Math.min(windowBytes, size - position);
            MappedByteBuffer window = channel.map(FileChannel.MapMode.READ_ONLY, position, length);
            while (window.hasRemaining()) {
                int n = Math.min(chunk.length, window.remaining());
                window.get(chunk, 0, n);
                digest.update(chunk, 0, n);
            }
        }
        return digest.getValue();
    }

    static String toHex(long value) {
        return HexFormat.of().toHexDigits(value);
    }
}
