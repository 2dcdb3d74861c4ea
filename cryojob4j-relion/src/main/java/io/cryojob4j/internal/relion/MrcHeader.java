package io.cryojob4j.internal.relion;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Dimensions from the first words of an MRC2014 header (little-endian).
 */
record MrcHeader(int nx, int ny, int nz) {

    private static final int DIMENSION_BYTES = 12;

    static MrcHeader read(Path file) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(DIMENSION_BYTES);
        }
        if (head.length < DIMENSION_BYTES) {
            throw new IOException("Truncated MRC header: " + file);
        }
        ByteBuffer buf = ByteBuffer.wrap(head).order(ByteOrder.LITTLE_ENDIAN);
        return new MrcHeader(buf.getInt(0), buf.getInt(4), buf.getInt(8));
    }

    /**
     * Whether both in-plane dimensions stay even after dividing by {@code binFactor}.
     */
    boolean evenAfterBinning(int binFactor) {
        double x = nx / (double) binFactor;
        double y = ny / (double) binFactor;
        return x % 2 == 0 && y % 2 == 0;
    }
}
