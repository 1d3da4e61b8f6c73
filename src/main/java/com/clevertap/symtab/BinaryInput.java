package com.clevertap.symtab;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Reads what {@link BinaryOutput} writes. Short reads surface as {@link java.io.EOFException}.
 */
class BinaryInput extends DataInputStream {

    private final boolean swap;

    BinaryInput(InputStream in, ByteOrder order) {
        super(in);
        swap = order != ByteOrder.BIG_ENDIAN;
    }

    int readInt32() throws IOException {
        final int v = readInt();
        return swap ? Integer.reverseBytes(v) : v;
    }

    long readInt64() throws IOException {
        final long v = readLong();
        return swap ? Long.reverseBytes(v) : v;
    }

    /**
     * @return The string, or null if the encoded length is negative
     */
    String readString() throws IOException {
        final int length = readInt32();
        if (length < 0) {
            return null;
        }
        // The length is untrusted, so read in bounded chunks instead of allocating it up front.
        final byte[] bytes = readNBytes(length);
        if (bytes.length < length) {
            throw new EOFException("String of " + length + " bytes cut short at " + bytes.length);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
