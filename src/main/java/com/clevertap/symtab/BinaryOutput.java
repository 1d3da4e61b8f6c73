package com.clevertap.symtab;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * A {@link DataOutputStream} writing fixed width integers in a chosen byte order, and strings as a
 * 32 bit length followed by UTF-8 bytes.
 */
class BinaryOutput extends DataOutputStream {

    private final boolean swap;

    BinaryOutput(OutputStream out, ByteOrder order) {
        super(out);
        swap = order != ByteOrder.BIG_ENDIAN;
    }

    void writeInt32(int v) throws IOException {
        writeInt(swap ? Integer.reverseBytes(v) : v);
    }

    void writeInt64(long v) throws IOException {
        writeLong(swap ? Long.reverseBytes(v) : v);
    }

    void writeString(String s) throws IOException {
        final byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        writeInt32(bytes.length);
        write(bytes);
    }

    long getBytesWritten() {
        return size();
    }
}
