package com.clevertap.symtab;

import com.clevertap.symtab.exceptions.DuplicateKeyException;
import com.clevertap.symtab.exceptions.SymbolTableFormatException;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.util.Map.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol: magic (4 bytes) | name (string) | available key (8 bytes) | count (8 bytes) | count x
 * (symbol (string), key (8 bytes)).
 * <p>
 * Notes:
 * <ul>
 *     <li>A string is a 4 byte length followed by that many UTF-8 bytes</li>
 *     <li>Integers use the native byte order of the writer. A reader with the opposite byte
 *     order detects it through the magic number and refuses the data</li>
 *     <li>Records list the dense range first, then the sparse keys in ascending order. Replaying
 *     them through {@link SymbolStore#addSymbol(String, long)} rebuilds the same dense/sparse
 *     split</li>
 * </ul>
 */
class BinaryFormat {

    static final int MAGIC = 2125658996;

    private static final Logger LOG = LoggerFactory.getLogger(BinaryFormat.class);

    private BinaryFormat() {
    }

    static void write(final SymbolStore store, final OutputStream os) throws IOException {
        final BinaryOutput out = new BinaryOutput(os, ByteOrder.nativeOrder());
        out.writeInt32(MAGIC);
        out.writeString(store.getName());
        out.writeInt64(store.availableKey());
        out.writeInt64(store.size());

        final int denseLimit = store.denseLimit();
        for (int i = 0; i < denseLimit; i++) {
            out.writeString(store.symbolAt(i));
            out.writeInt64(i);
        }
        for (Entry<Long, Integer> entry : store.sparseEntries().entrySet()) {
            out.writeString(store.symbolAt(entry.getValue()));
            out.writeInt64(entry.getKey());
        }
        out.flush();
        LOG.debug("Wrote {} symbols ({} bytes) of table \"{}\"", store.size(),
                out.getBytesWritten(), store.getName());
    }

    static DefaultSymbolTable read(final InputStream is, final String source, final Config conf)
            throws IOException, SymbolTableFormatException {
        final BinaryInput in = new BinaryInput(is, ByteOrder.nativeOrder());
        final SymbolStore store;
        long record = 0;
        try {
            final int magic = in.readInt32();
            if (magic != MAGIC) {
                if (Integer.reverseBytes(magic) == MAGIC) {
                    throw new SymbolTableFormatException("Symbol table " + source
                            + " was written with a different byte order");
                }
                throw new SymbolTableFormatException("Bad magic number 0x"
                        + Integer.toHexString(magic) + " in " + source);
            }

            final String name = in.readString();
            if (name == null) {
                throw new SymbolTableFormatException("Negative name length in " + source);
            }
            store = new SymbolStore(name);
            store.setAvailableKey(in.readInt64());

            final long count = in.readInt64();
            if (count < 0) {
                throw new SymbolTableFormatException("Negative symbol count " + count + " in "
                        + source);
            }

            for (; record < count; record++) {
                final String symbol = in.readString();
                if (symbol == null) {
                    throw new SymbolTableFormatException("Negative symbol length in " + source
                            + ", record = " + record);
                }
                store.addSymbol(symbol, in.readInt64());
            }
        } catch (EOFException e) {
            throw new SymbolTableFormatException("Read failed: " + source
                    + " is truncated, record = " + record, e);
        } catch (DuplicateKeyException e) {
            throw new SymbolTableFormatException("Read failed: " + source + ", record = "
                    + record + ": " + e.getMessage(), e);
        }

        store.shrinkToFit();
        LOG.info("Read {} symbols from {}", store.size(), source);
        return new DefaultSymbolTable(store, conf);
    }
}
