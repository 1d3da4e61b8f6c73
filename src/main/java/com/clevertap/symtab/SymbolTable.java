package com.clevertap.symtab;

import com.clevertap.symtab.entities.SymbolEntry;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Read contract shared by mutable and read only symbol tables.
 * <p>
 * A symbol table is a bijection between string symbols and 64 bit keys. Lookups never fail: absent
 * keys yield {@code null} and absent symbols yield {@link #NO_SYMBOL}.
 * <p>
 * Lookups, iteration and checksum queries may run concurrently, provided no thread is mutating the
 * table at the same time.
 */
public interface SymbolTable extends Iterable<SymbolEntry> {

    /**
     * Reserved key. Never bound to a symbol.
     */
    long NO_SYMBOL = -1;

    String getName();

    /**
     * @return The symbol stored under the key, or null
     */
    String find(long key);

    /**
     * @return The key of the symbol, or {@link #NO_SYMBOL}
     */
    long find(String symbol);

    default boolean member(long key) {
        return find(key) != null;
    }

    default boolean member(String symbol) {
        return find(symbol) != NO_SYMBOL;
    }

    int numSymbols();

    /**
     * @return The key assigned by the next auto keyed insertion
     */
    long availableKey();

    /**
     * @param position A storage position in {@code [0, numSymbols())}
     * @return The key at that position, or {@link #NO_SYMBOL}
     */
    long getNthKey(int position);

    /**
     * @return A digest of all symbols in storage order. Keys do not contribute.
     */
    String checkSum();

    /**
     * @return A digest of all symbol/key pairs. Used to decide compatibility.
     */
    String labeledCheckSum();

    /**
     * Visits every entry in ascending key order.
     */
    default void iterate(final SymbolConsumer consumer) throws IOException {
        for (SymbolEntry entry : this) {
            consumer.accept(entry.getSymbol(), entry.getKey());
        }
    }

    /**
     * Writes the binary representation of this table. See {@link SymbolTables#read}.
     */
    void write(OutputStream out) throws IOException;

    void write(Path path) throws IOException;

    /**
     * Writes one {@code symbol<separator>key} line per entry.
     */
    void writeText(Writer out) throws IOException;

    void writeText(Path path) throws IOException;
}
