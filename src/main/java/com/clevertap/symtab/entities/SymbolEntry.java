package com.clevertap.symtab.entities;

import java.util.Objects;

/**
 * A symbol and the key it is stored under.
 */
public class SymbolEntry {

    private final String symbol;
    private final long key;

    public SymbolEntry(String symbol, long key) {
        this.symbol = symbol;
        this.key = key;
    }

    public String getSymbol() {
        return symbol;
    }

    public long getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolEntry)) {
            return false;
        }
        final SymbolEntry that = (SymbolEntry) o;
        return key == that.key && symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, key);
    }

    @Override
    public String toString() {
        return symbol + "=" + key;
    }
}
