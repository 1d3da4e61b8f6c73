package com.clevertap.symtab;

import com.clevertap.symtab.entities.SymbolEntry;

/**
 * The mutable symbol table.
 */
public class DefaultSymbolTable extends AbstractSymbolTable implements MutableSymbolTable {

    public DefaultSymbolTable() {
        this("");
    }

    public DefaultSymbolTable(String name) {
        this(new SymbolStore(name), new Config());
    }

    DefaultSymbolTable(final SymbolStore store, final Config conf) {
        super(store, conf);
    }

    @Override
    public long addSymbol(String symbol, long key) {
        final int sizeBefore = store.size();
        final long effectiveKey = store.addSymbol(symbol, key);
        if (store.size() != sizeBefore) {
            checkSums.invalidate();
        }
        return effectiveKey;
    }

    @Override
    public long addSymbol(String symbol) {
        final int sizeBefore = store.size();
        final long effectiveKey = store.addSymbol(symbol);
        if (store.size() != sizeBefore) {
            checkSums.invalidate();
        }
        return effectiveKey;
    }

    @Override
    public void removeSymbol(long key) {
        if (store.removeSymbol(key)) {
            checkSums.invalidate();
        }
    }

    @Override
    public void setName(String name) {
        store.setName(name);
    }

    @Override
    public void addTable(SymbolTable table) {
        for (SymbolEntry entry : table) {
            addSymbol(entry.getSymbol());
        }
    }

    /**
     * @return An independent deep copy of this table
     */
    public DefaultSymbolTable copy() {
        return new DefaultSymbolTable(store.copy(), conf);
    }

    /**
     * Turns this table read only. The returned table shares this table's data without copying it.
     * Any later mutation through this instance throws
     * {@link com.clevertap.symtab.exceptions.ReadOnlySymbolTableException}.
     */
    public ConstSymbolTable freeze() {
        return new ConstSymbolTable(store, conf);
    }
}
