package com.clevertap.symtab;

/**
 * Write contract of a symbol table. Mutations are not synchronized: at most one thread may mutate
 * a table, and no thread may read it meanwhile.
 */
public interface MutableSymbolTable extends SymbolTable {

    /**
     * Adds a symbol under the requested key. If the symbol is already present, the requested key
     * is ignored and the existing key is returned, so callers depending on the key must check the
     * return value.
     *
     * @return The key the symbol is stored under
     * @throws com.clevertap.symtab.exceptions.DuplicateKeyException If the key is bound to a
     *                                                                 different symbol
     */
    long addSymbol(String symbol, long key);

    /**
     * Adds a symbol under {@link #availableKey()}.
     */
    long addSymbol(String symbol);

    /**
     * Removes the symbol stored under the key. Absent keys are ignored.
     */
    void removeSymbol(long key);

    void setName(String name);

    /**
     * Adds every symbol of the given table. Keys are not carried over: new symbols are keyed by
     * this table's {@link #availableKey()}, and symbols already present keep their key.
     */
    void addTable(SymbolTable table);
}
