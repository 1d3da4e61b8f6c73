package com.clevertap.symtab;

/**
 * A read only symbol table over an externally built {@link SymbolStore}.
 * <p>
 * The store is not copied. It is frozen on construction, so mutating it through its previous
 * owner fails with {@link com.clevertap.symtab.exceptions.ReadOnlySymbolTableException}. Since the
 * contents can no longer change, the checksums are computed at most once.
 */
public class ConstSymbolTable extends AbstractSymbolTable {

    ConstSymbolTable(final SymbolStore store, final Config conf) {
        super(store, conf);
        store.freeze();
    }

    /**
     * @return A mutable deep copy of this table
     */
    public DefaultSymbolTable toMutable() {
        return new DefaultSymbolTable(store.copy(), conf);
    }
}
