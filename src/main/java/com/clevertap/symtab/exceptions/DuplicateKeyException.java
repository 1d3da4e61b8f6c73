package com.clevertap.symtab.exceptions;

public class DuplicateKeyException extends SymbolTableRuntimeException {

    public DuplicateKeyException(final long key, final String boundSymbol) {
        super("The key " + key + " is already bound to the symbol \"" + boundSymbol + "\".");
    }
}
