package com.clevertap.symtab.exceptions;

/**
 * Signals a programming error: a read only symbol table was asked to mutate.
 */
public class ReadOnlySymbolTableException extends SymbolTableRuntimeException {

    public ReadOnlySymbolTableException(final String tableName) {
        super("The symbol table \"" + tableName + "\" is read only!");
    }
}
