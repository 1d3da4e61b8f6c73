package com.clevertap.symtab.exceptions;

/**
 * Thrown when persisted symbol table data cannot be parsed. No table is produced.
 */
public class SymbolTableFormatException extends SymbolTableException {

    public SymbolTableFormatException(String message) {
        super(message);
    }

    public SymbolTableFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
