package com.clevertap.symtab.exceptions;

/**
 * Base class for recoverable symbol table failures.
 */
public class SymbolTableException extends Exception {

    public SymbolTableException() {
    }

    public SymbolTableException(String message) {
        super(message);
    }

    public SymbolTableException(String message, Throwable cause) {
        super(message, cause);
    }

    public SymbolTableException(Throwable cause) {
        super(cause);
    }
}
