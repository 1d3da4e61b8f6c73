package com.clevertap.symtab.exceptions;

public class SymbolTableRuntimeException extends RuntimeException {

    public SymbolTableRuntimeException() {
    }

    public SymbolTableRuntimeException(String message) {
        super(message);
    }

    public SymbolTableRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }

    public SymbolTableRuntimeException(Throwable cause) {
        super(cause);
    }
}
