package com.clevertap.symtab.exceptions;

public class IncorrectConfigException extends SymbolTableRuntimeException {

    public IncorrectConfigException(String message) {
        super(message);
    }
}
