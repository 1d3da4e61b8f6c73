package com.clevertap.symtab;

import java.io.IOException;

public interface SymbolConsumer {

    void accept(final String symbol, final long key) throws IOException;
}
