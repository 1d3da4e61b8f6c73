package com.clevertap.symtab;

/**
 * Symbol table options. Use {@link SymbolTableBuilder} to create tables with a custom
 * configuration.
 */
public class Config {

    /**
     * Both tab and space separate the symbol and key columns of text tables.
     */
    static final String DEFAULT_FIELD_SEPARATOR = "\t ";

    String name = "";
    boolean allowNegativeLabels = false;
    String fieldSeparator = DEFAULT_FIELD_SEPARATOR;
    SymbolStore backingStore;

    public String getName() {
        return name;
    }

    /**
     * @return Whether text tables may carry negative keys. Binary tables always may.
     */
    public boolean negativeLabelsAllowed() {
        return allowNegativeLabels;
    }

    /**
     * @return The characters accepted as column separators. The first one is used for writing.
     */
    public String getFieldSeparator() {
        return fieldSeparator;
    }

    public SymbolStore getBackingStore() {
        return backingStore;
    }
}
