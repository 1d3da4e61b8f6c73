package com.clevertap.symtab;

import com.clevertap.symtab.exceptions.IncorrectConfigException;

public class SymbolTableBuilder {

    private final Config conf = new Config();

    /**
     * Default: empty.
     */
    public SymbolTableBuilder withName(String name) {
        conf.name = name;
        return this;
    }

    /**
     * Accept negative keys when reading text tables, and write them without a warning.
     * <p>
     * Default: false
     */
    public SymbolTableBuilder withNegativeLabelsAllowed() {
        conf.allowNegativeLabels = true;
        return this;
    }

    /**
     * Set the characters which separate the columns of a text table. Writing uses the first one.
     * <p>
     * Default: {@link Config#DEFAULT_FIELD_SEPARATOR}
     */
    public SymbolTableBuilder withFieldSeparator(String fieldSeparator) {
        conf.fieldSeparator = fieldSeparator;
        return this;
    }

    /**
     * Back a read only table with an existing store. The store is shared, not copied, and is
     * frozen by {@link #buildConst()}.
     */
    public SymbolTableBuilder withBackingStore(SymbolStore store) {
        conf.backingStore = store;
        return this;
    }

    Config validate() {
        if (conf.fieldSeparator == null || conf.fieldSeparator.isEmpty()) {
            throw new IncorrectConfigException("Missing required field separator.");
        }
        if (conf.fieldSeparator.indexOf('\n') >= 0) {
            throw new IncorrectConfigException("The field separator cannot contain a newline.");
        }
        return conf;
    }

    public DefaultSymbolTable build() {
        validate();
        if (conf.backingStore != null) {
            throw new IncorrectConfigException("A backing store is only supported by a read only "
                    + "table. Use buildConst() instead.");
        }
        return new DefaultSymbolTable(new SymbolStore(conf.name), conf);
    }

    public ConstSymbolTable buildConst() {
        validate();
        if (conf.backingStore == null) {
            throw new IncorrectConfigException("A read only table requires a backing store.");
        }
        return new ConstSymbolTable(conf.backingStore, conf);
    }
}
