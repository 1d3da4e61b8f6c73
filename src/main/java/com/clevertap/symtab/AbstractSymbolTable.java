package com.clevertap.symtab;

import com.clevertap.symtab.entities.SymbolEntry;
import java.io.BufferedOutputStream;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Read operations over a {@link SymbolStore}, shared by both table variants.
 */
abstract class AbstractSymbolTable implements SymbolTable {

    final SymbolStore store;
    final CheckSumCache checkSums;
    final Config conf;

    AbstractSymbolTable(final SymbolStore store, final Config conf) {
        this.store = store;
        this.conf = conf;
        this.checkSums = new CheckSumCache(store);
    }

    public Config getConf() {
        return conf;
    }

    @Override
    public String getName() {
        return store.getName();
    }

    @Override
    public String find(long key) {
        return store.find(key);
    }

    @Override
    public long find(String symbol) {
        return store.find(symbol);
    }

    @Override
    public int numSymbols() {
        return store.size();
    }

    @Override
    public long availableKey() {
        return store.availableKey();
    }

    @Override
    public long getNthKey(int position) {
        return store.getNthKey(position);
    }

    @Override
    public String checkSum() {
        return checkSums.checkSum();
    }

    @Override
    public String labeledCheckSum() {
        return checkSums.labeledCheckSum();
    }

    @Override
    public Iterator<SymbolEntry> iterator() {
        return store.iterator();
    }

    @Override
    public void write(OutputStream out) throws IOException {
        BinaryFormat.write(store, out);
    }

    @Override
    public void write(Path path) throws IOException {
        try (final OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            write(out);
        }
    }

    @Override
    public void writeText(Writer out) throws IOException {
        TextFormat.write(this, out, conf);
    }

    @Override
    public void writeText(Path path) throws IOException {
        try (final BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeText(out);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + getName() + ", symbols=" + numSymbols()
                + "}";
    }
}
