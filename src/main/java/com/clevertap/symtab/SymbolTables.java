package com.clevertap.symtab;

import com.clevertap.symtab.exceptions.SymbolTableException;
import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for loading symbol tables, and for comparing them.
 */
public class SymbolTables {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolTables.class);

    private SymbolTables() {
    }

    /**
     * Reads a table in the binary form written by {@link SymbolTable#write(java.io.OutputStream)}.
     *
     * @param source Used in error messages only. The table keeps its persisted name.
     * @throws com.clevertap.symtab.exceptions.SymbolTableFormatException If the data is not a
     *                                                                      valid symbol table
     */
    public static DefaultSymbolTable read(InputStream in, String source)
            throws IOException, SymbolTableException {
        return BinaryFormat.read(in, source, new Config());
    }

    public static DefaultSymbolTable read(Path path) throws IOException, SymbolTableException {
        try (final InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return read(in, path.toString());
        }
    }

    /**
     * Reads a text table. The table is named after the source.
     *
     * @param builder Supplies the field separators and the negative key policy
     */
    public static DefaultSymbolTable readText(Reader in, String source,
            SymbolTableBuilder builder) throws IOException, SymbolTableException {
        final BufferedReader reader = in instanceof BufferedReader
                ? (BufferedReader) in : new BufferedReader(in);
        return TextFormat.read(reader, source, builder.validate());
    }

    public static DefaultSymbolTable readText(Reader in, String source)
            throws IOException, SymbolTableException {
        return readText(in, source, new SymbolTableBuilder());
    }

    public static DefaultSymbolTable readText(Path path, SymbolTableBuilder builder)
            throws IOException, SymbolTableException {
        try (final BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readText(in, path.toString(), builder);
        }
    }

    public static DefaultSymbolTable readText(Path path) throws IOException, SymbolTableException {
        return readText(path, new SymbolTableBuilder());
    }

    public static byte[] toBytes(SymbolTable table) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            table.write(out);
        } catch (IOException e) {
            // Not possible with an in memory stream.
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public static DefaultSymbolTable fromBytes(byte[] bytes) throws SymbolTableException {
        try {
            return read(new ByteArrayInputStream(bytes), "<bytes>");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Two tables are compatible if either is absent or their labeled checksums match.
     */
    public static boolean compatible(SymbolTable first, SymbolTable second,
            CompatibilityPolicy policy) {
        if (!policy.isCheckEnabled()) {
            return true;
        }
        if (first != null && second != null
                && !first.labeledCheckSum().equals(second.labeledCheckSum())) {
            if (policy.warnOnMismatch()) {
                LOG.warn("Symbol table checksums do not match. Table sizes are {} and {}",
                        first.numSymbols(), second.numSymbols());
            }
            return false;
        }
        return true;
    }

    public static boolean compatible(SymbolTable first, SymbolTable second) {
        return compatible(first, second, CompatibilityPolicy.DEFAULT);
    }
}
