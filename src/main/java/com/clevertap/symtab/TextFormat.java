package com.clevertap.symtab;

import com.clevertap.symtab.exceptions.DuplicateKeyException;
import com.clevertap.symtab.exceptions.SymbolTableFormatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.StringTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line oriented text form: {@code symbol<separator>key}, one entry per line, no header.
 * <p>
 * Writing is permissive: negative keys are written even when the configuration disallows them
 * (with a warning). Reading is strict and rejects the whole input on the first bad line.
 */
class TextFormat {

    private static final Logger LOG = LoggerFactory.getLogger(TextFormat.class);

    private TextFormat() {
    }

    static void write(final SymbolTable table, final Writer out, final Config conf)
            throws IOException {
        final char separator = conf.getFieldSeparator().charAt(0);
        final boolean[] warned = {false};
        table.iterate((symbol, key) -> {
            if (key < 0 && !conf.negativeLabelsAllowed() && !warned[0]) {
                LOG.warn("Negative symbol table entry when not allowed: {} in table \"{}\"",
                        key, table.getName());
                warned[0] = true;
            }
            out.write(symbol);
            out.write(separator);
            out.write(Long.toString(key));
            out.write('\n');
        });
        out.flush();
    }

    /**
     * @param source Names the resulting table, and appears in error messages
     */
    static DefaultSymbolTable read(final BufferedReader in, final String source, final Config conf)
            throws IOException, SymbolTableFormatException {
        final SymbolStore store = new SymbolStore(source);
        final String delimiters = conf.getFieldSeparator() + "\n";

        long lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            final StringTokenizer columns = new StringTokenizer(line, delimiters);
            final int columnCount = columns.countTokens();
            if (columnCount == 0) {
                continue;
            }
            if (columnCount != 2) {
                throw new SymbolTableFormatException("Bad number of columns (" + columnCount
                        + "), source = " + source + ", line = " + lineNumber + ":<" + line + ">");
            }

            final String symbol = columns.nextToken();
            final String value = columns.nextToken();
            final long key = parseKey(value, source, lineNumber, conf);
            try {
                store.addSymbol(symbol, key);
            } catch (DuplicateKeyException e) {
                throw new SymbolTableFormatException(e.getMessage() + " source = " + source
                        + ", line = " + lineNumber, e);
            }
        }

        store.shrinkToFit();
        LOG.info("Read {} symbols from {}", store.size(), source);
        return new DefaultSymbolTable(store, conf);
    }

    private static long parseKey(final String value, final String source, final long lineNumber,
            final Config conf) throws SymbolTableFormatException {
        final long key;
        try {
            key = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw badKey(value, source, lineNumber, e);
        }
        if (key == SymbolTable.NO_SYMBOL || (key < 0 && !conf.negativeLabelsAllowed())) {
            throw badKey(value, source, lineNumber, null);
        }
        return key;
    }

    private static SymbolTableFormatException badKey(final String value, final String source,
            final long lineNumber, final Throwable cause) {
        return new SymbolTableFormatException("Bad non-negative integer \"" + value
                + "\", source = " + source + ", line = " + lineNumber, cause);
    }
}
