package com.clevertap.symtab;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.clevertap.symtab.entities.SymbolEntry;
import com.clevertap.symtab.exceptions.ReadOnlySymbolTableException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DefaultSymbolTableTest {

    @Test
    void simpleTest() {
        final DefaultSymbolTable table = new DefaultSymbolTable("simple");
        assertEquals("simple", table.getName());
        assertEquals(0, table.numSymbols());

        assertEquals(0, table.addSymbol("<eps>"));
        assertEquals(1, table.addSymbol("a"));
        assertEquals(2, table.addSymbol("b"));

        assertEquals(3, table.numSymbols());
        assertEquals(3, table.availableKey());
        assertEquals("a", table.find(1));
        assertEquals(2, table.find("b"));
        assertTrue(table.member(0));
        assertTrue(table.member("<eps>"));
        assertFalse(table.member(3));
        assertFalse(table.member("c"));
        assertNull(table.find(3));
        assertEquals(SymbolTable.NO_SYMBOL, table.find("c"));
    }

    @Test
    void reAddingSymbolReturnsOriginalKey() {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        table.addSymbol("a", 0);
        table.addSymbol("b", 1);
        final String checkSum = table.labeledCheckSum();

        assertEquals(1, table.addSymbol("b", 17));
        assertEquals(2, table.numSymbols());
        assertNull(table.find(17));
        assertEquals(checkSum, table.labeledCheckSum());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 5, 9})
    void removeKeepsOtherKeys(final int removed) {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        for (int i = 0; i < 10; i++) {
            table.addSymbol("s" + i, i);
        }
        table.addSymbol("far", 1000);

        table.removeSymbol(removed);

        assertNull(table.find(removed));
        assertEquals(SymbolTable.NO_SYMBOL, table.find("s" + removed));
        for (int i = 0; i < 10; i++) {
            if (i != removed) {
                assertEquals("s" + i, table.find(i));
                assertEquals(i, table.find("s" + i));
            }
        }
        assertEquals("far", table.find(1000));
        assertEquals(10, table.numSymbols());
    }

    @Test
    void removeAbsentKeyIsNoop() {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        table.addSymbol("a");
        final String checkSum = table.checkSum();
        table.removeSymbol(4);
        assertEquals(1, table.numSymbols());
        assertEquals(checkSum, table.checkSum());
    }

    @Test
    void getNthKey() {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        table.addSymbol("a", 0);
        table.addSymbol("b", 8);
        assertEquals(0, table.getNthKey(0));
        assertEquals(8, table.getNthKey(1));
        assertEquals(SymbolTable.NO_SYMBOL, table.getNthKey(2));
        assertEquals(SymbolTable.NO_SYMBOL, table.getNthKey(-1));
    }

    @Test
    void addTableMergesBySymbol() {
        final DefaultSymbolTable destination = new DefaultSymbolTable("dst");
        destination.addSymbol("a", 0);
        destination.addSymbol("b", 1);

        final DefaultSymbolTable source = new DefaultSymbolTable("src");
        source.addSymbol("b", 0);
        source.addSymbol("c", 40);
        source.addSymbol("d", 41);

        destination.addTable(source);

        assertEquals(4, destination.numSymbols());
        assertEquals(1, destination.find("b"));
        assertEquals(2, destination.find("c"));
        assertEquals(3, destination.find("d"));
        assertEquals("dst", destination.getName());
    }

    @Test
    void iterateInKeyOrder() throws IOException {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        table.addSymbol("x", 3);
        table.addSymbol("y", 0);
        table.addSymbol("z", 1);

        final List<SymbolEntry> entries = new ArrayList<>();
        table.iterate((symbol, key) -> entries.add(new SymbolEntry(symbol, key)));
        assertEquals(List.of(new SymbolEntry("y", 0), new SymbolEntry("z", 1),
                new SymbolEntry("x", 3)), entries);

        final List<SymbolEntry> iterated = new ArrayList<>();
        table.forEach(iterated::add);
        assertEquals(entries, iterated);
    }

    @Test
    void copyIsIndependent() {
        final DefaultSymbolTable table = new DefaultSymbolTable("orig");
        table.addSymbol("a");
        table.addSymbol("b");

        final DefaultSymbolTable copy = table.copy();
        assertEquals(table.labeledCheckSum(), copy.labeledCheckSum());

        copy.addSymbol("c");
        copy.setName("copy");
        table.removeSymbol(0);

        assertEquals("orig", table.getName());
        assertEquals(1, table.numSymbols());
        assertEquals(3, copy.numSymbols());
        assertEquals("a", copy.find(0));
        assertNotEquals(table.labeledCheckSum(), copy.labeledCheckSum());
    }

    @Test
    void freezeSharesStore() {
        final DefaultSymbolTable table = new DefaultSymbolTable("t");
        table.addSymbol("a");
        final ConstSymbolTable frozen = table.freeze();

        assertEquals("a", frozen.find(0));
        assertEquals(table.checkSum(), frozen.checkSum());
        assertThrows(ReadOnlySymbolTableException.class, () -> table.addSymbol("b"));
        assertThrows(ReadOnlySymbolTableException.class, () -> table.removeSymbol(0));
        assertThrows(ReadOnlySymbolTableException.class, () -> table.setName("u"));
        assertEquals(1, frozen.numSymbols());
    }

    @Test
    void growthAcrossBucketBoundaries() {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        for (int count : new int[]{20, 200}) {
            for (int i = 0; i < count; i++) {
                table.addSymbol("g" + count + "_" + i);
            }
        }
        assertEquals(220, table.numSymbols());
        long key = 0;
        for (SymbolEntry entry : table) {
            assertEquals(key++, entry.getKey());
            assertEquals(entry.getKey(), table.find(entry.getSymbol()));
        }
    }
}
