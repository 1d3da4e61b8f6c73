package com.clevertap.symtab;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.clevertap.symtab.utils.CheckSummer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CheckSumCacheTest {

    @Test
    void contentDigestIgnoresKeys() {
        final DefaultSymbolTable first = new DefaultSymbolTable();
        first.addSymbol("a", 0);
        first.addSymbol("b", 1);

        final DefaultSymbolTable second = new DefaultSymbolTable();
        second.addSymbol("a", 5);
        second.addSymbol("b", 9);

        assertEquals(first.checkSum(), second.checkSum());
        assertNotEquals(first.labeledCheckSum(), second.labeledCheckSum());
    }

    @Test
    void digestsMatchDefinition() {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        table.addSymbol("a", 0);
        table.addSymbol("b", 1);
        table.addSymbol("c", 7);

        final String content = new CheckSummer()
                .update("a").update((byte) 0)
                .update("b").update((byte) 0)
                .update("c").update((byte) 0)
                .digest();
        final String labeled = new CheckSummer()
                .update("a\t0")
                .update("b\t1")
                .update("c\t7")
                .digest();

        assertEquals(content, table.checkSum());
        assertEquals(labeled, table.labeledCheckSum());
        assertEquals(32, table.checkSum().length());
    }

    @Test
    void negativeKeysDoNotAffectLabeledDigest() {
        final DefaultSymbolTable first = new DefaultSymbolTable();
        first.addSymbol("a", 0);
        first.addSymbol("neg", -5);

        final DefaultSymbolTable second = new DefaultSymbolTable();
        second.addSymbol("a", 0);
        second.addSymbol("neg", -9);

        assertEquals(first.labeledCheckSum(), second.labeledCheckSum());
    }

    @Test
    void mutationInvalidates() {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        table.addSymbol("a");
        final String before = table.labeledCheckSum();
        assertTrue(table.checkSums.isValid());

        table.addSymbol("b");
        assertFalse(table.checkSums.isValid());
        final String afterAdd = table.labeledCheckSum();
        assertNotEquals(before, afterAdd);

        table.removeSymbol(1);
        assertFalse(table.checkSums.isValid());
        assertEquals(before, table.labeledCheckSum());
    }

    @Test
    void renameKeepsDigests() {
        final DefaultSymbolTable table = new DefaultSymbolTable("one");
        table.addSymbol("a");
        final String labeled = table.labeledCheckSum();
        table.setName("two");
        assertTrue(table.checkSums.isValid());
        assertEquals(labeled, table.labeledCheckSum());
    }

    @Test
    void concurrentReaders() throws Exception {
        final DefaultSymbolTable table = new DefaultSymbolTable();
        for (int i = 0; i < 50_000; i++) {
            table.addSymbol("symbol" + i);
        }
        final String expected = table.copy().labeledCheckSum();

        final int threads = 8;
        final ExecutorService service = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);
        final List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                final Callable<String> reader = () -> {
                    start.await();
                    final String labeled = table.labeledCheckSum();
                    assertEquals("symbol42", table.find(42));
                    assertEquals(42, table.find("symbol42"));
                    return labeled;
                };
                results.add(service.submit(reader));
            }
            start.countDown();

            final Set<String> digests = new HashSet<>();
            for (Future<String> result : results) {
                digests.add(result.get(1, TimeUnit.MINUTES));
            }
            assertEquals(Set.of(expected), digests);
        } finally {
            service.shutdown();
            assertTrue(service.awaitTermination(1, TimeUnit.MINUTES));
        }
    }
}
