/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.p4ls.core.document;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;
import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.language.LanguageDefinition;
import ru.nts.p4ls.core.syntax.P4Samples;
import ru.nts.p4ls.core.syntax.SyntaxParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DocumentManagerTest {

    private static final String URI = "file:///ingress.p4";

    private final LanguageDefinition rules = P4Samples.rules();
    private final CountDownLatch slowStarted = new CountDownLatch(1);
    private final CountDownLatch slowRelease = new CountDownLatch(1);
    private DocumentManager manager;

    /**
     * Парсер образцов, который задерживает файлы со словом SLOW до slowRelease
     * и падает на файлах со словом CRASH.
     */
    private SyntaxParser blockingParser() {
        SyntaxParser samples = P4Samples.parser();
        return (content, langId) -> {
            if (content.contains("CRASH")) {
                throw new IllegalStateException("grammar crashed");
            }
            if (content.contains("SLOW")) {
                slowStarted.countDown();
                try {
                    if (!slowRelease.await(10, TimeUnit.SECONDS)) {
                        throw new IllegalStateException("Release latch timed out");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            return samples.parse(content, langId);
        };
    }

    private static List<String> constantNames(DocumentSnapshot snapshot) {
        List<String> names = new ArrayList<>();
        snapshot.symbols().getTopLevelSymbols()
                .ifPresent(symbols -> symbols.getConstants().forEach(s -> names.add(s.getName())));
        return names;
    }

    @BeforeEach
    void setUp() {
        manager = new DocumentManager(blockingParser(), "p4", rules, 4);
    }

    @AfterEach
    void tearDown() {
        slowRelease.countDown();
        manager.close();
    }

    @Test
    @DisplayName("open() строит первый снимок синхронно")
    void openBuildsSnapshot() {
        DocumentSnapshot snapshot = manager.open(URI, 1, P4Samples.PROGRAM);

        assertEquals(1, snapshot.version());
        assertEquals(P4Samples.PROGRAM, snapshot.source());
        assertSame(snapshot, manager.snapshot(URI).orElseThrow());
        assertTrue(manager.isOpen(URI));
        assertEquals(Set.of(URI), manager.getOpenDocuments());
        assertEquals(Position.of(3, 4),
                manager.actions(URI).definition(Position.of(6, 19)).orElseThrow().start());
    }

    @Test
    @DisplayName("change() пересобирает документ целиком")
    void changeRebuilds() {
        manager.open(URI, 1, P4Samples.PROGRAM);

        DocumentSnapshot changed = manager.change(URI, 2, "const bit<8> ONLY = 1;");

        assertEquals(2, changed.version());
        assertEquals(List.of("ONLY"), constantNames(changed));
        assertTrue(manager.actions(URI).hover(Position.of(0, 13)).orElseThrow().contains("ONLY"));
    }

    @Test
    @DisplayName("Сбой парсера - INTERNAL_ERROR, опубликованный снимок остаётся")
    void parserFailureKeepsSnapshot() {
        DocumentSnapshot first = manager.open(URI, 1, P4Samples.PROGRAM);

        LsException e = assertThrows(LsException.class, () -> manager.change(URI, 2, "CRASH"));

        assertEquals(LsErrorCode.INTERNAL_ERROR, e.getCode());
        assertEquals(URI, e.getContext().get("uri"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertSame(first, manager.snapshot(URI).orElseThrow());
    }

    @Test
    @DisplayName("Старая версия не вытесняет более новую")
    void olderVersionIsIgnored() {
        manager.open(URI, 1, P4Samples.PROGRAM);
        manager.change(URI, 3, "const bit<8> NEWER = 1;");

        DocumentSnapshot result = manager.change(URI, 2, "const bit<8> OLDER = 1;");

        assertEquals(3, result.version());
        assertEquals(List.of("NEWER"), constantNames(manager.snapshot(URI).orElseThrow()));
    }

    @Test
    @DisplayName("До завершения пересборки запросы видят предыдущий снимок целиком")
    void swapOnCompletion() throws Exception {
        DocumentSnapshot first = manager.open(URI, 1, P4Samples.PROGRAM);

        CompletableFuture<DocumentSnapshot> rebuild = manager.changeAsync(URI, 2, "const bit<8> SLOW = 1;");
        assertTrue(slowStarted.await(10, TimeUnit.SECONDS));

        assertSame(first, manager.snapshot(URI).orElseThrow());
        assertEquals("variable a: bit<8>", manager.actions(URI).hover(Position.of(4, 4)).orElseThrow());
        assertFalse(rebuild.isDone());

        slowRelease.countDown();
        DocumentSnapshot second = rebuild.get(10, TimeUnit.SECONDS);

        assertEquals(2, second.version());
        assertSame(second, manager.snapshot(URI).orElseThrow());
        assertEquals(List.of("SLOW"), constantNames(second));
    }

    @Test
    @DisplayName("Разные документы пересобираются параллельно и независимо")
    void concurrentDocuments() throws Exception {
        List<CompletableFuture<DocumentSnapshot>> rebuilds = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String uri = "file:///doc" + i + ".p4";
            manager.open(uri, 1, "");
            rebuilds.add(manager.changeAsync(uri, 2, "const bit<8> C" + i + " = " + i + ";"));
        }
        CompletableFuture.allOf(rebuilds.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        for (int i = 0; i < 20; i++) {
            DocumentSnapshot snapshot = manager.snapshot("file:///doc" + i + ".p4").orElseThrow();
            assertEquals(2, snapshot.version());
            assertEquals(List.of("C" + i), constantNames(snapshot));
        }
        assertEquals(20, manager.getOpenDocuments().size());
    }

    @Test
    @DisplayName("Неоткрытый документ - DOCUMENT_NOT_FOUND")
    void unknownDocument() {
        LsException e = assertThrows(LsException.class, () -> manager.actions("file:///nowhere.p4"));
        assertEquals(LsErrorCode.DOCUMENT_NOT_FOUND, e.getCode());
        assertThrows(LsException.class, () -> manager.change("file:///nowhere.p4", 2, ""));
        assertThrows(LsException.class, () -> manager.changeAsync("file:///nowhere.p4", 2, ""));

        manager.open(URI, 1, P4Samples.PROGRAM);
        manager.close(URI);
        assertFalse(manager.isOpen(URI));
        assertTrue(manager.snapshot(URI).isEmpty());
    }

    @Test
    @DisplayName("DocumentState: публикация более старой версии отклоняется")
    void documentStateRejectsOlderVersion() {
        DocumentState state = new DocumentState(URI);
        assertNull(state.snapshot());

        DocumentSnapshot v2 = DocumentSnapshot.build(URI, 2, P4Samples.constants("const bit<8> B = 2;"), rules);
        DocumentSnapshot v1 = DocumentSnapshot.build(URI, 1, P4Samples.constants("const bit<8> A = 1;"), rules);

        assertTrue(state.publish(v2));
        assertFalse(state.publish(v1));
        assertSame(v2, state.snapshot());
    }
}
