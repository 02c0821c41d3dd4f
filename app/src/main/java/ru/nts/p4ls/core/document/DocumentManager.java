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

import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;
import ru.nts.p4ls.core.LsLog;
import ru.nts.p4ls.core.language.LanguageDefinition;
import ru.nts.p4ls.core.syntax.SyntaxParser;
import ru.nts.p4ls.core.syntax.SyntaxTree;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Открытые документы и их пересборка.
 *
 * Каждый документ пересобирается целиком при каждом изменении текста.
 * Разные документы независимы и пересобираются параллельно на пуле рабочих потоков,
 * общего изменяемого состояния между ними нет.
 * Дебаунс частых правок - забота протокольного слоя.
 */
public final class DocumentManager implements AutoCloseable {

    /**
     * Размер пула по умолчанию (переопределяется P4LS_WORKERS).
     */
    static final int DEFAULT_WORKERS = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);

    private final SyntaxParser parser;
    private final String langId;
    private final LanguageDefinition definition;
    private final Map<String, DocumentState> documents = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public DocumentManager(SyntaxParser parser, String langId, LanguageDefinition definition) {
        this(parser, langId, definition, workersFromEnvironment());
    }

    public DocumentManager(SyntaxParser parser, String langId, LanguageDefinition definition, int workers) {
        this.parser = parser;
        this.langId = langId;
        this.definition = definition;
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread thread = new Thread(r, "p4ls-rebuild-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Открывает документ и синхронно строит первый снимок.
     */
    public DocumentSnapshot open(String uri, int version, String content) {
        DocumentState state = documents.computeIfAbsent(uri, DocumentState::new);
        return rebuild(state, version, content);
    }

    /**
     * Синхронная пересборка после изменения текста.
     *
     * @throws LsException DOCUMENT_NOT_FOUND если документ не открыт
     */
    public DocumentSnapshot change(String uri, int version, String content) {
        return rebuild(requireState(uri), version, content);
    }

    /**
     * Пересборка на рабочем потоке. До её завершения запросы видят предыдущий снимок.
     */
    public CompletableFuture<DocumentSnapshot> changeAsync(String uri, int version, String content) {
        DocumentState state = requireState(uri);
        return CompletableFuture.supplyAsync(() -> rebuild(state, version, content), executor);
    }

    public void close(String uri) {
        documents.remove(uri);
    }

    public boolean isOpen(String uri) {
        return documents.containsKey(uri);
    }

    public Set<String> getOpenDocuments() {
        return Set.copyOf(documents.keySet());
    }

    /**
     * Текущий опубликованный снимок документа.
     */
    public Optional<DocumentSnapshot> snapshot(String uri) {
        DocumentState state = documents.get(uri);
        return state == null ? Optional.empty() : Optional.ofNullable(state.snapshot());
    }

    /**
     * Функции редактора над текущим снимком документа.
     *
     * @throws LsException DOCUMENT_NOT_FOUND если документ не открыт или ещё не собран
     */
    public LanguageActions actions(String uri) {
        DocumentSnapshot snapshot = snapshot(uri)
                .orElseThrow(() -> new LsException(LsErrorCode.DOCUMENT_NOT_FOUND, "uri", uri));
        return new LanguageActions(snapshot);
    }

    /**
     * Собирает и публикует снимок. Сбой сборки не трогает опубликованный снимок.
     *
     * @throws LsException INTERNAL_ERROR если парсер или сборка упали с непредвиденной ошибкой
     */
    private DocumentSnapshot rebuild(DocumentState state, int version, String content) {
        Instant start = Instant.now();
        DocumentSnapshot snapshot;
        try {
            SyntaxTree tree = parser.parse(content, langId);
            snapshot = DocumentSnapshot.build(state.getUri(), version, tree, definition);
        } catch (LsException e) {
            throw e;
        } catch (RuntimeException e) {
            LsLog.error("Rebuild of " + state.getUri() + " v" + version + " failed: "
                    + e.getClass().getName() + ": " + e.getMessage());
            throw new LsException(LsErrorCode.INTERNAL_ERROR,
                    Map.of("uri", state.getUri(), "version", version), e);
        }
        boolean published = state.publish(snapshot);
        LsLog.debug("Rebuilt " + state.getUri() + " v" + version + " in "
                + Duration.between(start, Instant.now()).toMillis() + " ms"
                + (published ? "" : " (superseded by a newer version)"));
        return published ? snapshot : state.snapshot();
    }

    private DocumentState requireState(String uri) {
        DocumentState state = documents.get(uri);
        if (state == null) {
            throw new LsException(LsErrorCode.DOCUMENT_NOT_FOUND, "uri", uri);
        }
        return state;
    }

    private static int workersFromEnvironment() {
        String value = System.getenv("P4LS_WORKERS");
        if (value == null || value.isBlank()) {
            return DEFAULT_WORKERS;
        }
        try {
            int workers = Integer.parseInt(value.trim());
            return workers > 0 ? workers : DEFAULT_WORKERS;
        } catch (NumberFormatException e) {
            LsLog.error("Invalid P4LS_WORKERS value '" + value + "', using " + DEFAULT_WORKERS);
            return DEFAULT_WORKERS;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
