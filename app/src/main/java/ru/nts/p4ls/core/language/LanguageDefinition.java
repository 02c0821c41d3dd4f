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
package ru.nts.p4ls.core.language;

import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;
import ru.nts.p4ls.core.LsLog;
import ru.nts.p4ls.core.ast.NodeKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Реестр определения языка: набор правил отображения CST -> AST.
 *
 * Загружается ровно один раз за время жизни процесса и после этого неизменяем.
 * Повторная загрузка, битый документ и обращение до загрузки - фатальные ошибки:
 * работать с неизвестной грамматикой нельзя, поэтому реестр падает громко,
 * а не подставляет пустые правила.
 */
public final class LanguageDefinition {

    private static final AtomicReference<LanguageDefinition> INSTANCE = new AtomicReference<>();

    private final List<Rule> rules;
    private final Map<String, Rule> rulesByName;
    private final Map<String, CompletionKind> symbolTypes;

    LanguageDefinition(List<Rule> rules, Map<String, CompletionKind> symbolTypes) {
        this.rules = List.copyOf(rules);
        Map<String, Rule> byName = new LinkedHashMap<>();
        for (Rule rule : rules) {
            byName.put(rule.name(), rule);
        }
        this.rulesByName = Collections.unmodifiableMap(byName);
        this.symbolTypes = Collections.unmodifiableMap(new LinkedHashMap<>(symbolTypes));
    }

    /**
     * Разбирает документ правил и регистрирует его как определение языка процесса.
     *
     * @param text JSON документ правил
     * @return загруженное определение
     * @throws LsException CONFIG_INVALID для битого документа, LANGUAGE_ALREADY_LOADED при повторном вызове
     */
    public static LanguageDefinition load(String text) {
        if (INSTANCE.get() != null) {
            throw new LsException(LsErrorCode.LANGUAGE_ALREADY_LOADED);
        }
        LanguageDefinition definition;
        try {
            definition = LanguageDefinitionParser.parse(text);
        } catch (LsException e) {
            LsLog.error("Failed to parse rules: " + e.toLogMessage());
            throw e;
        }
        if (!INSTANCE.compareAndSet(null, definition)) {
            throw new LsException(LsErrorCode.LANGUAGE_ALREADY_LOADED);
        }
        LsLog.info("Language definition loaded: " + definition.rules.size() + " rule(s), "
                + definition.symbolTypes.size() + " symbol type(s)");
        return definition;
    }

    /**
     * Загружает документ правил из файла (UTF-8).
     */
    public static LanguageDefinition load(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LsLog.error("Cannot read rule set " + file + ": " + e.getMessage());
            throw new LsException(LsErrorCode.CONFIG_NOT_READABLE, Map.of("file", file.toString()), e);
        }
        return load(text);
    }

    /**
     * Возвращает загруженное определение.
     *
     * @throws LsException LANGUAGE_NOT_LOADED если load() ещё не выполнен успешно
     */
    public static LanguageDefinition get() {
        LanguageDefinition definition = INSTANCE.get();
        if (definition == null) {
            throw new LsException(LsErrorCode.LANGUAGE_NOT_LOADED);
        }
        return definition;
    }

    public static boolean isLoaded() {
        return INSTANCE.get() != null;
    }

    /**
     * Сбрасывает определение процесса. Граница teardown для тестов и перезапуска ядра.
     */
    public static void resetForTesting() {
        INSTANCE.set(null);
    }

    /**
     * Создаёт определение без регистрации в процессе (для изолированной проверки документов).
     */
    public static LanguageDefinition parseDetached(String text) {
        return LanguageDefinitionParser.parse(text);
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * Ищет правило по имени. Пустой результат означает висячую ссылку на правило.
     */
    public Optional<Rule> ruleWithName(String name) {
        return Optional.ofNullable(rulesByName.get(name));
    }

    /**
     * Правило корня файла (гарантировано проверкой при загрузке).
     */
    public Rule rootRule() {
        return rulesByName.get(NodeKind.ROOT.name());
    }

    /**
     * Виды узлов AST, открывающих новую лексическую область видимости.
     */
    public Set<NodeKind> getScopeNodes() {
        Set<NodeKind> scopes = new LinkedHashSet<>();
        for (Rule rule : rules) {
            if (rule.isScope()) {
                scopes.add(NodeKind.rule(rule.name()));
            }
        }
        return scopes;
    }

    /**
     * Пары (вид узла, категория объявления) для правил с ролью Init.
     */
    public Map<NodeKind, String> getSymbolInitNodes() {
        Map<NodeKind, String> inits = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (rule.symbol() instanceof SymbolRole.Init init) {
                inits.put(NodeKind.rule(rule.name()), init.category());
            }
        }
        return inits;
    }

    /**
     * Вид автодополнения для символа, объявленного узлом указанного вида.
     */
    public Optional<CompletionKind> completionKindFor(NodeKind declarationKind) {
        return Optional.ofNullable(symbolTypes.get(declarationKind.name()));
    }
}
