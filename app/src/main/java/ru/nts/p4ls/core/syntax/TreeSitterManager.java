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
package ru.nts.p4ls.core.syntax;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;
import ru.nts.p4ls.core.LsLog;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Менеджер tree-sitter парсеров.
 * Грамматику P4 поставляет хост-процесс через {@link #registerLanguage(String, TSLanguage)}.
 * Thread-safe через ThreadLocal парсеров: каждый рабочий поток пересборки документов
 * получает свой TSParser.
 */
public final class TreeSitterManager implements SyntaxParser {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Зарегистрированные TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<String, TSLanguage> languages = new ConcurrentHashMap<>();

    /**
     * ThreadLocal парсеры для каждого языка (TSParser не thread-safe).
     */
    private final Map<String, ThreadLocal<TSParser>> parsers = new ConcurrentHashMap<>();

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Регистрирует грамматику под идентификатором языка.
     * Повторная регистрация заменяет грамматику и сбрасывает парсеры этого языка.
     */
    public void registerLanguage(String langId, TSLanguage language) {
        languages.put(langId, language);
        parsers.remove(langId);
        LsLog.info("Registered tree-sitter language: " + langId);
    }

    public boolean isSupported(String langId) {
        return languages.containsKey(langId);
    }

    public Set<String> getSupportedLanguages() {
        return Set.copyOf(languages.keySet());
    }

    /**
     * @throws LsException LANGUAGE_NOT_SUPPORTED если язык не зарегистрирован
     */
    public TSLanguage getLanguage(String langId) {
        TSLanguage language = languages.get(langId);
        if (language == null) {
            throw new LsException(LsErrorCode.LANGUAGE_NOT_SUPPORTED, "language", langId);
        }
        return language;
    }

    /**
     * Получает или создает TSParser для текущего потока.
     */
    private TSParser getParser(String langId) {
        TSLanguage language = getLanguage(langId);
        ThreadLocal<TSParser> parserHolder = parsers.computeIfAbsent(langId,
                k -> ThreadLocal.withInitial(() -> {
                    TSParser parser = new TSParser();
                    parser.setLanguage(language);
                    return parser;
                }));
        return parserHolder.get();
    }

    /**
     * Парсит строку содержимого целиком. Инкрементальный разбор не используется:
     * AST и таблица символов всё равно пересобираются полностью.
     *
     * @param content исходный код
     * @param langId идентификатор языка
     * @return дерево разбора вместе с исходным текстом
     */
    @Override
    public SyntaxTree parse(String content, String langId) {
        TSParser parser = getParser(langId);
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new LsException(LsErrorCode.PARSE_FAILED, "language", langId);
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return new SyntaxTree(new TsSyntaxNode(tree.getRootNode(), bytes), content);
    }

    /**
     * Удаляет все грамматики и парсеры.
     */
    public void clear() {
        languages.clear();
        parsers.clear();
    }
}
