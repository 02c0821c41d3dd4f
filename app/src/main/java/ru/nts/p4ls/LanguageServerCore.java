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
package ru.nts.p4ls;

import org.treesitter.TSLanguage;
import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;
import ru.nts.p4ls.core.LsLog;
import ru.nts.p4ls.core.document.DocumentManager;
import ru.nts.p4ls.core.language.LanguageDefinition;
import ru.nts.p4ls.core.syntax.TreeSitterManager;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Точка входа ядра языкового сервера P4.
 *
 * Загружает набор правил один раз при старте процесса. Ошибка в наборе правил фатальна:
 * исключение пробрасывается хосту, а {@link #main(String[])} завершает процесс с кодом 1.
 * Транспорт (LSP поверх stdio) и поставка грамматики tree-sitter - ответственность хоста.
 */
public final class LanguageServerCore {

    public static final String LANGUAGE_ID = "p4";

    /**
     * Переменная окружения с путём к документу правил.
     */
    public static final String RULES_ENV = "P4LS_RULES";

    /**
     * Набор правил по умолчанию в classpath.
     */
    public static final String BUNDLED_RULES = "/p4-rules.json";

    private LanguageServerCore() {}

    /**
     * Загружает набор правил из файла.
     *
     * @throws LsException CONFIG_NOT_READABLE, CONFIG_INVALID, LANGUAGE_ALREADY_LOADED
     */
    public static LanguageDefinition bootstrap(Path rulesFile) {
        LsLog.info("Loading rule set from " + rulesFile.toAbsolutePath().normalize());
        return LanguageDefinition.load(rulesFile);
    }

    /**
     * Загружает набор правил по пути из P4LS_RULES, а если переменная не задана - встроенный набор.
     */
    public static LanguageDefinition bootstrapFromEnvironment() {
        String rules = System.getenv(RULES_ENV);
        if (rules == null || rules.isBlank()) {
            LsLog.info(RULES_ENV + " is not set, using bundled rule set " + BUNDLED_RULES);
            return LanguageDefinition.load(bundledRules());
        }
        return bootstrap(Paths.get(rules));
    }

    /**
     * Текст встроенного набора правил P4.
     *
     * @throws LsException CONFIG_NOT_READABLE если ресурс отсутствует в сборке
     */
    public static String bundledRules() {
        try (InputStream in = LanguageServerCore.class.getResourceAsStream(BUNDLED_RULES)) {
            if (in == null) {
                throw new LsException(LsErrorCode.CONFIG_NOT_READABLE, Map.of("file", "classpath:" + BUNDLED_RULES));
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LsException(LsErrorCode.CONFIG_NOT_READABLE, Map.of("file", "classpath:" + BUNDLED_RULES), e);
        }
    }

    /**
     * Регистрирует грамматику P4 и создаёт менеджер документов поверх загруженного набора правил.
     */
    public static DocumentManager createDocumentManager(TSLanguage grammar) {
        TreeSitterManager parsers = TreeSitterManager.getInstance();
        parsers.registerLanguage(LANGUAGE_ID, grammar);
        return new DocumentManager(parsers, LANGUAGE_ID, LanguageDefinition.get());
    }

    /**
     * Проверка документа правил из командной строки: {@code LanguageServerCore <rules.json>}.
     */
    public static void main(String[] args) {
        // UTF-8 для stderr (сообщения об ошибках содержат пути и фрагменты правил)
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));
        try {
            LanguageDefinition definition = args.length > 0
                    ? bootstrap(Paths.get(args[0]))
                    : bootstrapFromEnvironment();
            System.err.println("Rule set OK: " + definition.getRules().size() + " rule(s), scopes="
                    + definition.getScopeNodes() + ", declarations=" + definition.getSymbolInitNodes().keySet());
        } catch (LsException e) {
            System.err.println("Critical error during startup: " + e.toUserMessage());
            System.exit(1);
        }
    }
}
