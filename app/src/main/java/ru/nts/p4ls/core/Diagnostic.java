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
package ru.nts.p4ls.core;

/**
 * Восстановимая проблема в одном документе.
 * Фатальные ошибки конфигурации сюда не попадают, для них есть {@link LsException}.
 *
 * @param range место проблемы
 * @param severity серьёзность
 * @param source подсистема, обнаружившая проблему
 * @param message текст для редактора
 */
public record Diagnostic(Range range, Severity severity, Source source, String message) {

    public static Diagnostic error(Range range, Source source, String message) {
        return new Diagnostic(range, Severity.ERROR, source, message);
    }

    public static Diagnostic warning(Range range, Source source, String message) {
        return new Diagnostic(range, Severity.WARNING, source, message);
    }

    public enum Severity {
        ERROR,
        WARNING
    }

    /**
     * Подсистема-источник диагностики.
     */
    public enum Source {
        /** ERROR/MISSING узлы дерева разбора. */
        SYNTAX("syntax"),
        /** Форма CST не удовлетворяет правилу. */
        TRANSLATION("translation"),
        /** Объявление не удалось отнести к категории. */
        SYMBOLS("symbols");

        private final String displayName;

        Source(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    @Override
    public String toString() {
        return "[" + source.getDisplayName() + "] " + severity + " " + range.format() + ": " + message;
    }
}
