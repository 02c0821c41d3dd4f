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
 * Диапазон в документе: [start, end).
 *
 * @param start начало (включительно)
 * @param end конец (исключительно)
 */
public record Range(Position start, Position end) {

    public Range {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Range bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
    }

    public static Range of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    /**
     * Проверяет, находится ли позиция внутри диапазона: start <= position < end.
     */
    public boolean contains(Position position) {
        return !position.isBefore(start) && position.isBefore(end);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    /**
     * Форматирует диапазон для вывода.
     */
    public String format() {
        if (start.line() == end.line()) {
            return String.format("%d:%d-%d", start.line(), start.character(), end.character());
        }
        return String.format("%d:%d-%d:%d", start.line(), start.character(), end.line(), end.character());
    }

    @Override
    public String toString() {
        return format();
    }
}
