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

import ru.nts.p4ls.core.Range;

/**
 * Узел конкретного синтаксического дерева, полученного от внешнего парсера.
 * Транслятор работает только через этот интерфейс и не зависит от конкретного парсера.
 */
public interface SyntaxNode {

    /** Вид узла по грамматике ("constant_declaration", "ERROR", ...). */
    String kind();

    Range range();

    /** Исходный текст, покрываемый узлом. */
    String text();

    int childCount();

    SyntaxNode child(int index);

    /**
     * Имя поля грамматики, под которым находится потомок, или null.
     */
    String fieldNameForChild(int index);

    /** Узел вставлен парсером при восстановлении после ошибки. */
    boolean isMissing();

    default boolean isError() {
        return "ERROR".equals(kind());
    }
}
