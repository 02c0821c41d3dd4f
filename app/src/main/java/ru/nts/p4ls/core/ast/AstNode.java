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
package ru.nts.p4ls.core.ast;

import ru.nts.p4ls.core.Range;

import java.util.List;

/**
 * Узел AST. Живёт в арене {@link Ast}, идентичность - индекс в арене.
 * Хранит только ссылки на детей: обратных ссылок на родителя нет, циклы невозможны.
 *
 * @param id индекс в арене
 * @param kind вид узла
 * @param range диапазон в исходном тексте
 * @param content исходный текст узла
 * @param children индексы детей в порядке добавления
 */
public record AstNode(int id, NodeKind kind, Range range, String content, List<Integer> children) {

    public AstNode {
        children = List.copyOf(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
