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

import ru.nts.p4ls.core.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка синтаксиса по дереву разбора.
 * Ищет ERROR и MISSING узлы, которые парсер вставил при восстановлении.
 */
public final class SyntaxChecker {

    private static final int MAX_ERRORS = 50;

    private SyntaxChecker() {}

    /**
     * Собирает синтаксические ошибки дерева.
     *
     * @param tree дерево разбора
     * @return диагностики в порядке обхода (не больше MAX_ERRORS)
     */
    public static List<Diagnostic> check(SyntaxTree tree) {
        List<Diagnostic> errors = new ArrayList<>();
        collectErrors(tree.root(), null, errors);
        return List.copyOf(errors);
    }

    private static void collectErrors(SyntaxNode node, SyntaxNode parent, List<Diagnostic> errors) {
        if (errors.size() >= MAX_ERRORS) return;

        if (node.isError() || node.isMissing()) {
            String message;
            if (node.isMissing()) {
                message = "Missing expected syntax: " + node.kind();
            } else {
                // ERROR-узел: показываем тип родителя для контекста
                String parentKind = parent != null ? parent.kind() : "unknown";
                message = "Syntax error in " + parentKind;
            }
            errors.add(Diagnostic.error(node.range(), Diagnostic.Source.SYNTAX, message));
            return; // Не рекурсим в ERROR-узлы - уже нашли ошибку
        }

        int childCount = node.childCount();
        for (int i = 0; i < childCount && errors.size() < MAX_ERRORS; i++) {
            SyntaxNode child = node.child(i);
            if (child != null) {
                collectErrors(child, node, errors);
            }
        }
    }
}
