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

import java.util.Objects;

/**
 * Ожидаемый дочерний элемент правила.
 *
 * @param query запрос к дереву разбора
 * @param rule во что транслировать совпадение
 * @param symbolUsage совпадение является ссылкой на символ
 */
public record Child(NodeQuery query, DirectOrRule rule, boolean symbolUsage) {

    public Child {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(rule, "rule");
    }

    public Child(NodeQuery query, DirectOrRule rule) {
        this(query, rule, false);
    }
}
