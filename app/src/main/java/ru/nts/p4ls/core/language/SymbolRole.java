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
 * Роль узла в таблице символов.
 */
public sealed interface SymbolRole permits SymbolRole.None, SymbolRole.Usage, SymbolRole.Init {

    SymbolRole NONE = new None();
    SymbolRole USAGE = new Usage();

    record None() implements SymbolRole {}

    /**
     * Узел является ссылкой на ранее объявленный символ.
     */
    record Usage() implements SymbolRole {}

    /**
     * Узел объявляет символ указанной категории ("constant", "variable", ...).
     */
    record Init(String category) implements SymbolRole {
        public Init {
            Objects.requireNonNull(category, "category");
        }
    }
}
