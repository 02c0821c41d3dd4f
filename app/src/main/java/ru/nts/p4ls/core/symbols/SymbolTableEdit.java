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
package ru.nts.p4ls.core.symbols;

import java.util.Objects;

/**
 * Структурная правка таблицы символов.
 */
public sealed interface SymbolTableEdit permits SymbolTableEdit.Rename {

    /**
     * Переименование символа по идентификатору.
     */
    record Rename(int symbolId, String newName) implements SymbolTableEdit {
        public Rename {
            Objects.requireNonNull(newName, "newName");
            if (newName.isBlank()) {
                throw new IllegalArgumentException("New name must not be blank");
            }
        }
    }
}
