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

import java.util.Locale;
import java.util.Optional;

/**
 * Категория объявления в таблице символов.
 * Строка категории приходит из роли Init набора правил.
 */
public enum SymbolCategory {
    TYPE("type"),
    CONSTANT("constant"),
    VARIABLE("variable"),
    FUNCTION("function");

    private final String displayName;

    SymbolCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Разбирает категорию из набора правил (без учёта регистра).
     */
    public static Optional<SymbolCategory> fromInitName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (SymbolCategory category : values()) {
            if (category.displayName.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return displayName;
    }
}
