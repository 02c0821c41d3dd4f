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
package ru.nts.p4ls.core.document;

import ru.nts.p4ls.core.Range;
import ru.nts.p4ls.core.symbols.SymbolCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Подсветка одного вхождения символа.
 *
 * @param range имя в объявлении или использование
 * @param category категория символа
 * @param declaration true для имени в объявлении
 */
public record SemanticToken(Range range, SymbolCategory category, boolean declaration) {

    /**
     * Тип токена LSP.
     */
    public String tokenType() {
        return switch (category) {
            case TYPE -> "type";
            case CONSTANT, VARIABLE -> "variable";
            case FUNCTION -> "function";
        };
    }

    /**
     * Модификаторы токена LSP.
     */
    public List<String> modifiers() {
        List<String> modifiers = new ArrayList<>(2);
        if (declaration) {
            modifiers.add("declaration");
        }
        if (category == SymbolCategory.CONSTANT) {
            modifiers.add("readonly");
        }
        return modifiers;
    }
}
