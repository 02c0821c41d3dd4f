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

import java.util.*;
import java.util.function.Predicate;

/**
 * Символы области видимости, сгруппированные по категориям.
 * Внутри категории порядок - порядок объявления в исходном тексте.
 */
public final class Symbols {

    private final Map<SymbolCategory, List<Symbol>> byCategory = new EnumMap<>(SymbolCategory.class);

    public Symbols() {
        for (SymbolCategory category : SymbolCategory.values()) {
            byCategory.put(category, new ArrayList<>());
        }
    }

    void add(Symbol symbol) {
        byCategory.get(symbol.getCategory()).add(symbol);
    }

    public List<Symbol> getTypes() {
        return get(SymbolCategory.TYPE);
    }

    public List<Symbol> getConstants() {
        return get(SymbolCategory.CONSTANT);
    }

    public List<Symbol> getVariables() {
        return get(SymbolCategory.VARIABLE);
    }

    public List<Symbol> getFunctions() {
        return get(SymbolCategory.FUNCTION);
    }

    public List<Symbol> get(SymbolCategory category) {
        return Collections.unmodifiableList(byCategory.get(category));
    }

    /**
     * Все символы: категории в порядке объявления enum, внутри - порядок исходного текста.
     */
    public List<Symbol> all() {
        List<Symbol> result = new ArrayList<>();
        for (SymbolCategory category : SymbolCategory.values()) {
            result.addAll(byCategory.get(category));
        }
        return result;
    }

    public int size() {
        int size = 0;
        for (List<Symbol> symbols : byCategory.values()) {
            size += symbols.size();
        }
        return size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Первый символ с именем в указанной категории.
     */
    public Optional<Symbol> find(SymbolCategory category, String name) {
        for (Symbol symbol : byCategory.get(category)) {
            if (symbol.getName().equals(name)) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Новый набор, содержащий только символы, прошедшие фильтр.
     */
    public Symbols filter(Predicate<Symbol> predicate) {
        Symbols result = new Symbols();
        for (SymbolCategory category : SymbolCategory.values()) {
            for (Symbol symbol : byCategory.get(category)) {
                if (predicate.test(symbol)) {
                    result.add(symbol);
                }
            }
        }
        return result;
    }

    /**
     * Новый набор: символы этого набора, за ними символы другого, по каждой категории.
     */
    public Symbols merge(Symbols other) {
        Symbols result = copy();
        for (SymbolCategory category : SymbolCategory.values()) {
            result.byCategory.get(category).addAll(other.byCategory.get(category));
        }
        return result;
    }

    public Symbols copy() {
        return filter(s -> true);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (SymbolCategory category : SymbolCategory.values()) {
            List<Symbol> symbols = byCategory.get(category);
            if (!symbols.isEmpty()) {
                sb.append(category.getDisplayName()).append("s: ");
                StringJoiner joiner = new StringJoiner(", ");
                for (Symbol symbol : symbols) {
                    joiner.add(symbol.getName());
                }
                sb.append(joiner).append("; ");
            }
        }
        return sb.toString().trim();
    }
}
