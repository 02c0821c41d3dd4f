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

import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.Range;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Таблица одной области видимости: узел дерева областей в арене {@link SymbolTable}.
 */
public final class ScopeSymbolTable {

    private final int id;
    private final Range range;
    private final Symbols symbols = new Symbols();
    private final List<Integer> children = new ArrayList<>();

    ScopeSymbolTable(int id, Range range) {
        this.id = id;
        this.range = range;
    }

    public int getId() {
        return id;
    }

    public Range getRange() {
        return range;
    }

    public Symbols getSymbols() {
        return symbols;
    }

    /**
     * Индексы ближайших вложенных областей в арене.
     */
    public List<Integer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean contains(Position position) {
        return range.contains(position);
    }

    void addChild(int childId) {
        children.add(childId);
    }
}
