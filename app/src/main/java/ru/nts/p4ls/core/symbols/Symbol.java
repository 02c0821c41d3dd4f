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
import ru.nts.p4ls.core.ast.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Объявленный символ.
 * Имя меняется только переименованием, список использований пополняется
 * при разрешении ссылок во время сборки таблицы.
 */
public final class Symbol {

    private final int id;
    private String name;
    private final SymbolCategory category;
    private final NodeKind declarationKind;
    private final Range declarationRange;
    private final Range nameRange;
    private final String type;
    private final List<Range> usages = new ArrayList<>();

    Symbol(int id, String name, SymbolCategory category, NodeKind declarationKind,
           Range declarationRange, Range nameRange, String type) {
        this.id = id;
        this.name = name;
        this.category = category;
        this.declarationKind = declarationKind;
        this.declarationRange = declarationRange;
        this.nameRange = nameRange;
        this.type = type;
    }

    /** Идентификатор, стабильный в пределах одной таблицы. */
    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public SymbolCategory getCategory() {
        return category;
    }

    /** Вид узла AST, объявившего символ. */
    public NodeKind getDeclarationKind() {
        return declarationKind;
    }

    /** Диапазон всего объявления. */
    public Range getDeclarationRange() {
        return declarationRange;
    }

    /** Диапазон имени в объявлении. */
    public Range getNameRange() {
        return nameRange;
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    public List<Range> getUsages() {
        return Collections.unmodifiableList(usages);
    }

    /**
     * Объявление полностью завершилось до позиции.
     */
    public boolean isDeclaredBefore(Position position) {
        return declarationRange.end().isBefore(position);
    }

    /**
     * Имя объявления или одно из использований покрывает позицию.
     */
    public boolean occursAt(Position position) {
        if (nameRange.contains(position)) {
            return true;
        }
        for (Range usage : usages) {
            if (usage.contains(position)) {
                return true;
            }
        }
        return false;
    }

    void addUsage(Range range) {
        usages.add(range);
    }

    void rename(String newName) {
        this.name = newName;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(category.getDisplayName()).append(' ').append(name);
        if (type != null) {
            sb.append(": ").append(type);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return describe() + " @" + declarationRange.format() + (usages.isEmpty() ? "" : " usages=" + usages);
    }
}
