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

import java.util.List;
import java.util.Objects;

/**
 * Одно именованное правило отображения CST -> AST.
 *
 * @param name имя правила, оно же вид порождаемого узла AST
 * @param isScope открывает ли узел новую лексическую область видимости
 * @param symbol роль узла в таблице символов
 * @param children ожидаемые дочерние элементы в порядке обработки
 */
public record Rule(String name, boolean isScope, SymbolRole symbol, List<Multiplicity> children) {

    public Rule {
        Objects.requireNonNull(name, "name");
        symbol = symbol != null ? symbol : SymbolRole.NONE;
        children = children != null ? List.copyOf(children) : List.of();
    }

    public Rule(String name, List<Multiplicity> children) {
        this(name, false, SymbolRole.NONE, children);
    }

    public boolean isSymbolInit() {
        return symbol instanceof SymbolRole.Init;
    }
}
