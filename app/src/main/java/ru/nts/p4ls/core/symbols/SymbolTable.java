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

import ru.nts.p4ls.core.Diagnostic;
import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;
import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.Range;
import ru.nts.p4ls.core.ast.NodeKind;

import java.util.*;

/**
 * Дерево областей видимости одного документа.
 * Арена {@link ScopeSymbolTable}, корень (индекс 0) - область всего файла.
 * Строится {@link SymbolTableBuilder} из AST того же снимка.
 */
public final class SymbolTable {

    public static final int ROOT_ID = 0;

    /**
     * Порядок категорий при разрешении имени, встречающегося в нескольких категориях одной области.
     */
    static final List<SymbolCategory> NAME_PRECEDENCE = List.of(
            SymbolCategory.VARIABLE,
            SymbolCategory.CONSTANT,
            SymbolCategory.FUNCTION,
            SymbolCategory.TYPE);

    private final List<ScopeSymbolTable> scopes = new ArrayList<>();
    private final List<Symbol> symbolsById = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    SymbolTable() {}

    // ===================== СБОРКА (для builder) =====================

    ScopeSymbolTable newScope(Range range) {
        ScopeSymbolTable scope = new ScopeSymbolTable(scopes.size(), range);
        scopes.add(scope);
        return scope;
    }

    Symbol newSymbol(ScopeSymbolTable scope, String name, SymbolCategory category,
                     NodeKind declarationKind, Range declarationRange,
                     Range nameRange, String type) {
        Symbol symbol = new Symbol(symbolsById.size(), name, category, declarationKind,
                declarationRange, nameRange, type);
        symbolsById.add(symbol);
        scope.getSymbols().add(symbol);
        return symbol;
    }

    void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    // ===================== ДОСТУП =====================

    public ScopeSymbolTable getRoot() {
        return scopes.get(ROOT_ID);
    }

    public ScopeSymbolTable getScope(int id) {
        return scopes.get(id);
    }

    public int getScopeCount() {
        return scopes.size();
    }

    public Optional<Symbol> getSymbol(int id) {
        if (id < 0 || id >= symbolsById.size()) {
            return Optional.empty();
        }
        return Optional.of(symbolsById.get(id));
    }

    public List<Symbol> getAllSymbols() {
        return Collections.unmodifiableList(symbolsById);
    }

    /**
     * Ошибки классификации объявлений.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    // ===================== ЗАПРОСЫ =====================

    /**
     * Полный набор символов корневой области без фильтрации (структура файла).
     */
    public Optional<Symbols> getTopLevelSymbols() {
        Symbols symbols = getRoot().getSymbols().copy();
        return symbols.isEmpty() ? Optional.empty() : Optional.of(symbols);
    }

    /**
     * Символы, видимые в позиции.
     *
     * Символы корня видны всегда и целиком. При каждом спуске в вложенную область,
     * содержащую позицию, добавляются её символы, объявление которых закончилось
     * строго до позиции. Уже добавленные символы предков повторно не фильтруются.
     */
    public Optional<Symbols> getSymbolsInScope(Position position) {
        Symbols result = getRoot().getSymbols().copy();
        for (ScopeSymbolTable scope : nestedChain(position)) {
            result = result.merge(scope.getSymbols().filter(s -> s.isDeclaredBefore(position)));
        }
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    /**
     * Разрешает имя в позиции.
     *
     * Приоритет: сначала самая внутренняя область цепочки, затем внешние вплоть до корня.
     * Внутри одной области категории перебираются в порядке {@link #NAME_PRECEDENCE},
     * внутри категории побеждает первое по тексту объявление.
     */
    public Optional<Symbol> getSymbolAtPos(String name, Position position) {
        List<ScopeSymbolTable> chain = nestedChain(position);
        for (int i = chain.size() - 1; i >= 0; i--) {
            Symbols visible = chain.get(i).getSymbols().filter(s -> s.isDeclaredBefore(position));
            Optional<Symbol> found = findByPrecedence(visible, name);
            if (found.isPresent()) {
                return found;
            }
        }
        return findByPrecedence(getRoot().getSymbols(), name);
    }

    /**
     * Символ, имя объявления или использование которого покрывает позицию.
     */
    public Optional<Symbol> findSymbolAt(Position position) {
        for (Symbol symbol : symbolsById) {
            if (symbol.occursAt(position)) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Цепочка вложенных областей (без корня), содержащих позицию, от внешней к внутренней.
     */
    List<ScopeSymbolTable> nestedChain(Position position) {
        List<ScopeSymbolTable> chain = new ArrayList<>();
        ScopeSymbolTable current = getRoot();
        while (true) {
            ScopeSymbolTable next = null;
            for (int childId : current.getChildren()) {
                ScopeSymbolTable child = scopes.get(childId);
                if (child.contains(position)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return chain;
            }
            chain.add(next);
            current = next;
        }
    }

    private static Optional<Symbol> findByPrecedence(Symbols symbols, String name) {
        for (SymbolCategory category : NAME_PRECEDENCE) {
            Optional<Symbol> found = symbols.find(category, name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    // ===================== ПРАВКИ =====================

    /**
     * Переименовывает символ на месте. Таблица расходится с AST до следующей пересборки.
     *
     * @throws LsException SYMBOL_NOT_FOUND для неизвестного идентификатора
     */
    void renameSymbol(int symbolId, String newName) {
        Symbol symbol = getSymbol(symbolId)
                .orElseThrow(() -> new LsException(LsErrorCode.SYMBOL_NOT_FOUND, "symbol", symbolId));
        symbol.rename(newName);
    }

    /**
     * Текстовое представление дерева областей для отладочного журнала.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(ROOT_ID, 0, sb);
        return sb.toString();
    }

    private void dump(int scopeId, int depth, StringBuilder sb) {
        ScopeSymbolTable scope = scopes.get(scopeId);
        sb.append("  ".repeat(depth)).append("scope ").append(scope.getRange().format())
                .append(" { ").append(scope.getSymbols()).append(" }\n");
        for (int childId : scope.getChildren()) {
            dump(childId, depth + 1, sb);
        }
    }
}
