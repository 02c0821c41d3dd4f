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
import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.ast.Ast;
import ru.nts.p4ls.core.ast.NodeKind;
import ru.nts.p4ls.core.language.LanguageDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Владелец таблицы символов одного документа: запросы видимости и правки.
 * Таблица всегда строится из AST целиком, инкрементальных патчей нет.
 */
public final class SymbolTableManager implements SymbolTableQuery, SymbolTableEditor {

    private final Set<NodeKind> scopeKinds;
    private final Map<NodeKind, String> initKinds;
    private SymbolTable symbolTable;

    public SymbolTableManager(Ast ast) {
        this(ast, LanguageDefinition.get());
    }

    public SymbolTableManager(Ast ast, LanguageDefinition definition) {
        this.scopeKinds = Set.copyOf(definition.getScopeNodes());
        this.initKinds = Map.copyOf(definition.getSymbolInitNodes());
        this.symbolTable = SymbolTableBuilder.build(ast, scopeKinds, initKinds);
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    @Override
    public Optional<Symbols> getTopLevelSymbols() {
        return symbolTable.getTopLevelSymbols();
    }

    @Override
    public Optional<Symbols> getSymbolsInScope(Position position) {
        return symbolTable.getSymbolsInScope(position);
    }

    @Override
    public Optional<Symbol> getSymbolAtPos(String name, Position position) {
        return symbolTable.getSymbolAtPos(name, position);
    }

    public Optional<Symbol> findSymbolAt(Position position) {
        return symbolTable.findSymbolAt(position);
    }

    public List<Diagnostic> getDiagnostics() {
        return symbolTable.getDiagnostics();
    }

    @Override
    public void newEdit(SymbolTableEdit edit) {
        if (edit instanceof SymbolTableEdit.Rename rename) {
            symbolTable.renameSymbol(rename.symbolId(), rename.newName());
        }
    }

    @Override
    public void update(Ast ast) {
        symbolTable = SymbolTableBuilder.build(ast, scopeKinds, initKinds);
    }
}
