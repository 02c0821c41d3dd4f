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

import ru.nts.p4ls.core.Diagnostic;
import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.Range;
import ru.nts.p4ls.core.ast.AstNode;
import ru.nts.p4ls.core.ast.NodeKind;
import ru.nts.p4ls.core.language.CompletionKind;
import ru.nts.p4ls.core.symbols.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Функции редактора поверх одного снимка документа:
 * Hover, Completion, Go to Definition, Rename, семантическая подсветка, диагностики.
 */
public final class LanguageActions {

    private final DocumentSnapshot snapshot;

    public LanguageActions(DocumentSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Описание символа под курсором, а если символа нет - вид узла AST в этой позиции.
     * Пробелы и комментарии верхнего уровня попадают в корень и подсказки не дают.
     */
    public Optional<String> hover(Position position) {
        Optional<Symbol> symbol = resolveSymbol(snapshot.symbols(), position);
        if (symbol.isPresent()) {
            return Optional.of(symbol.get().describe());
        }
        return snapshot.ast().nodeAt(position)
                .filter(node -> !NodeKind.ROOT.equals(node.kind()))
                .map(node -> node.kind().name());
    }

    /**
     * Кандидаты автодополнения: символы, видимые в позиции, в порядке категорий и объявления.
     */
    public List<CompletionItem> completion(Position position) {
        Optional<Symbols> visible = snapshot.ast().root().range().contains(position)
                ? snapshot.symbols().getSymbolsInScope(position)
                : snapshot.symbols().getTopLevelSymbols();
        if (visible.isEmpty()) {
            return List.of();
        }
        List<CompletionItem> items = new ArrayList<>();
        for (Symbol symbol : visible.get().all()) {
            CompletionKind kind = snapshot.definition().completionKindFor(symbol.getDeclarationKind())
                    .orElse(defaultKind(symbol.getCategory()));
            String detail = symbol.getType().orElse(symbol.getCategory().getDisplayName());
            items.add(new CompletionItem(symbol.getName(), kind, detail));
        }
        return items;
    }

    /**
     * Диапазон объявления символа под курсором.
     */
    public Optional<Range> definition(Position position) {
        return resolveSymbol(snapshot.symbols(), position).map(Symbol::getDeclarationRange);
    }

    /**
     * Правки текста для переименования символа под курсором: имя в объявлении и все использования.
     *
     * Правка применяется к собственной копии таблицы, построенной из AST снимка, поэтому
     * параллельные запросы к опубликованному снимку её не видят. После применения правок
     * вызывающая сторона обязана пересобрать документ.
     */
    public List<TextEdit> rename(Position position, String newName) {
        SymbolTableManager working = new SymbolTableManager(snapshot.ast(), snapshot.definition());
        Optional<Symbol> symbol = resolveSymbol(working, position);
        if (symbol.isEmpty()) {
            return List.of();
        }
        working.newEdit(new SymbolTableEdit.Rename(symbol.get().getId(), newName));

        Symbol renamed = symbol.get();
        List<TextEdit> edits = new ArrayList<>();
        edits.add(new TextEdit(renamed.getNameRange(), renamed.getName()));
        for (Range usage : renamed.getUsages()) {
            edits.add(new TextEdit(usage, renamed.getName()));
        }
        return edits;
    }

    /**
     * Семантическая подсветка: имена в объявлениях и разрешённые использования в порядке текста.
     */
    public List<SemanticToken> semanticTokens() {
        List<SemanticToken> tokens = new ArrayList<>();
        for (Symbol symbol : snapshot.symbols().getSymbolTable().getAllSymbols()) {
            tokens.add(new SemanticToken(symbol.getNameRange(), symbol.getCategory(), true));
            for (Range usage : symbol.getUsages()) {
                tokens.add(new SemanticToken(usage, symbol.getCategory(), false));
            }
        }
        tokens.sort(Comparator.comparing((SemanticToken token) -> token.range().start()));
        return tokens;
    }

    /**
     * Быстрые диагностики: синтаксис и структурные ошибки трансляции.
     */
    public List<Diagnostic> quickDiagnostics() {
        List<Diagnostic> diagnostics = new ArrayList<>(snapshot.syntaxDiagnostics());
        diagnostics.addAll(snapshot.ast().getDiagnostics());
        return diagnostics;
    }

    /**
     * Полные диагностики: быстрые плюс ошибки классификации символов.
     */
    public List<Diagnostic> fullDiagnostics() {
        List<Diagnostic> diagnostics = quickDiagnostics();
        diagnostics.addAll(snapshot.symbols().getDiagnostics());
        return diagnostics;
    }

    private Optional<Symbol> resolveSymbol(SymbolTableManager manager, Position position) {
        Optional<Symbol> direct = manager.findSymbolAt(position);
        if (direct.isPresent()) {
            return direct;
        }
        Optional<AstNode> node = snapshot.ast().nodeAt(position);
        if (node.isPresent() && NodeKind.NAME.equals(node.get().kind())) {
            return manager.getSymbolAtPos(node.get().content(), position);
        }
        return Optional.empty();
    }

    private static CompletionKind defaultKind(SymbolCategory category) {
        return switch (category) {
            case TYPE -> CompletionKind.STRUCT;
            case CONSTANT -> CompletionKind.CONSTANT;
            case VARIABLE -> CompletionKind.VARIABLE;
            case FUNCTION -> CompletionKind.FUNCTION;
        };
    }
}
