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
import ru.nts.p4ls.core.LsLog;
import ru.nts.p4ls.core.ast.Ast;
import ru.nts.p4ls.core.ast.AstNode;
import ru.nts.p4ls.core.ast.NodeKind;
import ru.nts.p4ls.core.ast.SymbolUsage;
import ru.nts.p4ls.core.language.LanguageDefinition;

import java.util.*;

/**
 * Строит {@link SymbolTable} по AST.
 *
 * В каждом узле, открывающем область видимости, создаётся {@link ScopeSymbolTable},
 * непосредственные дети-объявления раскладываются по категориям в порядке текста,
 * вложенные области подвешиваются детьми. Промежуточные узлы, не открывающие
 * область, просматриваются насквозь: у области в таблице ровно ближайшие вложенные области.
 *
 * Объявление, которое не удалось классифицировать, становится диагностикой
 * и не мешает соседним объявлениям.
 */
public final class SymbolTableBuilder {

    private final Ast ast;
    private final Set<NodeKind> scopeKinds;
    private final Map<NodeKind, String> initKinds;
    private final SymbolTable table = new SymbolTable();

    private SymbolTableBuilder(Ast ast, Set<NodeKind> scopeKinds, Map<NodeKind, String> initKinds) {
        this.ast = ast;
        this.scopeKinds = scopeKinds;
        this.initKinds = initKinds;
    }

    /**
     * Строит таблицу по определению языка процесса.
     */
    public static SymbolTable build(Ast ast) {
        LanguageDefinition definition = LanguageDefinition.get();
        return build(ast, definition.getScopeNodes(), definition.getSymbolInitNodes());
    }

    /**
     * @param ast дерево снимка
     * @param scopeKinds виды узлов, открывающих область видимости
     * @param initKinds вид узла-объявления -> категория
     */
    public static SymbolTable build(Ast ast, Set<NodeKind> scopeKinds, Map<NodeKind, String> initKinds) {
        SymbolTableBuilder builder = new SymbolTableBuilder(ast, scopeKinds, initKinds);
        builder.parseScope(ast.root());
        builder.resolveUsages();
        if (LsLog.isDebugEnabled()) {
            LsLog.debug("Symbol Table:\n" + builder.table.dump());
        }
        return builder.table;
    }

    private ScopeSymbolTable parseScope(AstNode scopeNode) {
        ScopeSymbolTable scope = table.newScope(scopeNode.range());

        // Дети узла идут в порядке правил, а категории должны хранить порядок текста
        List<AstNode> declarations = new ArrayList<>();
        for (AstNode child : ast.children(scopeNode.id())) {
            if (initKinds.containsKey(child.kind())) {
                declarations.add(child);
            }
        }
        declarations.sort(Comparator.comparing((AstNode node) -> node.range().start()));
        for (AstNode declaration : declarations) {
            parseDeclaration(scope, declaration, initKinds.get(declaration.kind()));
        }

        for (AstNode subscopeNode : subscopes(scopeNode)) {
            ScopeSymbolTable subscope = parseScope(subscopeNode);
            scope.addChild(subscope.getId());
        }
        return scope;
    }

    private void parseDeclaration(ScopeSymbolTable scope, AstNode declaration, String categoryName) {
        Optional<SymbolCategory> category = SymbolCategory.fromInitName(categoryName);
        if (category.isEmpty()) {
            table.addDiagnostic(Diagnostic.error(declaration.range(), Diagnostic.Source.SYMBOLS,
                    "Unknown symbol category '" + categoryName + "' for " + declaration.kind()));
            return;
        }
        Optional<AstNode> name = ast.childOfKind(declaration.id(), NodeKind.NAME);
        if (name.isEmpty() || name.get().content().isBlank()) {
            table.addDiagnostic(Diagnostic.error(declaration.range(), Diagnostic.Source.SYMBOLS,
                    "Cannot determine the name of " + declaration.kind()));
            return;
        }
        String type = typeOf(declaration);
        table.newSymbol(scope, name.get().content(), category.get(), declaration.kind(),
                declaration.range(), name.get().range(), type);
    }

    /**
     * Текст первого ребёнка вида "Type" (терминального или порождённого правилом).
     */
    private String typeOf(AstNode declaration) {
        for (AstNode child : ast.children(declaration.id())) {
            if (NodeKind.TYPE.name().equals(child.kind().name())) {
                return child.content();
            }
        }
        return null;
    }

    /**
     * Ближайшие потомки, открывающие область видимости.
     */
    private List<AstNode> subscopes(AstNode node) {
        List<AstNode> result = new ArrayList<>();
        for (AstNode child : ast.children(node.id())) {
            if (scopeKinds.contains(child.kind())) {
                result.add(child);
            } else {
                result.addAll(subscopes(child));
            }
        }
        return result;
    }

    /**
     * Привязывает ссылки AST к объявлениям, видимым в месте ссылки.
     * Неразрешённая ссылка - обычный промах, не ошибка.
     */
    private void resolveUsages() {
        for (SymbolUsage usage : ast.getUsages()) {
            table.getSymbolAtPos(usage.name(), usage.range().start())
                    .ifPresent(symbol -> symbol.addUsage(usage.range()));
        }
    }
}
