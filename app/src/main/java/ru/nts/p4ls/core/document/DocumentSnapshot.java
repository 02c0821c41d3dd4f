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
import ru.nts.p4ls.core.ast.Ast;
import ru.nts.p4ls.core.ast.AstTranslator;
import ru.nts.p4ls.core.language.LanguageDefinition;
import ru.nts.p4ls.core.symbols.SymbolTableManager;
import ru.nts.p4ls.core.syntax.SyntaxChecker;
import ru.nts.p4ls.core.syntax.SyntaxTree;

import java.util.List;

/**
 * Полный согласованный снимок документа: дерево разбора, AST и таблица символов,
 * построенные из одного и того же текста. Снимок собирается целиком и только
 * потом публикуется, частично построенный снимок наружу не попадает.
 *
 * @param uri идентификатор документа
 * @param version версия текста от редактора
 * @param syntaxTree дерево разбора
 * @param ast AST
 * @param symbols таблица символов
 * @param syntaxDiagnostics ERROR/MISSING узлы дерева разбора
 * @param definition набор правил, по которому построен снимок
 */
public record DocumentSnapshot(
        String uri,
        int version,
        SyntaxTree syntaxTree,
        Ast ast,
        SymbolTableManager symbols,
        List<Diagnostic> syntaxDiagnostics,
        LanguageDefinition definition
) {

    public DocumentSnapshot {
        syntaxDiagnostics = List.copyOf(syntaxDiagnostics);
    }

    /**
     * Строит снимок: проверка синтаксиса, трансляция, таблица символов.
     * Чистая синхронная работа без ввода-вывода.
     */
    public static DocumentSnapshot build(String uri, int version, SyntaxTree tree, LanguageDefinition definition) {
        List<Diagnostic> syntaxDiagnostics = SyntaxChecker.check(tree);
        Ast ast = AstTranslator.translate(tree, definition);
        SymbolTableManager symbols = new SymbolTableManager(ast, definition);
        return new DocumentSnapshot(uri, version, tree, ast, symbols, syntaxDiagnostics, definition);
    }

    public String source() {
        return syntaxTree.source();
    }
}
