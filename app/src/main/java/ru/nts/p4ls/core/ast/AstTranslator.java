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
package ru.nts.p4ls.core.ast;

import ru.nts.p4ls.core.Diagnostic;
import ru.nts.p4ls.core.LsLog;
import ru.nts.p4ls.core.language.*;
import ru.nts.p4ls.core.syntax.SyntaxNode;
import ru.nts.p4ls.core.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Трансляция CST -> AST по набору правил.
 *
 * Интерпретатор не знает ничего о конкретном языке: для каждого узла он берёт правило,
 * выполняет запросы его детей против узла дерева разбора и транслирует совпадения
 * либо в терминальный узел, либо рекурсивно по имени правила.
 *
 * Трансляция никогда не прерывается целиком: отсутствующий обязательный ребёнок
 * или ссылка на несуществующее правило дают диагностику и выпадение поддерева,
 * остальной файл транслируется как обычно.
 */
public final class AstTranslator {

    /**
     * Ограничение глубины рекурсии по правилам (защита от правил, ссылающихся сами на себя).
     */
    static final int MAX_DEPTH = 512;

    private final LanguageDefinition definition;
    private final Ast.Builder builder = new Ast.Builder();

    private AstTranslator(LanguageDefinition definition) {
        this.definition = definition;
    }

    /**
     * Транслирует дерево разбора по определению языка процесса.
     */
    public static Ast translate(SyntaxTree tree) {
        return translate(tree, LanguageDefinition.get());
    }

    /**
     * Транслирует дерево разбора по указанному определению языка.
     *
     * @param tree дерево разбора и исходный текст
     * @param definition набор правил
     * @return AST (возможно, частичный) со структурными диагностиками
     */
    public static Ast translate(SyntaxTree tree, LanguageDefinition definition) {
        AstTranslator translator = new AstTranslator(definition);
        translator.translateRoot(tree);
        Ast ast = translator.builder.build();
        if (LsLog.isDebugEnabled()) {
            LsLog.debug("AST:\n" + ast.dump());
        }
        return ast;
    }

    private void translateRoot(SyntaxTree tree) {
        SyntaxNode cstRoot = tree.root();
        int rootId = builder.newNode(NodeKind.ROOT, cstRoot.range(), tree.source());
        translateChildren(cstRoot, definition.rootRule(), rootId, 0);
    }

    private int translateRule(SyntaxNode cst, Rule rule, int depth) {
        int nodeId = builder.newNode(NodeKind.rule(rule.name()), cst.range(), cst.text());
        translateChildren(cst, rule, nodeId, depth);
        if (rule.symbol() instanceof SymbolRole.Usage) {
            builder.addUsage(usageOf(nodeId));
        }
        return nodeId;
    }

    private void translateChildren(SyntaxNode cst, Rule rule, int parentId, int depth) {
        for (Multiplicity multiplicity : rule.children()) {
            Child child = multiplicity.child();
            List<SyntaxNode> matches = query(cst, child.query());

            if (multiplicity instanceof Multiplicity.Many) {
                for (SyntaxNode match : matches) {
                    translateChild(match, child, parentId, depth);
                }
                continue;
            }

            if (matches.isEmpty()) {
                if (multiplicity instanceof Multiplicity.One) {
                    builder.addDiagnostic(Diagnostic.error(cst.range(), Diagnostic.Source.TRANSLATION,
                            "Expected " + describe(child.query()) + " in " + rule.name()));
                }
                continue;
            }
            if (matches.size() > 1) {
                builder.addDiagnostic(Diagnostic.warning(matches.get(1).range(), Diagnostic.Source.TRANSLATION,
                        "Expected a single " + describe(child.query()) + " in " + rule.name()
                                + ", found " + matches.size()));
            }
            translateChild(matches.get(0), child, parentId, depth);
        }
    }

    private void translateChild(SyntaxNode match, Child child, int parentId, int depth) {
        Optional<Integer> translated;
        if (child.rule() instanceof DirectOrRule.Direct direct) {
            translated = Optional.of(builder.newNode(direct.kind(), match.range(), match.text()));
        } else {
            translated = translateReference(match, ((DirectOrRule.Rule) child.rule()).name(), depth);
        }
        if (translated.isEmpty()) {
            return;
        }
        int childId = translated.get();
        builder.appendChild(parentId, childId);

        boolean recordedByRule = child.rule() instanceof DirectOrRule.Rule ref
                && definition.ruleWithName(ref.name()).map(r -> r.symbol() instanceof SymbolRole.Usage).orElse(false);
        if (child.symbolUsage() && !recordedByRule) {
            builder.addUsage(usageOf(childId));
        }
    }

    private Optional<Integer> translateReference(SyntaxNode match, String ruleName, int depth) {
        Optional<Rule> rule = definition.ruleWithName(ruleName);
        if (rule.isEmpty()) {
            builder.addDiagnostic(Diagnostic.error(match.range(), Diagnostic.Source.TRANSLATION,
                    "Undefined rule '" + ruleName + "' for " + match.kind()));
            return Optional.empty();
        }
        if (depth + 1 > MAX_DEPTH) {
            builder.addDiagnostic(Diagnostic.error(match.range(), Diagnostic.Source.TRANSLATION,
                    "Rule nesting too deep at '" + ruleName + "'"));
            return Optional.empty();
        }
        return Optional.of(translateRule(match, rule.get(), depth + 1));
    }

    /**
     * Ссылка формируется по дочернему Name, а если его нет - по самому узлу.
     */
    private SymbolUsage usageOf(int nodeId) {
        for (int childId : builder.childrenOf(nodeId)) {
            if (NodeKind.NAME.equals(builder.kindOf(childId))) {
                return new SymbolUsage(builder.contentOf(childId), builder.rangeOf(childId));
            }
        }
        return new SymbolUsage(builder.contentOf(nodeId), builder.rangeOf(nodeId));
    }

    // ===================== ЗАПРОСЫ К ДЕРЕВУ РАЗБОРА =====================

    /**
     * Выполняет запрос относительно узла. ERROR и MISSING узлы в совпадения не попадают,
     * о них сообщает проверка синтаксиса.
     */
    static List<SyntaxNode> query(SyntaxNode node, NodeQuery query) {
        List<SyntaxNode> matches = new ArrayList<>();
        for (SyntaxNode match : rawQuery(node, query)) {
            if (!match.isError() && !match.isMissing()) {
                matches.add(match);
            }
        }
        return matches;
    }

    private static List<SyntaxNode> rawQuery(SyntaxNode node, NodeQuery query) {
        List<SyntaxNode> result = new ArrayList<>();
        if (query instanceof NodeQuery.Kind kind) {
            for (int i = 0; i < node.childCount(); i++) {
                SyntaxNode child = node.child(i);
                if (child != null && kind.kind().equals(child.kind())) {
                    result.add(child);
                }
            }
        } else if (query instanceof NodeQuery.Field field) {
            for (int i = 0; i < node.childCount(); i++) {
                if (field.field().equals(node.fieldNameForChild(i))) {
                    SyntaxNode child = node.child(i);
                    if (child != null) {
                        result.add(child);
                    }
                }
            }
        } else if (query instanceof NodeQuery.Path path) {
            List<SyntaxNode> current = List.of(node);
            for (NodeQuery step : path.steps()) {
                List<SyntaxNode> next = new ArrayList<>();
                for (SyntaxNode n : current) {
                    next.addAll(rawQuery(n, step));
                }
                current = next;
            }
            result.addAll(current);
        }
        return result;
    }

    private static String describe(NodeQuery query) {
        if (query instanceof NodeQuery.Kind kind) {
            return "node of kind '" + kind.kind() + "'";
        }
        if (query instanceof NodeQuery.Field field) {
            return "field '" + field.field() + "'";
        }
        List<String> parts = new ArrayList<>();
        for (NodeQuery step : ((NodeQuery.Path) query).steps()) {
            parts.add(describe(step));
        }
        return "path [" + String.join(" / ", parts) + "]";
    }
}
