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
import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.Range;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * AST одного снимка документа.
 * Все узлы живут в одной арене и адресуются индексом, корень - индекс 0.
 * После сборки неизменяем: любое изменение текста даёт новый Ast.
 */
public final class Ast {

    public static final int ROOT_ID = 0;

    private final List<AstNode> nodes;
    private final List<SymbolUsage> usages;
    private final List<Diagnostic> diagnostics;

    private Ast(List<AstNode> nodes, List<SymbolUsage> usages, List<Diagnostic> diagnostics) {
        this.nodes = List.copyOf(nodes);
        this.usages = List.copyOf(usages);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public AstNode root() {
        return nodes.get(ROOT_ID);
    }

    public AstNode node(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public List<AstNode> children(int id) {
        List<Integer> ids = nodes.get(id).children();
        List<AstNode> result = new ArrayList<>(ids.size());
        for (int childId : ids) {
            result.add(nodes.get(childId));
        }
        return result;
    }

    /**
     * Первый непосредственный потомок указанного вида.
     */
    public Optional<AstNode> childOfKind(int id, NodeKind kind) {
        for (int childId : nodes.get(id).children()) {
            AstNode child = nodes.get(childId);
            if (child.kind().equals(kind)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Самый глубокий узел, диапазон которого содержит позицию.
     */
    public Optional<AstNode> nodeAt(Position position) {
        AstNode current = root();
        if (!current.range().contains(position)) {
            return Optional.empty();
        }
        boolean descended = true;
        while (descended) {
            descended = false;
            for (int childId : current.children()) {
                AstNode child = nodes.get(childId);
                if (child.range().contains(position)) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return Optional.of(current);
    }

    /**
     * Ссылки на символы в порядке обнаружения.
     */
    public List<SymbolUsage> getUsages() {
        return usages;
    }

    /**
     * Структурные ошибки трансляции.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Текстовое представление дерева для отладочного журнала.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        dump(ROOT_ID, 0, sb);
        return sb.toString();
    }

    private void dump(int id, int depth, StringBuilder sb) {
        AstNode node = nodes.get(id);
        sb.append("  ".repeat(depth)).append(node.kind()).append(" ").append(node.range().format());
        if (node.isLeaf()) {
            sb.append(" '").append(node.content()).append("'");
        }
        sb.append('\n');
        for (int childId : node.children()) {
            dump(childId, depth + 1, sb);
        }
    }

    /**
     * Арена на время сборки. Корень создаётся первым и получает индекс 0.
     */
    public static final class Builder {

        private final List<MutableNode> nodes = new ArrayList<>();
        private final List<SymbolUsage> usages = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        public int newNode(NodeKind kind, Range range, String content) {
            int id = nodes.size();
            nodes.add(new MutableNode(kind, range, content));
            return id;
        }

        public void appendChild(int parentId, int childId) {
            nodes.get(parentId).children.add(childId);
        }

        public NodeKind kindOf(int id) {
            return nodes.get(id).kind;
        }

        public List<Integer> childrenOf(int id) {
            return nodes.get(id).children;
        }

        public String contentOf(int id) {
            return nodes.get(id).content;
        }

        public Range rangeOf(int id) {
            return nodes.get(id).range;
        }

        public void addUsage(SymbolUsage usage) {
            usages.add(usage);
        }

        public void addDiagnostic(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
        }

        public Ast build() {
            if (nodes.isEmpty()) {
                throw new IllegalStateException("AST has no root node");
            }
            List<AstNode> frozen = new ArrayList<>(nodes.size());
            for (int i = 0; i < nodes.size(); i++) {
                MutableNode node = nodes.get(i);
                frozen.add(new AstNode(i, node.kind, node.range, node.content, node.children));
            }
            return new Ast(frozen, usages, diagnostics);
        }

        private static final class MutableNode {
            final NodeKind kind;
            final Range range;
            final String content;
            final List<Integer> children = new ArrayList<>();

            MutableNode(NodeKind kind, Range range, String content) {
                this.kind = kind;
                this.range = range;
                this.content = content;
            }
        }
    }
}
