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
package ru.nts.p4ls.core.syntax;

import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.Range;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Дерево разбора в памяти для тестов (без нативной грамматики).
 * Узлы строятся через {@link Source}, который вычисляет диапазоны по фрагментам текста.
 */
public final class FakeSyntax implements SyntaxNode {

    private final String kind;
    private final Range range;
    private final String text;
    private final List<FakeSyntax> children = new ArrayList<>();
    private String field;
    private boolean missing;

    FakeSyntax(String kind, Range range, String text) {
        this.kind = kind;
        this.range = range;
        this.text = text;
    }

    /**
     * Имя поля, под которым узел виден у родителя.
     */
    public FakeSyntax field(String name) {
        this.field = name;
        return this;
    }

    /**
     * Помечает узел как вставленный парсером при восстановлении.
     */
    public FakeSyntax missing() {
        this.missing = true;
        return this;
    }

    public FakeSyntax add(FakeSyntax... nodes) {
        children.addAll(Arrays.asList(nodes));
        return this;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public Range range() {
        return range;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public int childCount() {
        return children.size();
    }

    @Override
    public SyntaxNode child(int index) {
        return children.get(index);
    }

    @Override
    public String fieldNameForChild(int index) {
        return children.get(index).field;
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public String toString() {
        return kind + " " + range.format();
    }

    /**
     * Исходный текст, по которому строятся узлы.
     */
    public static final class Source {

        private final String text;
        private final String[] lines;
        private final int[] lineOffsets;

        public Source(String text) {
            this.text = text;
            this.lines = text.split("\n", -1);
            this.lineOffsets = new int[lines.length];
            int offset = 0;
            for (int i = 0; i < lines.length; i++) {
                lineOffsets[i] = offset;
                offset += lines[i].length() + 1;
            }
        }

        public String text() {
            return text;
        }

        /**
         * Начало первого вхождения фрагмента в строке.
         */
        public Position at(int line, String fragment) {
            int column = lines[line].indexOf(fragment);
            if (column < 0) {
                throw new IllegalArgumentException("'" + fragment + "' not found in line " + line + ": " + lines[line]);
            }
            return new Position(line, column);
        }

        /**
         * Лист, покрывающий первое вхождение фрагмента в строке.
         */
        public FakeSyntax leaf(String kind, int line, String fragment) {
            Position start = at(line, fragment);
            return create(kind, start, new Position(line, start.character() + fragment.length()));
        }

        /**
         * Лист, покрывающий фрагмент внутри первого вхождения контекста
         * ({@code leafIn("identifier", 3, "a", " a ")}).
         */
        public FakeSyntax leafIn(String kind, int line, String fragment, String context) {
            int contextColumn = at(line, context).character();
            int column = lines[line].indexOf(fragment, contextColumn);
            if (column < 0) {
                throw new IllegalArgumentException("'" + fragment + "' not found in '" + context + "'");
            }
            return create(kind, new Position(line, column), new Position(line, column + fragment.length()));
        }

        /**
         * Узел от начала фрагмента {@code from} до конца фрагмента {@code to}
         * (в той же строке {@code to} ищется после {@code from}).
         */
        public FakeSyntax node(String kind, int line, String from, int endLine, String to, FakeSyntax... children) {
            Position start = at(line, from);
            int endColumn = endLine == line
                    ? lines[line].indexOf(to, start.character())
                    : lines[endLine].indexOf(to);
            if (endColumn < 0) {
                throw new IllegalArgumentException("'" + to + "' not found in line " + endLine);
            }
            return create(kind, start, new Position(endLine, endColumn + to.length())).add(children);
        }

        public FakeSyntax node(String kind, int line, String from, String to, FakeSyntax... children) {
            return node(kind, line, from, line, to, children);
        }

        /**
         * Корень, покрывающий весь текст.
         */
        public FakeSyntax root(String kind, FakeSyntax... children) {
            int last = lines.length - 1;
            return create(kind, new Position(0, 0), new Position(last, lines[last].length())).add(children);
        }

        public SyntaxTree tree(FakeSyntax root) {
            return new SyntaxTree(root, text);
        }

        private FakeSyntax create(String kind, Position start, Position end) {
            String covered = text.substring(offsetOf(start), offsetOf(end));
            return new FakeSyntax(kind, new Range(start, end), covered);
        }

        private int offsetOf(Position position) {
            return lineOffsets[position.line()] + position.character();
        }
    }
}
