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

import org.treesitter.TSNode;
import org.treesitter.TSPoint;
import ru.nts.p4ls.core.Position;
import ru.nts.p4ls.core.Range;

import java.nio.charset.StandardCharsets;

/**
 * Адаптер узла tree-sitter к {@link SyntaxNode}.
 * Колонки tree-sitter считаются в байтах строки, а не в символах.
 */
final class TsSyntaxNode implements SyntaxNode {

    private final TSNode node;
    private final byte[] sourceBytes;

    TsSyntaxNode(TSNode node, byte[] sourceBytes) {
        this.node = node;
        this.sourceBytes = sourceBytes;
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public Range range() {
        return new Range(toPosition(node.getStartPoint()), toPosition(node.getEndPoint()));
    }

    /**
     * КРИТИЧНО: tree-sitter возвращает байтовые смещения, а не символьные!
     */
    @Override
    public String text() {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= sourceBytes.length && start < end) {
            return new String(sourceBytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    @Override
    public int childCount() {
        return node.getChildCount();
    }

    @Override
    public SyntaxNode child(int index) {
        TSNode child = node.getChild(index);
        if (child == null || child.isNull()) {
            return null;
        }
        return new TsSyntaxNode(child, sourceBytes);
    }

    @Override
    public String fieldNameForChild(int index) {
        return node.getFieldNameForChild(index);
    }

    @Override
    public boolean isMissing() {
        return node.isMissing();
    }

    private static Position toPosition(TSPoint point) {
        return new Position(point.getRow(), point.getColumn());
    }

    @Override
    public String toString() {
        return kind() + "@" + range().format();
    }
}
