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

import java.util.Objects;

/**
 * Вид узла AST.
 * Тег отделяет корень файла, терминальные узлы (имя, тип, значение) и узлы,
 * порождённые именованными правилами набора правил.
 *
 * @param tag категория вида
 * @param name имя вида ("Name", "Type", имя правила и т.д.)
 */
public record NodeKind(Tag tag, String name) {

    public static final NodeKind ROOT = new NodeKind(Tag.ROOT, "Root");
    public static final NodeKind NAME = new NodeKind(Tag.TERMINAL, "Name");
    public static final NodeKind TYPE = new NodeKind(Tag.TERMINAL, "Type");
    public static final NodeKind VALUE = new NodeKind(Tag.TERMINAL, "Value");

    public NodeKind {
        Objects.requireNonNull(tag, "tag");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node kind name must not be blank");
        }
    }

    /**
     * Вид узла, порождённого правилом. Правило с именем "Root" даёт корень файла.
     */
    public static NodeKind rule(String ruleName) {
        if (ROOT.name.equals(ruleName)) {
            return ROOT;
        }
        return new NodeKind(Tag.RULE, ruleName);
    }

    /**
     * Терминальный вид ("Name", "Type", "Value" или любое другое имя из набора правил).
     */
    public static NodeKind terminal(String terminalName) {
        return switch (terminalName) {
            case "Name" -> NAME;
            case "Type" -> TYPE;
            case "Value" -> VALUE;
            default -> new NodeKind(Tag.TERMINAL, terminalName);
        };
    }

    public boolean isRoot() {
        return tag == Tag.ROOT;
    }

    public boolean isTerminal() {
        return tag == Tag.TERMINAL;
    }

    @Override
    public String toString() {
        return name;
    }

    public enum Tag {
        ROOT,
        TERMINAL,
        RULE
    }
}
