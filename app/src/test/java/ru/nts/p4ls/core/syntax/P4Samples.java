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

import ru.nts.p4ls.LanguageServerCore;
import ru.nts.p4ls.core.language.LanguageDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Деревья разбора P4 программ в форме грамматики tree-sitter-p4, собранные вручную.
 */
public final class P4Samples {

    /**
     * Программа с тремя уровнями областей: файл, control и вложенный блок.
     * {@code a = c} ссылается на {@code c} до объявления.
     */
    public static final String PROGRAM = String.join("\n",
            "const bit<8> LIMIT = 5;",          // 0
            "typedef bit<16> port_t;",          // 1
            "control Ingress() {",              // 2
            "    bit<8> a = LIMIT;",            // 3
            "    a = LIMIT;",                   // 4
            "    {",                            // 5
            "        port_t b = a;",            // 6
            "    }",                            // 7
            "    a = c;",                       // 8
            "    bit<8> c = a;",                // 9
            "}",                                // 10
            "const bit<8> AFTER = 1;");         // 11

    private static final Pattern CONSTANT_LINE =
            Pattern.compile("const (\\S+) (\\w+) = (\\w+);");

    private P4Samples() {}

    /**
     * Встроенный набор правил без регистрации в процессе.
     */
    public static LanguageDefinition rules() {
        return LanguageDefinition.parseDetached(LanguageServerCore.bundledRules());
    }

    public static SyntaxTree program() {
        FakeSyntax.Source src = new FakeSyntax.Source(PROGRAM);

        FakeSyntax controlBody = src.node("control_body", 2, "{", 10, "}",
                variable(src, 3, "bit<8>", "a", identifierValue(src, 3, "LIMIT")),
                src.node("assignment_statement", 4, "a", ";",
                        src.leaf("identifier", 4, "a").field("left"),
                        identifierValue(src, 4, "LIMIT").field("right")),
                src.node("block_statement", 5, "{", 7, "}",
                        src.node("variable_declaration", 6, "port_t", ";",
                                src.leaf("type_name", 6, "port_t").field("type"),
                                src.leaf("identifier", 6, "b").field("name"),
                                identifierValue(src, 6, "a"))),
                src.node("assignment_statement", 8, "a", ";",
                        src.leaf("identifier", 8, "a").field("left"),
                        identifierValue(src, 8, "c").field("right")),
                variable(src, 9, "bit<8>", "c", identifierValue(src, 9, "a")))
                .field("body");

        FakeSyntax root = src.root("source_file",
                constant(src, 0, "bit<8>", "LIMIT", "5"),
                src.node("typedef_declaration", 1, "typedef", ";",
                        src.leaf("base_type", 1, "bit<16>").field("type"),
                        src.leaf("identifier", 1, "port_t").field("name")),
                src.node("control_declaration", 2, "control", 10, "}",
                        src.leaf("identifier", 2, "Ingress").field("name"),
                        controlBody),
                constant(src, 11, "bit<8>", "AFTER", "1"));
        return src.tree(root);
    }

    /**
     * Дерево для файла из строк вида {@code const <type> <NAME> = <value>;}.
     * Пустые строки пропускаются.
     */
    public static SyntaxTree constants(String text) {
        FakeSyntax.Source src = new FakeSyntax.Source(text);
        String[] lines = text.split("\n", -1);
        List<FakeSyntax> declarations = new ArrayList<>();
        for (int line = 0; line < lines.length; line++) {
            Matcher m = CONSTANT_LINE.matcher(lines[line]);
            if (m.find()) {
                declarations.add(constant(src, line, m.group(1), m.group(2), m.group(3)));
            }
        }
        return src.tree(src.root("source_file", declarations.toArray(new FakeSyntax[0])));
    }

    /**
     * Парсер для {@link #PROGRAM} и файлов из констант.
     */
    public static SyntaxParser parser() {
        return (content, langId) -> PROGRAM.equals(content) ? program() : constants(content);
    }

    private static FakeSyntax constant(FakeSyntax.Source src, int line, String type, String name, String value) {
        FakeSyntax valueNode = Character.isDigit(value.charAt(0))
                ? src.leafIn("integer", line, value, "= " + value).field("value")
                : identifierValue(src, line, value);
        return src.node("constant_declaration", line, "const", ";",
                src.leaf("base_type", line, type).field("type"),
                src.leafIn("identifier", line, name, " " + name + " ").field("name"),
                valueNode);
    }

    private static FakeSyntax variable(FakeSyntax.Source src, int line, String type, String name, FakeSyntax value) {
        return src.node("variable_declaration", line, type, ";",
                src.leaf("base_type", line, type).field("type"),
                src.leafIn("identifier", line, name, " " + name + " ").field("name"),
                value);
    }

    /**
     * Выражение из одного идентификатора (после знака '=').
     */
    private static FakeSyntax identifierValue(FakeSyntax.Source src, int line, String name) {
        return src.leafIn("expression", line, name, "= " + name)
                .add(src.leafIn("identifier", line, name, "= " + name))
                .field("value");
    }
}
