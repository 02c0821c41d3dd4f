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

import org.junit.jupiter.api.Test;
import ru.nts.p4ls.core.Diagnostic;
import ru.nts.p4ls.core.Range;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxCheckerTest {

    @Test
    void cleanTreeHasNoErrors() {
        assertTrue(SyntaxChecker.check(P4Samples.program()).isEmpty());
    }

    @Test
    void reportsErrorAndMissingNodes() {
        FakeSyntax.Source src = new FakeSyntax.Source("const bit<8> X = ;");
        FakeSyntax declaration = src.node("constant_declaration", 0, "const", ";",
                src.leaf("base_type", 0, "bit<8>").field("type"),
                src.leaf("identifier", 0, "X").field("name"),
                src.leaf("ERROR", 0, "= ").add(src.leaf("identifier", 0, "=")),
                src.leaf("integer", 0, ";").missing());
        SyntaxTree tree = src.tree(src.root("source_file", declaration));

        List<Diagnostic> errors = SyntaxChecker.check(tree);

        assertEquals(2, errors.size(), "Внутрь ERROR узла проверка не спускается");
        assertEquals(Diagnostic.Source.SYNTAX, errors.get(0).source());
        assertEquals("Syntax error in constant_declaration", errors.get(0).message());
        assertEquals(Range.of(0, 15, 0, 17), errors.get(0).range());
        assertEquals("Missing expected syntax: integer", errors.get(1).message());
    }

    @Test
    void errorCountIsCapped() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 80; i++) {
            text.append("?\n");
        }
        FakeSyntax.Source src = new FakeSyntax.Source(text.toString());
        FakeSyntax root = src.root("source_file");
        for (int line = 0; line < 80; line++) {
            root.add(src.leaf("ERROR", line, "?"));
        }

        assertEquals(50, SyntaxChecker.check(src.tree(root)).size());
    }
}
