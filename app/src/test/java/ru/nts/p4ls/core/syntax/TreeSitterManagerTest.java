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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterManagerTest {

    private TreeSitterManager manager;

    @BeforeEach
    void setUp() {
        manager = TreeSitterManager.getInstance();
        manager.clear();
    }

    @AfterEach
    void tearDown() {
        manager.clear();
    }

    @Test
    void getInstance() {
        assertSame(manager, TreeSitterManager.getInstance(), "Should be singleton");
    }

    @Test
    void unregisteredLanguageIsNotSupported() {
        assertFalse(manager.isSupported("p4"));
        assertTrue(manager.getSupportedLanguages().isEmpty());

        LsException e = assertThrows(LsException.class, () -> manager.getLanguage("p4"));
        assertEquals(LsErrorCode.LANGUAGE_NOT_SUPPORTED, e.getCode());
        assertEquals("p4", e.getContext().get("language"));
    }

    @Test
    void parseWithoutGrammarFails() {
        LsException e = assertThrows(LsException.class, () -> manager.parse("const bit<8> X = 1;", "p4"));
        assertEquals(LsErrorCode.LANGUAGE_NOT_SUPPORTED, e.getCode());
    }
}
