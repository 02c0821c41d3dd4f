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
package ru.nts.p4ls.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LsExceptionTest {

    @Test
    void solutionPlaceholdersAreInterpolated() {
        LsException e = new LsException(LsErrorCode.CONFIG_INVALID,
                Map.of("path", "ast_rules[2].symbol", "reason", "unknown symbol role 'Declare'"));

        String message = e.toUserMessage();
        assertTrue(message.startsWith("[ERROR: CONFIG_INVALID]"));
        assertTrue(message.contains("Fix the rule-set document at ast_rules[2].symbol: unknown symbol role 'Declare'."));
        assertEquals(message, e.getMessage());
    }

    @Test
    void unresolvedPlaceholdersAreHidden() {
        String message = new LsException(LsErrorCode.DOCUMENT_NOT_FOUND).toUserMessage();

        assertTrue(message.contains("Document '...' is not tracked"), message);
        assertFalse(message.contains("Context:"));
    }

    @Test
    void logMessageCarriesCodeAndContext() {
        LsException e = new LsException(LsErrorCode.SYMBOL_NOT_FOUND, "symbol", 42);

        assertEquals("[SYMBOL_NOT_FOUND] Symbol not found | symbol=42", e.toLogMessage());
        assertEquals(42, e.getContext().get("symbol"));
        assertEquals(LsErrorCode.SYMBOL_NOT_FOUND, e.getCode());
    }
}
