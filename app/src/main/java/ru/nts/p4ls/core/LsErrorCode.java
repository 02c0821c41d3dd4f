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

import java.util.Map;

/**
 * Structured error codes for the language server core.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example of a formatted error:
 * <pre>
 * [ERROR: CONFIG_INVALID]
 * Message: Malformed rule-set document
 * Solution: Fix the rule-set document at ast_rules[3]: unknown multiplicity 'Some'.
 * Context: path=ast_rules[3], reason=unknown multiplicity 'Some'
 * </pre>
 */
public enum LsErrorCode {

    // ============ Configuration Errors ============

    CONFIG_INVALID("Malformed rule-set document",
            "Fix the rule-set document at %path%: %reason%."),

    CONFIG_NOT_READABLE("Rule-set document not readable",
            "Check that %file% exists and is readable. Set P4LS_RULES to the rule-set path."),

    LANGUAGE_ALREADY_LOADED("Language definition already loaded",
            "The rule set is loaded once per process. Remove the second load call."),

    LANGUAGE_NOT_LOADED("Language definition has not been loaded",
            "Call LanguageDefinition.load(...) during startup before translating documents."),

    // ============ Parser Errors ============

    LANGUAGE_NOT_SUPPORTED("Language not supported",
            "No grammar registered for '%language%'. Register it with TreeSitterManager.registerLanguage."),

    PARSE_FAILED("Parser returned no tree",
            "The parser for '%language%' failed on the document. Check the grammar binary."),

    // ============ Symbol Errors ============

    SYMBOL_NOT_FOUND("Symbol not found",
            "Symbol #%symbol% does not exist in the current table. Rebuild the table and retry."),

    // ============ Document Errors ============

    DOCUMENT_NOT_FOUND("Document not open",
            "Document '%uri%' is not tracked. Open it before querying."),

    // ============ System Errors ============

    INTERNAL_ERROR("Internal error",
            "Unexpected error while rebuilding '%uri%'. Check logs for details.");

    private final String message;
    private final String solution;

    LsErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, reason, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }
}
