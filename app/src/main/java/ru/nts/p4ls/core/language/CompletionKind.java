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
package ru.nts.p4ls.core.language;

import java.util.Arrays;
import java.util.Optional;

/**
 * Виды элементов автодополнения из протокола LSP.
 * Используются только для отображения: набор правил сопоставляет
 * имени правила-объявления один из этих видов.
 */
public enum CompletionKind {
    TEXT("Text", 1),
    METHOD("Method", 2),
    FUNCTION("Function", 3),
    CONSTRUCTOR("Constructor", 4),
    FIELD("Field", 5),
    VARIABLE("Variable", 6),
    CLASS("Class", 7),
    INTERFACE("Interface", 8),
    MODULE("Module", 9),
    PROPERTY("Property", 10),
    UNIT("Unit", 11),
    VALUE("Value", 12),
    ENUM("Enum", 13),
    KEYWORD("Keyword", 14),
    SNIPPET("Snippet", 15),
    COLOR("Color", 16),
    FILE("File", 17),
    REFERENCE("Reference", 18),
    FOLDER("Folder", 19),
    ENUM_MEMBER("EnumMember", 20),
    CONSTANT("Constant", 21),
    STRUCT("Struct", 22),
    EVENT("Event", 23),
    OPERATOR("Operator", 24),
    TYPE_PARAMETER("TypeParameter", 25);

    private final String displayName;
    private final int protocolValue;

    CompletionKind(String displayName, int protocolValue) {
        this.displayName = displayName;
        this.protocolValue = protocolValue;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Числовое значение CompletionItemKind в протоколе.
     */
    public int getProtocolValue() {
        return protocolValue;
    }

    /**
     * Ищет вид по имени из документа правил ("Constant", "EnumMember", ...).
     */
    public static Optional<CompletionKind> fromDisplayName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.displayName.equals(name))
                .findFirst();
    }
}
