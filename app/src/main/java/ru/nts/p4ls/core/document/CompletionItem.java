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
package ru.nts.p4ls.core.document;

import ru.nts.p4ls.core.language.CompletionKind;

/**
 * Кандидат автодополнения.
 *
 * @param label имя символа
 * @param kind вид элемента для редактора
 * @param detail тип символа или его категория
 */
public record CompletionItem(String label, CompletionKind kind, String detail) {}
