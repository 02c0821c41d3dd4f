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

import ru.nts.p4ls.core.Range;

/**
 * Ссылка на символ, найденная при трансляции.
 * Разрешается позже по ближайшему видимому объявлению с тем же именем.
 *
 * @param name имя, на которое ссылаются
 * @param range место ссылки
 */
public record SymbolUsage(String name, Range range) {}
