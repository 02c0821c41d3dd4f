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
package ru.nts.p4ls.core.symbols;

import ru.nts.p4ls.core.Position;

import java.util.Optional;

/**
 * Запросы видимости к таблице символов.
 * Пустой результат - штатный промах, а не ошибка.
 */
public interface SymbolTableQuery {

    Optional<Symbols> getTopLevelSymbols();

    Optional<Symbols> getSymbolsInScope(Position position);

    Optional<Symbol> getSymbolAtPos(String name, Position position);
}
