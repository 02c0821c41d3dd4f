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

import java.util.Objects;

/**
 * Сколько совпадений запроса ожидает правило.
 */
public sealed interface Multiplicity permits Multiplicity.One, Multiplicity.Maybe, Multiplicity.Many {

    Child child();

    /**
     * Ровно одно совпадение. Отсутствие - структурная ошибка.
     */
    record One(Child child) implements Multiplicity {
        public One {
            Objects.requireNonNull(child, "child");
        }
    }

    /**
     * Ноль или одно совпадение.
     */
    record Maybe(Child child) implements Multiplicity {
        public Maybe {
            Objects.requireNonNull(child, "child");
        }
    }

    /**
     * Ноль или больше совпадений, в порядке исходного текста.
     */
    record Many(Child child) implements Multiplicity {
        public Many {
            Objects.requireNonNull(child, "child");
        }
    }
}
