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

import java.util.List;
import java.util.Objects;

/**
 * Запрос к дереву разбора относительно текущего узла.
 */
public sealed interface NodeQuery permits NodeQuery.Kind, NodeQuery.Field, NodeQuery.Path {

    /**
     * Непосредственные потомки с указанным синтаксическим видом.
     */
    record Kind(String kind) implements NodeQuery {
        public Kind {
            Objects.requireNonNull(kind, "kind");
        }
    }

    /**
     * Непосредственные потомки под указанным полем грамматики.
     */
    record Field(String field) implements NodeQuery {
        public Field {
            Objects.requireNonNull(field, "field");
        }
    }

    /**
     * Последовательная композиция запросов. Пустой путь выбирает сам текущий узел.
     */
    record Path(List<NodeQuery> steps) implements NodeQuery {
        public Path {
            steps = List.copyOf(steps);
        }
    }
}
