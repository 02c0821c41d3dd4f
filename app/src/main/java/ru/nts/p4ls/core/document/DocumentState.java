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

import java.util.concurrent.atomic.AtomicReference;

/**
 * Состояние одного документа: текущий опубликованный снимок.
 *
 * Пересборка строит новый снимок полностью и только затем подменяет ссылку,
 * поэтому запрос видит либо старый, либо новый снимок целиком.
 * Снимок более старой версии не может вытеснить более новый.
 */
public final class DocumentState {

    private final String uri;
    private final AtomicReference<DocumentSnapshot> current = new AtomicReference<>();

    public DocumentState(String uri) {
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }

    /**
     * Текущий снимок или null, если документ ещё ни разу не собран.
     */
    public DocumentSnapshot snapshot() {
        return current.get();
    }

    /**
     * Публикует собранный снимок.
     *
     * @return true если снимок опубликован, false если уже опубликована более новая версия
     */
    public boolean publish(DocumentSnapshot snapshot) {
        while (true) {
            DocumentSnapshot existing = current.get();
            if (existing != null && existing.version() > snapshot.version()) {
                return false;
            }
            if (current.compareAndSet(existing, snapshot)) {
                return true;
            }
        }
    }
}
