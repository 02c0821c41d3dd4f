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

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Журнал сервера.
 * ВАЖНО: stdout занят протоколом редактора, поэтому всё пишется только в stderr
 * и (опционально) в файл.
 *
 * Отладочный вывод в stderr включается переменной окружения P4LS_DEBUG=true.
 * Если установлен P4LS_LOG_FILE, все сообщения дописываются в этот файл.
 */
public final class LsLog {

    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("P4LS_DEBUG"));

    private static final String LOG_FILE = System.getenv("P4LS_LOG_FILE");
    private static PrintWriter logWriter = null;

    static {
        if (LOG_FILE != null && !LOG_FILE.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(LOG_FILE, true), true);
            } catch (IOException e) {
                System.err.println("Cannot open log file " + LOG_FILE + ": " + e.getMessage());
            }
        }
    }

    private LsLog() {}

    public static boolean isDebugEnabled() {
        return DEBUG;
    }

    /**
     * Отладочное сообщение: файл всегда, stderr только в режиме P4LS_DEBUG.
     */
    public static void debug(String message) {
        write("DEBUG", message);
        if (DEBUG) {
            System.err.println(message);
        }
    }

    public static void info(String message) {
        write("INFO", message);
        if (DEBUG) {
            System.err.println(message);
        }
    }

    /**
     * Ошибка: печатается в stderr всегда.
     */
    public static void error(String message) {
        write("ERROR", message);
        System.err.println(message);
    }

    private static synchronized void write(String level, String message) {
        if (logWriter != null) {
            logWriter.println("[" + LocalDateTime.now() + "] [" + level + "] [" + Thread.currentThread().getName() + "] " + message);
        }
    }
}
