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

import static org.junit.jupiter.api.Assertions.*;

class RangeTest {

    @Test
    void rangeIsHalfOpen() {
        Range range = Range.of(1, 4, 1, 9);

        assertTrue(range.contains(Position.of(1, 4)));
        assertTrue(range.contains(Position.of(1, 8)));
        assertFalse(range.contains(Position.of(1, 9)), "Конец диапазона не входит в него");
        assertFalse(range.contains(Position.of(0, 6)));
    }

    @Test
    void multiLineRange() {
        Range range = Range.of(2, 18, 10, 1);

        assertTrue(range.contains(Position.of(5, 0)));
        assertTrue(range.contains(Position.of(10, 0)));
        assertFalse(range.contains(Position.of(2, 17)));
        assertEquals("2:18-10:1", range.format());
        assertEquals("1:4-9", Range.of(1, 4, 1, 9).format());
    }

    @Test
    void positionOrdering() {
        assertTrue(Position.of(3, 21).isBefore(Position.of(4, 0)));
        assertEquals(0, Position.of(7, 7).compareTo(new Position(7, 7)));
    }

    @Test
    void rejectsInvertedRange() {
        assertThrows(IllegalArgumentException.class, () -> Range.of(4, 0, 3, 0));
        assertTrue(Range.of(1, 1, 1, 1).isEmpty());
    }
}
