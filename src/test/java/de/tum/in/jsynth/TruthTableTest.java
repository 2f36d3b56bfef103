/*
 * This file is part of JSynth.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JSynth is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JSynth is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JSynth. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jsynth;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TruthTableTest {
    @Test
    public void testParse() {
        TruthTable table = TruthTable.parse(CircuitFixtures.MULTIPLEXER);
        assertThat(table.inputs(), is(3));
        assertThat(table.rowCount(), is(8));
        assertThat(table.output(0), is(false));
        assertThat(table.output(1), is(true));
        assertThat(table.output(6), is(true));
        assertThat(table.toString(), is(CircuitFixtures.MULTIPLEXER));
        assertThat(table, is(TruthTable.of(false, true, false, true, false, false, true, true)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0", "010", "010100111", "0101001"})
    public void testRejectsInvalidLength(String truth) {
        assertThrows(IllegalArgumentException.class, () -> TruthTable.parse(truth));
    }

    @Test
    public void testRejectsInvalidCharacters() {
        assertThrows(IllegalArgumentException.class, () -> TruthTable.parse("01x1"));
        assertThrows(IllegalArgumentException.class, () -> TruthTable.parse("0 11"));
    }

    @Test
    public void testAssignmentOrder() {
        AssignmentMatrix matrix = AssignmentMatrix.of(3);
        assertThat(matrix.rowCount(), is(8));
        // Input 1 alternates fastest, input 3 slowest
        assertThat(matrix.toString(), is("000\n100\n010\n110\n001\n101\n011\n111\n"));
        assertThat(matrix.bit(6, 1), is(0));
        assertThat(matrix.bit(6, 2), is(1));
        assertThat(matrix.bit(6, 3), is(1));
    }

    @Test
    public void testAssignmentRows() {
        AssignmentMatrix matrix = AssignmentMatrix.of(4);
        for (int row = 0; row < matrix.rowCount(); row++) {
            boolean[] assignment = matrix.row(row);
            int value = 0;
            for (int input = 0; input < assignment.length; input++) {
                value |= assignment[input] ? 1 << input : 0;
            }
            assertThat(value, is(row));
        }
    }

    @Test
    public void testRejectsInvalidInputCount() {
        assertThrows(IllegalArgumentException.class, () -> AssignmentMatrix.of(0));
        assertThrows(IllegalArgumentException.class, () -> AssignmentMatrix.of(-1));
    }
}
