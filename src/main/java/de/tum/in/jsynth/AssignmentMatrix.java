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

import java.util.BitSet;

/**
 * All {@code 2^n} assignments of {@code n} input variables in canonical order.
 *
 * <p>Rows are indexed from 0 and columns (i.e. inputs) from 1. Row {@code j} assigns bit
 * {@code e - 1} of {@code j} to input {@code e}, so input 1 alternates fastest. Equivalently, the
 * matrix is the lexicographically ordered product {@code {0,1}^n} with reversed columns.</p>
 */
public final class AssignmentMatrix {
    static final int MAXIMAL_INPUTS = 30;

    private final int inputs;
    private final BitSet[] rows;

    private AssignmentMatrix(int inputs) {
        this.inputs = inputs;
        int rowCount = 1 << inputs;
        rows = new BitSet[rowCount];
        for (int row = 0; row < rowCount; row++) {
            rows[row] = BitSet.valueOf(new long[] {row});
        }
    }

    /**
     * Expands the assignments of {@code inputs} many variables.
     *
     * @throws IllegalArgumentException if {@code inputs} is not positive or too large.
     */
    public static AssignmentMatrix of(int inputs) {
        if (inputs < 1 || inputs > MAXIMAL_INPUTS) {
            throw new IllegalArgumentException("Invalid number of inputs " + inputs);
        }
        return new AssignmentMatrix(inputs);
    }

    public int inputs() {
        return inputs;
    }

    public int rowCount() {
        return rows.length;
    }

    public boolean get(int row, int input) {
        assert 1 <= input && input <= inputs;
        return rows[row].get(input - 1);
    }

    public int bit(int row, int input) {
        return get(row, input) ? 1 : 0;
    }

    public boolean[] row(int row) {
        boolean[] assignment = new boolean[inputs];
        for (int input = 1; input <= inputs; input++) {
            assignment[input - 1] = get(row, input);
        }
        return assignment;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < rows.length; row++) {
            for (int input = 1; input <= inputs; input++) {
                builder.append(bit(row, input));
            }
            builder.append('\n');
        }
        return builder.toString();
    }
}
