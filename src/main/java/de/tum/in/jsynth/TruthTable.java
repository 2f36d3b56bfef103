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

import java.util.Arrays;
import java.util.BitSet;

/**
 * The output column of a Boolean function {@code f: {0,1}^n -> {0,1}}, listed over the rows of the
 * {@link AssignmentMatrix} of {@code n} inputs. For example, {@code "01010011"} is the 2x1
 * multiplexer with data inputs 1, 2 and select input 3.
 */
public final class TruthTable {
    private final int inputs;
    private final int rows;
    private final BitSet outputs;

    private TruthTable(int inputs, BitSet outputs) {
        this.inputs = inputs;
        this.rows = 1 << inputs;
        this.outputs = outputs;
    }

    /**
     * Parses a string of {@code '0'} and {@code '1'} characters, one per input row.
     *
     * @throws IllegalArgumentException if the string contains other characters or its length is
     *     not a power of two greater than one.
     */
    public static TruthTable parse(String truth) {
        int inputs = inputCount(truth.length());
        BitSet outputs = new BitSet(truth.length());
        for (int row = 0; row < truth.length(); row++) {
            char value = truth.charAt(row);
            if (value == '1') {
                outputs.set(row);
            } else if (value != '0') {
                throw new IllegalArgumentException(
                        String.format("Invalid character '%c' at position %d of %s", value, row, truth));
            }
        }
        return new TruthTable(inputs, outputs);
    }

    public static TruthTable of(boolean... values) {
        int inputs = inputCount(values.length);
        BitSet outputs = new BitSet(values.length);
        for (int row = 0; row < values.length; row++) {
            outputs.set(row, values[row]);
        }
        return new TruthTable(inputs, outputs);
    }

    private static int inputCount(int length) {
        if (length < 2 || Integer.bitCount(length) != 1) {
            throw new IllegalArgumentException("Truth table length " + length + " is not a power of two");
        }
        int inputs = Integer.numberOfTrailingZeros(length);
        assert (1 << inputs) == length;
        return inputs;
    }

    public int inputs() {
        return inputs;
    }

    public int rowCount() {
        return rows;
    }

    public boolean output(int row) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException(row);
        }
        return outputs.get(row);
    }

    public AssignmentMatrix assignments() {
        return AssignmentMatrix.of(inputs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TruthTable)) {
            return false;
        }
        TruthTable other = (TruthTable) o;
        return inputs == other.inputs && outputs.equals(other.outputs);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new int[] {inputs, outputs.hashCode()});
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(rows);
        for (int row = 0; row < rows; row++) {
            builder.append(outputs.get(row) ? '1' : '0');
        }
        return builder.toString();
    }
}
