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

/**
 * A binary decision variable of a {@link CircuitModel}. Variables are only created by a
 * {@link VariableSpace}, which assigns each of them a name such as {@code u.1.3} and a dense index
 * reflecting the allocation order.
 */
public final class Variable {
    /**
     * The families of variables used in the encoding.
     */
    public enum Family {
        /** {@code u.e.k}: external input {@code e} feeds gate {@code k}. */
        INPUT_LINK("u", 2),
        /** {@code v.i.k}: the output of gate {@code i} feeds gate {@code k}. */
        GATE_LINK("v", 2),
        /** {@code p.k.j}: the output of gate {@code k} on input row {@code j}. */
        GATE_OUTPUT("p", 2),
        /** {@code r.i.k.j}: the product of {@code v.i.k} and {@code p.i.j}. */
        LINKED_OUTPUT("r", 3);

        private final String prefix;
        private final int arity;

        Family(String prefix, int arity) {
            this.prefix = prefix;
            this.arity = arity;
        }

        public String prefix() {
            return prefix;
        }

        public int arity() {
            return arity;
        }

        public boolean isConnection() {
            return this == INPUT_LINK || this == GATE_LINK;
        }
    }

    private final Family family;
    private final int[] indices;
    private final int index;
    private final String name;

    Variable(Family family, int index, int... indices) {
        assert indices.length == family.arity();
        this.family = family;
        this.index = index;
        this.indices = indices.clone();

        StringBuilder builder = new StringBuilder(family.prefix());
        for (int value : indices) {
            builder.append('.').append(value);
        }
        this.name = builder.toString();
    }

    public Family family() {
        return family;
    }

    /**
     * Returns the position of this variable in the allocation order of its variable space.
     */
    public int index() {
        return index;
    }

    /**
     * Returns the {@code position}-th (0-based) subscript of this variable, e.g. {@code 3} for
     * position 1 of {@code u.1.3}.
     */
    public int subscript(int position) {
        return indices[position];
    }

    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        Variable other = (Variable) o;
        return index == other.index && family == other.family && Arrays.equals(indices, other.indices);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
