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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A wire of a circuit, connecting either an external input or the output of a gate to an input of
 * a (later) gate. Inputs and gates are numbered from 1.
 */
public final class Connection {
    private static final Pattern NAME = Pattern.compile("([uv])\\.([1-9][0-9]{0,8})\\.([1-9][0-9]{0,8})");

    public enum Kind {
        INPUT("Input", Variable.Family.INPUT_LINK),
        GATE("Gate", Variable.Family.GATE_LINK);

        private final String label;
        private final Variable.Family family;

        Kind(String label, Variable.Family family) {
            this.label = label;
            this.family = family;
        }

        public String label() {
            return label;
        }

        public Variable.Family family() {
            return family;
        }
    }

    private final Kind kind;
    private final int source;
    private final int target;

    private Connection(Kind kind, int source, int target) {
        this.kind = kind;
        this.source = source;
        this.target = target;
    }

    public static Connection input(int input, int gate) {
        if (input < 1 || gate < 1) {
            throw new IllegalArgumentException(String.format("Invalid connection from input %d to gate %d", input, gate));
        }
        return new Connection(Kind.INPUT, input, gate);
    }

    /**
     * Creates the connection from the output of gate {@code from} to gate {@code to}.
     *
     * @throws IllegalArgumentException if {@code from} is not smaller than {@code to}.
     */
    public static Connection gate(int from, int to) {
        if (from < 1 || to <= from) {
            throw new IllegalArgumentException(String.format("Invalid connection from gate %d to gate %d", from, to));
        }
        return new Connection(Kind.GATE, from, to);
    }

    /**
     * Obtains the connection represented by a variable named {@code u.e.k} or {@code v.i.k}. Returns
     * an empty optional for any other name, including {@code v.i.k} with {@code i >= k}.
     */
    public static Optional<Connection> fromVariableName(String name) {
        Matcher matcher = NAME.matcher(name);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int source = Integer.parseInt(matcher.group(2));
        int target = Integer.parseInt(matcher.group(3));
        if ("u".equals(matcher.group(1))) {
            return Optional.of(new Connection(Kind.INPUT, source, target));
        }
        return source < target ? Optional.of(new Connection(Kind.GATE, source, target)) : Optional.empty();
    }

    public static Connection fromVariable(Variable variable) {
        switch (variable.family()) {
            case INPUT_LINK:
                return input(variable.subscript(0), variable.subscript(1));
            case GATE_LINK:
                return gate(variable.subscript(0), variable.subscript(1));
            default:
                throw new IllegalArgumentException("Variable " + variable + " is not a connection");
        }
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the index of the input or gate this connection starts at.
     */
    public int source() {
        return source;
    }

    /**
     * Returns the index of the gate this connection feeds.
     */
    public int target() {
        return target;
    }

    public String variableName() {
        return String.format("%s.%d.%d", kind.family().prefix(), source, target);
    }

    /**
     * Returns a human readable description such as {@code Input	 1 connects to gate 2}.
     */
    public String describe() {
        return String.format("%s\t %d connects to gate %d", kind.label(), source, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Connection)) {
            return false;
        }
        Connection other = (Connection) o;
        return kind == other.kind && source == other.source && target == other.target;
    }

    @Override
    public int hashCode() {
        return (kind.hashCode() * 31 + source) * 31 + target;
    }

    @Override
    public String toString() {
        return variableName();
    }
}
