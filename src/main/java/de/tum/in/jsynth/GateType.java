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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The gate types a circuit can be built from.
 *
 * <p>Each type is characterized by an integer marker {@code g}. A gate outputs {@code true} on a
 * given input row iff the number of its connected inputs which are {@code true} is at most
 * {@code -g}, and it may have at most {@code 1 - g} connected inputs. For {@code NOT} and a
 * two-input {@code NAND} this is exactly the usual semantics.</p>
 */
public enum GateType {
    NOT(0),
    NAND(-1);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int marker;

    GateType(int marker) {
        this.marker = marker;
    }

    public int marker() {
        return marker;
    }

    public int maximalFanIn() {
        return 1 - marker;
    }

    /**
     * Computes the output of this gate, given how many of its connected inputs are {@code true}.
     */
    public boolean output(int activeInputs) {
        return activeInputs <= -marker;
    }

    /**
     * Parses a single gate tag.
     *
     * @throws IllegalArgumentException if the tag is neither {@code NOT} nor {@code NAND}.
     */
    public static GateType parse(String tag) {
        for (GateType type : values()) {
            if (type.name().equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown gate type " + tag);
    }

    /**
     * Parses a whitespace separated sequence of gate tags, e.g. {@code "NOT NAND NAND NAND"}. The
     * order of the returned list is the order of the gates in the circuit.
     *
     * @throws IllegalArgumentException if the sequence is empty or contains an unknown tag.
     */
    public static List<GateType> parseSequence(String gates) {
        String stripped = gates.strip();
        if (stripped.isEmpty()) {
            throw new IllegalArgumentException("Empty gate sequence");
        }
        String[] tags = WHITESPACE.split(stripped);
        List<GateType> sequence = new ArrayList<>(tags.length);
        for (String tag : tags) {
            sequence.add(parse(tag));
        }
        return List.copyOf(sequence);
    }
}
