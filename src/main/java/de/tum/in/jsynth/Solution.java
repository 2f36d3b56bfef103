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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The outcome of solving a {@link CircuitModel}: a status and, if a solution was found, the values
 * of (some of) its variables. Solvers with a structured interface report all variables, while
 * solutions recovered from a solver log may only contain the variables of the objective which are
 * set to one.
 */
public final class Solution {
    public enum Status {
        OPTIMAL,
        FEASIBLE,
        INFEASIBLE;

        public boolean isFeasible() {
            return this != INFEASIBLE;
        }
    }

    private static final Solution INFEASIBLE = new Solution(Status.INFEASIBLE, Map.of());

    private final Status status;
    private final Map<String, Integer> values;

    private Solution(Status status, Map<String, Integer> values) {
        this.status = status;
        this.values = values;
    }

    public static Solution infeasible() {
        return INFEASIBLE;
    }

    /**
     * Creates a solution from the given variable values. The iteration order of {@code values}
     * determines the order of the {@link #connections() connections}.
     */
    public static Solution of(Status status, Map<String, Integer> values) {
        if (!status.isFeasible()) {
            if (!values.isEmpty()) {
                throw new IllegalArgumentException("Infeasible solution with values");
            }
            return INFEASIBLE;
        }
        return new Solution(status, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public Status status() {
        return status;
    }

    public boolean isFeasible() {
        return status.isFeasible();
    }

    public Map<String, Integer> values() {
        return values;
    }

    public OptionalInt value(String variable) {
        Integer value = values.get(variable);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    /**
     * Returns the connections of the circuit, i.e. all {@code u} and {@code v} variables set to
     * one. The list is empty for infeasible solutions.
     */
    public List<Connection> connections() {
        List<Connection> connections = new ArrayList<>();
        values.forEach((name, value) -> {
            if (value == 1) {
                Optional<Connection> connection = Connection.fromVariableName(name);
                connection.ifPresent(connections::add);
            }
        });
        return connections;
    }

    @Override
    public String toString() {
        return String.format("Solution{%s, %s}", status, connections());
    }
}
