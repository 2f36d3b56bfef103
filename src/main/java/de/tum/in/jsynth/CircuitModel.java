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

import java.util.List;

/**
 * A 0/1 integer linear program whose optimal solutions are the circuits with the fewest connections
 * that are built from a fixed gate sequence and compute a given truth table. Instances are created
 * by {@link CircuitModelBuilder} and are immutable.
 */
public final class CircuitModel {
    private final String name;
    private final TruthTable truthTable;
    private final List<GateType> gates;
    private final VariableSpace variables;
    private final LinearExpression objective;
    private final List<LinearConstraint> constraints;
    private final int bigM;

    CircuitModel(
            String name,
            TruthTable truthTable,
            List<GateType> gates,
            VariableSpace variables,
            LinearExpression objective,
            List<LinearConstraint> constraints,
            int bigM) {
        this.name = name;
        this.truthTable = truthTable;
        this.gates = List.copyOf(gates);
        this.variables = variables;
        this.objective = objective;
        this.constraints = List.copyOf(constraints);
        this.bigM = bigM;
    }

    public String name() {
        return name;
    }

    public TruthTable truthTable() {
        return truthTable;
    }

    public List<GateType> gates() {
        return gates;
    }

    public VariableSpace variables() {
        return variables;
    }

    /**
     * Returns the objective, which is to be minimized.
     */
    public LinearExpression objective() {
        return objective;
    }

    public List<LinearConstraint> constraints() {
        return constraints;
    }

    public int bigM() {
        return bigM;
    }

    @Override
    public String toString() {
        return String.format("CircuitModel{%s, %d variables, %d constraints}", name, variables.size(), constraints.size());
    }
}
