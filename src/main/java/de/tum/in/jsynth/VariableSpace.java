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

import static de.tum.in.jsynth.Util.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Allocates the decision variables of a circuit with {@code n} inputs, {@code R} gates and
 * {@code 2^n} input rows. All subscripts are 1-based.
 *
 * <p>Gate-to-gate links {@code v.i.k} and their linearization variables {@code r.i.k.j} only exist
 * for {@code i < k}, which restricts the circuit to feed-forward wiring. The last gate is the output
 * of the circuit and has no output variables {@code p.R.j}.</p>
 *
 * <p>Variables are allocated family by family in the order {@code u}, {@code v}, {@code p},
 * {@code r}; within a family, the gate index varies slowest (except for {@code u}, which is ordered
 * by input first).</p>
 */
public final class VariableSpace {
    private static final Logger logger = Logger.getLogger(VariableSpace.class.getName());

    private final int inputs;
    private final int gates;
    private final int rows;

    private final Variable[][] inputLinks;
    private final Variable[][] gateLinks;
    private final Variable[][] gateOutputs;
    private final Variable[][][] linkedOutputs;

    private final List<Variable> variables;
    private final Map<String, Variable> byName;

    public VariableSpace(int inputs, int gates) {
        checkArgument(0 < inputs && inputs <= AssignmentMatrix.MAXIMAL_INPUTS, "Invalid number of inputs %d", inputs);
        checkArgument(gates > 0, "Invalid number of gates %d", gates);
        this.inputs = inputs;
        this.gates = gates;
        this.rows = 1 << inputs;

        List<Variable> allocated = new ArrayList<>();

        inputLinks = new Variable[inputs][gates];
        for (int e = 1; e <= inputs; e++) {
            for (int k = 1; k <= gates; k++) {
                inputLinks[e - 1][k - 1] = allocate(allocated, Variable.Family.INPUT_LINK, e, k);
            }
        }

        gateLinks = new Variable[gates][];
        for (int k = 1; k <= gates; k++) {
            gateLinks[k - 1] = new Variable[k - 1];
            for (int i = 1; i < k; i++) {
                gateLinks[k - 1][i - 1] = allocate(allocated, Variable.Family.GATE_LINK, i, k);
            }
        }

        gateOutputs = new Variable[gates - 1][rows];
        for (int k = 1; k < gates; k++) {
            for (int j = 1; j <= rows; j++) {
                gateOutputs[k - 1][j - 1] = allocate(allocated, Variable.Family.GATE_OUTPUT, k, j);
            }
        }

        linkedOutputs = new Variable[gates][][];
        for (int k = 1; k <= gates; k++) {
            linkedOutputs[k - 1] = new Variable[k - 1][rows];
            for (int i = 1; i < k; i++) {
                for (int j = 1; j <= rows; j++) {
                    linkedOutputs[k - 1][i - 1][j - 1] = allocate(allocated, Variable.Family.LINKED_OUTPUT, i, k, j);
                }
            }
        }

        variables = Collections.unmodifiableList(allocated);
        Map<String, Variable> names = new HashMap<>(allocated.size() * 2);
        for (Variable variable : allocated) {
            names.put(variable.name(), variable);
        }
        byName = Collections.unmodifiableMap(names);

        logger.log(Level.FINE, "Allocated {0} variables for {1} inputs and {2} gates", new Object[] {
            allocated.size(), inputs, gates
        });
    }

    private static Variable allocate(List<Variable> allocated, Variable.Family family, int... indices) {
        Variable variable = new Variable(family, allocated.size(), indices);
        allocated.add(variable);
        return variable;
    }

    public int inputs() {
        return inputs;
    }

    public int gates() {
        return gates;
    }

    public int rows() {
        return rows;
    }

    /**
     * Returns {@code u.e.k}, i.e. whether external input {@code e} feeds gate {@code k}.
     */
    public Variable inputLink(int e, int k) {
        checkArgument(1 <= e && e <= inputs && 1 <= k && k <= gates, "No variable u.%d.%d", e, k);
        return inputLinks[e - 1][k - 1];
    }

    /**
     * Returns {@code v.i.k}, i.e. whether the output of gate {@code i} feeds gate {@code k}. Only
     * defined for {@code i < k}.
     */
    public Variable gateLink(int i, int k) {
        checkArgument(1 <= i && i < k && k <= gates, "No variable v.%d.%d", i, k);
        return gateLinks[k - 1][i - 1];
    }

    /**
     * Returns {@code p.k.j}, the output of gate {@code k} on row {@code j}. Only defined for all but
     * the last gate.
     */
    public Variable gateOutput(int k, int j) {
        checkArgument(1 <= k && k < gates && 1 <= j && j <= rows, "No variable p.%d.%d", k, j);
        return gateOutputs[k - 1][j - 1];
    }

    /**
     * Returns {@code r.i.k.j}, the value gate {@code i} contributes to gate {@code k} on row
     * {@code j}. Only defined for {@code i < k}.
     */
    public Variable linkedOutput(int i, int k, int j) {
        checkArgument(1 <= i && i < k && k <= gates && 1 <= j && j <= rows, "No variable r.%d.%d.%d", i, k, j);
        return linkedOutputs[k - 1][i - 1][j - 1];
    }

    /**
     * Returns all variables in allocation order.
     */
    public List<Variable> variables() {
        return variables;
    }

    public int size() {
        return variables.size();
    }

    public Optional<Variable> byName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public String toString() {
        return String.format("VariableSpace{inputs=%d, gates=%d, variables=%d}", inputs, gates, variables.size());
    }
}
