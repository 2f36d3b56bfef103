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

import de.tum.in.jsynth.LinearConstraint.Relation;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Encodes the synthesis of a circuit as a 0/1 integer linear program, following the gate
 * interconnection formulation of Muroga ("Computer-Aided Logic Synthesis for VLSI Chips", 1991).
 *
 * <p>With {@code t[j][e]} the value of input {@code e} on row {@code j}, {@code g(k)} the
 * {@link GateType#marker() marker} of gate {@code k}, {@code A = n + R} and
 * {@code S(k, j) = sum_e t[j][e] u.e.k + sum_{i < k} r.i.k.j} the number of true inputs of gate
 * {@code k} on row {@code j}, the model consists of</p>
 *
 * <ul>
 *   <li>{@code -S(k, j) >= g(k) - A (1 - p.k.j)} and {@code S(k, j) >= 1 - g(k) - A p.k.j} for all
 *       gates but the last, forcing {@code p.k.j} to be the output of gate {@code k},</li>
 *   <li>{@code -S(R, j) >= g(R)} if the function is true on row {@code j} and
 *       {@code S(R, j) >= 1 - g(R)} otherwise,</li>
 *   <li>{@code p.i.j + v.i.k - r.i.k.j <= 1} and {@code p.i.j + v.i.k - 2 r.i.k.j >= 0}, i.e.
 *       {@code r.i.k.j = p.i.j AND v.i.k},</li>
 *   <li>{@code sum_e u.e.k + sum_i v.i.k <= 1 - g(k)}, bounding the fan-in of each gate,</li>
 * </ul>
 *
 * <p>and the objective is to minimize the number of connections {@code sum u + sum v}. Constraints
 * are generated in the above order, so the same input always yields the same model.</p>
 */
public final class CircuitModelBuilder {
    private static final Logger logger = Logger.getLogger(CircuitModelBuilder.class.getName());

    private final TruthTable truthTable;
    private final List<GateType> gates;
    private final AssignmentMatrix table;
    private final VariableSpace variables;
    private final int gateCount;
    private final int rows;
    private final int bigM;
    private final List<LinearConstraint> constraints = new ArrayList<>();

    private CircuitModelBuilder(TruthTable truthTable, List<GateType> gates) {
        this.truthTable = truthTable;
        this.gates = List.copyOf(gates);
        this.table = truthTable.assignments();
        this.gateCount = gates.size();
        this.rows = table.rowCount();
        this.variables = new VariableSpace(table.inputs(), gateCount);
        this.bigM = table.inputs() + gateCount;
    }

    /**
     * Builds the model for the function described by {@code truth} (e.g. {@code "01010011"}) and
     * the gate sequence {@code gates} (e.g. {@code "NOT NAND NAND NAND"}).
     *
     * @throws IllegalArgumentException if the truth table or the gate sequence is malformed.
     */
    public static CircuitModel build(String truth, String gates) {
        TruthTable truthTable = TruthTable.parse(truth);
        List<GateType> sequence = GateType.parseSequence(gates);
        return build(truthTable, sequence);
    }

    public static CircuitModel build(TruthTable truthTable, List<GateType> gates) {
        checkArgument(!gates.isEmpty(), "Circuit needs at least one gate");
        return new CircuitModelBuilder(truthTable, gates).build();
    }

    private CircuitModel build() {
        for (int k = 1; k < gateCount; k++) {
            for (int j = 1; j <= rows; j++) {
                addGateConstraints(k, j);
            }
        }
        for (int j = 1; j <= rows; j++) {
            addOutputConstraint(j);
        }
        for (int k = 2; k <= gateCount; k++) {
            for (int j = 1; j <= rows; j++) {
                for (int i = 1; i < k; i++) {
                    addLinearization(i, k, j);
                }
            }
        }
        for (int k = 1; k <= gateCount; k++) {
            addFanIn(k);
        }

        String name = String.format("circuit for logic function %s with gates %s", truthTable, gates.stream()
                .map(GateType::name)
                .collect(Collectors.joining(" ")));
        CircuitModel model = new CircuitModel(name, truthTable, gates, variables, objective(), constraints, bigM);
        logger.log(Level.FINE, "Built {0}", model);
        return model;
    }

    private int marker(int k) {
        return gates.get(k - 1).marker();
    }

    /* Adds S(k, j) with the given sign to the builder */
    private LinearExpression.Builder activeInputs(LinearExpression.Builder builder, int k, int j, int sign) {
        for (int e = 1; e <= table.inputs(); e++) {
            builder.add(sign * table.bit(j - 1, e), variables.inputLink(e, k));
        }
        for (int i = 1; i < k; i++) {
            builder.add(sign, variables.linkedOutput(i, k, j));
        }
        return builder;
    }

    private void addGateConstraints(int k, int j) {
        Variable output = variables.gateOutput(k, j);
        int marker = marker(k);

        // Output true: at most -g inputs are true, relaxed by A if the output is false
        LinearExpression high =
                activeInputs(LinearExpression.builder(), k, j, -1).add(-bigM, output).build();
        add(String.format("gate_high.%d.%d", k, j), high, Relation.GREATER_EQUAL, marker - bigM);

        // Output false: at least 1 - g inputs are true, relaxed by A if the output is true
        LinearExpression low =
                activeInputs(LinearExpression.builder(), k, j, 1).add(bigM, output).build();
        add(String.format("gate_low.%d.%d", k, j), low, Relation.GREATER_EQUAL, 1 - marker);
    }

    private void addOutputConstraint(int j) {
        int marker = marker(gateCount);
        String name = String.format("output.%d", j);
        if (truthTable.output(j - 1)) {
            LinearExpression expression = activeInputs(LinearExpression.builder(), gateCount, j, -1).build();
            add(name, expression, Relation.GREATER_EQUAL, marker);
        } else {
            LinearExpression expression = activeInputs(LinearExpression.builder(), gateCount, j, 1).build();
            add(name, expression, Relation.GREATER_EQUAL, 1 - marker);
        }
    }

    private void addLinearization(int i, int k, int j) {
        Variable output = variables.gateOutput(i, j);
        Variable link = variables.gateLink(i, k);
        Variable product = variables.linkedOutput(i, k, j);

        LinearExpression upper = LinearExpression.builder()
                .add(output)
                .add(link)
                .subtract(product)
                .build();
        add(String.format("and_upper.%d.%d.%d", i, k, j), upper, Relation.LESS_EQUAL, 1);

        LinearExpression lower = LinearExpression.builder()
                .add(output)
                .add(link)
                .add(-2, product)
                .build();
        add(String.format("and_lower.%d.%d.%d", i, k, j), lower, Relation.GREATER_EQUAL, 0);
    }

    private void addFanIn(int k) {
        LinearExpression.Builder builder = LinearExpression.builder();
        for (int e = 1; e <= table.inputs(); e++) {
            builder.add(variables.inputLink(e, k));
        }
        for (int i = 1; i < k; i++) {
            builder.add(variables.gateLink(i, k));
        }
        add(String.format("fan_in.%d", k), builder.build(), Relation.LESS_EQUAL, gates.get(k - 1).maximalFanIn());
    }

    private LinearExpression objective() {
        LinearExpression.Builder builder = LinearExpression.builder();
        for (Variable variable : variables.variables()) {
            if (variable.family().isConnection()) {
                builder.add(variable);
            }
        }
        return builder.build();
    }

    private void add(String name, LinearExpression expression, Relation relation, int bound) {
        constraints.add(new LinearConstraint(name, expression, relation, bound));
    }
}
