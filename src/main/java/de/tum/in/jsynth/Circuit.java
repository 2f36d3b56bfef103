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
import java.util.List;
import java.util.stream.Collectors;

/**
 * A feed-forward circuit: a sequence of gates together with the connections between external
 * inputs and gates. The output of the circuit is the output of its last gate.
 *
 * <p>Gates are evaluated with the threshold semantics of {@link GateType#output(int)}. In
 * particular, a gate without inputs outputs {@code true}, as does a {@code NAND} with a single
 * input.</p>
 */
public final class Circuit {
    private final List<GateType> gates;
    private final int inputs;
    private final List<Connection> connections;
    private final int[][] inputSources;
    private final int[][] gateSources;

    private Circuit(List<GateType> gates, int inputs, List<Connection> connections) {
        this.gates = gates;
        this.inputs = inputs;
        this.connections = connections;

        List<List<Integer>> inputLists = new ArrayList<>(gates.size());
        List<List<Integer>> gateLists = new ArrayList<>(gates.size());
        for (int k = 0; k < gates.size(); k++) {
            inputLists.add(new ArrayList<>());
            gateLists.add(new ArrayList<>());
        }
        for (Connection connection : connections) {
            List<List<Integer>> lists = connection.kind() == Connection.Kind.INPUT ? inputLists : gateLists;
            lists.get(connection.target() - 1).add(connection.source());
        }
        inputSources = inputLists.stream()
                .map(list -> list.stream().mapToInt(Integer::intValue).toArray())
                .toArray(int[][]::new);
        gateSources = gateLists.stream()
                .map(list -> list.stream().mapToInt(Integer::intValue).toArray())
                .toArray(int[][]::new);
    }

    /**
     * Creates a circuit over {@code inputs} external inputs.
     *
     * @throws IllegalArgumentException if a connection refers to a non-existing input or gate, is
     *     given twice, or exceeds the fan-in of a gate.
     */
    public static Circuit of(List<GateType> gates, int inputs, List<Connection> connections) {
        checkArgument(!gates.isEmpty(), "Circuit needs at least one gate");
        checkArgument(inputs > 0, "Invalid number of inputs %d", inputs);
        int[] fanIn = new int[gates.size()];
        for (Connection connection : connections) {
            checkArgument(connection.target() <= gates.size(), "No gate %d for %s", connection.target(), connection);
            checkArgument(
                    connection.kind() != Connection.Kind.INPUT || connection.source() <= inputs,
                    "No input %d for %s",
                    connection.source(),
                    connection);
            fanIn[connection.target() - 1] += 1;
        }
        checkArgument(connections.stream().distinct().count() == connections.size(), "Duplicate connections");
        for (int k = 1; k <= gates.size(); k++) {
            GateType type = gates.get(k - 1);
            checkArgument(
                    fanIn[k - 1] <= type.maximalFanIn(),
                    "Gate %d (%s) has %d inputs",
                    k,
                    type,
                    fanIn[k - 1]);
        }
        return new Circuit(List.copyOf(gates), inputs, List.copyOf(connections));
    }

    /**
     * Creates the circuit described by a solution of the given model.
     */
    public static Circuit of(CircuitModel model, Solution solution) {
        checkArgument(solution.isFeasible(), "Solution is infeasible");
        return of(model.gates(), model.truthTable().inputs(), solution.connections());
    }

    public List<GateType> gates() {
        return gates;
    }

    public int inputs() {
        return inputs;
    }

    public List<Connection> connections() {
        return connections;
    }

    public int connectionCount() {
        return connections.size();
    }

    public int fanIn(int gate) {
        return inputSources[gate - 1].length + gateSources[gate - 1].length;
    }

    /**
     * Evaluates all gates on the given input values and returns the output of the last gate.
     */
    public boolean evaluate(boolean[] assignment) {
        return evaluateGates(assignment)[gates.size() - 1];
    }

    /**
     * Evaluates all gates on the given input values. The output of gate {@code k} is stored at
     * index {@code k - 1}.
     */
    public boolean[] evaluateGates(boolean[] assignment) {
        checkArgument(assignment.length == inputs, "Expected %d inputs, got %d", inputs, assignment.length);
        boolean[] outputs = new boolean[gates.size()];
        for (int k = 0; k < gates.size(); k++) {
            int active = 0;
            for (int input : inputSources[k]) {
                if (assignment[input - 1]) {
                    active += 1;
                }
            }
            for (int gate : gateSources[k]) {
                if (outputs[gate - 1]) {
                    active += 1;
                }
            }
            outputs[k] = gates.get(k).output(active);
        }
        return outputs;
    }

    /**
     * Computes the function of this circuit over all rows of the {@link AssignmentMatrix}.
     */
    public TruthTable truthTable() {
        AssignmentMatrix matrix = AssignmentMatrix.of(inputs);
        boolean[] values = new boolean[matrix.rowCount()];
        for (int row = 0; row < matrix.rowCount(); row++) {
            values[row] = evaluate(matrix.row(row));
        }
        return TruthTable.of(values);
    }

    /**
     * Lists the connections, one per line.
     */
    public String describe() {
        return connections.stream().map(Connection::describe).collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return String.format("Circuit{gates=%s, connections=%s}", gates, connections);
    }
}
