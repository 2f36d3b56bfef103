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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds circuits with the fewest connections for a given truth table and gate sequence.
 *
 * <p>The order of the gates matters: a gate can only be fed by earlier gates and the last gate is
 * the output of the circuit. For example, the multiplexer {@code "01010011"} can be built from
 * {@code "NOT NAND NAND NAND"} with seven connections.</p>
 */
public final class CircuitSynthesizer {
    private static final Logger logger = Logger.getLogger(CircuitSynthesizer.class.getName());

    private final CircuitSolver solver;

    public CircuitSynthesizer(CircuitSolver solver) {
        this.solver = solver;
    }

    /**
     * Returns a synthesizer using the in-process solver.
     */
    public static CircuitSynthesizer create() {
        return new CircuitSynthesizer(new OjAlgoSolver());
    }

    /**
     * Synthesizes a circuit, returning an empty optional if no circuit with the given gates
     * computes the function.
     *
     * @throws IllegalArgumentException if the truth table or the gate sequence is malformed.
     * @throws SolverException if the solver failed or its solution is not a circuit computing the
     *     function.
     */
    public Optional<Circuit> synthesize(String truth, String gates) throws SolverException {
        return synthesize(TruthTable.parse(truth), GateType.parseSequence(gates));
    }

    public Optional<Circuit> synthesize(TruthTable truthTable, List<GateType> gates) throws SolverException {
        CircuitModel model = CircuitModelBuilder.build(truthTable, gates);
        Solution solution = solver.solve(model);
        if (!solution.isFeasible()) {
            logger.log(Level.INFO, "No circuit with gates {0} computes {1}", new Object[] {gates, truthTable});
            return Optional.empty();
        }
        Circuit circuit;
        try {
            circuit = Circuit.of(model, solution);
        } catch (IllegalArgumentException e) {
            throw new SolverException("Solver returned an invalid wiring " + solution, e);
        }
        TruthTable computed = circuit.truthTable();
        if (!computed.equals(truthTable)) {
            logger.log(Level.WARNING, "{0} computes {1} instead of {2}", new Object[] {circuit, computed, truthTable});
            throw new SolverException(String.format("Solution computes %s instead of %s", computed, truthTable));
        }
        logger.log(Level.FINE, "Found {0} with {1} connections", new Object[] {circuit, circuit.connectionCount()});
        return Optional.of(circuit);
    }

    /**
     * Only writes the model for the given function and gates to {@code path}, in LP format.
     */
    public static CircuitModel writeModel(String truth, String gates, Path path) throws IOException {
        CircuitModel model = CircuitModelBuilder.build(truth, gates);
        LpWriter.write(model, path);
        return model;
    }

    public CircuitSolver solver() {
        return solver;
    }
}
