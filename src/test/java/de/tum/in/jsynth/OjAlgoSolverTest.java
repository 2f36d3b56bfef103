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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.ojalgo.optimisation.Optimisation;

public class OjAlgoSolverTest {
    private final OjAlgoSolver solver = new OjAlgoSolver();

    @Test
    public void testAllVariablesValued() throws SolverException {
        CircuitModel model = CircuitModelBuilder.build(CircuitFixtures.MULTIPLEXER, CircuitFixtures.NOT_GATES);
        Solution solution = solver.solve(model);

        assertThat(solution.status(), is(Solution.Status.OPTIMAL));
        assertThat(solution.values().size(), is(model.variables().size()));
        for (Variable variable : model.variables().variables()) {
            int value = solution.value(variable.name()).orElseThrow();
            assertThat(variable.name(), value == 0 || value == 1, is(true));
        }
        List<String> violated = model.constraints().stream()
                .filter(constraint -> !constraint.isSatisfiedBy(v -> solution.value(v.name()).orElseThrow()))
                .map(LinearConstraint::name)
                .collect(Collectors.toList());
        assertThat(violated, is(empty()));
        assertThat((int) model.objective().evaluate(v -> solution.value(v.name()).orElseThrow()), is(7));
    }

    @Test
    public void testGateOutputsMatchCircuit() throws SolverException {
        CircuitModel model = CircuitModelBuilder.build("0001", "NAND NOT");
        Solution solution = solver.solve(model);
        Circuit circuit = Circuit.of(model, solution);

        AssignmentMatrix matrix = AssignmentMatrix.of(2);
        for (int row = 0; row < matrix.rowCount(); row++) {
            boolean[] outputs = circuit.evaluateGates(matrix.row(row));
            // Only the gates before the last one carry output variables
            Variable output = model.variables().gateOutput(1, row + 1);
            assertThat(solution.value(output.name()).orElseThrow() == 1, is(outputs[0]));
        }
    }

    @Test
    public void testInfeasible() throws SolverException {
        Solution solution = solver.solve(CircuitModelBuilder.build("0110", "NOT NAND"));
        assertThat(solution.status(), is(Solution.Status.INFEASIBLE));
        assertThat(solution.values().isEmpty(), is(true));
    }

    @Test
    public void testConstantRow() throws SolverException {
        // The output row of the all-zero assignment has no variables for a single gate
        Solution solution = solver.solve(CircuitModelBuilder.build("11", "NAND"));
        assertThat(solution.isFeasible(), is(true));
        assertThat(solution.connections(), is(empty()));
    }

    @Test
    public void testStatus() throws SolverException {
        assertThat(OjAlgoSolver.status(Optimisation.State.OPTIMAL), is(Solution.Status.OPTIMAL));
        assertThat(OjAlgoSolver.status(Optimisation.State.FEASIBLE), is(Solution.Status.FEASIBLE));
        assertThat(OjAlgoSolver.status(Optimisation.State.INFEASIBLE), is(Solution.Status.INFEASIBLE));
    }

    @Test
    public void testUnfinishedSearch() {
        assertThrows(SolverException.class, () -> OjAlgoSolver.status(Optimisation.State.FAILED));
        assertThrows(SolverException.class, () -> OjAlgoSolver.status(Optimisation.State.UNEXPLORED));
    }
}
