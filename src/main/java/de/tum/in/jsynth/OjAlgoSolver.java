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

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;

/**
 * Solves models in-process with the mixed integer solver of ojAlgo. In contrast to
 * {@link ScipSolver}, the values of all variables are obtained directly from the solver.
 */
public final class OjAlgoSolver implements CircuitSolver {
    private static final Logger logger = Logger.getLogger(OjAlgoSolver.class.getName());

    private final SolverConfiguration configuration;

    public OjAlgoSolver() {
        this(ImmutableSolverConfiguration.builder().build());
    }

    public OjAlgoSolver(SolverConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public Solution solve(CircuitModel model) throws SolverException {
        List<Variable> variables = model.variables().variables();

        ExpressionsBasedModel solverModel = new ExpressionsBasedModel();
        if (configuration.timeoutSeconds() > 0) {
            solverModel.options.time_abort = configuration.timeoutSeconds() * 1000L;
        }

        org.ojalgo.optimisation.Variable[] solverVariables = new org.ojalgo.optimisation.Variable[variables.size()];
        for (Variable variable : variables) {
            org.ojalgo.optimisation.Variable solverVariable =
                    solverModel.newVariable(variable.name()).binary();
            int weight = model.objective().coefficient(variable);
            if (weight != 0) {
                solverVariable.weight(BigDecimal.valueOf(weight));
            }
            solverVariables[variable.index()] = solverVariable;
        }

        for (LinearConstraint constraint : model.constraints()) {
            if (constraint.expression().isEmpty()) {
                // Constant rows are decided right away
                if (!constraint.isSatisfiedBy(variable -> 0)) {
                    logger.log(Level.FINE, "Constraint {0} is unsatisfiable", constraint);
                    return Solution.infeasible();
                }
                continue;
            }
            Expression expression = solverModel.newExpression(constraint.name());
            for (LinearExpression.Term term : constraint.expression().terms()) {
                expression.set(solverVariables[term.variable().index()], BigDecimal.valueOf(term.coefficient()));
            }
            BigDecimal bound = BigDecimal.valueOf(constraint.bound());
            if (constraint.relation() == LinearConstraint.Relation.LESS_EQUAL) {
                expression.upper(bound);
            } else {
                expression.lower(bound);
            }
        }

        logger.log(Level.FINE, "Solving {0}", model);
        Optimisation.Result result = solverModel.minimise();
        Optimisation.State state = result.getState();
        logger.log(Level.FINE, "ojAlgo finished with state {0} and value {1}", new Object[] {state, result.getValue()});

        Solution.Status status = status(state);
        if (!status.isFeasible()) {
            return Solution.infeasible();
        }

        Map<String, Integer> values = new LinkedHashMap<>();
        for (Variable variable : variables) {
            values.put(variable.name(), (int) Math.round(result.get(variable.index()).doubleValue()));
        }
        assert model.constraints().stream().allMatch(constraint -> constraint.isSatisfiedBy(v -> values.get(v.name())))
                : "Solution violates constraints";
        return Solution.of(status, values);
    }

    /**
     * Maps the final state of ojAlgo to a status, failing if the search ended without a verdict,
     * e.g. when it was aborted before finding a feasible point.
     */
    static Solution.Status status(Optimisation.State state) throws SolverException {
        if (state == Optimisation.State.INFEASIBLE) {
            return Solution.Status.INFEASIBLE;
        }
        if (!state.isFeasible()) {
            throw new SolverException("ojAlgo failed with state " + state);
        }
        return state.isOptimal() ? Solution.Status.OPTIMAL : Solution.Status.FEASIBLE;
    }

    @Override
    public String toString() {
        return "ojAlgo";
    }
}
