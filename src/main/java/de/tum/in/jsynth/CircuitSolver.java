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

/**
 * Solves {@link CircuitModel circuit models}, i.e. finds an assignment of the model's variables
 * which satisfies all constraints and minimizes the objective.
 */
public interface CircuitSolver {
    /**
     * Solves the given model. An infeasible model is not an error, it yields a solution with
     * status {@link Solution.Status#INFEASIBLE}.
     *
     * @throws SolverException if the solver could not be run or failed to decide the model.
     */
    Solution solve(CircuitModel model) throws SolverException;
}
