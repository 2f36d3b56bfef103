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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a {@link Solution} from the textual log of a solver, as written by SCIP.
 *
 * <p>When displaying a solution, SCIP lists each non-zero variable on a separate line together with
 * its objective coefficient, e.g. {@code u.1.2    1 	(obj:1)}. Since exactly the connection
 * variables have coefficient one, the lines tagged with {@code (obj:1)} describe the circuit. All
 * other lines, including malformed ones, are ignored.</p>
 */
public final class SolutionDecoder {
    private static final Logger logger = Logger.getLogger(SolutionDecoder.class.getName());

    private static final Pattern OBJECTIVE_ENTRY = Pattern.compile("(\\S+)\\s+(\\S+)\\s+\\(obj:1\\)");
    private static final String OBJECTIVE_VALUE = "objective value:";
    private static final String NO_SOLUTION = "no solution available";
    private static final String OPTIMAL = "optimal solution found";

    private SolutionDecoder() {}

    /**
     * Reads the connections from a solver log. An infeasible model yields an empty list.
     */
    public static List<Connection> decode(BufferedReader reader) throws IOException {
        return readSolution(reader).connections();
    }

    public static Solution readSolution(Path log) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(log, StandardCharsets.UTF_8)) {
            return readSolution(reader);
        }
    }

    public static Solution readSolution(BufferedReader reader) throws IOException {
        Map<String, Integer> values = new LinkedHashMap<>();
        boolean solutionReported = false;
        boolean noSolution = false;
        boolean optimal = false;

        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber += 1;
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            if (stripped.startsWith(OBJECTIVE_VALUE)) {
                solutionReported = true;
            } else if (stripped.startsWith(NO_SOLUTION)) {
                noSolution = true;
            } else if (stripped.contains(OPTIMAL)) {
                optimal = true;
            }

            Matcher matcher = OBJECTIVE_ENTRY.matcher(stripped);
            if (!matcher.matches()) {
                continue;
            }
            String name = matcher.group(1);
            int value;
            try {
                value = (int) Math.round(Double.parseDouble(matcher.group(2)));
            } catch (NumberFormatException e) {
                logger.log(Level.FINE, "Skipping malformed line {0}: {1}", new Object[] {lineNumber, line});
                continue;
            }
            if (Connection.fromVariableName(name).isEmpty()) {
                logger.log(Level.FINE, "Skipping unknown variable {0} in line {1}", new Object[] {name, lineNumber});
                continue;
            }
            values.put(name, value);
        }

        if (noSolution || (!solutionReported && values.isEmpty())) {
            logger.log(Level.FINE, "Log reports no solution");
            return Solution.infeasible();
        }
        return Solution.of(optimal ? Solution.Status.OPTIMAL : Solution.Status.FEASIBLE, values);
    }
}
