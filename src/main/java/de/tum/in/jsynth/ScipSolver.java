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
import java.lang.ProcessBuilder.Redirect;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import javax.annotation.Nullable;

/**
 * Solves models by running the SCIP command line solver on an LP file and decoding its log with
 * {@link SolutionDecoder}. Each call uses its own pair of temporary files, hence a single instance
 * may be used concurrently.
 */
public final class ScipSolver implements CircuitSolver {
    private static final Logger logger = Logger.getLogger(ScipSolver.class.getName());

    private final SolverConfiguration configuration;

    public ScipSolver() {
        this(ImmutableSolverConfiguration.builder().build());
    }

    public ScipSolver(SolverConfiguration configuration) {
        this.configuration = configuration;
    }

    public SolverConfiguration configuration() {
        return configuration;
    }

    @Override
    public Solution solve(CircuitModel model) throws SolverException {
        Path modelFile = null;
        Path logFile = null;
        try {
            modelFile = Files.createTempFile(configuration.workingDirectory(), configuration.filePrefix() + '-', ".lp");
            String fileName = modelFile.getFileName().toString();
            logFile = modelFile.resolveSibling(fileName.substring(0, fileName.length() - 3) + ".log");
            Files.deleteIfExists(logFile);

            LpWriter.write(model, modelFile);
            run(command(modelFile, logFile));

            if (!Files.isRegularFile(logFile)) {
                throw new SolverException("Solver did not write a log to " + logFile);
            }
            Solution solution = restrict(SolutionDecoder.readSolution(logFile), model);
            logger.log(Level.FINE, "Solved {0}: {1}", new Object[] {model, solution});
            return solution;
        } catch (IOException e) {
            throw new SolverException("Failed to exchange files with the solver", e);
        } finally {
            if (configuration.deleteModel()) {
                delete(modelFile);
            }
            if (configuration.deleteLog()) {
                delete(logFile);
            }
        }
    }

    /**
     * Drops the values of names which are not variables of the model.
     */
    static Solution restrict(Solution solution, CircuitModel model) {
        if (!solution.isFeasible()) {
            return solution;
        }
        Map<String, Integer> values = new LinkedHashMap<>();
        solution.values().forEach((name, value) -> {
            if (model.variables().byName(name).isPresent()) {
                values.put(name, value);
            } else {
                logger.log(Level.FINE, "Skipping variable {0} which is not part of {1}", new Object[] {name, model});
            }
        });
        return values.size() == solution.values().size() ? solution : Solution.of(solution.status(), values);
    }

    List<String> command(Path modelFile, Path logFile) {
        List<String> command = new ArrayList<>();
        command.add(configuration.executable());
        if (!configuration.verbose()) {
            command.add("-q");
        }
        command.add("-f");
        command.add(modelFile.toString());
        command.add("-l");
        command.add(logFile.toString());
        return command;
    }

    private void run(List<String> command) throws SolverException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (configuration.verbose()) {
            builder.inheritIO();
        } else {
            builder.redirectOutput(Redirect.DISCARD).redirectError(Redirect.DISCARD);
        }

        logger.log(Level.FINE, "Running {0}", command);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SolverException("Could not start solver " + configuration.executable(), e);
        }

        int exitValue;
        try {
            long timeout = configuration.timeoutSeconds();
            if (timeout > 0 && !process.waitFor(timeout, TimeUnit.SECONDS)) {
                kill(process);
                throw new SolverException(String.format("Solver did not finish within %d seconds", timeout));
            }
            exitValue = process.waitFor();
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new SolverException("Interrupted while waiting for the solver", e);
        }

        if (exitValue != 0) {
            logger.log(Level.WARNING, "Solver {0} exited with code {1}", new Object[] {command.get(0), exitValue});
            throw new SolverException(String.format("Solver exited with code %d", exitValue));
        }
    }

    // Descendants have to be collected before the parent dies, afterwards they are re-parented
    private static void kill(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
    }

    private static void delete(@Nullable Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not delete " + file, e);
        }
    }

    @Override
    public String toString() {
        return "SCIP{" + configuration.executable() + '}';
    }
}
