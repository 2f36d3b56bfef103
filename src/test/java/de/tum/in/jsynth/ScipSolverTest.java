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
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
public class ScipSolverTest {
    @TempDir
    Path directory;

    private Path workingDirectory() throws IOException {
        return Files.createDirectories(directory.resolve("work"));
    }

    /* Writes a script which mimics the command line of SCIP: it copies the model it is given and
     * writes the log resource to the requested log file */
    private Path fakeSolver(String logResource, int exitCode) throws IOException {
        Path log = directory.resolve(logResource);
        try (InputStream stream =
                Objects.requireNonNull(ScipSolverTest.class.getResourceAsStream(logResource), logResource)) {
            Files.copy(stream, log, StandardCopyOption.REPLACE_EXISTING);
        }
        String script = "#!/bin/sh\n"
                + "while [ $# -gt 0 ]; do\n"
                + "  case \"$1\" in\n"
                + "    -f) model=\"$2\"; shift ;;\n"
                + "    -l) log=\"$2\"; shift ;;\n"
                + "  esac\n"
                + "  shift\n"
                + "done\n"
                + "cp \"$model\" \"" + directory.resolve("seen.lp") + "\"\n"
                + "cp \"" + log + "\" \"$log\"\n"
                + "exit " + exitCode + "\n";
        return executable("scip", script);
    }

    private Path executable(String name, String script) throws IOException {
        Path file = directory.resolve(name);
        Files.writeString(file, script, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
    }

    private ScipSolver solver(Path executable) throws IOException {
        return new ScipSolver(ImmutableSolverConfiguration.builder()
                .executable(executable.toString())
                .workingDirectory(workingDirectory())
                .timeoutSeconds(60)
                .build());
    }

    private List<Path> workingFiles() throws IOException {
        try (Stream<Path> files = Files.list(workingDirectory())) {
            return files.collect(Collectors.toList());
        }
    }

    @Test
    public void testSolve() throws IOException, SolverException {
        CircuitModel model = CircuitModelBuilder.build(CircuitFixtures.MULTIPLEXER, CircuitFixtures.NOT_GATES);
        Solution solution = solver(fakeSolver("scip-optimal.log", 0)).solve(model);

        assertThat(solution.status(), is(Solution.Status.OPTIMAL));
        assertThat(solution.connections(), hasSize(7));
        assertThat(Circuit.of(model, solution).truthTable(), is(model.truthTable()));
        // The solver received the model in LP format
        assertThat(Files.readString(directory.resolve("seen.lp"), StandardCharsets.UTF_8), is(LpWriter.toString(model)));
        // Temporary files are removed
        assertThat(workingFiles(), is(empty()));
    }

    @Test
    public void testUnknownVariablesSkipped() throws IOException, SolverException {
        CircuitModel model = CircuitModelBuilder.build(CircuitFixtures.MULTIPLEXER, CircuitFixtures.NOT_GATES);
        Solution solution = solver(fakeSolver("scip-unknown-variables.log", 0)).solve(model);

        assertThat(solution.value("u.4.1").isPresent(), is(false));
        assertThat(solution.value("v.5.9").isPresent(), is(false));
        assertThat(solution.connections(), hasSize(7));
        assertThat(Circuit.of(model, solution).truthTable(), is(model.truthTable()));

        CircuitSynthesizer synthesizer = new CircuitSynthesizer(solver(fakeSolver("scip-unknown-variables.log", 0)));
        Circuit circuit = synthesizer.synthesize(CircuitFixtures.MULTIPLEXER, CircuitFixtures.NOT_GATES).orElseThrow();
        assertThat(circuit.connectionCount(), is(7));
    }

    @Test
    public void testInfeasible() throws IOException, SolverException {
        CircuitModel model = CircuitModelBuilder.build("00", "NAND");
        Solution solution = solver(fakeSolver("scip-infeasible.log", 0)).solve(model);
        assertThat(solution.isFeasible(), is(false));
        assertThat(solution.connections(), is(empty()));
    }

    @Test
    public void testSynthesize() throws IOException, SolverException {
        CircuitSynthesizer synthesizer = new CircuitSynthesizer(solver(fakeSolver("scip-optimal.log", 0)));
        Circuit circuit = synthesizer.synthesize(CircuitFixtures.MULTIPLEXER, CircuitFixtures.NOT_GATES).orElseThrow();
        assertThat(circuit.connectionCount(), is(7));
    }

    @Test
    public void testKeepFiles() throws IOException, SolverException {
        ScipSolver solver = new ScipSolver(ImmutableSolverConfiguration.builder()
                .executable(fakeSolver("scip-infeasible.log", 0).toString())
                .workingDirectory(workingDirectory())
                .filePrefix("test")
                .deleteModel(false)
                .deleteLog(false)
                .build());
        solver.solve(CircuitModelBuilder.build("00", "NAND"));

        List<String> names = workingFiles().stream()
                .map(file -> file.getFileName().toString())
                .sorted()
                .collect(Collectors.toList());
        assertThat(names, hasSize(2));
        assertThat(names.get(0), endsWith(".log"));
        assertThat(names.get(1), endsWith(".lp"));
        assertThat(names.get(0).startsWith("test-"), is(true));
    }

    @Test
    public void testCommand() throws IOException {
        ScipSolver quiet = solver(Path.of("scip"));
        assertThat(
                quiet.command(Path.of("a.lp"), Path.of("a.log")),
                contains("scip", "-q", "-f", "a.lp", "-l", "a.log"));

        ScipSolver verbose = new ScipSolver(ImmutableSolverConfiguration.builder()
                .executable("scip")
                .verbose(true)
                .build());
        assertThat(verbose.command(Path.of("a.lp"), Path.of("a.log")), contains("scip", "-f", "a.lp", "-l", "a.log"));
    }

    @Test
    public void testNonZeroExit() throws IOException {
        ScipSolver solver = solver(fakeSolver("scip-optimal.log", 2));
        CircuitModel model = CircuitModelBuilder.build(CircuitFixtures.MULTIPLEXER, CircuitFixtures.NOT_GATES);
        assertThrows(SolverException.class, () -> solver.solve(model));
        assertThat(workingFiles(), is(empty()));
    }

    @Test
    public void testMissingExecutable() throws IOException {
        ScipSolver solver = solver(directory.resolve("does-not-exist"));
        assertThrows(SolverException.class, () -> solver.solve(CircuitModelBuilder.build("10", "NOT")));
        assertThat(workingFiles(), is(empty()));
    }

    @Test
    public void testMissingLog() throws IOException {
        ScipSolver solver = solver(executable("silent", "#!/bin/sh\nexit 0\n"));
        assertThrows(SolverException.class, () -> solver.solve(CircuitModelBuilder.build("10", "NOT")));
    }

    @Test
    public void testTimeout() throws IOException, InterruptedException {
        Path pidFile = directory.resolve("child.pid");
        String script = "#!/bin/sh\nsleep 30 &\necho $! > \"" + pidFile + "\"\nwait\n";
        ScipSolver solver = new ScipSolver(ImmutableSolverConfiguration.builder()
                .executable(executable("slow", script).toString())
                .workingDirectory(workingDirectory())
                .timeoutSeconds(1)
                .build());
        assertThrows(SolverException.class, () -> solver.solve(CircuitModelBuilder.build("10", "NOT")));
        assertThat(workingFiles(), is(empty()));

        // Children of the solver process are killed as well
        long pid = Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).strip());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (running(pid) && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertThat(running(pid), is(false));
    }

    /* Killed children may linger as zombies until reaped, these have no command any more */
    private static boolean running(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        return handle.isPresent() && handle.get().isAlive() && handle.get().info().command().isPresent();
    }
}
