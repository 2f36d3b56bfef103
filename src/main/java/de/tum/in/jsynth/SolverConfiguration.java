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

import java.nio.file.Path;
import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class SolverConfiguration {
    public static final String DEFAULT_EXECUTABLE = "./scip";
    public static final String DEFAULT_FILE_PREFIX = "circuit";

    /**
     * The solver binary, either a path or a name to be resolved through {@code PATH}.
     */
    @Value.Default
    public String executable() {
        return DEFAULT_EXECUTABLE;
    }

    /**
     * Whether the solver output is passed through instead of being discarded.
     */
    @Value.Default
    public boolean verbose() {
        return false;
    }

    @Value.Default
    public boolean deleteModel() {
        return true;
    }

    /**
     * Whether the solver log is deleted after decoding. Keep it to inspect infeasible runs.
     */
    @Value.Default
    public boolean deleteLog() {
        return true;
    }

    @Value.Default
    public Path workingDirectory() {
        return Path.of(System.getProperty("java.io.tmpdir"));
    }

    @Value.Default
    public String filePrefix() {
        return DEFAULT_FILE_PREFIX;
    }

    /**
     * Time limit of a single solver run in seconds, zero meaning no limit.
     */
    @Value.Default
    public long timeoutSeconds() {
        return 0L;
    }
}
