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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

public class ModelBenchmark extends BaseModelBenchmark {
    @Benchmark
    public static void buildModel(ModelState state, Blackhole bh) {
        bh.consume(CircuitModelBuilder.build(state.truthTable(), state.gates()));
    }

    @Benchmark
    public static void writeModel(ModelState state, Blackhole bh) {
        bh.consume(LpWriter.toString(CircuitModelBuilder.build(state.truthTable(), state.gates())));
    }
}
