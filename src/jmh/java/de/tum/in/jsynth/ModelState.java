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

import java.util.List;
import java.util.Random;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

@State(Scope.Benchmark)
public class ModelState {
    @Param({"3", "5", "7"})
    private int inputs;

    @Param({"4", "8"})
    private int gates;

    private TruthTable truthTable;
    private List<GateType> gateTypes;

    @Setup(Level.Trial)
    public void setUpModel() {
        Random random = new Random(0L);
        boolean[] values = new boolean[1 << inputs];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextBoolean();
        }
        truthTable = TruthTable.of(values);

        GateType[] types = new GateType[gates];
        for (int i = 0; i < gates; i++) {
            types[i] = i == 0 ? GateType.NOT : GateType.NAND;
        }
        gateTypes = List.of(types);
    }

    public TruthTable truthTable() {
        return truthTable;
    }

    public List<GateType> gates() {
        return gateTypes;
    }
}
