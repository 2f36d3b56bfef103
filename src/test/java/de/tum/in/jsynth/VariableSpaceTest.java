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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class VariableSpaceTest {
    @Test
    public void testSizes() {
        VariableSpace space = new VariableSpace(3, 4);
        List<Variable> variables = space.variables();

        // 3 * 4 u, 6 v, 3 * 8 p, 6 * 8 r
        assertThat(variables.size(), is(12 + 6 + 24 + 48));
        assertThat(count(variables, Variable.Family.INPUT_LINK), is(12L));
        assertThat(count(variables, Variable.Family.GATE_LINK), is(6L));
        assertThat(count(variables, Variable.Family.GATE_OUTPUT), is(24L));
        assertThat(count(variables, Variable.Family.LINKED_OUTPUT), is(48L));
    }

    @Test
    public void testAllocationOrder() {
        VariableSpace space = new VariableSpace(1, 3);
        List<String> names = space.variables().stream().map(Variable::name).collect(Collectors.toList());
        assertThat(names, contains(
                "u.1.1", "u.1.2", "u.1.3",
                "v.1.2", "v.1.3", "v.2.3",
                "p.1.1", "p.1.2", "p.2.1", "p.2.2",
                "r.1.2.1", "r.1.2.2", "r.1.3.1", "r.1.3.2", "r.2.3.1", "r.2.3.2"));
        for (int i = 0; i < space.size(); i++) {
            assertThat(space.variables().get(i).index(), is(i));
        }
    }

    @Test
    public void testAccessors() {
        VariableSpace space = new VariableSpace(2, 3);
        assertThat(space.inputLink(2, 3).name(), is("u.2.3"));
        assertThat(space.gateLink(1, 3).name(), is("v.1.3"));
        assertThat(space.gateOutput(2, 4).name(), is("p.2.4"));
        assertThat(space.linkedOutput(2, 3, 1).name(), is("r.2.3.1"));
        assertThat(space.byName("r.2.3.1").orElseThrow(), is(space.linkedOutput(2, 3, 1)));
        assertThat(space.byName("v.3.2").isPresent(), is(false));
    }

    @Test
    public void testOnlyFeedForwardLinks() {
        VariableSpace space = new VariableSpace(2, 5);
        for (Variable variable : space.variables()) {
            if (variable.family() == Variable.Family.GATE_LINK || variable.family() == Variable.Family.LINKED_OUTPUT) {
                assertThat(variable.subscript(0), lessThan(variable.subscript(1)));
            }
        }
        assertThrows(IllegalArgumentException.class, () -> space.gateLink(2, 2));
        assertThrows(IllegalArgumentException.class, () -> space.gateLink(3, 2));
        assertThrows(IllegalArgumentException.class, () -> space.linkedOutput(4, 4, 1));
    }

    @Test
    public void testNoOutputOfLastGate() {
        VariableSpace space = new VariableSpace(2, 3);
        assertThrows(IllegalArgumentException.class, () -> space.gateOutput(3, 1));
        assertThat(space.byName("p.3.1").isPresent(), is(false));
    }

    @Test
    public void testOutOfRange() {
        VariableSpace space = new VariableSpace(2, 3);
        assertThrows(IllegalArgumentException.class, () -> space.inputLink(0, 1));
        assertThrows(IllegalArgumentException.class, () -> space.inputLink(3, 1));
        assertThrows(IllegalArgumentException.class, () -> space.gateOutput(1, 5));
        assertThrows(IllegalArgumentException.class, () -> new VariableSpace(2, 0));
    }

    @Test
    public void testSingleGate() {
        VariableSpace space = new VariableSpace(2, 1);
        assertThat(space.size(), is(2));
        assertThat(count(space.variables(), Variable.Family.GATE_OUTPUT), is(0L));
    }

    private static long count(List<Variable> variables, Variable.Family family) {
        return variables.stream().filter(variable -> variable.family() == family).count();
    }
}
