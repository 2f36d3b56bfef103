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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * An integer linear combination of variables. Terms keep the order in which their variables were
 * first added and terms with a zero coefficient are dropped.
 */
public final class LinearExpression {
    private static final LinearExpression EMPTY = new LinearExpression(List.of());

    private final List<Term> terms;

    private LinearExpression(List<Term> terms) {
        this.terms = terms;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Term> terms() {
        return terms;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public int coefficient(Variable variable) {
        for (Term term : terms) {
            if (term.variable().equals(variable)) {
                return term.coefficient();
            }
        }
        return 0;
    }

    public long evaluate(ToIntFunction<Variable> assignment) {
        long value = 0L;
        for (Term term : terms) {
            value += (long) term.coefficient() * assignment.applyAsInt(term.variable());
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof LinearExpression && terms.equals(((LinearExpression) o).terms));
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder builder = new StringBuilder();
        for (Term term : terms) {
            if (builder.length() > 0) {
                builder.append(term.coefficient() < 0 ? " - " : " + ");
            } else if (term.coefficient() < 0) {
                builder.append("- ");
            }
            int magnitude = Math.abs(term.coefficient());
            if (magnitude != 1) {
                builder.append(magnitude).append(' ');
            }
            builder.append(term.variable().name());
        }
        return builder.toString();
    }

    public static final class Term {
        private final int coefficient;
        private final Variable variable;

        Term(int coefficient, Variable variable) {
            this.coefficient = coefficient;
            this.variable = variable;
        }

        public int coefficient() {
            return coefficient;
        }

        public Variable variable() {
            return variable;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Term)) {
                return false;
            }
            Term other = (Term) o;
            return coefficient == other.coefficient && variable.equals(other.variable);
        }

        @Override
        public int hashCode() {
            return 31 * variable.hashCode() + coefficient;
        }

        @Override
        public String toString() {
            return coefficient + " " + variable;
        }
    }

    public static final class Builder {
        private final Map<Variable, Integer> coefficients = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(Variable variable) {
            return add(1, variable);
        }

        public Builder add(int coefficient, Variable variable) {
            coefficients.merge(variable, coefficient, Integer::sum);
            return this;
        }

        public Builder subtract(Variable variable) {
            return add(-1, variable);
        }

        public LinearExpression build() {
            List<Term> terms = new ArrayList<>(coefficients.size());
            coefficients.forEach((variable, coefficient) -> {
                if (coefficient != 0) {
                    terms.add(new Term(coefficient, variable));
                }
            });
            return terms.isEmpty() ? EMPTY : new LinearExpression(Collections.unmodifiableList(terms));
        }
    }
}
