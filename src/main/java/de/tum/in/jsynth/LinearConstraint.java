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

import java.util.function.ToIntFunction;

/**
 * A named constraint {@code expression <relation> bound}, with all variables on the left-hand side.
 */
public final class LinearConstraint {
    public enum Relation {
        LESS_EQUAL("<="),
        GREATER_EQUAL(">=");

        private final String symbol;

        Relation(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final String name;
    private final LinearExpression expression;
    private final Relation relation;
    private final int bound;

    public LinearConstraint(String name, LinearExpression expression, Relation relation, int bound) {
        this.name = name;
        this.expression = expression;
        this.relation = relation;
        this.bound = bound;
    }

    public String name() {
        return name;
    }

    public LinearExpression expression() {
        return expression;
    }

    public Relation relation() {
        return relation;
    }

    public int bound() {
        return bound;
    }

    public boolean isSatisfiedBy(ToIntFunction<Variable> assignment) {
        long value = expression.evaluate(assignment);
        return relation == Relation.LESS_EQUAL ? value <= bound : value >= bound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LinearConstraint)) {
            return false;
        }
        LinearConstraint other = (LinearConstraint) o;
        return bound == other.bound
                && relation == other.relation
                && name.equals(other.name)
                && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return ((name.hashCode() * 31 + expression.hashCode()) * 31 + relation.hashCode()) * 31 + bound;
    }

    @Override
    public String toString() {
        return String.format("%s: %s %s %d", name, expression, relation.symbol(), bound);
    }
}
