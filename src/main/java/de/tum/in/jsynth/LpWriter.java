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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a {@link CircuitModel} in the CPLEX LP file format, which is understood by most integer
 * programming solvers. The output only depends on the model, i.e. equal models are written
 * byte-identical.
 */
public final class LpWriter {
    private static final Logger logger = Logger.getLogger(LpWriter.class.getName());

    static final int TERMS_PER_LINE = 8;
    static final int VARIABLES_PER_LINE = 10;

    private LpWriter() {}

    public static String toString(CircuitModel model) {
        StringWriter writer = new StringWriter();
        try {
            write(model, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    public static void write(CircuitModel model, Path path) throws IOException {
        logger.log(Level.FINE, "Writing {0} to {1}", new Object[] {model, path});
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(model, writer);
        }
    }

    public static void write(CircuitModel model, Writer writer) throws IOException {
        List<Variable> variables = model.variables().variables();
        Variable placeholder = variables.get(0);

        writer.append("\\ ").append(model.name()).append('\n');
        writer.append("Minimize\n");
        writer.append(" obj: ");
        writeExpression(writer, model.objective(), placeholder);
        writer.append('\n');

        writer.append("Subject To\n");
        for (LinearConstraint constraint : model.constraints()) {
            writer.append(' ').append(constraint.name()).append(": ");
            writeExpression(writer, constraint.expression(), placeholder);
            writer.append(' ')
                    .append(constraint.relation().symbol())
                    .append(' ')
                    .append(Integer.toString(constraint.bound()))
                    .append('\n');
        }

        writer.append("Binaries\n");
        for (int i = 0; i < variables.size(); i++) {
            writer.append(' ').append(variables.get(i).name());
            if (i % VARIABLES_PER_LINE == VARIABLES_PER_LINE - 1 || i == variables.size() - 1) {
                writer.append('\n');
            }
        }
        writer.append("End\n");
        writer.flush();
    }

    private static void writeExpression(Writer writer, LinearExpression expression, Variable placeholder)
            throws IOException {
        List<LinearExpression.Term> terms = expression.terms();
        if (terms.isEmpty()) {
            // The format has no empty rows
            writer.append("0 ").append(placeholder.name());
            return;
        }
        for (int i = 0; i < terms.size(); i++) {
            LinearExpression.Term term = terms.get(i);
            if (i > 0) {
                writer.append(i % TERMS_PER_LINE == 0 ? "\n   " : " ");
            }
            int coefficient = term.coefficient();
            writer.append(coefficient < 0 ? "- " : (i == 0 ? "" : "+ "));
            if (Math.abs(coefficient) != 1) {
                writer.append(Integer.toString(Math.abs(coefficient))).append(' ');
            }
            writer.append(term.variable().name());
        }
    }
}
