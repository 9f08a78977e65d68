package com.dslforge.cli;

import com.dslforge.core.config.VariableLoader;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.Variable;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Input handling shared by the commands.
 */
final class CommandInputs {

    private CommandInputs() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    static String readDsl(Path dslFile) {
        try {
            return Files.readString(dslFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read DSL file: " + dslFile, e);
        }
    }

    static List<Variable> readVariables(Path variablesFile) {
        return variablesFile == null ? List.of() : VariableLoader.load(variablesFile);
    }

    static void printDefects(PrintWriter writer, List<Defect> defects) {
        for (Defect defect : defects) {
            writer.println("  " + (defect.isFatal() ? "✗ " : "⚠ ") + defect.describe());
        }
    }
}
