package com.dslforge.core.workflow;

import com.dslforge.core.model.Module;
import com.dslforge.core.synthesis.PythonSyntax;

import java.util.List;

/**
 * Assembles the complete Python program: header, runtime import, module
 * functions in invocation order, entry point and a {@code __main__} guard that
 * reads input parameters as JSON from the first command-line argument.
 */
public class ProgramEmitter {

    /**
     * Emits the program source.
     *
     * @param title workflow title used in the header docstring
     * @param ordered modules in invocation order
     * @param entryPoint entry point source
     * @return program source ending with a newline
     */
    public String emit(String title, List<Module> ordered, String entryPoint) {
        StringBuilder sb = new StringBuilder();
        sb.append("\"\"\"\n");
        sb.append(title == null || title.isBlank() ? "Generated workflow" : title.replace("\"\"\"", "'''")).append("\n\n");
        sb.append("Generated by DslForge. DO NOT EDIT.\n");
        sb.append("\"\"\"\n");
        sb.append("import json\n");
        sb.append("import sys\n\n");
        sb.append("from ").append(PythonSyntax.RUNTIME_MODULE)
            .append(" import ").append(PythonSyntax.INVOKE_FUNCTION).append("\n");

        for (Module module : ordered) {
            sb.append("\n\n").append(module.code()).append("\n");
        }

        sb.append("\n\n").append(entryPoint).append("\n");
        sb.append("\n\n");
        sb.append("if __name__ == \"__main__\":\n");
        sb.append("    params = json.loads(sys.argv[1]) if len(sys.argv) > 1 else {}\n");
        sb.append("    print(").append(WorkflowOrchestrator.ENTRY_POINT).append("(params))\n");
        return sb.toString();
    }
}
