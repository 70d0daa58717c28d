package org.scriptweaver.cli.commands;

import com.typesafe.config.Config;
import org.scriptweaver.cli.CommandLineInterface;
import org.scriptweaver.compiler.Compiler;
import org.scriptweaver.compiler.CompilerOptions;
import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.api.CompiledSystem;
import org.scriptweaver.compiler.api.CycleDetectedException;
import org.scriptweaver.compiler.api.MalformedGraphException;
import org.scriptweaver.compiler.assembly.SystemSourceAssembler;
import org.scriptweaver.compiler.diagnostics.Diagnostic;
import org.scriptweaver.compiler.graph.VisualScript;
import org.scriptweaver.compiler.io.CompiledSystemWriter;
import org.scriptweaver.compiler.io.VisualScriptReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a visual script JSON document into a system body.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompileCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the visual script JSON file.")
    private File file;

    @Option(names = {"-a", "--assemble"}, description = "Wrap the body into the complete system declaration.")
    private boolean assemble;

    @Option(names = {"-j", "--json"}, description = "Print the compiled system (code, dependencies, diagnostics) as JSON.")
    private boolean json;

    @Option(names = {"-o", "--output"}, description = "Write the result to this file instead of stdout.")
    private File output;

    @Option(names = {"-v", "--verbosity"}, description = "Compiler log verbosity, 0=ERROR .. 4=TRACE. Overrides compiler.verbosity.")
    private Integer verbosity;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        Config config = parent.getConfig();
        CompilerOptions options = CompilerOptions.fromConfig(config);
        PrintWriter err = spec.commandLine().getErr();

        CompiledSystem system;
        try {
            VisualScript script = new VisualScriptReader().read(file.toPath());
            Compiler compiler = new Compiler(options);
            if (verbosity != null) {
                compiler.setVerbosity(verbosity);
            }
            system = compiler.compile(script);
        } catch (CompilationException e) {
            err.println(describeFailure(e));
            err.flush();
            return 1;
        }

        for (Diagnostic d : system.diagnostics()) {
            err.println(d);
        }
        err.flush();

        String result;
        if (json) {
            result = new CompiledSystemWriter().toJson(system);
        } else if (assemble) {
            result = new SystemSourceAssembler(options.indent()).assemble(system);
        } else {
            result = system.code();
        }

        if (output != null) {
            Files.writeString(output.toPath(), result + System.lineSeparator(), StandardCharsets.UTF_8);
            LOGGER.info("Wrote {} to {}", system.name(), output.getAbsolutePath());
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.println(result);
            out.flush();
        }
        return 0;
    }

    private String describeFailure(CompilationException e) {
        StringBuilder sb = new StringBuilder("Compilation failed [").append(e.getErrorCode()).append("]: ").append(e.getMessage());
        if (e instanceof MalformedGraphException mge && mge.getConnectionId() != null) {
            sb.append(" (connection ").append(mge.getConnectionId()).append(")");
        } else if (e instanceof CycleDetectedException cde) {
            sb.append(" (unresolved nodes ").append(cde.getUnresolvedNodeIds()).append(")");
        }
        return sb.toString();
    }
}
