package org.mdacademic.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.mdacademic.cli.CommandLineInterface;
import org.mdacademic.cli.rendering.OutputFormat;
import org.mdacademic.compiler.Compiler;
import org.mdacademic.compiler.api.CompilationException;
import org.mdacademic.compiler.api.ICompiler;
import org.mdacademic.compiler.api.RenderException;
import org.mdacademic.compiler.api.ResolveConfig;
import org.mdacademic.compiler.api.ResolvedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Parses and resolves an academic Markdown file and prints the result.")
public class CompileCommand implements Callable<Integer> {

    /** Exit code for a document that fails to parse or resolve. */
    public static final int EXIT_DOCUMENT_ERROR = 1;
    /** Exit code for a resolved document that cannot be written. */
    public static final int EXIT_RENDER_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @Parameters(index = "0", description = "The Markdown source file.")
    private File file;

    @Option(names = "--strict-citations", description = "Fail on citation keys missing from the bibliography.")
    private boolean strictCitations;

    @Option(names = "--strict-references", description = "Fail on unknown references and undefined footnotes.")
    private boolean strictReferences;

    @Option(names = "--format", defaultValue = "SUMMARY",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format;

    @Option(names = {"-v", "--verbosity"}, description = "Log verbosity, 0 (errors) to 4 (trace).")
    private Integer verbosity;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        Config config;
        try {
            config = parent.getConfig();
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_DOCUMENT_ERROR;
        }

        ResolveConfig resolveConfig = ResolveConfig.fromConfig(config);
        resolveConfig = resolveConfig.withStrictness(
                resolveConfig.strictCitations() || strictCitations,
                resolveConfig.strictReferences() || strictReferences);

        ICompiler compiler = new Compiler();
        compiler.setVerbosity(verbosity != null ? verbosity : config.getInt("mdacademic.logging.verbosity"));

        ResolvedDocument document;
        try {
            document = compiler.compile(file.toPath(), resolveConfig);
        } catch (CompilationException e) {
            LOG.debug("Compilation of {} failed", file, e);
            err.println("Compilation failed [" + e.getErrorCode() + "]: " + e.getMessage());
            return EXIT_DOCUMENT_ERROR;
        } catch (IOException e) {
            LOG.debug("Cannot read {}", file, e);
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_DOCUMENT_ERROR;
        }

        PrintWriter out = spec.commandLine().getOut();
        try {
            format.createRenderer().render(document, out);
        } catch (RenderException e) {
            LOG.debug("Rendering of {} failed", file, e);
            err.println("Cannot write output: " + e.getMessage());
            return EXIT_RENDER_ERROR;
        }
        out.flush();
        return 0;
    }
}
