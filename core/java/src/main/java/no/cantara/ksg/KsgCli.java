package no.cantara.ksg;

import no.cantara.ksg.config.KsgConfig;
import no.cantara.ksg.config.KsgConfigLoader;
import no.cantara.ksg.dag.ExecutionResult;
import no.cantara.ksg.dag.ToolCommand;
import no.cantara.ksg.model.Provenance;
import no.cantara.ksg.procedure.ProcedureBuilder;
import no.cantara.ksg.procedure.ProcedureParser;
import no.cantara.ksg.procedure.ProcedureValidator;
import no.cantara.ksg.store.InMemoryGraphStore;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line interface for procedure descriptions.
 * Usage: java -jar ksg-core.jar validate|run &lt;procedure.yaml|json&gt; [config.yaml]
 */
public class KsgCli {

    static final String USAGE = "Usage: java -jar ksg-core.jar validate|run <procedure.yaml|json> [config.yaml]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** @return the process exit code */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2 || !List.of("validate", "run").contains(args[0])) {
            err.println(USAGE);
            return 1;
        }

        Path path = Path.of(args[1]);
        if (!Files.exists(path)) {
            err.println("Error: file not found: " + path);
            return 1;
        }

        Map<String, Object> data;
        try {
            data = ProcedureParser.parse(path);
        } catch (IOException | ProcedureParser.ParseException e) {
            err.println("Parse error: " + e.getMessage());
            return 1;
        }

        ProcedureValidator.ValidationResult result = ProcedureValidator.validate(data);
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> err.println("  ⚠ " + w));
        }
        if (!result.isValid()) {
            err.println("Validation failed: " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> err.println("  • " + e));
            return 1;
        }

        if (args[0].equals("validate")) {
            out.printf("✓ %s is valid: procedure '%s', %d step(s)%n",
                    path, data.get("name"), ((List<?>) data.get("steps")).size());
            return 0;
        }

        KsgConfig config;
        try {
            config = args.length > 2 ? KsgConfigLoader.load(Path.of(args[2])) : KsgConfigLoader.load();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Config error: " + e.getMessage());
            return 1;
        }

        KnowShowGo ksg = new KnowShowGo(new InMemoryGraphStore(), null, config);
        ProcedureBuilder.BuildResult built = ksg.procedures()
                .createFromDescription(data, Provenance.of("cli", path.getFileName().toString()), false);
        List<ToolCommand> commands = new ArrayList<>();
        ExecutionResult execution = ksg.executor().execute(built.procedureUuid(), Map.of(), commands::add);

        commands.forEach(c -> out.println(c.tool() + " " + c.params()));
        out.printf("%s: %d executed, %d skipped, %d error(s), order %s%n",
                execution.status(), execution.executed().size(), execution.skipped().size(),
                execution.errors().size(), execution.executionOrder());
        execution.errors().forEach(e -> err.println("  • " + e.stepId() + ": " + e.message()));
        return execution.status() == ExecutionResult.Status.COMPLETED ? 0 : 2;
    }
}
