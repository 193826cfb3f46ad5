package io.chatflow.cli.commands;

import io.chatflow.core.ChatflowEnvironment;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.core.graph.ValidationReport;
import io.chatflow.serialization.ChatflowSerializer;
import jakarta.inject.Inject;
import java.util.List;
import picocli.CommandLine;

/// Runs every activation check on a chatflow file without activating it.
///
/// Structural errors come first in their fixed order, followed by per-node
/// configuration problems.
///
/// ### Usage
/// ```bash
/// chatflow validate [-d <working-dir>] [--json] <file>
/// ```
///
/// Exit code is 1 when the chatflow is invalid or cannot be read.
@CommandLine.Command(name = "validate", description = "Validate a chatflow definition")
class ChatflowValidateCommand extends ChatflowCommand {

    @CommandLine.Parameters(index = "0", description = "Chatflow JSON file", arity = "0..1")
    String chatflowFile;

    @CommandLine.Option(names = "--json", description = "Print the validation report as JSON")
    boolean json;

    @Inject ChatflowEnvironment environment;

    @Override
    protected boolean showBanner() {
        return !json;
    }

    @Override
    protected int execute() {
        try {
            ChatflowDefinition definition = loadDefinition(chatflowFile);
            ValidationReport report = environment.getActivator().check(definition);

            if (json) {
                System.out.println(ChatflowSerializer.toJson(report));
            } else if (report.valid()) {
                System.out.println(" [OK] Chatflow is valid!");
                System.out.println("   Id: " + definition.getId() + " v" + definition.getVersion());
                System.out.println("   Nodes: " + definition.getNodes().size());
                System.out.println("   Edges: " + definition.getEdges().size());
            } else {
                printErrors(report.errors());
            }
            return report.valid() ? 0 : 1;
        } catch (Exception e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
            return 1;
        }
    }

    private void printErrors(List<String> errors) {
        System.out.println(" [FAIL] Chatflow is invalid (" + errors.size() + " error(s))");
        for (int i = 0; i < errors.size(); i++) {
            System.out.println("   " + (i + 1) + ". " + errors.get(i));
        }
    }
}
