package io.chatflow.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Chatflow CLI.
///
/// Subcommands:
/// - `validate`: run every activation check and list the errors in order
/// - `visualize`: render the graph as text or a Mermaid diagram
/// - `preview`: show the topological order and the paths to each response node
/// - `run`: execute one turn, or a stdin conversation, against the chatflow
@TopCommand
@Command(
        name = "chatflow",
        description = "Chatflow conversational workflow engine",
        mixinStandardHelpOptions = true,
        subcommands = {
            ChatflowValidateCommand.class,
            ChatflowVisualizeCommand.class,
            ChatflowPreviewCommand.class,
            ChatflowRunCommand.class
        })
public class ChatflowCLI {}
