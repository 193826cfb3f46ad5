package io.chatflow.cli.commands;

import io.chatflow.cli.exception.UnsupportedChatflowException;
import io.chatflow.core.graph.ChatflowDefinition;
import io.chatflow.serialization.ChatflowSerializer;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;

/// Base class for commands that operate on a chatflow definition file.
///
/// ### Working Directory Resolution
/// 1. CLI option `-d` / `--working-dir`
/// 2. Config property `chatflow.working.dir`
/// 3. Current directory (`.`)
///
/// ### Chatflow File Resolution
/// 1. CLI positional parameter
/// 2. Config property `chatflow.file`
///
/// Relative file paths are resolved against the working directory.
///
/// @implNote Subclasses are package-private and annotated with `@Command`. The exit
/// code returned by {@link #execute()} becomes the process exit code.
public abstract class ChatflowCommand implements Callable<Integer> {

    private static final String[] BANNER = {
        "",
        "        _           _    __ _",
        "   ___ | |__   __ _| |_ / _| | _____      __",
        "  / __|| '_ \\ / _` | __| |_| |/ _ \\ \\ /\\ / /",
        " | (__ | | | | (_| | |_|  _| | (_) \\ V  V /",
        "  \\___||_| |_|\\__,_|\\__|_| |_|\\___/ \\_/\\_/",
        "",
        " Conversational workflow engine",
        ""
    };

    @Option(
            names = {"-d", "--working-dir"},
            description = "Directory that relative chatflow paths are resolved against")
    protected Path workingDirPath;

    @Inject
    @ConfigProperty(name = "chatflow.file")
    Optional<String> defaultChatflowFile;

    @Inject
    @ConfigProperty(name = "chatflow.working.dir", defaultValue = ".")
    String defaultWorkingDir;

    @Override
    public final Integer call() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        return execute();
    }

    /// Runs the command.
    ///
    /// @return process exit code, 0 on success
    protected abstract int execute();

    /// Whether to print the banner before running. Machine-readable output turns it off.
    protected boolean showBanner() {
        return true;
    }

    /// Reads and parses a chatflow definition.
    ///
    /// @param chatflowFile file path from the CLI, may be null to use the configured default
    /// @return the parsed definition, never null
    /// @throws UnsupportedChatflowException if no file is given or it cannot be read
    /// @throws IllegalArgumentException if the file is not a valid chatflow document
    protected ChatflowDefinition loadDefinition(String chatflowFile)
            throws UnsupportedChatflowException {
        String effectiveFile = resolveChatflowFile(chatflowFile);
        if (effectiveFile == null) {
            System.err.println(
                    """
              No chatflow file specified and no default configured.
              Usage: chatflow <command> <file> [-d <working-dir>]
              Or set chatflow.file in application.properties
              """);
            throw new UnsupportedChatflowException("Chatflow file not specified");
        }

        Path path = getWorkingDirectory().resolve(effectiveFile).normalize();
        if (!Files.isRegularFile(path)) {
            throw new UnsupportedChatflowException("Chatflow file not found: " + path);
        }
        try {
            return ChatflowSerializer.fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UnsupportedChatflowException("Cannot read chatflow file: " + path, e);
        }
    }

    /// @return absolute working directory, never null
    protected Path getWorkingDirectory() {
        Path effectivePath;
        if (workingDirPath != null) {
            effectivePath = workingDirPath;
        } else if (defaultWorkingDir != null && !defaultWorkingDir.isBlank()) {
            effectivePath = Path.of(defaultWorkingDir);
        } else {
            effectivePath = Path.of(".");
        }
        return effectivePath.toAbsolutePath();
    }

    /// @return the CLI file, else the configured default, else null
    protected String resolveChatflowFile(String chatflowFile) {
        if (chatflowFile != null && !chatflowFile.isBlank()) {
            return chatflowFile;
        }
        return defaultChatflowFile != null
                ? defaultChatflowFile.filter(file -> !file.isBlank()).orElse(null)
                : null;
    }
}
