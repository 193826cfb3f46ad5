package io.chatflow.cli.visualizer;

import io.chatflow.core.graph.Graph;

/// Strategy for rendering a chatflow graph in one output format.
///
/// Implementations are CDI beans collected by {@link ChatflowVisualizer}.
///
/// ### Built-in Formats
/// - `text`: box-drawing outline with ANSI colors ({@link TextVisualizationFormat})
/// - `mermaid`: Mermaid flowchart ({@link MermaidVisualizationFormat})
public interface VisualizationFormat {

    /// @return format name used for CLI selection, never null
    String getName();

    /// Renders the graph. Invalid graphs are rendered as far as their structure allows.
    ///
    /// @param graph the graph to render, not null
    /// @return rendered output, never null
    String render(Graph graph);
}
