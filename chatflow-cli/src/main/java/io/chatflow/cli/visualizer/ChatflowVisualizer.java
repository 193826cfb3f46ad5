package io.chatflow.cli.visualizer;

import io.chatflow.core.graph.Graph;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/// Dispatches rendering to the {@link VisualizationFormat} registered under a name.
///
/// @implNote Thread-safe after construction. The format map is immutable and sorted by name.
@ApplicationScoped
public class ChatflowVisualizer {

    private final Map<String, VisualizationFormat> formats;

    @Inject
    public ChatflowVisualizer(Instance<VisualizationFormat> formatInstances) {
        this((Iterable<VisualizationFormat>) formatInstances);
    }

    public ChatflowVisualizer(Iterable<VisualizationFormat> formatInstances) {
        Map<String, VisualizationFormat> byName = new TreeMap<>();
        for (VisualizationFormat format : formatInstances) {
            byName.put(format.getName(), format);
        }
        this.formats = Collections.unmodifiableMap(byName);
    }

    /// Renders the graph in the named format.
    ///
    /// @throws IllegalArgumentException if no format has that name
    public String visualize(Graph graph, String formatName) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(graph);
    }

    public Iterable<String> getAvailableFormats() {
        return formats.keySet();
    }
}
