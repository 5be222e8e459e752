package org.sn.exprtree.render;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.sn.exprtree.annotations.NotNull;


/**
 * Turn a render graph into text that some diagramming tool reads.
 */
public interface RenderFormatter {
    /**
     * The usual file extension of the output, without the dot, for example "dot".
     */
    @NotNull String fileExtension();

    @NotNull String format(@NotNull RenderGraph graph);

    /**
     * Write the formatted graph to a file as UTF-8, replacing the file if it exists.
     *
     * @throws IOException if the file cannot be written
     */
    default void write(@NotNull RenderGraph graph, @NotNull Path file) throws IOException {
        Files.writeString(file, format(graph), StandardCharsets.UTF_8);
    }
}
