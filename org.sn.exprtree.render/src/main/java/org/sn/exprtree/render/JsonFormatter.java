package org.sn.exprtree.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.UncheckedIOException;
import org.sn.exprtree.annotations.NotNull;


/**
 * Write a render graph as JSON, for example
 * <code>{"nodes":[{"id":2,"label":"+"},{"id":0,"label":"3"},{"id":1,"label":"4"}],"edges":[{"parent":2,"child":0},{"parent":2,"child":1}]}</code>.
 */
public class JsonFormatter implements RenderFormatter {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ObjectWriter writer;

    /**
     * Create a formatter that writes everything on one line.
     */
    public JsonFormatter() {
        this(false);
    }

    /**
     * Create a formatter.
     *
     * @param prettyPrint true to indent the output over several lines
     */
    public JsonFormatter(boolean prettyPrint) {
        this.writer = prettyPrint
                ? OBJECT_MAPPER.writer().with(SerializationFeature.INDENT_OUTPUT)
                : OBJECT_MAPPER.writer();
    }

    @Override
    public @NotNull String fileExtension() {
        return "json";
    }

    /**
     * Format the graph.
     *
     * @throws UncheckedIOException if Jackson fails to serialize the graph
     */
    @Override
    public @NotNull String format(@NotNull RenderGraph graph) {
        try {
            return writer.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
