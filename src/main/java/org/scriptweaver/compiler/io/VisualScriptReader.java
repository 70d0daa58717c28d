package org.scriptweaver.compiler.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.api.CompilerErrorCode;
import org.scriptweaver.compiler.graph.Connection;
import org.scriptweaver.compiler.graph.Node;
import org.scriptweaver.compiler.graph.VisualScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads visual scripts from their JSON document form:
 * <pre>
 * {
 *   "id": "...", "name": "...",
 *   "nodes": [ { "id": "...", "type": "math/add", "data": { ... } } ],
 *   "connections": [ { "id": "...", "source": "...", "sourceHandle": "...",
 *                      "target": "...", "targetHandle": "..." } ]
 * }
 * </pre>
 * Comments are tolerated.
 */
public final class VisualScriptReader {

    private static final Logger log = LoggerFactory.getLogger(VisualScriptReader.class);

    private static final Gson GSON = new GsonBuilder()
        .setLenient()
        .create();

    /**
     * Reads a script from a file.
     *
     * @param path The JSON file.
     * @return The script.
     * @throws CompilationException if the file cannot be read or is not a valid script document.
     */
    public VisualScript read(Path path) throws CompilationException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            log.debug("Reading visual script from {}", path);
            return parse(GSON.fromJson(reader, ScriptDocument.class), path.toString());
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.IO_ERROR_READING_SCRIPT,
                    "Failed to read '" + path + "': " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_SCRIPT_DOCUMENT,
                    "Invalid JSON in '" + path + "': " + e.getMessage(), e);
        }
    }

    /**
     * Reads a script from a JSON string.
     *
     * @param json The document.
     * @return The script.
     * @throws CompilationException if the text is not a valid script document.
     */
    public VisualScript fromJson(String json) throws CompilationException {
        try {
            return parse(GSON.fromJson(json, ScriptDocument.class), "<string>");
        } catch (JsonParseException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_SCRIPT_DOCUMENT,
                    "Invalid JSON: " + e.getMessage(), e);
        }
    }

    private VisualScript parse(ScriptDocument doc, String origin) throws CompilationException {
        if (doc == null) {
            throw new CompilationException(CompilerErrorCode.INVALID_SCRIPT_DOCUMENT, "Empty script document in " + origin);
        }
        List<Node> nodes = new ArrayList<>();
        if (doc.nodes != null) {
            for (int i = 0; i < doc.nodes.size(); i++) {
                NodeDocument n = doc.nodes.get(i);
                if (n == null || n.id == null || n.type == null) {
                    throw new CompilationException(CompilerErrorCode.INVALID_SCRIPT_DOCUMENT,
                            "Node #" + i + " in " + origin + " needs an 'id' and a 'type'");
                }
                nodes.add(new Node(n.id, n.type, n.data));
            }
        }
        List<Connection> connections = new ArrayList<>();
        if (doc.connections != null) {
            for (int i = 0; i < doc.connections.size(); i++) {
                ConnectionDocument c = doc.connections.get(i);
                if (c == null || c.source == null || c.target == null) {
                    throw new CompilationException(CompilerErrorCode.INVALID_SCRIPT_DOCUMENT,
                            "Connection #" + i + " in " + origin + " needs a 'source' and a 'target'");
                }
                String id = c.id != null ? c.id : "connection-" + i;
                connections.add(new Connection(id, c.source, c.sourceHandle, c.target, c.targetHandle));
            }
        }
        String name = doc.name != null ? doc.name : doc.id;
        log.debug("Parsed script '{}' with {} nodes and {} connections", name, nodes.size(), connections.size());
        return new VisualScript(doc.id, name, nodes, connections);
    }

    // Gson binding types; the public model is immutable and validated on conversion.
    private static final class ScriptDocument {
        String id;
        String name;
        List<NodeDocument> nodes;
        List<ConnectionDocument> connections;
    }

    private static final class NodeDocument {
        String id;
        String type;
        Map<String, Object> data;
    }

    private static final class ConnectionDocument {
        String id;
        String source;
        String sourceHandle;
        String target;
        String targetHandle;
    }
}
