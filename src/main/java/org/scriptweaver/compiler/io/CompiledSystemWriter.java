package org.scriptweaver.compiler.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.scriptweaver.compiler.api.CompiledSystem;
import org.scriptweaver.compiler.diagnostics.Diagnostic;

/**
 * Renders a {@link CompiledSystem} as pretty-printed JSON.
 */
public final class CompiledSystemWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * @param system The compiled system.
     * @return The JSON text with the fields {@code name}, {@code code}, {@code dependencies} and
     *         {@code diagnostics}.
     */
    public String toJson(CompiledSystem system) {
        JsonObject root = new JsonObject();
        root.addProperty("name", system.name());
        root.addProperty("code", system.code());
        JsonArray deps = new JsonArray();
        system.dependencies().forEach(deps::add);
        root.add("dependencies", deps);
        JsonArray diagnostics = new JsonArray();
        for (Diagnostic d : system.diagnostics()) {
            JsonObject o = new JsonObject();
            o.addProperty("type", d.type().name());
            o.addProperty("code", d.code().name());
            o.addProperty("nodeId", d.nodeId());
            if (d.port() != null) {
                o.addProperty("port", d.port());
            }
            o.addProperty("message", d.message());
            diagnostics.add(o);
        }
        root.add("diagnostics", diagnostics);
        return gson.toJson(root);
    }
}
