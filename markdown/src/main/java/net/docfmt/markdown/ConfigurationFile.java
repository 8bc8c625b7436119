package net.docfmt.markdown;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the JSON configuration of the markdown transformer, for example
 * <pre>
 * {"line_width": 100, "text_wrap": "maintain", "format_module_attributes": ["moduledoc", "doc"]}
 * </pre>
 * Values are returned untyped and validated later.
 */
public final class ConfigurationFile {
    private static final Gson GSON = new Gson();

    private ConfigurationFile() {
    }

    public static Map<String, Object> loadJson(Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path)) {
            return loadJson(reader);
        } catch (JsonParseException e) {
            throw new IOException("Invalid markdown configuration " + path + ": " + e.getMessage(), e);
        }
    }

    public static Map<String, Object> loadJson(Reader reader) {
        Map<String, Object> map = GSON.fromJson(reader, new TypeToken<LinkedHashMap<String, Object>>() {
        }.getType());
        return map == null ? new LinkedHashMap<>() : map;
    }
}
