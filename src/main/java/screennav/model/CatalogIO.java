package screennav.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link AppCatalog} files.
 *
 * <p>On read: validates the JSON against {@code catalog-schema.json} before
 * binding, and rejects catalogs with unsupported schema versions.
 *
 * <p>On write: pretty-prints for human readability.
 */
public class CatalogIO {

    private static final Logger log = LoggerFactory.getLogger(CatalogIO.class);
    private static final String SCHEMA_RESOURCE = "/catalog-schema.json";

    /** Shared mapper, configured once. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private CatalogIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a catalog from a JSON file.
     *
     * @throws IOException                 if the file cannot be read or bound
     * @throws CatalogValidationException  if the JSON violates the catalog schema
     * @throws CatalogVersionException     if the schema version is not supported
     */
    public static AppCatalog read(Path path) throws IOException {
        log.debug("Reading catalog from: {}", path);
        return parse(Files.readString(path), path.toString());
    }

    /**
     * Reads a catalog bundled on the classpath, e.g. {@code catalogs/instagram.json}.
     *
     * @throws IOException if the resource is missing or cannot be bound
     */
    public static AppCatalog readResource(String resource) throws IOException {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream is = CatalogIO.class.getClassLoader().getResourceAsStream(name)) {
            if (is == null) {
                throw new IOException("Classpath resource not found: " + name);
            }
            return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + name);
        }
    }

    /** Validated parse of a catalog held in memory. */
    public static AppCatalog fromJson(String json) throws IOException {
        return parse(json, "<string>");
    }

    public static void write(AppCatalog catalog, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writeValue(path.toFile(), catalog);
        log.info("Wrote catalog '{}' to {}", catalog.getAppId(), path);
    }

    public static String toJson(Object value) throws IOException {
        return MAPPER.writeValueAsString(value);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Internals ─────────────────────────────────────────────────────────

    private static AppCatalog parse(String json, String source) throws IOException {
        validateSchema(json, source);
        AppCatalog catalog = MAPPER.readValue(json, AppCatalog.class);
        if (!catalog.isVersionSupported()) {
            throw new CatalogVersionException(
                    "Unsupported catalog schema version in " + source + ": " + catalog.getSchemaVersion()
                    + " (expected: " + AppCatalog.CURRENT_SCHEMA_VERSION + ")");
        }
        log.info("Loaded catalog '{}' from {}: {} signature(s), {} source screen(s)",
                catalog.getAppId(), source, catalog.getSignatures().size(), catalog.getGraph().size());
        return catalog;
    }

    private static void validateSchema(String json, String source) throws IOException {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("catalog-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Catalog validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new CatalogValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (CatalogIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = CatalogIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class CatalogVersionException extends RuntimeException {
        public CatalogVersionException(String msg) { super(msg); }
    }

    public static class CatalogValidationException extends RuntimeException {
        public CatalogValidationException(String msg) { super(msg); }
    }
}
