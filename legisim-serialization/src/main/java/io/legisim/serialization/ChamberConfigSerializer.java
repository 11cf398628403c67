package io.legisim.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.legisim.core.exception.InvalidChamberConfigException;
import io.legisim.core.session.ChamberConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/// Utility class for reading and writing chamber configurations as JSON.
///
/// A document may be partial: every property it leaves out keeps the value of
/// {@link ChamberConfig#defaults()}, including single fields of the nested party
/// profiles.
///
/// ### Usage
/// {@snippet :
/// String json = ChamberConfigSerializer.toJson(ChamberConfig.defaults());
///
/// // Only the distance differs from the defaults
/// ChamberConfig config = ChamberConfigSerializer.fromJson("{\"distanceBetweenMedians\": 1.5}");
/// }
///
/// ### Document shape
/// {@snippet lang="json" :
/// {
///   "seats": 101,
///   "majorityPartySize": 51,
///   "distanceBetweenMedians": 1.0,
///   "majority": { "sigma": 0.1, "error": 0.02, "adjustment": 0.01 },
///   "minority": { "sigma": 0.1, "error": 0.02, "adjustment": 0.01 },
///   "baseSeed": 0,
///   "maxRounds": 10000,
///   "clippingRule": "LEGACY",
///   "proposerPolicy": "PERSISTENT"
/// }
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`.
public final class ChamberConfigSerializer {

    private ChamberConfigSerializer() {}

    /// Serializes a configuration to pretty-printed JSON.
    ///
    /// @param config the configuration to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ChamberConfig config) {
        try {
            return createMapper().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize chamber config: " + e.getMessage(), e);
        }
    }

    /// Deserializes a configuration, filling absent properties from the defaults.
    ///
    /// @param json JSON object, not null
    /// @return the configuration, never null
    /// @throws InvalidChamberConfigException if a value fails validation
    /// @throws IllegalArgumentException if the document cannot be parsed
    public static ChamberConfig fromJson(String json) {
        ObjectMapper mapper = createMapper();
        try {
            JsonNode document = mapper.readTree(json);
            if (document == null || !document.isObject()) {
                throw new IllegalArgumentException("Chamber config must be a JSON object");
            }
            ObjectNode merged = mapper.valueToTree(ChamberConfig.defaults());
            overlay(merged, (ObjectNode) document);
            return mapper.treeToValue(merged, ChamberConfig.class);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof InvalidChamberConfigException invalid) {
                throw invalid;
            }
            throw new IllegalArgumentException(
                    "Failed to deserialize chamber config: " + e.getOriginalMessage(), e);
        }
    }

    /// Reads a configuration file.
    ///
    /// @param file path to a JSON document, not null
    /// @return the configuration, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if the content is not a valid configuration
    public static ChamberConfig fromFile(Path file) throws IOException {
        return fromJson(Files.readString(file));
    }

    /// Creates an ObjectMapper configured for chamber configurations.
    ///
    /// Registers:
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Case-insensitive enum names, so `"symmetric"` reads as `SYMMETRIC`
    /// - Indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    private static void overlay(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode nested && field.getValue().isObject()) {
                overlay(nested, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
