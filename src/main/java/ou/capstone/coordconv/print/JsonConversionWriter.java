package ou.capstone.coordconv.print;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ou.capstone.coordconv.exceptions.CoordinateException;

/**
 * Renders a {@link ConversionView} as JSON:
 * <pre>
 * {
 *   "input" : "...",
 *   "detected" : "Decimal Degrees",
 *   "longitude" : -27.1234567,
 *   "latitude" : 109.2345678,
 *   "formats" : [ { "index" : 0, "name" : "...", "value" : "...", "detected" : true }, ... ]
 * }
 * </pre>
 */
public class JsonConversionWriter {
    private final ObjectMapper objectMapper;

    public JsonConversionWriter() {
        this.objectMapper = new ObjectMapper();
    }

    public ObjectNode toTree(final ConversionView view) {
        final ObjectNode root = objectMapper.createObjectNode();
        root.put("input", view.input());
        root.put("detected", view.detectedFormat());
        root.put("longitude", view.coordinate().getLongitude());
        root.put("latitude", view.coordinate().getLatitude());

        final ArrayNode formats = root.putArray("formats");
        for (final ConversionView.Entry entry : view.entries()) {
            final ObjectNode node = formats.addObject();
            node.put("index", entry.index());
            node.put("name", entry.formatName());
            node.put("value", entry.value());
            node.put("detected", entry.detected());
        }
        return root;
    }

    /**
     * @throws CoordinateException if Jackson fails to serialize the tree
     */
    public String write(final ConversionView view) throws CoordinateException {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(view));
        } catch (final JsonProcessingException e) {
            throw new CoordinateException("Failed to render conversion as JSON", e);
        }
    }
}
