package dev.contentagents.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.contentagents.model.InputRecord;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads product records from JSON. A dataset file is either {@code {"products": [...]}}
 * or a single product object.
 */
public final class DatasetLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SAMPLE_RESOURCE = "/sample-product.json";

    private DatasetLoader() {}

    /**
     * Load the product at {@code index} from a dataset file.
     */
    public static InputRecord load(Path path, int index) throws IOException {
        return select(loadAll(path), index);
    }

    public static List<InputRecord> loadAll(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "Dataset file not found");
        }
        return parseProducts(MAPPER.readTree(path.toFile()));
    }

    public static List<InputRecord> loadFromString(String json) throws IOException {
        return parseProducts(MAPPER.readTree(json));
    }

    /**
     * The bundled sample product, used when no dataset is given.
     */
    public static InputRecord loadSample() throws IOException {
        try (InputStream in = DatasetLoader.class.getResourceAsStream(SAMPLE_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + SAMPLE_RESOURCE);
            }
            return select(parseProducts(MAPPER.readTree(in)), 0);
        }
    }

    public static InputRecord select(List<InputRecord> products, int index) {
        if (index < 0 || index >= products.size()) {
            throw new IllegalArgumentException("Product index %d out of bounds. Dataset has %d product(s)."
                .formatted(index, products.size()));
        }
        return products.get(index);
    }

    private static List<InputRecord> parseProducts(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Dataset must be a JSON object");
        }
        if (!root.has("products")) {
            if (root.isEmpty()) {
                throw new IllegalArgumentException("Dataset missing 'products' key");
            }
            return List.of(new InputRecord((ObjectNode) root));
        }
        JsonNode products = root.get("products");
        if (!products.isArray()) {
            throw new IllegalArgumentException("Dataset 'products' must be a list");
        }
        if (products.isEmpty()) {
            throw new IllegalArgumentException("Dataset 'products' list is empty");
        }
        var records = new ArrayList<InputRecord>();
        for (int i = 0; i < products.size(); i++) {
            JsonNode product = products.get(i);
            if (!product.isObject()) {
                throw new IllegalArgumentException("Dataset product " + i + " is not an object");
            }
            records.add(new InputRecord((ObjectNode) product));
        }
        return records;
    }
}
