package com.formula.conversion.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.formula.conversion.core.model.CacheEntry;
import com.formula.conversion.core.model.ImagePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Persistent mapping from normalized formula and maths style to the image
 * produced for it, so that formulas are converted once across runs.
 *
 * <p>The cache is stored as a single JSON document next to the images:</p>
 * <pre>
 * {
 *   "formula_cache_version": "3.0",
 *   "formulas": {
 *     "\\frac{1}{2}": {
 *       "inline":  {"path": "img/eqn000.svg", "pos": {"height": 18.0, "width": 9.0, "depth": 6.0}},
 *       "display": {"path": "img/eqn001.svg", "pos": {"height": 27.0, "width": 11.0, "depth": 9.0}}
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>Image paths are relative to a base directory, normally the directory of the
 * output document. Lookups drop entries whose image no longer exists on disk.
 * All operations are synchronized; the conversion scheduler only mutates the cache
 * from its coordinating thread.</p>
 */
public class ImageCache {
    private static final Logger log = LoggerFactory.getLogger(ImageCache.class);

    /** File name of the persisted cache inside the image directory. */
    public static final String CACHE_FILE_NAME = "formula-images.cache";
    /** Format version; documents with any other version are rejected. */
    public static final String CACHE_VERSION = "3.0";
    /** Top-level field holding the format version. */
    public static final String VERSION_FIELD = "formula_cache_version";
    /** Top-level object holding the entries, keyed by normalized formula. */
    public static final String FORMULAS_FIELD = "formulas";
    /** Naming convention of generated images, removed when a cache is discarded. */
    public static final Pattern IMAGE_FILE_PATTERN = Pattern.compile("eqn\\d+\\.[A-Za-z]+");

    static final String INLINE = "inline";
    static final String DISPLAY = "display";

    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z]:.*");

    private final Path cacheFile;
    private final Path baseDirectory;
    private final ObjectMapper objectMapper;
    private final Map<CacheKey, CacheEntry> entries = new LinkedHashMap<>();
    private final String version;

    private ImageCache(Path cacheFile, Path baseDirectory, ObjectMapper objectMapper) {
        this.cacheFile = cacheFile;
        this.baseDirectory = baseDirectory;
        this.objectMapper = objectMapper;
        this.version = CACHE_VERSION;
    }

    /**
     * Opens the cache stored in the given file; image paths are resolved against the file's directory.
     *
     * @see #open(Path, Path, CachePolicy)
     */
    public static ImageCache open(Path cacheFile, CachePolicy policy) throws CacheFormatException {
        Path parent = cacheFile.toAbsolutePath().getParent();
        return open(cacheFile, parent, policy);
    }

    /**
     * Opens a cache, reading the existing document if there is one.
     *
     * @param cacheFile     location of the persisted cache
     * @param baseDirectory directory that cached image paths are relative to
     * @param policy        how to react to an unreadable or incompatible document
     * @throws CacheFormatException if the document is unusable and the policy is {@link CachePolicy#FAIL}
     */
    public static ImageCache open(Path cacheFile, Path baseDirectory, CachePolicy policy)
            throws CacheFormatException {
        Objects.requireNonNull(cacheFile, "cacheFile is required");
        Objects.requireNonNull(baseDirectory, "baseDirectory is required");
        Objects.requireNonNull(policy, "policy is required");

        ImageCache cache = new ImageCache(cacheFile, baseDirectory, new ObjectMapper());
        if (!Files.exists(cacheFile)) {
            log.debug("cache.created path={}", cacheFile);
            return cache;
        }
        try {
            cache.read();
            log.info("cache.opened path={} entries={}", cacheFile, cache.size());
        } catch (CacheFormatException e) {
            if (policy == CachePolicy.FAIL) {
                throw e;
            }
            log.warn("cache.discarded path={} reason={}", cacheFile, e.getMessage());
            cache.entries.clear();
            discard(cacheFile);
        }
        return cache;
    }

    /**
     * Checks whether the formula is cached and its image still exists.
     * A stale entry is removed as a side effect.
     */
    public synchronized boolean contains(String formula, boolean displayMath) {
        return lookup(CacheKey.of(formula, displayMath)).isPresent();
    }

    /**
     * Returns the cached entry for the formula, or empty if it is absent or its image is gone.
     */
    public synchronized Optional<CacheEntry> get(String formula, boolean displayMath) {
        return lookup(CacheKey.of(formula, displayMath));
    }

    /**
     * Stores an entry, replacing any previous one for the same formula and style.
     * Backslashes in the image path are replaced by forward slashes.
     *
     * @throws InvalidEntryException if the formula is blank, the position is missing,
     *                               or the path is empty or absolute
     */
    public synchronized void put(String formula, boolean displayMath, CacheEntry entry) {
        if (formula == null || formula.isBlank()) {
            throw new InvalidEntryException("formula must not be empty");
        }
        if (entry == null || entry.position() == null) {
            throw new InvalidEntryException("position of formula '" + formula + "' must not be empty");
        }
        String path = entry.outputPath();
        if (path == null || path.isBlank()) {
            throw new InvalidEntryException("image path of formula '" + formula + "' must not be empty");
        }
        if (isAbsolute(path)) {
            throw new InvalidEntryException("image path must be relative to the base directory, got " + path);
        }
        CacheKey key = CacheKey.of(formula, displayMath);
        entries.put(key, new CacheEntry(path.replace('\\', '/'), entry.position()));
        log.debug("cache.put formula='{}' display={} path={}", key.normalizedFormula(), displayMath, path);
    }

    /**
     * Removes a formula and deletes its image, if present.
     *
     * @throws FormulaNotFoundException if the formula is not cached
     */
    public synchronized void remove(String formula, boolean displayMath) {
        CacheKey key = CacheKey.of(formula, displayMath);
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            throw new FormulaNotFoundException(key);
        }
        deleteQuietly(baseDirectory.resolve(removed.outputPath()));
    }

    /**
     * Writes the cache to disk. The document is written to a temporary file and
     * moved into place, so readers never see a partial document. An empty cache
     * that was never written before is not persisted.
     *
     * @throws UncheckedIOException if the document cannot be written
     */
    public synchronized void persist() {
        if (entries.isEmpty() && !Files.exists(cacheFile)) {
            return;
        }
        try {
            Path directory = cacheFile.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            Path temporary = Files.createTempFile(directory, CACHE_FILE_NAME, ".tmp");
            try {
                objectMapper.writeValue(temporary.toFile(), toDocument());
                moveIntoPlace(temporary);
            } finally {
                Files.deleteIfExists(temporary);
            }
            log.debug("cache.persisted path={} entries={}", cacheFile, entries.size());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write cache to " + cacheFile, e);
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public String getVersion() {
        return version;
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    private Optional<CacheEntry> lookup(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!Files.exists(baseDirectory.resolve(entry.outputPath()))) {
            entries.remove(key);
            log.warn("cache.stale formula='{}' missingImage={}", key.normalizedFormula(), entry.outputPath());
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private void read() throws CacheFormatException {
        JsonNode root;
        try {
            root = objectMapper.readTree(cacheFile.toFile());
        } catch (JsonProcessingException e) {
            throw new CacheFormatException(cacheFile, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CacheFormatException(cacheFile, String.valueOf(e.getMessage()), e);
        }
        if (root == null || !root.isObject()) {
            throw new CacheFormatException(cacheFile, "decoded JSON is not an object");
        }
        JsonNode versionNode = root.get(VERSION_FIELD);
        if (versionNode == null || !versionNode.isTextual()) {
            throw new CacheFormatException(cacheFile, "no format version found");
        }
        if (!CACHE_VERSION.equals(versionNode.asText())) {
            throw new CacheFormatException(cacheFile, "cache has version " + versionNode.asText()
                    + ", expected " + CACHE_VERSION);
        }

        JsonNode formulas = root.get(FORMULAS_FIELD);
        if (formulas == null) {
            return;
        }
        if (!formulas.isObject()) {
            throw new CacheFormatException(cacheFile, "field " + FORMULAS_FIELD + " is not an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = formulas.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode styles = field.getValue();
            if (!styles.isObject()) {
                throw new CacheFormatException(cacheFile, "entry for formula '" + field.getKey()
                        + "' is not an object");
            }
            readStyle(field.getKey(), styles, INLINE, false);
            readStyle(field.getKey(), styles, DISPLAY, true);
        }
    }

    private void readStyle(String formula, JsonNode styles, String style, boolean displayMath)
            throws CacheFormatException {
        JsonNode node = styles.get(style);
        if (node == null) {
            return;
        }
        JsonNode path = node.get("path");
        JsonNode pos = node.get("pos");
        if (path == null || !path.isTextual() || pos == null || !pos.isObject()
                || !pos.path("height").isNumber() || !pos.path("width").isNumber()
                || !pos.path("depth").isNumber()) {
            throw new CacheFormatException(cacheFile, "malformed " + style + " entry for formula '"
                    + formula + "'");
        }
        ImagePosition position = ImagePosition.of(pos.get("height").asDouble(),
                pos.get("width").asDouble(), pos.get("depth").asDouble());
        entries.put(new CacheKey(formula, displayMath), new CacheEntry(path.asText(), position));
    }

    private ObjectNode toDocument() {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(VERSION_FIELD, version);
        ObjectNode formulas = root.putObject(FORMULAS_FIELD);
        for (Map.Entry<CacheKey, CacheEntry> entry : entries.entrySet()) {
            CacheKey key = entry.getKey();
            ObjectNode styles = formulas.has(key.normalizedFormula())
                    ? (ObjectNode) formulas.get(key.normalizedFormula())
                    : formulas.putObject(key.normalizedFormula());
            ObjectNode node = styles.putObject(key.displayMath() ? DISPLAY : INLINE);
            node.put("path", entry.getValue().outputPath());
            ImagePosition position = entry.getValue().position();
            node.putObject("pos")
                    .put("height", position.height())
                    .put("width", position.width())
                    .put("depth", position.depth());
        }
        return root;
    }

    private void moveIntoPlace(Path temporary) throws IOException {
        try {
            Files.move(temporary, cacheFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temporary, cacheFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isAbsolute(String path) {
        return path.startsWith("/") || path.startsWith("\\") || WINDOWS_DRIVE.matcher(path).matches();
    }

    private static void discard(Path cacheFile) {
        deleteQuietly(cacheFile);
        Path directory = cacheFile.toAbsolutePath().getParent();
        try (DirectoryStream<Path> images = Files.newDirectoryStream(directory,
                file -> IMAGE_FILE_PATTERN.matcher(file.getFileName().toString()).matches())) {
            for (Path image : images) {
                deleteQuietly(image);
            }
        } catch (IOException e) {
            log.warn("cache.discard.listFailed directory={} error={}", directory, e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("cache.delete.failed path={} error={}", file, e.getMessage());
        }
    }
}
