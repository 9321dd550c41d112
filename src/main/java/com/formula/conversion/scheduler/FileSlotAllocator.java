package com.formula.conversion.scheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Hands out image file names {@code eqnNNN.ext} that neither exist on disk nor
 * were handed out earlier in the same batch. Not thread-safe; used by the
 * coordinating thread before any worker starts.
 */
public class FileSlotAllocator {

    static final String FILE_NAME_FORMAT = "eqn%03d.%s";

    private final Path baseDirectory;
    private final String imageDirectory;
    private final String extension;
    private final Set<String> claimed = new HashSet<>();
    private int next = 0;

    /**
     * @param baseDirectory  directory the returned paths are relative to
     * @param imageDirectory image directory relative to the base directory, empty for the base itself
     * @param extension      image file extension without the dot
     */
    public FileSlotAllocator(Path baseDirectory, String imageDirectory, String extension) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory is required");
        this.imageDirectory = imageDirectory == null ? "" : imageDirectory;
        this.extension = Objects.requireNonNull(extension, "extension is required");
    }

    /**
     * Returns the next free image path, relative to the base directory and with '/' separators.
     */
    public String allocate() {
        String candidate = pathFor(next);
        while (claimed.contains(candidate) || Files.exists(baseDirectory.resolve(candidate))) {
            next++;
            candidate = pathFor(next);
        }
        claimed.add(candidate);
        next++;
        return candidate;
    }

    private String pathFor(int index) {
        String fileName = String.format(FILE_NAME_FORMAT, index, extension);
        return imageDirectory.isEmpty() ? fileName : imageDirectory + "/" + fileName;
    }
}
