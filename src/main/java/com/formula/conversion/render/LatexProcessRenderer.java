package com.formula.conversion.render;

import com.formula.conversion.api.ConversionOptions;
import com.formula.conversion.api.ImageFormat;
import com.formula.conversion.core.model.ImagePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Renders LaTeX documents by running {@code latex} followed by {@code dvisvgm}
 * (SVG) or {@code dvipng} (PNG) as external processes.
 *
 * <p>All intermediate files are created next to the output base path and
 * removed afterwards unless {@link ConversionOptions#isKeepLatexSource()} is set.
 * Each process is killed if it runs longer than the configured render timeout.</p>
 */
public class LatexProcessRenderer implements Renderer {
    private static final Logger log = LoggerFactory.getLogger(LatexProcessRenderer.class);

    static final int DEFAULT_DPI = 100;

    private final ConversionOptions options;
    private final String latexCommand;
    private final String dvisvgmCommand;
    private final String dvipngCommand;

    public LatexProcessRenderer(ConversionOptions options) {
        this(options, "latex", "dvisvgm", "dvipng");
    }

    /**
     * Creates a renderer using explicit executables, e.g. absolute paths of a TeX distribution.
     */
    public LatexProcessRenderer(ConversionOptions options, String latexCommand,
                                String dvisvgmCommand, String dvipngCommand) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.latexCommand = Objects.requireNonNull(latexCommand, "latexCommand is required");
        this.dvisvgmCommand = Objects.requireNonNull(dvisvgmCommand, "dvisvgmCommand is required");
        this.dvipngCommand = Objects.requireNonNull(dvipngCommand, "dvipngCommand is required");
    }

    @Override
    public RenderResult render(String documentSource, Path outputBasePath) throws RenderException {
        Path directory = outputBasePath.toAbsolutePath().getParent();
        String baseName = outputBasePath.getFileName().toString();
        Path texFile = directory.resolve(baseName + ".tex");
        Path dviFile = directory.resolve(baseName + ".dvi");
        Path logFile = directory.resolve(baseName + ".log");
        Path auxFile = directory.resolve(baseName + ".aux");
        Path toolOutput = directory.resolve(baseName + ".out");
        ImageFormat format = options.getImageFormat();
        Path imageFile = directory.resolve(baseName + "." + format.extension());

        boolean succeeded = false;
        try {
            Charset encoding = options.getEncoding().orElse(StandardCharsets.UTF_8);
            Files.createDirectories(directory);
            Files.writeString(texFile, documentSource, encoding);

            int latexExit = run(List.of(latexCommand, "-interaction=nonstopmode", "-halt-on-error",
                    texFile.getFileName().toString()), directory, toolOutput);
            String latexLog = readIfExists(logFile, encoding);
            if (latexExit != 0 || !Files.exists(dviFile)) {
                String diagnostic = LatexLogParser.extractError(latexLog);
                throw new RenderException(diagnostic.isEmpty()
                        ? "latex exited with status " + latexExit : diagnostic);
            }

            ImagePosition position = format == ImageFormat.SVG
                    ? convertToSvg(dviFile, imageFile, latexLog, directory, toolOutput)
                    : convertToPng(dviFile, imageFile, directory, toolOutput);
            succeeded = true;
            log.debug("render.completed image={} height={} width={} depth={}",
                    imageFile, position.height(), position.width(), position.depth());
            return new RenderResult(position, imageFile);
        } catch (IOException e) {
            throw new RenderException("cannot run the LaTeX toolchain: " + e.getMessage(), e);
        } finally {
            deleteQuietly(dviFile);
            deleteQuietly(logFile);
            deleteQuietly(auxFile);
            deleteQuietly(toolOutput);
            if (!options.isKeepLatexSource()) {
                deleteQuietly(texFile);
            }
            if (!succeeded) {
                deleteQuietly(imageFile);
            }
        }
    }

    private ImagePosition convertToSvg(Path dviFile, Path imageFile, String latexLog, Path directory,
                                       Path toolOutput) throws IOException, RenderException {
        int exit = run(List.of(dvisvgmCommand, "--no-fonts", "--page=1",
                "--output=" + imageFile.getFileName(), dviFile.getFileName().toString()), directory, toolOutput);
        if (exit != 0 || !Files.exists(imageFile)) {
            throw new RenderException("dvisvgm failed: " + readIfExists(toolOutput, StandardCharsets.UTF_8).strip());
        }
        return DimensionParser.fromPreviewLog(latexLog)
                .orElseThrow(() -> new RenderException("could not read formula dimensions from the LaTeX log"));
    }

    private ImagePosition convertToPng(Path dviFile, Path imageFile, Path directory, Path toolOutput)
            throws IOException, RenderException {
        List<String> command = new ArrayList<>(List.of(dvipngCommand, "-q*",
                "-D", String.valueOf(options.getDpi().orElse(DEFAULT_DPI))));
        if (options.getBackgroundColor().isEmpty()) {
            command.add("-bg");
            command.add("Transparent");
        }
        command.addAll(List.of("--height*", "--depth*", "--width*",
                "-o", imageFile.getFileName().toString(), dviFile.getFileName().toString()));
        int exit = run(command, directory, toolOutput);
        String output = readIfExists(toolOutput, StandardCharsets.UTF_8);
        if (exit != 0 || !Files.exists(imageFile)) {
            throw new RenderException("dvipng failed: " + output.strip());
        }
        return DimensionParser.fromDvipngOutput(output)
                .orElseThrow(() -> new RenderException("could not parse dvipng output: " + output.strip()));
    }

    private int run(List<String> command, Path directory, Path output) throws IOException, RenderException {
        log.debug("render.process command={} directory={}", command, directory);
        Process process = new ProcessBuilder(command)
                .directory(directory.toFile())
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
        try {
            if (!process.waitFor(options.getRenderTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RenderException(command.get(0) + " did not finish within "
                        + options.getRenderTimeout().toSeconds() + "s");
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RenderException(command.get(0) + " was interrupted", e);
        }
    }

    private static String readIfExists(Path file, Charset encoding) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        // TeX logs may mix encodings; decode leniently
        return new String(Files.readAllBytes(file), encoding);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("render.cleanup.failed path={} error={}", file, e.getMessage());
        }
    }
}
