package com.formula.conversion.api;

import com.formula.conversion.cache.CachePolicy;

import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Options for converting formulas to images.
 * Covers typesetting (font size, colours, preamble), image output and scheduling.
 */
public class ConversionOptions {

    private static final int DEFAULT_FONT_SIZE = 12;
    private static final Duration DEFAULT_RENDER_TIMEOUT = Duration.ofSeconds(20);
    private static final double WORKERS_PER_PROCESSOR = 2.5;

    private static final Pattern HEX_COLOR = Pattern.compile("[0-9A-Fa-f]{6}");
    private static final Pattern NAMED_COLOR = Pattern.compile("[A-Za-z]+");

    private final ImageFormat imageFormat;
    private final Integer dpi;
    private final int fontSize;
    private final String backgroundColor;
    private final String foregroundColor;
    private final String preamble;
    private final String mathsEnvironment;
    private final boolean keepLatexSource;
    private final Charset encoding;
    private final String imageDirectory;
    private final CachePolicy cachePolicy;
    private final int workerCount;
    private final Duration renderTimeout;

    private ConversionOptions(Builder builder) {
        this.imageFormat = builder.imageFormat;
        this.dpi = builder.dpi;
        this.fontSize = builder.fontSize;
        this.backgroundColor = builder.backgroundColor;
        this.foregroundColor = builder.foregroundColor;
        this.preamble = builder.preamble;
        this.mathsEnvironment = builder.mathsEnvironment;
        this.keepLatexSource = builder.keepLatexSource;
        this.encoding = builder.encoding;
        this.imageDirectory = builder.imageDirectory;
        this.cachePolicy = builder.cachePolicy;
        this.workerCount = builder.workerCount;
        this.renderTimeout = builder.renderTimeout;
    }

    public ImageFormat getImageFormat() {
        return imageFormat;
    }

    /**
     * Resolution for PNG output; empty when the renderer default applies.
     */
    public Optional<Integer> getDpi() {
        return Optional.ofNullable(dpi);
    }

    public int getFontSize() {
        return fontSize;
    }

    /**
     * Background colour as {@code RRGGBB} hex or dvips colour name; empty means transparent.
     */
    public Optional<String> getBackgroundColor() {
        return Optional.ofNullable(backgroundColor);
    }

    /**
     * Foreground colour as {@code RRGGBB} hex or dvips colour name; empty means black.
     */
    public Optional<String> getForegroundColor() {
        return Optional.ofNullable(foregroundColor);
    }

    public String getPreamble() {
        return preamble;
    }

    /**
     * Maths environment such as {@code flalign*} used instead of {@code \( \)} and {@code \[ \]}.
     */
    public Optional<String> getMathsEnvironment() {
        return Optional.ofNullable(mathsEnvironment);
    }

    public boolean isKeepLatexSource() {
        return keepLatexSource;
    }

    /**
     * Encoding of formula text; required when formulas contain non-ASCII characters.
     */
    public Optional<Charset> getEncoding() {
        return Optional.ofNullable(encoding);
    }

    /**
     * Image directory relative to the output document; empty for the document's own directory.
     */
    public String getImageDirectory() {
        return imageDirectory;
    }

    public CachePolicy getCachePolicy() {
        return cachePolicy;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getRenderTimeout() {
        return renderTimeout;
    }

    /**
     * Number of workers used when none is configured: 2.5 per available processor,
     * since workers mostly wait for external processes.
     */
    public static int defaultWorkerCount() {
        return Math.max(1, (int) Math.round(Runtime.getRuntime().availableProcessors() * WORKERS_PER_PROCESSOR));
    }

    /**
     * Creates default options: SVG output, 12pt, no colours, cache errors are fatal.
     */
    public static ConversionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with these options.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.imageFormat = imageFormat;
        builder.dpi = dpi;
        builder.fontSize = fontSize;
        builder.backgroundColor = backgroundColor;
        builder.foregroundColor = foregroundColor;
        builder.preamble = preamble;
        builder.mathsEnvironment = mathsEnvironment;
        builder.keepLatexSource = keepLatexSource;
        builder.encoding = encoding;
        builder.imageDirectory = imageDirectory;
        builder.cachePolicy = cachePolicy;
        builder.workerCount = workerCount;
        builder.renderTimeout = renderTimeout;
        return builder;
    }

    public static class Builder {
        private ImageFormat imageFormat = ImageFormat.SVG;
        private Integer dpi;
        private int fontSize = DEFAULT_FONT_SIZE;
        private String backgroundColor;
        private String foregroundColor;
        private String preamble = "";
        private String mathsEnvironment;
        private boolean keepLatexSource = false;
        private Charset encoding;
        private String imageDirectory = "";
        private CachePolicy cachePolicy = CachePolicy.FAIL;
        private int workerCount = defaultWorkerCount();
        private Duration renderTimeout = DEFAULT_RENDER_TIMEOUT;

        public Builder imageFormat(ImageFormat imageFormat) {
            this.imageFormat = Objects.requireNonNull(imageFormat, "imageFormat is required");
            return this;
        }

        public Builder dpi(int dpi) {
            if (dpi <= 0) {
                throw new IllegalArgumentException("dpi must be positive");
            }
            this.dpi = dpi;
            return this;
        }

        public Builder fontSize(int fontSize) {
            if (fontSize <= 0) {
                throw new IllegalArgumentException("fontSize must be positive");
            }
            this.fontSize = fontSize;
            return this;
        }

        public Builder backgroundColor(String backgroundColor) {
            this.backgroundColor = validateColor(backgroundColor, "backgroundColor");
            return this;
        }

        public Builder foregroundColor(String foregroundColor) {
            this.foregroundColor = validateColor(foregroundColor, "foregroundColor");
            return this;
        }

        public Builder preamble(String preamble) {
            this.preamble = preamble != null ? preamble : "";
            return this;
        }

        public Builder mathsEnvironment(String mathsEnvironment) {
            this.mathsEnvironment = mathsEnvironment == null || mathsEnvironment.isBlank()
                    ? null : mathsEnvironment.strip();
            return this;
        }

        public Builder keepLatexSource(boolean keepLatexSource) {
            this.keepLatexSource = keepLatexSource;
            return this;
        }

        public Builder encoding(Charset encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder imageDirectory(String imageDirectory) {
            String directory = imageDirectory == null ? "" : imageDirectory.strip().replace('\\', '/');
            if (directory.equals(".")) {
                directory = "";
            }
            if (directory.startsWith("/")) {
                throw new IllegalArgumentException("imageDirectory must be relative to the output document");
            }
            while (directory.endsWith("/")) {
                directory = directory.substring(0, directory.length() - 1);
            }
            this.imageDirectory = directory;
            return this;
        }

        public Builder cachePolicy(CachePolicy cachePolicy) {
            this.cachePolicy = Objects.requireNonNull(cachePolicy, "cachePolicy is required");
            return this;
        }

        public Builder workerCount(int workerCount) {
            if (workerCount <= 0) {
                throw new IllegalArgumentException("workerCount must be positive");
            }
            this.workerCount = workerCount;
            return this;
        }

        public Builder renderTimeout(Duration renderTimeout) {
            Objects.requireNonNull(renderTimeout, "renderTimeout is required");
            if (renderTimeout.isZero() || renderTimeout.isNegative()) {
                throw new IllegalArgumentException("renderTimeout must be positive");
            }
            this.renderTimeout = renderTimeout;
            return this;
        }

        public ConversionOptions build() {
            if (dpi != null && imageFormat != ImageFormat.PNG) {
                throw new IllegalArgumentException(
                        "dpi can only be set for PNG output; use fontSize to scale SVG images");
            }
            return new ConversionOptions(this);
        }

        private static String validateColor(String color, String name) {
            if (color == null || color.isBlank()) {
                return null;
            }
            String value = color.strip();
            if (!HEX_COLOR.matcher(value).matches() && !NAMED_COLOR.matcher(value).matches()) {
                throw new IllegalArgumentException(name + " must be a RRGGBB hex value or a colour name, got '"
                        + color + "'");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "ConversionOptions{" +
                "imageFormat=" + imageFormat +
                ", dpi=" + dpi +
                ", fontSize=" + fontSize +
                ", backgroundColor=" + backgroundColor +
                ", foregroundColor=" + foregroundColor +
                ", mathsEnvironment=" + mathsEnvironment +
                ", keepLatexSource=" + keepLatexSource +
                ", encoding=" + encoding +
                ", imageDirectory='" + imageDirectory + '\'' +
                ", cachePolicy=" + cachePolicy +
                ", workerCount=" + workerCount +
                ", renderTimeout=" + renderTimeout +
                '}';
    }
}
