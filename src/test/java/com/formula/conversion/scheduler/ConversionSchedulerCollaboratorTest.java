package com.formula.conversion.scheduler;

import com.formula.conversion.api.ConversionOptions;
import com.formula.conversion.cache.CachePolicy;
import com.formula.conversion.cache.ImageCache;
import com.formula.conversion.core.model.CacheEntry;
import com.formula.conversion.core.model.FormulaRecord;
import com.formula.conversion.core.model.ImagePosition;
import com.formula.conversion.metrics.MetricsService;
import com.formula.conversion.render.DocumentBuilder;
import com.formula.conversion.render.RenderException;
import com.formula.conversion.render.RenderResult;
import com.formula.conversion.render.Renderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversionSchedulerCollaboratorTest {

    @Mock
    private Renderer renderer;

    @Mock
    private DocumentBuilder documentBuilder;

    @Mock
    private MetricsService metrics;

    @TempDir
    Path base;

    private ImageCache cache;
    private ConversionOptions options;
    private ConversionScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        cache = ImageCache.open(base.resolve("img").resolve(ImageCache.CACHE_FILE_NAME), base, CachePolicy.FAIL);
        options = ConversionOptions.builder().imageDirectory("img").workerCount(2).build();
        scheduler = ConversionScheduler.builder()
                .cache(cache)
                .renderer(renderer)
                .documentBuilder(documentBuilder)
                .options(options)
                .baseDirectory(base)
                .metrics(metrics)
                .build();
    }

    private static RenderResult writeImage(Path outputBasePath) throws Exception {
        Path image = outputBasePath.resolveSibling(outputBasePath.getFileName() + ".svg");
        Files.writeString(image, "<svg/>");
        return new RenderResult(ImagePosition.of(10, 20, 2), image);
    }

    @Test
    @DisplayName("Renderer receives the built document and the extensionless slot path")
    void passesDocumentAndSlot() throws Exception {
        when(documentBuilder.build("\\sum_i", true, options)).thenReturn("document");
        when(renderer.render(eq("document"), any(Path.class)))
                .thenAnswer(invocation -> writeImage(invocation.getArgument(1)));

        scheduler.convertAll(List.of(FormulaRecord.display("\\sum_i")));

        verify(renderer).render("document", base.resolve("img/eqn000"));
        verify(metrics).recordBatchSize(1);
        verify(metrics).recordCacheMiss();
        verify(metrics).incrementConversionSucceeded();
        verify(metrics, never()).incrementConversionFailed();
        assertEquals("img/eqn000.svg", scheduler.getResult("\\sum_i", true).orElseThrow().outputPath());
    }

    @Test
    @DisplayName("Equivalent formulas reach the renderer once")
    void rendersOncePerKey() throws Exception {
        when(documentBuilder.build(anyString(), eq(false), eq(options))).thenReturn("document");
        when(renderer.render(anyString(), any(Path.class)))
                .thenAnswer(invocation -> writeImage(invocation.getArgument(1)));

        BatchSummary summary = scheduler.convertAll(List.of(
                FormulaRecord.inline("a + b"), FormulaRecord.inline("a  + b"), FormulaRecord.inline("\ta + b{}")));

        verify(renderer, times(1)).render(anyString(), any(Path.class));
        verify(documentBuilder, times(1)).build(anyString(), anyBoolean(), any());
        assertEquals(2, summary.duplicates());
    }

    @Test
    @DisplayName("Render failure is counted and reported")
    void renderFailure() throws Exception {
        when(documentBuilder.build("x", false, options)).thenReturn("document");
        when(renderer.render(anyString(), any(Path.class))).thenThrow(new RenderException("! Missing $ inserted."));

        ConversionException e = assertThrows(ConversionException.class,
                () -> scheduler.convertAll(List.of(FormulaRecord.inline("x"))));

        assertEquals("! Missing $ inserted.", e.getDiagnostic());
        verify(metrics).incrementConversionFailed();
        verify(metrics).recordConversionDuration(eq(false), eq(false), any());
        verify(metrics, never()).incrementConversionSucceeded();
    }

    @Test
    @DisplayName("Fully cached batch never touches the renderer")
    void fullyCached() throws Exception {
        Files.createDirectories(base.resolve("img"));
        Files.writeString(base.resolve("img/eqn000.svg"), "<svg/>");
        cache.put("x", false, new CacheEntry("img/eqn000.svg", ImagePosition.of(1, 1, 0)));

        BatchSummary summary = scheduler.convertAll(List.of(FormulaRecord.inline(" x ")));

        assertEquals(new BatchSummary(1, 1, 0, 0), summary);
        verifyNoInteractions(renderer, documentBuilder);
        verify(metrics).recordCacheHit();
    }
}
