package me.golemcore.deck.domain.service;

import me.golemcore.deck.adapter.outbound.pptx.PoiPresentationAssembler;
import me.golemcore.deck.domain.model.ExportResult;
import me.golemcore.deck.domain.model.ProgressEvent;
import me.golemcore.deck.domain.model.ProgressEventType;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import me.golemcore.deck.port.outbound.PresentationAssemblerPort;
import me.golemcore.deck.port.outbound.SlideRendererPort;
import me.golemcore.deck.tools.WorkspacePathResolver;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PresentationExportServiceTest {

    private static final String SLIDE_1 = "slides/slide_1.html";
    private static final String SLIDE_2 = "slides/slide_2.html";
    private static final String SLIDE_3 = "slides/slide_3.html";

    @TempDir
    Path workspace;

    private DeckProperties properties;
    private FakeRenderer renderer;
    private List<ProgressEvent> events;

    @BeforeEach
    void setUp() throws IOException {
        properties = new DeckProperties();
        properties.getWorkspace().setRoot(workspace.toString());
        renderer = new FakeRenderer();
        events = new ArrayList<>();
        Files.createDirectories(workspace.resolve("slides"));
    }

    private void writeSlide(String relative) throws IOException {
        Files.writeString(workspace.resolve(relative), "<html><body>slide</body></html>");
    }

    private PresentationExportService service(PresentationAssemblerPort assembler) {
        return new PresentationExportService(renderer, assembler, new WorkspacePathResolver(workspace), properties);
    }

    // ==================== Happy path ====================

    @Test
    void shouldSkipMissingSlideAndKeepOrder() throws IOException {
        writeSlide(SLIDE_1);
        writeSlide(SLIDE_3);

        ExportResult result = service(new PoiPresentationAssembler(properties))
                .export(List.of(SLIDE_1, SLIDE_2, SLIDE_3), "Quarterly Review", events::add);

        assertTrue(result.hasPresentation());
        Path pptx = Path.of(result.presentationFile());
        assertEquals("Quarterly_Review.pptx", pptx.getFileName().toString());
        assertTrue(Files.isRegularFile(pptx));
        assertEquals(2, result.screenshots().size());
        assertTrue(result.screenshots().get(0).endsWith("slide_1.png"));
        assertTrue(result.screenshots().get(1).endsWith("slide_3.png"));

        try (InputStream in = Files.newInputStream(pptx); XMLSlideShow deck = new XMLSlideShow(in)) {
            assertEquals(2, deck.getSlides().size());
        }
        assertEquals(List.of(workspace.resolve(SLIDE_1), workspace.resolve(SLIDE_3)), renderer.rendered);
    }

    @Test
    void shouldReportRasterizationAndAssemblyProgress() throws IOException {
        writeSlide(SLIDE_1);
        writeSlide(SLIDE_2);

        service(new PoiPresentationAssembler(properties))
                .export(List.of(SLIDE_1, SLIDE_2), "Deck", events::add);

        List<ProgressEventType> types = events.stream().map(ProgressEvent::type).toList();
        assertEquals(List.of(ProgressEventType.RASTERIZATION_PROGRESS, ProgressEventType.RASTERIZATION_PROGRESS,
                ProgressEventType.ASSEMBLY_PROGRESS, ProgressEventType.ASSEMBLY_PROGRESS), types);
        assertEquals(1, events.get(0).payload().get("slide_number"));
        assertEquals(2, events.get(0).payload().get("total_slides"));
        assertEquals("slide_1.png", events.get(0).payload().get("filename"));
    }

    @Test
    void shouldSkipSlideThatFailsToRender() throws IOException {
        writeSlide(SLIDE_1);
        writeSlide(SLIDE_2);
        renderer.failOn = workspace.resolve(SLIDE_1);

        ExportResult result = service(new PoiPresentationAssembler(properties))
                .export(List.of(SLIDE_1, SLIDE_2), "Deck", events::add);

        assertTrue(result.hasPresentation());
        assertEquals(1, result.screenshots().size());
        assertTrue(result.screenshots().get(0).endsWith("slide_2.png"));
    }

    @Test
    void shouldSkipSlidesOutsideWorkspace(@TempDir Path outside) throws IOException {
        Path root = workspace.resolve("ws");
        Files.createDirectories(root.resolve("slides"));
        Files.writeString(root.resolve(SLIDE_1), "<html><body>slide</body></html>");
        Files.writeString(workspace.resolve("secret.html"), "<html><body>secret</body></html>");
        Path absolute = Files.writeString(outside.resolve("notes.html"), "<html><body>notes</body></html>");
        properties.getWorkspace().setRoot(root.toString());
        PresentationExportService service = new PresentationExportService(renderer,
                new PoiPresentationAssembler(properties), new WorkspacePathResolver(root), properties);

        ExportResult result = service.export(List.of("../secret.html", absolute.toString(), SLIDE_1), "Deck",
                events::add);

        assertEquals(List.of(root.resolve(SLIDE_1)), renderer.rendered);
        assertEquals(1, result.screenshots().size());
        assertTrue(result.screenshots().get(0).endsWith("slide_3.png"));
    }

    // ==================== Empty results ====================

    @Test
    void shouldReturnEmptyResultWhenNothingWasCaptured() {
        ExportResult result = service(new PoiPresentationAssembler(properties))
                .export(List.of(SLIDE_1, SLIDE_2), "Deck", events::add);

        assertFalse(result.hasPresentation());
        assertNull(result.presentationFile());
        assertTrue(result.screenshots().isEmpty());
        assertFalse(Files.exists(workspace.resolve("exports/Deck.pptx")));
    }

    @Test
    void shouldReturnEmptyResultWhenAssemblerFails() throws IOException {
        writeSlide(SLIDE_1);
        PresentationAssemblerPort assembler = mock(PresentationAssemblerPort.class);
        when(assembler.assemble(anyList(), any(), anyString(), any())).thenThrow(new IOException("disk full"));

        ExportResult result = service(assembler).export(List.of(SLIDE_1), "Deck", events::add);

        assertFalse(result.hasPresentation());
    }

    @Test
    void shouldDeleteOutputWhenAssemblerWritesNoPages() throws IOException {
        writeSlide(SLIDE_1);
        PresentationAssemblerPort assembler = mock(PresentationAssemblerPort.class);
        when(assembler.assemble(anyList(), any(), anyString(), any())).thenAnswer(invocation -> {
            Path output = invocation.getArgument(1);
            Files.writeString(output, "partial");
            return 0;
        });

        ExportResult result = service(assembler).export(List.of(SLIDE_1), "Deck", events::add);

        assertFalse(result.hasPresentation());
        assertFalse(Files.exists(workspace.resolve("exports/Deck.pptx")));
    }

    // ==================== File names ====================

    @Test
    void shouldSanitizeTitleForFileName() {
        assertEquals("Q3_Results_2026", PresentationExportService.sanitizeTitle("Q3 Results: 2026?"));
        assertEquals("Presentation", PresentationExportService.sanitizeTitle("  "));
        assertEquals("Presentation", PresentationExportService.sanitizeTitle(null));
        assertEquals("Presentation", PresentationExportService.sanitizeTitle("///"));
        assertEquals("..etc", PresentationExportService.sanitizeTitle("../etc"));
        assertEquals("Presentation", PresentationExportService.sanitizeTitle(".."));
    }

    private static final class FakeRenderer implements SlideRendererPort {

        private final List<Path> rendered = new ArrayList<>();
        private Path failOn;

        @Override
        public CompletableFuture<byte[]> render(Path htmlFile) {
            if (htmlFile.equals(failOn)) {
                return CompletableFuture.failedFuture(new IllegalStateException("navigation timeout"));
            }
            rendered.add(htmlFile);
            return CompletableFuture.completedFuture(png());
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        private static byte[] png() {
            BufferedImage image = new BufferedImage(16, 9, BufferedImage.TYPE_INT_RGB);
            try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
                ImageIO.write(image, "png", out);
                return out.toByteArray();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
