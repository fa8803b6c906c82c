/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.deck.adapter.outbound.pptx;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.domain.model.ProgressEvent;
import me.golemcore.deck.domain.model.ProgressListener;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import me.golemcore.deck.port.outbound.PresentationAssemblerPort;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.springframework.stereotype.Component;

import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Apache POI implementation of {@link PresentationAssemblerPort}. Builds a
 * 16:9 deck with one blank slide per image, the picture stretched over the
 * whole slide.
 */
@Component
@Slf4j
public class PoiPresentationAssembler implements PresentationAssemblerPort {

    private static final int POINTS_PER_INCH = 72;

    private final DeckProperties.ExportProperties settings;

    public PoiPresentationAssembler(DeckProperties properties) {
        this.settings = properties.getExport();
    }

    @Override
    public int assemble(List<Path> images, Path output, String title, ProgressListener listener)
            throws IOException {
        ProgressListener progress = listener != null ? listener : ProgressListener.NOOP;
        int width = (int) Math.round(settings.getSlideWidthInches() * POINTS_PER_INCH);
        int height = (int) Math.round(settings.getSlideHeightInches() * POINTS_PER_INCH);

        try (XMLSlideShow deck = new XMLSlideShow()) {
            deck.setPageSize(new Dimension(width, height));
            if (title != null && !title.isBlank()) {
                deck.getProperties().getCoreProperties().setTitle(title);
            }

            int added = 0;
            int total = images.size();
            for (Path image : images) {
                if (!Files.isRegularFile(image)) {
                    log.warn("[Export] Screenshot not found, skipping: {}", image);
                    continue;
                }
                byte[] bytes;
                try {
                    bytes = Files.readAllBytes(image);
                } catch (IOException e) {
                    log.warn("[Export] Failed to read screenshot {}: {}", image, e.getMessage());
                    continue;
                }

                XSLFSlide slide = deck.createSlide();
                XSLFPictureData picture = deck.addPicture(bytes, PictureData.PictureType.PNG);
                XSLFPictureShape shape = slide.createPicture(picture);
                shape.setAnchor(new Rectangle2D.Double(0, 0, width, height));
                added++;
                log.debug("[Export] Added slide {}/{}: {}", added, total, image.getFileName());
                progress.onEvent(ProgressEvent.slideAdded(added, total));
            }

            if (added == 0) {
                return 0;
            }
            try (OutputStream out = Files.newOutputStream(output)) {
                deck.write(out);
            }
            return added;
        }
    }
}
