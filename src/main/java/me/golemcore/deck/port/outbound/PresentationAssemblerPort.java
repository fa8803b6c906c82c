package me.golemcore.deck.port.outbound;

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

import me.golemcore.deck.domain.model.ProgressListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for packing slide images into a single presentation document.
 */
public interface PresentationAssemblerPort {

    /**
     * Writes one full-bleed page per image, in order, to {@code output}.
     * Unreadable images are skipped. One assembly progress event is emitted per
     * added page.
     *
     * @return number of pages written
     */
    int assemble(List<Path> images, Path output, String title, ProgressListener listener) throws IOException;
}
