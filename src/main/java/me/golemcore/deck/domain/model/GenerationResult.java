package me.golemcore.deck.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a generation session. The first four fields travel behind the
 * completion marker; {@code presentationFile} and {@code screenshots} are added
 * by the export pipeline afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerationResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String message;

    @JsonProperty("slide_count")
    private int slideCount;

    @JsonProperty("slide_files")
    @Builder.Default
    private List<String> slideFiles = new ArrayList<>();

    @JsonProperty("pptx_file")
    private String presentationFile;

    @Builder.Default
    private List<String> screenshots = new ArrayList<>();

    public static GenerationResult failed(String message) {
        return GenerationResult.builder()
                .success(false)
                .message(message)
                .build();
    }

    /**
     * Returns a copy enriched with the export artifacts. An empty export leaves
     * the result as it was.
     */
    public GenerationResult withExport(ExportResult export) {
        if (export == null || !export.hasPresentation()) {
            return this;
        }
        return GenerationResult.builder()
                .success(success)
                .message(message)
                .slideCount(slideCount)
                .slideFiles(new ArrayList<>(slideFiles))
                .presentationFile(export.presentationFile())
                .screenshots(new ArrayList<>(export.screenshots()))
                .build();
    }
}
