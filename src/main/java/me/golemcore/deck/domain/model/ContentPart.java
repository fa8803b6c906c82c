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

/**
 * One part of a multimodal user turn: either text or a base64-encoded image.
 */
public record ContentPart(Type type, String text, String mimeType, String base64Data) {

    public enum Type {
        TEXT, IMAGE
    }

    public static ContentPart text(String text) {
        return new ContentPart(Type.TEXT, text, null, null);
    }

    public static ContentPart image(String mimeType, String base64Data) {
        return new ContentPart(Type.IMAGE, null, mimeType, base64Data);
    }

    public boolean isImage() {
        return type == Type.IMAGE;
    }
}
