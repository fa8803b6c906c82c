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

package me.golemcore.deck.adapter.outbound.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.LoadState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.deck.infrastructure.config.DeckProperties;
import me.golemcore.deck.port.outbound.SlideRendererPort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Playwright implementation of {@link SlideRendererPort}.
 *
 * <p>
 * Each slide is opened in a fresh page of a Chromium context whose viewport
 * matches the slide canvas, loaded from its {@code file://} URL, given time to
 * settle after network idle, and captured as a viewport-sized PNG.
 *
 * <p>
 * Lazy initialization: the browser is only launched on first use. All
 * Playwright calls run on one dedicated thread because Playwright objects are
 * not thread-safe.
 */
@Component
@Slf4j
public class PlaywrightSlideRenderer implements SlideRendererPort {

    private final DeckProperties.ExportProperties settings;
    private final ExecutorService browserThread = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "deck-playwright");
        thread.setDaemon(true);
        return thread;
    });

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private volatile boolean initialized = false;

    public PlaywrightSlideRenderer(DeckProperties properties) {
        this.settings = properties.getExport();
    }

    @SuppressWarnings("PMD.CloseResource")
    private void ensureInitialized() {
        if (initialized) {
            return;
        }

        Playwright pw = null;
        Browser br = null;
        try {
            pw = Playwright.create();
            br = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(settings.isHeadless()));
            this.context = br.newContext(new Browser.NewContextOptions()
                    .setViewportSize(settings.getViewportWidth(), settings.getViewportHeight()));
            this.browser = br;
            this.playwright = pw;
            initialized = true;
            log.info("[Playwright] Browser initialized (headless: {}, viewport: {}x{})", settings.isHeadless(),
                    settings.getViewportWidth(), settings.getViewportHeight());
        } catch (RuntimeException e) {
            log.warn("[Playwright] Failed to initialize: {}", e.getMessage());
            // Release partially created resources
            if (br != null) {
                try {
                    br.close();
                } catch (RuntimeException ex) {
                    log.trace("[Playwright] Error closing browser: {}", ex.getMessage());
                }
            }
            if (pw != null) {
                try {
                    pw.close();
                } catch (RuntimeException ex) {
                    log.trace("[Playwright] Error closing driver: {}", ex.getMessage());
                }
            }
            throw new IllegalStateException("Browser not available: " + e.getMessage(), e);
        }
    }

    @Override
    @SuppressWarnings("PMD.UseTryWithResources")
    public CompletableFuture<byte[]> render(Path slideFile) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            Page page = context.newPage();
            try {
                page.setDefaultTimeout(settings.getTimeoutMs());
                page.navigate(slideFile.toAbsolutePath().toUri().toString());
                page.waitForLoadState(LoadState.NETWORKIDLE);
                // Fonts and CDN styles may still be applying after network idle
                page.waitForTimeout(settings.getSettleDelayMs());
                return page.screenshot(new Page.ScreenshotOptions().setFullPage(false));
            } finally {
                page.close();
            }
        }, browserThread);
    }

    @Override
    public boolean isAvailable() {
        return browser != null && browser.isConnected();
    }

    @PreDestroy
    public void destroy() {
        CompletableFuture.runAsync(this::close, browserThread).join();
        browserThread.shutdown();
    }

    private void close() {
        try {
            if (context != null) {
                context.close();
            }
            if (browser != null) {
                browser.close();
            }
            if (playwright != null) {
                playwright.close();
            }
            if (initialized) {
                log.info("[Playwright] Browser closed");
            }
        } catch (RuntimeException e) {
            log.error("[Playwright] Error closing browser", e);
        } finally {
            initialized = false;
        }
    }
}
