package com.tightzone.chart;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChartRendererTest {

    @TempDir
    Path tmp;

    @Test
    void renderShouldWritePngOfConfiguredSize() throws Exception {
        Path out = tmp.resolve("nested").resolve("AAA.png");

        new ChartRenderer(800, 480).render("NASDAQ:AAA", ContractionZoneDetectorTest.narrowingSeries(8, 4, 2, 1), out);

        assertTrue(Files.size(out) > 0);
        BufferedImage img = ImageIO.read(out.toFile());
        assertNotNull(img);
        assertEquals(800, img.getWidth());
        assertEquals(480, img.getHeight());
    }

    @Test
    void renderShouldHandleSinglePoint() throws Exception {
        Path out = tmp.resolve("ONE.png");
        new ChartRenderer().render("ONE", List.of(new PriceBar(Instant.EPOCH, 10.0, 0.0)), out);
        assertTrue(Files.exists(out));
    }

    @Test
    void renderShouldRejectEmptySeries() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChartRenderer().render("NONE", List.of(), tmp.resolve("NONE.png")));
    }
}
