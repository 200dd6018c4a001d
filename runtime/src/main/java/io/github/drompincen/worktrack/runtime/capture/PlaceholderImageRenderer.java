package io.github.drompincen.worktrack.runtime.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** 640x480 "Camera Unavailable" frame stamped with the capture time. */
public class PlaceholderImageRenderer {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderImageRenderer.class);

    public static final int WIDTH = 640;
    public static final int HEIGHT = 480;
    public static final String LABEL = "Camera Unavailable";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public PlaceholderImageRenderer(Clock clock) {
        this.clock = clock;
    }

    public byte[] render() {
        BufferedImage image = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setColor(new Color(0x1e, 0x1e, 0x1e));
            g.fillRect(0, 0, WIDTH, HEIGHT);

            drawLabels(g);
        } finally {
            g.dispose();
        }
        try {
            return AwtScreenCaptureSource.toJpeg(image);
        } catch (IOException e) {
            throw new UncheckedIOException("Placeholder encoding failed", e);
        }
    }

    private void drawLabels(Graphics2D g) {
        try {
            g.setColor(new Color(0xb4, 0xb4, 0xb4));
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 28));
            drawCentered(g, LABEL, HEIGHT / 2 - 10);

            g.setColor(new Color(0x78, 0x78, 0x78));
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 16));
            drawCentered(g, STAMP.format(clock.instant().atZone(ZoneId.systemDefault())), HEIGHT / 2 + 30);
        } catch (RuntimeException | InternalError | LinkageError e) {
            // Hosts without fonts still get a blank frame.
            log.warn("Placeholder text rendering unavailable: {}", e.getMessage());
        }
    }

    private static void drawCentered(Graphics2D g, String text, int baseline) {
        FontMetrics metrics = g.getFontMetrics();
        g.drawString(text, (WIDTH - metrics.stringWidth(text)) / 2, baseline);
    }
}
