package io.github.drompincen.worktrack.runtime.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/** Grabs the primary screen with {@link Robot}. Headless hosts always report failure. */
public class AwtScreenCaptureSource implements ScreenCaptureSource {

    private static final Logger log = LoggerFactory.getLogger(AwtScreenCaptureSource.class);

    @Override
    public ScreenCaptureResult capture() {
        if (GraphicsEnvironment.isHeadless()) {
            log.warn("Screen capture unavailable on a headless host");
            return ScreenCaptureResult.failed();
        }
        Robot robot;
        try {
            robot = new Robot();
        } catch (SecurityException e) {
            log.warn("Screen capture permission denied: {}", e.getMessage());
            return ScreenCaptureResult.permissionDenied();
        } catch (AWTException e) {
            log.warn("Screen capture not supported: {}", e.getMessage());
            return ScreenCaptureResult.failed();
        }

        try {
            Rectangle bounds = new Rectangle(Toolkit.getDefaultToolkit().getScreenSize());
            BufferedImage image = robot.createScreenCapture(bounds);
            return ScreenCaptureResult.captured(toJpeg(image));
        } catch (SecurityException e) {
            log.warn("Screen capture permission denied: {}", e.getMessage());
            return ScreenCaptureResult.permissionDenied();
        } catch (IOException e) {
            log.warn("Screen capture encoding failed: {}", e.getMessage());
            return ScreenCaptureResult.failed();
        }
    }

    static byte[] toJpeg(BufferedImage image) throws IOException {
        BufferedImage rgb = image;
        if (image.getType() != BufferedImage.TYPE_INT_RGB) {
            rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
            rgb.getGraphics().drawImage(image, 0, 0, null);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(rgb, "jpg", out)) {
            throw new IOException("No JPEG writer available");
        }
        return out.toByteArray();
    }
}
