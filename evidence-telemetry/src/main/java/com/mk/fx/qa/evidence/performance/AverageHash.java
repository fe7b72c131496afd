package com.mk.fx.qa.evidence.performance;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import javax.imageio.ImageIO;

/**
 * 64-bit average hash: the image is scaled to 8x8 grayscale and each bit records whether a pixel
 * is brighter than the mean.
 */
public final class AverageHash {

  private static final int SIZE = 8;

  private AverageHash() {
    // Utility class, no instantiation
  }

  /**
   * @throws IllegalArgumentException when the bytes are not a readable image
   */
  public static long of(byte[] image) {
    BufferedImage source;
    try {
      source = ImageIO.read(new ByteArrayInputStream(image));
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot decode image", e);
    }
    if (source == null) {
      throw new IllegalArgumentException("Unsupported image format");
    }
    return of(source);
  }

  public static long of(BufferedImage source) {
    var scaled = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_BYTE_GRAY);
    Graphics2D g = scaled.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.drawImage(source, 0, 0, SIZE, SIZE, null);
    } finally {
      g.dispose();
    }
    int[] pixels = new int[SIZE * SIZE];
    scaled.getRaster().getPixels(0, 0, SIZE, SIZE, pixels);
    long sum = 0;
    for (int p : pixels) sum += p;
    double mean = (double) sum / pixels.length;
    long hash = 0;
    for (int i = 0; i < pixels.length; i++) {
      if (pixels[i] > mean) {
        hash |= 1L << i;
      }
    }
    return hash;
  }

  /** 1 for identical hashes, 0 when every bit differs. */
  public static double similarity(long a, long b) {
    return 1.0 - Long.bitCount(a ^ b) / 64.0;
  }
}
