package com.mk.fx.qa.evidence.performance;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.evidence.dto.Filmstrip;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class FilmstripBuilderTest {

  /** 64x64 image, left half {@code left}, right half {@code right}. */
  static BufferedImage split(Color left, Color right) {
    var image = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
    var g = image.createGraphics();
    try {
      g.setColor(left);
      g.fillRect(0, 0, 32, 64);
      g.setColor(right);
      g.fillRect(32, 0, 32, 64);
    } finally {
      g.dispose();
    }
    return image;
  }

  static byte[] png(BufferedImage image) {
    var out = new ByteArrayOutputStream();
    try {
      ImageIO.write(image, "png", out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  @Test
  void averageHash_sameImage_fullySimilar() {
    byte[] image = png(split(Color.BLACK, Color.WHITE));
    assertEquals(1.0, AverageHash.similarity(AverageHash.of(image), AverageHash.of(image)));
  }

  @Test
  void averageHash_invertedImage_mostlyDifferent() {
    long a = AverageHash.of(split(Color.BLACK, Color.WHITE));
    long b = AverageHash.of(split(Color.WHITE, Color.BLACK));
    assertTrue(AverageHash.similarity(a, b) <= 0.25);
  }

  @Test
  void averageHash_notAnImage_rejected() {
    assertThrows(IllegalArgumentException.class, () -> AverageHash.of(new byte[] {1, 2, 3}));
  }

  @Test
  void visualProgression_firstZeroLastHundred() {
    byte[] blank = png(split(Color.WHITE, Color.BLACK));
    byte[] done = png(split(Color.BLACK, Color.WHITE));
    var frames =
        List.of(
            new ScreenFrame(0, blank),
            new ScreenFrame(100, new byte[] {9, 9}),
            new ScreenFrame(200, done),
            new ScreenFrame(300, done));

    double[] progression = FilmstripBuilder.visualProgression(frames);

    assertEquals(0, progression[0], 1e-9);
    // undecodable frame counts as no progress
    assertEquals(0, progression[1], 1e-9);
    assertEquals(100, progression[2], 1e-9);
    assertEquals(100, progression[3], 1e-9);
  }

  @Test
  void build_keyFramesMarkFirstChangeAndCompleteness() {
    byte[] blank = png(split(Color.WHITE, Color.BLACK));
    byte[] done = png(split(Color.BLACK, Color.WHITE));
    var frames =
        List.of(new ScreenFrame(0, blank), new ScreenFrame(250, done), new ScreenFrame(600, done));

    Filmstrip.ScenarioFilmstrip strip =
        FilmstripBuilder.build("scn-1", "https://app.example.com/", frames, 420);

    assertEquals(3, strip.frames().size());
    assertEquals(420, strip.speedIndex(), 1e-9);
    assertEquals(
        List.of(
            "start",
            "first-visual-change",
            "visually-complete-50",
            "visually-complete-85",
            "visually-complete-95",
            "visually-complete-100"),
        strip.keyFrames().stream().map(Filmstrip.KeyFrame::type).toList());
    assertEquals(250, strip.keyFrames().get(1).timestamp(), 1e-9);
  }

  @Test
  void build_noFrames_noKeyFrames() {
    var strip = FilmstripBuilder.build("scn-1", null, List.of(), 0);
    assertTrue(strip.frames().isEmpty());
    assertTrue(strip.keyFrames().isEmpty());
  }
}
