package com.mk.fx.qa.evidence.performance;

import com.mk.fx.qa.evidence.dto.Filmstrip;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Turns screenshot frames into visual completeness values and key frames. */
@Slf4j
final class FilmstripBuilder {

  private static final int[] COMPLETENESS_MARKS = {50, 85, 95, 100};

  private FilmstripBuilder() {
    // Utility class, no instantiation
  }

  static Filmstrip.ScenarioFilmstrip build(
      String scenarioId, String url, List<ScreenFrame> frames, double speedIndex) {
    double[] progression = visualProgression(frames);
    List<Filmstrip.Frame> out = new ArrayList<>(frames.size());
    for (int i = 0; i < frames.size(); i++) {
      ScreenFrame f = frames.get(i);
      out.add(new Filmstrip.Frame(i, f.timestamp(), f.image(), progression[i]));
    }
    return new Filmstrip.ScenarioFilmstrip(
        scenarioId, url, out, keyFrames(frames, progression), speedIndex);
  }

  /**
   * First frame 0, last frame 100, every frame in between its average-hash similarity to the last
   * frame times 100. Undecodable frames count as 0.
   */
  static double[] visualProgression(List<ScreenFrame> frames) {
    int n = frames.size();
    double[] progression = new double[n];
    if (n == 0) return progression;
    progression[n - 1] = 100;
    if (n <= 2) return progression;
    Long last = hashOrNull(frames.get(n - 1));
    for (int i = 1; i < n - 1; i++) {
      Long current = hashOrNull(frames.get(i));
      progression[i] =
          last == null || current == null ? 0 : AverageHash.similarity(current, last) * 100.0;
    }
    return progression;
  }

  static List<Filmstrip.KeyFrame> keyFrames(List<ScreenFrame> frames, double[] progression) {
    List<Filmstrip.KeyFrame> keyFrames = new ArrayList<>();
    if (frames.isEmpty()) return keyFrames;
    keyFrames.add(new Filmstrip.KeyFrame(0, "start", frames.get(0).timestamp()));
    for (int i = 1; i < progression.length; i++) {
      if (progression[i] > 0) {
        keyFrames.add(new Filmstrip.KeyFrame(i, "first-visual-change", frames.get(i).timestamp()));
        break;
      }
    }
    for (int mark : COMPLETENESS_MARKS) {
      for (int i = 0; i < progression.length; i++) {
        if (progression[i] >= mark) {
          keyFrames.add(
              new Filmstrip.KeyFrame(i, "visually-complete-" + mark, frames.get(i).timestamp()));
          break;
        }
      }
    }
    return keyFrames;
  }

  private static Long hashOrNull(ScreenFrame frame) {
    try {
      return AverageHash.of(frame.image());
    } catch (RuntimeException e) {
      log.warn("Skipping undecodable filmstrip frame at {}ms: {}", frame.timestamp(), e.getMessage());
      return null;
    }
  }
}
