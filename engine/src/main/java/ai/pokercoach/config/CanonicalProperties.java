package ai.pokercoach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for situation canonicalization.
 * <p>
 * Stack depth is bucketed into fixed-width bands of {@code stackBucketSize} big blinds,
 * and the pot is expressed as a percentage of the effective stack rounded to a grid of
 * {@code potRatioStepPercent}. Coarser grids raise the cache hit rate and lose strategic
 * fidelity; finer grids do the opposite. Changing either value changes every key, so a
 * store built under one policy is not reusable under another.
 * <p>
 * The 25bb default is calibrated for postflop solving, where SPR matters: 150bb and 180bb
 * land in different buckets. Precomputed data laid out in 100bb bands (0-100, 100-200)
 * needs {@code stack-bucket-size: 100} so its keys match; 150bb and 180bb then share one.
 * <p>
 * Usage:
 * {@code java -jar engine.jar --canonical.stack-bucket-size=25 --canonical.pot-ratio-step-percent=5}
 */
@Component
@ConfigurationProperties(prefix = "canonical")
public class CanonicalProperties {
  private double stackBucketSize = 25.0;
  private int potRatioStepPercent = 5;

  /**
   * Returns the width of a stack-depth bucket in big blinds.
   * @return bucket width, must be positive
   */
  public double getStackBucketSize() {
    return stackBucketSize;
  }

  public void setStackBucketSize(double stackBucketSize) {
    this.stackBucketSize = stackBucketSize;
  }

  /**
   * Returns the pot-to-stack grid step, in percent.
   * @return grid step, must be positive
   */
  public int getPotRatioStepPercent() {
    return potRatioStepPercent;
  }

  public void setPotRatioStepPercent(int potRatioStepPercent) {
    this.potRatioStepPercent = potRatioStepPercent;
  }
}
