package com.consullo.sessions.workspace;

/**
 * Tab packing constants.
 *
 * @param averageWidth upper bound for a tab's ideal width
 * @param minimumWidth smallest usable tab width; narrower measurements are clamped to it
 * @since 1.0
 */
public record TabLayoutConfig(double averageWidth, double minimumWidth) {

  public TabLayoutConfig {
    if (minimumWidth <= 0 || averageWidth < minimumWidth) {
      throw new IllegalArgumentException("need 0 < minimumWidth <= averageWidth");
    }
  }
}
