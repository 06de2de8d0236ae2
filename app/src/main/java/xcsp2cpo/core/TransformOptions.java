package xcsp2cpo.core;

import java.util.Locale;
import java.util.Properties;

/** Configuration for the normalize, decompose and rewrite pipeline. */
public record TransformOptions(Mode mode, TargetVocabulary vocabulary) {

  public static final String MODE_PROPERTY = "xcsp2cpo.mode";
  public static final String NATIVE_IMPLICATION_PROPERTY = "xcsp2cpo.nativeImplication";

  public static TransformOptions defaults() {
    return new TransformOptions(Mode.FULL, TargetVocabulary.cpo());
  }

  public static TransformOptions legacy() {
    return new TransformOptions(Mode.LEGACY, TargetVocabulary.cpo());
  }

  public static TransformOptions normalize(TransformOptions options) {
    if (options == null) {
      return defaults();
    }
    TransformOptions defaults = defaults();
    Mode mode = options.mode() != null ? options.mode() : defaults.mode();
    TargetVocabulary vocabulary =
        options.vocabulary() != null ? options.vocabulary() : defaults.vocabulary();
    return new TransformOptions(mode, vocabulary);
  }

  /**
   * Reads {@code xcsp2cpo.mode} ({@code full} or {@code legacy}) and {@code
   * xcsp2cpo.nativeImplication} ({@code true} or {@code false}); absent keys keep the defaults.
   */
  public static TransformOptions fromProperties(Properties properties) {
    TransformOptions defaults = defaults();
    if (properties == null) {
      return defaults;
    }
    Mode mode = defaults.mode();
    String rawMode = properties.getProperty(MODE_PROPERTY);
    if (rawMode != null && !rawMode.isBlank()) {
      mode = Mode.parse(rawMode);
    }
    TargetVocabulary vocabulary = defaults.vocabulary();
    String rawImplication = properties.getProperty(NATIVE_IMPLICATION_PROPERTY);
    if (rawImplication != null && !rawImplication.isBlank()) {
      vocabulary = vocabulary.withNativeImplication(parseFlag(rawImplication));
    }
    return new TransformOptions(mode, vocabulary);
  }

  public TransformOptions withMode(Mode newMode) {
    return new TransformOptions(newMode, vocabulary);
  }

  public TransformOptions withVocabulary(TargetVocabulary newVocabulary) {
    return new TransformOptions(mode, newVocabulary);
  }

  private static boolean parseFlag(String raw) {
    String value = raw.trim().toLowerCase(Locale.ROOT);
    return switch (value) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(
          "Invalid boolean for " + NATIVE_IMPLICATION_PROPERTY + ": " + raw);
    };
  }

  /** Which stages run after normalization. */
  public enum Mode {
    /** Normalize, decompose and rewrite. */
    FULL,
    /** Normalize only; constraints and expressions pass through as parsed. */
    LEGACY;

    public boolean decomposes() {
      return this == FULL;
    }

    static Mode parse(String raw) {
      try {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("Invalid value for " + MODE_PROPERTY + ": " + raw, ex);
      }
    }
  }
}
