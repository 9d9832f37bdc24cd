package com.intellifill.mapping.service.scoring;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns free-form field labels into comparable tokens. {@code first_name}, {@code firstName},
 * {@code First-Name} and {@code first name} all tokenize to {@code [first, name]} and normalize to
 * {@code firstname}.
 */
public final class FieldNameNormalizer {

  private static final Pattern LOWER_TO_UPPER = Pattern.compile("(?<=[a-z])(?=[A-Z])");
  private static final Pattern ACRONYM_TO_WORD = Pattern.compile("(?<=[A-Z])(?=[A-Z][a-z])");
  private static final Pattern LETTER_TO_DIGIT =
      Pattern.compile("(?<=[A-Za-z])(?=\\d)|(?<=\\d)(?=[A-Za-z])");
  private static final Pattern SEPARATORS = Pattern.compile("[^A-Za-z0-9]+");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private FieldNameNormalizer() {}

  public static List<String> tokenize(String name) {
    if (name == null || name.isBlank()) {
      return Collections.emptyList();
    }
    String spaced = LOWER_TO_UPPER.matcher(name).replaceAll(" ");
    spaced = ACRONYM_TO_WORD.matcher(spaced).replaceAll(" ");
    spaced = LETTER_TO_DIGIT.matcher(spaced).replaceAll(" ");
    spaced = SEPARATORS.matcher(spaced).replaceAll(" ");

    List<String> tokens = new ArrayList<>();
    for (String part : spaced.trim().split("\\s+")) {
      if (!part.isEmpty()) {
        tokens.add(part.toLowerCase(Locale.ROOT));
      }
    }
    return tokens;
  }

  public static String normalize(String name) {
    return String.join("", tokenize(name));
  }

  /**
   * Token set used for overlap scoring. Pure digit tokens ({@code name1}, {@code address_2}) are
   * ordinals rather than meaning and are dropped unless nothing else is left.
   */
  public static Set<String> significantTokens(String name) {
    List<String> tokens = tokenize(name);
    Set<String> significant = new LinkedHashSet<>();
    for (String token : tokens) {
      if (!DIGITS.matcher(token).matches()) {
        significant.add(token);
      }
    }
    return significant.isEmpty() ? new LinkedHashSet<>(tokens) : significant;
  }
}
