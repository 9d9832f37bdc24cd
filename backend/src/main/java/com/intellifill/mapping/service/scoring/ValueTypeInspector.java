package com.intellifill.mapping.service.scoring;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import com.intellifill.mapping.dto.field.FieldTypeGuess;

/**
 * Regex-based inspection of extracted values. Used to give type credit to values that look like the
 * target type regardless of the extractor's guess, and by the QA gate to decide coercibility.
 */
public final class ValueTypeInspector {

  private static final Pattern EMAIL =
      Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

  private static final Set<String> BOOLEAN_WORDS =
      Set.of("true", "false", "yes", "no", "y", "n", "on", "off");

  private static final String MONTH =
      "(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?";

  private static final Pattern[] DATES = {
    Pattern.compile("^\\d{1,2}[/.-]\\d{1,2}[/.-]\\d{2,4}$"),
    Pattern.compile("^\\d{4}[/.-]\\d{1,2}[/.-]\\d{1,2}$"),
    Pattern.compile("^\\d{1,2}\\s+" + MONTH + ",?\\s+\\d{4}$", Pattern.CASE_INSENSITIVE),
    Pattern.compile("^" + MONTH + "\\s+\\d{1,2},?\\s+\\d{4}$", Pattern.CASE_INSENSITIVE)
  };

  private static final Pattern CURRENCY =
      Pattern.compile(
          "^(?:[$€£¥₹]|AED|USD|EUR|GBP)\\s?-?\\d{1,3}(?:,?\\d{3})*(?:\\.\\d+)?$",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern NUMERIC =
      Pattern.compile("^[+-]?(?:\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d+)?$");

  private static final Pattern PHONE_CHARS = Pattern.compile("^\\+?[0-9\\s().-]+$");

  private ValueTypeInspector() {}

  /** Apparent type of a value; {@link FieldTypeGuess#UNKNOWN} for blank input. */
  public static FieldTypeGuess detect(String value) {
    if (value == null || value.isBlank()) {
      return FieldTypeGuess.UNKNOWN;
    }
    String v = value.trim();
    if (isEmail(v)) {
      return FieldTypeGuess.EMAIL;
    }
    if (isBoolean(v)) {
      return FieldTypeGuess.BOOLEAN;
    }
    if (isDate(v)) {
      return FieldTypeGuess.DATE;
    }
    if (CURRENCY.matcher(v).matches()) {
      return FieldTypeGuess.CURRENCY;
    }
    if (NUMERIC.matcher(v).matches()) {
      return FieldTypeGuess.NUMERIC;
    }
    if (isPhone(v)) {
      return FieldTypeGuess.PHONE;
    }
    return FieldTypeGuess.TEXT;
  }

  /**
   * Whether {@code value} can stand in a field of {@code type}. Empty values are always coercible,
   * a missing value is a completeness problem rather than a type problem.
   */
  public static boolean isCoercible(String value, FieldTypeGuess type) {
    if (value == null || value.isBlank()) {
      return true;
    }
    String v = value.trim();
    switch (FieldTypeGuess.orDefault(type)) {
      case EMAIL:
        return isEmail(v);
      case PHONE:
        return isPhone(v);
      case DATE:
        return isDate(v);
      case NUMERIC:
        return NUMERIC.matcher(v).matches();
      case CURRENCY:
        return CURRENCY.matcher(v).matches() || NUMERIC.matcher(v).matches();
      case BOOLEAN:
        return isBoolean(v);
      case NAME:
        return looksLikeName(v);
      case ADDRESS:
        return v.chars().anyMatch(Character::isLetterOrDigit);
      default:
        return true;
    }
  }

  private static boolean isEmail(String v) {
    return EMAIL.matcher(v).matches();
  }

  private static boolean isBoolean(String v) {
    return BOOLEAN_WORDS.contains(v.toLowerCase(Locale.ROOT));
  }

  private static boolean isDate(String v) {
    for (Pattern pattern : DATES) {
      if (pattern.matcher(v).matches()) {
        return true;
      }
    }
    return false;
  }

  private static boolean isPhone(String v) {
    if (!PHONE_CHARS.matcher(v).matches()) {
      return false;
    }
    long digits = v.chars().filter(Character::isDigit).count();
    return digits >= 7 && digits <= 15;
  }

  private static boolean looksLikeName(String v) {
    if (v.indexOf('@') >= 0) {
      return false;
    }
    long letters = v.chars().filter(Character::isLetter).count();
    long digits = v.chars().filter(Character::isDigit).count();
    return letters > 0 && digits <= letters;
  }
}
