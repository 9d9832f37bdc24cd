package com.intellifill.mapping.dto.field;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Best-effort type guess attached to extracted and target fields. The set is closed: anything the
 * extractor reports that is not recognised becomes {@link #UNKNOWN}, so compatibility lookups are
 * total.
 */
public enum FieldTypeGuess {
  NAME("name"),
  EMAIL("email"),
  PHONE("phone"),
  DATE("date"),
  NUMERIC("numeric"),
  CURRENCY("currency"),
  ADDRESS("address"),
  BOOLEAN("boolean"),
  TEXT("text"),
  UNKNOWN("unknown");

  private static final Map<FieldTypeGuess, Map<FieldTypeGuess, Double>> COMPATIBILITY =
      new EnumMap<>(FieldTypeGuess.class);

  static {
    for (FieldTypeGuess type : values()) {
      COMPATIBILITY.put(type, new EnumMap<>(FieldTypeGuess.class));
    }
    compatible(TEXT, NAME, 0.6);
    compatible(TEXT, ADDRESS, 0.6);
    compatible(TEXT, EMAIL, 0.3);
    compatible(TEXT, PHONE, 0.3);
    compatible(TEXT, DATE, 0.3);
    compatible(TEXT, NUMERIC, 0.3);
    compatible(TEXT, CURRENCY, 0.3);
    compatible(TEXT, BOOLEAN, 0.3);
    compatible(NUMERIC, CURRENCY, 0.8);
    compatible(NUMERIC, PHONE, 0.3);
    compatible(NAME, ADDRESS, 0.2);
  }

  private final String wireName;

  FieldTypeGuess(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  /**
   * Parses an extractor-supplied type string. {@code null} or blank means the extractor had no
   * opinion and defaults to {@link #TEXT}; anything unrecognised maps to {@link #UNKNOWN}.
   */
  @JsonCreator
  public static FieldTypeGuess fromValue(String value) {
    if (value == null || value.isBlank()) {
      return TEXT;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "number":
      case "integer":
      case "decimal":
        return NUMERIC;
      case "string":
        return TEXT;
      case "money":
        return CURRENCY;
      case "telephone":
        return PHONE;
      default:
        break;
    }
    for (FieldTypeGuess type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    return UNKNOWN;
  }

  public static FieldTypeGuess orDefault(FieldTypeGuess type) {
    return type != null ? type : TEXT;
  }

  /**
   * Symmetric compatibility in [0,1]: 1.0 for identical known types, partial credit for coercible
   * pairs, a small constant when either side is {@link #UNKNOWN} and 0 otherwise.
   */
  public double compatibilityWith(FieldTypeGuess other) {
    FieldTypeGuess target = orDefault(other);
    if (this == UNKNOWN || target == UNKNOWN) {
      return 0.25;
    }
    if (this == target) {
      return 1.0;
    }
    return COMPATIBILITY.get(this).getOrDefault(target, 0.0);
  }

  private static void compatible(FieldTypeGuess a, FieldTypeGuess b, double score) {
    COMPATIBILITY.get(a).put(b, score);
    COMPATIBILITY.get(b).put(a, score);
  }
}
