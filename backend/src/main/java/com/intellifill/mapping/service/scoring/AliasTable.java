package com.intellifill.mapping.service.scoring;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Domain synonym groups. Two names are aliases when their normalized forms belong to at least one
 * common group, so {@code dob} and {@code Date-Of-Birth} match through the {@code date-of-birth}
 * group.
 */
public final class AliasTable {

  public static final Map<String, List<String>> DEFAULT_GROUPS = defaultGroups();

  private final Map<String, Set<String>> groupsByName;

  private AliasTable(Map<String, Set<String>> groupsByName) {
    this.groupsByName = groupsByName;
  }

  public static AliasTable fromGroups(Map<String, List<String>> groups) {
    Map<String, Set<String>> index = new HashMap<>();
    if (groups != null) {
      groups.forEach(
          (group, names) -> {
            if (names == null) {
              return;
            }
            for (String name : names) {
              String normalized = FieldNameNormalizer.normalize(name);
              if (!normalized.isEmpty()) {
                index.computeIfAbsent(normalized, k -> new HashSet<>()).add(group);
              }
            }
          });
    }
    return new AliasTable(index);
  }

  public static AliasTable empty() {
    return new AliasTable(Collections.emptyMap());
  }

  public boolean areAliases(String first, String second) {
    Set<String> firstGroups = groupsByName.get(FieldNameNormalizer.normalize(first));
    Set<String> secondGroups = groupsByName.get(FieldNameNormalizer.normalize(second));
    if (firstGroups == null || secondGroups == null) {
      return false;
    }
    for (String group : firstGroups) {
      if (secondGroups.contains(group)) {
        return true;
      }
    }
    return false;
  }

  private static Map<String, List<String>> defaultGroups() {
    Map<String, List<String>> groups = new LinkedHashMap<>();
    groups.put("first-name", List.of("first_name", "given_name", "forename", "fname"));
    groups.put("last-name", List.of("last_name", "family_name", "surname", "lname"));
    groups.put("full-name", List.of("full_name", "name", "applicant_name", "complete_name"));
    groups.put("email", List.of("email", "email_address", "e_mail", "electronic_mail"));
    groups.put(
        "phone",
        List.of(
            "phone", "phone_number", "telephone", "tel", "mobile", "mobile_number", "cell_phone"));
    groups.put(
        "address", List.of("address", "street_address", "mailing_address", "home_address"));
    groups.put("date-of-birth", List.of("date_of_birth", "dob", "birth_date", "birthdate"));
    groups.put("postal-code", List.of("zip", "zip_code", "postal_code", "postcode"));
    groups.put("salary", List.of("salary", "income", "annual_income"));
    return Collections.unmodifiableMap(groups);
  }
}
