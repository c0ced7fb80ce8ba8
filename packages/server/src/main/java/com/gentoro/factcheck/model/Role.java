package com.gentoro.factcheck.model;

/** Author of a conversation turn. */
public enum Role {
  USER("user"),
  MODEL("model");

  private final String wireName;

  Role(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Role fromWireName(String value) {
    if (value == null) return USER;
    for (Role role : values()) {
      if (role.wireName.equalsIgnoreCase(value)) return role;
    }
    return USER;
  }
}
