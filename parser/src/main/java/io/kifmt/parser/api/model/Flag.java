package io.kifmt.parser.api.model;

import java.util.Objects;

/**
 * A boolean attribute together with the way it was written.
 *
 * <p>KiCad has spelled the same attribute in three ways over time: a bare word among the values
 * ({@code (pad "1" smd rect locked ...)}), a child with a yes/no value ({@code (locked yes)}) and a
 * child without a value ({@code (fields_autoplaced)}). A field holding a {@code Flag} is {@code
 * null} when the attribute was absent.
 *
 * @param value the attribute value
 * @param form how the attribute is written
 */
public record Flag(boolean value, Form form) {
  /** Spelling of a flag. */
  public enum Form {
    /** A bare word among the values; only ever means {@code true}. */
    SYMBOL,
    /** A child node with a {@code yes} or {@code no} value. */
    CHILD,
    /** A child node without a value; only ever means {@code true}. */
    MARKER
  }

  public Flag {
    Objects.requireNonNull(form, "form");
    if (!value && form != Form.CHILD) {
      throw new IllegalArgumentException("A false flag must be written as a child node");
    }
  }

  /** A flag written in the current layout, {@code (token yes|no)}. */
  public static Flag of(boolean value) {
    return new Flag(value, Form.CHILD);
  }

  public boolean isChildNode() {
    return form != Form.SYMBOL;
  }

  /**
   * Returns a flag with a new value, keeping this form when it can express the value.
   *
   * @param newValue the new value
   * @return the updated flag
   */
  public Flag withValue(boolean newValue) {
    if (newValue || form == Form.CHILD) {
      return new Flag(newValue, form);
    }
    return of(false);
  }

  /** Returns {@code true} if the flag is present and set. */
  public static boolean isSet(Flag flag) {
    return flag != null && flag.value;
  }

  /**
   * Updates a possibly absent flag.
   *
   * @param current the current flag or {@code null}
   * @param value the new value
   * @return the updated flag
   */
  public static Flag update(Flag current, boolean value) {
    return current == null ? of(value) : current.withValue(value);
  }
}
