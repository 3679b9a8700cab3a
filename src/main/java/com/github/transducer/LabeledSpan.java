package com.github.transducer;

import java.util.Objects;

/**
 * A run of consecutively consumed tokens, joined by single spaces, and the last label assigned
 * along the path that consumed them.
 */
public final class LabeledSpan {
  private final String text;
  private final String label;

  private LabeledSpan(String text, String label) {
    this.text = text;
    this.label = label;
  }

  public String getText() {
    return text;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LabeledSpan)) {
      return false;
    }
    LabeledSpan span = (LabeledSpan) o;
    return Objects.equals(text, span.text) && Objects.equals(label, span.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, label);
  }

  @Override
  public String toString() {
    return "(" + text + ", " + label + ")";
  }

  public static LabeledSpan of(String text, String label) {
    return new LabeledSpan(text, label);
  }
}
