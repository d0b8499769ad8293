package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Free text found ahead of the first section. It is metadata only and never changes what the
 * machine does; the raw text is kept verbatim next to the fields extracted from it.
 */
public final class SpecificationHeader {
  public static final SpecificationHeader EMPTY =
      new SpecificationHeader(null, null, Collections.<String>emptyList(), "");

  private static final Pattern featureLine =
      Pattern.compile("^\\s*#\\s*FEATURE\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern intentLine =
      Pattern.compile("^\\s*#\\s*INTENT\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern assumeLine =
      Pattern.compile("^\\s*#\\s*ASSUME\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern assumptionsBlock =
      Pattern.compile("^\\s*ASSUMPTIONS?\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);

  private final String feature;
  private final String intent;
  private final List<String> assumptions;
  private final String rawText;

  public SpecificationHeader(final String feature, final String intent,
      final List<String> assumptions, final String rawText) {
    this.feature = feature;
    this.intent = intent;
    this.assumptions = assumptions == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(assumptions));
    this.rawText = rawText == null ? "" : rawText;
  }

  /**
   * Extracts {@code # FEATURE:}, {@code # INTENT:}, {@code # ASSUME:} lines and the lines of an
   * {@code ASSUMPTIONS:} block.
   */
  public static SpecificationHeader parse(final String rawText) {
    if (rawText == null || rawText.trim().isEmpty()) {
      return EMPTY;
    }
    String feature = null;
    String intent = null;
    final List<String> assumptions = new ArrayList<>();
    boolean inAssumptions = false;
    for (final String line : rawText.split("\n", -1)) {
      Matcher matcher = featureLine.matcher(line);
      if (matcher.matches()) {
        feature = matcher.group(1).trim();
        inAssumptions = false;
        continue;
      }
      matcher = intentLine.matcher(line);
      if (matcher.matches()) {
        intent = matcher.group(1).trim();
        inAssumptions = false;
        continue;
      }
      matcher = assumeLine.matcher(line);
      if (matcher.matches()) {
        addAssumption(assumptions, matcher.group(1));
        inAssumptions = false;
        continue;
      }
      matcher = assumptionsBlock.matcher(line);
      if (matcher.matches()) {
        addAssumption(assumptions, matcher.group(1));
        inAssumptions = true;
        continue;
      }
      if (inAssumptions && !line.trim().startsWith("#")) {
        addAssumption(assumptions, line);
      }
    }
    return new SpecificationHeader(feature, intent, assumptions, rawText);
  }

  private static void addAssumption(final List<String> assumptions, final String text) {
    String assumption = text.trim();
    if (assumption.startsWith("-") || assumption.startsWith("*")) {
      assumption = assumption.substring(1).trim();
    }
    if (!assumption.isEmpty()) {
      assumptions.add(assumption);
    }
  }

  public String getFeature() {
    return feature;
  }

  public String getIntent() {
    return intent;
  }

  public List<String> getAssumptions() {
    return assumptions;
  }

  public String getRawText() {
    return rawText;
  }

  @Override
  public int hashCode() {
    return Objects.hash(feature, intent, assumptions, rawText);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SpecificationHeader)) {
      return false;
    }
    final SpecificationHeader other = (SpecificationHeader) obj;
    return Objects.equals(feature, other.feature) && Objects.equals(intent, other.intent)
        && assumptions.equals(other.assumptions) && rawText.equals(other.rawText);
  }

  @Override
  public String toString() {
    return "SpecificationHeader [feature=" + feature + ", intent=" + intent + ", assumptions="
        + assumptions + "]";
  }
}
