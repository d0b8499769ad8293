package com.github.fsmcompiler;

import java.util.Objects;

/**
 * Advisory metadata attached to a state or transition by an {@link AnnotationProvider}. The code
 * generator may read hints to pick an encoding or emit remarks, but no annotation ever changes
 * which state a trigger leads to.
 */
public final class Annotation {
  private final Target target;
  private final String subject;
  private final Hint hint;
  private final String note;

  public Annotation(final Target target, final String subject, final Hint hint,
      final String note) {
    this.target = Objects.requireNonNull(target);
    this.subject = Objects.requireNonNull(subject);
    this.hint = Objects.requireNonNull(hint);
    this.note = note == null ? "" : note;
  }

  public Target getTarget() {
    return target;
  }

  /**
   * State name for STATE targets, {@code <state>/<trigger key>} for TRANSITION targets (with
   * {@code *} as state for global transitions), the feature name for MACHINE targets.
   */
  public String getSubject() {
    return subject;
  }

  public Hint getHint() {
    return hint;
  }

  public String getNote() {
    return note;
  }

  @Override
  public int hashCode() {
    return Objects.hash(target, subject, hint, note);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Annotation)) {
      return false;
    }
    final Annotation other = (Annotation) obj;
    return target == other.target && subject.equals(other.subject) && hint == other.hint
        && note.equals(other.note);
  }

  @Override
  public String toString() {
    return "Annotation [target=" + target + ", subject=" + subject + ", hint=" + hint + ", note="
        + note + "]";
  }

  public static enum Target {
    MACHINE, STATE, TRANSITION;
  }

  public static enum Hint {
    // safety relevant path, worth a second look in review
    CRITICAL,
    // the author expects this part to change in a later revision
    FUTURE,
    // prefer a one-hot state register
    PREFER_ONE_HOT,
    // prefer the encoding with the fewest flip-flops
    PREFER_LOW_POWER;
  }
}
