package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Deterministic keyword scan of the comments and header of a specification:<br>
 * 1. {@code critical} marks the commented state or transition CRITICAL<br>
 * 2. {@code v2} or {@code future} marks it FUTURE<br>
 * 3. {@code low power} or {@code one-hot} anywhere becomes a machine-wide encoding preference<br>
 */
public final class CommentHintAnnotator implements AnnotationProvider {
  private static final Logger logger =
      LogManager.getLogger(CommentHintAnnotator.class.getSimpleName());

  private static final Pattern critical =
      Pattern.compile("\\bcritical\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern future =
      Pattern.compile("\\b(v2|future)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern lowPower =
      Pattern.compile("\\blow[ -]?power\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern oneHot =
      Pattern.compile("\\bone[ -]?hot\\b", Pattern.CASE_INSENSITIVE);

  @Override
  public List<Annotation> annotate(final Specification specification) {
    final Set<Annotation> annotations = new LinkedHashSet<>();
    final String machine = specification.getHeader().getFeature() == null ? "machine"
        : specification.getHeader().getFeature();
    scanMachine(annotations, machine, specification.getHeader().getRawText());

    for (final State state : specification.getStates().values()) {
      scan(annotations, Annotation.Target.STATE, state.getName(), state.getComment());
      scanMachine(annotations, machine, state.getComment());
    }
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      scan(annotations, Annotation.Target.TRANSITION, "*/" + global.getTrigger().key(),
          global.getComment());
      scanMachine(annotations, machine, global.getComment());
    }
    for (final LocalTransition local : specification.getLocalTransitions()) {
      final String subject = local.getSource() + "/" + local.getTrigger().key();
      for (final GuardedBranch branch : local.getBranches()) {
        scan(annotations, Annotation.Target.TRANSITION, subject, branch.getComment());
        scanMachine(annotations, machine, branch.getComment());
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Derived " + annotations.size() + " annotations from comments");
    }
    return new ArrayList<>(annotations);
  }

  private static void scan(final Set<Annotation> annotations, final Annotation.Target target,
      final String subject, final String comment) {
    if (comment == null || comment.isEmpty()) {
      return;
    }
    if (critical.matcher(comment).find()) {
      annotations.add(new Annotation(target, subject, Annotation.Hint.CRITICAL, comment));
    }
    if (future.matcher(comment).find()) {
      annotations.add(new Annotation(target, subject, Annotation.Hint.FUTURE, comment));
    }
  }

  private static void scanMachine(final Set<Annotation> annotations, final String machine,
      final String text) {
    if (text == null || text.isEmpty()) {
      return;
    }
    if (lowPower.matcher(text).find()) {
      annotations.add(new Annotation(Annotation.Target.MACHINE, machine,
          Annotation.Hint.PREFER_LOW_POWER, "low power requested"));
    }
    if (oneHot.matcher(text).find()) {
      annotations.add(new Annotation(Annotation.Target.MACHINE, machine,
          Annotation.Hint.PREFER_ONE_HOT, "one-hot encoding requested"));
    }
  }
}
