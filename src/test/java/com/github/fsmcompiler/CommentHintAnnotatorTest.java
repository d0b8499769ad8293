package com.github.fsmcompiler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

/**
 * Tests to maintain the sanity and correctness of the CommentHintAnnotator.
 */
public final class CommentHintAnnotatorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testSmartLockHints() throws Exception {
    final Specification smartLock = TestSpecifications
        .build(TestSpecifications.load(TestSpecifications.smartLock), new Diagnostics());
    final List<Annotation> annotations = new CommentHintAnnotator().annotate(smartLock);

    assertEquals(1, annotations.size());
    final Annotation critical = annotations.get(0);
    assertEquals(Annotation.Target.TRANSITION, critical.getTarget());
    assertEquals("*/EVENT:USER_ENTERS_MASTER_CODE", critical.getSubject());
    assertEquals(Annotation.Hint.CRITICAL, critical.getHint());
    assertEquals("critical override", critical.getNote());
    assertFalse(smartLock.withAnnotations(annotations).hasHint(Annotation.Hint.PREFER_ONE_HOT));
  }

  @Test
  public void testHintsFromEveryKindOfComment() throws Exception {
    final Diagnostics diagnostics = new Diagnostics();
    final Specification blinker = TestSpecifications.build("# FEATURE: Blinker\n"
        + "# INTENT: low-power status lamp\n"
        + "STATE_LIST:\n"
        + "  OFF_STATE [Output: Lamp=OFF] INITIAL  # v2 candidate\n"
        + "  ON_STATE [Output: Lamp=ON]\n"
        + "TRANSITIONS:\n"
        + "  FROM(OFF_STATE):\n"
        + "    ON_EVENT(TICK): -> TO(ON_STATE)  # Critical path, one hot please\n"
        + "  FROM(ON_STATE):\n"
        + "    ON_EVENT(TICK): -> TO(OFF_STATE)\n", diagnostics);
    assertFalse(diagnostics.hasErrors());

    final List<Annotation> annotations = new CommentHintAnnotator().annotate(blinker);
    assertEquals(4, annotations.size());

    // 1. the header asks for low power
    assertEquals(new Annotation(Annotation.Target.MACHINE, "Blinker",
        Annotation.Hint.PREFER_LOW_POWER, "low power requested"), annotations.get(0));
    // 2. the state comment defers the state
    assertEquals(new Annotation(Annotation.Target.STATE, "OFF_STATE", Annotation.Hint.FUTURE,
        "v2 candidate"), annotations.get(1));
    // 3. the transition comment is both critical and a machine-wide preference
    assertEquals(new Annotation(Annotation.Target.TRANSITION, "OFF_STATE/EVENT:TICK",
        Annotation.Hint.CRITICAL, "Critical path, one hot please"), annotations.get(2));
    assertEquals(new Annotation(Annotation.Target.MACHINE, "Blinker",
        Annotation.Hint.PREFER_ONE_HOT, "one-hot encoding requested"), annotations.get(3));

    // 4. low power outweighs one-hot under AUTO
    final Specification annotated = blinker.withAnnotations(annotations);
    assertTrue(annotated.hasHint(Annotation.Hint.PREFER_ONE_HOT));
    assertEquals(EncodingStyle.BINARY,
        StateEncoding.of(annotated, EncodingStyle.AUTO).getStyle());
    assertEquals(EncodingStyle.ONE_HOT,
        StateEncoding.of(annotated, EncodingStyle.ONE_HOT).getStyle());
  }

  @Test
  public void testRepeatedHintsCollapse() throws Exception {
    final Specification spec = TestSpecifications.build("STATE_LIST:\n"
        + "  A [Output: Lamp=OFF] INITIAL  # one-hot\n"
        + "  B [Output: Lamp=ON]  # one hot as well\n"
        + "TRANSITIONS:\n"
        + "  FROM(A):\n"
        + "    ON_EVENT(GO): -> TO(B)\n"
        + "  FROM(B):\n"
        + "    ON_EVENT(GO): -> TO(A)\n", new Diagnostics());
    final CommentHintAnnotator annotator = new CommentHintAnnotator();
    final List<Annotation> annotations = annotator.annotate(spec);

    assertEquals(1, annotations.size());
    assertEquals("machine", annotations.get(0).getSubject());
    assertEquals(annotations, annotator.annotate(spec));
    assertEquals(EncodingStyle.ONE_HOT,
        StateEncoding.of(spec.withAnnotations(annotations), EncodingStyle.AUTO).getStyle());
  }
}
