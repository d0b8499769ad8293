package com.github.fsmcompiler;

import java.util.List;

/**
 * Producer of advisory metadata for a specification. Implementations may look at anything, free
 * text included, but what they return is only ever read as a hint: the transition table is
 * resolved without it.
 */
public interface AnnotationProvider {

  /**
   * Returns the annotations for {@code specification}, empty if there is nothing to say. Must not
   * throw for any well-formed specification.
   */
  List<Annotation> annotate(final Specification specification);

}
