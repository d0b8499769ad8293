package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assignment of bit patterns to states. Binary numbers states in declaration order; one-hot gives
 * the n-th declared state bit n. Every pattern not listed here is illegal and recovers to the
 * initial state.
 */
public final class StateEncoding {
  private final EncodingStyle style;
  private final List<String> states;
  private final int width;

  private StateEncoding(final EncodingStyle style, final List<String> states) {
    this.style = style;
    this.states = Collections.unmodifiableList(new ArrayList<>(states));
    if (style == EncodingStyle.ONE_HOT) {
      this.width = Math.max(1, states.size());
    } else {
      this.width = Math.max(1, 32 - Integer.numberOfLeadingZeros(Math.max(0, states.size() - 1)));
    }
  }

  /**
   * Resolves {@link EncodingStyle#AUTO} from the specification's hints: one-hot when asked for and
   * not overruled by a low power preference.
   */
  public static StateEncoding of(final Specification specification, final EncodingStyle style) {
    EncodingStyle resolved = style;
    if (style == EncodingStyle.AUTO) {
      resolved = specification.hasHint(Annotation.Hint.PREFER_ONE_HOT)
          && !specification.hasHint(Annotation.Hint.PREFER_LOW_POWER) ? EncodingStyle.ONE_HOT
              : EncodingStyle.BINARY;
    }
    return new StateEncoding(resolved, new ArrayList<>(specification.getStates().keySet()));
  }

  /**
   * Either BINARY or ONE_HOT, never AUTO.
   */
  public EncodingStyle getStyle() {
    return style;
  }

  public int getWidth() {
    return width;
  }

  public List<String> getStates() {
    return states;
  }

  public int indexOf(final String state) {
    return states.indexOf(state);
  }

  /**
   * Sized Verilog literal of the state's pattern, eg. {@code 2'd3} or {@code 4'b0100}.
   */
  public String literal(final String state) {
    final int index = states.indexOf(state);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown state " + state);
    }
    if (style == EncodingStyle.ONE_HOT) {
      final StringBuilder bits = new StringBuilder();
      for (int bit = width - 1; bit >= 0; bit--) {
        bits.append(bit == index ? '1' : '0');
      }
      return width + "'b" + bits;
    }
    return width + "'d" + index;
  }

  @Override
  public String toString() {
    return "StateEncoding [style=" + style + ", width=" + width + ", states=" + states.size()
        + "]";
  }
}
