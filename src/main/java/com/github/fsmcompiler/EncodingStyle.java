package com.github.fsmcompiler;

/**
 * How the generated state register encodes states.
 */
public enum EncodingStyle {
  // ceil(log2(n)) flip-flops, states numbered in declaration order
  BINARY,
  // one flip-flop per state
  ONE_HOT,
  // binary unless the annotations ask for one-hot
  AUTO;
}
