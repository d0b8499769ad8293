package com.github.fsmcompiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of code generation: the HDL text plus the side-channel report of the widths chosen for
 * the timer counters.
 */
public final class GeneratedDesign {
  private final String moduleName;
  private final String hdl;
  private final StateEncoding encoding;
  private final Map<String, Integer> counterWidths;
  private final Map<String, Long> counterCycles;

  GeneratedDesign(final String moduleName, final String hdl, final StateEncoding encoding,
      final Map<String, Integer> counterWidths, final Map<String, Long> counterCycles) {
    this.moduleName = moduleName;
    this.hdl = hdl;
    this.encoding = encoding;
    this.counterWidths = Collections.unmodifiableMap(new LinkedHashMap<>(counterWidths));
    this.counterCycles = Collections.unmodifiableMap(new LinkedHashMap<>(counterCycles));
  }

  public String getModuleName() {
    return moduleName;
  }

  public String getHdl() {
    return hdl;
  }

  public StateEncoding getEncoding() {
    return encoding;
  }

  /**
   * Owning state to counter width in bits.
   */
  public Map<String, Integer> getCounterWidths() {
    return counterWidths;
  }

  /**
   * Owning state to the number of clock cycles the counter spans.
   */
  public Map<String, Long> getCounterCycles() {
    return counterCycles;
  }

  public int getLineCount() {
    int lines = 0;
    for (int i = 0; i < hdl.length(); i++) {
      if (hdl.charAt(i) == '\n') {
        lines++;
      }
    }
    return lines;
  }

  /**
   * Human readable counter report, one line per timer.
   */
  public String report() {
    final StringBuilder builder = new StringBuilder();
    builder.append("module ").append(moduleName).append(": ").append(encoding.getStyle())
        .append(" state register, ").append(encoding.getWidth()).append(" bits\n");
    for (final Map.Entry<String, Integer> entry : counterWidths.entrySet()) {
      builder.append("timer ").append(entry.getKey()).append(": ")
          .append(counterCycles.get(entry.getKey())).append(" cycles, ").append(entry.getValue())
          .append(" bits\n");
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return "GeneratedDesign [moduleName=" + moduleName + ", encoding=" + encoding
        + ", counterWidths=" + counterWidths + "]";
  }
}
