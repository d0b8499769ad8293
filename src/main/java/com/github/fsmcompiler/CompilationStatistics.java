package com.github.fsmcompiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple statistics holder for one compile.
 */
public final class CompilationStatistics {
  private final String compileId;
  private final long startMillis = System.currentTimeMillis();
  // stage name to elapsed nanos, in pipeline order
  private final Map<String, Long> stageNanos = new LinkedHashMap<>();
  int tokens;
  int states;
  int globalTransitions;
  int localTransitions;
  int resolvedEntries;
  int errors;
  int warnings;
  int generatedLines;

  CompilationStatistics(final String compileId) {
    this.compileId = compileId;
  }

  void recordStage(final String stage, final long elapsedNanos) {
    stageNanos.put(stage, elapsedNanos);
  }

  public String getCompileId() {
    return compileId;
  }

  public long getStartTimeMillis() {
    return startMillis;
  }

  public int getTokens() {
    return tokens;
  }

  public int getStates() {
    return states;
  }

  public int getGlobalTransitions() {
    return globalTransitions;
  }

  public int getLocalTransitions() {
    return localTransitions;
  }

  public int getResolvedEntries() {
    return resolvedEntries;
  }

  public int getErrors() {
    return errors;
  }

  public int getWarnings() {
    return warnings;
  }

  /**
   * Zero when no HDL was generated.
   */
  public int getGeneratedLines() {
    return generatedLines;
  }

  public Map<String, Long> getStageNanos() {
    return Collections.unmodifiableMap(stageNanos);
  }

  public long getTotalNanos() {
    long total = 0L;
    for (final long nanos : stageNanos.values()) {
      total += nanos;
    }
    return total;
  }

  @Override
  public String toString() {
    return "CompilationStatistics [compileId=" + compileId + ", tokens=" + tokens + ", states="
        + states + ", globalTransitions=" + globalTransitions + ", localTransitions="
        + localTransitions + ", resolvedEntries=" + resolvedEntries + ", errors=" + errors
        + ", warnings=" + warnings + ", generatedLines=" + generatedLines + ", totalMillis="
        + getTotalNanos() / 1_000_000L + "]";
  }

}
