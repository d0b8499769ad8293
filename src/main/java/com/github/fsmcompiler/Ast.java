package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Syntax tree produced by the {@link Parser}. Nodes mirror the source one-to-one and carry only
 * what was written; no cross-reference has been checked yet. Lowering to the IR happens in
 * {@link IrBuilder}.
 */
public final class Ast {
  private Ast() {}

  public static final class Document {
    private final String header;
    private final List<GlobalTransitionNode> globalTransitions;
    private final List<StateNode> states;
    private final List<FromBlock> fromBlocks;

    Document(final String header, final List<GlobalTransitionNode> globalTransitions,
        final List<StateNode> states, final List<FromBlock> fromBlocks) {
      this.header = header == null ? "" : header;
      this.globalTransitions = freeze(globalTransitions);
      this.states = freeze(states);
      this.fromBlocks = freeze(fromBlocks);
    }

    /**
     * Raw text ahead of the first section, empty if there was none.
     */
    public String getHeader() {
      return header;
    }

    public List<GlobalTransitionNode> getGlobalTransitions() {
      return globalTransitions;
    }

    public List<StateNode> getStates() {
      return states;
    }

    public List<FromBlock> getFromBlocks() {
      return fromBlocks;
    }
  }

  public static final class TriggerNode {
    private final boolean timeout;
    private final String event;
    private final Duration duration;
    private final SourcePosition position;

    private TriggerNode(final boolean timeout, final String event, final Duration duration,
        final SourcePosition position) {
      this.timeout = timeout;
      this.event = event;
      this.duration = duration;
      this.position = position;
    }

    static TriggerNode onEvent(final String event, final SourcePosition position) {
      return new TriggerNode(false, event, null, position);
    }

    static TriggerNode onTimeout(final Duration duration, final SourcePosition position) {
      return new TriggerNode(true, null, duration, position);
    }

    public boolean isTimeout() {
      return timeout;
    }

    /**
     * Event name for ON_EVENT triggers, null for ON_TIMEOUT.
     */
    public String getEvent() {
      return event;
    }

    /**
     * Timeout duration, null for ON_EVENT or for an ON_TIMEOUT written without one.
     */
    public Duration getDuration() {
      return duration;
    }

    public SourcePosition getPosition() {
      return position;
    }
  }

  public static final class ActionNode {
    private final String name;
    private final List<String> arguments;
    private final Duration duration;
    private final SourcePosition position;

    ActionNode(final String name, final List<String> arguments, final Duration duration,
        final SourcePosition position) {
      this.name = name;
      this.arguments = freeze(arguments);
      this.duration = duration;
      this.position = position;
    }

    public String getName() {
      return name;
    }

    public List<String> getArguments() {
      return arguments;
    }

    /**
     * Set only for START_TIMER.
     */
    public Duration getDuration() {
      return duration;
    }

    public SourcePosition getPosition() {
      return position;
    }
  }

  public static final class GlobalTransitionNode {
    private final TriggerNode trigger;
    private final List<ActionNode> actions;
    private final String destination;
    private final SourcePosition destinationPosition;
    private final String comment;
    private final SourcePosition position;

    GlobalTransitionNode(final TriggerNode trigger, final List<ActionNode> actions,
        final String destination, final SourcePosition destinationPosition, final String comment,
        final SourcePosition position) {
      this.trigger = trigger;
      this.actions = freeze(actions);
      this.destination = destination;
      this.destinationPosition = destinationPosition;
      this.comment = comment;
      this.position = position;
    }

    public TriggerNode getTrigger() {
      return trigger;
    }

    public List<ActionNode> getActions() {
      return actions;
    }

    public String getDestination() {
      return destination;
    }

    public SourcePosition getDestinationPosition() {
      return destinationPosition;
    }

    public String getComment() {
      return comment;
    }

    public SourcePosition getPosition() {
      return position;
    }
  }

  public static final class OutputNode {
    private final String signal;
    private final String level;
    private final SourcePosition position;

    OutputNode(final String signal, final String level, final SourcePosition position) {
      this.signal = signal;
      this.level = level;
      this.position = position;
    }

    public String getSignal() {
      return signal;
    }

    public String getLevel() {
      return level;
    }

    public SourcePosition getPosition() {
      return position;
    }
  }

  public static final class StateNode {
    private final String name;
    private final List<OutputNode> outputs;
    private final boolean initial;
    private final String comment;
    private final SourcePosition position;

    StateNode(final String name, final List<OutputNode> outputs, final boolean initial,
        final String comment, final SourcePosition position) {
      this.name = name;
      this.outputs = freeze(outputs);
      this.initial = initial;
      this.comment = comment;
      this.position = position;
    }

    public String getName() {
      return name;
    }

    public List<OutputNode> getOutputs() {
      return outputs;
    }

    public boolean isInitial() {
      return initial;
    }

    public String getComment() {
      return comment;
    }

    public SourcePosition getPosition() {
      return position;
    }
  }

  public static final class FromBlock {
    private final String state;
    private final SourcePosition position;
    private final List<RuleNode> rules;

    FromBlock(final String state, final SourcePosition position, final List<RuleNode> rules) {
      this.state = state;
      this.position = position;
      this.rules = freeze(rules);
    }

    public String getState() {
      return state;
    }

    public SourcePosition getPosition() {
      return position;
    }

    public List<RuleNode> getRules() {
      return rules;
    }
  }

  /**
   * One line of a FROM block. An unguarded rule carries {@link Condition#ALWAYS}; a null
   * destination means STAY.
   */
  public static final class RuleNode {
    private final TriggerNode trigger;
    private final Condition condition;
    private final boolean explicitElse;
    private final List<ActionNode> actions;
    private final String destination;
    private final SourcePosition destinationPosition;
    private final String comment;
    private final SourcePosition position;

    RuleNode(final TriggerNode trigger, final Condition condition, final boolean explicitElse,
        final List<ActionNode> actions, final String destination,
        final SourcePosition destinationPosition, final String comment,
        final SourcePosition position) {
      this.trigger = trigger;
      this.condition = condition;
      this.explicitElse = explicitElse;
      this.actions = freeze(actions);
      this.destination = destination;
      this.destinationPosition = destinationPosition;
      this.comment = comment;
      this.position = position;
    }

    public TriggerNode getTrigger() {
      return trigger;
    }

    public Condition getCondition() {
      return condition;
    }

    public boolean isExplicitElse() {
      return explicitElse;
    }

    public List<ActionNode> getActions() {
      return actions;
    }

    public String getDestination() {
      return destination;
    }

    public SourcePosition getDestinationPosition() {
      return destinationPosition;
    }

    public String getComment() {
      return comment;
    }

    public SourcePosition getPosition() {
      return position;
    }
  }

  private static <T> List<T> freeze(final List<T> list) {
    return list == null ? Collections.<T>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(list));
  }
}
