package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmcompiler.Ast.ActionNode;
import com.github.fsmcompiler.Ast.Document;
import com.github.fsmcompiler.Ast.FromBlock;
import com.github.fsmcompiler.Ast.GlobalTransitionNode;
import com.github.fsmcompiler.Ast.OutputNode;
import com.github.fsmcompiler.Ast.RuleNode;
import com.github.fsmcompiler.Ast.StateNode;
import com.github.fsmcompiler.Ast.TriggerNode;

/**
 * Lowers a syntax tree into a {@link Specification}.
 *
 * Identifiers are taken exactly as written. FROM blocks naming the same state are merged and the
 * branches of every (state, trigger) pair are concatenated in source order, which keeps first
 * match semantics across blocks. Colliding declarations are reported as IR diagnostics; the
 * offending declaration is dropped and building carries on.
 */
public final class IrBuilder {
  private static final Logger logger = LogManager.getLogger(IrBuilder.class.getSimpleName());

  private final List<OutputDomain> domains;
  private final Diagnostics diagnostics;

  public IrBuilder(final List<OutputDomain> domains, final Diagnostics diagnostics) {
    this.domains = domains == null || domains.isEmpty() ? OutputDomain.builtIns()
        : Collections.unmodifiableList(new ArrayList<>(domains));
    this.diagnostics = diagnostics;
  }

  public Specification build(final Document document) {
    final Set<String> events = new LinkedHashSet<>();

    final List<GlobalTransition> globals = new ArrayList<>();
    for (final GlobalTransitionNode node : document.getGlobalTransitions()) {
      final Trigger trigger = lowerTrigger(node.getTrigger());
      if (trigger.isTimeout()) {
        diagnostics.report(DiagnosticKind.TIMEOUT_IN_GLOBAL_TRANSITION,
            "Global transition to " + node.getDestination()
                + " triggers on a timeout; timeouts can only be handled inside a FROM block",
            node.getPosition());
        continue;
      }
      events.add(trigger.getEvent());
      globals.add(new GlobalTransition(trigger, lowerActions(node.getActions()),
          node.getDestination(), node.getComment(), node.getPosition()));
    }

    final List<State> states = lowerStates(document.getStates());
    final List<OutputSignal> signals = inferSignals(document.getStates(), states);

    final Map<StateTrigger, List<GuardedBranch>> chains = new LinkedHashMap<>();
    final Map<StateTrigger, SourcePosition> chainPositions = new LinkedHashMap<>();
    final Map<String, Duration> declaredTimeouts = new LinkedHashMap<>();
    final VariableInference variables = new VariableInference();
    for (final FromBlock block : document.getFromBlocks()) {
      for (final RuleNode rule : block.getRules()) {
        final Trigger trigger = lowerTrigger(rule.getTrigger());
        if (trigger.isTimeout()) {
          if (trigger.getDuration() != null) {
            declaredTimeouts.putIfAbsent(block.getState(), trigger.getDuration());
          }
        } else {
          events.add(trigger.getEvent());
        }
        final StateTrigger key = StateTrigger.of(block.getState(), trigger);
        if (!chains.containsKey(key)) {
          chains.put(key, new ArrayList<GuardedBranch>());
          chainPositions.put(key, rule.getPosition());
        }
        variables.infer(rule.getCondition(), rule.getPosition());
        chains.get(key).add(new GuardedBranch(rule.getCondition(), rule.getDestination(),
            lowerActions(rule.getActions()), rule.getComment(), rule.getPosition()));
      }
    }

    final List<LocalTransition> locals = new ArrayList<>();
    for (final Map.Entry<StateTrigger, List<GuardedBranch>> chain : chains.entrySet()) {
      final StateTrigger key = chain.getKey();
      locals.add(new LocalTransition(key.getState(), key.getTrigger(), chain.getValue(),
          chainPositions.get(key)));
    }

    final List<Timer> timers = inferTimers(states, globals, locals, declaredTimeouts);

    final Specification specification = new Specification(
        SpecificationHeader.parse(document.getHeader()), states, globals, locals, signals,
        new ArrayList<>(events), variables.toList(), timers, null);
    logger.info(String.format(
        "Built IR with %d states, %d global transitions, %d local transitions, %d events, "
            + "%d signals, %d variables, %d timers",
        states.size(), globals.size(), locals.size(), events.size(), signals.size(),
        specification.getVariables().size(), timers.size()));
    return specification;
  }

  private List<State> lowerStates(final List<StateNode> nodes) {
    final Map<String, State> states = new LinkedHashMap<>();
    for (final StateNode node : nodes) {
      final State existing = states.get(node.getName());
      if (existing != null) {
        diagnostics.report(DiagnosticKind.DUPLICATE_STATE_NAME,
            "State " + node.getName() + " is already declared at " + existing.getPosition(),
            node.getPosition());
        continue;
      }
      final Map<String, String> outputs = new LinkedHashMap<>();
      for (final OutputNode output : node.getOutputs()) {
        if (outputs.containsKey(output.getSignal())) {
          diagnostics.report(DiagnosticKind.DUPLICATE_OUTPUT_ASSIGNMENT,
              "State " + node.getName() + " assigns output " + output.getSignal() + " twice",
              output.getPosition());
          continue;
        }
        outputs.put(output.getSignal(), output.getLevel());
      }
      states.put(node.getName(), new State(node.getName(), outputs, node.isInitial(),
          node.getComment(), node.getPosition()));
    }
    return new ArrayList<>(states.values());
  }

  /**
   * A signal takes the first registered domain that admits every level it is assigned. Failing
   * that, the domain of its first level is binding and every level outside it is reported. Only
   * a signal whose first level is unregistered gets an open domain of its own.
   */
  private List<OutputSignal> inferSignals(final List<StateNode> nodes, final List<State> states) {
    final Map<String, List<OutputNode>> assignments = new LinkedHashMap<>();
    final Set<String> kept = new LinkedHashSet<>();
    for (final State state : states) {
      kept.add(state.getName() + "@" + state.getPosition());
    }
    for (final StateNode node : nodes) {
      if (!kept.contains(node.getName() + "@" + node.getPosition())) {
        continue;
      }
      for (final OutputNode output : node.getOutputs()) {
        if (!assignments.containsKey(output.getSignal())) {
          assignments.put(output.getSignal(), new ArrayList<OutputNode>());
        }
        assignments.get(output.getSignal()).add(output);
      }
    }

    final List<OutputSignal> signals = new ArrayList<>();
    for (final Map.Entry<String, List<OutputNode>> entry : assignments.entrySet()) {
      final List<String> levels = new ArrayList<>();
      for (final OutputNode output : entry.getValue()) {
        if (!levels.contains(output.getLevel())) {
          levels.add(output.getLevel());
        }
      }
      OutputDomain chosen = null;
      for (final OutputDomain domain : domains) {
        if (domain.getLevels().containsAll(levels)) {
          chosen = domain;
          break;
        }
      }
      if (chosen == null) {
        // the first level fixes the vocabulary; only an unregistered one opens a domain
        chosen = registeredDomainOf(levels.get(0));
        if (chosen == null) {
          chosen = OutputDomain.open(entry.getKey(), levels);
        } else {
          for (final OutputNode output : entry.getValue()) {
            if (!chosen.admits(output.getLevel())) {
              diagnostics.report(DiagnosticKind.UNKNOWN_OUTPUT_DOMAIN,
                  "Output " + entry.getKey() + " is a " + chosen.getName() + " signal "
                      + chosen.getLevels() + " but is assigned " + output.getLevel(),
                  output.getPosition());
            }
          }
        }
      }
      signals.add(new OutputSignal(entry.getKey(), chosen));
    }
    return signals;
  }

  private OutputDomain registeredDomainOf(final String level) {
    for (final OutputDomain domain : domains) {
      if (domain.admits(level)) {
        return domain;
      }
    }
    return null;
  }

  /**
   * Timed states are those waiting on a timeout or declaring Timer=RUNNING. The duration comes
   * from ON_TIMEOUT(d) when written, else from the first START_TIMER(d) on an edge into the state.
   */
  private static List<Timer> inferTimers(final List<State> states,
      final List<GlobalTransition> globals, final List<LocalTransition> locals,
      final Map<String, Duration> declaredTimeouts) {
    final Set<String> timed = new LinkedHashSet<>();
    for (final State state : states) {
      if (state.declaresRunningTimer()) {
        timed.add(state.getName());
      }
    }
    for (final LocalTransition local : locals) {
      if (local.getTrigger().isTimeout()) {
        timed.add(local.getSource());
      }
    }
    final Set<String> declared = new LinkedHashSet<>();
    for (final State state : states) {
      declared.add(state.getName());
    }

    final List<Timer> timers = new ArrayList<>();
    for (final State state : states) {
      final String name = state.getName();
      if (!timed.contains(name) || !declared.contains(name)) {
        continue;
      }
      Duration duration = declaredTimeouts.get(name);
      if (duration == null) {
        duration = firstStartedDuration(name, globals, locals);
      }
      timers.add(new Timer(name, duration));
    }
    return timers;
  }

  private static Duration firstStartedDuration(final String state,
      final List<GlobalTransition> globals, final List<LocalTransition> locals) {
    for (final GlobalTransition global : globals) {
      if (global.getDestination().equals(state)) {
        final Duration started = startedDuration(global.getActions());
        if (started != null) {
          return started;
        }
      }
    }
    for (final LocalTransition local : locals) {
      for (final GuardedBranch branch : local.getBranches()) {
        if (branch.destinationFrom(local.getSource()).equals(state)) {
          final Duration started = startedDuration(branch.getActions());
          if (started != null) {
            return started;
          }
        }
      }
    }
    return null;
  }

  static Duration startedDuration(final List<Action> actions) {
    for (final Action action : actions) {
      if (action.getType() == Action.Type.START_TIMER) {
        return action.getDuration();
      }
    }
    return null;
  }

  private static Trigger lowerTrigger(final TriggerNode node) {
    if (node.isTimeout()) {
      return Trigger.timeout(node.getDuration());
    }
    if (Trigger.timerExpiredEvent.equals(node.getEvent())) {
      return Trigger.timeout(null);
    }
    return Trigger.event(node.getEvent());
  }

  private static List<Action> lowerActions(final List<ActionNode> nodes) {
    final List<Action> actions = new ArrayList<>(nodes.size());
    for (final ActionNode node : nodes) {
      actions.add(Action.of(node.getName(), node.getArguments(), node.getDuration()));
    }
    return actions;
  }

  /**
   * Works out each guard variable's kind from how it is used, reporting the first use that
   * contradicts the kind established before it.
   */
  private final class VariableInference implements Condition.Visitor<Void> {
    private final Map<String, ConditionVariable.Kind> kinds = new LinkedHashMap<>();
    private final Map<String, List<String>> symbols = new LinkedHashMap<>();
    private final Map<String, Long> maxLiterals = new LinkedHashMap<>();
    private final Set<String> conflicted = new LinkedHashSet<>();
    private SourcePosition position;

    void infer(final Condition condition, final SourcePosition position) {
      this.position = position;
      condition.accept(this);
    }

    List<ConditionVariable> toList() {
      final List<ConditionVariable> variables = new ArrayList<>();
      for (final Map.Entry<String, ConditionVariable.Kind> entry : kinds.entrySet()) {
        final String name = entry.getKey();
        final Long max = maxLiterals.get(name);
        variables.add(new ConditionVariable(name, entry.getValue(), symbols.get(name),
            max == null ? 0L : max));
      }
      return variables;
    }

    private boolean use(final String name, final ConditionVariable.Kind kind,
        final String usage) {
      final ConditionVariable.Kind established = kinds.get(name);
      if (established == null) {
        kinds.put(name, kind);
        return true;
      }
      if (established != kind) {
        if (conflicted.add(name)) {
          diagnostics.report(DiagnosticKind.INCOMPATIBLE_VARIABLE_USAGE,
              "Variable " + name + " is " + established.name().toLowerCase() + " but is used in "
                  + usage,
              position);
        }
        return false;
      }
      return true;
    }

    @Override
    public Void visitAlways() {
      return null;
    }

    @Override
    public Void visitVariable(final Condition.Variable variable) {
      use(variable.getName(), ConditionVariable.Kind.BOOLEAN, variable.canonical());
      return null;
    }

    @Override
    public Void visitComparison(final Condition.Comparison comparison) {
      final String name = comparison.getVariable();
      if (comparison.isNumeric()) {
        if (use(name, ConditionVariable.Kind.NUMERIC, comparison.canonical())) {
          final Long current = maxLiterals.get(name);
          final long literal = (Long) comparison.getLiteral();
          maxLiterals.put(name, current == null ? literal : Math.max(current, literal));
        }
        return null;
      }
      if (comparison.getOperator().isOrdering()) {
        if (conflicted.add(name)) {
          diagnostics.report(DiagnosticKind.INCOMPATIBLE_VARIABLE_USAGE,
              "Symbolic constant " + comparison.getLiteral() + " cannot be ordered in "
                  + comparison.canonical(),
              position);
        }
        return null;
      }
      if (use(name, ConditionVariable.Kind.SYMBOLIC, comparison.canonical())) {
        if (!symbols.containsKey(name)) {
          symbols.put(name, new ArrayList<String>());
        }
        final List<String> known = symbols.get(name);
        final String symbol = (String) comparison.getLiteral();
        if (!known.contains(symbol)) {
          known.add(symbol);
        }
      }
      return null;
    }

    @Override
    public Void visitNot(final Condition.Not not) {
      return not.getOperand().accept(this);
    }

    @Override
    public Void visitBinary(final Condition.Binary binary) {
      binary.getLeft().accept(this);
      return binary.getRight().accept(this);
    }
  }
}
