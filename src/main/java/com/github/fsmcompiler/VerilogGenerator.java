package com.github.fsmcompiler;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Emits a synthesizable Verilog-2001 Moore machine for a validated specification.
 *
 * Layout of the generated module:<br>
 * 1. a state register with synchronous reset to the initial state<br>
 * 2. one combinational next-state block: global transitions first in declaration order, then a
 * case over the current state running each state's guard chains, the default being to hold<br>
 * 3. one one-shot down counter per timed state, loaded by START_TIMER edges into that state and
 * read only by that state's timeout<br>
 * 4. output decode from the current state alone, so outputs can never glitch on a transition<br>
 * 5. a registered one-cycle strobe per domain action<br>
 *
 * Generation is deterministic: the same specification and configuration give the same text.
 */
public final class VerilogGenerator {
  private static final Logger logger =
      LogManager.getLogger(VerilogGenerator.class.getSimpleName());

  private static final String indent = "  ";

  private final CompilerConfiguration config;

  public VerilogGenerator(final CompilerConfiguration config) {
    this.config = config;
  }

  /**
   * Generates the module. Must only be called once validation came back without errors; anything
   * else is a pipeline bug and fails with
   * {@link CompilerException.Code#INTERNAL_INVARIANT_VIOLATION}.
   */
  public GeneratedDesign generate(final Specification specification, final TransitionTable table,
      final Diagnostics diagnostics) throws CompilerException {
    if (diagnostics != null && diagnostics.hasErrors()) {
      throw new CompilerException(CompilerException.Code.INTERNAL_INVARIANT_VIOLATION,
          "Code generation invoked with " + diagnostics.errorCount() + " unresolved errors");
    }
    final State initial = specification.getInitialState();
    if (initial == null) {
      throw new CompilerException(CompilerException.Code.INTERNAL_INVARIANT_VIOLATION,
          "Code generation invoked without an initial state");
    }

    final StateEncoding encoding = StateEncoding.of(specification, config.getEncoding());
    final Map<String, Integer> counterWidths = new LinkedHashMap<>();
    final Map<String, Long> counterCycles = new LinkedHashMap<>();
    for (final Timer timer : specification.getTimers().values()) {
      if (timer.getDuration() == null) {
        throw new CompilerException(CompilerException.Code.INTERNAL_INVARIANT_VIOLATION,
            "Timer of " + timer.getOwner() + " has no duration");
      }
      final long cycles = timer.getDuration().toCycles(config.getClockHz());
      counterCycles.put(timer.getOwner(), cycles);
      counterWidths.put(timer.getOwner(), counterWidth(cycles));
    }

    final Emitter emitter =
        new Emitter(specification, table, encoding, counterWidths, counterCycles);
    final String hdl = emitter.emit();
    final GeneratedDesign design = new GeneratedDesign(config.getModuleName(), hdl, encoding,
        counterWidths, counterCycles);
    logger.info(String.format("Generated module %s: %s encoding, %d state bits, %d timers",
        config.getModuleName(), encoding.getStyle(), encoding.getWidth(), counterWidths.size()));
    if (logger.isDebugEnabled()) {
      logger.debug(design.report());
    }
    return design;
  }

  /**
   * Bits needed to count down from {@code cycles - 1}, ie. ceil(log2(cycles)) and at least 1.
   */
  static int counterWidth(final long cycles) {
    return Math.max(1, 64 - Long.numberOfLeadingZeros(cycles - 1L));
  }

  static String range(final int width) {
    return width == 1 ? "" : "[" + (width - 1) + ":0] ";
  }

  static String stateParam(final String state) {
    return "S_" + state;
  }

  static String eventPort(final String event) {
    return "ev_" + event;
  }

  static String variablePort(final String variable) {
    return "in_" + variable;
  }

  static String outputPort(final String signal) {
    return "out_" + signal;
  }

  static String actionPort(final String action) {
    return "act_" + action;
  }

  static String symbolParam(final String variable, final String symbol) {
    return "C_" + variable + "_" + symbol;
  }

  static String timerCounter(final String owner) {
    return "tmr_" + owner;
  }

  /**
   * Holds everything one generation run needs; created per call so the generator stays stateless.
   */
  private final class Emitter {
    private final Specification specification;
    private final TransitionTable table;
    private final StateEncoding encoding;
    private final Map<String, Integer> counterWidths;
    private final Map<String, Long> counterCycles;
    private final List<String> actions;
    private final StringWriter buffer = new StringWriter();
    private final PrintWriter out = new PrintWriter(buffer);

    Emitter(final Specification specification, final TransitionTable table,
        final StateEncoding encoding, final Map<String, Integer> counterWidths,
        final Map<String, Long> counterCycles) {
      this.specification = specification;
      this.table = table;
      this.encoding = encoding;
      this.counterWidths = counterWidths;
      this.counterCycles = counterCycles;
      this.actions = collectActions(specification);
    }

    String emit() {
      emitBanner();
      emitPorts();
      emitDeclarations();
      emitStateRegister();
      emitNextState();
      emitOutputDecode();
      out.print("endmodule\n");
      out.flush();
      return buffer.toString();
    }

    private void emitBanner() {
      final SpecificationHeader header = specification.getHeader();
      out.print("// Generated by fsm-compiler. Do not edit.\n");
      if (header.getFeature() != null) {
        out.printf("// Feature: %s\n", header.getFeature());
      }
      if (header.getIntent() != null) {
        out.printf("// Intent: %s\n", header.getIntent());
      }
      for (final String assumption : header.getAssumptions()) {
        out.printf("// Assumes: %s\n", assumption);
      }
      out.printf("// State encoding: %s, %d bits\n", encoding.getStyle(), encoding.getWidth());
      for (final Annotation annotation : specification.getAnnotations()) {
        if (annotation.getTarget() == Annotation.Target.MACHINE) {
          out.printf("// Hint: %s %s\n", annotation.getHint(), annotation.getNote());
        }
      }
      out.print("\n");
    }

    private void emitPorts() {
      final List<String> ports = new ArrayList<>();
      ports.add("input  wire clk");
      ports.add("input  wire " + resetPort());
      for (final String event : specification.getEvents()) {
        ports.add("input  wire " + eventPort(event));
      }
      for (final ConditionVariable variable : specification.getVariables().values()) {
        ports.add("input  wire " + range(variableWidth(variable))
            + variablePort(variable.getName()));
      }
      for (final OutputSignal signal : specification.getSignals().values()) {
        ports.add("output reg  " + range(signal.width()) + outputPort(signal.getName()));
      }
      for (final String action : actions) {
        ports.add("output reg  " + actionPort(action));
      }
      out.printf("module %s (\n", config.getModuleName());
      for (int i = 0; i < ports.size(); i++) {
        out.printf("%s%s%s\n", indent, ports.get(i), i + 1 < ports.size() ? "," : "");
      }
      out.print(");\n\n");
    }

    private void emitDeclarations() {
      for (final String state : encoding.getStates()) {
        out.printf("%slocalparam %s%s = %s;\n", indent, range(encoding.getWidth()),
            stateParam(state), encoding.literal(state));
      }
      for (final ConditionVariable variable : specification.getVariables().values()) {
        final int width = variableWidth(variable);
        final List<String> symbols = variable.getSymbols();
        for (int i = 0; i < symbols.size(); i++) {
          out.printf("%slocalparam %s%s = %d'd%d;\n", indent, range(width),
              symbolParam(variable.getName(), symbols.get(i)), width, i);
        }
      }
      out.print("\n");
      out.printf("%sreg %sstate_q;\n", indent, range(encoding.getWidth()));
      out.printf("%sreg %sstate_d;\n", indent, range(encoding.getWidth()));
      for (final Map.Entry<String, Integer> counter : counterWidths.entrySet()) {
        final String name = timerCounter(counter.getKey());
        out.printf("%s// %s: %s, %d cycles\n", indent, name,
            specification.getTimer(counter.getKey()).getDuration(),
            counterCycles.get(counter.getKey()));
        out.printf("%sreg %s%s;\n", indent, range(counter.getValue()), name);
        out.printf("%sreg %s_run;\n", indent, name);
        out.printf("%sreg %s_start;\n", indent, name);
        out.printf("%sreg %s_stop;\n", indent, name);
        out.printf("%swire %s_expired = %s_run && (%s == %d'd0);\n", indent, name, name, name,
            counter.getValue());
      }
      for (final String action : actions) {
        out.printf("%sreg %s_d;\n", indent, actionPort(action));
      }
      out.print("\n");
    }

    private void emitStateRegister() {
      final String initial = stateParam(specification.getInitialState().getName());
      out.printf("%salways @(posedge clk) begin\n", indent);
      out.printf("%s%sif (%s) begin\n", indent, indent, resetCondition());
      out.printf("%s%s%sstate_q <= %s;\n", indent, indent, indent, initial);
      for (final Map.Entry<String, Integer> counter : counterWidths.entrySet()) {
        final String name = timerCounter(counter.getKey());
        out.printf("%s%s%s%s <= %d'd0;\n", indent, indent, indent, name, counter.getValue());
        out.printf("%s%s%s%s_run <= 1'b0;\n", indent, indent, indent, name);
      }
      for (final String action : actions) {
        out.printf("%s%s%s%s <= 1'b0;\n", indent, indent, indent, actionPort(action));
      }
      out.printf("%s%send else begin\n", indent, indent);
      out.printf("%s%s%sstate_q <= state_d;\n", indent, indent, indent);
      for (final Map.Entry<String, Integer> counter : counterWidths.entrySet()) {
        final String name = timerCounter(counter.getKey());
        final String prefix = indent + indent + indent;
        out.printf("%sif (%s_start) begin\n", prefix, name);
        out.printf("%s%s%s <= %d'd%d;\n", prefix, indent, name, counter.getValue(),
            counterCycles.get(counter.getKey()) - 1L);
        out.printf("%s%s%s_run <= 1'b1;\n", prefix, indent, name);
        out.printf("%send else if (%s_stop || %s_expired) begin\n", prefix, name, name);
        out.printf("%s%s%s_run <= 1'b0;\n", prefix, indent, name);
        out.printf("%send else if (%s_run) begin\n", prefix, name);
        out.printf("%s%s%s <= %s - %d'd1;\n", prefix, indent, name, name, counter.getValue());
        out.printf("%send\n", prefix);
      }
      for (final String action : actions) {
        out.printf("%s%s%s%s <= %s_d;\n", indent, indent, indent, actionPort(action),
            actionPort(action));
      }
      out.printf("%s%send\n", indent, indent);
      out.printf("%send\n\n", indent);
    }

    private void emitNextState() {
      final String body = indent + indent;
      out.printf("%salways @* begin\n", indent);
      out.printf("%sstate_d = state_q;\n", body);
      for (final String owner : counterWidths.keySet()) {
        out.printf("%s%s_start = 1'b0;\n", body, timerCounter(owner));
        out.printf("%s%s_stop = 1'b0;\n", body, timerCounter(owner));
      }
      for (final String action : actions) {
        out.printf("%s%s_d = 1'b0;\n", body, actionPort(action));
      }

      String keyword = "if";
      for (final GlobalTransition global : distinctGlobals()) {
        out.printf("%s%s (%s) begin\n", body, keyword, eventPort(global.getTrigger().getEvent()));
        emitComment(body + indent, global.getComment());
        emitAnnotations(body + indent, Annotation.Target.TRANSITION,
            "*/" + global.getTrigger().key());
        emitTransition(body + indent, null, global.getDestination(), global.getActions());
        out.printf("%send", body);
        keyword = " else if";
      }
      final boolean nested = !"if".equals(keyword);
      final String caseIndent = nested ? body + indent : body;
      if (nested) {
        out.print(" else begin\n");
      }
      emitCase(caseIndent);
      if (nested) {
        out.printf("%send\n", body);
      }
      out.printf("%send\n\n", indent);
    }

    private void emitCase(final String prefix) {
      out.printf("%scase (state_q)\n", prefix);
      for (final State state : specification.getStates().values()) {
        final String name = state.getName();
        out.printf("%s%s%s: begin\n", prefix, indent, stateParam(name));
        emitAnnotations(prefix + indent + indent, Annotation.Target.STATE, name);
        String keyword = "if";
        for (final ResolvedEntry entry : localEntries(name)) {
          final Trigger trigger = entry.getTrigger();
          final String fired = trigger.isTimeout() ? timerCounter(name) + "_expired"
              : eventPort(trigger.getEvent());
          out.printf("%s%s%s%s (%s) begin\n", prefix, indent, indent,
              "if".equals(keyword) ? keyword : "end " + keyword, fired);
          emitAnnotations(prefix + indent + indent + indent, Annotation.Target.TRANSITION,
              name + "/" + trigger.key());
          emitChain(prefix + indent + indent + indent, name, entry.getBranches());
          keyword = "else if";
        }
        if (!"if".equals(keyword)) {
          out.printf("%s%s%send\n", prefix, indent, indent);
        }
        out.printf("%s%send\n", prefix, indent);
      }
      out.printf("%s%sdefault: begin\n", prefix, indent);
      out.printf("%s%s%sstate_d = %s;\n", prefix, indent, indent,
          stateParam(specification.getInitialState().getName()));
      out.printf("%s%send\n", prefix, indent);
      out.printf("%sendcase\n", prefix);
    }

    private void emitChain(final String prefix, final String source,
        final List<GuardedBranch> branches) {
      boolean open = false;
      for (int i = 0; i < branches.size(); i++) {
        final GuardedBranch branch = branches.get(i);
        final Condition condition = branch.getCondition();
        if (condition.isAlways()) {
          out.printf("%s%s\n", prefix, open ? "end else begin" : "begin");
        } else {
          out.printf("%s%s (%s) begin\n", prefix, open ? "end else if" : "if",
              condition.accept(new ConditionWriter()));
        }
        emitComment(prefix + indent, branch.getComment());
        emitTransition(prefix + indent, source, branch.getDestination(), branch.getActions());
        open = true;
        if (condition.isAlways()) {
          // anything after a catch-all is dead
          break;
        }
      }
      if (open) {
        out.printf("%send\n", prefix);
      }
    }

    /**
     * Destination null means STAY. Source null means a global transition, taken from any state.
     */
    private void emitTransition(final String prefix, final String source,
        final String destination, final List<Action> edgeActions) {
      if (destination == null) {
        out.printf("%sstate_d = state_q;\n", prefix);
      } else {
        out.printf("%sstate_d = %s;\n", prefix, stateParam(destination));
      }
      final String entered = destination == null ? source : destination;
      for (final Action action : edgeActions) {
        switch (action.getType()) {
          case START_TIMER:
            if (entered != null && counterWidths.containsKey(entered)) {
              out.printf("%s%s_start = 1'b1;\n", prefix, timerCounter(entered));
            } else {
              out.printf("%s// %s: %s owns no timer\n", prefix, action, entered);
            }
            break;
          case STOP_TIMER:
            if (source == null) {
              for (final String owner : counterWidths.keySet()) {
                out.printf("%s%s_stop = (state_q == %s);\n", prefix, timerCounter(owner),
                    stateParam(owner));
              }
            } else if (counterWidths.containsKey(source)) {
              out.printf("%s%s_stop = 1'b1;\n", prefix, timerCounter(source));
            }
            break;
          case STOP_ALL_TIMERS:
            for (final String owner : counterWidths.keySet()) {
              out.printf("%s%s_stop = 1'b1;\n", prefix, timerCounter(owner));
            }
            break;
          default:
            out.printf("%s%s_d = 1'b1;%s\n", prefix, actionPort(action.getName()),
                action.getArguments().isEmpty() ? "" : " // " + action);
            break;
        }
      }
    }

    private void emitOutputDecode() {
      final String body = indent + indent;
      out.printf("%salways @* begin\n", indent);
      out.printf("%scase (state_q)\n", body);
      for (final State state : specification.getStates().values()) {
        out.printf("%s%s%s: begin\n", body, indent, stateParam(state.getName()));
        emitOutputs(body + indent + indent, state);
        out.printf("%s%send\n", body, indent);
      }
      out.printf("%s%sdefault: begin\n", body, indent);
      emitOutputs(body + indent + indent, specification.getInitialState());
      out.printf("%s%send\n", body, indent);
      out.printf("%sendcase\n", body);
      out.printf("%send\n\n", indent);
    }

    private void emitOutputs(final String prefix, final State state) {
      for (final OutputSignal signal : specification.getSignals().values()) {
        final String level = state.getOutputLevel(signal.getName());
        out.printf("%s%s = %d'd%d; // %s\n", prefix, outputPort(signal.getName()),
            signal.width(), signal.getDomain().encode(level), level);
      }
    }

    private void emitComment(final String prefix, final String comment) {
      if (comment != null && !comment.isEmpty()) {
        out.printf("%s// %s\n", prefix, comment);
      }
    }

    private void emitAnnotations(final String prefix, final Annotation.Target target,
        final String subject) {
      for (final Annotation annotation : specification.getAnnotations(target, subject)) {
        out.printf("%s// %s: %s\n", prefix, annotation.getHint(), annotation.getNote());
      }
    }

    private List<GlobalTransition> distinctGlobals() {
      final Set<Trigger> seen = new LinkedHashSet<>();
      final List<GlobalTransition> globals = new ArrayList<>();
      for (final GlobalTransition global : specification.getGlobalTransitions()) {
        if (seen.add(global.getTrigger())) {
          globals.add(global);
        }
      }
      return globals;
    }

    private List<ResolvedEntry> localEntries(final String state) {
      final List<ResolvedEntry> entries = new ArrayList<>();
      for (final Trigger trigger : specification.triggersFor(state)) {
        final ResolvedEntry entry = table.lookup(state, trigger);
        if (entry.getSource() == ResolvedEntry.Source.LOCAL) {
          entries.add(entry);
        }
      }
      return entries;
    }

    private String resetPort() {
      return config.isResetActiveLow() ? "rst_n" : "rst";
    }

    private String resetCondition() {
      return config.isResetActiveLow() ? "!rst_n" : "rst";
    }

    private int variableWidth(final ConditionVariable variable) {
      return variable.width(config.getNumericVariableWidth());
    }

    /**
     * Renders a guard as a Verilog expression over the input ports.
     */
    private final class ConditionWriter implements Condition.Visitor<String> {
      @Override
      public String visitAlways() {
        return "1'b1";
      }

      @Override
      public String visitVariable(final Condition.Variable variable) {
        return variablePort(variable.getName());
      }

      @Override
      public String visitComparison(final Condition.Comparison comparison) {
        final String right;
        if (comparison.isNumeric()) {
          final ConditionVariable variable =
              specification.getVariables().get(comparison.getVariable());
          right = variableWidth(variable) + "'d" + comparison.getLiteral();
        } else {
          right = symbolParam(comparison.getVariable(), (String) comparison.getLiteral());
        }
        return variablePort(comparison.getVariable()) + " " + comparison.getOperator().getSymbol()
            + " " + right;
      }

      @Override
      public String visitNot(final Condition.Not not) {
        return "!(" + not.getOperand().accept(this) + ")";
      }

      @Override
      public String visitBinary(final Condition.Binary binary) {
        return "(" + binary.getLeft().accept(this)
            + (binary.isConjunction() ? " && " : " || ") + binary.getRight().accept(this) + ")";
      }
    }
  }

  /**
   * Distinct domain actions in first-use order; each becomes a strobe output.
   */
  private static List<String> collectActions(final Specification specification) {
    final Set<String> names = new LinkedHashSet<>();
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      for (final Action action : global.getActions()) {
        if (!action.isTimerControl()) {
          names.add(action.getName());
        }
      }
    }
    for (final LocalTransition local : specification.getLocalTransitions()) {
      for (final GuardedBranch branch : local.getBranches()) {
        for (final Action action : branch.getActions()) {
          if (!action.isTimerControl()) {
            names.add(action.getName());
          }
        }
      }
    }
    return new ArrayList<>(names);
  }
}
