package com.github.fsmcompiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Reads and writes the JSON interchange form of a {@link Specification}. The document is versioned
 * and mirrors the IR field for field; guards are stored as their canonical text and parsed again on
 * the way back in, so a round trip resolves to the same transition table.
 */
public final class IrSerializer {
  private static final Logger logger = LogManager.getLogger(IrSerializer.class.getSimpleName());

  public static final int formatVersion = 1;

  private final Gson gson =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

  public String toJson(final Specification specification) {
    final JsonObject root = new JsonObject();
    root.addProperty("formatVersion", formatVersion);
    root.add("header", writeHeader(specification.getHeader()));

    final JsonArray signals = new JsonArray();
    for (final OutputSignal signal : specification.getSignals().values()) {
      final JsonObject object = new JsonObject();
      object.addProperty("name", signal.getName());
      object.addProperty("domain", signal.getDomain().getName());
      object.addProperty("open", signal.getDomain().isOpen());
      object.add("levels", strings(signal.getDomain().getLevels()));
      signals.add(object);
    }
    root.add("signals", signals);

    final JsonArray states = new JsonArray();
    for (final State state : specification.getStates().values()) {
      final JsonObject object = new JsonObject();
      object.addProperty("name", state.getName());
      object.addProperty("initial", state.isMarkedInitial());
      final JsonObject outputs = new JsonObject();
      for (final Map.Entry<String, String> output : state.getOutputs().entrySet()) {
        outputs.addProperty(output.getKey(), output.getValue());
      }
      object.add("outputs", outputs);
      object.addProperty("comment", state.getComment());
      writePosition(object, state.getPosition());
      states.add(object);
    }
    root.add("states", states);

    root.add("events", strings(specification.getEvents()));

    final JsonArray variables = new JsonArray();
    for (final ConditionVariable variable : specification.getVariables().values()) {
      final JsonObject object = new JsonObject();
      object.addProperty("name", variable.getName());
      object.addProperty("kind", variable.getKind().name());
      object.add("symbols", strings(variable.getSymbols()));
      object.addProperty("maxLiteral", variable.getMaxLiteral());
      variables.add(object);
    }
    root.add("variables", variables);

    final JsonArray timers = new JsonArray();
    for (final Timer timer : specification.getTimers().values()) {
      final JsonObject object = new JsonObject();
      object.addProperty("owner", timer.getOwner());
      object.addProperty("duration",
          timer.getDuration() == null ? null : timer.getDuration().canonical());
      timers.add(object);
    }
    root.add("timers", timers);

    final JsonArray globals = new JsonArray();
    for (final GlobalTransition global : specification.getGlobalTransitions()) {
      final JsonObject object = new JsonObject();
      object.addProperty("event", global.getTrigger().getEvent());
      object.add("actions", writeActions(global.getActions()));
      object.addProperty("destination", global.getDestination());
      object.addProperty("comment", global.getComment());
      writePosition(object, global.getPosition());
      globals.add(object);
    }
    root.add("globalTransitions", globals);

    final JsonArray locals = new JsonArray();
    for (final LocalTransition local : specification.getLocalTransitions()) {
      final JsonObject object = new JsonObject();
      object.addProperty("source", local.getSource());
      object.add("trigger", writeTrigger(local.getTrigger()));
      writePosition(object, local.getPosition());
      final JsonArray branches = new JsonArray();
      for (final GuardedBranch branch : local.getBranches()) {
        final JsonObject branchObject = new JsonObject();
        branchObject.addProperty("condition", branch.getCondition().canonical());
        branchObject.addProperty("destination", branch.getDestination());
        branchObject.add("actions", writeActions(branch.getActions()));
        branchObject.addProperty("comment", branch.getComment());
        writePosition(branchObject, branch.getPosition());
        branches.add(branchObject);
      }
      object.add("branches", branches);
      locals.add(object);
    }
    root.add("localTransitions", locals);

    final JsonArray annotations = new JsonArray();
    for (final Annotation annotation : specification.getAnnotations()) {
      final JsonObject object = new JsonObject();
      object.addProperty("target", annotation.getTarget().name());
      object.addProperty("subject", annotation.getSubject());
      object.addProperty("hint", annotation.getHint().name());
      object.addProperty("note", annotation.getNote());
      annotations.add(object);
    }
    root.add("annotations", annotations);

    return gson.toJson(root);
  }

  public Specification fromJson(final String json) throws CompilerException {
    if (json == null) {
      throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
          "IR document cannot be null");
    }
    try {
      final JsonObject root = asObject(JsonParser.parseString(json), "IR document");
      final int version = member(root, "formatVersion").getAsInt();
      if (version != formatVersion) {
        throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
            "Unsupported IR format version " + version + ", expected " + formatVersion);
      }

      final List<OutputSignal> signals = new ArrayList<>();
      for (final JsonElement element : array(root, "signals")) {
        final JsonObject object = asObject(element, "signal");
        final String name = string(object, "name");
        final List<String> levels = readStrings(array(object, "levels"));
        final OutputDomain domain = member(object, "open").getAsBoolean()
            ? OutputDomain.open(name, levels)
            : OutputDomain.of(string(object, "domain"), levels);
        signals.add(new OutputSignal(name, domain));
      }

      final List<State> states = new ArrayList<>();
      for (final JsonElement element : array(root, "states")) {
        final JsonObject object = asObject(element, "state");
        final Map<String, String> outputs = new LinkedHashMap<>();
        for (final Map.Entry<String, JsonElement> output : asObject(member(object, "outputs"),
            "outputs").entrySet()) {
          outputs.put(output.getKey(), output.getValue().getAsString());
        }
        states.add(new State(string(object, "name"), outputs,
            member(object, "initial").getAsBoolean(), optionalString(object, "comment"),
            readPosition(object)));
      }

      final List<String> events = readStrings(array(root, "events"));

      final List<ConditionVariable> variables = new ArrayList<>();
      for (final JsonElement element : array(root, "variables")) {
        final JsonObject object = asObject(element, "variable");
        variables.add(new ConditionVariable(string(object, "name"),
            ConditionVariable.Kind.valueOf(string(object, "kind")),
            readStrings(array(object, "symbols")), member(object, "maxLiteral").getAsLong()));
      }

      final List<Timer> timers = new ArrayList<>();
      for (final JsonElement element : array(root, "timers")) {
        final JsonObject object = asObject(element, "timer");
        timers.add(new Timer(string(object, "owner"),
            readDuration(optionalString(object, "duration"))));
      }

      final List<GlobalTransition> globals = new ArrayList<>();
      for (final JsonElement element : array(root, "globalTransitions")) {
        final JsonObject object = asObject(element, "global transition");
        globals.add(new GlobalTransition(Trigger.event(string(object, "event")),
            readActions(array(object, "actions")), string(object, "destination"),
            optionalString(object, "comment"), readPosition(object)));
      }

      final List<LocalTransition> locals = new ArrayList<>();
      for (final JsonElement element : array(root, "localTransitions")) {
        final JsonObject object = asObject(element, "local transition");
        final List<GuardedBranch> branches = new ArrayList<>();
        for (final JsonElement branchElement : array(object, "branches")) {
          final JsonObject branch = asObject(branchElement, "branch");
          branches.add(new GuardedBranch(readCondition(string(branch, "condition")),
              optionalString(branch, "destination"), readActions(array(branch, "actions")),
              optionalString(branch, "comment"), readPosition(branch)));
        }
        locals.add(new LocalTransition(string(object, "source"),
            readTrigger(asObject(member(object, "trigger"), "trigger")), branches,
            readPosition(object)));
      }

      final List<Annotation> annotations = new ArrayList<>();
      for (final JsonElement element : array(root, "annotations")) {
        final JsonObject object = asObject(element, "annotation");
        annotations.add(new Annotation(Annotation.Target.valueOf(string(object, "target")),
            string(object, "subject"), Annotation.Hint.valueOf(string(object, "hint")),
            optionalString(object, "note")));
      }

      final JsonElement header = root.get("header");
      final Specification specification = new Specification(
          header == null || header.isJsonNull() ? SpecificationHeader.EMPTY
              : readHeader(asObject(header, "header")),
          states, globals, locals, signals, events, variables, timers, annotations);
      if (logger.isDebugEnabled()) {
        logger.debug("Read IR document: " + specification);
      }
      return specification;
    } catch (JsonParseException | IllegalStateException | IllegalArgumentException
        | UnsupportedOperationException problem) {
      logger.error("Failed to read IR document", problem);
      throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE, problem);
    }
  }

  private static JsonObject writeHeader(final SpecificationHeader header) {
    final JsonObject object = new JsonObject();
    object.addProperty("feature", header.getFeature());
    object.addProperty("intent", header.getIntent());
    object.add("assumptions", strings(header.getAssumptions()));
    object.addProperty("raw", header.getRawText());
    return object;
  }

  private static SpecificationHeader readHeader(final JsonObject object)
      throws CompilerException {
    return new SpecificationHeader(optionalString(object, "feature"),
        optionalString(object, "intent"), readStrings(array(object, "assumptions")),
        optionalString(object, "raw"));
  }

  private static JsonObject writeTrigger(final Trigger trigger) {
    final JsonObject object = new JsonObject();
    object.addProperty("kind", trigger.getKind().name());
    if (trigger.isTimeout()) {
      object.addProperty("duration",
          trigger.getDuration() == null ? null : trigger.getDuration().canonical());
    } else {
      object.addProperty("event", trigger.getEvent());
    }
    return object;
  }

  private static Trigger readTrigger(final JsonObject object) throws CompilerException {
    if (Trigger.Kind.valueOf(string(object, "kind")) == Trigger.Kind.TIMEOUT) {
      return Trigger.timeout(readDuration(optionalString(object, "duration")));
    }
    return Trigger.event(string(object, "event"));
  }

  private static JsonArray writeActions(final List<Action> actions) {
    final JsonArray array = new JsonArray();
    for (final Action action : actions) {
      final JsonObject object = new JsonObject();
      object.addProperty("name", action.getName());
      object.add("arguments", strings(action.getArguments()));
      array.add(object);
    }
    return array;
  }

  private static List<Action> readActions(final JsonArray array) throws CompilerException {
    final List<Action> actions = new ArrayList<>();
    for (final JsonElement element : array) {
      final JsonObject object = asObject(element, "action");
      final String name = string(object, "name");
      final List<String> arguments = readStrings(array(object, "arguments"));
      Duration duration = null;
      if (Action.Type.forName(name) == Action.Type.START_TIMER) {
        duration = readDuration(arguments.isEmpty() ? null : arguments.get(0));
        if (duration == null) {
          throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
              "START_TIMER without a duration");
        }
      }
      actions.add(Action.of(name, arguments, duration));
    }
    return actions;
  }

  private static Condition readCondition(final String text) throws CompilerException {
    final Diagnostics diagnostics = new Diagnostics();
    final Condition condition = Parser.parseCondition(text, diagnostics);
    if (condition == null) {
      throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
          "Malformed condition '" + text + "': "
              + Diagnostics.format(diagnostics.toList()).trim());
    }
    return condition;
  }

  private static Duration readDuration(final String text) throws CompilerException {
    if (text == null) {
      return null;
    }
    final Duration duration = Duration.parse(text);
    if (duration == null) {
      throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
          "Malformed duration '" + text + "'");
    }
    return duration;
  }

  private static void writePosition(final JsonObject object, final SourcePosition position) {
    object.addProperty("line", position.getLine());
    object.addProperty("column", position.getColumn());
  }

  private static SourcePosition readPosition(final JsonObject object) {
    if (!object.has("line") || !object.has("column")) {
      return SourcePosition.UNKNOWN;
    }
    return new SourcePosition(object.get("line").getAsInt(), object.get("column").getAsInt());
  }

  private static JsonArray strings(final List<String> values) {
    final JsonArray array = new JsonArray();
    for (final String value : values) {
      array.add(value);
    }
    return array;
  }

  private static List<String> readStrings(final JsonArray array) {
    final List<String> values = new ArrayList<>();
    for (final JsonElement element : array) {
      values.add(element.getAsString());
    }
    return values;
  }

  /**
   * An optional array member; absent or null reads as empty.
   */
  private static JsonArray array(final JsonObject object, final String name)
      throws CompilerException {
    final JsonElement element = object.get(name);
    if (element == null || element.isJsonNull()) {
      return new JsonArray();
    }
    if (!element.isJsonArray()) {
      throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
          "Member '" + name + "' must be an array");
    }
    return element.getAsJsonArray();
  }

  private static JsonElement member(final JsonObject object, final String name)
      throws CompilerException {
    final JsonElement element = object.get(name);
    if (element == null || element.isJsonNull()) {
      throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
          "Missing member '" + name + "'");
    }
    return element;
  }

  private static String string(final JsonObject object, final String name)
      throws CompilerException {
    return member(object, name).getAsString();
  }

  private static JsonObject asObject(final JsonElement element, final String what)
      throws CompilerException {
    if (element == null || !element.isJsonObject()) {
      throw new CompilerException(CompilerException.Code.IR_SERIALIZATION_FAILURE,
          "Expected " + what + " to be a JSON object");
    }
    return element.getAsJsonObject();
  }

  private static String optionalString(final JsonObject object, final String name) {
    final JsonElement element = object.get(name);
    return element == null || element.isJsonNull() ? null : element.getAsString();
  }
}
