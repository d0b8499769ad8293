package com.github.fsmcompiler;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable boolean guard attached to a branch of a local transition. The compiler never decides a
 * guard itself; it turns guards into comparison logic. {@link #evaluate(Map)} exists so tooling and
 * tests can ask what the generated logic would do for a given set of input values.
 *
 * Two guards are considered the same when their {@link #canonical()} text is the same.
 */
public abstract class Condition {
  /**
   * The catch-all guard written as ELSE.
   */
  public static final Condition ALWAYS = new Always();

  private Condition() {}

  public abstract <R> R accept(final Visitor<R> visitor);

  /**
   * Fully parenthesized text that parses back into an equal condition.
   */
  public abstract String canonical();

  /**
   * Evaluates against variable values: {@link Number}s for numeric variables, {@link Boolean}s for
   * boolean ones and anything else (compared by its string form) for symbolic ones. Unbound
   * variables make their comparison false.
   */
  public abstract boolean evaluate(final Map<String, ?> bindings);

  public boolean isAlways() {
    return this == ALWAYS;
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Condition)) {
      return false;
    }
    return canonical().equals(((Condition) obj).canonical());
  }

  @Override
  public final int hashCode() {
    return canonical().hashCode();
  }

  @Override
  public String toString() {
    return canonical();
  }

  public static Condition comparison(final String variable, final Operator operator,
      final Object literal) {
    return new Comparison(variable, operator, literal);
  }

  public static Condition variable(final String name) {
    return new Variable(name);
  }

  public static Condition not(final Condition operand) {
    return new Not(operand);
  }

  public static Condition and(final Condition left, final Condition right) {
    return new Binary(true, left, right);
  }

  public static Condition or(final Condition left, final Condition right) {
    return new Binary(false, left, right);
  }

  public interface Visitor<R> {
    R visitAlways();

    R visitVariable(Variable variable);

    R visitComparison(Comparison comparison);

    R visitNot(Not not);

    R visitBinary(Binary binary);
  }

  public static enum Operator {
    EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

    private final String symbol;

    private Operator(final String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    /**
     * True for operators that need an ordered operand, ie. anything but equality.
     */
    public boolean isOrdering() {
      return this != EQ && this != NE;
    }

    boolean test(final int comparison) {
      switch (this) {
        case EQ:
          return comparison == 0;
        case NE:
          return comparison != 0;
        case LT:
          return comparison < 0;
        case LE:
          return comparison <= 0;
        case GT:
          return comparison > 0;
        case GE:
          return comparison >= 0;
        default:
          throw new IllegalStateException("Unhandled operator " + this);
      }
    }

    static Operator of(final TokenType type) {
      switch (type) {
        case EQ:
          return EQ;
        case NE:
          return NE;
        case LT:
          return LT;
        case LE:
          return LE;
        case GT:
          return GT;
        case GE:
          return GE;
        default:
          return null;
      }
    }
  }

  public static final class Always extends Condition {
    private Always() {}

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAlways();
    }

    @Override
    public String canonical() {
      return "ELSE";
    }

    @Override
    public boolean evaluate(final Map<String, ?> bindings) {
      return true;
    }
  }

  public static final class Variable extends Condition {
    private final String name;

    private Variable(final String name) {
      this.name = Objects.requireNonNull(name);
    }

    public String getName() {
      return name;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitVariable(this);
    }

    @Override
    public String canonical() {
      return name;
    }

    @Override
    public boolean evaluate(final Map<String, ?> bindings) {
      final Object value = bindings.get(name);
      if (value instanceof Boolean) {
        return (Boolean) value;
      }
      if (value instanceof Number) {
        return ((Number) value).longValue() != 0L;
      }
      return false;
    }
  }

  /**
   * {@code variable op literal}. The literal is a {@link Long} for numeric comparisons and a
   * {@link String} naming a symbolic constant otherwise.
   */
  public static final class Comparison extends Condition {
    private final String variable;
    private final Operator operator;
    private final Object literal;

    private Comparison(final String variable, final Operator operator, final Object literal) {
      this.variable = Objects.requireNonNull(variable);
      this.operator = Objects.requireNonNull(operator);
      if (!(literal instanceof Long) && !(literal instanceof String)) {
        throw new IllegalArgumentException("Comparison literal must be Long or String: " + literal);
      }
      this.literal = literal;
    }

    public String getVariable() {
      return variable;
    }

    public Operator getOperator() {
      return operator;
    }

    public Object getLiteral() {
      return literal;
    }

    public boolean isNumeric() {
      return literal instanceof Long;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitComparison(this);
    }

    @Override
    public String canonical() {
      return variable + " " + operator.getSymbol() + " " + literal;
    }

    @Override
    public boolean evaluate(final Map<String, ?> bindings) {
      final Object value = bindings.get(variable);
      if (value == null) {
        return false;
      }
      if (isNumeric()) {
        if (!(value instanceof Number)) {
          return false;
        }
        return operator.test(Long.compare(((Number) value).longValue(), (Long) literal));
      }
      if (operator.isOrdering()) {
        return false;
      }
      return operator.test(value.toString().equals(literal) ? 0 : 1);
    }
  }

  public static final class Not extends Condition {
    private final Condition operand;

    private Not(final Condition operand) {
      this.operand = Objects.requireNonNull(operand);
    }

    public Condition getOperand() {
      return operand;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitNot(this);
    }

    @Override
    public String canonical() {
      return "NOT (" + operand.canonical() + ")";
    }

    @Override
    public boolean evaluate(final Map<String, ?> bindings) {
      return !operand.evaluate(bindings);
    }
  }

  public static final class Binary extends Condition {
    private final boolean conjunction;
    private final Condition left;
    private final Condition right;

    private Binary(final boolean conjunction, final Condition left, final Condition right) {
      this.conjunction = conjunction;
      this.left = Objects.requireNonNull(left);
      this.right = Objects.requireNonNull(right);
    }

    /**
     * True for AND, false for OR.
     */
    public boolean isConjunction() {
      return conjunction;
    }

    public Condition getLeft() {
      return left;
    }

    public Condition getRight() {
      return right;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public String canonical() {
      return "(" + left.canonical() + (conjunction ? " AND " : " OR ") + right.canonical() + ")";
    }

    @Override
    public boolean evaluate(final Map<String, ?> bindings) {
      if (conjunction) {
        return left.evaluate(bindings) && right.evaluate(bindings);
      }
      return left.evaluate(bindings) || right.evaluate(bindings);
    }
  }
}
