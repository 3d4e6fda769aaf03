/*
 * Copyright 2025 The Leolang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.leolang.synth;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.leolang.CompilerOptions;
import org.leolang.Logging;
import org.leolang.asg.Assignee;
import org.leolang.asg.Circuit;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Expression;
import org.leolang.asg.Expression.BinaryOp;
import org.leolang.asg.Function;
import org.leolang.asg.IntegerType;
import org.leolang.asg.Program;
import org.leolang.asg.Span;
import org.leolang.asg.Statement;
import org.leolang.asg.Type;
import org.leolang.asg.Variable;
import org.leolang.compiler.Compiler;
import org.leolang.gadgets.Bech32;
import org.leolang.gadgets.Bit;
import org.leolang.gadgets.EdwardsBls12;
import org.leolang.gadgets.FieldGadgets;
import org.leolang.gadgets.GadgetException;
import org.leolang.gadgets.GroupElement;
import org.leolang.gadgets.GroupGadgets;
import org.leolang.gadgets.IntegerGadgets;
import org.leolang.r1cs.ConstraintSystem;
import org.leolang.r1cs.LinearCombination;
import org.leolang.r1cs.Wire;
import org.leolang.r1cs.WitnessInstruction;

/**
 * Lowers the entry function of a resolved program to a rank-1 constraint system.
 *
 * <p>The function body is executed symbolically: every expression evaluates to a {@link Value}
 * whose leaves are linear combinations, and operations on non-constant values add constraints.
 * Loops are unrolled, calls are inlined, and both branches of a conditional whose condition is not
 * a constant are executed, after which the variables they assigned are merged by selection. All
 * iteration is in declaration or insertion order, so the same program always produces the same
 * constraint system.
 */
public final class Synthesizer
    implements Statement.Visitor<@Nullable Void>, Expression.Visitor<Value> {

  private static final Logger logger = Logging.getLogger();

  /** The bit width of the limbs that represent an address. */
  private static final int ADDRESS_LIMB_BITS = 128;

  private final Program program;
  private final CompilerOptions options;
  private final ConstraintSystem cs = new ConstraintSystem();

  /** The variables of the function currently being executed. */
  private Frame frame = new Frame();

  /**
   * One if execution reaches the current statement, considering the enclosing conditionals and
   * calls (but not earlier returns in the current function, which are tracked by the frame).
   */
  private Bit pathCondition = Bit.TRUE;

  /** The number of loop iterations unrolled so far. */
  private int iterations;

  private final List<ConsoleEvent> events = new ArrayList<>();

  /** The input leaves read by the witness, with the span of the parameter each belongs to. */
  private final Map<String, Span> inputs = new LinkedHashMap<>();

  private Synthesizer(Program program, CompilerOptions options) {
    this.program = program;
    this.options = options;
  }

  /**
   * Synthesizes the constraint system for the entry function named by {@code options}.
   *
   * @throws SynthesisError if the program cannot be synthesized
   */
  public static CompiledCircuit synthesize(Program program, CompilerOptions options) {
    Function entry = program.function(options.entryFunction);
    if (entry == null) {
      throw SynthesisError.create(
          ErrorKind.UNRESOLVED_VARIABLE,
          Span.NONE,
          "No function named '%s' in %s",
          options.entryFunction,
          program.path);
    }
    Synthesizer synthesizer = new Synthesizer(program, options);
    Value output = synthesizer.synthesizeEntry(entry);
    ConstraintSystem cs = synthesizer.cs;
    logger.debug(
        String.format(
            "Synthesized %s: %s constraints, %s wires, %s console statements",
            entry,
            cs.numConstraints(),
            cs.numWires(),
            synthesizer.events.size()));
    return new CompiledCircuit(
        program,
        entry,
        options,
        cs,
        ImmutableMap.copyOf(synthesizer.inputs),
        output,
        ImmutableList.copyOf(synthesizer.events));
  }

  /**
   * Evaluates a constant expression, such as one returned by {@link Compiler#parseLiteral}.
   *
   * @throws SynthesisError if evaluation fails, e.g. because of an invalid group literal
   */
  static Value evaluateConstant(Program program, Expression expr) {
    Value result = new Synthesizer(program, CompilerOptions.DEFAULTS).eval(expr);
    if (!result.isConstant()) {
      throw SynthesisError.create(
          ErrorKind.MISSING_INPUT, expr.span, "Expected a constant but found '%s'", expr.span);
    }
    return result;
  }

  private Value synthesizeEntry(Function entry) {
    for (Variable param : entry.params) {
      if (param.kind == Variable.Kind.CONST_PARAMETER) {
        String text = options.constants.get(param.name);
        if (text == null) {
          throw SynthesisError.create(
              ErrorKind.MISSING_INPUT,
              param.span,
              "No value given for const parameter '%s'",
              param.name);
        }
        Expression literal = Compiler.parseLiteral(text, param.type, program);
        frame.define(param, evaluateConstant(program, literal));
      } else {
        Wire.Visibility visibility =
            param.name.equals("input") ? Wire.Visibility.PUBLIC : Wire.Visibility.PRIVATE;
        frame.define(param, allocateInput(param.type, param.name, visibility, param.span));
      }
    }
    cs.inNamespace(entry.toString(), () -> entry.body().accept(this));
    return (frame.result != null) ? frame.result : Value.UNIT;
  }

  /**
   * Allocates the wires for an input of the given type, constraining each leaf to be a valid
   * value of its type.
   */
  private Value allocateInput(Type type, String path, Wire.Visibility visibility, Span span) {
    switch (type.kind()) {
      case BOOLEAN:
        return Value.bool(Bit.allocate(cs, path, visibility, input(path, span)));
      case INTEGER:
        LinearCombination lc =
            LinearCombination.of(cs.allocate(path, visibility, input(path, span)));
        IntegerGadgets.rangeCheck(cs, path, lc, type.asInteger());
        return Value.integer(type.asInteger(), lc);
      case FIELD:
        return Value.field(LinearCombination.of(cs.allocate(path, visibility, input(path, span))));
      case GROUP:
        {
          String x = path + ".x";
          String y = path + ".y";
          GroupElement point =
              new GroupElement(
                  LinearCombination.of(cs.allocate(x, visibility, input(x, span))),
                  LinearCombination.of(cs.allocate(y, visibility, input(y, span))));
          GroupGadgets.enforceOnCurve(cs, point);
          return Value.group(point);
        }
      case ADDRESS:
        {
          String high = path + ".high";
          String low = path + ".low";
          LinearCombination highLc =
              LinearCombination.of(cs.allocate(high, visibility, input(high, span)));
          LinearCombination lowLc =
              LinearCombination.of(cs.allocate(low, visibility, input(low, span)));
          FieldGadgets.toBits(cs, high, highLc, ADDRESS_LIMB_BITS);
          FieldGadgets.toBits(cs, low, lowLc, ADDRESS_LIMB_BITS);
          return new Value.Address(highLc, lowLc);
        }
      case TUPLE:
        {
          Type.Tuple tuple = (Type.Tuple) type;
          ImmutableList.Builder<Value> elements = ImmutableList.builder();
          for (int i = 0; i < tuple.elements.size(); i++) {
            elements.add(allocateInput(tuple.elements.get(i), path + "." + i, visibility, span));
          }
          return new Value.Tuple(tuple, elements.build());
        }
      case ARRAY:
        {
          Type.Array array = (Type.Array) type;
          ImmutableList.Builder<Value> elements = ImmutableList.builder();
          for (int i = 0; i < array.length; i++) {
            elements.add(allocateInput(array.element, path + "[" + i + "]", visibility, span));
          }
          return new Value.Array(array, elements.build());
        }
      case CIRCUIT:
        {
          Circuit circuit = ((Type.CircuitRef) type).circuit();
          ImmutableList.Builder<Value> members = ImmutableList.builder();
          circuit
              .members()
              .forEach(
                  (name, memberType) ->
                      members.add(allocateInput(memberType, path + "." + name, visibility, span)));
          return new Value.CircuitValue(circuit, members.build());
        }
    }
    throw new AssertionError(type);
  }

  private WitnessInstruction input(String key, Span span) {
    inputs.put(key, span);
    return WitnessInstruction.input(key);
  }

  private Value eval(Expression expr) {
    return expr.accept(this);
  }

  private Bit evalBit(Expression expr) {
    return ((Value.Bool) eval(expr)).bit;
  }

  /** Returns the value of an expression that must be a constant integer. */
  private BigInteger evalConstantInt(Expression expr) {
    Value.Int value = (Value.Int) eval(expr);
    if (!value.isConstant()) {
      throw SynthesisError.create(
          ErrorKind.NON_CONSTANT_EXPONENT, expr.span, "'%s' is not a constant", expr.span.content);
    }
    return value.constantValue();
  }

  /** One if the current statement executes. */
  private Bit indicator() {
    return pathCondition.and(cs, frame.returned.not());
  }

  /** Runs a gadget, reporting any failure against the given span. */
  private static <T> T gadget(Span span, Supplier<T> body) {
    try {
      return body.get();
    } catch (GadgetException e) {
      throw new SynthesisError(errorKind(e.reason), e.getMessage(), span);
    }
  }

  private static ErrorKind errorKind(GadgetException.Reason reason) {
    switch (reason) {
      case OVERFLOW:
        return ErrorKind.INTEGER_OVERFLOW;
      case DIVISION_BY_ZERO:
        return ErrorKind.DIVISION_BY_ZERO;
      case INVALID_INDEX:
        return ErrorKind.INVALID_ARRAY_INDEX;
      case INVALID_GROUP:
        return ErrorKind.INVALID_GROUP;
      case NON_CONSTANT_EXPONENT:
        return ErrorKind.NON_CONSTANT_EXPONENT;
    }
    throw new AssertionError(reason);
  }

  // Statements

  @Override
  public @Nullable Void visitBlock(Statement.Block stmt) {
    for (Statement statement : stmt.statements) {
      if (frame.hasReturned()) {
        break;
      }
      statement.accept(this);
    }
    return null;
  }

  @Override
  public @Nullable Void visitDefinition(Statement.Definition stmt) {
    Value value = eval(stmt.value);
    if (stmt.variables.size() == 1) {
      frame.define(stmt.variables.get(0), value);
    } else {
      ImmutableList<Value> elements = ((Value.Tuple) value).elements;
      for (int i = 0; i < stmt.variables.size(); i++) {
        frame.define(stmt.variables.get(i), elements.get(i));
      }
    }
    return null;
  }

  @Override
  public @Nullable Void visitAssign(Statement.Assign stmt) {
    Value value = eval(stmt.value);
    List<Value.Int> indices = evalIndices(stmt.target);
    if (stmt.op != null) {
      Value current = read(stmt.target, indices);
      value = binary(stmt.op, stmt.target.type, current, value, stmt.span);
    }
    write(stmt.target, indices, value);
    return null;
  }

  /** Evaluates the dynamic index expressions of an assignee; null for the other accesses. */
  private List<Value.Int> evalIndices(Assignee target) {
    List<Value.Int> indices = new ArrayList<>();
    for (Assignee.Access access : target.accesses) {
      indices.add((access.arrayIndex == null) ? null : (Value.Int) eval(access.arrayIndex));
    }
    return indices;
  }

  private Value read(Assignee target, List<Value.Int> indices) {
    Value value = frame.get(target.root, target.span);
    for (int i = 0; i < target.accesses.size(); i++) {
      Assignee.Access access = target.accesses.get(i);
      Value.Aggregate aggregate = (Value.Aggregate) value;
      switch (access.kind) {
        case MEMBER:
        case TUPLE_INDEX:
          value = aggregate.elements.get(access.index);
          break;
        case ARRAY_RANGE:
          value = aggregate.withElements(aggregate.elements.subList(access.index, access.end));
          break;
        case ARRAY_INDEX:
          value = element(aggregate, indices.get(i), target.span);
          break;
      }
    }
    return value;
  }

  private void write(Assignee target, List<Value.Int> indices, Value value) {
    Value root = frame.get(target.root, target.span);
    frame.assign(cs, target.root, update(root, target, indices, 0, value));
  }

  /** Returns {@code base} with the place reached by accesses {@code i...} replaced by value. */
  private Value update(
      Value base, Assignee target, List<Value.Int> indices, int i, Value newValue) {
    if (i == target.accesses.size()) {
      return newValue;
    }
    Assignee.Access access = target.accesses.get(i);
    Value.Aggregate aggregate = (Value.Aggregate) base;
    List<Value> elements = new ArrayList<>(aggregate.elements);
    switch (access.kind) {
      case MEMBER:
      case TUPLE_INDEX:
        elements.set(
            access.index, update(elements.get(access.index), target, indices, i + 1, newValue));
        break;
      case ARRAY_RANGE:
        {
          Value.Aggregate range =
              aggregate.withElements(aggregate.elements.subList(access.index, access.end));
          Value.Aggregate updated =
              (Value.Aggregate) update(range, target, indices, i + 1, newValue);
          for (int k = access.index; k < access.end; k++) {
            elements.set(k, updated.elements.get(k - access.index));
          }
          break;
        }
      case ARRAY_INDEX:
        {
          Value.Int index = indices.get(i);
          if (index.isConstant()) {
            int k = checkIndex(index.constantValue(), elements.size(), target.span);
            elements.set(k, update(elements.get(k), target, indices, i + 1, newValue));
          } else {
            List<Bit> selectors = selectors(index, elements.size(), target.span);
            for (int k = 0; k < elements.size(); k++) {
              Value old = elements.get(k);
              Value updated = update(old, target, indices, i + 1, newValue);
              elements.set(k, Values.select(cs, selectors.get(k), updated, old));
            }
          }
          break;
        }
    }
    return aggregate.withElements(ImmutableList.copyOf(elements));
  }

  private static int checkIndex(BigInteger index, int length, Span span) {
    if (index.signum() < 0 || index.compareTo(BigInteger.valueOf(length)) >= 0) {
      throw SynthesisError.create(
          ErrorKind.INVALID_ARRAY_INDEX,
          span,
          "Index %s is out of bounds for an array of length %s",
          index,
          length);
    }
    return index.intValue();
  }

  /**
   * Returns one bit per array element that is one iff {@code index} selects that element, and
   * constrains exactly one of them to be set.
   */
  private List<Bit> selectors(Value.Int index, int length, Span span) {
    if (length == 0) {
      throw SynthesisError.create(
          ErrorKind.INVALID_ARRAY_INDEX, span, "Cannot index an empty array");
    }
    List<Bit> selectors = new ArrayList<>();
    LinearCombination sum = LinearCombination.ZERO;
    for (int k = 0; k < length; k++) {
      Bit selected = FieldGadgets.isEqual(cs, index.lc, LinearCombination.constant(k));
      selectors.add(selected);
      sum = sum.add(selected.lc());
    }
    cs.enforceEqual("index.bounds", sum, LinearCombination.ONE);
    return selectors;
  }

  /** Returns the element of an array at a possibly non-constant index. */
  private Value element(Value.Aggregate array, Value.Int index, Span span) {
    ImmutableList<Value> elements = array.elements;
    if (index.isConstant()) {
      return elements.get(checkIndex(index.constantValue(), elements.size(), span));
    }
    List<Bit> selectors = selectors(index, elements.size(), span);
    Value result = elements.get(0);
    for (int k = 1; k < elements.size(); k++) {
      result = Values.select(cs, selectors.get(k), elements.get(k), result);
    }
    return result;
  }

  @Override
  public @Nullable Void visitConditional(Statement.Conditional stmt) {
    Bit condition = evalBit(stmt.condition);
    if (condition.isConstant()) {
      // Only the branch that will be taken is synthesized.
      if (condition.constantValue()) {
        stmt.thenBlock.accept(this);
      } else if (stmt.otherwise != null) {
        stmt.otherwise.accept(this);
      }
      return null;
    }
    Frame outer = frame;
    Bit outerPath = pathCondition;
    Frame ifTrue = outer.branch();
    Frame ifFalse = outer.branch();
    try {
      frame = ifTrue;
      pathCondition = outerPath.and(cs, condition);
      stmt.thenBlock.accept(this);
      frame = ifFalse;
      pathCondition = outerPath.and(cs, condition.not());
      if (stmt.otherwise != null) {
        stmt.otherwise.accept(this);
      }
    } finally {
      frame = outer;
      pathCondition = outerPath;
    }
    outer.merge(cs, condition, ifTrue, ifFalse);
    return null;
  }

  @Override
  public @Nullable Void visitIteration(Statement.Iteration stmt) {
    BigInteger start = evalConstantInt(stmt.start);
    BigInteger stop = evalConstantInt(stmt.stop);
    IntegerType type = stmt.variable.type.asInteger();
    for (BigInteger i = start; i.compareTo(stop) < 0; i = i.add(BigInteger.ONE)) {
      if (frame.hasReturned()) {
        break;
      } else if (++iterations > options.maxUnrolledIterations) {
        throw SynthesisError.create(
            ErrorKind.UNROLL_LIMIT,
            stmt.span,
            "Loops would unroll to more than %s iterations",
            options.maxUnrolledIterations);
      }
      frame.define(stmt.variable, Value.integer(type, LinearCombination.constant(i)));
      stmt.body.accept(this);
    }
    return null;
  }

  @Override
  public @Nullable Void visitConsoleAssert(Statement.ConsoleAssert stmt) {
    Bit condition = evalBit(stmt.condition);
    // indicator * (1 - condition) = 0
    cs.enforce(
        "assert " + stmt.span,
        indicator().lc(),
        condition.not().lc(),
        LinearCombination.ZERO);
    return null;
  }

  @Override
  public @Nullable Void visitConsolePrint(Statement.ConsolePrint stmt) {
    ConsoleEvent event =
        cs.diagnostic(
            () -> {
              ImmutableList<Value> args =
                  stmt.args.stream().map(this::eval).collect(ImmutableList.toImmutableList());
              return new ConsoleEvent(stmt.kind, stmt.span, stmt.fragments, args, indicator());
            });
    events.add(event);
    return null;
  }

  @Override
  public @Nullable Void visitExpression(Statement.ExpressionStatement stmt) {
    eval(stmt.expression);
    return null;
  }

  @Override
  public @Nullable Void visitReturn(Statement.Return stmt) {
    frame.setResult(cs, eval(stmt.value));
    return null;
  }

  // Expressions

  @Override
  public Value visitBoolean(Expression.BooleanLiteral expr) {
    return Value.bool(Bit.constant(expr.value));
  }

  @Override
  public Value visitInteger(Expression.IntegerLiteral expr) {
    return Value.integer(expr.integerType(), LinearCombination.constant(expr.value));
  }

  @Override
  public Value visitField(Expression.FieldLiteral expr) {
    return Value.field(LinearCombination.constant(expr.value));
  }

  @Override
  public Value visitGroup(Expression.GroupLiteralExpression expr) {
    EdwardsBls12.AffinePoint point = gadget(expr.span, () -> EdwardsBls12.fromLiteral(expr.value));
    return Value.group(GroupElement.constant(point));
  }

  @Override
  public Value visitAddress(Expression.AddressLiteral expr) {
    ImmutableList<BigInteger> limbs = Bech32.addressLimbs(expr.value);
    return new Value.Address(
        LinearCombination.constant(limbs.get(0)), LinearCombination.constant(limbs.get(1)));
  }

  @Override
  public Value visitVariable(Expression.VariableRef expr) {
    return frame.get(expr.variable, expr.span);
  }

  @Override
  public Value visitUnary(Expression.Unary expr) {
    Value operand = eval(expr.operand);
    if (expr.op == Expression.UnaryOp.NOT) {
      return Value.bool(((Value.Bool) operand).bit.not());
    }
    return gadget(
        expr.span,
        () -> {
          switch (operand.type().kind()) {
            case INTEGER:
              Value.Int value = (Value.Int) operand;
              return Value.integer(
                  value.integerType, IntegerGadgets.negate(cs, value.integerType, value.lc));
            case FIELD:
              return Value.field(((Value.Field) operand).lc.negate());
            default:
              return Value.group(GroupGadgets.negate(((Value.Group) operand).point));
          }
        });
  }

  @Override
  public Value visitBinary(Expression.Binary expr) {
    if (expr.op.isLogical()) {
      Bit left = evalBit(expr.left);
      // Both operands are always evaluated, so that any constraints they add are unconditional.
      Bit right = evalBit(expr.right);
      return Value.bool(
          (expr.op == BinaryOp.AND) ? left.and(cs, right) : left.or(cs, right));
    }
    Value left = eval(expr.left);
    Value right = eval(expr.right);
    return binary(expr.op, expr.type, left, right, expr.span);
  }

  /** Applies a non-logical binary operator to evaluated operands. */
  private Value binary(BinaryOp op, Type resultType, Value left, Value right, Span span) {
    return gadget(
        span,
        () -> {
          if (op.isEquality()) {
            Bit equal = Values.isEqual(cs, left, right);
            return Value.bool((op == BinaryOp.EQ) ? equal : equal.not());
          } else if (op.isOrdering()) {
            return Value.bool(compare(op, left, right));
          }
          return arithmetic(op, resultType, left, right);
        });
  }

  private Bit compare(BinaryOp op, Value left, Value right) {
    // a > b is b < a; a <= b is !(b < a); a >= b is !(a < b)
    boolean swap = (op == BinaryOp.GT || op == BinaryOp.LE);
    Bit less = lessThan(swap ? right : left, swap ? left : right);
    return (op == BinaryOp.LT || op == BinaryOp.GT) ? less : less.not();
  }

  private Bit lessThan(Value a, Value b) {
    switch (a.type().kind()) {
      case INTEGER:
        Value.Int x = (Value.Int) a;
        return IntegerGadgets.lessThan(cs, x.integerType, x.lc, ((Value.Int) b).lc);
      case FIELD:
        return FieldGadgets.lessThan(cs, ((Value.Field) a).lc, ((Value.Field) b).lc);
      default:
        // false < true
        return ((Value.Bool) a).bit.not().and(cs, ((Value.Bool) b).bit);
    }
  }

  private Value arithmetic(BinaryOp op, Type resultType, Value left, Value right) {
    switch (resultType.kind()) {
      case INTEGER:
        {
          IntegerType type = resultType.asInteger();
          LinearCombination a = ((Value.Int) left).lc;
          LinearCombination b = ((Value.Int) right).lc;
          switch (op) {
            case ADD:
              return Value.integer(type, IntegerGadgets.add(cs, type, a, b));
            case SUB:
              return Value.integer(type, IntegerGadgets.subtract(cs, type, a, b));
            case MUL:
              return Value.integer(type, IntegerGadgets.multiply(cs, type, a, b));
            case DIV:
              return Value.integer(type, IntegerGadgets.divide(cs, type, a, b));
            default:
              return Value.integer(type, IntegerGadgets.pow(cs, type, a, b));
          }
        }
      case FIELD:
        {
          LinearCombination a = ((Value.Field) left).lc;
          LinearCombination b = ((Value.Field) right).lc;
          switch (op) {
            case ADD:
              return Value.field(a.add(b));
            case SUB:
              return Value.field(a.subtract(b));
            case MUL:
              return Value.field(cs.multiply("field.mul", a, b));
            default:
              return Value.field(FieldGadgets.divide(cs, a, b));
          }
        }
      default:
        return groupArithmetic(op, left, right);
    }
  }

  private Value groupArithmetic(BinaryOp op, Value left, Value right) {
    if (op == BinaryOp.MUL) {
      boolean scalarFirst = left instanceof Value.Int;
      Value.Int scalar = (Value.Int) (scalarFirst ? left : right);
      GroupElement point = ((Value.Group) (scalarFirst ? right : left)).point;
      if (scalar.isConstant() && point.isConstant()) {
        return Value.group(
            GroupElement.constant(point.constantValue().multiply(scalar.constantValue())));
      }
      List<Bit> bits = IntegerGadgets.rangeCheck(cs, "scalar", scalar.lc, scalar.integerType);
      return Value.group(GroupGadgets.multiply(cs, point, bits));
    }
    GroupElement a = ((Value.Group) left).point;
    GroupElement b = ((Value.Group) right).point;
    return Value.group(
        (op == BinaryOp.ADD) ? GroupGadgets.add(cs, a, b) : GroupGadgets.subtract(cs, a, b));
  }

  @Override
  public Value visitTernary(Expression.Ternary expr) {
    Bit condition = evalBit(expr.condition);
    if (condition.isConstant()) {
      return eval(condition.constantValue() ? expr.ifTrue : expr.ifFalse);
    }
    Value ifTrue = eval(expr.ifTrue);
    Value ifFalse = eval(expr.ifFalse);
    return Values.select(cs, condition, ifTrue, ifFalse);
  }

  @Override
  public Value visitCast(Expression.Cast expr) {
    Value.Int operand = (Value.Int) eval(expr.operand);
    if (expr.type.equals(Type.FIELD)) {
      return Value.field(operand.lc);
    }
    IntegerType target = expr.type.asInteger();
    return Value.integer(
        target,
        gadget(expr.span, () -> IntegerGadgets.cast(cs, operand.integerType, target, operand.lc)));
  }

  @Override
  public Value visitTupleInit(Expression.TupleInit expr) {
    return new Value.Tuple((Type.Tuple) expr.type, evalAll(expr.elements));
  }

  private ImmutableList<Value> evalAll(List<Expression> exprs) {
    return exprs.stream().map(this::eval).collect(ImmutableList.toImmutableList());
  }

  @Override
  public Value visitTupleAccess(Expression.TupleAccess expr) {
    return ((Value.Aggregate) eval(expr.tuple)).elements.get(expr.index);
  }

  @Override
  public Value visitArrayInline(Expression.ArrayInline expr) {
    ImmutableList.Builder<Value> elements = ImmutableList.builder();
    for (int i = 0; i < expr.elements.size(); i++) {
      Value value = eval(expr.elements.get(i));
      if (expr.spread.get(i)) {
        elements.addAll(((Value.Aggregate) value).elements);
      } else {
        elements.add(value);
      }
    }
    return new Value.Array((Type.Array) expr.type, elements.build());
  }

  @Override
  public Value visitArrayInit(Expression.ArrayInit expr) {
    Value element = eval(expr.element);
    return new Value.Array(
        (Type.Array) expr.type, ImmutableList.copyOf(Collections.nCopies(expr.length(), element)));
  }

  @Override
  public Value visitArrayAccess(Expression.ArrayAccess expr) {
    Value.Aggregate array = (Value.Aggregate) eval(expr.array);
    Value.Int index = (Value.Int) eval(expr.index);
    return element(array, index, expr.span);
  }

  @Override
  public Value visitArrayRange(Expression.ArrayRangeAccess expr) {
    Value.Aggregate array = (Value.Aggregate) eval(expr.array);
    return new Value.Array(
        (Type.Array) expr.type, array.elements.subList(expr.from, expr.to));
  }

  @Override
  public Value visitCircuitInit(Expression.CircuitInit expr) {
    return new Value.CircuitValue(expr.circuit, evalAll(expr.values));
  }

  @Override
  public Value visitMemberAccess(Expression.MemberAccess expr) {
    return ((Value.Aggregate) eval(expr.base)).elements.get(expr.index);
  }

  /**
   * Inlines a call. The callee runs in a new frame under the caller's indicator; for a {@code mut
   * self} function called on a place, the final value of {@code self} is written back to it.
   * The place's index expressions are evaluated once, before the arguments.
   */
  @Override
  public Value visitCall(Expression.Call expr) {
    Function fn = expr.function;
    List<Value.Int> placeIndices = null;
    Value receiver = null;
    if (expr.writeBack != null) {
      placeIndices = evalIndices(expr.writeBack);
      receiver = read(expr.writeBack, placeIndices);
    } else if (expr.receiver != null) {
      receiver = eval(expr.receiver);
    }
    ImmutableList<Value> args = evalAll(expr.args);
    Frame callee = new Frame();
    if (fn.self != null) {
      callee.define(fn.self, receiver);
    }
    for (int i = 0; i < args.size(); i++) {
      callee.define(fn.params.get(i), args.get(i));
    }
    Frame caller = frame;
    Bit callerPath = pathCondition;
    pathCondition = indicator();
    frame = callee;
    try {
      cs.inNamespace(fn.toString(), () -> fn.body().accept(this));
    } finally {
      frame = caller;
      pathCondition = callerPath;
    }
    if (expr.writeBack != null) {
      Value self = callee.get(fn.self, expr.span);
      write(expr.writeBack, placeIndices, self);
    }
    return (callee.result != null) ? callee.result : Value.UNIT;
  }
}
