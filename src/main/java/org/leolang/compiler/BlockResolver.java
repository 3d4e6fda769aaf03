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

package org.leolang.compiler;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.antlr.v4.runtime.Token;
import org.leolang.asg.Assignee;
import org.leolang.asg.Circuit;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Expression;
import org.leolang.asg.Expression.BinaryOp;
import org.leolang.asg.Function;
import org.leolang.asg.IntegerType;
import org.leolang.asg.Statement;
import org.leolang.asg.Type;
import org.leolang.asg.Variable;
import org.leolang.compiler.LeoParser.AssignIndexContext;
import org.leolang.compiler.LeoParser.AssignMemberContext;
import org.leolang.compiler.LeoParser.AssignRangeContext;
import org.leolang.compiler.LeoParser.AssignStatementContext;
import org.leolang.compiler.LeoParser.AssignTupleIndexContext;
import org.leolang.compiler.LeoParser.AssigneeAccessContext;
import org.leolang.compiler.LeoParser.AssigneeContext;
import org.leolang.compiler.LeoParser.BlockContext;
import org.leolang.compiler.LeoParser.BlockStatementContext;
import org.leolang.compiler.LeoParser.ConditionalContext;
import org.leolang.compiler.LeoParser.ConditionalStatementContext;
import org.leolang.compiler.LeoParser.ConsoleAssertContext;
import org.leolang.compiler.LeoParser.ConsolePrintContext;
import org.leolang.compiler.LeoParser.ConsoleStatementContext;
import org.leolang.compiler.LeoParser.DefinitionStatementContext;
import org.leolang.compiler.LeoParser.ExpressionContext;
import org.leolang.compiler.LeoParser.ExpressionStatementContext;
import org.leolang.compiler.LeoParser.IterationStatementContext;
import org.leolang.compiler.LeoParser.ReturnStatementContext;
import org.leolang.compiler.LeoParser.StatementContext;
import org.leolang.compiler.LeoParser.VariableNameContext;

/** Resolves the statements of a function body. */
class BlockResolver extends VisitorBase<Statement> {
  private final Function function;
  private final TypeResolver types;
  private final ExpressionResolver exprs;

  BlockResolver(Symbols symbols, Function function) {
    super(symbols.path);
    this.function = function;
    this.types = new TypeResolver(symbols, function.owner);
    Scope params = new Scope(null);
    for (Variable param : function.params) {
      params.declare(param, param.span);
    }
    this.exprs = new ExpressionResolver(symbols, function, params);
  }

  Statement.Block resolveBody(BlockContext ctx) {
    return (Statement.Block) visit(ctx);
  }

  /** The functions called from the body. */
  ImmutableSet<Function> callees() {
    return exprs.callees();
  }

  /**
   * True if execution of {@code stmt} always ends with a return: a return statement, a block
   * containing one, or a conditional whose branches all do.
   */
  static boolean definitelyReturns(Statement stmt) {
    if (stmt instanceof Statement.Return) {
      return true;
    } else if (stmt instanceof Statement.Block) {
      return ((Statement.Block) stmt)
          .statements.stream().anyMatch(BlockResolver::definitelyReturns);
    } else if (stmt instanceof Statement.Conditional) {
      Statement.Conditional conditional = (Statement.Conditional) stmt;
      return definitelyReturns(conditional.thenBlock)
          && conditional.otherwise != null
          && definitelyReturns(conditional.otherwise);
    }
    return false;
  }

  @Override
  public Statement visitBlock(BlockContext ctx) {
    Scope outer = exprs.scope;
    exprs.scope = new Scope(outer);
    try {
      ImmutableList.Builder<Statement> statements = ImmutableList.builder();
      for (StatementContext statement : ctx.statement()) {
        statements.add(visit(statement));
      }
      return new Statement.Block(statements.build(), currentSpan());
    } finally {
      exprs.scope = outer;
    }
  }

  @Override
  public Statement visitBlockStatement(BlockStatementContext ctx) {
    return visit(ctx.block());
  }

  @Override
  public Statement visitReturnStatement(ReturnStatementContext ctx) {
    Expression value;
    if (ctx.expression() != null) {
      value = exprs.expect(ctx.expression(), function.returnType);
    } else if (function.returnType.equals(Type.UNIT)) {
      value = new Expression.TupleInit(Type.UNIT, ImmutableList.of(), currentSpan());
    } else {
      throw error(
          ErrorKind.TYPE_MISMATCH,
          "'%s' must return a value of type %s",
          function,
          function.returnType);
    }
    return new Statement.Return(value, currentSpan());
  }

  @Override
  public Statement visitDefinitionStatement(DefinitionStatementContext ctx) {
    boolean isConst = ctx.kind.getType() == TokenType.CONST;
    List<VariableNameContext> names = ctx.variableNames().variableName();
    Expression value;
    if (ctx.type() == null) {
      value = exprs.resolve(ctx.expression(), null);
    } else {
      value = exprs.expect(ctx.expression(), types.resolve(ctx.type()));
    }
    if (isConst && !value.isConstant()) {
      throw error(
          ctx.expression(),
          ErrorKind.NON_CONSTANT_ARGUMENT,
          "A const declaration requires a compile-time constant value");
    }
    List<Type> varTypes;
    if (names.size() == 1) {
      varTypes = ImmutableList.of(value.type);
    } else if (value.type instanceof Type.Tuple
        && ((Type.Tuple) value.type).elements.size() == names.size()) {
      varTypes = ((Type.Tuple) value.type).elements;
    } else {
      throw error(
          ctx.expression(),
          ErrorKind.TYPE_MISMATCH,
          "Expected a tuple of %s elements but found %s",
          names.size(),
          value.type);
    }
    ImmutableList.Builder<Variable> variables = ImmutableList.builder();
    for (int i = 0; i < names.size(); i++) {
      VariableNameContext name = names.get(i);
      boolean mutable = name.mut != null;
      if (isConst && mutable) {
        throw error(name, ErrorKind.SYNTAX, "'const' bindings cannot be mutable");
      }
      variables.add(
          new Variable(
              name.LOWER_ID().getText(),
              varTypes.get(i),
              isConst ? Variable.Kind.CONST : Variable.Kind.LET,
              mutable,
              isConst,
              span(name)));
    }
    ImmutableList<Variable> built = variables.build();
    // The new variables are not in scope in their own initializer.
    for (Variable v : built) {
      exprs.scope.declare(v, v.span);
    }
    return new Statement.Definition(built, value, currentSpan());
  }

  @Override
  public Statement visitAssignStatement(AssignStatementContext ctx) {
    Assignee target = resolveAssignee(ctx.assignee());
    if (!target.root.mutable) {
      throw Compiler.cannotAssign(target.span, ctx.assignee().getText(), target.root.name);
    }
    String opText = ctx.op.getText();
    BinaryOp op =
        opText.equals("=") ? null : BinaryOp.fromSymbol(opText.substring(0, opText.length() - 1));
    Expression value;
    if (op == BinaryOp.MUL && target.type.equals(Type.GROUP)) {
      value = exprs.resolve(ctx.expression(), null);
      if (!ExpressionResolver.isGroupScaling(target.type, value.type)) {
        throw error(
            ctx.expression(),
            ErrorKind.TYPE_MISMATCH,
            "A group can only be multiplied by an unsigned integer, found %s",
            value.type);
      }
    } else {
      if (op != null) {
        ExpressionResolver.checkArithmetic(op, target.type, currentSpan());
      }
      value = exprs.expect(ctx.expression(), target.type);
    }
    return new Statement.Assign(target, op, value, currentSpan());
  }

  private Assignee resolveAssignee(AssigneeContext ctx) {
    Token root = ctx.root;
    Variable variable;
    if (root.getType() == TokenType.SELF) {
      variable = function.self;
      if (variable == null) {
        throw error(
            ErrorKind.UNRESOLVED_IDENTIFIER,
            "'self' is only available in circuit functions with a self parameter");
      }
    } else {
      variable = exprs.scope.lookup(root.getText());
      if (variable == null) {
        throw error(ErrorKind.UNRESOLVED_IDENTIFIER, "Unknown variable '%s'", root.getText());
      }
    }
    Type type = variable.type;
    ImmutableList.Builder<Assignee.Access> accesses = ImmutableList.builder();
    for (AssigneeAccessContext access : ctx.assigneeAccess()) {
      if (access instanceof AssignIndexContext || access instanceof AssignRangeContext) {
        if (!(type instanceof Type.Array)) {
          throw error(access, ErrorKind.TYPE_MISMATCH, "Expected an array but found %s", type);
        }
        Type.Array array = (Type.Array) type;
        if (access instanceof AssignIndexContext) {
          ExpressionContext index = ((AssignIndexContext) access).index;
          accesses.add(Assignee.Access.arrayIndex(exprs.resolveIndex(index, array.length)));
          type = array.element;
        } else {
          AssignRangeContext range = (AssignRangeContext) access;
          int from = exprs.rangeBound(range.left, 0);
          int to = exprs.rangeBound(range.right, array.length);
          type = exprs.rangeType(array, from, to, span(access));
          accesses.add(Assignee.Access.arrayRange(from, to));
        }
      } else if (access instanceof AssignMemberContext) {
        if (!(type instanceof Type.CircuitRef)) {
          throw error(access, ErrorKind.TYPE_MISMATCH, "Expected a circuit but found %s", type);
        }
        Circuit circuit = ((Type.CircuitRef) type).circuit();
        String name = ((AssignMemberContext) access).LOWER_ID().getText();
        type = circuit.memberType(name);
        if (type == null) {
          throw error(
              access,
              ErrorKind.UNRESOLVED_IDENTIFIER,
              "Circuit '%s' has no member '%s'",
              circuit.name,
              name);
        }
        accesses.add(Assignee.Access.member(circuit.memberIndex(name)));
      } else {
        if (!(type instanceof Type.Tuple)) {
          throw error(access, ErrorKind.TYPE_MISMATCH, "Expected a tuple but found %s", type);
        }
        List<Type> elements = ((Type.Tuple) type).elements;
        int index = TypeResolver.natural(((AssignTupleIndexContext) access).INTEGER(), path);
        if (index >= elements.size()) {
          throw error(
              access,
              ErrorKind.INDEX_OUT_OF_BOUNDS,
              "Index %s is out of bounds for a tuple of %s elements",
              index,
              elements.size());
        }
        type = elements.get(index);
        accesses.add(Assignee.Access.tupleIndex(index));
      }
    }
    return new Assignee(variable, accesses.build(), type, span(ctx));
  }

  @Override
  public Statement visitConditionalStatement(ConditionalStatementContext ctx) {
    return visit(ctx.conditional());
  }

  @Override
  public Statement visitConditional(ConditionalContext ctx) {
    Expression condition = exprs.expect(ctx.condition, Type.BOOLEAN);
    Statement.Block thenBlock = (Statement.Block) visit(ctx.thenBlock);
    Statement otherwise = null;
    if (ctx.elseIf != null) {
      otherwise = visit(ctx.elseIf);
    } else if (ctx.elseBlock != null) {
      otherwise = visit(ctx.elseBlock);
    }
    return new Statement.Conditional(condition, thenBlock, otherwise, currentSpan());
  }

  @Override
  public Statement visitIterationStatement(IterationStatementContext ctx) {
    Expression start;
    Expression stop;
    if (ExpressionResolver.isUntyped(ctx.start) && !ExpressionResolver.isUntyped(ctx.stop)) {
      stop = exprs.resolve(ctx.stop, null);
      start = exprs.resolve(ctx.start, stop.type);
    } else {
      // Bounds that are both unsuffixed literals default to u32.
      Type hint =
          ExpressionResolver.isUntyped(ctx.start) ? Type.integer(IntegerType.U32) : null;
      start = exprs.resolve(ctx.start, hint);
      stop = exprs.resolve(ctx.stop, start.type);
    }
    if (!start.type.isInteger()) {
      throw error(
          ctx.start, ErrorKind.TYPE_MISMATCH, "Loop bounds must be integers, found %s", start.type);
    } else if (!stop.type.equals(start.type)) {
      throw Compiler.typeMismatch(span(ctx.stop), start.type, stop.type);
    }
    checkLoopBound(ctx.start, start);
    checkLoopBound(ctx.stop, stop);
    Variable variable =
        new Variable(
            ctx.name.getText(),
            start.type,
            Variable.Kind.LOOP,
            false,
            true,
            Compiler.span(ctx.name, path));
    Scope outer = exprs.scope;
    exprs.scope = new Scope(outer);
    try {
      exprs.scope.declare(variable, variable.span);
      Statement.Block body = (Statement.Block) visit(ctx.block());
      return new Statement.Iteration(variable, start, stop, body, currentSpan());
    } finally {
      exprs.scope = outer;
    }
  }

  private void checkLoopBound(ExpressionContext ctx, Expression bound) {
    if (!bound.isConstant()) {
      throw error(
          ctx,
          ErrorKind.NON_CONSTANT_LOOP_BOUND,
          "Loop bound '%s' is not a compile-time constant",
          ctx.getText());
    }
  }

  @Override
  public Statement visitConsoleStatement(ConsoleStatementContext ctx) {
    return visit(ctx.consoleCall());
  }

  @Override
  public Statement visitConsoleAssert(ConsoleAssertContext ctx) {
    Expression condition = exprs.expect(ctx.expression(), Type.BOOLEAN);
    return new Statement.ConsoleAssert(condition, currentSpan());
  }

  @Override
  public Statement visitConsolePrint(ConsolePrintContext ctx) {
    String quoted = ctx.STRING().getText();
    String format = unescape(quoted.substring(1, quoted.length() - 1));
    List<String> fragments = Splitter.on("{}").splitToList(format);
    List<ExpressionContext> argCtxs = ctx.expression();
    if (fragments.size() - 1 != argCtxs.size()) {
      throw error(
          ErrorKind.INVALID_FORMAT,
          "Format string expects %s arguments but %s were given",
          fragments.size() - 1,
          argCtxs.size());
    }
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    for (ExpressionContext arg : argCtxs) {
      args.add(exprs.resolve(arg, null));
    }
    Statement.ConsoleKind kind;
    if (ctx.kind.getType() == TokenType.LOG) {
      kind = Statement.ConsoleKind.LOG;
    } else if (ctx.kind.getType() == TokenType.DEBUG) {
      kind = Statement.ConsoleKind.DEBUG;
    } else {
      kind = Statement.ConsoleKind.ERROR;
    }
    return new Statement.ConsolePrint(
        kind, ImmutableList.copyOf(fragments), args.build(), currentSpan());
  }

  /** Replaces the backslash escapes allowed in string literals. */
  private static String unescape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length()) {
        char next = s.charAt(++i);
        switch (next) {
          case 'n':
            sb.append('\n');
            break;
          case 't':
            sb.append('\t');
            break;
          default:
            sb.append(next);
        }
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public Statement visitExpressionStatement(ExpressionStatementContext ctx) {
    Expression expression = exprs.resolve(ctx.expression(), null);
    return new Statement.ExpressionStatement(expression, currentSpan());
  }
}
