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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.leolang.Logging;
import org.leolang.asg.Circuit;
import org.leolang.asg.DeclarationArena;
import org.leolang.asg.ErrorKind;
import org.leolang.asg.Function;
import org.leolang.asg.Program;
import org.leolang.asg.Span;
import org.leolang.asg.Statement;
import org.leolang.asg.Type;
import org.leolang.asg.Variable;
import org.leolang.compiler.LeoParser.CircuitDeclContext;
import org.leolang.compiler.LeoParser.CircuitMemberContext;
import org.leolang.compiler.LeoParser.FileContext;
import org.leolang.compiler.LeoParser.FunctionDeclContext;
import org.leolang.compiler.LeoParser.ImportAllContext;
import org.leolang.compiler.LeoParser.ImportDeclContext;
import org.leolang.compiler.LeoParser.ImportNamedContext;
import org.leolang.compiler.LeoParser.MemberFunctionContext;
import org.leolang.compiler.LeoParser.MemberVariableContext;
import org.leolang.compiler.LeoParser.ParamContext;
import org.leolang.compiler.LeoParser.SelfParamContext;
import org.leolang.compiler.LeoParser.ValueParamContext;

/**
 * Holds the file-level declarations of a program while it is being resolved, and drives the
 * resolution passes:
 *
 * <ol>
 *   <li>imports, and the names of all circuits, are registered (so that declarations may refer to
 *       circuits declared later in the file);
 *   <li>circuit member types are resolved;
 *   <li>function signatures (top-level and circuit) are resolved and registered;
 *   <li>function bodies are resolved;
 *   <li>the call graph is checked for recursion.
 * </ol>
 *
 * <p>Each declaration stops at its first error, but the remaining declarations are still checked
 * so that all of the errors can be reported together.
 */
final class Symbols {
  private static final Logger logger = Logging.getLogger();

  final String path;
  private final Map<String, Program> packages;
  final DeclarationArena arena;

  /** Every name visible at file level, mapped to a Circuit or Function. */
  private final Map<String, Object> declarations = new LinkedHashMap<>();

  private final Map<String, Circuit> circuits = new LinkedHashMap<>();
  private final Map<String, Function> functions = new LinkedHashMap<>();
  private final Map<String, Object> imports = new LinkedHashMap<>();

  /** Functions whose signatures have been resolved, with the syntax of their bodies. */
  private final Map<Function, FunctionDeclContext> pending = new LinkedHashMap<>();

  /** The functions called directly by each resolved function body. */
  private final Map<Function, ImmutableSet<Function>> callGraph = new LinkedHashMap<>();

  private final List<CompileError> errors = new ArrayList<>();

  private Symbols(String path, Map<String, Program> packages, DeclarationArena arena) {
    this.path = path;
    this.packages = packages;
    this.arena = arena;
  }

  /**
   * Returns a Symbols containing the declarations of an already-resolved program, for resolving
   * expressions (such as input values) that refer to its circuits.
   */
  static Symbols forProgram(Program program) {
    Symbols symbols = new Symbols(program.path, ImmutableMap.of(), program.arena);
    symbols.declarations.putAll(program.imports);
    symbols.declarations.putAll(program.circuits);
    symbols.declarations.putAll(program.functions);
    return symbols;
  }

  static Program resolve(FileContext file, String path, Map<String, Program> packages) {
    Symbols symbols = new Symbols(path, packages, new DeclarationArena());
    symbols.resolveFile(file);
    if (!symbols.errors.isEmpty()) {
      throw new CompileErrors(symbols.errors);
    }
    return new Program(
        path,
        symbols.arena,
        ImmutableMap.copyOf(symbols.circuits),
        ImmutableMap.copyOf(symbols.functions),
        ImmutableMap.copyOf(symbols.imports));
  }

  /** Returns the circuit with the given name, or null. */
  @Nullable Circuit circuit(String name) {
    Object decl = declarations.get(name);
    return (decl instanceof Circuit) ? (Circuit) decl : null;
  }

  /** Returns the top-level function with the given name, or null. */
  @Nullable Function function(String name) {
    Object decl = declarations.get(name);
    return (decl instanceof Function) ? (Function) decl : null;
  }

  /** True if {@code name} is declared at file level. */
  boolean isDeclared(String name) {
    return declarations.containsKey(name);
  }

  private void resolveFile(FileContext file) {
    file.importDecl().forEach(imp -> attempt(() -> addImport(imp)));
    // Keep the declarations in source order, so that duplicates are reported on the later one.
    List<CircuitDeclContext> circuitDecls = new ArrayList<>();
    List<FunctionDeclContext> functionDecls = new ArrayList<>();
    for (ParseTree child : file.children) {
      if (child instanceof CircuitDeclContext) {
        circuitDecls.add((CircuitDeclContext) child);
      } else if (child instanceof FunctionDeclContext) {
        functionDecls.add((FunctionDeclContext) child);
      }
    }
    Map<Circuit, CircuitDeclContext> registered = new LinkedHashMap<>();
    for (CircuitDeclContext ctx : circuitDecls) {
      attempt(
          () -> {
            Span nameSpan = Compiler.span(ctx.name, path);
            declare(ctx.name.getText(), nameSpan);
            Circuit circuit = arena.newCircuit(ctx.name.getText(), Compiler.span(ctx, path));
            declarations.put(circuit.name, circuit);
            circuits.put(circuit.name, circuit);
            registered.put(circuit, ctx);
          });
    }
    registered.forEach(
        (circuit, ctx) -> {
          try {
            resolveMembers(circuit, ctx);
          } catch (CompileError e) {
            errors.add(e);
            // Let the rest of the program see the circuit as having no members.
            circuit.setMembers(ImmutableMap.of());
          }
        });
    registered.keySet().forEach(this::checkContainment);
    for (FunctionDeclContext ctx : functionDecls) {
      attempt(() -> declareFunction(ctx, null));
    }
    registered.forEach(
        (circuit, ctx) -> {
          for (CircuitMemberContext member : ctx.circuitMember()) {
            if (member instanceof MemberFunctionContext) {
              FunctionDeclContext fnCtx = ((MemberFunctionContext) member).functionDecl();
              attempt(() -> declareFunction(fnCtx, circuit));
            }
          }
        });
    pending.forEach((fn, ctx) -> attempt(() -> resolveBody(fn, ctx)));
    checkRecursion();
  }

  private void attempt(Runnable step) {
    try {
      step.run();
    } catch (CompileError e) {
      errors.add(e);
    }
  }

  private void declare(String name, Span span) {
    if (declarations.containsKey(name)) {
      throw Compiler.error(
          ErrorKind.DUPLICATE_DECLARATION, span, "Duplicate definition of '%s'", name);
    }
  }

  private void addImport(ImportDeclContext ctx) {
    String pkgName = ctx.pkg.stream().map(Token::getText).collect(Collectors.joining("."));
    Program pkg = packages.get(pkgName);
    Span span = Compiler.span(ctx, path);
    if (pkg == null) {
      throw Compiler.error(ErrorKind.UNRESOLVED_IDENTIFIER, span, "Unknown package '%s'", pkgName);
    }
    if (ctx.importTarget() instanceof ImportAllContext) {
      Map<String, Object> all = new LinkedHashMap<>();
      all.putAll(pkg.circuits);
      all.putAll(pkg.functions);
      all.forEach((name, decl) -> addImported(name, decl, span));
    } else {
      ImportNamedContext named = (ImportNamedContext) ctx.importTarget();
      String name = named.name.getText();
      Object decl =
          pkg.circuits.containsKey(name) ? pkg.circuits.get(name) : pkg.functions.get(name);
      if (decl == null) {
        throw Compiler.error(
            ErrorKind.UNRESOLVED_IDENTIFIER,
            span,
            "Package '%s' has no declaration named '%s'",
            pkgName,
            name);
      }
      addImported((named.alias != null) ? named.alias.getText() : name, decl, span);
    }
  }

  private void addImported(String name, Object decl, Span span) {
    declare(name, span);
    declarations.put(name, decl);
    imports.put(name, decl);
  }

  private void resolveMembers(Circuit circuit, CircuitDeclContext ctx) {
    TypeResolver types = new TypeResolver(this, circuit);
    Map<String, Type> members = new LinkedHashMap<>();
    Set<String> functionNames = new HashSet<>();
    for (CircuitMemberContext member : ctx.circuitMember()) {
      if (member instanceof MemberVariableContext) {
        MemberVariableContext variable = (MemberVariableContext) member;
        String name = variable.name.getText();
        if (members.containsKey(name)) {
          throw Compiler.error(
              ErrorKind.DUPLICATE_DECLARATION,
              Compiler.span(variable.name, path),
              "Duplicate member '%s' in circuit '%s'",
              name,
              circuit.name);
        }
        members.put(name, types.resolve(variable.type()));
      } else {
        functionNames.add(((MemberFunctionContext) member).functionDecl().name.getText());
      }
    }
    for (String name : members.keySet()) {
      if (functionNames.contains(name)) {
        throw Compiler.error(
            ErrorKind.DUPLICATE_DECLARATION,
            Compiler.span(ctx.name, path),
            "Circuit '%s' has both a member and a function named '%s'",
            circuit.name,
            name);
      }
    }
    circuit.setMembers(members);
  }

  /**
   * Reports a circuit whose members contain a value of the circuit itself, either directly or
   * through arrays, tuples and other circuits. Such a circuit has no finite value.
   */
  private void checkContainment(Circuit circuit) {
    Set<Circuit> visited = new HashSet<>();
    for (Type member : circuit.members().values()) {
      if (contains(member, circuit, visited)) {
        errors.add(
            Compiler.error(
                ErrorKind.TYPE_MISMATCH,
                circuit.span,
                "Circuit '%s' cannot contain itself",
                circuit.name));
        return;
      }
    }
  }

  /** True if a value of {@code type} includes a value of {@code target}. */
  private static boolean contains(Type type, Circuit target, Set<Circuit> visited) {
    if (type instanceof Type.Array) {
      return contains(((Type.Array) type).element, target, visited);
    } else if (type instanceof Type.Tuple) {
      for (Type element : ((Type.Tuple) type).elements) {
        if (contains(element, target, visited)) {
          return true;
        }
      }
    } else if (type instanceof Type.CircuitRef) {
      Circuit circuit = ((Type.CircuitRef) type).circuit();
      if (circuit == target) {
        return true;
      } else if (visited.add(circuit)) {
        for (Type member : circuit.members().values()) {
          if (contains(member, target, visited)) {
            return true;
          }
        }
      }
    }
    return false;
  }

  /** Resolves a function's signature and makes it visible to calls. */
  private void declareFunction(FunctionDeclContext ctx, @Nullable Circuit owner) {
    String name = ctx.name.getText();
    Span nameSpan = Compiler.span(ctx.name, path);
    TypeResolver types = new TypeResolver(this, owner);
    Function.Receiver receiver = Function.Receiver.NONE;
    Variable self = null;
    ImmutableList.Builder<Variable> params = ImmutableList.builder();
    Set<String> paramNames = new HashSet<>();
    List<ParamContext> paramCtxs = ctx.param();
    for (int i = 0; i < paramCtxs.size(); i++) {
      ParamContext paramCtx = paramCtxs.get(i);
      Span span = Compiler.span(paramCtx, path);
      if (paramCtx instanceof SelfParamContext) {
        if (owner == null) {
          throw Compiler.error(
              ErrorKind.UNRESOLVED_IDENTIFIER,
              span,
              "'self' parameters are only allowed in circuit functions");
        } else if (i != 0) {
          throw Compiler.error(
              ErrorKind.SYNTAX, span, "'self' must be the first parameter");
        }
        Token qualifier = ((SelfParamContext) paramCtx).qualifier;
        if (qualifier == null) {
          receiver = Function.Receiver.SELF;
        } else if (qualifier.getType() == TokenType.MUT) {
          receiver = Function.Receiver.MUT_SELF;
        } else {
          receiver = Function.Receiver.CONST_SELF;
        }
        self =
            new Variable(
                "self",
                owner.type(),
                Variable.Kind.SELF,
                receiver == Function.Receiver.MUT_SELF,
                receiver == Function.Receiver.CONST_SELF,
                span);
      } else {
        ValueParamContext valueParam = (ValueParamContext) paramCtx;
        String paramName = valueParam.name.getText();
        if (!paramNames.add(paramName)) {
          throw Compiler.error(
              ErrorKind.DUPLICATE_DECLARATION, span, "Duplicate parameter '%s'", paramName);
        }
        Token qualifier = valueParam.qualifier;
        boolean isConst = qualifier != null && qualifier.getType() == TokenType.CONST;
        boolean isMut = qualifier != null && qualifier.getType() == TokenType.MUT;
        params.add(
            new Variable(
                paramName,
                types.resolve(valueParam.type()),
                isConst ? Variable.Kind.CONST_PARAMETER : Variable.Kind.PARAMETER,
                isMut,
                isConst,
                span));
      }
    }
    Type returnType = (ctx.returnType == null) ? Type.UNIT : types.resolve(ctx.returnType);
    Function fn =
        new Function(
            name, Compiler.span(ctx, path), owner, receiver, self, params.build(), returnType);
    if (owner == null) {
      declare(name, nameSpan);
      declarations.put(name, fn);
      functions.put(name, fn);
    } else {
      if (owner.function(name) != null) {
        throw Compiler.error(
            ErrorKind.DUPLICATE_DECLARATION,
            nameSpan,
            "Duplicate function '%s' in circuit '%s'",
            name,
            owner.name);
      }
      owner.addFunction(fn);
    }
    pending.put(fn, ctx);
  }

  private void resolveBody(Function fn, FunctionDeclContext ctx) {
    BlockResolver resolver = new BlockResolver(this, fn);
    Statement.Block body = resolver.resolveBody(ctx.block());
    if (!fn.returnType.equals(Type.UNIT) && !BlockResolver.definitelyReturns(body)) {
      throw Compiler.error(
          ErrorKind.MISSING_RETURN,
          Compiler.span(ctx.name, path),
          "Function '%s' does not return a value on every path",
          fn);
    }
    fn.setBody(body);
    callGraph.put(fn, resolver.callees());
    logger.debug(String.format("Resolved %s (%s statements)", fn, body.statements.size()));
  }

  /** Reports each function that can reach itself through the call graph. */
  private void checkRecursion() {
    for (Function fn : callGraph.keySet()) {
      if (reaches(fn, fn, new HashSet<>())) {
        errors.add(
            Compiler.error(
                ErrorKind.RECURSION, fn.span, "Function '%s' calls itself recursively", fn));
      }
    }
  }

  /** True if {@code target} is called (directly or indirectly) by {@code from}. */
  private boolean reaches(Function from, Function target, Set<Function> visited) {
    ImmutableSet<Function> callees = callGraph.get(from);
    if (callees == null) {
      return false;
    }
    for (Function callee : callees) {
      if (callee == target) {
        return true;
      }
      if (visited.add(callee) && reaches(callee, target, visited)) {
        return true;
      }
    }
    return false;
  }
}
