package specval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

import specval.core.Attribute;
import specval.core.AttributedExpr;
import specval.core.BinaryOp;
import specval.core.DatatypeCtor;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FrameExpr;
import specval.core.FunctionKind;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.ModuleDefinition;
import specval.core.ModuleSignature;
import specval.core.Pattern;
import specval.core.PrefixNameModule;
import specval.core.Program;
import specval.core.Rhs;
import specval.core.Specification;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.UnaryOp;
import specval.core.Variable;
import specval.core.WitnessKind;
import specval.json.ProgramJson;
import specval.runtime.ErrorMessages;
import specval.runtime.ProgramFormatException;

/**
 * 读取解析器导出的 JSON 程序树并构建不可变模型。
 *
 * <p>Jackson 按 {@code kind} 把 JSON 绑定到 {@link ProgramJson}；这里再把绑定结果转换为 {@code specval.core}
 * 的不可变记录，同时解析变量 id 与 break 目标，使输入中的共享引用成为同一个 Java 对象。
 * 无类型实参的 {@code UserDefined} 类型名若是内建类型或作用域中的类型参数，则解析为相应的类型。</p>
 *
 * <p>一个 loader 实例只加载一个程序，变量表与类型参数作用域不跨程序复用。</p>
 */
public final class ProgramLoader {
  private static final Logger logger = Logger.getLogger(ProgramLoader.class.getName());

  private static final Set<String> BASIC_TYPES =
      Set.of("int", "bool", "nat", "string", "real", "char", "ORDINAL", "object");

  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, true)
      .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

  // 变量 id -> 变量对象；同名 id 后声明者覆盖先声明者
  private final Map<String, Variable> variables = new HashMap<>();
  private final Deque<Map<String, TypeParameter>> typeScopes = new ArrayDeque<>();
  private final Deque<String> enclosingStatements = new ArrayDeque<>();

  public Program load(Path file) throws IOException {
    ProgramJson.Program root;
    try {
      root = mapper.readValue(file.toFile(), ProgramJson.Program.class);
    } catch (JsonProcessingException e) {
      throw bindingError(e);
    }
    String fallbackName = file.getFileName().toString().replaceFirst("\\.json$", "");
    return buildProgram(root, fallbackName);
  }

  public Program load(String json, String fallbackName) throws IOException {
    ProgramJson.Program root;
    try {
      root = mapper.readValue(json, ProgramJson.Program.class);
    } catch (JsonProcessingException e) {
      throw bindingError(e);
    }
    return buildProgram(root, fallbackName);
  }

  private Program buildProgram(ProgramJson.Program root, String fallbackName) throws IOException {
    variables.clear();
    typeScopes.clear();
    enclosingStatements.clear();
    if (root == null) {
      throw error("", "program must be a JSON object");
    }
    String name = root.name != null ? root.name : fallbackName;
    ModuleDefinition module = moduleDefinition(required(root.module, "module", ""), "/module");
    logger.fine(() -> "loaded program " + name + " with " + module.decls().size() + " top-level declarations");
    return new Program(name, module, root.sourcePath);
  }

  // ---------------------------------------------------------------------------------------------
  // 模块与声明

  private ModuleDefinition moduleDefinition(ProgramJson.ModuleDef n, String at) throws IOException {
    String name = n.name != null ? n.name : ModuleDefinition.DEFAULT_MODULE_NAME;
    List<Decl> decls = list(n.decls, "decls", at, this::decl);
    List<PrefixNameModule> prefixModules = list(n.prefixModules, "prefixModules", at, (p, pat) -> {
      List<String> prefix = required(p.prefix, "prefix", pat);
      var def = moduleDefinition(required(p.module, "module", pat), pat + "/module");
      return new PrefixNameModule(prefix, new Decl.LiteralModule(def, uuid(p.cloneId, pat)));
    });
    return new ModuleDefinition(name, n.isAbstract, n.refines, decls, prefixModules, attributes(n.attributes, at));
  }

  private Decl decl(ProgramJson.Decl n, String at) throws IOException {
    if (n instanceof ProgramJson.AbstractType d) {
      var tps = pushTypeParams(d.typeParams, at);
      try {
        return new Decl.AbstractType(name(d.name, at), tps, characteristics(d.characteristics, at),
            types(d.parents, "extends", at), members(d.members, at), attributes(d.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.SubsetType d) {
      var tps = pushTypeParams(d.typeParams, at);
      try {
        var bound = boundVar(required(d.var, "var", at), at + "/var");
        return new Decl.SubsetType(name(d.name, at), tps, characteristics(d.characteristics, at), bound,
            expr(required(d.constraint, "constraint", at), at + "/constraint"), witnessKind(d.witnessKind, at),
            optionalExpr(d.witness, "witness", at), attributes(d.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.TypeSynonym d) {
      var tps = pushTypeParams(d.typeParams, at);
      try {
        return new Decl.TypeSynonym(name(d.name, at), tps, characteristics(d.characteristics, at),
            type(required(d.rhs, "rhs", at), at + "/rhs"), attributes(d.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.Newtype d) {
      Type base = type(required(d.base, "base", at), at + "/base");
      Variable.BoundVar bound = d.var != null ? boundVar(d.var, at + "/var") : null;
      return new Decl.Newtype(name(d.name, at), base, bound, optionalExpr(d.constraint, "constraint", at),
          witnessKind(d.witnessKind, at), optionalExpr(d.witness, "witness", at), types(d.parents, "extends", at),
          members(d.members, at), attributes(d.attributes, at));
    }
    if (n instanceof ProgramJson.Datatype d) {
      var tps = pushTypeParams(d.typeParams, at);
      try {
        List<DatatypeCtor> ctors = list(d.ctors, "ctors", at, (c, cat) -> new DatatypeCtor(name(c.name, cat),
            c.ghost, formals(c.formals, "formals", cat, true), attributes(c.attributes, cat)));
        return new Decl.Datatype(name(d.name, at), d.coinductive, tps, ctors, types(d.parents, "extends", at),
            members(d.members, at), attributes(d.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.TupleType d) {
      return new Decl.TupleType(required(d.arity, "arity", at));
    }
    if (n instanceof ProgramJson.Iterator d) {
      var tps = pushTypeParams(d.typeParams, at);
      try {
        return new Decl.Iterator(name(d.name, at), tps, formals(d.ins, "ins", at, true),
            formals(d.outs, "outs", at, false), frames(d.reads, "reads", at), frames(d.modifies, "modifies", at),
            decreases(d.decreases, at), clauses(d.requires, "requires", at), clauses(d.ensures, "ensures", at),
            clauses(d.yieldRequires, "yieldRequires", at), clauses(d.yieldEnsures, "yieldEnsures", at),
            optionalBlock(d.body, "body", at), attributes(d.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.Trait d) {
      var tps = pushTypeParams(d.typeParams, at);
      try {
        return new Decl.Trait(name(d.name, at), tps, types(d.parents, "extends", at), members(d.members, at),
            attributes(d.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.ClassDecl d) {
      var tps = pushTypeParams(d.typeParams, at);
      try {
        return new Decl.ClassDecl(name(d.name, at), tps, types(d.parents, "extends", at), members(d.members, at),
            attributes(d.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.DefaultClass d) {
      return new Decl.DefaultClass(members(d.members, at));
    }
    if (n instanceof ProgramJson.LiteralModule d) {
      return new Decl.LiteralModule(moduleDefinition(d, at), uuid(d.cloneId, at));
    }
    if (n instanceof ProgramJson.AliasModule d) {
      return new Decl.AliasModule(name(d.name, at), required(d.target, "target", at), d.opened, orEmpty(d.exports),
          signature(d.signature), uuid(d.cloneId, at));
    }
    if (n instanceof ProgramJson.AbstractModule d) {
      return new Decl.AbstractModule(name(d.name, at), required(d.path, "path", at), d.opened, orEmpty(d.exports),
          signature(d.signature), uuid(d.cloneId, at));
    }
    if (n instanceof ProgramJson.Export d) {
      return new Decl.ModuleExport(d.name != null ? d.name : "", orEmpty(d.provides), orEmpty(d.reveals),
          orEmpty(d.parents), d.provideAll, d.revealAll, d.isDefault);
    }
    throw error(at, "no rule for declaration " + n.getClass().getSimpleName());
  }

  private static ModuleSignature signature(ProgramJson.Signature s) {
    if (s == null) return null;
    return new ModuleSignature(s.module, orEmpty(s.exports));
  }

  private WitnessKind witnessKind(String raw, String at) throws IOException {
    return raw != null ? enumValue(WitnessKind.class, raw, at + "/witnessKind") : WitnessKind.NONE;
  }

  // ---------------------------------------------------------------------------------------------
  // 成员

  private List<Member> members(List<ProgramJson.Member> members, String at) throws IOException {
    return list(members, "members", at, this::member);
  }

  private Member member(ProgramJson.Member n, String at) throws IOException {
    if (n instanceof ProgramJson.Field f) {
      return new Member.Field(name(f.name, at), f.isStatic, f.ghost, f.mutable, f.userMutable,
          type(required(f.type, "type", at), at + "/type"), attributes(f.attributes, at));
    }
    if (n instanceof ProgramJson.Const c) {
      Type t = c.type != null ? type(c.type, at + "/type") : new Type.InferredType(null);
      return new Member.ConstantField(name(c.name, at), optionalExpr(c.rhs, "rhs", at), c.isStatic, c.ghost, c.opaque,
          t, attributes(c.attributes, at));
    }
    if (n instanceof ProgramJson.SpecialField f) {
      String name = name(f.name, at);
      return new Member.SpecialField(name, f.specialId != null ? f.specialId : name, f.ghost, f.mutable,
          f.userMutable, type(required(f.type, "type", at), at + "/type"), attributes(f.attributes, at));
    }
    if (n instanceof ProgramJson.Function f) {
      var tps = pushTypeParams(f.typeParams, at);
      try {
        FunctionKind fk = f.functionKind != null
            ? enumValue(FunctionKind.class, f.functionKind, at + "/functionKind") : FunctionKind.FUNCTION;
        var ins = formals(f.ins, "ins", at, true);
        Variable.Formal result = f.result != null ? formal(f.result, at + "/result", false) : null;
        Type resultType;
        if (f.resultType != null) {
          resultType = type(f.resultType, at + "/resultType");
        } else if (result != null) {
          resultType = result.type();
        } else if (fk == FunctionKind.FUNCTION || fk == FunctionKind.TWO_STATE_FUNCTION) {
          throw error(at, "missing required field 'resultType'");
        } else {
          resultType = Type.BasicType.BOOL;
        }
        return new Member.Function(fk, name(f.name, at), f.isStatic, f.ghost, f.opaque, tps, ins, result, resultType,
            clauses(f.requires, "requires", at), frames(f.reads, "reads", at), clauses(f.ensures, "ensures", at),
            decreases(f.decreases, at), optionalExpr(f.body, "body", at), optionalBlock(f.byMethod, "byMethod", at),
            attributes(f.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    if (n instanceof ProgramJson.Method m) {
      var tps = pushTypeParams(m.typeParams, at);
      try {
        MethodKind mk = m.methodKind != null
            ? enumValue(MethodKind.class, m.methodKind, at + "/methodKind") : MethodKind.METHOD;
        var ins = formals(m.ins, "ins", at, true);
        var outs = formals(m.outs, "outs", at, false);
        Stmt body = m.body != null ? stmt(m.body, at + "/body") : null;
        return new Member.Method(mk, name(m.name, at), m.isStatic, m.ghost, tps, ins, outs,
            clauses(m.requires, "requires", at), frames(m.reads, "reads", at), frames(m.modifies, "modifies", at),
            clauses(m.ensures, "ensures", at), decreases(m.decreases, at), body, attributes(m.attributes, at));
      } finally {
        typeScopes.pop();
      }
    }
    throw error(at, "no rule for member " + n.getClass().getSimpleName());
  }

  // ---------------------------------------------------------------------------------------------
  // 变量

  private List<Variable.Formal> formals(List<ProgramJson.Var> vars, String field, String at, boolean inParam)
      throws IOException {
    return list(vars, field, at, (f, fat) -> formal(f, fat, inParam));
  }

  private Variable.Formal formal(ProgramJson.Var n, String at, boolean inParam) throws IOException {
    String name = name(n.name, at);
    var f = new Variable.Formal(name, type(required(n.type, "type", at), at + "/type"), inParam, n.ghost,
        optionalExpr(n.defaultValue, "default", at), attributes(n.attributes, at), n.old, n.nameOnly, n.older,
        n.compileName != null ? n.compileName : name);
    register(n, f);
    return f;
  }

  private Variable.BoundVar boundVar(ProgramJson.Var n, String at) throws IOException {
    Type t = n.type != null ? type(n.type, at + "/type") : new Type.InferredType(null);
    var bv = new Variable.BoundVar(name(n.name, at), t, n.ghost);
    register(n, bv);
    return bv;
  }

  private Variable.LocalVariable local(ProgramJson.Var n, String at) throws IOException {
    Type syntactic = n.type != null ? type(n.type, at + "/type") : null;
    Type resolved = n.resolvedType != null ? type(n.resolvedType, at + "/resolvedType") : null;
    var lv = new Variable.LocalVariable(name(n.name, at), syntactic, n.ghost, syntactic != null, resolved);
    register(n, lv);
    return lv;
  }

  private void register(ProgramJson.Var n, Variable v) {
    variables.put(n.id != null ? n.id : v.name(), v);
  }

  private List<Variable.BoundVar> boundVars(List<ProgramJson.Var> vars, String field, String at) throws IOException {
    return list(vars, field, at, this::boundVar);
  }

  // ---------------------------------------------------------------------------------------------
  // 类型

  private List<TypeParameter> pushTypeParams(List<ProgramJson.TypeParam> params, String at) throws IOException {
    List<TypeParameter> tps = list(params, "typeParams", at, this::typeParameter);
    Map<String, TypeParameter> scope = new HashMap<>();
    for (TypeParameter tp : tps) scope.put(tp.name(), tp);
    typeScopes.push(scope);
    return tps;
  }

  private TypeParameter typeParameter(ProgramJson.TypeParam n, String at) throws IOException {
    TypeParameter.Variance variance = n.variance != null
        ? enumValue(TypeParameter.Variance.class, n.variance, at + "/variance") : null;
    return new TypeParameter(name(n.name, at), variance, characteristics(n.characteristics, at));
  }

  private TypeParameter.Characteristics characteristics(ProgramJson.Characteristics c, String at) throws IOException {
    if (c == null) return TypeParameter.Characteristics.DEFAULT;
    String cat = at + "/characteristics";
    TypeParameter.EqualitySupport eq = c.equality != null
        ? enumValue(TypeParameter.EqualitySupport.class, c.equality, cat + "/equality") : null;
    TypeParameter.AutoInit init = c.autoInit != null
        ? enumValue(TypeParameter.AutoInit.class, c.autoInit, cat + "/autoInit") : null;
    return new TypeParameter.Characteristics(eq, init, c.noReferences);
  }

  private List<Type> types(List<ProgramJson.Type> types, String field, String at) throws IOException {
    return list(types, field, at, this::type);
  }

  private Type type(ProgramJson.Type n, String at) throws IOException {
    if (n instanceof ProgramJson.BasicT t) {
      return new Type.BasicType(name(t.name, at));
    }
    if (n instanceof ProgramJson.SetT t) {
      return new Type.SetType(t.finite, type(required(t.arg, "arg", at), at + "/arg"));
    }
    if (n instanceof ProgramJson.SeqT t) {
      return new Type.SeqType(type(required(t.arg, "arg", at), at + "/arg"));
    }
    if (n instanceof ProgramJson.MultiSetT t) {
      return new Type.MultiSetType(type(required(t.arg, "arg", at), at + "/arg"));
    }
    if (n instanceof ProgramJson.MapT t) {
      return new Type.MapType(t.finite, type(required(t.domain, "domain", at), at + "/domain"),
          type(required(t.range, "range", at), at + "/range"));
    }
    if (n instanceof ProgramJson.ArrowT t) {
      return new Type.ArrowType(types(t.args, "args", at), type(required(t.result, "result", at), at + "/result"));
    }
    if (n instanceof ProgramJson.UserDefinedT t) {
      return namedType(name(t.name, at), types(t.typeArgs, "typeArgs", at));
    }
    if (n instanceof ProgramJson.InferredT t) {
      return new Type.InferredType(t.resolved != null ? type(t.resolved, at + "/resolved") : null);
    }
    if (n instanceof ProgramJson.TypeParamT t) {
      TypeParameter tp = lookupTypeParam(name(t.name, at));
      if (tp == null) throw dangling(at + "/name", t.name);
      return new Type.TypeParamRef(tp);
    }
    if (n instanceof ProgramJson.RefinementT t) {
      return new Type.RefinementWrapper(type(required(t.inner, "inner", at), at + "/inner"));
    }
    throw error(at, "no rule for type " + n.getClass().getSimpleName());
  }

  private Type namedType(String name, List<Type> typeArgs) {
    if (typeArgs.isEmpty()) {
      if (BASIC_TYPES.contains(name)) return new Type.BasicType(name);
      TypeParameter tp = lookupTypeParam(name);
      if (tp != null) return new Type.TypeParamRef(tp);
    }
    return new Type.UserDefinedType(name, typeArgs);
  }

  private TypeParameter lookupTypeParam(String name) {
    for (Map<String, TypeParameter> scope : typeScopes) {
      TypeParameter tp = scope.get(name);
      if (tp != null) return tp;
    }
    return null;
  }

  // ---------------------------------------------------------------------------------------------
  // 规格

  private List<AttributedExpr> clauses(List<ProgramJson.Clause> clauses, String field, String at) throws IOException {
    return list(clauses, field, at, (c, cat) -> new AttributedExpr(expr(required(c.expr, "expr", cat), cat + "/expr"),
        c.label, attributes(c.attributes, cat), c.injected));
  }

  private Specification<FrameExpr> frames(ProgramJson.FrameSpec spec, String field, String at) throws IOException {
    if (spec == null) return Specification.empty();
    String fat = at + "/" + field;
    List<FrameExpr> frames = list(spec.exprs, "exprs", fat,
        (f, eat) -> new FrameExpr(expr(required(f.expr, "expr", eat), eat + "/expr"), f.field));
    return new Specification<>(frames, attributes(spec.attributes, fat));
  }

  private Specification<Expr> decreases(ProgramJson.ExprSpec spec, String at) throws IOException {
    if (spec == null) return Specification.empty();
    String dat = at + "/decreases";
    return new Specification<>(exprs(spec.exprs, "exprs", dat), attributes(spec.attributes, dat));
  }

  private List<Attribute> attributes(List<ProgramJson.Attr> attrs, String at) throws IOException {
    return list(attrs, "attributes", at, (a, aat) -> new Attribute(name(a.name, aat), exprs(a.args, "args", aat)));
  }

  // ---------------------------------------------------------------------------------------------
  // 语句

  private Stmt.Block optionalBlock(ProgramJson.Stmt n, String field, String at) throws IOException {
    if (n == null) return null;
    return block(n, at + "/" + field);
  }

  private Stmt.Block block(ProgramJson.Stmt n, String at) throws IOException {
    Stmt s = stmt(n, at);
    if (s instanceof Stmt.Block b) return b;
    throw error(at, "expected a Block statement");
  }

  private List<Stmt> stmts(List<ProgramJson.Stmt> stmts, String field, String at) throws IOException {
    return list(stmts, field, at, this::stmt);
  }

  private Stmt stmt(ProgramJson.Stmt n, String at) throws IOException {
    StmtMeta meta = meta(n, at);
    if (meta.id() != null) enclosingStatements.push(meta.id());
    try {
      return stmtBody(meta, n, at);
    } finally {
      if (meta.id() != null) enclosingStatements.pop();
    }
  }

  private StmtMeta meta(ProgramJson.Stmt n, String at) throws IOException {
    List<StmtMeta.Label> labels = new ArrayList<>();
    for (String l : orEmpty(n.labels)) labels.add(new StmtMeta.Label(l));
    // assert 与 assume 只用于证明，解析后总是 ghost
    boolean ghost = n.ghost || n instanceof ProgramJson.Assert || n instanceof ProgramJson.Assume;
    return new StmtMeta(n.id, labels, attributes(n.attributes, at), ghost);
  }

  private Stmt stmtBody(StmtMeta meta, ProgramJson.Stmt n, String at) throws IOException {
    if (n instanceof ProgramJson.Block s) {
      return new Stmt.Block(meta, stmts(s.body, "body", at));
    }
    if (n instanceof ProgramJson.DividedBlock s) {
      return new Stmt.DividedBlock(meta, stmts(s.init, "init", at), stmts(s.proper, "proper", at));
    }
    if (n instanceof ProgramJson.Assert s) {
      return new Stmt.Assert(meta, expr(required(s.expr, "expr", at), at + "/expr"), s.label,
          optionalBlock(s.proof, "proof", at));
    }
    if (n instanceof ProgramJson.Assume s) {
      return new Stmt.Assume(meta, expr(required(s.expr, "expr", at), at + "/expr"));
    }
    if (n instanceof ProgramJson.Expect s) {
      return new Stmt.Expect(meta, expr(required(s.expr, "expr", at), at + "/expr"),
          optionalExpr(s.message, "message", at));
    }
    if (n instanceof ProgramJson.Print s) {
      return new Stmt.Print(meta, exprs(s.args, "args", at));
    }
    if (n instanceof ProgramJson.Return s) {
      return new Stmt.Return(meta, rhss(s.rhss, "rhss", at));
    }
    if (n instanceof ProgramJson.Break s) {
      if (s.target != null && !enclosingStatements.contains(s.target)) {
        throw dangling(at + "/target", s.target);
      }
      return new Stmt.Break(meta, s.label, s.count, s.isContinue, s.target);
    }
    if (n instanceof ProgramJson.VarDecl s) {
      // 右侧在局部变量之前求值：其中的同名引用指向外层变量
      List<Rhs> rhss = s.rhss != null ? rhss(s.rhss, "rhss", at) : null;
      List<Variable.LocalVariable> locals = list(s.locals, "locals", at, this::local);
      Stmt.Update update = null;
      if (rhss != null) {
        List<Expr> lhss = new ArrayList<>(locals.size());
        for (Variable.LocalVariable lv : locals) lhss.add(Expr.Ident.of(lv));
        update = new Stmt.Update(StmtMeta.of(meta.ghost()), lhss, rhss);
      }
      return new Stmt.VarDecl(meta, locals, update);
    }
    if (n instanceof ProgramJson.Update s) {
      return new Stmt.Update(meta, exprs(s.lhss, "lhss", at), rhss(s.rhss, "rhss", at));
    }
    if (n instanceof ProgramJson.Assign s) {
      return new Stmt.Assign(meta, expr(required(s.lhs, "lhs", at), at + "/lhs"),
          rhs(required(s.rhs, "rhs", at), at + "/rhs"));
    }
    if (n instanceof ProgramJson.CallStmt s) {
      return new Stmt.Call(meta, exprs(s.lhss, "lhss", at), optionalExpr(s.receiver, "receiver", at),
          required(s.method, "method", at), exprs(s.args, "args", at));
    }
    if (n instanceof ProgramJson.If s) {
      Expr guard = optionalExpr(s.guard, "guard", at);
      Stmt.Block thn = block(required(s.thenStmt, "then", at), at + "/then");
      Stmt els = s.elseStmt != null ? stmt(s.elseStmt, at + "/else") : null;
      return new Stmt.If(meta, guard, thn, els);
    }
    if (n instanceof ProgramJson.While s) {
      return new Stmt.While(meta, optionalExpr(s.guard, "guard", at), clauses(s.invariants, "invariants", at),
          decreases(s.decreases, at), frames(s.modifies, "modifies", at), optionalBlock(s.body, "body", at));
    }
    if (n instanceof ProgramJson.MatchStmt s) {
      Expr source = expr(required(s.source, "source", at), at + "/source");
      List<Stmt.MatchCase> cases = list(s.cases, "cases", at, (c, cat) -> new Stmt.MatchCase(
          pattern(required(c.pattern, "pattern", cat), cat + "/pattern"), stmts(c.body, "body", cat),
          attributes(c.attributes, cat)));
      return new Stmt.Match(meta, source, cases);
    }
    if (n instanceof ProgramJson.Forall s) {
      var vars = boundVars(s.vars, "vars", at);
      Stmt body = s.body != null ? stmt(s.body, at + "/body") : null;
      return new Stmt.Forall(meta, vars, optionalExpr(s.range, "range", at), clauses(s.ensures, "ensures", at), body);
    }
    if (n instanceof ProgramJson.Reveal s) {
      return new Stmt.Reveal(meta, exprs(s.exprs, "exprs", at));
    }
    if (n instanceof ProgramJson.Modify s) {
      return new Stmt.Modify(meta, frames(s.modifies, "modifies", at), optionalBlock(s.body, "body", at));
    }
    throw error(at, "no rule for statement " + n.getClass().getSimpleName());
  }

  private List<Rhs> rhss(List<ProgramJson.Rhs> rhss, String field, String at) throws IOException {
    return list(rhss, field, at, this::rhs);
  }

  private Rhs rhs(ProgramJson.Rhs n, String at) throws IOException {
    if (n instanceof ProgramJson.Havoc) {
      return new Rhs.HavocRhs();
    }
    if (n instanceof ProgramJson.New r) {
      return new Rhs.TypeRhs(type(required(r.type, "type", at), at + "/type"), exprs(r.dims, "dims", at), r.ctor,
          r.args != null ? exprs(r.args, "args", at) : null);
    }
    if (n instanceof ProgramJson.ExprRhs r) {
      return new Rhs.ExprRhs(expr(required(r.expr, "expr", at), at + "/expr"), attributes(r.attributes, at));
    }
    throw error(at, "no rule for right-hand side " + n.getClass().getSimpleName());
  }

  // ---------------------------------------------------------------------------------------------
  // 表达式

  private Expr optionalExpr(ProgramJson.Expr n, String field, String at) throws IOException {
    if (n == null) return null;
    return expr(n, at + "/" + field);
  }

  private List<Expr> exprs(List<ProgramJson.Expr> exprs, String field, String at) throws IOException {
    return list(exprs, field, at, this::expr);
  }

  private Type optionalType(ProgramJson.Type n, String at) throws IOException {
    return n != null ? type(n, at + "/type") : null;
  }

  private Expr expr(ProgramJson.Expr n, String at) throws IOException {
    if (n instanceof ProgramJson.Literal e) {
      return new Expr.Literal(literalValue(e, at), optionalType(e.type, at));
    }
    if (n instanceof ProgramJson.Ident e) {
      String name = name(e.name, at);
      Variable var;
      if (e.var != null) {
        var = variables.get(e.var);
        if (var == null) throw dangling(at + "/var", e.var);
      } else {
        var = variables.get(name);
      }
      Type t = e.type != null ? type(e.type, at + "/type") : var != null ? var.type() : null;
      return new Expr.Ident(name, var, t);
    }
    if (n instanceof ProgramJson.This e) {
      return new Expr.This(optionalType(e.type, at), e.implicit);
    }
    if (n instanceof ProgramJson.StaticReceiver e) {
      return new Expr.StaticReceiver(optionalType(e.type, at));
    }
    if (n instanceof ProgramJson.DotName e) {
      return new Expr.DotName(expr(required(e.obj, "obj", at), at + "/obj"), required(e.suffix, "suffix", at),
          types(e.typeArgs, "typeArgs", at));
    }
    if (n instanceof ProgramJson.CallExpr e) {
      return new Expr.FunctionCall(optionalExpr(e.receiver, "receiver", at), name(e.name, at),
          exprs(e.args, "args", at), e.at);
    }
    if (n instanceof ProgramJson.Unary e) {
      return new Expr.Unary(unaryOp(required(e.op, "op", at), at + "/op"),
          expr(required(e.operand, "operand", at), at + "/operand"));
    }
    if (n instanceof ProgramJson.Binary e) {
      BinaryOp op;
      try {
        op = BinaryOp.fromSymbol(required(e.op, "op", at));
      } catch (IllegalArgumentException ex) {
        throw new ProgramFormatException(at + "/op", ErrorMessages.malformedProgram(at + "/op", ex.getMessage()), ex);
      }
      return new Expr.Binary(op, expr(required(e.left, "left", at), at + "/left"),
          expr(required(e.right, "right", at), at + "/right"));
    }
    if (n instanceof ProgramJson.Ite e) {
      return new Expr.Ite(expr(required(e.test, "test", at), at + "/test"),
          expr(required(e.thenExpr, "then", at), at + "/then"), expr(required(e.elseExpr, "else", at), at + "/else"));
    }
    if (n instanceof ProgramJson.Old e) {
      return new Expr.Old(expr(required(e.expr, "expr", at), at + "/expr"), e.at);
    }
    if (n instanceof ProgramJson.SeqDisplay e) {
      return new Expr.SeqDisplay(exprs(e.elements, "elements", at));
    }
    if (n instanceof ProgramJson.SetDisplay e) {
      return new Expr.SetDisplay(e.finite, exprs(e.elements, "elements", at));
    }
    if (n instanceof ProgramJson.MapDisplay e) {
      List<Expr.MapEntry> entries = list(e.entries, "entries", at, (m, eat) -> new Expr.MapEntry(
          expr(required(m.key, "key", eat), eat + "/key"), expr(required(m.value, "value", eat), eat + "/value")));
      return new Expr.MapDisplay(e.finite, entries);
    }
    if (n instanceof ProgramJson.SeqSelect e) {
      return new Expr.SeqSelect(e.selectOne, expr(required(e.seq, "seq", at), at + "/seq"),
          optionalExpr(e.lo, "lo", at), optionalExpr(e.hi, "hi", at));
    }
    if (n instanceof ProgramJson.Quantifier e) {
      var vars = boundVars(e.vars, "vars", at);
      return new Expr.Quantifier(e.universal, vars, optionalExpr(e.range, "range", at),
          expr(required(e.term, "term", at), at + "/term"), attributes(e.attributes, at));
    }
    if (n instanceof ProgramJson.Lambda e) {
      var vars = boundVars(e.vars, "vars", at);
      return new Expr.Lambda(vars, optionalExpr(e.range, "range", at), frames(e.reads, "reads", at),
          expr(required(e.body, "body", at), at + "/body"));
    }
    if (n instanceof ProgramJson.Let e) {
      List<Expr> rhss = exprs(e.rhss, "rhss", at);
      var vars = boundVars(e.vars, "vars", at);
      return new Expr.Let(vars, rhss, expr(required(e.body, "body", at), at + "/body"));
    }
    if (n instanceof ProgramJson.MatchExpr e) {
      Expr source = expr(required(e.source, "source", at), at + "/source");
      List<Expr.MatchCase> cases = list(e.cases, "cases", at, (c, cat) -> new Expr.MatchCase(
          pattern(required(c.pattern, "pattern", cat), cat + "/pattern"),
          expr(required(c.body, "body", cat), cat + "/body"), attributes(c.attributes, cat)));
      return new Expr.Match(source, cases);
    }
    if (n instanceof ProgramJson.Parens e) {
      return new Expr.Parens(expr(required(e.inner, "inner", at), at + "/inner"));
    }
    if (n instanceof ProgramJson.DatatypeValue e) {
      return new Expr.DatatypeValue(e.datatype, required(e.ctor, "ctor", at), exprs(e.args, "args", at));
    }
    throw error(at, "no rule for expression " + n.getClass().getSimpleName());
  }

  private static Object literalValue(ProgramJson.Literal n, String at) throws IOException {
    if (n.ch != null) {
      if (n.ch.length() != 1) throw error(at + "/char", "char literal must have exactly one character");
      return n.ch.charAt(0);
    }
    Object v = n.value;
    if (v == null || v instanceof Boolean || v instanceof BigInteger || v instanceof BigDecimal
        || v instanceof String) {
      return v;
    }
    throw error(at + "/value", "unsupported literal value " + v.getClass().getSimpleName());
  }

  private static UnaryOp unaryOp(String symbol, String at) throws IOException {
    for (UnaryOp op : UnaryOp.values()) {
      if (op.symbol().equals(symbol) || op.name().equals(symbol)) return op;
    }
    throw error(at, "unknown unary operator '" + symbol + "'");
  }

  private Pattern pattern(ProgramJson.Pattern n, String at) throws IOException {
    if (n instanceof ProgramJson.LitPattern p) {
      Expr lit = expr(required(p.lit, "lit", at), at + "/lit");
      if (!(lit instanceof Expr.Literal l)) throw error(at + "/lit", "literal pattern needs a Literal");
      return new Pattern.Lit(l);
    }
    if (n instanceof ProgramJson.IdPattern p) {
      Variable.BoundVar bound = p.var != null ? boundVar(p.var, at + "/var") : null;
      List<Pattern> args = p.arguments != null ? list(p.arguments, "arguments", at, this::pattern) : null;
      String id = p.id != null ? p.id : bound != null ? bound.name() : null;
      if (id == null) throw error(at, "id pattern needs an 'id' or a 'var'");
      return new Pattern.Id(id, bound, args, p.ghost);
    }
    if (n instanceof ProgramJson.DisjunctivePattern p) {
      return new Pattern.Disjunctive(list(p.alternatives, "alternatives", at, this::pattern), p.ghost);
    }
    throw error(at, "no rule for pattern " + n.getClass().getSimpleName());
  }

  // ---------------------------------------------------------------------------------------------
  // 辅助

  @FunctionalInterface
  private interface NodeReader<T, R> {
    R read(T n, String at) throws IOException;
  }

  private static <T, R> List<R> list(List<T> items, String field, String at, NodeReader<T, R> reader)
      throws IOException {
    if (items == null) return List.of();
    String fat = at + "/" + field;
    List<R> result = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      T item = items.get(i);
      if (item == null) throw error(fat + "/" + i, "unexpected null element");
      result.add(reader.read(item, fat + "/" + i));
    }
    return result;
  }

  private static <T> List<T> orEmpty(List<T> list) {
    return list != null ? list : List.of();
  }

  private static <T> T required(T value, String field, String at) throws IOException {
    if (value == null) throw error(at, "missing required field '" + field + "'");
    return value;
  }

  private static String name(String name, String at) throws IOException {
    return required(name, "name", at);
  }

  private static UUID uuid(String raw, String at) throws IOException {
    if (raw == null) return null;
    try {
      return UUID.fromString(raw);
    } catch (IllegalArgumentException e) {
      throw new ProgramFormatException(at + "/cloneId",
          ErrorMessages.malformedProgram(at + "/cloneId", "not a UUID: " + raw), e);
    }
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String raw, String at) throws IOException {
    try {
      return Enum.valueOf(type, raw);
    } catch (IllegalArgumentException e) {
      for (E constant : type.getEnumConstants()) {
        if (constant.name().replace("_", "").equalsIgnoreCase(raw.replace(" ", "").replace("_", ""))) {
          return constant;
        }
      }
      throw new ProgramFormatException(at, ErrorMessages.malformedProgram(at, "unknown " + type.getSimpleName()
          + " '" + raw + "'"), e);
    }
  }

  /** Jackson 绑定阶段的错误：取异常路径作为 JSON Pointer，未知或缺失的 {@code kind} 指向该字段。 */
  private static ProgramFormatException bindingError(JsonProcessingException e) {
    if (e instanceof InvalidTypeIdException t) {
      String at = path(t) + "/kind";
      String detail = t.getTypeId() == null
          ? "missing required field 'kind'"
          : "unknown " + category(t.getBaseType().getRawClass()) + " kind '" + t.getTypeId() + "'";
      return new ProgramFormatException(at, ErrorMessages.malformedProgram(at, detail), e);
    }
    String at = e instanceof JsonMappingException m ? pointer(path(m)) : "/";
    return new ProgramFormatException(at, ErrorMessages.malformedProgram(at, e.getOriginalMessage()), e);
  }

  private static String path(JsonMappingException e) {
    StringBuilder sb = new StringBuilder();
    for (JsonMappingException.Reference ref : e.getPath()) {
      if (ref.getFieldName() != null) {
        sb.append('/').append(ref.getFieldName());
      } else if (ref.getIndex() >= 0) {
        sb.append('/').append(ref.getIndex());
      }
    }
    return sb.toString();
  }

  private static String category(Class<?> base) {
    if (base == ProgramJson.Decl.class) return "declaration";
    if (base == ProgramJson.Member.class) return "member";
    if (base == ProgramJson.Stmt.class) return "statement";
    if (base == ProgramJson.Expr.class) return "expression";
    if (base == ProgramJson.Type.class) return "type";
    if (base == ProgramJson.Rhs.class) return "right-hand side";
    if (base == ProgramJson.Pattern.class) return "pattern";
    return base.getSimpleName();
  }

  private static ProgramFormatException error(String at, String detail) {
    return new ProgramFormatException(pointer(at), ErrorMessages.malformedProgram(pointer(at), detail));
  }

  private static ProgramFormatException dangling(String at, String id) {
    return new ProgramFormatException(pointer(at), ErrorMessages.danglingReference(pointer(at), id));
  }

  private static String pointer(String at) {
    return at.isEmpty() ? "/" : at;
  }
}
