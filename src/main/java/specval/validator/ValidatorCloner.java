package specval.validator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import specval.clone.DeepModuleSignatureCloner;
import specval.core.Attribute;
import specval.core.AttributedExpr;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FrameExpr;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.ModuleDefinition;
import specval.core.PrefixNameModule;
import specval.core.Rhs;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;

/**
 * 生成模块树的校验器副本。
 *
 * <p>只描述形状的声明（抽象类型、子集类型、类型同义词、newtype、datatype、导出集）被丢弃；
 * 类与 trait 被改名为 {@code X_valid}，字段被丢弃，方法被替换为委托给原方法的外壳：
 * 外壳多一个有效性见证形参 {@code arg_valid}，方法体只有一条 {@code outs := arg_valid.m(ins);}。
 * 类带 {@code {:autocontracts}} 时，外壳的 requires/ensures 以 {@code arg_valid.Valid()} 开头，
 * modifies 以 {@code arg_valid.Repr} 开头。</p>
 *
 * <p>模块导入声明的路径前缀 {@code Gen}，使其指向引用副本；嵌套模块改名为 {@code M_valid}，
 * 并以 {@code import opened M = Gen...M} 看到自己包装的原声明。</p>
 *
 * <p>一个实例只做一次变换：记忆表与见证形参都属于这一次调用，第二次调用 {@link #transform} 抛出
 * {@link IllegalStateException}。</p>
 */
public class ValidatorCloner extends DeepModuleSignatureCloner<ValidatorContext> {
  private static final Logger logger = Logger.getLogger(ValidatorCloner.class.getName());

  private final ValidatorOptions options;
  private final IdSource ids;
  private boolean used;

  public ValidatorCloner(ValidatorOptions options, IdSource ids) {
    this(options, ids, false);
  }

  public ValidatorCloner(ValidatorOptions options, IdSource ids, boolean cloneResolvedFields) {
    super(cloneResolvedFields);
    this.options = options;
    this.ids = ids;
  }

  /**
   * 变换根模块。根模块本身只改名为 {@code name}，不加后缀，也不注入自导入声明。
   *
   * @throws IllegalStateException 本实例已经做过一次变换
   */
  public ModuleDefinition transform(ModuleDefinition module, String name) {
    if (used) {
      throw new IllegalStateException("ValidatorCloner already used; create a new instance per transform");
    }
    used = true;
    return cloneModuleDefinition(module, name, ValidatorContext.root());
  }

  @Override
  public ModuleDefinition cloneModuleDefinition(ModuleDefinition m, String name, ValidatorContext ctx) {
    ModuleDefinition result = super.cloneModuleDefinition(m, name, ctx);
    if (result != null) {
      checkDistinct(result.name(), declNames(result.decls()));
    }
    return result;
  }

  // ---------------------------------------------------------------------------------------------
  // 声明过滤

  @Override
  public Decl visitAbstractType(Decl.AbstractType d, ValidatorContext ctx) {
    return dropDecl(d, "abstract type");
  }

  @Override
  public Decl visitSubsetType(Decl.SubsetType d, ValidatorContext ctx) {
    return dropDecl(d, "subset type");
  }

  @Override
  public Decl visitTypeSynonym(Decl.TypeSynonym d, ValidatorContext ctx) {
    return dropDecl(d, "type synonym");
  }

  @Override
  public Decl visitNewtype(Decl.Newtype d, ValidatorContext ctx) {
    return dropDecl(d, "newtype");
  }

  @Override
  public Decl visitDatatype(Decl.Datatype d, ValidatorContext ctx) {
    return dropDecl(d, d.coinductive() ? "codatatype" : "datatype");
  }

  @Override
  public Decl visitModuleExport(Decl.ModuleExport d, ValidatorContext ctx) {
    return dropDecl(d, "export set");
  }

  private Decl dropDecl(Decl d, String kind) {
    logger.fine(String.format("Dropping %s %s from validator module", kind, d.name()));
    return null;
  }

  @Override
  public Decl visitAliasModule(Decl.AliasModule d, ValidatorContext ctx) {
    return new Decl.AliasModule(d.name(), underReferenceRoot(d.targetPath()), d.opened(), d.exports(), null,
        d.cloneId());
  }

  @Override
  public Decl visitAbstractModule(Decl.AbstractModule d, ValidatorContext ctx) {
    return new Decl.AbstractModule(d.name(), underReferenceRoot(d.path()), d.opened(), d.exports(), null,
        d.cloneId());
  }

  /**
   * 前缀命名模块 {@code A.B} 的自导入指向 {@code Gen.A.B}：先按前缀逐段进入，再按普通嵌套模块变换。
   */
  @Override
  protected PrefixNameModule clonePrefixNamedModule(PrefixNameModule p, ValidatorContext ctx) {
    ValidatorContext outer = ctx;
    List<String> prefix = p.prefixIds();
    for (String id : prefix.subList(0, Math.max(0, prefix.size() - 1))) {
      outer = outer.enterModule(id);
    }
    Decl clone = visitLiteralModule(p.module(), outer);
    return clone instanceof Decl.LiteralModule lm ? new PrefixNameModule(prefix, lm) : null;
  }

  private static List<String> underReferenceRoot(List<String> path) {
    List<String> out = new ArrayList<>(path.size() + 1);
    out.add(ValidatorNames.REFERENCE_ROOT);
    out.addAll(path);
    return out;
  }

  @Override
  public Decl visitLiteralModule(Decl.LiteralModule d, ValidatorContext ctx) {
    String originalName = d.def().name();
    ValidatorContext inner = ctx.enterModule(originalName);
    ModuleDefinition cloned = cloneModuleDefinition(d.def(), ValidatorNames.validName(originalName), inner);
    var selfImport = new Decl.AliasModule(originalName, inner.modulePath(), true, List.of(), null, ids.next());
    List<Decl> decls = new ArrayList<>(cloned.decls().size() + 1);
    decls.add(selfImport);
    decls.addAll(cloned.decls());
    checkDistinct(cloned.name(), declNames(decls));
    return new Decl.LiteralModule(cloned.withDecls(decls), d.cloneId());
  }

  // ---------------------------------------------------------------------------------------------
  // 类与 trait

  @Override
  public Decl visitClassDecl(Decl.ClassDecl d, ValidatorContext ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    var members = transformMembers(d.name(), d.typeArgs(), d.attributes(), d.members(), ctx);
    return new Decl.ClassDecl(ValidatorNames.validName(d.name()), tps, List.of(), members,
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitTrait(Decl.Trait d, ValidatorContext ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    var members = transformMembers(d.name(), d.typeArgs(), d.attributes(), d.members(), ctx);
    return new Decl.Trait(ValidatorNames.validName(d.name()), tps, List.of(), members,
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitDefaultClass(Decl.DefaultClass d, ValidatorContext ctx) {
    var members = filterMembers(d.members(), ctx);
    checkDistinct(d.name(), memberNames(members));
    return new Decl.DefaultClass(members);
  }

  private List<Member> transformMembers(String className, List<TypeParameter> typeArgs, List<Attribute> attributes,
                                        List<Member> members, ValidatorContext ctx) {
    List<Type> typeArgRefs = new ArrayList<>(typeArgs.size());
    for (TypeParameter tp : typeArgs) {
      typeArgRefs.add(new Type.TypeParamRef(cloneTypeParam(tp)));
    }
    boolean autoContracts = Attribute.isTrue(attributes, ValidatorNames.AUTOCONTRACTS);
    var cls = new ValidatorContext.ClassContext(className, typeArgRefs, autoContracts);
    List<Member> out = filterMembers(members, ctx.enterClass(cls));
    checkDistinct(ValidatorNames.validName(className), memberNames(out));
    return out;
  }

  @Override
  protected List<Member> filterMembers(List<Member> members, ValidatorContext ctx) {
    List<Member> out = new ArrayList<>(members.size());
    for (Member m : members) {
      Member clone = cloneMember(m, ctx);
      if (clone == null) continue;
      out.add(clone);
      if (options.addPureCopies() && m instanceof Member.Function f) {
        out.add(pureCopy(f, ctx));
      }
    }
    return out;
  }

  /**
   * 以原名输出的函数副本。副本需要自己的一套形参，所以用新的克隆器生成，只沿用类型参数的副本。
   */
  private Member.Function pureCopy(Member.Function f, ValidatorContext ctx) {
    var copier = new ValidatorCloner(options, ids, cloneResolvedFields());
    copier.inheritTypeParameterClones(this);
    return copier.transformFunction(f, f.name(), ctx);
  }

  // ---------------------------------------------------------------------------------------------
  // 成员

  @Override
  public Member visitField(Member.Field f, ValidatorContext ctx) {
    return ctx.inClass() ? dropMember(f, "field") : super.visitField(f, ctx);
  }

  @Override
  public Member visitConstantField(Member.ConstantField f, ValidatorContext ctx) {
    return ctx.inClass() ? dropMember(f, "constant field") : super.visitConstantField(f, ctx);
  }

  @Override
  public Member visitSpecialField(Member.SpecialField f, ValidatorContext ctx) {
    return ctx.inClass() ? dropMember(f, "special field") : super.visitSpecialField(f, ctx);
  }

  private Member dropMember(Member m, String kind) {
    logger.fine(String.format("Dropping %s %s from validator class", kind, m.name()));
    return null;
  }

  @Override
  public Member visitFunction(Member.Function f, ValidatorContext ctx) {
    if (ctx.inClass() && !options.validatePure()) {
      return dropMember(f, f.kind().keyword());
    }
    return transformFunction(f, ValidatorNames.validName(f.name()), ctx);
  }

  /**
   * 克隆函数并改名。类中的实例函数多一个见证形参，函数体里的 {@code this} 改写为对它的引用。
   */
  private Member.Function transformFunction(Member.Function f, String name, ValidatorContext ctx) {
    Variable.Formal witness = null;
    if (ctx.inClass() && !f.isStatic()) {
      List<Variable.Formal> taken = new ArrayList<>(f.ins());
      if (f.result() != null) taken.add(f.result());
      witness = newWitness(ctx.classContext(), taken);
    }
    Member.Function cloned = cloneFunction(f, name, ctx.withWitness(witness));
    if (witness == null) {
      return cloned;
    }
    return new Member.Function(cloned.kind(), cloned.name(), cloned.isStatic(), cloned.ghost(), cloned.opaque(),
        cloned.typeArgs(), append(cloned.ins(), witness), cloned.result(), cloned.resultType(), cloned.req(),
        cloned.reads(), cloned.ens(), cloned.decreases(), cloned.body(), cloned.byMethodBody(),
        cloned.attributes());
  }

  @Override
  public Member visitMethod(Member.Method m, ValidatorContext ctx) {
    if (m.kind() == MethodKind.CONSTRUCTOR) {
      return dropMember(m, "constructor");
    }
    if (m.kind().isLemma() && !options.validateLemmas()) {
      return dropMember(m, m.kind().keyword());
    }
    return buildShim(m, ctx);
  }

  /**
   * 构造方法外壳：签名与规格从原方法克隆，方法体重新合成为一次委托调用。
   */
  private Member.Method buildShim(Member.Method m, ValidatorContext ctx) {
    ValidatorContext.ClassContext cls = ctx.classContext();
    Variable.Formal witness = null;
    if (cls != null) {
      List<Variable.Formal> taken = new ArrayList<>(m.ins());
      taken.addAll(m.outs());
      witness = newWitness(cls, taken);
    }
    ValidatorContext inner = ctx.withWitness(witness);

    var tps = cloneTypeParams(m.typeArgs());
    var ins = cloneFormals(m.ins(), inner);
    var outs = cloneFormals(m.outs(), inner);
    var req = cloneAttributedExprs(m.req(), inner);
    var reads = cloneSpecFrameExpr(m.reads(), inner);
    var mod = cloneSpecFrameExpr(m.mod(), inner);
    var ens = cloneAttributedExprs(m.ens(), inner);
    var decreases = cloneSpecExpr(m.decreases(), inner);

    if (witness != null) {
      ins = append(ins, witness);
      if (cls.autoContracts()) {
        mod = mod.prepend(FrameExpr.of(Expr.DotName.of(Expr.Ident.of(witness), ValidatorNames.REPR_FIELD)));
        req = prepend(AttributedExpr.injected(validityCall(witness)), req);
        ens = prepend(AttributedExpr.injected(validityCall(witness)), ens);
      }
    }

    Stmt body = m.body() == null ? null : delegationBody(m, witness, inner);
    logger.fine(String.format("Built validator shim %s for %s", ValidatorNames.validName(m.name()), m.name()));
    return new Member.Method(m.kind(), ValidatorNames.validName(m.name()), m.isStatic(), m.ghost(), tps, ins, outs,
        req, reads, mod, ens, decreases, body, cloneAttributes(m.attributes(), inner));
  }

  /**
   * {@code outs := receiver.m(ins);}。实参与左侧引用克隆后的形参，类型取原形参的类型。
   */
  private Stmt.Block delegationBody(Member.Method m, Variable.Formal witness, ValidatorContext inner) {
    List<Expr> args = new ArrayList<>(m.ins().size());
    for (Variable.Formal in : m.ins()) {
      args.add(new Expr.Ident(in.name(), cloneFormal(in, inner), in.type()));
    }
    List<Expr> lhss = new ArrayList<>(m.outs().size());
    for (Variable.Formal out : m.outs()) {
      lhss.add(new Expr.Ident(out.name(), cloneFormal(out, inner), out.type()));
    }
    Expr receiver = witness != null ? Expr.Ident.of(witness) : new Expr.StaticReceiver(null);
    var call = Expr.FunctionCall.of(receiver, m.name(), args);
    var update = new Stmt.Update(StmtMeta.NONE, lhss, List.of(Rhs.ExprRhs.of(call)));
    return Stmt.Block.of(List.of(update));
  }

  /** 见证形参名与成员自己的形参不同：{@code arg_valid} 被占用时依次尝试 {@code arg_valid0}、{@code arg_valid1}…… */
  private static Variable.Formal newWitness(ValidatorContext.ClassContext cls, List<Variable.Formal> taken) {
    Set<String> names = new HashSet<>();
    for (Variable.Formal f : taken) names.add(f.name());
    String name = ValidatorNames.WITNESS;
    for (int i = 0; names.contains(name); i++) {
      name = ValidatorNames.WITNESS + i;
    }
    return Variable.Formal.in(name, cls.witnessType());
  }

  private static Expr validityCall(Variable.Formal witness) {
    return Expr.FunctionCall.of(Expr.Ident.of(witness), ValidatorNames.VALIDITY_PREDICATE, List.of());
  }

  // ---------------------------------------------------------------------------------------------
  // 表达式与属性

  @Override
  public Expr visitThisExpr(Expr.This e, ValidatorContext ctx) {
    if (!ctx.inClass()) {
      return super.visitThisExpr(e, ctx);
    }
    if (ctx.witness() != null) {
      return Expr.Ident.of(ctx.witness());
    }
    return new Expr.Ident(ValidatorNames.WITNESS, null, ctx.classContext().witnessType());
  }

  @Override
  protected boolean keepAttribute(Attribute a) {
    return !ValidatorNames.AUTOCONTRACTS.equals(a.name()) && super.keepAttribute(a);
  }

  // ---------------------------------------------------------------------------------------------

  private static void checkDistinct(String scope, List<String> names) {
    Set<String> seen = new HashSet<>();
    for (String n : names) {
      if (!seen.add(n)) {
        throw new NameCollisionException(scope, n);
      }
    }
  }

  private static List<String> declNames(List<Decl> decls) {
    List<String> names = new ArrayList<>(decls.size());
    for (Decl d : decls) names.add(d.name());
    return names;
  }

  private static List<String> memberNames(List<Member> members) {
    List<String> names = new ArrayList<>(members.size());
    for (Member m : members) names.add(m.name());
    return names;
  }

  private static <T> List<T> append(List<T> list, T last) {
    List<T> out = new ArrayList<>(list.size() + 1);
    out.addAll(list);
    out.add(last);
    return out;
  }

  private static <T> List<T> prepend(T first, List<T> list) {
    List<T> out = new ArrayList<>(list.size() + 1);
    out.add(first);
    out.addAll(list);
    return out;
  }
}
