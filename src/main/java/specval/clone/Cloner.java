package specval.clone;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import specval.core.Attribute;
import specval.core.AttributedExpr;
import specval.core.DatatypeCtor;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FrameExpr;
import specval.core.Member;
import specval.core.ModuleDefinition;
import specval.core.Pattern;
import specval.core.PrefixNameModule;
import specval.core.Rhs;
import specval.core.Specification;
import specval.core.Stmt;
import specval.core.StmtMeta;
import specval.core.Type;
import specval.core.TypeParameter;
import specval.core.Variable;
import specval.runtime.UnreachableException;

/**
 * 语法树深拷贝。
 *
 * <p>每个语法类别都有一个访问者实现，新增变体时编译器会要求在这里补上对应规则。
 * 变量、语句、成员、类型参数各有一张按对象身份记忆的表：同一个源节点在一次克隆中只产生一个副本，
 * 共享引用在克隆后仍然共享。记忆表属于一个 {@code Cloner} 实例，不要跨多次克隆复用。</p>
 *
 * <p>所有公开的 {@code clone*} 入口对 null 返回 null。</p>
 *
 * @param <C> 递归过程中向下传递的上下文类型；不需要上下文时用 {@link Void} 并传 null
 */
public class Cloner<C> implements Decl.Visitor<Decl, C>, Member.Visitor<Member, C>, Type.Visitor<Type, C>,
    Variable.Visitor<Variable, C>, Expr.Visitor<Expr, C>, Stmt.Visitor<Stmt, C>, Rhs.Visitor<Rhs, C>,
    Pattern.Visitor<Pattern, C> {

  private final boolean cloneResolvedFields;
  private final boolean cloneLiteralModuleDefinition;

  private final Map<Stmt, Stmt> statementClones = new IdentityHashMap<>();
  private final Map<Variable, Variable> variableClones = new IdentityHashMap<>();
  private final Map<Member, Member> memberClones = new IdentityHashMap<>();
  private final Map<TypeParameter, TypeParameter> typeParameterClones = new IdentityHashMap<>();

  public Cloner() {
    this(false, false);
  }

  /**
   * @param cloneLiteralModuleDefinition 为 true 时嵌套模块的定义也被深拷贝，否则副本与原树共享嵌套模块定义
   * @param cloneResolvedFields 为 true 时保留解析阶段的结果（推断类型、模块签名、break 目标、保留属性）
   */
  public Cloner(boolean cloneLiteralModuleDefinition, boolean cloneResolvedFields) {
    this.cloneLiteralModuleDefinition = cloneLiteralModuleDefinition;
    this.cloneResolvedFields = cloneResolvedFields;
  }

  public boolean cloneResolvedFields() {
    return cloneResolvedFields;
  }

  /**
   * 预先登记某条语句的副本，之后对 {@code original} 的克隆都返回 {@code clone}。
   *
   * @throws IllegalStateException 该语句已经有副本
   */
  public void registerStatementClone(Stmt original, Stmt clone) {
    if (statementClones.containsKey(original)) {
      throw new IllegalStateException("Statement already cloned: " + original.getClass().getSimpleName());
    }
    statementClones.put(original, clone);
  }

  /** 沿用另一个克隆器已经建立的类型参数副本，使两次克隆产出的树引用同一批类型参数。 */
  public void inheritTypeParameterClones(Cloner<?> other) {
    typeParameterClones.putAll(other.typeParameterClones);
  }

  // ---------------------------------------------------------------------------------------------
  // 模块与声明

  public ModuleDefinition cloneModuleDefinition(ModuleDefinition m, C ctx) {
    if (m == null) return null;
    return cloneModuleDefinition(m, m.name(), ctx);
  }

  public ModuleDefinition cloneModuleDefinition(ModuleDefinition m, String name, C ctx) {
    if (m == null) return null;
    List<Decl> decls = filterDecls(m.decls(), ctx);
    List<PrefixNameModule> prefixed = new ArrayList<>(m.prefixNamedModules().size());
    for (PrefixNameModule p : m.prefixNamedModules()) {
      PrefixNameModule clone = clonePrefixNamedModule(p, ctx);
      if (clone != null) prefixed.add(clone);
    }
    return new ModuleDefinition(name, m.isAbstract(), m.refinementBase(), decls, prefixed,
        cloneAttributes(m.attributes(), ctx));
  }

  protected PrefixNameModule clonePrefixNamedModule(PrefixNameModule p, C ctx) {
    Decl clone = cloneDeclaration(p.module(), ctx);
    return clone instanceof Decl.LiteralModule lm ? new PrefixNameModule(p.prefixIds(), lm) : null;
  }

  /** 克隆声明列表，丢弃被过滤掉（返回 null）的声明。 */
  protected List<Decl> filterDecls(List<Decl> decls, C ctx) {
    List<Decl> out = new ArrayList<>(decls.size());
    for (Decl d : decls) {
      Decl clone = cloneDeclaration(d, ctx);
      if (clone != null) out.add(clone);
    }
    return out;
  }

  public Decl cloneDeclaration(Decl d, C ctx) {
    if (d == null) return null;
    return d.accept(this, ctx);
  }

  @Override
  public Decl visitAbstractType(Decl.AbstractType d, C ctx) {
    var characteristics = cloneCharacteristics(d.characteristics());
    var tps = cloneTypeParams(d.typeArgs());
    var parents = cloneTypes(d.parentTraits(), ctx);
    return new Decl.AbstractType(d.name(), tps, characteristics, parents, filterMembers(d.members(), ctx),
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitSubsetType(Decl.SubsetType d, C ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    return new Decl.SubsetType(d.name(), tps, cloneCharacteristics(d.characteristics()),
        cloneVariable(d.var(), ctx), cloneExpr(d.constraint(), ctx), d.witnessKind(), cloneExpr(d.witness(), ctx),
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitTypeSynonym(Decl.TypeSynonym d, C ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    return new Decl.TypeSynonym(d.name(), tps, cloneCharacteristics(d.characteristics()), cloneType(d.rhs(), ctx),
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitNewtype(Decl.Newtype d, C ctx) {
    var baseType = cloneType(d.baseType(), ctx);
    var bound = cloneVariable(d.var(), ctx);
    return new Decl.Newtype(d.name(), baseType, bound, cloneExpr(d.constraint(), ctx), d.witnessKind(),
        cloneExpr(d.witness(), ctx), cloneTypes(d.parentTraits(), ctx), filterMembers(d.members(), ctx),
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitDatatype(Decl.Datatype d, C ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    List<DatatypeCtor> ctors = new ArrayList<>(d.ctors().size());
    for (DatatypeCtor ct : d.ctors()) ctors.add(cloneCtor(ct, ctx));
    return new Decl.Datatype(d.name(), d.coinductive(), tps, ctors, cloneTypes(d.parentTraits(), ctx),
        filterMembers(d.members(), ctx), cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitTupleType(Decl.TupleType d, C ctx) {
    // 元组类型只存在于系统模块，不会出现在被克隆的用户模块中
    throw UnreachableException.of("clone", d);
  }

  @Override
  public Decl visitIterator(Decl.Iterator d, C ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    var ins = cloneFormals(d.ins(), ctx);
    var outs = cloneFormals(d.outs(), ctx);
    var reads = cloneSpecFrameExpr(d.reads(), ctx);
    var mod = cloneSpecFrameExpr(d.mod(), ctx);
    var decr = cloneSpecExpr(d.decreases(), ctx);
    var req = cloneAttributedExprs(d.req(), ctx);
    var yreq = cloneAttributedExprs(d.yieldReq(), ctx);
    var ens = cloneAttributedExprs(d.ens(), ctx);
    var yens = cloneAttributedExprs(d.yieldEns(), ctx);
    var body = cloneBlockStmt(d.body(), ctx);
    return new Decl.Iterator(d.name(), tps, ins, outs, reads, mod, decr, req, ens, yreq, yens, body,
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitTrait(Decl.Trait d, C ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    var members = filterMembers(d.members(), ctx);
    return new Decl.Trait(d.name(), tps, cloneTypes(d.parentTraits(), ctx), members,
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitClassDecl(Decl.ClassDecl d, C ctx) {
    var tps = cloneTypeParams(d.typeArgs());
    var members = filterMembers(d.members(), ctx);
    return new Decl.ClassDecl(d.name(), tps, cloneTypes(d.parentTraits(), ctx), members,
        cloneAttributes(d.attributes(), ctx));
  }

  @Override
  public Decl visitDefaultClass(Decl.DefaultClass d, C ctx) {
    return new Decl.DefaultClass(filterMembers(d.members(), ctx));
  }

  @Override
  public Decl visitLiteralModule(Decl.LiteralModule d, C ctx) {
    ModuleDefinition def = cloneLiteralModuleDefinition ? cloneModuleDefinition(d.def(), ctx) : d.def();
    return new Decl.LiteralModule(def, d.cloneId());
  }

  @Override
  public Decl visitAliasModule(Decl.AliasModule d, C ctx) {
    return new Decl.AliasModule(d.name(), d.targetPath(), d.opened(), d.exports(),
        cloneResolvedFields ? d.signature() : null, d.cloneId());
  }

  @Override
  public Decl visitAbstractModule(Decl.AbstractModule d, C ctx) {
    return new Decl.AbstractModule(d.name(), d.path(), d.opened(), d.exports(),
        cloneResolvedFields ? d.signature() : null, d.cloneId());
  }

  @Override
  public Decl visitModuleExport(Decl.ModuleExport d, C ctx) {
    return new Decl.ModuleExport(d.name(), d.provides(), d.reveals(), d.extendsNames(), d.provideAll(),
        d.revealAll(), d.isDefault());
  }

  public DatatypeCtor cloneCtor(DatatypeCtor ct, C ctx) {
    if (ct == null) return null;
    return new DatatypeCtor(ct.name(), ct.ghost(), cloneFormals(ct.formals(), ctx),
        cloneAttributes(ct.attributes(), ctx));
  }

  // ---------------------------------------------------------------------------------------------
  // 类型参数与类型

  public TypeParameter cloneTypeParam(TypeParameter tp) {
    if (tp == null) return null;
    TypeParameter cached = typeParameterClones.get(tp);
    if (cached != null) return cached;
    var clone = new TypeParameter(tp.name(), tp.variance(), cloneCharacteristics(tp.characteristics()));
    typeParameterClones.put(tp, clone);
    return clone;
  }

  protected List<TypeParameter> cloneTypeParams(List<TypeParameter> tps) {
    List<TypeParameter> out = new ArrayList<>(tps.size());
    for (TypeParameter tp : tps) out.add(cloneTypeParam(tp));
    return out;
  }

  /** 推断出的 (==) 约束会被重新推断，副本中恢复为未指定。 */
  public TypeParameter.Characteristics cloneCharacteristics(TypeParameter.Characteristics ch) {
    if (ch == null) return null;
    var eq = ch.equalitySupport() == TypeParameter.EqualitySupport.INFERRED_REQUIRED
        ? TypeParameter.EqualitySupport.UNSPECIFIED
        : ch.equalitySupport();
    return new TypeParameter.Characteristics(eq, ch.autoInit(), ch.containsNoReferenceTypes());
  }

  public Type cloneType(Type t, C ctx) {
    if (t == null) return null;
    return t.accept(this, ctx);
  }

  protected List<Type> cloneTypes(List<Type> types, C ctx) {
    List<Type> out = new ArrayList<>(types.size());
    for (Type t : types) out.add(cloneType(t, ctx));
    return out;
  }

  @Override
  public Type visitBasicType(Type.BasicType t, C ctx) {
    return t;
  }

  @Override
  public Type visitSetType(Type.SetType t, C ctx) {
    return new Type.SetType(t.finite(), cloneType(t.arg(), ctx));
  }

  @Override
  public Type visitSeqType(Type.SeqType t, C ctx) {
    return new Type.SeqType(cloneType(t.arg(), ctx));
  }

  @Override
  public Type visitMultiSetType(Type.MultiSetType t, C ctx) {
    return new Type.MultiSetType(cloneType(t.arg(), ctx));
  }

  @Override
  public Type visitMapType(Type.MapType t, C ctx) {
    return new Type.MapType(t.finite(), cloneType(t.domain(), ctx), cloneType(t.range(), ctx));
  }

  @Override
  public Type visitArrowType(Type.ArrowType t, C ctx) {
    return new Type.ArrowType(cloneTypes(t.args(), ctx), cloneType(t.result(), ctx));
  }

  @Override
  public Type visitUserDefinedType(Type.UserDefinedType t, C ctx) {
    return new Type.UserDefinedType(t.name(), cloneTypes(t.typeArgs(), ctx));
  }

  @Override
  public Type visitInferredType(Type.InferredType t, C ctx) {
    return new Type.InferredType(cloneResolvedFields ? t.resolved() : null);
  }

  @Override
  public Type visitTypeParamRef(Type.TypeParamRef t, C ctx) {
    return new Type.TypeParamRef(cloneTypeParam(t.param()));
  }

  @Override
  public Type visitRefinementWrapper(Type.RefinementWrapper t, C ctx) {
    return cloneType(t.inner(), ctx);
  }

  // ---------------------------------------------------------------------------------------------
  // 变量

  /** 按身份记忆的变量克隆：同一个源变量总是得到同一个副本。 */
  @SuppressWarnings("unchecked")
  public <V extends Variable> V cloneVariable(V v, C ctx) {
    if (v == null) return null;
    Variable cached = variableClones.get(v);
    if (cached != null) return (V) cached;
    Variable clone = v.accept(this, ctx);
    variableClones.put(v, clone);
    return (V) clone;
  }

  public Variable.Formal cloneFormal(Variable.Formal f, C ctx) {
    return cloneVariable(f, ctx);
  }

  protected List<Variable.Formal> cloneFormals(List<Variable.Formal> formals, C ctx) {
    List<Variable.Formal> out = new ArrayList<>(formals.size());
    for (Variable.Formal f : formals) out.add(cloneFormal(f, ctx));
    return out;
  }

  protected List<Variable.BoundVar> cloneBoundVars(List<Variable.BoundVar> vars, C ctx) {
    List<Variable.BoundVar> out = new ArrayList<>(vars.size());
    for (Variable.BoundVar bv : vars) out.add(cloneVariable(bv, ctx));
    return out;
  }

  @Override
  public Variable visitFormal(Variable.Formal f, C ctx) {
    return new Variable.Formal(f.name(), cloneType(f.type(), ctx), f.inParam(), f.ghost(),
        cloneExpr(f.defaultValue(), ctx), cloneAttributes(f.attributes(), ctx), f.old(), f.nameOnly(), f.older(),
        f.nameForCompilation());
  }

  @Override
  public Variable visitBoundVar(Variable.BoundVar bv, C ctx) {
    return new Variable.BoundVar(bv.name(), cloneType(bv.type(), ctx), bv.ghost());
  }

  @Override
  public Variable visitLocalVariable(Variable.LocalVariable lv, C ctx) {
    return new Variable.LocalVariable(lv.name(), cloneType(lv.syntacticType(), ctx), lv.ghost(), lv.typeExplicit(),
        cloneResolvedFields ? lv.resolvedType() : null);
  }

  // ---------------------------------------------------------------------------------------------
  // 属性与规格

  public List<Attribute> cloneAttributes(List<Attribute> attrs, C ctx) {
    if (attrs == null) return null;
    List<Attribute> out = new ArrayList<>(attrs.size());
    for (Attribute a : attrs) {
      if (!keepAttribute(a)) continue;
      out.add(new Attribute(a.name(), cloneExprs(a.args(), ctx)));
    }
    return out;
  }

  /** 保留属性是解析阶段的产物，只在保留解析结果时复制。 */
  protected boolean keepAttribute(Attribute a) {
    return cloneResolvedFields || !a.isReserved();
  }

  public AttributedExpr cloneAttributedExpr(AttributedExpr e, C ctx) {
    if (e == null) return null;
    return new AttributedExpr(cloneExpr(e.expr(), ctx), e.label(), cloneAttributes(e.attributes(), ctx),
        e.injected());
  }

  protected List<AttributedExpr> cloneAttributedExprs(List<AttributedExpr> exprs, C ctx) {
    List<AttributedExpr> out = new ArrayList<>(exprs.size());
    for (AttributedExpr e : exprs) out.add(cloneAttributedExpr(e, ctx));
    return out;
  }

  public Specification<Expr> cloneSpecExpr(Specification<Expr> spec, C ctx) {
    if (spec == null) return null;
    return new Specification<>(cloneExprs(spec.expressions(), ctx), cloneAttributes(spec.attributes(), ctx));
  }

  public Specification<FrameExpr> cloneSpecFrameExpr(Specification<FrameExpr> spec, C ctx) {
    if (spec == null) return null;
    List<FrameExpr> frames = new ArrayList<>(spec.expressions().size());
    for (FrameExpr fe : spec.expressions()) frames.add(cloneFrameExpr(fe, ctx));
    return new Specification<>(frames, cloneAttributes(spec.attributes(), ctx));
  }

  public FrameExpr cloneFrameExpr(FrameExpr fe, C ctx) {
    if (fe == null) return null;
    return new FrameExpr(cloneExpr(fe.expr(), ctx), fe.fieldName());
  }

  // ---------------------------------------------------------------------------------------------
  // 成员

  /** 克隆成员列表，丢弃被过滤掉（返回 null）的成员。 */
  protected List<Member> filterMembers(List<Member> members, C ctx) {
    List<Member> out = new ArrayList<>(members.size());
    for (Member m : members) {
      Member clone = cloneMember(m, ctx);
      if (clone != null) out.add(clone);
    }
    return out;
  }

  public Member cloneMember(Member member, C ctx) {
    if (member == null) return null;
    if (memberClones.containsKey(member)) return memberClones.get(member);
    Member clone = member.accept(this, ctx);
    memberClones.put(member, clone);
    return clone;
  }

  @Override
  public Member visitField(Member.Field f, C ctx) {
    return new Member.Field(f.name(), f.isStatic(), f.ghost(), f.mutable(), f.userMutable(),
        cloneType(f.type(), ctx), cloneAttributes(f.attributes(), ctx));
  }

  @Override
  public Member visitConstantField(Member.ConstantField f, C ctx) {
    return new Member.ConstantField(f.name(), cloneExpr(f.rhs(), ctx), f.isStatic(), f.ghost(), f.opaque(),
        cloneType(f.type(), ctx), cloneAttributes(f.attributes(), ctx));
  }

  @Override
  public Member visitSpecialField(Member.SpecialField f, C ctx) {
    return new Member.SpecialField(f.name(), f.specialId(), f.ghost(), f.mutable(), f.userMutable(),
        cloneType(f.type(), ctx), cloneAttributes(f.attributes(), ctx));
  }

  @Override
  public Member visitFunction(Member.Function f, C ctx) {
    return cloneFunction(f, f.name(), ctx);
  }

  @Override
  public Member visitMethod(Member.Method m, C ctx) {
    return cloneMethod(m, m.name(), ctx);
  }

  public Member.Function cloneFunction(Member.Function f, String newName, C ctx) {
    if (f == null) return null;
    var tps = cloneTypeParams(f.typeArgs());
    var formals = cloneFormals(f.ins(), ctx);
    var result = cloneFormal(f.result(), ctx);
    var req = cloneAttributedExprs(f.req(), ctx);
    var reads = cloneSpecFrameExpr(f.reads(), ctx);
    var decreases = cloneSpecExpr(f.decreases(), ctx);
    var ens = cloneAttributedExprs(f.ens(), ctx);
    var body = cloneExpr(f.body(), ctx);
    var byMethodBody = cloneBlockStmt(f.byMethodBody(), ctx);
    return new Member.Function(f.kind(), newName != null ? newName : f.name(), f.isStatic(), f.ghost(), f.opaque(),
        tps, formals, result, cloneType(f.resultType(), ctx), req, reads, ens, decreases, body, byMethodBody,
        cloneAttributes(f.attributes(), ctx));
  }

  public Member.Method cloneMethod(Member.Method m, String newName, C ctx) {
    if (m == null) return null;
    var tps = cloneTypeParams(m.typeArgs());
    var ins = cloneFormals(m.ins(), ctx);
    var outs = cloneFormals(m.outs(), ctx);
    var req = cloneAttributedExprs(m.req(), ctx);
    var reads = cloneSpecFrameExpr(m.reads(), ctx);
    var mod = cloneSpecFrameExpr(m.mod(), ctx);
    var ens = cloneAttributedExprs(m.ens(), ctx);
    var decreases = cloneSpecExpr(m.decreases(), ctx);
    var body = cloneMethodBody(m, ctx);
    return new Member.Method(m.kind(), newName != null ? newName : m.name(), m.isStatic(), m.ghost(), tps, ins,
        outs, req, reads, mod, ens, decreases, body, cloneAttributes(m.attributes(), ctx));
  }

  public Stmt cloneMethodBody(Member.Method m, C ctx) {
    if (m.body() instanceof Stmt.Block block) {
      return cloneBlockStmt(block, ctx);
    }
    return cloneStmt(m.body(), ctx);
  }

  // ---------------------------------------------------------------------------------------------
  // 语句

  /**
   * 克隆语句。先查语句记忆表，使预先登记的副本与重复访问的语句都返回同一个对象。
   */
  public Stmt cloneStmt(Stmt s, C ctx) {
    if (s == null) return null;
    Stmt cached = statementClones.get(s);
    if (cached != null) return cached;
    Stmt clone = s.accept(this, ctx);
    statementClones.put(s, clone);
    return clone;
  }

  public Stmt.Block cloneBlockStmt(Stmt.Block b, C ctx) {
    return (Stmt.Block) cloneStmt(b, ctx);
  }

  protected List<Stmt> cloneStmts(List<Stmt> stmts, C ctx) {
    List<Stmt> out = new ArrayList<>(stmts.size());
    for (Stmt s : stmts) out.add(cloneStmt(s, ctx));
    return out;
  }

  /** 没有名字的标签是解析阶段为隐式 break 目标生成的，不复制。 */
  protected StmtMeta cloneMeta(StmtMeta meta, C ctx) {
    List<StmtMeta.Label> labels = new ArrayList<>(meta.labels().size());
    for (StmtMeta.Label l : meta.labels()) {
      if (l.name() != null) labels.add(new StmtMeta.Label(l.name()));
    }
    return new StmtMeta(meta.id(), labels, cloneAttributes(meta.attributes(), ctx), meta.ghost());
  }

  @Override
  public Stmt visitBlockStmt(Stmt.Block s, C ctx) {
    return new Stmt.Block(cloneMeta(s.meta(), ctx), cloneStmts(s.body(), ctx));
  }

  @Override
  public Stmt visitDividedBlockStmt(Stmt.DividedBlock s, C ctx) {
    return new Stmt.DividedBlock(cloneMeta(s.meta(), ctx), cloneStmts(s.init(), ctx), cloneStmts(s.proper(), ctx));
  }

  @Override
  public Stmt visitAssertStmt(Stmt.Assert s, C ctx) {
    return new Stmt.Assert(cloneMeta(s.meta(), ctx), cloneExpr(s.expr(), ctx), s.label(),
        cloneBlockStmt(s.proof(), ctx));
  }

  @Override
  public Stmt visitAssumeStmt(Stmt.Assume s, C ctx) {
    return new Stmt.Assume(cloneMeta(s.meta(), ctx), cloneExpr(s.expr(), ctx));
  }

  @Override
  public Stmt visitExpectStmt(Stmt.Expect s, C ctx) {
    return new Stmt.Expect(cloneMeta(s.meta(), ctx), cloneExpr(s.expr(), ctx), cloneExpr(s.message(), ctx));
  }

  @Override
  public Stmt visitPrintStmt(Stmt.Print s, C ctx) {
    return new Stmt.Print(cloneMeta(s.meta(), ctx), cloneExprs(s.args(), ctx));
  }

  @Override
  public Stmt visitReturnStmt(Stmt.Return s, C ctx) {
    return new Stmt.Return(cloneMeta(s.meta(), ctx), cloneRhss(s.rhss(), ctx));
  }

  @Override
  public Stmt visitBreakStmt(Stmt.Break s, C ctx) {
    return new Stmt.Break(cloneMeta(s.meta(), ctx), s.targetLabel(), s.breakCount(), s.isContinue(),
        cloneResolvedFields ? s.targetId() : null);
  }

  @Override
  public Stmt visitVarDeclStmt(Stmt.VarDecl s, C ctx) {
    List<Variable.LocalVariable> locals = new ArrayList<>(s.locals().size());
    for (Variable.LocalVariable lv : s.locals()) locals.add(cloneVariable(lv, ctx));
    return new Stmt.VarDecl(cloneMeta(s.meta(), ctx), locals, (Stmt.Update) cloneStmt(s.update(), ctx));
  }

  @Override
  public Stmt visitUpdateStmt(Stmt.Update s, C ctx) {
    return new Stmt.Update(cloneMeta(s.meta(), ctx), cloneExprs(s.lhss(), ctx), cloneRhss(s.rhss(), ctx));
  }

  @Override
  public Stmt visitAssignStmt(Stmt.Assign s, C ctx) {
    return new Stmt.Assign(cloneMeta(s.meta(), ctx), cloneExpr(s.lhs(), ctx), cloneRhs(s.rhs(), ctx));
  }

  @Override
  public Stmt visitCallStmt(Stmt.Call s, C ctx) {
    return new Stmt.Call(cloneMeta(s.meta(), ctx), cloneExprs(s.lhss(), ctx), cloneExpr(s.receiver(), ctx),
        s.methodName(), cloneExprs(s.args(), ctx));
  }

  @Override
  public Stmt visitIfStmt(Stmt.If s, C ctx) {
    return new Stmt.If(cloneMeta(s.meta(), ctx), cloneExpr(s.guard(), ctx), cloneBlockStmt(s.thn(), ctx),
        cloneStmt(s.els(), ctx));
  }

  @Override
  public Stmt visitWhileStmt(Stmt.While s, C ctx) {
    return new Stmt.While(cloneMeta(s.meta(), ctx), cloneExpr(s.guard(), ctx),
        cloneAttributedExprs(s.invariants(), ctx), cloneSpecExpr(s.decreases(), ctx),
        cloneSpecFrameExpr(s.mod(), ctx), cloneBlockStmt(s.body(), ctx));
  }

  @Override
  public Stmt visitMatchStmt(Stmt.Match s, C ctx) {
    List<Stmt.MatchCase> cases = new ArrayList<>(s.cases().size());
    for (Stmt.MatchCase c : s.cases()) {
      cases.add(new Stmt.MatchCase(clonePattern(c.pattern(), ctx), cloneStmts(c.body(), ctx),
          cloneAttributes(c.attributes(), ctx)));
    }
    return new Stmt.Match(cloneMeta(s.meta(), ctx), cloneExpr(s.source(), ctx), cases);
  }

  @Override
  public Stmt visitForallStmt(Stmt.Forall s, C ctx) {
    return new Stmt.Forall(cloneMeta(s.meta(), ctx), cloneBoundVars(s.vars(), ctx), cloneExpr(s.range(), ctx),
        cloneAttributedExprs(s.ens(), ctx), cloneStmt(s.body(), ctx));
  }

  @Override
  public Stmt visitRevealStmt(Stmt.Reveal s, C ctx) {
    return new Stmt.Reveal(cloneMeta(s.meta(), ctx), cloneExprs(s.exprs(), ctx));
  }

  @Override
  public Stmt visitModifyStmt(Stmt.Modify s, C ctx) {
    return new Stmt.Modify(cloneMeta(s.meta(), ctx), cloneSpecFrameExpr(s.mod(), ctx),
        cloneBlockStmt(s.body(), ctx));
  }

  // ---------------------------------------------------------------------------------------------
  // 赋值右侧与模式

  public Rhs cloneRhs(Rhs r, C ctx) {
    if (r == null) return null;
    return r.accept(this, ctx);
  }

  protected List<Rhs> cloneRhss(List<Rhs> rhss, C ctx) {
    List<Rhs> out = new ArrayList<>(rhss.size());
    for (Rhs r : rhss) out.add(cloneRhs(r, ctx));
    return out;
  }

  @Override
  public Rhs visitExprRhs(Rhs.ExprRhs r, C ctx) {
    return new Rhs.ExprRhs(cloneExpr(r.expr(), ctx), cloneAttributes(r.attributes(), ctx));
  }

  @Override
  public Rhs visitHavocRhs(Rhs.HavocRhs r, C ctx) {
    return new Rhs.HavocRhs();
  }

  @Override
  public Rhs visitTypeRhs(Rhs.TypeRhs r, C ctx) {
    return new Rhs.TypeRhs(cloneType(r.type(), ctx), cloneExprs(r.arrayDims(), ctx), r.ctorName(),
        r.args() == null ? null : cloneExprs(r.args(), ctx));
  }

  public Pattern clonePattern(Pattern p, C ctx) {
    if (p == null) return null;
    return p.accept(this, ctx);
  }

  @Override
  public Pattern visitLitPattern(Pattern.Lit p, C ctx) {
    return new Pattern.Lit((Expr.Literal) cloneExpr(p.lit(), ctx));
  }

  @Override
  public Pattern visitIdPattern(Pattern.Id p, C ctx) {
    List<Pattern> args = null;
    if (p.arguments() != null) {
      args = new ArrayList<>(p.arguments().size());
      for (Pattern a : p.arguments()) args.add(clonePattern(a, ctx));
    }
    return new Pattern.Id(p.id(), cloneVariable(p.var(), ctx), args, p.ghost());
  }

  @Override
  public Pattern visitDisjunctivePattern(Pattern.Disjunctive p, C ctx) {
    List<Pattern> alts = new ArrayList<>(p.alternatives().size());
    for (Pattern a : p.alternatives()) alts.add(clonePattern(a, ctx));
    return new Pattern.Disjunctive(alts, p.ghost());
  }

  // ---------------------------------------------------------------------------------------------
  // 表达式

  public Expr cloneExpr(Expr e, C ctx) {
    if (e == null) return null;
    return e.accept(this, ctx);
  }

  protected List<Expr> cloneExprs(List<Expr> exprs, C ctx) {
    List<Expr> out = new ArrayList<>(exprs.size());
    for (Expr e : exprs) out.add(cloneExpr(e, ctx));
    return out;
  }

  @Override
  public Expr visitLiteralExpr(Expr.Literal e, C ctx) {
    return new Expr.Literal(e.value(), cloneResolvedFields ? e.type() : null);
  }

  @Override
  public Expr visitIdentExpr(Expr.Ident e, C ctx) {
    return new Expr.Ident(e.name(), cloneVariable(e.var(), ctx), cloneResolvedFields ? e.type() : null);
  }

  @Override
  public Expr visitThisExpr(Expr.This e, C ctx) {
    return new Expr.This(cloneResolvedFields ? e.type() : null, e.implicit());
  }

  @Override
  public Expr visitStaticReceiverExpr(Expr.StaticReceiver e, C ctx) {
    return new Expr.StaticReceiver(cloneType(e.type(), ctx));
  }

  @Override
  public Expr visitDotNameExpr(Expr.DotName e, C ctx) {
    return new Expr.DotName(cloneExpr(e.obj(), ctx), e.suffix(), cloneTypes(e.typeArgs(), ctx));
  }

  @Override
  public Expr visitFunctionCallExpr(Expr.FunctionCall e, C ctx) {
    return new Expr.FunctionCall(cloneExpr(e.receiver(), ctx), e.name(), cloneExprs(e.args(), ctx), e.atLabel());
  }

  @Override
  public Expr visitUnaryExpr(Expr.Unary e, C ctx) {
    return new Expr.Unary(e.op(), cloneExpr(e.operand(), ctx));
  }

  @Override
  public Expr visitBinaryExpr(Expr.Binary e, C ctx) {
    return new Expr.Binary(e.op(), cloneExpr(e.left(), ctx), cloneExpr(e.right(), ctx));
  }

  @Override
  public Expr visitIteExpr(Expr.Ite e, C ctx) {
    return new Expr.Ite(cloneExpr(e.test(), ctx), cloneExpr(e.thn(), ctx), cloneExpr(e.els(), ctx));
  }

  @Override
  public Expr visitOldExpr(Expr.Old e, C ctx) {
    return new Expr.Old(cloneExpr(e.expr(), ctx), e.at());
  }

  @Override
  public Expr visitSeqDisplayExpr(Expr.SeqDisplay e, C ctx) {
    return new Expr.SeqDisplay(cloneExprs(e.elements(), ctx));
  }

  @Override
  public Expr visitSetDisplayExpr(Expr.SetDisplay e, C ctx) {
    return new Expr.SetDisplay(e.finite(), cloneExprs(e.elements(), ctx));
  }

  @Override
  public Expr visitMapDisplayExpr(Expr.MapDisplay e, C ctx) {
    List<Expr.MapEntry> entries = new ArrayList<>(e.entries().size());
    for (Expr.MapEntry me : e.entries()) {
      entries.add(new Expr.MapEntry(cloneExpr(me.key(), ctx), cloneExpr(me.value(), ctx)));
    }
    return new Expr.MapDisplay(e.finite(), entries);
  }

  @Override
  public Expr visitSeqSelectExpr(Expr.SeqSelect e, C ctx) {
    return new Expr.SeqSelect(e.selectOne(), cloneExpr(e.seq(), ctx), cloneExpr(e.lo(), ctx),
        cloneExpr(e.hi(), ctx));
  }

  @Override
  public Expr visitQuantifierExpr(Expr.Quantifier e, C ctx) {
    var vars = cloneBoundVars(e.vars(), ctx);
    return new Expr.Quantifier(e.universal(), vars, cloneExpr(e.range(), ctx), cloneExpr(e.term(), ctx),
        cloneAttributes(e.attributes(), ctx));
  }

  @Override
  public Expr visitLambdaExpr(Expr.Lambda e, C ctx) {
    var vars = cloneBoundVars(e.vars(), ctx);
    return new Expr.Lambda(vars, cloneExpr(e.range(), ctx), cloneSpecFrameExpr(e.reads(), ctx),
        cloneExpr(e.body(), ctx));
  }

  @Override
  public Expr visitLetExpr(Expr.Let e, C ctx) {
    var vars = cloneBoundVars(e.vars(), ctx);
    return new Expr.Let(vars, cloneExprs(e.rhss(), ctx), cloneExpr(e.body(), ctx));
  }

  @Override
  public Expr visitMatchExpr(Expr.Match e, C ctx) {
    List<Expr.MatchCase> cases = new ArrayList<>(e.cases().size());
    for (Expr.MatchCase c : e.cases()) {
      cases.add(new Expr.MatchCase(clonePattern(c.pattern(), ctx), cloneExpr(c.body(), ctx),
          cloneAttributes(c.attributes(), ctx)));
    }
    return new Expr.Match(cloneExpr(e.source(), ctx), cases);
  }

  @Override
  public Expr visitParensExpr(Expr.Parens e, C ctx) {
    return new Expr.Parens(cloneExpr(e.inner(), ctx));
  }

  @Override
  public Expr visitDatatypeValueExpr(Expr.DatatypeValue e, C ctx) {
    return new Expr.DatatypeValue(e.datatypeName(), e.ctorName(), cloneExprs(e.args(), ctx));
  }
}
