package specval.json;

import com.fasterxml.jackson.annotation.*;
import java.util.List;

/**
 * 解析器导出的程序树 JSON 的绑定类。
 *
 * <p>多态节点以 {@code kind} 判别；变量声明带 {@code id}（缺省取名字），引用处以 {@code "var": id} 指向它；
 * 语句可带 {@code id}，break 以 {@code "target"} 引用外层语句。共享与作用域由 {@link specval.ProgramLoader}
 * 在转换为不可变模型时解析。</p>
 */
public final class ProgramJson {
  private ProgramJson() {}

  public static final class Program { public String name; public String sourcePath; public ModuleDef module; }

  public static class ModuleDef {
    public String name;
    @JsonProperty("abstract") public boolean isAbstract;
    public List<String> refines;
    public List<Decl> decls;
    public List<PrefixModule> prefixModules;
    public List<Attr> attributes;
  }
  public static final class PrefixModule { public List<String> prefix; public ModuleDef module; public String cloneId; }
  public static final class Signature { public String module; public List<String> exports; }

  // ---------------------------------------------------------------------------------------------
  // 声明

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = AbstractType.class, name = "AbstractType"),
    @JsonSubTypes.Type(value = SubsetType.class, name = "SubsetType"),
    @JsonSubTypes.Type(value = TypeSynonym.class, name = "TypeSynonym"),
    @JsonSubTypes.Type(value = Newtype.class, name = "Newtype"),
    @JsonSubTypes.Type(value = Datatype.class, name = "Datatype"),
    @JsonSubTypes.Type(value = TupleType.class, name = "TupleType"),
    @JsonSubTypes.Type(value = Iterator.class, name = "Iterator"),
    @JsonSubTypes.Type(value = Trait.class, name = "Trait"),
    @JsonSubTypes.Type(value = ClassDecl.class, name = "Class"),
    @JsonSubTypes.Type(value = DefaultClass.class, name = "DefaultClass"),
    @JsonSubTypes.Type(value = LiteralModule.class, name = "Module"),
    @JsonSubTypes.Type(value = AliasModule.class, name = "AliasModule"),
    @JsonSubTypes.Type(value = AbstractModule.class, name = "AbstractModule"),
    @JsonSubTypes.Type(value = Export.class, name = "Export")
  })
  public sealed interface Decl permits AbstractType, SubsetType, TypeSynonym, Newtype, Datatype, TupleType, Iterator,
      Trait, ClassDecl, DefaultClass, LiteralModule, AliasModule, AbstractModule, Export {}

  @JsonTypeName("AbstractType")
  public static final class AbstractType implements Decl {
    public String name; public List<TypeParam> typeParams; public Characteristics characteristics;
    @JsonProperty("extends") public List<Type> parents; public List<Member> members; public List<Attr> attributes;
  }
  @JsonTypeName("SubsetType")
  public static final class SubsetType implements Decl {
    public String name; public List<TypeParam> typeParams; public Characteristics characteristics;
    public Var var; public Expr constraint; public String witnessKind; public Expr witness; public List<Attr> attributes;
  }
  @JsonTypeName("TypeSynonym")
  public static final class TypeSynonym implements Decl {
    public String name; public List<TypeParam> typeParams; public Characteristics characteristics; public Type rhs;
    public List<Attr> attributes;
  }
  @JsonTypeName("Newtype")
  public static final class Newtype implements Decl {
    public String name; public Type base; public Var var; public Expr constraint; public String witnessKind;
    public Expr witness; @JsonProperty("extends") public List<Type> parents; public List<Member> members;
    public List<Attr> attributes;
  }
  @JsonTypeName("Datatype")
  public static final class Datatype implements Decl {
    public String name; public boolean coinductive; public List<TypeParam> typeParams; public List<Ctor> ctors;
    @JsonProperty("extends") public List<Type> parents; public List<Member> members; public List<Attr> attributes;
  }
  public static final class Ctor { public String name; public boolean ghost; public List<Var> formals; public List<Attr> attributes; }
  @JsonTypeName("TupleType") public static final class TupleType implements Decl { public Integer arity; }
  @JsonTypeName("Iterator")
  public static final class Iterator implements Decl {
    public String name; public List<TypeParam> typeParams; public List<Var> ins; public List<Var> outs;
    public FrameSpec reads; public FrameSpec modifies; public ExprSpec decreases;
    public List<Clause> requires; public List<Clause> ensures; public List<Clause> yieldRequires;
    public List<Clause> yieldEnsures; public Stmt body; public List<Attr> attributes;
  }
  @JsonTypeName("Trait")
  public static final class Trait implements Decl {
    public String name; public List<TypeParam> typeParams; @JsonProperty("extends") public List<Type> parents;
    public List<Member> members; public List<Attr> attributes;
  }
  @JsonTypeName("Class")
  public static final class ClassDecl implements Decl {
    public String name; public List<TypeParam> typeParams; @JsonProperty("extends") public List<Type> parents;
    public List<Member> members; public List<Attr> attributes;
  }
  @JsonTypeName("DefaultClass") public static final class DefaultClass implements Decl { public List<Member> members; }
  @JsonTypeName("Module") public static final class LiteralModule extends ModuleDef implements Decl { public String cloneId; }
  @JsonTypeName("AliasModule")
  public static final class AliasModule implements Decl {
    public String name; public List<String> target; public boolean opened; public List<String> exports;
    public Signature signature; public String cloneId;
  }
  @JsonTypeName("AbstractModule")
  public static final class AbstractModule implements Decl {
    public String name; public List<String> path; public boolean opened; public List<String> exports;
    public Signature signature; public String cloneId;
  }
  @JsonTypeName("Export")
  public static final class Export implements Decl {
    public String name; public List<String> provides; public List<String> reveals;
    @JsonProperty("extends") public List<String> parents; public boolean provideAll; public boolean revealAll;
    @JsonProperty("default") public boolean isDefault;
  }

  // ---------------------------------------------------------------------------------------------
  // 成员

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Field.class, name = "Field"),
    @JsonSubTypes.Type(value = Const.class, name = "Const"),
    @JsonSubTypes.Type(value = SpecialField.class, name = "SpecialField"),
    @JsonSubTypes.Type(value = Function.class, name = "Function"),
    @JsonSubTypes.Type(value = Method.class, name = "Method")
  })
  public sealed interface Member permits Field, Const, SpecialField, Function, Method {}

  @JsonTypeName("Field")
  public static final class Field implements Member {
    public String name; @JsonProperty("static") public boolean isStatic; public boolean ghost;
    public boolean mutable = true; public boolean userMutable = true; public Type type; public List<Attr> attributes;
  }
  @JsonTypeName("Const")
  public static final class Const implements Member {
    public String name; public Expr rhs; @JsonProperty("static") public boolean isStatic; public boolean ghost;
    public boolean opaque; public Type type; public List<Attr> attributes;
  }
  @JsonTypeName("SpecialField")
  public static final class SpecialField implements Member {
    public String name; public String specialId; public boolean ghost; public boolean mutable; public boolean userMutable;
    public Type type; public List<Attr> attributes;
  }
  @JsonTypeName("Function")
  public static final class Function implements Member {
    public String functionKind; public String name; @JsonProperty("static") public boolean isStatic; public boolean ghost;
    public boolean opaque; public List<TypeParam> typeParams; public List<Var> ins; public Var result;
    public Type resultType; public List<Clause> requires; public FrameSpec reads; public List<Clause> ensures;
    public ExprSpec decreases; public Expr body; public Stmt byMethod; public List<Attr> attributes;
  }
  @JsonTypeName("Method")
  public static final class Method implements Member {
    public String methodKind; public String name; @JsonProperty("static") public boolean isStatic; public boolean ghost;
    public List<TypeParam> typeParams; public List<Var> ins; public List<Var> outs; public List<Clause> requires;
    public FrameSpec reads; public FrameSpec modifies; public List<Clause> ensures; public ExprSpec decreases;
    public Stmt body; public List<Attr> attributes;
  }

  // ---------------------------------------------------------------------------------------------
  // 变量、类型参数、规格

  /** 形参、约束变量与局部变量共用的声明节点。 */
  public static final class Var {
    public String id; public String name; public Type type; public Type resolvedType; public boolean ghost;
    @JsonProperty("default") public Expr defaultValue; public List<Attr> attributes;
    public boolean old; public boolean nameOnly; public boolean older; public String compileName;
  }

  public static final class TypeParam { public String name; public String variance; public Characteristics characteristics; }
  public static final class Characteristics { public String equality; public String autoInit; public boolean noReferences; }

  public static final class Attr { public String name; public List<Expr> args; }
  public static final class Clause { public Expr expr; public String label; public List<Attr> attributes; public boolean injected; }
  public static final class Frame { public Expr expr; public String field; }
  public static final class FrameSpec { public List<Frame> exprs; public List<Attr> attributes; }
  public static final class ExprSpec { public List<Expr> exprs; public List<Attr> attributes; }

  // ---------------------------------------------------------------------------------------------
  // 类型

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = BasicT.class, name = "Basic"),
    @JsonSubTypes.Type(value = SetT.class, name = "Set"),
    @JsonSubTypes.Type(value = SeqT.class, name = "Seq"),
    @JsonSubTypes.Type(value = MultiSetT.class, name = "MultiSet"),
    @JsonSubTypes.Type(value = MapT.class, name = "Map"),
    @JsonSubTypes.Type(value = ArrowT.class, name = "Arrow"),
    @JsonSubTypes.Type(value = UserDefinedT.class, name = "UserDefined"),
    @JsonSubTypes.Type(value = InferredT.class, name = "Inferred"),
    @JsonSubTypes.Type(value = TypeParamT.class, name = "TypeParam"),
    @JsonSubTypes.Type(value = RefinementT.class, name = "Refinement")
  })
  public sealed interface Type permits BasicT, SetT, SeqT, MultiSetT, MapT, ArrowT, UserDefinedT, InferredT, TypeParamT,
      RefinementT {}
  @JsonTypeName("Basic") public static final class BasicT implements Type { public String name; }
  @JsonTypeName("Set") public static final class SetT implements Type { public boolean finite = true; public Type arg; }
  @JsonTypeName("Seq") public static final class SeqT implements Type { public Type arg; }
  @JsonTypeName("MultiSet") public static final class MultiSetT implements Type { public Type arg; }
  @JsonTypeName("Map") public static final class MapT implements Type { public boolean finite = true; public Type domain; public Type range; }
  @JsonTypeName("Arrow") public static final class ArrowT implements Type { public List<Type> args; public Type result; }
  // 无类型实参时名字可能指向作用域中的类型参数，由 loader 解析
  @JsonTypeName("UserDefined") public static final class UserDefinedT implements Type { public String name; public List<Type> typeArgs; }
  @JsonTypeName("Inferred") public static final class InferredT implements Type { public Type resolved; }
  @JsonTypeName("TypeParam") public static final class TypeParamT implements Type { public String name; }
  @JsonTypeName("Refinement") public static final class RefinementT implements Type { public Type inner; }

  // ---------------------------------------------------------------------------------------------
  // 语句

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = DividedBlock.class, name = "DividedBlock"),
    @JsonSubTypes.Type(value = Assert.class, name = "Assert"),
    @JsonSubTypes.Type(value = Assume.class, name = "Assume"),
    @JsonSubTypes.Type(value = Expect.class, name = "Expect"),
    @JsonSubTypes.Type(value = Print.class, name = "Print"),
    @JsonSubTypes.Type(value = Return.class, name = "Return"),
    @JsonSubTypes.Type(value = Break.class, name = "Break"),
    @JsonSubTypes.Type(value = VarDecl.class, name = "VarDecl"),
    @JsonSubTypes.Type(value = Update.class, name = "Update"),
    @JsonSubTypes.Type(value = Assign.class, name = "Assign"),
    @JsonSubTypes.Type(value = CallStmt.class, name = "Call"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = While.class, name = "While"),
    @JsonSubTypes.Type(value = MatchStmt.class, name = "Match"),
    @JsonSubTypes.Type(value = Forall.class, name = "Forall"),
    @JsonSubTypes.Type(value = Reveal.class, name = "Reveal"),
    @JsonSubTypes.Type(value = Modify.class, name = "Modify")
  })
  public abstract static sealed class Stmt permits Block, DividedBlock, Assert, Assume, Expect, Print, Return, Break,
      VarDecl, Update, Assign, CallStmt, If, While, MatchStmt, Forall, Reveal, Modify {
    public String id; public List<String> labels; public List<Attr> attributes; public boolean ghost;
  }
  @JsonTypeName("Block") public static final class Block extends Stmt { public List<Stmt> body; }
  @JsonTypeName("DividedBlock") public static final class DividedBlock extends Stmt { public List<Stmt> init; public List<Stmt> proper; }
  @JsonTypeName("Assert") public static final class Assert extends Stmt { public Expr expr; public String label; public Stmt proof; }
  @JsonTypeName("Assume") public static final class Assume extends Stmt { public Expr expr; }
  @JsonTypeName("Expect") public static final class Expect extends Stmt { public Expr expr; public Expr message; }
  @JsonTypeName("Print") public static final class Print extends Stmt { public List<Expr> args; }
  @JsonTypeName("Return") public static final class Return extends Stmt { public List<Rhs> rhss; }
  @JsonTypeName("Break")
  public static final class Break extends Stmt {
    public String label; public int count = 1; @JsonProperty("continue") public boolean isContinue; public String target;
  }
  @JsonTypeName("VarDecl") public static final class VarDecl extends Stmt { public List<Var> locals; public List<Rhs> rhss; }
  @JsonTypeName("Update") public static final class Update extends Stmt { public List<Expr> lhss; public List<Rhs> rhss; }
  @JsonTypeName("Assign") public static final class Assign extends Stmt { public Expr lhs; public Rhs rhs; }
  @JsonTypeName("Call")
  public static final class CallStmt extends Stmt { public List<Expr> lhss; public Expr receiver; public String method; public List<Expr> args; }
  @JsonTypeName("If")
  public static final class If extends Stmt { public Expr guard; @JsonProperty("then") public Stmt thenStmt; @JsonProperty("else") public Stmt elseStmt; }
  @JsonTypeName("While")
  public static final class While extends Stmt {
    public Expr guard; public List<Clause> invariants; public ExprSpec decreases; public FrameSpec modifies; public Stmt body;
  }
  @JsonTypeName("Match") public static final class MatchStmt extends Stmt { public Expr source; public List<StmtCase> cases; }
  public static final class StmtCase { public Pattern pattern; public List<Stmt> body; public List<Attr> attributes; }
  @JsonTypeName("Forall")
  public static final class Forall extends Stmt { public List<Var> vars; public Expr range; public List<Clause> ensures; public Stmt body; }
  @JsonTypeName("Reveal") public static final class Reveal extends Stmt { public List<Expr> exprs; }
  @JsonTypeName("Modify") public static final class Modify extends Stmt { public FrameSpec modifies; public Stmt body; }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Havoc.class, name = "Havoc"),
    @JsonSubTypes.Type(value = New.class, name = "New"),
    @JsonSubTypes.Type(value = ExprRhs.class, name = "ExprRhs")
  })
  public sealed interface Rhs permits Havoc, New, ExprRhs {}
  @JsonTypeName("Havoc") public static final class Havoc implements Rhs {}
  @JsonTypeName("New") public static final class New implements Rhs { public Type type; public List<Expr> dims; public String ctor; public List<Expr> args; }
  @JsonTypeName("ExprRhs") public static final class ExprRhs implements Rhs { public Expr expr; public List<Attr> attributes; }

  // ---------------------------------------------------------------------------------------------
  // 表达式

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = Ident.class, name = "Ident"),
    @JsonSubTypes.Type(value = This.class, name = "This"),
    @JsonSubTypes.Type(value = StaticReceiver.class, name = "StaticReceiver"),
    @JsonSubTypes.Type(value = DotName.class, name = "DotName"),
    @JsonSubTypes.Type(value = CallExpr.class, name = "Call"),
    @JsonSubTypes.Type(value = Unary.class, name = "Unary"),
    @JsonSubTypes.Type(value = Binary.class, name = "Binary"),
    @JsonSubTypes.Type(value = Ite.class, name = "Ite"),
    @JsonSubTypes.Type(value = Old.class, name = "Old"),
    @JsonSubTypes.Type(value = SeqDisplay.class, name = "SeqDisplay"),
    @JsonSubTypes.Type(value = SetDisplay.class, name = "SetDisplay"),
    @JsonSubTypes.Type(value = MapDisplay.class, name = "MapDisplay"),
    @JsonSubTypes.Type(value = SeqSelect.class, name = "SeqSelect"),
    @JsonSubTypes.Type(value = Quantifier.class, name = "Quantifier"),
    @JsonSubTypes.Type(value = Lambda.class, name = "Lambda"),
    @JsonSubTypes.Type(value = Let.class, name = "Let"),
    @JsonSubTypes.Type(value = MatchExpr.class, name = "Match"),
    @JsonSubTypes.Type(value = Parens.class, name = "Parens"),
    @JsonSubTypes.Type(value = DatatypeValue.class, name = "DatatypeValue")
  })
  public sealed interface Expr permits Literal, Ident, This, StaticReceiver, DotName, CallExpr, Unary, Binary, Ite, Old,
      SeqDisplay, SetDisplay, MapDisplay, SeqSelect, Quantifier, Lambda, Let, MatchExpr, Parens, DatatypeValue {}
  // value 按 JSON 自然类型绑定：布尔、整数（BigInteger）、小数（BigDecimal）、字符串或 null
  @JsonTypeName("Literal") public static final class Literal implements Expr { public Object value; @JsonProperty("char") public String ch; public Type type; }
  @JsonTypeName("Ident") public static final class Ident implements Expr { public String name; public String var; public Type type; }
  @JsonTypeName("This") public static final class This implements Expr { public Type type; public boolean implicit; }
  @JsonTypeName("StaticReceiver") public static final class StaticReceiver implements Expr { public Type type; }
  @JsonTypeName("DotName") public static final class DotName implements Expr { public Expr obj; public String suffix; public List<Type> typeArgs; }
  @JsonTypeName("Call") public static final class CallExpr implements Expr { public Expr receiver; public String name; public List<Expr> args; public String at; }
  @JsonTypeName("Unary") public static final class Unary implements Expr { public String op; public Expr operand; }
  @JsonTypeName("Binary") public static final class Binary implements Expr { public String op; public Expr left; public Expr right; }
  @JsonTypeName("Ite")
  public static final class Ite implements Expr { public Expr test; @JsonProperty("then") public Expr thenExpr; @JsonProperty("else") public Expr elseExpr; }
  @JsonTypeName("Old") public static final class Old implements Expr { public Expr expr; public String at; }
  @JsonTypeName("SeqDisplay") public static final class SeqDisplay implements Expr { public List<Expr> elements; }
  @JsonTypeName("SetDisplay") public static final class SetDisplay implements Expr { public boolean finite = true; public List<Expr> elements; }
  @JsonTypeName("MapDisplay") public static final class MapDisplay implements Expr { public boolean finite = true; public List<MapEntry> entries; }
  public static final class MapEntry { public Expr key; public Expr value; }
  @JsonTypeName("SeqSelect") public static final class SeqSelect implements Expr { public boolean selectOne; public Expr seq; public Expr lo; public Expr hi; }
  @JsonTypeName("Quantifier")
  public static final class Quantifier implements Expr {
    public boolean universal = true; public List<Var> vars; public Expr range; public Expr term; public List<Attr> attributes;
  }
  @JsonTypeName("Lambda") public static final class Lambda implements Expr { public List<Var> vars; public Expr range; public FrameSpec reads; public Expr body; }
  @JsonTypeName("Let") public static final class Let implements Expr { public List<Var> vars; public List<Expr> rhss; public Expr body; }
  @JsonTypeName("Match") public static final class MatchExpr implements Expr { public Expr source; public List<ExprCase> cases; }
  public static final class ExprCase { public Pattern pattern; public Expr body; public List<Attr> attributes; }
  @JsonTypeName("Parens") public static final class Parens implements Expr { public Expr inner; }
  @JsonTypeName("DatatypeValue") public static final class DatatypeValue implements Expr { public String datatype; public String ctor; public List<Expr> args; }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = LitPattern.class, name = "LitPattern"),
    @JsonSubTypes.Type(value = IdPattern.class, name = "IdPattern"),
    @JsonSubTypes.Type(value = DisjunctivePattern.class, name = "DisjunctivePattern")
  })
  public sealed interface Pattern permits LitPattern, IdPattern, DisjunctivePattern {}
  @JsonTypeName("LitPattern") public static final class LitPattern implements Pattern { public Expr lit; }
  @JsonTypeName("IdPattern") public static final class IdPattern implements Pattern { public String id; public Var var; public List<Pattern> arguments; public boolean ghost; }
  @JsonTypeName("DisjunctivePattern") public static final class DisjunctivePattern implements Pattern { public List<Pattern> alternatives; public boolean ghost; }
}
