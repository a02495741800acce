package specval.core;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * 模块中的顶层声明。
 *
 * <p>不是所有声明都有成员或父 trait，默认实现返回空列表。</p>
 */
public sealed interface Decl {
  String name();

  default List<Member> members() {
    return List.of();
  }

  default List<Type> parentTraits() {
    return List.of();
  }

  default List<Attribute> attributes() {
    return List.of();
  }

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitAbstractType(AbstractType d, C ctx);
    R visitSubsetType(SubsetType d, C ctx);
    R visitTypeSynonym(TypeSynonym d, C ctx);
    R visitNewtype(Newtype d, C ctx);
    R visitDatatype(Datatype d, C ctx);
    R visitTupleType(TupleType d, C ctx);
    R visitIterator(Iterator d, C ctx);
    R visitTrait(Trait d, C ctx);
    R visitClassDecl(ClassDecl d, C ctx);
    R visitDefaultClass(DefaultClass d, C ctx);
    R visitLiteralModule(LiteralModule d, C ctx);
    R visitAliasModule(AliasModule d, C ctx);
    R visitAbstractModule(AbstractModule d, C ctx);
    R visitModuleExport(ModuleExport d, C ctx);
  }

  /** {@code type T(==)<A> extends Tr { members }}：不透明类型。 */
  record AbstractType(String name, List<TypeParameter> typeArgs, TypeParameter.Characteristics characteristics,
                      List<Type> parentTraits, List<Member> members, List<Attribute> attributes) implements Decl {
    public AbstractType {
      Objects.requireNonNull(name, "name");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      characteristics = characteristics == null ? TypeParameter.Characteristics.DEFAULT : characteristics;
      parentTraits = parentTraits == null ? List.of() : List.copyOf(parentTraits);
      members = members == null ? List.of() : List.copyOf(members);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitAbstractType(this, ctx); }
  }

  /** {@code type T = x: Base | constraint witness w}。 */
  record SubsetType(String name, List<TypeParameter> typeArgs, TypeParameter.Characteristics characteristics,
                    Variable.BoundVar var, Expr constraint, WitnessKind witnessKind, Expr witness,
                    List<Attribute> attributes) implements Decl {
    public SubsetType {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(var, "var");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      characteristics = characteristics == null ? TypeParameter.Characteristics.DEFAULT : characteristics;
      witnessKind = witnessKind == null ? WitnessKind.NONE : witnessKind;
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitSubsetType(this, ctx); }
  }

  record TypeSynonym(String name, List<TypeParameter> typeArgs, TypeParameter.Characteristics characteristics,
                     Type rhs, List<Attribute> attributes) implements Decl {
    public TypeSynonym {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(rhs, "rhs");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      characteristics = characteristics == null ? TypeParameter.Characteristics.DEFAULT : characteristics;
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitTypeSynonym(this, ctx); }
  }

  /** {@code newtype N = x: Base | constraint}；{@code var} 为 null 时是无约束形式 {@code newtype N = Base}。 */
  record Newtype(String name, Type baseType, Variable.BoundVar var, Expr constraint, WitnessKind witnessKind,
                 Expr witness, List<Type> parentTraits, List<Member> members, List<Attribute> attributes)
      implements Decl {
    public Newtype {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(baseType, "baseType");
      witnessKind = witnessKind == null ? WitnessKind.NONE : witnessKind;
      parentTraits = parentTraits == null ? List.of() : List.copyOf(parentTraits);
      members = members == null ? List.of() : List.copyOf(members);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitNewtype(this, ctx); }
  }

  /** 归纳（{@code coinductive=false}）或余归纳 datatype。 */
  record Datatype(String name, boolean coinductive, List<TypeParameter> typeArgs, List<DatatypeCtor> ctors,
                  List<Type> parentTraits, List<Member> members, List<Attribute> attributes) implements Decl {
    public Datatype {
      Objects.requireNonNull(name, "name");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      ctors = List.copyOf(ctors);
      parentTraits = parentTraits == null ? List.of() : List.copyOf(parentTraits);
      members = members == null ? List.of() : List.copyOf(members);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitDatatype(this, ctx); }
  }

  /** 元组类型，只存在于系统模块中。 */
  record TupleType(int arity) implements Decl {
    @Override
    public String name() {
      return "_tuple#" + arity;
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitTupleType(this, ctx); }
  }

  record Iterator(String name, List<TypeParameter> typeArgs, List<Variable.Formal> ins, List<Variable.Formal> outs,
                  Specification<FrameExpr> reads, Specification<FrameExpr> mod, Specification<Expr> decreases,
                  List<AttributedExpr> req, List<AttributedExpr> ens, List<AttributedExpr> yieldReq,
                  List<AttributedExpr> yieldEns, Stmt.Block body, List<Attribute> attributes) implements Decl {
    public Iterator {
      Objects.requireNonNull(name, "name");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      ins = ins == null ? List.of() : List.copyOf(ins);
      outs = outs == null ? List.of() : List.copyOf(outs);
      reads = reads == null ? Specification.empty() : reads;
      mod = mod == null ? Specification.empty() : mod;
      decreases = decreases == null ? Specification.empty() : decreases;
      req = req == null ? List.of() : List.copyOf(req);
      ens = ens == null ? List.of() : List.copyOf(ens);
      yieldReq = yieldReq == null ? List.of() : List.copyOf(yieldReq);
      yieldEns = yieldEns == null ? List.of() : List.copyOf(yieldEns);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitIterator(this, ctx); }
  }

  record Trait(String name, List<TypeParameter> typeArgs, List<Type> parentTraits, List<Member> members,
               List<Attribute> attributes) implements Decl {
    public Trait {
      Objects.requireNonNull(name, "name");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      parentTraits = parentTraits == null ? List.of() : List.copyOf(parentTraits);
      members = members == null ? List.of() : List.copyOf(members);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitTrait(this, ctx); }
  }

  record ClassDecl(String name, List<TypeParameter> typeArgs, List<Type> parentTraits, List<Member> members,
                   List<Attribute> attributes) implements Decl {
    public ClassDecl {
      Objects.requireNonNull(name, "name");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      parentTraits = parentTraits == null ? List.of() : List.copyOf(parentTraits);
      members = members == null ? List.of() : List.copyOf(members);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitClassDecl(this, ctx); }
  }

  /** 模块级成员（顶层方法、函数、常量）的隐式宿主。 */
  record DefaultClass(List<Member> members) implements Decl {
    public static final String NAME = "_default";

    public DefaultClass { members = members == null ? List.of() : List.copyOf(members); }

    @Override
    public String name() {
      return NAME;
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitDefaultClass(this, ctx); }
  }

  /** 源码中直接写出的嵌套模块；{@code cloneId} 区分同一模块的多个克隆。 */
  record LiteralModule(ModuleDefinition def, UUID cloneId) implements Decl {
    public LiteralModule { Objects.requireNonNull(def, "def"); }

    @Override
    public String name() {
      return def.name();
    }

    @Override
    public List<Attribute> attributes() {
      return def.attributes();
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitLiteralModule(this, ctx); }
  }

  /** {@code import opened Name = A.B`{exports}}；{@code signature} 由解析器填写。 */
  record AliasModule(String name, List<String> targetPath, boolean opened, List<String> exports,
                     ModuleSignature signature, UUID cloneId) implements Decl {
    public AliasModule {
      Objects.requireNonNull(name, "name");
      targetPath = List.copyOf(targetPath);
      exports = exports == null ? List.of() : List.copyOf(exports);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitAliasModule(this, ctx); }
  }

  /** {@code import Name : A.B}：抽象模块导入。 */
  record AbstractModule(String name, List<String> path, boolean opened, List<String> exports,
                        ModuleSignature signature, UUID cloneId) implements Decl {
    public AbstractModule {
      Objects.requireNonNull(name, "name");
      path = List.copyOf(path);
      exports = exports == null ? List.of() : List.copyOf(exports);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitAbstractModule(this, ctx); }
  }

  /** {@code export Name extends E provides a reveals b}。 */
  record ModuleExport(String name, List<String> provides, List<String> reveals, List<String> extendsNames,
                      boolean provideAll, boolean revealAll, boolean isDefault) implements Decl {
    public ModuleExport {
      Objects.requireNonNull(name, "name");
      provides = provides == null ? List.of() : List.copyOf(provides);
      reveals = reveals == null ? List.of() : List.copyOf(reveals);
      extendsNames = extendsNames == null ? List.of() : List.copyOf(extendsNames);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitModuleExport(this, ctx); }
  }
}
