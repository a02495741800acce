package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * 类 / trait / 默认类中的成员。
 */
public sealed interface Member {
  String name();

  boolean ghost();

  boolean isStatic();

  List<Attribute> attributes();

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitField(Field f, C ctx);
    R visitConstantField(ConstantField f, C ctx);
    R visitSpecialField(SpecialField f, C ctx);
    R visitFunction(Function f, C ctx);
    R visitMethod(Method m, C ctx);
  }

  record Field(String name, boolean isStatic, boolean ghost, boolean mutable, boolean userMutable, Type type,
               List<Attribute> attributes) implements Member {
    public Field {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitField(this, ctx); }
  }

  /** {@code const x: T := rhs}；{@code rhs} 可为 null。 */
  record ConstantField(String name, Expr rhs, boolean isStatic, boolean ghost, boolean opaque, Type type,
                       List<Attribute> attributes) implements Member {
    public ConstantField {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitConstantField(this, ctx); }
  }

  /** 解析器合成的字段（datatype 判别器、数组长度等），以 {@code specialId} 区分。 */
  record SpecialField(String name, String specialId, boolean ghost, boolean mutable, boolean userMutable, Type type,
                      List<Attribute> attributes) implements Member {
    public SpecialField {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override
    public boolean isStatic() {
      return false;
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitSpecialField(this, ctx); }
  }

  /**
   * 函数 / 谓词家族。{@code result} 为具名结果形参（可为 null），{@code body} 可为 null（无体声明）。
   */
  record Function(FunctionKind kind, String name, boolean isStatic, boolean ghost, boolean opaque,
                  List<TypeParameter> typeArgs, List<Variable.Formal> ins, Variable.Formal result, Type resultType,
                  List<AttributedExpr> req, Specification<FrameExpr> reads, List<AttributedExpr> ens,
                  Specification<Expr> decreases, Expr body, Stmt.Block byMethodBody,
                  List<Attribute> attributes) implements Member {
    public Function {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(resultType, "resultType");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      ins = ins == null ? List.of() : List.copyOf(ins);
      req = req == null ? List.of() : List.copyOf(req);
      reads = reads == null ? Specification.empty() : reads;
      ens = ens == null ? List.of() : List.copyOf(ens);
      decreases = decreases == null ? Specification.empty() : decreases;
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitFunction(this, ctx); }
  }

  /** 方法家族；{@code body} 为 Block、DividedBlock（构造器）或 null。 */
  record Method(MethodKind kind, String name, boolean isStatic, boolean ghost, List<TypeParameter> typeArgs,
                List<Variable.Formal> ins, List<Variable.Formal> outs, List<AttributedExpr> req,
                Specification<FrameExpr> reads, Specification<FrameExpr> mod, List<AttributedExpr> ens,
                Specification<Expr> decreases, Stmt body, List<Attribute> attributes) implements Member {
    public Method {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(name, "name");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
      ins = ins == null ? List.of() : List.copyOf(ins);
      outs = outs == null ? List.of() : List.copyOf(outs);
      req = req == null ? List.of() : List.copyOf(req);
      reads = reads == null ? Specification.empty() : reads;
      mod = mod == null ? Specification.empty() : mod;
      ens = ens == null ? List.of() : List.copyOf(ens);
      decreases = decreases == null ? Specification.empty() : decreases;
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitMethod(this, ctx); }
  }
}
