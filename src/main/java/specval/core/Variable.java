package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * 可被标识符引用的变量：形参、约束变量、局部变量。
 *
 * <p>记录类型按值比较；所有需要"同一个变量"语义的地方都用 {@link java.util.IdentityHashMap}。</p>
 */
public sealed interface Variable {
  String name();

  Type type();

  boolean ghost();

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitFormal(Formal f, C ctx);
    R visitBoundVar(BoundVar bv, C ctx);
    R visitLocalVariable(LocalVariable lv, C ctx);
  }

  record Formal(String name, Type type, boolean inParam, boolean ghost, Expr defaultValue,
                List<Attribute> attributes, boolean old, boolean nameOnly, boolean older,
                String nameForCompilation) implements Variable {
    public Formal {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static Formal in(String name, Type type) {
      return new Formal(name, type, true, false, null, List.of(), false, false, false, name);
    }

    public static Formal out(String name, Type type) {
      return new Formal(name, type, false, false, null, List.of(), false, false, false, name);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitFormal(this, ctx); }
  }

  record BoundVar(String name, Type type, boolean ghost) implements Variable {
    public BoundVar {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitBoundVar(this, ctx); }
  }

  /**
   * 局部变量。{@code syntacticType} 为源码中写出的类型（可能是 {@link Type.InferredType}），
   * {@code resolvedType} 是解析后的类型。
   */
  record LocalVariable(String name, Type syntacticType, boolean ghost, boolean typeExplicit,
                       Type resolvedType) implements Variable {
    public LocalVariable {
      Objects.requireNonNull(name, "name");
      syntacticType = syntacticType == null ? new Type.InferredType(null) : syntacticType;
    }

    @Override
    public Type type() {
      return resolvedType != null ? resolvedType : syntacticType;
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitLocalVariable(this, ctx); }
  }
}
