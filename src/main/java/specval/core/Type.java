package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * 类型语法树。
 */
public sealed interface Type {

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitBasicType(BasicType t, C ctx);
    R visitSetType(SetType t, C ctx);
    R visitSeqType(SeqType t, C ctx);
    R visitMultiSetType(MultiSetType t, C ctx);
    R visitMapType(MapType t, C ctx);
    R visitArrowType(ArrowType t, C ctx);
    R visitUserDefinedType(UserDefinedType t, C ctx);
    R visitInferredType(InferredType t, C ctx);
    R visitTypeParamRef(TypeParamRef t, C ctx);
    R visitRefinementWrapper(RefinementWrapper t, C ctx);
  }

  /** int、bool、real、char、string、nat、object 等内建类型。 */
  record BasicType(String name) implements Type {
    public static final BasicType INT = new BasicType("int");
    public static final BasicType BOOL = new BasicType("bool");
    public static final BasicType NAT = new BasicType("nat");
    public static final BasicType STRING = new BasicType("string");

    public BasicType { Objects.requireNonNull(name, "name"); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitBasicType(this, ctx); }
  }

  record SetType(boolean finite, Type arg) implements Type {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitSetType(this, ctx); }
  }

  record SeqType(Type arg) implements Type {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitSeqType(this, ctx); }
  }

  record MultiSetType(Type arg) implements Type {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitMultiSetType(this, ctx); }
  }

  record MapType(boolean finite, Type domain, Type range) implements Type {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitMapType(this, ctx); }
  }

  record ArrowType(List<Type> args, Type result) implements Type {
    public ArrowType {
      args = List.copyOf(args);
      Objects.requireNonNull(result, "result");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitArrowType(this, ctx); }
  }

  /** 具名类型引用：类、trait、datatype 或（未解析时的）类型参数名。 */
  record UserDefinedType(String name, List<Type> typeArgs) implements Type {
    public UserDefinedType {
      Objects.requireNonNull(name, "name");
      typeArgs = typeArgs == null ? List.of() : List.copyOf(typeArgs);
    }

    public static UserDefinedType of(String name) {
      return new UserDefinedType(name, List.of());
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitUserDefinedType(this, ctx); }
  }

  /** 待推断类型；{@code resolved} 为类型推断的结果，未解析时为 null。 */
  record InferredType(Type resolved) implements Type {
    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitInferredType(this, ctx); }
  }

  /** 指向某个类型参数对象的开放类型引用。 */
  record TypeParamRef(TypeParameter param) implements Type {
    public TypeParamRef { Objects.requireNonNull(param, "param"); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitTypeParamRef(this, ctx); }
  }

  /** 精化模块引入的包装，克隆时直接拆掉。 */
  record RefinementWrapper(Type inner) implements Type {
    public RefinementWrapper { Objects.requireNonNull(inner, "inner"); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitRefinementWrapper(this, ctx); }
  }
}
