package specval.validator;

import java.util.ArrayList;
import java.util.List;

import specval.core.Type;
import specval.core.Variable;

/**
 * 变换递归中向下传递的上下文。不可变：进入模块、类或成员时产生新的实例。
 *
 * @param modulePath 从引用根开始、到当前模块为止的路径，例如 {@code [Gen, A, B]}
 * @param classContext 当前所在的类或 trait，模块级成员为 null
 * @param witness 当前成员的有效性见证形参，尚未进入成员或成员不需要见证时为 null
 */
public record ValidatorContext(List<String> modulePath, ClassContext classContext, Variable.Formal witness) {

  public ValidatorContext {
    modulePath = List.copyOf(modulePath);
  }

  public static ValidatorContext root() {
    return new ValidatorContext(List.of(ValidatorNames.REFERENCE_ROOT), null, null);
  }

  public ValidatorContext enterModule(String name) {
    List<String> path = new ArrayList<>(modulePath);
    path.add(name);
    return new ValidatorContext(path, null, null);
  }

  public ValidatorContext enterClass(ClassContext cls) {
    return new ValidatorContext(modulePath, cls, null);
  }

  public ValidatorContext withWitness(Variable.Formal formal) {
    return new ValidatorContext(modulePath, classContext, formal);
  }

  public boolean inClass() {
    return classContext != null;
  }

  /**
   * 类上下文。
   *
   * @param className 原类名（未加后缀）
   * @param typeArgs 指向类自身（克隆后）类型参数的开放类型引用
   * @param autoContracts 类是否带 {@code {:autocontracts}}
   */
  public record ClassContext(String className, List<Type> typeArgs, boolean autoContracts) {
    public ClassContext {
      typeArgs = List.copyOf(typeArgs);
    }

    /** 见证形参的类型：原类在其自身类型参数上的实例化。 */
    public Type witnessType() {
      return new Type.UserDefinedType(className, typeArgs);
    }
  }
}
