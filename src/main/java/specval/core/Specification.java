package specval.core;

import java.util.ArrayList;
import java.util.List;

/** 带属性的规格子句列表（reads / modifies / decreases）。 */
public record Specification<T>(List<T> expressions, List<Attribute> attributes) {
  public Specification {
    expressions = expressions == null ? List.of() : List.copyOf(expressions);
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public static <T> Specification<T> empty() {
    return new Specification<>(List.of(), List.of());
  }

  public boolean isEmpty() {
    return expressions.isEmpty();
  }

  public Specification<T> prepend(T first) {
    List<T> all = new ArrayList<>(expressions.size() + 1);
    all.add(first);
    all.addAll(expressions);
    return new Specification<>(all, attributes);
  }
}
