package specval.core;

import java.util.List;
import java.util.Objects;

public record DatatypeCtor(String name, boolean ghost, List<Variable.Formal> formals, List<Attribute> attributes) {
  public DatatypeCtor {
    Objects.requireNonNull(name, "name");
    formals = formals == null ? List.of() : List.copyOf(formals);
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }
}
