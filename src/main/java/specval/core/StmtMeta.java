package specval.core;

import java.util.List;

/**
 * 所有语句共有的元数据：稳定句柄 {@code id}（break 目标通过它引用外层语句）、标签、属性与 ghost 标记。
 */
public record StmtMeta(String id, List<Label> labels, List<Attribute> attributes, boolean ghost) {
  public static final StmtMeta NONE = new StmtMeta(null, List.of(), List.of(), false);
  public static final StmtMeta GHOST = new StmtMeta(null, List.of(), List.of(), true);

  public StmtMeta {
    labels = labels == null ? List.of() : List.copyOf(labels);
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
  }

  public static StmtMeta of(boolean ghost) {
    return ghost ? GHOST : NONE;
  }

  /** 语句标签；name 为 null 表示解析阶段生成的隐式 break 目标。 */
  public record Label(String name) {}
}
