package specval.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * 带缩进的输出树。
 *
 * <p>{@link #fork()} 在当前位置留出一个子树，之后仍可往里写；{@link #newBlock(String)} 写出
 * {@code header {} 并返回缩进一级的块体，右花括号在块体之后自动补上。渲染时才计算缩进。</p>
 */
public final class ConcreteSyntaxTree {
  static final int INDENT = 2;

  private final List<Object> nodes = new ArrayList<>();
  private final int relativeIndent;

  public ConcreteSyntaxTree() {
    this(0);
  }

  private ConcreteSyntaxTree(int relativeIndent) {
    this.relativeIndent = relativeIndent;
  }

  public ConcreteSyntaxTree write(String text) {
    nodes.add(text);
    return this;
  }

  public ConcreteSyntaxTree writeLine(String text) {
    nodes.add(text);
    nodes.add("\n");
    return this;
  }

  /** 在当前位置插入同一缩进层级的子树。 */
  public ConcreteSyntaxTree fork() {
    var child = new ConcreteSyntaxTree(0);
    nodes.add(child);
    return child;
  }

  public ConcreteSyntaxTree newBlock(String header) {
    writeLine(header.isEmpty() ? "{" : header + " {");
    var body = new ConcreteSyntaxTree(1);
    nodes.add(body);
    writeLine("}");
    return body;
  }

  public boolean isEmpty() {
    for (Object n : nodes) {
      if (n instanceof String s && !s.isEmpty()) return false;
      if (n instanceof ConcreteSyntaxTree t && !t.isEmpty()) return false;
    }
    return true;
  }

  @Override
  public String toString() {
    var sb = new StringBuilder();
    render(sb, 0, new boolean[] {true});
    return sb.toString();
  }

  private void render(StringBuilder sb, int outerIndent, boolean[] atLineStart) {
    int indent = outerIndent + relativeIndent * INDENT;
    for (Object n : nodes) {
      if (n instanceof ConcreteSyntaxTree child) {
        child.render(sb, indent, atLineStart);
        continue;
      }
      for (char c : ((String) n).toCharArray()) {
        if (c == '\n') {
          sb.append('\n');
          atLineStart[0] = true;
          continue;
        }
        if (atLineStart[0]) {
          sb.append(" ".repeat(indent));
          atLineStart[0] = false;
        }
        sb.append(c);
      }
    }
  }
}
