package specval.core;

import java.util.List;
import java.util.Objects;

/**
 * 语句语法树。每个语句以 {@link StmtMeta} 开头，ghost 标记也在其中。
 *
 * <p>break 语句不持有目标语句对象，而是持有目标的 {@link StmtMeta#id()} 句柄；
 * 不可变树无法表达环形引用。</p>
 */
public sealed interface Stmt {

  StmtMeta meta();

  default boolean ghost() {
    return meta().ghost();
  }

  <R, C> R accept(Visitor<R, C> visitor, C ctx);

  interface Visitor<R, C> {
    R visitBlockStmt(Block s, C ctx);
    R visitDividedBlockStmt(DividedBlock s, C ctx);
    R visitAssertStmt(Assert s, C ctx);
    R visitAssumeStmt(Assume s, C ctx);
    R visitExpectStmt(Expect s, C ctx);
    R visitPrintStmt(Print s, C ctx);
    R visitReturnStmt(Return s, C ctx);
    R visitBreakStmt(Break s, C ctx);
    R visitVarDeclStmt(VarDecl s, C ctx);
    R visitUpdateStmt(Update s, C ctx);
    R visitAssignStmt(Assign s, C ctx);
    R visitCallStmt(Call s, C ctx);
    R visitIfStmt(If s, C ctx);
    R visitWhileStmt(While s, C ctx);
    R visitMatchStmt(Match s, C ctx);
    R visitForallStmt(Forall s, C ctx);
    R visitRevealStmt(Reveal s, C ctx);
    R visitModifyStmt(Modify s, C ctx);
  }

  record Block(StmtMeta meta, List<Stmt> body) implements Stmt {
    public Block {
      Objects.requireNonNull(meta, "meta");
      body = List.copyOf(body);
    }

    public static Block of(List<Stmt> body) {
      return new Block(StmtMeta.NONE, body);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitBlockStmt(this, ctx); }
  }

  /** 构造器体：{@code new;} 之前为初始化段，之后为常规段。 */
  record DividedBlock(StmtMeta meta, List<Stmt> init, List<Stmt> proper) implements Stmt {
    public DividedBlock {
      Objects.requireNonNull(meta, "meta");
      init = List.copyOf(init);
      proper = List.copyOf(proper);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitDividedBlockStmt(this, ctx); }
  }

  /** 断言；{@code proof} 为可选的 {@code by { ... }} 证明块。 */
  record Assert(StmtMeta meta, Expr expr, String label, Block proof) implements Stmt {
    public Assert {
      Objects.requireNonNull(meta, "meta");
      Objects.requireNonNull(expr, "expr");
    }

    public static Assert ghost(Expr expr) {
      return new Assert(StmtMeta.GHOST, expr, null, null);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitAssertStmt(this, ctx); }
  }

  record Assume(StmtMeta meta, Expr expr) implements Stmt {
    public Assume {
      Objects.requireNonNull(meta, "meta");
      Objects.requireNonNull(expr, "expr");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitAssumeStmt(this, ctx); }
  }

  /** 运行时检查；{@code message} 可为 null。 */
  record Expect(StmtMeta meta, Expr expr, Expr message) implements Stmt {
    public Expect {
      Objects.requireNonNull(meta, "meta");
      Objects.requireNonNull(expr, "expr");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitExpectStmt(this, ctx); }
  }

  record Print(StmtMeta meta, List<Expr> args) implements Stmt {
    public Print {
      Objects.requireNonNull(meta, "meta");
      args = List.copyOf(args);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitPrintStmt(this, ctx); }
  }

  record Return(StmtMeta meta, List<Rhs> rhss) implements Stmt {
    public Return {
      Objects.requireNonNull(meta, "meta");
      rhss = rhss == null ? List.of() : List.copyOf(rhss);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitReturnStmt(this, ctx); }
  }

  /**
   * break / continue。{@code targetLabel} 为源码中的标签（可为 null），
   * {@code targetId} 为解析后目标语句的句柄，只在已解析的树中存在。
   */
  record Break(StmtMeta meta, String targetLabel, int breakCount, boolean isContinue, String targetId)
      implements Stmt {
    public Break { Objects.requireNonNull(meta, "meta"); }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitBreakStmt(this, ctx); }
  }

  /** {@code var x, y := ...;}，{@code update} 可为 null。 */
  record VarDecl(StmtMeta meta, List<Variable.LocalVariable> locals, Update update) implements Stmt {
    public VarDecl {
      Objects.requireNonNull(meta, "meta");
      locals = List.copyOf(locals);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitVarDeclStmt(this, ctx); }
  }

  /**
   * {@code lhs1, lhs2 := rhs1, rhs2;}。左侧为空时是一个独立的调用语句，
   * 例如 {@code m(x);}。
   */
  record Update(StmtMeta meta, List<Expr> lhss, List<Rhs> rhss) implements Stmt {
    public Update {
      Objects.requireNonNull(meta, "meta");
      lhss = List.copyOf(lhss);
      rhss = List.copyOf(rhss);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitUpdateStmt(this, ctx); }
  }

  /** 解析后的单个赋值。 */
  record Assign(StmtMeta meta, Expr lhs, Rhs rhs) implements Stmt {
    public Assign {
      Objects.requireNonNull(meta, "meta");
      Objects.requireNonNull(lhs, "lhs");
      Objects.requireNonNull(rhs, "rhs");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitAssignStmt(this, ctx); }
  }

  /** 解析后的方法调用；{@code receiver} 为 null 时调用同一作用域内的方法。 */
  record Call(StmtMeta meta, List<Expr> lhss, Expr receiver, String methodName, List<Expr> args) implements Stmt {
    public Call {
      Objects.requireNonNull(meta, "meta");
      Objects.requireNonNull(methodName, "methodName");
      lhss = List.copyOf(lhss);
      args = List.copyOf(args);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitCallStmt(this, ctx); }
  }

  /** {@code guard} 为 null 表示 {@code if *}；{@code els} 为 null、Block 或嵌套 If。 */
  record If(StmtMeta meta, Expr guard, Block thn, Stmt els) implements Stmt {
    public If {
      Objects.requireNonNull(meta, "meta");
      Objects.requireNonNull(thn, "thn");
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitIfStmt(this, ctx); }
  }

  record While(StmtMeta meta, Expr guard, List<AttributedExpr> invariants, Specification<Expr> decreases,
               Specification<FrameExpr> mod, Block body) implements Stmt {
    public While {
      Objects.requireNonNull(meta, "meta");
      invariants = invariants == null ? List.of() : List.copyOf(invariants);
      decreases = decreases == null ? Specification.empty() : decreases;
      mod = mod == null ? Specification.empty() : mod;
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitWhileStmt(this, ctx); }
  }

  record MatchCase(Pattern pattern, List<Stmt> body, List<Attribute> attributes) {
    public MatchCase {
      Objects.requireNonNull(pattern, "pattern");
      body = List.copyOf(body);
      attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
  }

  record Match(StmtMeta meta, Expr source, List<MatchCase> cases) implements Stmt {
    public Match {
      Objects.requireNonNull(meta, "meta");
      Objects.requireNonNull(source, "source");
      cases = List.copyOf(cases);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitMatchStmt(this, ctx); }
  }

  record Forall(StmtMeta meta, List<Variable.BoundVar> vars, Expr range, List<AttributedExpr> ens, Stmt body)
      implements Stmt {
    public Forall {
      Objects.requireNonNull(meta, "meta");
      vars = List.copyOf(vars);
      ens = ens == null ? List.of() : List.copyOf(ens);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitForallStmt(this, ctx); }
  }

  record Reveal(StmtMeta meta, List<Expr> exprs) implements Stmt {
    public Reveal {
      Objects.requireNonNull(meta, "meta");
      exprs = List.copyOf(exprs);
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitRevealStmt(this, ctx); }
  }

  /** {@code modify frame;} 或 {@code modify frame { body }}。 */
  record Modify(StmtMeta meta, Specification<FrameExpr> mod, Block body) implements Stmt {
    public Modify {
      Objects.requireNonNull(meta, "meta");
      mod = mod == null ? Specification.empty() : mod;
    }

    @Override public <R, C> R accept(Visitor<R, C> v, C ctx) { return v.visitModifyStmt(this, ctx); }
  }
}
