package specval;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import specval.codegen.JavaCodeGenerator;
import specval.core.Decl;
import specval.core.Expr;
import specval.core.FunctionKind;
import specval.core.Member;
import specval.core.MethodKind;
import specval.core.Program;
import specval.core.Rhs;
import specval.core.Stmt;
import specval.core.Type;
import specval.runtime.ProgramFormatException;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramLoaderTest {

  private static Path fixture(String name) throws Exception {
    return Paths.get(ProgramLoaderTest.class.getResource("/programs/" + name).toURI());
  }

  @Test
  public void testLoadCounterFixture() throws Exception {
    Program program = new ProgramLoader().load(fixture("counter.json"));

    assertEquals("counter", program.name());
    assertEquals("counter.dfy", program.sourcePath());
    var cls = (Decl.ClassDecl) program.defaultModule().decls().get(0);
    assertEquals("Counter", cls.name());
    assertEquals(4, cls.members().size());
    var valid = (Member.Function) cls.members().get(1);
    assertEquals(FunctionKind.PREDICATE, valid.kind());
    assertEquals(Type.BasicType.BOOL, valid.resultType());
    assertTrue(valid.ghost());
  }

  @Test
  public void testReferencesShareTheDeclaredVariable() throws Exception {
    Program program = new ProgramLoader().load(fixture("counter.json"));

    var add = (Member.Method) program.defaultModule().decls().get(0).members().get(2);
    var x = add.ins().get(0);
    var y = add.outs().get(0);
    var requires = (Expr.Binary) add.req().get(0).expr();
    assertSame(x, ((Expr.Ident) requires.left()).var());
    var body = (Stmt.Block) add.body();
    var second = (Stmt.Update) body.body().get(1);
    assertSame(y, ((Expr.Ident) second.lhss().get(0)).var());
    var first = (Stmt.Update) body.body().get(0);
    var sum = (Expr.Binary) ((Rhs.ExprRhs) first.rhss().get(0)).expr();
    assertSame(x, ((Expr.Ident) sum.right()).var());
  }

  @Test
  public void testExplicitIdsDistinguishShadowedNames() throws Exception {
    String json = """
        {"module": {"decls": [{"kind": "DefaultClass", "members": [
          {"kind": "Method", "name": "M", "ins": [{"name": "a", "id": "a#1", "type": {"kind": "Basic", "name": "int"}}],
           "body": {"kind": "Block", "body": [
             {"kind": "VarDecl", "locals": [{"name": "a", "id": "a#2", "type": {"kind": "Basic", "name": "int"}}],
              "rhss": [{"kind": "ExprRhs", "expr": {"kind": "Ident", "name": "a", "var": "a#1"}}]},
             {"kind": "Print", "args": [{"kind": "Ident", "name": "a", "var": "a#2"}]}
           ]}}
        ]}]}}
        """;
    Program program = new ProgramLoader().load(json, "shadow");

    assertEquals("shadow", program.name());
    var m = (Member.Method) program.defaultModule().decls().get(0).members().get(0);
    var body = ((Stmt.Block) m.body()).body();
    var decl = (Stmt.VarDecl) body.get(0);
    var init = (Expr.Ident) ((Rhs.ExprRhs) decl.update().rhss().get(0)).expr();
    assertSame(m.ins().get(0), init.var());
    var printed = (Expr.Ident) ((Stmt.Print) body.get(1)).args().get(0);
    assertSame(decl.locals().get(0), printed.var());
    assertSame(decl.locals().get(0), ((Expr.Ident) decl.update().lhss().get(0)).var());
  }

  @Test
  public void testTypeParameterNamesResolveToTheDeclaration() throws Exception {
    String json = """
        {"module": {"decls": [{"kind": "Class", "name": "Box", "typeParams": [{"name": "T"}], "members": [
          {"kind": "Field", "name": "item", "type": {"kind": "UserDefined", "name": "T"}},
          {"kind": "Field", "name": "items", "type": {"kind": "Seq", "arg": {"kind": "TypeParam", "name": "T"}}},
          {"kind": "Field", "name": "other", "type": {"kind": "UserDefined", "name": "Other"}}
        ]}]}}
        """;
    var cls = (Decl.ClassDecl) new ProgramLoader().load(json, "box").defaultModule().decls().get(0);

    var t = cls.typeArgs().get(0);
    assertSame(t, ((Type.TypeParamRef) ((Member.Field) cls.members().get(0)).type()).param());
    var seq = (Type.SeqType) ((Member.Field) cls.members().get(1)).type();
    assertSame(t, ((Type.TypeParamRef) seq.arg()).param());
    assertEquals(Type.UserDefinedType.of("Other"), ((Member.Field) cls.members().get(2)).type());
  }

  @Test
  public void testDanglingVariableReference() {
    String json = """
        {"module": {"decls": [{"kind": "DefaultClass", "members": [
          {"kind": "Method", "name": "M", "body": {"kind": "Block", "body": [
            {"kind": "Print", "args": [{"kind": "Ident", "name": "z", "var": "z1"}]}
          ]}}
        ]}]}}
        """;
    var ex = assertThrows(ProgramFormatException.class, () -> new ProgramLoader().load(json, "p"));
    assertEquals("/module/decls/0/members/0/body/body/0/args/0/var", ex.pointer());
    assertTrue(ex.getMessage().contains("dangling reference 'z1'"), ex.getMessage());
  }

  @Test
  public void testDanglingBreakTarget() {
    String json = """
        {"module": {"decls": [{"kind": "DefaultClass", "members": [
          {"kind": "Method", "name": "M", "body": {"kind": "Block", "id": "outer", "body": [
            {"kind": "Break", "target": "outer"},
            {"kind": "Break", "target": "missing"}
          ]}}
        ]}]}}
        """;
    var ex = assertThrows(ProgramFormatException.class, () -> new ProgramLoader().load(json, "p"));
    assertEquals("/module/decls/0/members/0/body/body/1/target", ex.pointer());
  }

  @Test
  public void testUnknownDeclarationKind() {
    String json = """
        {"module": {"decls": [{"kind": "Widget", "name": "W"}]}}
        """;
    var ex = assertThrows(ProgramFormatException.class, () -> new ProgramLoader().load(json, "p"));
    assertEquals("/module/decls/0/kind", ex.pointer());
    assertTrue(ex.getMessage().contains("unknown declaration kind 'Widget'"), ex.getMessage());
  }

  @Test
  public void testUnknownNestedKindPointsAtTheNode() {
    String json = """
        {"module": {"decls": [{"kind": "DefaultClass", "members": [
          {"kind": "Method", "name": "M", "body": {"kind": "Block", "body": [
            {"kind": "Print", "args": [{"kind": "Gizmo"}]}
          ]}}
        ]}]}}
        """;
    var ex = assertThrows(ProgramFormatException.class, () -> new ProgramLoader().load(json, "p"));
    assertEquals("/module/decls/0/members/0/body/body/0/args/0/kind", ex.pointer());
    assertTrue(ex.getMessage().contains("unknown expression kind 'Gizmo'"), ex.getMessage());
  }

  @Test
  public void testMissingKind() {
    String json = """
        {"module": {"decls": [{"name": "W"}]}}
        """;
    var ex = assertThrows(ProgramFormatException.class, () -> new ProgramLoader().load(json, "p"));
    assertEquals("/module/decls/0/kind", ex.pointer());
    assertTrue(ex.getMessage().contains("missing required field 'kind'"), ex.getMessage());
  }

  @Test
  public void testAssertAndAssumeAreGhostWithoutTheFlag() throws Exception {
    String json = """
        {"module": {"decls": [{"kind": "DefaultClass", "members": [
          {"kind": "Method", "name": "M", "body": {"kind": "Block", "body": [
            {"kind": "Assert", "expr": {"kind": "Literal", "value": true}},
            {"kind": "Assume", "expr": {"kind": "Literal", "value": true}},
            {"kind": "Print", "args": [{"kind": "Literal", "value": 1}]}
          ]}}
        ]}]}}
        """;
    var m = (Member.Method) new ProgramLoader().load(json, "p").defaultModule().decls().get(0).members().get(0);
    var body = ((Stmt.Block) m.body()).body();

    assertTrue(body.get(0).meta().ghost());
    assertTrue(body.get(1).meta().ghost());
    assertFalse(body.get(2).meta().ghost());
    var generator = new JavaCodeGenerator();
    assertTrue(generator.compileStatement(body.get(0)).startsWith("specval.runtime.Checks.check("));
    assertEquals("", generator.compileStatement(body.get(1)));
  }

  @Test
  public void testFunctionNeedsResultType() {
    String json = """
        {"module": {"decls": [{"kind": "DefaultClass", "members": [
          {"kind": "Function", "name": "F", "body": {"kind": "Literal", "value": 1}}
        ]}]}}
        """;
    var ex = assertThrows(ProgramFormatException.class, () -> new ProgramLoader().load(json, "p"));
    assertEquals("/module/decls/0/members/0", ex.pointer());
    assertTrue(ex.getMessage().contains("missing required field 'resultType'"), ex.getMessage());
  }

  @Test
  public void testRootMustBeAnObject() {
    var ex = assertThrows(ProgramFormatException.class, () -> new ProgramLoader().load("[1, 2]", "p"));
    assertEquals("/", ex.pointer());
  }

  @Test
  public void testEnumNamesAcceptKeywordSpelling() throws Exception {
    String json = """
        {"module": {"decls": [{"kind": "DefaultClass", "members": [
          {"kind": "Method", "name": "L", "methodKind": "least lemma", "ghost": true}
        ]}]}}
        """;
    var m = (Member.Method) new ProgramLoader().load(json, "p").defaultModule().decls().get(0).members().get(0);
    assertEquals(MethodKind.LEAST_LEMMA, m.kind());
    assertNull(m.body());
  }
}
