package com.forcetree.translation;

import com.forcetree.ast.CompoundStatement;
import com.forcetree.ast.DmlStatement;
import com.forcetree.ast.DoWhileLoopStatement;
import com.forcetree.ast.EnhancedForLoopStatement;
import com.forcetree.ast.ExpressionStatement;
import com.forcetree.ast.ForLoopStatement;
import com.forcetree.ast.IfStatement;
import com.forcetree.ast.LiteralExpression;
import com.forcetree.ast.MethodDeclaration;
import com.forcetree.ast.ReturnStatement;
import com.forcetree.ast.RunAsStatement;
import com.forcetree.ast.Statement;
import com.forcetree.ast.SwitchStatement;
import com.forcetree.ast.ThrowStatement;
import com.forcetree.ast.TryStatement;
import com.forcetree.ast.UnaryExpression;
import com.forcetree.ast.VariableDeclaration;
import com.forcetree.ast.VariableDeclarationStatement;
import com.forcetree.ast.VariableExpression;
import com.forcetree.ast.WhileLoopStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.forcetree.translation.ParseHelper.methodWithBody;
import static com.forcetree.translation.ParseHelper.statementOf;
import static org.junit.jupiter.api.Assertions.*;

public class StatementTest {

    private static String variableName(Object expression) {
        return assertInstanceOf(VariableExpression.class, expression).id().string();
    }

    @Test
    void testMethodBodyIsCompoundStatement() throws Exception {
        MethodDeclaration method = methodWithBody("x = 1; y = 2;");
        CompoundStatement body = method.body();
        assertEquals(2, body.statements().size());
        assertEquals(CompoundStatement.Scoping.SCOPE_BOUNDARY, body.scoping());
        assertSame(method, body.parent());
    }

    @Test
    void testIfWithoutElse() throws Exception {
        IfStatement node = assertInstanceOf(IfStatement.class, statementOf("if (x) { }"));
        assertEquals("x", variableName(node.condition()));
        assertInstanceOf(CompoundStatement.class, node.thenStatement());
        assertNull(node.elseStatement());
    }

    @Test
    void testIfWithElse() throws Exception {
        IfStatement node = assertInstanceOf(IfStatement.class, statementOf("if (x) { } else { }"));
        assertNotNull(node.elseStatement());
    }

    @Test
    void testElseIfChain() throws Exception {
        IfStatement node = assertInstanceOf(IfStatement.class,
            statementOf("if (a) { return 1; } else if (b) { return 2; } else { return 3; }"));
        IfStatement nested = assertInstanceOf(IfStatement.class, node.elseStatement());
        assertEquals("b", variableName(nested.condition()));
        assertNotNull(nested.elseStatement());
    }

    @Test
    void testSwitchWithElse() throws Exception {
        SwitchStatement node = assertInstanceOf(SwitchStatement.class,
            statementOf("switch on x { when else { } }"));
        assertEquals("x", variableName(node.condition()));
        assertEquals(1, node.whenClauses().size());
        assertInstanceOf(SwitchStatement.WhenElse.class, node.whenClauses().get(0));
    }

    @Test
    void testSwitchWhenWithTwoValues() throws Exception {
        SwitchStatement node = assertInstanceOf(SwitchStatement.class,
            statementOf("switch on x { when 1, 2 { } when else { } }"));
        SwitchStatement.WhenValue when = assertInstanceOf(SwitchStatement.WhenValue.class, node.whenClauses().get(0));
        assertEquals(2, when.values().size());
    }

    @Test
    void testSwitchWhenLiteralValues() throws Exception {
        SwitchStatement node = assertInstanceOf(SwitchStatement.class,
            statementOf("switch on x { when -5, 7L, 'abc', null { } when RED { } }"));
        List<?> values = ((SwitchStatement.WhenValue) node.whenClauses().get(0)).values();

        assertEquals(-5, assertInstanceOf(LiteralExpression.IntegerVal.class, values.get(0)).value());
        assertEquals(7L, assertInstanceOf(LiteralExpression.LongVal.class, values.get(1)).value());
        assertEquals("abc", assertInstanceOf(LiteralExpression.StringVal.class, values.get(2)).value());
        assertInstanceOf(LiteralExpression.NullVal.class, values.get(3));

        List<?> enumValues = ((SwitchStatement.WhenValue) node.whenClauses().get(1)).values();
        assertEquals("RED", variableName(enumValues.get(0)));
    }

    @Test
    void testSwitchWhenDeclaresVariable() throws Exception {
        SwitchStatement node = assertInstanceOf(SwitchStatement.class,
            statementOf("switch on x { when Type variable { } }"));
        SwitchStatement.WhenType when = assertInstanceOf(SwitchStatement.WhenType.class, node.whenClauses().get(0));
        assertEquals("Type", when.type().asCodeString());
        assertEquals("Type", when.variableDeclaration().type().asCodeString());
        assertEquals("variable", when.variableDeclaration().id().string());
        assertNotSame(when.type(), when.variableDeclaration().type());
    }

    @Test
    void testTraditionalForDeclaresTwoVariables() throws Exception {
        ForLoopStatement node = assertInstanceOf(ForLoopStatement.class,
            statementOf("for (Integer i = 0, j = 10; i < j; i++, j--) { }"));
        assertEquals(2, node.declarations().size());
        assertEquals("j", node.declarations().get(1).id().string());
        assertTrue(node.initializations().isEmpty());
        assertNotNull(node.condition());
        assertEquals(2, node.updates().size());
        assertEquals(UnaryExpression.Operator.POST_DECREMENT,
            assertInstanceOf(UnaryExpression.class, node.updates().get(1)).op());
    }

    @Test
    void testTraditionalForInitializesTwoExpressions() throws Exception {
        ForLoopStatement node = assertInstanceOf(ForLoopStatement.class,
            statementOf("for (i = 0, j = 10; ; ) { }"));
        assertTrue(node.declarations().isEmpty());
        assertEquals(2, node.initializations().size());
        assertNull(node.condition());
        assertTrue(node.updates().isEmpty());
    }

    @Test
    void testEnhancedForDeclaresVariable() throws Exception {
        EnhancedForLoopStatement node = assertInstanceOf(EnhancedForLoopStatement.class,
            statementOf("for (String s : strings) { }"));
        assertEquals("String", node.elementDeclaration().type().asCodeString());
        assertEquals("s", node.elementDeclaration().id().string());
        assertNull(node.elementDeclaration().initializer());
        assertEquals("strings", variableName(node.collection()));
    }

    @Test
    void testWhileAndDoWhile() throws Exception {
        WhileLoopStatement loop = assertInstanceOf(WhileLoopStatement.class, statementOf("while (x) { }"));
        assertEquals("x", variableName(loop.condition()));

        DoWhileLoopStatement doLoop = assertInstanceOf(DoWhileLoopStatement.class,
            statementOf("do { } while (y);"));
        assertEquals("y", variableName(doLoop.condition()));
        assertInstanceOf(CompoundStatement.class, doLoop.body());
    }

    @Test
    void testTryWithFinally() throws Exception {
        TryStatement node = assertInstanceOf(TryStatement.class, statementOf("try { } finally { }"));
        assertTrue(node.catchBlocks().isEmpty());
        assertNotNull(node.finallyBlock());
    }

    @Test
    void testTryWithTwoCatchBlocks() throws Exception {
        TryStatement node = assertInstanceOf(TryStatement.class,
            statementOf("try { } catch (System.DmlException e) { } catch (Exception e) { }"));
        assertEquals(2, node.catchBlocks().size());
        assertNull(node.finallyBlock());

        VariableDeclaration first = node.catchBlocks().get(0).exceptionVariable();
        assertEquals("System.DmlException", first.type().asCodeString());
        assertEquals("e", first.id().string());
        assertEquals("Exception", node.catchBlocks().get(1).exceptionVariable().type().asCodeString());
    }

    @Test
    void testJumpStatements() throws Exception {
        MethodDeclaration method = methodWithBody("return x; throw e; break; continue; return;");
        List<Statement> statements = method.body().statements();

        assertEquals(1, assertInstanceOf(ReturnStatement.class, statements.get(0)).children().size());
        assertEquals("e", variableName(assertInstanceOf(ThrowStatement.class, statements.get(1)).exception()));
        assertTrue(statements.get(2).children().isEmpty());
        assertTrue(statements.get(3).children().isEmpty());
        assertNull(assertInstanceOf(ReturnStatement.class, statements.get(4)).value());
    }

    @Test
    void testDmlStatements() throws Exception {
        MethodDeclaration method = methodWithBody(
            "insert a; update a; delete a; undelete a; upsert a Account.External__c; merge a b; insert as user a;");
        List<Statement> statements = method.body().statements();

        assertInstanceOf(DmlStatement.Insert.class, statements.get(0));
        assertInstanceOf(DmlStatement.Update.class, statements.get(1));
        assertInstanceOf(DmlStatement.Delete.class, statements.get(2));
        assertInstanceOf(DmlStatement.Undelete.class, statements.get(3));
        for (int i = 0; i < 4; i++) {
            assertEquals(1, statements.get(i).children().size());
        }

        DmlStatement.Upsert upsert = assertInstanceOf(DmlStatement.Upsert.class, statements.get(4));
        assertEquals("Account.External__c", upsert.field().string());
        assertEquals(2, upsert.children().size());

        DmlStatement.Merge merge = assertInstanceOf(DmlStatement.Merge.class, statements.get(5));
        assertEquals("b", variableName(merge.from()));
        assertEquals(2, merge.children().size());
        assertNull(merge.access());

        DmlStatement.Insert userMode = assertInstanceOf(DmlStatement.Insert.class, statements.get(6));
        assertEquals(DmlStatement.AccessLevel.USER_MODE, userMode.access());
    }

    @Test
    void testRunAs() throws Exception {
        RunAsStatement node = assertInstanceOf(RunAsStatement.class,
            statementOf("System.runAs(u) { insert a; }"));
        assertEquals(1, node.contexts().size());
        assertEquals("u", variableName(node.contexts().get(0)));
        assertEquals(1, node.body().statements().size());
    }

    @Test
    void testLocalVariableDeclarations() throws Exception {
        VariableDeclarationStatement node = assertInstanceOf(VariableDeclarationStatement.class,
            statementOf("final String s = 'a', t;"));
        assertEquals(2, node.variableDeclarations().size());

        VariableDeclaration first = node.variableDeclarations().get(0);
        assertEquals("s", first.id().string());
        assertEquals("String", first.type().asCodeString());
        assertNotNull(first.initializer());
        assertEquals(1, first.modifiers().size());

        VariableDeclaration second = node.variableDeclarations().get(1);
        assertNull(second.initializer());
        assertNotSame(first.type(), second.type());
        assertNotSame(first.modifiers().get(0), second.modifiers().get(0));
    }

    @Test
    void testExpressionStatement() throws Exception {
        ExpressionStatement node = assertInstanceOf(ExpressionStatement.class, statementOf("doWork();"));
        assertEquals(1, node.children().size());
    }

    @Test
    void testNestedBlock() throws Exception {
        CompoundStatement node = assertInstanceOf(CompoundStatement.class, statementOf("{ x++; }"));
        assertEquals(1, node.statements().size());
    }
}
