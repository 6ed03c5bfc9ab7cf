package com.forcetree.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NodeTest {

    private static Identifier id(String name) {
        return new Identifier(name, SourceLocation.UNKNOWN);
    }

    @Test
    void testLinkParents() {
        VariableExpression left = new VariableExpression(id("a"), null);
        VariableExpression right = new VariableExpression(id("b"), null);
        BinaryExpression sum = new BinaryExpression(left, BinaryExpression.Operator.ADDITION, right, null);

        assertNull(left.parent());
        assertEquals(5, Node.linkParents(sum));
        assertSame(sum, left.parent());
        assertSame(sum, right.parent());
        assertSame(left, left.id().parent());
        assertNull(sum.parent());
    }

    @Test
    void testSecondParentFails() {
        VariableExpression shared = new VariableExpression(id("a"), null);
        BinaryExpression first = new BinaryExpression(shared, BinaryExpression.Operator.ADDITION,
            new LiteralExpression.IntegerVal(1, null), null);
        Node.linkParents(first);

        ExpressionStatement second = new ExpressionStatement(shared, null);
        assertThrows(NodeIntegrityException.class, () -> Node.linkParents(second));
    }

    @Test
    void testSharedSubtreeFails() {
        Identifier shared = id("x");
        VariableExpression a = new VariableExpression(shared, null);
        VariableExpression b = new VariableExpression(shared, null);
        BinaryExpression both = new BinaryExpression(a, BinaryExpression.Operator.EQUAL, b, null);
        assertThrows(NodeIntegrityException.class, () -> Node.linkParents(both));
    }

    @Test
    void testChildrenAreCachedAndImmutable() {
        CompoundStatement block = new CompoundStatement(
            List.of(new BreakStatement(null), new ContinueStatement(null)),
            CompoundStatement.Scoping.SCOPE_BOUNDARY,
            null);

        List<Node> children = block.children();
        assertSame(children, block.children());
        assertEquals(2, children.size());
        assertThrows(UnsupportedOperationException.class, () -> children.add(new BreakStatement(null)));
    }

    @Test
    void testAbsentOptionalChildrenAreOmitted() {
        IfStatement withoutElse = new IfStatement(
            new VariableExpression(id("x"), null), new BreakStatement(null), null, null);
        assertEquals(2, withoutElse.children().size());
        assertNull(withoutElse.elseStatement());
    }

    @Test
    void testNullLocationBecomesUnknown() {
        assertSame(SourceLocation.UNKNOWN, new BreakStatement(null).loc());
    }

    @Test
    void testTypeRefCodeString() {
        TypeRef inner = TypeRef.of(id("String"));
        TypeRef map = new TypeRef(List.of(
            new TypeRef.Component(id("System"), List.of()),
            new TypeRef.Component(id("Map"), List.of(inner, TypeRef.of(id("Integer"))))), 1, null);

        assertEquals("System.Map<String, Integer>[]", map.asCodeString());
        assertEquals("void", TypeRef.voidType().asCodeString());
        assertTrue(TypeRef.voidType().isVoid());
        assertEquals("Schema.SObjectType", TypeRef.ofQualifiedName("Schema.SObjectType", null).asCodeString());
    }

    @Test
    void testKeywordFromString() {
        assertEquals(KeywordModifier.Keyword.WITH_SHARING, KeywordModifier.Keyword.fromString("with  sharing"));
        assertEquals(KeywordModifier.Keyword.INHERITED_SHARING, KeywordModifier.Keyword.fromString("inheritedsharing"));
        assertEquals(KeywordModifier.Keyword.PUBLIC, KeywordModifier.Keyword.fromString("Public"));
        assertNull(KeywordModifier.Keyword.fromString("shared"));
    }

    @Test
    void testIdentifierMatchesIgnoringCase() {
        assertTrue(id("MyClass").matches("myclass"));
        assertFalse(id("MyClass").matches("MyClass2"));
    }
}
