package com.forcetree.translation;

import com.forcetree.ast.AssignExpression;
import com.forcetree.ast.ConstructorInitializer;
import com.forcetree.ast.Initializer;
import com.forcetree.ast.LiteralExpression;
import com.forcetree.ast.MapInitializer;
import com.forcetree.ast.NewExpression;
import com.forcetree.ast.SizedArrayInitializer;
import com.forcetree.ast.ValuesInitializer;
import org.junit.jupiter.api.Test;

import static com.forcetree.translation.ParseHelper.expressionOf;
import static org.junit.jupiter.api.Assertions.*;

public class InitializerTest {

    private static Initializer initializerOf(String expression) throws Exception {
        return assertInstanceOf(NewExpression.class, expressionOf(expression)).initializer();
    }

    @Test
    void testConstructorInitializer() throws Exception {
        ConstructorInitializer init = assertInstanceOf(ConstructorInitializer.class,
            initializerOf("new Account(Name = 'Acme', Industry = 'Retail')"));
        assertEquals("Account", init.type().asCodeString());
        assertEquals(2, init.args().size());
        assertInstanceOf(AssignExpression.class, init.args().get(0));
    }

    @Test
    void testGenericConstructorWithoutArguments() throws Exception {
        ConstructorInitializer init = assertInstanceOf(ConstructorInitializer.class,
            initializerOf("new List<Account>()"));
        assertEquals("List<Account>", init.type().asCodeString());
        assertTrue(init.args().isEmpty());
    }

    @Test
    void testEmptyBraces() throws Exception {
        ValuesInitializer init = assertInstanceOf(ValuesInitializer.class, initializerOf("new Set<String>{}"));
        assertTrue(init.values().isEmpty());
        assertEquals("Set<String>", init.type().asCodeString());
    }

    @Test
    void testSetValues() throws Exception {
        ValuesInitializer init = assertInstanceOf(ValuesInitializer.class,
            initializerOf("new Set<Integer>{ 1, 2, 3 }"));
        assertEquals(3, init.values().size());
        assertEquals(3, assertInstanceOf(LiteralExpression.IntegerVal.class, init.values().get(2)).value());
    }

    @Test
    void testArrayValues() throws Exception {
        ValuesInitializer init = assertInstanceOf(ValuesInitializer.class,
            initializerOf("new String[]{ 'a', 'b' }"));
        assertEquals(2, init.values().size());
        assertEquals(1, init.type().arrayNesting());
        assertEquals("String[]", init.type().asCodeString());
    }

    @Test
    void testEmptyArray() throws Exception {
        ValuesInitializer init = assertInstanceOf(ValuesInitializer.class, initializerOf("new Integer[]"));
        assertTrue(init.values().isEmpty());
        assertEquals("Integer[]", init.type().asCodeString());
    }

    @Test
    void testSizedArray() throws Exception {
        SizedArrayInitializer init = assertInstanceOf(SizedArrayInitializer.class,
            initializerOf("new Integer[count + 1]"));
        assertEquals("Integer[]", init.type().asCodeString());
        assertNotNull(init.size());
    }

    @Test
    void testMapPairs() throws Exception {
        MapInitializer init = assertInstanceOf(MapInitializer.class,
            initializerOf("new Map<String, Integer>{ 'a' => 1, 'b' => 2 }"));
        assertEquals("Map<String, Integer>", init.type().asCodeString());
        assertEquals(2, init.pairs().size());

        MapInitializer.Entry second = init.pairs().get(1);
        assertEquals("b", assertInstanceOf(LiteralExpression.StringVal.class, second.key()).value());
        assertEquals(2, assertInstanceOf(LiteralExpression.IntegerVal.class, second.value()).value());
        assertSame(init, second.parent());
    }

    @Test
    void testQualifiedTypeName() throws Exception {
        ConstructorInitializer init = assertInstanceOf(ConstructorInitializer.class,
            initializerOf("new Outer.Inner(1)"));
        assertEquals("Outer.Inner", init.type().asCodeString());
    }
}
