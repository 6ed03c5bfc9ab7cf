package com.forcetree.translation;

import com.forcetree.ast.ClassDeclaration;
import com.forcetree.ast.CompilationUnit;
import com.forcetree.ast.EnumDeclaration;
import com.forcetree.ast.FieldDeclaration;
import com.forcetree.ast.InterfaceDeclaration;
import com.forcetree.ast.KeywordModifier;
import com.forcetree.ast.LiteralExpression;
import com.forcetree.ast.MethodDeclaration;
import com.forcetree.ast.ParameterDeclaration;
import com.forcetree.ast.SourceLocation;
import com.forcetree.ast.TypeDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.forcetree.translation.ParseHelper.classOf;
import static com.forcetree.translation.ParseHelper.parseClass;
import static org.junit.jupiter.api.Assertions.*;

public class ClassDeclarationTest {

    @Test
    void testEmptyClass() throws Exception {
        ClassDeclaration type = classOf("class Test { }");
        assertEquals("Test", type.id().string());
        assertNull(type.extendsType());
        assertTrue(type.implementsTypes().isEmpty());
        assertTrue(type.bodyDeclarations().isEmpty());
        assertTrue(type.modifiers().isEmpty());
    }

    @Test
    void testExtendsAndImplements() throws Exception {
        ClassDeclaration type = classOf("public virtual class Foo extends Bar implements Baz, Outer.Inner { }");
        assertEquals("Bar", type.extendsType().asCodeString());
        assertEquals(2, type.implementsTypes().size());
        assertEquals("Outer.Inner", type.implementsTypes().get(1).asCodeString());
        assertTrue(type.hasKeyword(KeywordModifier.Keyword.PUBLIC));
        assertTrue(type.hasKeyword(KeywordModifier.Keyword.VIRTUAL));
        assertFalse(type.hasKeyword(KeywordModifier.Keyword.ABSTRACT));
    }

    @Test
    void testInnerTypes() throws Exception {
        ClassDeclaration outer = classOf("""
            public class Outer {
                class Inner { void run() { } }
                interface Api { }
                enum Color { RED }
            }
            """);
        List<TypeDeclaration> inner = outer.innerTypeDeclarations();
        assertEquals(3, inner.size());

        ClassDeclaration innerClass = assertInstanceOf(ClassDeclaration.class, inner.get(0));
        assertInstanceOf(InterfaceDeclaration.class, inner.get(1));
        assertInstanceOf(EnumDeclaration.class, inner.get(2));

        assertSame(outer, innerClass.enclosingType());
        assertEquals("Outer.Inner", innerClass.qualifiedName());
        assertEquals("Outer.Inner.run", innerClass.methodDeclarations().get(0).qualifiedName());
        assertNull(outer.enclosingType());
    }

    @Test
    void testFieldWithSeveralDeclarators() throws Exception {
        String source = "class Test { private static Integer a = 1, b; }";
        ClassDeclaration type = classOf(source);
        List<FieldDeclaration> fields = type.fieldDeclarations();
        assertEquals(2, fields.size());

        FieldDeclaration a = fields.get(0);
        FieldDeclaration b = fields.get(1);
        assertEquals("a", a.id().string());
        assertEquals(1, assertInstanceOf(LiteralExpression.IntegerVal.class, a.initializer()).value());
        assertNull(b.initializer());
        assertEquals(2, a.modifiers().size());
        assertEquals(2, b.modifiers().size());
        assertNotSame(a.modifiers().get(0), b.modifiers().get(0));
        assertNotSame(a.type(), b.type());
        assertEquals("a = 1", a.loc().extractFrom(source).trim());
    }

    @Test
    void testSingleFieldSpansWholeDeclaration() throws Exception {
        String source = "class Test { Integer count = 0; }";
        FieldDeclaration field = classOf(source).fieldDeclarations().get(0);
        assertEquals("Integer count = 0;", field.loc().extractFrom(source).trim());
    }

    @Test
    void testMethodDeclaration() throws Exception {
        ClassDeclaration type = classOf("""
            class Test {
                public static List<String> names(Integer count, final Map<Id, Account> byId) {
                    return null;
                }
            }
            """);
        MethodDeclaration method = type.methodDeclarations().get(0);
        assertEquals("names", method.id().string());
        assertEquals("List<String>", method.returnType().asCodeString());
        assertFalse(method.isConstructor());
        assertFalse(method.isAnonymousInitializationCode());

        List<ParameterDeclaration> parameters = method.parameterDeclarations();
        assertEquals(2, parameters.size());
        assertEquals("Integer", parameters.get(0).type().asCodeString());
        assertEquals("Map<Id, Account>", parameters.get(1).type().asCodeString());
        assertTrue(parameters.get(1).hasKeyword(KeywordModifier.Keyword.FINAL));
        assertEquals(1, method.body().statements().size());
    }

    @Test
    void testVoidAndAbstractMethods() throws Exception {
        ClassDeclaration type = classOf("abstract class Test { abstract void run(); String[] names() { return null; } }");
        MethodDeclaration run = type.methodDeclarations().get(0);
        assertTrue(run.returnType().isVoid());
        assertNull(run.body());

        MethodDeclaration names = type.methodDeclarations().get(1);
        assertEquals(1, names.returnType().arrayNesting());
        assertEquals("String[]", names.returnType().asCodeString());
    }

    @Test
    void testConstructor() throws Exception {
        ClassDeclaration type = classOf("class Test { public Test(String name) { this.name = name; } }");
        MethodDeclaration constructor = type.methodDeclarations().get(0);
        assertTrue(constructor.isConstructor());
        assertEquals("Test", constructor.id().string());
        assertTrue(constructor.returnType().isVoid());
        assertEquals(SourceLocation.UNKNOWN, constructor.returnType().loc());
        assertEquals(1, constructor.parameterDeclarations().size());
    }

    @Test
    void testAnonymousInitializers() throws Exception {
        ClassDeclaration type = classOf("class Test { { x = 1; } static { y = 2; } }");
        List<MethodDeclaration> methods = type.methodDeclarations();
        assertEquals(2, methods.size());

        MethodDeclaration instance = methods.get(0);
        assertEquals(MethodDeclaration.ANONYMOUS_INITIALIZER_NAME, instance.id().string());
        assertTrue(instance.isAnonymousInitializationCode());
        assertTrue(instance.parameterDeclarations().isEmpty());
        assertTrue(instance.returnType().isVoid());
        assertFalse(instance.hasKeyword(KeywordModifier.Keyword.STATIC));

        assertTrue(methods.get(1).hasKeyword(KeywordModifier.Keyword.STATIC));
    }

    @Test
    void testInterface() throws Exception {
        CompilationUnit unit = parseClass("public interface Shape extends Named, Sized { Double area(); void scale(Double factor); }");
        InterfaceDeclaration shape = assertInstanceOf(InterfaceDeclaration.class, unit.typeDeclaration());
        assertEquals(2, shape.extendsTypes().size());
        assertEquals(2, shape.methodDeclarations().size());
        assertNull(shape.methodDeclarations().get(0).body());
        assertTrue(shape.methodDeclarations().get(1).returnType().isVoid());
    }

    @Test
    void testEnum() throws Exception {
        EnumDeclaration season = assertInstanceOf(EnumDeclaration.class,
            parseClass("public enum Season { WINTER, SPRING, SUMMER, FALL }").typeDeclaration());
        assertEquals(4, season.values().size());
        assertEquals("FALL", season.values().get(3).string());

        EnumDeclaration empty = assertInstanceOf(EnumDeclaration.class, parseClass("enum Empty { }").typeDeclaration());
        assertTrue(empty.values().isEmpty());
    }

    @Test
    void testBodyKeepsSourceOrder() throws Exception {
        ClassDeclaration type = classOf("class Test { Integer a; void m() { } Integer b { get; } ; class C { } }");
        List<?> body = type.bodyDeclarations();
        assertEquals(4, body.size());
        assertEquals(1, type.propertyDeclarations().size());
        assertEquals("C", type.innerTypeDeclarations().get(0).id().string());
    }
}
