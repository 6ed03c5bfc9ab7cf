package com.forcetree.translation;

import com.forcetree.ast.AnnotationModifier;
import com.forcetree.ast.ArrayExpression;
import com.forcetree.ast.AssignExpression;
import com.forcetree.ast.BinaryExpression;
import com.forcetree.ast.BreakStatement;
import com.forcetree.ast.CallExpression;
import com.forcetree.ast.CastExpression;
import com.forcetree.ast.ClassDeclaration;
import com.forcetree.ast.CompilationUnit;
import com.forcetree.ast.CompoundStatement;
import com.forcetree.ast.ConstructorInitializer;
import com.forcetree.ast.ContinueStatement;
import com.forcetree.ast.Declaration;
import com.forcetree.ast.DmlStatement;
import com.forcetree.ast.DoWhileLoopStatement;
import com.forcetree.ast.ElementArgument;
import com.forcetree.ast.ElementValue;
import com.forcetree.ast.EnhancedForLoopStatement;
import com.forcetree.ast.EnumDeclaration;
import com.forcetree.ast.Expression;
import com.forcetree.ast.ExpressionStatement;
import com.forcetree.ast.FieldDeclaration;
import com.forcetree.ast.FieldExpression;
import com.forcetree.ast.ForLoopStatement;
import com.forcetree.ast.Identifier;
import com.forcetree.ast.IfStatement;
import com.forcetree.ast.Initializer;
import com.forcetree.ast.InterfaceDeclaration;
import com.forcetree.ast.KeywordModifier;
import com.forcetree.ast.LiteralExpression;
import com.forcetree.ast.MapInitializer;
import com.forcetree.ast.MethodDeclaration;
import com.forcetree.ast.Modifier;
import com.forcetree.ast.NewExpression;
import com.forcetree.ast.Node;
import com.forcetree.ast.NodeIntegrityException;
import com.forcetree.ast.ParameterDeclaration;
import com.forcetree.ast.PropertyDeclaration;
import com.forcetree.ast.ReturnStatement;
import com.forcetree.ast.RunAsStatement;
import com.forcetree.ast.SizedArrayInitializer;
import com.forcetree.ast.SoqlOrSoslExpression;
import com.forcetree.ast.SourceLocation;
import com.forcetree.ast.Statement;
import com.forcetree.ast.SuperExpression;
import com.forcetree.ast.SwitchStatement;
import com.forcetree.ast.TernaryExpression;
import com.forcetree.ast.ThisExpression;
import com.forcetree.ast.ThrowStatement;
import com.forcetree.ast.TriggerDeclaration;
import com.forcetree.ast.TryStatement;
import com.forcetree.ast.TypeDeclaration;
import com.forcetree.ast.TypeRef;
import com.forcetree.ast.TypeRefExpression;
import com.forcetree.ast.UnaryExpression;
import com.forcetree.ast.ValuesInitializer;
import com.forcetree.ast.VariableDeclaration;
import com.forcetree.ast.VariableDeclarationStatement;
import com.forcetree.ast.VariableExpression;
import com.forcetree.ast.WhileLoopStatement;
import com.forcetree.parser.ApexParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates an Apex parse tree into an AST in a single depth-first pass.
 *
 * <p>Every node is created through {@link #node(Node)} so that the number of created nodes can be
 * checked against the number of nodes reachable from the root once translation is done. A
 * translator holds per-file state and translates one tree.
 */
public class Translator {

    private static final Logger logger = LoggerFactory.getLogger(Translator.class);

    private static final String SETTER_PARAMETER_NAME = "value";

    private final TranslationContext context;

    public Translator(String file, TokenStream tokens) {
        this.context = new TranslationContext(file, tokens);
    }

    /**
     * Translates a compilation unit or trigger unit parse tree.
     *
     * @throws TranslationException if the tree cannot be translated or the result fails the
     *     node integrity check
     * @throws IllegalArgumentException if the tree root is neither kind of unit
     */
    public CompilationUnit translate(ParserRuleContext tree) throws TranslationException {
        logger.info("Translating {}", context.file());

        CompilationUnit unit;
        if (tree instanceof ApexParser.CompilationUnitContext compilationUnit) {
            unit = translateCompilationUnit(compilationUnit);
        } else if (tree instanceof ApexParser.TriggerUnitContext triggerUnit) {
            unit = translateTriggerUnit(triggerUnit);
        } else {
            throw new IllegalArgumentException(
                "Cannot translate parse tree rooted at " + tree.getClass().getSimpleName());
        }

        int reachable = linkParents(tree, unit);
        int created = context.counter().count();
        if (reachable != created) {
            throw new TranslationException(tree,
                "Number of created nodes " + created + " should match number of reachable nodes " + reachable);
        }

        logger.info("Translated AST successfully. Created {} nodes.", created);
        return unit;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Links parents below {@code root} and returns the number of reachable nodes. A node that is
     * reachable twice fails the translation of {@code tree}.
     */
    static int linkParents(ParserRuleContext tree, Node root) throws TranslationException {
        try {
            return Node.linkParents(root);
        } catch (NodeIntegrityException e) {
            throw new TranslationException(tree, e.getMessage(), e);
        }
    }

    private <T extends Node> T node(T node) {
        return context.counter().register(node);
    }

    private SourceLocation loc(ParserRuleContext ctx) {
        return context.locationOf(ctx);
    }

    private SourceLocation loc(TerminalNode terminal) {
        return context.locationOf(terminal);
    }

    private static void requireExactlyOne(ParserRuleContext ctx, Object... alternatives)
            throws TranslationException {
        requireExactlyOne(ctx, "Mutual exclusion violation", alternatives);
    }

    private static void requireExactlyOne(ParserRuleContext ctx, String message, Object... alternatives)
            throws TranslationException {
        int present = 0;
        for (Object alternative : alternatives) {
            if (alternative != null) {
                present++;
            }
        }
        if (present != 1) {
            throw new TranslationException(ctx, message);
        }
    }

    @FunctionalInterface
    private interface Translation<C, R> {
        R apply(C ctx) throws TranslationException;
    }

    private static <C, R> R translateOptional(C ctx, Translation<C, R> translation) throws TranslationException {
        return ctx != null ? translation.apply(ctx) : null;
    }

    private static <C, R> List<R> translateList(List<C> contexts, Translation<C, R> translation)
            throws TranslationException {
        List<R> result = new ArrayList<>();
        for (C ctx : contexts) {
            result.add(translation.apply(ctx));
        }
        return result;
    }

    private static <C, R> List<R> translateOptionalList(C ctx, Translation<C, List<R>> translation)
            throws TranslationException {
        return ctx != null ? translation.apply(ctx) : List.of();
    }

    // ========================================================================
    // Compilation units
    // ========================================================================

    private CompilationUnit translateCompilationUnit(ApexParser.CompilationUnitContext ctx)
            throws TranslationException {
        TypeDeclaration type = translateTypeDeclaration(ctx.typeDeclaration());
        return node(new CompilationUnit(type, context.file(), loc(ctx)));
    }

    private CompilationUnit translateTriggerUnit(ApexParser.TriggerUnitContext ctx) throws TranslationException {
        if (ctx.id().size() != 2) {
            throw new TranslationException(ctx, "TriggerUnit rule should include 2 identifiers");
        }
        Identifier name = translateId(ctx.id(0));
        Identifier target = translateId(ctx.id(1));
        List<TriggerDeclaration.TriggerCase> cases = translateList(ctx.triggerCase(), this::translateTriggerCase);
        CompoundStatement body = translateBlock(ctx.block());
        TriggerDeclaration trigger = node(new TriggerDeclaration(name, target, cases, body, loc(ctx)));
        return node(new CompilationUnit(trigger, context.file(), loc(ctx)));
    }

    private TriggerDeclaration.TriggerCase translateTriggerCase(ApexParser.TriggerCaseContext ctx)
            throws TranslationException {
        requireExactlyOne(ctx, ctx.BEFORE(), ctx.AFTER());
        requireExactlyOne(ctx, ctx.INSERT(), ctx.UPDATE(), ctx.DELETE(), ctx.UNDELETE());
        return TriggerDeclaration.TriggerCase.of(ctx.getChild(0).getText(), ctx.getChild(1).getText());
    }

    // ========================================================================
    // Type declarations
    // ========================================================================

    private TypeDeclaration translateTypeDeclaration(ApexParser.TypeDeclarationContext ctx)
            throws TranslationException {
        requireExactlyOne(ctx, ctx.classDeclaration(), ctx.enumDeclaration(), ctx.interfaceDeclaration());
        List<Modifier> modifiers = translateModifiers(ctx.modifier());
        if (ctx.classDeclaration() != null) {
            return translateClassDeclaration(ctx.classDeclaration(), modifiers);
        } else if (ctx.enumDeclaration() != null) {
            return translateEnumDeclaration(ctx.enumDeclaration(), modifiers);
        }
        return translateInterfaceDeclaration(ctx.interfaceDeclaration(), modifiers);
    }

    private ClassDeclaration translateClassDeclaration(ApexParser.ClassDeclarationContext ctx, List<Modifier> modifiers)
            throws TranslationException {
        Identifier id = translateId(ctx.id());
        TypeRef extendsType = translateOptional(ctx.typeRef(), this::translateTypeRef);
        List<TypeRef> implementsTypes = translateOptionalList(ctx.typeList(), this::translateTypeList);
        List<Declaration> bodyDeclarations = new ArrayList<>();
        for (ApexParser.ClassBodyDeclarationContext member : ctx.classBody().classBodyDeclaration()) {
            translateClassBodyDeclaration(member, bodyDeclarations);
        }
        return node(new ClassDeclaration(id, modifiers, extendsType, implementsTypes, bodyDeclarations, loc(ctx)));
    }

    private EnumDeclaration translateEnumDeclaration(ApexParser.EnumDeclarationContext ctx, List<Modifier> modifiers)
            throws TranslationException {
        Identifier id = translateId(ctx.id());
        List<Identifier> values = ctx.enumConstants() != null
            ? translateList(ctx.enumConstants().id(), this::translateId)
            : List.of();
        return node(new EnumDeclaration(id, modifiers, values, loc(ctx)));
    }

    private InterfaceDeclaration translateInterfaceDeclaration(
        ApexParser.InterfaceDeclarationContext ctx,
        List<Modifier> modifiers
    ) throws TranslationException {
        Identifier id = translateId(ctx.id());
        List<TypeRef> extendsTypes = translateOptionalList(ctx.typeList(), this::translateTypeList);
        List<MethodDeclaration> methods =
            translateList(ctx.interfaceBody().interfaceMethodDeclaration(), this::translateInterfaceMethod);
        return node(new InterfaceDeclaration(id, modifiers, extendsTypes, methods, loc(ctx)));
    }

    private MethodDeclaration translateInterfaceMethod(ApexParser.InterfaceMethodDeclarationContext ctx)
            throws TranslationException {
        requireExactlyOne(ctx, "Method should return void or a type", ctx.typeRef(), ctx.VOID());
        List<Modifier> modifiers = translateModifiers(ctx.modifier());
        TypeRef returnType = ctx.typeRef() != null ? translateTypeRef(ctx.typeRef()) : voidType(loc(ctx.VOID()));
        Identifier id = translateId(ctx.id());
        List<ParameterDeclaration> parameters = translateFormalParameters(ctx.formalParameters());
        return node(new MethodDeclaration(id, modifiers, returnType, parameters, null, false, loc(ctx)));
    }

    /**
     * Appends the declarations of one class member. A field member with several declarators adds
     * one declaration per declarator, each with its own copy of the modifiers and type.
     */
    private void translateClassBodyDeclaration(
        ApexParser.ClassBodyDeclarationContext ctx,
        List<Declaration> out
    ) throws TranslationException {
        if (ctx.SEMI() != null) {
            return;
        }
        if (ctx.block() != null) {
            out.add(translateInitializerBlock(ctx));
            return;
        }

        ApexParser.MemberDeclarationContext member = ctx.memberDeclaration();
        List<ApexParser.ModifierContext> modifiers = ctx.modifier();
        requireExactlyOne(member,
            member.methodDeclaration(),
            member.fieldDeclaration(),
            member.constructorDeclaration(),
            member.interfaceDeclaration(),
            member.classDeclaration(),
            member.enumDeclaration(),
            member.propertyDeclaration());

        if (member.methodDeclaration() != null) {
            out.add(translateMethod(member.methodDeclaration(), translateModifiers(modifiers)));
        } else if (member.fieldDeclaration() != null) {
            out.addAll(translateFieldDeclaration(member.fieldDeclaration(), modifiers));
        } else if (member.constructorDeclaration() != null) {
            out.add(translateConstructor(member.constructorDeclaration(), translateModifiers(modifiers)));
        } else if (member.interfaceDeclaration() != null) {
            out.add(translateInterfaceDeclaration(member.interfaceDeclaration(), translateModifiers(modifiers)));
        } else if (member.classDeclaration() != null) {
            out.add(translateClassDeclaration(member.classDeclaration(), translateModifiers(modifiers)));
        } else if (member.enumDeclaration() != null) {
            out.add(translateEnumDeclaration(member.enumDeclaration(), translateModifiers(modifiers)));
        } else {
            out.add(translateProperty(member.propertyDeclaration(), translateModifiers(modifiers)));
        }
    }

    /**
     * An anonymous initializer block becomes a parameterless void method named {@code _init}.
     */
    private MethodDeclaration translateInitializerBlock(ApexParser.ClassBodyDeclarationContext ctx)
            throws TranslationException {
        List<Modifier> modifiers = ctx.STATIC() != null
            ? List.of(node(new KeywordModifier(KeywordModifier.Keyword.STATIC, loc(ctx.STATIC()))))
            : List.of();
        Identifier id = node(new Identifier(MethodDeclaration.ANONYMOUS_INITIALIZER_NAME, loc(ctx)));
        CompoundStatement body = translateBlock(ctx.block());
        return node(new MethodDeclaration(
            id, modifiers, voidType(SourceLocation.UNKNOWN), List.of(), body, false, loc(ctx)));
    }

    private MethodDeclaration translateMethod(ApexParser.MethodDeclarationContext ctx, List<Modifier> modifiers)
            throws TranslationException {
        requireExactlyOne(ctx, "Method should return void or a type", ctx.typeRef(), ctx.VOID());
        TypeRef returnType = ctx.typeRef() != null ? translateTypeRef(ctx.typeRef()) : voidType(loc(ctx.VOID()));
        Identifier id = translateId(ctx.id());
        List<ParameterDeclaration> parameters = translateFormalParameters(ctx.formalParameters());
        CompoundStatement body = translateOptional(ctx.block(), this::translateBlock);
        return node(new MethodDeclaration(id, modifiers, returnType, parameters, body, false, loc(ctx)));
    }

    private MethodDeclaration translateConstructor(ApexParser.ConstructorDeclarationContext ctx, List<Modifier> modifiers)
            throws TranslationException {
        Identifier id = node(new Identifier(ctx.qualifiedName().getText(), loc(ctx.qualifiedName())));
        List<ParameterDeclaration> parameters = translateFormalParameters(ctx.formalParameters());
        CompoundStatement body = translateBlock(ctx.block());
        return node(new MethodDeclaration(
            id, modifiers, voidType(SourceLocation.UNKNOWN), parameters, body, true, loc(ctx)));
    }

    private List<FieldDeclaration> translateFieldDeclaration(
        ApexParser.FieldDeclarationContext ctx,
        List<ApexParser.ModifierContext> modifiers
    ) throws TranslationException {
        List<ApexParser.VariableDeclaratorContext> declarators = ctx.variableDeclarators().variableDeclarator();
        List<FieldDeclaration> fields = new ArrayList<>();
        for (ApexParser.VariableDeclaratorContext declarator : declarators) {
            SourceLocation location = declarators.size() == 1 ? loc(ctx) : loc(declarator);
            fields.add(node(new FieldDeclaration(
                translateId(declarator.id()),
                translateModifiers(modifiers),
                translateTypeRef(ctx.typeRef()),
                translateOptional(declarator.expression(), this::translateExpression),
                location)));
        }
        return fields;
    }

    private PropertyDeclaration translateProperty(ApexParser.PropertyDeclarationContext ctx, List<Modifier> modifiers)
            throws TranslationException {
        List<ApexParser.PropertyBlockContext> getters = new ArrayList<>();
        List<ApexParser.PropertyBlockContext> setters = new ArrayList<>();
        for (ApexParser.PropertyBlockContext block : ctx.propertyBlock()) {
            requireExactlyOne(block, block.getter(), block.setter());
            if (block.getter() != null) {
                getters.add(block);
            } else {
                setters.add(block);
            }
        }
        if (getters.size() > 1) {
            throw new TranslationException(ctx, "There should only be zero or one getter");
        }
        if (setters.size() > 1) {
            throw new TranslationException(ctx, "There should only be zero or one setter");
        }

        TypeRef type = translateTypeRef(ctx.typeRef());
        Identifier id = translateId(ctx.id());
        MethodDeclaration getter = getters.isEmpty() ? null : translateGetter(getters.get(0), ctx.typeRef());
        MethodDeclaration setter = setters.isEmpty() ? null : translateSetter(setters.get(0), ctx.typeRef());
        return node(new PropertyDeclaration(id, modifiers, type, getter, setter, loc(ctx)));
    }

    /**
     * A getter is a parameterless method returning the property type.
     */
    private MethodDeclaration translateGetter(ApexParser.PropertyBlockContext ctx, ApexParser.TypeRefContext type)
            throws TranslationException {
        ApexParser.GetterContext getter = ctx.getter();
        List<Modifier> modifiers = translateModifiers(ctx.modifier());
        Identifier id = node(new Identifier(getter.GET().getText(), loc(getter.GET())));
        TypeRef returnType = translateTypeRef(type);
        CompoundStatement body = translateOptional(getter.block(), this::translateBlock);
        return node(new MethodDeclaration(id, modifiers, returnType, List.of(), body, false, loc(ctx)));
    }

    /**
     * A setter is a void method taking one parameter named {@code value} of the property type.
     */
    private MethodDeclaration translateSetter(ApexParser.PropertyBlockContext ctx, ApexParser.TypeRefContext type)
            throws TranslationException {
        ApexParser.SetterContext setter = ctx.setter();
        List<Modifier> modifiers = translateModifiers(ctx.modifier());
        Identifier id = node(new Identifier(setter.SET().getText(), loc(setter.SET())));
        ParameterDeclaration parameter = node(new ParameterDeclaration(
            node(new Identifier(SETTER_PARAMETER_NAME, SourceLocation.UNKNOWN)),
            List.of(),
            translateTypeRef(type),
            SourceLocation.UNKNOWN));
        CompoundStatement body = translateOptional(setter.block(), this::translateBlock);
        return node(new MethodDeclaration(
            id, modifiers, voidType(SourceLocation.UNKNOWN), List.of(parameter), body, false, loc(ctx)));
    }

    private List<ParameterDeclaration> translateFormalParameters(ApexParser.FormalParametersContext ctx)
            throws TranslationException {
        if (ctx.formalParameterList() == null) {
            return List.of();
        }
        return translateList(ctx.formalParameterList().formalParameter(), this::translateFormalParameter);
    }

    private ParameterDeclaration translateFormalParameter(ApexParser.FormalParameterContext ctx)
            throws TranslationException {
        List<Modifier> modifiers = translateModifiers(ctx.modifier());
        TypeRef type = translateTypeRef(ctx.typeRef());
        Identifier id = translateId(ctx.id());
        return node(new ParameterDeclaration(id, modifiers, type, loc(ctx)));
    }

    // ========================================================================
    // Modifiers
    // ========================================================================

    private List<Modifier> translateModifiers(List<ApexParser.ModifierContext> contexts) throws TranslationException {
        return translateList(contexts, this::translateModifier);
    }

    private Modifier translateModifier(ApexParser.ModifierContext ctx) throws TranslationException {
        if (ctx.annotation() != null) {
            return translateAnnotation(ctx.annotation());
        }
        String text = ctx.getText();
        KeywordModifier.Keyword keyword = KeywordModifier.Keyword.fromString(text);
        if (keyword == null) {
            throw new TranslationException(ctx, "Unexpected modifier keyword: " + text);
        }
        return node(new KeywordModifier(keyword, loc(ctx)));
    }

    private AnnotationModifier translateAnnotation(ApexParser.AnnotationContext ctx) throws TranslationException {
        if (ctx.elementValuePairs() != null && ctx.elementValue() != null) {
            throw new TranslationException(ctx, "At most one value should be present");
        }
        Identifier name = node(new Identifier(ctx.qualifiedName().getText(), loc(ctx.qualifiedName())));
        List<ElementArgument> args = new ArrayList<>();
        if (ctx.elementValuePairs() != null) {
            for (ApexParser.ElementValuePairContext pair : ctx.elementValuePairs().elementValuePair()) {
                args.add(node(new ElementArgument(
                    translateId(pair.id()), translateElementValue(pair.elementValue()), loc(pair))));
            }
        } else if (ctx.elementValue() != null) {
            args.add(node(new ElementArgument(
                null, translateElementValue(ctx.elementValue()), loc(ctx.elementValue()))));
        }
        return node(new AnnotationModifier(name, args, loc(ctx)));
    }

    private ElementValue translateElementValue(ApexParser.ElementValueContext ctx) throws TranslationException {
        requireExactlyOne(ctx, ctx.expression(), ctx.annotation(), ctx.elementValueArrayInitializer());
        if (ctx.expression() != null) {
            return node(new ElementValue.ExpressionValue(translateExpression(ctx.expression()), loc(ctx)));
        } else if (ctx.annotation() != null) {
            return node(new ElementValue.AnnotationValue(translateAnnotation(ctx.annotation()), loc(ctx)));
        }
        List<ElementValue> values =
            translateList(ctx.elementValueArrayInitializer().elementValue(), this::translateElementValue);
        return node(new ElementValue.ArrayValue(values, loc(ctx)));
    }

    // ========================================================================
    // Names and types
    // ========================================================================

    private Identifier translateId(ApexParser.IdContext ctx) {
        return node(new Identifier(ctx.getText(), loc(ctx)));
    }

    private Identifier translateAnyId(ApexParser.AnyIdContext ctx) {
        return node(new Identifier(ctx.getText(), loc(ctx)));
    }

    private TypeRef voidType(SourceLocation location) {
        return node(new TypeRef(List.of(), 0, location));
    }

    private List<TypeRef> translateTypeList(ApexParser.TypeListContext ctx) throws TranslationException {
        return translateList(ctx.typeRef(), this::translateTypeRef);
    }

    private TypeRef translateTypeRef(ApexParser.TypeRefContext ctx) throws TranslationException {
        List<TypeRef.Component> components = new ArrayList<>();
        for (ApexParser.TypeNameContext typeName : ctx.typeName()) {
            Identifier id;
            if (typeName.id() != null) {
                id = translateId(typeName.id());
            } else {
                TerminalNode keyword = typeName.LIST() != null ? typeName.LIST()
                    : typeName.SET() != null ? typeName.SET()
                    : typeName.MAP();
                id = node(new Identifier(keyword.getText(), loc(keyword)));
            }
            List<TypeRef> args = typeName.typeArguments() != null
                ? translateTypeList(typeName.typeArguments().typeList())
                : List.of();
            components.add(new TypeRef.Component(id, args));
        }
        int arrayNesting = ctx.arraySubscripts().LBRACK().size();
        return node(new TypeRef(components, arrayNesting, loc(ctx)));
    }

    /**
     * Builds a type from a dotted name such as {@code System.DmlException}.
     */
    private TypeRef translateQualifiedNameAsType(ApexParser.QualifiedNameContext ctx) {
        List<TypeRef.Component> components = new ArrayList<>();
        for (ApexParser.IdContext id : ctx.id()) {
            components.add(new TypeRef.Component(translateId(id), List.of()));
        }
        return node(new TypeRef(components, 0, loc(ctx)));
    }

    private TypeRef typeRefOf(ApexParser.IdContext ctx) {
        return node(new TypeRef(List.of(new TypeRef.Component(translateId(ctx), List.of())), 0, loc(ctx)));
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private CompoundStatement translateBlock(ApexParser.BlockContext ctx) throws TranslationException {
        List<Statement> statements = translateList(ctx.statement(), this::translateStatement);
        return node(new CompoundStatement(statements, CompoundStatement.Scoping.SCOPE_BOUNDARY, loc(ctx)));
    }

    private Statement translateStatement(ApexParser.StatementContext ctx) throws TranslationException {
        requireExactlyOne(ctx,
            ctx.block(),
            ctx.ifStatement(),
            ctx.switchStatement(),
            ctx.forStatement(),
            ctx.whileStatement(),
            ctx.doWhileStatement(),
            ctx.tryStatement(),
            ctx.returnStatement(),
            ctx.throwStatement(),
            ctx.breakStatement(),
            ctx.continueStatement(),
            ctx.insertStatement(),
            ctx.updateStatement(),
            ctx.deleteStatement(),
            ctx.undeleteStatement(),
            ctx.upsertStatement(),
            ctx.mergeStatement(),
            ctx.runAsStatement(),
            ctx.localVariableDeclarationStatement(),
            ctx.expressionStatement());

        if (ctx.block() != null) {
            return translateBlock(ctx.block());
        } else if (ctx.ifStatement() != null) {
            return translateIfStatement(ctx.ifStatement());
        } else if (ctx.switchStatement() != null) {
            return translateSwitchStatement(ctx.switchStatement());
        } else if (ctx.forStatement() != null) {
            return translateForStatement(ctx.forStatement());
        } else if (ctx.whileStatement() != null) {
            ApexParser.WhileStatementContext loop = ctx.whileStatement();
            return node(new WhileLoopStatement(
                translateExpression(loop.parExpression().expression()),
                translateStatement(loop.statement()),
                loc(loop)));
        } else if (ctx.doWhileStatement() != null) {
            ApexParser.DoWhileStatementContext loop = ctx.doWhileStatement();
            return node(new DoWhileLoopStatement(
                translateBlock(loop.block()),
                translateExpression(loop.parExpression().expression()),
                loc(loop)));
        } else if (ctx.tryStatement() != null) {
            return translateTryStatement(ctx.tryStatement());
        } else if (ctx.returnStatement() != null) {
            ApexParser.ReturnStatementContext ret = ctx.returnStatement();
            return node(new ReturnStatement(translateOptional(ret.expression(), this::translateExpression), loc(ret)));
        } else if (ctx.throwStatement() != null) {
            ApexParser.ThrowStatementContext thr = ctx.throwStatement();
            return node(new ThrowStatement(translateExpression(thr.expression()), loc(thr)));
        } else if (ctx.breakStatement() != null) {
            return node(new BreakStatement(loc(ctx.breakStatement())));
        } else if (ctx.continueStatement() != null) {
            return node(new ContinueStatement(loc(ctx.continueStatement())));
        } else if (ctx.insertStatement() != null) {
            ApexParser.InsertStatementContext dml = ctx.insertStatement();
            return node(new DmlStatement.Insert(
                translateExpression(dml.expression()), translateAccessLevel(dml.accessLevel()), loc(dml)));
        } else if (ctx.updateStatement() != null) {
            ApexParser.UpdateStatementContext dml = ctx.updateStatement();
            return node(new DmlStatement.Update(
                translateExpression(dml.expression()), translateAccessLevel(dml.accessLevel()), loc(dml)));
        } else if (ctx.deleteStatement() != null) {
            ApexParser.DeleteStatementContext dml = ctx.deleteStatement();
            return node(new DmlStatement.Delete(
                translateExpression(dml.expression()), translateAccessLevel(dml.accessLevel()), loc(dml)));
        } else if (ctx.undeleteStatement() != null) {
            ApexParser.UndeleteStatementContext dml = ctx.undeleteStatement();
            return node(new DmlStatement.Undelete(
                translateExpression(dml.expression()), translateAccessLevel(dml.accessLevel()), loc(dml)));
        } else if (ctx.upsertStatement() != null) {
            ApexParser.UpsertStatementContext dml = ctx.upsertStatement();
            Identifier field = dml.qualifiedName() != null
                ? node(new Identifier(dml.qualifiedName().getText(), loc(dml.qualifiedName())))
                : null;
            return node(new DmlStatement.Upsert(
                translateExpression(dml.expression()), field, translateAccessLevel(dml.accessLevel()), loc(dml)));
        } else if (ctx.mergeStatement() != null) {
            ApexParser.MergeStatementContext dml = ctx.mergeStatement();
            return node(new DmlStatement.Merge(
                translateExpression(dml.expression(0)),
                translateExpression(dml.expression(1)),
                translateAccessLevel(dml.accessLevel()),
                loc(dml)));
        } else if (ctx.runAsStatement() != null) {
            ApexParser.RunAsStatementContext runAs = ctx.runAsStatement();
            return node(new RunAsStatement(
                translateOptionalList(runAs.expressionList(), this::translateExpressionList),
                translateBlock(runAs.block()),
                loc(runAs)));
        } else if (ctx.localVariableDeclarationStatement() != null) {
            ApexParser.LocalVariableDeclarationStatementContext decl = ctx.localVariableDeclarationStatement();
            return node(new VariableDeclarationStatement(
                translateLocalVariableDeclaration(decl.localVariableDeclaration()), loc(decl)));
        }
        ApexParser.ExpressionStatementContext stmt = ctx.expressionStatement();
        return node(new ExpressionStatement(translateExpression(stmt.expression()), loc(stmt)));
    }

    private DmlStatement.AccessLevel translateAccessLevel(ApexParser.AccessLevelContext ctx)
            throws TranslationException {
        if (ctx == null) {
            return null;
        }
        requireExactlyOne(ctx, ctx.USER(), ctx.SYSTEM());
        return ctx.USER() != null ? DmlStatement.AccessLevel.USER_MODE : DmlStatement.AccessLevel.SYSTEM_MODE;
    }

    /**
     * Each declarator becomes its own declaration with its own copy of the modifiers and type.
     */
    private List<VariableDeclaration> translateLocalVariableDeclaration(ApexParser.LocalVariableDeclarationContext ctx)
            throws TranslationException {
        List<VariableDeclaration> declarations = new ArrayList<>();
        for (ApexParser.VariableDeclaratorContext declarator : ctx.variableDeclarators().variableDeclarator()) {
            declarations.add(node(new VariableDeclaration(
                translateId(declarator.id()),
                translateModifiers(ctx.modifier()),
                translateTypeRef(ctx.typeRef()),
                translateOptional(declarator.expression(), this::translateExpression),
                loc(declarator))));
        }
        return declarations;
    }

    private IfStatement translateIfStatement(ApexParser.IfStatementContext ctx) throws TranslationException {
        Expression condition = translateExpression(ctx.parExpression().expression());
        Statement thenStatement = translateStatement(ctx.statement(0));
        Statement elseStatement = ctx.statement().size() > 1 ? translateStatement(ctx.statement(1)) : null;
        return node(new IfStatement(condition, thenStatement, elseStatement, loc(ctx)));
    }

    private SwitchStatement translateSwitchStatement(ApexParser.SwitchStatementContext ctx)
            throws TranslationException {
        Expression condition = translateExpression(ctx.expression());
        List<SwitchStatement.When> whenClauses = translateList(ctx.whenControl(), this::translateWhenControl);
        return node(new SwitchStatement(condition, whenClauses, loc(ctx)));
    }

    private SwitchStatement.When translateWhenControl(ApexParser.WhenControlContext ctx) throws TranslationException {
        ApexParser.WhenValueContext value = ctx.whenValue();
        if (value.ELSE() != null) {
            return node(new SwitchStatement.WhenElse(translateBlock(ctx.block()), loc(ctx)));
        }
        if (!value.whenLiteral().isEmpty()) {
            List<Expression> values = translateList(value.whenLiteral(), this::translateWhenLiteral);
            return node(new SwitchStatement.WhenValue(values, translateBlock(ctx.block()), loc(ctx)));
        }
        if (value.id().size() != 2) {
            throw new TranslationException(value, "When type clauses should have 2 identifiers");
        }
        TypeRef type = typeRefOf(value.id(0));
        VariableDeclaration variable = node(new VariableDeclaration(
            translateId(value.id(1)), List.of(), typeRefOf(value.id(0)), null, loc(value)));
        return node(new SwitchStatement.WhenType(type, variable, translateBlock(ctx.block()), loc(ctx)));
    }

    private Expression translateWhenLiteral(ApexParser.WhenLiteralContext ctx) throws TranslationException {
        String sign = ctx.SUB() != null ? "-" : "";
        if (ctx.IntegerLiteral() != null) {
            return node(new LiteralExpression.IntegerVal(parseInteger(ctx, sign + ctx.IntegerLiteral().getText()), loc(ctx)));
        } else if (ctx.LongLiteral() != null) {
            return node(new LiteralExpression.LongVal(parseLong(ctx, sign + ctx.LongLiteral().getText()), loc(ctx)));
        } else if (ctx.StringLiteral() != null) {
            return node(new LiteralExpression.StringVal(stripQuotes(ctx.StringLiteral().getText()), loc(ctx)));
        } else if (ctx.NULL() != null) {
            return node(new LiteralExpression.NullVal(loc(ctx)));
        }
        return node(new VariableExpression(translateId(ctx.id()), loc(ctx)));
    }

    private Statement translateForStatement(ApexParser.ForStatementContext ctx) throws TranslationException {
        ApexParser.ForControlContext control = ctx.forControl();
        if (control.enhancedForControl() != null) {
            ApexParser.EnhancedForControlContext enhanced = control.enhancedForControl();
            VariableDeclaration element = node(new VariableDeclaration(
                translateId(enhanced.id()),
                List.of(),
                translateTypeRef(enhanced.typeRef()),
                null,
                SourceLocation.span(loc(enhanced.typeRef()), loc(enhanced.id()))));
            Expression collection = translateExpression(enhanced.expression());
            return node(new EnhancedForLoopStatement(element, collection, translateStatement(ctx.statement()), loc(ctx)));
        }

        List<VariableDeclaration> declarations = List.of();
        List<Expression> initializations = List.of();
        ApexParser.ForInitContext init = control.forInit();
        if (init != null) {
            requireExactlyOne(init, init.localVariableDeclaration(), init.expressionList());
            if (init.localVariableDeclaration() != null) {
                declarations = translateLocalVariableDeclaration(init.localVariableDeclaration());
            } else {
                initializations = translateExpressionList(init.expressionList());
            }
        }
        Expression condition = translateOptional(control.expression(), this::translateExpression);
        List<Expression> updates = control.forUpdate() != null
            ? translateExpressionList(control.forUpdate().expressionList())
            : List.of();
        Statement body = translateStatement(ctx.statement());
        return node(new ForLoopStatement(declarations, initializations, condition, updates, body, loc(ctx)));
    }

    private TryStatement translateTryStatement(ApexParser.TryStatementContext ctx) throws TranslationException {
        CompoundStatement body = translateBlock(ctx.block());
        List<TryStatement.CatchBlock> catchBlocks = translateList(ctx.catchClause(), this::translateCatchClause);
        CompoundStatement finallyBlock = ctx.finallyBlock() != null ? translateBlock(ctx.finallyBlock().block()) : null;
        return node(new TryStatement(body, catchBlocks, finallyBlock, loc(ctx)));
    }

    private TryStatement.CatchBlock translateCatchClause(ApexParser.CatchClauseContext ctx)
            throws TranslationException {
        List<Modifier> modifiers = translateModifiers(ctx.modifier());
        TypeRef type = translateQualifiedNameAsType(ctx.qualifiedName());
        Identifier id = translateId(ctx.id());
        VariableDeclaration variable = node(new VariableDeclaration(
            id, modifiers, type, null, SourceLocation.span(loc(ctx.qualifiedName()), loc(ctx.id()))));
        return node(new TryStatement.CatchBlock(variable, translateBlock(ctx.block()), loc(ctx)));
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private List<Expression> translateExpressionList(ApexParser.ExpressionListContext ctx)
            throws TranslationException {
        return translateList(ctx.expression(), this::translateExpression);
    }

    private Expression translateExpression(ApexParser.ExpressionContext ctx) throws TranslationException {
        if (ctx instanceof ApexParser.PrimaryExpressionContext primary) {
            return translatePrimary(primary.primary());
        } else if (ctx instanceof ApexParser.DotExpressionContext dot) {
            return translateDotExpression(dot);
        } else if (ctx instanceof ApexParser.ArrayExpressionContext array) {
            return node(new ArrayExpression(
                translateExpression(array.expression(0)), translateExpression(array.expression(1)), loc(ctx)));
        } else if (ctx instanceof ApexParser.MethodCallExpressionContext call) {
            return translateMethodCall(call.methodCall());
        } else if (ctx instanceof ApexParser.NewExpressionContext creation) {
            return node(new NewExpression(translateCreator(creation.creator()), loc(ctx)));
        } else if (ctx instanceof ApexParser.CastExpressionContext cast) {
            TypeRef type = translateTypeRef(cast.typeRef());
            return node(new CastExpression(translateExpression(cast.expression()), type, loc(ctx)));
        } else if (ctx instanceof ApexParser.SubExpressionContext sub) {
            return translateExpression(sub.expression());
        } else if (ctx instanceof ApexParser.PostOpExpressionContext postOp) {
            return unary(ctx, postOp.expression(), postOp.getChild(1).getText(), true);
        } else if (ctx instanceof ApexParser.PreOpExpressionContext preOp) {
            return unary(ctx, preOp.expression(), preOp.getChild(0).getText(), false);
        } else if (ctx instanceof ApexParser.NegExpressionContext neg) {
            return unary(ctx, neg.expression(), neg.getChild(0).getText(), false);
        } else if (ctx instanceof ApexParser.Arth1ExpressionContext arth) {
            return binary(ctx, arth.expression(), arth.getChild(1).getText());
        } else if (ctx instanceof ApexParser.Arth2ExpressionContext arth) {
            return binary(ctx, arth.expression(), arth.getChild(1).getText());
        } else if (ctx instanceof ApexParser.BitExpressionContext bit) {
            String symbol = "<".repeat(bit.LT().size()) + ">".repeat(bit.GT().size());
            return binary(ctx, bit.expression(), symbol);
        } else if (ctx instanceof ApexParser.CmpExpressionContext cmp) {
            String symbol = (cmp.GT() != null ? ">" : "<") + (cmp.ASSIGN() != null ? "=" : "");
            return binary(ctx, cmp.expression(), symbol);
        } else if (ctx instanceof ApexParser.InstanceOfExpressionContext instanceOf) {
            Expression left = translateExpression(instanceOf.expression());
            TypeRef type = translateTypeRef(instanceOf.typeRef());
            Expression right = node(new TypeRefExpression(type, loc(instanceOf.typeRef())));
            return node(new BinaryExpression(left, BinaryExpression.Operator.INSTANCEOF, right, loc(ctx)));
        } else if (ctx instanceof ApexParser.EqualityExpressionContext equality) {
            return binary(ctx, equality.expression(), equality.getChild(1).getText());
        } else if (ctx instanceof ApexParser.BitAndExpressionContext bitAnd) {
            return binary(ctx, bitAnd.expression(), BinaryExpression.Operator.BITWISE_AND);
        } else if (ctx instanceof ApexParser.BitNotExpressionContext bitXor) {
            return binary(ctx, bitXor.expression(), BinaryExpression.Operator.BITWISE_XOR);
        } else if (ctx instanceof ApexParser.BitOrExpressionContext bitOr) {
            return binary(ctx, bitOr.expression(), BinaryExpression.Operator.BITWISE_OR);
        } else if (ctx instanceof ApexParser.LogAndExpressionContext logAnd) {
            return binary(ctx, logAnd.expression(), BinaryExpression.Operator.LOGICAL_AND);
        } else if (ctx instanceof ApexParser.LogOrExpressionContext logOr) {
            return binary(ctx, logOr.expression(), BinaryExpression.Operator.LOGICAL_OR);
        } else if (ctx instanceof ApexParser.CondExpressionContext cond) {
            return node(new TernaryExpression(
                translateExpression(cond.expression(0)),
                translateExpression(cond.expression(1)),
                translateExpression(cond.expression(2)),
                loc(ctx)));
        } else if (ctx instanceof ApexParser.AssignExpressionContext assign) {
            BinaryExpression.Operator preOperation;
            try {
                preOperation = AssignExpression.preOperationFromSymbol(assign.getChild(1).getText());
            } catch (IllegalArgumentException e) {
                throw new TranslationException(ctx, e.getMessage(), e);
            }
            return node(new AssignExpression(
                translateExpression(assign.expression(0)),
                translateExpression(assign.expression(1)),
                preOperation,
                loc(ctx)));
        }
        throw new TranslationException(ctx, "Unexpected expression " + ctx.getClass().getSimpleName());
    }

    private Expression unary(
        ApexParser.ExpressionContext ctx,
        ApexParser.ExpressionContext operand,
        String symbol,
        boolean postfix
    ) throws TranslationException {
        UnaryExpression.Operator op;
        try {
            op = UnaryExpression.Operator.fromSymbol(symbol, postfix);
        } catch (IllegalArgumentException e) {
            throw new TranslationException(ctx, e.getMessage(), e);
        }
        return node(new UnaryExpression(translateExpression(operand), op, loc(ctx)));
    }

    private Expression binary(ApexParser.ExpressionContext ctx, List<ApexParser.ExpressionContext> operands, String symbol)
            throws TranslationException {
        BinaryExpression.Operator op;
        try {
            op = BinaryExpression.Operator.fromSymbol(symbol);
        } catch (IllegalArgumentException e) {
            throw new TranslationException(ctx, e.getMessage(), e);
        }
        return binary(ctx, operands, op);
    }

    private Expression binary(
        ApexParser.ExpressionContext ctx,
        List<ApexParser.ExpressionContext> operands,
        BinaryExpression.Operator op
    ) throws TranslationException {
        if (operands.size() != 2) {
            throw new TranslationException(ctx, "Binary expression should have 2 operands");
        }
        Expression left = translateExpression(operands.get(0));
        Expression right = translateExpression(operands.get(1));
        return node(new BinaryExpression(left, op, right, loc(ctx)));
    }

    private Expression translateDotExpression(ApexParser.DotExpressionContext ctx) throws TranslationException {
        requireExactlyOne(ctx, ctx.dotMethodCall(), ctx.anyId());
        Expression receiver = translateExpression(ctx.expression());
        boolean safe = ctx.QUESTIONDOT() != null;
        if (ctx.dotMethodCall() != null) {
            ApexParser.DotMethodCallContext call = ctx.dotMethodCall();
            Identifier id = translateAnyId(call.anyId());
            List<Expression> args = translateOptionalList(call.expressionList(), this::translateExpressionList);
            return node(new CallExpression(receiver, id, args, safe, loc(ctx)));
        }
        return node(new FieldExpression(receiver, translateAnyId(ctx.anyId()), safe, loc(ctx)));
    }

    /**
     * Unqualified calls, including {@code this(...)} and {@code super(...)}, have no receiver.
     */
    private Expression translateMethodCall(ApexParser.MethodCallContext ctx) throws TranslationException {
        requireExactlyOne(ctx, ctx.id(), ctx.THIS(), ctx.SUPER());
        Identifier id;
        if (ctx.id() != null) {
            id = translateId(ctx.id());
        } else {
            TerminalNode keyword = ctx.THIS() != null ? ctx.THIS() : ctx.SUPER();
            id = node(new Identifier(keyword.getText(), loc(keyword)));
        }
        List<Expression> args = translateOptionalList(ctx.expressionList(), this::translateExpressionList);
        return node(new CallExpression(null, id, args, false, loc(ctx)));
    }

    private Initializer translateCreator(ApexParser.CreatorContext ctx) throws TranslationException {
        requireExactlyOne(ctx,
            ctx.noRest(),
            ctx.classCreatorRest(),
            ctx.arrayCreatorRest(),
            ctx.mapCreatorRest(),
            ctx.setCreatorRest());

        if (ctx.noRest() != null) {
            return node(new ValuesInitializer(List.of(), translateCreatedName(ctx.createdName(), 0), loc(ctx)));
        } else if (ctx.classCreatorRest() != null) {
            List<Expression> args = translateOptionalList(
                ctx.classCreatorRest().arguments().expressionList(), this::translateExpressionList);
            return node(new ConstructorInitializer(args, translateCreatedName(ctx.createdName(), 0), loc(ctx)));
        } else if (ctx.arrayCreatorRest() != null) {
            ApexParser.ArrayCreatorRestContext array = ctx.arrayCreatorRest();
            TypeRef type = translateCreatedName(ctx.createdName(), 1);
            if (array.expression() != null) {
                return node(new SizedArrayInitializer(translateExpression(array.expression()), type, loc(ctx)));
            }
            List<Expression> values = array.arrayInitializer() != null
                ? translateList(array.arrayInitializer().expression(), this::translateExpression)
                : List.of();
            return node(new ValuesInitializer(values, type, loc(ctx)));
        } else if (ctx.mapCreatorRest() != null) {
            List<MapInitializer.Entry> pairs = new ArrayList<>();
            for (ApexParser.MapCreatorRestPairContext pair : ctx.mapCreatorRest().mapCreatorRestPair()) {
                pairs.add(node(new MapInitializer.Entry(
                    translateExpression(pair.expression(0)), translateExpression(pair.expression(1)), loc(pair))));
            }
            return node(new MapInitializer(pairs, translateCreatedName(ctx.createdName(), 0), loc(ctx)));
        }
        List<Expression> values = translateList(ctx.setCreatorRest().expression(), this::translateExpression);
        return node(new ValuesInitializer(values, translateCreatedName(ctx.createdName(), 0), loc(ctx)));
    }

    private TypeRef translateCreatedName(ApexParser.CreatedNameContext ctx, int arrayNesting)
            throws TranslationException {
        List<TypeRef.Component> components = new ArrayList<>();
        for (ApexParser.IdCreatedNamePairContext pair : ctx.idCreatedNamePair()) {
            Identifier id = translateAnyId(pair.anyId());
            List<TypeRef> args = translateOptionalList(pair.typeList(), this::translateTypeList);
            components.add(new TypeRef.Component(id, args));
        }
        return node(new TypeRef(components, arrayNesting, loc(ctx)));
    }

    // ========================================================================
    // Primaries and literals
    // ========================================================================

    private Expression translatePrimary(ApexParser.PrimaryContext ctx) throws TranslationException {
        if (ctx instanceof ApexParser.ThisPrimaryContext) {
            return node(new ThisExpression(loc(ctx)));
        } else if (ctx instanceof ApexParser.SuperPrimaryContext) {
            return node(new SuperExpression(loc(ctx)));
        } else if (ctx instanceof ApexParser.LiteralPrimaryContext literal) {
            return translateLiteral(literal.literal());
        } else if (ctx instanceof ApexParser.TypeRefPrimaryContext typeRef) {
            return node(new TypeRefExpression(translateTypeRef(typeRef.typeRef()), loc(ctx)));
        } else if (ctx instanceof ApexParser.IdPrimaryContext id) {
            Identifier identifier = translateId(id.id());
            return node(new VariableExpression(identifier, identifier.loc()));
        } else if (ctx instanceof ApexParser.SoqlPrimaryContext soql) {
            ApexParser.SoqlLiteralContext query = soql.soqlLiteral();
            return translateQuery(SoqlOrSoslExpression.Kind.SOQL, query, query.SELECT().getSymbol(),
                query.RBRACK().getSymbol(), query.queryBody());
        } else if (ctx instanceof ApexParser.SoslPrimaryContext sosl) {
            ApexParser.SoslLiteralContext query = sosl.soslLiteral();
            return translateQuery(SoqlOrSoslExpression.Kind.SOSL, query, query.FIND().getSymbol(),
                query.RBRACK().getSymbol(), query.queryBody());
        }
        throw new TranslationException(ctx, "Unexpected primary " + ctx.getClass().getSimpleName());
    }

    /**
     * The query text runs from the leading keyword to just before the closing bracket.
     */
    private Expression translateQuery(
        SoqlOrSoslExpression.Kind kind,
        ParserRuleContext ctx,
        Token keyword,
        Token closingBracket,
        ApexParser.QueryBodyContext body
    ) throws TranslationException {
        String query = keyword.getInputStream()
            .getText(Interval.of(keyword.getStartIndex(), closingBracket.getStartIndex() - 1));
        List<Expression> bindings = new ArrayList<>();
        collectBindings(body.queryElement(), bindings);
        return node(new SoqlOrSoslExpression(kind, query, bindings, loc(ctx)));
    }

    private void collectBindings(List<ApexParser.QueryElementContext> elements, List<Expression> out)
            throws TranslationException {
        for (ApexParser.QueryElementContext element : elements) {
            if (element.boundExpression() != null) {
                out.add(translateExpression(element.boundExpression().expression()));
            } else {
                collectBindings(element.queryElement(), out);
            }
        }
    }

    private LiteralExpression translateLiteral(ApexParser.LiteralContext ctx) throws TranslationException {
        String text = ctx.getText();
        if (ctx.IntegerLiteral() != null) {
            return node(new LiteralExpression.IntegerVal(parseInteger(ctx, text), loc(ctx)));
        } else if (ctx.LongLiteral() != null) {
            return node(new LiteralExpression.LongVal(parseLong(ctx, text), loc(ctx)));
        } else if (ctx.NumberLiteral() != null) {
            try {
                return node(new LiteralExpression.DoubleVal(
                    Double.parseDouble(text.replaceFirst("[dD]$", "")), loc(ctx)));
            } catch (NumberFormatException e) {
                throw literalFormatError(ctx, text, e);
            }
        } else if (ctx.StringLiteral() != null) {
            return node(new LiteralExpression.StringVal(stripQuotes(text), loc(ctx)));
        } else if (ctx.BooleanLiteral() != null) {
            return node(new LiteralExpression.BooleanVal(Boolean.parseBoolean(text), loc(ctx)));
        } else if (ctx.NULL() != null) {
            return node(new LiteralExpression.NullVal(loc(ctx)));
        }
        throw new TranslationException(ctx, "Unexpected literal " + text);
    }

    private static int parseInteger(ParserRuleContext ctx, String text) throws TranslationException {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw literalFormatError(ctx, text, e);
        }
    }

    private static long parseLong(ParserRuleContext ctx, String text) throws TranslationException {
        try {
            return Long.parseLong(text.replaceFirst("[lL]$", ""));
        } catch (NumberFormatException e) {
            throw literalFormatError(ctx, text, e);
        }
    }

    private static TranslationException literalFormatError(ParserRuleContext ctx, String text, NumberFormatException e) {
        return new TranslationException(ctx, "Literal '" + text + "' format is incorrect", e);
    }

    private static String stripQuotes(String text) {
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
