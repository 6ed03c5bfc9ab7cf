package com.forcetree.translation;

import com.forcetree.CompilationType;
import com.forcetree.ForceTree;
import com.forcetree.ast.CompilationUnit;
import com.forcetree.ast.TriggerDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TriggerTest {

    @Test
    void testTriggerDeclaration() throws Exception {
        CompilationUnit unit = ForceTree.parseAndTranslate(
            "trigger MyTrigger on MyObject(before update, after delete) { }", CompilationType.TRIGGER);
        TriggerDeclaration trigger = assertInstanceOf(TriggerDeclaration.class, unit.typeDeclaration());

        assertEquals("MyTrigger", trigger.id().string());
        assertEquals("MyObject", trigger.target().string());
        assertEquals(List.of(TriggerDeclaration.TriggerCase.BEFORE_UPDATE, TriggerDeclaration.TriggerCase.AFTER_DELETE),
            trigger.cases());
        assertTrue(trigger.modifiers().isEmpty());
        assertTrue(trigger.body().statements().isEmpty());
    }

    @Test
    void testTriggerBody() throws Exception {
        CompilationUnit unit = ForceTree.parseAndTranslate("""
            trigger AccountTrigger on Account (before insert, before update, after undelete) {
                for (Account a : Trigger.new) {
                    a.Name = a.Name.trim();
                }
            }
            """, CompilationType.TRIGGER);
        TriggerDeclaration trigger = (TriggerDeclaration) unit.typeDeclaration();
        assertEquals(3, trigger.cases().size());
        assertEquals(TriggerDeclaration.TriggerCase.AFTER_UNDELETE, trigger.cases().get(2));
        assertEquals(1, trigger.body().statements().size());
    }

    @Test
    void testTriggerCaseLookup() {
        assertEquals(TriggerDeclaration.TriggerCase.BEFORE_INSERT, TriggerDeclaration.TriggerCase.of("Before", "INSERT"));
    }
}
