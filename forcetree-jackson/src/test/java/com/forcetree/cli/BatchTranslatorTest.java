package com.forcetree.cli;

import com.forcetree.json.AstJsonProvider;
import com.forcetree.ast.CompilationUnit;
import com.forcetree.ast.TriggerDeclaration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BatchTranslatorTest {

    private static final String SERVICE = """
        public class Service {
            public Integer count(List<Account> accounts) { return accounts.size(); }
        }
        """;

    private static final String TRIGGER = """
        trigger AccountTrigger on Account (before insert) {
            for (Account a : Trigger.new) { a.Name = a.Name.trim(); }
        }
        """;

    @Test
    void testConfigFlags() {
        BatchTranslator.Config config = BatchTranslator.Config.parse(
            new String[]{"--json", "--compact", "--threads=3", "-v", "src/classes", "Foo.cls"});
        assertNotNull(config);
        assertTrue(config.json());
        assertTrue(config.compact());
        assertTrue(config.verbose());
        assertEquals(3, config.threads());
        assertEquals(List.of(Path.of("src/classes"), Path.of("Foo.cls")), config.inputs());
    }

    @Test
    void testConfigDefaults() {
        BatchTranslator.Config config = BatchTranslator.Config.parse(new String[]{"Foo.cls"});
        assertNotNull(config);
        assertFalse(config.json());
        assertFalse(config.compact());
        assertFalse(config.verbose());
        assertTrue(config.threads() >= 1);
    }

    @Test
    void testConfigRejectsBadArguments() {
        assertNull(BatchTranslator.Config.parse(new String[]{"--help"}));
        assertNull(BatchTranslator.Config.parse(new String[]{"--json"}));
        assertNull(BatchTranslator.Config.parse(new String[]{"--frobnicate", "Foo.cls"}));
        assertNull(BatchTranslator.Config.parse(new String[]{"--threads=zero", "Foo.cls"}));
        assertNull(BatchTranslator.Config.parse(new String[]{"--threads=0", "Foo.cls"}));
    }

    @Test
    void testTranslatesDirectoryAndWritesJson(@TempDir Path dir) throws Exception {
        Path classes = Files.createDirectories(dir.resolve("classes"));
        Path triggers = Files.createDirectories(dir.resolve("triggers"));
        Files.writeString(classes.resolve("Service.cls"), SERVICE);
        Files.writeString(classes.resolve("README.md"), "not apex");
        Files.writeString(triggers.resolve("AccountTrigger.trigger"), TRIGGER);

        BatchTranslator translator = new BatchTranslator(
            BatchTranslator.Config.parse(new String[]{"--json", "--threads=2", dir.toString()}));

        assertEquals(0, translator.run());
        assertEquals(2, translator.getTotalFiles());
        assertEquals(2, translator.getTranslatedFiles());
        assertEquals(0, translator.getFailedFiles());
        assertEquals(List.of("Service"), translator.getSymbolTable().classNames());

        Path json = triggers.resolve("AccountTrigger.trigger" + BatchTranslator.JSON_SUFFIX);
        assertTrue(Files.exists(json));
        assertTrue(Files.exists(classes.resolve("Service.cls.json")));
        assertFalse(Files.exists(classes.resolve("README.md.json")));

        CompilationUnit unit = AstJsonProvider.getProvider().getDeserializer()
            .deserializeCompilationUnit(Files.readString(json));
        TriggerDeclaration trigger = assertInstanceOf(TriggerDeclaration.class, unit.typeDeclaration());
        assertEquals("Account", trigger.target().string());
        assertFalse(unit.typeDeclaration().loc().isUnknown());
    }

    @Test
    void testCompactJsonHasNoLocations(@TempDir Path dir) throws Exception {
        Path source = Files.writeString(dir.resolve("Service.cls"), SERVICE);

        BatchTranslator translator = new BatchTranslator(
            BatchTranslator.Config.parse(new String[]{"--json", "--compact", source.toString()}));

        assertEquals(0, translator.run());
        String json = Files.readString(dir.resolve("Service.cls.json"));
        assertTrue(json.contains("\"@type\" : \"ClassDeclaration\""));
        assertFalse(json.contains("\"loc\""));
    }

    @Test
    void testFailuresAreCountedAndReported(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("Service.cls"), SERVICE);
        Files.writeString(dir.resolve("Broken.cls"), "public class Broken { void m( { }");
        Files.writeString(dir.resolve("Duplicate.cls"), SERVICE);

        BatchTranslator translator = new BatchTranslator(
            BatchTranslator.Config.parse(new String[]{"--threads=1", dir.toString()}));

        assertEquals(1, translator.run());
        assertEquals(3, translator.getTotalFiles());
        assertEquals(2, translator.getTranslatedFiles());
        // one parse failure plus the duplicate class name rejected during resolution
        assertEquals(2, translator.getFailedFiles());
        assertNull(translator.getSymbolTable());
        assertFalse(Files.exists(dir.resolve("Service.cls.json")));
    }

    @Test
    void testMissingInputIsSkipped(@TempDir Path dir) throws Exception {
        BatchTranslator translator = new BatchTranslator(
            BatchTranslator.Config.parse(new String[]{dir.resolve("nope").toString()}));

        assertEquals(0, translator.run());
        assertEquals(0, translator.getTotalFiles());
        assertEquals(0, translator.getSymbolTable().size());
    }

    @Test
    void testWorkerThreadsStopWhenRunFinishes(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("Service.cls"), SERVICE);
        Files.writeString(dir.resolve("Broken.cls"), "public class Broken {");
        Files.writeString(dir.resolve("AccountTrigger.trigger"), TRIGGER);

        BatchTranslator translator = new BatchTranslator(
            BatchTranslator.Config.parse(new String[]{"--threads=2", dir.toString()}));
        assertEquals(1, translator.run());

        for (Thread thread : workerThreads()) {
            thread.join(2000);
            assertFalse(thread.isAlive(), thread.getName() + " is still running");
        }
    }

    private static List<Thread> workerThreads() {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(thread -> thread.getName().startsWith(BatchTranslator.WORKER_THREAD_PREFIX))
            .collect(Collectors.toList());
    }
}
