package com.goerdes.symbelf.components;

import com.goerdes.symbelf.components.tools.BinaryTools;
import com.goerdes.symbelf.config.SymbElfProperties;
import com.goerdes.symbelf.model.Binary;
import com.goerdes.symbelf.model.CSymbol;
import com.goerdes.symbelf.model.CppSymbol;
import com.goerdes.symbelf.utils.CannedToolRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.goerdes.symbelf.utils.CannedToolRunner.SIZE;
import static org.junit.jupiter.api.Assertions.*;

class BinaryFactoryTest {

    @TempDir
    Path tmp;

    private final SymbElfProperties properties = new SymbElfProperties();
    private final WarningRegistry registry = new WarningRegistry();
    private String demo;

    @BeforeEach
    void setUp() throws IOException {
        demo = Files.createFile(tmp.resolve("demo")).toString();
    }

    private Binary create(CannedToolRunner runner) {
        BinaryFactory factory = factory(runner);
        return factory.create(demo, factory.getSelectionFilter(), registry);
    }

    private BinaryFactory factory(CannedToolRunner runner) {
        return new BinaryFactory(new BinaryTools(runner, properties), properties);
    }

    @Test
    void createsCppSymbolsByDefault() {
        Binary binary = create(CannedToolRunner.demoBinary());

        assertEquals(6, binary.getSymbols().size());
        assertInstanceOf(CppSymbol.class, binary.getSymbols().get("_Z3foov"));
    }

    @Test
    void languageSettingSelectsSymbolVariant() {
        properties.setLanguage("c");

        Binary binary = create(CannedToolRunner.demoBinary());

        assertInstanceOf(CSymbol.class, binary.getSymbols().get("main"));
    }

    @Test
    void unknownLanguageFailsAtStartup() {
        properties.setLanguage("fortran");

        assertThrows(IllegalArgumentException.class, () -> factory(CannedToolRunner.demoBinary()));
    }

    @Test
    void configuredPatternsSelectSymbols() {
        properties.setSymbolSelectionRegex("ns::|foo");
        properties.setSymbolExclusionRegex("ns::Timer");

        Binary binary = create(CannedToolRunner.demoBinary());

        assertEquals(List.of("_Z3foov", "_ZN2ns7Counter9incrementEv"), List.copyOf(binary.getSymbols().keySet()));
        assertEquals(4, binary.getNumSymbolsDropped());
    }

    @Test
    void manglingFileIsApplied() throws IOException {
        Path manglingFile = Files.write(tmp.resolve("mangling.txt"), List.of("_Z3bari", "bar(int)"));
        properties.setManglingFile(manglingFile.toString());

        Binary binary = create(CannedToolRunner.demoBinary().with(SIZE, ""));

        assertFalse(binary.isToolsReliable());
        assertEquals("bar(int)", binary.getSymbols().get("_Z3bari").getDisplayName());
        assertEquals("_Z3foov", binary.getSymbols().get("_Z3foov").getDisplayName());
    }

    @Test
    void warningsGoToTheGivenRegistry() {
        BinaryFactory factory = factory(CannedToolRunner.demoBinary().with(SIZE, ""));
        WarningRegistry other = new WarningRegistry();

        factory.create(demo, factory.getSelectionFilter(), other);

        assertTrue(other.hasWarnings());
        assertFalse(registry.hasWarnings());
    }

    @Test
    void perCallFilterReplacesConfiguredOne() {
        properties.setSymbolExclusionRegex("main");
        BinaryFactory factory = factory(CannedToolRunner.demoBinary());

        Binary binary = factory.create(demo, SymbolSelectionFilter.acceptAll(), registry);

        assertTrue(binary.getSymbols().containsKey("main"));
        assertFalse(factory.getSelectionFilter().isSelected("main"));
    }
}
