package com.goerdes.symbelf.components.tools;

import com.goerdes.symbelf.config.SymbElfProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.*;

class BinaryToolsTest {

    private final ToolRunner runner = mock(ToolRunner.class);
    private final SymbElfProperties properties = new SymbElfProperties();
    private BinaryTools tools;

    @BeforeEach
    void setUp() {
        properties.getTools().setObjdump("arm-none-eabi-objdump");
        properties.getTools().setNm("arm-none-eabi-nm");
        properties.getTools().setReadelf("arm-none-eabi-readelf");
        properties.getTools().setSize("arm-none-eabi-size");
        tools = new BinaryTools(runner, properties);
    }

    @Test
    void usesConfiguredExecutables() {
        when(runner.run(anyString(), anyList())).thenReturn("output");

        assertEquals("output", tools.archiveHeaders("fw.elf"));
        tools.sizeSummary("fw.elf");
        tools.disassembly("fw.elf");
        tools.debugInfo("fw.elf");

        verify(runner).run("arm-none-eabi-objdump", List.of("-a", "fw.elf"));
        verify(runner).run("arm-none-eabi-size", List.of("fw.elf"));
        verify(runner).run("arm-none-eabi-objdump", List.of("-drwS", "fw.elf"));
        verify(runner).run("arm-none-eabi-readelf", List.of("--debug-dump=info", "fw.elf"));
    }

    @Test
    void symbolListingDemanglesOnRequest() {
        tools.symbolListing("fw.elf", false);
        tools.symbolListing("fw.elf", true);

        verify(runner).run("arm-none-eabi-nm", List.of("--print-size", "--size-sort", "--radix=d", "fw.elf"));
        verify(runner).run("arm-none-eabi-nm", List.of("--print-size", "--size-sort", "--radix=d", "-C", "fw.elf"));
    }
}
