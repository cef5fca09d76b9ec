package com.goerdes.symbelf;

import com.goerdes.symbelf.components.BinaryFactory;
import com.goerdes.symbelf.config.SymbElfProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SymbElfApplicationTest {

    @Autowired
    private SymbElfProperties properties;

    @Autowired
    private BinaryFactory binaryFactory;

    @Test
    void contextLoads() {
        assertEquals("objdump", properties.getTools().getObjdump());
        assertEquals("cpp", properties.getLanguage());
        assertTrue(binaryFactory.getSelectionFilter().isSelected("main"));
    }
}
