package com.goerdes.symbelf.components;

import com.goerdes.symbelf.model.DemangledName;
import com.goerdes.symbelf.model.Mangling;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DemanglingResolverTest {

    private final Mangling mangling = new Mangling(Map.of("_Z3foov", "foo()"));

    @Test
    void manglingEntryWinsOverTools() {
        DemanglingResolver resolver = new DemanglingResolver(mangling, true);

        assertEquals(new DemangledName("foo()", true), resolver.resolve("_Z3foov", "something else"));
    }

    @Test
    void manglingEntryIsUsedWithUnreliableTools() {
        DemanglingResolver resolver = new DemanglingResolver(mangling, false);

        assertEquals(new DemangledName("foo()", true), resolver.resolve("_Z3foov", "_Z3foov"));
    }

    @Test
    void reliableToolsProvideTheName() {
        DemanglingResolver resolver = new DemanglingResolver(mangling, true);

        assertEquals(new DemangledName("bar(int)", true), resolver.resolve("_Z3bari", "bar(int)"));
    }

    @Test
    void unreliableToolsKeepTheMangledName() {
        DemanglingResolver resolver = new DemanglingResolver(Mangling.none(), false);

        assertEquals(new DemangledName("_Z3bari", false), resolver.resolve("_Z3bari", "bar(int)"));
    }
}
