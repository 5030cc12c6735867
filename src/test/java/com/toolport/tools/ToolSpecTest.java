package com.toolport.tools;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolSpecTest {

    static class Instance {
        @Tool(description = "Say hi")
        public String sayHello() {
            return "hi";
        }

        @Tool(name = "CustomName", description = "Named explicitly", returns = "Nothing much")
        public String other() {
            return "";
        }

        public String notATool() {
            return "";
        }

        @Tool(description = "Static helper")
        public static String helper() {
            return "";
        }
    }

    @Test
    void defaultsNameToPascalCase() {
        assertEquals("SayHello", ToolSpec.of(new Instance(), "sayHello").name());
        assertEquals("ListEmails", ToolSpec.pascalCase("list_emails"));
        assertEquals("Add", ToolSpec.pascalCase("add"));
    }

    @Test
    void readsToolAnnotation() {
        var spec = ToolSpec.of(new Instance(), "other");
        assertEquals("CustomName", spec.name());
        assertEquals("Named explicitly", spec.description());
        assertEquals("Nothing much", spec.returns());
        assertNull(spec.authRequirement());
        assertEquals(Instance.class, spec.declaringClass());
    }

    @Test
    void scansInstanceMethods() {
        var names = ToolSpec.scan(new Instance()).stream().map(ToolSpec::name).toList();
        assertEquals(List.of("CustomName", "SayHello"), names);
    }

    @Test
    void scansStaticMethodsOfAClass() {
        var specs = ToolSpec.scan(Instance.class);
        assertEquals(1, specs.size());
        assertEquals("Helper", specs.get(0).name());
        assertNull(specs.get(0).target());
    }

    @Test
    void instanceMethodNeedsATarget() throws Exception {
        var method = Instance.class.getMethod("sayHello");
        assertThrows(IllegalArgumentException.class, () -> ToolSpec.of(null, method));
        assertThrows(IllegalArgumentException.class, () -> ToolSpec.of("wrong", method));
    }

    @Test
    void toolkitTakesDefaultVersion() {
        var kit = Toolkit.scan("Kit", null, new Instance());
        assertEquals(Toolkit.DEFAULT_VERSION, kit.version());
        assertEquals(2, kit.tools().size());
        assertThrows(IllegalArgumentException.class, () -> new Toolkit(" ", "1", null, List.of()));
    }
}
