package com.toolport.catalog;

import com.toolport.errors.ToolDefinitionException;
import com.toolport.errors.ToolNotFoundException;
import com.toolport.schema.AuthRequirement;
import com.toolport.tools.Param;
import com.toolport.tools.RequiresAuth;
import com.toolport.tools.Tool;
import com.toolport.tools.ToolContext;
import com.toolport.tools.ToolSpec;
import com.toolport.tools.Toolkit;
import com.toolport.toolkits.math.MathTools;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ToolCatalogTest {

    static class Fixtures {

        @Tool(description = "Echo the text back")
        public String echo(@Param("Text to echo") String text) {
            return text;
        }

        @Tool
        public String undocumented(@Param("Text") String text) {
            return text;
        }

        @Tool(description = "List recent emails")
        @RequiresAuth(provider = "google", scopes = "https://www.googleapis.com/auth/gmail.readonly")
        public List<String> listEmails(@Param("How many") int max, ToolContext context) {
            return List.of();
        }
    }

    private final Fixtures fixtures = new Fixtures();

    @Test
    void registersToolkit() {
        var catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());

        assertEquals(7, catalog.size());
        var add = catalog.get("Add");
        assertEquals("0.1.0", add.version());
        assertEquals("Math", add.definition().toolkit());
        assertEquals("Math", add.meta().module());
        assertEquals(MathTools.class.getName(), add.meta().source());
        assertTrue(catalog.contains("SqrtAsync"));
    }

    @Test
    void acceptsQualifiedNames() {
        var catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());

        assertSame(catalog.get("Add"), catalog.get("Math.Add"));
        assertFalse(catalog.contains("Other.Add"));
    }

    @Test
    void listsSummariesWithEndpoints() {
        var catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());

        assertThat(catalog.list())
                .extracting(ToolSummary::endpoint)
                .contains("/tool/Math/Add", "/tool/Math/Divide");
        assertThat(catalog.list()).allMatch(s -> "0.1.0".equals(s.version()));
    }

    @Test
    void defaultsToolkitAndVersion() {
        var catalog = new ToolCatalog();
        var tool = catalog.addTool(ToolSpec.of(fixtures, "echo"));

        assertEquals("Echo", tool.name());
        assertEquals(ToolCatalog.DEFAULT_TOOLKIT, tool.definition().toolkit());
        assertEquals(Toolkit.DEFAULT_VERSION, tool.version());
    }

    @Test
    void sameKeyFromSameToolkitOverwrites() {
        var clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        var catalog = new ToolCatalog(clock);
        var first = catalog.addTool(ToolSpec.of(fixtures, "echo"), "Kit");
        var second = catalog.addTool(ToolSpec.builder(fixtures, first.method())
                .description("Echo, improved")
                .build(), "Kit");

        assertEquals(1, catalog.size());
        assertSame(second, catalog.get("Echo"));
        assertEquals("Echo, improved", catalog.get("Echo").definition().description());
        assertEquals(first.meta().dateAdded(), second.meta().dateAdded());
    }

    @Test
    void sameKeyFromAnotherToolkitIsAnError() {
        var catalog = new ToolCatalog();
        catalog.addTool(ToolSpec.of(fixtures, "echo"), "KitA");

        var e = assertThrows(ToolDefinitionException.class,
                () -> catalog.addTool(ToolSpec.of(fixtures, "echo"), "KitB"));
        assertTrue(e.getMessage().contains("KitA"));
    }

    @Test
    void resolvesUnversionedLookups() {
        var catalog = new ToolCatalog();
        catalog.addToolkit(new Toolkit("Kit", "1.0", null, List.of(ToolSpec.of(fixtures, "echo"))));
        catalog.addToolkit(new Toolkit("Kit", "2.0", null, List.of(ToolSpec.of(fixtures, "echo"))));

        assertEquals("2.0", catalog.get("Echo").version());
        assertEquals("1.0", catalog.get("Echo", "1.0").version());

        catalog.addTool(ToolSpec.of(fixtures, "echo"), "Kit");
        assertEquals(Toolkit.DEFAULT_VERSION, catalog.get("Echo").version());
        assertEquals(3, catalog.size());
    }

    @Test
    void unknownToolsAreNotFound() {
        var catalog = new ToolCatalog();
        catalog.addTool(ToolSpec.of(fixtures, "echo"));

        assertTrue(catalog.find("Nope", null).isEmpty());
        assertThrows(ToolNotFoundException.class, () -> catalog.get("Echo", "9.9"));
    }

    @Test
    void missingDescriptionIsAnError() {
        var catalog = new ToolCatalog();
        var e = assertThrows(ToolDefinitionException.class,
                () -> catalog.addTool(ToolSpec.of(fixtures, "undocumented")));
        assertEquals("Tool Undocumented is missing a description", e.getMessage());
        assertEquals(0, catalog.size());
    }

    @Test
    void builderOverridesName() {
        var catalog = new ToolCatalog();
        var spec = ToolSpec.builder(fixtures, ToolSpec.of(fixtures, "echo").method())
                .name("Parrot")
                .build();
        catalog.addTool(spec);
        assertTrue(catalog.contains("Parrot"));
        assertFalse(catalog.contains("Echo"));
    }

    @Test
    void carriesAuthRequirement() {
        var catalog = new ToolCatalog();
        var tool = catalog.addTool(ToolSpec.of(fixtures, "listEmails"));

        var auth = tool.definition().authRequirement();
        assertEquals("google", auth.providerId());
        assertEquals(AuthRequirement.OAUTH2, auth.providerType());
        assertEquals(List.of("https://www.googleapis.com/auth/gmail.readonly"), auth.scopes());
        assertEquals(1, tool.definition().inputs().parameters().size());
        assertEquals(1, catalog.definitions().size());
    }

    @Test
    void iteratesOverRegisteredTools() {
        var catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());

        var count = 0;
        for (var tool : catalog) {
            assertNotNull(tool.definition());
            count++;
        }
        assertEquals(catalog.size(), count);
    }
}
