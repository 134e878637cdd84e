package com.memberassist.orchestrator.service.catalog;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolCatalogTest {

    @Test
    void looksUpToolsByNameAndKeepsDeclarationOrder() {
        ToolCatalog catalog = new ToolCatalog(List.of(tool("IBTAgent"), tool("ClaimsAgent")));

        assertThat(catalog.lookup("ClaimsAgent")).map(ToolDefinition::name).contains("ClaimsAgent");
        assertThat(catalog.lookup("PharmacyAgent")).isEmpty();
        assertThat(catalog.lookup(null)).isEmpty();
        assertThat(catalog.names()).containsExactly("IBTAgent", "ClaimsAgent");
        assertThat(catalog.capabilities()).containsEntry("IBTAgent", List.of("benefits"));
        assertThat(catalog.contains("IBTAgent")).isTrue();
        assertThat(catalog.size()).isEqualTo(2);
    }

    @Test
    void exposesNoMutation() {
        List<ToolDefinition> source = new ArrayList<>(List.of(tool("IBTAgent")));
        ToolCatalog catalog = new ToolCatalog(source);
        source.add(tool("ClaimsAgent"));

        assertThat(catalog.size()).isEqualTo(1);
        assertThatThrownBy(() -> catalog.all().add(tool("SupportAgent")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsDuplicateNames() {
        assertThatThrownBy(() -> new ToolCatalog(List.of(tool("IBTAgent"), tool("IBTAgent"))))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("Duplicate tool name 'IBTAgent' at index 1");
    }

    @Test
    void rejectsMissingRequiredFields() {
        ToolDefinition noDescription = new ToolDefinition("IBTAgent", " ", URI.create("http://tools.test/ibt"),
                List.of("benefits"), new ToolParameters(List.of(), List.of()), List.of());
        ToolDefinition noEndpoint = new ToolDefinition("IBTAgent", "Benefits", null,
                List.of("benefits"), new ToolParameters(List.of(), List.of()), List.of());
        ToolDefinition noCapabilities = new ToolDefinition("IBTAgent", "Benefits", URI.create("http://tools.test/ibt"),
                List.of(), new ToolParameters(List.of(), List.of()), List.of());

        assertThatThrownBy(() -> new ToolCatalog(List.of(noDescription)))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("description");
        assertThatThrownBy(() -> new ToolCatalog(List.of(noEndpoint)))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("endpoint");
        assertThatThrownBy(() -> new ToolCatalog(List.of(noCapabilities)))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("capabilities");
    }

    @Test
    void rejectsNonHttpEndpoints() {
        ToolDefinition ftp = new ToolDefinition("IBTAgent", "Benefits", URI.create("ftp://tools.test/ibt"),
                List.of("benefits"), new ToolParameters(List.of(), List.of()), List.of());

        assertThatThrownBy(() -> new ToolCatalog(List.of(ftp)))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("http or https");
    }

    @Test
    void rejectsMalformedParameterLists() {
        ToolDefinition overlapping = new ToolDefinition("ClaimsAgent", "Claims", URI.create("http://tools.test/claims"),
                List.of("claims"), new ToolParameters(List.of("claim_id"), List.of("claim_id")), List.of());

        assertThatThrownBy(() -> new ToolCatalog(List.of(overlapping)))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("claim_id");
    }

    @Test
    void reservesSentinelNames() {
        assertThatThrownBy(() -> new ToolCatalog(List.of(tool("NO_TOOL"))))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("reserved");
    }

    private static ToolDefinition tool(String name) {
        return new ToolDefinition(name, name + " description", URI.create("http://tools.test/" + name),
                List.of("benefits"), new ToolParameters(List.of(), List.of()), List.of());
    }
}
