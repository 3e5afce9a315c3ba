package com.caura.txmapper.registry;

import com.caura.txmapper.TestFixtures;
import com.caura.txmapper.exception.RegistryFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ClientRegistry Unit Tests")
class ClientRegistryTest {

    private static final String ONE_CLIENT = """
            {"clients": [{"caura_id": "CL1", "personal_info": {"given_name": "Ada", "family_name": "King", "emails": ["ada@example.com"]}}]}
            """;

    private static final String TWO_CLIENTS = """
            {"clients": [
                {"caura_id": "CL1", "personal_info": {"given_name": "Ada", "family_name": "King", "emails": ["ada@example.com"]}},
                {"caura_id": "CL2", "personal_info": {"given_name": "Bo", "family_name": "Lin", "emails": ["bo@example.com"]}}
            ]}
            """;

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load once and cache the snapshot")
    void shouldCacheSnapshot() {
        // Given
        ClientRegistry registry = TestFixtures.testRegistry();

        // When
        RegistrySnapshot first = registry.load();
        RegistrySnapshot second = registry.load();

        // Then
        assertThat(second).isSameAs(first);
        assertThat(registry.findByEmail("a@x.com")).contains("CL00001");
        assertThat(registry.getClient("CL00005")).isPresent();
    }

    @Test
    @DisplayName("Should publish a fresh snapshot on reload")
    void shouldPublishFreshSnapshotOnReload() throws IOException {
        // Given
        Path file = tempDir.resolve("clients.json");
        Files.writeString(file, ONE_CLIENT);
        ClientRegistry registry = new ClientRegistry(TestFixtures.loader(), new FileSystemResource(file));
        RegistrySnapshot before = registry.load();
        Files.writeString(file, TWO_CLIENTS);

        // When
        RegistrySnapshot after = registry.reload();

        // Then
        assertThat(after).isNotSameAs(before);
        assertThat(registry.load()).isSameAs(after);
        assertThat(registry.findByEmail("bo@example.com")).contains("CL2");
        // A holder of the old snapshot keeps a consistent view
        assertThat(before.size()).isEqualTo(1);
        assertThat(before.findByEmail("bo@example.com")).isEmpty();
    }

    @Test
    @DisplayName("Should keep the previous snapshot when a reload fails")
    void shouldKeepPreviousSnapshotWhenReloadFails() throws IOException {
        // Given
        Path file = tempDir.resolve("clients.json");
        Files.writeString(file, ONE_CLIENT);
        ClientRegistry registry = new ClientRegistry(TestFixtures.loader(), new FileSystemResource(file));
        RegistrySnapshot before = registry.load();
        Files.writeString(file, "{\"clients\": 42}");

        // When/Then
        assertThatThrownBy(registry::reload).isInstanceOf(RegistryFormatException.class);
        assertThat(registry.load()).isSameAs(before);
        assertThat(registry.findByEmail("ada@example.com")).contains("CL1");
    }

    @Test
    @DisplayName("Should not publish anything when the first load fails")
    void shouldNotPublishPartialRegistry() throws IOException {
        // Given
        Path file = tempDir.resolve("clients.json");
        Files.writeString(file, "{\"clients\": [{\"caura_id\": \"CL1\"}, {\"caura_id\": \"CL1\"}]}");
        ClientRegistry registry = new ClientRegistry(TestFixtures.loader(), new FileSystemResource(file));

        // When/Then
        assertThatThrownBy(registry::load).isInstanceOf(RegistryFormatException.class);

        // A corrected file loads on the next attempt
        Files.writeString(file, ONE_CLIENT);
        assertThat(registry.load().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should answer lookups from the active snapshot")
    void shouldDelegateLookupsToActiveSnapshot() {
        // Given
        ClientRegistry registry = TestFixtures.testRegistry();

        // When/Then
        assertThat(registry.findByName("Robert Brown")).containsExactly("CL00002");
        assertThat(registry.findByPlatformIdentifier("shiftcare", "SC-2002")).contains("CL00002");
        assertThat(registry.findByAddress("PAYMENT 12 Smith Street Parkville", 0.80))
                .hasValueSatisfying(match -> assertThat(match.clientId()).isEqualTo("CL00001"));
        assertThat(registry.getClient("CL99999")).isEmpty();
    }
}
