package com.caura.txmapper;

import com.caura.txmapper.config.MatchingProperties;
import com.caura.txmapper.domain.Transaction;
import com.caura.txmapper.registry.ClientRegistry;
import com.caura.txmapper.registry.ClientRegistryLoader;
import com.caura.txmapper.registry.RegistrySnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Shared test data: the five-client test registry and transaction builders.
 * <p>
 * Registry clients: CL00001 Alice Nguyen (12 Smith St Parkville 3052, stripe cus_A1),
 * CL00002 Robert Brown (45 King Rd Fitzroy 3065, aged_care acn 123456789),
 * CL00003 Catherine Lee (7 Ocean Dr St Kilda 3182, phone (03) 9876 5432),
 * CL00004 Daniel Okafor (Unit 3, 88 High St Kew 3101),
 * CL00005 Margaret Wilson (3 Rose Ln Brunswick 3056).
 */
public final class TestFixtures {

    public static final String TEST_REGISTRY = "registry/test-client-map.json";

    private TestFixtures() {}

    public static ObjectMapper objectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        return objectMapper;
    }

    public static ClientRegistryLoader loader() {
        return new ClientRegistryLoader(objectMapper());
    }

    public static RegistrySnapshot testSnapshot() {
        return loader().load(new ClassPathResource(TEST_REGISTRY));
    }

    public static ClientRegistry testRegistry() {
        return new ClientRegistry(loader(), new ClassPathResource(TEST_REGISTRY));
    }

    public static MatchingProperties defaultProperties() {
        return new MatchingProperties();
    }

    public static Transaction transaction(String id, String description) {
        return transaction(id, "bank_statement", description, null, null, Map.of());
    }

    public static Transaction transaction(String id,
                                          String platform,
                                          String description,
                                          String email,
                                          String clientIdentifier,
                                          Map<String, String> metadata) {
        return new Transaction(
                id,
                LocalDate.of(2025, 7, 14),
                new BigDecimal("120.00"),
                description,
                null,
                email,
                clientIdentifier,
                platform,
                metadata
        );
    }

    public static Transaction paperReceipt(String id, String clientName, String clientSuburb) {
        Map<String, String> metadata = new java.util.HashMap<>();
        if (clientName != null) {
            metadata.put("client_name", clientName);
        }
        if (clientSuburb != null) {
            metadata.put("client_suburb", clientSuburb);
        }
        return transaction(id, "paper_receipt", null, null, null, metadata);
    }
}
