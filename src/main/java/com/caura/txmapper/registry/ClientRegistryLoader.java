package com.caura.txmapper.registry;

import com.caura.txmapper.domain.ClientRecord;
import com.caura.txmapper.exception.RegistryFormatException;
import com.caura.txmapper.exception.RegistryLoadException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses a client registry snapshot into a {@link RegistrySnapshot}.
 * <p>
 * Two JSON shapes are accepted:
 * <ul>
 *   <li>flat: {@code {"CL00001": {...}, "CL00002": {...}}}, keyed by client id</li>
 *   <li>envelope: {@code {"metadata": {...}, "clients": [{"caura_id": "CL00001", ...}]}}</li>
 * </ul>
 * Anything else fails with {@link RegistryFormatException}.
 */
@Component
@Slf4j
public class ClientRegistryLoader {

    static final String CLIENTS_FIELD = "clients";
    static final String METADATA_FIELD = "metadata";
    static final String ID_FIELD = "caura_id";

    private final ObjectMapper objectMapper;

    public ClientRegistryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads and indexes the registry at the given resource.
     *
     * @throws RegistryFormatException if the content is not a valid registry
     * @throws RegistryLoadException if the resource cannot be read
     */
    public RegistrySnapshot load(Resource resource) {
        String source = resource.getDescription();
        log.info("Loading client registry from {}", source);

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new RegistryFormatException("Client registry is not valid JSON: " + e.getOriginalMessage(), source, e);
        } catch (IOException e) {
            throw new RegistryLoadException("Unable to read client registry: " + e.getMessage(), source, e);
        }
        return parse(root, source);
    }

    /**
     * Builds a snapshot from an already parsed registry document.
     */
    public RegistrySnapshot parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new RegistryFormatException("Invalid client registry format: expected a JSON object", source);
        }

        if (root.has(CLIENTS_FIELD)) {
            return parseEnvelope(root, source);
        }
        return parseFlat(root, source);
    }

    private RegistrySnapshot parseEnvelope(JsonNode root, String source) {
        JsonNode clientsNode = root.get(CLIENTS_FIELD);
        if (!clientsNode.isArray()) {
            throw new RegistryFormatException("Invalid client registry format: 'clients' must be an array", source);
        }

        List<ClientRecord> clients = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int position = 0;
        for (JsonNode node : clientsNode) {
            if (!node.isObject()) {
                throw new RegistryFormatException("Client entry " + position + " is not an object", source);
            }
            JsonNode idNode = node.get(ID_FIELD);
            if (idNode == null || !idNode.isValueNode() || idNode.asText().isBlank()) {
                throw new RegistryFormatException("Client entry " + position + " has no " + ID_FIELD, source);
            }
            ClientRecord client = toRecord(node, source).withClientId(idNode.asText().trim());
            addUnique(clients, seen, client, source);
            position++;
        }

        Map<String, Object> metadata = root.hasNonNull(METADATA_FIELD)
                ? objectMapper.convertValue(root.get(METADATA_FIELD), new TypeReference<Map<String, Object>>() {})
                : Map.of();
        log.debug("Parsed envelope registry with {} clients", clients.size());
        return RegistrySnapshot.build(source, metadata, clients);
    }

    private RegistrySnapshot parseFlat(JsonNode root, String source) {
        List<ClientRecord> clients = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isObject()) {
                throw new RegistryFormatException(
                        "Invalid client registry format: entry '" + field.getKey() + "' is not a client record", source);
            }
            ClientRecord client = toRecord(field.getValue(), source).withClientId(field.getKey());
            addUnique(clients, seen, client, source);
        }
        log.debug("Parsed flat registry with {} clients", clients.size());
        return RegistrySnapshot.build(source, Map.of(), clients);
    }

    private ClientRecord toRecord(JsonNode node, String source) {
        try {
            return objectMapper.treeToValue(node, ClientRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RegistryFormatException("Malformed client record: " + e.getMessage(), source, e);
        }
    }

    private static void addUnique(List<ClientRecord> clients, Set<String> seen, ClientRecord client, String source) {
        if (!seen.add(client.clientId())) {
            throw new RegistryFormatException("Duplicate client id in registry: " + client.clientId(), source);
        }
        clients.add(client);
    }
}
