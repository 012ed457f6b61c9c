// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kestrel.core.error.ConfigurationException;
import io.kestrel.core.types.AccountId;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Client configuration read from JSON.
 *
 * <p>
 * <strong>Format:</strong>
 * <pre>{@code
 * {
 *   "network": "testnet",                      // or {"127.0.0.1:50211": "0.0.3", ...}
 *   "mirrorNetwork": "testnet",                // or ["127.0.0.1:5600", ...]
 *   "operator": {"accountId": "0.0.1001"}
 * }
 * }</pre>
 * Only {@code network} is required. Unknown fields are ignored.
 *
 * @param networkName   the named network, or {@code null} if explicit addresses are given
 * @param network       explicit consensus node addresses, or {@code null} if a name is given
 * @param mirrorName    the named mirror network, or {@code null}
 * @param mirrorNetwork explicit mirror addresses, or {@code null}
 * @param operator      the operator account, or {@code null}
 * @since 0.1.0
 */
public record ClientConfigFile(
        @Nullable NetworkName networkName,
        @Nullable Map<String, AccountId> network,
        @Nullable NetworkName mirrorName,
        @Nullable List<String> mirrorNetwork,
        @Nullable AccountId operator) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parses a JSON configuration.
     *
     * @param json the JSON text
     * @return the parsed configuration
     * @throws ConfigurationException if the JSON is malformed or does not follow the format
     */
    public static ClientConfigFile parse(final String json) {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Client configuration is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Client configuration must be a JSON object");
        }

        final JsonNode networkNode = root.get("network");
        NetworkName networkName = null;
        Map<String, AccountId> network = null;
        if (networkNode == null || networkNode.isNull()) {
            throw new ConfigurationException("Client configuration is missing \"network\"");
        } else if (networkNode.isTextual()) {
            networkName = NetworkName.fromString(networkNode.asText());
        } else if (networkNode.isObject()) {
            network = readAddresses(networkNode);
        } else {
            throw new ConfigurationException("\"network\" must be a network name or an object of address to node id");
        }

        final JsonNode mirrorNode = root.get("mirrorNetwork");
        NetworkName mirrorName = null;
        List<String> mirrorNetwork = null;
        if (mirrorNode != null && !mirrorNode.isNull()) {
            if (mirrorNode.isTextual()) {
                mirrorName = NetworkName.fromString(mirrorNode.asText());
            } else if (mirrorNode.isArray()) {
                mirrorNetwork = new ArrayList<>();
                for (JsonNode address : mirrorNode) {
                    if (!address.isTextual()) {
                        throw new ConfigurationException("\"mirrorNetwork\" entries must be strings");
                    }
                    mirrorNetwork.add(address.asText());
                }
            } else {
                throw new ConfigurationException("\"mirrorNetwork\" must be a network name or an array of addresses");
            }
        }

        AccountId operator = null;
        final JsonNode operatorNode = root.get("operator");
        if (operatorNode != null && !operatorNode.isNull()) {
            final JsonNode accountId = operatorNode.get("accountId");
            if (accountId == null || !accountId.isTextual()) {
                throw new ConfigurationException("\"operator.accountId\" must be a string");
            }
            operator = parseAccountId(accountId.asText());
        }

        return new ClientConfigFile(networkName, network, mirrorName, mirrorNetwork, operator);
    }

    /**
     * Reads and parses a JSON configuration file.
     *
     * @param path the file
     * @return the parsed configuration
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public static ClientConfigFile read(final Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read client configuration " + path, e);
        }
    }

    private static Map<String, AccountId> readAddresses(final JsonNode node) {
        final Map<String, AccountId> addresses = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new ConfigurationException("Node id for " + field.getKey() + " must be a string");
            }
            addresses.put(field.getKey(), parseAccountId(field.getValue().asText()));
        }
        return addresses;
    }

    private static AccountId parseAccountId(final String text) {
        try {
            return AccountId.parse(text);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }
}
