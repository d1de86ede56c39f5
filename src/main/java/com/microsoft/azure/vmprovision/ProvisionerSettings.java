/*
 Copyright 2016 Microsoft, Inc.

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 */
package com.microsoft.azure.vmprovision;

import com.azure.core.management.AzureEnvironment;
import com.azure.resourcemanager.storage.models.SkuName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microsoft.azure.vmprovision.util.AzureUtil;
import com.microsoft.azure.vmprovision.util.Constants;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of the provisioner. The bundled {@code provisioner-defaults.json} is read first and any
 * caller supplied JSON document is laid over it, key by key.
 */
public final class ProvisionerSettings {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String tenantId;

    private final String clientId;

    private final String clientSecret;

    private final String subscriptionId;

    private final String environment;

    private final int maxNameAttempts;

    private final SkuName storageSku;

    private final String extensionName;

    private final String extensionPublisher;

    private final String extensionDefaultVersion;

    private ProvisionerSettings(JsonNode root) {
        JsonNode credentials = root.path("credentials");
        this.tenantId = text(credentials, "tenantId", null);
        this.clientId = text(credentials, "clientId", null);
        this.clientSecret = text(credentials, "clientSecret", null);
        this.subscriptionId = text(credentials, "subscriptionId", null);
        this.environment = text(credentials, "environment", Constants.ENVIRONMENT_AZURE);

        JsonNode bootDiagnostics = root.path("bootDiagnostics");
        this.maxNameAttempts = bootDiagnostics.path("maxNameAttempts").asInt(Constants.DEFAULT_MAX_NAME_ATTEMPTS);
        this.storageSku = SkuName.fromString(
                text(bootDiagnostics, "storageSku", Constants.DEFAULT_DIAGNOSTICS_STORAGE_SKU));

        JsonNode extension = root.path("extension");
        this.extensionName = text(extension, "name", Constants.BGINFO_EXTENSION_NAME);
        this.extensionPublisher = text(extension, "publisher", Constants.BGINFO_EXTENSION_PUBLISHER);
        this.extensionDefaultVersion = text(extension, "defaultVersion", Constants.BGINFO_EXTENSION_DEFAULT_VERSION);

        validate();
    }

    /**
     * @return the bundled defaults
     */
    public static ProvisionerSettings defaults() throws IOException {
        return new ProvisionerSettings(readDefaults());
    }

    /**
     * Reads settings from a JSON document, falling back to the bundled defaults for every key the
     * document does not set.
     */
    public static ProvisionerSettings load(InputStream overrides) throws IOException {
        ObjectNode root = readDefaults();
        if (overrides != null) {
            JsonNode custom = MAPPER.readTree(overrides);
            if (custom != null && !custom.isObject()) {
                throw new IOException("Provisioner settings must be a JSON object");
            }
            if (custom != null) {
                merge(root, (ObjectNode) custom);
            }
        }
        return new ProvisionerSettings(root);
    }

    private static ObjectNode readDefaults() throws IOException {
        try (InputStream in = ProvisionerSettings.class.getResourceAsStream(Constants.DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing bundled resource " + Constants.DEFAULTS_RESOURCE);
            }
            return (ObjectNode) MAPPER.readTree(in);
        }
    }

    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    private static String text(JsonNode node, String name, String defaultValue) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull() || StringUtils.isBlank(value.asText())) {
            return defaultValue;
        }
        return value.asText().trim();
    }

    private void validate() {
        if (maxNameAttempts < 1) {
            throw new IllegalArgumentException("bootDiagnostics.maxNameAttempts must be at least 1");
        }
        if (AzureUtil.isPremium(storageSku)) {
            throw new IllegalArgumentException(
                    "bootDiagnostics.storageSku " + storageSku + " does not support boot diagnostics");
        }
        getAzureEnvironment();
    }

    public AzureEnvironment getAzureEnvironment() {
        switch (environment.toUpperCase(Locale.ROOT)) {
            case Constants.ENVIRONMENT_AZURE:
                return AzureEnvironment.AZURE;
            case Constants.ENVIRONMENT_AZURE_CHINA:
                return AzureEnvironment.AZURE_CHINA;
            case Constants.ENVIRONMENT_AZURE_US_GOVERNMENT:
                return AzureEnvironment.AZURE_US_GOVERNMENT;
            default:
                throw new IllegalArgumentException("Unknown Azure environment " + environment);
        }
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public String getEnvironment() {
        return environment;
    }

    public int getMaxNameAttempts() {
        return maxNameAttempts;
    }

    public SkuName getStorageSku() {
        return storageSku;
    }

    public String getExtensionName() {
        return extensionName;
    }

    public String getExtensionPublisher() {
        return extensionPublisher;
    }

    public String getExtensionDefaultVersion() {
        return extensionDefaultVersion;
    }
}
