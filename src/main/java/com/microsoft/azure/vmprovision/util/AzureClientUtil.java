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
package com.microsoft.azure.vmprovision.util;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.profile.AzureProfile;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.resourcemanager.AzureResourceManager;
import com.microsoft.azure.vmprovision.ProvisionerSettings;
import org.apache.commons.lang3.StringUtils;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class AzureClientUtil {

    private static final Logger LOGGER = Logger.getLogger(AzureClientUtil.class.getName());

    public static AzureResourceManager getClient(ProvisionerSettings settings) {
        AzureProfile profile = StringUtils.isBlank(settings.getTenantId())
                ? new AzureProfile(settings.getAzureEnvironment())
                : new AzureProfile(settings.getTenantId(), settings.getSubscriptionId(), settings.getAzureEnvironment());
        TokenCredential tokenCredential = getTokenCredential(settings, profile);

        AzureResourceManager.Authenticated authenticated = AzureResourceManager
                .configure()
                .authenticate(tokenCredential, profile);
        if (StringUtils.isBlank(settings.getSubscriptionId())) {
            LOGGER.log(Level.INFO, "AzureClientUtil: getClient: no subscription configured, using the default one");
            return authenticated.withDefaultSubscription();
        }
        return authenticated.withSubscription(settings.getSubscriptionId());
    }

    /**
     * Service principal credentials when a client secret is configured, the default credential
     * chain (environment, managed identity, Azure CLI) otherwise.
     */
    static TokenCredential getTokenCredential(ProvisionerSettings settings, AzureProfile profile) {
        String authorityHost = profile.getEnvironment().getActiveDirectoryEndpoint();
        if (StringUtils.isNotBlank(settings.getClientSecret())) {
            return new ClientSecretCredentialBuilder()
                    .tenantId(settings.getTenantId())
                    .clientId(settings.getClientId())
                    .clientSecret(settings.getClientSecret())
                    .authorityHost(authorityHost)
                    .build();
        }
        return new DefaultAzureCredentialBuilder()
                .authorityHost(authorityHost)
                .build();
    }

    private AzureClientUtil() {
    }
}
