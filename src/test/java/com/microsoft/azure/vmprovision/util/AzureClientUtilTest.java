package com.microsoft.azure.vmprovision.util;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.core.management.profile.AzureProfile;
import com.azure.identity.ClientSecretCredential;
import com.azure.identity.DefaultAzureCredential;
import com.microsoft.azure.vmprovision.ProvisionerSettings;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;

class AzureClientUtilTest {

    @Test
    void getTokenCredentialGivenClientSecretThenUsesServicePrincipal() throws IOException {
        // Given
        ProvisionerSettings settings;
        try (InputStream in = getClass().getResourceAsStream("/service-principal-settings.json")) {
            settings = ProvisionerSettings.load(in);
        }
        AzureProfile profile = new AzureProfile(
                settings.getTenantId(), settings.getSubscriptionId(), settings.getAzureEnvironment());

        // When
        TokenCredential credential = AzureClientUtil.getTokenCredential(settings, profile);

        // Then
        assertThat(settings.getAzureEnvironment(), sameInstance(AzureEnvironment.AZURE_US_GOVERNMENT));
        assertThat(credential, instanceOf(ClientSecretCredential.class));
    }

    @Test
    void getTokenCredentialGivenNoClientSecretThenUsesDefaultChain() throws IOException {
        ProvisionerSettings settings = ProvisionerSettings.defaults();

        TokenCredential credential = AzureClientUtil.getTokenCredential(
                settings, new AzureProfile(settings.getAzureEnvironment()));

        assertThat(credential, instanceOf(DefaultAzureCredential.class));
    }
}
