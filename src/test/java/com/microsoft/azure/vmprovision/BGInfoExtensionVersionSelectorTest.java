package com.microsoft.azure.vmprovision;

import com.microsoft.azure.vmprovision.client.ComputeClient;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BGInfoExtensionVersionSelectorTest {

    private ComputeClient computeClient;

    private BGInfoExtensionVersionSelector selector;

    @BeforeEach
    void setUp() {
        computeClient = mock(ComputeClient.class);
        selector = new BGInfoExtensionVersionSelector(computeClient);
    }

    @Test
    void selectVersionReturnsNewestMajorMinor() throws AzureCloudException {
        // Given
        givenExtensionPublished("1.0", "2.3.0.1", "bogus", "2.1");

        // When
        Optional<String> version = selector.selectVersion("West US");

        // Then
        assertThat(version.get(), equalTo("2.3"));
    }

    @Test
    void selectVersionComparesNumerically() throws AzureCloudException {
        givenExtensionPublished("9.5", "10.0", "2.10");

        assertThat(selector.selectVersion("westus").get(), equalTo("10.0"));
    }

    @Test
    void selectVersionGivenNoParsableVersionThenReturnsDefault() throws AzureCloudException {
        givenExtensionPublished("latest", "v2", "1.a");

        assertThat(selector.selectVersion("westus").get(), equalTo("2.1"));
    }

    @Test
    void selectVersionGivenMissingPublisherThenEmpty() throws AzureCloudException {
        // Given
        when(computeClient.listPublishers("westus")).thenReturn(Collections.singletonList("Canonical"));

        // When
        Optional<String> version = selector.selectVersion("westus");

        // Then
        assertFalse(version.isPresent());
        verify(computeClient, never()).listExtensionTypes(anyString(), anyString());
    }

    @Test
    void selectVersionGivenMissingTypeThenEmpty() throws AzureCloudException {
        // Given
        when(computeClient.listPublishers("westus")).thenReturn(Collections.singletonList("Microsoft.Compute"));
        when(computeClient.listExtensionTypes("westus", "Microsoft.Compute"))
                .thenReturn(Collections.singletonList("CustomScriptExtension"));

        // When
        Optional<String> version = selector.selectVersion("westus");

        // Then
        assertFalse(version.isPresent());
        verify(computeClient, never()).listExtensionVersions(anyString(), anyString(), anyString());
    }

    @Test
    void selectVersionGivenNoVersionsThenEmpty() throws AzureCloudException {
        givenExtensionPublished();

        assertFalse(selector.selectVersion("westus").isPresent());
    }

    @Test
    void selectVersionPropagatesLookupFailures() throws AzureCloudException {
        when(computeClient.listPublishers("westus")).thenThrow(AzureCloudException.create("throttled"));

        assertThrows(AzureCloudException.class, () -> selector.selectVersion("westus"));
    }

    @Test
    void parseVersion() {
        assertThat(BGInfoExtensionVersionSelector.parseVersion("2.1")[1], equalTo(1));
        assertThat(BGInfoExtensionVersionSelector.parseVersion("2.1.0.4")[0], equalTo(2));
        assertThat(BGInfoExtensionVersionSelector.parseVersion("2"), nullValue());
        assertThat(BGInfoExtensionVersionSelector.parseVersion("1.2.3.4.5"), nullValue());
        assertThat(BGInfoExtensionVersionSelector.parseVersion("2..1"), nullValue());
        assertThat(BGInfoExtensionVersionSelector.parseVersion("-1.0"), nullValue());
        assertThat(BGInfoExtensionVersionSelector.parseVersion(null), nullValue());
    }

    private void givenExtensionPublished(String... versions) throws AzureCloudException {
        when(computeClient.listPublishers("westus"))
                .thenReturn(Arrays.asList("Canonical", "Microsoft.Compute"));
        when(computeClient.listExtensionTypes("westus", "Microsoft.Compute"))
                .thenReturn(Arrays.asList("CustomScriptExtension", "BGInfo"));
        when(computeClient.listExtensionVersions("westus", "Microsoft.Compute", "BGInfo"))
                .thenReturn(Arrays.asList(versions));
    }
}
