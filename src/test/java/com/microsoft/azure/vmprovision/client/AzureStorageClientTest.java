package com.microsoft.azure.vmprovision.client;

import com.azure.core.http.HttpResponse;
import com.azure.core.http.rest.PagedIterable;
import com.azure.core.management.exception.ManagementException;
import com.azure.resourcemanager.storage.models.CheckNameAvailabilityResult;
import com.azure.resourcemanager.storage.models.Endpoints;
import com.azure.resourcemanager.storage.models.PublicEndpoints;
import com.azure.resourcemanager.storage.models.SkuName;
import com.azure.resourcemanager.storage.models.StorageAccount;
import com.azure.resourcemanager.storage.models.StorageAccountSkuType;
import com.azure.resourcemanager.storage.models.StorageAccounts;
import com.microsoft.azure.vmprovision.StorageAccountInfo;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;
import com.microsoft.azure.vmprovision.exceptions.AzureResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AzureStorageClientTest {

    private StorageAccounts storageAccounts;

    private AzureStorageClient storageClient;

    @BeforeEach
    void setUp() {
        storageAccounts = mock(StorageAccounts.class);
        storageClient = new AzureStorageClient(storageAccounts);
    }

    @Test
    void getStorageAccountMapsNameSkuAndBlobEndpoint() throws Exception {
        // Given
        StorageAccount account = account("acct", StorageAccountSkuType.STANDARD_LRS, "https://acct.blob/");
        when(storageAccounts.getByResourceGroup("rg", "acct")).thenReturn(account);

        // When
        StorageAccountInfo info = storageClient.getStorageAccount("rg", "acct");

        // Then
        assertThat(info.getName(), equalTo("acct"));
        assertThat(info.getAccountType(), equalTo(SkuName.STANDARD_LRS));
        assertThat(info.getBlobEndpoint(), equalTo("https://acct.blob/"));
    }

    @Test
    void getStorageAccountGiven404ThenThrowsNotFound() {
        // Given
        ManagementException serviceError = managementException(404, "not here");
        when(storageAccounts.getByResourceGroup("rg", "missing")).thenThrow(serviceError);

        // When / Then
        AzureResourceNotFoundException e = assertThrows(AzureResourceNotFoundException.class,
                () -> storageClient.getStorageAccount("rg", "missing"));
        assertThat(e.getResourceGroupName(), equalTo("rg"));
        assertThat(e.getResourceName(), equalTo("missing"));
    }

    @Test
    void getStorageAccountGivenNullThenThrowsNotFound() {
        when(storageAccounts.getByResourceGroup("rg", "missing")).thenReturn(null);

        assertThrows(AzureResourceNotFoundException.class, () -> storageClient.getStorageAccount("rg", "missing"));
    }

    @Test
    void getStorageAccountGivenOtherServiceErrorThenThrowsCloudException() {
        // Given
        ManagementException serviceError = managementException(403, "denied");
        when(storageAccounts.getByResourceGroup("rg", "acct")).thenThrow(serviceError);

        // When / Then
        AzureCloudException e = assertThrows(AzureCloudException.class,
                () -> storageClient.getStorageAccount("rg", "acct"));
        assertThat(e.getMessage(), containsString("acct"));
        assertThat(e.getMessage(), containsString("denied"));
    }

    @Test
    void listByResourceGroupKeepsServiceOrder() throws AzureCloudException {
        // Given
        StorageAccount premium = account("premium", StorageAccountSkuType.PREMIUM_LRS, "https://premium.blob/");
        StorageAccount unknown = account("unknown", null, null);
        StorageAccount standard = account("standard", StorageAccountSkuType.STANDARD_GRS, "https://standard.blob/");
        @SuppressWarnings("unchecked")
        PagedIterable<StorageAccount> paged = mock(PagedIterable.class);
        when(paged.iterator()).thenReturn(Arrays.asList(premium, unknown, standard).iterator());
        when(storageAccounts.listByResourceGroup("rg")).thenReturn(paged);

        // When
        List<StorageAccountInfo> accounts = storageClient.listByResourceGroup("rg");

        // Then
        assertThat(accounts, hasSize(3));
        assertTrue(accounts.get(0).isPremium());
        assertFalse(accounts.get(1).hasKnownAccountType());
        assertThat(accounts.get(1).getBlobEndpoint(), nullValue());
        assertThat(accounts.get(2).getName(), equalTo("standard"));
        assertThat(accounts.get(2).getAccountType(), equalTo(SkuName.STANDARD_GRS));
    }

    @Test
    void listByResourceGroupGivenFailureThenThrowsCloudException() {
        when(storageAccounts.listByResourceGroup("rg")).thenThrow(new IllegalStateException("boom"));

        assertThrows(AzureCloudException.class, () -> storageClient.listByResourceGroup("rg"));
    }

    @Test
    void isNameAvailable() throws AzureCloudException {
        // Given
        CheckNameAvailabilityResult available = mock(CheckNameAvailabilityResult.class);
        when(available.isAvailable()).thenReturn(true);
        CheckNameAvailabilityResult taken = mock(CheckNameAvailabilityResult.class);
        when(taken.isAvailable()).thenReturn(false);
        when(storageAccounts.checkNameAvailability("free")).thenReturn(available);
        when(storageAccounts.checkNameAvailability("taken")).thenReturn(taken);

        // Then
        assertTrue(storageClient.isNameAvailable("free"));
        assertFalse(storageClient.isNameAvailable("taken"));
        assertFalse(storageClient.isNameAvailable("unknown"));
    }

    private static StorageAccount account(String name, StorageAccountSkuType skuType, String blobEndpoint) {
        StorageAccount account = mock(StorageAccount.class);
        when(account.name()).thenReturn(name);
        when(account.skuType()).thenReturn(skuType);
        if (blobEndpoint != null) {
            Endpoints primary = mock(Endpoints.class);
            when(primary.blob()).thenReturn(blobEndpoint);
            PublicEndpoints endpoints = mock(PublicEndpoints.class);
            when(endpoints.primary()).thenReturn(primary);
            when(account.endPoints()).thenReturn(endpoints);
        }
        return account;
    }

    private static ManagementException managementException(int statusCode, String message) {
        HttpResponse response = mock(HttpResponse.class);
        when(response.getStatusCode()).thenReturn(statusCode);
        return new ManagementException(message, response);
    }
}
