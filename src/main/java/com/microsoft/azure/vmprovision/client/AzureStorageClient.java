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
package com.microsoft.azure.vmprovision.client;

import com.azure.core.http.rest.PagedIterable;
import com.azure.core.management.exception.ManagementException;
import com.azure.resourcemanager.AzureResourceManager;
import com.azure.resourcemanager.storage.models.CheckNameAvailabilityResult;
import com.azure.resourcemanager.storage.models.SkuName;
import com.azure.resourcemanager.storage.models.StorageAccount;
import com.azure.resourcemanager.storage.models.StorageAccountSkuType;
import com.azure.resourcemanager.storage.models.StorageAccounts;
import com.microsoft.azure.vmprovision.StorageAccountInfo;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;
import com.microsoft.azure.vmprovision.exceptions.AzureResourceNotFoundException;
import com.microsoft.azure.vmprovision.util.Constants;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AzureStorageClient implements StorageClient {

    private static final Logger LOGGER = Logger.getLogger(AzureStorageClient.class.getName());

    private final StorageAccounts storageAccounts;

    public AzureStorageClient(StorageAccounts storageAccounts) {
        if (storageAccounts == null) {
            throw new NullPointerException("the storage accounts client is null!");
        }
        this.storageAccounts = storageAccounts;
    }

    public static AzureStorageClient create(AzureResourceManager azureClient) {
        return new AzureStorageClient(azureClient.storageAccounts());
    }

    @Override
    public StorageAccountInfo getStorageAccount(String resourceGroupName, String accountName)
            throws AzureResourceNotFoundException, AzureCloudException {
        StorageAccount account;
        try {
            account = storageAccounts.getByResourceGroup(resourceGroupName, accountName);
        } catch (ManagementException e) {
            if (e.getResponse() != null && e.getResponse().getStatusCode() == Constants.HTTP_NOT_FOUND) {
                throw new AzureResourceNotFoundException(resourceGroupName, accountName);
            }
            throw AzureCloudException.create(
                    String.format("Failed to get storage account %s in resource group %s",
                            accountName, resourceGroupName),
                    e);
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to get storage account %s in resource group %s",
                            accountName, resourceGroupName),
                    e);
        }
        if (account == null) {
            throw new AzureResourceNotFoundException(resourceGroupName, accountName);
        }
        return toInfo(account);
    }

    @Override
    public List<StorageAccountInfo> listByResourceGroup(String resourceGroupName) throws AzureCloudException {
        List<StorageAccountInfo> result = new ArrayList<>();
        try {
            PagedIterable<StorageAccount> accounts = storageAccounts.listByResourceGroup(resourceGroupName);
            if (accounts == null) {
                return result;
            }
            for (StorageAccount account : accounts) {
                result.add(toInfo(account));
            }
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to list storage accounts in resource group %s", resourceGroupName), e);
        }
        LOGGER.log(Level.FINE, "AzureStorageClient: listByResourceGroup: {0} accounts in {1}",
                new Object[]{result.size(), resourceGroupName});
        return result;
    }

    @Override
    public boolean isNameAvailable(String accountName) throws AzureCloudException {
        try {
            CheckNameAvailabilityResult checkResult = storageAccounts.checkNameAvailability(accountName);
            return checkResult != null && Boolean.TRUE.equals(checkResult.isAvailable());
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to check availability of storage account name %s", accountName), e);
        }
    }

    @Override
    public void createStorageAccount(
            String resourceGroupName, String accountName, String location, SkuName skuName)
            throws AzureCloudException {
        LOGGER.log(Level.INFO,
                "AzureStorageClient: createStorageAccount: creating {0} ({1}) in resource group {2} at {3}",
                new Object[]{accountName, skuName, resourceGroupName, location});
        try {
            storageAccounts.define(accountName)
                    .withRegion(location)
                    .withExistingResourceGroup(resourceGroupName)
                    .withSku(StorageAccountSkuType.fromSkuName(skuName))
                    .create();
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format(
                            "Failed to create storage account with account name %s, location %s, "
                                    + "resourceGroupName %s",
                            accountName, location, resourceGroupName),
                    e);
        }
    }

    private static StorageAccountInfo toInfo(StorageAccount account) {
        SkuName skuName = account.skuType() == null ? null : account.skuType().name();
        String blobEndpoint = null;
        if (account.endPoints() != null && account.endPoints().primary() != null) {
            blobEndpoint = account.endPoints().primary().blob();
        }
        return new StorageAccountInfo(account.name(), skuName, blobEndpoint);
    }
}
