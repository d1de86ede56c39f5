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

import com.azure.resourcemanager.storage.models.SkuName;
import com.microsoft.azure.vmprovision.StorageAccountInfo;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;
import com.microsoft.azure.vmprovision.exceptions.AzureResourceNotFoundException;

import java.util.List;

/**
 * Storage account operations used to pick a boot diagnostics account.
 */
public interface StorageClient {

    /**
     * @throws AzureResourceNotFoundException when no such account exists in the resource group
     * @throws AzureCloudException            on any other failure
     */
    StorageAccountInfo getStorageAccount(String resourceGroupName, String accountName)
            throws AzureResourceNotFoundException, AzureCloudException;

    List<StorageAccountInfo> listByResourceGroup(String resourceGroupName) throws AzureCloudException;

    boolean isNameAvailable(String accountName) throws AzureCloudException;

    void createStorageAccount(String resourceGroupName, String accountName, String location, SkuName skuName)
            throws AzureCloudException;
}
