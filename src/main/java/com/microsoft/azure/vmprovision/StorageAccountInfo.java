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

import com.azure.resourcemanager.storage.models.SkuName;
import com.microsoft.azure.vmprovision.util.AzureUtil;

/**
 * The parts of a storage account the boot diagnostics resolver looks at.
 */
public class StorageAccountInfo {

    private final String name;

    private final SkuName accountType;

    private final String blobEndpoint;

    public StorageAccountInfo(String name, SkuName accountType, String blobEndpoint) {
        this.name = name;
        this.accountType = accountType;
        this.blobEndpoint = blobEndpoint;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the SKU of the account, or null when the service did not report one
     */
    public SkuName getAccountType() {
        return accountType;
    }

    public String getBlobEndpoint() {
        return blobEndpoint;
    }

    public boolean hasKnownAccountType() {
        return accountType != null;
    }

    public boolean isPremium() {
        return AzureUtil.isPremium(accountType);
    }

    @Override
    public String toString() {
        return "StorageAccountInfo{name=" + name + ", accountType=" + accountType + "}";
    }
}
