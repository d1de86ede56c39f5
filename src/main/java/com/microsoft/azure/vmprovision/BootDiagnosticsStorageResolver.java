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
import com.microsoft.azure.vmprovision.client.SessionContext;
import com.microsoft.azure.vmprovision.client.StorageClient;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;
import com.microsoft.azure.vmprovision.exceptions.AzureResourceNotFoundException;
import com.microsoft.azure.vmprovision.util.AzureUtil;
import com.microsoft.azure.vmprovision.util.Constants;
import com.microsoft.azure.vmprovision.util.Messages;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the storage account that receives the boot diagnostics of a new virtual machine.
 *
 * <p>In order of preference: the account holding the VM's OS disk, any existing standard account in
 * the resource group, or a new account. Premium accounts are never used. Failing to find or create
 * an account is not an error, the VM is then created without boot diagnostics.</p>
 */
public class BootDiagnosticsStorageResolver {

    private static final Logger LOGGER = Logger.getLogger(BootDiagnosticsStorageResolver.class.getName());

    private final StorageClient storageClient;

    private final SessionContext sessionContext;

    private final StorageAccountNameGenerator nameGenerator;

    private final int maxNameAttempts;

    private final SkuName storageSku;

    public BootDiagnosticsStorageResolver(
            StorageClient storageClient,
            SessionContext sessionContext,
            StorageAccountNameGenerator nameGenerator,
            int maxNameAttempts,
            SkuName storageSku) {
        this.storageClient = storageClient;
        this.sessionContext = sessionContext;
        this.nameGenerator = nameGenerator;
        this.maxNameAttempts = maxNameAttempts;
        this.storageSku = storageSku;
    }

    public BootDiagnosticsStorageResolver(StorageClient storageClient, SessionContext sessionContext) {
        this(storageClient, sessionContext, new StorageAccountNameGenerator(), Constants.DEFAULT_MAX_NAME_ATTEMPTS,
                SkuName.STANDARD_GRS);
    }

    /**
     * @param resourceGroupName resource group of the VM
     * @param location          location used when a new account has to be created
     * @param vm                the VM being created
     * @return the blob endpoint to store boot diagnostics in, absent when none could be determined
     * @throws AzureCloudException when listing the accounts of the resource group fails
     */
    public DiagnosticResult<String> resolve(String resourceGroupName, String location, VirtualMachineSpec vm)
            throws AzureCloudException {
        List<String> notices = new ArrayList<>();

        String osDiskAccountName = AzureUtil.getStorageAccountNameFromUri(vm.getOsDiskVhdUri());
        if (StringUtils.isNotEmpty(osDiskAccountName)) {
            StorageAccountInfo osDiskAccount = getOsDiskStorageAccount(resourceGroupName, osDiskAccountName, notices);
            if (osDiskAccount != null && !osDiskAccount.isPremium()) {
                LOGGER.log(Level.INFO,
                        "BootDiagnosticsStorageResolver: resolve: using OS disk storage account {0}",
                        osDiskAccountName);
                if (osDiskAccount.getBlobEndpoint() == null) {
                    LOGGER.log(Level.FINE,
                            "BootDiagnosticsStorageResolver: resolve: storage account {0} reports no blob endpoint, "
                                    + "boot diagnostics stay disabled",
                            osDiskAccountName);
                }
                return DiagnosticResult.of(osDiskAccount.getBlobEndpoint(), notices);
            }
        }

        StorageAccountInfo existing = chooseExistingStandardStorageAccount(resourceGroupName);
        if (existing != null) {
            warn(notices, Messages.usingExistingStorageAccountForBootDiagnostics(existing.getName()));
            return DiagnosticResult.of(existing.getBlobEndpoint(), notices);
        }

        String blobEndpoint = createStandardStorageAccount(resourceGroupName, location, vm, notices);
        return DiagnosticResult.of(blobEndpoint, notices);
    }

    private StorageAccountInfo getOsDiskStorageAccount(
            String resourceGroupName, String accountName, List<String> notices) {
        try {
            return storageClient.getStorageAccount(resourceGroupName, accountName);
        } catch (AzureResourceNotFoundException e) {
            warn(notices, Messages.storageAccountNotFoundForBootDiagnostics(accountName));
        } catch (AzureCloudException | RuntimeException e) {
            LOGGER.log(Level.FINE, "BootDiagnosticsStorageResolver: getOsDiskStorageAccount: lookup failed", e);
            warn(notices, Messages.errorDuringGettingStorageAccountForBootDiagnostics(accountName, e.getMessage()));
        }
        return null;
    }

    private StorageAccountInfo chooseExistingStandardStorageAccount(String resourceGroupName)
            throws AzureCloudException {
        List<StorageAccountInfo> accounts = storageClient.listByResourceGroup(resourceGroupName);
        if (accounts == null) {
            return null;
        }
        for (StorageAccountInfo account : accounts) {
            if (account != null && account.hasKnownAccountType() && !account.isPremium()) {
                return account;
            }
        }
        return null;
    }

    private String createStandardStorageAccount(
            String resourceGroupName, String location, VirtualMachineSpec vm, List<String> notices)
            throws AzureCloudException {
        String subscriptionName;
        try {
            subscriptionName = sessionContext.getSubscriptionName();
        } catch (AzureCloudException | RuntimeException e) {
            LOGGER.log(Level.FINE,
                    "BootDiagnosticsStorageResolver: createStandardStorageAccount: subscription lookup failed", e);
            warn(notices, Messages.errorDuringCreatingStorageAccountForBootDiagnostics(e.getMessage()));
            return null;
        }
        String accountName;

        // Invalid candidates are skipped without a service call. The last candidate is taken
        // without an availability check.
        int i = 0;
        do {
            accountName = nameGenerator.generate(subscriptionName, resourceGroupName, vm.getName(), i);
            i++;
        } while (i < maxNameAttempts
                && !(AzureUtil.validateStorageAccountName(accountName) && storageClient.isNameAvailable(accountName)));

        LOGGER.log(Level.INFO,
                "BootDiagnosticsStorageResolver: createStandardStorageAccount: creating {0} after {1} attempts",
                new Object[]{accountName, i});
        try {
            storageClient.createStorageAccount(resourceGroupName, accountName, location, storageSku);
            StorageAccountInfo created = storageClient.getStorageAccount(resourceGroupName, accountName);
            warn(notices, Messages.creatingStorageAccountForBootDiagnostics(accountName));
            return created.getBlobEndpoint();
        } catch (AzureCloudException | AzureResourceNotFoundException | RuntimeException e) {
            LOGGER.log(Level.FINE,
                    "BootDiagnosticsStorageResolver: createStandardStorageAccount: failed to create "
                            + accountName, e);
            warn(notices, Messages.errorDuringCreatingStorageAccountForBootDiagnostics(e.getMessage()));
            return null;
        }
    }

    private static void warn(List<String> notices, String message) {
        LOGGER.log(Level.WARNING, message);
        notices.add(message);
    }
}
