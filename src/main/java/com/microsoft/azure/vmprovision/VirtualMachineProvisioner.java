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

import com.azure.resourcemanager.AzureResourceManager;
import com.azure.resourcemanager.compute.fluent.models.VirtualMachineInner;
import com.azure.resourcemanager.compute.models.BootDiagnostics;
import com.azure.resourcemanager.compute.models.DiagnosticsProfile;
import com.microsoft.azure.vmprovision.client.AzureComputeClient;
import com.microsoft.azure.vmprovision.client.AzureSessionContext;
import com.microsoft.azure.vmprovision.client.AzureStorageClient;
import com.microsoft.azure.vmprovision.client.ComputeClient;
import com.microsoft.azure.vmprovision.client.SessionContext;
import com.microsoft.azure.vmprovision.client.StorageClient;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;
import com.microsoft.azure.vmprovision.util.AzureUtil;
import com.microsoft.azure.vmprovision.util.Constants;
import com.microsoft.azure.vmprovision.util.Messages;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates virtual machines. Boot diagnostics are switched on when the VM does not declare them and
 * a storage account can be found, and the BGInfo extension is installed on non-Linux machines.
 */
public class VirtualMachineProvisioner {

    private static final Logger LOGGER = Logger.getLogger(VirtualMachineProvisioner.class.getName());

    private final ComputeClient computeClient;

    private final BootDiagnosticsStorageResolver storageResolver;

    private final BGInfoExtensionVersionSelector extensionVersionSelector;

    private final ProvisionerSettings settings;

    private final Clock clock;

    public static VirtualMachineProvisioner getInstance(AzureResourceManager azureClient, ProvisionerSettings settings) {
        if (azureClient == null) {
            throw new NullPointerException("the azure client is null!");
        }
        return new VirtualMachineProvisioner(
                AzureComputeClient.create(azureClient),
                AzureStorageClient.create(azureClient),
                new AzureSessionContext(azureClient),
                settings);
    }

    public VirtualMachineProvisioner(
            ComputeClient computeClient,
            StorageClient storageClient,
            SessionContext sessionContext,
            ProvisionerSettings settings) {
        this(computeClient,
                new BootDiagnosticsStorageResolver(storageClient, sessionContext, new StorageAccountNameGenerator(),
                        settings.getMaxNameAttempts(), settings.getStorageSku()),
                new BGInfoExtensionVersionSelector(computeClient, settings.getExtensionPublisher(),
                        settings.getExtensionName(), settings.getExtensionDefaultVersion()),
                settings,
                Clock.systemUTC());
    }

    public VirtualMachineProvisioner(
            ComputeClient computeClient,
            BootDiagnosticsStorageResolver storageResolver,
            BGInfoExtensionVersionSelector extensionVersionSelector,
            ProvisionerSettings settings,
            Clock clock) {
        this.computeClient = computeClient;
        this.storageResolver = storageResolver;
        this.extensionVersionSelector = extensionVersionSelector;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Creates the virtual machine described by the request.
     *
     * @param request resource group, location, VM, tags and extension switch
     * @return the creation operation and any warnings raised on the way
     * @throws AzureCloudException when the VM could not be created or the storage accounts of the
     *                             resource group could not be listed
     */
    public ProvisioningResult createVirtualMachine(CreateVirtualMachineRequest request) throws AzureCloudException {
        final String resourceGroupName = request.getResourceGroupName();
        final String location = request.getEffectiveLocation();
        if (StringUtils.isBlank(location)) {
            throw new IllegalArgumentException("location is null or empty");
        }

        List<String> notices = new ArrayList<>();
        VirtualMachineSpec vm = request.getVirtualMachine();
        LOGGER.log(Level.INFO,
                "VirtualMachineProvisioner: createVirtualMachine: creating {0} in resource group {1} at {2}",
                new Object[]{vm.getName(), resourceGroupName, location});

        if (vm.getDiagnosticsProfile() == null) {
            DiagnosticResult<String> storageUri = storageResolver.resolve(resourceGroupName, location, vm);
            notices.addAll(storageUri.getNotices());
            if (storageUri.isPresent()) {
                vm = vm.withDiagnosticsProfile(new DiagnosticsProfile()
                        .withBootDiagnostics(new BootDiagnostics()
                                .withEnabled(true)
                                .withStorageUri(storageUri.getValue().get())));
            } else {
                LOGGER.log(Level.INFO,
                        "VirtualMachineProvisioner: createVirtualMachine: {0} is created without boot diagnostics",
                        vm.getName());
            }
        }

        VirtualMachineInner parameters = buildParameters(vm, location, request.getTags());

        OffsetDateTime startTime = OffsetDateTime.now(clock);
        VirtualMachineInner created = computeClient.createOrUpdateVirtualMachine(
                resourceGroupName, vm.getName(), parameters);
        ComputeLongRunningOperation operation = toOperation(created, startTime, OffsetDateTime.now(clock));
        LOGGER.log(Level.INFO, "VirtualMachineProvisioner: createVirtualMachine: {0}", operation);

        if (!(request.isDisableBginfoExtension() || vm.isLinuxOs())) {
            installBginfoExtension(resourceGroupName, vm.getName(), location, notices);
        }

        return new ProvisioningResult(operation, notices);
    }

    static VirtualMachineInner buildParameters(VirtualMachineSpec vm, String location, List<AzureTagPair> tags) {
        Map<String, String> effectiveTags = tags != null
                ? AzureUtil.toTagMap(tags)
                : new LinkedHashMap<>(vm.getTags());

        VirtualMachineInner parameters = new VirtualMachineInner()
                .withDiagnosticsProfile(vm.getDiagnosticsProfile())
                .withHardwareProfile(vm.getHardwareProfile())
                .withStorageProfile(vm.getStorageProfile())
                .withNetworkProfile(vm.getNetworkProfile())
                .withOsProfile(vm.getOsProfile())
                .withPlan(vm.getPlan())
                .withAvailabilitySet(vm.getAvailabilitySetReference());
        parameters.withLocation(location);
        parameters.withTags(effectiveTags);
        return parameters;
    }

    private ComputeLongRunningOperation toOperation(
            VirtualMachineInner created, OffsetDateTime startTime, OffsetDateTime endTime) {
        String operationId = created == null ? null : created.id();
        String status = created == null || StringUtils.isBlank(created.provisioningState())
                ? Constants.PROVISIONING_STATE_SUCCEEDED
                : created.provisioningState();
        return new ComputeLongRunningOperation(operationId, status, startTime, endTime);
    }

    private void installBginfoExtension(
            String resourceGroupName, String vmName, String location, List<String> notices) {
        try {
            Optional<String> version = extensionVersionSelector.selectVersion(location);
            if (!version.isPresent()) {
                LOGGER.log(Level.INFO,
                        "VirtualMachineProvisioner: installBginfoExtension: no {0} version available, skipped",
                        settings.getExtensionName());
                return;
            }

            VirtualMachineExtensionSpec extension = new VirtualMachineExtensionSpec(
                    location,
                    settings.getExtensionName(),
                    settings.getExtensionPublisher(),
                    settings.getExtensionName(),
                    version.get(),
                    true);
            computeClient.createOrUpdateExtension(resourceGroupName, vmName, extension);
        } catch (AzureCloudException | RuntimeException e) {
            String message = Messages.errorDuringInstallingBGInfoExtension(vmName, e.getMessage());
            LOGGER.log(Level.WARNING, message, e);
            notices.add(message);
        }
    }
}
