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

import com.azure.resourcemanager.AzureResourceManager;
import com.azure.resourcemanager.compute.fluent.ComputeManagementClient;
import com.azure.resourcemanager.compute.fluent.models.VirtualMachineExtensionImageInner;
import com.azure.resourcemanager.compute.fluent.models.VirtualMachineExtensionInner;
import com.azure.resourcemanager.compute.fluent.models.VirtualMachineImageResourceInner;
import com.azure.resourcemanager.compute.fluent.models.VirtualMachineInner;
import com.microsoft.azure.vmprovision.VirtualMachineExtensionSpec;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AzureComputeClient implements ComputeClient {

    private static final Logger LOGGER = Logger.getLogger(AzureComputeClient.class.getName());

    private final ComputeManagementClient computeClient;

    public AzureComputeClient(ComputeManagementClient computeClient) {
        if (computeClient == null) {
            throw new NullPointerException("the compute client is null!");
        }
        this.computeClient = computeClient;
    }

    public static AzureComputeClient create(AzureResourceManager azureClient) {
        return new AzureComputeClient(azureClient.virtualMachines().manager().serviceClient());
    }

    @Override
    public VirtualMachineInner createOrUpdateVirtualMachine(
            String resourceGroupName, String vmName, VirtualMachineInner parameters) throws AzureCloudException {
        LOGGER.log(Level.INFO, "AzureComputeClient: createOrUpdateVirtualMachine: {0} in resource group {1}",
                new Object[]{vmName, resourceGroupName});
        try {
            return computeClient.getVirtualMachines().createOrUpdate(resourceGroupName, vmName, parameters);
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to create virtual machine %s in resource group %s",
                            vmName, resourceGroupName),
                    e);
        }
    }

    @Override
    public void createOrUpdateExtension(
            String resourceGroupName, String vmName, VirtualMachineExtensionSpec extension)
            throws AzureCloudException {
        VirtualMachineExtensionInner parameters = new VirtualMachineExtensionInner()
                .withPublisher(extension.getPublisher())
                .withTypePropertiesType(extension.getExtensionType())
                .withTypeHandlerVersion(extension.getTypeHandlerVersion())
                .withAutoUpgradeMinorVersion(extension.isAutoUpgradeMinorVersion());
        parameters.withLocation(extension.getLocation());

        LOGGER.log(Level.INFO, "AzureComputeClient: createOrUpdateExtension: {0} {1} on {2}",
                new Object[]{extension.getName(), extension.getTypeHandlerVersion(), vmName});
        try {
            computeClient.getVirtualMachineExtensions()
                    .createOrUpdate(resourceGroupName, vmName, extension.getName(), parameters);
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to install extension %s on virtual machine %s",
                            extension.getName(), vmName),
                    e);
        }
    }

    @Override
    public List<String> listPublishers(String location) throws AzureCloudException {
        try {
            List<String> names = new ArrayList<>();
            List<VirtualMachineImageResourceInner> publishers =
                    computeClient.getVirtualMachineImages().listPublishers(location);
            if (publishers != null) {
                for (VirtualMachineImageResourceInner publisher : publishers) {
                    names.add(publisher.name());
                }
            }
            return names;
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to list image publishers at %s", location), e);
        }
    }

    @Override
    public List<String> listExtensionTypes(String location, String publisherName) throws AzureCloudException {
        try {
            return names(computeClient.getVirtualMachineExtensionImages().listTypes(location, publisherName));
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to list extension types of %s at %s", publisherName, location), e);
        }
    }

    @Override
    public List<String> listExtensionVersions(String location, String publisherName, String type)
            throws AzureCloudException {
        try {
            return names(computeClient.getVirtualMachineExtensionImages().listVersions(location, publisherName, type));
        } catch (Exception e) {
            throw AzureCloudException.create(
                    String.format("Failed to list versions of extension %s/%s at %s", publisherName, type, location),
                    e);
        }
    }

    private static List<String> names(List<VirtualMachineExtensionImageInner> images) {
        List<String> names = new ArrayList<>();
        if (images != null) {
            for (VirtualMachineExtensionImageInner image : images) {
                names.add(image.name());
            }
        }
        return names;
    }
}
