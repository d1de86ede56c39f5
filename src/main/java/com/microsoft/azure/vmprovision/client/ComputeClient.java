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

import com.azure.resourcemanager.compute.fluent.models.VirtualMachineInner;
import com.microsoft.azure.vmprovision.VirtualMachineExtensionSpec;
import com.microsoft.azure.vmprovision.exceptions.AzureCloudException;

import java.util.List;

/**
 * Compute operations used while creating a virtual machine.
 */
public interface ComputeClient {

    /**
     * Creates or updates a virtual machine and blocks until the service finishes provisioning it.
     *
     * @param resourceGroupName resource group of the VM
     * @param vmName            name of the VM
     * @param parameters        the VM definition
     * @return the VM as reported by the service
     */
    VirtualMachineInner createOrUpdateVirtualMachine(
            String resourceGroupName, String vmName, VirtualMachineInner parameters) throws AzureCloudException;

    /**
     * Installs or updates an extension on an existing virtual machine.
     */
    void createOrUpdateExtension(
            String resourceGroupName, String vmName, VirtualMachineExtensionSpec extension)
            throws AzureCloudException;

    /**
     * @return names of the image publishers available at the location
     */
    List<String> listPublishers(String location) throws AzureCloudException;

    /**
     * @return names of the extension types a publisher offers at the location
     */
    List<String> listExtensionTypes(String location, String publisherName) throws AzureCloudException;

    /**
     * @return version names of an extension type
     */
    List<String> listExtensionVersions(String location, String publisherName, String type)
            throws AzureCloudException;
}
