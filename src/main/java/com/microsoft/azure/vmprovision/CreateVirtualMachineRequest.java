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

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameters of a single virtual machine creation.
 */
public class CreateVirtualMachineRequest {

    private final String resourceGroupName;

    private final String location;

    private final VirtualMachineSpec virtualMachine;

    private final List<AzureTagPair> tags;

    private final boolean disableBginfoExtension;

    /**
     * @param resourceGroupName      resource group the VM is created in
     * @param location               location overriding the one declared on the VM, may be blank
     * @param virtualMachine         the VM to create
     * @param tags                   tags replacing the VM's own tags, or null to keep them
     * @param disableBginfoExtension true to skip the BGInfo extension
     */
    public CreateVirtualMachineRequest(
            String resourceGroupName,
            String location,
            VirtualMachineSpec virtualMachine,
            List<AzureTagPair> tags,
            boolean disableBginfoExtension) {
        if (StringUtils.isBlank(resourceGroupName)) {
            throw new IllegalArgumentException("resourceGroupName is null or empty");
        }
        if (virtualMachine == null) {
            throw new IllegalArgumentException("virtualMachine is null");
        }
        if (StringUtils.isBlank(virtualMachine.getName())) {
            throw new IllegalArgumentException("virtualMachine name is null or empty");
        }
        this.resourceGroupName = resourceGroupName;
        this.location = location;
        this.virtualMachine = virtualMachine;
        this.tags = tags == null ? null : Collections.unmodifiableList(new ArrayList<>(tags));
        this.disableBginfoExtension = disableBginfoExtension;
    }

    public CreateVirtualMachineRequest(String resourceGroupName, String location, VirtualMachineSpec virtualMachine) {
        this(resourceGroupName, location, virtualMachine, null, false);
    }

    public String getResourceGroupName() {
        return resourceGroupName;
    }

    public String getLocation() {
        return location;
    }

    public VirtualMachineSpec getVirtualMachine() {
        return virtualMachine;
    }

    public List<AzureTagPair> getTags() {
        return tags;
    }

    public boolean isDisableBginfoExtension() {
        return disableBginfoExtension;
    }

    /**
     * The explicit location when one was given, the VM's declared location otherwise.
     */
    public String getEffectiveLocation() {
        return StringUtils.isNotBlank(location) ? location : virtualMachine.getLocation();
    }
}
