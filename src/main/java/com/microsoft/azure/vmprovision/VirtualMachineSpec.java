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

import com.azure.core.management.SubResource;
import com.azure.resourcemanager.compute.models.DiagnosticsProfile;
import com.azure.resourcemanager.compute.models.HardwareProfile;
import com.azure.resourcemanager.compute.models.NetworkProfile;
import com.azure.resourcemanager.compute.models.OSDisk;
import com.azure.resourcemanager.compute.models.OSProfile;
import com.azure.resourcemanager.compute.models.OperatingSystemTypes;
import com.azure.resourcemanager.compute.models.Plan;
import com.azure.resourcemanager.compute.models.StorageProfile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declared state of a virtual machine to be created. Instances are immutable, use
 * {@link com.microsoft.azure.vmprovision.builders.VirtualMachineSpecBuilder} to build them.
 */
public class VirtualMachineSpec {

    private final String resourceGroupName;

    private final String location;

    private final String name;

    private final HardwareProfile hardwareProfile;

    private final StorageProfile storageProfile;

    private final NetworkProfile networkProfile;

    private final OSProfile osProfile;

    private final DiagnosticsProfile diagnosticsProfile;

    private final Plan plan;

    private final SubResource availabilitySetReference;

    private final Map<String, String> tags;

    @SuppressWarnings("checkstyle:ParameterNumber")
    public VirtualMachineSpec(
            String resourceGroupName,
            String location,
            String name,
            HardwareProfile hardwareProfile,
            StorageProfile storageProfile,
            NetworkProfile networkProfile,
            OSProfile osProfile,
            DiagnosticsProfile diagnosticsProfile,
            Plan plan,
            SubResource availabilitySetReference,
            Map<String, String> tags) {
        this.resourceGroupName = resourceGroupName;
        this.location = location;
        this.name = name;
        this.hardwareProfile = hardwareProfile;
        this.storageProfile = storageProfile;
        this.networkProfile = networkProfile;
        this.osProfile = osProfile;
        this.diagnosticsProfile = diagnosticsProfile;
        this.plan = plan;
        this.availabilitySetReference = availabilitySetReference;
        this.tags = tags == null
                ? Collections.<String, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public String getResourceGroupName() {
        return resourceGroupName;
    }

    public String getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public HardwareProfile getHardwareProfile() {
        return hardwareProfile;
    }

    public StorageProfile getStorageProfile() {
        return storageProfile;
    }

    public NetworkProfile getNetworkProfile() {
        return networkProfile;
    }

    public OSProfile getOsProfile() {
        return osProfile;
    }

    public DiagnosticsProfile getDiagnosticsProfile() {
        return diagnosticsProfile;
    }

    public Plan getPlan() {
        return plan;
    }

    public SubResource getAvailabilitySetReference() {
        return availabilitySetReference;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    /**
     * Returns a copy of this spec carrying the given diagnostics profile.
     */
    public VirtualMachineSpec withDiagnosticsProfile(DiagnosticsProfile profile) {
        return new VirtualMachineSpec(resourceGroupName, location, name, hardwareProfile, storageProfile,
                networkProfile, osProfile, profile, plan, availabilitySetReference, tags);
    }

    /**
     * @return the URI of the unmanaged OS disk, or null when the OS disk is not a VHD blob
     */
    public String getOsDiskVhdUri() {
        OSDisk osDisk = getOsDisk();
        if (osDisk == null || osDisk.vhd() == null) {
            return null;
        }
        return osDisk.vhd().uri();
    }

    /**
     * The OS type declared on the OS disk wins; without one, a Linux configuration section in the
     * OS profile marks the machine as Linux.
     */
    public boolean isLinuxOs() {
        OSDisk osDisk = getOsDisk();
        if (osDisk != null && osDisk.osType() != null) {
            return OperatingSystemTypes.LINUX.equals(osDisk.osType());
        }
        return osProfile != null && osProfile.linuxConfiguration() != null;
    }

    private OSDisk getOsDisk() {
        return storageProfile == null ? null : storageProfile.osDisk();
    }
}
