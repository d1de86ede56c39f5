package com.microsoft.azure.vmprovision.builders;

import com.azure.core.management.SubResource;
import com.azure.resourcemanager.compute.models.DiagnosticsProfile;
import com.azure.resourcemanager.compute.models.HardwareProfile;
import com.azure.resourcemanager.compute.models.NetworkProfile;
import com.azure.resourcemanager.compute.models.OSProfile;
import com.azure.resourcemanager.compute.models.Plan;
import com.azure.resourcemanager.compute.models.StorageProfile;

import java.util.LinkedHashMap;
import java.util.Map;

public class VirtualMachineSpecFluent<T extends VirtualMachineSpecFluent<T>> {
    private String resourceGroupName;
    private String location;
    private String name;
    private HardwareProfile hardwareProfile;
    private StorageProfile storageProfile;
    private NetworkProfile networkProfile;
    private OSProfile osProfile;
    private DiagnosticsProfile diagnosticsProfile;
    private Plan plan;
    private SubResource availabilitySetReference;
    private Map<String, String> tags;

    public VirtualMachineSpecFluent() {
        this.tags = new LinkedHashMap<>();
    }

    //CHECKSTYLE:OFF
    public T withResourceGroupName(String resourceGroupName) {
        this.resourceGroupName = resourceGroupName;
        return (T) this;
    }

    public T withLocation(String location) {
        this.location = location;
        return (T) this;
    }

    public T withName(String name) {
        this.name = name;
        return (T) this;
    }

    public T withHardwareProfile(HardwareProfile hardwareProfile) {
        this.hardwareProfile = hardwareProfile;
        return (T) this;
    }

    public T withStorageProfile(StorageProfile storageProfile) {
        this.storageProfile = storageProfile;
        return (T) this;
    }

    public T withNetworkProfile(NetworkProfile networkProfile) {
        this.networkProfile = networkProfile;
        return (T) this;
    }

    public T withOsProfile(OSProfile osProfile) {
        this.osProfile = osProfile;
        return (T) this;
    }

    public T withDiagnosticsProfile(DiagnosticsProfile diagnosticsProfile) {
        this.diagnosticsProfile = diagnosticsProfile;
        return (T) this;
    }

    public T withPlan(Plan plan) {
        this.plan = plan;
        return (T) this;
    }

    public T withAvailabilitySet(String availabilitySetId) {
        this.availabilitySetReference = availabilitySetId == null ? null : new SubResource().withId(availabilitySetId);
        return (T) this;
    }

    public T withAvailabilitySetReference(SubResource availabilitySetReference) {
        this.availabilitySetReference = availabilitySetReference;
        return (T) this;
    }

    public T withTag(String tagName, String tagValue) {
        this.tags.put(tagName, tagValue);
        return (T) this;
    }

    public T withTags(Map<String, String> tags) {
        this.tags = tags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tags);
        return (T) this;
    }
    //CHECKSTYLE:ON

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
}
