package com.microsoft.azure.vmprovision.builders;

import com.microsoft.azure.vmprovision.VirtualMachineSpec;

public class VirtualMachineSpecBuilder extends VirtualMachineSpecFluent<VirtualMachineSpecBuilder> {
    private VirtualMachineSpecFluent<?> fluent;

    public VirtualMachineSpecBuilder(VirtualMachineSpecFluent<?> fluent) {
        this.fluent = fluent;
    }

    public VirtualMachineSpecBuilder(VirtualMachineSpecFluent<?> fluent, VirtualMachineSpec spec) {
        this.fluent = fluent;
        copy(fluent, spec);
    }

    public VirtualMachineSpecBuilder() {
        this.fluent = this;
    }

    public VirtualMachineSpecBuilder(VirtualMachineSpec spec) {
        this.fluent = this;
        copy(fluent, spec);
    }

    private static void copy(VirtualMachineSpecFluent<?> fluent, VirtualMachineSpec spec) {
        fluent.withResourceGroupName(spec.getResourceGroupName());
        fluent.withLocation(spec.getLocation());
        fluent.withName(spec.getName());
        fluent.withHardwareProfile(spec.getHardwareProfile());
        fluent.withStorageProfile(spec.getStorageProfile());
        fluent.withNetworkProfile(spec.getNetworkProfile());
        fluent.withOsProfile(spec.getOsProfile());
        fluent.withDiagnosticsProfile(spec.getDiagnosticsProfile());
        fluent.withPlan(spec.getPlan());
        fluent.withAvailabilitySetReference(spec.getAvailabilitySetReference());
        fluent.withTags(spec.getTags());
    }

    public VirtualMachineSpec build() {
        return new VirtualMachineSpec(
                fluent.getResourceGroupName(),
                fluent.getLocation(),
                fluent.getName(),
                fluent.getHardwareProfile(),
                fluent.getStorageProfile(),
                fluent.getNetworkProfile(),
                fluent.getOsProfile(),
                fluent.getDiagnosticsProfile(),
                fluent.getPlan(),
                fluent.getAvailabilitySetReference(),
                fluent.getTags());
    }
}
