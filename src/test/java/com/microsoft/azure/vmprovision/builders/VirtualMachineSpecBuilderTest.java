package com.microsoft.azure.vmprovision.builders;

import com.azure.resourcemanager.compute.models.HardwareProfile;
import com.azure.resourcemanager.compute.models.Plan;
import com.azure.resourcemanager.compute.models.VirtualMachineSizeTypes;
import com.microsoft.azure.vmprovision.VirtualMachineSpec;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

class VirtualMachineSpecBuilderTest {

    @Test
    void buildCopiesEveryField() {
        // Given
        HardwareProfile hardwareProfile = new HardwareProfile().withVmSize(VirtualMachineSizeTypes.STANDARD_D2S_V3);
        Plan plan = new Plan().withName("plan").withPublisher("publisher").withProduct("product");

        // When
        VirtualMachineSpec spec = new VirtualMachineSpecBuilder()
                .withResourceGroupName("rg")
                .withLocation("eastus")
                .withName("vm1")
                .withHardwareProfile(hardwareProfile)
                .withPlan(plan)
                .withAvailabilitySet("/subscriptions/s/resourceGroups/rg/providers/Microsoft.Compute/availabilitySets/as")
                .withTag("env", "dev")
                .build();

        // Then
        assertThat(spec.getResourceGroupName(), equalTo("rg"));
        assertThat(spec.getLocation(), equalTo("eastus"));
        assertThat(spec.getName(), equalTo("vm1"));
        assertThat(spec.getHardwareProfile(), sameInstance(hardwareProfile));
        assertThat(spec.getPlan(), sameInstance(plan));
        assertThat(spec.getAvailabilitySetReference().id(),
                equalTo("/subscriptions/s/resourceGroups/rg/providers/Microsoft.Compute/availabilitySets/as"));
        assertThat(spec.getTags(), hasEntry("env", "dev"));
        assertThat(spec.getDiagnosticsProfile(), nullValue());
    }

    @Test
    void builderFromSpecStartsWithSameValues() {
        // Given
        VirtualMachineSpec original = new VirtualMachineSpecBuilder()
                .withName("vm1")
                .withLocation("eastus")
                .withTags(Collections.singletonMap("owner", "ops"))
                .build();

        // When
        VirtualMachineSpec copy = new VirtualMachineSpecBuilder(original)
                .withLocation("westus")
                .build();

        // Then
        assertThat(copy.getName(), equalTo("vm1"));
        assertThat(copy.getLocation(), equalTo("westus"));
        assertThat(copy.getTags(), hasEntry("owner", "ops"));
        assertThat(original.getLocation(), equalTo("eastus"));
    }

    @Test
    void withTagsGivenNullThenClearsTags() {
        VirtualMachineSpec spec = new VirtualMachineSpecBuilder()
                .withTag("env", "dev")
                .withTags(null)
                .withAvailabilitySet(null)
                .build();

        assertThat(spec.getTags(), anEmptyMap());
        assertThat(spec.getAvailabilitySetReference(), nullValue());
    }
}
