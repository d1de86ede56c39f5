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

import com.microsoft.azure.vmprovision.util.AzureUtil;
import com.microsoft.azure.vmprovision.util.Constants;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds storage account names out of the subscription, resource group and VM names, the current
 * minute and an attempt counter. Names are lower case alphanumeric.
 */
public class StorageAccountNameGenerator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern(Constants.STORAGE_NAME_DATE_FORMAT);

    private final Clock clock;

    public StorageAccountNameGenerator() {
        this(Clock.systemDefaultZone());
    }

    public StorageAccountNameGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String subscriptionName, String resourceGroupName, String vmName, int iteration) {
        String output = AzureUtil.getTruncatedStr(subscriptionName, Constants.STORAGE_NAME_SUBSCRIPTION_LENGTH)
                + AzureUtil.getTruncatedStr(resourceGroupName, Constants.STORAGE_NAME_RESOURCE_GROUP_LENGTH)
                + AzureUtil.getTruncatedStr(vmName, Constants.STORAGE_NAME_VM_LENGTH)
                + DATE_FORMAT.format(LocalDateTime.now(clock))
                + iteration;

        return AzureUtil.stripNonAlphanumeric(output).toLowerCase(Locale.ROOT);
    }
}
