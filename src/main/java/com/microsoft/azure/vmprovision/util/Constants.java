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
package com.microsoft.azure.vmprovision.util;

public final class Constants {

    public static final String DEFAULTS_RESOURCE = "/provisioner-defaults.json";

    public static final String MESSAGES_BUNDLE = "com.microsoft.azure.vmprovision.Messages";

    public static final int HTTP_NOT_FOUND = 404;

    /**
     * Azure environments.
     */
    public static final String ENVIRONMENT_AZURE = "AZURE";

    public static final String ENVIRONMENT_AZURE_CHINA = "AZURE_CHINA";

    public static final String ENVIRONMENT_AZURE_US_GOVERNMENT = "AZURE_US_GOVERNMENT";

    /**
     * Boot diagnostics storage accounts.
     */
    public static final String PREMIUM_SKU_PREFIX = "Premium";

    public static final String DEFAULT_DIAGNOSTICS_STORAGE_SKU = "Standard_GRS";

    public static final int DEFAULT_MAX_NAME_ATTEMPTS = 10;

    public static final int STORAGE_NAME_SUBSCRIPTION_LENGTH = 5;

    public static final int STORAGE_NAME_RESOURCE_GROUP_LENGTH = 6;

    public static final int STORAGE_NAME_VM_LENGTH = 4;

    public static final String STORAGE_NAME_DATE_FORMAT = "MMddHHmm";

    /**
     * BGInfo extension.
     */
    public static final String BGINFO_EXTENSION_NAME = "BGInfo";

    public static final String BGINFO_EXTENSION_PUBLISHER = "Microsoft.Compute";

    public static final String BGINFO_EXTENSION_DEFAULT_VERSION = "2.1";

    /**
     * Provisioning states.
     */
    public static final String PROVISIONING_STATE_SUCCEEDED = "Succeeded";

    private Constants() {
        // hide constructor
    }
}
