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
package com.microsoft.azure.vmprovision.exceptions;

/**
 * Thrown when the resource manager answers a lookup with 404.
 */
public final class AzureResourceNotFoundException extends Exception {

    private static final long serialVersionUID = 3316942207446431094L;

    private final String resourceGroupName;

    private final String resourceName;

    public AzureResourceNotFoundException(String resourceGroupName, String resourceName) {
        super(String.format("Resource %s was not found in resource group %s", resourceName, resourceGroupName));
        this.resourceGroupName = resourceGroupName;
        this.resourceName = resourceName;
    }

    public String getResourceGroupName() {
        return resourceGroupName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
