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

public class VirtualMachineExtensionSpec {

    private final String location;

    private final String name;

    private final String publisher;

    private final String extensionType;

    private final String typeHandlerVersion;

    private final boolean autoUpgradeMinorVersion;

    public VirtualMachineExtensionSpec(
            String location,
            String name,
            String publisher,
            String extensionType,
            String typeHandlerVersion,
            boolean autoUpgradeMinorVersion) {
        this.location = location;
        this.name = name;
        this.publisher = publisher;
        this.extensionType = extensionType;
        this.typeHandlerVersion = typeHandlerVersion;
        this.autoUpgradeMinorVersion = autoUpgradeMinorVersion;
    }

    public String getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public String getPublisher() {
        return publisher;
    }

    public String getExtensionType() {
        return extensionType;
    }

    public String getTypeHandlerVersion() {
        return typeHandlerVersion;
    }

    public boolean isAutoUpgradeMinorVersion() {
        return autoUpgradeMinorVersion;
    }
}
